package com.nsmctl.commandline.descriptor;

import com.nsmctl.commandline.iface.ParsedArguments;

/**
 * Constructs a target object from its constructor arguments.
 */
@FunctionalInterface
public interface TargetFactory<T> {

    T create(ParsedArguments arguments) throws Exception;
}
