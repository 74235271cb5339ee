package com.nsmctl.commandline.descriptor;

import com.nsmctl.commandline.iface.ParsedArguments;

/**
 * Calls one operation on a constructed target. The return value is surfaced to the caller.
 */
@FunctionalInterface
public interface OperationInvoker<T> {

    Object invoke(T target, ParsedArguments arguments) throws Exception;
}
