package com.nsmctl.commandline.dispatch;

import com.nsmctl.commandline.iface.ParsedArguments;

/**
 * Parsed values split into what the constructor receives and what the operation receives.
 */
public record ArgumentPartition(ParsedArguments constructorArguments, ParsedArguments operationArguments) {
}
