package com.nsmctl.commandline.iface;

/**
 * Sub-command chosen on a {@link CommandSuite} command line, with the values parsed for it.
 * The values carry the sub-command name under the reserved {@code sub_interface} key.
 */
public record SuiteInvocation(String commandName, ParsedArguments arguments) {
}
