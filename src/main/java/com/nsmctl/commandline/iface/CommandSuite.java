package com.nsmctl.commandline.iface;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nsmctl.commandline.descriptor.ReservedNames;
import com.nsmctl.commandline.exception.UsageException;

import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParseResult;

/**
 * Parent dispatcher that attaches already-built interfaces under sub-command names, e.g.
 * {@code logstash install ...}, {@code logstash process start}.
 */
public class CommandSuite {

    private static final Logger log = LoggerFactory.getLogger(CommandSuite.class);

    private final String name;
    private final String description;
    private final Map<String, CommandInterface<?>> interfaces = new LinkedHashMap<>();

    public CommandSuite(String name, String description) {
        this.name = name;
        this.description = description == null ? "" : description;
    }

    /**
     * Attaches an interface's existing grammar under {@code commandName}.
     */
    public CommandSuite register(String commandName, CommandInterface<?> commandInterface) {
        if (interfaces.containsKey(commandName)) {
            throw new IllegalArgumentException("Sub-command '" + commandName + "' is already registered");
        }
        interfaces.put(commandName, commandInterface);
        log.debug("Registered sub-command {} -> {}", commandName, commandInterface.getName());
        return this;
    }

    public Map<String, CommandInterface<?>> getInterfaces() {
        return Collections.unmodifiableMap(interfaces);
    }

    public Optional<CommandInterface<?>> find(String commandName) {
        return Optional.ofNullable(interfaces.get(commandName));
    }

    public CommandSpec toCommandSpec() {
        CommandSpec root = CommandSpec.create().name(name);
        if (!description.isEmpty()) {
            root.usageMessage().description(description);
        }
        interfaces.forEach((commandName, commandInterface) -> {
            CommandSpec sub = commandInterface.getGrammar().toCommandSpec().name(commandName);
            if (!commandInterface.getDescription().isEmpty()) {
                sub.usageMessage().description(commandInterface.getDescription());
            }
            root.addSubcommand(commandName, new CommandLine(sub));
        });
        return root;
    }

    public SuiteInvocation parse(String... args) {
        CommandLine commandLine = new CommandLine(toCommandSpec());
        ParseResult result;
        try {
            result = commandLine.parseArgs(args);
        } catch (ParameterException e) {
            throw new UsageException(e.getMessage(), e.getCommandLine().getUsageMessage());
        }

        ParseResult sub = result.subcommand();
        if (sub == null) {
            throw new UsageException("Missing required sub-command; choose from " + interfaces.keySet(),
                    commandLine.getUsageMessage());
        }
        String commandName = sub.commandSpec().name();
        ParsedArguments values = interfaces.get(commandName).getGrammar().collect(sub)
                .with(ReservedNames.SUB_INTERFACE, commandName);
        return new SuiteInvocation(commandName, values);
    }

    public Object execute(SuiteInvocation invocation) throws Exception {
        CommandInterface<?> commandInterface = interfaces.get(invocation.commandName());
        if (commandInterface == null) {
            throw new UsageException("Unknown sub-command '" + invocation.commandName() + "'", usage());
        }
        return commandInterface.execute(invocation.arguments());
    }

    public Object run(String... args) throws Exception {
        return execute(parse(args));
    }

    public String usage() {
        return new CommandLine(toCommandSpec()).getUsageMessage();
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }
}
