package com.nsmctl.commandline.iface;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.nsmctl.commandline.descriptor.ReservedNames;
import com.nsmctl.commandline.exception.UsageException;
import com.nsmctl.commandline.flag.FlagSpec;

import lombok.Value;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.Model.PositionalParamSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParseResult;

/**
 * Complete set of flags, plus an optional closed {@code action} selector, derived for one interface.
 *
 * Immutable. Each call to {@link #toCommandSpec()} projects it onto a fresh picocli model, so the same
 * grammar can back a standalone parser and any number of sub-commands.
 */
@Value
public class Grammar {

    String name;
    String description;
    List<FlagSpec> flags;
    List<String> actionChoices;

    public Grammar(String name, String description, List<FlagSpec> flags, List<String> actionChoices) {
        this.name = name;
        this.description = description == null ? "" : description;
        this.flags = List.copyOf(flags);
        this.actionChoices = List.copyOf(actionChoices);
    }

    public Grammar(String name, String description, List<FlagSpec> flags) {
        this(name, description, flags, List.of());
    }

    public boolean hasActionSelector() {
        return !actionChoices.isEmpty();
    }

    public Optional<FlagSpec> findFlag(String parameterName) {
        return flags.stream().filter(f -> f.getName().equals(parameterName)).findFirst();
    }

    public Set<String> flagNames() {
        Set<String> names = new LinkedHashSet<>();
        flags.forEach(f -> names.add(f.getName()));
        return names;
    }

    public CommandSpec toCommandSpec() {
        CommandSpec spec = CommandSpec.create().name(name);
        if (!description.isEmpty()) {
            spec.usageMessage().description(description);
        }
        for (FlagSpec flag : flags) {
            spec.addOption(toOptionSpec(flag));
        }
        if (hasActionSelector()) {
            spec.addPositional(PositionalParamSpec.builder()
                    .index("0")
                    .arity("1")
                    .paramLabel(ReservedNames.ACTION)
                    .type(String.class)
                    .completionCandidates(actionChoices)
                    .description("One of: " + String.join(", ", actionChoices))
                    .build());
        }
        return spec;
    }

    private static OptionSpec toOptionSpec(FlagSpec flag) {
        List<String> switches = flag.getFlags();
        OptionSpec.Builder option = OptionSpec
                .builder(switches.get(0), switches.subList(1, switches.size()).toArray(new String[0]))
                .required(flag.isRequired())
                .description(describe(flag));

        if (flag.isToggle()) {
            option.type(boolean.class).arity("0");
        } else if (flag.isMultiValued()) {
            option.type(List.class)
                    .auxiliaryTypes(flag.getValueType().getJavaType())
                    .arity("1..*")
                    .paramLabel("<" + flag.getName() + ">");
        } else {
            option.type(flag.getValueType().getJavaType())
                    .arity("1")
                    .paramLabel("<" + flag.getName() + ">");
        }
        return option.build();
    }

    private static String describe(FlagSpec flag) {
        if (flag.getDefaultValue() == null || flag.isToggle()) {
            return flag.getHelpText();
        }
        String help = flag.getHelpText().isEmpty() ? "" : flag.getHelpText() + " ";
        return help + "(default: " + flag.getDefaultValue() + ")";
    }

    /**
     * Parses raw arguments against this grammar alone.
     *
     * @throws UsageException for unknown or missing flags, unconvertible values or an action outside the choices
     */
    public ParsedArguments parse(String... args) {
        CommandLine commandLine = new CommandLine(toCommandSpec());
        ParseResult result;
        try {
            result = commandLine.parseArgs(args);
        } catch (ParameterException e) {
            throw new UsageException(e.getMessage(), e.getCommandLine().getUsageMessage());
        }
        return collect(result);
    }

    /**
     * Reads this grammar's values out of a picocli parse result, which may belong to a sub-command.
     */
    public ParsedArguments collect(ParseResult result) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (FlagSpec flag : flags) {
            values.put(flag.getName(), valueOf(flag, result));
        }
        if (hasActionSelector()) {
            String action = result.matchedPositionalValue(0, null);
            if (action == null) {
                throw new UsageException("Missing required parameter: '" + ReservedNames.ACTION + "'", usage());
            }
            if (!actionChoices.contains(action)) {
                throw new UsageException(String.format(
                        "Invalid value for positional parameter '%s': '%s' (choose from %s)",
                        ReservedNames.ACTION, action, String.join(", ", actionChoices)), usage());
            }
            values.put(ReservedNames.ACTION, action);
        }
        return new ParsedArguments(values);
    }

    private static Object valueOf(FlagSpec flag, ParseResult result) {
        if (result.hasMatchedOption(flag.getPrimaryFlag())) {
            if (flag.isToggle()) {
                return Boolean.TRUE;
            }
            return result.matchedOptionValue(flag.getPrimaryFlag(), null);
        }
        if (flag.isToggle()) {
            return flag.getDefaultValue() instanceof Boolean b ? b : Boolean.FALSE;
        }
        return flag.getDefaultValue();
    }

    public String usage() {
        return new CommandLine(toCommandSpec()).getUsageMessage();
    }
}
