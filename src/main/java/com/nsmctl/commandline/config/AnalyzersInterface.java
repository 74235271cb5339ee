package com.nsmctl.commandline.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nsmctl.commandline.flag.FlagSpec;
import com.nsmctl.commandline.flag.Multiplicity;
import com.nsmctl.commandline.flag.ValueType;
import com.nsmctl.commandline.iface.CommandInterface;
import com.nsmctl.commandline.iface.Grammar;
import com.nsmctl.commandline.iface.ParsedArguments;
import com.nsmctl.commandline.report.TabularReport;
import com.nsmctl.commandline.util.Values;

/**
 * Turns any config object owning an {@link AnalyzerCollection} (scripts, signatures, rule-sets) into a command.
 *
 * With no ids selected a pass reports every analyzer; with ids selected it enables, disables or re-values those
 * analyzers and returns the mutated config object.
 */
public class AnalyzersInterface<C extends AnalyzerConfig> implements CommandInterface<MutationResult<C>> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzersInterface.class);

    public static final String IDS = "analyzer_ids";
    public static final String ENABLE = "enable";
    public static final String DISABLE = "disable";
    public static final String VALUE = "value";

    static final List<String> HEADERS = List.of("Id", "Name", "Enabled", "Value");

    private static final String STATEMENT_TERMINATOR = ";";

    private final String name;
    private final String description;
    private final C config;
    private final Grammar grammar;

    public AnalyzersInterface(String name, C config) {
        this(name, null, config);
    }

    public AnalyzersInterface(String name, String description, C config) {
        this.name = name;
        this.description = description == null ? "" : description;
        this.config = config;
        this.grammar = buildGrammar();
    }

    private Grammar buildGrammar() {
        List<FlagSpec> flags = new ArrayList<>();
        flags.add(FlagSpec.builder()
                .name(IDS)
                .flag("--ids")
                .valueType(ValueType.INTEGER)
                .multiplicity(Multiplicity.MANY)
                .required(false)
                .defaultValue(List.of())
                .helpText("Specify one or more ids for the config object you want to work with.")
                .build());
        flags.add(toggle(ENABLE, "Enable selected object."));
        flags.add(toggle(DISABLE, "Disable selected object."));

        AnalyzerCollection analyzers = config.getAnalyzers();
        if (!analyzers.isEmpty() && Values.isTruthy(analyzers.getAnalyzers().get(0).getValue())) {
            flags.add(FlagSpec.builder()
                    .name(VALUE)
                    .flag("--value")
                    .valueType(ValueType.STRING)
                    .required(false)
                    .helpText("The value associated with the selected object.")
                    .build());
        }
        return new Grammar(name, description, flags);
    }

    static FlagSpec toggle(String name, String help) {
        return FlagSpec.builder()
                .name(name)
                .flag("--" + name)
                .valueType(ValueType.NONE)
                .required(false)
                .helpText(help)
                .build();
    }

    @Override
    public MutationResult<C> execute(ParsedArguments arguments) {
        List<Integer> selected = arguments.getList(IDS, Integer.class);
        AnalyzerCollection analyzers = config.getAnalyzers();

        if (selected.isEmpty()) {
            return MutationResult.report(snapshot(analyzers));
        }

        boolean enable = arguments.getBoolean(ENABLE);
        boolean disable = arguments.getBoolean(DISABLE);
        String value = canonicalize(arguments.getString(VALUE));

        for (Integer id : selected) {
            if (analyzers.find(id).isEmpty()) {
                log.debug("Ignoring unknown analyzer id {}", id);
            }
        }

        ChangeSet changes = new ChangeSet();
        for (Analyzer analyzer : analyzers) {
            if (!selected.contains(analyzer.getId())) {
                continue;
            }
            Analyzer before = analyzer.copy();
            if (enable) {
                analyzer.setEnabled(true);
            } else if (disable) {
                analyzer.setEnabled(false);
            }
            if (value != null) {
                analyzer.setValue(value);
            }
            changes.record(String.valueOf(analyzer.getId()), before, analyzer.copy());
        }

        if (changes.isEmpty()) {
            // Only unknown ids were selected
            return MutationResult.report(snapshot(analyzers));
        }
        log.info("{}: updated {} analyzer(s) {}", name, changes.size(), changes.keys());
        return MutationResult.mutated(config, changes);
    }

    /**
     * Statements must end with a terminator; one is appended when missing. Empty input means "no new value".
     */
    static String canonicalize(String value) {
        if (Values.isFalsy(value)) {
            return null;
        }
        return value.endsWith(STATEMENT_TERMINATOR) ? value : value + STATEMENT_TERMINATOR;
    }

    static TabularReport snapshot(AnalyzerCollection analyzers) {
        List<List<Object>> rows = new ArrayList<>();
        for (Analyzer analyzer : analyzers) {
            rows.add(Arrays.asList(analyzer.getId(), analyzer.getName(), analyzer.isEnabled(),
                    Values.orNotAvailable(analyzer.getValue())));
        }
        return new TabularReport(HEADERS, rows);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public Grammar getGrammar() {
        return grammar;
    }

    public C getConfig() {
        return config;
    }
}
