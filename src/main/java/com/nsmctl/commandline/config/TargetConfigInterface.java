package com.nsmctl.commandline.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nsmctl.commandline.descriptor.ReservedNames;
import com.nsmctl.commandline.flag.FlagMapper;
import com.nsmctl.commandline.iface.CommandInterface;
import com.nsmctl.commandline.iface.FlagMerger;
import com.nsmctl.commandline.iface.Grammar;
import com.nsmctl.commandline.iface.ParsedArguments;
import com.nsmctl.commandline.report.TabularReport;
import com.nsmctl.commandline.util.NamingUtil;
import com.nsmctl.commandline.util.Values;

/**
 * Turns a {@link TargetConfig} into a command: one optional flag per schema field plus enable/disable toggles.
 *
 * Supplied (non-empty) values are written onto the config object and recorded as changes; fields left empty are
 * reported with their current value instead. If nothing changed the pass returns the report.
 */
public class TargetConfigInterface<C extends TargetConfig> implements CommandInterface<MutationResult<C>> {

    private static final Logger log = LoggerFactory.getLogger(TargetConfigInterface.class);

    public static final String ENABLED_FIELD = "enabled";
    public static final String ENABLE = "enable";
    public static final String DISABLE = "disable";

    static final List<String> HEADERS = List.of("Config Option", "Value");

    private final String name;
    private final String description;
    private final C config;
    private final TargetConfigSchema<C> schema;
    private final Map<String, Object> defaults;
    private final Set<String> reservedNames;
    private final Grammar grammar;

    public TargetConfigInterface(String name, C config, TargetConfigSchema<C> schema) {
        this(name, null, config, schema, Map.of());
    }

    /**
     * @param defaults values fixed by the caller; fields named here are neither exposed nor mutated
     */
    public TargetConfigInterface(String name, String description, C config, TargetConfigSchema<C> schema,
            Map<String, Object> defaults) {
        this.name = name;
        this.description = description == null ? "" : description;
        this.config = config;
        this.schema = schema;
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
        this.reservedNames = ReservedNames.DEFAULTS;
        this.grammar = buildGrammar();
    }

    private Grammar buildGrammar() {
        FlagMapper mapper = new FlagMapper();
        FlagMerger merger = new FlagMerger();
        for (ConfigField<C> field : schema.getFields()) {
            if (!isEligible(field.getName())) {
                continue;
            }
            String help = field.getDescription().replace('\n', ' ');
            merger.offer(mapper.map(field.toParameter(), null, help).toBuilder().required(false).build());
        }
        merger.offer(AnalyzersInterface.toggle(ENABLE, "Enable selected target."));
        merger.offer(AnalyzersInterface.toggle(DISABLE, "Disable selected target."));
        return new Grammar(name, description, merger.getAccepted());
    }

    private boolean isEligible(String option) {
        return !ENABLED_FIELD.equals(option)
                && !ENABLE.equals(option)
                && !DISABLE.equals(option)
                && !defaults.containsKey(option)
                && !reservedNames.contains(option);
    }

    @Override
    public MutationResult<C> execute(ParsedArguments arguments) {
        ChangeSet changes = new ChangeSet();
        List<List<Object>> rows = new ArrayList<>();

        for (String option : arguments.names()) {
            if (!isEligible(option)) {
                continue;
            }
            Optional<ConfigField<C>> field = schema.find(option);
            if (field.isEmpty()) {
                log.debug("{}: no field '{}' on {}", name, option, config.getClass().getSimpleName());
                continue;
            }
            Object value = arguments.get(option);
            Object current = field.get().read(config);
            if (Values.isFalsy(value)) {
                rows.add(Arrays.asList(NamingUtil.toHyphenated(option), Values.orNotAvailable(current)));
            } else {
                changes.record(option, current, value);
                field.get().write(config, value);
            }
        }

        if (arguments.getBoolean(ENABLE)) {
            changes.record(ENABLED_FIELD, config.isEnabled(), true);
            config.setEnabled(true);
        } else if (arguments.getBoolean(DISABLE)) {
            changes.record(ENABLED_FIELD, config.isEnabled(), false);
            config.setEnabled(false);
        }

        if (changes.isEmpty()) {
            rows.add(Arrays.asList(ENABLED_FIELD, config.isEnabled()));
            return MutationResult.report(new TabularReport(HEADERS, rows));
        }
        log.info("{}: {} change(s) {}", name, changes.size(), changes.keys());
        return MutationResult.mutated(config, changes);
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
