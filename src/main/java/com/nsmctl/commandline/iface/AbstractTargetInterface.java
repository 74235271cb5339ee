package com.nsmctl.commandline.iface;

import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nsmctl.commandline.descriptor.DescriptorExtractor;
import com.nsmctl.commandline.descriptor.ParameterDescriptor;
import com.nsmctl.commandline.descriptor.ReservedNames;
import com.nsmctl.commandline.descriptor.TargetDescriptor;
import com.nsmctl.commandline.descriptor.TargetType;
import com.nsmctl.commandline.dispatch.ArgumentPartition;
import com.nsmctl.commandline.dispatch.ExecutionDispatcher;
import com.nsmctl.commandline.flag.FlagMapper;

/**
 * Shared base-parameter handling for the two interface shapes.
 *
 * The grammar is assembled once in the constructor and never changes afterwards.
 */
public abstract class AbstractTargetInterface<T> implements CommandInterface<Object> {

    private static final Logger log = LoggerFactory.getLogger(AbstractTargetInterface.class);

    protected final TargetDescriptor<T> target;
    protected final InterfaceOptions options;
    protected final Set<String> reservedNames;
    protected final FlagMapper mapper = new FlagMapper();

    private final ExecutionDispatcher dispatcher;
    private Grammar grammar;
    private Set<String> baseFlagNames;

    protected AbstractTargetInterface(TargetType<T> targetType, InterfaceOptions options,
            ExecutionDispatcher dispatcher) {
        this.options = options;
        this.reservedNames = ReservedNames.with(options.getReservedNames());
        this.target = new DescriptorExtractor(reservedNames).extract(targetType);
        this.dispatcher = dispatcher;
    }

    /**
     * Builds the grammar; subclasses call this at the end of their constructor once their own state is set.
     */
    protected final void assemble() {
        FlagMerger merger = new FlagMerger();
        addParameters(merger, target.getBaseParameters());
        baseFlagNames = Set.copyOf(merger.getAccepted().stream().map(f -> f.getName()).toList());

        List<String> actions = addOperations(merger);
        grammar = new Grammar(options.getName(), getDescription(), merger.getAccepted(), actions);

        log.info("Built interface '{}' for {}: {} flag(s), actions {}", options.getName(), target.getName(),
                grammar.getFlags().size(), actions);
        if (!merger.getSkipped().isEmpty()) {
            log.debug("Flags skipped on collision: {}",
                    merger.getSkipped().stream().map(f -> f.getPrimaryFlag()).toList());
        }
    }

    /**
     * Adds this shape's operation flags after the base flags.
     *
     * @return the action choices to expose, empty for none
     */
    protected abstract List<String> addOperations(FlagMerger merger);

    /**
     * Name of the operation selected by the parsed values. Must fail with a usage error, not construct anything,
     * when no operation can be resolved.
     */
    protected abstract String resolveOperation(ParsedArguments arguments);

    protected void addParameters(FlagMerger merger, List<ParameterDescriptor> parameters) {
        for (ParameterDescriptor parameter : parameters) {
            if (parameter.isReserved()) {
                continue;
            }
            merger.offer(mapper.map(parameter, options.getDefaults().get(parameter.getName())));
        }
    }

    @Override
    public Object execute(ParsedArguments arguments) throws Exception {
        String operation = resolveOperation(arguments);
        ArgumentPartition partition = dispatcher.partition(arguments, baseFlagNames, reservedNames);
        return dispatcher.dispatch(target, operation, partition, options.isPrintResult());
    }

    @Override
    public String getName() {
        return options.getName();
    }

    @Override
    public String getDescription() {
        if (options.getDescription() != null) {
            return options.getDescription();
        }
        return target.getSummary();
    }

    @Override
    public Grammar getGrammar() {
        return grammar;
    }

    public TargetDescriptor<T> getTarget() {
        return target;
    }

    public Set<String> getBaseFlagNames() {
        return baseFlagNames;
    }
}
