package com.nsmctl.commandline.iface;

import java.util.List;

import com.nsmctl.commandline.descriptor.OperationDescriptor;
import com.nsmctl.commandline.descriptor.TargetType;
import com.nsmctl.commandline.dispatch.ExecutionDispatcher;
import com.nsmctl.commandline.exception.CommandSynthesisException;

/**
 * Maps a type with exactly one responsibility (e.g. an install manager's {@code setup}) onto a flat command:
 * constructor flags followed by the entry operation's flags, no action selector.
 */
public class SingleResponsibilityInterface<T> extends AbstractTargetInterface<T> {

    private final String entryOperation;

    public SingleResponsibilityInterface(TargetType<T> targetType, String entryOperation, InterfaceOptions options) {
        this(targetType, entryOperation, options, new ExecutionDispatcher());
    }

    public SingleResponsibilityInterface(TargetType<T> targetType, String entryOperation, InterfaceOptions options,
            ExecutionDispatcher dispatcher) {
        super(targetType, options, dispatcher);
        if (!target.hasOperation(entryOperation)) {
            throw new CommandSynthesisException(
                    "Entry operation '" + entryOperation + "' is not defined on " + target.getName());
        }
        this.entryOperation = entryOperation;
        assemble();
    }

    @Override
    protected List<String> addOperations(FlagMerger merger) {
        OperationDescriptor operation = target.getOperations().get(entryOperation);
        addParameters(merger, operation.getParameters());
        return List.of();
    }

    @Override
    protected String resolveOperation(ParsedArguments arguments) {
        return entryOperation;
    }

    public String getEntryOperation() {
        return entryOperation;
    }
}
