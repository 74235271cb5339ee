package com.nsmctl.commandline.iface;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nsmctl.commandline.descriptor.OperationDescriptor;
import com.nsmctl.commandline.descriptor.ReservedNames;
import com.nsmctl.commandline.descriptor.TargetType;
import com.nsmctl.commandline.dispatch.ExecutionDispatcher;
import com.nsmctl.commandline.exception.UsageException;
import com.nsmctl.commandline.util.NamingUtil;

/**
 * Maps a type with several responsibilities (e.g. a process manager's start/stop/status) onto one command with a
 * positional {@code action} selector.
 *
 * Whitelisted operations without parameters become action tokens (hyphenated, in whitelist order). Whitelisted
 * operations with parameters contribute their flags to the grammar instead of becoming actions.
 */
public class MultipleResponsibilityInterface<T> extends AbstractTargetInterface<T> {

    private static final Logger log = LoggerFactory.getLogger(MultipleResponsibilityInterface.class);

    private final List<String> supportedOperations;

    public MultipleResponsibilityInterface(TargetType<T> targetType, List<String> supportedOperations,
            InterfaceOptions options) {
        this(targetType, supportedOperations, options, new ExecutionDispatcher());
    }

    public MultipleResponsibilityInterface(TargetType<T> targetType, List<String> supportedOperations,
            InterfaceOptions options, ExecutionDispatcher dispatcher) {
        super(targetType, options, dispatcher);
        this.supportedOperations = List.copyOf(supportedOperations);
        assemble();
    }

    @Override
    protected List<String> addOperations(FlagMerger merger) {
        List<String> actions = new ArrayList<>();
        for (String operationName : supportedOperations) {
            OperationDescriptor operation = target.getOperations().get(operationName);
            if (operation == null) {
                log.warn("{} does not define whitelisted operation '{}'", target.getName(), operationName);
                continue;
            }
            if (operation.hasParameters()) {
                addParameters(merger, operation.getParameters());
            } else {
                actions.add(NamingUtil.toHyphenated(operationName));
            }
        }
        return actions;
    }

    @Override
    protected String resolveOperation(ParsedArguments arguments) {
        String token = arguments.getString(ReservedNames.ACTION);
        if (token == null) {
            throw new UsageException("No action selected; choose from " + getGrammar().getActionChoices(),
                    getGrammar().usage());
        }
        String operationName = NamingUtil.toUnderscored(token);
        if (!getGrammar().getActionChoices().contains(token) || !target.hasOperation(operationName)) {
            throw new UsageException("Unsupported action '" + token + "'; choose from "
                    + getGrammar().getActionChoices(), getGrammar().usage());
        }
        return operationName;
    }
}
