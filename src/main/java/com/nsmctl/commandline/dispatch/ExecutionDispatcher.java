package com.nsmctl.commandline.dispatch;

import java.io.PrintWriter;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nsmctl.commandline.descriptor.TargetDescriptor;
import com.nsmctl.commandline.iface.ParsedArguments;

/**
 * Instantiates a target with its constructor arguments and invokes the chosen operation with the rest.
 *
 * Performs no I/O of its own beyond optionally printing the operation's return value. Anything thrown by the
 * target's constructor or operation propagates unchanged.
 */
public class ExecutionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

    private final PrintWriter out;

    public ExecutionDispatcher() {
        this(new PrintWriter(System.out, true));
    }

    public ExecutionDispatcher(PrintWriter out) {
        this.out = out;
    }

    /**
     * Values whose names match a base flag go to the constructor; everything else except reserved dispatch keys
     * goes to the operation.
     */
    public ArgumentPartition partition(ParsedArguments values, Set<String> baseFlagNames, Set<String> reservedNames) {
        ParsedArguments constructorArguments = values.filter(baseFlagNames::contains);
        ParsedArguments operationArguments = values.filter(
                name -> !baseFlagNames.contains(name) && !reservedNames.contains(name));
        return new ArgumentPartition(constructorArguments, operationArguments);
    }

    public <T> Object dispatch(TargetDescriptor<T> target, String operationName, ArgumentPartition partition,
            boolean printResult) throws Exception {
        log.debug("Dispatching {}.{} constructor={} operation={}", target.getName(), operationName,
                partition.constructorArguments().names(), partition.operationArguments().names());

        T instance = target.instantiate(partition.constructorArguments());
        Object result = target.invoke(operationName, instance, partition.operationArguments());

        if (printResult && result != null) {
            out.println(result);
            out.flush();
        }
        return result;
    }
}
