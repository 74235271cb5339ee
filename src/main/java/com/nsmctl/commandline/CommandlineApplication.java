package com.nsmctl.commandline;

import java.io.PrintWriter;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nsmctl.commandline.config.MutationResult;
import com.nsmctl.commandline.exception.UsageException;
import com.nsmctl.commandline.iface.CommandSuite;

/**
 * Main entry point. Collects every {@link InterfaceProvider} on the class path into one command suite
 * and runs it against the process arguments.
 */
public class CommandlineApplication {

    private static final Logger log = LoggerFactory.getLogger(CommandlineApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final CommandSuite suite;
    private final PrintWriter out;
    private final PrintWriter err;

    public CommandlineApplication(CommandSuite suite, PrintWriter out, PrintWriter err) {
        this.suite = suite;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        CommandSuite suite = discover("nsmctl", ServiceLoader.load(InterfaceProvider.class));
        int exitCode = new CommandlineApplication(suite, new PrintWriter(System.out, true),
                new PrintWriter(System.err, true)).run(args);
        System.exit(exitCode);
    }

    static CommandSuite discover(String name, Iterable<InterfaceProvider> providers) {
        CommandSuite suite = new CommandSuite(name, "Manage the services installed on this sensor.");
        for (InterfaceProvider provider : providers) {
            log.debug("Loading interfaces from {}", provider.getClass().getName());
            provider.contribute(suite);
        }
        return suite;
    }

    public int run(String... args) {
        try {
            Object result = suite.run(args);
            if (result instanceof MutationResult<?> mutation) {
                out.println(mutation);
                out.flush();
            }
            return EXIT_OK;
        } catch (UsageException e) {
            e.getErrors().forEach(err::println);
            err.println(e.getUsage());
            err.flush();
            return EXIT_USAGE;
        } catch (Exception e) {
            log.error("Command failed: {}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return EXIT_FAILURE;
        }
    }

    public CommandSuite getSuite() {
        return suite;
    }
}
