package com.nsmctl.commandline;

import java.util.List;

import com.nsmctl.commandline.config.Analyzer;
import com.nsmctl.commandline.config.AnalyzerCollection;
import com.nsmctl.commandline.config.AnalyzerConfig;
import com.nsmctl.commandline.config.AnalyzersInterface;
import com.nsmctl.commandline.descriptor.OperationDeclaration;
import com.nsmctl.commandline.descriptor.SemanticType;
import com.nsmctl.commandline.descriptor.TargetType;
import com.nsmctl.commandline.iface.CommandSuite;
import com.nsmctl.commandline.iface.InterfaceOptions;
import com.nsmctl.commandline.iface.MultipleResponsibilityInterface;

/**
 * Registered in META-INF/services for the application tests.
 */
public class SampleInterfaceProvider implements InterfaceProvider {

    static class Signatures implements AnalyzerConfig {
        private final AnalyzerCollection rules = AnalyzerCollection.of(
                new Analyzer(1, "emerging-dns.rules", true),
                new Analyzer(2, "emerging-scan.rules", false));

        @Override
        public AnalyzerCollection getAnalyzers() {
            return rules;
        }
    }

    static class Agent {
        private final boolean strict;

        Agent(boolean strict) {
            this.strict = strict;
        }

        String start() {
            if (strict) {
                throw new IllegalStateException("agent binary not found");
            }
            return "started";
        }
    }

    private static final TargetType<Agent> AGENT = TargetType.<Agent>builder("AgentProcessManager")
            .documentation("Manage the agent process.")
            .constructorParameter("strict", SemanticType.bool())
            .factory(args -> new Agent(args.getBoolean("strict")))
            .operation(OperationDeclaration.<Agent>builder("start")
                    .invoker((target, args) -> target.start())
                    .build())
            .build();

    @Override
    public void contribute(CommandSuite suite) {
        suite.register("rules", new AnalyzersInterface<>("suricata rules",
                new Signatures()));
        suite.register("agent", new MultipleResponsibilityInterface<>(AGENT, List.of("start"),
                InterfaceOptions.builder().name("agent process").printResult(true).build()));
    }
}
