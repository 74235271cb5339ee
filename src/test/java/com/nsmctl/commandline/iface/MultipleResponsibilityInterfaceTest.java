package com.nsmctl.commandline.iface;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.nsmctl.commandline.descriptor.OperationDeclaration;
import com.nsmctl.commandline.descriptor.TargetType;
import com.nsmctl.commandline.dispatch.ExecutionDispatcher;
import com.nsmctl.commandline.exception.UsageException;
import com.nsmctl.commandline.flag.FlagSpec;
import com.nsmctl.commandline.iface.ServiceFixtures.ProcessManager;

import static org.assertj.core.api.Assertions.*;

class MultipleResponsibilityInterfaceTest {

    private final AtomicInteger instantiations = new AtomicInteger();

    private MultipleResponsibilityInterface<ProcessManager> process(List<String> operations) {
        return new MultipleResponsibilityInterface<>(ServiceFixtures.zeekProcess(instantiations), operations,
                InterfaceOptions.named("zeek process"));
    }

    @Test
    void testActionChoicesFollowWhitelistOrder() {
        MultipleResponsibilityInterface<ProcessManager> process = process(List.of("start", "stop", "status"));

        assertThat(process.getGrammar().getActionChoices()).containsExactly("start", "stop", "status");
        assertThat(process.getGrammar().flagNames()).containsExactly("stdout", "verbose");
        assertThat(process.getDescription()).isEqualTo("Manage the Zeek processes.");
    }

    @Test
    void testAssemblyIsDeterministic() {
        TargetType<ProcessManager> type = ServiceFixtures.zeekProcess(instantiations);
        List<String> operations = List.of("start", "stop", "status", "tail", "clear_logs");
        InterfaceOptions options = InterfaceOptions.named("zeek process");

        Grammar first = new MultipleResponsibilityInterface<>(type, operations, options).getGrammar();
        Grammar second = new MultipleResponsibilityInterface<>(type, operations, options).getGrammar();

        assertThat(second).isEqualTo(first);
        assertThat(second.getFlags()).containsExactlyElementsOf(first.getFlags());
        assertThat(second.getActionChoices()).containsExactly("start", "stop", "status", "clear-logs");
        assertThat(instantiations).hasValue(0);
    }

    @Test
    void testUnlistedActionFailsBeforeInstantiation() {
        MultipleResponsibilityInterface<ProcessManager> process = process(List.of("start", "stop", "status"));

        assertThatThrownBy(() -> process.run("restart")).isInstanceOf(UsageException.class);
        assertThatThrownBy(() -> process.execute(ParsedArguments.of("action", "restart")))
                .isInstanceOf(UsageException.class)
                .hasMessageContaining("restart");
        assertThatThrownBy(() -> process.execute(ParsedArguments.empty()))
                .isInstanceOf(UsageException.class);
        assertThat(instantiations).hasValue(0);
    }

    @Test
    void testRunDispatchesSelectedAction() throws Exception {
        MultipleResponsibilityInterface<ProcessManager> process = process(List.of("start", "stop", "status"));

        ProcessManager manager = (ProcessManager) process.run("stop", "--verbose");

        assertThat(instantiations).hasValue(1);
        assertThat(manager.calls).containsExactly("stop");
        assertThat(manager.constructorArguments.asMap()).containsEntry("stdout", true).containsEntry("verbose", true);
        assertThat(manager.lastOperationArguments.isEmpty()).isTrue();
    }

    @Test
    void testParameterizedOperationsContributeFlags() throws Exception {
        MultipleResponsibilityInterface<ProcessManager> process =
                process(List.of("start", "tail", "clear_logs", "missing"));
        Grammar grammar = process.getGrammar();

        assertThat(grammar.getActionChoices()).containsExactly("start", "clear-logs");
        // the operation's verbose collides with the constructor toggle and is dropped
        assertThat(grammar.flagNames()).containsExactly("stdout", "verbose", "lines");
        assertThat(grammar.findFlag("verbose")).get().extracting(FlagSpec::isToggle).isEqualTo(true);
        assertThat(grammar.findFlag("lines")).get().extracting(FlagSpec::getHelpText)
                .isEqualTo("Number of lines to show");

        ProcessManager manager = (ProcessManager) process.run("clear-logs", "--lines", "50");

        assertThat(manager.calls).containsExactly("clear_logs");
        assertThat(manager.lastOperationArguments.names()).containsExactly("lines");
        assertThat(manager.lastOperationArguments.getInteger("lines")).isEqualTo(50);
    }

    @Test
    void testTargetErrorsPropagateUnchanged() {
        IllegalStateException failure = new IllegalStateException("zeekctl not found");
        TargetType<ProcessManager> broken = TargetType.<ProcessManager>builder("BrokenProcessManager")
                .factory(ProcessManager::new)
                .operation(OperationDeclaration.<ProcessManager>builder("start")
                        .invoker((target, args) -> {
                            throw failure;
                        })
                        .build())
                .build();
        MultipleResponsibilityInterface<ProcessManager> process =
                new MultipleResponsibilityInterface<>(broken, List.of("start"), InterfaceOptions.named("broken"));

        assertThatThrownBy(() -> process.run("start")).isSameAs(failure);
    }

    @Test
    void testPrintsResultWhenAsked() throws Exception {
        TargetType<ProcessManager> type = TargetType.<ProcessManager>builder("StatusOnly")
                .factory(ProcessManager::new)
                .operation(OperationDeclaration.<ProcessManager>builder("status")
                        .invoker((target, args) -> "running")
                        .build())
                .build();
        StringWriter out = new StringWriter();
        InterfaceOptions options = InterfaceOptions.builder().name("status only").printResult(true).build();
        MultipleResponsibilityInterface<ProcessManager> process = new MultipleResponsibilityInterface<>(type,
                List.of("status"), options, new ExecutionDispatcher(new PrintWriter(out)));

        process.run("status");

        assertThat(out.toString()).isEqualToIgnoringNewLines("running");
    }
}
