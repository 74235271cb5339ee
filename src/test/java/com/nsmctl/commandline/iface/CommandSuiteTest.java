package com.nsmctl.commandline.iface;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.nsmctl.commandline.exception.UsageException;
import com.nsmctl.commandline.iface.ServiceFixtures.ProcessManager;

import static org.assertj.core.api.Assertions.*;

class CommandSuiteTest {

    private final AtomicInteger instantiations = new AtomicInteger();
    private CommandSuite suite;

    @BeforeEach
    void setUp() {
        InterfaceOptions installOptions = InterfaceOptions.builder()
                .name("filebeat install")
                .defaultValue("install_directory", "/opt/dynamite/filebeat")
                .build();
        suite = new CommandSuite("filebeat", "Manage Filebeat")
                .register("install", new SingleResponsibilityInterface<>(
                        ServiceFixtures.filebeatInstall(), "setup", installOptions))
                .register("process", new MultipleResponsibilityInterface<>(
                        ServiceFixtures.zeekProcess(instantiations), List.of("start", "stop", "status"),
                        InterfaceOptions.named("filebeat process")));
    }

    @Test
    void testParseSelectsSubCommand() {
        SuiteInvocation invocation = suite.parse("process", "status", "--verbose");

        assertThat(invocation.commandName()).isEqualTo("process");
        assertThat(invocation.arguments().getString("sub_interface")).isEqualTo("process");
        assertThat(invocation.arguments().getString("action")).isEqualTo("status");
        assertThat(invocation.arguments().getBoolean("verbose")).isTrue();
    }

    @Test
    void testRunDispatchesToRegisteredInterface() throws Exception {
        Object result = suite.run("install", "--targets", "10.0.0.9:5044");

        assertThat(result).isEqualTo("installed to /opt/dynamite/filebeat");
    }

    @Test
    void testReservedKeysDoNotReachTarget() throws Exception {
        ProcessManager manager = (ProcessManager) suite.run("process", "start");

        assertThat(manager.calls).containsExactly("start");
        assertThat(manager.constructorArguments.names()).containsExactly("stdout", "verbose");
        assertThat(manager.lastOperationArguments.names()).doesNotContain("sub_interface", "action");
    }

    @Test
    void testSubCommandUsageErrorsSurface() {
        assertThatThrownBy(() -> suite.run("process", "restart")).isInstanceOf(UsageException.class);
        assertThatThrownBy(() -> suite.run("install")).isInstanceOf(UsageException.class);
        assertThat(instantiations).hasValue(0);
    }

    @Test
    void testMissingOrUnknownSubCommand() {
        assertThatThrownBy(() -> suite.parse())
                .isInstanceOfSatisfying(UsageException.class,
                        e -> assertThat(e.getMessage()).contains("install", "process"));
        assertThatThrownBy(() -> suite.parse("uninstall")).isInstanceOf(UsageException.class);
    }

    @Test
    void testDuplicateRegistrationIsRejected() {
        assertThatThrownBy(() -> suite.register("install", suite.find("process").orElseThrow()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testUsageListsSubCommands() {
        assertThat(suite.usage()).contains("install", "process", "Manage Filebeat");
        assertThat(suite.getInterfaces()).containsOnlyKeys("install", "process");
        assertThat(suite.find("install")).get().isInstanceOf(SingleResponsibilityInterface.class);
        assertThat(suite.find("install").map(CommandInterface::getGrammar).orElseThrow().getName())
                .isEqualTo("filebeat install");
        assertThat(suite.find("missing")).isEmpty();
    }

    @Test
    void testInterfacesStayUsableOnTheirOwn() throws Exception {
        suite.toCommandSpec();

        Object result = suite.find("install").orElseThrow().run("--targets", "a:5044");

        assertThat(result).isEqualTo("installed to /opt/dynamite/filebeat");
    }
}
