package com.nsmctl.commandline;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ServiceLoader;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CommandlineApplicationTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandlineApplication application;

    @BeforeEach
    void setUp() {
        application = new CommandlineApplication(
                CommandlineApplication.discover("nsmctl", ServiceLoader.load(InterfaceProvider.class)),
                new PrintWriter(out), new PrintWriter(err));
    }

    @Test
    void testProvidersAreDiscovered() {
        assertThat(application.getSuite().getInterfaces()).containsKeys("rules", "agent");
    }

    @Test
    void testReportIsPrinted() {
        int exitCode = application.run("rules");

        assertThat(exitCode).isEqualTo(CommandlineApplication.EXIT_OK);
        assertThat(out.toString()).contains("emerging-dns.rules", "emerging-scan.rules", "│ Id │");
    }

    @Test
    void testChangesArePrinted() {
        int exitCode = application.run("rules", "--ids", "2", "--enable");

        assertThat(exitCode).isEqualTo(CommandlineApplication.EXIT_OK);
        assertThat(out.toString()).startsWith("2: ").contains("enabled=false", "enabled=true");
    }

    @Test
    void testOperationResultPrintedByInterface() {
        int exitCode = application.run("agent", "start");

        assertThat(exitCode).isEqualTo(CommandlineApplication.EXIT_OK);
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void testUsageErrorExitCode() {
        int exitCode = application.run("agent", "stop");

        assertThat(exitCode).isEqualTo(CommandlineApplication.EXIT_USAGE);
        assertThat(err.toString()).contains("stop", "Usage:");
    }

    @Test
    void testTargetFailureExitCode() {
        int exitCode = application.run("agent", "start", "--strict");

        assertThat(exitCode).isEqualTo(CommandlineApplication.EXIT_FAILURE);
        assertThat(err.toString()).contains("agent binary not found");
    }
}
