package com.acme.editor.cli.commands;

import com.acme.editor.cli.CliApplication;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class ServicesCommandsTest {

    @Test
    void testServicesCommands_hasListSubcommand() {
        CommandLine cmd = new CommandLine(new ServicesCommands());
        assertThat(cmd.getCommandName()).isEqualTo("services");
        assertThat(cmd.getSubcommands()).containsKeys("list");
        assertThat(cmd.getSubcommands().get("list").getCommandSpec().findOption("format")).isNotNull();
    }

    @Test
    void testListCommand_printsTable() {
        StringWriter out = new StringWriter();
        CommandLine cmd = new CommandLine(new CliApplication());
        cmd.setOut(new PrintWriter(out));

        int exitCode = cmd.execute("services", "list");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString())
                .contains("TOKEN")
                .contains("eventLog")
                .contains("historyManager")
                .contains("canvasSurface")
                .contains("Total services:");
    }

    @Test
    void testListCommand_printsJson() {
        StringWriter out = new StringWriter();
        CommandLine cmd = new CommandLine(new CliApplication());
        cmd.setOut(new PrintWriter(out));

        int exitCode = cmd.execute("services", "list", "--format", "json");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).startsWith("[").contains("\"token\" : \"eventBus\"");
    }
}
