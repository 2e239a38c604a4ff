package com.acme.editor.cli.commands;

import com.acme.editor.cli.CliApplication;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class HistoryCommandsTest {

    @Test
    void testHistoryCommands_hasDemoSubcommand() {
        CommandLine cmd = new CommandLine(new HistoryCommands());
        assertThat(cmd.getSubcommands()).containsKeys("demo");
        assertThat(cmd.getSubcommands().get("demo").getCommandSpec().findOption("actions")).isNotNull();
    }

    @Test
    void testDemo_printsStackDepths() {
        StringWriter out = new StringWriter();
        CommandLine cmd = new CommandLine(new CliApplication());
        cmd.setOut(new PrintWriter(out));

        int exitCode = cmd.execute("history", "demo", "--actions", "4");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString())
                .contains("record 4 actions")
                .contains("revert to 'demo'");
    }

    @Test
    void testDemo_rejectsZeroActions() {
        StringWriter err = new StringWriter();
        CommandLine cmd = new CommandLine(new CliApplication());
        cmd.setOut(new PrintWriter(new StringWriter()));
        cmd.setErr(new PrintWriter(err));

        assertThat(cmd.execute("history", "demo", "--actions", "0")).isEqualTo(1);
        assertThat(err.toString()).contains("actions must be positive");
    }
}
