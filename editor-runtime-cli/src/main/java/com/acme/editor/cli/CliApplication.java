package com.acme.editor.cli;

import com.acme.editor.cli.commands.HistoryCommands;
import com.acme.editor.cli.commands.LogCommands;
import com.acme.editor.cli.commands.ServicesCommands;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "editor-runtime",
        description = "Editor Runtime CLI - Inspect and exercise the editor runtime",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        subcommands = {
                ServicesCommands.class,
                LogCommands.class,
                HistoryCommands.class
        }
)
public class CliApplication implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CliApplication()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // When run without subcommand, show help
        CommandLine.usage(this, System.out);
    }
}
