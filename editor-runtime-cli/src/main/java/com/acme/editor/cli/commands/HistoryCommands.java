package com.acme.editor.cli.commands;

import com.acme.editor.cli.config.CliConfiguration;
import com.acme.editor.cli.service.HistoryStep;
import com.acme.editor.cli.service.RuntimeService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "history",
        description = "Undo/redo history operations",
        subcommands = {
                HistoryCommands.Demo.class
        }
)
public class HistoryCommands {

    @Command(name = "demo", description = "Record actions, checkpoint, undo, redo and revert")
    static class Demo implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Option(names = {"-k", "--actions"}, description = "Number of actions to record (default: 3)", defaultValue = "3")
        private int actions;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            try (RuntimeService runtime = new RuntimeService(CliConfiguration.getInstance().toRuntimeConfig())) {
                List<HistoryStep> steps = runtime.historyDemo(actions);
                out.printf("%-32s %5s %5s %5s%n", "STEP", "UNDO", "REDO", "HEAD");
                for (HistoryStep step : steps) {
                    out.printf("%-32s %5d %5d %5d%n",
                            step.action(), step.undoDepth(), step.redoDepth(), step.headSequence());
                }
                return 0;
            } catch (Exception e) {
                spec.commandLine().getErr().println("Error running history demo: " + e.getMessage());
                return 1;
            }
        }
    }
}
