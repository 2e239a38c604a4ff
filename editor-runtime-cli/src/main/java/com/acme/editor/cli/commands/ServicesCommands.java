package com.acme.editor.cli.commands;

import com.acme.editor.cli.config.CliConfiguration;
import com.acme.editor.cli.service.RuntimeService;
import com.acme.editor.runtime.container.ServiceInfo;
import com.acme.editor.runtime.core.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "services",
        description = "Service registry inspection",
        subcommands = {
                ServicesCommands.ListServices.class
        }
)
public class ServicesCommands {

    @Command(name = "list", description = "Boot the runtime and list every registered service")
    static class ListServices implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Option(names = {"-f", "--format"}, description = "Output format: text or json (default: text)", defaultValue = "text")
        private String format;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            try (RuntimeService runtime = new RuntimeService(CliConfiguration.getInstance().toRuntimeConfig())) {
                List<ServiceInfo> services = runtime.listServices();
                if ("json".equalsIgnoreCase(format)) {
                    out.println(Jsons.toPrettyJson(services));
                } else {
                    printTable(out, services);
                }
                return 0;
            } catch (Exception e) {
                spec.commandLine().getErr().println("Error listing services: " + e.getMessage());
                return 1;
            }
        }

        private void printTable(PrintWriter out, List<ServiceInfo> services) {
            out.printf("%-20s %-10s %-15s %-9s %s%n", "TOKEN", "LIFECYCLE", "PHASE", "RESOLVED", "DEPENDENCIES");
            for (ServiceInfo info : services) {
                out.printf("%-20s %-10s %-15s %-9s %s%n",
                        info.token(),
                        info.lifecycle(),
                        info.phase(),
                        info.resolved() ? "yes" : "no",
                        info.dependencies().isEmpty() ? "-" : String.join(", ", info.dependencies()));
            }
            out.printf("%nTotal services: %d%n", services.size());
        }
    }
}
