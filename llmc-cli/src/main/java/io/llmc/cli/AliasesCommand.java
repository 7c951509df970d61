package io.llmc.cli;

import io.llmc.core.config.model.LlmcConfig;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(name = "aliases", description = "Manage model aliases (name -> provider:model)")
public final class AliasesCommand implements Runnable {
    private final CliContext context;

    @Spec
    CommandSpec spec;

    public AliasesCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "add", description = "Add or replace an alias")
    int add(
        @Parameters(index = "0", paramLabel = "NAME") String name,
        @Parameters(index = "1", paramLabel = "PROVIDER:MODEL") String target
    ) {
        try {
            LlmcConfig config = context.loadConfig();
            context.saveConfig(config.withAlias(name, target));
            System.out.println("Alias " + name + " -> " + target);
            return 0;
        } catch (Exception e) {
            System.err.println("Aliases add failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "remove", description = "Remove an alias")
    int remove(@Parameters(index = "0", paramLabel = "NAME") String name) {
        try {
            LlmcConfig config = context.loadConfig();
            context.saveConfig(config.withoutAlias(name));
            System.out.println("Removed alias " + name);
            return 0;
        } catch (Exception e) {
            System.err.println("Aliases remove failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "list", description = "List aliases")
    int list() {
        try {
            Map<String, String> aliases = context.loadConfig().aliases();
            if (aliases.isEmpty()) {
                System.out.println("No aliases configured.");
                return 0;
            }
            aliases.forEach((name, target) -> System.out.println(name + " -> " + target));
            return 0;
        } catch (Exception e) {
            System.err.println("Aliases list failed: " + e.getMessage());
            return 1;
        }
    }
}
