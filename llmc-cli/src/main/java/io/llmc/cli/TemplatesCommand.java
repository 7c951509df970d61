package io.llmc.cli;

import io.llmc.core.config.model.LlmcConfig;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(name = "templates", description = "Manage stored prompts, referenced as t:<name> in prompts and system prompts")
public final class TemplatesCommand implements Runnable {
    private static final int PREVIEW_LENGTH = 60;

    private final CliContext context;

    @Spec
    CommandSpec spec;

    public TemplatesCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "add", description = "Add or replace a template")
    int add(
        @Parameters(index = "0", paramLabel = "NAME") String name,
        @Parameters(index = "1", paramLabel = "PROMPT") String prompt
    ) {
        try {
            LlmcConfig config = context.loadConfig();
            context.saveConfig(config.withTemplate(name, prompt));
            System.out.println("Template '" + name + "' added");
            return 0;
        } catch (Exception e) {
            System.err.println("Templates add failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "remove", aliases = "delete", description = "Remove a template")
    int remove(@Parameters(index = "0", paramLabel = "NAME") String name) {
        try {
            LlmcConfig config = context.loadConfig();
            context.saveConfig(config.withoutTemplate(name));
            System.out.println("Template '" + name + "' removed");
            return 0;
        } catch (Exception e) {
            System.err.println("Templates remove failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "show", description = "Print a template's full prompt")
    int show(@Parameters(index = "0", paramLabel = "NAME") String name) {
        try {
            String prompt = context.loadConfig().templates().get(name);
            if (prompt == null) {
                System.err.println("Template '" + name + "' not found");
                return 1;
            }
            System.out.println(prompt);
            return 0;
        } catch (Exception e) {
            System.err.println("Templates show failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "list", description = "List templates")
    int list() {
        try {
            Map<String, String> templates = context.loadConfig().templates();
            if (templates.isEmpty()) {
                System.out.println("No templates configured.");
                return 0;
            }
            templates.forEach((name, prompt) -> System.out.println(name + " -> " + preview(prompt)));
            return 0;
        } catch (Exception e) {
            System.err.println("Templates list failed: " + e.getMessage());
            return 1;
        }
    }

    private static String preview(String prompt) {
        return prompt.length() > PREVIEW_LENGTH ? prompt.substring(0, PREVIEW_LENGTH) + "..." : prompt;
    }
}
