package io.llmc.cli;

import io.llmc.core.config.model.LlmcConfig;
import io.llmc.core.models.ModelFilter;
import io.llmc.core.models.ModelMetadata;
import io.llmc.core.runtime.LlmcRuntime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "models", description = "List models of configured providers")
public final class ModelsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-p", "--provider"}, description = "Only this provider")
    String provider;

    @Option(names = "--refresh", description = "Refetch model lists instead of using the cache")
    boolean refresh;

    @Option(names = {"-q", "--query"}, description = "Case-insensitive search in id, name and description")
    String query;

    @Option(names = "--tools", description = "Only models that support tool calling")
    boolean tools;

    @Option(names = "--reasoning", description = "Only models that support reasoning")
    boolean reasoning;

    @Option(names = "--vision", description = "Only models that accept images")
    boolean vision;

    @Option(names = "--audio", description = "Only models that accept audio")
    boolean audio;

    @Option(names = "--code", description = "Only models tuned for code")
    boolean code;

    @Option(names = "--ctx", description = "Minimum context length, e.g. 128k")
    String minContext;

    @Option(names = "--input", description = "Minimum input token limit, e.g. 128k")
    String minInput;

    @Option(names = "--output", description = "Minimum output token limit, e.g. 8k")
    String minOutput;

    @Option(names = "--input-price", description = "Maximum input price per million tokens")
    Double maxInputPrice;

    @Option(names = "--output-price", description = "Maximum output price per million tokens")
    Double maxOutputPrice;

    public ModelsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ModelFilter filter = filter();
            LlmcConfig config = context.loadConfig();
            try (LlmcRuntime runtime = context.openRuntime(config)) {
                List<String> providers = provider == null || provider.isBlank()
                    ? runtime.registry().names()
                    : List.of(runtime.registry().require(provider).name());
                if (providers.isEmpty()) {
                    System.out.println("No providers configured. Add one with 'llmc providers add'.");
                    return 0;
                }
                int failures = 0;
                int shown = 0;
                for (String name : providers) {
                    try {
                        List<ModelMetadata> models = filter.apply(refresh
                            ? runtime.catalog().refresh(name).models()
                            : runtime.catalog().models(name));
                        shown += models.size();
                        for (ModelMetadata model : models) {
                            System.out.println(name + ":" + model.id() + describe(model));
                        }
                    } catch (RuntimeException e) {
                        failures++;
                        System.err.println("Failed to list models for " + name + ": " + e.getMessage());
                    }
                }
                if (shown == 0 && failures < providers.size() && !filter.equals(ModelFilter.NONE)) {
                    System.out.println("No models match the given filters.");
                }
                return failures == providers.size() ? 1 : 0;
            }
        } catch (Exception e) {
            System.err.println("Models command failed: " + e.getMessage());
            return 1;
        }
    }

    private ModelFilter filter() {
        return new ModelFilter(
            query,
            tools,
            reasoning,
            vision,
            audio,
            code,
            minContext == null ? null : ModelFilter.parseTokenCount(minContext),
            minInput == null ? null : ModelFilter.parseTokenCount(minInput),
            minOutput == null ? null : ModelFilter.parseTokenCount(minOutput),
            maxInputPrice,
            maxOutputPrice
        );
    }

    private static String describe(ModelMetadata model) {
        List<String> details = new ArrayList<>();
        if (model.contextLength() != null) {
            details.add("ctx " + model.contextLength());
        }
        if (model.supportsTools()) {
            details.add("tools");
        }
        if (model.supportsVision()) {
            details.add("vision");
        }
        if (model.supportsAudio()) {
            details.add("audio");
        }
        if (model.maxOutputTokens() != null) {
            details.add("out " + model.maxOutputTokens());
        }
        if (model.supportsReasoning()) {
            details.add("reasoning");
        }
        if (model.supportsCode()) {
            details.add("code");
        }
        if (model.inputPricePerMillion() != null && model.outputPricePerMillion() != null) {
            details.add(String.format(Locale.ROOT, "$%.2f/$%.2f per 1M", model.inputPricePerMillion(), model.outputPricePerMillion()));
        }
        return details.isEmpty() ? "" : "  [" + String.join(", ", details) + "]";
    }
}
