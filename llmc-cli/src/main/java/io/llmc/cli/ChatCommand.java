package io.llmc.cli;

import io.llmc.core.chatlog.ChatLog;
import io.llmc.core.chatlog.ChatLogEntry;
import io.llmc.core.client.ModelTarget;
import io.llmc.core.config.model.LlmcConfig;
import io.llmc.core.model.ChatChunk;
import io.llmc.core.model.ChatMessage;
import io.llmc.core.model.ChatRequest;
import io.llmc.core.model.ChatResponse;
import io.llmc.core.model.ToolCall;
import io.llmc.core.model.Usage;
import io.llmc.core.normalize.ChatStream;
import io.llmc.core.runtime.LlmcRuntime;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "chat", description = "Send a prompt to a provider, optionally continuing a logged conversation")
public final class ChatCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Prompt to send, or t:<name> for a stored template")
    String prompt;

    @Option(names = {"-m", "--model"}, description = "Model, alias or provider:model")
    String model;

    @Option(names = {"-p", "--provider"}, description = "Provider override")
    String provider;

    @Option(names = "--stream", description = "Stream the answer as it is generated")
    boolean stream;

    @Option(names = "--max-tokens", description = "Maximum tokens to generate, e.g. 512 or 2k")
    String maxTokens;

    @Option(names = "--temperature", description = "Sampling temperature")
    Double temperature;

    @Option(names = {"-s", "--system"}, description = "System prompt, or t:<name> for a stored template")
    String system;

    @Option(names = "--cid", description = "Chat id to start or continue")
    String chatId;

    @Option(names = {"-c", "--continue"}, description = "Continue the current session")
    boolean continueSession;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            LlmcConfig config = context.loadConfig();
            ChatLog chatLog = context.openChatLog();
            String sessionId = sessionId(chatLog);
            String question = config.resolveTemplateOrPrompt(prompt);
            try (LlmcRuntime runtime = context.openRuntime(config)) {
                ModelTarget target = target(config, runtime);
                List<ChatMessage> messages = new ArrayList<>();
                String systemPrompt = config.resolveTemplateOrPrompt(system != null ? system : config.systemPrompt());
                if (systemPrompt != null && !systemPrompt.isBlank()) {
                    messages.add(ChatMessage.system(systemPrompt));
                }
                messages.addAll(ChatLogEntry.transcript(chatLog.history(sessionId)));
                messages.add(ChatMessage.user(question));
                boolean streaming = stream || Boolean.TRUE.equals(config.stream());
                ChatRequest request = new ChatRequest(
                    target.model(),
                    messages,
                    maxTokens != null ? Integer.valueOf(LlmcConfig.parseMaxTokens(maxTokens)) : config.maxTokens(),
                    temperature != null ? temperature : config.temperature(),
                    List.of(),
                    streaming
                );
                Answer answer = streaming
                    ? printStream(runtime, target, request)
                    : printResponse(runtime.client().chat(target, request));
                saveEntry(chatLog, new ChatLogEntry(sessionId, target.toString(), question, answer.text(), Instant.now(),
                    answer.usage() == null ? null : answer.usage().inputTokens(),
                    answer.usage() == null ? null : answer.usage().outputTokens()));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }

    private String sessionId(ChatLog chatLog) throws IOException {
        if (chatId != null && !chatId.isBlank()) {
            return chatId.trim();
        }
        if (continueSession) {
            return chatLog.currentSession().orElseGet(() -> UUID.randomUUID().toString());
        }
        return UUID.randomUUID().toString();
    }

    private ModelTarget target(LlmcConfig config, LlmcRuntime runtime) {
        String requested = model != null && !model.isBlank() ? model : config.defaultModel();
        if (provider != null && !provider.isBlank()) {
            runtime.registry().require(provider);
            return new ModelTarget(provider, requested);
        }
        return runtime.resolver().resolve(requested, config.defaultProvider());
    }

    private Answer printStream(LlmcRuntime runtime, ModelTarget target, ChatRequest request) {
        StringBuilder text = new StringBuilder();
        Usage usage;
        try (ChatStream chunks = runtime.client().stream(target, request)) {
            while (chunks.hasNext()) {
                ChatChunk chunk = chunks.next();
                if (!chunk.content().isEmpty()) {
                    text.append(chunk.content());
                    System.out.print(chunk.content());
                    System.out.flush();
                }
            }
            usage = chunks.usage();
        }
        System.out.println();
        return new Answer(text.toString(), usage);
    }

    private Answer printResponse(ChatResponse response) {
        if (!response.content().isEmpty()) {
            System.out.println(response.content());
        }
        for (ToolCall call : response.toolCalls()) {
            System.out.println("Tool call: " + call.name() + " " + call.arguments());
        }
        return new Answer(response.content(), response.usage());
    }

    // The answer is already printed, so a log failure only warns.
    private static void saveEntry(ChatLog chatLog, ChatLogEntry entry) {
        try {
            chatLog.append(entry);
            chatLog.setCurrentSession(entry.chatId());
        } catch (IOException e) {
            System.err.println("Warning: failed to save chat log: " + e.getMessage());
        }
    }

    private record Answer(String text, Usage usage) {
    }
}
