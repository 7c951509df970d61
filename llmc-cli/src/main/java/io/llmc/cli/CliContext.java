package io.llmc.cli;

import io.llmc.core.chatlog.ChatLog;
import io.llmc.core.chatlog.SqliteChatLog;
import io.llmc.core.config.ConfigPaths;
import io.llmc.core.config.ConfigService;
import io.llmc.core.config.model.LlmcConfig;
import io.llmc.core.http.TransportSettings;
import io.llmc.core.runtime.LlmcRuntime;
import java.io.IOException;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    TransportSettings transportSettings,
    GatewayRunner gatewayRunner
) {
    public CliContext(ConfigService configService, Path configPath, TransportSettings transportSettings) {
        this(configService, configPath, transportSettings, (runtime, host, port, filter) -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }

    public LlmcConfig loadConfig() throws IOException {
        return configService.load(configPath);
    }

    public void saveConfig(LlmcConfig config) throws IOException {
        configService.save(configPath, config);
    }

    public LlmcRuntime openRuntime(LlmcConfig config) throws IOException {
        return LlmcRuntime.create(config, configPath, transportSettings);
    }

    public ChatLog openChatLog() throws IOException {
        return new SqliteChatLog(ConfigPaths.chatLogDbPath(configPath));
    }
}
