package io.llmc.cli;

import picocli.CommandLine.Command;

@Command(name = "llmc", mixinStandardHelpOptions = true, description = "Multi-provider LLM client and OpenAI-compatible gateway")
public final class LlmcCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
