package io.llmc.cli;

import io.llmc.core.gateway.GatewayFilter;
import io.llmc.core.runtime.LlmcRuntime;

@FunctionalInterface
public interface GatewayRunner {
    int run(LlmcRuntime runtime, String host, int port, GatewayFilter filter) throws Exception;
}
