package io.kairo.cli;

@FunctionalInterface
public interface GatewayRunner {
    int run(long drainIntervalMs) throws Exception;
}
