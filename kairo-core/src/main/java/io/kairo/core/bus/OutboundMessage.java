package io.kairo.core.bus;

public record OutboundMessage(String channel, String to, String content) {
}
