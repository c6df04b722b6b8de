package io.kairo.core.bus;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;

public final class InMemoryMessageBus implements MessageBus {
    private final ConcurrentLinkedQueue<OutboundMessage> pending = new ConcurrentLinkedQueue<>();

    @Override
    public void publish(OutboundMessage message) {
        pending.offer(Objects.requireNonNull(message, "message must not be null"));
    }

    @Override
    public Optional<OutboundMessage> poll() {
        return Optional.ofNullable(pending.poll());
    }

    public int size() {
        return pending.size();
    }
}
