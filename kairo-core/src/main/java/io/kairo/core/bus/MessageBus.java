package io.kairo.core.bus;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Hand-off point between producers of outbound messages (scheduled jobs) and the channels that
 * deliver them.
 */
public interface MessageBus {
    void publish(OutboundMessage message);

    Optional<OutboundMessage> poll();

    /** Removes and returns everything queued so far, oldest first. */
    default List<OutboundMessage> drain() {
        List<OutboundMessage> drained = new ArrayList<>();
        for (Optional<OutboundMessage> next = poll(); next.isPresent(); next = poll()) {
            drained.add(next.get());
        }
        return drained;
    }
}
