package io.kairo.core.cron;

import io.kairo.core.bus.MessageBus;
import io.kairo.core.bus.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards the response of a successful run to the job's channel when its payload asks for delivery.
 */
public final class CronDeliveryListener implements CronJobListener {
    private static final Logger LOG = LoggerFactory.getLogger(CronDeliveryListener.class);

    private final MessageBus messageBus;

    public CronDeliveryListener(MessageBus messageBus) {
        this.messageBus = messageBus;
    }

    @Override
    public void onJobExecuted(CronJobEvent event) {
        CronPayload payload = event.job().payload();
        if (!payload.deliver() || !event.success()) {
            return;
        }
        if (event.response() == null || event.response().isBlank()) {
            LOG.debug("Cron job {} produced no response to deliver", event.job().id());
            return;
        }
        if (payload.channel() == null || payload.channel().isBlank()) {
            LOG.warn("Cron job {} asks for delivery but has no channel", event.job().id());
            return;
        }
        messageBus.publish(new OutboundMessage(payload.channel(), payload.to(), event.response()));
    }
}
