package io.kairo.core.cron;

import static org.assertj.core.api.Assertions.assertThat;

import io.kairo.core.bus.InMemoryMessageBus;
import io.kairo.core.bus.OutboundMessage;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class CronDeliveryListenerTest {
    private final InMemoryMessageBus bus = new InMemoryMessageBus();
    private final CronDeliveryListener listener = new CronDeliveryListener(bus);

    private static CronJob job(CronPayload payload) {
        return new CronJob("abcd1234", "digest", true, CronSchedule.every(60_000), payload, null, 0L, 0L, false);
    }

    @Test
    void shouldPublishResponseToPayloadChannel() {
        listener.onJobExecuted(new CronJobEvent(job(new CronPayload("digest", true, "telegram", "42")), true, "Here is your digest", null));

        assertThat(bus.poll()).contains(new OutboundMessage("telegram", "42", "Here is your digest"));
        assertThat(bus.poll()).isEmpty();
    }

    @Test
    void shouldSkipWhenDeliveryNotRequested() {
        listener.onJobExecuted(new CronJobEvent(job(new CronPayload("digest", false, "telegram", "42")), true, "quiet", null));

        assertThat(bus.poll()).isEmpty();
    }

    @Test
    void shouldSkipFailedRunsBlankResponsesAndMissingChannel() {
        CronJob delivering = job(new CronPayload("digest", true, "telegram", "42"));
        listener.onJobExecuted(new CronJobEvent(delivering, false, null, "boom"));
        listener.onJobExecuted(new CronJobEvent(delivering, true, "  ", null));
        listener.onJobExecuted(new CronJobEvent(job(new CronPayload("digest", true, null, "42")), true, "lost", null));

        assertThat(bus.poll()).isEmpty();
    }

    @Test
    void shouldDeliverThroughRunningService() {
        MutableClock clock = new MutableClock(1_000_000L);
        FakeWakeTimer timer = new FakeWakeTimer();
        CronService service = new CronService(
            new InMemoryCronStore(),
            clock,
            job -> CompletableFuture.completedFuture("reply to " + job.payload().to()),
            new ScheduleEvaluator(ZoneOffset.UTC),
            timer
        );
        service.addListener(listener);
        service.start();
        service.addJob(new CronJobDefinition("ping", CronSchedule.every(1_000), new CronPayload("ping", true, "slack", "C01"), false));

        clock.advance(1_000);
        timer.fire();

        assertThat(bus.poll()).contains(new OutboundMessage("slack", "C01", "reply to C01"));
    }
}
