package io.kairo.core.cron;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scheduled-job engine: owns the job registry, keeps one wake timer armed for the earliest due job
 * and runs due jobs one after another through the injected {@link CronJobHandler}.
 *
 * <p>Registry and timer state are guarded by a single lock. The handler itself runs outside of it,
 * so queries and mutations stay responsive while a job executes. Batches and manual runs are
 * serialized by a second lock.
 */
public final class CronService implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CronService.class);
    private static final int ID_LENGTH = 8;

    private final CronStore store;
    private final Clock clock;
    private final CronJobHandler handler;
    private final ScheduleEvaluator evaluator;
    private final WakeTimer wakeTimer;
    private final List<CronJobListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private final Object executionLock = new Object();

    private final List<CronJob> jobs = new ArrayList<>();
    private boolean loaded;
    private ServiceState state = ServiceState.STOPPED;

    public CronService(CronStore store, Clock clock, CronJobHandler handler) {
        this(store, clock, handler, new ScheduleEvaluator(), new ScheduledWakeTimer());
    }

    public CronService(
        CronStore store,
        Clock clock,
        CronJobHandler handler,
        ScheduleEvaluator evaluator,
        WakeTimer wakeTimer
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.handler = handler;
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.wakeTimer = Objects.requireNonNull(wakeTimer, "wakeTimer must not be null");
    }

    public void addListener(CronJobListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(CronJobListener listener) {
        listeners.remove(listener);
    }

    // --- lifecycle ---

    public void start() {
        int jobCount;
        synchronized (lock) {
            if (state != ServiceState.STOPPED) {
                return;
            }
            state = ServiceState.STARTING;
            try {
                ensureLoaded();
                long now = now();
                for (int i = 0; i < jobs.size(); i++) {
                    CronJob job = jobs.get(i);
                    if (job.enabled()) {
                        jobs.set(i, job.withState(job.state().withNextRunAtMs(nextRunAt(job.schedule(), now))));
                    }
                }
                persist();
                state = ServiceState.RUNNING;
                armTimer();
            } catch (RuntimeException e) {
                state = ServiceState.STOPPED;
                throw e;
            }
            jobCount = jobs.size();
        }
        LOG.info("Cron service started with {} jobs", jobCount);
    }

    public void stop() {
        synchronized (lock) {
            if (state == ServiceState.STOPPED) {
                return;
            }
            state = ServiceState.STOPPED;
            wakeTimer.cancel();
        }
        LOG.info("Cron service stopped");
    }

    public ServiceState state() {
        synchronized (lock) {
            return state;
        }
    }

    @Override
    public void close() {
        stop();
        wakeTimer.close();
    }

    // --- registry ---

    /**
     * @throws IllegalArgumentException if the schedule is invalid; nothing is changed in that case
     */
    public CronJob addJob(CronJobDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        evaluator.validate(definition.schedule());

        CronJob job;
        synchronized (lock) {
            ensureLoaded();
            long now = now();
            job = new CronJob(
                newId(),
                definition.name(),
                true,
                definition.schedule(),
                definition.payload(),
                CronJobState.initial(nextRunAt(definition.schedule(), now)),
                now,
                now,
                definition.deleteAfterRun()
            );
            jobs.add(job);
            persist();
            armTimer();
        }
        LOG.info("Added cron job '{}' ({}) {}", job.name(), job.id(), job.schedule().describe());
        return job;
    }

    public boolean removeJob(String id) {
        synchronized (lock) {
            ensureLoaded();
            boolean removed = jobs.removeIf(job -> job.id().equals(id));
            if (!removed) {
                return false;
            }
            persist();
            armTimer();
        }
        LOG.info("Removed cron job {}", id);
        return true;
    }

    public Optional<CronJob> enableJob(String id, boolean enabled) {
        CronJob updated;
        synchronized (lock) {
            ensureLoaded();
            int index = indexOf(id);
            if (index < 0) {
                return Optional.empty();
            }
            long now = now();
            CronJob job = jobs.get(index);
            Long nextRun = enabled ? nextRunAt(job.schedule(), now) : null;
            updated = job.withEnabled(enabled)
                .withState(job.state().withNextRunAtMs(nextRun))
                .withUpdatedAtMs(now);
            jobs.set(index, updated);
            persist();
            armTimer();
        }
        LOG.info("Cron job '{}' ({}) {}", updated.name(), updated.id(), enabled ? "enabled" : "disabled");
        return Optional.of(updated);
    }

    public Optional<CronJob> getJob(String id) {
        synchronized (lock) {
            ensureLoaded();
            int index = indexOf(id);
            return index < 0 ? Optional.empty() : Optional.of(jobs.get(index));
        }
    }

    /**
     * Snapshot ordered by next run; jobs without one come last.
     */
    public List<CronJob> listJobs(boolean includeDisabled) {
        List<CronJob> snapshot;
        synchronized (lock) {
            ensureLoaded();
            snapshot = new ArrayList<>(jobs);
        }
        if (!includeDisabled) {
            snapshot.removeIf(job -> !job.enabled());
        }
        snapshot.sort(Comparator.comparingLong(CronService::sortKey));
        return List.copyOf(snapshot);
    }

    public CronServiceStatus getStatus() {
        synchronized (lock) {
            ensureLoaded();
            int enabled = (int) jobs.stream().filter(CronJob::enabled).count();
            OptionalLong nextWake = nextWakeAtMs();
            return new CronServiceStatus(
                state == ServiceState.RUNNING,
                jobs.size(),
                enabled,
                nextWake.isPresent() ? nextWake.getAsLong() : null
            );
        }
    }

    // --- execution ---

    /**
     * Runs one job now, whether or not it is enabled.
     *
     * @return the completion event, or empty when no job has this id
     */
    public Optional<CronJobEvent> runJob(String id) {
        synchronized (executionLock) {
            synchronized (lock) {
                ensureLoaded();
            }
            Optional<CronJobEvent> event = execute(id, false);
            if (event.isPresent()) {
                synchronized (lock) {
                    persist();
                    armTimer();
                }
            }
            return event;
        }
    }

    private void onWake() {
        synchronized (executionLock) {
            List<String> dueIds;
            synchronized (lock) {
                if (state != ServiceState.RUNNING) {
                    return;
                }
                long now = now();
                dueIds = jobs.stream().filter(job -> job.dueAt(now)).map(CronJob::id).toList();
            }

            try {
                for (String id : dueIds) {
                    if (state() != ServiceState.RUNNING) {
                        LOG.info("Cron service stopped, skipping {} remaining due jobs", dueIds.size() - dueIds.indexOf(id));
                        break;
                    }
                    execute(id, true);
                }
            } finally {
                synchronized (lock) {
                    persist();
                    armTimer();
                }
            }
        }
    }

    private Optional<CronJobEvent> execute(String id, boolean scheduled) {
        CronJob job;
        synchronized (lock) {
            int index = indexOf(id);
            if (index < 0) {
                return Optional.empty();
            }
            long now = now();
            job = jobs.get(index);
            if (scheduled && !job.dueAt(now)) {
                // removed from the batch by a concurrent disable or re-enable
                return Optional.empty();
            }
            job = job.withState(job.state().withLastRunAtMs(now));
            jobs.set(index, job);
        }

        LOG.info("Executing cron job '{}' ({})", job.name(), job.id());
        String response = null;
        String error = null;
        try {
            response = invokeHandler(job);
            LOG.info("Cron job '{}' ({}) completed", job.name(), job.id());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = "interrupted";
            LOG.warn("Cron job '{}' ({}) interrupted", job.name(), job.id());
        } catch (Exception e) {
            error = describe(e);
            LOG.error("Cron job '{}' ({}) failed", job.name(), job.id(), e);
        }

        CronJob result;
        synchronized (lock) {
            result = recordResult(job, error);
        }

        CronJobEvent event = new CronJobEvent(result, error == null, response, error);
        notifyListeners(event);
        return Optional.of(event);
    }

    private String invokeHandler(CronJob job) throws Exception {
        if (handler == null) {
            return null;
        }
        CompletionStage<String> stage = handler.handle(job);
        if (stage == null) {
            return null;
        }
        try {
            return stage.toCompletableFuture().get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Applies the outcome to the registry's current copy of the job, which may have been changed
     * while the handler ran. Must hold {@link #lock}.
     */
    private CronJob recordResult(CronJob executed, String error) {
        long now = now();
        int index = indexOf(executed.id());
        CronJob current = index >= 0 ? jobs.get(index) : executed;

        CronJobState state = current.state().withLastRunAtMs(executed.state().lastRunAtMs());
        state = error == null ? state.succeeded() : state.failed(error);
        CronJob result = current.withUpdatedAtMs(now);

        if (result.schedule().kind() == ScheduleKind.AT) {
            result = result.withState(state.withNextRunAtMs(null));
            if (result.deleteAfterRun()) {
                if (index >= 0) {
                    jobs.remove(index);
                    LOG.info("Deleted one-shot cron job '{}' ({}) after run", result.name(), result.id());
                }
                return result;
            }
            result = result.withEnabled(false);
        } else {
            Long nextRun = result.enabled() ? nextRunAt(result.schedule(), now) : null;
            result = result.withState(state.withNextRunAtMs(nextRun));
        }

        if (index >= 0) {
            jobs.set(index, result);
        }
        return result;
    }

    private void notifyListeners(CronJobEvent event) {
        for (CronJobListener listener : listeners) {
            try {
                listener.onJobExecuted(event);
            } catch (RuntimeException e) {
                LOG.error("Cron job listener failed for job {}", event.job().id(), e);
            }
        }
    }

    // --- internals, callers hold the lock ---

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        jobs.clear();
        jobs.addAll(store.load());
        loaded = true;
    }

    private void persist() {
        try {
            store.save(List.copyOf(jobs));
        } catch (RuntimeException e) {
            LOG.error("Failed to persist cron jobs, keeping in-memory state", e);
        }
    }

    private void armTimer() {
        wakeTimer.cancel();
        if (state != ServiceState.RUNNING) {
            return;
        }
        OptionalLong nextWake = nextWakeAtMs();
        if (nextWake.isEmpty()) {
            LOG.debug("No enabled cron job has a next run, timer left idle");
            return;
        }
        long delay = Math.max(0L, nextWake.getAsLong() - now());
        wakeTimer.schedule(delay, this::onWake);
        LOG.debug("Cron timer armed for {} ms", delay);
    }

    private OptionalLong nextWakeAtMs() {
        return jobs.stream()
            .filter(job -> job.enabled() && job.state().nextRunAtMs() != null)
            .mapToLong(job -> job.state().nextRunAtMs())
            .min();
    }

    private Long nextRunAt(CronSchedule schedule, long now) {
        OptionalLong next = evaluator.nextRun(schedule, now);
        return next.isPresent() ? next.getAsLong() : null;
    }

    private int indexOf(String id) {
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private String newId() {
        while (true) {
            String candidate = UUID.randomUUID().toString().replace("-", "").substring(0, ID_LENGTH);
            if (indexOf(candidate) < 0) {
                return candidate;
            }
        }
    }

    private long now() {
        return clock.millis();
    }

    private static long sortKey(CronJob job) {
        Long next = job.state().nextRunAtMs();
        return next == null ? Long.MAX_VALUE : next;
    }

    private static String describe(Exception e) {
        return e.getMessage() == null || e.getMessage().isBlank() ? e.getClass().getSimpleName() : e.getMessage();
    }
}
