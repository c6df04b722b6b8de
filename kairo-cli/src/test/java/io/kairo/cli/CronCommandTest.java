package io.kairo.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.kairo.core.config.ConfigPaths;
import io.kairo.core.config.ConfigService;
import io.kairo.core.cron.CronJob;
import io.kairo.core.cron.CronService;
import io.kairo.core.cron.FileCronStore;
import io.kairo.core.cron.ScheduleKind;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CronCommandTest {

    @TempDir
    Path tempDir;

    private Path storePath;
    private CliContext context;
    private PrintStream originalOut;
    private PrintStream originalErr;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() throws Exception {
        storePath = tempDir.resolve("cron/jobs.json");
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "cron": {
                "storePath": "%s"
              }
            }
            """.formatted(storePath.toString().replace("\\", "\\\\")), StandardCharsets.UTF_8);

        context = new CliContext(new ConfigService(), configPath, config -> new CronService(
            new FileCronStore(ConfigPaths.resolveCronStore(config.cron().storePath())),
            Clock.systemUTC(),
            job -> CompletableFuture.completedFuture(job.payload().message().isBlank() ? null : "echo " + job.payload().message())
        ));

        originalOut = System.out;
        originalErr = System.err;
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private int cron(String... args) {
        return CronCommand.create(context).execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private List<CronJob> storedJobs() {
        return new FileCronStore(storePath).load();
    }

    @Test
    void shouldAddRecurringJobAndListIt() {
        int add = cron("add", "--name", "digest", "--message", "summarize inbox", "--every", "3600");
        int list = cron("list");

        assertThat(add).isZero();
        assertThat(list).isZero();
        CronJob job = storedJobs().get(0);
        assertThat(job.schedule().everyMs()).isEqualTo(3_600_000L);
        assertThat(job.state().nextRunAtMs()).isNotNull();
        assertThat(stdout())
            .contains("Added job 'digest' (" + job.id() + ")")
            .contains(job.id())
            .contains("every 3600s")
            .contains("Total: 1 job(s)");
    }

    @Test
    void shouldAddCronJobWithTimezoneAndDelivery() {
        int code = cron(
            "add", "-n", "standup", "-m", "standup notes",
            "--cron", "30 9 * * 1-5", "--tz", "America/Vancouver",
            "--deliver", "--channel", "slack", "--to", "C123"
        );

        assertThat(code).isZero();
        CronJob job = storedJobs().get(0);
        assertThat(job.schedule().kind()).isEqualTo(ScheduleKind.CRON);
        assertThat(job.schedule().tz()).isEqualTo("America/Vancouver");
        assertThat(job.payload().deliver()).isTrue();
        assertThat(job.payload().channel()).isEqualTo("slack");
        assertThat(job.payload().to()).isEqualTo("C123");
    }

    @Test
    void shouldAddOneShotFromNaturalTime() {
        int code = cron("add", "-n", "tea", "-m", "tea is ready", "--at", "in 10m", "--delete-after-run");

        assertThat(code).isZero();
        CronJob job = storedJobs().get(0);
        assertThat(job.schedule().kind()).isEqualTo(ScheduleKind.AT);
        assertThat(job.schedule().atMs()).isGreaterThan(System.currentTimeMillis());
        assertThat(job.deleteAfterRun()).isTrue();
    }

    @Test
    void shouldWarnWhenOneShotIsAlreadyPast() {
        int code = cron("add", "-n", "late", "-m", "too late", "--at", "2020-01-01T00:00:00Z");

        assertThat(code).isZero();
        assertThat(stdout()).contains("Warning: job has no upcoming run");
    }

    @Test
    void shouldRejectAmbiguousOrInvalidSchedules() {
        assertThat(cron("add", "-n", "x", "-m", "x")).isEqualTo(1);
        assertThat(cron("add", "-n", "x", "-m", "x", "--every", "10", "--cron", "* * * * *")).isEqualTo(1);
        assertThat(stderr()).contains("Cron add failed: specify exactly one of --every, --cron or --at");

        assertThat(cron("add", "-n", "x", "-m", "x", "--every", "10", "--tz", "UTC")).isEqualTo(1);
        assertThat(stderr()).contains("Cron add failed: --tz can only be used with --cron");

        assertThat(cron("add", "-n", "x", "-m", "x", "--cron", "0 9 * * *", "--tz", "Atlantis/Capital")).isEqualTo(1);
        assertThat(stderr()).contains("Cron add failed: Invalid timezone: Atlantis/Capital");

        assertThat(cron("add", "-n", "x", "-m", "x", "--every", "18446744073709552")).isEqualTo(1);
        assertThat(cron("add", "-n", "x", "-m", "x", "--every", "9223372036854776")).isEqualTo(1);
        assertThat(stderr()).contains("Cron add failed: --every is too large: 9223372036854776");

        assertThat(cron("add", "-n", "x", "-m", "x", "--at", "someday")).isEqualTo(1);
        assertThat(storedJobs()).isEmpty();
    }

    @Test
    void shouldDisableEnableRunAndRemoveJob() {
        cron("add", "-n", "ping", "-m", "ping", "--every", "60");
        String id = storedJobs().get(0).id();

        assertThat(cron("enable", id, "--disable")).isZero();
        assertThat(storedJobs().get(0).enabled()).isFalse();
        assertThat(cron("list")).isZero();
        assertThat(stdout()).contains("Job 'ping' disabled").contains("No scheduled jobs.");

        assertThat(cron("list", "--all")).isZero();
        assertThat(stdout()).contains("disabled").contains("Total: 1 job(s)");

        assertThat(cron("run", id)).isZero();
        assertThat(stdout()).contains("Job executed").contains("echo ping");
        assertThat(storedJobs().get(0).state().lastStatus()).isEqualTo("ok");

        assertThat(cron("enable", id)).isZero();
        assertThat(storedJobs().get(0).state().nextRunAtMs()).isNotNull();

        assertThat(cron("remove", id)).isZero();
        assertThat(stdout()).contains("Removed job " + id);
        assertThat(storedJobs()).isEmpty();
    }

    @Test
    void shouldFailForUnknownJobIds() {
        assertThat(cron("remove", "nope1234")).isEqualTo(1);
        assertThat(cron("enable", "nope1234")).isEqualTo(1);
        assertThat(cron("run", "nope1234")).isEqualTo(1);
        assertThat(stdout()).contains("Job nope1234 not found");
        assertThat(Files.exists(storePath)).isFalse();
    }

    @Test
    void shouldShowStatus() {
        cron("add", "-n", "a", "-m", "a", "--every", "60");
        cron("add", "-n", "b", "-m", "b", "--every", "120");
        cron("enable", storedJobs().get(1).id(), "--disable");

        int code = cron("status");

        assertThat(code).isZero();
        assertThat(stdout()).contains("Running: false").contains("Jobs: 2 (1 enabled)").contains("Next wake: ");
        assertThat(stdout()).doesNotContain("Next wake: -");
    }
}
