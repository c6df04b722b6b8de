package io.kairo.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.kairo.core.config.model.KairoConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        KairoConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.workspace()).isEqualTo("~/.kairo/workspace");
        assertThat(config.cron().enabled()).isTrue();
        assertThat(config.cron().storePath()).isEqualTo("~/.kairo/cron/jobs.json");
    }

    @Test
    void shouldMergeExistingValuesOverDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "cron": {
                "enabled": false
              },
              "channels": {
                "telegram": {"token": "ignored"}
              }
            }
            """);

        KairoConfig config = service.load(configPath);

        assertThat(config.cron().enabled()).isFalse();
        assertThat(config.cron().storePath()).isEqualTo("~/.kairo/cron/jobs.json");
        assertThat(config.workspace()).isEqualTo("~/.kairo/workspace");
    }

    @Test
    void onboardShouldKeepExistingValuesAndCreateStoreDirectory() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".kairo/config.json");
        Path storePath = tempDir.resolve("data/cron/jobs.json");
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, "{\"cron\": {\"storePath\": \"" + storePath.toString().replace("\\", "\\\\") + "\"}}");

        OnboardResult result = service.onboard(configPath, false);

        assertThat(result.createdConfig()).isFalse();
        assertThat(result.overwrittenConfig()).isFalse();
        assertThat(result.cronStorePath()).isEqualTo(storePath);
        assertThat(Files.isDirectory(storePath.getParent())).isTrue();
        assertThat(Files.readString(configPath)).contains("\"workspace\"").contains("\"enabled\" : true");
        assertThat(service.load(configPath).cron().storePath()).isEqualTo(storePath.toString());
    }

    @Test
    void shouldExpandHomePrefixWhenResolvingPaths() {
        Path home = Path.of(System.getProperty("user.home"));

        assertThat(ConfigPaths.resolveCronStore("~/jobs/cron.json")).isEqualTo(home.resolve("jobs/cron.json"));
        assertThat(ConfigPaths.resolveCronStore(" ")).isEqualTo(ConfigPaths.defaultCronStorePath());
        assertThat(ConfigPaths.resolveWorkspace(tempDir.toString())).isEqualTo(tempDir);
    }
}
