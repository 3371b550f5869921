package org.carball.querylens.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultConfiguration() {
        // When
        QueryLensConfig config = new ConfigurationLoader(Map.of()).loadDefaults();

        // Then
        assertThat(config.isEnabled()).isTrue();
        assertThat(config.getConnections()).containsExactly("*");
        assertThat(config.getSlowQueryThresholdMs()).isEqualTo(100.0);
        assertThat(config.getNPlusOneThreshold()).isEqualTo(3);
        assertThat(config.getNPlusOneTimeWindowMs()).isEqualTo(100);
        assertThat(config.getNPlusOneAlertMode()).isEqualTo(NPlusOneAlertMode.EXACT_THRESHOLD);
        assertThat(config.getSamplingPercent()).isEqualTo(100);
        assertThat(config.getStoragePath()).isEqualTo(Paths.get("logs", "queries"));
        assertThat(config.getMaxFileSizeBytes()).isEqualTo(50L * 1024 * 1024);
        assertThat(config.getRetentionDays()).isEqualTo(7);
        assertThat(config.isAlertsEnabled()).isFalse();
        assertThat(config.getQueryCountThreshold()).isEqualTo(50);
    }

    @Test
    void shouldReadYamlFile() throws IOException {
        // Given
        Path file = tempDir.resolve("query-lens.yml");
        Files.writeString(file, """
                slow_query_threshold: 250
                connections: [primary, replica]
                n_plus_one_detection:
                  threshold: 5
                  time_window_ms: 500
                  alert_mode: FIRST_DETECTION
                storage:
                  path: /var/log/query-lens
                  max_file_size_mb: 2
                alerts:
                  enabled: true
                  channels: [log, slack]
                  webhook_url: https://hooks.example.com/T000
                metadata:
                  tenant_id: true
                unknown_key: ignored
                """);

        // When
        QueryLensConfig config = new ConfigurationLoader(Map.of()).load(file);

        // Then
        assertThat(config.getSlowQueryThresholdMs()).isEqualTo(250.0);
        assertThat(config.getConnections()).containsExactly("primary", "replica");
        assertThat(config.getNPlusOneThreshold()).isEqualTo(5);
        assertThat(config.getNPlusOneTimeWindowMs()).isEqualTo(500);
        assertThat(config.getNPlusOneAlertMode()).isEqualTo(NPlusOneAlertMode.FIRST_DETECTION);
        assertThat(config.getStoragePath()).isEqualTo(Paths.get("/var/log/query-lens"));
        assertThat(config.getMaxFileSizeBytes()).isEqualTo(2L * 1024 * 1024);
        assertThat(config.isAlertsEnabled()).isTrue();
        assertThat(config.getAlertChannels()).containsExactly("log", "slack");
        assertThat(config.getWebhookUrl()).isEqualTo("https://hooks.example.com/T000");
        assertThat(config.isCollectTenantId()).isTrue();
        // untouched sections keep their defaults
        assertThat(config.getRetentionDays()).isEqualTo(7);
        assertThat(config.isCollectUserId()).isTrue();
    }

    @Test
    void shouldLetEnvironmentOverrideFile() throws IOException {
        // Given
        Path file = tempDir.resolve("query-lens.yml");
        Files.writeString(file, "slow_query_threshold: 250\nsampling: 50\n");
        Map<String, String> env = Map.of(
                "QUERY_LENS_SLOW_THRESHOLD", "40",
                "QUERY_LENS_CONNECTIONS", "primary, analytics ,",
                "QUERY_LENS_ALERTS", "true",
                "QUERY_LENS_MAX_FILE_SIZE_MB", "1");

        // When
        QueryLensConfig config = new ConfigurationLoader(env).load(file);

        // Then
        assertThat(config.getSlowQueryThresholdMs()).isEqualTo(40.0);
        assertThat(config.getSamplingPercent()).isEqualTo(50);
        assertThat(config.getConnections()).containsExactly("primary", "analytics");
        assertThat(config.isAlertsEnabled()).isTrue();
        assertThat(config.getMaxFileSizeBytes()).isEqualTo(1024L * 1024);
    }

    @Test
    void shouldIgnoreInvalidNumericEnvironmentValues() {
        // Given
        Map<String, String> env = Map.of(
                "QUERY_LENS_N_PLUS_ONE_THRESHOLD", "many",
                "QUERY_LENS_RETENTION_DAYS", "14");

        // When
        QueryLensConfig config = new ConfigurationLoader(env).loadDefaults();

        // Then
        assertThat(config.getNPlusOneThreshold()).isEqualTo(3);
        assertThat(config.getRetentionDays()).isEqualTo(14);
    }

    @Test
    void shouldFallBackToDefaultsForMissingOrBrokenFile() throws IOException {
        // Given
        Path broken = tempDir.resolve("broken.yml");
        Files.writeString(broken, "slow_query_threshold: [not, a, number\n");

        // When
        QueryLensConfig missing = new ConfigurationLoader(Map.of()).load(tempDir.resolve("absent.yml"));
        QueryLensConfig unreadable = new ConfigurationLoader(Map.of()).load(broken);

        // Then
        assertThat(missing.getSlowQueryThresholdMs()).isEqualTo(100.0);
        assertThat(unreadable.getSlowQueryThresholdMs()).isEqualTo(100.0);
    }

    @Test
    void shouldLoadProfileWithOverrides() throws IOException {
        // Given
        Path file = tempDir.resolve("query-lens.yml");
        Files.writeString(file, "backtrace:\n  limit: 3\n");

        // When
        QueryLensConfig config = new ConfigurationLoader(Map.of("QUERY_LENS_SAMPLING", "25"))
                .loadProfile("production", file);

        // Then
        assertThat(config.getSamplingPercent()).isEqualTo(25);
        assertThat(config.getBacktraceLimit()).isEqualTo(3);
        assertThat(config.isAnalyzeSlowQueries()).isFalse();
        assertThat(config.isAlertsEnabled()).isTrue();
        assertThat(config.isCollectIp()).isFalse();
    }

    @Test
    void shouldThrowExceptionForUnknownProfile() {
        // When/Then
        assertThatThrownBy(() -> new ConfigurationLoader(Map.of()).loadProfile("nonexistent", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown profile: nonexistent");
    }

    @Test
    void shouldRejectInvalidValuesFromEnvironment() {
        // Given
        Map<String, String> env = Map.of("QUERY_LENS_SAMPLING", "0");

        // When/Then
        assertThatThrownBy(() -> new ConfigurationLoader(env).loadDefaults())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Sampling percentage");
    }

    @Test
    void shouldLoadBundledSampleConfiguration() throws URISyntaxException {
        // Given
        Path sample = Paths.get(getClass().getResource("/query-lens.yml").toURI());

        // When
        QueryLensConfig config = new ConfigurationLoader(Map.of()).load(sample);

        // Then
        assertThat(config.getExcludePatterns()).hasSize(3);
        assertThat(config.getWebhookUrl()).isNull();
        assertThat(config.getResponseKey()).isEqualTo("_query_debug");
        assertThat(config.getAlertChannels()).isEqualTo(List.of("log"));
    }

    @Test
    void shouldDescribeEnvironmentVariables() {
        assertThat(ConfigurationLoader.getEnvironmentHelp())
                .contains("QUERY_LENS_SLOW_THRESHOLD")
                .contains("QUERY_LENS_WEBHOOK_URL");
    }
}
