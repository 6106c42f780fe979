package com.httpretry.core.util;

import com.httpretry.core.model.RetryConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class YamlConfigLoaderTest {

    @TempDir
    Path tmp;

    private static InputStream yaml(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void loads_full_file_from_classpath() throws Exception {
        RetryConfig cfg;
        try (InputStream in = getClass().getResourceAsStream("/retry-test.yml")) {
            assertThat(in).as("test resource retry-test.yml").isNotNull();
            cfg = YamlConfigLoader.load(in);
        }

        assertThat(cfg.getStrategy()).isEqualTo(RetryConfig.Strategy.EXPONENTIAL);
        assertThat(cfg.getMaxAttempts()).isEqualTo(5);
        assertThat(cfg.getWait()).isEqualTo(Duration.ofMillis(200));
        assertThat(cfg.getMaxWait()).isEqualTo(Duration.ofSeconds(2));
        assertThat(cfg.getJitter()).isEqualTo(0.1);
        assertThat(cfg.isHonorRetryAfter()).isTrue();
        assertThat(cfg.getRetryAfterCap()).isEqualTo(Duration.ofSeconds(5));
        assertThat(cfg.getCallTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(cfg.isStrictTransport()).isTrue();
        assertThat(cfg.getTransport().getConnectTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(cfg.getTransport().getRequestTimeout()).isEqualTo(Duration.ofSeconds(4));
        assertThat(cfg.getTransport().isFollowRedirects()).isFalse();
        assertThat(cfg.getEvaluator().getRetryStatuses()).containsExactly(408, 425);
        assertThat(cfg.getEvaluator().getExcludeStatuses()).containsExactly(501);
    }

    @Test
    void empty_document_gives_defaults() {
        RetryConfig cfg = YamlConfigLoader.load(yaml(""));
        assertThat(cfg.getMaxAttempts()).isEqualTo(RetryConfig.DEFAULT_MAX_ATTEMPTS);
        assertThat(cfg.getWait()).isEqualTo(RetryConfig.DEFAULT_WAIT);
    }

    @Test
    void partial_document_keeps_other_defaults_and_accepts_comma_lists() {
        RetryConfig cfg = YamlConfigLoader.load(yaml("""
                maxAttempts: 4
                evaluator:
                  retryStatuses: "408, 409"
                """));

        assertThat(cfg.getMaxAttempts()).isEqualTo(4);
        assertThat(cfg.getStrategy()).isEqualTo(RetryConfig.Strategy.CONSTANT);
        assertThat(cfg.getEvaluator().getRetryStatuses()).containsExactly(408, 409);
    }

    @Test
    void strategy_is_case_insensitive_and_unknown_values_fail() {
        assertThat(YamlConfigLoader.load(yaml("strategy: Constant")).getStrategy())
                .isEqualTo(RetryConfig.Strategy.CONSTANT);
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("strategy: fibonacci")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fibonacci");
    }

    @Test
    void invalid_values_are_rejected_by_validation() {
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("evaluator:\n  excludeStatuses: [700]\n")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void load_from_path() throws Exception {
        Path file = tmp.resolve("retry.yml");
        Files.writeString(file, "waitMs: 250\ncallTimeoutMs: 0\n");

        RetryConfig cfg = YamlConfigLoader.load(file);

        assertThat(cfg.getWaitMs()).isEqualTo(250);
        assertThat(cfg.getCallTimeout()).isNull();
    }

    @Test
    void missing_file_is_an_io_error() {
        assertThatThrownBy(() -> YamlConfigLoader.load(tmp.resolve("nope.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }
}
