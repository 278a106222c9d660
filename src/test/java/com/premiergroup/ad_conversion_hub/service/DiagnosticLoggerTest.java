package com.premiergroup.ad_conversion_hub.service;

import com.premiergroup.ad_conversion_hub.support.InMemorySettingsStore;
import com.premiergroup.ad_conversion_hub.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticLoggerTest {

    @TempDir
    Path uploads;

    private GoogleAdsSettingsService settingsService;
    private DiagnosticLogger logger;

    @BeforeEach
    void setUp() {
        settingsService = new GoogleAdsSettingsService(new InMemorySettingsStore(), event -> {
        });
        MutableClock clock = new MutableClock(Instant.parse("2026-05-01T08:00:00Z"), ZoneOffset.ofHours(2));
        logger = new DiagnosticLogger(settingsService, clock, uploads.toString());
    }

    @Test
    @DisplayName("Nothing is written while logging is disabled")
    void disabled_writesNothing() {
        logger.info("hello");
        logger.error("boom");

        assertThat(logger.exists()).isFalse();
        assertThat(logger.getContents()).isEmpty();
    }

    @Test
    @DisplayName("Enabled logging appends timestamped lines under the uploads directory")
    void enabled_appendsFormattedLines() {
        enableLogging();

        logger.info("hello");
        logger.error("boom");

        assertThat(logger.getPath())
                .isEqualTo(uploads.resolve("ad-conversion-hub").resolve("gads-conversions.log").toAbsolutePath());
        assertThat(logger.getContents()).isEqualTo(
                "[2026-05-01 10:00:00+02:00] INFO hello\n"
                        + "[2026-05-01 10:00:00+02:00] ERROR boom\n");
    }

    @Test
    @DisplayName("The setting is read on every call")
    void disablingStopsFurtherWrites() {
        enableLogging();
        logger.info("first");

        settingsService.update(Map.of("enable_logging", "0"));
        logger.info("second");

        assertThat(logger.getContents()).contains("first").doesNotContain("second");
    }

    @Test
    @DisplayName("An oversized log is cut to its tail, starting at a line boundary")
    void oversizedLog_isTrimmedBeforeAppend() throws Exception {
        enableLogging();
        Path path = logger.getPath();
        Files.createDirectories(path.getParent());

        // 99 chars + newline per line
        String line = "x".repeat(99) + "\n";
        StringBuilder content = new StringBuilder();
        while (content.length() <= DiagnosticLogger.MAX_SIZE) {
            content.append(line);
        }
        Files.writeString(path, content, StandardCharsets.UTF_8);

        logger.info("after trim");

        long size = Files.size(path);
        String contents = logger.getContents();
        assertThat(size).isLessThanOrEqualTo(DiagnosticLogger.TRIM_KEEP + 100L);
        assertThat(contents).startsWith("x".repeat(99) + "\n");
        assertThat(contents).endsWith("] INFO after trim\n");
        assertThat(contents.lines().filter(l -> l.startsWith("x")).allMatch(l -> l.length() == 99)).isTrue();
    }

    @Test
    @DisplayName("A log at the size limit is not trimmed")
    void logBelowLimit_isKept() throws Exception {
        enableLogging();
        Path path = logger.getPath();
        Files.createDirectories(path.getParent());
        Files.writeString(path, "a".repeat((int) DiagnosticLogger.MAX_SIZE - 1) + "\n", StandardCharsets.UTF_8);

        logger.info("kept");

        assertThat(Files.size(path)).isGreaterThan(DiagnosticLogger.MAX_SIZE);
    }

    @Test
    void clear_removesFile_andIsIdempotent() {
        enableLogging();
        logger.info("hello");
        assertThat(logger.exists()).isTrue();

        logger.clear();
        logger.clear();

        assertThat(logger.exists()).isFalse();
    }

    @Test
    void mask_keepsLastFourCharacters() {
        assertThat(DiagnosticLogger.mask("")).isEmpty();
        assertThat(DiagnosticLogger.mask(null)).isEmpty();
        assertThat(DiagnosticLogger.mask("abc")).isEqualTo("***");
        assertThat(DiagnosticLogger.mask("abcd")).isEqualTo("****");
        assertThat(DiagnosticLogger.mask("abcde")).isEqualTo("*bcde");
        assertThat(DiagnosticLogger.mask("secret-1234")).isEqualTo("*******1234");
    }

    private void enableLogging() {
        settingsService.update(Map.of("enable_logging", "1"));
    }
}
