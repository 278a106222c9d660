package com.premiergroup.ad_conversion_hub.service;

import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Opt-in diagnostic log of the Google Ads traffic, kept in a single size-capped file the
 * operator can download.
 * <p>
 * Writes are a no-op unless {@code enable_logging} is on; the setting is read on every call.
 * Once the file grows past {@link #MAX_SIZE} it is cut down to roughly the last
 * {@link #TRIM_KEEP} bytes, starting at a line boundary. Secrets must go through
 * {@link #mask(String)} before they are logged.
 */
@Component
@Log4j2
public class DiagnosticLogger {

    static final String DIR_NAME = "ad-conversion-hub";
    static final String FILE_NAME = "gads-conversions.log";
    static final long MAX_SIZE = 512_000;
    static final int TRIM_KEEP = 256_000;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssxxx");
    private static final int VISIBLE = 4;

    private final GoogleAdsSettingsService settingsService;
    private final Clock clock;
    private final Path path;

    public DiagnosticLogger(GoogleAdsSettingsService settingsService,
                            Clock clock,
                            @Value("${gads.log.uploads-dir:uploads}") String uploadsDir) {
        this.settingsService = settingsService;
        this.clock = clock;
        this.path = Path.of(uploadsDir, DIR_NAME, FILE_NAME).toAbsolutePath();
    }

    public void info(String message) {
        write("INFO", message);
    }

    public void error(String message) {
        write("ERROR", message);
    }

    /**
     * Hides all but the last four characters, e.g. {@code "**********1234"}.
     * Values of four characters or fewer are hidden entirely; an empty value stays empty.
     */
    public static String mask(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        int length = value.length();
        if (length <= VISIBLE) {
            return "*".repeat(length);
        }
        return "*".repeat(length - VISIBLE) + value.substring(length - VISIBLE);
    }

    public Path getPath() {
        return path;
    }

    public boolean exists() {
        return Files.exists(path);
    }

    /**
     * @return the whole log, or an empty string when there is no log file
     */
    public synchronized String getContents() {
        if (!exists()) {
            return "";
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read diagnostic log {}", path, e);
            return "";
        }
    }

    /**
     * Deletes the log file. Does nothing when there is none.
     */
    public synchronized void clear() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete diagnostic log {}", path, e);
        }
    }

    // Trim and append share one lock so readers never see a half-rewritten file.
    private synchronized void write(String level, String message) {
        if (!settingsService.getAll().isLoggingEnabled()) {
            return;
        }

        String line = "[" + ZonedDateTime.now(clock).format(TIMESTAMP) + "] " + level + " " + message + "\n";

        try {
            Files.createDirectories(path.getParent());
            try (FileChannel channel = FileChannel.open(path,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {

                if (channel.size() > MAX_SIZE) {
                    trim(channel);
                }
                channel.position(channel.size());
                writeFully(channel, ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8)));
            }
        } catch (IOException e) {
            log.warn("Could not write diagnostic log {}", path, e);
        }
    }

    private static void trim(FileChannel channel) throws IOException {
        long size = channel.size();
        ByteBuffer tail = ByteBuffer.allocate(TRIM_KEEP);
        channel.position(size - TRIM_KEEP);
        int read;
        do {
            read = channel.read(tail);
        } while (read >= 0 && tail.hasRemaining());
        tail.flip();

        // drop the partial line at the head of the tail
        int start = 0;
        for (int i = 0; i < tail.limit(); i++) {
            if (tail.get(i) == '\n') {
                start = i + 1;
                break;
            }
        }
        tail.position(start);

        channel.truncate(0);
        channel.position(0);
        writeFully(channel, tail);
    }

    private static void writeFully(FileChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }
}
