package com.cardtally.bot.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;

/**
 * Writes the last known bot status to a small JSON file for operators.
 *
 * <p>Purely informational: nothing reads the file back, and a failed write is logged
 * and otherwise ignored.
 */
@Component
public class BotStatusWriter {

    private static final Logger log = LoggerFactory.getLogger(BotStatusWriter.class);

    private final ObjectMapper objectMapper;
    private final Path statusPath;
    private final Clock clock;

    public BotStatusWriter(ObjectMapper objectMapper,
                           @Value("${bot.status.path:bot_status.json}") String statusPath,
                           Clock clock) {
        this.objectMapper = objectMapper;
        this.statusPath   = Path.of(statusPath);
        this.clock        = clock;
    }

    public void running(String lastMessage) {
        write(new BotStatus(true, lastMessage, null, Instant.now(clock)));
    }

    public void stopped(String lastMessage, String error) {
        write(new BotStatus(false, lastMessage, error, Instant.now(clock)));
    }

    public Path path() {
        return statusPath;
    }

    private synchronized void write(BotStatus status) {
        Path tmp = statusPath.resolveSibling(statusPath.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(tmp.toFile(), status);
            Files.move(tmp, statusPath, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("Status file write failed (ignored). path={} reason={}", statusPath, e.getMessage());
        }
    }
}
