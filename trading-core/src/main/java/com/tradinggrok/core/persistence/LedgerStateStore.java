package com.tradinggrok.core.persistence;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.locks.StampedLock;

/**
 * JSON file holding {@link PersistedState}. Writes go to a temp file in the same directory and are
 * moved over the target, so a crash leaves either the old or the new state, never a partial file.
 */
public final class LedgerStateStore {
    private static final Logger logger = LoggerFactory.getLogger(LedgerStateStore.class);

    private final Path stateFile;
    private final ObjectMapper objectMapper;
    private final StampedLock lock = new StampedLock();

    public LedgerStateStore(Path stateFile) {
        this.stateFile = stateFile.toAbsolutePath();
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * @throws UncheckedIOException if the state cannot be written
     */
    public void save(PersistedState state) {
        long stamp = lock.writeLock();
        try {
            Path dir = stateFile.getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path temp = Files.createTempFile(dir, stateFile.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), state);
                moveIntoPlace(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
            logger.debug("State saved: {} ({} positions)", state.orchestratorState(), state.positions().size());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write state file " + stateFile, e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * @return the last saved state, or empty if no state file exists yet
     * @throws UncheckedIOException if the file exists but cannot be read
     */
    public Optional<PersistedState> load() {
        long stamp = lock.readLock();
        try {
            if (!Files.exists(stateFile)) {
                logger.info("No state file at {}, starting with an empty ledger", stateFile);
                return Optional.empty();
            }
            PersistedState state = objectMapper.readValue(stateFile.toFile(), PersistedState.class);
            logger.info("Loaded state from {}: {} with {} positions, saved {}", stateFile,
                state.orchestratorState(), state.positions().size(), state.savedAt());
            return Optional.of(state);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read state file " + stateFile, e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public Path getStateFile() {
        return stateFile;
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, stateFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, replacing in place", stateFile);
            Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
