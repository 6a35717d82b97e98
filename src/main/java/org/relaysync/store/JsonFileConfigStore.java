package org.relaysync.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.relaysync.model.AdminAuth;
import org.relaysync.model.ConfigSnapshot;
import org.relaysync.model.Job;
import org.relaysync.utils.JsonUtil;
import org.relaysync.utils.security.PasswordUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * {@link ConfigStore} backed by a single JSON document.
 * <p>
 * Reads always go to disk, so edits made by another writer are never lost. Writes go to a
 * sibling temp file which is then moved over the original, so a crash leaves either the old
 * or the new document, never a partial one. One lock serializes all access in this process.
 */
public class JsonFileConfigStore implements ConfigStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileConfigStore.class);

    private final Path file;
    private final String defaultTimezone;
    private final ObjectMapper mapper = JsonUtil.mapper().copy().enable(SerializationFeature.INDENT_OUTPUT);
    private final ReentrantLock lock = new ReentrantLock();

    public JsonFileConfigStore(Path file, String defaultTimezone) {
        this.file = file;
        this.defaultTimezone = defaultTimezone;
    }

    /**
     * Creates the store file with generated admin credentials when it does not exist yet.
     *
     * @return true if a new file was written
     */
    public boolean initializeIfMissing() {
        lock.lock();
        try {
            if (Files.exists(file)) {
                return false;
            }
            AdminAuth auth = new AdminAuth(PasswordUtil.generateUsername(), PasswordUtil.generatePassword());
            write(new ConfigSnapshot(auth, defaultTimezone, new LinkedHashMap<>()));
            logger.warn("No job store found, created {} with generated admin credentials. Change the auth section and restart!",
                    file.toAbsolutePath());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ConfigSnapshot getSnapshot() {
        lock.lock();
        try {
            return read();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Job> findJob(String jobId) {
        return Optional.ofNullable(getSnapshot().jobs().get(jobId));
    }

    @Override
    public boolean updateJob(String jobId, UnaryOperator<Job> patch) {
        lock.lock();
        try {
            ConfigSnapshot current = read();
            Job job = current.jobs().get(jobId);
            if (job == null) {
                return false;
            }
            Job patched = patch.apply(job);
            if (patched == null) {
                throw new IllegalArgumentException("Patch for job " + jobId + " returned null");
            }
            current.jobs().put(jobId, patched);
            write(current);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ConfigSnapshot update(UnaryOperator<ConfigSnapshot> mutation) {
        lock.lock();
        try {
            ConfigSnapshot next = mutation.apply(read());
            if (next == null) {
                throw new IllegalArgumentException("Snapshot mutation returned null");
            }
            write(next);
            return next.copy();
        } finally {
            lock.unlock();
        }
    }

    private ConfigSnapshot read() {
        if (!Files.exists(file)) {
            return new ConfigSnapshot(AdminAuth.empty(), defaultTimezone, new LinkedHashMap<>());
        }
        try {
            ConfigSnapshot snapshot = mapper.readValue(file.toFile(), ConfigSnapshot.class);
            if (snapshot == null) {
                return new ConfigSnapshot(AdminAuth.empty(), defaultTimezone, new LinkedHashMap<>());
            }
            return snapshot;
        } catch (IOException e) {
            throw new ConfigStoreException("Failed to read job store " + file, e);
        }
    }

    private void write(ConfigSnapshot snapshot) {
        Path dir = file.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            if (dir != null) {
                Files.createDirectories(dir);
            }
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            mapper.writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new ConfigStoreException("Failed to write job store " + file, e);
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            logger.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }

    public Path getFile() {
        return file;
    }
}
