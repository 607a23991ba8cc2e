package com.kubeforge.orchestrator.login;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Reads and writes cluster-login files, one per cluster, named
 * {@code root@<cluster>.login.json} under the login folder.
 *
 * Writes go to a temp file first and are moved into place, so a crash never
 * leaves a half-written login behind.
 */
public class ClusterLoginStore {

    private static final Logger log = LoggerFactory.getLogger(ClusterLoginStore.class);

    private final Path         folder;
    private final ObjectMapper json;

    public ClusterLoginStore(Path folder, ObjectMapper objectMapper) {
        this.folder = folder;
        this.json   = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path pathFor(String clusterName) {
        return folder.resolve("root@" + clusterName + ".login.json");
    }

    public Optional<ClusterLogin> load(String clusterName) {
        Path path = pathFor(clusterName);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(json.readValue(path.toFile(), ClusterLogin.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read cluster login " + path, e);
        }
    }

    /** Serializes on {@code login}; mutate it under the same monitor while other threads may save. */
    public void save(ClusterLogin login) {
        Path path = pathFor(login.getClusterName());
        synchronized (login) {
            write(login, path);
        }
    }

    private void write(ClusterLogin login, Path path) {
        Path temp = null;
        try {
            Files.createDirectories(folder);
            temp = Files.createTempFile(folder, ".login-", ".tmp");
            json.writeValue(temp.toFile(), login);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
            log.debug("Saved cluster login {}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write cluster login " + path, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Cannot delete temporary file {}: {}", temp, e.getMessage());
        }
    }
}
