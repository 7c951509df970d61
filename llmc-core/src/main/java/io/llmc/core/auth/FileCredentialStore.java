package io.llmc.core.auth;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Credentials kept as one JSON object keyed by provider name.
 *
 * <p>Reads are served from a parsed snapshot that is reloaded when the file's modification time or size changes.
 */
public final class FileCredentialStore implements CredentialStore {
    private static final TypeReference<LinkedHashMap<String, AuthCredential>> CREDENTIALS = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper mapper;
    private volatile Snapshot snapshot;

    public FileCredentialStore(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public Optional<AuthCredential> find(String provider) throws IOException {
        return Optional.ofNullable(current().credentials().get(provider));
    }

    @Override
    public Map<String, AuthCredential> all() throws IOException {
        return current().credentials();
    }

    @Override
    public synchronized void put(String provider, AuthCredential credential) throws IOException {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(credential, "credential must not be null");
        Map<String, AuthCredential> credentials = new LinkedHashMap<>(reload().credentials());
        credentials.put(provider, credential);
        save(credentials);
    }

    @Override
    public synchronized boolean remove(String provider) throws IOException {
        Map<String, AuthCredential> credentials = new LinkedHashMap<>(reload().credentials());
        if (credentials.remove(provider) == null) {
            return false;
        }
        save(credentials);
        return true;
    }

    private Snapshot current() throws IOException {
        Snapshot loaded = snapshot;
        if (loaded != null && loaded.matches(stamp())) {
            return loaded;
        }
        return reload();
    }

    private synchronized Snapshot reload() throws IOException {
        FileStamp stamp = stamp();
        Snapshot loaded = snapshot;
        if (loaded != null && loaded.matches(stamp)) {
            return loaded;
        }
        Map<String, AuthCredential> credentials = stamp == null
            ? Map.of()
            : Collections.unmodifiableMap(mapper.readValue(Files.readString(path), CREDENTIALS));
        loaded = new Snapshot(stamp, credentials);
        snapshot = loaded;
        return loaded;
    }

    private FileStamp stamp() throws IOException {
        if (!Files.exists(path)) {
            return null;
        }
        return new FileStamp(Files.getLastModifiedTime(path), Files.size(path));
    }

    private void save(Map<String, AuthCredential> credentials) throws IOException {
        Path absolute = path.toAbsolutePath();
        Files.createDirectories(absolute.getParent());
        String json = mapper.writerFor(CREDENTIALS).withDefaultPrettyPrinter().writeValueAsString(credentials);
        Path tmp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        restrictPermissions(tmp);
        Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        snapshot = new Snapshot(stamp(), Collections.unmodifiableMap(new LinkedHashMap<>(credentials)));
    }

    private void restrictPermissions(Path file) throws IOException {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException ignored) {
            // non-POSIX file system
        }
    }

    private record FileStamp(FileTime modified, long size) {
    }

    private record Snapshot(FileStamp stamp, Map<String, AuthCredential> credentials) {
        boolean matches(FileStamp current) {
            return Objects.equals(stamp, current);
        }
    }
}
