package com.eios.collab.persistence;

import com.eios.collab.error.TransientStorageException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores objects as files under a root directory. A write lands in a temporary file
 * first and is moved into place atomically, so a crash never leaves a half-written
 * object under its final key.
 */
public class FileSystemBlobStore implements BlobStore {

    private static final Logger LOG = Logger.getLogger(FileSystemBlobStore.class);

    private final Path root;

    public FileSystemBlobStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        LOG.infof("Using filesystem storage at %s", this.root);
    }

    @Override
    public void put(String key, byte[] data) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(tmp, data);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new TransientStorageException("Failed to write " + key, e);
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        try {
            return Optional.of(Files.readAllBytes(resolve(key)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new TransientStorageException("Failed to read " + key, e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files
                .filter(Files::isRegularFile)
                .map(path -> root.relativize(path).toString().replace('\\', '/'))
                .filter(key -> key.startsWith(prefix) && !key.endsWith(".tmp"))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new TransientStorageException("Failed to list " + prefix, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new TransientStorageException("Failed to delete " + key, e);
        }
    }

    @Override
    public void ping() {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new TransientStorageException("Storage directory " + root + " is not usable", e);
        }
        if (!Files.isWritable(root)) {
            throw new TransientStorageException("Storage directory " + root + " is not writable", null);
        }
    }

    private Path resolve(String key) {
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("Key escapes the storage root: " + key);
        }
        return path;
    }
}
