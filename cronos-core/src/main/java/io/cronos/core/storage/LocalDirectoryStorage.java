package io.cronos.core.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LocalDirectoryStorage implements Storage {
    private static final Logger LOG = LoggerFactory.getLogger(LocalDirectoryStorage.class);
    private static final String UPLOAD_SUFFIX = ".upload";

    private final Path root;

    public LocalDirectoryStorage(Path root) {
        if (root == null) {
            throw new IllegalArgumentException("root must not be null");
        }
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public List<FileInfo> listFiles() throws StorageException {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(root)) {
            List<FileInfo> files = new ArrayList<>();
            paths.filter(Files::isRegularFile)
                .filter(path -> !path.getFileName().toString().endsWith(UPLOAD_SUFFIX))
                .sorted(Comparator.naturalOrder())
                .forEach(path -> files.add(info(root.relativize(path).toString().replace('\\', '/'), path)));
            return files;
        } catch (IOException e) {
            throw new StorageException("Failed to list " + root, e);
        }
    }

    @Override
    public InputStream downloadFile(String name) throws StorageException {
        Path path = resolve(name);
        try {
            return Files.newInputStream(path);
        } catch (NoSuchFileException e) {
            throw new StorageObjectNotFoundException(name, e);
        } catch (IOException e) {
            throw new StorageException("Failed to open " + name, e);
        }
    }

    @Override
    public FileInfo uploadFile(String name, InputStream data) throws StorageException {
        Path path = resolve(name);
        Path tmp = path.resolveSibling(path.getFileName() + UPLOAD_SUFFIX);
        boolean moved = false;
        try {
            Files.createDirectories(path.getParent());
            Files.copy(data, tmp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            moved = true;
            return info(name, path);
        } catch (IOException e) {
            throw new StorageException("Failed to upload " + name, e);
        } finally {
            if (!moved) {
                discard(tmp);
            }
        }
    }

    @Override
    public void deleteFile(String name) throws StorageException {
        Path path = resolve(name);
        try {
            if (!Files.deleteIfExists(path)) {
                throw new StorageObjectNotFoundException(name);
            }
        } catch (StorageException e) {
            throw e;
        } catch (IOException e) {
            throw new StorageException("Failed to delete " + name, e);
        }
    }

    @Override
    public void renameFile(String oldName, String newName) throws StorageException {
        Path source = resolve(oldName);
        Path target = resolve(newName);
        if (!Files.exists(source)) {
            throw new StorageObjectNotFoundException(oldName);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Failed to rename " + oldName + " to " + newName, e);
        }
    }

    private Path resolve(String name) throws StorageException {
        if (name == null || name.isBlank()) {
            throw new StorageException("object name must not be blank");
        }
        Path resolved = root.resolve(name).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new StorageException("object name escapes storage root: " + name);
        }
        return resolved;
    }

    private static void discard(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Could not remove partial upload {}", tmp, e);
        }
    }

    private static FileInfo info(String name, Path path) {
        return new FileInfo(name, path.toUri().toString());
    }
}
