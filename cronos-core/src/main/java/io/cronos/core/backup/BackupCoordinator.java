package io.cronos.core.backup;

import io.cronos.core.persistence.PersistenceException;
import io.cronos.core.storage.Storage;
import io.cronos.core.storage.StorageException;
import io.cronos.core.storage.StorageObjectNotFoundException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class BackupCoordinator {
    public static final String CHECKSUM_FILE = ".last_checksum";

    private static final Logger LOG = LoggerFactory.getLogger(BackupCoordinator.class);
    private static final String DIGEST_ALGORITHM = "SHA-256";

    private final Storage storage;

    public BackupCoordinator(Storage storage) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
    }

    public static Path markerPath(Path localPath) {
        Path parent = localPath.toAbsolutePath().getParent();
        return parent.resolve(CHECKSUM_FILE);
    }

    /**
     * Uploads {@code localPath} as {@code remoteName} unless its content matches the last uploaded digest.
     *
     * @throws PersistenceException if the local file cannot be read
     * @throws StorageException if the upload fails; the marker is left untouched so the next call retries
     */
    public BackupOutcome backup(Path localPath, String remoteName) throws IOException {
        byte[] content;
        try {
            content = Files.readAllBytes(localPath);
        } catch (NoSuchFileException e) {
            throw new PersistenceException("Local database does not exist: " + localPath, e);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read local database " + localPath, e);
        }

        MessageDigest digest = newDigest();
        String current = HexFormat.of().formatHex(digest.digest(content));
        Path marker = markerPath(localPath);
        String last = readMarker(marker);

        if (current.equals(last)) {
            LOG.debug("Backup skipped, no change detected in {} (checksum {})", localPath, current);
            return BackupOutcome.SKIPPED;
        }

        LOG.info("Uploading backup of {} to {}", localPath, remoteName);
        try (InputStream in = new ByteArrayInputStream(content)) {
            storage.uploadFile(remoteName, in);
        }
        writeMarker(marker, current);
        LOG.info("Backup successful for {} as {} (checksum {})", localPath, remoteName, current);
        return BackupOutcome.UPLOADED;
    }

    /**
     * Replaces {@code localPath} with the remote copy. The download goes to a temporary file in the same directory
     * that is moved over the target only once complete.
     *
     * @return {@code true} if the local file was replaced; {@code false} when there is no remote copy or the
     *     download failed, in which case local state is untouched
     */
    public boolean restore(Path localPath, String remoteName) {
        Path target = localPath.toAbsolutePath();
        LOG.info("Restoring {} from {}", target, remoteName);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".restore");
            MessageDigest digest = newDigest();
            try (InputStream remote = storage.downloadFile(remoteName);
                 DigestInputStream in = new DigestInputStream(remote, digest)) {
                Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
            }
            String checksum = HexFormat.of().formatHex(digest.digest());
            replace(temp, target);
            temp = null;
            writeMarker(markerPath(target), checksum);
            LOG.info("Restore completed for {} from {} (checksum {})", target, remoteName, checksum);
            return true;
        } catch (StorageObjectNotFoundException e) {
            LOG.info("No existing backup found at {}, starting fresh", remoteName);
            return false;
        } catch (IOException e) {
            LOG.warn("Restore of {} from {} failed, starting with local state", target, remoteName, e);
            return false;
        } finally {
            deleteQuietly(temp);
        }
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static String readMarker(Path marker) {
        try {
            return Files.readString(marker).trim();
        } catch (NoSuchFileException e) {
            return "";
        } catch (IOException e) {
            LOG.warn("Could not read checksum marker {}, treating content as changed", marker, e);
            return "";
        }
    }

    private static void writeMarker(Path marker, String checksum) {
        try {
            Files.writeString(marker, checksum);
        } catch (IOException e) {
            // next backup re-uploads unchanged content
            LOG.warn("Failed to write checksum marker {}", marker, e);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.debug("Could not delete temporary file {}: {}", path, e.getMessage());
        }
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(DIGEST_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " not available", e);
        }
    }
}
