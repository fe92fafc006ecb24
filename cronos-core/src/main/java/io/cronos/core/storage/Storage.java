package io.cronos.core.storage;

import java.io.InputStream;
import java.util.List;

public interface Storage {
    List<FileInfo> listFiles() throws StorageException;

    /**
     * Opens the object for reading; the caller closes the stream.
     *
     * @throws StorageObjectNotFoundException if no object has that name
     */
    InputStream downloadFile(String name) throws StorageException;

    FileInfo uploadFile(String name, InputStream data) throws StorageException;

    void deleteFile(String name) throws StorageException;

    void renameFile(String oldName, String newName) throws StorageException;
}
