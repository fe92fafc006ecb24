package io.cronos.core.storage;

public class StorageObjectNotFoundException extends StorageException {
    private final String name;

    public StorageObjectNotFoundException(String name) {
        super("object not found: " + name);
        this.name = name;
    }

    public StorageObjectNotFoundException(String name, Throwable cause) {
        super("object not found: " + name, cause);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
