package io.cronos.core.storage;

public record FileInfo(String name, String url) {
}
