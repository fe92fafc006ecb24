package io.cronos.core.schedule;

public record TriggerHandle(long id) {
}
