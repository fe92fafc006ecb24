package io.cronos.core.cron;

import io.cronos.core.persistence.PersistenceException;
import java.util.List;
import java.util.Optional;

public record LoadResult(int loaded, List<String> failures) {

    public LoadResult {
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public Optional<PersistenceException> error() {
        if (failures.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PersistenceException(
            "loaded " + loaded + " jobs with " + failures.size() + " errors: " + failures.get(0)
        ));
    }
}
