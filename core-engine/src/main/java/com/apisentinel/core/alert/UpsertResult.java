package com.apisentinel.core.alert;

import com.apisentinel.core.model.Alert;

import java.util.Objects;

/**
 * Outcome of {@link AlertStore#upsert}: the stored alert, and whether it was
 * created rather than merged into an existing active alert.
 *
 * @since 1.0.0
 */
public final class UpsertResult {

    private final Alert alert;
    private final boolean created;

    public UpsertResult(Alert alert, boolean created) {
        this.alert = Objects.requireNonNull(alert, "alert must not be null");
        this.created = created;
    }

    public Alert getAlert() {
        return alert;
    }

    public boolean isCreated() {
        return created;
    }
}
