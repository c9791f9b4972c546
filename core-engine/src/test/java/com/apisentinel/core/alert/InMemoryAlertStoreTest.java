package com.apisentinel.core.alert;

import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.AlertStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryAlertStore}.
 */
class InMemoryAlertStoreTest extends AlertStoreContractTest {

    @Override
    protected AlertStore createStore() {
        return new InMemoryAlertStore(3);
    }

    @Test
    @DisplayName("Should evict the oldest resolved alert when full")
    void shouldEvictOldestResolved() {
        store.upsert(alert("a1", "k1", "/a", T0), (existing, incoming) -> existing);
        store.upsert(alert("a2", "k2", "/b", T0), (existing, incoming) -> existing);
        store.upsert(alert("a3", "k3", "/c", T0), (existing, incoming) -> existing);
        store.transition("a2", AlertStatus.OPEN, AlertStatus.RESOLVED, T0.plusSeconds(1));
        store.transition("a3", AlertStatus.OPEN, AlertStatus.RESOLVED, T0.plusSeconds(2));

        store.upsert(alert("a4", "k4", "/d", T0.plusSeconds(3)), (existing, incoming) -> existing);

        assertThat(store.size()).isEqualTo(3);
        assertThat(store.get("a2")).isEmpty();
        assertThat(store.get("a3")).isPresent();
    }

    @Test
    @DisplayName("Should never evict active alerts")
    void shouldKeepActiveAlertsBeyondCapacity() {
        for (int i = 0; i < 4; i++) {
            store.upsert(alert("a" + i, "k" + i, "/e" + i, T0), (existing, incoming) -> existing);
        }

        assertThat(store.size()).isEqualTo(4);
        assertThat(store.list(AlertQuery.all())).allMatch(Alert::isActive);
    }

    @Test
    @DisplayName("Should require an id for new alerts")
    void shouldRequireId() {
        Alert withoutId = alert(null, "k1", "/a", T0);

        assertThatThrownBy(() -> store.upsert(withoutId, (existing, incoming) -> existing))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("id");
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new InMemoryAlertStore(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity");
    }
}
