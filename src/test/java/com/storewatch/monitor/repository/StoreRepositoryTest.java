package com.storewatch.monitor.repository;

import com.storewatch.monitor.model.Store;
import com.storewatch.monitor.model.StoreStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
@DisplayName("StoreRepository")
class StoreRepositoryTest extends PostgresRepositorySupport {

    private StoreRepository repository;

    @BeforeEach
    void setUp() {
        repository = new StoreRepository(dataSource);
    }

    @Test
    @DisplayName("findActive returns only ACTIVE stores, never-checked first")
    void findActive() throws SQLException {
        UUID checked = insertStore("checked.example.com", "ACTIVE", null);
        UUID fresh = insertStore("fresh.example.com", "ACTIVE", null);
        insertStore("gone.example.com", "INACTIVE", null);
        repository.updateLastChecked(checked, Instant.now());

        List<Store> active = repository.findActive();

        assertThat(active).extracting(Store::getId).containsExactly(fresh, checked);
        assertThat(active).allSatisfy(s -> assertThat(s.getStatus()).isEqualTo(StoreStatus.ACTIVE));
    }

    @Test
    @DisplayName("Baseline and last-checked updates are read back")
    void updates() throws SQLException {
        UUID id = insertStore("shop.example.com", "ACTIVE", "owner@shop.example.com");
        Instant checkedAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);

        repository.updateBaseline(id, "https://cdn.test/screenshots/a.png");
        repository.updateLastChecked(id, checkedAt);

        Store store = repository.findById(id).orElseThrow();
        assertThat(store.getBaselineUrl()).isEqualTo("https://cdn.test/screenshots/a.png");
        assertThat(store.getLastChecked()).isEqualTo(checkedAt);
        assertThat(store.getOwnerEmail()).isEqualTo("owner@shop.example.com");
    }

    @Test
    @DisplayName("Failure counter and deactivation")
    void failureCounter() throws SQLException {
        UUID id = insertStore("shop.example.com", "ACTIVE", null);
        assertThat(repository.findFailedAttempts(id)).isZero();

        repository.updateFailedAttempts(id, 3);
        assertThat(repository.findFailedAttempts(id)).isEqualTo(3);

        repository.markInactive(id, 5);
        Store store = repository.findById(id).orElseThrow();
        assertThat(store.getStatus()).isEqualTo(StoreStatus.INACTIVE);
        assertThat(store.getFailedAttempts()).isEqualTo(5);
        assertThat(repository.findActive()).isEmpty();
    }

    @Test
    @DisplayName("Owner e-mail lookup ignores blank addresses and unknown stores")
    void ownerEmail() throws SQLException {
        UUID withOwner = insertStore("a.example.com", "ACTIVE", "owner@a.example.com");
        UUID blankOwner = insertStore("b.example.com", "ACTIVE", "  ");

        assertThat(repository.findOwnerEmail(withOwner)).contains("owner@a.example.com");
        assertThat(repository.findOwnerEmail(blankOwner)).isEmpty();
        assertThat(repository.findOwnerEmail(UUID.randomUUID())).isEmpty();
        assertThat(repository.findFailedAttempts(UUID.randomUUID())).isZero();
    }
}
