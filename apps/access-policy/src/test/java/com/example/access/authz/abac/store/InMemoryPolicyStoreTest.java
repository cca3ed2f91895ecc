package com.example.access.authz.abac.store;

import com.example.access.authz.abac.model.Policy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.example.access.util.PolicyTestBuilder.anAllowPolicy;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryPolicyStore")
class InMemoryPolicyStoreTest {

    @Test
    @DisplayName("should publish a new version on every replace")
    void shouldBumpVersionOnReplace() {
        InMemoryPolicyStore store = new InMemoryPolicyStore(List.of(anAllowPolicy("a").build()));
        PolicySnapshot initial = store.snapshot();

        PolicySnapshot published = store.replace(List.of(anAllowPolicy("b").build()));

        assertThat(initial.version()).isEqualTo(1L);
        assertThat(published.version()).isEqualTo(2L);
        assertThat(store.snapshot()).isSameAs(published);
        assertThat(initial.findById("a")).isPresent();
        assertThat(published.findById("a")).isEmpty();
    }

    @Test
    @DisplayName("should keep earlier snapshots unchanged")
    void shouldKeepSnapshotsImmutable() {
        InMemoryPolicyStore store = new InMemoryPolicyStore(List.of(anAllowPolicy("a").build()));
        PolicySnapshot initial = store.snapshot();

        store.replace(List.of());

        assertThat(initial.policies()).hasSize(1);
    }

    @Test
    @DisplayName("should keep null entries so evaluation can report them")
    void shouldKeepNullEntries() {
        List<Policy> withNull = new ArrayList<>();
        withNull.add(null);
        withNull.add(anAllowPolicy("a").build());

        PolicySnapshot snapshot = new PolicySnapshot(withNull, 3L);

        assertThat(snapshot.policies()).hasSize(2);
        assertThat(snapshot.findById("a")).isPresent();
    }
}
