package com.custodia.auditchain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LifecycleState")
class LifecycleStateTest {

    @Test
    @DisplayName("draft moves to validated or flagged only")
    void draftTargets() {
        assertThat(LifecycleState.DRAFT.allowedTargets())
                .containsExactlyInAnyOrder(LifecycleState.VALIDATED, LifecycleState.FLAGGED);
    }

    @Test
    @DisplayName("archive requires validated or flagged")
    void archiveSources() {
        assertThat(LifecycleState.DRAFT.canTransitionTo(LifecycleState.ARCHIVED)).isFalse();
        assertThat(LifecycleState.VALIDATED.canTransitionTo(LifecycleState.ARCHIVED)).isTrue();
        assertThat(LifecycleState.FLAGGED.canTransitionTo(LifecycleState.ARCHIVED)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(LifecycleState.class)
    @DisplayName("nothing returns to draft")
    void noWayBackToDraft(LifecycleState state) {
        assertThat(state.canTransitionTo(LifecycleState.DRAFT)).isFalse();
    }

    @Test
    @DisplayName("archived is terminal")
    void archivedTerminal() {
        assertThat(LifecycleState.ARCHIVED.isTerminal()).isTrue();
        assertThat(LifecycleState.ARCHIVED.allowedTargets()).isEmpty();
    }

    @Test
    @DisplayName("fromString accepts value and name")
    void fromString() {
        assertThat(LifecycleState.fromString("flagged")).contains(LifecycleState.FLAGGED);
        assertThat(LifecycleState.fromString("VALIDATED")).contains(LifecycleState.VALIDATED);
        assertThat(LifecycleState.fromString("deleted")).isEmpty();
    }
}
