package com.tickety.handoff.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class OperationStateTest {

  @Test
  void pendingMayMoveToProcessingOrAnyNonCompletedTerminal() {
    assertThat(OperationState.PENDING.canTransitionTo(OperationState.PROCESSING)).isTrue();
    assertThat(OperationState.PENDING.canTransitionTo(OperationState.FAILED)).isTrue();
    assertThat(OperationState.PENDING.canTransitionTo(OperationState.CANCELLED)).isTrue();
    assertThat(OperationState.PENDING.canTransitionTo(OperationState.EXPIRED)).isTrue();
    assertThat(OperationState.PENDING.canTransitionTo(OperationState.COMPLETED)).isFalse();
  }

  @Test
  void processingMayFinishButNotGoBack() {
    assertThat(OperationState.PROCESSING.canTransitionTo(OperationState.COMPLETED)).isTrue();
    assertThat(OperationState.PROCESSING.canTransitionTo(OperationState.PENDING)).isFalse();
  }

  @ParameterizedTest
  @EnumSource(
      value = OperationState.class,
      names = {"COMPLETED", "FAILED", "CANCELLED", "EXPIRED"})
  void terminalStatesHaveNoExit(OperationState terminal) {
    assertThat(terminal.isTerminal()).isTrue();
    for (OperationState target : OperationState.values()) {
      assertThat(terminal.canTransitionTo(target)).isFalse();
    }
  }

  @Test
  void openStatesAreTheNonTerminalOnes() {
    assertThat(OperationState.open())
        .containsExactlyInAnyOrder(OperationState.PENDING, OperationState.PROCESSING);
    assertThat(OperationState.sourcesOf(OperationState.COMPLETED))
        .containsExactly(OperationState.PROCESSING);
  }
}
