package com.tickety.initiator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class OutcomeMessagesTest {

  @Test
  void everyTerminalStateReadsDifferently() {
    final List<String> messages =
        Arrays.stream(HandoffState.values())
            .filter(HandoffState::isTerminal)
            .map(state -> OutcomeMessages.forState(state, null))
            .toList();

    assertThat(messages).hasSize(4).doesNotHaveDuplicates();
  }

  @Test
  void failureNamesItsReason() {
    assertThat(OutcomeMessages.forState(HandoffState.FAILED, "card_declined"))
        .isEqualTo("Failed: card_declined");
    assertThat(OutcomeMessages.forState(HandoffState.FAILED, "not_owner"))
        .isEqualTo("Failed: the ticket no longer belongs to the sender");
    assertThat(OutcomeMessages.forState(HandoffState.FAILED, " ")).isEqualTo("Failed");
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "expired",
        "already_redeemed",
        "not_found",
        "revoked",
        "operation_cancelled",
        "not_owner",
        "self_transfer",
        "not_authorized"
      })
  void everyClaimErrorHasItsOwnMessage(String wireError) {
    assertThat(OutcomeMessages.forClaimError(wireError))
        .isNotEqualTo(OutcomeMessages.forClaimError("something_else"));
  }

  @Test
  void onlyRelayStatesMapFromTheWire() {
    assertThat(HandoffState.fromWire("PROCESSING")).isEqualTo(HandoffState.PROCESSING);
    assertThat(HandoffState.WAITING.isTerminal()).isFalse();
    assertThat(HandoffState.EXPIRED.isTerminal()).isTrue();
    assertThatThrownBy(() -> HandoffState.fromWire("WAITING"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> HandoffState.fromWire("BOGUS"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
