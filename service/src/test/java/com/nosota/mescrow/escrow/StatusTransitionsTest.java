package com.nosota.mescrow.escrow;

import com.nosota.mescrow.api.model.Status;
import com.nosota.mescrow.api.model.StrategyState;
import com.nosota.mescrow.error.EscrowStateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Status and strategy state transitions")
class StatusTransitionsTest {

    @Test
    @DisplayName("Recipients move NONE → PENDING → ACCEPTED only")
    void recipientTransitions() {
        assertThat(StatusTransitions.RECIPIENT.isTransitionAllowed(Status.NONE, Status.PENDING)).isTrue();
        assertThat(StatusTransitions.RECIPIENT.isTransitionAllowed(Status.PENDING, Status.ACCEPTED)).isTrue();
        assertThat(StatusTransitions.RECIPIENT.isTransitionAllowed(Status.NONE, Status.ACCEPTED)).isFalse();
        assertThat(StatusTransitions.RECIPIENT.getAllowedTransitions(Status.ACCEPTED)).isEmpty();
    }

    @Test
    @DisplayName("Rejected milestones can be resubmitted, accepted ones are final")
    void milestoneTransitions() {
        assertThat(StatusTransitions.MILESTONE.isTransitionAllowed(Status.REJECTED, Status.PENDING)).isTrue();
        assertThat(StatusTransitions.MILESTONE.isTransitionAllowed(Status.PENDING, Status.PENDING)).isTrue();
        assertThat(StatusTransitions.MILESTONE.isTransitionAllowed(Status.ACCEPTED, Status.PENDING)).isFalse();
        assertThat(StatusTransitions.MILESTONE.isTransitionAllowed(null, Status.PENDING)).isFalse();

        assertThatThrownBy(() -> StatusTransitions.MILESTONE.validateTransition(Status.NONE, Status.ACCEPTED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("MILESTONE");
    }

    @Test
    @DisplayName("Strategy runs NONE → ACTIVE → EXECUTED and stays there")
    void strategyExecutes() {
        StrategyStateMachine stateMachine = new StrategyStateMachine();
        assertThatThrownBy(() -> stateMachine.requireActive("vote")).isInstanceOf(EscrowStateException.class);

        stateMachine.activate();
        assertThatCode(() -> stateMachine.requireActive("vote")).doesNotThrowAnyException();

        stateMachine.execute();
        assertThat(stateMachine.getState()).isEqualTo(StrategyState.EXECUTED);
        assertThat(stateMachine.isFinalState()).isTrue();
        assertThatThrownBy(stateMachine::reject).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> stateMachine.requireActive("vote"))
                .isInstanceOf(EscrowStateException.class)
                .hasMessageContaining("EXECUTED");
    }

    @Test
    @DisplayName("Settings reject out-of-range thresholds and shared capabilities")
    void settingsValidation() {
        EscrowSettings.EscrowSettingsBuilder builder = EscrowSettings.builder()
                .projectId(UUID.randomUUID())
                .poolId("pool")
                .maxRecipients(1)
                .recipientThreshold(77)
                .milestoneOfferThreshold(77)
                .milestoneSubmissionThreshold(77)
                .abortThreshold(70)
                .participantCapability("participant")
                .executorCapability("executor");
        assertThatCode(builder::build).doesNotThrowAnyException();

        assertThatThrownBy(() -> builder.abortThreshold(101).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.abortThreshold(70).executorCapability("participant").build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
