package com.nosota.mescrow.escrow;

import com.nosota.mescrow.api.model.EscrowEventType;
import com.nosota.mescrow.api.model.Status;
import com.nosota.mescrow.error.AuthorizationException;
import com.nosota.mescrow.error.EscrowStateException;
import com.nosota.mescrow.error.EscrowValidationException;
import com.nosota.mescrow.model.Milestone;
import com.nosota.mescrow.model.Recipient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("Milestone plan offer and review")
class MilestoneOfferWorkflowTest extends EscrowTestSupport {

    @Test
    @DisplayName("OFR-001: Plan [0.5, 0.5] becomes binding once the threshold is crossed")
    void wholePlanIsAccepted() throws Exception {
        // Arrange
        EscrowContext context = openDefaultEscrow();
        acceptRecipient(context);

        // Act: the offer is ALICE's vote (0.40), BOB brings it to 0.70
        context.offerMilestones(ALICE, RECIPIENT, plan(50, 50));
        context.reviewOfferedMilestones(BOB, RECIPIENT, Status.ACCEPTED);

        // Assert: still in flight
        Recipient inFlight = context.getRecipient(RECIPIENT);
        assertThat(inFlight.getOfferedMilestones()).hasSize(2);
        assertThat(inFlight.getMilestones()).isEmpty();
        assertThat(inFlight.getMilestoneReviewStatus()).isEqualTo(Status.NONE);

        // Act
        context.reviewOfferedMilestones(CAROL, RECIPIENT, Status.ACCEPTED);

        // Assert
        Recipient recipient = context.getRecipient(RECIPIENT);
        assertThat(recipient.getMilestoneReviewStatus()).isEqualTo(Status.ACCEPTED);
        assertThat(recipient.getOfferedMilestones()).isEmpty();
        assertThat(recipient.getNextMilestone()).isZero();
        assertThat(recipient.getMilestones())
                .extracting(Milestone::getPercentage, Milestone::getStatus)
                .containsExactly(
                        tuple(FixedPoint.percent(50), Status.NONE),
                        tuple(FixedPoint.percent(50), Status.NONE));
        assertThat(eventsOfType(EscrowEventType.MILESTONES_SET)).hasSize(1);
    }

    @Test
    @DisplayName("OFR-002: Plan [0.5, 0.4] fails on the crossing vote and records nothing")
    void incompletePlanFailsOnCrossingVote() throws Exception {
        // Arrange
        EscrowContext context = openDefaultEscrow();
        acceptRecipient(context);
        context.offerMilestones(ALICE, RECIPIENT, plan(50, 40));
        context.reviewOfferedMilestones(BOB, RECIPIENT, Status.ACCEPTED);

        // Act & Assert
        assertThatThrownBy(() -> context.reviewOfferedMilestones(CAROL, RECIPIENT, Status.ACCEPTED))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("add up");

        Recipient recipient = context.getRecipient(RECIPIENT);
        assertThat(recipient.getMilestoneReviewStatus()).isEqualTo(Status.NONE);
        assertThat(recipient.getMilestones()).isEmpty();
        assertThat(recipient.getOfferedMilestones()).hasSize(2);

        // CAROL's vote was not recorded, so she can still vote in this round
        assertThatCode(() -> context.reviewOfferedMilestones(CAROL, RECIPIENT, Status.REJECTED))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("OFR-003: An offer that crosses on its own must add up before it is stored")
    void selfCrossingOfferIsValidatedFirst() throws Exception {
        // Arrange: ALICE alone holds 0.80
        EscrowContext context = openEscrow(contributions(ALICE, 800L, BOB, 200L), 1000L, 1);
        context.registerRecipient(RECIPIENT, new RecipientRegistration(RECIPIENT, null, false, null));
        context.reviewRecipient(ALICE, RECIPIENT, Status.ACCEPTED);
        assertThat(context.getRecipientStatus(RECIPIENT)).isEqualTo(Status.ACCEPTED);

        // Act & Assert
        assertThatThrownBy(() -> context.offerMilestones(ALICE, RECIPIENT, plan(50, 40)))
                .isInstanceOf(EscrowValidationException.class);
        assertThat(context.getRecipient(RECIPIENT).getOfferedMilestones()).isEmpty();
        assertThat(eventsOfType(EscrowEventType.MILESTONES_OFFERED)).isEmpty();

        context.offerMilestones(ALICE, RECIPIENT, plan(30, 70));
        assertThat(context.getRecipient(RECIPIENT).getMilestoneReviewStatus()).isEqualTo(Status.ACCEPTED);
    }

    @Test
    @DisplayName("OFR-004: The executor may offer, and a rejected offer is discarded")
    void executorOfferRejected() throws Exception {
        // Arrange
        EscrowContext context = openDefaultEscrow();
        acceptRecipient(context);

        // Act: executor offer carries no weight, so all three can reject it
        context.offerMilestones(RECIPIENT, RECIPIENT, plan(100));
        context.reviewOfferedMilestones(ALICE, RECIPIENT, Status.REJECTED);
        context.reviewOfferedMilestones(BOB, RECIPIENT, Status.REJECTED);
        context.reviewOfferedMilestones(CAROL, RECIPIENT, Status.REJECTED);

        // Assert
        Recipient recipient = context.getRecipient(RECIPIENT);
        assertThat(recipient.getOfferedMilestones()).isEmpty();
        assertThat(recipient.getMilestoneReviewStatus()).isEqualTo(Status.NONE);
        assertThat(eventsOfType(EscrowEventType.OFFERED_MILESTONES_RESET)).hasSize(1);
        assertThatThrownBy(() -> context.reviewOfferedMilestones(ALICE, RECIPIENT, Status.ACCEPTED))
                .isInstanceOf(EscrowStateException.class);
    }

    @Test
    @DisplayName("OFR-005: A new offer replaces the one in flight and restarts the round")
    void newOfferRestartsRound() throws Exception {
        EscrowContext context = openDefaultEscrow();
        acceptRecipient(context);
        context.offerMilestones(ALICE, RECIPIENT, plan(50, 50));
        context.reviewOfferedMilestones(BOB, RECIPIENT, Status.ACCEPTED);

        context.offerMilestones(RECIPIENT, RECIPIENT, plan(20, 30, 50));

        // BOB voted in the previous round only
        context.reviewOfferedMilestones(BOB, RECIPIENT, Status.ACCEPTED);
        context.reviewOfferedMilestones(ALICE, RECIPIENT, Status.ACCEPTED);
        assertThat(context.getRecipient(RECIPIENT).getMilestoneReviewStatus()).isEqualTo(Status.NONE);
        context.reviewOfferedMilestones(CAROL, RECIPIENT, Status.ACCEPTED);

        assertThat(context.getMilestones(RECIPIENT)).hasSize(3);
    }

    @Test
    @DisplayName("OFR-006: Offers are refused for strangers, pending recipients and accepted plans")
    void offerPreconditions() throws Exception {
        EscrowContext context = openDefaultEscrow();
        context.registerRecipient(RECIPIENT, new RecipientRegistration(RECIPIENT, null, false, null));

        assertThatThrownBy(() -> context.offerMilestones(ALICE, RECIPIENT, plan(100)))
                .isInstanceOf(EscrowStateException.class);

        context.reviewRecipient(ALICE, RECIPIENT, Status.ACCEPTED);
        context.reviewRecipient(BOB, RECIPIENT, Status.ACCEPTED);
        context.reviewRecipient(CAROL, RECIPIENT, Status.ACCEPTED);

        assertThatThrownBy(() -> context.offerMilestones(STRANGER, RECIPIENT, plan(100)))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> context.offerMilestones(ALICE, RECIPIENT, List.of()))
                .isInstanceOf(EscrowValidationException.class);
        assertThatThrownBy(() -> context.offerMilestones(ALICE, RECIPIENT, List.of(new Milestone(0, "zero"))))
                .isInstanceOf(EscrowValidationException.class);
        assertThatThrownBy(() -> context.reviewOfferedMilestones(RECIPIENT, RECIPIENT, Status.ACCEPTED))
                .isInstanceOf(AuthorizationException.class);

        acceptPlan(context, 100);
        assertThatThrownBy(() -> context.offerMilestones(ALICE, RECIPIENT, plan(100)))
                .isInstanceOf(EscrowStateException.class);
    }
}
