package com.nosota.mescrow.escrow;

import com.nosota.mescrow.api.model.EscrowEventType;
import com.nosota.mescrow.api.model.Status;
import com.nosota.mescrow.api.model.StrategyState;
import com.nosota.mescrow.error.AuthorizationException;
import com.nosota.mescrow.error.CapacityExceededException;
import com.nosota.mescrow.error.DuplicateVoteException;
import com.nosota.mescrow.error.EscrowStateException;
import com.nosota.mescrow.error.EscrowValidationException;
import com.nosota.mescrow.external.Profile;
import com.nosota.mescrow.model.Recipient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Recipient lifecycle")
class RecipientLifecycleTest extends EscrowTestSupport {

    @Test
    @DisplayName("REC-001: 0.40 + 0.30 stays below 77%, the third vote accepts the recipient")
    void recipientAcceptedOnceThresholdCrossed() throws Exception {
        // Arrange
        EscrowContext context = openDefaultEscrow();
        context.registerRecipient(RECIPIENT, new RecipientRegistration(RECIPIENT, "payout-1", false, "meta"));
        assertThat(context.getRecipientStatus(RECIPIENT)).isEqualTo(Status.PENDING);

        // Act: 0.70 for
        context.reviewRecipient(ALICE, RECIPIENT, Status.ACCEPTED);
        context.reviewRecipient(BOB, RECIPIENT, Status.ACCEPTED);

        // Assert: still pending
        assertThat(context.getRecipientStatus(RECIPIENT)).isEqualTo(Status.PENDING);
        assertThat(oracle.hasCapability("payout-1", settings.executorCapability())).isFalse();

        // Act: 1.00 for
        context.reviewRecipient(CAROL, RECIPIENT, Status.ACCEPTED);

        // Assert
        Recipient recipient = context.getRecipient(RECIPIENT);
        assertThat(recipient.getStatus()).isEqualTo(Status.ACCEPTED);
        assertThat(recipient.getGrantAmount()).isEqualTo(1000L);
        assertThat(recipient.getRecipientAddress()).isEqualTo("payout-1");
        assertThat(context.getAcceptedRecipientCount()).isEqualTo(1);
        assertThat(oracle.hasCapability("payout-1", settings.executorCapability())).isTrue();
        assertThat(eventsOfType(EscrowEventType.RECIPIENT_STATUS_CHANGED))
                .extracting(EscrowEvent::status)
                .containsExactly(Status.PENDING, Status.ACCEPTED);
    }

    @Test
    @DisplayName("REC-002: Passed rejection removes the recipient and revokes its capability")
    void rejectionRemovesAcceptedRecipient() throws Exception {
        // Arrange
        EscrowContext context = openDefaultEscrow();
        acceptRecipient(context);
        assertThat(oracle.hasCapability(RECIPIENT, settings.executorCapability())).isTrue();

        // Act
        context.reviewRecipient(ALICE, RECIPIENT, Status.REJECTED);
        context.reviewRecipient(BOB, RECIPIENT, Status.REJECTED);
        context.reviewRecipient(CAROL, RECIPIENT, Status.REJECTED);

        // Assert
        assertThat(context.getRecipientStatus(RECIPIENT)).isEqualTo(Status.NONE);
        assertThat(context.getAcceptedRecipientCount()).isZero();
        assertThat(oracle.hasCapability(RECIPIENT, settings.executorCapability())).isFalse();
        assertThat(eventsOfType(EscrowEventType.RECIPIENT_STATUS_CHANGED))
                .extracting(EscrowEvent::status)
                .endsWith(Status.REJECTED);
    }

    @Test
    @DisplayName("REC-003: A rejected recipient can be registered and accepted again")
    void rejectedRecipientCanComeBack() throws Exception {
        EscrowContext context = openDefaultEscrow();
        acceptRecipient(context);
        context.reviewRecipient(ALICE, RECIPIENT, Status.REJECTED);
        context.reviewRecipient(BOB, RECIPIENT, Status.REJECTED);
        context.reviewRecipient(CAROL, RECIPIENT, Status.REJECTED);

        acceptRecipient(context);

        assertThat(context.getRecipientStatus(RECIPIENT)).isEqualTo(Status.ACCEPTED);
        assertThat(context.getAcceptedRecipientCount()).isEqualTo(1);
        assertThat(oracle.hasCapability(RECIPIENT, settings.executorCapability())).isTrue();
    }

    @Test
    @DisplayName("REC-004: Accept votes beyond the recipient cap are refused")
    void capacityIsEnforced() throws Exception {
        // Arrange: cap of one recipient, already used
        EscrowContext context = openDefaultEscrow();
        acceptRecipient(context);
        context.registerRecipient("recipient-2", new RecipientRegistration("recipient-2", null, false, null));

        // Act & Assert
        assertThatThrownBy(() -> context.reviewRecipient(ALICE, "recipient-2", Status.ACCEPTED))
                .isInstanceOf(CapacityExceededException.class);

        // A reject vote is still possible
        context.reviewRecipient(ALICE, "recipient-2", Status.REJECTED);
        assertThat(context.getRecipientStatus("recipient-2")).isEqualTo(Status.PENDING);
    }

    @Test
    @DisplayName("REC-005: Accepting an already accepted recipient is a state error")
    void acceptingAcceptedRecipientFails() throws Exception {
        EscrowContext context = openDefaultEscrow();
        acceptRecipient(context);

        assertThatThrownBy(() -> context.reviewRecipient(ALICE, RECIPIENT, Status.ACCEPTED))
                .isInstanceOf(EscrowStateException.class);
        assertThatThrownBy(() -> context.registerRecipient(RECIPIENT,
                new RecipientRegistration(RECIPIENT, null, false, null)))
                .isInstanceOf(EscrowStateException.class);
    }

    @Test
    @DisplayName("REC-006: Only participants vote, once per round, with ACCEPTED or REJECTED")
    void voteValidation() throws Exception {
        EscrowContext context = openDefaultEscrow();
        context.registerRecipient(RECIPIENT, new RecipientRegistration(RECIPIENT, null, false, null));
        context.reviewRecipient(ALICE, RECIPIENT, Status.ACCEPTED);

        assertThatThrownBy(() -> context.reviewRecipient(ALICE, RECIPIENT, Status.REJECTED))
                .isInstanceOf(DuplicateVoteException.class);
        assertThatThrownBy(() -> context.reviewRecipient(STRANGER, RECIPIENT, Status.ACCEPTED))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> context.reviewRecipient(BOB, RECIPIENT, Status.PENDING))
                .isInstanceOf(EscrowValidationException.class);
    }

    @Test
    @DisplayName("REC-007: Voting for an unknown recipient creates a pending candidate")
    void voteCreatesCandidate() throws Exception {
        EscrowContext context = openDefaultEscrow();

        context.reviewRecipient(ALICE, "unregistered", Status.REJECTED);
        assertThat(context.getRecipientStatus("unregistered")).isEqualTo(Status.NONE);

        context.reviewRecipient(BOB, "unregistered", Status.ACCEPTED);
        assertThat(context.getRecipientStatus("unregistered")).isEqualTo(Status.PENDING);
        assertThat(context.getRecipient("unregistered").getRecipientAddress()).isEqualTo("unregistered");
    }

    @Test
    @DisplayName("REC-008: Registration by a third party is refused")
    void strangerCannotRegister() throws Exception {
        EscrowContext context = openDefaultEscrow();

        assertThatThrownBy(() -> context.registerRecipient(STRANGER,
                new RecipientRegistration(RECIPIENT, null, false, null)))
                .isInstanceOf(AuthorizationException.class);
        assertThat(context.getRecipientStatus(RECIPIENT)).isEqualTo(Status.NONE);
        assertThat(events).isEmpty();

        // participants may register on behalf of a recipient
        context.registerRecipient(ALICE, new RecipientRegistration(RECIPIENT, null, false, null));
        assertThat(context.getRecipientStatus(RECIPIENT)).isEqualTo(Status.PENDING);
    }

    @Test
    @DisplayName("REC-009: Anchor registration requires the profile owner or a member")
    void anchorRegistration() throws Exception {
        EscrowContext context = openDefaultEscrow();
        profiles.register(new Profile("profile-1", "anchor-1", "owner-1"), Set.of("member-1"));

        assertThatThrownBy(() -> context.registerRecipient(STRANGER,
                new RecipientRegistration("anchor-1", null, true, null)))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> context.registerRecipient("member-1",
                new RecipientRegistration("unknown-anchor", null, true, null)))
                .isInstanceOf(AuthorizationException.class);

        context.registerRecipient("member-1", new RecipientRegistration("anchor-1", "payout-1", true, null));

        Recipient recipient = context.getRecipient("anchor-1");
        assertThat(recipient.getStatus()).isEqualTo(Status.PENDING);
        assertThat(recipient.isUseRegistryAnchor()).isTrue();
        assertThat(recipient.getRecipientAddress()).isEqualTo("payout-1");
    }

    @Test
    @DisplayName("REC-010: Re-registering a pending candidate updates it without a new event")
    void reRegistrationUpdatesCandidate() throws Exception {
        EscrowContext context = openDefaultEscrow();
        context.registerRecipient(RECIPIENT, new RecipientRegistration(RECIPIENT, null, false, "v1"));
        context.registerRecipient(RECIPIENT, new RecipientRegistration(RECIPIENT, "payout-2", false, "v2"));

        Recipient recipient = context.getRecipient(RECIPIENT);
        assertThat(recipient.getMetadata()).isEqualTo("v2");
        assertThat(recipient.getRecipientAddress()).isEqualTo("payout-2");
        assertThat(eventsOfType(EscrowEventType.RECIPIENT_STATUS_CHANGED)).hasSize(1);
    }

    @Test
    @DisplayName("REC-011: Removing a recipient releases allocations of accepted but unpaid milestones")
    void rejectionReleasesUnpaidAllocation() throws Exception {
        // Arrange: milestone 1 accepted ahead of milestone 0, so its share stays allocated
        EscrowContext context = openDefaultEscrow();
        acceptRecipient(context);
        acceptPlan(context, 50, 50);
        acceptMilestone(context, 1);
        assertThat(context.getAllocatedAmount()).isEqualTo(500L);

        // Act
        context.reviewRecipient(ALICE, RECIPIENT, Status.REJECTED);
        context.reviewRecipient(BOB, RECIPIENT, Status.REJECTED);
        context.reviewRecipient(CAROL, RECIPIENT, Status.REJECTED);

        // Assert
        assertThat(context.getAllocatedAmount()).isZero();
        assertThat(context.getCurrentSupply()).isEqualTo(1000L);

        // Act: the next recipient can still be paid in full
        acceptRecipient(context);
        acceptPlan(context, 50, 50);
        acceptMilestone(context, 0);
        acceptMilestone(context, 1);

        // Assert
        assertThat(context.getStrategyState()).isEqualTo(StrategyState.EXECUTED);
        assertThat(ledger.balanceOf(ASSET, RECIPIENT)).isEqualTo(1000L);
        assertThat(context.getAllocatedAmount()).isZero();
    }
}
