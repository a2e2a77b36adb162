package restopm.billing.model;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BillingStateTest {

    @Test
    void processingChainOnlyMovesForward() {
        assertThat(BillingState.IDLE.successors()).containsExactly(BillingState.VALIDATING);
        assertThat(BillingState.VALIDATING.canTransitionTo(BillingState.GENERATING)).isTrue();
        assertThat(BillingState.GENERATING.canTransitionTo(BillingState.VALIDATING)).isFalse();
        assertThat(BillingState.SENDING.canTransitionTo(BillingState.SIGNING)).isFalse();
        assertThat(BillingState.WAITING_AUTHORIZATION.successors())
                .containsExactlyInAnyOrder(BillingState.AUTHORIZED, BillingState.PENDING, BillingState.ERROR);
    }

    @Test
    void finalStatesAllowNoTransition() {
        assertThat(BillingState.AUTHORIZED.successors()).isEmpty();
        assertThat(BillingState.ERROR.successors()).isEmpty();
        assertThat(BillingState.AUTHORIZED.isFinal()).isTrue();
        assertThat(BillingState.PENDING.isFinal()).isFalse();
    }

    @Test
    void pendingCanOnlyBeRecheckedExplicitly() {
        assertThat(BillingState.PENDING.successors()).containsExactly(BillingState.WAITING_AUTHORIZATION);
    }

    @Test
    void dismissalIsBlockedWhileProcessing() {
        for (BillingState state : EnumSet.range(BillingState.VALIDATING, BillingState.WAITING_AUTHORIZATION)) {
            assertThat(state.isProcessing()).as(state.name()).isTrue();
            assertThat(state.isDismissible()).as(state.name()).isFalse();
        }
        assertThat(BillingState.PENDING.isDismissible()).isTrue();
        assertThat(BillingState.ERROR.isDismissible()).isTrue();
        assertThat(BillingState.AUTHORIZED.isDismissible()).isTrue();
    }

    @Test
    void processRejectsInvalidTransition() {
        IssuanceProcess process = new IssuanceProcess("order-1");
        process.transitionTo(BillingState.VALIDATING, null);

        assertThatThrownBy(() -> process.transitionTo(BillingState.AUTHORIZED, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("VALIDATING")
                .hasMessageContaining("AUTHORIZED");
        assertThat(process.getState()).isEqualTo(BillingState.VALIDATING);
    }

    @Test
    void processSnapshotCarriesMessageAndReceipt() {
        IssuanceProcess process = new IssuanceProcess("order-1");
        process.transitionTo(BillingState.VALIDATING, null);
        process.transitionTo(BillingState.GENERATING, null);
        process.transitionTo(BillingState.SIGNING, null);
        process.transitionTo(BillingState.SENDING, null);
        BillingState previous = process.transitionTo(BillingState.WAITING_AUTHORIZATION, null);
        process.recordSubmission("000000012", "key");
        process.recordReceiptDraft(PrintableReceipt.builder().sequential("000000012").build());
        process.recordAuthorization("2026-10-19T10:00:00-05:00");
        process.transitionTo(BillingState.AUTHORIZED, "ok");

        IssuanceSnapshot snapshot = process.snapshot();
        assertThat(previous).isEqualTo(BillingState.SENDING);
        assertThat(snapshot.getState()).isEqualTo(BillingState.AUTHORIZED);
        assertThat(snapshot.getMessage()).isEqualTo(BillingState.AUTHORIZED.getDisplayMessage());
        assertThat(snapshot.getDetails()).isEqualTo("ok");
        assertThat(snapshot.isDismissible()).isTrue();
        assertThat(snapshot.getReceipt().getAuthorizationDate()).isEqualTo("2026-10-19T10:00:00-05:00");
    }
}
