package restopm.billing.service;

import org.junit.jupiter.api.Test;
import restopm.billing.exception.IssuanceInProgressException;
import restopm.billing.exception.ResourceNotFoundException;
import restopm.billing.model.BillingState;
import restopm.billing.model.IssuanceProcess;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IssuanceRegistryTest {

    private final IssuanceRegistry registry = new IssuanceRegistry();

    @Test
    void liveProcessBlocksNewOne() {
        IssuanceProcess process = registry.begin("o-1");
        process.transitionTo(BillingState.VALIDATING, null);

        assertThatThrownBy(() -> registry.begin("o-1"))
                .isInstanceOf(IssuanceInProgressException.class)
                .extracting("state").isEqualTo(BillingState.VALIDATING);
    }

    @Test
    void erroredProcessIsReplaced() {
        IssuanceProcess first = registry.begin("o-1");
        first.transitionTo(BillingState.VALIDATING, null);
        first.transitionTo(BillingState.ERROR, "sin items");

        IssuanceProcess second = registry.begin("o-1");

        assertThat(second).isNotSameAs(first);
        assertThat(second.getState()).isEqualTo(BillingState.IDLE);
    }

    @Test
    void processingIssuanceCannotBeDismissed() {
        registry.begin("o-1").transitionTo(BillingState.VALIDATING, null);

        assertThatThrownBy(() -> registry.dismiss("o-1")).isInstanceOf(IllegalStateException.class);
        assertThat(registry.find("o-1")).isPresent();
    }

    @Test
    void dismissedPendingProcessStillBlocksNewOne() {
        IssuanceProcess process = pending("o-1");

        registry.dismiss("o-1");

        assertThat(registry.require("o-1").isDismissed()).isTrue();
        assertThat(registry.require("o-1").getAccessKey()).isEqualTo("key-o-1");
        assertThatThrownBy(() -> registry.begin("o-1"))
                .isInstanceOf(IssuanceInProgressException.class)
                .extracting("state").isEqualTo(BillingState.PENDING);
        assertThat(registry.require("o-1")).isSameAs(process);
    }

    @Test
    void dismissedErrorIsForgotten() {
        IssuanceProcess process = registry.begin("o-1");
        process.transitionTo(BillingState.VALIDATING, null);
        process.transitionTo(BillingState.ERROR, "sin items");

        registry.dismiss("o-1");

        assertThat(registry.find("o-1")).isEmpty();
    }

    @Test
    void unknownOrderIsNotFound() {
        assertThatThrownBy(() -> registry.require("missing")).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> registry.dismiss("missing")).isInstanceOf(ResourceNotFoundException.class);
    }

    private IssuanceProcess pending(String orderId) {
        IssuanceProcess process = registry.begin(orderId);
        process.transitionTo(BillingState.VALIDATING, null);
        process.transitionTo(BillingState.GENERATING, null);
        process.transitionTo(BillingState.SIGNING, null);
        process.transitionTo(BillingState.SENDING, null);
        process.transitionTo(BillingState.WAITING_AUTHORIZATION, null);
        process.recordSubmission("12", "key-" + orderId);
        process.transitionTo(BillingState.PENDING, "RECIBIDA");
        return process;
    }
}
