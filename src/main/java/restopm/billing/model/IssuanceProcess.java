package restopm.billing.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable issuance process for one order. All access is synchronized because the
 * issuing request thread advances it while status requests read it.
 */
public class IssuanceProcess {

    private final String orderId;
    private BillingState state = BillingState.IDLE;
    private String message = BillingState.IDLE.getDisplayMessage();
    private String details;
    private String sequential;
    private String accessKey;
    private String authorizationDate;
    private TaxBreakdown amounts;
    private PrintableReceipt receipt;
    private PrintableReceipt receiptDraft;
    private final List<IssuanceWarning> warnings = new ArrayList<>();
    private boolean dismissed;
    private Instant updatedAt = Instant.now();

    public IssuanceProcess(String orderId) {
        this.orderId = orderId;
    }

    public String getOrderId() {
        return orderId;
    }

    public synchronized BillingState getState() {
        return state;
    }

    public synchronized String getAccessKey() {
        return accessKey;
    }

    public synchronized TaxBreakdown getAmounts() {
        return amounts;
    }

    /**
     * Moves to {@code target}, keeping the previous details unless new ones are given.
     *
     * @return the state the process was in before the move
     * @throws IllegalStateException if the transition is not allowed from the current state
     */
    public synchronized BillingState transitionTo(BillingState target, String details) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Issuance for order " + orderId + " cannot move from " + state + " to " + target);
        }
        BillingState previous = state;
        state = target;
        message = target.getDisplayMessage();
        if (details != null) {
            this.details = details;
        }
        updatedAt = Instant.now();
        return previous;
    }

    public synchronized void recordAmounts(TaxBreakdown amounts) {
        this.amounts = amounts;
    }

    public synchronized void recordWarnings(List<IssuanceWarning> acknowledged) {
        warnings.clear();
        warnings.addAll(acknowledged);
    }

    public synchronized void recordSubmission(String sequential, String accessKey) {
        this.sequential = sequential;
        this.accessKey = accessKey;
    }

    /**
     * Receipt data known at submission time, completed once the authorization arrives.
     */
    public synchronized void recordReceiptDraft(PrintableReceipt draft) {
        this.receiptDraft = draft;
    }

    public synchronized void recordAuthorization(String authorizationDate) {
        this.authorizationDate = authorizationDate;
        if (receiptDraft != null) {
            receiptDraft.setAuthorizationDate(authorizationDate);
            this.receipt = receiptDraft;
        }
    }

    /**
     * The operator closed the dialog. The process stays registered so the order
     * cannot be issued twice and a pending one can still be re-checked.
     */
    public synchronized void markDismissed() {
        this.dismissed = true;
    }

    public synchronized boolean isDismissed() {
        return dismissed;
    }

    public synchronized void overrideMessage(String message) {
        this.message = message;
        updatedAt = Instant.now();
    }

    public synchronized IssuanceSnapshot snapshot() {
        return IssuanceSnapshot.builder()
                .orderId(orderId)
                .state(state)
                .message(message)
                .details(details)
                .dismissible(state.isDismissible())
                .dismissed(dismissed)
                .sequential(sequential)
                .accessKey(accessKey)
                .authorizationDate(authorizationDate)
                .amounts(amounts)
                .receipt(receipt)
                .warnings(List.copyOf(warnings))
                .updatedAt(updatedAt)
                .build();
    }
}
