package restopm.billing.exception;

/**
 * Failure reported by (or while reaching) the billing backend. The message is the
 * backend's own text: it often carries SRI remediation hints and is shown verbatim.
 */
public class BillingBackendException extends RuntimeException {

    private final int statusCode;
    private final boolean transportFailure;

    public BillingBackendException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
        this.transportFailure = false;
    }

    private BillingBackendException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.transportFailure = true;
    }

    /**
     * No HTTP response was received (connection refused, timeout, reset).
     */
    public static BillingBackendException transport(String operation, Throwable cause) {
        return new BillingBackendException(
                "Sin respuesta del servidor de facturación (" + operation + "): " + cause.getMessage(), cause);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTransportFailure() {
        return transportFailure;
    }
}
