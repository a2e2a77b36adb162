package restopm.billing.context;

/**
 * Thread-local storage for the operator's bearer token, relayed to the billing backend
 * on every call. Background work must set and clear it explicitly.
 */
public final class OperatorContext {

    private static final ThreadLocal<String> BEARER_TOKEN = new ThreadLocal<>();
    private static final ThreadLocal<String> OPERATOR = new ThreadLocal<>();

    private OperatorContext() {}

    public static void setBearerToken(String token) {
        BEARER_TOKEN.set(token);
    }

    public static String getBearerToken() {
        return BEARER_TOKEN.get();
    }

    public static void setOperator(String operator) {
        OPERATOR.set(operator);
    }

    /**
     * Operator name for log lines; "anonymous" when the UI did not send one.
     */
    public static String getOperator() {
        String operator = OPERATOR.get();
        return operator != null ? operator : "anonymous";
    }

    public static void clear() {
        BEARER_TOKEN.remove();
        OPERATOR.remove();
    }
}
