package restopm.billing.service;

import lombok.Value;
import org.springframework.stereotype.Component;
import restopm.billing.client.dto.GenerateInvoiceResponse;
import restopm.billing.client.dto.SriResult;
import restopm.billing.client.dto.StatusCheckResponse;
import restopm.billing.model.BillingState;

import java.util.Locale;
import java.util.Set;

/**
 * Maps the authority's verdict, as relayed by the backend, onto the terminal
 * states of an issuance: AUTHORIZED, PENDING or ERROR.
 */
@Component
public class AuthorizationClassifier {

    private static final String AUTHORIZED = "AUTORIZADO";
    private static final Set<String> IN_PROGRESS =
            Set.of("RECIBIDA", "EN PROCESO", "PENDING", "SENT", "TIMEOUT_POLLING", "UNKNOWN");
    private static final Set<String> REJECTED = Set.of("DEVUELTA", "NO AUTORIZADO", "RECHAZADA");

    @Value
    public static class Verdict {
        BillingState state;
        String status;
        String details;
    }

    public Verdict classify(GenerateInvoiceResponse response) {
        if (!response.isSuccess()) {
            String details = firstNonBlank(response.getError(), messagesOf(response.getAuthorization()),
                    messagesOf(response.getSriResponse()), "El servidor de facturación rechazó la solicitud");
            return new Verdict(BillingState.ERROR, null, details);
        }
        SriResult verdict = response.getAuthorization() != null && hasStatus(response.getAuthorization())
                ? response.getAuthorization()
                : nestedOrSelf(response.getSriResponse());
        return classify(verdict, response.getAccessKey());
    }

    public Verdict classify(StatusCheckResponse response, String accessKey) {
        if (!response.isSuccess()) {
            String details = firstNonBlank(response.getError(), messagesOf(response.getAuthorization()),
                    "El SRI no autorizó el comprobante");
            return new Verdict(BillingState.ERROR, null, details);
        }
        return classify(response.getAuthorization(), accessKey);
    }

    Verdict classify(SriResult verdict, String accessKey) {
        String status = normalize(verdict != null ? verdict.getEstado() : null);
        String messages = messagesOf(verdict);
        if (AUTHORIZED.equals(status)) {
            return new Verdict(BillingState.AUTHORIZED, status, messages);
        }
        if (status != null && REJECTED.contains(status)) {
            return new Verdict(BillingState.ERROR, status,
                    firstNonBlank(messages, "Comprobante " + status + " por el SRI"));
        }
        boolean hasAccessKey = accessKey != null && !accessKey.isBlank();
        if (status != null && IN_PROGRESS.contains(status)) {
            return new Verdict(BillingState.PENDING, status, messages);
        }
        if (hasAccessKey) {
            // no verdict yet; the document exists at the authority under this key
            return new Verdict(BillingState.PENDING, status, messages);
        }
        return new Verdict(BillingState.ERROR, status,
                firstNonBlank(messages, "Respuesta sin estado ni clave de acceso del servidor de facturación"));
    }

    private static SriResult nestedOrSelf(SriResult result) {
        if (result != null && result.getAuthResult() != null && hasStatus(result.getAuthResult())) {
            return result.getAuthResult();
        }
        return result;
    }

    private static boolean hasStatus(SriResult result) {
        return result.getEstado() != null && !result.getEstado().isBlank();
    }

    private static String normalize(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        String value = status.trim().toUpperCase(Locale.ROOT);
        return "NO_AUTORIZADO".equals(value) ? "NO AUTORIZADO" : value;
    }

    private static String messagesOf(SriResult result) {
        return result != null ? result.describeMessages() : null;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
