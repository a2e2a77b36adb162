package restopm.billing.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reception or authorization verdict of the SRI as relayed by the backend.
 * Field names follow the SRI web services.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SriResult {
    private String estado;                // RECIBIDA, DEVUELTA, AUTORIZADO, NO AUTORIZADO, EN PROCESO...
    private String fechaAutorizacion;
    private String numeroAutorizacion;
    private SriResult authResult;         // some backend versions nest the authorization here

    @Builder.Default
    private List<Object> mensajes = new ArrayList<>();  // plain strings or {identificador, mensaje, informacionAdicional}

    /**
     * Authority messages flattened into one line, in the order the SRI returned them.
     */
    public String describeMessages() {
        if (mensajes == null || mensajes.isEmpty()) {
            return null;
        }
        return mensajes.stream()
                .map(SriResult::describeMessage)
                .filter(text -> !text.isBlank())
                .collect(Collectors.joining("; "));
    }

    private static String describeMessage(Object message) {
        if (message instanceof Map<?, ?> map) {
            StringBuilder text = new StringBuilder();
            Object identifier = map.get("identificador");
            Object body = map.get("mensaje");
            Object extra = map.get("informacionAdicional");
            if (identifier != null) {
                text.append('[').append(identifier).append("] ");
            }
            if (body != null) {
                text.append(body);
            }
            if (extra != null) {
                text.append(" (").append(extra).append(')');
            }
            return text.toString().trim();
        }
        return message == null ? "" : message.toString();
    }
}
