package restopm.billing.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import restopm.billing.exception.IssuanceValidationException;
import restopm.billing.model.ClientData;
import restopm.billing.model.IssuanceWarning;
import restopm.billing.model.Order;
import restopm.billing.model.OrderStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Local checks run before an invoice is sent. Errors block the issuance; warnings
 * only require the operator's confirmation.
 */
@Component
@Slf4j
public class IssuanceValidator {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private final IdentificationValidator identificationValidator;
    private final String finalConsumerIdentification;
    private final BigDecimal finalConsumerMaxTotal;

    public IssuanceValidator(
            IdentificationValidator identificationValidator,
            @Value("${restopm.billing.final-consumer.identification:9999999999999}") String finalConsumerIdentification,
            @Value("${restopm.billing.final-consumer.max-total:50.00}") BigDecimal finalConsumerMaxTotal) {
        this.identificationValidator = identificationValidator;
        this.finalConsumerIdentification = finalConsumerIdentification;
        this.finalConsumerMaxTotal = finalConsumerMaxTotal;
    }

    /**
     * @throws IssuanceValidationException on the first blocking problem found
     */
    public void validate(Order order, ClientData client) {
        if (order == null) {
            throw new IssuanceValidationException("La orden es requerida");
        }
        if (!order.hasItems()) {
            throw new IssuanceValidationException("La orden " + order.getId() + " no tiene productos");
        }
        if (order.getStatus() != OrderStatus.COMPLETED) {
            throw new IssuanceValidationException(
                    "Solo se pueden facturar órdenes completadas (estado actual: "
                            + (order.getStatus() != null ? order.getStatus().getLabel() : "desconocido") + ")");
        }
        if (order.isBilled()) {
            throw new IssuanceValidationException("La orden " + order.getId() + " ya fue facturada");
        }
        if (client == null || isBlank(client.getIdentification())) {
            throw new IssuanceValidationException("La identificación del cliente es requerida");
        }
        if (isBlank(client.getName())) {
            throw new IssuanceValidationException("El nombre del cliente es requerido");
        }
    }

    /**
     * Findings the operator must acknowledge. Never throws and never calls the backend.
     */
    public List<IssuanceWarning> warnings(Order order, ClientData client) {
        List<IssuanceWarning> warnings = new ArrayList<>();
        if (client == null || isBlank(client.getIdentification())) {
            return warnings;
        }
        String identification = client.getIdentification().trim();
        BigDecimal total = order != null ? order.total() : BigDecimal.ZERO;

        if (isFinalConsumer(identification)) {
            if (total.compareTo(finalConsumerMaxTotal) > 0) {
                warnings.add(new IssuanceWarning(IssuanceWarning.Code.FINAL_CONSUMER_LIMIT,
                        "Las facturas a consumidor final no pueden superar $" + finalConsumerMaxTotal
                                + " (total: $" + total.setScale(2, RoundingMode.HALF_UP) + ")"));
            }
        } else {
            if (!isDeliverableEmail(client.getEmail())) {
                warnings.add(new IssuanceWarning(IssuanceWarning.Code.NO_EMAIL_DELIVERY,
                        "El cliente no tiene un email válido; la factura no será enviada por correo"));
            }
            if (!identificationValidator.isValid(identification)) {
                warnings.add(new IssuanceWarning(IssuanceWarning.Code.IDENTIFICATION_CHECK_DIGIT,
                        "La identificación " + identification + " no supera la validación del dígito verificador"));
            }
        }
        if (!warnings.isEmpty()) {
            log.debug("Order {} has {} warning(s): {}", order != null ? order.getId() : null, warnings.size(), warnings);
        }
        return warnings;
    }

    public boolean isFinalConsumer(String identification) {
        return identification != null && finalConsumerIdentification.equals(identification.trim());
    }

    static boolean isDeliverableEmail(String email) {
        if (email == null || email.isBlank()) {
            return false;
        }
        String value = email.trim();
        if (value.contains(",") || value.contains(" ")) {
            return false;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.contains("noemail") || lower.contains("consumidor@final")) {
            return false;
        }
        return EMAIL.matcher(value).matches();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
