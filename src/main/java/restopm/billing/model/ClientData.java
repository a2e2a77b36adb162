package restopm.billing.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Buyer data typed by the operator in the billing form.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClientData {
    private String identification;   // RUC, cédula, passport or the final-consumer sentinel
    private String name;
    private String email;
    private String address;
    private String phone;

    @Builder.Default
    private String paymentMethod = "01";  // 01 = sin utilización del sistema financiero
}
