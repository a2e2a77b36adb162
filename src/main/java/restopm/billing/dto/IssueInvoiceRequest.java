package restopm.billing.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import restopm.billing.model.ClientData;
import restopm.billing.model.Order;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to issue an electronic invoice for a completed order")
public class IssueInvoiceRequest {

    @NotNull(message = "order is required")
    @Valid
    private Order order;

    @NotNull(message = "client is required")
    @Valid
    private ClientData client;

    @DecimalMin(value = "0", message = "taxRate must be zero or positive")
    @Schema(description = "IVA percentage; defaults to the configured rate", example = "15")
    private BigDecimal taxRate;

    @Schema(description = "Logo printed on the RIDE; defaults to the configured fiscal logo")
    private String logoUrl;

    @Schema(description = "Operator acknowledged the warnings returned by precheck")
    private boolean confirmWarnings;
}
