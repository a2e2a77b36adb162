package restopm.billing.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Credit note cancelling an authorized invoice")
public class CreditNoteRequest {

    @NotBlank(message = "billId is required")
    private String billId;

    @NotBlank(message = "reasonCode is required")
    @Pattern(regexp = "0[1-7]", message = "reasonCode must be one of 01..07")
    @Schema(description = "SRI reason code", example = "01")
    private String reasonCode;

    @Size(max = 300, message = "customDescription must be at most 300 characters")
    private String customDescription;

    @DecimalMin(value = "0", message = "taxRate must be zero or positive")
    private BigDecimal taxRate;
}
