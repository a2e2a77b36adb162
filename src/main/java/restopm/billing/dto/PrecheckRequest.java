package restopm.billing.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import restopm.billing.model.ClientData;
import restopm.billing.model.Order;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PrecheckRequest {

    @NotNull(message = "order is required")
    private Order order;

    @NotNull(message = "client is required")
    private ClientData client;
}
