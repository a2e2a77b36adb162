package restopm.billing.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AccessKeyRequest {

    @NotBlank(message = "accessKey is required")
    private String accessKey;
}
