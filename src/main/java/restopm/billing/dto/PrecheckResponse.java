package restopm.billing.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import restopm.billing.model.IssuanceWarning;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PrecheckResponse {
    private List<IssuanceWarning> warnings;
    private boolean confirmationRequired;

    public static PrecheckResponse of(List<IssuanceWarning> warnings) {
        return new PrecheckResponse(warnings, !warnings.isEmpty());
    }
}
