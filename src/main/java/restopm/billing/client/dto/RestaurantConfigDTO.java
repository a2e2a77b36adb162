package restopm.billing.client.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Restaurant configuration aggregate. Only the fields the billing flow reads are typed;
 * everything else is carried through untouched so an update never drops it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = "additional", ignoreUnknown = true)
public class RestaurantConfigDTO {

    private String name;
    private String logo;
    private String email;
    private String ruc;
    private String businessName;
    private String fiscalEmail;
    private String fiscalLogo;
    private Boolean obligadoContabilidad;
    private String contribuyenteEspecial;
    private BrandColors brandColors;
    private BillingSettings billing;

    @Builder.Default
    private Map<String, Object> additional = new LinkedHashMap<>();

    @JsonAnySetter
    public void putAdditional(String key, Object value) {
        additional.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditional() {
        return additional;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BrandColors {
        private String primary;
        private String secondary;
        private String accent;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BillingSettings {
        private String establishment;
        private String emissionPoint;
        private String regime;
        private Long currentSequenceFactura;
        private Long currentSequenceNotaCredito;
        private Long currentSequenceNotaVenta;
        private BigDecimal taxRate;
        private String environment;     // 1 = pruebas, 2 = producción
    }
}
