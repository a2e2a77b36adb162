package restopm.billing.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import restopm.billing.client.RestaurantConfigClient;
import restopm.billing.client.dto.RestaurantConfigDTO;
import restopm.billing.exception.BillingBackendException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Last known restaurant configuration. A successful fetch replaces the snapshot;
 * a failed one keeps it (or the built-in defaults before the first success).
 * Sequences are only read here, the backend is the one that assigns them.
 */
@Component
@Slf4j
public class RestaurantConfigCache {

    private final RestaurantConfigClient configClient;
    private final BigDecimal defaultTaxRate;

    private volatile RestaurantConfigDTO snapshot;
    private volatile Instant refreshedAt;
    private volatile boolean loadedFromBackend;

    public RestaurantConfigCache(RestaurantConfigClient configClient,
                                 @Value("${restopm.billing.default-tax-rate:15}") BigDecimal defaultTaxRate) {
        this.configClient = configClient;
        this.defaultTaxRate = defaultTaxRate;
    }

    /**
     * Cached configuration, fetched on first use.
     */
    public RestaurantConfigDTO current() {
        RestaurantConfigDTO config = snapshot;
        if (config == null) {
            return refresh();
        }
        return config;
    }

    public RestaurantConfigDTO refresh() {
        try {
            RestaurantConfigDTO fetched = configClient.fetchConfig();
            replace(fetched);
            log.debug("Restaurant configuration refreshed, invoice sequence at {}", currentInvoiceSequence(fetched));
            return fetched;
        } catch (BillingBackendException e) {
            if (snapshot == null) {
                log.warn("Could not load restaurant configuration, using defaults: {}", e.getMessage());
                snapshot = defaults();
                loadedFromBackend = false;
            } else {
                log.warn("Could not refresh restaurant configuration, keeping snapshot from {}: {}",
                        refreshedAt, e.getMessage());
            }
            return snapshot;
        }
    }

    public void replace(RestaurantConfigDTO config) {
        snapshot = config;
        refreshedAt = Instant.now();
        loadedFromBackend = true;
    }

    /**
     * Drops the snapshot so the next read goes to the backend.
     */
    public void invalidate() {
        snapshot = null;
        refreshedAt = null;
        loadedFromBackend = false;
    }

    public boolean isLoadedFromBackend() {
        return loadedFromBackend;
    }

    public Instant getRefreshedAt() {
        return refreshedAt;
    }

    /**
     * Configured IVA rate, or the service default when the configuration has none.
     */
    public BigDecimal taxRate() {
        RestaurantConfigDTO.BillingSettings billing = current().getBilling();
        if (billing != null && billing.getTaxRate() != null) {
            return billing.getTaxRate();
        }
        return defaultTaxRate;
    }

    public String logoUrl() {
        RestaurantConfigDTO config = current();
        if (config.getFiscalLogo() != null && !config.getFiscalLogo().isBlank()) {
            return config.getFiscalLogo();
        }
        return config.getLogo();
    }

    /**
     * Number the next invoice would get if nobody else issues first. Display only.
     */
    public String nextInvoiceNumberEstimate() {
        RestaurantConfigDTO.BillingSettings billing = billingOrDefaults();
        return formatDocumentNumber(billing, nextOf(billing.getCurrentSequenceFactura()));
    }

    public String nextCreditNoteNumberEstimate() {
        RestaurantConfigDTO.BillingSettings billing = billingOrDefaults();
        return formatDocumentNumber(billing, nextOf(billing.getCurrentSequenceNotaCredito()));
    }

    public static String formatDocumentNumber(RestaurantConfigDTO.BillingSettings billing, long sequential) {
        return String.format("%s-%s-%09d",
                orDefault(billing.getEstablishment(), "001"),
                orDefault(billing.getEmissionPoint(), "001"),
                sequential);
    }

    public static RestaurantConfigDTO defaults() {
        Map<String, Object> additional = new LinkedHashMap<>();
        additional.put("slogan", "Sistema de Gestión Gastronómica");
        additional.put("phone", "+593 99 123 4567");
        additional.put("address", "Av. Principal 123, Quito, Ecuador");
        additional.put("website", "https://restoai.com");
        additional.put("currency", "USD");
        additional.put("currencySymbol", "$");
        additional.put("timezone", "America/Guayaquil");
        additional.put("locale", "es-EC");

        return RestaurantConfigDTO.builder()
                .name("RestoAI")
                .email("contacto@restoai.com")
                .ruc("1790012345001")
                .businessName("Restaurante Ejemplo CIA LTDA")
                .brandColors(RestaurantConfigDTO.BrandColors.builder()
                        .primary("#3B82F6")
                        .secondary("#8B5CF6")
                        .accent("#10B981")
                        .build())
                .billing(RestaurantConfigDTO.BillingSettings.builder()
                        .establishment("001")
                        .emissionPoint("001")
                        .regime("General")
                        .currentSequenceFactura(1L)
                        .currentSequenceNotaCredito(1L)
                        .currentSequenceNotaVenta(1L)
                        .build())
                .additional(additional)
                .build();
    }

    private RestaurantConfigDTO.BillingSettings billingOrDefaults() {
        RestaurantConfigDTO.BillingSettings billing = current().getBilling();
        return billing != null ? billing : defaults().getBilling();
    }

    private static Long currentInvoiceSequence(RestaurantConfigDTO config) {
        return config.getBilling() != null ? config.getBilling().getCurrentSequenceFactura() : null;
    }

    // the stored value is the last sequential used
    private static long nextOf(Long current) {
        return (current != null ? current : 0L) + 1;
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
