package restopm.billing.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import restopm.billing.client.RestaurantConfigClient;
import restopm.billing.client.dto.RestaurantConfigDTO;
import restopm.billing.dto.SequenceEstimateResponse;
import restopm.billing.exception.ConfirmationPhraseMismatchException;

import java.util.LinkedHashMap;

/**
 * Restaurant configuration as seen by the billing screens: cached reads, partial
 * updates merged into the full aggregate, and the guarded reset to defaults.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConfigService {

    public static final String RESET_CONFIG_PHRASE = "RESTAURAR CONFIG";

    private final RestaurantConfigCache configCache;
    private final RestaurantConfigClient configClient;
    private final ObjectMapper objectMapper;

    public RestaurantConfigDTO current() {
        return configCache.current();
    }

    public RestaurantConfigDTO refresh() {
        return configCache.refresh();
    }

    /**
     * Merge the non-null fields of {@code changes} into the current configuration
     * (brand colors and billing settings field by field) and store the result.
     * Sequence counters are only sent when {@code changes} sets them; the cached
     * values may already be behind the backend.
     */
    public RestaurantConfigDTO update(RestaurantConfigDTO changes) {
        RestaurantConfigDTO current = configCache.current();
        RestaurantConfigDTO merged = merge(copyOf(current), changes);
        withoutSequences(merged, changes != null ? changes.getBilling() : null);
        RestaurantConfigDTO stored = configClient.updateConfig(merged);
        configCache.replace(withKnownSequences(stored, current));
        log.info("Restaurant configuration updated");
        return stored;
    }

    public SequenceEstimateResponse nextSequence() {
        return SequenceEstimateResponse.builder()
                .nextInvoiceNumber(configCache.nextInvoiceNumberEstimate())
                .nextCreditNoteNumber(configCache.nextCreditNoteNumberEstimate())
                .fromBackend(configCache.isLoadedFromBackend())
                .refreshedAt(configCache.getRefreshedAt())
                .build();
    }

    /**
     * Restore the default configuration. No sequence counters are sent, so the
     * backend keeps numbering from where it is.
     */
    public RestaurantConfigDTO resetToDefaults(String confirmation) {
        if (!RESET_CONFIG_PHRASE.equals(confirmation)) {
            throw new ConfirmationPhraseMismatchException("configuration reset");
        }
        RestaurantConfigDTO current = configCache.current();
        RestaurantConfigDTO defaults = withoutSequences(RestaurantConfigCache.defaults(), null);
        log.warn("⚠️ Restoring default restaurant configuration");
        RestaurantConfigDTO stored = configClient.updateConfig(defaults);
        configCache.replace(withKnownSequences(stored, current));
        return stored;
    }

    private RestaurantConfigDTO copyOf(RestaurantConfigDTO config) {
        return objectMapper.convertValue(config, RestaurantConfigDTO.class);
    }

    // keeps only the counters the caller set explicitly
    static RestaurantConfigDTO withoutSequences(RestaurantConfigDTO config,
                                                RestaurantConfigDTO.BillingSettings explicit) {
        RestaurantConfigDTO.BillingSettings billing = config.getBilling();
        if (billing == null) {
            return config;
        }
        billing.setCurrentSequenceFactura(explicit != null ? explicit.getCurrentSequenceFactura() : null);
        billing.setCurrentSequenceNotaCredito(explicit != null ? explicit.getCurrentSequenceNotaCredito() : null);
        billing.setCurrentSequenceNotaVenta(explicit != null ? explicit.getCurrentSequenceNotaVenta() : null);
        return config;
    }

    /**
     * Cache copy of {@code stored} where counters the backend did not echo fall back
     * to the last fetched ones, so next-number estimates survive an acknowledge-only reply.
     */
    private RestaurantConfigDTO withKnownSequences(RestaurantConfigDTO stored, RestaurantConfigDTO previous) {
        RestaurantConfigDTO cached = copyOf(stored);
        RestaurantConfigDTO.BillingSettings known = previous != null ? previous.getBilling() : null;
        if (known == null) {
            return cached;
        }
        if (cached.getBilling() == null) {
            cached.setBilling(new RestaurantConfigDTO.BillingSettings());
        }
        RestaurantConfigDTO.BillingSettings billing = cached.getBilling();
        if (billing.getCurrentSequenceFactura() == null) billing.setCurrentSequenceFactura(known.getCurrentSequenceFactura());
        if (billing.getCurrentSequenceNotaCredito() == null) billing.setCurrentSequenceNotaCredito(known.getCurrentSequenceNotaCredito());
        if (billing.getCurrentSequenceNotaVenta() == null) billing.setCurrentSequenceNotaVenta(known.getCurrentSequenceNotaVenta());
        return cached;
    }

    static RestaurantConfigDTO merge(RestaurantConfigDTO target, RestaurantConfigDTO changes) {
        if (changes == null) {
            return target;
        }
        if (changes.getName() != null) target.setName(changes.getName());
        if (changes.getLogo() != null) target.setLogo(changes.getLogo());
        if (changes.getEmail() != null) target.setEmail(changes.getEmail());
        if (changes.getRuc() != null) target.setRuc(changes.getRuc());
        if (changes.getBusinessName() != null) target.setBusinessName(changes.getBusinessName());
        if (changes.getFiscalEmail() != null) target.setFiscalEmail(changes.getFiscalEmail());
        if (changes.getFiscalLogo() != null) target.setFiscalLogo(changes.getFiscalLogo());
        if (changes.getObligadoContabilidad() != null) target.setObligadoContabilidad(changes.getObligadoContabilidad());
        if (changes.getContribuyenteEspecial() != null) target.setContribuyenteEspecial(changes.getContribuyenteEspecial());

        if (changes.getBrandColors() != null) {
            RestaurantConfigDTO.BrandColors colors = target.getBrandColors() != null
                    ? target.getBrandColors()
                    : new RestaurantConfigDTO.BrandColors();
            RestaurantConfigDTO.BrandColors update = changes.getBrandColors();
            if (update.getPrimary() != null) colors.setPrimary(update.getPrimary());
            if (update.getSecondary() != null) colors.setSecondary(update.getSecondary());
            if (update.getAccent() != null) colors.setAccent(update.getAccent());
            target.setBrandColors(colors);
        }

        if (changes.getBilling() != null) {
            RestaurantConfigDTO.BillingSettings billing = target.getBilling() != null
                    ? target.getBilling()
                    : new RestaurantConfigDTO.BillingSettings();
            RestaurantConfigDTO.BillingSettings update = changes.getBilling();
            if (update.getEstablishment() != null) billing.setEstablishment(update.getEstablishment());
            if (update.getEmissionPoint() != null) billing.setEmissionPoint(update.getEmissionPoint());
            if (update.getRegime() != null) billing.setRegime(update.getRegime());
            if (update.getCurrentSequenceFactura() != null) billing.setCurrentSequenceFactura(update.getCurrentSequenceFactura());
            if (update.getCurrentSequenceNotaCredito() != null) billing.setCurrentSequenceNotaCredito(update.getCurrentSequenceNotaCredito());
            if (update.getCurrentSequenceNotaVenta() != null) billing.setCurrentSequenceNotaVenta(update.getCurrentSequenceNotaVenta());
            if (update.getTaxRate() != null) billing.setTaxRate(update.getTaxRate());
            if (update.getEnvironment() != null) billing.setEnvironment(update.getEnvironment());
            target.setBilling(billing);
        }

        if (changes.getAdditional() != null && !changes.getAdditional().isEmpty()) {
            LinkedHashMap<String, Object> additional = new LinkedHashMap<>(
                    target.getAdditional() != null ? target.getAdditional() : new LinkedHashMap<>());
            additional.putAll(changes.getAdditional());
            target.setAdditional(additional);
        }
        return target;
    }
}
