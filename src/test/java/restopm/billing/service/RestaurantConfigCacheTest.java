package restopm.billing.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import restopm.billing.client.RestaurantConfigClient;
import restopm.billing.client.dto.RestaurantConfigDTO;
import restopm.billing.exception.BillingBackendException;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RestaurantConfigCacheTest {

    @Mock
    private RestaurantConfigClient configClient;

    private RestaurantConfigCache cache;

    @BeforeEach
    void setUp() {
        cache = new RestaurantConfigCache(configClient, new BigDecimal("15"));
    }

    @Test
    void firstReadFetchesAndLaterReadsAreCached() {
        when(configClient.fetchConfig()).thenReturn(config(41L, new BigDecimal("12")));

        cache.current();
        RestaurantConfigDTO second = cache.current();

        assertThat(second.getBilling().getCurrentSequenceFactura()).isEqualTo(41L);
        assertThat(cache.isLoadedFromBackend()).isTrue();
        verify(configClient, times(1)).fetchConfig();
    }

    @Test
    void failedFirstFetchFallsBackToDefaults() {
        when(configClient.fetchConfig()).thenThrow(new BillingBackendException(503, "down"));

        RestaurantConfigDTO config = cache.current();

        assertThat(config.getRuc()).isEqualTo("1790012345001");
        assertThat(config.getBrandColors().getPrimary()).isEqualTo("#3B82F6");
        assertThat(cache.isLoadedFromBackend()).isFalse();
        assertThat(cache.taxRate()).isEqualByComparingTo("15");
    }

    @Test
    void failedRefreshKeepsLastSnapshot() {
        when(configClient.fetchConfig())
                .thenReturn(config(41L, null))
                .thenThrow(new BillingBackendException(0, "timeout"));

        cache.refresh();
        RestaurantConfigDTO kept = cache.refresh();

        assertThat(kept.getBilling().getCurrentSequenceFactura()).isEqualTo(41L);
        assertThat(cache.isLoadedFromBackend()).isTrue();
    }

    @Test
    void invalidatedSnapshotIsNotServedWhenRefreshFails() {
        when(configClient.fetchConfig())
                .thenReturn(config(41L, null))
                .thenThrow(new BillingBackendException(0, "timeout"));
        cache.refresh();

        cache.invalidate();
        RestaurantConfigDTO config = cache.refresh();

        assertThat(config.getBilling().getCurrentSequenceFactura()).isNotEqualTo(41L);
        assertThat(cache.isLoadedFromBackend()).isFalse();
        assertThat(cache.getRefreshedAt()).isNull();
    }

    @Test
    void estimateIsNextAfterCurrentAndNeverAdvancesLocally() {
        when(configClient.fetchConfig()).thenReturn(config(41L, null));

        assertThat(cache.nextInvoiceNumberEstimate()).isEqualTo("002-003-000000042");
        assertThat(cache.nextInvoiceNumberEstimate()).isEqualTo("002-003-000000042");
        assertThat(cache.nextCreditNoteNumberEstimate()).isEqualTo("002-003-000000008");
    }

    @Test
    void prefersFiscalLogo() {
        RestaurantConfigDTO config = config(1L, null);
        config.setLogo("logo.png");
        config.setFiscalLogo("fiscal.png");
        when(configClient.fetchConfig()).thenReturn(config);

        assertThat(cache.logoUrl()).isEqualTo("fiscal.png");
    }

    @Test
    void configuredRateWins() {
        when(configClient.fetchConfig()).thenReturn(config(1L, new BigDecimal("12")));

        assertThat(cache.taxRate()).isEqualByComparingTo("12");
    }

    private static RestaurantConfigDTO config(Long invoiceSequence, BigDecimal taxRate) {
        return RestaurantConfigDTO.builder()
                .ruc("1790011674001")
                .businessName("Picantería La Guayaca S.A.")
                .billing(RestaurantConfigDTO.BillingSettings.builder()
                        .establishment("002")
                        .emissionPoint("003")
                        .currentSequenceFactura(invoiceSequence)
                        .currentSequenceNotaCredito(7L)
                        .taxRate(taxRate)
                        .build())
                .build();
    }
}
