package restopm.billing.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import restopm.billing.client.BillingBackendClient;
import restopm.billing.exception.ConfirmationPhraseMismatchException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class BillingAdminServiceTest {

    @Mock
    private BillingBackendClient billingBackendClient;
    @Mock
    private IssuanceRegistry issuanceRegistry;
    @Mock
    private BillHistoryService billHistoryService;
    @Mock
    private RestaurantConfigCache configCache;

    @InjectMocks
    private BillingAdminService billingAdminService;

    @Test
    void lowercasePhraseIsRefused() {
        assertThatThrownBy(() -> billingAdminService.resetBillingSystem("eliminar todo"))
                .isInstanceOf(ConfirmationPhraseMismatchException.class);
        verifyNoInteractions(billingBackendClient, issuanceRegistry, billHistoryService, configCache);
    }

    @Test
    void paddedPhraseIsRefused() {
        assertThatThrownBy(() -> billingAdminService.resetBillingSystem(" ELIMINAR TODO"))
                .isInstanceOf(ConfirmationPhraseMismatchException.class);
        verifyNoInteractions(billingBackendClient);
    }

    @Test
    void exactPhraseResetsBackendAndLocalState() {
        billingAdminService.resetBillingSystem("ELIMINAR TODO");

        verify(billingBackendClient).resetBillingSystem();
        verify(issuanceRegistry).clear();
        verify(billHistoryService).clear();
        InOrder cache = inOrder(configCache);
        cache.verify(configCache).invalidate();
        cache.verify(configCache).refresh();
    }
}
