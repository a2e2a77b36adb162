package restopm.billing.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import restopm.billing.client.dto.RestaurantConfigDTO;
import restopm.billing.context.OperatorContext;

import java.util.concurrent.CompletableFuture;

/**
 * Re-reads the configuration after the backend consumed a sequential, so the
 * next-number estimate shown to the operator catches up.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillingConfigSynchronizer {

    private final RestaurantConfigCache configCache;

    /**
     * Runs on the async executor. The caller's token is passed explicitly because
     * the request thread's context is not visible here.
     */
    @Async
    public CompletableFuture<RestaurantConfigDTO> refreshAfterIssuance(String bearerToken) {
        try {
            OperatorContext.setBearerToken(bearerToken);
            log.debug("🔄 Refreshing configuration after issuance");
            return CompletableFuture.completedFuture(configCache.refresh());
        } finally {
            OperatorContext.clear();
        }
    }
}
