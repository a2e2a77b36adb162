package restopm.billing.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import restopm.billing.client.BillingBackendClient;
import restopm.billing.client.dto.GenerateInvoiceRequest;
import restopm.billing.client.dto.GenerateInvoiceResponse;
import restopm.billing.client.dto.RestaurantConfigDTO;
import restopm.billing.client.dto.StatusCheckResponse;
import restopm.billing.context.OperatorContext;
import restopm.billing.dto.IssueInvoiceRequest;
import restopm.billing.event.IssuanceStateChangedEvent;
import restopm.billing.exception.BillingBackendException;
import restopm.billing.exception.IssuanceValidationException;
import restopm.billing.exception.IssuanceWarningsException;
import restopm.billing.model.BillingState;
import restopm.billing.model.ClientData;
import restopm.billing.model.IssuanceProcess;
import restopm.billing.model.IssuanceSnapshot;
import restopm.billing.model.IssuanceWarning;
import restopm.billing.model.Order;
import restopm.billing.model.PrintableReceipt;
import restopm.billing.model.TaxBreakdown;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Implementation of InvoiceIssuanceService.
 * The request thread runs the whole issuance; status requests observe it through the registry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceIssuanceServiceImpl implements InvoiceIssuanceService {

    static final String NO_RESPONSE_MESSAGE =
            "No se recibió respuesta del servidor de facturación. La factura pudo haberse emitido: "
                    + "verifique su estado en el historial de facturas antes de volver a facturar esta orden.";

    private final IssuanceRegistry registry;
    private final IssuanceValidator validator;
    private final TaxCalculator taxCalculator;
    private final AuthorizationClassifier classifier;
    private final BillingBackendClient billingBackendClient;
    private final RestaurantConfigCache configCache;
    private final BillingConfigSynchronizer configSynchronizer;
    private final ApplicationEventPublisher eventPublisher;

    @Value("${restopm.billing.config-refresh-wait-seconds:5}")
    private long configRefreshWaitSeconds = 5;

    private volatile CompletableFuture<?> pendingConfigRefresh = CompletableFuture.completedFuture(null);

    @Override
    public List<IssuanceWarning> precheck(Order order, ClientData client) {
        return validator.warnings(order, client);
    }

    @Override
    public IssuanceSnapshot issue(IssueInvoiceRequest request) {
        Order order = request.getOrder();
        ClientData client = request.getClient();
        if (order == null || order.getId() == null || order.getId().isBlank()) {
            throw new IssuanceValidationException("La orden a facturar no tiene identificador");
        }

        IssuanceProcess process = registry.begin(order.getId());
        log.info("🧾 Invoice issuance started for order {} by {}", order.getId(), OperatorContext.getOperator());
        try {
            move(process, BillingState.VALIDATING, null);
            List<IssuanceWarning> warnings = checkLocally(process, order, client, request.isConfirmWarnings());
            process.recordWarnings(warnings);

            awaitPendingConfigRefresh();

            move(process, BillingState.GENERATING, null);
            BigDecimal taxRate = request.getTaxRate() != null ? request.getTaxRate() : configCache.taxRate();
            TaxBreakdown amounts = taxCalculator.breakdown(order, taxRate);
            process.recordAmounts(amounts);
            String logoUrl = request.getLogoUrl() != null && !request.getLogoUrl().isBlank()
                    ? request.getLogoUrl()
                    : configCache.logoUrl();
            GenerateInvoiceRequest payload = GenerateInvoiceRequest.builder()
                    .order(order)
                    .client(client)
                    .taxRate(taxRate)
                    .logoUrl(logoUrl)
                    .build();
            log.debug("Order {} amounts: subtotal {} tax {} total {}", order.getId(),
                    amounts.getSubtotal(), amounts.getTax(), amounts.getTotal());

            move(process, BillingState.SIGNING, null);
            GenerateInvoiceResponse response = submit(process, payload);
            if (response == null) {
                return process.snapshot();
            }

            move(process, BillingState.WAITING_AUTHORIZATION, null);
            process.recordSubmission(response.getInvoiceId(), response.getAccessKey());
            process.recordReceiptDraft(buildReceipt(order, client, amounts, logoUrl, response));

            AuthorizationClassifier.Verdict verdict = classifier.classify(response);
            resolve(process, verdict, response.resolveAuthorizationDate());
            return process.snapshot();
        } catch (IssuanceValidationException | IssuanceWarningsException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("❌ Unexpected failure issuing invoice for order {}: {}", order.getId(), e.getMessage(), e);
            failIfLive(process, e.getMessage());
            throw e;
        }
    }

    @Override
    public IssuanceSnapshot status(String orderId) {
        return registry.require(orderId).snapshot();
    }

    @Override
    public IssuanceSnapshot checkStatus(String orderId) {
        IssuanceProcess process = registry.require(orderId);
        if (process.getState() != BillingState.PENDING) {
            throw new IllegalStateException(
                    "Only pending issuances can be re-checked; order " + orderId + " is " + process.getState());
        }
        String accessKey = process.getAccessKey();
        if (accessKey == null || accessKey.isBlank()) {
            throw new IllegalStateException("Issuance for order " + orderId + " has no access key to check");
        }

        move(process, BillingState.WAITING_AUTHORIZATION, null);
        StatusCheckResponse response;
        try {
            response = billingBackendClient.checkInvoiceStatus(accessKey);
        } catch (BillingBackendException e) {
            log.warn("Status check for order {} failed, keeping it pending: {}", orderId, e.getMessage());
            move(process, BillingState.PENDING, null);
            process.overrideMessage("No se pudo consultar el estado en el SRI: " + e.getMessage());
            return process.snapshot();
        } catch (RuntimeException e) {
            move(process, BillingState.PENDING, null);
            throw e;
        }

        AuthorizationClassifier.Verdict verdict = classifier.classify(response, accessKey);
        String authorizationDate = response.getAuthorization() != null
                ? response.getAuthorization().getFechaAutorizacion()
                : null;
        resolve(process, verdict, authorizationDate);
        return process.snapshot();
    }

    @Override
    public void dismiss(String orderId) {
        registry.dismiss(orderId);
        log.debug("Issuance for order {} dismissed", orderId);
    }

    private List<IssuanceWarning> checkLocally(IssuanceProcess process, Order order, ClientData client,
                                               boolean confirmWarnings) {
        try {
            validator.validate(order, client);
        } catch (IssuanceValidationException e) {
            move(process, BillingState.ERROR, e.getMessage());
            throw e;
        }
        List<IssuanceWarning> warnings = validator.warnings(order, client);
        if (!warnings.isEmpty() && !confirmWarnings) {
            log.info("Order {} needs confirmation of {} warning(s)", order.getId(), warnings.size());
            process.recordWarnings(warnings);
            move(process, BillingState.ERROR, "Emisión detenida: advertencias sin confirmar");
            throw new IssuanceWarningsException(warnings);
        }
        return new ArrayList<>(warnings);
    }

    /**
     * @return the backend response, or null when the process already ended in ERROR
     */
    private GenerateInvoiceResponse submit(IssuanceProcess process, GenerateInvoiceRequest payload) {
        try {
            GenerateInvoiceResponse response = billingBackendClient.generateInvoice(payload,
                    () -> move(process, BillingState.SENDING, null));
            ensureSending(process);
            return response;
        } catch (BillingBackendException e) {
            ensureSending(process);
            if (e.isTransportFailure()) {
                log.error("❌ No response for order {}: {}", process.getOrderId(), e.getMessage());
                move(process, BillingState.ERROR, NO_RESPONSE_MESSAGE);
            } else {
                log.error("❌ Billing backend rejected order {} (HTTP {}): {}",
                        process.getOrderId(), e.getStatusCode(), e.getMessage());
                move(process, BillingState.ERROR, e.getMessage());
            }
            return null;
        }
    }

    private void resolve(IssuanceProcess process, AuthorizationClassifier.Verdict verdict, String authorizationDate) {
        switch (verdict.getState()) {
            case AUTHORIZED -> {
                process.recordAuthorization(authorizationDate);
                move(process, BillingState.AUTHORIZED, verdict.getDetails());
                scheduleConfigRefresh();
            }
            case PENDING -> {
                move(process, BillingState.PENDING, verdict.getDetails());
                scheduleConfigRefresh();
            }
            default -> move(process, BillingState.ERROR, verdict.getDetails());
        }
    }

    // the transport may fail before the dispatch callback fires
    private void ensureSending(IssuanceProcess process) {
        if (process.getState() == BillingState.SIGNING) {
            move(process, BillingState.SENDING, null);
        }
    }

    private void failIfLive(IssuanceProcess process, String details) {
        if (process.getState().canTransitionTo(BillingState.ERROR)) {
            move(process, BillingState.ERROR, details);
        }
    }

    private void move(IssuanceProcess process, BillingState target, String details) {
        BillingState previous = process.transitionTo(target, details);
        eventPublisher.publishEvent(IssuanceStateChangedEvent.builder()
                .orderId(process.getOrderId())
                .previousState(previous)
                .state(target)
                .details(details)
                .accessKey(process.getAccessKey())
                .operator(OperatorContext.getOperator())
                .occurredAt(Instant.now())
                .build());
    }

    private void scheduleConfigRefresh() {
        pendingConfigRefresh = configSynchronizer.refreshAfterIssuance(OperatorContext.getBearerToken());
    }

    private void awaitPendingConfigRefresh() {
        CompletableFuture<?> refresh = pendingConfigRefresh;
        if (refresh == null || refresh.isDone()) {
            return;
        }
        try {
            refresh.get(configRefreshWaitSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for configuration refresh", e);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Previous configuration refresh did not finish cleanly, continuing: {}", e.getMessage());
        }
    }

    private PrintableReceipt buildReceipt(Order order, ClientData client, TaxBreakdown amounts, String logoUrl,
                                          GenerateInvoiceResponse response) {
        RestaurantConfigDTO config = configCache.current();
        RestaurantConfigDTO.BillingSettings billing = config.getBilling() != null
                ? config.getBilling()
                : RestaurantConfigCache.defaults().getBilling();
        String sequential = response.getInvoiceId();
        return PrintableReceipt.builder()
                .sequential(sequential)
                .documentNumber(documentNumber(billing, sequential))
                .accessKey(response.getAccessKey())
                .environment(billing.getEnvironment() != null ? billing.getEnvironment() : environmentOf(response.getAccessKey()))
                .issuerRuc(config.getRuc())
                .issuerBusinessName(config.getBusinessName())
                .customerIdentification(client.getIdentification())
                .customerName(client.getName())
                .customerAddress(client.getAddress())
                .customerEmail(client.getEmail())
                .items(order.getItems())
                .amounts(amounts)
                .logoUrl(logoUrl)
                .build();
    }

    private static String documentNumber(RestaurantConfigDTO.BillingSettings billing, String sequential) {
        if (sequential == null || sequential.isBlank()) {
            return null;
        }
        try {
            return RestaurantConfigCache.formatDocumentNumber(billing, Long.parseLong(sequential.trim()));
        } catch (NumberFormatException e) {
            // already formatted by the backend
            return sequential;
        }
    }

    // position 24 of the 49-digit access key is the environment
    private static String environmentOf(String accessKey) {
        if (accessKey != null && accessKey.length() == 49) {
            return accessKey.substring(23, 24);
        }
        return null;
    }
}
