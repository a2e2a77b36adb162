package restopm.billing.service;

import restopm.billing.dto.IssueInvoiceRequest;
import restopm.billing.model.ClientData;
import restopm.billing.model.IssuanceSnapshot;
import restopm.billing.model.IssuanceWarning;
import restopm.billing.model.Order;

import java.util.List;

/**
 * Service interface for electronic invoice issuance.
 * Drives the issuance state machine of an order and delegates the fiscal work to the billing backend.
 */
public interface InvoiceIssuanceService {

    /**
     * Warnings the operator must acknowledge before issuing. No network call.
     *
     * @param order Order to invoice
     * @param client Buyer data
     * @return Warnings, empty when the issuance can go straight through
     */
    List<IssuanceWarning> precheck(Order order, ClientData client);

    /**
     * Issue an invoice and block until the process reaches AUTHORIZED, PENDING or ERROR.
     * Validation problems, unacknowledged warnings and a live issuance for the same order
     * are raised as exceptions before anything is sent.
     *
     * @param request Order, buyer, optional tax rate and logo, warning acknowledgement
     * @return Snapshot of the finished process
     */
    IssuanceSnapshot issue(IssueInvoiceRequest request);

    /**
     * Current snapshot of the issuance for an order.
     *
     * @param orderId Order ID
     * @return Snapshot
     */
    IssuanceSnapshot status(String orderId);

    /**
     * Re-query the authority for a PENDING issuance.
     *
     * @param orderId Order ID
     * @return Snapshot after the check
     */
    IssuanceSnapshot checkStatus(String orderId);

    /**
     * Close the dialog of a finished process. Errored processes are forgotten; pending and
     * authorized ones stay registered so the order cannot be issued twice.
     * Not allowed while it is processing.
     *
     * @param orderId Order ID
     */
    void dismiss(String orderId);
}
