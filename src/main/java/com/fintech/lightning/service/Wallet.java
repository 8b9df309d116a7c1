package com.fintech.lightning.service;

import com.fintech.lightning.dto.InvoiceData;
import com.fintech.lightning.dto.InvoiceParams;
import com.fintech.lightning.dto.InvoiceStatus;
import com.fintech.lightning.dto.PaymentData;
import com.fintech.lightning.dto.PaymentParams;
import com.fintech.lightning.dto.PaymentStatus;
import com.fintech.lightning.dto.WalletInfo;
import com.fintech.lightning.exception.InvalidCheckingIdException;
import com.fintech.lightning.exception.NodeClientException;
import com.fintech.lightning.exception.PaymentNotFoundException;

/**
 * What every Lightning backend needs to implement.
 * <p>
 * All operations may be called concurrently. Synchronous calls report node failures as
 * {@link NodeClientException}; the two stream operations hand out independent
 * subscriptions that receive events for as long as they stay open.
 */
public interface Wallet {

    /**
     * Short backend identifier, e.g. {@code "lnd"}.
     */
    String kind();

    WalletInfo getInfo();

    /**
     * Creates an invoice. Either a complete {@link InvoiceData} comes back or the call fails;
     * there is no partial result.
     */
    InvoiceData createInvoice(InvoiceParams params);

    /**
     * Looks up an invoice. An id the backend does not know yields {@code exists=false},
     * not an exception.
     *
     * @throws InvalidCheckingIdException if the id cannot be a backend identity at all
     */
    InvoiceStatus getInvoiceStatus(String checkingId);

    /**
     * Subscribes to settled invoices.
     */
    EventSubscription<InvoiceStatus> paidInvoicesStream();

    /**
     * Starts a payment and returns once the backend has registered the attempt, not when
     * it completes. Track completion with {@link #getPaymentStatus(String)} or
     * {@link #paymentsStream()}.
     */
    PaymentData makePayment(PaymentParams params);

    /**
     * @throws InvalidCheckingIdException if the id does not parse as the backend's payment key
     * @throws PaymentNotFoundException   if no payment exists under that key
     */
    PaymentStatus getPaymentStatus(String checkingId);

    /**
     * Subscribes to payment status updates. Delivery is at-least-once; the same
     * checking id and status may arrive more than once.
     */
    EventSubscription<PaymentStatus> paymentsStream();
}
