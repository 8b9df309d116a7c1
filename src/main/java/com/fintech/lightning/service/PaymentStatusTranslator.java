package com.fintech.lightning.service;

import com.fintech.lightning.dto.PaymentStatus;
import com.fintech.lightning.dto.Status;
import com.fintech.lightning.node.dto.NodePayment;
import org.springframework.stereotype.Component;

/**
 * Maps node payment records onto the wallet's payment state machine.
 * <p>
 * Stateless: the same record always yields the same status.
 */
@Component
public class PaymentStatusTranslator {

    public PaymentStatus translate(NodePayment payment) {
        String checkingId = toCheckingId(payment.getPaymentIndex());

        if (payment.getStatus() == null) {
            return unknown(checkingId);
        }

        return switch (payment.getStatus()) {
            case IN_FLIGHT -> PaymentStatus.builder()
                    .checkingID(checkingId)
                    .status(Status.PENDING)
                    .build();
            // An empty HTLC list means the node gave up before sending anything (e.g. no route)
            case FAILED -> PaymentStatus.builder()
                    .checkingID(checkingId)
                    .status(payment.getHtlcs() == null || payment.getHtlcs().isEmpty() ? Status.NEVER_TRIED : Status.FAILED)
                    .build();
            case SUCCEEDED -> PaymentStatus.builder()
                    .checkingID(checkingId)
                    .status(Status.COMPLETE)
                    .feePaid(payment.getFeeMsat())
                    .preimage(payment.getPaymentPreimage() == null ? "" : payment.getPaymentPreimage())
                    .build();
            case UNKNOWN, INITIATED -> unknown(checkingId);
        };
    }

    /**
     * Payment indexes are unsigned 64-bit values on the wire.
     */
    public static String toCheckingId(long paymentIndex) {
        return Long.toUnsignedString(paymentIndex);
    }

    private static PaymentStatus unknown(String checkingId) {
        return PaymentStatus.builder()
                .checkingID(checkingId)
                .status(Status.UNKNOWN)
                .build();
    }
}
