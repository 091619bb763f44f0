package com.vbwd.plugin.payment.mock;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a provider call.
 *
 * @param success       whether the provider accepted the request
 * @param transactionId provider transaction id; null when the call failed before one existed
 * @param status        payment status after the call; null for failed refunds
 * @param errorMessage  failure reason; null on success
 * @param metadata      provider-specific extras (client secret, refund amount, ...)
 */
public record PaymentResult(boolean success, String transactionId, PaymentStatus status, String errorMessage,
                            Map<String, Object> metadata) {

    public PaymentResult {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    static PaymentResult succeeded(String transactionId, PaymentStatus status, Map<String, Object> metadata) {
        return new PaymentResult(true, transactionId, status, null, metadata);
    }

    static PaymentResult failed(String transactionId, PaymentStatus status, String errorMessage) {
        return new PaymentResult(false, transactionId, status, errorMessage, null);
    }
}
