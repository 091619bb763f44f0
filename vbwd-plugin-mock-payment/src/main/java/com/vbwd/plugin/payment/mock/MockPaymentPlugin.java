package com.vbwd.plugin.payment.mock;

import com.vbwd.plugin.api.AbstractPlugin;
import com.vbwd.plugin.api.PluginMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory payment provider for development and tests. Every call succeeds unless the plugin is told to
 * fail, either through config {@code should_fail=true} or {@link #setShouldFail(boolean)}.
 * <p>
 * Config keys: {@code should_fail} (boolean), {@code webhook_secret} (default {@code test_secret}).
 */
public class MockPaymentPlugin extends AbstractPlugin {

    private static final Logger log = LoggerFactory.getLogger(MockPaymentPlugin.class);

    public static final String NAME = "mock_payment";
    public static final String CONFIG_SHOULD_FAIL = "should_fail";
    public static final String CONFIG_WEBHOOK_SECRET = "webhook_secret";
    static final String DEFAULT_WEBHOOK_SECRET = "test_secret";

    private static final PluginMetadata METADATA = PluginMetadata.builder(NAME)
            .version("1.0.0")
            .author("VBWD Team")
            .description("Mock payment provider for testing")
            .build();

    private static final Map<Locale, Map<String, String>> TRANSLATIONS = Map.of(
            Locale.ENGLISH, Map.of(
                    "title", "Mock payment",
                    "pay", "Pay now",
                    "failed", "Mock payment failure"),
            Locale.GERMAN, Map.of(
                    "title", "Testzahlung",
                    "pay", "Jetzt bezahlen",
                    "failed", "Testzahlung fehlgeschlagen"));

    private final Map<String, Transaction> transactions = new ConcurrentHashMap<>();
    private final MockPaymentRoutes routes = new MockPaymentRoutes();
    private volatile Boolean shouldFailOverride;

    @Override
    public PluginMetadata getMetadata() {
        return METADATA;
    }

    @Override
    public void onEnable(Map<String, Object> config) {
        super.onEnable(config);
        log.info("Mock payment provider enabled (should_fail={})", shouldFail());
    }

    @Override
    public void onDisable() {
        log.info("Mock payment provider disabled; {} transaction(s) in memory", transactions.size());
    }

    @Override
    public Object getRoutableHandle() {
        return routes;
    }

    @Override
    public Map<Locale, Map<String, String>> getTranslations() {
        return TRANSLATIONS;
    }

    /** Overrides the {@code should_fail} config until the plugin is re-created. */
    public void setShouldFail(boolean shouldFail) {
        this.shouldFailOverride = shouldFail;
    }

    public PaymentResult createPaymentIntent(BigDecimal amount, String currency, UUID subscriptionId, UUID userId,
                                             Map<String, Object> metadata) {
        Objects.requireNonNull(amount, "amount");
        if (shouldFail()) {
            return PaymentResult.failed(null, PaymentStatus.FAILED, "Mock payment failure");
        }
        String transactionId = "mock_pi_" + shortId();
        transactions.put(transactionId, new Transaction(amount, currency, subscriptionId, userId, metadata));
        log.debug("Created mock payment intent {} for {} {}", transactionId, amount, currency);
        return PaymentResult.succeeded(transactionId, PaymentStatus.PENDING, Map.of("client_secret", transactionId + "_secret"));
    }

    public PaymentResult processPayment(String paymentIntentId, String paymentMethod) {
        Transaction tx = paymentIntentId != null ? transactions.get(paymentIntentId) : null;
        if (tx == null) {
            return PaymentResult.failed(null, PaymentStatus.FAILED, "Payment intent not found");
        }
        if (shouldFail()) {
            tx.status = "failed";
            return PaymentResult.failed(paymentIntentId, PaymentStatus.FAILED, "Mock payment failure");
        }
        tx.status = "succeeded";
        tx.paymentMethod = paymentMethod;
        return PaymentResult.succeeded(paymentIntentId, PaymentStatus.COMPLETED,
                Map.of("payment_method", paymentMethod != null ? paymentMethod : ""));
    }

    /**
     * Refunds a transaction; a null amount refunds the full intent amount.
     */
    public PaymentResult refundPayment(String transactionId, BigDecimal amount) {
        Transaction tx = transactionId != null ? transactions.get(transactionId) : null;
        if (tx == null) {
            return PaymentResult.failed(null, null, "Transaction not found");
        }
        if (shouldFail()) {
            return PaymentResult.failed(null, null, "Mock refund failure");
        }
        BigDecimal refundAmount = amount != null ? amount : tx.amount;
        tx.refundAmount = refundAmount;
        return PaymentResult.succeeded("mock_ref_" + shortId(), PaymentStatus.REFUNDED,
                Map.of("refund_amount", refundAmount.toPlainString(), "original_transaction", transactionId));
    }

    public boolean verifyWebhook(byte[] payload, String signature) {
        Object expected = getConfig(CONFIG_WEBHOOK_SECRET, DEFAULT_WEBHOOK_SECRET);
        return expected.toString().equals(signature);
    }

    /** Applies {@code payment_intent.succeeded} / {@code payment_intent.failed} events to known intents. */
    public void handleWebhook(Map<String, Object> payload) {
        if (payload == null) return;
        Object type = payload.get("type");
        String newStatus;
        if ("payment_intent.succeeded".equals(type)) {
            newStatus = "succeeded";
        } else if ("payment_intent.failed".equals(type)) {
            newStatus = "failed";
        } else {
            log.debug("Ignoring mock webhook event {}", type);
            return;
        }
        Object data = payload.get("data");
        Object intentId = data instanceof Map<?, ?> m ? m.get("id") : null;
        Transaction tx = intentId != null ? transactions.get(intentId.toString()) : null;
        if (tx != null) {
            tx.status = newStatus;
        }
    }

    /** Status of a known intent ("created", "succeeded", "failed"), or null. */
    public String getTransactionStatus(String transactionId) {
        Transaction tx = transactionId != null ? transactions.get(transactionId) : null;
        return tx != null ? tx.status : null;
    }

    /**
     * Snapshot of a known intent (amount, currency, subscription_id, user_id, status, payment_method,
     * refund_amount, metadata), or null.
     */
    public Map<String, Object> getTransaction(String transactionId) {
        Transaction tx = transactionId != null ? transactions.get(transactionId) : null;
        return tx != null ? tx.snapshot() : null;
    }

    private boolean shouldFail() {
        Boolean override = shouldFailOverride;
        return override != null ? override : getConfigBoolean(CONFIG_SHOULD_FAIL, false);
    }

    private static String shortId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    private static final class Transaction {
        final BigDecimal amount;
        final String currency;
        final String subscriptionId;
        final String userId;
        final Map<String, Object> metadata;
        volatile String status = "created";
        volatile String paymentMethod;
        volatile BigDecimal refundAmount;

        Transaction(BigDecimal amount, String currency, UUID subscriptionId, UUID userId, Map<String, Object> metadata) {
            this.amount = amount;
            this.currency = currency;
            this.subscriptionId = subscriptionId != null ? subscriptionId.toString() : null;
            this.userId = userId != null ? userId.toString() : null;
            this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        }

        Map<String, Object> snapshot() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("amount", amount);
            out.put("currency", currency);
            out.put("subscription_id", subscriptionId);
            out.put("user_id", userId);
            out.put("status", status);
            out.put("payment_method", paymentMethod);
            out.put("refund_amount", refundAmount);
            out.put("metadata", metadata);
            return Collections.unmodifiableMap(out);
        }
    }
}
