package com.vbwd.plugin.payment.mock;

import com.vbwd.plugin.api.Plugin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MockPaymentPluginTest {

    private MockPaymentPlugin plugin;

    @BeforeEach
    void setUp() {
        plugin = new MockPaymentPlugin();
        plugin.onEnable(Map.of());
    }

    private String createIntent() {
        PaymentResult result = plugin.createPaymentIntent(new BigDecimal("29.99"), "EUR", UUID.randomUUID(),
                UUID.randomUUID(), Map.of("plan", "pro"));
        assertTrue(result.success());
        return result.transactionId();
    }

    @Test
    void metadata_matchesBundledProvider() {
        assertEquals("mock_payment", plugin.getMetadata().name());
        assertEquals("1.0.0", plugin.getMetadata().version());
        assertTrue(plugin.getMetadata().dependencies().isEmpty());
    }

    @Test
    void createPaymentIntent_returnsPendingIntentWithClientSecret() {
        PaymentResult result = plugin.createPaymentIntent(new BigDecimal("10.00"), "USD", UUID.randomUUID(),
                UUID.randomUUID(), null);

        assertTrue(result.success());
        assertEquals(PaymentStatus.PENDING, result.status());
        assertTrue(result.transactionId().startsWith("mock_pi_"));
        assertEquals(result.transactionId() + "_secret", result.metadata().get("client_secret"));
        assertEquals("created", plugin.getTransaction(result.transactionId()).get("status"));
    }

    @Test
    void processPayment_completesKnownIntent() {
        String intent = createIntent();

        PaymentResult result = plugin.processPayment(intent, "card");

        assertTrue(result.success());
        assertEquals(PaymentStatus.COMPLETED, result.status());
        assertEquals("succeeded", plugin.getTransaction(intent).get("status"));
        assertEquals("card", plugin.getTransaction(intent).get("payment_method"));
    }

    @Test
    void processPayment_unknownIntentFails() {
        PaymentResult result = plugin.processPayment("mock_pi_missing", "card");

        assertFalse(result.success());
        assertEquals("Payment intent not found", result.errorMessage());
    }

    @Test
    void refundPayment_defaultsToFullAmount() {
        String intent = createIntent();

        PaymentResult result = plugin.refundPayment(intent, null);

        assertTrue(result.success());
        assertEquals(PaymentStatus.REFUNDED, result.status());
        assertEquals("29.99", result.metadata().get("refund_amount"));
        assertEquals(intent, result.metadata().get("original_transaction"));
    }

    @Test
    void shouldFailConfig_failsEveryOperation() {
        String intent = createIntent();
        plugin.onEnable(Map.of(MockPaymentPlugin.CONFIG_SHOULD_FAIL, true));

        PaymentResult create = plugin.createPaymentIntent(BigDecimal.ONE, "EUR", null, null, null);
        PaymentResult process = plugin.processPayment(intent, "card");
        PaymentResult refund = plugin.refundPayment(intent, BigDecimal.ONE);

        assertFalse(create.success());
        assertEquals(PaymentStatus.FAILED, create.status());
        assertFalse(process.success());
        assertEquals("failed", plugin.getTransaction(intent).get("status"));
        assertFalse(refund.success());
        assertEquals("Mock refund failure", refund.errorMessage());
    }

    @Test
    void setShouldFail_overridesConfig() {
        plugin.onEnable(Map.of(MockPaymentPlugin.CONFIG_SHOULD_FAIL, "true"));
        plugin.setShouldFail(false);

        assertTrue(plugin.createPaymentIntent(BigDecimal.TEN, "EUR", null, null, null).success());
    }

    @Test
    void webhook_verifiesSecretAndUpdatesIntent() {
        String intent = createIntent();
        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);

        assertTrue(plugin.verifyWebhook(body, "test_secret"));
        assertFalse(plugin.verifyWebhook(body, "wrong"));

        plugin.handleWebhook(Map.of("type", "payment_intent.failed", "data", Map.of("id", intent)));
        assertEquals("failed", plugin.getTransaction(intent).get("status"));
        assertNull(plugin.getTransaction("unknown"));
    }

    @Test
    void capabilities_exposeRoutesAndTranslations() {
        MockPaymentRoutes routes = assertInstanceOf(MockPaymentRoutes.class, plugin.getRoutableHandle());
        assertEquals("processPayment", routes.operationFor(MockPaymentRoutes.PROCESS));
        assertEquals("Testzahlung", plugin.getTranslations().get(Locale.GERMAN).get("title"));
        assertNotNull(plugin.getTranslations().get(Locale.ENGLISH));
        assertNull(plugin.getUiComponent());
    }

    @Test
    void serviceRegistration_isVisibleToServiceLoader() {
        boolean found = false;
        for (Plugin p : ServiceLoader.load(Plugin.class)) {
            if (p instanceof MockPaymentPlugin) found = true;
        }
        assertTrue(found);
    }
}
