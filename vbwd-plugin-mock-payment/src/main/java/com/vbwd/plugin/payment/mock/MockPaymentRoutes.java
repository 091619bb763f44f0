package com.vbwd.plugin.payment.mock;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Route table exposed by {@link MockPaymentPlugin}: relative path → operation name. The host mounts it
 * under the plugin's route prefix.
 */
public final class MockPaymentRoutes {

    public static final String CREATE_INTENT = "POST /payment-intents";
    public static final String PROCESS = "POST /payment-intents/{id}/process";
    public static final String REFUND = "POST /transactions/{id}/refund";
    public static final String WEBHOOK = "POST /webhook";

    private final Map<String, String> routes;

    MockPaymentRoutes() {
        Map<String, String> r = new LinkedHashMap<>();
        r.put(CREATE_INTENT, "createPaymentIntent");
        r.put(PROCESS, "processPayment");
        r.put(REFUND, "refundPayment");
        r.put(WEBHOOK, "handleWebhook");
        this.routes = Collections.unmodifiableMap(r);
    }

    public Map<String, String> getRoutes() {
        return routes;
    }

    /** Operation bound to the route, or null. */
    public String operationFor(String route) {
        return routes.get(route);
    }

    @Override
    public String toString() {
        return "MockPaymentRoutes" + routes.keySet();
    }
}
