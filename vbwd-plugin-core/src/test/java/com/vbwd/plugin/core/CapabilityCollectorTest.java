package com.vbwd.plugin.core;

import com.vbwd.plugin.api.Plugin;
import com.vbwd.plugin.api.capability.Capability;
import com.vbwd.plugin.api.capability.CapabilityKind;
import com.vbwd.plugin.api.capability.CapabilityKinds;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CapabilityCollectorTest {

    private static PluginInstance instance(Plugin plugin, long seq) {
        return new PluginInstance(plugin, plugin.getMetadata(), seq, Instant.EPOCH);
    }

    @Test
    void collect_tagsArtifactsWithOwnerAndMountPrefix() {
        RecordingPlugin stripe = new RecordingPlugin("stripe") {
            @Override
            public Map<Locale, Map<String, String>> getTranslations() {
                return Map.of(Locale.ENGLISH, Map.of("title", "Stripe"));
            }

            @Override
            public Object getUiComponent() {
                return "StripeSettings";
            }
        };
        stripe.routes = "stripe-routes";

        CapabilityBundle bundle = new CapabilityCollector().collect(List.of(instance(stripe, 1)));

        assertEquals(List.of(CapabilityKinds.ROUTE_NAME, CapabilityKinds.TRANSLATION_BUNDLE_NAME,
                CapabilityKinds.UI_COMPONENT_NAME), bundle.getKinds());
        assertEquals(3, bundle.size());
        assertEquals("/api/v1/plugins/stripe", bundle.get(CapabilityKinds.ROUTE_NAME).get(0).mountPrefix());
        assertEquals("stripe", bundle.get(CapabilityKinds.TRANSLATION_BUNDLE_NAME).get(0).mountPrefix());
        Capability<?> ui = bundle.get(CapabilityKinds.UI_COMPONENT_NAME).get(0);
        assertEquals("/plugins/stripe", ui.mountPrefix());
        assertEquals("StripeSettings", ui.artifact());
    }

    @Test
    void collect_keepsPluginOrderAndSkipsNullArtifacts() {
        RecordingPlugin first = new RecordingPlugin("first");
        first.routes = "r1";
        RecordingPlugin none = new RecordingPlugin("none");
        RecordingPlugin second = new RecordingPlugin("second");
        second.routes = "r2";

        CapabilityBundle bundle = new CapabilityCollector().collect(
                List.of(instance(first, 1), instance(none, 2), instance(second, 3)));

        List<Capability<?>> routes = bundle.get(CapabilityKinds.ROUTE_NAME);
        assertEquals(2, routes.size());
        assertEquals("first", routes.get(0).ownerName());
        assertEquals("second", routes.get(1).ownerName());
    }

    @Test
    void collect_skipsCapabilityMethodThatThrows() {
        RecordingPlugin faulty = new RecordingPlugin("faulty") {
            @Override
            public Object getRoutableHandle() {
                throw new IllegalStateException("routes not ready");
            }
        };
        RecordingPlugin healthy = new RecordingPlugin("healthy");
        healthy.routes = "ok";

        CapabilityBundle bundle = new CapabilityCollector().collect(List.of(instance(faulty, 1), instance(healthy, 2)));

        assertEquals(1, bundle.get(CapabilityKinds.ROUTE_NAME).size());
        assertEquals("healthy", bundle.get(CapabilityKinds.ROUTE_NAME).get(0).ownerName());
    }

    @Test
    void customKind_isCollectedWithoutChangingPlugins() {
        CapabilityKind<String> jobs = CapabilityKind.of("scheduled-job", String.class,
                p -> p.getMetadata().name() + "-nightly", "jobs/{name}");
        CapabilityCollector collector = new CapabilityCollector(List.of(CapabilityKinds.ROUTE, jobs));

        CapabilityBundle bundle = collector.collect(List.of(instance(new RecordingPlugin("reports"), 1)));

        assertTrue(bundle.get(CapabilityKinds.ROUTE_NAME).isEmpty());
        Capability<?> job = bundle.get("scheduled-job").get(0);
        assertEquals("reports-nightly", job.artifact());
        assertEquals("jobs/reports", job.mountPrefix());
    }

    @Test
    void constructor_rejectsDuplicateKindNames() {
        assertThrows(IllegalArgumentException.class,
                () -> new CapabilityCollector(List.of(CapabilityKinds.ROUTE, CapabilityKinds.ROUTE)));
    }

    @Test
    void collect_noPluginsGivesEmptyKinds() {
        CapabilityBundle bundle = new CapabilityCollector().collect(List.of());

        assertEquals(0, bundle.size());
        assertTrue(bundle.get(CapabilityKinds.UI_COMPONENT_NAME).isEmpty());
    }
}
