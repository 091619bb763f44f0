package com.vbwd.plugin.api.capability;

import com.vbwd.plugin.api.Plugin;

import java.util.List;
import java.util.Map;

/**
 * Built-in capability kinds collected from every enabled plugin.
 */
public final class CapabilityKinds {

    public static final String ROUTE_NAME = "route";
    public static final String TRANSLATION_BUNDLE_NAME = "translation-bundle";
    public static final String UI_COMPONENT_NAME = "ui-component";

    /** Request-routing handle, mounted under {@code /api/v1/plugins/<name>}. */
    public static final CapabilityKind<Object> ROUTE =
            CapabilityKind.of(ROUTE_NAME, Object.class, Plugin::getRoutableHandle, "/api/v1/plugins/{name}");

    /** Localized text bundles, namespaced by plugin name. */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static final CapabilityKind<Map> TRANSLATION_BUNDLE =
            CapabilityKind.of(TRANSLATION_BUNDLE_NAME, Map.class, Plugin::getTranslations, "{name}");

    /** UI-mountable unit, mounted under {@code /plugins/<name>}. */
    public static final CapabilityKind<Object> UI_COMPONENT =
            CapabilityKind.of(UI_COMPONENT_NAME, Object.class, Plugin::getUiComponent, "/plugins/{name}");

    private CapabilityKinds() {
    }

    /** The built-in kinds in collection order. */
    public static List<CapabilityKind<?>> defaults() {
        return List.of(ROUTE, TRANSLATION_BUNDLE, UI_COMPONENT);
    }
}
