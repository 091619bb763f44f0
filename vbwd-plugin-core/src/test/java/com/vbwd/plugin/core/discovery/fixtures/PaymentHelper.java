package com.vbwd.plugin.core.discovery.fixtures;

/** Non-plugin class shipped in a module. */
public class PaymentHelper {

    public String describe() {
        return "helper";
    }
}
