package com.ariia.authgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * First-start provisioning of the platform operator, bound from {@code ariia.bootstrap.*}.
 *
 * @param enabled       whether to create the system tenant and admin when missing
 * @param adminEmail    email of the system admin to create
 * @param adminPassword initial password of that admin
 * @param tenantSlug    slug of the system tenant (default {@code system})
 * @param tenantName    display name of the system tenant
 */
@ConfigurationProperties(prefix = "ariia.bootstrap")
public record BootstrapProperties(
        boolean enabled, String adminEmail, String adminPassword, String tenantSlug, String tenantName) {

    public BootstrapProperties {
        if (tenantSlug == null || tenantSlug.isBlank()) {
            tenantSlug = "system";
        }
        if (tenantName == null || tenantName.isBlank()) {
            tenantName = "ARIIA System";
        }
    }

    /** Hides the password. */
    @Override
    public String toString() {
        return "BootstrapProperties[enabled=%s, adminEmail=%s, adminPassword=***, tenantSlug=%s, tenantName=%s]"
                .formatted(enabled, adminEmail, tenantSlug, tenantName);
    }
}
