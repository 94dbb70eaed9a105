package com.ariia.security.legacy;

/**
 * Switches for the unsigned-header fallback. The fallback runs only when both are on.
 *
 * @param transitionMode      platform is in the token migration window
 * @param allowHeaderFallback header-based identity is explicitly permitted
 */
public record LegacySettings(boolean transitionMode, boolean allowHeaderFallback) {

    public static final LegacySettings DISABLED = new LegacySettings(false, false);

    public boolean enabled() {
        return transitionMode && allowHeaderFallback;
    }
}
