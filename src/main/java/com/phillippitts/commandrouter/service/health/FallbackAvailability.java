package com.phillippitts.commandrouter.service.health;

/**
 * Answers whether the Tier 2 fallback backend should be called right now.
 */
@FunctionalInterface
public interface FallbackAvailability {

    boolean isAvailable();
}
