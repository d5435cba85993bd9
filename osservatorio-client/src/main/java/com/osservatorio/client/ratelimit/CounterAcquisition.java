package com.osservatorio.client.ratelimit;

import com.osservatorio.common.model.RateTier;
import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of an all-or-nothing acquire. When denied, no counter was incremented.
 */
@Value
public class CounterAcquisition {
    boolean acquired;
    Map<RateTier, WindowUsage> windows;

    public List<WindowUsage> exhaustedTiers() {
        return windows.values().stream().filter(WindowUsage::isExhausted).toList();
    }

    /**
     * Tier with the fewest remaining requests after this acquisition.
     */
    public Optional<WindowUsage> tightest() {
        return windows.values().stream().min(Comparator.comparingInt(WindowUsage::remaining));
    }

    /**
     * Among the tiers that rejected the request, the one whose window resets last.
     */
    public Optional<WindowUsage> bindingDenial() {
        return exhaustedTiers().stream().max(Comparator.comparingLong(WindowUsage::getWindowEndMillis));
    }
}
