package com.metromatch.bpm;

/**
 * Which tiers a {@link BpmResolver} was built with.
 */
public record PipelineStatus(boolean cacheEnabled, boolean apiEnabled, boolean webEnabled, boolean browserSearchEnabled) {
}
