package com.metromatch.bpm.web;

import com.metromatch.bpm.ResolutionResult;

import java.util.Optional;

/**
 * One fallback technique of the web tier. Implementations catch their own I/O failures and report them as empty.
 */
public interface WebStrategy {
    /**
     * Short name used in logs and in the persisted metadata.
     */
    String name();

    /**
     * Tries to resolve the attempt's track once.
     * @param attempt per-call state shared with the other strategies
     * @return scraper-sourced result with a plausible BPM, or empty
     */
    Optional<ResolutionResult> attempt(ResolutionAttempt attempt);
}
