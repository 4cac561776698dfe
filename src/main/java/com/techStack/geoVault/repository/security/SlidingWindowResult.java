package com.techStack.geoVault.repository.security;

import java.time.Duration;

/**
 * Outcome of recording one attempt in a sliding window.
 *
 * @param allowed    whether the attempt fit within the limit (and was recorded)
 * @param count      attempts inside the window after this call
 * @param retryAfter time until the oldest counted attempt leaves the window; zero when allowed
 */
public record SlidingWindowResult(boolean allowed, int count, Duration retryAfter) {
}
