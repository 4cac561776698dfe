package com.techStack.geoVault.models.crypto;

/**
 * A KEM output tagged with the mode that produced it, so a classical fallback is always visible to callers.
 */
public record KemResult<T>(KemMode mode, T value) {

    public boolean isPostQuantum() {
        return mode == KemMode.POST_QUANTUM;
    }
}
