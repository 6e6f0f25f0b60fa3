package com.opssentinel.core.model;

import java.util.Locale;

/**
 * Detection strategy that produced an {@link AnomalyAlert}.
 *
 * @since 1.0.0
 */
public enum AnomalyType {

    STATISTICAL("stat"),
    THRESHOLD("thresh"),
    PATTERN("pattern"),
    CORRELATION("corr");

    /** Prefix used when minting alert ids. */
    private final String idPrefix;

    AnomalyType(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String idPrefix() {
        return idPrefix;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
