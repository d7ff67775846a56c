package com.causal.graph.service.enrichment;

import java.util.Locale;

/**
 * Normalizes node and term names for matching: lower-case, runs of non-alphanumerics
 * collapsed to a single {@code _}, no leading or trailing {@code _}.
 */
public final class NameNormalizer {

    private NameNormalizer() {
    }

    public static String normalize(String name) {
        if (name == null) return "";
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_|_$", "");
    }
}
