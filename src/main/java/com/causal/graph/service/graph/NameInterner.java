package com.causal.graph.service.graph;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Two-way mapping between node names and identifiers that are safe for DAGitty and
 * similar tools.
 *
 * A safe id replaces every non-alphanumeric character with {@code _}, collapses runs of
 * {@code _}, trims leading and trailing {@code _}, and prefixes {@code n} when the result
 * starts with a digit. Names that clash after cleaning all get {@code _1}, {@code _2}, ...
 * in encounter order.
 */
public final class NameInterner {

    private final Map<String, String> safeByOriginal = new LinkedHashMap<>();
    private final Map<String, String> originalBySafe = new HashMap<>();

    private NameInterner() {
    }

    public static NameInterner of(Collection<String> names) {
        var interner = new NameInterner();
        var cleaned = new LinkedHashMap<String, String>();
        var occurrences = new HashMap<String, Integer>();
        for (String name : names) {
            if (cleaned.containsKey(name)) continue;
            var safe = sanitize(name);
            cleaned.put(name, safe);
            occurrences.merge(safe, 1, Integer::sum);
        }

        var suffixes = new HashMap<String, Integer>();
        cleaned.forEach((original, safe) -> {
            var unique = safe;
            if (occurrences.get(safe) > 1) {
                int suffix = suffixes.merge(safe, 1, Integer::sum);
                unique = safe + "_" + suffix;
                while (occurrences.containsKey(unique) || interner.originalBySafe.containsKey(unique)) {
                    suffix = suffixes.merge(safe, 1, Integer::sum);
                    unique = safe + "_" + suffix;
                }
            }
            interner.safeByOriginal.put(original, unique);
            interner.originalBySafe.put(unique, original);
        });
        return interner;
    }

    public static String sanitize(String name) {
        var safe = name.replaceAll("[^A-Za-z0-9_]", "_")
                .replaceAll("_+", "_")
                .replaceAll("^_|_$", "");
        if (safe.isEmpty()) {
            return "n";
        }
        return Character.isDigit(safe.charAt(0)) ? "n" + safe : safe;
    }

    public String safeId(String original) {
        var safe = safeByOriginal.get(original);
        if (safe == null) {
            throw new IllegalArgumentException("Unknown node: " + original);
        }
        return safe;
    }

    public Optional<String> original(String safeId) {
        return Optional.ofNullable(originalBySafe.get(safeId));
    }

    public int size() {
        return safeByOriginal.size();
    }

    /**
     * Names whose safe id differs from the original, in encounter order.
     */
    public List<Mapping> changedNames() {
        return safeByOriginal.entrySet().stream()
                .filter(entry -> !entry.getKey().equals(entry.getValue()))
                .map(entry -> new Mapping(entry.getKey(), entry.getValue()))
                .toList();
    }

    public record Mapping(String original, String safeId) {}
}
