package com.autofix.orchestrator.agent;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adapters that collapse the shapes agents use for the same field into one
 * canonical type, so nothing past the agent boundary sees the variants.
 */
public final class PayloadNormalizer {

    private PayloadNormalizer() {}

    /**
     * Confidence as a scalar in [0, 1].
     *
     * Accepts a number, a numeric string, or an object carrying the number
     * under {@code overall}. Anything else yields {@code fallback}. Values
     * outside the range are clamped.
     */
    public static double confidence(Object raw, double fallback) {
        Object value = raw instanceof Map<?, ?> map ? map.get("overall") : raw;
        double parsed;
        if (value instanceof Number n) {
            parsed = n.doubleValue();
        } else if (value instanceof String s) {
            try {
                parsed = Double.parseDouble(s.strip());
            } catch (NumberFormatException e) {
                return fallback;
            }
        } else {
            return fallback;
        }
        if (Double.isNaN(parsed)) {
            return fallback;
        }
        return Math.max(0.0, Math.min(1.0, parsed));
    }

    /** {@link #confidence(Object, double)} for the {@code confidence} key of a payload. */
    public static double confidence(Map<String, Object> payload, double fallback) {
        return confidence(payload.get("confidence"), fallback);
    }

    /**
     * Changed-file list, merged from {@code files_changed} and
     * {@code files_modified} in that order, without duplicates.
     *
     * Entries may be plain paths or objects with a {@code path} (or
     * {@code file}) key.
     */
    public static List<String> changedFiles(Map<String, Object> payload) {
        Set<String> merged = new LinkedHashSet<>();
        addPaths(merged, payload.get("files_changed"));
        addPaths(merged, payload.get("files_modified"));
        return List.copyOf(merged);
    }

    /** Ordered union of two path lists. */
    public static List<String> union(List<String> first, List<String> second) {
        Set<String> merged = new LinkedHashSet<>(first);
        merged.addAll(second);
        return List.copyOf(merged);
    }

    /**
     * Text of a field that may be a plain string or an object with a
     * {@code description} (used for research's {@code root_cause}).
     */
    public static String text(Object raw) {
        if (raw == null) {
            return "";
        }
        if (raw instanceof Map<?, ?> map) {
            Object description = map.get("description");
            return description == null ? "" : description.toString();
        }
        return raw.toString();
    }

    /** List of strings from a list value; a lone string becomes a one-element list. */
    public static List<String> textList(Object raw) {
        List<String> out = new ArrayList<>();
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                String text = text(item);
                if (!text.isBlank()) {
                    out.add(text);
                }
            }
        } else if (raw instanceof String s && !s.isBlank()) {
            out.add(s);
        }
        return out;
    }

    /** Boolean from a JSON boolean or a "true"/"false" string; null if neither. */
    public static Boolean flag(Object raw) {
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof String s) {
            if ("true".equalsIgnoreCase(s.strip()))  return Boolean.TRUE;
            if ("false".equalsIgnoreCase(s.strip())) return Boolean.FALSE;
        }
        return null;
    }

    private static void addPaths(Set<String> into, Object raw) {
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                String path = item instanceof Map<?, ?> map
                        ? String.valueOf(map.containsKey("path") ? map.get("path") : map.get("file"))
                        : String.valueOf(item);
                if (item != null && !path.isBlank() && !"null".equals(path)) {
                    into.add(path.strip());
                }
            }
        } else if (raw instanceof String s && !s.isBlank()) {
            into.add(s.strip());
        }
    }
}
