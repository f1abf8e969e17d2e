package com.example.healthintake.context;

import java.math.BigDecimal;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Comparison and normalization rules for extracted field values.
 *
 * <p>Two values have the same meaning when they differ only in case, accents, punctuation or
 * spacing ("Cardiología" and "cardiologia"), or are numerically equal.
 */
public final class FieldValues {

    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Set<String> NULL_LITERALS = Set.of("null", "none", "n/a");

    private FieldValues() {
    }

    /**
     * A value the extraction did not really supply.
     */
    public static boolean isAbsent(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            return text.isEmpty() || NULL_LITERALS.contains(text.toLowerCase(Locale.ROOT));
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream().allMatch(FieldValues::isAbsent);
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).values().stream().allMatch(FieldValues::isAbsent);
        }
        return false;
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        String stripped = MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
        return NON_ALNUM.matcher(stripped).replaceAll(" ").trim();
    }

    public static boolean sameMeaning(Object left, Object right) {
        if (isAbsent(left) || isAbsent(right)) {
            return isAbsent(left) && isAbsent(right);
        }
        if (left instanceof Number && right instanceof Number) {
            return toDecimal((Number) left).compareTo(toDecimal((Number) right)) == 0;
        }
        if (left instanceof Map && right instanceof Map) {
            return sameMapMeaning((Map<?, ?>) left, (Map<?, ?>) right);
        }
        if (left instanceof Collection && right instanceof Collection) {
            return normalizedSet((Collection<?>) left).equals(normalizedSet((Collection<?>) right));
        }
        if (left instanceof Map || right instanceof Map || left instanceof Collection || right instanceof Collection) {
            return false;
        }
        return normalize(left.toString()).equals(normalize(right.toString()));
    }

    /**
     * Appends the additions not already present (by normalized form) to {@code base}, keeping the
     * first spelling seen and the original insertion order.
     */
    public static List<String> unionReasons(Collection<String> base, Collection<String> additions) {
        List<String> union = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String reason : base) {
            addReason(union, seen, reason);
        }
        for (String reason : additions) {
            addReason(union, seen, reason);
        }
        return union;
    }

    /**
     * Reads a reasons-like value: a list of texts or a single text.
     */
    public static List<String> toStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (!isAbsent(item)) {
                    result.add(item.toString().trim());
                }
            }
        } else if (!isAbsent(value)) {
            result.add(value.toString().trim());
        }
        return result;
    }

    /**
     * Whole-word containment on normalized text: "dolor de pecho" occurs in "dolor de pecho intenso"
     * but "fiebre" does not occur in "fiebres".
     */
    public static boolean containsPhrase(String normalizedText, String normalizedPhrase) {
        if (normalizedPhrase.isEmpty()) {
            return false;
        }
        return (" " + normalizedText + " ").contains(" " + normalizedPhrase + " ");
    }

    private static void addReason(List<String> union, Set<String> seen, String reason) {
        if (isAbsent(reason)) {
            return;
        }
        String key = normalize(reason);
        if (seen.add(key)) {
            union.add(reason.trim());
        }
    }

    private static boolean sameMapMeaning(Map<?, ?> left, Map<?, ?> right) {
        Set<Object> keys = new LinkedHashSet<>();
        keys.addAll(left.keySet());
        keys.addAll(right.keySet());
        for (Object key : keys) {
            if (!sameMeaning(left.get(key), right.get(key))) {
                return false;
            }
        }
        return true;
    }

    private static Set<String> normalizedSet(Collection<?> values) {
        Set<String> normalized = new HashSet<>();
        for (Object value : values) {
            if (!isAbsent(value)) {
                normalized.add(normalize(Objects.toString(value)));
            }
        }
        return normalized;
    }

    private static BigDecimal toDecimal(Number number) {
        return new BigDecimal(number.toString());
    }
}
