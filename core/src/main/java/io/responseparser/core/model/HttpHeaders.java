package io.responseparser.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Case-insensitive HTTP response header collection.
 *
 * <p>
 * Lookups ignore case (RFC 9110 §5.1), but the spelling the server used is kept so that
 * prefix-derived map keys (e.g. {@code x-amz-meta-Color} → {@code Color}) survive unchanged. When
 * two spellings of the same name are supplied, the first spelling wins and the values are merged.
 * The class is immutable.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));

    /** Internal storage: case-insensitive key order, values are non-empty lists. */
    private final TreeMap<String, List<String>> store;

    private HttpHeaders(TreeMap<String, List<String>> store) {
        this.store = store;
    }

    /**
     * First value for a header name (case-insensitive).
     *
     * @return the first value, or {@code null} if the header is absent
     */
    public String first(String name) {
        List<String> values = store.get(name);
        return values != null && !values.isEmpty() ? values.get(0) : null;
    }

    /** First value for a header name, or {@code defaultValue} when absent. */
    public String firstOrDefault(String name, String defaultValue) {
        String value = first(name);
        return value != null ? value : defaultValue;
    }

    /**
     * All values for a header name (case-insensitive).
     *
     * @return an unmodifiable list of values, or an empty list if absent
     */
    public List<String> all(String name) {
        List<String> values = store.get(name);
        return values != null ? Collections.unmodifiableList(values) : List.of();
    }

    /** True if the header exists (case-insensitive). */
    public boolean contains(String name) {
        return store.containsKey(name);
    }

    /** Returns {@code true} if no headers are present. */
    public boolean isEmpty() {
        return store.isEmpty();
    }

    /** Header names in their original spelling, case-insensitively ordered. */
    public Set<String> names() {
        return Collections.unmodifiableSet(store.keySet());
    }

    /**
     * First-value-per-name view keeping the original name spelling.
     *
     * @return an unmodifiable map
     */
    public Map<String, String> toSingleValueMap() {
        Map<String, String> result = new LinkedHashMap<>();
        store.forEach((key, values) -> result.put(key, values.get(0)));
        return Collections.unmodifiableMap(result);
    }

    // ── Factory methods ──

    /**
     * Creates headers from a single-value map.
     *
     * @param singleValue header name → single value
     * @return immutable {@code HttpHeaders}
     */
    public static HttpHeaders of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        singleValue.forEach((key, value) -> merge(map, key, List.of(value)));
        return new HttpHeaders(map);
    }

    /**
     * Creates headers from alternating name/value arguments.
     *
     * @throws IllegalArgumentException if an odd number of arguments is given
     */
    public static HttpHeaders of(String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs, got " + namesAndValues.length + " values");
        }
        TreeMap<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (int i = 0; i < namesAndValues.length; i += 2) {
            merge(map, namesAndValues[i], List.of(namesAndValues[i + 1]));
        }
        return map.isEmpty() ? EMPTY : new HttpHeaders(map);
    }

    /**
     * Creates headers from a multi-value map. Empty value lists are dropped.
     *
     * @param multiValue header name → list of values
     * @return immutable {@code HttpHeaders}
     */
    public static HttpHeaders ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        multiValue.forEach((key, values) -> {
            if (values != null && !values.isEmpty()) {
                merge(map, key, values);
            }
        });
        return new HttpHeaders(map);
    }

    /** Returns an empty headers instance. */
    public static HttpHeaders empty() {
        return EMPTY;
    }

    private static void merge(TreeMap<String, List<String>> map, String name, List<String> values) {
        List<String> existing = map.get(name);
        if (existing == null) {
            map.put(name, List.copyOf(values));
        } else {
            List<String> merged = new ArrayList<>(existing);
            merged.addAll(values);
            map.put(name, List.copyOf(merged));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpHeaders that)) return false;
        return store.equals(that.store);
    }

    @Override
    public int hashCode() {
        return store.hashCode();
    }

    @Override
    public String toString() {
        return "HttpHeaders" + store.keySet();
    }
}
