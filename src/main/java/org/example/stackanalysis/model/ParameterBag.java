package org.example.stackanalysis.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator supplied values keyed by the names shown to the user.
 * Values are already typed (numbers, booleans, strings, lists of ids);
 * the typed getters only bridge JSON number widths and string forms.
 */
public class ParameterBag {

    public static final String DATA_TYPE = "Data_Type";
    public static final String IDS = "IDs";
    public static final String CHANNEL_1 = "Channel 1";
    public static final String CHANNEL_2 = "Channel 2";
    public static final String CHANNEL_3 = "Channel 3";
    public static final String METHOD = "Method";
    public static final String PERMUTATIONS = "Permutations";
    public static final String MIN_SHIFT = "Minimum shift";
    public static final String MAX_SHIFT = "Maximum shift";
    public static final String SIGNIFICANCE = "Significance";
    public static final String INTERSECT = "Intersect";
    public static final String AGGREGATE_STACK = "Aggregate z-stack";
    public static final String UPLOAD_RESULTS = "Upload results";
    public static final String EMAIL_RESULTS = "Email results";
    public static final String EMAIL = "Email";

    private final Map<String, Object> values;

    public ParameterBag(Map<String, ?> values) {
        this.values = new LinkedHashMap<>();
        if (values != null) this.values.putAll(values);
    }

    /** Values from {@code overrides} replace these; null overrides are ignored. */
    public ParameterBag withOverrides(Map<String, ?> overrides) {
        ParameterBag merged = new ParameterBag(values);
        if (overrides != null) {
            overrides.forEach((k, v) -> {
                if (v != null) merged.values.put(k, v);
            });
        }
        return merged;
    }

    public String getString(String key) {
        Object v = values.get(key);
        if (v == null) return null;
        String s = v.toString().trim();
        return s.isEmpty() ? null : s;
    }

    /**
     * @throws NumberFormatException when a string value is not an integer
     * @throws ArithmeticException   when a number has a fraction or does not fit an int
     */
    public Integer getInt(String key) {
        Object v = values.get(key);
        if (v instanceof Number n) return wholeNumber(n);
        String s = getString(key);
        return s == null ? null : Integer.valueOf(s);
    }

    private static int wholeNumber(Number n) {
        if (n instanceof BigDecimal d) return d.intValueExact();
        if (n instanceof BigInteger i) return i.intValueExact();
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
                throw new ArithmeticException("not a whole int: " + n);
            }
            return (int) d;
        }
        return Math.toIntExact(n.longValue());
    }

    public Double getDouble(String key) {
        Object v = values.get(key);
        if (v instanceof Number n) return n.doubleValue();
        String s = getString(key);
        return s == null ? null : Double.valueOf(s);
    }

    public boolean getBoolean(String key) {
        Object v = values.get(key);
        if (v instanceof Boolean b) return b;
        return v != null && Boolean.parseBoolean(v.toString().trim());
    }

    public List<Long> getLongList(String key) {
        Object v = values.get(key);
        List<Long> out = new ArrayList<>();
        if (v instanceof Collection<?> c) {
            for (Object o : c) {
                if (o instanceof Number n) out.add(n.longValue());
                else if (o != null && !o.toString().isBlank()) out.add(Long.valueOf(o.toString().trim()));
            }
        } else if (v instanceof Number n) {
            out.add(n.longValue());
        } else if (v != null) {
            for (String part : v.toString().split(",")) {
                if (!part.isBlank()) out.add(Long.valueOf(part.trim()));
            }
        }
        return out;
    }

    public Map<String, Object> asMap() {
        return new LinkedHashMap<>(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
