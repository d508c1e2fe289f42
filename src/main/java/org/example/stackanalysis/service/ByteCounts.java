package org.example.stackanalysis.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Human readable byte counts, e.g. {@code 1 Megabyte, 200 Kilobytes, 3 Bytes}.
 */
public final class ByteCounts {

    private static final String[] PREFIX = {"", "kilo", "mega", "giga", "tera", "peta", "exa"};

    private ByteCounts() {
    }

    public static String format(long number) {
        if (number == 0) return "0 Bytes";
        String sign = number < 0 ? "-" : "";
        // Long.MIN_VALUE has no positive counterpart; it is formatted one byte short.
        long n = number == Long.MIN_VALUE ? Long.MAX_VALUE : Math.abs(number);

        List<Long> parts = new ArrayList<>();
        while (n > 0) {
            parts.add(n % 1024);
            n /= 1024;
        }
        List<String> out = new ArrayList<>();
        for (int power = parts.size() - 1; power >= 0; power--) {
            long v = parts.get(power);
            if (v != 0) out.add(v + " " + suffix(power, v));
        }
        return sign + String.join(", ", out);
    }

    private static String suffix(int power, long value) {
        String s = PREFIX[power] + "byte";
        s = Character.toUpperCase(s.charAt(0)) + s.substring(1);
        return value != 1 ? s + "s" : s;
    }
}
