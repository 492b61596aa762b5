package com.mgmt.session.auth.server;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses duration strings such as {@code 24h}, {@code 1h30m}, {@code 1.5h} or {@code 0}.
 * Valid units are {@code ns}, {@code us} ({@code µs}), {@code ms}, {@code s}, {@code m} and {@code h}.
 */
public final class SessionDurations {
    private static final Pattern SEGMENT = Pattern.compile("(\\d+(?:\\.\\d*)?|\\.\\d+)(ns|us|µs|ms|s|m|h)");

    private static final BigDecimal MAX_NANOS = BigDecimal.valueOf(Long.MAX_VALUE);

    private static final Map<String, Long> NANOS_PER_UNIT = Map.of(
        "ns", 1L,
        "us", 1_000L,
        "µs", 1_000L,
        "ms", 1_000_000L,
        "s", 1_000_000_000L,
        "m", 60_000_000_000L,
        "h", 3_600_000_000_000L
    );

    private SessionDurations() {}

    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Duration must not be empty");
        }

        String s = value.trim();
        boolean negative = false;
        if (s.startsWith("-") || s.startsWith("+")) {
            negative = s.charAt(0) == '-';
            s = s.substring(1);
        }
        if ("0".equals(s)) {
            return Duration.ZERO;
        }
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Invalid duration: " + value);
        }

        Matcher m = SEGMENT.matcher(s);
        BigDecimal nanos = BigDecimal.ZERO;
        int pos = 0;
        while (pos < s.length()) {
            if (!m.find(pos) || m.start() != pos) {
                throw new IllegalArgumentException("Invalid duration: " + value);
            }
            BigDecimal amount = new BigDecimal(m.group(1).endsWith(".") ? m.group(1) + "0" : m.group(1));
            nanos = nanos.add(amount.multiply(BigDecimal.valueOf(NANOS_PER_UNIT.get(m.group(2)))));
            pos = m.end();
        }

        if (nanos.compareTo(MAX_NANOS) > 0) {
            throw new IllegalArgumentException("Duration out of range: " + value);
        }
        long total = nanos.longValue();
        return Duration.ofNanos(negative ? -total : total);
    }
}
