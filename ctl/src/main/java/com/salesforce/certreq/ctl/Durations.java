/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.ctl;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.salesforce.certreq.model.IssuanceException;
import com.salesforce.certreq.model.IssuanceException.Failure;

/**
 * Manifest durations: unit suffixed decimal sequences such as {@code 2160h}, {@code 1h30m} or {@code 1.5s}, as well
 * as ISO-8601 durations such as {@code PT2160H}.
 */
public final class Durations {
    private static final Pattern                 ELEMENT = Pattern.compile(
    "(\\d+(?:\\.\\d*)?|\\.\\d+)(ns|us|µs|ms|s|m|h)");
    private static final Map<String, BigDecimal> NANOS   = Map.of("ns", BigDecimal.ONE,
                                                                  "us", BigDecimal.valueOf(1_000L),
                                                                  "µs", BigDecimal.valueOf(1_000L),
                                                                  "ms", BigDecimal.valueOf(1_000_000L),
                                                                  "s", BigDecimal.valueOf(1_000_000_000L),
                                                                  "m", BigDecimal.valueOf(60_000_000_000L),
                                                                  "h", BigDecimal.valueOf(3_600_000_000_000L));

    /**
     * Renders the duration in the unit suffixed form, e.g. {@code 2160h0m0s}
     */
    public static String format(Duration duration) {
        if (duration.isZero()) {
            return "0s";
        }
        final StringBuilder builder = new StringBuilder();
        Duration remaining = duration;
        if (duration.isNegative()) {
            builder.append('-');
            remaining = duration.negated();
        }
        if (remaining.compareTo(Duration.ofSeconds(1)) < 0) {
            final long nanos = remaining.toNanos();
            if (nanos % 1_000_000 == 0) {
                return builder.append(nanos / 1_000_000).append("ms").toString();
            }
            return builder.append(nanos).append("ns").toString();
        }
        final long hours = remaining.toHours();
        final int minutes = remaining.toMinutesPart();
        if (hours > 0) {
            builder.append(hours).append('h');
        }
        if (hours > 0 || minutes > 0) {
            builder.append(minutes).append('m');
        }
        builder.append(remaining.toSecondsPart());
        final int nanos = remaining.toNanosPart();
        if (nanos != 0) {
            builder.append(BigDecimal.valueOf(nanos, 9).stripTrailingZeros().toPlainString().substring(1));
        }
        return builder.append('s').toString();
    }

    /**
     * @return the parsed duration, or null if the value is null or empty
     * @throws IssuanceException {@link Failure#MALFORMED_MANIFEST} if the value is not a duration
     */
    public static Duration parse(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        if (value.startsWith("P") || value.startsWith("-P")) {
            try {
                return Duration.parse(value);
            } catch (DateTimeParseException e) {
                throw new IssuanceException(Failure.MALFORMED_MANIFEST, "invalid duration: " + value, e);
            }
        }
        String remaining = value;
        boolean negative = false;
        if (remaining.startsWith("-") || remaining.startsWith("+")) {
            negative = remaining.charAt(0) == '-';
            remaining = remaining.substring(1);
        }
        if ("0".equals(remaining)) {
            return Duration.ZERO;
        }
        final Matcher matcher = ELEMENT.matcher(remaining);
        BigDecimal nanos = BigDecimal.ZERO;
        int position = 0;
        while (position < remaining.length()) {
            if (!matcher.find(position) || matcher.start() != position) {
                throw new IssuanceException(Failure.MALFORMED_MANIFEST, "invalid duration: " + value);
            }
            nanos = nanos.add(new BigDecimal(matcher.group(1)).multiply(NANOS.get(matcher.group(2))));
            position = matcher.end();
        }
        if (position == 0) {
            throw new IssuanceException(Failure.MALFORMED_MANIFEST, "invalid duration: " + value);
        }
        final Duration duration;
        try {
            duration = Duration.ofNanos(nanos.setScale(0, RoundingMode.DOWN).longValueExact());
        } catch (ArithmeticException e) {
            throw new IssuanceException(Failure.MALFORMED_MANIFEST, "invalid duration: " + value, e);
        }
        return negative ? duration.negated() : duration;
    }

    private Durations() {
    }
}
