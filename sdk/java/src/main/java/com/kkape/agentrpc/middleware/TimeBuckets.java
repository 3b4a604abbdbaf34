package com.kkape.agentrpc.middleware;

import java.time.Duration;

/**
 * Coarse durations for success logs, so that log lines aggregate well.
 */
public final class TimeBuckets {

    private TimeBuckets() {
    }

    /**
     * Up to one second reports 1s. Up to four seconds, whole seconds (truncated). Up to a
     * minute, three second buckets centred on 6s, 9s, 12s ... 60s. Beyond that, the nearest
     * minute.
     */
    public static Duration bucket(Duration elapsed) {
        long millis = elapsed.toMillis();
        if (millis <= 1000) {
            return Duration.ofSeconds(1);
        }
        long seconds = millis / 1000;
        if (seconds <= 4) {
            return Duration.ofSeconds(seconds);
        }
        if (millis <= 60_000) {
            return Duration.ofSeconds(((seconds - 5) / 3) * 3 + 6);
        }
        return Duration.ofMinutes((millis + 30_000) / 60_000);
    }

    /**
     * Compact rendering: {@code 850ms}, {@code 6s}, {@code 6.4s}, {@code 2m30s}, {@code 1h0m0s}.
     */
    public static String format(Duration duration) {
        long nanos = duration.toNanos();
        if (nanos == 0) {
            return "0s";
        }
        StringBuilder out = new StringBuilder();
        if (nanos < 0) {
            out.append('-');
            nanos = -nanos;
        }
        if (nanos < 1_000L) {
            return out.append(nanos).append("ns").toString();
        }
        if (nanos < 1_000_000L) {
            return out.append(decimal(nanos, 1_000L)).append("µs").toString();
        }
        if (nanos < 1_000_000_000L) {
            return out.append(decimal(nanos, 1_000_000L)).append("ms").toString();
        }

        long hours = nanos / 3_600_000_000_000L;
        nanos -= hours * 3_600_000_000_000L;
        long minutes = nanos / 60_000_000_000L;
        nanos -= minutes * 60_000_000_000L;
        if (hours > 0) {
            out.append(hours).append('h');
        }
        if (hours > 0 || minutes > 0) {
            out.append(minutes).append('m');
        }
        return out.append(decimal(nanos, 1_000_000_000L)).append('s').toString();
    }

    private static String decimal(long value, long unit) {
        long whole = value / unit;
        long fraction = value % unit;
        if (fraction == 0) {
            return Long.toString(whole);
        }
        int digits = Long.toString(unit).length() - 1;
        String padded = String.format("%0" + digits + "d", fraction);
        int end = padded.length();
        while (end > 0 && padded.charAt(end - 1) == '0') {
            end--;
        }
        return whole + "." + padded.substring(0, end);
    }
}
