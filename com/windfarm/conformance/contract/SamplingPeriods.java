package com.windfarm.conformance.contract;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 采样周期文本解析：支持 10min、1h、h、30s、1d 以及ISO-8601格式（PT10M）。
 */
public final class SamplingPeriods {

    private static final Pattern SHORT_FORM = Pattern.compile("(\\d*)\\s*(s|min|t|h|d)");

    private SamplingPeriods() {}

    public static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Sampling period must not be blank");
        }
        String value = text.trim();
        Duration period;
        if (value.toUpperCase(Locale.ROOT).startsWith("P")) {
            try {
                period = Duration.parse(value.toUpperCase(Locale.ROOT));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid sampling period: " + text, e);
            }
        } else {
            Matcher m = SHORT_FORM.matcher(value.toLowerCase(Locale.ROOT));
            if (!m.matches()) {
                throw new IllegalArgumentException("Invalid sampling period: " + text);
            }
            long amount = m.group(1).isEmpty() ? 1 : Long.parseLong(m.group(1));
            switch (m.group(2)) {
                case "s": period = Duration.ofSeconds(amount); break;
                case "min":
                case "t": period = Duration.ofMinutes(amount); break;
                case "h": period = Duration.ofHours(amount); break;
                default: period = Duration.ofDays(amount);
            }
        }
        if (period.isZero() || period.isNegative() || period.getNano() != 0) {
            throw new IllegalArgumentException("Sampling period must be a positive whole number of seconds: " + text);
        }
        return period;
    }

    /** 周期折算为小时 */
    public static double hours(Duration period) {
        return period.getSeconds() / 3600.0;
    }
}
