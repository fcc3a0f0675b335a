package com.eainde.compliance.remediation;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses free-text effort strings into hours. {@code "N hours"} is N, {@code "N days"} is 8N;
 * anything else counts as {@value #DEFAULT_HOURS} hours.
 */
public final class EffortEstimate {

    public static final int DEFAULT_HOURS = 2;
    public static final int HOURS_PER_DAY = 8;

    private static final Pattern EFFORT = Pattern.compile("^\\s*(\\d+)\\s*(hours?|days?)\\b");

    private EffortEstimate() {}

    public static int hours(String effort) {
        if (effort == null) return DEFAULT_HOURS;
        Matcher m = EFFORT.matcher(effort.toLowerCase(Locale.ROOT));
        if (!m.find()) return DEFAULT_HOURS;
        int amount;
        try {
            amount = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return DEFAULT_HOURS;
        }
        return m.group(2).startsWith("day") ? amount * HOURS_PER_DAY : amount;
    }

    public static String format(int hours) {
        return hours + (hours == 1 ? " hour" : " hours");
    }
}
