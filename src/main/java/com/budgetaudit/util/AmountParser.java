package com.budgetaudit.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses monetary amounts as they appear in disclosure text ("1,234.56", "１２３．４", "-0.5").
 * Units (万元, 亿元) are not converted: every amount inside one statement shares its unit.
 */
public final class AmountParser {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:,\\d{3})*(?:\\.\\d+)?|-?\\d+(?:\\.\\d+)?");

    private AmountParser() {
        // Utility class
    }

    /**
     * @return the parsed value, or null when the text holds no number
     */
    public static Double parse(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = NUMBER.matcher(toHalfWidth(text));
        if (!matcher.find()) {
            return null;
        }
        try {
            return Double.parseDouble(matcher.group().replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Finds the first number starting at or after {@code from}, looking no further than {@code maxDistance} chars.
     *
     * @return the parsed value, or null if none is in range
     */
    public static Double firstNumberAfter(String text, int from, int maxDistance) {
        if (text == null || from < 0 || from >= text.length()) {
            return null;
        }
        int end = Math.min(text.length(), from + maxDistance);
        Matcher matcher = NUMBER.matcher(toHalfWidth(text.substring(from, end)));
        if (!matcher.find()) {
            return null;
        }
        return Double.parseDouble(matcher.group().replace(",", ""));
    }

    static String toHalfWidth(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (c >= '０' && c <= '９') {
                sb.append((char) (c - '０' + '0'));
            } else if (c == '．') {
                sb.append('.');
            } else if (c == '，') {
                sb.append(',');
            } else if (c == '－') {
                sb.append('-');
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
