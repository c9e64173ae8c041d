package org.carball.planlens.parser.mssql;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Attribute lookups over raw ShowPlan text. Works on fragments and truncated
 * documents since nothing here requires well-formed XML.
 */
final class ShowPlanAttributes {

    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    private ShowPlanAttributes() {
    }

    static String attribute(String text, String name) {
        if (text == null) {
            return null;
        }
        Matcher matcher = pattern(name).matcher(text);
        return matcher.find() ? unescape(matcher.group(1)) : null;
    }

    static boolean has(String text, String name) {
        return text != null && pattern(name).matcher(text).find();
    }

    static Double number(String text, String name) {
        return parseDouble(attribute(text, name));
    }

    static Integer integer(String text, String name) {
        Double value = number(text, name);
        return value != null ? (int) Math.round(value) : null;
    }

    /**
     * "1" and "true" (any case) are true; any other present value is false; absent is null.
     */
    static Boolean flag(String text, String name) {
        String value = attribute(text, name);
        if (value == null) {
            return null;
        }
        return "1".equals(value) || "true".equalsIgnoreCase(value);
    }

    /**
     * Sum of every occurrence of a numeric attribute, e.g. per-thread runtime counters.
     */
    static Double sum(String text, String name) {
        Matcher matcher = pattern(name).matcher(text);
        Double total = null;
        while (matcher.find()) {
            Double value = parseDouble(matcher.group(1));
            if (value != null) {
                total = total == null ? value : total + value;
            }
        }
        return total;
    }

    static Double parseDouble(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String stripBrackets(String identifier) {
        return identifier == null ? null : identifier.replaceAll("[\\[\\]]", "");
    }

    static String unescape(String value) {
        if (value.indexOf('&') < 0) {
            return value;
        }
        return value.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }

    private static Pattern pattern(String name) {
        return PATTERNS.computeIfAbsent(name,
                n -> Pattern.compile("\\b" + Pattern.quote(n) + "=\"([^\"]*)\""));
    }
}
