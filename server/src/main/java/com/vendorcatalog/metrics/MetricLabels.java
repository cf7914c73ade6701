package com.vendorcatalog.metrics;

import java.util.Locale;

public final class MetricLabels {

    public static final int METHOD_MAX_LENGTH = 16;
    public static final int PATH_MAX_LENGTH = 160;

    private static final String ELLIPSIS = "...";

    private MetricLabels() {
    }

    public static String method(String method) {
        String upper = method == null ? "" : method.toUpperCase(Locale.ROOT);
        return clean(upper, "UNKNOWN", METHOD_MAX_LENGTH);
    }

    public static String path(String path) {
        return clean(path, "/", PATH_MAX_LENGTH);
    }

    public static String statusClass(int statusCode) {
        if (statusCode < 100) {
            return "0xx";
        }
        return (statusCode / 100) + "xx";
    }

    public static String statusClass(String statusCode) {
        if (statusCode == null) {
            return "0xx";
        }
        try {
            return statusClass(Integer.parseInt(statusCode.trim()));
        } catch (NumberFormatException e) {
            return "0xx";
        }
    }

    public static String clean(String value, String fallback, int maxLength) {
        String text = value == null ? "" : replaceControlChars(value).strip();
        if (text.isEmpty()) {
            text = fallback;
        }
        if (text.length() > maxLength) {
            int keep = Math.max(0, maxLength - ELLIPSIS.length());
            text = text.substring(0, keep) + ELLIPSIS;
        }
        return text;
    }

    private static String replaceControlChars(String value) {
        StringBuilder sb = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isISOControl(c)) {
                if (sb == null) {
                    sb = new StringBuilder(value.length());
                    sb.append(value, 0, i);
                }
                sb.append(' ');
            } else if (sb != null) {
                sb.append(c);
            }
        }
        return sb == null ? value : sb.toString();
    }
}
