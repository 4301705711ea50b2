package com.example.meetingscheduler.util;

import java.util.Locale;

public final class TextCase {

    private TextCase() {
    }

    /**
     * Upper-cases the first letter of every word and lower-cases the rest. A word starts after
     * any character that is not a letter, so "q3 review" becomes "Q3 Review".
     */
    public static String titleCase(String text) {
        if (text == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                sb.append(c);
                startOfWord = !Character.isDigit(c);
            }
        }
        return sb.toString();
    }

    public static String normalize(String text) {
        return text == null ? "" : text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
