package com.example.meetingscheduler.util;

import java.util.regex.Pattern;

public final class EmailAddresses {

    /** Finds addresses embedded in free text. */
    public static final Pattern EMBEDDED = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");

    private static final Pattern WHOLE = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private EmailAddresses() {
    }

    public static boolean isValid(String email) {
        return email != null && WHOLE.matcher(email.trim()).matches();
    }

    /**
     * "jane.doe_smith@corp.io" becomes "Jane Doe Smith".
     */
    public static String displayNameFromEmail(String email) {
        String localPart = email.trim();
        int at = localPart.indexOf('@');
        if (at >= 0) {
            localPart = localPart.substring(0, at);
        }
        return TextCase.titleCase(localPart.replace('.', ' ').replace('_', ' '));
    }
}
