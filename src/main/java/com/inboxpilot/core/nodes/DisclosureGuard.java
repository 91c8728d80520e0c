package com.inboxpilot.core.nodes;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes private calendar details from outgoing text. Subjects of the calendar owner's other
 * events must never reach the requester, whatever the composer produced.
 */
public final class DisclosureGuard {

    static final String REPLACEMENT = "another commitment";

    private DisclosureGuard() {}

    public static String redact(String text, List<String> withheldSubjects) {
        String result = text;
        for (String subject : withheldSubjects) {
            if (subject == null || subject.isBlank()) {
                continue;
            }
            Pattern pattern = Pattern.compile(Pattern.quote(subject.trim()), Pattern.CASE_INSENSITIVE);
            result = pattern.matcher(result).replaceAll(Matcher.quoteReplacement(REPLACEMENT));
        }
        return result;
    }

    public static boolean discloses(String text, List<String> withheldSubjects) {
        String lower = text.toLowerCase();
        return withheldSubjects.stream()
                .filter(subject -> subject != null && !subject.isBlank())
                .anyMatch(subject -> lower.contains(subject.trim().toLowerCase()));
    }
}
