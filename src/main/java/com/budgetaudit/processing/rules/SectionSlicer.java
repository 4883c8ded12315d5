package com.budgetaudit.processing.rules;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cuts an explanatory section out of the document text by a start heading and the next heading.
 */
public final class SectionSlicer {

    private SectionSlicer() {
        // Utility class
    }

    /**
     * @param startRegex heading that opens the section; null means the whole text
     * @param endRegex   heading that opens the next section, searched after the start; null or no hit
     *                   means the section runs to the end of the text
     */
    public static Optional<Section> slice(String text, String startRegex, String endRegex) {
        if (startRegex == null || startRegex.isBlank()) {
            return Optional.of(new Section(0, text.length(), text));
        }
        Matcher start = Pattern.compile(startRegex, Pattern.MULTILINE).matcher(text);
        if (!start.find()) {
            return Optional.empty();
        }
        int begin = start.start();
        int end = text.length();
        if (endRegex != null && !endRegex.isBlank()) {
            Matcher next = Pattern.compile(endRegex, Pattern.MULTILINE).matcher(text);
            if (next.find(start.end())) {
                end = next.start();
            }
        }
        return Optional.of(new Section(begin, end, text.substring(begin, end)));
    }

    public static class Section {
        private final int start;
        private final int end;
        private final String text;

        public Section(int start, int end, String text) {
            this.start = start;
            this.end = end;
            this.text = text;
        }

        public int getStart() {
            return start;
        }

        public int getEnd() {
            return end;
        }

        public String getText() {
            return text;
        }

        /**
         * First line of the section, used as its display name.
         */
        public String getHeading() {
            String trimmed = text.trim();
            int newline = trimmed.indexOf('\n');
            String heading = newline >= 0 ? trimmed.substring(0, newline).trim() : trimmed;
            return heading.length() > 40 ? heading.substring(0, 40) : heading;
        }
    }
}
