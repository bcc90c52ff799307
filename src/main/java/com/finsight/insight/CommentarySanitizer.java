package com.finsight.insight;

/**
 * Cleans untrusted model output into a single plain-text line.
 */
final class CommentarySanitizer {
    private CommentarySanitizer() {
    }

    static String clean(String out, int maxChars) {
        String text = out == null ? "" : out;
        text = text.replaceAll("```[a-zA-Z]*", " ")
                .replace("`", "")
                .replace("**", "")
                .replace("__", "")
                .replaceAll("(?m)^\\s{0,3}#{1,6}\\s*", "")
                .replaceAll("(?m)^\\s*>\\s?", "")
                .replaceAll("(?m)^\\s*[-*+]\\s+", "");

        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (Character.isWhitespace(ch)) {
                sb.append(' ');
            } else if (!Character.isISOControl(ch) && Character.getType(ch) != Character.FORMAT) {
                sb.append(ch);
            }
        }
        String collapsed = sb.toString().replaceAll(" {2,}", " ").trim();
        if (collapsed.length() <= maxChars) {
            return collapsed;
        }
        String cut = collapsed.substring(0, maxChars);
        int lastSpace = cut.lastIndexOf(' ');
        if (lastSpace > maxChars / 2) {
            cut = cut.substring(0, lastSpace);
        }
        return cut.trim();
    }
}
