package com.stlmonitor.core.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class HtmlUtils {
    public static final int MAX_TEXT_LENGTH = 500;
    public static final int SUMMARY_LENGTH = 150;

    private static final Pattern TAG_PATTERN = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");
    private static final Pattern DECIMAL_ENTITY = Pattern.compile("&#(\\d+);");
    private static final Pattern HEX_ENTITY = Pattern.compile("&#[xX]([0-9a-fA-F]+);");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?]+");

    private HtmlUtils() {
    }

    /**
     * Decodes the handful of entities feeds actually emit. {@code &amp;} goes first so double-escaped markup
     * such as {@code &amp;lt;} ends up as a real tag that {@link #stripTags} can remove.
     */
    public static String decodeEntities(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String decoded = text
                .replace("&amp;", "&")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&apos;", "'")
                .replace("&nbsp;", " ");
        decoded = replaceCodePoints(DECIMAL_ENTITY, decoded, 10);
        return replaceCodePoints(HEX_ENTITY, decoded, 16);
    }

    /**
     * Replaces tags with spaces, collapses whitespace and caps the result at {@value #MAX_TEXT_LENGTH} characters.
     */
    public static String stripTags(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        String text = TAG_PATTERN.matcher(html).replaceAll(" ");
        text = WHITESPACE_PATTERN.matcher(text).replaceAll(" ").trim();
        return text.length() > MAX_TEXT_LENGTH ? text.substring(0, MAX_TEXT_LENGTH) : text;
    }

    /**
     * Short snippet for a card: the text itself when short enough, otherwise as many leading sentences as fit.
     */
    public static String summarize(String description) {
        if (description == null) {
            return "";
        }
        if (description.length() <= SUMMARY_LENGTH) {
            return description;
        }
        StringBuilder summary = new StringBuilder();
        for (String sentence : SENTENCE_BREAK.split(description)) {
            String trimmed = sentence.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (summary.length() + trimmed.length() > SUMMARY_LENGTH) {
                break;
            }
            if (summary.length() > 0) {
                summary.append(". ");
            }
            summary.append(trimmed);
        }
        if (summary.length() == 0) {
            return description.substring(0, SUMMARY_LENGTH) + "...";
        }
        if (summary.charAt(summary.length() - 1) != '.') {
            summary.append("...");
        }
        return summary.toString();
    }

    private static String replaceCodePoints(Pattern pattern, String text, int radix) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String replacement;
            try {
                int codePoint = Integer.parseInt(matcher.group(1), radix);
                replacement = Character.isValidCodePoint(codePoint) ? new String(Character.toChars(codePoint)) : matcher.group();
            } catch (NumberFormatException e) {
                replacement = matcher.group();
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
