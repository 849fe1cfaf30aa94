package com.hagglehub.ingest;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Approximate HTML to text conversion. Good enough for regex signal extraction,
 * not a markup parser.
 */
final class HtmlText {

    private static final Pattern SCRIPT_OR_STYLE = Pattern.compile(
            "(?is)<(script|style)[^>]*>.*?</\\1\\s*>");
    private static final Pattern BLOCK_BREAK = Pattern.compile(
            "(?i)<\\s*(br|/p|/div|/li|/tr|/h[1-6])[^>]*>");
    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#(x?[0-9a-fA-F]+);");
    private static final Pattern SPACES = Pattern.compile("[ \\t\\x0B\\f\\r]+");

    private HtmlText() {}

    static String strip(String html) {
        if (html == null || html.isEmpty()) return "";
        var text = SCRIPT_OR_STYLE.matcher(html).replaceAll(" ");
        text = BLOCK_BREAK.matcher(text).replaceAll("\n");
        text = TAG.matcher(text).replaceAll(" ");
        text = text.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&apos;", "'");
        text = decodeNumeric(text);
        // &amp; last so "&amp;lt;" stays a literal "&lt;"
        text = text.replace("&amp;", "&");
        text = SPACES.matcher(text).replaceAll(" ");
        return text.trim();
    }

    private static String decodeNumeric(String text) {
        var m = NUMERIC_ENTITY.matcher(text);
        var sb = new StringBuilder();
        while (m.find()) {
            var code = m.group(1);
            String replacement;
            try {
                int cp = code.startsWith("x") || code.startsWith("X")
                        ? Integer.parseInt(code.substring(1), 16)
                        : Integer.parseInt(code);
                replacement = Character.isValidCodePoint(cp) ? new String(Character.toChars(cp)) : " ";
            } catch (NumberFormatException e) {
                replacement = " ";
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
