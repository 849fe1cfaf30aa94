package com.hagglehub.ingest;

import com.hagglehub.shared.model.ExtractedSignals;
import com.hagglehub.shared.model.InboundMessage;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Best-effort extraction of a VIN, a counterparty name and a URL from subject and body.
 * Any of the three may come back empty.
 */
public class SignalExtractor {

    static final int MAX_NAME_LENGTH = 60;

    private static final Pattern VIN = Pattern.compile(
            "(?<![A-Za-z0-9])[A-HJ-NPR-Za-hj-npr-z0-9]{17}(?![A-Za-z0-9])");
    private static final Pattern COUNTERPARTY = Pattern.compile(
            "(?i)\\bfrom\\s+([^.!?,\\n]{1,120}?)\\s*[.!?,\\n]");
    private static final Pattern URL = Pattern.compile("(?i)https?://[^\\s<>\"'()\\[\\]]+");
    private static final Pattern URL_TRAILING = Pattern.compile("[.,;:!?]+$");
    private static final Set<String> NAME_BLACKLIST = Set.of("me", "us", "you", "them", "him", "her");

    public ExtractedSignals extract(InboundMessage message) {
        var body = message.text().isEmpty() ? HtmlText.strip(message.html()) : message.text();
        return extract(message.subject() + "\n" + body);
    }

    public ExtractedSignals extract(String text) {
        if (text == null || text.isBlank()) return ExtractedSignals.none();
        return new ExtractedSignals(vin(text), counterpartyName(text), url(text));
    }

    static String vin(String text) {
        var m = VIN.matcher(text);
        return m.find() ? m.group().toUpperCase(Locale.ROOT) : "";
    }

    static String counterpartyName(String text) {
        // terminate the last sentence so a name at the very end still has a delimiter
        var m = COUNTERPARTY.matcher(text + "\n");
        if (!m.find()) return "";
        var name = m.group(1).trim();
        if (name.length() > MAX_NAME_LENGTH) {
            name = name.substring(0, MAX_NAME_LENGTH).trim();
        }
        if (name.isEmpty() || NAME_BLACKLIST.contains(name.toLowerCase(Locale.ROOT))) {
            return "";
        }
        return name;
    }

    static String url(String text) {
        var m = URL.matcher(text);
        if (!m.find()) return "";
        return URL_TRAILING.matcher(m.group()).replaceAll("");
    }
}
