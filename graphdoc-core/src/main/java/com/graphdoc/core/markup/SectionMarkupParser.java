package com.graphdoc.core.markup;

import com.graphdoc.core.util.TextLines;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a section marker, title and body from free label text.
 *
 * <p>The first line starting with a marker (leading whitespace ignored) opens the section.
 * Lines before it are dropped. The rest of the marker line is the title, optionally
 * preceded by a numeric order hint. The following lines, blank-trimmed, are the body.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SectionMarkupParser parser = new SectionMarkupParser();
 * parser.parse("[T] 2 Setup\nSelect the levels first.")
 *     .ifPresent(markup -> markup.order()); // 2
 * }</pre>
 */
public class SectionMarkupParser {

    private static final Pattern ORDER_HINT = Pattern.compile("^(\\d+)(?:\\s+|$)(.*)$");

    /**
     * Parses label text.
     *
     * @param text raw text, may be null
     * @param sourceId id of the annotation or group
     * @return parsed markup, empty if the text has no marker
     */
    public Optional<SectionMarkup> parse(String text, String sourceId) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        List<String> lines = Arrays.asList(text.split("\\R", -1));
        for (int index = 0; index < lines.size(); index++) {
            String line = lines.get(index);
            Optional<Section> section = Section.ofLine(line);
            if (section.isEmpty()) {
                continue;
            }
            String remainder = line.stripLeading().substring(section.get().marker().length()).trim();
            Integer order = null;
            String title = remainder;
            Matcher matcher = ORDER_HINT.matcher(remainder);
            if (matcher.matches()) {
                order = Integer.valueOf(matcher.group(1));
                title = matcher.group(2).trim();
            }
            List<String> body = TextLines.stripBlank(lines.subList(index + 1, lines.size()));
            return Optional.of(new SectionMarkup(section.get(), title, order, body, sourceId));
        }
        return Optional.empty();
    }

    /**
     * Parses label text without a source id.
     *
     * @param text raw text, may be null
     * @return parsed markup, empty if the text has no marker
     */
    public Optional<SectionMarkup> parse(String text) {
        return parse(text, null);
    }
}
