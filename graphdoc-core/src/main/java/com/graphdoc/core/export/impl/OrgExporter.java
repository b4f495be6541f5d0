package com.graphdoc.core.export.impl;

import com.graphdoc.core.export.DocExporter;
import com.graphdoc.core.export.TableRange;
import com.graphdoc.core.util.FileUtils;
import com.graphdoc.core.util.TextLines;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Exporter for Emacs Org mode documents.
 *
 * <p><b>Output format:</b>
 * <pre>{@code
 * #+setupfile: https://example.org/theme.setup
 * #+title: 01 Walls
 *
 * * Source Code
 *
 * ** Python Nodes
 *
 * | Engine | CPython3 |
 *
 * #+begin_src python
 * import clr
 * #+end_src
 * }</pre>
 *
 * <p>Headings are lines starting with one or more {@code *} followed by a space and text.
 * Body lines that would read as a heading are indented by one space, code lines that
 * start with {@code *} or {@code #+} are escaped with a comma.
 */
public class OrgExporter implements DocExporter {

    private static final Pattern HEADING = Pattern.compile("^\\*+ +\\S.*$");
    private static final Pattern CODE_ESCAPE = Pattern.compile("^(\\s*)(,*)(\\*|#\\+)");
    private static final String FILE_LINK = "[[file:";

    private final String setupFile;
    private final OrgTableWriter tableWriter = new OrgTableWriter();

    /**
     * Creates an exporter without setup file.
     */
    public OrgExporter() {
        this(null);
    }

    /**
     * Creates an exporter referencing an Org setup file (theme) in every document.
     *
     * @param setupFile setup file path or URL, may be null
     */
    public OrgExporter(String setupFile) {
        this.setupFile = setupFile;
    }

    @Override
    public String fileExtension() {
        return "org";
    }

    @Override
    public List<String> docHead() {
        if (setupFile == null || setupFile.isBlank()) {
            return List.of();
        }
        return List.of("#+setupfile: " + setupFile.trim());
    }

    @Override
    public List<String> title(String displayName) {
        return List.of("#+title: " + singleLine(displayName));
    }

    @Override
    public String heading(String text, int level) {
        if (level < 1) {
            throw new IllegalArgumentException("Heading level must be at least 1 but was " + level);
        }
        return "*".repeat(level) + " " + singleLine(text);
    }

    @Override
    public boolean isHeading(String line) {
        return line != null && HEADING.matcher(line).matches();
    }

    @Override
    public List<String> asTable(List<String> header, List<List<String>> rows) {
        return tableWriter.write(header, rows);
    }

    @Override
    public List<TableRange> tableRanges(List<String> lines) {
        List<TableRange> ranges = new ArrayList<>();
        int start = -1;
        for (int index = 0; index < lines.size(); index++) {
            boolean tableLine = lines.get(index).startsWith("|");
            if (tableLine && start < 0) {
                start = index;
            } else if (!tableLine && start >= 0) {
                ranges.add(new TableRange(start, index));
                start = -1;
            }
        }
        if (start >= 0) {
            ranges.add(new TableRange(start, lines.size()));
        }
        return ranges;
    }

    @Override
    public List<String> asList(List<String> values) {
        return values.stream()
            .map(value -> "- " + singleLine(value))
            .toList();
    }

    @Override
    public List<String> asCode(String code, String language, int indent) {
        List<String> lines = new ArrayList<>();
        lines.add("#+begin_src " + (language == null || language.isBlank() ? "text" : language));
        String tab = " ".repeat(Math.max(indent, 0));
        for (String line : TextLines.stripBlank(TextLines.split(code))) {
            String expanded = line.replace("\t", tab).stripTrailing();
            lines.add(CODE_ESCAPE.matcher(expanded).replaceFirst("$1,$2$3"));
        }
        lines.add("#+end_src");
        return lines;
    }

    @Override
    public List<String> asText(List<String> lines) {
        return lines.stream()
            .map(line -> isHeading(line) ? " " + line : line)
            .toList();
    }

    @Override
    public String fileLink(Path target, Path relativeTo, String label) {
        return "[[file:" + FileUtils.relativeLink(target, relativeTo) + "][" + linkLabel(label) + "]]";
    }

    @Override
    public String urlLink(String url, String label) {
        if (label == null || label.isBlank()) {
            return "[[" + url + "]]";
        }
        return "[[" + url + "][" + linkLabel(label) + "]]";
    }

    @Override
    public String headingLink(String heading, String label) {
        return "[[*" + linkLabel(heading) + "][" + linkLabel(label) + "]]";
    }

    @Override
    public List<Integer> linkIndexes(List<String> lines) {
        List<Integer> indexes = new ArrayList<>();
        for (int index = 0; index < lines.size(); index++) {
            if (lines.get(index).contains(FILE_LINK)) {
                indexes.add(index);
            }
        }
        return indexes;
    }

    private static String singleLine(String text) {
        return text == null ? "" : text.replaceAll("\\s*\\R\\s*", " ").trim();
    }

    private static String linkLabel(String text) {
        return singleLine(text).replace("[", "(").replace("]", ")");
    }
}
