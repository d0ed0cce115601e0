package com.docaudit.core.fix;

import com.docaudit.core.analysis.FrontmatterExtractor;
import com.docaudit.core.model.Document;
import com.docaudit.core.model.DocumentAnalysis;
import com.docaudit.core.model.FrontmatterFinding;
import com.docaudit.core.model.FrontmatterRecord;
import com.docaudit.core.util.FileUtils;
import com.docaudit.core.util.MarkdownPatterns;
import com.docaudit.core.util.MarkdownPatterns.BodyLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fills in missing front-matter fields that can be derived from the document itself.
 *
 * <p>Only {@code title}, {@code description} and {@code last_updated} are derived:
 * the title from the first {@code # } heading or the file name, the description from the first
 * paragraph after that heading or a generic sentence, and the date from the clock. Fields that
 * are declared but blank or malformed are never overwritten; they are reported as manual work
 * together with every other missing field.</p>
 */
public class FrontmatterFixer {

    private static final Logger log = LoggerFactory.getLogger(FrontmatterFixer.class);

    private static final String SPECIAL_VALUE_START = "[{\"'>|*&!%@-#";

    private final Clock clock;

    public FrontmatterFixer() {
        this(Clock.systemDefaultZone());
    }

    public FrontmatterFixer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Computes additions for every document whose front-matter is not complete.
     *
     * @param analyses analyzed documents
     * @return one entry per incomplete document, in input order
     */
    public List<FrontmatterFixSuggestion> suggest(List<DocumentAnalysis> analyses) {
        List<FrontmatterFixSuggestion> suggestions = new ArrayList<>();
        for (DocumentAnalysis analysis : analyses) {
            FrontmatterFinding finding = analysis.frontmatter();
            if (!finding.isComplete()) {
                suggestions.add(suggest(analysis.document(), finding));
            }
        }
        return suggestions;
    }

    FrontmatterFixSuggestion suggest(Document document, FrontmatterFinding finding) {
        FrontmatterRecord frontmatter = document.frontmatter();
        Map<String, String> additions = new LinkedHashMap<>();
        List<String> manual = new ArrayList<>();

        for (String field : finding.missingFields()) {
            boolean declared = frontmatter != null && frontmatter.fields().containsKey(field);
            Optional<String> value = declared ? Optional.empty() : derive(field, document);
            if (value.isPresent()) {
                additions.put(field, value.get());
            } else {
                manual.add(field);
            }
        }
        return new FrontmatterFixSuggestion(document.path(), frontmatter == null, additions, manual);
    }

    private Optional<String> derive(String field, Document document) {
        switch (field) {
            case FrontmatterExtractor.TITLE:
                return Optional.of(firstHeading(document.body()).orElseGet(() -> titleFromFileName(document.fileName())));
            case FrontmatterExtractor.DESCRIPTION:
                return Optional.of(firstParagraph(document.body())
                    .orElseGet(() -> "Description of " + words(document.fileName())));
            case FrontmatterExtractor.LAST_UPDATED:
                return Optional.of(LocalDate.now(clock).toString());
            default:
                return Optional.empty();
        }
    }

    /**
     * Writes the additions into the documents, one write per changed file.
     *
     * @param baseDirectory directory the document paths are relative to
     * @param suggestions suggestions from {@link #suggest(List)}
     * @return what was applied
     * @throws IOException if a document cannot be read or written
     */
    public FrontmatterFixResult apply(Path baseDirectory, List<FrontmatterFixSuggestion> suggestions) throws IOException {
        List<FrontmatterFixSuggestion> applied = new ArrayList<>();
        List<String> modified = new ArrayList<>();

        for (FrontmatterFixSuggestion suggestion : suggestions) {
            if (!suggestion.hasAdditions()) {
                continue;
            }
            Path file = baseDirectory.resolve(suggestion.path());
            String original = Files.readString(file, StandardCharsets.UTF_8);
            String updated = insertFields(original, suggestion.additions());
            Files.writeString(file, updated, StandardCharsets.UTF_8);
            applied.add(suggestion);
            modified.add(suggestion.path());
            log.info("Added front-matter fields {} to {}", suggestion.additions().keySet(), suggestion.path());
        }
        return new FrontmatterFixResult(applied, modified);
    }

    static String insertFields(String content, Map<String, String> additions) {
        String bom = content.startsWith("\uFEFF") ? "\uFEFF" : "";
        String text = content.substring(bom.length());
        String eol = text.contains("\r\n") ? "\r\n" : "\n";

        StringBuilder fields = new StringBuilder();
        additions.forEach((key, value) -> fields.append(key).append(": ").append(yamlValue(value)).append(eol));

        String[] lines = text.split("\n", -1);
        if (lines[0].stripTrailing().equals(FrontmatterExtractor.DELIMITER)) {
            int offset = lines[0].length() + 1;
            for (int i = 1; i < lines.length; i++) {
                if (lines[i].stripTrailing().equals(FrontmatterExtractor.DELIMITER)) {
                    return bom + text.substring(0, offset) + fields + text.substring(offset);
                }
                offset += lines[i].length() + 1;
            }
        }
        return bom + FrontmatterExtractor.DELIMITER + eol + fields + FrontmatterExtractor.DELIMITER + eol + text;
    }

    private static Optional<String> firstHeading(String body) {
        for (BodyLine line : MarkdownPatterns.lines(body)) {
            if (!line.code() && MarkdownPatterns.TOP_LEVEL_HEADING.matcher(line.text()).matches()) {
                return Optional.of(line.text().substring(2).trim());
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstParagraph(String body) {
        boolean afterHeading = false;
        for (BodyLine line : MarkdownPatterns.lines(body)) {
            if (line.code()) {
                if (afterHeading) {
                    return Optional.empty();
                }
                continue;
            }
            String text = line.text().trim();
            if (!afterHeading) {
                afterHeading = MarkdownPatterns.TOP_LEVEL_HEADING.matcher(line.text()).matches();
            } else if (!text.isEmpty()) {
                return text.startsWith("#") ? Optional.empty() : Optional.of(text);
            }
        }
        return Optional.empty();
    }

    static String titleFromFileName(String fileName) {
        StringBuilder title = new StringBuilder();
        for (String word : words(fileName).split(" ")) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
        }
        return title.toString();
    }

    private static String words(String fileName) {
        String name = fileName.toLowerCase(Locale.ROOT).endsWith(FileUtils.MARKDOWN_EXTENSION)
            ? fileName.substring(0, fileName.length() - FileUtils.MARKDOWN_EXTENSION.length())
            : fileName;
        return name.replace('-', ' ').replace('_', ' ').trim();
    }

    private static String yamlValue(String value) {
        if (value.isEmpty() || SPECIAL_VALUE_START.indexOf(value.charAt(0)) < 0) {
            return value;
        }
        return "\"" + value.replace('"', '\'') + "\"";
    }
}
