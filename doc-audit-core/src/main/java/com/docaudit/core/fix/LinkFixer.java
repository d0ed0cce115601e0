package com.docaudit.core.fix;

import com.docaudit.core.analysis.FrontmatterExtractor;
import com.docaudit.core.model.BrokenReference;
import com.docaudit.core.model.DocumentGraph;
import com.docaudit.core.model.ReferenceOrigin;
import com.docaudit.core.util.FileUtils;
import com.docaudit.core.util.MarkdownPatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Suggests and applies replacements for broken references.
 *
 * <p>A broken reference is matched by file name against the scanned documents; the first match
 * by sorted path wins. Documents under the corpus root are suggested as rooted {@code /docs/...}
 * references, others as paths relative to the referring document.</p>
 */
public class LinkFixer {

    private static final Logger log = LoggerFactory.getLogger(LinkFixer.class);

    private final String corpusRoot;

    public LinkFixer(String corpusRoot) {
        this.corpusRoot = Objects.requireNonNull(corpusRoot, "corpusRoot must not be null");
    }

    /**
     * Computes a suggestion for every broken reference of the graph.
     *
     * @param graph reference graph of the scanned documents
     * @return one entry per broken reference, in graph order
     */
    public List<LinkFixSuggestion> suggest(DocumentGraph graph) {
        Map<String, List<String>> byFileName = new TreeMap<>();
        graph.nodes().stream().sorted().forEach(path ->
            byFileName.computeIfAbsent(FileUtils.fileNameOf(path), key -> new ArrayList<>()).add(path));

        List<LinkFixSuggestion> suggestions = new ArrayList<>();
        for (BrokenReference broken : graph.brokenReferences()) {
            String path = MarkdownPatterns.stripFragment(broken.reference().trim());
            String fileName = FileUtils.fileNameOf(path);
            List<String> candidates = byFileName.getOrDefault(fileName, List.of());
            String replacement = candidates.isEmpty()
                ? null
                : toReference(candidates.get(0), broken.sourcePath()) + fragmentOf(broken.reference().trim());
            suggestions.add(new LinkFixSuggestion(broken, replacement));
        }
        return suggestions;
    }

    /**
     * Rewrites the referring documents in place, one write per changed file.
     *
     * @param baseDirectory directory the document paths are relative to
     * @param suggestions suggestions from {@link #suggest(DocumentGraph)}
     * @return what was applied
     * @throws IOException if a document cannot be read or written
     */
    public LinkFixResult apply(Path baseDirectory, List<LinkFixSuggestion> suggestions) throws IOException {
        Map<String, List<LinkFixSuggestion>> bySource = new LinkedHashMap<>();
        suggestions.stream()
            .filter(LinkFixSuggestion::hasSuggestion)
            .forEach(suggestion -> bySource.computeIfAbsent(suggestion.sourcePath(), key -> new ArrayList<>()).add(suggestion));

        List<LinkFixSuggestion> applied = new ArrayList<>();
        List<LinkFixSuggestion> unmatched = new ArrayList<>();
        List<String> modified = new ArrayList<>();

        for (Map.Entry<String, List<LinkFixSuggestion>> entry : bySource.entrySet()) {
            Path file = baseDirectory.resolve(entry.getKey());
            String original = Files.readString(file, StandardCharsets.UTF_8);
            String content = original;
            Set<String> done = new HashSet<>();
            for (LinkFixSuggestion suggestion : entry.getValue()) {
                String key = suggestion.broken().edge().origin() + ":" + suggestion.reference();
                if (done.contains(key)) {
                    applied.add(suggestion);
                    continue;
                }
                String updated = suggestion.broken().edge().origin() == ReferenceOrigin.RELATED
                    ? replaceRelated(content, suggestion.reference(), suggestion.replacement())
                    : replaceBodyLink(content, suggestion.reference(), suggestion.replacement());
                if (updated.equals(content)) {
                    unmatched.add(suggestion);
                } else {
                    applied.add(suggestion);
                    done.add(key);
                    content = updated;
                }
            }
            if (!content.equals(original)) {
                Files.writeString(file, content, StandardCharsets.UTF_8);
                modified.add(entry.getKey());
                log.info("Fixed links in {}", entry.getKey());
            }
        }
        return new LinkFixResult(applied, unmatched, modified);
    }

    private String toReference(String targetPath, String sourcePath) {
        if (targetPath.startsWith(corpusRoot + "/")) {
            return "/" + targetPath;
        }
        Path from = Path.of(FileUtils.parentOf(sourcePath).isEmpty() ? "." : FileUtils.parentOf(sourcePath));
        return FileUtils.toSlashPath(from.relativize(Path.of(targetPath)).normalize());
    }

    private static String fragmentOf(String reference) {
        int hash = reference.indexOf('#');
        return hash < 0 ? "" : reference.substring(hash);
    }

    /**
     * Rewrites inline links to {@code reference} in prose lines. Front-matter and fenced code
     * are left untouched.
     */
    static String replaceBodyLink(String content, String reference, String replacement) {
        Pattern pattern = Pattern.compile("\\]\\(\\s*<?" + Pattern.quote(reference) + ">?(\\s+\"[^\"]*\")?\\s*\\)");
        String[] lines = content.split("\n", -1);
        int bodyStart = bodyStart(lines);
        String body = String.join("\n", List.of(lines).subList(bodyStart, lines.length));
        List<MarkdownPatterns.BodyLine> bodyLines = MarkdownPatterns.lines(body);
        for (int i = bodyStart; i < lines.length; i++) {
            if (bodyLines.get(i - bodyStart).code()) {
                continue;
            }
            Matcher matcher = pattern.matcher(lines[i]);
            StringBuilder result = new StringBuilder();
            while (matcher.find()) {
                String title = matcher.group(1) == null ? "" : matcher.group(1);
                matcher.appendReplacement(result, Matcher.quoteReplacement("](" + replacement + title + ")"));
            }
            matcher.appendTail(result);
            lines[i] = result.toString();
        }
        return String.join("\n", lines);
    }

    private static int bodyStart(String[] lines) {
        if (lines.length == 0 || !lines[0].stripTrailing().equals(FrontmatterExtractor.DELIMITER)) {
            return 0;
        }
        for (int i = 1; i < lines.length; i++) {
            if (lines[i].stripTrailing().equals(FrontmatterExtractor.DELIMITER)) {
                return i + 1;
            }
        }
        return 0;
    }

    static String replaceRelated(String content, String reference, String replacement) {
        String[] lines = content.split("\n", -1);
        if (lines.length == 0 || !lines[0].stripTrailing().equals(FrontmatterExtractor.DELIMITER)) {
            return content;
        }
        Pattern item = Pattern.compile("^(\\s*-\\s*)([\"']?)" + Pattern.quote(reference) + "\\2(\\s*)$");
        Pattern inline = Pattern.compile("^(related\\s*:\\s*\\[)(.*)(\\][^\\n]*)$");
        boolean inRelated = false;
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.stripTrailing().equals(FrontmatterExtractor.DELIMITER)) {
                break;
            }
            Matcher inlineMatcher = inline.matcher(line);
            if (inlineMatcher.matches()) {
                lines[i] = inlineMatcher.group(1) + replaceInlineItem(inlineMatcher.group(2), reference, replacement)
                    + inlineMatcher.group(3);
                inRelated = false;
                continue;
            }
            if (line.matches("^related\\s*:\\s*$")) {
                inRelated = true;
                continue;
            }
            if (inRelated) {
                Matcher itemMatcher = item.matcher(line);
                if (itemMatcher.matches()) {
                    lines[i] = itemMatcher.group(1) + itemMatcher.group(2) + replacement + itemMatcher.group(2)
                        + itemMatcher.group(3);
                } else if (!line.matches("^\\s*-.*")) {
                    inRelated = false;
                }
            }
        }
        return String.join("\n", lines);
    }

    private static String replaceInlineItem(String items, String reference, String replacement) {
        List<String> parts = new ArrayList<>();
        for (String part : items.split(",", -1)) {
            String trimmed = part.trim();
            String unquoted = trimmed.replaceAll("^([\"'])(.*)\\1$", "$2");
            if (unquoted.equals(reference)) {
                String quote = trimmed.length() > unquoted.length() ? trimmed.substring(0, 1) : "";
                int leading = part.indexOf(trimmed.isEmpty() ? " " : trimmed);
                parts.add((leading > 0 ? part.substring(0, leading) : "") + quote + replacement + quote);
            } else {
                parts.add(part);
            }
        }
        return String.join(",", parts);
    }
}
