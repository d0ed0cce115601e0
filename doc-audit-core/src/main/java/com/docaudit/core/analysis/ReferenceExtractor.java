package com.docaudit.core.analysis;

import com.docaudit.core.model.ExtractedReference;
import com.docaudit.core.model.FrontmatterRecord;
import com.docaudit.core.util.MarkdownPatterns;
import com.docaudit.core.util.MarkdownPatterns.BodyLine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Collects the references of a document: inline body links outside code, then the
 * front-matter {@code related} entries. Images are not references.
 */
public class ReferenceExtractor {

    /**
     * @param frontmatter parsed front-matter, may be {@code null}
     * @param body document body
     * @param bodyStartLine file line at which the body starts, used for line numbers
     * @return references in document order
     */
    public List<ExtractedReference> extract(FrontmatterRecord frontmatter, String body, int bodyStartLine) {
        List<ExtractedReference> references = new ArrayList<>(bodyLinks(body, bodyStartLine));
        if (frontmatter != null) {
            frontmatter.related().forEach(entry -> references.add(ExtractedReference.related(entry)));
        }
        return references;
    }

    /**
     * Inline link targets in a Markdown body, code excluded.
     *
     * @param body document body
     * @param bodyStartLine file line at which the body starts
     * @return body references in order of appearance
     */
    public List<ExtractedReference> bodyLinks(String body, int bodyStartLine) {
        List<ExtractedReference> references = new ArrayList<>();
        for (BodyLine line : MarkdownPatterns.lines(body)) {
            if (line.code()) {
                continue;
            }
            String text = MarkdownPatterns.stripInlineCode(line.text());
            Matcher matcher = MarkdownPatterns.INLINE_LINK.matcher(text);
            while (matcher.find()) {
                if (matcher.start() > 0 && text.charAt(matcher.start() - 1) == '!') {
                    continue;
                }
                references.add(ExtractedReference.body(matcher.group(2), bodyStartLine + line.number() - 1));
            }
        }
        return references;
    }
}
