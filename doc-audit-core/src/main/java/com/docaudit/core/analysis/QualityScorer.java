package com.docaudit.core.analysis;

import com.docaudit.core.model.Document;
import com.docaudit.core.model.ExtractedReference;
import com.docaudit.core.model.QualityLabel;
import com.docaudit.core.model.QualityRecord;
import com.docaudit.core.util.MarkdownPatterns;
import com.docaudit.core.util.MarkdownPatterns.BodyLine;

import java.util.List;
import java.util.regex.Matcher;

/**
 * Scores the structural completeness of a document on a 0..10 rubric.
 *
 * <p>One point each for: front-matter title, front-matter description, a {@code # } heading,
 * a {@code ## } heading, a second {@code ## } heading, a fenced code block, a language on a
 * fence, an internal Markdown link, a {@code ## Related Documents} heading, and a Markdown link
 * inside that section. Headings and links inside code blocks do not count.</p>
 */
public class QualityScorer {

    private final ReferenceExtractor referenceExtractor;

    public QualityScorer() {
        this(new ReferenceExtractor());
    }

    public QualityScorer(ReferenceExtractor referenceExtractor) {
        this.referenceExtractor = referenceExtractor;
    }

    public QualityRecord score(Document document) {
        List<BodyLine> lines = MarkdownPatterns.lines(document.body());

        boolean hasTitle = document.frontmatterRecord().map(fm -> fm.hasTitle()).orElse(false);
        boolean hasDescription = document.frontmatterRecord().map(fm -> fm.hasDescription()).orElse(false);

        boolean topLevelHeading = false;
        int subsections = 0;
        boolean codeBlock = false;
        boolean codeLanguage = false;
        boolean relatedSection = false;
        boolean relatedLinks = false;
        boolean inRelated = false;
        boolean openingFence = true;

        for (BodyLine line : lines) {
            Matcher fence = MarkdownPatterns.FENCE.matcher(line.text());
            if (fence.matches()) {
                if (openingFence) {
                    codeBlock = true;
                    if (!fence.group(2).isBlank() && Character.isLetter(fence.group(2).charAt(0))) {
                        codeLanguage = true;
                    }
                }
                openingFence = !openingFence;
                continue;
            }
            if (line.code()) {
                continue;
            }
            String text = line.text();
            if (MarkdownPatterns.TOP_LEVEL_HEADING.matcher(text).matches()) {
                topLevelHeading = true;
                inRelated = false;
            } else if (MarkdownPatterns.SUBSECTION_HEADING.matcher(text).matches()) {
                subsections++;
                inRelated = MarkdownPatterns.RELATED_DOCUMENTS_HEADING.matcher(text).matches();
                relatedSection |= inRelated;
            } else if (inRelated && containsMarkdownLink(text)) {
                relatedLinks = true;
            }
        }

        boolean internalLink = referenceExtractor.bodyLinks(document.body(), 1).stream()
            .map(ExtractedReference::target)
            .anyMatch(target -> LinkResolver.classify(target).isInternal() && MarkdownPatterns.isMarkdownTarget(target));

        int score = point(hasTitle)
            + point(hasDescription)
            + point(topLevelHeading)
            + point(subsections >= 1)
            + point(subsections >= 2)
            + point(codeBlock)
            + point(codeBlock && codeLanguage)
            + point(internalLink)
            + point(relatedSection)
            + point(relatedSection && relatedLinks);

        return new QualityRecord(document.path(), hasTitle, hasDescription, topLevelHeading, subsections,
            codeBlock, codeLanguage, internalLink, relatedSection, relatedLinks, score, QualityLabel.fromScore(score));
    }

    private static boolean containsMarkdownLink(String line) {
        Matcher matcher = MarkdownPatterns.INLINE_LINK.matcher(MarkdownPatterns.stripInlineCode(line));
        while (matcher.find()) {
            if (MarkdownPatterns.isMarkdownTarget(matcher.group(2))) {
                return true;
            }
        }
        return false;
    }

    private static int point(boolean condition) {
        return condition ? 1 : 0;
    }
}
