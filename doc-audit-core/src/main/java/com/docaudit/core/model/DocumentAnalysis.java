package com.docaudit.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Everything computed for one document independently of the rest of the corpus.
 *
 * @param document parsed document
 * @param references references extracted from body and front-matter
 * @param frontmatter front-matter validation result
 * @param quality structural quality record
 * @param readability readability record
 */
public record DocumentAnalysis(
    Document document,
    List<ExtractedReference> references,
    FrontmatterFinding frontmatter,
    QualityRecord quality,
    ReadabilityRecord readability
) {
    public DocumentAnalysis {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(frontmatter, "frontmatter must not be null");
        Objects.requireNonNull(quality, "quality must not be null");
        Objects.requireNonNull(readability, "readability must not be null");
        references = references == null ? List.of() : List.copyOf(references);
    }

    public String path() {
        return document.path();
    }
}
