package com.docaudit.core.analysis;

import com.docaudit.core.model.LinkClassification;
import com.docaudit.core.model.ResolvedReference;
import com.docaudit.core.util.FileUtils;
import com.docaudit.core.util.MarkdownPatterns;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Resolves reference strings to canonical paths relative to the base directory.
 *
 * <p>Resolution order:</p>
 * <ol>
 *   <li>{@code http://}, {@code https://}, {@code ftp://} or another URI scheme: external</li>
 *   <li>{@code #anchor}: anchor-only</li>
 *   <li>{@code /docs/rest}: rooted, {@code docs/rest}</li>
 *   <li>any other {@code /rest}: rooted with the corpus root assumed missing, {@code docs/rest}</li>
 *   <li>{@code ../rest}: relative to the referring document's directory</li>
 *   <li>{@code ./rest}: dot-relative to the referring document's directory</li>
 *   <li>anything else: relative to the referring document's directory</li>
 * </ol>
 *
 * <p>Existence is checked on every call; nothing is cached.</p>
 */
public class LinkResolver {

    public static final String DEFAULT_CORPUS_ROOT = "docs";

    private static final List<String> EXTERNAL_PREFIXES = List.of("http://", "https://", "ftp://");
    private static final Pattern URI_SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]+:.*");

    private final String corpusRoot;
    private final Predicate<String> existenceCheck;

    /**
     * @param corpusRoot corpus root relative to the base directory, e.g. {@code docs}
     * @param existenceCheck tells whether a slash-separated path relative to the base directory is an existing file
     */
    public LinkResolver(String corpusRoot, Predicate<String> existenceCheck) {
        String root = FileUtils.normalize(Objects.requireNonNull(corpusRoot, "corpusRoot must not be null"));
        if (root == null || root.isEmpty()) {
            throw new IllegalArgumentException("corpusRoot must name a directory below the base directory: " + corpusRoot);
        }
        this.corpusRoot = root;
        this.existenceCheck = Objects.requireNonNull(existenceCheck, "existenceCheck must not be null");
    }

    public String getCorpusRoot() {
        return corpusRoot;
    }

    /**
     * Classifies a reference without touching the file system.
     *
     * @param reference reference as written
     * @return classification
     */
    public static LinkClassification classify(String reference) {
        String value = reference.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        for (String prefix : EXTERNAL_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return LinkClassification.EXTERNAL;
            }
        }
        if (URI_SCHEME.matcher(value).matches()) {
            return LinkClassification.EXTERNAL;
        }
        if (value.startsWith("#")) {
            return LinkClassification.ANCHOR_ONLY;
        }
        if (value.startsWith("/")) {
            return LinkClassification.ROOTED;
        }
        if (value.startsWith("./")) {
            return LinkClassification.DOT_RELATIVE;
        }
        return LinkClassification.RELATIVE;
    }

    /**
     * Resolves a reference found in a document.
     *
     * @param reference reference as written
     * @param documentPath path of the referring document relative to the base directory
     * @return classification, canonical path and existence
     */
    public ResolvedReference resolve(String reference, String documentPath) {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(documentPath, "documentPath must not be null");

        LinkClassification classification = classify(reference);
        if (!classification.isInternal()) {
            return ResolvedReference.external(reference, classification);
        }

        String path = MarkdownPatterns.stripFragment(reference.trim()).replace("%20", " ");
        String joined;
        if (classification == LinkClassification.ROOTED) {
            String rootedPrefix = "/" + corpusRoot + "/";
            joined = path.startsWith(rootedPrefix) ? path.substring(1) : corpusRoot + path;
        } else if (path.isEmpty()) {
            joined = documentPath;
        } else {
            String directory = FileUtils.parentOf(documentPath);
            String relative = classification == LinkClassification.DOT_RELATIVE ? path.substring(2) : path;
            joined = directory.isEmpty() ? relative : directory + "/" + relative;
        }

        String canonical = FileUtils.normalize(joined);
        if (canonical == null || canonical.isEmpty()) {
            return ResolvedReference.unresolvable(reference, classification);
        }
        return new ResolvedReference(reference, classification, canonical, existenceCheck.test(canonical), false);
    }
}
