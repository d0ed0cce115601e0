package com.docaudit.core.analysis;

import com.docaudit.core.model.FrontmatterFinding;
import com.docaudit.core.model.FrontmatterRecord;
import com.docaudit.core.model.FrontmatterStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks a front-matter block against the list of required fields.
 */
public class FrontmatterValidator {

    public static final List<String> DEFAULT_REQUIRED_FIELDS = List.of(
        FrontmatterExtractor.TITLE,
        FrontmatterExtractor.DESCRIPTION,
        FrontmatterExtractor.CATEGORY,
        FrontmatterExtractor.TAGS,
        FrontmatterExtractor.LAST_UPDATED
    );

    private final List<String> requiredFields;

    public FrontmatterValidator() {
        this(DEFAULT_REQUIRED_FIELDS);
    }

    public FrontmatterValidator(List<String> requiredFields) {
        this.requiredFields = List.copyOf(Objects.requireNonNull(requiredFields, "requiredFields must not be null"));
    }

    public List<String> getRequiredFields() {
        return requiredFields;
    }

    /**
     * Validates one document's front-matter.
     *
     * @param path document path
     * @param frontmatter parsed block, {@code null} when absent
     * @return finding with status and missing fields
     */
    public FrontmatterFinding validate(String path, FrontmatterRecord frontmatter) {
        if (frontmatter == null) {
            return new FrontmatterFinding(path, FrontmatterStatus.ABSENT, requiredFields, List.of());
        }
        List<String> missing = new ArrayList<>();
        for (String field : requiredFields) {
            if (!frontmatter.declares(field)) {
                missing.add(field);
            }
        }
        FrontmatterStatus status = missing.isEmpty() ? FrontmatterStatus.COMPLETE : FrontmatterStatus.INCOMPLETE;
        return new FrontmatterFinding(path, status, missing, frontmatter.malformedFields());
    }
}
