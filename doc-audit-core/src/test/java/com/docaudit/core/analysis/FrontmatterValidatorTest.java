package com.docaudit.core.analysis;

import com.docaudit.core.model.FrontmatterFinding;
import com.docaudit.core.model.FrontmatterStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FrontmatterValidator}.
 */
class FrontmatterValidatorTest {

    private final FrontmatterExtractor extractor = new FrontmatterExtractor();
    private final FrontmatterValidator validator = new FrontmatterValidator();

    @Test
    void validate_absentBlock_reportsAllRequiredMissing() {
        FrontmatterFinding finding = validator.validate("docs/a.md", null);

        assertThat(finding.status()).isEqualTo(FrontmatterStatus.ABSENT);
        assertThat(finding.missingFields()).isEqualTo(FrontmatterValidator.DEFAULT_REQUIRED_FIELDS);
    }

    @Test
    void validate_allFields_isComplete() {
        String content = """
            ---
            title: A
            description: B
            category: guide
            tags: [x]
            last_updated: 2024-01-01
            ---
            """;

        FrontmatterFinding finding = validator.validate("docs/a.md", extractor.extract(content).frontmatter());

        assertThat(finding.status()).isEqualTo(FrontmatterStatus.COMPLETE);
        assertThat(finding.isComplete()).isTrue();
        assertThat(finding.missingFields()).isEmpty();
    }

    @Test
    void validate_malformedRequiredField_isIncomplete() {
        String content = """
            ---
            title: A
            description: B
            category: unknown
            tags: [x]
            last_updated: 2024-01-01
            ---
            """;

        FrontmatterFinding finding = validator.validate("docs/a.md", extractor.extract(content).frontmatter());

        assertThat(finding.status()).isEqualTo(FrontmatterStatus.INCOMPLETE);
        assertThat(finding.missingFields()).containsExactly("category");
        assertThat(finding.malformedFields()).containsExactly("category");
    }

    @Test
    void validate_customRequiredFields_onlyChecksThose() {
        FrontmatterValidator titleOnly = new FrontmatterValidator(List.of("title", "owner"));

        FrontmatterFinding finding = titleOnly.validate("docs/a.md", extractor.extract("---\ntitle: A\n---\n").frontmatter());

        assertThat(finding.status()).isEqualTo(FrontmatterStatus.INCOMPLETE);
        assertThat(finding.missingFields()).containsExactly("owner");
    }
}
