package com.docaudit.core.generator.impl;

import com.docaudit.core.generator.GeneratedReport;
import com.docaudit.core.generator.GeneratorConfig;
import com.docaudit.core.generator.GeneratorTestBase;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CsvReportGenerator}.
 */
class CsvReportGeneratorTest extends GeneratorTestBase {

    private static final String HEADER = "path,title,category,tags,quality,readability,word_count,related_count";

    private final CsvReportGenerator generator = new CsvReportGenerator();

    @Test
    void generate_emptyCorpus_writesHeaderOnly() {
        GeneratedReport generated = generator.generate(emptyReport(), GeneratorConfig.defaults());

        assertThat(generated.content()).isEqualTo(HEADER + "\n");
        assertThat(generated.fileName()).isEqualTo("documentation_inventory_2024-05-01.csv");
    }

    @Test
    void generate_oneRowPerDocumentSortedByPath() {
        GeneratedReport generated = generator.generate(report(Map.of(
            "docs/z.md", "# Z\n",
            "docs/guides/setup.md", COMPLETE_GUIDE)), GeneratorConfig.defaults());

        String[] lines = generated.content().split("\n");
        assertThat(lines).hasSize(3);
        assertThat(lines[0]).isEqualTo(HEADER);
        assertThat(lines[1]).startsWith("docs/guides/setup.md,")
            .contains("Setup Guide")
            .contains(",guide,setup;java,Excellent,")
            .endsWith(",1");
        assertThat(lines[2]).startsWith("docs/z.md,").contains(",uncategorized,").endsWith(",0");
    }
}
