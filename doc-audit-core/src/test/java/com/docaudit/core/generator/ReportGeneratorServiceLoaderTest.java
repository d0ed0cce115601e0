package com.docaudit.core.generator;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.StreamSupport;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies the generators registered in {@code META-INF/services}.
 */
class ReportGeneratorServiceLoaderTest {

    @Test
    void serviceLoader_discoversOneGeneratorPerFormat() {
        List<ReportGenerator> generators = StreamSupport
            .stream(ServiceLoader.load(ReportGenerator.class).spliterator(), false)
            .toList();

        assertThat(generators).extracting(ReportGenerator::getFormat)
            .containsExactlyInAnyOrder(ReportFormat.values());
        assertThat(generators).allSatisfy(generator ->
            assertThat(generator.getId()).isEqualTo(generator.getFormat().id()));
    }

    @Test
    void fromId_isCaseInsensitiveAndRejectsUnknown() {
        assertThat(ReportFormat.fromId(" CSV ")).contains(ReportFormat.CSV);
        assertThat(ReportFormat.fromId("pdf")).isEmpty();
        assertThat(ReportFormat.fromId(null)).isEmpty();
    }
}
