package com.docaudit.core.analysis;

import com.docaudit.core.model.LinkClassification;
import com.docaudit.core.model.ResolvedReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LinkResolver}.
 */
class LinkResolverTest {

    private final Set<String> existing = Set.of("docs/a.md", "docs/b.md", "docs/guides/setup.md", "docs/img/logo.png");
    private final LinkResolver resolver = new LinkResolver("docs", existing::contains);

    @ParameterizedTest
    @ValueSource(strings = {"http://example.com", "https://example.com/a.md", "ftp://files.example.com/x", "mailto:team@example.com"})
    void resolve_externalReference_isNeverChecked(String reference) {
        ResolvedReference resolved = resolver.resolve(reference, "docs/a.md");

        assertThat(resolved.classification()).isEqualTo(LinkClassification.EXTERNAL);
        assertThat(resolved.canonicalPath()).isNull();
        assertThat(resolved.exists()).isFalse();
        assertThat(resolved.isInternal()).isFalse();
    }

    @Test
    void resolve_anchor_isAnchorOnly() {
        ResolvedReference resolved = resolver.resolve("#installation", "docs/a.md");

        assertThat(resolved.classification()).isEqualTo(LinkClassification.ANCHOR_ONLY);
        assertThat(resolved.canonicalPath()).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"guides/setup.md", "a/b/c.md", "deep/nested/path/file.md", "b.md"})
    void resolve_rootedReference_mapsToCorpusRemainder(String remainder) {
        ResolvedReference resolved = resolver.resolve("/docs/" + remainder, "docs/guides/setup.md");

        assertThat(resolved.classification()).isEqualTo(LinkClassification.ROOTED);
        assertThat(resolved.canonicalPath()).isEqualTo("docs/" + remainder);
    }

    @Test
    void resolve_rootedWithoutCorpusSegment_prependsCorpusRoot() {
        ResolvedReference resolved = resolver.resolve("/guides/setup.md", "docs/a.md");

        assertThat(resolved.classification()).isEqualTo(LinkClassification.ROOTED);
        assertThat(resolved.canonicalPath()).isEqualTo("docs/guides/setup.md");
        assertThat(resolved.exists()).isTrue();
    }

    @Test
    void resolve_bareCorpusSegment_isTreatedAsMissingPrefix() {
        ResolvedReference resolved = resolver.resolve("/docs", "docs/a.md");

        assertThat(resolved.canonicalPath()).isEqualTo("docs/docs");
        assertThat(resolved.exists()).isFalse();
    }

    @Test
    void resolve_parentReference_collapsesSegments() {
        ResolvedReference resolved = resolver.resolve("../a.md", "docs/guides/setup.md");

        assertThat(resolved.classification()).isEqualTo(LinkClassification.RELATIVE);
        assertThat(resolved.canonicalPath()).isEqualTo("docs/a.md");
        assertThat(resolved.exists()).isTrue();
    }

    @Test
    void resolve_dotRelativeSibling_existsWhenPresent() {
        ResolvedReference resolved = resolver.resolve("./b.md", "docs/a.md");

        assertThat(resolved.classification()).isEqualTo(LinkClassification.DOT_RELATIVE);
        assertThat(resolved.canonicalPath()).isEqualTo("docs/b.md");
        assertThat(resolved.exists()).isTrue();
    }

    @Test
    void resolve_dotRelativeSibling_missingWhenAbsent() {
        LinkResolver withoutB = new LinkResolver("docs", Set.of("docs/a.md")::contains);

        ResolvedReference resolved = withoutB.resolve("./b.md", "docs/a.md");

        assertThat(resolved.classification()).isEqualTo(LinkClassification.DOT_RELATIVE);
        assertThat(resolved.canonicalPath()).isEqualTo("docs/b.md");
        assertThat(resolved.exists()).isFalse();
        assertThat(resolved.unresolvable()).isFalse();
    }

    @Test
    void resolve_implicitRelative_joinsDocumentDirectory() {
        ResolvedReference resolved = resolver.resolve("setup.md", "docs/guides/index.md");

        assertThat(resolved.classification()).isEqualTo(LinkClassification.RELATIVE);
        assertThat(resolved.canonicalPath()).isEqualTo("docs/guides/setup.md");
    }

    @Test
    void resolve_docsPrefixWithoutSlash_isRelative() {
        ResolvedReference resolved = resolver.resolve("docs/a.md", "docs/guides/setup.md");

        assertThat(resolved.classification()).isEqualTo(LinkClassification.RELATIVE);
        assertThat(resolved.canonicalPath()).isEqualTo("docs/guides/docs/a.md");
        assertThat(resolved.exists()).isFalse();
    }

    @Test
    void resolve_fragmentAndQuery_areStripped() {
        assertThat(resolver.resolve("./b.md#usage", "docs/a.md").canonicalPath()).isEqualTo("docs/b.md");
        assertThat(resolver.resolve("b.md?plain=1", "docs/a.md").canonicalPath()).isEqualTo("docs/b.md");
    }

    @Test
    void resolve_climbingAboveBase_isUnresolvable() {
        ResolvedReference resolved = resolver.resolve("../../../outside.md", "docs/a.md");

        assertThat(resolved.unresolvable()).isTrue();
        assertThat(resolved.canonicalPath()).isNull();
        assertThat(resolved.exists()).isFalse();
    }

    @Test
    void resolve_nonMarkdownAsset_usesExistenceCheck() {
        assertThat(resolver.resolve("img/logo.png", "docs/a.md").exists()).isTrue();
    }

    @Test
    void resolve_existenceIsCheckedOnEveryCall() {
        Set<String> files = new HashSet<>();
        LinkResolver live = new LinkResolver("docs", files::contains);

        assertThat(live.resolve("b.md", "docs/a.md").exists()).isFalse();
        files.add("docs/b.md");
        assertThat(live.resolve("b.md", "docs/a.md").exists()).isTrue();
    }
}
