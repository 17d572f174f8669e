package com.leanspec.sync.bridge.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

class SpecFileFormatTest {

    @Test
    void splitsFrontmatterFromBody() {
        SpecFileFormat.Document doc = SpecFileFormat.parse(
                "---\nstatus: planned\ntags: [a, b]\n---\n# Title\n\nText\n");

        assertThat(doc.frontmatter())
                .containsEntry("status", "planned")
                .containsEntry("tags", List.of("a", "b"));
        assertThat(doc.body()).isEqualTo("# Title\n\nText\n");
    }

    @Test
    void datesStayStrings() {
        SpecFileFormat.Document doc = SpecFileFormat.parse("---\ncreated: 2025-01-02\n---\nbody");

        assertThat(doc.frontmatter().get("created")).isEqualTo("2025-01-02");
    }

    @Test
    void nonStringKeysAreReadAsTheirText() {
        SpecFileFormat.Document doc = SpecFileFormat.parse("---\n1: one\ntrue: yes\nstatus: planned\n---\nbody");

        assertThat(doc.frontmatter())
                .containsEntry("1", "one")
                .containsEntry("true", true)
                .containsEntry("status", "planned");
    }

    @Test
    void fileWithoutFrontmatterIsAllBody() {
        SpecFileFormat.Document doc = SpecFileFormat.parse("# Just markdown\n");

        assertThat(doc.frontmatter()).isEmpty();
        assertThat(doc.body()).isEqualTo("# Just markdown\n");
    }

    @Test
    void unterminatedFrontmatterIsAllBody() {
        String text = "---\nstatus: planned\n# No closing delimiter\n";

        assertThat(SpecFileFormat.parse(text).frontmatter()).isEmpty();
        assertThat(SpecFileFormat.parse(text).body()).isEqualTo(text);
    }

    @Test
    void nonMappingFrontmatterIsRejected() {
        assertThatThrownBy(() -> SpecFileFormat.parse("---\n- a\n- b\n---\nbody"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void renderKeepsBodyAndReparsesToTheSameFrontmatter() {
        SpecFileFormat.Document doc = SpecFileFormat.parse(
                "---\nstatus: planned\ncreated: '2025-01-02'\ndepends_on:\n- 001-base\n---\n# T\nbody\n");
        doc.frontmatter().put("status", "complete");

        String rendered = SpecFileFormat.render(doc);

        assertThat(rendered).startsWith("---\n").endsWith("---\n# T\nbody\n");
        SpecFileFormat.Document reparsed = SpecFileFormat.parse(rendered);
        assertThat(reparsed.frontmatter())
                .containsEntry("status", "complete")
                .containsEntry("created", "2025-01-02")
                .containsEntry("depends_on", List.of("001-base"));
    }

    @Test
    void titleIsTheFirstLevelOneHeading() {
        assertThat(SpecFileFormat.title("intro\n## Sub\n# Main Title \n# Second")).isEqualTo("Main Title");
        assertThat(SpecFileFormat.title("no heading")).isNull();
    }
}
