package com.ammann.conversion.graph;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.conversion.converter.ConverterRegistry;
import com.ammann.conversion.enumeration.Format;
import com.ammann.conversion.model.ConversionPath;
import com.ammann.conversion.model.FormatPair;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("FormatGraph")
class FormatGraphTest {

    private final FormatGraph graph = FormatGraph.from(ConverterRegistry.defaults(), Set.of());

    @ParameterizedTest
    @CsvSource({
        "markdown, html, markdown->html",
        "text, pdf, text->html->pdf",
        "markdown, docx, markdown->html->docx",
        "pdf, html, pdf->text->html",
        "docx, markdown, docx->text->html->markdown",
        "pdf, docx, pdf->text->html->docx",
        "html, text, html->text"
    })
    @DisplayName("should find the shortest path with the default converters")
    void shouldResolveShortestPaths(String source, String target, String expected) {
        ConversionPath path = graph.resolve(Format.fromName(source), Format.fromName(target)).orElseThrow();

        assertThat(path.describe()).isEqualTo(expected);
    }

    @Test
    @DisplayName("should resolve identity to a zero-hop path")
    void shouldResolveIdentity() {
        assertThat(graph.resolve(Format.PDF, Format.PDF)).hasValueSatisfying(path -> {
            assertThat(path.isIdentity()).isTrue();
            assertThat(path.source()).isEqualTo(Format.PDF);
        });
    }

    @Test
    @DisplayName("should report unreachable targets as an empty result")
    void shouldReportMissingPath() {
        FormatGraph restricted = FormatGraph.from(
                ConverterRegistry.defaults(), Set.of(FormatPair.of(Format.HTML, Format.DOCX)));

        assertThat(restricted.resolve(Format.TEXT, Format.DOCX)).isEmpty();
        assertThat(restricted.resolve(Format.TEXT, Format.PDF)).isPresent();
        assertThat(restricted.hasEdge(FormatPair.of(Format.HTML, Format.DOCX))).isFalse();
    }

    @Test
    @DisplayName("should break ties by pivot priority, not by edge order")
    void shouldBreakTiesByPriority() {
        // two 2-hop routes from TEXT to PDF: via HTML and via MARKDOWN
        List<FormatPair> edges = List.of(
                FormatPair.of(Format.TEXT, Format.MARKDOWN),
                FormatPair.of(Format.MARKDOWN, Format.PDF),
                FormatPair.of(Format.TEXT, Format.HTML),
                FormatPair.of(Format.HTML, Format.PDF));

        FormatGraph forward = new FormatGraph(edges);
        FormatGraph reversed = new FormatGraph(List.of(edges.get(3), edges.get(2), edges.get(1), edges.get(0)));

        assertThat(forward.resolve(Format.TEXT, Format.PDF).orElseThrow().describe()).isEqualTo("text->html->pdf");
        assertThat(reversed.resolve(Format.TEXT, Format.PDF).orElseThrow().describe()).isEqualTo("text->html->pdf");
    }

    @Test
    @DisplayName("should prefer a direct edge over any pivot")
    void shouldPreferDirectEdge() {
        FormatGraph withDirect = new FormatGraph(List.of(
                FormatPair.of(Format.TEXT, Format.HTML),
                FormatPair.of(Format.HTML, Format.PDF),
                FormatPair.of(Format.TEXT, Format.PDF)));

        assertThat(withDirect.resolve(Format.TEXT, Format.PDF).orElseThrow().hopCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should list the formats that take part in an edge")
    void shouldListFormats() {
        assertThat(graph.formats()).containsExactlyInAnyOrder(Format.values());
        assertThat(new FormatGraph(List.of(FormatPair.of(Format.TEXT, Format.HTML))).formats())
                .containsExactly(Format.TEXT, Format.HTML);
    }
}
