package com.ciro.jstyle.tree;

import com.ciro.jstyle.StyleParseException;
import com.ciro.jstyle.StyleSheet;
import com.ciro.jstyle.StyleSheetFactory;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StyleTreeReaderTest {

    private final StyleTreeReader reader = new StyleTreeReader();

    @Test
    void mapsJsonToTaggedValues() {
        StyleLayer layer = reader.read("""
                {"color": "red", "zIndex": 3, "opacity": 0.5, "margin": null,
                 "background": ["red", "blue"], "&:hover": {"color": "blue"}}
                """);

        Map<String, StyleValue> e = layer.entries();
        assertThat(e.get("color")).isEqualTo(new StyleValue.Scalar("red"));
        assertThat(e.get("zIndex")).isEqualTo(new StyleValue.Scalar("3"));
        assertThat(e.get("opacity")).isEqualTo(new StyleValue.Scalar("0.5"));
        assertThat(e.get("margin")).isEqualTo(StyleValue.Absent.INSTANCE);
        assertThat(e.get("background")).isEqualTo(new StyleValue.ScalarArray(List.of(
                new StyleValue.Scalar("red"), new StyleValue.Scalar("blue"))));
        assertThat(e.get("&:hover")).isInstanceOf(StyleValue.NestedLayer.class);
    }

    @Test
    void jsonAndMapInputCompileToTheSameClass() {
        StyleSheet sheet = new StyleSheetFactory().create();

        String fromJson = sheet.registerStyle(reader.read("{\"color\":\"red\",\"@media print\":{\"color\":\"black\"}}"
                .getBytes(StandardCharsets.UTF_8)));
        String fromMap = sheet.registerStyle(Map.of("@media print", Map.of("color", "black"), "color", "red"));

        assertThat(fromJson).isEqualTo(fromMap);
    }

    @Test
    void oddScalarsArePassedThroughAsText() {
        StyleLayer layer = reader.read("{\"visible\": true, \"list\": [1, [2, 3], null]}");

        assertThat(layer.entries().get("visible")).isEqualTo(new StyleValue.Scalar("true"));
        assertThat(layer.entries().get("list")).isEqualTo(new StyleValue.ScalarArray(List.of(
                new StyleValue.Scalar("1"), new StyleValue.Scalar("2,3"), StyleValue.Absent.INSTANCE)));
    }

    @Test
    void objectsInsideArraysMatchMapInput() {
        StyleLayer fromJson = reader.read("{\"list\": [\"a\", {\"b\": \"c\"}], \"big\": 1e21}");
        StyleLayer fromMap = StyleLayer.of(Map.of("list", List.of("a", Map.of("b", "c")), "big", 1e21));

        assertThat(fromJson).isEqualTo(fromMap);
        assertThat(fromJson.entries().get("big")).isEqualTo(new StyleValue.Scalar("1e+21"));
    }

    @Test
    void rejectsNonObjectRoot() {
        assertThatThrownBy(() -> reader.read("[1, 2]"))
                .isInstanceOf(StyleParseException.class)
                .hasMessageContaining("ARRAY");
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> reader.read("{color: "))
                .isInstanceOf(StyleParseException.class)
                .hasCauseInstanceOf(java.io.IOException.class);
    }
}
