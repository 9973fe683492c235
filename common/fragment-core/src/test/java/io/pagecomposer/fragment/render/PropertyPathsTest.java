package io.pagecomposer.fragment.render;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PropertyPathsTest {

    private final Map<String, Object> data = Map.of(
        "basket", Map.of("items", List.of(Map.of("name", "tea"), Map.of("name", "milk"))),
        "codes", new String[] {"a", "b"});

    @Test
    void rootIsTheFirstSegment() {
        assertThat(PropertyPaths.root("basket.items")).isEqualTo("basket");
        assertThat(PropertyPaths.root("basket[0].name")).isEqualTo("basket");
        assertThat(PropertyPaths.root("basket")).isEqualTo("basket");
    }

    @Test
    void walksMapsListsAndArrays() {
        assertThat(PropertyPaths.get(data, "basket.items.1.name")).isEqualTo("milk");
        assertThat(PropertyPaths.get(data, "basket.items[0].name")).isEqualTo("tea");
        assertThat(PropertyPaths.get(data, "codes.1")).isEqualTo("b");
    }

    @Test
    void missingStepsYieldNull() {
        assertThat(PropertyPaths.get(data, "basket.total.amount")).isNull();
        assertThat(PropertyPaths.get(data, "basket.items.5")).isNull();
        assertThat(PropertyPaths.get(data, "basket.items.name")).isNull();
    }

    @Test
    void onlyCollectionsAndArraysAreSequences() {
        assertThat(PropertyPaths.sequence(List.of(1, 2))).containsExactly(1, 2);
        assertThat(PropertyPaths.sequence(new int[] {3, 4})).containsExactly(3, 4);
        assertThat(PropertyPaths.sequence("text")).isEmpty();
        assertThat(PropertyPaths.sequence(Map.of("a", 1))).isEmpty();
        assertThat(PropertyPaths.sequence(null)).isEmpty();
    }
}
