package io.pagecomposer.fragment.source;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class PathParametersTest {

    private final Map<String, String> params = Map.of("a", "one", "b", "two");

    @Test
    void replacesPlaceholdersInEverySection() {
        assertThat(PathParameters.apply("/:a", params)).isEqualTo("/one");
        assertThat(PathParameters.apply(":a/:b", params)).isEqualTo("one/two");
        assertThat(PathParameters.apply(":a/foo", params)).isEqualTo("one/foo");
        assertThat(PathParameters.apply("/:a/foo:b", params)).isEqualTo("/one/footwo");
    }

    @Test
    void leavesLiteralPathsAlone() {
        assertThat(PathParameters.apply("a", params)).isEqualTo("a");
        assertThat(PathParameters.apply("/static/path/", params)).isEqualTo("/static/path/");
    }

    @Test
    void unknownParametersBecomeEmpty() {
        assertThat(PathParameters.apply("/users/:id/profile", params)).isEqualTo("/users//profile");
        assertThat(PathParameters.apply("/:a", null)).isEqualTo("/");
    }
}
