package io.pagecomposer.fragment.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pagecomposer.fragment.RenderContext;
import org.junit.jupiter.api.Test;

class RemoteUrlTest {

    private final RenderContext context = RenderContext.builder().param("id", "7").param("lang", "en").build();

    @Test
    void baseAloneResolvesToItself() {
        assertThat(SourceLocator.remote("http://header-service/header").resolve(context))
            .isEqualTo("http://header-service/header");
    }

    @Test
    void relativePartIsResolvedAgainstTheBase() {
        assertThat(SourceLocator.remote("http://svc/api/", "items/:id").resolve(context))
            .isEqualTo("http://svc/api/items/7");
        assertThat(SourceLocator.remote("http://svc/api/", "/:lang/home").resolve(context))
            .isEqualTo("http://svc/en/home");
    }

    @Test
    void relativePartMayBeComputed() {
        RemoteUrl url = new RemoteUrl("http://svc/", (ctx, base) -> "search/" + ctx.params().get("lang"), "Bearer t");

        assertThat(url.resolve(context)).isEqualTo("http://svc/search/en");
        assertThat(url.authorization()).isEqualTo("Bearer t");
    }

    @Test
    void toStringMasksTheAuthorization() {
        RemoteUrl url = new RemoteUrl("http://svc/", "a", "Bearer secret");

        assertThat(url.toString()).isEqualTo("Url.Remote(http://svc/, a, ***)").doesNotContain("secret");
    }

    @Test
    void rejectsBlankBase() {
        assertThatThrownBy(() -> SourceLocator.remote(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
