package io.pagecomposer.fragment;

import static org.assertj.core.api.Assertions.assertThat;

import io.pagecomposer.fragment.source.SourceLocator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FragmentTest {

    @Test
    void factoriesFixTheBodyType() {
        FragmentOptions options = FragmentOptions.builder().data("x").bodyType(BodyType.JSON).build();

        assertThat(FragmentFactory.html(options).create().bodyType()).isEqualTo(BodyType.HTML);
        assertThat(FragmentFactory.json(options).create().isJson()).isTrue();
        assertThat(FragmentFactory.base(options).create().bodyType()).isEqualTo(BodyType.JSON);
        assertThat(FragmentFactory.base(FragmentOptions.builder().data("x").build()).create().bodyType())
            .isEqualTo(BodyType.HTML);
    }

    @Test
    void classifiesTheSource() {
        Fragment remote = FragmentFactory.html(FragmentOptions.builder()
            .source(SourceLocator.remote("http://svc")).build()).create();
        Fragment file = FragmentFactory.html(FragmentOptions.builder()
            .source(SourceLocator.localFile("a.html")).build()).create();
        Fragment inline = FragmentFactory.html(FragmentOptions.builder().data(null).build()).create();
        Fragment empty = FragmentFactory.html(FragmentOptions.builder().build()).create();

        assertThat(remote.isRemote()).isTrue();
        assertThat(file.isFile()).isTrue();
        assertThat(inline.isLocalData()).isTrue();
        assertThat(inline.hasLocalData()).isTrue();
        assertThat(empty.isLocalData()).isTrue();
        assertThat(empty.hasLocalData()).isFalse();
    }

    @Test
    void normalisesOptions() {
        Fragment fragment = FragmentFactory.html(FragmentOptions.builder()
            .data("x")
            .method(" post ")
            .requiredData("a", "b", "a")
            .build()).create();

        assertThat(fragment.method()).isEqualTo("POST");
        assertThat(fragment.requiredData()).containsExactly("a", "b");
        assertThat(fragment.query()).isEmpty();
        assertThat(FragmentOptions.builder().build().method()).isEqualTo("GET");
    }

    @Test
    void defaultMessages() {
        Fragment fragment = Fragment.inline("{{ x }}", false);
        RuntimeException error = new RuntimeException("boom");

        assertThat(fragment.contentMissingMessage(error))
            .isEqualTo(new FragmentBody("<p>Sorry this content could not be fetched. Please try again.</p>", "text/html"));
        assertThat(fragment.renderErrorMessage(error))
            .isEqualTo("<p>Sorry this content could not be rendered. Please try again.</p>");
    }

    @Test
    void structuredMissingContentMessageIsJson() {
        Fragment fragment = FragmentFactory.json(FragmentOptions.builder()
            .source(SourceLocator.remote("http://svc"))
            .contentMissingMessage(FallbackMessage.literal(Map.of("items", List.of())))
            .build()).create();

        FragmentBody body = fragment.contentMissingMessage(new RuntimeException());

        assertThat(body.body()).isEqualTo(Map.of("items", List.of()));
        assertThat(body.contentType()).isEqualTo("application/json");
    }

    @Test
    void callbackMessagesReceiveTheError() {
        Fragment fragment = FragmentFactory.html(FragmentOptions.builder()
            .data("x")
            .renderErrorMessage(FallbackMessage.of(error -> "<p>" + error.getMessage() + "</p>"))
            .build()).create();

        assertThat(fragment.renderErrorMessage(new IllegalStateException("offline"))).isEqualTo("<p>offline</p>");
    }

    @Test
    void inlineFragmentsCarryTheirTemplate() {
        Fragment fragment = Fragment.inline("<p>{{ a }}</p>", true);

        assertThat(fragment.localData()).isEqualTo("<p>{{ a }}</p>");
        assertThat(fragment.isRequired()).isTrue();
        assertThat(fragment.type()).isEqualTo(FragmentType.HTML);
    }
}
