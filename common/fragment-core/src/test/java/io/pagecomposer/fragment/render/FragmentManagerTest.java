package io.pagecomposer.fragment.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pagecomposer.fragment.FetchOptions;
import io.pagecomposer.fragment.FragmentFactory;
import io.pagecomposer.fragment.FragmentFetcher;
import io.pagecomposer.fragment.FragmentOptions;
import io.pagecomposer.fragment.RenderContext;
import io.pagecomposer.fragment.Route;
import io.pagecomposer.fragment.error.UnknownFragmentReferenceException;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

class FragmentManagerTest {

    private final Route route = Route.builder()
        .path("/manager")
        .baseFragment(FragmentFactory.base(FragmentOptions.builder().data("<main></main>").build()))
        .fragment("header", FragmentFactory.html(FragmentOptions.builder().data("<header></header>").build()))
        .build();

    @Test
    void exposesBaseBodyAndContentType() {
        FragmentManager manager = new FragmentManager(route, new RecordingFetcher(), RenderContext.empty());

        assertThat(manager.baseBody().join()).isEqualTo("<main></main>");
        assertThat(manager.baseContentType().join()).isEqualTo("text/html");
    }

    @Test
    void baseFragmentIsAlwaysRequired() {
        FragmentManager manager = new FragmentManager(route, new RecordingFetcher(), RenderContext.empty());

        assertThat(manager.fragment("header").isRequired()).isFalse();
        assertThat(route.baseFragment().create().isRequired()).isTrue();
    }

    @Test
    void fetchesNamedFragmentsWithTheGivenOptions() {
        RecordingFetcher fetcher = new RecordingFetcher();
        FragmentManager manager = new FragmentManager(route, fetcher, RenderContext.empty());

        assertThat(manager.fragmentBody("header", FetchOptions.failFast()).join()).isEqualTo("<header></header>");
        assertThat(fetcher.calls()).singleElement()
            .satisfies(call -> assertThat(call.options().neverHandleError()).isTrue());
    }

    @Test
    void unknownNameFailsTheFuture() {
        FragmentManager manager = new FragmentManager(route, new RecordingFetcher(), RenderContext.empty());

        assertThat(manager.hasFragment("footer")).isFalse();
        assertThatThrownBy(() -> manager.fragmentBody("footer").join())
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(UnknownFragmentReferenceException.class);
    }

    @Test
    void fetcherExceptionsAndNullResultsBecomeFailedFutures() {
        FragmentFetcher throwing = (fragment, context, options) -> {
            throw new IllegalArgumentException("bad fragment");
        };
        FragmentFetcher silent = (fragment, context, options) -> null;

        assertThat(new FragmentManager(route, throwing, null).fetchBase()).isCompletedExceptionally();
        assertThatThrownBy(() -> new FragmentManager(route, silent, null).fetchBase().join())
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsRoutesWithoutBase() {
        Route redirect = Route.builder().path("/old").redirect("/new").build();

        assertThatThrownBy(() -> new FragmentManager(redirect, new RecordingFetcher(), RenderContext.empty()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
