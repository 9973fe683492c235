package io.pagecomposer.fragment;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FetchOptionsTest {

    @Test
    void defaultsLetTheFetcherSubstituteFallbacks() {
        assertThat(FetchOptions.defaults().neverHandleError()).isFalse();
    }

    @Test
    void failFastPropagatesEveryError() {
        assertThat(FetchOptions.failFast().neverHandleError()).isTrue();
        assertThat(FetchOptions.failFast()).isEqualTo(new FetchOptions(true));
    }
}
