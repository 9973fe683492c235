package io.pagecomposer.fragment;

/**
 * Per-call hints handed to a {@link FragmentFetcher}.
 *
 * @param neverHandleError when set the fetcher must fail instead of substituting a fallback body
 */
public record FetchOptions(boolean neverHandleError) {

    private static final FetchOptions DEFAULTS = new FetchOptions(false);
    private static final FetchOptions FAIL_FAST = new FetchOptions(true);

    public static FetchOptions defaults() {
        return DEFAULTS;
    }

    /** Options that make the fetcher propagate every failure. */
    public static FetchOptions failFast() {
        return FAIL_FAST;
    }
}
