package io.pagecomposer.fetch;

import java.io.IOException;

/**
 * Transport for remote fragments. Implementations fail with {@link FragmentFetchException} when the
 * source answers with a non-success status.
 */
public interface RemoteFragmentClient {

    RemoteResponse execute(RemoteRequest request) throws IOException;
}
