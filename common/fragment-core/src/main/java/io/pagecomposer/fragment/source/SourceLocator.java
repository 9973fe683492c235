package io.pagecomposer.fragment.source;

/**
 * Where a fragment's body comes from. A fragment without a locator carries inline data instead.
 */
public sealed interface SourceLocator permits RemoteUrl, LocalFilePath {

    static RemoteUrl remote(String base, String relative) {
        return new RemoteUrl(base, relative, null);
    }

    static RemoteUrl remote(String base) {
        return new RemoteUrl(base, (String) null, null);
    }

    static LocalFilePath localFile(String... parts) {
        return LocalFilePath.of(parts);
    }
}
