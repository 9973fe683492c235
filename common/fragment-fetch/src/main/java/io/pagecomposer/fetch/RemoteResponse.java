package io.pagecomposer.fetch;

/**
 * Successful answer of a remote fragment source.
 *
 * @param status      HTTP status code
 * @param body        decoded body text, empty when the response had no entity
 * @param contentType MIME type without parameters, or {@code null} when not sent
 */
public record RemoteResponse(int status, String body, String contentType) {
}
