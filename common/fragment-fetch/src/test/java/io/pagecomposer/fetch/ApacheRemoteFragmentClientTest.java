package io.pagecomposer.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.util.Map;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.HttpClientResponseHandler;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.http.message.BasicClassicHttpResponse;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ApacheRemoteFragmentClientTest {

    private final HttpClient httpClient = mock(HttpClient.class);
    private final ApacheRemoteFragmentClient client = new ApacheRemoteFragmentClient(httpClient);

    @Test
    void sendsMethodUriAndHeadersAndReadsTheBody() throws Exception {
        respondWith(200, "{\"ok\":true}", ContentType.APPLICATION_JSON);
        RemoteRequest request = new RemoteRequest("POST", URI.create("http://svc/items?page=2"),
            Map.of("Authorization", "Bearer t"));

        RemoteResponse response = client.execute(request);

        assertThat(response.status()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("{\"ok\":true}");
        assertThat(response.contentType()).isEqualTo("application/json");
        ArgumentCaptor<ClassicHttpRequest> sent = ArgumentCaptor.forClass(ClassicHttpRequest.class);
        verify(httpClient).execute(sent.capture(), any(HttpClientResponseHandler.class));
        assertThat(sent.getValue().getMethod()).isEqualTo("POST");
        assertThat(sent.getValue().getUri()).isEqualTo(URI.create("http://svc/items?page=2"));
        assertThat(sent.getValue().getFirstHeader("Authorization").getValue()).isEqualTo("Bearer t");
    }

    @Test
    void nonSuccessStatusFailsWithTheStatus() throws Exception {
        respondWith(503, "down", ContentType.TEXT_PLAIN);

        assertThatThrownBy(() -> client.execute(new RemoteRequest("GET", URI.create("http://svc/"), Map.of())))
            .isInstanceOf(FragmentFetchException.class)
            .hasMessage("GET http://svc/ answered with status 503")
            .satisfies(error -> assertThat(((FragmentFetchException) error).status()).isEqualTo(503));
    }

    @Test
    void emptyResponseHasEmptyBodyAndNoContentType() throws Exception {
        BasicClassicHttpResponse response = new BasicClassicHttpResponse(204);
        when(httpClient.execute(any(ClassicHttpRequest.class), any(HttpClientResponseHandler.class)))
            .thenAnswer(invocation -> {
                HttpClientResponseHandler<?> handler = invocation.getArgument(1);
                return handler.handleResponse(response);
            });

        RemoteResponse result = client.execute(new RemoteRequest("GET", URI.create("http://svc/"), Map.of()));

        assertThat(result.body()).isEmpty();
        assertThat(result.contentType()).isNull();
    }

    private void respondWith(int status, String body, ContentType contentType) throws Exception {
        BasicClassicHttpResponse response = new BasicClassicHttpResponse(status);
        response.setEntity(new StringEntity(body, contentType));
        when(httpClient.execute(any(ClassicHttpRequest.class), any(HttpClientResponseHandler.class)))
            .thenAnswer(invocation -> {
                HttpClientResponseHandler<?> handler = invocation.getArgument(1);
                return handler.handleResponse(response);
            });
    }
}
