package io.pagecomposer.compose;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pagecomposer.fetch.ApacheRemoteFragmentClient;
import io.pagecomposer.fetch.DefaultFragmentFetcher;
import io.pagecomposer.fetch.RemoteFragmentClient;
import io.pagecomposer.fragment.FragmentFetcher;
import io.pagecomposer.fragment.render.FragmentComposer;
import io.pagecomposer.templating.PebbleTemplateRenderer;
import io.pagecomposer.templating.TemplateRenderer;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ComposeServiceProperties.class)
public class ComposeConfiguration {

    @Bean(destroyMethod = "close")
    CloseableHttpClient fragmentHttpClient(ComposeServiceProperties properties) {
        ComposeServiceProperties.Fetch fetch = properties.getFetch();
        PoolingHttpClientConnectionManager manager = new PoolingHttpClientConnectionManager();
        manager.setMaxTotal(fetch.getMaxConnections());
        manager.setDefaultMaxPerRoute(fetch.getMaxConnections());
        manager.setDefaultConnectionConfig(ConnectionConfig.custom()
            .setConnectTimeout(Timeout.ofMilliseconds(fetch.getConnectTimeout().toMillis()))
            .build());
        return HttpClients.custom()
            .setConnectionManager(manager)
            .setDefaultRequestConfig(RequestConfig.custom()
                .setResponseTimeout(Timeout.ofMilliseconds(fetch.getResponseTimeout().toMillis()))
                .build())
            .build();
    }

    @Bean(destroyMethod = "shutdown")
    ExecutorService fragmentFetchExecutor(ComposeServiceProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getFetch().getThreads(), runnable -> {
            Thread thread = new Thread(runnable, "fragment-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    RemoteFragmentClient remoteFragmentClient(CloseableHttpClient fragmentHttpClient) {
        return new ApacheRemoteFragmentClient(fragmentHttpClient);
    }

    @Bean
    FragmentFetcher fragmentFetcher(RemoteFragmentClient remoteFragmentClient,
                                    ObjectMapper objectMapper,
                                    ExecutorService fragmentFetchExecutor,
                                    ComposeServiceProperties properties) {
        return new DefaultFragmentFetcher(remoteFragmentClient, objectMapper, fragmentFetchExecutor,
            properties.getWorkingDirectory());
    }

    @Bean
    TemplateRenderer templateRenderer(ObjectMapper objectMapper) {
        return new PebbleTemplateRenderer(objectMapper);
    }

    @Bean
    FragmentComposer fragmentComposer(TemplateRenderer templateRenderer) {
        return new FragmentComposer(templateRenderer);
    }

    @Bean
    RouteCatalogue routeCatalogue(ComposeServiceProperties properties) {
        return RouteCatalogue.fromProperties(properties);
    }
}
