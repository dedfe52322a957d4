package org.operaton.nostrpub;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.io.HttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.operaton.nostrpub.config.NostrPubProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Main Spring Boot application class for NostrPub.
 * NostrPub bridges Nostr relays and the ActivityPub fediverse: every Nostr key
 * appears as a fediverse actor and every fediverse actor gets a Nostr key.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(NostrPubProperties.class)
@Slf4j
public class NostrPubApplication {

    public static void main(String[] args) {
        SpringApplication.run(NostrPubApplication.class, args);
        log.info("NostrPub bridge started");
    }

    /**
     * REST template for talking to remote ActivityPub servers.
     * Redirects are not followed and non-2xx responses are returned instead of thrown,
     * so the delivery engine can decide about retries itself.
     */
    @Bean
    public RestTemplate restTemplate(NostrPubProperties properties) {
        HttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
            .setMaxConnTotal(200)
            .setMaxConnPerRoute(properties.getDelivery().getMaxConcurrencyPerDomain() * 2)
            .build();

        RequestConfig requestConfig = RequestConfig.custom()
            .setResponseTimeout(Timeout.of(properties.getDelivery().getRequestTimeout()))
            .build();

        HttpClient httpClient = HttpClientBuilder.create()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(requestConfig)
            .setUserAgent(properties.getUserAgent())
            .disableRedirectHandling()
            .build();

        RestTemplate restTemplate = new RestTemplate(new HttpComponentsClientHttpRequestFactory(httpClient));
        restTemplate.setErrorHandler(new DefaultResponseErrorHandler() {
            @Override
            protected boolean hasError(org.springframework.http.HttpStatusCode statusCode) {
                return false;
            }
        });
        return restTemplate;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
