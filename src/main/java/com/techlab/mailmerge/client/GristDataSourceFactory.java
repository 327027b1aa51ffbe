package com.techlab.mailmerge.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.techlab.mailmerge.exception.InvalidInputException;
import com.techlab.mailmerge.model.DataSourceCredentials;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.function.Function;

/**
 * Builds a Grist data source for the credentials of one request. Nothing is kept between
 * requests.
 *
 * <p>Each source gets two clients on the same server and API key: one with the regular read
 * timeout, one with the longer timeout used for full-table reads.
 */
@Component
public class GristDataSourceFactory implements TabularDataSourceFactory {

    private final RestClient.Builder restClientBuilder;
    private final ObjectMapper objectMapper;
    private final String server;
    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final Duration largeReadTimeout;
    private final Function<ClientHttpRequestFactorySettings, ClientHttpRequestFactory> requestFactories;

    @Autowired
    public GristDataSourceFactory(RestClient.Builder restClientBuilder,
                                  ObjectMapper objectMapper,
                                  @Value("${mailmerge.grist.server:https://grist.numerique.gouv.fr}") String server,
                                  @Value("${mailmerge.grist.connect-timeout-ms:10000}") long connectTimeoutMs,
                                  @Value("${mailmerge.grist.read-timeout-ms:30000}") long readTimeoutMs,
                                  @Value("${mailmerge.grist.large-read-timeout-ms:60000}") long largeReadTimeoutMs) {
        this(restClientBuilder, objectMapper, server, connectTimeoutMs, readTimeoutMs, largeReadTimeoutMs,
                ClientHttpRequestFactories::get);
    }

    GristDataSourceFactory(RestClient.Builder restClientBuilder,
                           ObjectMapper objectMapper,
                           String server,
                           long connectTimeoutMs,
                           long readTimeoutMs,
                           long largeReadTimeoutMs,
                           Function<ClientHttpRequestFactorySettings, ClientHttpRequestFactory> requestFactories) {
        this.restClientBuilder = restClientBuilder;
        this.objectMapper = objectMapper;
        this.server = server.endsWith("/") ? server.substring(0, server.length() - 1) : server;
        this.connectTimeout = Duration.ofMillis(connectTimeoutMs);
        this.readTimeout = Duration.ofMillis(readTimeoutMs);
        this.largeReadTimeout = Duration.ofMillis(largeReadTimeoutMs);
        this.requestFactories = requestFactories;
    }

    @Override
    public TabularDataSource connect(DataSourceCredentials credentials) {
        if (credentials == null || isBlank(credentials.getApiKey()) || isBlank(credentials.getDocId())) {
            throw new InvalidInputException("API key and document id are required");
        }
        return new GristDataSource(
                client(credentials.getApiKey(), readTimeout),
                client(credentials.getApiKey(), largeReadTimeout),
                objectMapper,
                credentials.getDocId());
    }

    private RestClient client(String apiKey, Duration timeout) {
        ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(connectTimeout)
                .withReadTimeout(timeout);
        return restClientBuilder.clone()
                .baseUrl(server)
                .requestFactory(requestFactories.apply(settings))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
