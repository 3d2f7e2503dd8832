package com.flagship.mill_sync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client for the remote system of record.
 */
@Configuration
public class RemoteClientConfig {

    @Bean
    public RestClient remoteRestClient(RestClient.Builder builder, SyncProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getRemote().getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getRemote().getReadTimeout().toMillis());

        return builder
                .baseUrl(properties.getRemote().getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
