package com.flagship.mill_sync.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.mill_sync.common.Failure;
import com.flagship.mill_sync.common.FailureType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link RemoteApi} over HTTP.
 *
 * Replies may come wrapped in an envelope
 * {@code {"success": true, "data": ..., "message": ...}}; the data field is
 * unwrapped so callers always see the payload itself.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RestRemoteApi implements RemoteApi {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final RestClient remoteRestClient;
    private final SessionTokenHolder tokenHolder;
    private final ObjectMapper objectMapper;

    @Override
    public RemoteResult send(RemoteRequest request) {
        if (Thread.currentThread().isInterrupted()) {
            return RemoteResult.failure(Failure.of(FailureType.CANCELLED, "Sync cancelled before the call"));
        }
        try {
            RestClient.RequestBodySpec spec = remoteRestClient.method(request.getMethod())
                    .uri(request.getPath())
                    .headers(headers -> applyHeaders(headers, request));
            if (request.getBody() != null) {
                spec.contentType(MediaType.APPLICATION_JSON).body(request.getBody());
            }
            ResponseEntity<JsonNode> response = spec.retrieve().toEntity(JsonNode.class);

            log.debug("Remote {} {} -> {}", request.getMethod(), request.getPath(), response.getStatusCode().value());
            return RemoteResult.success(unwrap(response.getStatusCode().value(), response.getBody()));

        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            String message = errorMessage(e);
            log.debug("Remote {} {} rejected: status={}, message={}",
                    request.getMethod(), request.getPath(), status, message);
            return RemoteResult.failure(classifyStatus(status), message, status);

        } catch (ResourceAccessException e) {
            if (Thread.currentThread().isInterrupted()) {
                return RemoteResult.failure(Failure.of(FailureType.CANCELLED, "Sync cancelled during the call"));
            }
            log.debug("Remote {} {} unreachable: {}", request.getMethod(), request.getPath(), e.getMessage());
            return RemoteResult.failure(Failure.of(FailureType.NETWORK, e.getMessage()));

        } catch (RestClientException e) {
            log.warn("Unreadable reply from remote {} {}: {}", request.getMethod(), request.getPath(), e.getMessage());
            return RemoteResult.failure(Failure.of(FailureType.SERVER, e.getMessage()));
        }
    }

    static FailureType classifyStatus(int status) {
        if (status == 401 || status == 403) {
            return FailureType.AUTH;
        }
        if (status == 408 || status == 429) {
            return FailureType.NETWORK;
        }
        if (status == 409 || status == 410) {
            return FailureType.CONFLICT;
        }
        if (status >= 400 && status < 500) {
            return FailureType.VALIDATION;
        }
        return FailureType.SERVER;
    }

    private void applyHeaders(HttpHeaders headers, RemoteRequest request) {
        if (request.getIdempotencyKey() != null) {
            headers.set(IDEMPOTENCY_KEY_HEADER, request.getIdempotencyKey());
        }
        if (tokenHolder.hasToken()) {
            headers.setBearerAuth(tokenHolder.getToken());
        }
    }

    private RemoteResponse unwrap(int status, JsonNode body) {
        if (body != null && body.isObject() && body.has("success") && body.has("data")) {
            JsonNode message = body.get("message");
            return RemoteResponse.of(status, body.get("data"), message != null ? message.asText() : null);
        }
        return RemoteResponse.of(status, body, null);
    }

    private String errorMessage(RestClientResponseException e) {
        String raw = e.getResponseBodyAsString();
        if (raw.isBlank()) {
            return e.getStatusText();
        }
        try {
            JsonNode body = objectMapper.readTree(raw);
            JsonNode message = body.get("message");
            return message != null && !message.isNull() ? message.asText() : raw;
        } catch (JsonProcessingException parseFailure) {
            return raw;
        }
    }
}
