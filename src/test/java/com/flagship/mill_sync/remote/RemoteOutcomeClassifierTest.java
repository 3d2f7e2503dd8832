package com.flagship.mill_sync.remote;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.flagship.mill_sync.common.FailureType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class RemoteOutcomeClassifierTest {

    private final RemoteOutcomeClassifier classifier = new RemoteOutcomeClassifier();

    private final RemoteRequest create = RemoteRequest.post("/customers", JsonNodeFactory.instance.objectNode(), "k");

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "NETWORK, TRANSIENT",
            "SERVER, TRANSIENT",
            "STORAGE, TRANSIENT",
            "AUTH, AUTH_REQUIRED",
            "VALIDATION, SEMANTIC_CONFLICT",
            "CONFLICT, SEMANTIC_CONFLICT",
            "NOT_FOUND, SEMANTIC_CONFLICT",
            "CANCELLED, CANCELLED"
    })
    void testFailureRouting(FailureType type, RemoteOutcome expected) {
        assertEquals(expected, classifier.classify(create, RemoteResult.failure(type, "scripted", 0)));
    }

    @Test
    @DisplayName("Success is success")
    void testSuccess() {
        RemoteResult ok = RemoteResult.success(RemoteResponse.ok(JsonNodeFactory.instance.objectNode()));
        assertEquals(RemoteOutcome.SUCCESS, classifier.classify(create, ok));
    }

    @Test
    @DisplayName("404 completes a delete but rejects a create")
    void testNotFound() {
        RemoteResult notFound = RemoteResult.failure(FailureType.VALIDATION, "Not Found", 404);

        assertEquals(RemoteOutcome.SUCCESS,
                classifier.classify(RemoteRequest.delete("/customers/srv-1", "k"), notFound));
        assertEquals(RemoteOutcome.SEMANTIC_CONFLICT, classifier.classify(create, notFound));
    }
}
