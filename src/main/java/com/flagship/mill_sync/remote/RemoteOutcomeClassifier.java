package com.flagship.mill_sync.remote;

import org.springframework.stereotype.Component;

/**
 * Routes remote results to the record transition they call for.
 *
 * Network errors, timeouts, throttling and 5xx are transient and retried
 * with backoff. Rejected payloads (400/422), duplicates and stale versions
 * (409/410) are semantic conflicts: the same payload would be rejected
 * forever, so they never consume the retry budget.
 */
@Component
public class RemoteOutcomeClassifier {

    public RemoteOutcome classify(RemoteRequest request, RemoteResult result) {
        if (result.isSuccess()) {
            return RemoteOutcome.SUCCESS;
        }
        Integer status = result.getFailure().getStatusCode();
        if (request.isNotFoundIsSuccess() && status != null && status == 404) {
            return RemoteOutcome.SUCCESS;
        }
        return switch (result.getFailure().getType()) {
            case NETWORK, SERVER, STORAGE -> RemoteOutcome.TRANSIENT;
            case AUTH -> RemoteOutcome.AUTH_REQUIRED;
            case VALIDATION, CONFLICT, NOT_FOUND -> RemoteOutcome.SEMANTIC_CONFLICT;
            case CANCELLED -> RemoteOutcome.CANCELLED;
        };
    }
}
