package com.campaignkeeper.collaborator;

import dev.langchain4j.exception.HttpException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Failure classes for external collaborators. The core never retries a collaborator call; it only
 * reports which of these happened so the caller can decide whether to offer the turn again.
 */
public enum CollaboratorFailure {
    TIMEOUT(true),
    RATE_LIMITED(true),
    UNAVAILABLE(true),
    REJECTED(false),
    MALFORMED_RESPONSE(true);

    private final boolean retryable;

    CollaboratorFailure(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Classifies an exception thrown by a collaborator, walking its cause chain.
     */
    public static CollaboratorFailure classify(Throwable error) {
        List<Throwable> chain = new ArrayList<>();
        Throwable current = error;
        while (current != null && chain.size() < 20 && !chain.contains(current)) {
            chain.add(current);
            current = current.getCause();
        }

        for (Throwable cause : chain) {
            if (cause instanceof HttpException http) {
                int status = http.statusCode();
                if (status == 429) {
                    return RATE_LIMITED;
                }
                if (status == 408 || status == 504) {
                    return TIMEOUT;
                }
                if (status >= 500) {
                    return UNAVAILABLE;
                }
                if (status >= 400) {
                    return REJECTED;
                }
            }
            if (cause instanceof TimeoutException || cause instanceof SocketTimeoutException
                || cause instanceof HttpTimeoutException) {
                return TIMEOUT;
            }
        }

        StringBuilder messages = new StringBuilder();
        for (Throwable cause : chain) {
            if (cause.getMessage() != null) {
                messages.append(cause.getMessage().toLowerCase(Locale.ROOT)).append(" | ");
            }
        }
        String text = messages.toString();
        if (text.contains("rate limit") || text.contains("too many requests")) {
            return RATE_LIMITED;
        }
        if (text.contains("timed out") || text.contains("timeout")) {
            return TIMEOUT;
        }
        return UNAVAILABLE;
    }
}
