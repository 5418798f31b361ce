package com.williamcallahan.notepreview.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Builds the JSON bodies the preview endpoints answer with when they do not return a rendered
 * preview: rejected requests, failed renders and cache maintenance.
 */
@Component
public class PreviewResponseBuilder {

    /**
     * 400 response for a render request the endpoint cannot act on.
     */
    public ResponseEntity<Map<String, Object>> invalidRequest(String message) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("status", "error", "message", message));
    }

    /**
     * Response for a render that did not produce a preview. A render that ran past its deadline
     * answers 504; any other failure answers 500. Both carry the failure description.
     *
     * @param failure cause of the failed render, unwrapped from its completion exception
     * @return ResponseEntity with error details
     */
    public ResponseEntity<Map<String, Object>> renderFailure(Throwable failure) {
        boolean timedOut = failure instanceof TimeoutException;
        HttpStatus status = timedOut ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status)
            .body(Map.of(
                "status", "error",
                "message", timedOut ? "Preview render timed out" : "Failed to render preview",
                "details", describeException(failure)
            ));
    }

    /**
     * Confirms a cache clear.
     *
     * @param evictedDocuments documents cached before the clear
     */
    public ResponseEntity<Map<String, Object>> cacheCleared(long evictedDocuments) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("message", "Preview cache cleared");
        response.put("evicted", evictedDocuments);
        return ResponseEntity.ok(response);
    }

    /**
     * Describes an exception and its root cause for diagnostics.
     *
     * @param exception exception to describe
     * @return type and message of the exception, plus its root cause when different
     */
    public String describeException(Throwable exception) {
        if (exception == null) {
            return "";
        }
        Throwable root = exception;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String description = exception.getClass().getSimpleName() + ": " + exception.getMessage();
        if (root != exception) {
            description += " (cause " + root.getClass().getSimpleName() + ": " + root.getMessage() + ")";
        }
        return description;
    }
}
