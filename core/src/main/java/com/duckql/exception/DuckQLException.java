package com.duckql.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Base class for every error surfaced by the query engine.
 *
 * <p>Each error carries:
 * <ul>
 *   <li>a message</li>
 *   <li>a stable {@link ErrorKind}</li>
 *   <li>contextual fields (table, column, SQL, ...) in insertion order</li>
 *   <li>actionable suggestions</li>
 *   <li>a correlation identifier shared by all attempts and log lines of
 *       the originating request</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       engine.execute(request);
 *   } catch (DuckQLException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println(e.getTechnicalMessage());
 *   }
 * </pre>
 */
public abstract class DuckQLException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> context;
    private final List<String> suggestions;
    private volatile String correlationId;

    protected DuckQLException(String message, ErrorKind kind,
                              Map<String, Object> context, List<String> suggestions,
                              Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.context = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
        this.suggestions = suggestions != null ? new ArrayList<>(suggestions) : new ArrayList<>();
        this.correlationId = newCorrelationId();
    }

    /**
     * Generates a fresh correlation identifier.
     *
     * @return a new identifier of the form {@code q_xxxxxxxxxxxx}
     */
    public static String newCorrelationId() {
        return "q_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Returns the stable error code, e.g. {@code VALIDATION_ERROR}.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return kind.code();
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    public List<String> getSuggestions() {
        return Collections.unmodifiableList(suggestions);
    }

    public String getCorrelationId() {
        return correlationId;
    }

    /**
     * Ties this error to the request that produced it.
     *
     * <p>Errors raised below the engine (compiler, classifier) are created
     * before the request identifier is known to them; the engine rebinds
     * them before surfacing.
     *
     * @param correlationId the request correlation identifier
     * @return this exception
     */
    public DuckQLException withCorrelationId(String correlationId) {
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId must not be null");
        return this;
    }

    /**
     * Returns whether the failure is expected to resolve on retry.
     *
     * @return true for retryable kinds
     */
    public boolean isRetryable() {
        return kind.isRetryable();
    }

    protected void putContext(String key, Object value) {
        if (value != null) {
            context.put(key, value);
        }
    }

    protected void addSuggestion(String suggestion) {
        suggestions.add(suggestion);
    }

    /**
     * Returns a short message suitable for end users.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        return getMessage();
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(getErrorCode()).append("] ").append(getMessage()).append("\n");

        if (!context.isEmpty()) {
            sb.append("Context: ").append(context).append("\n");
        }

        if (!suggestions.isEmpty()) {
            sb.append("Suggestions:\n");
            for (int i = 0; i < suggestions.size(); i++) {
                sb.append("  ").append(i + 1).append(". ").append(suggestions.get(i)).append("\n");
            }
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        sb.append("Correlation ID: ").append(correlationId);
        return sb.toString();
    }

    /**
     * Returns the error as a map suitable for JSON serialization by an
     * external presentation layer.
     *
     * @return error, message, context, suggestions and correlation_id entries
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("error", getErrorCode());
        map.put("message", getMessage());
        map.put("context", getContext());
        map.put("suggestions", getSuggestions());
        map.put("correlation_id", correlationId);
        return map;
    }
}
