package com.duckql.exception;

import java.util.List;
import java.util.Map;

/**
 * Exception thrown for engine failures expected to resolve on retry:
 * lock contention, write-write conflicts and transient I/O.
 */
public class TransientEngineException extends DuckQLException {

    public TransientEngineException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public TransientEngineException(String message, Throwable cause, Map<String, Object> context) {
        super(message, ErrorKind.TRANSIENT_ENGINE_ERROR, context,
            List.of("The operation is retried automatically; if it keeps failing, reduce concurrent load"),
            cause);
    }
}
