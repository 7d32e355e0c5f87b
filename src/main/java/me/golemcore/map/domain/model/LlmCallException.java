package me.golemcore.map.domain.model;

/**
 * Raised by LLM adapters when a chat call fails. The message is prefixed with
 * a stable error code (see {@code LlmErrorClassifier}).
 */
public class LlmCallException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LlmCallException(String message) {
        super(message);
    }

    public LlmCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
