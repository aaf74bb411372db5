package io.github.drompincen.crewflow.runtime.dispatch;

/**
 * Fails the run immediately, whatever retry budget remains.
 */
public class NonRetriableException extends EngineException {

    public NonRetriableException(String message) {
        super(message);
    }

    public NonRetriableException(String message, Throwable cause) {
        super(message, cause);
    }
}
