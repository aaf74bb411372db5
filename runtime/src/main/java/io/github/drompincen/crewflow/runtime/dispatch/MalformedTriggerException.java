package io.github.drompincen.crewflow.runtime.dispatch;

public class MalformedTriggerException extends NonRetriableException {

    public MalformedTriggerException(String message) {
        super(message);
    }
}
