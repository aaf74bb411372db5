package io.github.drompincen.crewflow.runtime.lifecycle;

public class DecisionNotFoundException extends RuntimeException {

    public DecisionNotFoundException(String decisionId) {
        super("Decision not found: " + decisionId);
    }
}
