package io.github.drompincen.crewflow.runtime.dispatch;

public class StepExecutionException extends EngineException {

    private final String stepName;

    public StepExecutionException(String stepName, Throwable cause) {
        super("Step '" + stepName + "' failed: " + cause.getMessage(), cause);
        this.stepName = stepName;
    }

    public String getStepName() { return stepName; }
}
