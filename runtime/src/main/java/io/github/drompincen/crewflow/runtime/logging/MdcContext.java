package io.github.drompincen.crewflow.runtime.logging;

import org.slf4j.MDC;

/**
 * MDC keys attached to every log line written while a run executes.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String FUNCTION_ID = "functionId";
    public static final String AGENT_ID = "agentId";
    public static final String PROJECT_ID = "projectId";

    private MdcContext() {}

    public static void setRun(String runId, String functionId) {
        MDC.put(RUN_ID, runId);
        MDC.put(FUNCTION_ID, functionId);
    }

    public static void setAgent(String agentId, String projectId) {
        if (agentId != null) MDC.put(AGENT_ID, agentId);
        if (projectId != null) MDC.put(PROJECT_ID, projectId);
    }

    public static void setProject(String projectId) {
        if (projectId != null) MDC.put(PROJECT_ID, projectId);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(FUNCTION_ID);
        MDC.remove(AGENT_ID);
        MDC.remove(PROJECT_ID);
    }
}
