package io.github.drompincen.crewflow.protocol.api;

public enum DecisionKind {
    TASK_REASSIGNMENT,
    DEADLINE_EXTENSION,
    HELP_REQUEST,
    WORKLOAD_REBALANCE,
    BLOCKER_ESCALATION,
    REVIEW_ASSIGNMENT,
    SPRINT_REPLANNING,
    BURNOUT_ALERT
}
