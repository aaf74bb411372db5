package io.github.drompincen.crewflow.protocol.api;

public record PlanningCycleResult(
        CycleStatus status,
        long messagesExpired,
        int agentCount,
        boolean optimizerRan,
        boolean managerRan,
        int developersRan
) {}
