package io.github.drompincen.crewflow.protocol.event;

public final class EventNames {

    public static final String THINK = "agent/think";
    public static final String PLANNING_CYCLE = "agent/planning.cycle";
    public static final String CRON = "engine/cron";

    private EventNames() {}
}
