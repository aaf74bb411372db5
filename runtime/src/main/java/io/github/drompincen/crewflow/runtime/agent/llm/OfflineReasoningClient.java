package io.github.drompincen.crewflow.runtime.agent.llm;

/**
 * Used when no model provider is configured: every agent observes and does nothing.
 */
public class OfflineReasoningClient implements ReasoningClient {

    static final String RESPONSE = "{\"reasoning\":\"No reasoning model configured\","
            + "\"actions\":[{\"kind\":\"no_action\",\"reason\":\"Offline reasoning provider\"}]}";

    @Override
    public String complete(String systemPrompt, String prompt) {
        return RESPONSE;
    }
}
