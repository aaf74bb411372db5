package io.github.drompincen.crewflow.runtime.agent.llm;

public interface ReasoningClient {

    /**
     * Sends one system prompt and one user prompt, returns the raw model text.
     */
    String complete(String systemPrompt, String prompt);
}
