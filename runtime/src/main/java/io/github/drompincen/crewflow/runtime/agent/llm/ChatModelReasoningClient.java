package io.github.drompincen.crewflow.runtime.agent.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

public class ChatModelReasoningClient implements ReasoningClient {

    private static final Logger log = LoggerFactory.getLogger(ChatModelReasoningClient.class);

    private final ChatModel chatModel;

    public ChatModelReasoningClient(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public String complete(String systemPrompt, String prompt) {
        ChatResponse response = chatModel.call(new Prompt(List.of(new SystemMessage(systemPrompt), new UserMessage(prompt))));
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            log.warn("Chat model returned no output");
            return "";
        }
        String text = response.getResult().getOutput().getText();
        return text != null ? text : "";
    }
}
