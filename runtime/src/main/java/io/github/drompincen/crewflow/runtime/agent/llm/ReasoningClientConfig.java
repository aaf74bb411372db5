package io.github.drompincen.crewflow.runtime.agent.llm;

import io.github.drompincen.crewflow.runtime.config.ReasoningProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReasoningClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ReasoningClientConfig.class);

    @Bean
    @ConditionalOnProperty(name = "crewflow.reasoning.provider", havingValue = "openai")
    ReasoningClient openAiReasoningClient(ReasoningProperties properties) {
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            throw new IllegalStateException("crewflow.reasoning.api-key is required for the openai provider");
        }
        OpenAiApi api = OpenAiApi.builder().apiKey(properties.getApiKey()).build();
        OpenAiChatModel chatModel = OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(properties.getModel())
                        .temperature(properties.getTemperature())
                        .maxTokens(properties.getMaxTokens())
                        .build())
                .build();
        log.info("Reasoning provider: openai ({})", properties.getModel());
        return new ChatModelReasoningClient(chatModel);
    }

    @Bean
    @ConditionalOnProperty(name = "crewflow.reasoning.provider", havingValue = "offline", matchIfMissing = true)
    ReasoningClient offlineReasoningClient() {
        log.info("Reasoning provider: offline");
        return new OfflineReasoningClient();
    }
}
