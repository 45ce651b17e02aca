package com.deepagent.core.llm;

import com.deepagent.core.run.AgentModel;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    @Bean
    @ConditionalOnMissingBean(AgentModel.class)
    public AgentModel agentModel(ChatModel chatModel, LlmProperties properties, ObjectMapper objectMapper,
                                 @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        log.info("Agent model initialized (base-url: {}, default model: {})", baseUrl, properties.getDefaultModel());
        return new SpringAiAgentModel(chatModel, properties, objectMapper);
    }
}
