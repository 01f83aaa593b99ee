package com.nei10u.taxmusr.oracle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 基于 Spring AI ChatClient 的生成实现（OpenAI 或兼容 OpenAI 协议的路由）。
 */
@Component
public class SpringAiGenerationOracle implements GenerationOracle {
    private static final Logger log = LoggerFactory.getLogger(SpringAiGenerationOracle.class);

    private final ChatClient chatClient;

    public SpringAiGenerationOracle(ChatClient.Builder builder) {
        this.chatClient = builder.build();
    }

    @Override
    public OracleResponse generate(String template, Map<String, Object> variables, GenerationSettings settings) {
        String prompt = new PromptTemplate(template).render(variables);
        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(settings.model())
                .temperature(settings.temperature())
                .topP(settings.topP())
                .maxTokens(settings.maxTokens())
                .build();

        ChatResponse response = chatClient.prompt().user(prompt).options(options).call().chatResponse();
        String text = "";
        if (response != null && response.getResult() != null && response.getResult().getOutput() != null) {
            String raw = response.getResult().getOutput().getText();
            text = raw == null ? "" : raw;
        }
        log.debug("oracle raw: {}", abbreviate(text));
        return new OracleResponse(text, usageOf(response));
    }

    private TokenUsage usageOf(ChatResponse response) {
        if (response == null || response.getMetadata() == null) {
            return TokenUsage.empty();
        }
        Usage usage = response.getMetadata().getUsage();
        if (usage == null) {
            return TokenUsage.empty();
        }
        return new TokenUsage(usage.getPromptTokens(), usage.getCompletionTokens(), usage.getTotalTokens());
    }

    private String abbreviate(String raw) {
        String clean = raw.replaceAll("\\s+", " ");
        return clean.length() > 200 ? clean.substring(0, 200) + "..." : clean;
    }
}
