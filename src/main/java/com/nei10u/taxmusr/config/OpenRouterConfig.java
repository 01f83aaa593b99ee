package com.nei10u.taxmusr.config;

import com.nei10u.taxmusr.oracle.GenerationSettings;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * 生成能力的接入配置：OpenAI 或任何兼容 OpenAI 协议的路由（如 OpenRouter）。
 */
@Configuration
public class OpenRouterConfig {

    @Value("${spring.ai.openai.api-key}")
    private String apiKey;

    @Value("${spring.ai.openai.base-url}")
    private String baseUrl;

    @Value("${spring.ai.openai.chat.options.model}")
    private String model;

    @Value("${taxmusr.openai.completions-path:/v1/chat/completions}")
    private String completionsPath;

    @Value("${taxmusr.openai.headers.http-referer:}")
    private String httpReferer;

    @Value("${taxmusr.openai.headers.x-title:}")
    private String xTitle;

    @Bean
    @Primary
    public OpenAiApi openAiApi() {
        return OpenAiApi.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .completionsPath(completionsPath) // OpenRouter 的 base-url 已包含 /api/v1，需设为 /chat/completions
                .build();
    }

    @Bean
    @Primary
    public OpenAiChatModel openAiChatModel(OpenAiApi openAiApi) {
        // 路由服务用于统计来源的可选头部
        Map<String, String> httpHeaders = new HashMap<>();
        if (StringUtils.hasText(httpReferer)) {
            httpHeaders.put("HTTP-Referer", httpReferer);
        }
        if (StringUtils.hasText(xTitle)) {
            httpHeaders.put("X-Title", xTitle);
        }

        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(model)
                .httpHeaders(httpHeaders)
                .build();

        return OpenAiChatModel.builder()
                .openAiApi(openAiApi)
                .defaultOptions(options)
                .build();
    }

    /**
     * 每次生成调用使用的参数，model 为空时沿用 spring.ai.openai.chat.options.model。
     */
    @Bean
    public GenerationSettings generationSettings(
            @Value("${taxmusr.generation.model:}") String generationModel,
            @Value("${taxmusr.generation.temperature:1.0}") double temperature,
            @Value("${taxmusr.generation.top-p:1.0}") double topP,
            @Value("${taxmusr.generation.max-tokens:2048}") int maxTokens) {
        String effectiveModel = StringUtils.hasText(generationModel) ? generationModel : model;
        return new GenerationSettings(effectiveModel, temperature, topP, maxTokens);
    }
}
