package com.example.Orin.config;

import com.example.Orin.orchestration.GenerativeModel;
import com.example.Orin.orchestration.SpringAiGenerativeModel;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Configuration
public class AiConfig {

    /**
     * DeepSeek is the default chat model, OpenAI the alternative.
     * Models are looked up on every call, so the app starts even when an API key
     * is missing in some envs; a request then fails with ModelUnavailableException.
     */
    @Bean
    public GenerativeModel generativeModel(
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider,
            OrinProperties properties
    ) {
        return new SpringAiGenerativeModel(() -> {
            Map<String, ChatModel> models = new LinkedHashMap<>();
            deepSeekProvider.ifAvailable(model -> models.put("deepseek", model));
            openAiProvider.ifAvailable(model -> models.put("openai", model));
            return models;
        }, properties.getOrchestrator().getDefaultModel().toLowerCase(Locale.ROOT));
    }
}
