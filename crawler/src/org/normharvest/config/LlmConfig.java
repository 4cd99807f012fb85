package org.normharvest.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jetbrains.annotations.Nullable;

/**
 * Multimodal model used to read scanned PDF pages.
 *
 * @param apiKey  provider API key. OCR is disabled without one
 * @param baseUrl OpenAI-compatible endpoint, the OpenAI API when unset
 * @param model   model name
 * @param prompt  instruction sent along with every page image
 */
public record LlmConfig(
        @Nullable String apiKey,
        @Nullable String baseUrl,
        String model,
        String prompt) {

    public static final String DEFAULT_MODEL = "gpt-4o-mini";
    public static final String DEFAULT_PROMPT = "Extraia todo o conteúdo da imagem. Retorne somente o conteúdo extraído";

    @JsonCreator
    public LlmConfig {
        if (model == null || model.isBlank()) model = DEFAULT_MODEL;
        if (prompt == null || prompt.isBlank()) prompt = DEFAULT_PROMPT;
    }

    public LlmConfig() {
        this(null, null, null, null);
    }

    @JsonIgnore
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "LlmConfig[apiKey=" + (isEnabled() ? "***" : null) + ", baseUrl=" + baseUrl + ", model=" + model +
               ", prompt=" + prompt + "]";
    }
}
