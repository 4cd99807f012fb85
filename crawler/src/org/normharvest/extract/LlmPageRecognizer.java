package org.normharvest.extract;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.Response;
import org.jetbrains.annotations.Nullable;
import org.normharvest.config.LlmConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * OCR through a multimodal chat model on an OpenAI-compatible API.
 */
public class LlmPageRecognizer implements PageRecognizer {
    private static final Logger log = LoggerFactory.getLogger(LlmPageRecognizer.class);
    private static final String DESCRIPTION_HEADER = "# Description:";
    private static final Pattern CODE_FENCE = Pattern.compile("\\A```[a-zA-Z]*\\s*\\n(.*?)\\n?```\\s*\\z",
            Pattern.DOTALL);
    private final ChatLanguageModel model;
    private final String prompt;

    public LlmPageRecognizer(LlmConfig config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.apiKey())
                .modelName(config.model())
                .timeout(Duration.ofMinutes(2))
                .maxRetries(1);
        if (config.baseUrl() != null && !config.baseUrl().isBlank()) {
            builder.baseUrl(config.baseUrl());
        }
        this.model = builder.build();
        this.prompt = config.prompt();
    }

    LlmPageRecognizer(ChatLanguageModel model, String prompt) {
        this.model = model;
        this.prompt = prompt;
    }

    /**
     * @return a recognizer for the configured model, or null when no API key is set
     */
    public static @Nullable PageRecognizer fromConfig(LlmConfig config) {
        if (!config.isEnabled()) {
            log.info("No LLM API key configured, OCR of scanned PDFs is disabled");
            return null;
        }
        log.info("OCR enabled using model {}", config.model());
        return new LlmPageRecognizer(config);
    }

    @Override
    public String recognize(byte[] png, int pageNumber) throws IOException {
        UserMessage message = UserMessage.from(
                TextContent.from(prompt),
                ImageContent.from(Base64.getEncoder().encodeToString(png), "image/png"));
        Response<AiMessage> response;
        try {
            response = model.generate(message);
        } catch (RuntimeException e) {
            throw new IOException("OCR of page " + pageNumber + " failed: " + e.getMessage(), e);
        }
        String text = response == null || response.content() == null ? null : response.content().text();
        log.debug("OCR of page {} returned {} chars", pageNumber, text == null ? 0 : text.length());
        return clean(text);
    }

    /**
     * Strips the wrapping some models put around their answer.
     */
    static String clean(@Nullable String text) {
        if (text == null) return "";
        String cleaned = text.replace("\n" + DESCRIPTION_HEADER + "\n", "\n").strip();
        if (cleaned.startsWith(DESCRIPTION_HEADER)) cleaned = cleaned.substring(DESCRIPTION_HEADER.length()).strip();
        var fence = CODE_FENCE.matcher(cleaned);
        if (fence.matches()) cleaned = fence.group(1).strip();
        return cleaned;
    }
}
