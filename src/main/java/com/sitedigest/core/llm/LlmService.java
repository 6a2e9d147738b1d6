package com.sitedigest.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Typed model calls over Spring AI's {@link ChatClient}.
 * <p>
 * The target class's JSON schema (from {@link BeanOutputConverter}) is appended
 * to the user prompt. If the converter cannot read the reply, a lenient Jackson
 * mapper gets a second try on the fence-stripped text before the call is
 * reported as a parse failure.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private static final Pattern CODE_FENCE = Pattern.compile("^```[A-Za-z]*\\s*(.*?)\\s*```$", Pattern.DOTALL);

    private final ChatClient chatClient;
    private final ObjectMapper lenientMapper;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.lenientMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .registerModule(new ParameterNamesModule());
        log.info("LlmService initialized, OpenAI base-url: {}", baseUrl);
    }

    /**
     * One system + user exchange whose reply must decode as {@code outputType}.
     *
     * @param outputType record or bean the reply is read into
     * @throws LlmEmptyResponseException if the model returns no content
     * @throws LlmParseException         if the content is not valid JSON for {@code outputType}
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.debug("Model reply for {} after {} ms", outputType.getSimpleName(), elapsed);

        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName());
        }
        try {
            T result = converter.convert(response);
            if (result != null) {
                return result;
            }
        } catch (Exception e) {
            log.debug("BeanOutputConverter rejected response for {}: {}", outputType.getSimpleName(), e.getMessage());
        }
        return readLeniently(response, outputType);
    }

    /** Unwraps a reply given as a markdown code block, with or without a language tag. */
    static String stripCodeFence(String raw) {
        Matcher fenced = CODE_FENCE.matcher(raw.trim());
        return fenced.matches() ? fenced.group(1) : raw.trim();
    }

    private <T> T readLeniently(String json, Class<T> outputType) {
        try {
            T result = lenientMapper.readValue(stripCodeFence(json), outputType);
            if (result == null) {
                throw new LlmParseException("LLM response for " + outputType.getSimpleName() + " was JSON null");
            }
            return result;
        } catch (LlmParseException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Failed to parse LLM response to {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", json);
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }
}
