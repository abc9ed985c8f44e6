package com.tradecodes.classifier.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.util.concurrent.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.io.IOException;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Amazon Bedrock access for query embeddings and chat completions.
 * Throttling is retried here with exponential backoff; callers see either a result or an exception.
 */
@Service
public class BedrockModelService implements EmbeddingClient {

    private static final Logger logger = LoggerFactory.getLogger(BedrockModelService.class);

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final String chatModelId;
    private final String embeddingModelId;
    private final int maxTokens;
    private final int maxAttempts;
    private final RateLimiter chatRateLimiter;
    private final RateLimiter embedRateLimiter;

    /**
     * @param bedrockClient    shared runtime client with SDK retries disabled
     * @param objectMapper     JSON mapper for request and response bodies
     * @param chatModelId      model used for verification prompts
     * @param embeddingModelId model used for query embeddings
     * @param maxTokens        default completion budget
     * @param maxAttempts      calls made before throttling is surfaced
     */
    public BedrockModelService(BedrockRuntimeClient bedrockClient,
                               ObjectMapper objectMapper,
                               @Value("${aws.bedrock.modelId}") String chatModelId,
                               @Value("${aws.bedrock.embeddingModelId}") String embeddingModelId,
                               @Value("${app.bedrock.maxTokens:512}") int maxTokens,
                               @Value("${app.bedrock.maxAttempts:6}") int maxAttempts,
                               @Qualifier("chatRateLimiter") RateLimiter chatRateLimiter,
                               @Qualifier("embedRateLimiter") RateLimiter embedRateLimiter) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.chatModelId = chatModelId;
        this.embeddingModelId = embeddingModelId;
        this.maxTokens = Math.max(128, maxTokens);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.chatRateLimiter = chatRateLimiter;
        this.embedRateLimiter = embedRateLimiter;
        logger.info("BedrockModelService initialized with chat model {} and embedding model {}", chatModelId, embeddingModelId);
    }

    @Override
    public float[] embed(String text) {
        try {
            return generateEmbedding(text);
        } catch (IOException | ThrottledException | SdkClientException e) {
            throw new RetrievalFailureException("Embedding generation failed: " + e.getMessage(), e);
        }
    }

    /**
     * Generates a vector embedding for the provided text using the configured embedding model.
     *
     * @throws IOException when the Bedrock call fails or the response cannot be parsed
     */
    public float[] generateEmbedding(String text) throws IOException {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("inputText", text);

        InvokeModelRequest request = InvokeModelRequest.builder()
                .modelId(embeddingModelId)
                .contentType("application/json")
                .accept("application/json")
                .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(payload)))
                .build();

        try {
            embedRateLimiter.acquire();
            InvokeModelResponse response = invokeWithRetry(request, true);
            JsonNode embeddingNode = objectMapper.readTree(response.body().asUtf8String()).path("embedding");
            if (!embeddingNode.isArray() || embeddingNode.isEmpty()) {
                throw new IOException("Bedrock embedding response has no embedding array");
            }
            float[] embedding = new float[embeddingNode.size()];
            for (int i = 0; i < embeddingNode.size(); i++) {
                embedding[i] = embeddingNode.get(i).floatValue();
            }
            return embedding;
        } catch (BedrockRuntimeException e) {
            logger.error("Bedrock API error during embedding generation: {}", errorMessage(e), e);
            throw new IOException("Bedrock API error during embedding generation.", e);
        } catch (SdkClientException e) {
            logger.error("Bedrock client failure during embedding generation: {}", e.getMessage(), e);
            throw new IOException("Bedrock client failure during embedding generation.", e);
        }
    }

    /**
     * Calls Bedrock chat completion and returns the first text block, optionally overriding max tokens.
     *
     * @throws IOException when the call fails or the response has no text block
     */
    public String invokeChatForText(String content, Integer overrideMaxTokens) throws IOException {
        int tokens = overrideMaxTokens != null ? Math.max(64, overrideMaxTokens) : this.maxTokens;

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("anthropic_version", "bedrock-2023-05-31");
        payload.put("max_tokens", tokens);
        ArrayNode messages = payload.putArray("messages");
        ObjectNode userMessage = messages.addObject();
        userMessage.put("role", "user");
        userMessage.put("content", content);

        InvokeModelRequest request = InvokeModelRequest.builder()
                .modelId(chatModelId)
                .contentType("application/json")
                .accept("application/json")
                .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(payload)))
                .build();

        try {
            chatRateLimiter.acquire();
            InvokeModelResponse response = invokeWithRetry(request, false);
            JsonNode contentBlock = objectMapper.readTree(response.body().asUtf8String()).path("content");
            if (contentBlock.isArray() && !contentBlock.isEmpty()) {
                return stripFences(contentBlock.get(0).path("text").asText("").trim());
            }
            throw new IOException("Bedrock response missing content block");
        } catch (BedrockRuntimeException e) {
            logger.error("Bedrock API error during chat invoke for model {}: {}", chatModelId, errorMessage(e), e);
            throw new IOException("Bedrock API error during chat invoke", e);
        } catch (SdkClientException e) {
            // timeouts and connection failures never reach the service
            logger.error("Bedrock client failure during chat invoke for model {}: {}", chatModelId, e.getMessage(), e);
            throw new IOException("Bedrock client failure during chat invoke", e);
        }
    }

    private static String stripFences(String text) {
        String trimmed = text;
        if (trimmed.startsWith("```")) {
            int newline = trimmed.indexOf('\n');
            trimmed = newline > 0 ? trimmed.substring(newline + 1) : trimmed.substring(3);
            if (trimmed.endsWith("```")) {
                trimmed = trimmed.substring(0, trimmed.length() - 3);
            }
        }
        return trimmed.trim();
    }

    /**
     * Invokes Bedrock, backing off exponentially with jitter while the call is throttled.
     *
     * @param isEmbedding embedding calls use a shorter base backoff
     */
    private InvokeModelResponse invokeWithRetry(InvokeModelRequest request, boolean isEmbedding) {
        final long baseBackoffMs = isEmbedding ? 400L : 800L;

        for (int attempt = 1; ; attempt++) {
            try {
                return bedrockClient.invokeModel(request);
            } catch (BedrockRuntimeException e) {
                if (!isThrottling(e)) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    logger.warn("Bedrock throttled after {} attempts; surfacing throttling.", attempt);
                    throw new ThrottledException("Bedrock throttling after retries", attempt, e);
                }

                long jitter = ThreadLocalRandom.current().nextLong(50, 200);
                long sleepMs = (long) Math.min(10_000, baseBackoffMs * Math.pow(2, attempt - 1) + jitter);
                logger.warn("Bedrock throttled (attempt {}/{}). Backing off for {} ms. Error: {}",
                        attempt, maxAttempts, sleepMs, errorMessage(e));
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ThrottledException("Interrupted during Bedrock backoff", attempt, ie);
                }
            }
        }
    }

    private static boolean isThrottling(BedrockRuntimeException e) {
        String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
        return e.statusCode() == 429
                || "ThrottlingException".equalsIgnoreCase(code)
                || "TooManyRequestsException".equalsIgnoreCase(code)
                || "ProvisionedThroughputExceededException".equalsIgnoreCase(code);
    }

    private static String errorMessage(BedrockRuntimeException e) {
        return e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
    }
}
