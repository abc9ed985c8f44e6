package com.tradecodes.classifier.service;

import com.tradecodes.classifier.config.ClassifierProperties;
import com.tradecodes.classifier.model.Candidate;
import com.tradecodes.classifier.model.CompletionVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the chat model to pick one of the shortlisted codes.
 */
@Service
public class BedrockCompletionService implements CompletionService {

    private static final Logger logger = LoggerFactory.getLogger(BedrockCompletionService.class);

    private static final Pattern CODE_LINE = Pattern.compile("CODE:\\s*(\\d{4}(?:\\.\\d{2}){0,2})");
    private static final Pattern CONFIDENCE_LINE = Pattern.compile("CONFIDENCE:\\s*([\\d.]+)");
    private static final Pattern REASONING_LINE = Pattern.compile("REASONING:\\s*(.+)");
    private static final double DEFAULT_CONFIDENCE = 0.7;

    private final BedrockModelService bedrockModelService;
    private final int candidateLimit;
    private final String promptTemplate;

    public BedrockCompletionService(BedrockModelService bedrockModelService, ClassifierProperties properties) {
        this.bedrockModelService = bedrockModelService;
        this.candidateLimit = properties.getDecision().getVerificationCandidates();
        this.promptTemplate = loadPromptTemplate();
    }

    @Override
    public CompletionVerdict verify(String query, List<Candidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new VerificationFailureException("No candidates to verify");
        }
        String prompt = buildPrompt(query, candidates);
        String response;
        try {
            response = bedrockModelService.invokeChatForText(prompt, 150);
        } catch (IOException | ThrottledException | SdkClientException e) {
            throw new VerificationFailureException("Verification call failed: " + e.getMessage(), e);
        }
        CompletionVerdict verdict = parseVerdict(response);
        logger.debug("Verification picked {} at {} for '{}'", verdict.code(), verdict.confidence(), query);
        return verdict;
    }

    String buildPrompt(String query, List<Candidate> candidates) {
        StringBuilder list = new StringBuilder();
        int n = Math.min(candidateLimit, candidates.size());
        for (int i = 0; i < n; i++) {
            Candidate c = candidates.get(i);
            if (i > 0) {
                list.append('\n');
            }
            list.append(i + 1).append(". ").append(c.code()).append(": ").append(c.description())
                    .append(String.format(Locale.ROOT, " (%.1f%%)", c.similarity() * 100));
        }
        return promptTemplate
                .replace("{query}", query == null ? "" : query)
                .replace("{candidates}", list.toString());
    }

    /**
     * Reads the CODE / CONFIDENCE / REASONING lines. Confidence above 1 is treated as a percentage.
     */
    static CompletionVerdict parseVerdict(String text) {
        if (text == null) {
            throw new VerificationFailureException("Empty verification response");
        }
        Matcher code = CODE_LINE.matcher(text);
        if (!code.find()) {
            throw new VerificationFailureException("Verification response has no code");
        }
        double confidence = DEFAULT_CONFIDENCE;
        Matcher conf = CONFIDENCE_LINE.matcher(text);
        if (conf.find()) {
            try {
                confidence = Double.parseDouble(conf.group(1));
            } catch (NumberFormatException e) {
                logger.debug("Unparseable confidence '{}', using default", conf.group(1));
            }
        }
        if (confidence > 1) {
            confidence = confidence / 100.0;
        }
        Matcher reason = REASONING_LINE.matcher(text);
        String reasoning = reason.find() ? reason.group(1).trim() : "Model verified";
        return new CompletionVerdict(code.group(1), Math.max(0, Math.min(1, confidence)), reasoning);
    }

    private String loadPromptTemplate() {
        try {
            ClassPathResource resource = new ClassPathResource("prompts/verification_prompt.txt");
            byte[] bytes = resource.getInputStream().readAllBytes();
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("Failed to load verification prompt template: {}", e.getMessage());
            return "Expert HS classifier. Select best code for: \"{query}\"\n\nCandidates:\n{candidates}\n\n"
                    + "Rules: Function over material, prefer 8-digit, avoid \"Other\".\n\n"
                    + "Respond:\nCODE: [code]\nCONFIDENCE: [0-1]\nREASONING: [one line]";
        }
    }
}
