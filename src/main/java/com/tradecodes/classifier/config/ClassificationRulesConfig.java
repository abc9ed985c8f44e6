package com.tradecodes.classifier.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;

@Configuration
@EnableConfigurationProperties(ClassifierProperties.class)
public class ClassificationRulesConfig {

    private static final Logger logger = LoggerFactory.getLogger(ClassificationRulesConfig.class);

    static final String TERM_DICTIONARY = "rules/term-dictionary.json";
    static final String CHAPTER_RULES = "rules/chapter-rules.json";
    static final String RERANKER_RULES = "rules/reranker-rules.json";
    static final String DIFFERENTIAL_TERMS = "rules/differential-terms.json";
    static final String SPECIFICITY_SIGNALS = "rules/specificity-signals.json";
    static final String SCORING_TERMS = "rules/scoring-terms.json";

    @Bean
    public ClassificationRules classificationRules(ObjectMapper objectMapper) {
        return load(objectMapper);
    }

    /**
     * Reads every rule table from the classpath.
     *
     * @throws IllegalStateException when a table is missing or malformed
     */
    public static ClassificationRules load(ObjectMapper objectMapper) {
        ClassificationRules rules = new ClassificationRules(
                read(objectMapper, TERM_DICTIONARY, ClassificationRules.TermDictionary.class),
                read(objectMapper, CHAPTER_RULES, ClassificationRules.ChapterRules.class),
                read(objectMapper, RERANKER_RULES, ClassificationRules.RerankerRules.class),
                read(objectMapper, DIFFERENTIAL_TERMS, ClassificationRules.DifferentialTerms.class),
                read(objectMapper, SPECIFICITY_SIGNALS, ClassificationRules.SpecificitySignals.class),
                read(objectMapper, SCORING_TERMS, ClassificationRules.ScoringTerms.class));
        logger.info("Loaded classification rules: {} chapters, {} override rules, {} ambiguous terms, {} finished-product keywords",
                rules.chapterRules().chapters().size(),
                rules.chapterRules().functionalOverrides().size(),
                rules.chapterRules().ambiguousTerms().size(),
                rules.rerankerRules().finishedProductKeywords().size());
        return rules;
    }

    private static <T> T read(ObjectMapper objectMapper, String path, Class<T> type) {
        ClassPathResource resource = new ClassPathResource(path);
        try (InputStream in = resource.getInputStream()) {
            T value = objectMapper.readValue(in, type);
            if (value == null) {
                throw new IllegalStateException("Rule table " + path + " is empty");
            }
            return value;
        } catch (IOException e) {
            logger.error("Failed to load rule table {}: {}", path, e.getMessage());
            throw new IllegalStateException("Unable to load rule table " + path, e);
        }
    }
}
