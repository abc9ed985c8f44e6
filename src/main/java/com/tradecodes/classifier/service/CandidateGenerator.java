package com.tradecodes.classifier.service;

import com.tradecodes.classifier.config.ClassificationRules;
import com.tradecodes.classifier.config.ClassifierProperties;
import com.tradecodes.classifier.model.Candidate;
import com.tradecodes.classifier.model.CandidateSource;
import com.tradecodes.classifier.model.CatalogEntry;
import com.tradecodes.classifier.model.ChapterPredictionResult;
import com.tradecodes.classifier.model.MatchType;
import com.tradecodes.classifier.model.VectorMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Fuses the lexical, vector and scoped-keyword retrieval channels into one deduplicated candidate list.
 * Channels run concurrently on the retrieval executor; a failed or timed-out channel contributes nothing.
 */
@Service
public class CandidateGenerator {

    private static final Logger logger = LoggerFactory.getLogger(CandidateGenerator.class);

    private final EmbeddingClient embeddingClient;
    private final VectorSearchStore vectorSearchStore;
    private final LexicalIndex lexicalIndex;
    private final TaskExecutor retrievalExecutor;
    private final ClassifierProperties.Retrieval settings;
    private final Set<String> stopWords;

    public CandidateGenerator(EmbeddingClient embeddingClient,
                              VectorSearchStore vectorSearchStore,
                              LexicalIndex lexicalIndex,
                              ClassificationRules rules,
                              ClassifierProperties properties,
                              @Qualifier("retrievalExecutor") TaskExecutor retrievalExecutor) {
        this.embeddingClient = embeddingClient;
        this.vectorSearchStore = vectorSearchStore;
        this.lexicalIndex = lexicalIndex;
        this.retrievalExecutor = retrievalExecutor;
        this.settings = properties.getRetrieval();
        this.stopWords = rules.scoringTerms().stopWords();
    }

    /**
     * Runs the retrieval channels for a query and merges their results, best score first.
     *
     * @param query      text to search for
     * @param prediction chapter prediction used to scope the vector and keyword passes
     */
    public List<Candidate> generate(String query, ChapterPredictionResult prediction) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        ChapterPredictionResult chapters = prediction != null ? prediction : ChapterPredictionResult.empty();
        List<String> terms = QueryTerms.meaningful(query, stopWords);
        List<String> scope = scopedChapters(chapters);
        boolean shortQuery = !terms.isEmpty() && terms.size() < settings.getSemanticOnlyTokenThreshold();

        CompletableFuture<List<Candidate>> semantic = runChannel("semantic", () -> semanticPass(query, chapters, scope));
        CompletableFuture<List<Candidate>> keyword = runChannel("keyword", () -> keywordPass(terms, scope));
        CompletableFuture<List<Candidate>> lexical = shortQuery
                ? runChannel("lexical", () -> lexicalPass(terms, scope))
                : CompletableFuture.completedFuture(List.of());

        CompletableFuture.allOf(semantic, keyword, lexical).join();
        List<Candidate> merged = merge(lexical.join(), keyword.join(), semantic.join());
        logger.debug("Retrieval for '{}' produced {} candidates (short query: {}, scope: {})",
                query, merged.size(), shortQuery, scope);
        return merged;
    }

    private CompletableFuture<List<Candidate>> runChannel(String channel, Supplier<List<Candidate>> pass) {
        return CompletableFuture.supplyAsync(pass, retrievalExecutor)
                .orTimeout(settings.getTimeoutMs(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    logger.warn("Retrieval channel '{}' failed, continuing without it: {}", channel, ex.getMessage());
                    return List.of();
                });
    }

    private List<String> scopedChapters(ChapterPredictionResult prediction) {
        if (prediction.hasOverride()) {
            return List.of(prediction.functionalOverride().forceChapter());
        }
        return prediction.chapters().stream().limit(Math.max(0, settings.getScopedChapterCount())).toList();
    }

    /**
     * Vector pass: override scope only, or global plus a scoped pass for chapter coverage.
     */
    List<Candidate> semanticPass(String query, ChapterPredictionResult prediction, List<String> scope) {
        float[] vector = embeddingClient.embed(query);
        Map<String, VectorMatch> matches = new LinkedHashMap<>();
        if (prediction.hasOverride()) {
            addMatches(matches, vectorSearchStore.search(vector, scope, settings.getInitialSearchLimit()));
        } else {
            addMatches(matches, vectorSearchStore.search(vector, List.of(), settings.getInitialSearchLimit()));
            if (!scope.isEmpty()) {
                try {
                    addMatches(matches, vectorSearchStore.search(vector, scope, settings.getKeywordPassLimit()));
                } catch (RetrievalFailureException e) {
                    logger.warn("Scoped vector search over {} failed: {}", scope, e.getMessage());
                }
            }
        }
        List<Candidate> candidates = new ArrayList<>(matches.size());
        for (VectorMatch m : matches.values()) {
            candidates.add(new Candidate(m.code(), m.description(), m.similarity() * settings.getSemanticScale(),
                    m.similarity(), MatchType.SEMANTIC, CandidateSource.SEMANTIC, m.keywords(), List.of(), List.of()));
        }
        return candidates;
    }

    private static void addMatches(Map<String, VectorMatch> target, List<VectorMatch> matches) {
        for (VectorMatch m : matches) {
            target.merge(m.code(), m, (a, b) -> b.similarity() > a.similarity() ? b : a);
        }
    }

    /**
     * Description substring search for the query terms inside the scoped chapters.
     */
    List<Candidate> keywordPass(List<String> terms, Collection<String> scope) {
        if (terms.isEmpty() || scope.isEmpty()) {
            return List.of();
        }
        List<Candidate> candidates = new ArrayList<>();
        for (CatalogEntry entry : lexicalIndex.searchDescriptions(terms, scope, settings.getKeywordPassLimit())) {
            String description = entry.description() == null ? "" : entry.description().toLowerCase();
            long hits = terms.stream().filter(description::contains).count();
            double score = hits * settings.getPartialMatchScore();
            candidates.add(new Candidate(entry.code(), entry.description(), score, lexicalSimilarity(score, terms.size()),
                    MatchType.KEYWORD, CandidateSource.LEXICAL, entry.keywords(), entry.commonProducts(), entry.synonyms()));
        }
        return candidates;
    }

    /**
     * Exact, partial and fuzzy term matching against each entry's term bag, with the short-query noise filter.
     */
    List<Candidate> lexicalPass(List<String> terms, Collection<String> predictedChapters) {
        Set<String> allowedChapters = new HashSet<>(predictedChapters);
        allowedChapters.addAll(settings.getFuzzyAllowedChapters());

        List<Candidate> hits = new ArrayList<>();
        for (CatalogEntry entry : lexicalIndex.lookup(terms, settings.getLexicalLimit())) {
            List<String> bag = termBag(entry);
            double score = 0;
            int matchedTerms = 0;
            MatchType matchType = null;
            for (String term : terms) {
                if (bag.contains(term)) {
                    score += settings.getExactMatchScore();
                    matchType = MatchType.EXACT;
                    matchedTerms++;
                } else if (bag.stream().anyMatch(t -> t.contains(term) || term.contains(t))) {
                    score += settings.getPartialMatchScore();
                    matchType = matchType == MatchType.EXACT ? matchType : MatchType.PARTIAL;
                    matchedTerms++;
                } else if (!FuzzyMatcher.closeMatches(term, bag, settings.getFuzzyThreshold(), 1).isEmpty()) {
                    score += settings.getFuzzyMatchScore();
                    matchType = matchType == null ? MatchType.FUZZY : matchType;
                    matchedTerms++;
                }
            }
            if (score <= 0) {
                continue;
            }
            String chapter = entry.code().replaceAll("[^0-9]", "");
            chapter = chapter.length() >= 2 ? chapter.substring(0, 2) : chapter;
            boolean keep = matchType == MatchType.EXACT
                    || matchedTerms >= settings.getNoiseMinMatchedTerms()
                    || allowedChapters.contains(chapter);
            if (!keep) {
                continue;
            }
            hits.add(new Candidate(entry.code(), entry.description(), score, lexicalSimilarity(score, terms.size()),
                    matchType, CandidateSource.LEXICAL, entry.keywords(), entry.commonProducts(), entry.synonyms()));
        }
        hits.sort(Comparator.comparingDouble(Candidate::score).reversed());
        return hits.size() > settings.getLexicalLimit() ? hits.subList(0, settings.getLexicalLimit()) : hits;
    }

    private static List<String> termBag(CatalogEntry entry) {
        List<String> bag = new ArrayList<>();
        entry.keywords().forEach(k -> bag.add(k.toLowerCase()));
        entry.commonProducts().forEach(k -> bag.add(k.toLowerCase()));
        entry.synonyms().forEach(k -> bag.add(k.toLowerCase()));
        bag.addAll(QueryTerms.words(entry.description()));
        bag.removeIf(t -> t.length() <= 2);
        return bag;
    }

    private double lexicalSimilarity(double score, int termCount) {
        if (termCount == 0) {
            return 0;
        }
        return Math.min(1.0, score / (settings.getExactMatchScore() * termCount));
    }

    /**
     * Lexical hits first, then keyword hits for unseen codes, then semantic hits blended into duplicates.
     */
    List<Candidate> merge(List<Candidate> lexical, List<Candidate> keyword, List<Candidate> semantic) {
        Map<String, Candidate> byCode = new LinkedHashMap<>();
        for (Candidate c : lexical) {
            byCode.putIfAbsent(c.code(), c);
        }
        for (Candidate c : keyword) {
            byCode.putIfAbsent(c.code(), c);
        }
        for (Candidate c : semantic) {
            Candidate existing = byCode.get(c.code());
            if (existing == null) {
                byCode.put(c.code(), c);
                continue;
            }
            if (existing.source() == CandidateSource.COMBINED) {
                continue;
            }
            boolean exact = existing.matchType() == MatchType.EXACT;
            double w = exact ? settings.getExactMergeWeight() : settings.getDefaultMergeWeight();
            byCode.put(c.code(), new Candidate(
                    existing.code(),
                    existing.description().isEmpty() ? c.description() : existing.description(),
                    existing.score() * w + c.score() * (1 - w),
                    existing.similarity() * w + c.similarity() * (1 - w),
                    exact ? MatchType.EXACT_SEMANTIC : MatchType.FUZZY_SEMANTIC,
                    CandidateSource.COMBINED,
                    existing.keywords().isEmpty() ? c.keywords() : existing.keywords(),
                    existing.commonProducts(),
                    existing.synonyms()));
        }
        List<Candidate> merged = new ArrayList<>(byCode.values());
        merged.sort(Comparator.comparingDouble(Candidate::score).reversed());
        return merged.size() > settings.getMaxCandidates() ? List.copyOf(merged.subList(0, settings.getMaxCandidates())) : merged;
    }
}
