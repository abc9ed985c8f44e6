package com.tradecodes.classifier.repository;

import com.tradecodes.classifier.model.TariffCode;
import com.tradecodes.classifier.model.VectorMatch;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

@Repository
public class TariffCodeRepositoryImpl implements TariffCodeRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<VectorMatch> findNearest(float[] embedding, Collection<String> chapters, double minSimilarity, int limit) {
        boolean scoped = chapters != null && !chapters.isEmpty();
        String sql = "SELECT code, description, COALESCE(array_to_string(keywords, '|'), '') AS kw, " +
                "1 - (embedding <=> CAST(:vec AS vector)) AS similarity " +
                "FROM hs_codes WHERE embedding IS NOT NULL " +
                (scoped ? "AND LEFT(code, 2) IN (:chapters) " : "") +
                "AND 1 - (embedding <=> CAST(:vec AS vector)) >= :minSimilarity " +
                "ORDER BY embedding <=> CAST(:vec AS vector)";

        Query q = entityManager.createNativeQuery(sql);
        q.setParameter("vec", toVectorLiteral(embedding));
        q.setParameter("minSimilarity", minSimilarity);
        if (scoped) {
            q.setParameter("chapters", new ArrayList<>(chapters));
        }
        q.setMaxResults(Math.max(1, limit));

        @SuppressWarnings("unchecked")
        List<Object[]> rows = q.getResultList();
        List<VectorMatch> matches = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            String keywords = row[2] == null ? "" : row[2].toString();
            matches.add(new VectorMatch(
                    (String) row[0],
                    (String) row[1],
                    keywords.isEmpty() ? List.of() : Arrays.asList(keywords.split("\\|")),
                    ((Number) row[3]).doubleValue()));
        }
        return matches;
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<TariffCode> findByTerms(List<String> terms, int limit) {
        if (terms == null || terms.isEmpty()) {
            return List.of();
        }
        Query q = entityManager.createNativeQuery(termSearchSql(terms.size()), TariffCode.class);
        for (int i = 0; i < terms.size(); i++) {
            String term = terms.get(i).toLowerCase(Locale.ROOT);
            // stem-ish prefix so "bolts" also finds "bolt"
            q.setParameter("p" + i, "%" + term.substring(0, Math.min(4, term.length())) + "%");
            q.setParameter("w" + i, "%" + term + "%");
            q.setParameter("t" + i, term);
        }
        q.setMaxResults(Math.max(1, limit));
        return q.getResultList();
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<TariffCode> findByDescriptionInChapters(List<String> terms, Collection<String> chapters, int limit) {
        if (terms == null || terms.isEmpty() || chapters == null || chapters.isEmpty()) {
            return List.of();
        }
        Query q = entityManager.createNativeQuery(chapterDescriptionSql(terms.size()), TariffCode.class);
        q.setParameter("chapters", new ArrayList<>(chapters));
        for (int i = 0; i < terms.size(); i++) {
            q.setParameter("d" + i, "%" + terms.get(i).toLowerCase(Locale.ROOT) + "%");
        }
        q.setMaxResults(Math.max(1, limit));
        return q.getResultList();
    }

    /**
     * Rows matching any term, best matches first: an exact keyword, product or synonym hit
     * outranks the whole term in the description, which outranks a prefix hit.
     * The row limit applies after this ordering.
     */
    static String termSearchSql(int termCount) {
        List<String> clauses = new ArrayList<>();
        List<String> scores = new ArrayList<>();
        for (int i = 0; i < termCount; i++) {
            String exact = ":t" + i + " = ANY(keywords) OR :t" + i + " = ANY(common_products) OR :t" + i + " = ANY(synonyms)";
            clauses.add("LOWER(description) LIKE :p" + i + " OR " + exact);
            scores.add("CASE WHEN " + exact + " THEN 3 ELSE 0 END");
            scores.add("CASE WHEN LOWER(description) LIKE :w" + i + " THEN 2 ELSE 0 END");
            scores.add("CASE WHEN LOWER(description) LIKE :p" + i + " THEN 1 ELSE 0 END");
        }
        return "SELECT * FROM hs_codes WHERE " + String.join(" OR ", clauses) +
                " ORDER BY (" + String.join(" + ", scores) + ") DESC, code";
    }

    static String chapterDescriptionSql(int termCount) {
        List<String> clauses = new ArrayList<>();
        List<String> scores = new ArrayList<>();
        for (int i = 0; i < termCount; i++) {
            clauses.add("LOWER(description) LIKE :d" + i);
            scores.add("CASE WHEN LOWER(description) LIKE :d" + i + " THEN 1 ELSE 0 END");
        }
        return "SELECT * FROM hs_codes WHERE LEFT(code, 2) IN (:chapters) AND (" +
                String.join(" OR ", clauses) + ") ORDER BY (" + String.join(" + ", scores) + ") DESC, code";
    }

    private static String toVectorLiteral(float[] embedding) {
        StringBuilder sb = new StringBuilder(embedding.length * 10).append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(embedding[i]);
        }
        return sb.append(']').toString();
    }
}
