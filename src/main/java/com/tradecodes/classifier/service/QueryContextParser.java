package com.tradecodes.classifier.service;

import com.tradecodes.classifier.model.QueryContext;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Separates what is being classified from where it is used:
 * "diesel engine for trucks" has subject "diesel engine" and context "trucks".
 */
@Service
public class QueryContextParser {

    private static final List<Pattern> CONTEXT_PATTERNS = List.of(
            Pattern.compile("(.+?)\\s+for\\s+(.+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(.+?)\\s+used in\\s+(.+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(.+?)\\s+in\\s+(.+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(.+?)\\s+of\\s+(.+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(.+?)\\s+from\\s+(.+)", Pattern.CASE_INSENSITIVE));

    public QueryContext parse(String query) {
        String trimmed = query == null ? "" : query.trim();
        for (Pattern pattern : CONTEXT_PATTERNS) {
            Matcher matcher = pattern.matcher(trimmed);
            if (matcher.matches()) {
                String subject = matcher.group(1).trim();
                String context = matcher.group(2).trim();
                return new QueryContext(subject, context, words(subject), words(context));
            }
        }
        return new QueryContext(trimmed, "", words(trimmed), List.of());
    }

    private static List<String> words(String text) {
        return Arrays.stream(text.toLowerCase().split("\\s+"))
                .map(w -> w.replaceAll("[^a-z0-9-]", ""))
                .filter(w -> w.length() > 2)
                .toList();
    }
}
