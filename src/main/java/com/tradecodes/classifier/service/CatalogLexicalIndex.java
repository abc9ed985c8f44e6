package com.tradecodes.classifier.service;

import com.tradecodes.classifier.model.CatalogEntry;
import com.tradecodes.classifier.model.TariffCode;
import com.tradecodes.classifier.repository.TariffCodeRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * Lexical channel over the {@code hs_codes} catalog table.
 */
@Service
public class CatalogLexicalIndex implements LexicalIndex {

    private final TariffCodeRepository tariffCodeRepository;

    public CatalogLexicalIndex(TariffCodeRepository tariffCodeRepository) {
        this.tariffCodeRepository = tariffCodeRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<CatalogEntry> lookup(List<String> terms, int limit) {
        try {
            return tariffCodeRepository.findByTerms(terms, limit).stream()
                    .map(TariffCode::toCatalogEntry)
                    .toList();
        } catch (RuntimeException e) {
            throw new RetrievalFailureException("Catalog term lookup failed: " + e.getMessage(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<CatalogEntry> searchDescriptions(List<String> terms, Collection<String> chapters, int limit) {
        try {
            return tariffCodeRepository.findByDescriptionInChapters(terms, chapters, limit).stream()
                    .map(TariffCode::toCatalogEntry)
                    .toList();
        } catch (RuntimeException e) {
            throw new RetrievalFailureException("Catalog description search failed: " + e.getMessage(), e);
        }
    }
}
