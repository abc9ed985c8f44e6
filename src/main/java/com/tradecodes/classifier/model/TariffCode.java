package com.tradecodes.classifier.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Catalog row of the {@code hs_codes} table. The embedding column is only read through native queries.
 */
@Getter
@Setter
@Entity
@Table(name = "hs_codes")
public class TariffCode {

    @Id
    @Column(name = "code", nullable = false, updatable = false)
    private String code;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "chapter")
    private String chapter;

    @Column(name = "heading")
    private String heading;

    @Column(name = "subheading")
    private String subheading;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "keywords", columnDefinition = "text[]")
    private String[] keywords;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "common_products", columnDefinition = "text[]")
    private String[] commonProducts;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "synonyms", columnDefinition = "text[]")
    private String[] synonyms;

    @Column(name = "is_other")
    private Boolean other;

    /**
     * Default constructor for JPA.
     */
    public TariffCode() {}

    public TariffCode(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public CatalogEntry toCatalogEntry() {
        return new CatalogEntry(code, description, asList(keywords), asList(commonProducts), asList(synonyms));
    }

    private static List<String> asList(String[] values) {
        return values == null ? List.of() : Arrays.stream(values).filter(Objects::nonNull).toList();
    }
}
