package com.tradecodes.classifier.repository;

import com.tradecodes.classifier.model.TariffCode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TariffCodeRepository extends JpaRepository<TariffCode, String>, TariffCodeRepositoryCustom {
}
