package com.cred.freestyle.arbitrage.repository;

import com.cred.freestyle.arbitrage.domain.model.Gender;
import com.cred.freestyle.arbitrage.domain.model.SizeAlias;
import com.cred.freestyle.arbitrage.domain.model.SizeStandard;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

/**
 * Repository interface for SizeAlias entity.
 *
 * @author Arbitrage Team
 */
@Repository
public interface SizeAliasRepository extends JpaRepository<SizeAlias, String> {

    /**
     * All aliases for a notation. The caller picks the most specific brand/category match.
     *
     * @param fromStandard Source notation
     * @param fromValue Source value
     * @param gender Sizing gender
     * @return Candidate aliases
     */
    List<SizeAlias> findByFromStandardAndFromValueAndGender(SizeStandard fromStandard, BigDecimal fromValue, Gender gender);

    List<SizeAlias> findByCanonicalSizeId(String canonicalSizeId);

    List<SizeAlias> findAllByOrderByCreatedAtAsc();
}
