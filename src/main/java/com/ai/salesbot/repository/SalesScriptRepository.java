package com.ai.salesbot.repository;

import com.ai.salesbot.entity.SalesScript;
import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.SalesMethod;
import com.ai.salesbot.utils.ScriptType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

@Repository
public interface SalesScriptRepository extends JpaRepository<SalesScript, Long> {

    List<SalesScript> findByProductIdAndScriptTypeAndLanguageAndActiveTrueOrderByPriorityDescSuccessRateDescIdAsc(
            Long productId,
            ScriptType scriptType,
            Language language
    );

    @Query("SELECT s FROM SalesScript s WHERE s.active = true "
            + "AND (:productId IS NULL OR s.productId = :productId) "
            + "AND (:scriptType IS NULL OR s.scriptType = :scriptType) "
            + "AND (:technique IS NULL OR s.technique = :technique) "
            + "AND (:language IS NULL OR s.language = :language) "
            + "ORDER BY s.priority DESC, s.successRate DESC, s.id ASC")
    List<SalesScript> search(@Param("productId") Long productId,
                             @Param("scriptType") ScriptType scriptType,
                             @Param("technique") SalesMethod technique,
                             @Param("language") Language language);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SalesScript s WHERE s.id = :id")
    Optional<SalesScript> findByIdForUpdate(@Param("id") Long id);
}
