package com.ai.salesbot.repository;

import com.ai.salesbot.entity.ObjectionHandler;
import com.ai.salesbot.utils.HandlerTechnique;
import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.ObjectionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

@Repository
public interface ObjectionHandlerRepository extends JpaRepository<ObjectionHandler, Long> {

    Optional<ObjectionHandler> findFirstByObjectionTypeAndLanguageAndActiveTrueOrderByPriorityDescSuccessRateDescIdAsc(
            ObjectionType objectionType,
            Language language
    );

    @Query("SELECT h FROM ObjectionHandler h WHERE h.active = true "
            + "AND (:objectionType IS NULL OR h.objectionType = :objectionType) "
            + "AND (:technique IS NULL OR h.technique = :technique) "
            + "AND (:language IS NULL OR h.language = :language) "
            + "ORDER BY h.priority DESC, h.successRate DESC, h.id ASC")
    List<ObjectionHandler> search(@Param("objectionType") ObjectionType objectionType,
                                  @Param("technique") HandlerTechnique technique,
                                  @Param("language") Language language);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM ObjectionHandler h WHERE h.id = :id")
    Optional<ObjectionHandler> findByIdForUpdate(@Param("id") Long id);
}
