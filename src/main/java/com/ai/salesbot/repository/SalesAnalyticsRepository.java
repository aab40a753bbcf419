package com.ai.salesbot.repository;

import com.ai.salesbot.entity.SalesAnalytics;
import com.ai.salesbot.utils.ConversionStage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SalesAnalyticsRepository extends JpaRepository<SalesAnalytics, Long> {

    Optional<SalesAnalytics> findByCallId(String callId);

    List<SalesAnalytics> findByCreatedAtBetween(Instant from, Instant to);

    List<SalesAnalytics> findTop10ByConversionStageInOrderByCreatedAtDesc(Collection<ConversionStage> stages);
}
