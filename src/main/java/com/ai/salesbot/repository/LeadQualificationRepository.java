package com.ai.salesbot.repository;

import com.ai.salesbot.entity.LeadQualification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface LeadQualificationRepository extends JpaRepository<LeadQualification, Long> {

    Optional<LeadQualification> findByCallId(String callId);

    List<LeadQualification> findByCreatedAtBetween(Instant from, Instant to);
}
