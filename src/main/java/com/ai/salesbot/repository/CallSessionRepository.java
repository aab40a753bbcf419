package com.ai.salesbot.repository;

import com.ai.salesbot.entity.CallSession;
import com.ai.salesbot.utils.CallDirection;
import com.ai.salesbot.utils.CallStatus;
import com.ai.salesbot.utils.Satisfaction;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface CallSessionRepository extends JpaRepository<CallSession, Long> {

    Optional<CallSession> findByCallId(String callId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CallSession c WHERE c.callId = :callId")
    Optional<CallSession> findByCallIdForUpdate(@Param("callId") String callId);

    List<CallSession> findByStatusOrderByStartTimeDesc(CallStatus status);

    /**
     * Ids only, so the rows are loaded fresh by the locking lookup that follows.
     */
    @Query("SELECT c.callId FROM CallSession c WHERE c.status = :status AND c.startTime < :cutoff ORDER BY c.startTime")
    List<String> findCallIdsByStatusAndStartTimeBefore(@Param("status") CallStatus status,
                                                       @Param("cutoff") Instant cutoff);

    long countByStatus(CallStatus status);

    long countByCreatedAtGreaterThanEqual(Instant since);

    List<CallSession> findByCreatedAtBetween(Instant from, Instant to);

    @Query("SELECT c FROM CallSession c WHERE (:status IS NULL OR c.status = :status) "
            + "AND (:direction IS NULL OR c.direction = :direction) "
            + "AND c.createdAt BETWEEN :from AND :to")
    Page<CallSession> search(@Param("status") CallStatus status,
                             @Param("direction") CallDirection direction,
                             @Param("from") Instant from,
                             @Param("to") Instant to,
                             Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CallSession c SET c.interruptionCount = c.interruptionCount + 1, c.updatedAt = :now "
            + "WHERE c.callId = :callId")
    int incrementInterruptions(@Param("callId") String callId, @Param("now") Instant now);

    /**
     * Finishes a call only if it is still running. Returns 0 when another writer got there first.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CallSession c SET c.status = :status, c.endTime = :endTime, c.duration = :duration, "
            + "c.transcript = COALESCE(:transcript, c.transcript), c.audioRef = COALESCE(:audioRef, c.audioRef), "
            + "c.satisfaction = COALESCE(:satisfaction, c.satisfaction), c.updatedAt = :endTime "
            + "WHERE c.callId = :callId AND c.status = com.ai.salesbot.utils.CallStatus.IN_PROGRESS")
    int finishIfInProgress(@Param("callId") String callId,
                           @Param("status") CallStatus status,
                           @Param("endTime") Instant endTime,
                           @Param("duration") long duration,
                           @Param("transcript") String transcript,
                           @Param("audioRef") String audioRef,
                           @Param("satisfaction") Satisfaction satisfaction);
}
