package com.ai.salesbot.service;

import com.ai.salesbot.dto.DashboardEvent;
import com.ai.salesbot.dto.DateRange;
import com.ai.salesbot.dto.QualificationStats;
import com.ai.salesbot.dto.QualificationUpdate;
import com.ai.salesbot.entity.BantDimension;
import com.ai.salesbot.entity.LeadQualification;
import com.ai.salesbot.exception.NotFoundException;
import com.ai.salesbot.exception.ValidationException;
import com.ai.salesbot.repository.CallSessionRepository;
import com.ai.salesbot.repository.LeadQualificationRepository;
import com.ai.salesbot.utils.QualificationLevel;
import com.ai.salesbot.utils.QualificationStage;
import com.ai.salesbot.websocket.EventBroadcaster;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * BANT scoring per call. The total is derived from the four dimensions on every write.
 */
@Service
public class QualificationService {

    private static final Logger log = LoggerFactory.getLogger(QualificationService.class);

    private final LeadQualificationRepository repository;
    private final CallSessionRepository callRepository;
    private final EventBroadcaster broadcaster;

    public QualificationService(LeadQualificationRepository repository,
                                CallSessionRepository callRepository,
                                EventBroadcaster broadcaster) {
        this.repository = repository;
        this.callRepository = callRepository;
        this.broadcaster = broadcaster;
    }

    /**
     * Merges the supplied dimensions. Any out-of-range score rejects the whole update.
     */
    @Transactional
    public LeadQualification updateScore(String callId, QualificationUpdate update) {
        if (StringUtils.isBlank(callId)) throw new ValidationException("callId is required");
        if (update == null) throw new ValidationException("Qualification update is required");
        checkRange("budget", update.getBudget());
        checkRange("authority", update.getAuthority());
        checkRange("need", update.getNeed());
        checkRange("timeline", update.getTimeline());

        LeadQualification q = repository.findByCallId(callId).orElseGet(() -> newRecord(callId));
        apply(q.getBudget(), update.getBudget(), update.getBudgetNotes());
        apply(q.getAuthority(), update.getAuthority(), update.getAuthorityNotes());
        apply(q.getNeed(), update.getNeed(), update.getNeedNotes());
        apply(q.getTimeline(), update.getTimeline(), update.getTimelineNotes());
        if (update.getStage() != null) q.setStage(update.getStage());
        if (update.getNotes() != null) q.setNotes(update.getNotes());

        q.recomputeScore();
        q = repository.save(q);

        log.info("Qualification updated | callId={} score={} level={}",
                callId, q.getQualificationScore(), q.getQualificationLevel().getCode());
        broadcaster.publish(DashboardEvent.QUALIFICATION_UPDATED, callId, q);
        return q;
    }

    @Transactional(readOnly = true)
    public LeadQualification get(String callId) {
        return repository.findByCallId(callId)
                .orElseThrow(() -> NotFoundException.of("Qualification", callId));
    }

    @Transactional(readOnly = true)
    public Optional<LeadQualification> find(String callId) {
        return repository.findByCallId(callId);
    }

    /**
     * Current total, 0 when the call has not been qualified yet.
     */
    @Transactional(readOnly = true)
    public int currentScore(String callId) {
        return repository.findByCallId(callId)
                .map(LeadQualification::getQualificationScore)
                .orElse(0);
    }

    @Transactional(readOnly = true)
    public QualificationStats stats(DateRange range) {
        DateRange r = range != null ? range : DateRange.all();
        List<LeadQualification> leads = repository.findByCreatedAtBetween(r.getFrom(), r.getTo());

        long total = leads.size();
        long sum = 0, qualified = 0, high = 0, converted = 0;
        long[] byLevel = new long[QualificationLevel.values().length];
        for (LeadQualification q : leads) {
            int score = q.getQualificationScore();
            sum += score;
            if (score >= QualificationLevel.MEDIUM.getThreshold()) qualified++;
            if (score >= QualificationLevel.HIGH.getThreshold()) high++;
            if (q.getStage() == QualificationStage.CONVERTED) converted++;
            byLevel[q.getQualificationLevel().ordinal()]++;
        }
        return QualificationStats.builder()
                .totalLeads(total)
                .averageScore(total == 0 ? 0 : Math.round(sum * 10.0 / total) / 10.0)
                .qualifiedLeads(qualified)
                .highQualifiedLeads(high)
                .convertedLeads(converted)
                .highLevel(byLevel[QualificationLevel.HIGH.ordinal()])
                .mediumLevel(byLevel[QualificationLevel.MEDIUM.ordinal()])
                .lowLevel(byLevel[QualificationLevel.LOW.ordinal()])
                .unqualified(byLevel[QualificationLevel.UNQUALIFIED.ordinal()])
                .build();
    }

    private LeadQualification newRecord(String callId) {
        if (callRepository.findByCallId(callId).isEmpty()) {
            throw NotFoundException.of("Call", callId);
        }
        return LeadQualification.builder().callId(callId).build();
    }

    private static void apply(BantDimension dimension, Integer score, String notes) {
        if (score != null) dimension.setScore(score);
        if (notes != null) dimension.setNotes(notes);
    }

    private static void checkRange(String name, Integer score) {
        if (score == null) return;
        if (score < BantDimension.MIN_SCORE || score > BantDimension.MAX_SCORE) {
            throw new ValidationException(name + " score must be between "
                    + BantDimension.MIN_SCORE + " and " + BantDimension.MAX_SCORE);
        }
    }
}
