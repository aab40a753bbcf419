package com.ai.salesbot.service;

import com.ai.salesbot.dto.ScriptSelectionRequest;
import com.ai.salesbot.entity.CallSession;
import com.ai.salesbot.entity.Product;
import com.ai.salesbot.entity.SalesScript;
import com.ai.salesbot.entity.ScriptConditions;
import com.ai.salesbot.exception.NotFoundException;
import com.ai.salesbot.exception.ValidationException;
import com.ai.salesbot.repository.ProductRepository;
import com.ai.salesbot.repository.SalesScriptRepository;
import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.ObjectionType;
import com.ai.salesbot.utils.SalesMethod;
import com.ai.salesbot.utils.ScriptType;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Picks the script to use next. A script is eligible only when every gate passes:
 * product, type and language match, it is active, the call is not longer than its
 * maximum, the lead score reaches its minimum, its triggers match the utterance and
 * its required objections were all detected.
 */
@Service
public class ScriptSelector {

    private static final Logger log = LoggerFactory.getLogger(ScriptSelector.class);

    /** Priority desc, success rate desc, then insertion order. */
    static final Comparator<SalesScript> RANKING = Comparator
            .comparingInt(SalesScript::getPriority).reversed()
            .thenComparing(Comparator.comparingInt(SalesScript::getSuccessRate).reversed())
            .thenComparing(SalesScript::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final SalesScriptRepository repository;
    private final ProductRepository productRepository;
    private final CallSessionService callSessionService;
    private final QualificationService qualificationService;

    public ScriptSelector(SalesScriptRepository repository,
                          ProductRepository productRepository,
                          CallSessionService callSessionService,
                          QualificationService qualificationService) {
        this.repository = repository;
        this.productRepository = productRepository;
        this.callSessionService = callSessionService;
        this.qualificationService = qualificationService;
    }

    /**
     * Conversation state the gates are evaluated against.
     */
    public static class Context {
        final long elapsedSeconds;
        final int qualificationScore;
        final String utterance;
        final Set<ObjectionType> detectedObjections;

        public Context(long elapsedSeconds, int qualificationScore, String utterance, Set<ObjectionType> detectedObjections) {
            this.elapsedSeconds = elapsedSeconds;
            this.qualificationScore = qualificationScore;
            this.utterance = utterance;
            this.detectedObjections = detectedObjections != null ? detectedObjections : Collections.emptySet();
        }

        public long getElapsedSeconds() {
            return elapsedSeconds;
        }

        public int getQualificationScore() {
            return qualificationScore;
        }
    }

    @Transactional(readOnly = true)
    public Optional<SalesScript> select(ScriptSelectionRequest request) {
        List<SalesScript> ranked = rank(request);
        if (ranked.isEmpty()) {
            log.debug("No eligible script | productId={} type={} language={}",
                    request.getProductId(), request.getScriptType(), request.getLanguage());
            return Optional.empty();
        }
        return Optional.of(ranked.get(0));
    }

    /**
     * Every eligible script, best first.
     */
    @Transactional(readOnly = true)
    public List<SalesScript> rank(ScriptSelectionRequest request) {
        if (request == null || request.getScriptType() == null) {
            throw new ValidationException("scriptType is required");
        }
        Long productId = request.getProductId() != null ? request.getProductId() : activeProductId();
        if (productId == null) {
            log.debug("No product given and none active, nothing to select");
            return Collections.emptyList();
        }
        Language language = request.getLanguage() != null ? request.getLanguage() : Language.EN;
        Context context = contextFor(request);

        List<SalesScript> candidates = repository
                .findByProductIdAndScriptTypeAndLanguageAndActiveTrueOrderByPriorityDescSuccessRateDescIdAsc(
                        productId, request.getScriptType(), language);
        return candidates.stream()
                .filter(s -> isEligible(s, context))
                .sorted(RANKING)
                .collect(Collectors.toList());
    }

    public boolean isEligible(SalesScript script, Context context) {
        if (!script.isActive()) return false;
        ScriptConditions conditions = script.getConditions();
        if (conditions != null) {
            if (conditions.getMaxCallDuration() != null && context.elapsedSeconds > conditions.getMaxCallDuration()) {
                return false;
            }
            if (conditions.getMinQualificationScore() != null
                    && context.qualificationScore < conditions.getMinQualificationScore()) {
                return false;
            }
        }
        if (StringUtils.isNotBlank(context.utterance) && !script.getTriggers().isEmpty()) {
            String text = context.utterance.toLowerCase();
            boolean triggered = script.getTriggers().stream()
                    .anyMatch(t -> StringUtils.isNotBlank(t) && text.contains(t.toLowerCase()));
            if (!triggered) return false;
        }
        return context.detectedObjections.containsAll(script.getRequiredObjections());
    }

    @Transactional
    public SalesScript recordUsage(Long id, boolean success) {
        SalesScript script = repository.findByIdForUpdate(id)
                .orElseThrow(() -> NotFoundException.of("Script", id));
        script.recordUsage(success);
        script = repository.save(script);
        log.info("Script usage recorded | id={} success={} rate={} uses={}",
                id, success, script.getSuccessRate(), script.getUsageCount());
        return script;
    }

    @Transactional(readOnly = true)
    public List<SalesScript> listScripts(Long productId, ScriptType scriptType, SalesMethod technique, Language language) {
        return repository.search(productId, scriptType, technique, language);
    }

    @Transactional(readOnly = true)
    public SalesScript get(Long id) {
        return repository.findById(id).orElseThrow(() -> NotFoundException.of("Script", id));
    }

    @Transactional
    public SalesScript create(SalesScript script) {
        if (script.getProductId() == null) throw new ValidationException("productId is required");
        if (script.getScriptType() == null) throw new ValidationException("scriptType is required");
        if (StringUtils.isBlank(script.getContent())) throw new ValidationException("content is required");
        if (script.getPriority() < 1 || script.getPriority() > 10) {
            throw new ValidationException("priority must be between 1 and 10");
        }
        if (!productRepository.existsById(script.getProductId())) {
            throw NotFoundException.of("Product", script.getProductId());
        }
        SalesScript saved = repository.save(script);
        log.info("Script created | id={} productId={} type={}", saved.getId(), saved.getProductId(), saved.getScriptType());
        return saved;
    }

    Context contextFor(ScriptSelectionRequest request) {
        long elapsed = request.getElapsedSeconds() != null ? request.getElapsedSeconds() : 0L;
        int score = request.getQualificationScore() != null ? request.getQualificationScore() : 0;
        if (StringUtils.isNotBlank(request.getCallId())) {
            Optional<CallSession> call = callSessionService.find(request.getCallId());
            if (call.isPresent()) {
                elapsed = call.get().elapsedSeconds(Instant.now());
            }
            score = qualificationService.currentScore(request.getCallId());
        }
        return new Context(elapsed, score, request.getUtterance(), request.getDetectedObjections());
    }

    private Long activeProductId() {
        return productRepository.findFirstByActiveTrueOrderByUpdatedAtDesc()
                .map(Product::getId)
                .orElse(null);
    }
}
