package com.ai.salesbot.service;

import com.ai.salesbot.component.UtteranceSignals;
import com.ai.salesbot.dto.HandlerView;
import com.ai.salesbot.dto.ObjectionDetection;
import com.ai.salesbot.dto.ScriptSelectionRequest;
import com.ai.salesbot.dto.ScriptView;
import com.ai.salesbot.dto.TurnRecommendation;
import com.ai.salesbot.dto.UtteranceRequest;
import com.ai.salesbot.entity.CallSession;
import com.ai.salesbot.exception.ValidationException;
import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.ObjectionType;
import com.ai.salesbot.utils.ScriptType;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Runs one prospect utterance through the sales pipeline: objection detection, sentiment and
 * key-phrase capture, then the best handler and script for the current call state.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    static final String SUPPORTED_LANGUAGES = "supported_languages";

    private final CallSessionService callSessionService;
    private final ObjectionClassifier classifier;
    private final ObjectionHandlerService handlerService;
    private final SalesAnalyticsService analyticsService;
    private final QualificationService qualificationService;
    private final ScriptSelector scriptSelector;
    private final UtteranceSignals signals;
    private final SystemConfigService configService;

    public ConversationOrchestrator(CallSessionService callSessionService,
                                    ObjectionClassifier classifier,
                                    ObjectionHandlerService handlerService,
                                    SalesAnalyticsService analyticsService,
                                    QualificationService qualificationService,
                                    ScriptSelector scriptSelector,
                                    UtteranceSignals signals,
                                    SystemConfigService configService) {
        this.callSessionService = callSessionService;
        this.classifier = classifier;
        this.handlerService = handlerService;
        this.analyticsService = analyticsService;
        this.qualificationService = qualificationService;
        this.scriptSelector = scriptSelector;
        this.signals = signals;
        this.configService = configService;
    }

    @Transactional
    public TurnRecommendation processUtterance(String callId, UtteranceRequest request) {
        if (request == null || StringUtils.isBlank(request.getUtterance())) {
            throw new ValidationException("utterance is required");
        }
        CallSession call = callSessionService.get(callId);
        String text = request.getUtterance().trim();
        Language language = resolveLanguage(request.getLanguage() != null ? request.getLanguage() : call.getLanguage());

        ObjectionDetection detection = classifier.detect(text, language);
        if (detection.hasObjection()) {
            analyticsService.recordObjections(callId, detection.getMatchedTypes());
        }

        double sentiment = signals.sentiment(text);
        analyticsService.recordSentiment(callId, sentiment, text);

        Map<String, String> phrases = signals.keyPhrases(text);
        if (!phrases.isEmpty()) {
            analyticsService.recordKeyPhrases(callId, phrases, text);
        }

        HandlerView handler = null;
        if (detection.hasObjection()) {
            ObjectionType primary = detection.getMatchedTypes().iterator().next();
            handler = handlerService.findBestHandler(primary, language).map(HandlerView::from).orElse(null);
        }

        ScriptType scriptType = request.getScriptType() != null
                ? request.getScriptType()
                : detection.hasObjection() ? ScriptType.OBJECTION : ScriptType.PRESENTATION;
        int score = qualificationService.currentScore(callId);
        long elapsed = call.elapsedSeconds(Instant.now());

        ScriptView script = scriptSelector.select(ScriptSelectionRequest.builder()
                        .productId(request.getProductId())
                        .scriptType(scriptType)
                        .language(language)
                        .elapsedSeconds(elapsed)
                        .qualificationScore(score)
                        .utterance(text)
                        .detectedObjections(detection.getMatchedTypes())
                        .build())
                .map(ScriptView::from)
                .orElse(null);

        log.info("Utterance processed | callId={} objections={} sentiment={} handler={} script={}",
                callId, detection.getMatchedTypes(), sentiment,
                handler != null ? handler.getId() : null, script != null ? script.getId() : null);

        return TurnRecommendation.builder()
                .callId(callId)
                .detectedObjections(detection.getMatchedTypes())
                .sentiment(sentiment)
                .handler(handler)
                .script(script)
                .qualificationScore(score)
                .elapsedSeconds(elapsed)
                .build();
    }

    /**
     * Falls back to English when the operator has not enabled the requested language.
     */
    private Language resolveLanguage(Language requested) {
        List<String> supported = configService.getList(SUPPORTED_LANGUAGES);
        if (supported.isEmpty() || supported.contains(requested.getCode())) {
            return requested;
        }
        log.debug("Language not enabled, using en | requested={} supported={}", requested.getCode(), supported);
        return Language.EN;
    }
}
