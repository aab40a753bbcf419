package com.ai.salesbot.service;

import com.ai.salesbot.entity.ObjectionHandler;
import com.ai.salesbot.exception.NotFoundException;
import com.ai.salesbot.exception.ValidationException;
import com.ai.salesbot.repository.ObjectionHandlerRepository;
import com.ai.salesbot.utils.HandlerTechnique;
import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.ObjectionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class ObjectionHandlerService {

    private static final Logger log = LoggerFactory.getLogger(ObjectionHandlerService.class);

    private final ObjectionHandlerRepository repository;

    public ObjectionHandlerService(ObjectionHandlerRepository repository) {
        this.repository = repository;
    }

    /**
     * Highest priority, then highest success rate, then oldest handler for the type and language.
     */
    @Transactional(readOnly = true)
    public ObjectionHandler getBestHandler(ObjectionType type, Language language) {
        Language lang = language != null ? language : Language.EN;
        return findBestHandler(type, lang)
                .orElseThrow(() -> NotFoundException.of("Objection handler", type.getCode() + "/" + lang.getCode()));
    }

    @Transactional(readOnly = true)
    public Optional<ObjectionHandler> findBestHandler(ObjectionType type, Language language) {
        if (type == null) throw new ValidationException("objectionType is required");
        Language lang = language != null ? language : Language.EN;
        return repository.findFirstByObjectionTypeAndLanguageAndActiveTrueOrderByPriorityDescSuccessRateDescIdAsc(type, lang);
    }

    @Transactional(readOnly = true)
    public List<ObjectionHandler> listHandlers(ObjectionType type, HandlerTechnique technique, Language language) {
        return repository.search(type, technique, language);
    }

    @Transactional
    public ObjectionHandler recordUsage(Long id, boolean success) {
        ObjectionHandler handler = repository.findByIdForUpdate(id)
                .orElseThrow(() -> NotFoundException.of("Objection handler", id));
        handler.recordUsage(success);
        handler = repository.save(handler);
        log.info("Handler usage recorded | id={} success={} rate={} uses={}",
                id, success, handler.getSuccessRate(), handler.getUsageCount());
        return handler;
    }

    @Transactional
    public ObjectionHandler create(ObjectionHandler handler) {
        if (handler.getObjectionType() == null) throw new ValidationException("objectionType is required");
        if (handler.getResponse() == null || handler.getResponse().isBlank()) {
            throw new ValidationException("response is required");
        }
        if (handler.getPriority() < 1 || handler.getPriority() > 10) {
            throw new ValidationException("priority must be between 1 and 10");
        }
        return repository.save(handler);
    }
}
