package com.ai.salesbot.service;

import com.ai.salesbot.entity.SystemConfig;
import com.ai.salesbot.exception.NotFoundException;
import com.ai.salesbot.exception.ValidationException;
import com.ai.salesbot.repository.SystemConfigRepository;
import com.ai.salesbot.utils.ConfigDataType;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;

/**
 * Operator settings. Values are always stored in the canonical form of their type tag.
 */
@Service
public class SystemConfigService {

    private static final Logger log = LoggerFactory.getLogger(SystemConfigService.class);

    private final SystemConfigRepository repository;

    public SystemConfigService(SystemConfigRepository repository) {
        this.repository = repository;
    }

    @Transactional(readOnly = true)
    public List<SystemConfig> list(String category) {
        if (StringUtils.isBlank(category)) {
            return repository.findByActiveTrueOrderByCategoryAscNameAsc();
        }
        return repository.findByCategoryAndActiveTrueOrderByNameAsc(category.trim().toLowerCase());
    }

    @Transactional(readOnly = true)
    public SystemConfig get(String name) {
        return repository.findByNameAndActiveTrue(name)
                .orElseThrow(() -> NotFoundException.of("Config", name));
    }

    @Transactional
    public SystemConfig update(String name, String rawValue) {
        SystemConfig config = get(name);
        if (!config.isEditable()) {
            throw new ValidationException("Config " + name + " is not editable");
        }
        config.setValue(config.getDataType().canonicalize(rawValue, config.getValidation()));
        config = repository.save(config);
        log.info("Config updated | name={} value={}", name, config.getValue());
        return config;
    }

    /**
     * Inserts the entry unless one with the same name exists. Returns the stored entry.
     */
    @Transactional
    public SystemConfig define(SystemConfig config) {
        return repository.findByName(config.getName()).orElseGet(() -> {
            config.setValue(config.getDataType().canonicalize(config.getValue(), config.getValidation()));
            return repository.save(config);
        });
    }

    @Transactional(readOnly = true)
    public String getString(String name, String fallback) {
        return repository.findByNameAndActiveTrue(name)
                .map(SystemConfig::getValue)
                .orElse(fallback);
    }

    @Transactional(readOnly = true)
    public double getNumber(String name, double fallback) {
        return repository.findByNameAndActiveTrue(name)
                .filter(c -> c.getDataType() == ConfigDataType.NUMBER)
                .map(SystemConfig::numberValue)
                .orElse(fallback);
    }

    @Transactional(readOnly = true)
    public boolean getBoolean(String name, boolean fallback) {
        return repository.findByNameAndActiveTrue(name)
                .filter(c -> c.getDataType() == ConfigDataType.BOOLEAN)
                .map(SystemConfig::booleanValue)
                .orElse(fallback);
    }

    @Transactional(readOnly = true)
    public List<String> getList(String name) {
        return repository.findByNameAndActiveTrue(name)
                .filter(c -> c.getDataType() == ConfigDataType.LIST)
                .map(SystemConfig::listValue)
                .orElse(Collections.emptyList());
    }
}
