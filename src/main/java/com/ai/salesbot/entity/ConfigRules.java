package com.ai.salesbot.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Validation rules attached to a configuration entry.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConfigRules {

    @Column(name = "rule_min")
    private Double min;

    @Column(name = "rule_max")
    private Double max;

    @Column(name = "rule_pattern", length = 255)
    private String pattern;

    /** Comma separated list of allowed values. */
    @Column(name = "rule_options", length = 1000)
    private String options;

    public List<String> getOptionList() {
        if (StringUtils.isBlank(options)) return Collections.emptyList();
        return Arrays.stream(options.split(","))
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .collect(Collectors.toList());
    }
}
