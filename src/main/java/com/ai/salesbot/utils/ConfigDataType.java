package com.ai.salesbot.utils;

import com.ai.salesbot.exception.ValidationException;
import com.ai.salesbot.entity.ConfigRules;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Type tag of a system configuration value. Each tag owns the validator and the canonical
 * string form that gets stored, so a value can never disagree with its tag.
 */
public enum ConfigDataType {

    STRING {
        @Override
        public String canonicalize(String raw, ConfigRules rules) {
            if (raw == null) throw new ValidationException("Value is required");
            if (rules != null && StringUtils.isNotBlank(rules.getPattern())
                    && !compile(rules.getPattern()).matcher(raw).matches()) {
                throw new ValidationException("Value does not match required pattern");
            }
            if (rules != null && !rules.getOptionList().isEmpty()
                    && !rules.getOptionList().contains(raw)) {
                throw new ValidationException("Value must be one of " + rules.getOptionList());
            }
            return raw;
        }
    },

    NUMBER {
        @Override
        public String canonicalize(String raw, ConfigRules rules) {
            BigDecimal value;
            try {
                value = new BigDecimal(StringUtils.trimToEmpty(raw));
            } catch (NumberFormatException e) {
                throw new ValidationException("Value must be a valid number");
            }
            if (rules != null && rules.getMin() != null && value.doubleValue() < rules.getMin()) {
                throw new ValidationException("Value must be at least " + rules.getMin());
            }
            if (rules != null && rules.getMax() != null && value.doubleValue() > rules.getMax()) {
                throw new ValidationException("Value must be at most " + rules.getMax());
            }
            return value.stripTrailingZeros().toPlainString();
        }
    },

    BOOLEAN {
        @Override
        public String canonicalize(String raw, ConfigRules rules) {
            String v = StringUtils.trimToEmpty(raw).toLowerCase();
            if (!"true".equals(v) && !"false".equals(v)) {
                throw new ValidationException("Value must be true or false");
            }
            return v;
        }
    },

    LIST {
        @Override
        public String canonicalize(String raw, ConfigRules rules) {
            if (raw == null) throw new ValidationException("Value is required");
            List<String> items = split(raw);
            if (rules != null && !rules.getOptionList().isEmpty()) {
                for (String item : items) {
                    if (!rules.getOptionList().contains(item)) {
                        throw new ValidationException("List item '" + item + "' is not an allowed option");
                    }
                }
            }
            return String.join(",", items);
        }
    };

    /**
     * Validates a raw value and returns the form to store.
     */
    public abstract String canonicalize(String raw, ConfigRules rules);

    public static double asNumber(String canonical) {
        return Double.parseDouble(canonical);
    }

    public static boolean asBoolean(String canonical) {
        return Boolean.parseBoolean(canonical);
    }

    public static List<String> asList(String canonical) {
        return canonical == null ? Collections.emptyList() : split(canonical);
    }

    private static Pattern compile(String pattern) {
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new ValidationException("Invalid validation pattern: " + e.getDescription());
        }
    }

    private static List<String> split(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .collect(Collectors.toList());
    }
}
