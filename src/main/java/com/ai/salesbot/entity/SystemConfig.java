package com.ai.salesbot.entity;

import com.ai.salesbot.exception.ValidationException;
import com.ai.salesbot.utils.ConfigDataType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.List;

/**
 * Operator-editable setting. {@code value} is always the canonical form produced by the
 * validator of {@code dataType}.
 */
@Entity
@Table(name = "system_config", indexes = {
    @Index(name = "idx_system_config_name", columnList = "name", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SystemConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    /** voice, language, call, security, notification or integration. */
    @Column(nullable = false, length = 20)
    private String category;

    @Enumerated(EnumType.STRING)
    @Column(name = "data_type", nullable = false, length = 10)
    private ConfigDataType dataType;

    @Column(name = "config_value", nullable = false, length = 2000)
    private String value;

    @Column(length = 500)
    private String description;

    @Embedded
    @Builder.Default
    private ConfigRules validation = new ConfigRules();

    @Column(nullable = false)
    @Builder.Default
    private boolean editable = true;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    private Instant createdAt;

    private Instant updatedAt;

    public double numberValue() {
        requireType(ConfigDataType.NUMBER);
        return ConfigDataType.asNumber(value);
    }

    public boolean booleanValue() {
        requireType(ConfigDataType.BOOLEAN);
        return ConfigDataType.asBoolean(value);
    }

    public List<String> listValue() {
        requireType(ConfigDataType.LIST);
        return ConfigDataType.asList(value);
    }

    private void requireType(ConfigDataType expected) {
        if (dataType != expected) {
            throw new ValidationException("Config " + name + " holds " + dataType + ", not " + expected);
        }
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
