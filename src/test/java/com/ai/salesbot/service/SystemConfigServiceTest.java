package com.ai.salesbot.service;

import com.ai.salesbot.auth.SalesBotApplication;
import com.ai.salesbot.entity.ConfigRules;
import com.ai.salesbot.entity.SystemConfig;
import com.ai.salesbot.exception.NotFoundException;
import com.ai.salesbot.exception.ValidationException;
import com.ai.salesbot.utils.ConfigDataType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ContextConfiguration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ContextConfiguration(classes = SalesBotApplication.class)
@Import(SystemConfigService.class)
@DisplayName("SystemConfigService")
class SystemConfigServiceTest {

    @Autowired
    private SystemConfigService service;

    @BeforeEach
    void setUp() {
        service.define(entry("tts_speed", ConfigDataType.NUMBER, "1.0", true,
                ConfigRules.builder().min(0.5).max(2.0).build()));
        service.define(entry("call_recording_enabled", ConfigDataType.BOOLEAN, "true", true, new ConfigRules()));
        service.define(entry("supported_languages", ConfigDataType.LIST, "en,hi", true,
                ConfigRules.builder().options("en,hi,mixed").build()));
        service.define(entry("tts_provider", ConfigDataType.STRING, "openai", false, new ConfigRules()));
    }

    @Test
    @DisplayName("typed getters parse the stored canonical value")
    void typedGetters() {
        assertThat(service.getNumber("tts_speed", 9)).isEqualTo(1.0);
        assertThat(service.getBoolean("call_recording_enabled", false)).isTrue();
        assertThat(service.getList("supported_languages")).containsExactly("en", "hi");
        assertThat(service.getString("tts_provider", "none")).isEqualTo("openai");
    }

    @Test
    @DisplayName("missing entries and type mismatches fall back")
    void fallbacks() {
        assertThat(service.getNumber("missing", 3.5)).isEqualTo(3.5);
        assertThat(service.getBoolean("tts_speed", true)).isTrue();
        assertThat(service.getList("tts_speed")).isEmpty();
    }

    @Test
    @DisplayName("define keeps an existing entry")
    void defineIsIdempotent() {
        SystemConfig again = service.define(entry("tts_speed", ConfigDataType.NUMBER, "1.8", true, new ConfigRules()));

        assertThat(again.getValue()).isEqualTo("1");
    }

    @Test
    @DisplayName("update stores the canonical form within the rules")
    void update() {
        assertThat(service.update("tts_speed", "1.25").getValue()).isEqualTo("1.25");
        assertThatThrownBy(() -> service.update("tts_speed", "3"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("locked and unknown entries cannot be updated")
    void rejected() {
        assertThatThrownBy(() -> service.update("tts_provider", "azure"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("not editable");
        assertThatThrownBy(() -> service.update("nope", "x"))
                .isInstanceOf(NotFoundException.class);
    }

    private static SystemConfig entry(String name, ConfigDataType type, String value, boolean editable, ConfigRules rules) {
        return SystemConfig.builder()
                .name(name)
                .category("test")
                .dataType(type)
                .value(value)
                .editable(editable)
                .validation(rules)
                .build();
    }
}
