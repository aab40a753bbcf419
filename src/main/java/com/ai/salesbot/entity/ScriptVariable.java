package com.ai.salesbot.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * Placeholder declared by a script template, e.g. {@code {product_name}}.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScriptVariable {

    @Column(name = "var_name", nullable = false, length = 50)
    private String name;

    /** text, number, date or boolean. */
    @Column(name = "var_type", length = 20)
    private String type;

    @Column(name = "default_value", length = 255)
    private String defaultValue;

    @Column(length = 255)
    private String description;
}
