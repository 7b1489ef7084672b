package com.liftlog.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Arrays;

public enum WeightUnit {
    KG("kg", BigDecimal.ONE),
    LB("lb", new BigDecimal("0.453592"));

    private final String value;
    private final BigDecimal kilogramsPerUnit;

    WeightUnit(String value, BigDecimal kilogramsPerUnit) {
        this.value = value;
        this.kilogramsPerUnit = kilogramsPerUnit;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Converts a weight expressed in this unit to kilograms, exactly. */
    public BigDecimal toKilograms(BigDecimal weight) {
        return this == KG ? weight : weight.multiply(kilogramsPerUnit);
    }

    @JsonCreator
    public static WeightUnit fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown weight unit: " + raw));
    }
}
