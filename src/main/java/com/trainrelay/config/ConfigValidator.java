package com.trainrelay.config;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

public class ConfigValidator {
    static final String CUTOFF_DATE = "cutoff_date";
    static final String DELTA_VERSION = "delta_version";

    private final List<String> requiredFields;

    public ConfigValidator(List<String> requiredFields) {
        this.requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
    }

    public List<String> validate(List<UnitConfig> units) {
        List<String> problems = new ArrayList<>();
        for (UnitConfig unit : units) {
            for (String field : requiredFields) {
                Object value = unit.parameters().get(field);
                if (value == null || String.valueOf(value).isBlank()) {
                    problems.add(unit.unitId() + ": missing required field '" + field + "'");
                }
            }
            Object cutoff = unit.parameters().get(CUTOFF_DATE);
            if (cutoff != null && !isIsoDate(String.valueOf(cutoff))) {
                problems.add(unit.unitId() + ": " + CUTOFF_DATE + " must be YYYY-MM-DD, got '" + cutoff + "'");
            }
            Object deltaVersion = unit.parameters().get(DELTA_VERSION);
            if (deltaVersion != null && !isNonNegativeInteger(deltaVersion)) {
                problems.add(unit.unitId() + ": " + DELTA_VERSION + " must be an integer >= 0, got '" + deltaVersion + "'");
            }
        }
        return problems;
    }

    private static boolean isIsoDate(String value) {
        if (value.length() != 10) {
            return false;
        }
        try {
            LocalDate.parse(value);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static boolean isNonNegativeInteger(Object value) {
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue() >= 0;
        }
        return false;
    }
}
