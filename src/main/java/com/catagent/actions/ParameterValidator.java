package com.catagent.actions;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks request parameters against an action's declared parameter list, applies defaults
 * and coerces values to their declared types. Undeclared parameters are dropped.
 */
public class ParameterValidator {

    public record Validation(Map<String, Object> parameters, List<String> errors) {
        public boolean valid() {
            return errors.isEmpty();
        }
    }

    public Validation validate(ActionDefinition definition, Map<String, Object> input) {
        var normalized = new LinkedHashMap<String, Object>();
        var errors = new ArrayList<String>();

        for (var param : definition.parameters()) {
            var raw = input.get(param.name());
            if (raw == null || (raw instanceof String s && s.isBlank())) {
                if (param.required()) {
                    errors.add("missing required parameter '" + param.name() + "'");
                } else if (param.defaultValue() != null) {
                    normalized.put(param.name(), param.defaultValue());
                }
                continue;
            }
            var coerced = coerce(param.type(), raw);
            if (coerced == null) {
                errors.add("parameter '" + param.name() + "' must be " + describe(param.type()));
            } else {
                normalized.put(param.name(), coerced);
            }
        }
        return new Validation(normalized, errors);
    }

    private Object coerce(ActionParameter.Type type, Object raw) {
        return switch (type) {
            case STRING -> raw instanceof String || raw instanceof Number || raw instanceof Boolean
                ? String.valueOf(raw) : raw instanceof Map<?, ?> ? raw : null;
            case ENTITY_ID, USER_ID -> raw instanceof String || raw instanceof Number ? String.valueOf(raw).trim() : null;
            case BOOLEAN -> toBoolean(raw);
            case NUMBER -> toDecimal(raw);
            case SATS -> toSats(raw);
        };
    }

    private static Boolean toBoolean(Object raw) {
        if (raw instanceof Boolean b) return b;
        if (raw instanceof String s) {
            var v = s.trim().toLowerCase(Locale.ROOT);
            if (v.equals("true")) return true;
            if (v.equals("false")) return false;
        }
        return null;
    }

    private static BigDecimal toDecimal(Object raw) {
        try {
            if (raw instanceof Number n) return new BigDecimal(n.toString());
            if (raw instanceof String s) return new BigDecimal(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
        return null;
    }

    private static Long toSats(Object raw) {
        var value = toDecimal(raw);
        if (value == null || value.signum() < 0) return null;
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static String describe(ActionParameter.Type type) {
        return switch (type) {
            case STRING -> "a string";
            case ENTITY_ID, USER_ID -> "an identifier";
            case BOOLEAN -> "true or false";
            case NUMBER -> "a number";
            case SATS -> "a non-negative whole number of sats";
        };
    }
}
