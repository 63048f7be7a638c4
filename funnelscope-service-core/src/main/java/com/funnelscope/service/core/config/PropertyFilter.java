package com.funnelscope.service.core.config;

import java.util.Locale;

/** A single property condition on an event, the acting person or one of its groups. */
public record PropertyFilter(String key, Operator operator, Object value, Scope scope, Integer groupTypeIndex) {

    public PropertyFilter {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("property filter key is required");
        }
        operator = operator == null ? Operator.EXACT : operator;
        scope = scope == null ? Scope.EVENT : scope;
    }

    public static PropertyFilter event(String key, Operator operator, Object value) {
        return new PropertyFilter(key, operator, value, Scope.EVENT, null);
    }

    public static PropertyFilter eventEquals(String key, Object value) {
        return event(key, Operator.EXACT, value);
    }

    public static PropertyFilter person(String key, Operator operator, Object value) {
        return new PropertyFilter(key, operator, value, Scope.PERSON, null);
    }

    public enum Scope {
        EVENT,
        PERSON,
        GROUP
    }

    public enum Operator {
        EXACT,
        IS_NOT,
        ICONTAINS,
        NOT_ICONTAINS,
        REGEX,
        NOT_REGEX,
        GT,
        LT,
        IS_SET,
        IS_NOT_SET;

        public static Operator fromConfigValue(String value) {
            if (value == null || value.isBlank()) {
                return EXACT;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "exact" -> EXACT;
                case "is_not" -> IS_NOT;
                case "icontains" -> ICONTAINS;
                case "not_icontains" -> NOT_ICONTAINS;
                case "regex" -> REGEX;
                case "not_regex" -> NOT_REGEX;
                case "gt" -> GT;
                case "lt" -> LT;
                case "is_set" -> IS_SET;
                case "is_not_set" -> IS_NOT_SET;
                default -> throw new IllegalArgumentException("Unsupported property operator: " + value);
            };
        }
    }
}
