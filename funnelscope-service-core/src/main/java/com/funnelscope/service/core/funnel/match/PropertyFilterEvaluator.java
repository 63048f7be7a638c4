package com.funnelscope.service.core.funnel.match;

import com.funnelscope.funnel.model.EventProperties;
import com.funnelscope.funnel.model.RawEvent;
import com.funnelscope.service.core.config.PropertyFilter;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.springframework.stereotype.Component;

/**
 * Evaluates {@link PropertyFilter}s against a raw event. Negative operators ({@code is_not}, {@code not_icontains},
 * {@code not_regex}) match events where the property is absent.
 */
@Component
public class PropertyFilterEvaluator {
    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    public boolean matchesAll(List<PropertyFilter> filters, RawEvent event) {
        for (PropertyFilter filter : filters) {
            if (!matches(filter, event)) {
                return false;
            }
        }
        return true;
    }

    public boolean matches(PropertyFilter filter, RawEvent event) {
        EventProperties props = scoped(filter, event);
        Object actual = props.get(filter.key());
        boolean present = actual != null;
        Object expected = filter.value();
        return switch (filter.operator()) {
            case EXACT -> present && anyEquals(actual, expected);
            case IS_NOT -> !present || !anyEquals(actual, expected);
            case ICONTAINS -> present && containsIgnoreCase(actual, expected);
            case NOT_ICONTAINS -> !present || !containsIgnoreCase(actual, expected);
            case REGEX -> present && regexFind(actual, expected);
            case NOT_REGEX -> !present || !regexFind(actual, expected);
            case GT -> present && compareNumeric(actual, expected) > 0;
            case LT -> present && compareNumeric(actual, expected) < 0;
            case IS_SET -> present;
            case IS_NOT_SET -> !present;
        };
    }

    private static EventProperties scoped(PropertyFilter filter, RawEvent event) {
        return switch (filter.scope()) {
            case EVENT -> event.properties();
            case PERSON -> event.actorProperties();
            case GROUP -> filter.groupTypeIndex() == null
                    ? EventProperties.empty()
                    : event.groupProperties(filter.groupTypeIndex());
        };
    }

    private static boolean anyEquals(Object actual, Object expected) {
        if (expected instanceof Collection<?> options) {
            for (Object option : options) {
                if (scalarEquals(actual, option)) {
                    return true;
                }
            }
            return false;
        }
        return scalarEquals(actual, expected);
    }

    private static boolean scalarEquals(Object actual, Object expected) {
        if (expected == null) {
            return false;
        }
        if (actual instanceof Number a && expected instanceof Number e) {
            return toDecimal(a).compareTo(toDecimal(e)) == 0;
        }
        return String.valueOf(actual).equals(String.valueOf(expected));
    }

    private static boolean containsIgnoreCase(Object actual, Object expected) {
        if (expected == null) {
            return false;
        }
        String haystack = String.valueOf(actual).toLowerCase(Locale.ROOT);
        return haystack.contains(String.valueOf(expected).toLowerCase(Locale.ROOT));
    }

    private boolean regexFind(Object actual, Object expected) {
        if (expected == null) {
            return false;
        }
        Pattern pattern = patterns.computeIfAbsent(String.valueOf(expected), PropertyFilterEvaluator::compile);
        return pattern.matcher(String.valueOf(actual)).find();
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException ex) {
            throw new IllegalArgumentException("Invalid property filter regex: " + regex, ex);
        }
    }

    private static int compareNumeric(Object actual, Object expected) {
        BigDecimal a = parseDecimal(actual);
        BigDecimal e = parseDecimal(expected);
        if (a == null || e == null) {
            // non-numeric values never satisfy gt/lt
            return 0;
        }
        return a.compareTo(e);
    }

    private static BigDecimal parseDecimal(Object value) {
        if (value instanceof Number n) {
            return toDecimal(n);
        }
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(String.valueOf(value).trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd;
        }
        if (n instanceof Double || n instanceof Float) {
            return BigDecimal.valueOf(n.doubleValue());
        }
        return new BigDecimal(n.toString());
    }
}
