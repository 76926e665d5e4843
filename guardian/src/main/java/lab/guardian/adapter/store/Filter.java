package lab.guardian.adapter.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Composable row filter in the PostgREST grammar: {@code column=op.value} terms joined with {@code &}.
 * <p>
 * Supported operators are {@code eq}, {@code neq}, {@code gt}, {@code gte}, {@code lt}, {@code lte},
 * {@code in.(a,b)} and {@code is.null}. Instances are immutable; every builder call returns a new filter.
 */
public final class Filter {

    private static final Filter ALL = new Filter(List.of());

    private final List<Condition> conditions;

    private Filter(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    public static Filter all() {
        return ALL;
    }

    public static Filter where(String column, Operator operator, Object value) {
        return ALL.and(column, operator, value);
    }

    public static Filter eq(String column, Object value) {
        return ALL.andEq(column, value);
    }

    public static Filter in(String column, Collection<?> values) {
        return ALL.andIn(column, values);
    }

    public Filter andEq(String column, Object value) {
        return and(column, Operator.EQ, value);
    }

    public Filter andIn(String column, Collection<?> values) {
        List<String> texts = values.stream().map(String::valueOf).toList();
        return with(new Condition(column, Operator.IN, texts));
    }

    public Filter andIsNull(String column) {
        return with(new Condition(column, Operator.IS, List.of("null")));
    }

    public Filter and(String column, Operator operator, Object value) {
        if (operator == Operator.IN) {
            throw new IllegalArgumentException("use andIn for in-lists");
        }
        return with(new Condition(column, operator, List.of(String.valueOf(value))));
    }

    public Filter and(Filter other) {
        List<Condition> merged = new ArrayList<>(conditions);
        merged.addAll(other.conditions);
        return new Filter(merged);
    }

    private Filter with(Condition condition) {
        List<Condition> next = new ArrayList<>(conditions);
        next.add(condition);
        return new Filter(next);
    }

    public List<Condition> conditions() {
        return conditions;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    public boolean matches(Map<String, Object> row) {
        for (Condition condition : conditions) {
            if (!condition.matches(row.get(condition.column()))) {
                return false;
            }
        }
        return true;
    }

    public String toQueryString() {
        return conditions.stream().map(Condition::render).collect(Collectors.joining("&"));
    }

    public static Filter parse(String query) {
        if (query == null || query.isBlank()) {
            return ALL;
        }
        List<Condition> parsed = new ArrayList<>();
        for (String part : query.split("&")) {
            int eq = part.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("malformed filter term: " + part);
            }
            String column = part.substring(0, eq);
            String expression = part.substring(eq + 1);
            int dot = expression.indexOf('.');
            if (dot <= 0) {
                throw new IllegalArgumentException("malformed filter expression: " + expression);
            }
            Operator operator = Operator.fromToken(expression.substring(0, dot));
            String operand = expression.substring(dot + 1);
            if (operator == Operator.IN) {
                if (!operand.startsWith("(") || !operand.endsWith(")")) {
                    throw new IllegalArgumentException("in-list must be parenthesized: " + operand);
                }
                String inner = operand.substring(1, operand.length() - 1);
                List<String> values = inner.isEmpty() ? List.of() : Arrays.asList(inner.split(","));
                parsed.add(new Condition(column, operator, values));
            } else {
                parsed.add(new Condition(column, operator, List.of(operand)));
            }
        }
        return new Filter(parsed);
    }

    @Override
    public String toString() {
        return toQueryString();
    }

    public enum Operator {
        EQ("eq"),
        NEQ("neq"),
        GT("gt"),
        GTE("gte"),
        LT("lt"),
        LTE("lte"),
        IN("in"),
        IS("is");

        private final String token;

        Operator(String token) {
            this.token = token;
        }

        public String token() {
            return token;
        }

        static Operator fromToken(String token) {
            String normalized = token.toLowerCase(Locale.ROOT);
            for (Operator operator : values()) {
                if (operator.token.equals(normalized)) {
                    return operator;
                }
            }
            throw new IllegalArgumentException("unsupported filter operator: " + token);
        }
    }

    public record Condition(String column, Operator operator, List<String> values) {

        public String operand() {
            if (operator == Operator.IN) {
                return "(" + String.join(",", values) + ")";
            }
            return values.get(0);
        }

        public String render() {
            return column + "=" + operator.token() + "." + operand();
        }

        boolean matches(Object actual) {
            return switch (operator) {
                case IS -> "null".equalsIgnoreCase(values.get(0)) ? actual == null : actual != null;
                case EQ -> actual != null && StoreValues.sameValue(actual, values.get(0));
                case NEQ -> actual != null && !StoreValues.sameValue(actual, values.get(0));
                case IN -> actual != null && values.stream().anyMatch(v -> StoreValues.sameValue(actual, v));
                case GT -> actual != null && StoreValues.compare(actual, values.get(0)) > 0;
                case GTE -> actual != null && StoreValues.compare(actual, values.get(0)) >= 0;
                case LT -> actual != null && StoreValues.compare(actual, values.get(0)) < 0;
                case LTE -> actual != null && StoreValues.compare(actual, values.get(0)) <= 0;
            };
        }
    }
}
