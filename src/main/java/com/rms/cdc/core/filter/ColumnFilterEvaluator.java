package com.rms.cdc.core.filter;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rms.cdc.core.model.ColumnFilter;
import com.rms.cdc.core.model.Field;
import com.rms.cdc.core.model.FilterOperator;
import com.rms.cdc.core.model.FilterValue;
import com.rms.cdc.core.model.ValueType;

/**
 * =====================================================================
 * ColumnFilterEvaluator
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Evaluates one {@link ColumnFilter} against the decoded fields of a change.
 *
 * TOTALITY
 * --------
 * The evaluator is a pure function that is defined for every
 * (filter, fields) pair. It never throws:
 *
 *  - column absent           → {@link MissingColumnPolicy} (default: false)
 *  - field value null        → false, except for IS_NULL / NOT_NULL
 *  - type mismatch           → false
 *  - ordering on booleans    → false
 *
 * COERCION
 * --------
 * The literal's {@link ValueType} tag drives coercion of the field value:
 *
 *  STRING   : CharSequence, UUID, Character, Enum (as text)
 *  NUMBER   : any Number, or numeric text (Postgres numeric is often decoded as text)
 *  BOOLEAN  : Boolean, or t / f / true / false
 *  DATETIME : Instant, OffsetDateTime, ZonedDateTime, LocalDateTime (UTC), Date, ISO-8601 text,
 *             Postgres timestamp text (space separator, short offset)
 *
 * THREAD SAFETY
 * -------------
 * Stateless apart from the immutable policy; safe to share.
 */
public final class ColumnFilterEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ColumnFilterEvaluator.class);

    /** Postgres text output: {@code 2024-05-01 10:15:30.123+00}, offset optional. */
    private static final DateTimeFormatter POSTGRES_TIMESTAMP = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffset("+HH:mm", "Z")
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    /** Text datetime forms, tried in order. */
    private static final List<Function<String, Instant>> DATETIME_PARSERS = List.of(
            Instant::parse,
            s -> OffsetDateTime.parse(s).toInstant(),
            s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
            ColumnFilterEvaluator::parsePostgresTimestamp);

    private final MissingColumnPolicy missingColumnPolicy;

    public ColumnFilterEvaluator() {
        this(MissingColumnPolicy.FAIL);
    }

    public ColumnFilterEvaluator(MissingColumnPolicy missingColumnPolicy) {
        this.missingColumnPolicy = Objects.requireNonNull(missingColumnPolicy, "missingColumnPolicy");
    }

    /**
     * @return {@code true} iff the filter passes for the given fields
     */
    public boolean evaluate(ColumnFilter filter, List<Field> fields) {
        try {
            Field field = findField(fields, filter.columnAttnum());
            if (field == null) {
                return missingColumnPolicy == MissingColumnPolicy.PASS;
            }
            return apply(filter.operator(), filter.value(), field.value());
        } catch (RuntimeException e) {
            // Unexpected coercion failures resolve to "no match" so routing stays exception-free.
            log.debug("Filter evaluation failed; treating as no match. filter={} err={}", filter, e.toString());
            return false;
        }
    }

    public MissingColumnPolicy missingColumnPolicy() {
        return missingColumnPolicy;
    }

    private static Field findField(List<Field> fields, int attnum) {
        if (fields == null) {
            return null;
        }
        for (Field f : fields) {
            if (f != null && f.columnAttnum() == attnum) {
                return f;
            }
        }
        return null;
    }

    private static boolean apply(FilterOperator op, FilterValue literal, Object fieldValue) {
        if (op == FilterOperator.IS_NULL) {
            return fieldValue == null;
        }
        if (op == FilterOperator.NOT_NULL) {
            return fieldValue != null;
        }
        if (fieldValue == null) {
            return false;
        }

        if (op.isSetOperator()) {
            return applySet(op, literal.elements(), fieldValue);
        }

        if (literal.type() == ValueType.BOOLEAN && op != FilterOperator.EQ && op != FilterOperator.NEQ) {
            return false;
        }

        OptionalInt cmp = compare(fieldValue, literal);
        if (cmp.isEmpty()) {
            return false;
        }
        int c = cmp.getAsInt();
        return switch (op) {
            case EQ -> c == 0;
            case NEQ -> c != 0;
            case GT -> c > 0;
            case LT -> c < 0;
            case GTE -> c >= 0;
            case LTE -> c <= 0;
            default -> false;
        };
    }

    private static boolean applySet(FilterOperator op, List<FilterValue> elements, Object fieldValue) {
        boolean found = false;
        for (FilterValue element : elements) {
            OptionalInt cmp = compare(fieldValue, element);
            if (cmp.isEmpty()) {
                // A mixed-type set is a mismatch for NOT_IN; IN only needs one comparable hit.
                if (op == FilterOperator.NOT_IN) {
                    return false;
                }
                continue;
            }
            if (cmp.getAsInt() == 0) {
                found = true;
                break;
            }
        }
        return op == FilterOperator.IN ? found : !found;
    }

    /**
     * Compares the field value with the literal ({@code field <=> literal}).
     *
     * @return empty when the two cannot be brought to a common representation
     */
    private static OptionalInt compare(Object fieldValue, FilterValue literal) {
        return switch (literal.type()) {
            case STRING -> {
                String s = asText(fieldValue);
                yield s == null ? OptionalInt.empty() : OptionalInt.of(Integer.signum(s.compareTo((String) literal.value())));
            }
            case NUMBER -> {
                BigDecimal n = asNumber(fieldValue);
                yield n == null ? OptionalInt.empty() : OptionalInt.of(n.compareTo((BigDecimal) literal.value()));
            }
            case BOOLEAN -> {
                Boolean b = asBoolean(fieldValue);
                yield b == null ? OptionalInt.empty() : OptionalInt.of(Boolean.compare(b, (Boolean) literal.value()));
            }
            case DATETIME -> {
                Instant i = asInstant(fieldValue);
                yield i == null ? OptionalInt.empty() : OptionalInt.of(i.compareTo((Instant) literal.value()));
            }
            case LIST, NULL -> OptionalInt.empty();
        };
    }

    private static String asText(Object v) {
        if (v instanceof CharSequence cs) return cs.toString();
        if (v instanceof UUID || v instanceof Character) return v.toString();
        if (v instanceof Enum<?> e) return e.name();
        return null;
    }

    private static BigDecimal asNumber(Object v) {
        if (v instanceof BigDecimal bd) return bd;
        if (v instanceof Double d) return d.isNaN() || d.isInfinite() ? null : BigDecimal.valueOf(d);
        if (v instanceof Float f) return f.isNaN() || f.isInfinite() ? null : BigDecimal.valueOf(f.doubleValue());
        if (v instanceof java.math.BigInteger bi) return new BigDecimal(bi);
        if (v instanceof Number n) return BigDecimal.valueOf(n.longValue());
        if (v instanceof CharSequence cs) {
            try {
                return new BigDecimal(cs.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Boolean asBoolean(Object v) {
        if (v instanceof Boolean b) return b;
        if (v instanceof CharSequence cs) {
            return switch (cs.toString().trim().toLowerCase(Locale.ROOT)) {
                case "t", "true" -> Boolean.TRUE;
                case "f", "false" -> Boolean.FALSE;
                default -> null;
            };
        }
        return null;
    }

    private static Instant asInstant(Object v) {
        if (v instanceof Instant i) return i;
        if (v instanceof OffsetDateTime odt) return odt.toInstant();
        if (v instanceof ZonedDateTime zdt) return zdt.toInstant();
        if (v instanceof LocalDateTime ldt) return ldt.toInstant(ZoneOffset.UTC);
        if (v instanceof Date d) return d.toInstant();
        if (v instanceof CharSequence cs) {
            return parseInstant(cs.toString().trim());
        }
        return null;
    }

    private static Instant parseInstant(String s) {
        for (Function<String, Instant> parser : DATETIME_PARSERS) {
            Instant parsed = tryParse(parser, s);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static Instant parsePostgresTimestamp(String s) {
        TemporalAccessor parsed = POSTGRES_TIMESTAMP.parseBest(s, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    }

    private static Instant tryParse(Function<String, Instant> parser, String s) {
        try {
            return parser.apply(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
