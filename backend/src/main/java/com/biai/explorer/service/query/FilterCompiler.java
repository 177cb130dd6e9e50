package com.biai.explorer.service.query;

import com.biai.explorer.exception.InvalidQueryException;
import com.biai.explorer.exception.UnsupportedOperatorException;
import com.biai.explorer.model.enums.FilterOperator;
import com.biai.explorer.model.query.Filter;
import com.biai.explorer.model.query.FilterValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.biai.explorer.service.query.SqlSanitizer.ensureFiniteNumber;
import static com.biai.explorer.service.query.SqlSanitizer.escapeIdentifier;
import static com.biai.explorer.service.query.SqlSanitizer.numericLiteral;
import static com.biai.explorer.service.query.SqlSanitizer.quoteString;

/**
 * Filter Compiler
 *
 * Compiles a {@link Filter} tree into a ClickHouse boolean expression.
 * An empty result means "no condition": logical nodes drop empty children, and a
 * leaf without a usable column or operator contributes nothing. Invalid values are
 * always fatal.
 *
 * Columns are qualified with the given alias, or left unqualified when the alias is
 * {@code null} (inside membership subqueries).
 */
@Slf4j
@Component
public class FilterCompiler {

    public static final String EMPTY_SENTINEL = "(Empty)";
    public static final String NOT_AVAILABLE_SENTINEL = "(N/A)";
    public static final String NOT_AVAILABLE_LITERAL = "N/A";

    /** Condition that never matches. */
    public static final String ALWAYS_FALSE = "0";

    public Optional<String> compile(Filter filter, String alias) {
        if (filter == null) {
            return Optional.empty();
        }
        return filter.accept(new Compilation(alias));
    }

    private final class Compilation implements Filter.Visitor<Optional<String>> {

        private final String alias;

        private Compilation(String alias) {
            this.alias = alias;
        }

        @Override
        public Optional<String> visitAnd(Filter.And and) {
            return join(and.filters(), " AND ");
        }

        @Override
        public Optional<String> visitOr(Filter.Or or) {
            return join(or.filters(), " OR ");
        }

        @Override
        public Optional<String> visitNot(Filter.Not not) {
            return compile(not.filter(), alias).map(inner -> "NOT (" + inner + ")");
        }

        private Optional<String> join(List<Filter> children, String separator) {
            List<String> conditions = new ArrayList<>();
            for (Filter child : children) {
                compile(child, alias).ifPresent(conditions::add);
            }
            if (conditions.isEmpty()) {
                return Optional.empty();
            }
            if (conditions.size() == 1) {
                return Optional.of(conditions.get(0));
            }
            return Optional.of("(" + String.join(separator, conditions) + ")");
        }

        @Override
        public Optional<String> visitCondition(Filter.Condition condition) {
            if (!condition.isComplete()) {
                return Optional.empty();
            }
            if (!SqlSanitizer.isValidIdentifierFormat(condition.column())) {
                log.warn("Dropping filter on malformed column name '{}'", condition.column());
                return Optional.empty();
            }

            String col = columnRef(condition.column());
            FilterValue value = condition.value();
            FilterOperator operator = condition.operator();

            return Optional.of(switch (operator) {
                case EQ -> equality(col, value);
                case IN -> membership(col, value);
                case GT -> col + " > " + number(value, operator);
                case LT -> col + " < " + number(value, operator);
                case GTE -> col + " >= " + number(value, operator);
                case LTE -> col + " <= " + number(value, operator);
                case BETWEEN -> between(col, value);
                case TEMPORAL_BEFORE -> temporalOrder(condition, col, " < ");
                case TEMPORAL_AFTER -> temporalOrder(condition, col, " > ");
                case TEMPORAL_DURATION -> temporalDuration(condition, col);
                case TEMPORAL_WITHIN, TEMPORAL_OVERLAPS -> throw new UnsupportedOperatorException(operator);
            });
        }

        private String columnRef(String column) {
            String escaped = escapeIdentifier(column);
            return alias == null ? escaped : alias + "." + escaped;
        }

        // ====================================================================
        // Operators
        // ====================================================================

        private String equality(String col, FilterValue value) {
            if (value.isString() && (EMPTY_SENTINEL.equals(value.asString()) || value.asString().isEmpty())) {
                return "(" + col + " = '' OR isNull(" + col + "))";
            }
            if (value.isString() && NOT_AVAILABLE_SENTINEL.equals(value.asString())) {
                return col + " = " + quoteString(NOT_AVAILABLE_LITERAL);
            }
            if (value.isNull()) {
                return "isNull(" + col + ")";
            }
            if (value.isNumber()) {
                return col + " = " + numericLiteral(ensureFiniteNumber(value.scalar(), "eq"));
            }
            if (value.isString()) {
                return col + " = " + quoteString(value.asString());
            }
            throw new InvalidQueryException("Invalid value provided for eq filter");
        }

        private String membership(String col, FilterValue value) {
            boolean includesEmpty = false;
            boolean includesNull = false;
            List<String> literals = new ArrayList<>();

            for (FilterValue element : value.elements()) {
                if (element.isNull()) {
                    includesNull = true;
                } else if (element.isString()) {
                    String text = element.asString();
                    if (EMPTY_SENTINEL.equals(text) || text.isEmpty()) {
                        includesEmpty = true;
                    } else if (NOT_AVAILABLE_SENTINEL.equals(text)) {
                        literals.add(quoteString(NOT_AVAILABLE_LITERAL));
                    } else {
                        literals.add(quoteString(text));
                    }
                } else if (element.isNumber()) {
                    literals.add(numericLiteral(ensureFiniteNumber(element.scalar(), "in")));
                } else {
                    throw new InvalidQueryException("Invalid value provided for in filter");
                }
            }

            List<String> conditions = new ArrayList<>();
            if (!literals.isEmpty()) {
                conditions.add(col + " IN (" + String.join(", ", literals) + ")");
            }
            if (includesEmpty) {
                conditions.add(col + " = ''");
                conditions.add("isNull(" + col + ")");
            } else if (includesNull) {
                conditions.add("isNull(" + col + ")");
            }

            if (conditions.isEmpty()) {
                return ALWAYS_FALSE;
            }
            if (conditions.size() == 1) {
                return conditions.get(0);
            }
            return "(" + String.join(" OR ", conditions) + ")";
        }

        private String between(String col, FilterValue value) {
            if (!value.isList() || value.elements().size() != 2) {
                throw new InvalidQueryException("Between filter requires an array with exactly two values");
            }
            List<FilterValue> bounds = value.elements();
            String start = numericLiteral(ensureFiniteNumber(bounds.get(0).scalar(), "between"));
            String end = numericLiteral(ensureFiniteNumber(bounds.get(1).scalar(), "between"));
            return col + " BETWEEN " + start + " AND " + end;
        }

        private String number(FilterValue value, FilterOperator operator) {
            return numericLiteral(ensureFiniteNumber(value.scalar(), operator.getValue()));
        }

        private String temporalOrder(Filter.Condition condition, String col, String comparison) {
            String ref = referenceColumn(condition);
            return "(" + col + " IS NOT NULL AND " + ref + " IS NOT NULL AND " + col + comparison + ref + ")";
        }

        private String temporalDuration(Filter.Condition condition, String start) {
            if (condition.temporalReferenceColumn() == null || condition.value().isAbsent()) {
                throw new InvalidQueryException(
                    "temporal_duration requires column (start), temporal_reference_column (stop), and value (threshold)");
            }
            String stop = referenceColumn(condition);
            String threshold = numericLiteral(ensureFiniteNumber(condition.value().scalar(), "temporal_duration"));
            return "(" + start + " IS NOT NULL AND " + stop + " IS NOT NULL AND (" + stop + " - " + start + ") >= "
                + threshold + ")";
        }

        private String referenceColumn(Filter.Condition condition) {
            String reference = condition.temporalReferenceColumn();
            if (reference == null || reference.isBlank()) {
                throw new InvalidQueryException(
                    condition.operator().getValue() + " requires column and temporal_reference_column");
            }
            String referenceTable = condition.temporalReferenceTable();
            if (referenceTable != null && condition.tableName() != null && !referenceTable.equals(condition.tableName())) {
                throw new InvalidQueryException(
                    condition.operator().getValue() + " cannot compare against a column of another table ("
                        + referenceTable + ")");
            }
            return columnRef(reference);
        }
    }
}
