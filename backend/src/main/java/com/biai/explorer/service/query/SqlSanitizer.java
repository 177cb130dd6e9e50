package com.biai.explorer.service.query;

import com.biai.explorer.exception.InvalidIdentifierException;
import com.biai.explorer.exception.InvalidQueryException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * SQL sanitization for ClickHouse.
 *
 * Identifiers (column/table names) cannot be bound as parameters, so they are
 * validated against the schema whitelist and the identifier format, then quoted
 * with backticks. String literals are escaped backslash-first. Every identifier or
 * value interpolated into generated SQL goes through this class.
 */
public final class SqlSanitizer {

    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
    private static final Pattern DIGITS_PATTERN = Pattern.compile("^\\d+$");

    public static final int MAX_IDENTIFIER_LENGTH = 128;
    public static final int MAX_NUMERIC_DIGITS = 400;

    private SqlSanitizer() {
    }

    // ========================================================================
    // Identifiers
    // ========================================================================

    public static String validateIdentifier(String name, Set<String> allowed) {
        return validateIdentifier(name, allowed, "column");
    }

    /**
     * Validate an identifier against the names known for the schema.
     *
     * @param name raw identifier from the request
     * @param allowed identifiers that exist (case-sensitive)
     * @param entityType "column", "table" or "database", used in messages
     * @return the trimmed identifier
     */
    public static String validateIdentifier(String name, Set<String> allowed, String entityType) {
        String trimmed = requireNonBlank(name, entityType);

        if (!allowed.contains(trimmed)) {
            throw new InvalidIdentifierException(
                "Invalid " + entityType + " name: '" + trimmed + "' is not a valid " + entityType);
        }
        return trimmed;
    }

    public static String validateIdentifierFormat(String name) {
        return validateIdentifierFormat(name, "column");
    }

    public static String validateIdentifierFormat(String name, String entityType) {
        String trimmed = requireNonBlank(name, entityType);

        if (!IDENTIFIER_PATTERN.matcher(trimmed).matches()) {
            throw new InvalidIdentifierException("Invalid " + entityType + " name format: '" + trimmed + "'");
        }
        return trimmed;
    }

    public static boolean isValidIdentifierFormat(String name) {
        if (name == null) {
            return false;
        }
        String trimmed = name.trim();
        return !trimmed.isEmpty()
            && trimmed.length() <= MAX_IDENTIFIER_LENGTH
            && IDENTIFIER_PATTERN.matcher(trimmed).matches();
    }

    /**
     * Quote an identifier with backticks. The format is re-checked first, so the
     * embedded-backtick doubling only matters if the pattern is ever relaxed.
     */
    public static String escapeIdentifier(String name) {
        String valid = validateIdentifierFormat(name, "identifier");
        return "`" + valid.replace("`", "``") + "`";
    }

    /**
     * Escape a possibly database-qualified storage name, e.g. {@code biai.patients_x}
     * becomes {@code `biai`.`patients_x`}.
     */
    public static String qualifyTableName(String database, String table) {
        return escapeIdentifier(database) + "." + escapeIdentifier(table);
    }

    /**
     * Qualify a stored table name with {@code defaultDatabase} unless it already
     * carries a database prefix.
     */
    public static String qualifyStorageName(String storageName, String defaultDatabase) {
        String trimmed = requireNonBlank(storageName, "table");
        int dot = trimmed.indexOf('.');
        if (dot < 0) {
            return qualifyTableName(defaultDatabase, trimmed);
        }
        return qualifyTableName(trimmed.substring(0, dot), trimmed.substring(dot + 1));
    }

    private static String requireNonBlank(String name, String entityType) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidIdentifierException("Invalid " + entityType + " name: must be a non-empty string");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_IDENTIFIER_LENGTH) {
            throw new InvalidIdentifierException(
                "Invalid " + entityType + " name: exceeds maximum length of " + MAX_IDENTIFIER_LENGTH);
        }
        return trimmed;
    }

    // ========================================================================
    // Values
    // ========================================================================

    /**
     * Validate a non-negative integer (LIMIT, bin counts). Accepts integral number
     * types and digit-only strings; floats, exponents, hex and NaN/Infinity are rejected.
     */
    public static int ensurePositiveInteger(Object value, String paramName) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            BigInteger integer = value instanceof BigInteger big ? big : BigInteger.valueOf(((Number) value).longValue());
            return toNonNegativeInt(integer, paramName);
        }

        if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            if (!DIGITS_PATTERN.matcher(trimmed).matches()) {
                throw invalidInteger(paramName);
            }
            return toNonNegativeInt(new BigInteger(trimmed), paramName);
        }

        throw invalidInteger(paramName);
    }

    private static int toNonNegativeInt(BigInteger value, String paramName) {
        if (value.signum() < 0 || value.bitLength() >= Integer.SIZE) {
            throw invalidInteger(paramName);
        }
        return value.intValue();
    }

    private static InvalidQueryException invalidInteger(String paramName) {
        return new InvalidQueryException("Invalid " + paramName + ": must be a non-negative integer");
    }

    /**
     * Validate a finite number for numeric comparisons. Strings must parse as a
     * decimal literal within double range; the returned value is what gets rendered
     * into SQL.
     */
    public static BigDecimal ensureFiniteNumber(Object value, String context) {
        if (value instanceof BigDecimal decimal) {
            return bounded(decimal, context);
        }
        if (value instanceof BigInteger integer) {
            return bounded(new BigDecimal(integer), context);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isFinite(d)) {
                throw invalidNumber(context);
            }
            return BigDecimal.valueOf(d);
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.longValue());
        }
        if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            if (trimmed.isEmpty()) {
                throw invalidNumber(context);
            }
            BigDecimal parsed;
            try {
                parsed = new BigDecimal(trimmed);
            } catch (NumberFormatException e) {
                throw new InvalidQueryException("Invalid numeric value provided for " + context + " filter", e);
            }
            if (!Double.isFinite(parsed.doubleValue())) {
                throw invalidNumber(context);
            }
            return bounded(parsed, context);
        }
        throw invalidNumber(context);
    }

    /**
     * Literals are rendered in plain notation, so both the digit count and the
     * exponent must stay small.
     */
    private static BigDecimal bounded(BigDecimal value, String context) {
        if (value.precision() > MAX_NUMERIC_DIGITS || Math.abs((long) value.scale()) > MAX_NUMERIC_DIGITS) {
            throw invalidNumber(context);
        }
        return value;
    }

    /**
     * Render a validated number as a plain SQL literal ({@code 30}, {@code 1.5}).
     */
    public static String numericLiteral(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() < 0) {
            stripped = stripped.setScale(0);
        }
        return stripped.toPlainString();
    }

    private static InvalidQueryException invalidNumber(String context) {
        return new InvalidQueryException("Invalid numeric value provided for " + context + " filter");
    }

    /**
     * Escape a string value for use inside single quotes. Backslashes are escaped
     * before quotes so an escaped quote cannot be un-escaped by input.
     */
    public static String escapeStringValue(Object value) {
        if (!(value instanceof String text)) {
            throw new InvalidQueryException("Value must be a string");
        }
        return text.replace("\\", "\\\\").replace("'", "\\'");
    }

    public static String quoteString(String value) {
        return "'" + escapeStringValue(value) + "'";
    }
}
