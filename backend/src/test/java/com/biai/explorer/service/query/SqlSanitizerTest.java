package com.biai.explorer.service.query;

import com.biai.explorer.exception.InvalidIdentifierException;
import com.biai.explorer.exception.InvalidQueryException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlSanitizerTest {

    private static final Set<String> COLUMNS = Set.of("patient_id", "age", "Sex");

    @Test
    void validateIdentifierTrimsAndMatchesWhitelist() {
        assertThat(SqlSanitizer.validateIdentifier("  age ", COLUMNS)).isEqualTo("age");
    }

    @Test
    void validateIdentifierIsCaseSensitive() {
        assertThatThrownBy(() -> SqlSanitizer.validateIdentifier("sex", COLUMNS))
            .isInstanceOf(InvalidIdentifierException.class)
            .hasMessage("Invalid column name: 'sex' is not a valid column");
    }

    @Test
    void validateIdentifierRejectsBlankAndOverlongNames() {
        assertThatThrownBy(() -> SqlSanitizer.validateIdentifier("  ", COLUMNS))
            .hasMessageContaining("must be a non-empty string");
        assertThatThrownBy(() -> SqlSanitizer.validateIdentifierFormat("a".repeat(129)))
            .hasMessageContaining("exceeds maximum length of 128");
    }

    @ParameterizedTest
    @ValueSource(strings = {"1abc", "a-b", "a b", "a;DROP TABLE x", "col`", "名前"})
    void validateIdentifierFormatRejectsUnsafeNames(String name) {
        assertThatThrownBy(() -> SqlSanitizer.validateIdentifierFormat(name))
            .isInstanceOf(InvalidIdentifierException.class);
    }

    @Test
    void escapeIdentifierQuotesWithBackticks() {
        assertThat(SqlSanitizer.escapeIdentifier("_sample_id2")).isEqualTo("`_sample_id2`");
    }

    @Test
    void escapedIdentifierUnquotesToOriginal() {
        String escaped = SqlSanitizer.escapeIdentifier("patient_id");
        String unquoted = escaped.substring(1, escaped.length() - 1).replace("``", "`");
        assertThat(unquoted).isEqualTo("patient_id");
    }

    @Test
    void qualifyStorageNameAddsDefaultDatabase() {
        assertThat(SqlSanitizer.qualifyStorageName("patients_ab12", "biai")).isEqualTo("`biai`.`patients_ab12`");
        assertThat(SqlSanitizer.qualifyStorageName("other.samples", "biai")).isEqualTo("`other`.`samples`");
    }

    @Test
    void qualifyStorageNameRejectsInjectedDatabase() {
        assertThatThrownBy(() -> SqlSanitizer.qualifyStorageName("biai.x; DROP", "biai"))
            .isInstanceOf(InvalidIdentifierException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"1.5", "-1", "1e10", "0x10", "NaN", "Infinity", "null", "undefined", "", " "})
    void ensurePositiveIntegerRejectsNonIntegerStrings(String value) {
        assertThatThrownBy(() -> SqlSanitizer.ensurePositiveInteger(value, "limit"))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessage("Invalid limit: must be a non-negative integer");
    }

    @Test
    void ensurePositiveIntegerRejectsNonIntegralNumbers() {
        assertThatThrownBy(() -> SqlSanitizer.ensurePositiveInteger(1.5, "limit"))
            .isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> SqlSanitizer.ensurePositiveInteger(Double.NaN, "limit"))
            .isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> SqlSanitizer.ensurePositiveInteger(-3, "limit"))
            .isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> SqlSanitizer.ensurePositiveInteger(null, "limit"))
            .isInstanceOf(InvalidQueryException.class);
    }

    @Test
    void ensurePositiveIntegerAcceptsIntegers() {
        assertThat(SqlSanitizer.ensurePositiveInteger(0, "limit")).isZero();
        assertThat(SqlSanitizer.ensurePositiveInteger("0", "limit")).isZero();
        assertThat(SqlSanitizer.ensurePositiveInteger(" 50 ", "limit")).isEqualTo(50);
        assertThat(SqlSanitizer.ensurePositiveInteger(100L, "limit")).isEqualTo(100);
        assertThat(SqlSanitizer.ensurePositiveInteger(BigInteger.TEN, "limit")).isEqualTo(10);
    }

    @Test
    void ensurePositiveIntegerRejectsValuesBeyondIntRange() {
        assertThatThrownBy(() -> SqlSanitizer.ensurePositiveInteger("2147483648", "limit"))
            .isInstanceOf(InvalidQueryException.class);
    }

    @Test
    void ensureFiniteNumberRejectsNonFiniteAndGarbage() {
        assertThatThrownBy(() -> SqlSanitizer.ensureFiniteNumber(Double.POSITIVE_INFINITY, "gt"))
            .hasMessage("Invalid numeric value provided for gt filter");
        assertThatThrownBy(() -> SqlSanitizer.ensureFiniteNumber("12abc", "gt"))
            .hasMessage("Invalid numeric value provided for gt filter");
        assertThatThrownBy(() -> SqlSanitizer.ensureFiniteNumber(null, "lt"))
            .isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> SqlSanitizer.ensureFiniteNumber("1e999999999", "gt"))
            .hasMessage("Invalid numeric value provided for gt filter");
        assertThatThrownBy(() -> SqlSanitizer.ensureFiniteNumber("1e-999999999", "between"))
            .hasMessage("Invalid numeric value provided for between filter");
        assertThatThrownBy(() -> SqlSanitizer.ensureFiniteNumber(BigInteger.TEN.pow(500), "in"))
            .isInstanceOf(InvalidQueryException.class);
        assertThat(SqlSanitizer.ensureFiniteNumber("1e-20", "lt")).isEqualByComparingTo("0.00000000000000000001");
    }

    @Test
    void numericLiteralRendersPlainNumbers() {
        assertThat(SqlSanitizer.numericLiteral(new BigDecimal("30.00"))).isEqualTo("30");
        assertThat(SqlSanitizer.numericLiteral(new BigDecimal("1E+3"))).isEqualTo("1000");
        assertThat(SqlSanitizer.numericLiteral(SqlSanitizer.ensureFiniteNumber(" 2.50 ", "eq"))).isEqualTo("2.5");
    }

    @Test
    void escapeStringValueEscapesBackslashBeforeQuote() {
        assertThat(SqlSanitizer.escapeStringValue("O'Brien")).isEqualTo("O\\'Brien");
        assertThat(SqlSanitizer.escapeStringValue("a\\'b")).isEqualTo("a\\\\\\'b");
        assertThat(SqlSanitizer.quoteString("x")).isEqualTo("'x'");
    }

    @Test
    void escapeStringValueRejectsNonStrings() {
        assertThatThrownBy(() -> SqlSanitizer.escapeStringValue(42))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessage("Value must be a string");
    }
}
