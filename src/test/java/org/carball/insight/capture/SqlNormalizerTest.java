package org.carball.insight.capture;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class SqlNormalizerTest {

    @Test
    void shouldReplaceNamedParameters() {
        assertThat(SqlNormalizer.normalize("SELECT * FROM Users WHERE Id = @p0 AND TenantId = @tenantId"))
                .isEqualTo("SELECT * FROM Users WHERE Id = ? AND TenantId = ?");
    }

    @Test
    void shouldReplacePositionalParameters() {
        assertThat(SqlNormalizer.normalize("SELECT * FROM users WHERE id = $1 AND org = $2"))
                .isEqualTo("SELECT * FROM users WHERE id = ? AND org = ?");
    }

    @Test
    void shouldKeepJdbcPlaceholders() {
        assertThat(SqlNormalizer.normalize("SELECT * FROM users WHERE id = ?"))
                .isEqualTo("SELECT * FROM users WHERE id = ?");
    }

    @Test
    void shouldReplaceStringAndNumericLiterals() {
        String first = SqlNormalizer.normalize("SELECT * FROM Users WHERE Name = 'bob' AND Age > 30");
        String second = SqlNormalizer.normalize("SELECT * FROM Users WHERE Name = 'alice' AND Age > 41");

        assertThat(first).isEqualTo("SELECT * FROM Users WHERE Name = ? AND Age > ?");
        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldReplaceDecimalAndExponentLiteralsAsOneValue() {
        String integer = SqlNormalizer.normalize("SELECT * FROM Products WHERE Price > 2");
        String decimal = SqlNormalizer.normalize("SELECT * FROM Products WHERE Price > 1.5");
        String exponent = SqlNormalizer.normalize("SELECT * FROM Products WHERE Price > 2.5E3");
        String leadingDot = SqlNormalizer.normalize("SELECT * FROM Products WHERE Price > .75");

        assertThat(integer).isEqualTo("SELECT * FROM Products WHERE Price > ?");
        assertThat(decimal).isEqualTo(integer);
        assertThat(exponent).isEqualTo(integer);
        assertThat(leadingDot).isEqualTo(integer);
        assertThat(SqlNormalizer.hash(decimal)).isEqualTo(SqlNormalizer.hash(integer));
    }

    @Test
    void shouldReplaceStringWithEscapedQuoteAsOneValue() {
        String escaped = SqlNormalizer.normalize("SELECT * FROM Customers WHERE Name = 'O''Brien' AND Id = 1");
        String plain = SqlNormalizer.normalize("SELECT * FROM Customers WHERE Name = 'Smith' AND Id = 2");
        String empty = SqlNormalizer.normalize("SELECT * FROM Customers WHERE Name = '' AND Id = 3");

        assertThat(plain).isEqualTo("SELECT * FROM Customers WHERE Name = ? AND Id = ?");
        assertThat(escaped).isEqualTo(plain);
        assertThat(empty).isEqualTo(plain);
    }

    @Test
    void shouldKeepQualifiedColumnsWithDigits() {
        assertThat(SqlNormalizer.normalize("SELECT t1.Id FROM Orders t1 WHERE t1.Total >= 10.25 AND Code = 'A1'"))
                .isEqualTo("SELECT t1.Id FROM Orders t1 WHERE t1.Total >= ? AND Code = ?");
    }

    @Test
    void shouldNotTouchDigitsInsideIdentifiers() {
        assertThat(SqlNormalizer.normalize("SELECT t0.Id, Column1 FROM Orders AS t0 WHERE t0.Total > 100"))
                .isEqualTo("SELECT t0.Id, Column1 FROM Orders AS t0 WHERE t0.Total > ?");
    }

    @Test
    void shouldCollapseWhitespace() {
        assertThat(SqlNormalizer.normalize("  SELECT   *\n\tFROM  Users\r\n WHERE Id = 1 "))
                .isEqualTo("SELECT * FROM Users WHERE Id = ?");
    }

    @Test
    void shouldTreatNullAsEmpty() {
        assertThat(SqlNormalizer.normalize(null)).isEmpty();
    }

    @Test
    void shouldProduceSixteenCharacterLowercaseHash() {
        String hash = SqlNormalizer.hash("SELECT * FROM Users WHERE Id = ?");

        assertThat(hash).hasSize(16).matches("[0-9a-f]{16}");
        assertThat(SqlNormalizer.hash("SELECT * FROM Users WHERE Id = ?")).isEqualTo(hash);
        assertThat(SqlNormalizer.hash("SELECT * FROM Orders WHERE Id = ?")).isNotEqualTo(hash);
    }
}
