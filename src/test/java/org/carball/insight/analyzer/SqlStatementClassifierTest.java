package org.carball.insight.analyzer;

import org.carball.insight.analyzer.SqlStatementClassifier.StatementKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class SqlStatementClassifierTest {

    @Test
    void shouldClassifySelectAsRead() {
        assertThat(SqlStatementClassifier.classify("SELECT Id, Name FROM Users WHERE Id = ?"))
                .isEqualTo(StatementKind.READ);
        assertThat(SqlStatementClassifier.isRead("WITH recent AS (SELECT Id FROM Orders) SELECT * FROM recent"))
                .isTrue();
    }

    @Test
    void shouldClassifyDataModificationAsWrite() {
        assertThat(SqlStatementClassifier.classify("INSERT INTO Users (Name) VALUES ('a')")).isEqualTo(StatementKind.WRITE);
        assertThat(SqlStatementClassifier.classify("UPDATE Users SET Name = 'b' WHERE Id = 1")).isEqualTo(StatementKind.WRITE);
        assertThat(SqlStatementClassifier.classify("DELETE FROM Users WHERE Id = 1")).isEqualTo(StatementKind.WRITE);
    }

    @Test
    void shouldClassifyDdlAsOther() {
        assertThat(SqlStatementClassifier.classify("CREATE TABLE Users (Id INT)")).isEqualTo(StatementKind.OTHER);
    }

    @Test
    void shouldTreatBlankInputAsOther() {
        assertThat(SqlStatementClassifier.classify(null)).isEqualTo(StatementKind.OTHER);
        assertThat(SqlStatementClassifier.classify("   ")).isEqualTo(StatementKind.OTHER);
    }

    @Test
    void shouldFallBackToLeadingKeyword() {
        assertThat(SqlStatementClassifier.classifyByKeyword("-- load users\nSELECT 1")).isEqualTo(StatementKind.READ);
        assertThat(SqlStatementClassifier.classifyByKeyword("/* hint */ update Users set Name = 'x'"))
                .isEqualTo(StatementKind.WRITE);
        assertThat(SqlStatementClassifier.classifyByKeyword("EXEC sp_who")).isEqualTo(StatementKind.OTHER);
    }

    @Test
    void shouldTreatCteFeedingDeleteAsWrite() {
        assertThat(SqlStatementClassifier.classifyByKeyword(
                "WITH gone AS (DELETE FROM Sessions RETURNING *) SELECT count(*) FROM gone"))
                .isEqualTo(StatementKind.WRITE);
    }
}
