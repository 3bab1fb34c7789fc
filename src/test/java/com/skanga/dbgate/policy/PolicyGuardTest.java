package com.skanga.dbgate.policy;

import com.skanga.dbgate.error.ParameterBindingException;
import com.skanga.dbgate.error.ReadOnlyViolationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class PolicyGuardTest {
    private final PolicyGuard readOnlyGuard = new PolicyGuard(true);
    private final PolicyGuard readWriteGuard = new PolicyGuard(false);

    @Mock
    PreparedStatement statement;

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT * FROM countries",
            "  select name from cities where id = 1",
            "SHOW TABLES",
            "DESCRIBE cities",
            "DESC cities",
            "EXPLAIN SELECT 1",
            "WITH big AS (SELECT * FROM cities) SELECT * FROM big",
            "(SELECT 1) UNION (SELECT 2)",
            "-- leading comment\nSELECT 1",
            "/* block */ SELECT 1",
            "# hash comment\nSELECT 1",
            "SELECT 'DELETE FROM cities' AS text",
            "SELECT `update` FROM t",
            "SELECT REPLACE(name, 'a', 'b') FROM cities",
            "SELECT INSERT(name, 1, 2, 'xx') FROM cities",
            "SELECT * FROM cities ORDER BY name DESC;",
            "VALUES (1, 2)",
            "TABLE cities"
    })
    void testReadStatements(String sql) {
        assertEquals(StatementType.READ, readOnlyGuard.classify(sql), sql);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "INSERT INTO cities (name) VALUES ('x')",
            "update cities set name = 'x'",
            "DELETE FROM cities",
            "DROP TABLE cities",
            "CREATE TABLE t (id INT)",
            "ALTER TABLE cities ADD COLUMN x INT",
            "TRUNCATE TABLE cities",
            "GRANT ALL ON *.* TO 'x'",
            "REPLACE INTO cities VALUES (1)",
            "CALL cleanup()",
            "SET @a = 1",
            "-- SELECT\nDELETE FROM cities",
            "/* SELECT */ DELETE FROM cities",
            "WITH doomed AS (SELECT id FROM cities) DELETE FROM cities WHERE id IN (SELECT id FROM doomed)",
            "SELECT * FROM cities; DELETE FROM cities",
            "SELECT 1; SELECT 2",
            "SELECT * INTO OUTFILE '/tmp/x' FROM cities",
            "SELECT * FROM cities FOR UPDATE",
            "SELECT 1 /*! ; DROP TABLE cities */",
            "/*!50000 DELETE FROM cities */",
            "SELECT * FROM cities /*M! INTO OUTFILE '/tmp/x' */",
            "SELECT * FROM cities /*M!100100 FOR UPDATE */",
            "",
            "   ",
            "-- only a comment"
    })
    void testWriteStatements(String sql) {
        assertEquals(StatementType.WRITE, readOnlyGuard.classify(sql), sql);
    }

    @Test
    void testReadOnlyRejectsWrite() {
        assertThatThrownBy(() -> readOnlyGuard.checkAllowed("DELETE FROM cities"))
                .isInstanceOf(ReadOnlyViolationException.class)
                .hasMessageContaining("DELETE");
    }

    @Test
    void testReadWriteAllowsWrite() throws Exception {
        assertEquals(StatementType.WRITE, readWriteGuard.checkAllowed("DELETE FROM cities"));
    }

    @Test
    void testReadOnlyAllowsRead() throws Exception {
        assertEquals(StatementType.READ, readOnlyGuard.checkAllowed("SELECT 1"));
    }

    @Test
    void testEmptySqlRejected() {
        assertThatThrownBy(() -> readOnlyGuard.checkAllowed("  "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> readWriteGuard.checkAllowed(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testPrepareSqlRewritesFormatPlaceholders() {
        assertEquals("SELECT * FROM cities WHERE name = ? AND population > ?",
                readOnlyGuard.prepareSql("SELECT * FROM cities WHERE name = %s AND population > %s"));
    }

    @Test
    void testPrepareSqlLeavesLiteralsAlone() {
        assertEquals("SELECT '%s' AS raw, name FROM cities WHERE id = ?",
                readOnlyGuard.prepareSql("SELECT '%s' AS raw, name FROM cities WHERE id = %s"));
    }

    @Test
    void testPrepareSqlCollapsesEscapedPercent() {
        assertEquals("SELECT name FROM cities WHERE name LIKE 'P%' AND id = ?",
                readOnlyGuard.prepareSql("SELECT name FROM cities WHERE name LIKE 'P%%' AND id = %s"));
    }

    @Test
    void testPrepareSqlWithoutFormatPlaceholdersIsUnchanged() {
        String sql = "SELECT name FROM cities WHERE name LIKE 'P%%' AND id = ?";
        assertSame(sql, readOnlyGuard.prepareSql(sql));
    }

    @Test
    void testCountPlaceholders() {
        assertEquals(2, readOnlyGuard.countPlaceholders("SELECT * FROM t WHERE a = ? AND b = %s"));
        assertEquals(0, readOnlyGuard.countPlaceholders("SELECT '?' FROM t -- ?"));
    }

    @Test
    void testParameterCountMismatch() {
        assertThatThrownBy(() -> readOnlyGuard.checkParameterCount("SELECT * FROM t WHERE a = ?", List.of()))
                .isInstanceOf(ParameterBindingException.class)
                .hasMessageContaining("1 placeholder")
                .hasMessageContaining("0 parameter");
    }

    @Test
    void testParameterCountMatchesWithNullList() throws Exception {
        readOnlyGuard.checkParameterCount("SELECT 1", null);
    }

    @Test
    void testBindUsesTypedSetters() throws Exception {
        List<Object> params = Arrays.asList("Paris", 7, 9_000_000_000L, 1.5d, true,
                new BigDecimal("12.50"), null, LocalDate.of(2024, 1, 31));

        readOnlyGuard.bind(statement, params);

        verify(statement).setString(1, "Paris");
        verify(statement).setInt(2, 7);
        verify(statement).setLong(3, 9_000_000_000L);
        verify(statement).setDouble(4, 1.5d);
        verify(statement).setBoolean(5, true);
        verify(statement).setBigDecimal(6, new BigDecimal("12.50"));
        verify(statement).setNull(7, Types.NULL);
        verify(statement).setObject(8, LocalDate.of(2024, 1, 31));
    }

    @Test
    void testBindNothing() throws Exception {
        readOnlyGuard.bind(statement, null);
        verifyNoInteractions(statement);
    }

    @Test
    void testBindFailureIsWrapped() throws Exception {
        doThrow(new SQLException("bad value")).when(statement).setString(1, "x");

        assertThatThrownBy(() -> readOnlyGuard.bind(statement, List.of("x")))
                .isInstanceOf(ParameterBindingException.class)
                .hasMessageContaining("position 1")
                .hasCauseInstanceOf(SQLException.class);
    }

    @Test
    void testCap() {
        List<Integer> rows = List.of(1, 2, 3, 4);

        assertThat(readOnlyGuard.cap(rows, 2)).containsExactly(1, 2);
        assertSame(rows, readOnlyGuard.cap(rows, 4));
        assertThat(readOnlyGuard.cap(rows, 0)).isEmpty();
    }
}
