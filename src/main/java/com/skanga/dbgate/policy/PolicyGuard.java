package com.skanga.dbgate.policy;

import com.skanga.dbgate.config.ResourceManager;
import com.skanga.dbgate.error.ParameterBindingException;
import com.skanga.dbgate.error.ReadOnlyViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Safety checks applied to every statement before it reaches a connection.
 *
 * <p>Statement classification is a lexical heuristic: comments and literals are skipped, then the leading
 * keyword of each statement decides. Only statements that start with a read keyword and contain no
 * data-modifying keyword count as {@link StatementType#READ}; everything else, including input the
 * heuristic cannot make sense of, is {@link StatementType#WRITE}.
 *
 * <p>Instances hold no mutable state and are safe to share between threads.
 */
public class PolicyGuard {
    private static final Logger logger = LoggerFactory.getLogger(PolicyGuard.class);

    private static final Set<String> READ_KEYWORDS = Set.of(
            "SELECT", "SHOW", "DESCRIBE", "DESC", "EXPLAIN", "WITH", "VALUES", "TABLE");

    // keywords that make an otherwise read-looking statement change data or write files
    private static final Set<String> WRITE_MARKERS = Set.of(
            "INSERT", "UPDATE", "DELETE", "MERGE", "REPLACE", "UPSERT", "TRUNCATE", "CREATE", "DROP", "ALTER",
            "RENAME", "GRANT", "REVOKE", "OUTFILE", "DUMPFILE", "CALL");

    // write markers that are also names of built-in string functions when followed by '('
    private static final Set<String> FUNCTION_NAMES = Set.of("INSERT", "REPLACE");

    private final boolean readOnly;

    public PolicyGuard(boolean readOnly) {
        this.readOnly = readOnly;
    }

    /**
     * Classifies a statement as read or write.
     *
     * @param sqlText the statement text, may contain comments
     * @return READ only for a single read statement; batches of several statements are always WRITE
     */
    public StatementType classify(String sqlText) {
        List<List<SqlLexer.Token>> sqlStatements = splitStatements(SqlLexer.tokenize(sqlText));
        if (sqlStatements.size() != 1) {
            return StatementType.WRITE;
        }
        return classifyStatement(sqlStatements.get(0));
    }

    /**
     * Rejects empty statements, and write statements when running read-only.
     *
     * @param sqlText the statement text
     * @return the statement classification
     * @throws ReadOnlyViolationException if a write is attempted in read-only mode
     * @throws IllegalArgumentException   if the statement is empty
     */
    public StatementType checkAllowed(String sqlText) throws ReadOnlyViolationException {
        if (sqlText == null || sqlText.trim().isEmpty()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("sql.validation.empty"));
        }
        StatementType statementType = classify(sqlText);
        if (readOnly && statementType == StatementType.WRITE) {
            String leadingKeyword = leadingKeyword(sqlText);
            logger.warn("Blocked write statement in read-only mode: {}", leadingKeyword);
            throw new ReadOnlyViolationException(
                    ResourceManager.getErrorMessage("sql.readonly.denied", leadingKeyword));
        }
        return statementType;
    }

    /**
     * Rewrites DB-API style {@code %s} placeholders into JDBC {@code ?} placeholders.
     * When any {@code %s} is rewritten, {@code %%} escapes collapse to a single {@code %}, as they do for
     * format-style parameter substitution. Text inside literals and comments is left alone otherwise.
     *
     * @param sqlText the statement text
     * @return the statement ready for {@link java.sql.Connection#prepareStatement(String)}
     */
    public String prepareSql(String sqlText) {
        List<SqlLexer.Token> sqlTokens = SqlLexer.tokenize(sqlText);
        boolean hasFormatPlaceholders = sqlTokens.stream()
                .anyMatch(t -> t.type() == SqlLexer.TokenType.FORMAT_PLACEHOLDER);
        if (!hasFormatPlaceholders) {
            return sqlText;
        }
        StringBuilder preparedSql = new StringBuilder(sqlText.length());
        int copiedUpTo = 0;
        for (SqlLexer.Token sqlToken : sqlTokens) {
            if (sqlToken.type() == SqlLexer.TokenType.FORMAT_PLACEHOLDER) {
                preparedSql.append(sqlText, copiedUpTo, sqlToken.start()).append('?');
                copiedUpTo = sqlToken.end();
            }
        }
        preparedSql.append(sqlText.substring(copiedUpTo));
        return preparedSql.toString().replace("%%", "%");
    }

    /**
     * Counts bind placeholders outside literals and comments, in either style.
     */
    public int countPlaceholders(String sqlText) {
        int placeholderCount = 0;
        for (SqlLexer.Token sqlToken : SqlLexer.tokenize(sqlText)) {
            if (sqlToken.type() == SqlLexer.TokenType.QUESTION_PLACEHOLDER
                    || sqlToken.type() == SqlLexer.TokenType.FORMAT_PLACEHOLDER) {
                placeholderCount++;
            }
        }
        return placeholderCount;
    }

    /**
     * Verifies that the number of supplied parameters matches the placeholders.
     *
     * @throws ParameterBindingException on a mismatch
     */
    public void checkParameterCount(String sqlText, List<?> paramList) throws ParameterBindingException {
        int placeholderCount = countPlaceholders(sqlText);
        int paramCount = paramList == null ? 0 : paramList.size();
        if (placeholderCount != paramCount) {
            throw new ParameterBindingException(ResourceManager.getErrorMessage(
                    "sql.parameter.count.mismatch", placeholderCount, paramCount));
        }
    }

    /**
     * Binds parameters through the typed JDBC setters. Values are never spliced into the SQL text.
     *
     * @param prepStmt  statement prepared from {@link #prepareSql(String)}
     * @param paramList positional parameters, may be null
     * @throws ParameterBindingException if the driver rejects a value
     */
    public void bind(PreparedStatement prepStmt, List<?> paramList) throws ParameterBindingException {
        if (paramList == null || paramList.isEmpty()) {
            logger.debug("No parameters to bind for query");
            return;
        }
        logger.debug("Binding {} parameters to query", paramList.size());
        for (int i = 0; i < paramList.size(); i++) {
            Object paramValue = paramList.get(i);
            try {
                setParameterValue(prepStmt, i + 1, paramValue);
                logger.trace("Parameter {}: type {}", i + 1,
                        paramValue != null ? paramValue.getClass().getSimpleName() : "null");
            } catch (SQLException e) {
                logger.error("Failed to bind parameter {}: {}", i + 1, e.getMessage());
                throw new ParameterBindingException(
                        ResourceManager.getErrorMessage("sql.parameter.bind.failed", i + 1, e.getMessage()), e);
            }
        }
    }

    /**
     * Truncates rows to at most {@code limit} entries.
     *
     * @return the same list when already within the limit, otherwise a copy of the first {@code limit} rows
     */
    public <T> List<T> cap(List<T> resultRows, int limit) {
        if (resultRows.size() <= limit) {
            return resultRows;
        }
        return new ArrayList<>(resultRows.subList(0, Math.max(0, limit)));
    }

    private StatementType classifyStatement(List<SqlLexer.Token> statementTokens) {
        String firstWord = null;
        for (SqlLexer.Token sqlToken : statementTokens) {
            if (sqlToken.type() == SqlLexer.TokenType.WORD) {
                firstWord = sqlToken.text();
                break;
            }
            if (sqlToken.type() != SqlLexer.TokenType.OPEN_PAREN) {
                return StatementType.WRITE;
            }
        }
        if (firstWord == null || !READ_KEYWORDS.contains(firstWord)) {
            return StatementType.WRITE;
        }

        for (int i = 0; i < statementTokens.size(); i++) {
            SqlLexer.Token sqlToken = statementTokens.get(i);
            if (sqlToken.type() != SqlLexer.TokenType.WORD || !WRITE_MARKERS.contains(sqlToken.text())) {
                continue;
            }
            boolean calledAsFunction = FUNCTION_NAMES.contains(sqlToken.text())
                    && i + 1 < statementTokens.size()
                    && statementTokens.get(i + 1).type() == SqlLexer.TokenType.OPEN_PAREN
                    && statementTokens.get(i + 1).start() == sqlToken.end();
            if (!calledAsFunction) {
                return StatementType.WRITE;
            }
        }
        return StatementType.READ;
    }

    private static List<List<SqlLexer.Token>> splitStatements(List<SqlLexer.Token> sqlTokens) {
        List<List<SqlLexer.Token>> sqlStatements = new ArrayList<>();
        List<SqlLexer.Token> currentStatement = new ArrayList<>();
        for (SqlLexer.Token sqlToken : sqlTokens) {
            if (sqlToken.type() == SqlLexer.TokenType.SEMICOLON) {
                if (!currentStatement.isEmpty()) {
                    sqlStatements.add(currentStatement);
                    currentStatement = new ArrayList<>();
                }
            } else {
                currentStatement.add(sqlToken);
            }
        }
        if (!currentStatement.isEmpty()) {
            sqlStatements.add(currentStatement);
        }
        return sqlStatements;
    }

    private static String leadingKeyword(String sqlText) {
        for (SqlLexer.Token sqlToken : SqlLexer.tokenize(sqlText)) {
            if (sqlToken.type() == SqlLexer.TokenType.WORD) {
                return sqlToken.text();
            }
        }
        return "UNKNOWN";
    }

    private static void setParameterValue(PreparedStatement prepStmt, int paramIndex, Object paramValue) throws SQLException {
        if (paramValue == null) {
            prepStmt.setNull(paramIndex, Types.NULL);
        } else if (paramValue instanceof String) {
            prepStmt.setString(paramIndex, (String) paramValue);
        } else if (paramValue instanceof Integer) {
            prepStmt.setInt(paramIndex, (Integer) paramValue);
        } else if (paramValue instanceof Long) {
            prepStmt.setLong(paramIndex, (Long) paramValue);
        } else if (paramValue instanceof Double) {
            prepStmt.setDouble(paramIndex, (Double) paramValue);
        } else if (paramValue instanceof Float) {
            prepStmt.setFloat(paramIndex, (Float) paramValue);
        } else if (paramValue instanceof Boolean) {
            prepStmt.setBoolean(paramIndex, (Boolean) paramValue);
        } else if (paramValue instanceof BigDecimal) {
            prepStmt.setBigDecimal(paramIndex, (BigDecimal) paramValue);
        } else if (paramValue instanceof BigInteger) {
            prepStmt.setBigDecimal(paramIndex, new BigDecimal((BigInteger) paramValue));
        } else if (paramValue instanceof java.sql.Date) {
            prepStmt.setDate(paramIndex, (java.sql.Date) paramValue);
        } else if (paramValue instanceof java.sql.Time) {
            prepStmt.setTime(paramIndex, (java.sql.Time) paramValue);
        } else if (paramValue instanceof java.sql.Timestamp) {
            prepStmt.setTimestamp(paramIndex, (java.sql.Timestamp) paramValue);
        } else if (paramValue instanceof java.util.Date) {
            prepStmt.setTimestamp(paramIndex, new java.sql.Timestamp(((java.util.Date) paramValue).getTime()));
        } else if (paramValue instanceof LocalDate || paramValue instanceof LocalDateTime
                || paramValue instanceof LocalTime || paramValue instanceof OffsetDateTime) {
            prepStmt.setObject(paramIndex, paramValue);
        } else if (paramValue instanceof byte[]) {
            prepStmt.setBytes(paramIndex, (byte[]) paramValue);
        } else {
            // For other types, convert to string and let the database handle it
            prepStmt.setString(paramIndex, paramValue.toString());
        }
    }
}
