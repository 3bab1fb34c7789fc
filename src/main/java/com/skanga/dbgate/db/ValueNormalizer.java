package com.skanga.dbgate.db;

import java.io.IOException;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.time.OffsetDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

/**
 * Converts JDBC column values into JSON-friendly Java values. Every row value the gateway returns passes
 * through here.
 *
 * <ul>
 *   <li>numbers (including {@link java.math.BigDecimal}) and booleans are kept</li>
 *   <li>dates, times and timestamps become ISO-8601 strings</li>
 *   <li>binary values become UTF-8 text when they decode cleanly, Base64 otherwise</li>
 *   <li>LOBs are read into strings; everything else becomes its string form</li>
 * </ul>
 */
public final class ValueNormalizer {
    private static final int MAX_LOB_CHARS = 1_000_000;
    private static final int MAX_ARRAY_DEPTH = 3;

    private ValueNormalizer() {
    }

    /**
     * Reads and normalizes one column of the current row.
     *
     * @param resultSet   result set positioned on a row
     * @param columnIndex 1-based column index
     * @throws SQLException if the driver fails to read the value
     */
    public static Object readValue(ResultSet resultSet, int columnIndex) throws SQLException {
        return normalize(resultSet.getObject(columnIndex));
    }

    public static Object normalize(Object columnValue) throws SQLException {
        return normalize(columnValue, 0);
    }

    private static Object normalize(Object columnValue, int depth) throws SQLException {
        if (columnValue == null) {
            return null;
        }
        if (columnValue instanceof Number || columnValue instanceof Boolean || columnValue instanceof String) {
            return columnValue;
        }
        if (columnValue instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) columnValue).toLocalDateTime().toString();
        }
        if (columnValue instanceof java.sql.Date) {
            return ((java.sql.Date) columnValue).toLocalDate().toString();
        }
        if (columnValue instanceof java.sql.Time) {
            return ((java.sql.Time) columnValue).toLocalTime().toString();
        }
        if (columnValue instanceof java.util.Date) {
            return ((java.util.Date) columnValue).toInstant().toString();
        }
        if (columnValue instanceof OffsetDateTime) {
            return ((OffsetDateTime) columnValue).toString();
        }
        if (columnValue instanceof TemporalAccessor) {
            return columnValue.toString();
        }
        if (columnValue instanceof byte[]) {
            return decodeBytes((byte[]) columnValue);
        }
        if (columnValue instanceof Clob) {
            return readClob((Clob) columnValue);
        }
        if (columnValue instanceof Blob) {
            Blob blob = (Blob) columnValue;
            int toRead = (int) Math.min(blob.length(), MAX_LOB_CHARS);
            return toRead <= 0 ? "" : decodeBytes(blob.getBytes(1, toRead));
        }
        if (columnValue instanceof SQLXML) {
            return ((SQLXML) columnValue).getString();
        }
        if (columnValue instanceof UUID) {
            return columnValue.toString();
        }
        if (columnValue instanceof java.sql.Array) {
            return normalizeArray((java.sql.Array) columnValue, depth);
        }
        return String.valueOf(columnValue);
    }

    /**
     * Returns the bytes as text when they are valid UTF-8, otherwise Base64.
     */
    static String decodeBytes(byte[] rawBytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(rawBytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return Base64.getEncoder().encodeToString(rawBytes);
        }
    }

    private static Object normalizeArray(java.sql.Array sqlArray, int depth) throws SQLException {
        Object arrayValue = sqlArray.getArray();
        if (!(arrayValue instanceof Object[]) || depth >= MAX_ARRAY_DEPTH) {
            return String.valueOf(arrayValue);
        }
        Object[] arrayElements = (Object[]) arrayValue;
        List<Object> normalizedElements = new ArrayList<>(arrayElements.length);
        for (Object arrayElement : arrayElements) {
            normalizedElements.add(normalize(arrayElement, depth + 1));
        }
        return normalizedElements;
    }

    private static String readClob(Clob clob) throws SQLException {
        try (Reader clobReader = clob.getCharacterStream()) {
            if (clobReader == null) {
                return "";
            }
            StringBuilder clobText = new StringBuilder();
            char[] readBuffer = new char[8192];
            int charsRead;
            while (clobText.length() < MAX_LOB_CHARS
                    && (charsRead = clobReader.read(readBuffer, 0, Math.min(readBuffer.length, MAX_LOB_CHARS - clobText.length()))) > 0) {
                clobText.append(readBuffer, 0, charsRead);
            }
            return clobText.toString();
        } catch (IOException e) {
            throw new SQLException("Failed to read CLOB value: " + e.getMessage(), e);
        }
    }
}
