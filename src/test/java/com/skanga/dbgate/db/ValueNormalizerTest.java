package com.skanga.dbgate.db;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ValueNormalizerTest {
    @Mock
    Clob clob;
    @Mock
    Blob blob;
    @Mock
    java.sql.Array sqlArray;
    @Mock
    ResultSet resultSet;

    @Test
    void testScalarsPassThrough() throws Exception {
        BigDecimal amount = new BigDecimal("551695.00");

        assertSame(amount, ValueNormalizer.normalize(amount));
        assertEquals(42, ValueNormalizer.normalize(42));
        assertEquals(Boolean.TRUE, ValueNormalizer.normalize(true));
        assertEquals("Paris", ValueNormalizer.normalize("Paris"));
        assertNull(ValueNormalizer.normalize(null));
    }

    @Test
    void testTemporalValuesBecomeIsoStrings() throws Exception {
        assertEquals("2024-03-12", ValueNormalizer.normalize(Date.valueOf(LocalDate.of(2024, 3, 12))));
        assertEquals("08:30", ValueNormalizer.normalize(Time.valueOf(LocalTime.of(8, 30))));
        assertEquals("2024-03-12T08:30:15",
                ValueNormalizer.normalize(Timestamp.valueOf(LocalDateTime.of(2024, 3, 12, 8, 30, 15))));
        assertEquals("2024-03-12T08:30", ValueNormalizer.normalize(LocalDateTime.of(2024, 3, 12, 8, 30)));
    }

    @Test
    void testBytesDecodeAsTextOrBase64() throws Exception {
        byte[] text = "héllo".getBytes(StandardCharsets.UTF_8);
        byte[] binary = {(byte) 0xFF, (byte) 0xFE, 0x00, 0x10};

        assertEquals("héllo", ValueNormalizer.normalize(text));
        assertEquals(Base64.getEncoder().encodeToString(binary), ValueNormalizer.normalize(binary));
    }

    @Test
    void testClobIsRead() throws Exception {
        when(clob.getCharacterStream()).thenReturn(new StringReader("long description"));

        assertEquals("long description", ValueNormalizer.normalize(clob));
    }

    @Test
    void testBlobIsDecoded() throws Exception {
        byte[] content = "blob text".getBytes(StandardCharsets.UTF_8);
        when(blob.length()).thenReturn((long) content.length);
        when(blob.getBytes(1, content.length)).thenReturn(content);

        assertEquals("blob text", ValueNormalizer.normalize(blob));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testArrayBecomesList() throws Exception {
        when(sqlArray.getArray()).thenReturn(new Object[]{1, "two", null});

        Object normalized = ValueNormalizer.normalize(sqlArray);

        assertThat(normalized).isInstanceOf(List.class);
        assertThat((List<Object>) normalized).containsExactly(1, "two", null);
    }

    @Test
    void testOtherTypesUseStringForm() throws Exception {
        UUID uuid = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");

        assertEquals(uuid.toString(), ValueNormalizer.normalize(uuid));
        assertEquals("[a]", ValueNormalizer.normalize(new StringBuilder("[a]")));
    }

    @Test
    void testReadValueNormalizesColumn() throws Exception {
        when(resultSet.getObject(2)).thenReturn(Date.valueOf(LocalDate.of(1999, 12, 31)));

        assertEquals("1999-12-31", ValueNormalizer.readValue(resultSet, 2));
    }
}
