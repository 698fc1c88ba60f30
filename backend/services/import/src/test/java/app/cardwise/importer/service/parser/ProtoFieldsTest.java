package app.cardwise.importer.service.parser;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProtoFieldsTest {

    @Test
    void decode_readsVarintsStringsAndRepeatedMessages() {
        byte[] data = {
                0x08, (byte) 0x96, 0x01,
                0x12, 0x02, 'h', 'i',
                0x1A, 0x02, 0x08, 0x05,
                0x1A, 0x02, 0x08, 0x06
        };

        ProtoFields fields = ProtoFields.decode(data);

        assertFalse(fields.truncated());
        assertEquals(150, fields.varint(1, -1));
        assertEquals("hi", fields.string(2));
        assertEquals(2, fields.messages(3).size());
        assertEquals(6, ProtoFields.decode(fields.messages(3).get(1)).varint(1, -1));
        assertTrue(fields.has(3));
        assertFalse(fields.has(4));
        assertEquals(-1, fields.varint(4, -1));
    }

    @Test
    void decode_skipsFixedWidthFields() {
        byte[] data = {
                0x09, 1, 2, 3, 4, 5, 6, 7, 8,
                0x15, 1, 2, 3, 4,
                0x18, 0x07
        };

        ProtoFields fields = ProtoFields.decode(data);

        assertFalse(fields.truncated());
        assertEquals(7, fields.varint(3, 0));
    }

    @Test
    void decode_marksTruncatedInput() {
        byte[] data = {0x12, 0x05, 'a', 'b'};

        ProtoFields fields = ProtoFields.decode(data);

        assertTrue(fields.truncated());
        assertNull(fields.string(2));
    }

    @Test
    void decode_nullIsEmpty() {
        ProtoFields fields = ProtoFields.decode(null);

        assertFalse(fields.truncated());
        assertArrayEquals(new byte[0][], fields.messages(1).toArray(new byte[0][]));
    }

    @Test
    void string_decodesUtf8() {
        byte[] name = "café.png".getBytes(StandardCharsets.UTF_8);
        byte[] data = new byte[name.length + 2];
        data[0] = 0x0A;
        data[1] = (byte) name.length;
        System.arraycopy(name, 0, data, 2, name.length);

        assertEquals("café.png", ProtoFields.decode(data).string(1));
    }
}
