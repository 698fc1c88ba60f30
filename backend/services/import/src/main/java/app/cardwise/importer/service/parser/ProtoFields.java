package app.cardwise.importer.service.parser;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal protobuf wire reader for the config blobs of the newer collection schema. Keeps the
 * varints and length-delimited values of the top-level message, by field number.
 */
final class ProtoFields {

    private final Map<Integer, Long> varints = new HashMap<>();
    private final Map<Integer, List<byte[]>> bytes = new HashMap<>();
    private boolean truncated;

    private ProtoFields() {
    }

    static ProtoFields decode(byte[] data) {
        ProtoFields fields = new ProtoFields();
        if (data == null) {
            return fields;
        }
        int index = 0;
        while (index < data.length) {
            Varint key = readVarint(data, index);
            if (key == null) {
                fields.truncated = true;
                break;
            }
            int fieldNumber = (int) (key.value() >>> 3);
            int wireType = (int) (key.value() & 0x7);
            index = key.nextIndex();
            switch (wireType) {
                case 0 -> {
                    Varint value = readVarint(data, index);
                    if (value == null) {
                        fields.truncated = true;
                        return fields;
                    }
                    fields.varints.putIfAbsent(fieldNumber, value.value());
                    index = value.nextIndex();
                }
                case 2 -> {
                    Varint length = readVarint(data, index);
                    if (length == null) {
                        fields.truncated = true;
                        return fields;
                    }
                    int len = (int) length.value();
                    index = length.nextIndex();
                    if (len < 0 || index + len > data.length) {
                        fields.truncated = true;
                        return fields;
                    }
                    byte[] value = new byte[len];
                    System.arraycopy(data, index, value, 0, len);
                    fields.bytes.computeIfAbsent(fieldNumber, k -> new ArrayList<>()).add(value);
                    index += len;
                }
                case 1 -> index += 8;
                case 5 -> index += 4;
                default -> {
                    fields.truncated = true;
                    return fields;
                }
            }
        }
        return fields;
    }

    long varint(int fieldNumber, long fallback) {
        return varints.getOrDefault(fieldNumber, fallback);
    }

    String string(int fieldNumber) {
        List<byte[]> values = bytes.get(fieldNumber);
        return values == null ? null : new String(values.get(0), StandardCharsets.UTF_8);
    }

    List<byte[]> messages(int fieldNumber) {
        return bytes.getOrDefault(fieldNumber, List.of());
    }

    boolean has(int fieldNumber) {
        return varints.containsKey(fieldNumber) || bytes.containsKey(fieldNumber);
    }

    boolean truncated() {
        return truncated;
    }

    private static Varint readVarint(byte[] data, int offset) {
        long result = 0;
        int shift = 0;
        int index = offset;
        while (index < data.length && shift < 64) {
            int b = data[index] & 0xFF;
            result |= (long) (b & 0x7F) << shift;
            index++;
            if ((b & 0x80) == 0) {
                return new Varint(result, index);
            }
            shift += 7;
        }
        return null;
    }

    private record Varint(long value, int nextIndex) {
    }
}
