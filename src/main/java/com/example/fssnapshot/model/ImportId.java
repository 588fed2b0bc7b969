package com.example.fssnapshot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.ByteBuffer;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Opaque 128-bit identifier of an import, rendered as 32 lowercase hex characters.
 */
public record ImportId(UUID value) {
    private static final HexFormat HEX = HexFormat.of();

    public static ImportId random() {
        return new ImportId(UUID.randomUUID());
    }

    public static ImportId fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != 16) {
            throw new IllegalArgumentException("Import id must be 16 bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        return new ImportId(new UUID(buffer.getLong(), buffer.getLong()));
    }

    @JsonCreator
    public static ImportId fromHex(String hex) {
        if (hex == null || hex.length() != 32) {
            throw new IllegalArgumentException("Import id must be 32 hex characters: " + hex);
        }
        return fromBytes(HEX.parseHex(hex));
    }

    public byte[] toBytes() {
        return ByteBuffer.allocate(16)
                .putLong(value.getMostSignificantBits())
                .putLong(value.getLeastSignificantBits())
                .array();
    }

    @JsonValue
    public String hex() {
        return HEX.formatHex(toBytes());
    }

    @Override
    public String toString() {
        return hex();
    }
}
