package com.example.fssnapshot.store;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Flat string maps as stored in the tag columns: {@code /key:value/key:value/}, sorted by key.
 * {@code /} cannot occur in a path segment on any supported platform, so captured values never
 * contain it.
 */
public final class TagCodec {
    static final String TAG_DELIMITER = "/";
    static final String TAG_VALUE_DELIMITER = ":";

    private TagCodec() {
    }

    public static String serialize(Map<String, String> tags) {
        if (tags.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder(TAG_DELIMITER);
        for (Map.Entry<String, String> entry : new TreeMap<>(tags).entrySet()) {
            String key = entry.getKey();
            String value = entry.getValue();
            if (key.isEmpty() || key.contains(TAG_DELIMITER) || key.contains(TAG_VALUE_DELIMITER)) {
                throw new TagFormatException("Tag key cannot be stored: '" + key + "'");
            }
            if (value.contains(TAG_DELIMITER)) {
                throw new TagFormatException("Tag value cannot be stored: '" + value + "'");
            }
            builder.append(key).append(TAG_VALUE_DELIMITER).append(value).append(TAG_DELIMITER);
        }
        return builder.toString();
    }

    public static Map<String, String> deserialize(String serialized) {
        Map<String, String> tags = new LinkedHashMap<>();
        if (serialized == null || serialized.isEmpty()) {
            return tags;
        }
        for (String tag : serialized.split(TAG_DELIMITER)) {
            if (tag.isEmpty()) {
                continue;
            }
            int separator = tag.indexOf(TAG_VALUE_DELIMITER);
            if (separator <= 0) {
                throw new TagFormatException("Bad tag format: '" + tag + "'");
            }
            tags.put(tag.substring(0, separator), tag.substring(separator + 1));
        }
        return tags;
    }

    /**
     * Import tag keys are case-insensitive: trimmed and lower-cased before they are stored.
     *
     * @throws TagFormatException if two keys normalize to the same key
     */
    public static Map<String, String> normalizeKeys(Map<String, String> tags) {
        Map<String, String> normalized = new TreeMap<>();
        Map<String, String> originalKeys = new TreeMap<>();
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            String key = entry.getKey().strip().toLowerCase(Locale.ROOT);
            String previous = originalKeys.putIfAbsent(key, entry.getKey());
            if (previous != null) {
                throw new TagFormatException("Tag keys '" + previous + "' and '" + entry.getKey()
                        + "' both normalize to '" + key + "'");
            }
            normalized.put(key, entry.getValue());
        }
        return normalized;
    }
}
