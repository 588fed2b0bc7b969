package com.example.fssnapshot.diff;

import com.example.fssnapshot.model.Digest;
import com.example.fssnapshot.model.FileRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;

/**
 * One change between two imports. Serialized with a {@code $type} property naming the variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "$type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Action.Created.class, name = "Created"),
        @JsonSubTypes.Type(value = Action.Removed.class, name = "Removed"),
        @JsonSubTypes.Type(value = Action.Copied.class, name = "Copied"),
        @JsonSubTypes.Type(value = Action.Moved.class, name = "Moved"),
        @JsonSubTypes.Type(value = Action.Renamed.class, name = "Renamed"),
        @JsonSubTypes.Type(value = Action.Archived.class, name = "Archived"),
        @JsonSubTypes.Type(value = Action.Modified.class, name = "Modified")
})
public sealed interface Action {

    record Created(@JsonProperty("new") FileRecord created) implements Action {
    }

    record Removed(FileRecord original) implements Action {
    }

    record Copied(FileRecord original, FileRecord copy) implements Action {
    }

    record Moved(FileRecord original, @JsonProperty("dirName") String newDirName,
            @JsonProperty("metadata") Map<String, String> newMetadata) implements Action {
    }

    record Renamed(FileRecord original, @JsonProperty("baseName") String newBaseName,
            @JsonProperty("metadata") Map<String, String> newMetadata) implements Action {
    }

    /**
     * A move into a location the archive policy flags.
     */
    record Archived(FileRecord original, @JsonProperty("dirName") String newDirName,
            @JsonProperty("metadata") Map<String, String> newMetadata) implements Action {
    }

    record Modified(FileRecord original, @JsonProperty("modified") double newModified,
            @JsonProperty("size") long newSize, @JsonProperty("digest") Digest newDigest) implements Action {
    }
}
