package com.example.fssnapshot.policy;

import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Detects the media type of a file from its name and leading bytes.
 */
public class MediaTypeDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaTypeDetector.class);
    static final String FALLBACK = MediaType.OCTET_STREAM.toString();

    private final Tika tika;

    public MediaTypeDetector(Tika tika) {
        this.tika = tika;
    }

    public String detect(Path path) {
        try {
            MediaType mediaType = MediaType.parse(tika.detect(path));
            return mediaType == null ? FALLBACK : mediaType.getBaseType().toString();
        } catch (IOException ex) {
            LOGGER.debug("Media type detection failed for {}", path, ex);
            return FALLBACK;
        }
    }
}
