package com.example.fssnapshot.policy;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a label (file group, file type) from extracted path metadata.
 */
@FunctionalInterface
public interface CalcBy {
    Optional<String> calculate(Map<String, String> metadata);

    CalcBy NONE = metadata -> Optional.empty();

    static CalcBy fromMetadata(String format) {
        return new FromMetadata(format);
    }

    /**
     * Substitutes {@code {name}} tokens in {@code format} with metadata values. Yields nothing
     * when a referenced name was not captured.
     */
    record FromMetadata(String format) implements CalcBy {
        private static final Pattern VARIABLE = Pattern.compile("\\{([A-Za-z0-9_]+)\\}");

        public FromMetadata {
            if (format == null || format.isEmpty()) {
                throw new IllegalArgumentException("from-metadata requires a format.");
            }
            String stripped = VARIABLE.matcher(format).replaceAll("");
            if (stripped.indexOf('{') >= 0 || stripped.indexOf('}') >= 0) {
                throw new IllegalArgumentException("Unbalanced brace in format: '" + format + "'");
            }
        }

        @Override
        public Optional<String> calculate(Map<String, String> metadata) {
            Matcher matcher = VARIABLE.matcher(format);
            StringBuilder result = new StringBuilder();
            while (matcher.find()) {
                String value = metadata.get(matcher.group(1));
                if (value == null) {
                    return Optional.empty();
                }
                matcher.appendReplacement(result, Matcher.quoteReplacement(value));
            }
            matcher.appendTail(result);
            return Optional.of(result.toString());
        }
    }
}
