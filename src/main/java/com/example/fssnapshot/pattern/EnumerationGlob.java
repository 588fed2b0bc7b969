package com.example.fssnapshot.pattern;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Coarse filter derived from a path template by replacing every variable with {@code *}.
 * Accepts a superset of the paths the template matcher accepts, so it can be used to
 * prune the filesystem walk before precise matching.
 */
public final class EnumerationGlob {
    private final String glob;
    private final List<String> baseSegments;
    private final Pattern regex;

    EnumerationGlob(String glob, List<String> baseSegments) {
        this.glob = glob;
        this.baseSegments = List.copyOf(baseSegments);
        this.regex = Pattern.compile(toRegex(glob), Pattern.CASE_INSENSITIVE);
    }

    public String glob() {
        return glob;
    }

    /**
     * Leading directory of the glob that contains no wildcard, {@code ""} for the root.
     */
    public String baseDirectory() {
        return String.join(PathTemplateCompiler.SEPARATOR, baseSegments);
    }

    public boolean matches(String path) {
        return regex.matcher(path).matches();
    }

    /**
     * Returns true if a file below the given root-relative directory could satisfy this glob.
     * Only the literal base segments are compared, case-insensitively.
     */
    public boolean mayContain(String directory) {
        if (directory.isEmpty()) {
            return true;
        }
        String[] segments = directory.split(PathTemplateCompiler.SEPARATOR);
        int shared = Math.min(segments.length, baseSegments.size());
        for (int i = 0; i < shared; i++) {
            if (!lower(segments[i]).equals(lower(baseSegments.get(i)))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return glob;
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }

    private static String toRegex(String glob) {
        StringBuilder builder = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (literal.length() > 0) {
                    builder.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    builder.append(".*");
                    i += 2;
                } else {
                    builder.append("[^/]*");
                    i++;
                }
            } else {
                literal.append(c);
                i++;
            }
        }
        if (literal.length() > 0) {
            builder.append(Pattern.quote(literal.toString()));
        }
        return builder.toString();
    }
}
