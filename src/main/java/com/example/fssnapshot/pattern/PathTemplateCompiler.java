package com.example.fssnapshot.pattern;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles declarative path templates such as {@code {protocol}/{id}_C_*.CSV} into an
 * {@link EnumerationGlob} and a {@link TemplateMatcher}.
 * <p>
 * Supported tokens, each confined to the segment it appears in unless noted:
 * <ul>
 *   <li>{@code *} one or more characters other than the separator</li>
 *   <li>{@code **} one or more characters, may span separators</li>
 *   <li>{@code {name}} like {@code *}, captured under {@code name}</li>
 * </ul>
 * Everything else is matched literally. Matching is case-insensitive for ASCII letters only.
 */
public final class PathTemplateCompiler {
    public static final String SEPARATOR = "/";

    private static final Pattern TOKEN = Pattern.compile("\\{[A-Za-z0-9_]+\\}|\\*\\*|\\*");
    private static final String ANY_SEGMENT_CHARS = "[^/]+";
    private static final String ANY_CHARS = ".+";

    private PathTemplateCompiler() {
    }

    public static PathTemplate compile(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new PatternException(String.valueOf(pattern), "Path template is empty");
        }
        if (pattern.startsWith(SEPARATOR)) {
            throw new PatternException(pattern, "Path template must be relative to the root directory");
        }

        String[] segments = pattern.split(SEPARATOR, -1);
        List<String> variables = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        List<String> regexSegments = new ArrayList<>(segments.length);
        List<String> globSegments = new ArrayList<>(segments.length);
        List<String> baseSegments = new ArrayList<>();
        boolean wildcardSeen = false;

        for (int index = 0; index < segments.length; index++) {
            String segment = segments[index];
            if (segment.isEmpty()) {
                throw new PatternException(pattern, "Path template contains an empty segment");
            }
            StringBuilder regex = new StringBuilder();
            StringBuilder glob = new StringBuilder();
            boolean hasToken = false;
            String previousToken = null;
            int literalStart = 0;

            Matcher tokens = TOKEN.matcher(segment);
            while (tokens.find()) {
                String literal = segment.substring(literalStart, tokens.start());
                appendLiteral(pattern, literal, regex, glob);
                String token = tokens.group();
                if (literal.isEmpty() && isWildcard(token) && isWildcard(previousToken)) {
                    throw new PatternException(pattern, "Adjacent wildcards are ambiguous");
                }
                if (token.equals("**")) {
                    regex.append(ANY_CHARS);
                    glob.append("**");
                } else if (token.equals("*")) {
                    regex.append(ANY_SEGMENT_CHARS);
                    glob.append('*');
                } else {
                    String name = token.substring(1, token.length() - 1);
                    if (!seen.add(name)) {
                        throw new PatternException(pattern, "Duplicate variable '" + name + "'");
                    }
                    regex.append("(?<").append(TemplateMatcher.groupName(variables.size())).append('>')
                            .append(ANY_SEGMENT_CHARS).append(')');
                    glob.append('*');
                    variables.add(name);
                }
                previousToken = token;
                hasToken = true;
                literalStart = tokens.end();
            }
            appendLiteral(pattern, segment.substring(literalStart), regex, glob);

            regexSegments.add(regex.toString());
            globSegments.add(glob.toString());
            // The last segment names the file itself, so it never belongs to the base directory.
            if (hasToken) {
                wildcardSeen = true;
            } else if (!wildcardSeen && index < segments.length - 1) {
                baseSegments.add(segment);
            }
        }

        Pattern regex = Pattern.compile(String.join(Pattern.quote(SEPARATOR), regexSegments),
                Pattern.CASE_INSENSITIVE);
        EnumerationGlob glob = new EnumerationGlob(String.join(SEPARATOR, globSegments), baseSegments);
        return new PathTemplate(pattern, glob, new TemplateMatcher(regex, variables));
    }

    public static List<PathTemplate> compileAll(List<String> patterns) {
        List<PathTemplate> compiled = new ArrayList<>(patterns.size());
        for (String pattern : patterns) {
            compiled.add(compile(pattern));
        }
        return List.copyOf(compiled);
    }

    private static void appendLiteral(String pattern, String literal, StringBuilder regex, StringBuilder glob) {
        if (literal.isEmpty()) {
            return;
        }
        if (literal.indexOf('{') >= 0 || literal.indexOf('}') >= 0) {
            throw new PatternException(pattern, "Unbalanced brace or invalid variable name");
        }
        regex.append(Pattern.quote(literal));
        glob.append(literal);
    }

    private static boolean isWildcard(String token) {
        return token != null && token.startsWith("*");
    }
}
