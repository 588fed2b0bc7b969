package com.example.fssnapshot.pattern;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Anchored matcher for a compiled path template. Each {@code {name}} variable is bound
 * to a positional group, since Java group names cannot carry every variable name we accept.
 */
public final class TemplateMatcher {
    private final Pattern regex;
    private final List<String> variables;

    TemplateMatcher(Pattern regex, List<String> variables) {
        this.regex = regex;
        this.variables = List.copyOf(variables);
    }

    /**
     * Matches a root-relative, {@code /}-separated path against the whole template.
     *
     * @return the captured variables in declaration order, or empty if the path does not match
     */
    public Optional<Map<String, String>> match(String path) {
        Matcher matcher = regex.matcher(path);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Map<String, String> captured = new LinkedHashMap<>();
        for (int i = 0; i < variables.size(); i++) {
            captured.put(variables.get(i), matcher.group(groupName(i)));
        }
        return Optional.of(captured);
    }

    public boolean matches(String path) {
        return regex.matcher(path).matches();
    }

    public List<String> variables() {
        return variables;
    }

    public String regex() {
        return regex.pattern();
    }

    static String groupName(int index) {
        return "v" + index;
    }
}
