package com.example.fssnapshot.pattern;

import java.util.List;

/**
 * A compiled path template: the glob used to narrow the walk and the matcher that extracts metadata.
 */
public record PathTemplate(
        String pattern,
        EnumerationGlob glob,
        TemplateMatcher matcher
) {
    public List<String> variables() {
        return matcher.variables();
    }
}
