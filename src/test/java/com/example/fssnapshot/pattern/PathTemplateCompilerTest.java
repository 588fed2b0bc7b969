package com.example.fssnapshot.pattern;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PathTemplateCompilerTest {
    @Test
    void capturesVariablesInMixedSegments() {
        PathTemplate template = PathTemplateCompiler.compile("{protocol}/{protocol_id}_C_*.CSV");

        Optional<Map<String, String>> match = template.matcher().match("P1/123_C_x.CSV");

        assertTrue(match.isPresent());
        assertEquals(Map.of("protocol", "P1", "protocol_id", "123"), match.get());
        assertEquals(List.of("protocol", "protocol_id"), List.copyOf(match.get().keySet()));
        assertEquals("*/*_C_*.CSV", template.glob().glob());
    }

    @Test
    void singleStarDoesNotCrossSeparators() {
        PathTemplate template = PathTemplateCompiler.compile("{protocol}/{protocol_id}_C_*.CSV");

        assertFalse(template.matcher().matches("P1/sub/123_C_x.CSV"));
        assertFalse(template.matcher().matches("P1/123_C_.CSV"));
    }

    @Test
    void doubleStarSpansSegments() {
        PathTemplate template = PathTemplateCompiler.compile("archive/{protocol}/**");

        assertEquals(Map.of("protocol", "P1"), template.matcher().match("archive/P1/2020/01/a.csv").orElseThrow());
        assertFalse(template.matcher().matches("archive/P1"));
        assertEquals("archive", template.glob().baseDirectory());
    }

    @Test
    void matchingIgnoresAsciiCase() {
        PathTemplate template = PathTemplateCompiler.compile("Data/{id}.csv");

        assertEquals(Map.of("id", "Report"), template.matcher().match("DATA/Report.CSV").orElseThrow());
        assertTrue(template.glob().matches("data/Report.Csv"));
    }

    @Test
    void literalRegexCharactersAreQuoted() {
        PathTemplate template = PathTemplateCompiler.compile("a+b/(x).{ext}");

        assertEquals(Map.of("ext", "txt"), template.matcher().match("a+b/(x).txt").orElseThrow());
        assertFalse(template.matcher().matches("aab/(x).txt"));
    }

    @Test
    void globAcceptsEverythingTheMatcherAccepts() {
        PathTemplate template = PathTemplateCompiler.compile("in/{site}/**/{name}_v*.dat");
        List<String> paths = List.of(
                "in/north/a/b/file_v1.dat",
                "IN/south/x/report_v22.DAT",
                "in/north/file_v1.dat",
                "out/north/a/file_v1.dat",
                "in/north/a/file.dat"
        );

        for (String path : paths) {
            if (template.matcher().matches(path)) {
                assertTrue(template.glob().matches(path), path);
            }
        }
        assertEquals("in", template.glob().baseDirectory());
    }

    @Test
    void baseDirectoryPrunesUnrelatedDirectories() {
        EnumerationGlob glob = PathTemplateCompiler.compile("deliveries/incoming/{id}.csv").glob();

        assertTrue(glob.mayContain(""));
        assertTrue(glob.mayContain("Deliveries"));
        assertTrue(glob.mayContain("deliveries/incoming"));
        assertFalse(glob.mayContain("archive"));
        assertFalse(glob.mayContain("deliveries/outgoing"));
    }

    @Test
    void rejectsDuplicateVariables() {
        PatternException error = assertThrows(PatternException.class,
                () -> PathTemplateCompiler.compile("{id}/{id}.csv"));

        assertEquals("{id}/{id}.csv", error.pattern());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "/abs/{id}", "a//b", "{id", "id}", "{}/x", "{bad-name}", "a/***", "a/***.txt"})
    void rejectsMalformedPatterns(String pattern) {
        assertThrows(PatternException.class, () -> PathTemplateCompiler.compile(pattern));
    }

    @Test
    void matchingNeverThrows() {
        TemplateMatcher matcher = PathTemplateCompiler.compile("{a}/*.txt").matcher();

        assertTrue(matcher.match("").isEmpty());
        assertTrue(matcher.match("/").isEmpty());
        assertTrue(matcher.match("x/y/z.txt").isEmpty());
    }
}
