package ai.aiengineer.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class PythonSummarizerTest {

    private final PythonSummarizer summarizer = new PythonSummarizer();

    @Test
    void testSectionsInOrder() {
        var source =
                """
                \"""Module doc.\"""

                import os

                X = 1

                def f(a, b):
                    return a + b

                class A:
                    \"""A doc.\"""

                    def method(self):
                        pass
                """;

        var expected =
                """
                Module Description:
                Module doc.

                Classes:
                class A:
                \"""
                A doc.
                \"""

                Functions:
                def f(a, b):

                Variables:
                X = 1""";
        assertEquals(expected, summarizer.summarize(source));
    }

    @Test
    void testNestedDefinitionsAreInvisible() {
        var source =
                """
                if True:
                    def hidden():
                        pass

                class Outer:
                    def inner(self):
                        y = 2
                """;

        var summary = summarizer.summarize(source);
        assertEquals("Classes:\nclass Outer:", summary);
        assertFalse(summary.contains("hidden"));
        assertFalse(summary.contains("inner"));
    }

    @Test
    void testMultiLineSignatureKeptWhole() {
        var source =
                """
                def g(
                    a,
                    b,
                ) -> int:
                    return a
                """;

        assertEquals("Functions:\ndef g(\n    a,\n    b,\n) -> int:", summarizer.summarize(source));
    }

    @Test
    void testDecoratorsExcluded() {
        var source =
                """
                import functools

                @functools.lru_cache
                def h():
                    \"""Cached.\"""
                    return 1
                """;

        var summary = summarizer.summarize(source);
        assertEquals("Functions:\ndef h():\n\"\"\"\nCached.\n\"\"\"", summary);
    }

    @Test
    void testOneLineClassStaysOneLine() {
        assertEquals("Classes:\nclass A: pass", summarizer.summarize("class A: pass\n"));
    }

    @Test
    void testHashInsideStringIsNotAComment() {
        var source =
                """
                def f(x="#"):  # note
                    return x
                """;

        assertEquals("Functions:\ndef f(x=\"#\"):  # note", summarizer.summarize(source));
    }

    @Test
    void testAssignmentKinds() {
        var source =
                """
                a = b = 1
                count += 1
                z: int = 3
                y: int
                print(a)
                """;

        assertEquals("Variables:\na = b = 1\nz: int = 3", summarizer.summarize(source));
    }

    @Test
    void testDocstringAfterLeadingComment() {
        var source =
                """
                # -*- coding: utf-8 -*-
                \"""
                    Indented module doc.
                    Second line.
                \"""
                """;

        assertEquals("Module Description:\nIndented module doc.\nSecond line.", summarizer.summarize(source));
    }

    @Test
    void testNonAsciiTextBeforeDocstring() {
        var source =
                """
                NAME = "café"

                def f():
                    \"""Gibt zurück.\"""
                    return NAME
                """;

        var summary = summarizer.summarize(source);
        assertTrue(summary.contains("def f():\n\"\"\"\nGibt zurück.\n\"\"\""), summary);
        assertTrue(summary.endsWith("Variables:\nNAME = \"café\""), summary);
    }

    @Test
    void testEmptyModuleHasEmptySummary() {
        assertEquals("", summarizer.summarize("import os\n"));
        assertEquals("", summarizer.summarize(""));
    }

    @Test
    void testSummaryIsDeterministic() {
        var source = "class A:\n    '''doc'''\n\ndef f():\n    pass\n\nX = [1, 2]\n";
        assertEquals(summarizer.summarize(source), summarizer.summarize(source));
        assertEquals(summarizer.summarize(source), new PythonSummarizer().summarize(source));
    }

    @Test
    void testSyntaxErrorThrows() {
        var ex = assertThrows(SourceParseException.class, () -> summarizer.summarize("x = 1\ndef broken(:\n    pass\n"));
        assertTrue(ex.getLine() >= 1, "line should be 1-based");
    }

    @Test
    void testPython2PrintStatementRejected() {
        var ex = assertThrows(
                SourceParseException.class, () -> summarizer.summarize("X = 1\nprint \"hello\"\n"));
        assertEquals(2, ex.getLine());
    }

    @Test
    void testPython2ExecStatementRejected() {
        var source =
                """
                def run():
                    exec "x = 1"
                """;

        var ex = assertThrows(SourceParseException.class, () -> summarizer.summarize(source));
        assertEquals(2, ex.getLine());
    }

    @Test
    void testPrintAndExecCallsAccepted() {
        assertEquals("", summarizer.summarize("print(\"hello\")\nexec(\"x = 1\")\n"));
    }

    @Test
    void testStringValue() {
        assertEquals("plain", PythonSummarizer.stringValue("'plain'").orElseThrow());
        assertEquals("triple", PythonSummarizer.stringValue("'''triple'''").orElseThrow());
        assertEquals("a\\n", PythonSummarizer.stringValue("r\"a\\n\"").orElseThrow());
        assertEquals("a\nb", PythonSummarizer.stringValue("\"a\\nb\"").orElseThrow());
        assertTrue(PythonSummarizer.stringValue("b\"bytes\"").isEmpty());
        assertTrue(PythonSummarizer.stringValue("f\"{x}\"").isEmpty());
    }

    @Test
    void testCleanDocstring() {
        assertEquals("Line one.\nLine two.", PythonSummarizer.cleanDocstring("\n    Line one.\n    Line two.\n    "));
        assertEquals(
                "Summary.\n\nfirst\n  indented",
                PythonSummarizer.cleanDocstring("Summary.\n\n    first\n      indented\n    "));
    }

    @Test
    void testCodePart() {
        assertEquals("x = 1", PythonSummarizer.codePart("x = 1  # c"));
        assertEquals("s = '#'", PythonSummarizer.codePart("s = '#'"));
        assertEquals("def f(x=\"a\\\"#\"):", PythonSummarizer.codePart("def f(x=\"a\\\"#\"):  # trailing"));
    }
}
