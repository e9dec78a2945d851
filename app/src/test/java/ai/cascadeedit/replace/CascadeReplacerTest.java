package ai.cascadeedit.replace;

import static ai.cascadeedit.testutil.AssertionHelperUtil.assertCodeEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.cascadeedit.replace.MatchOutcome.Matched;
import ai.cascadeedit.replace.ReplaceOutcome.ReplaceFailure;
import ai.cascadeedit.replace.ReplaceOutcome.ReplaceResult;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class CascadeReplacerTest {
    private final CascadeReplacer replacer = new CascadeReplacer();

    private ReplaceResult assertReplaced(ReplaceOutcome outcome, StrategyName expectedStrategy) {
        var result = assertInstanceOf(ReplaceResult.class, outcome, () -> "expected success but got " + outcome);
        assertEquals(expectedStrategy, result.strategy());
        return result;
    }

    @Test
    void testStagesRunInDeclaredOrder() {
        var names = CascadeReplacer.STAGES.stream().map(CascadeReplacer.Stage::name).toList();
        assertEquals(Arrays.asList(StrategyName.values()), names);
    }

    @Test
    void testExactMatch() {
        var result = assertReplaced(replacer.replace("hello world", "world", "earth", false), StrategyName.EXACT);
        assertEquals("hello earth", result.content());
        assertTrue(result.ok());
    }

    @Test
    void testDuplicatesFallThroughToMultiOccurrence() {
        var result =
                assertReplaced(replacer.replace("foo bar foo", "foo", "baz", false), StrategyName.MULTI_OCCURRENCE);
        assertEquals("baz bar baz", result.content());
    }

    @Test
    void testReplaceAllIsHandledByExact() {
        var result = assertReplaced(replacer.replace("foo bar foo", "foo", "baz", true), StrategyName.EXACT);
        assertEquals("baz bar baz", result.content());
    }

    @Test
    void testLineTrimmedLeavesSurroundingLinesUntouched() {
        var content =
                """
                function foo() {
                    const x = 1;
                    return x;
                }""";
        var result = assertReplaced(
                replacer.replace(content, "const x = 1;\nreturn x;", "const x = 2;\nreturn x * 2;", false),
                StrategyName.LINE_TRIMMED);
        assertCodeEquals("function foo() {\nconst x = 2;\nreturn x * 2;\n}", result.content());

        var indented = assertReplaced(
                replacer.replace(content, "const x = 1;\nreturn x;", "    const x = 2;\n    return x * 2;", false),
                StrategyName.LINE_TRIMMED);
        assertCodeEquals(
                """
                function foo() {
                    const x = 2;
                    return x * 2;
                }""",
                indented.content());
    }

    @Test
    void testTabsVersusSpacesUsesReplacementAsGiven() {
        var replace = "if (x) {\n  return false;\n}";
        var result = assertReplaced(
                replacer.replace("if (x) {\n\treturn true;\n}", "if (x) {\n  return true;\n}", replace, false),
                StrategyName.LINE_TRIMMED);
        assertEquals(replace, result.content());
    }

    @Test
    void testClosingBraceStaysWhereReplacementPutsIt() {
        var result = assertReplaced(
                replacer.replace("function foo() {\n    return x;\n}", "return x; \n}", "    return y;\n}", false),
                StrategyName.LINE_TRIMMED);
        assertEquals("function foo() {\n    return y;\n}", result.content());
    }

    @Test
    void testWhitespaceNormalized() {
        var result = assertReplaced(
                replacer.replace(
                        "if(x  &&  y) {\n  doSomething(  a,  b  );\n}",
                        "if(x && y) {\n  doSomething( a, b );\n}",
                        "if (x && y) {\n  doOther(a, b);\n}",
                        false),
                StrategyName.WHITESPACE_NORMALIZED);
        assertEquals("if (x && y) {\n  doOther(a, b);\n}", result.content());
    }

    @Test
    void testBlockAnchor() {
        var result = assertReplaced(
                replacer.replace(
                        "void render() {\n    draw();\n    paint();\n}\n",
                        "void render() {\n    drawAll();\n    paintAll();\n}\n",
                        "void render() {\n    clear();\n}\n",
                        false),
                StrategyName.BLOCK_ANCHOR);
        assertEquals("void render() {\n    clear();\n}\n", result.content());
    }

    @Test
    void testIndentationFlexible() {
        var result = assertReplaced(
                replacer.replace("  x \n  y\n  x\n  y", "x \ny", "z", false), StrategyName.INDENTATION_FLEXIBLE);
        assertEquals("z\n  x\n  y", result.content());
    }

    @Test
    void testEscapeNormalized() {
        var result = assertReplaced(
                replacer.replace("line1\nline2\nline3", "line1\\nline2", "replaced\\nstuff", false),
                StrategyName.ESCAPE_NORMALIZED);
        assertEquals("replaced\nstuff\nline3", result.content());
    }

    @Test
    void testTrimmedBoundary() {
        var result = assertReplaced(
                replacer.replace("aaa hello world bbb", "\n  hello world  \n", "goodbye", false),
                StrategyName.TRIMMED_BOUNDARY);
        assertEquals("aaa goodbye bbb", result.content());
    }

    @Test
    void testContextAwareDisambiguatesSharedAnchors() {
        var content = "if (a) {\n    one();\n}\nif (a) {\n    two();\n}";
        var result = assertReplaced(
                replacer.replace(content, "if (a) {\n    twoo();\n}", "if (a) {\n    three();\n}", false),
                StrategyName.CONTEXT_AWARE);
        assertEquals("if (a) {\n    one();\n}\nif (a) {\n    three();\n}", result.content());
    }

    @Test
    void testFailureQuotesSearchBlock() {
        var outcome = replacer.replace("hello world", "completely different text", "x", false);
        var failure = assertInstanceOf(ReplaceFailure.class, outcome);
        assertFalse(failure.ok());
        assertTrue(failure.message().contains("Search block not found"), failure.message());
        assertTrue(failure.message().contains("completely different text"), failure.message());
        assertEquals("hello world", failure.content());
    }

    @Test
    void testFailurePreviewIsTruncated() {
        var search = "q1\nq2\nq3\nq4\nq5\nq6\nq7";
        var failure = assertInstanceOf(ReplaceFailure.class, replacer.replace("a\nb\nc", search, "x", false));
        assertTrue(failure.message().contains("q5"), failure.message());
        assertFalse(failure.message().contains("q6"), failure.message());
        assertTrue(failure.message().contains("(2 more lines)"), failure.message());

        var shortPreview = new CascadeReplacer(new ReplacerConfig(0.5, 0.5, 1));
        var brief = assertInstanceOf(ReplaceFailure.class, shortPreview.replace("a\nb\nc", search, "x", false));
        assertFalse(brief.message().contains("q2"), brief.message());
        assertTrue(brief.message().contains("(6 more lines)"), brief.message());
    }

    @Test
    void testAmbiguousFuzzyMatchFailsClosed() {
        var content = "  x\n  y\n  x\n  y";
        var outcome = replacer.replace(content, "x\ny", "z", false);
        assertEquals(content, assertInstanceOf(ReplaceFailure.class, outcome).content());
    }

    @Test
    void testMalformedInputTakesNoMatchPath() {
        assertInstanceOf(ReplaceFailure.class, replacer.replace("", "x", "y", false));
        assertInstanceOf(ReplaceFailure.class, replacer.replace("abc", "", "y", false));
        assertThrows(NullPointerException.class, () -> replacer.replace(null, "x", "y", false));
    }

    @Test
    void testDeletionIsNotRepeatable() {
        var deleted = assertReplaced(replacer.replace("a\nb\nc", "b\n", "", false), StrategyName.EXACT);
        assertEquals("a\nc", deleted.content());
        assertInstanceOf(ReplaceFailure.class, replacer.replace(deleted.content(), "b\n", "", false));
    }

    @Test
    void testUniqueExactMatchAlwaysWins() {
        // every line-based strategy would also find this block, but exact comes first
        var content = "  alpha\n  beta\n  gamma\n";
        var result = assertReplaced(replacer.replace(content, "  alpha\n  beta\n  gamma", "x", false), StrategyName.EXACT);
        assertEquals("x\n", result.content());
    }

    static Stream<Arguments> cascadeRequests() {
        return Stream.of(
                Arguments.of(new EditRequest("hello world", "world", "earth")),
                Arguments.of(new EditRequest("foo bar foo", "foo", "baz")),
                Arguments.of(new EditRequest("function foo() {\n    const x = 1;\n}", "const x = 1;", "const x = 2;")),
                Arguments.of(new EditRequest("if(x  &&  y) {\n  go();\n}", "if(x && y) {\n  go();\n}", "z")),
                Arguments.of(new EditRequest("line1\nline2", "line1\\nline2", "x")),
                Arguments.of(new EditRequest("aaa hello bbb", " hello\n", "x")),
                Arguments.of(new EditRequest("if (a) {\n    one();\n}\nif (a) {\n    two();\n}", "if (a) {\n    twoo();\n}", "x")),
                Arguments.of(new EditRequest("nothing here", "absent", "x")));
    }

    @ParameterizedTest
    @MethodSource("cascadeRequests")
    void testWinnerIsEarliestMatchingStage(EditRequest request) {
        var outcome = replacer.replace(request);
        int winner = outcome instanceof ReplaceResult result
                ? CascadeReplacer.STAGES.stream().map(CascadeReplacer.Stage::name).toList().indexOf(result.strategy())
                : CascadeReplacer.STAGES.size();
        List<CascadeReplacer.Stage> earlier = CascadeReplacer.STAGES.subList(0, winner);
        for (var stage : earlier) {
            assertFalse(
                    stage.strategy().match(request, replacer.config()) instanceof Matched,
                    () -> stage.name() + " would have matched before the reported winner");
        }
    }

    @ParameterizedTest
    @MethodSource("cascadeRequests")
    void testDeterministicAndNonDestructive(EditRequest request) {
        var first = replacer.replace(request);
        var second = replacer.replace(request);
        assertEquals(first, second);
        if (first instanceof ReplaceFailure failure) {
            assertEquals(request.content(), failure.content());
        }
    }

    @Test
    void testApplySpansSplicesLeftToRight() {
        var matched = new Matched(List.of(new MatchSpan(0, 1), new MatchSpan(2, 3)), "XY");
        assertEquals("XY-XY-c", CascadeReplacer.applySpans("a-b-c", matched));
    }
}
