package com.herzen.ink;

import com.herzen.ink.graph.StoryModels.*;
import com.herzen.ink.markup.MarkupModels.Markup;
import com.herzen.ink.parser.InkParser;
import com.herzen.ink.parser.ParserDtos.ParseError;
import com.herzen.ink.validation.StoryValidator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.herzen.ink.graph.StoryModels.ROOT_KNOT;
import static org.junit.jupiter.api.Assertions.*;

class StoryGraphBuilderTest {
    private final InkParser parser = new InkParser(new StoryValidator());

    @Test
    void nestsChoicesAndGathersByDepth() {
        StoryGraph graph = parser.read("""
                === k ===
                * A
                  * * B
                    * * * C
                    - - - deep gather
                  - - mid gather
                - top gather
                -> END
                """);
        ContentBlock top = graph.knots().get("k").defaultStitch().content();
        assertEquals(2, top.size());
        Choice a = assertInstanceOf(Choice.class, top.get(0));
        assertEquals(1, assertInstanceOf(Gather.class, top.get(1)).depth());

        assertEquals(2, a.body().size());
        Choice b = assertInstanceOf(Choice.class, a.body().get(0));
        assertEquals(2, assertInstanceOf(Gather.class, a.body().get(1)).depth());

        Choice c = assertInstanceOf(Choice.class, b.body().get(0));
        Gather deep = assertInstanceOf(Gather.class, b.body().get(1));
        assertEquals(3, deep.depth());
        assertEquals(Markup.literal("deep gather"), assertInstanceOf(TextLine.class, deep.body().get(0)).text());
        assertEquals(0, c.body().size());
    }

    @Test
    void parsingTheSameSourceTwiceGivesEqualGraphs() {
        String source = """
                VAR coins = 3
                Start. # intro
                * [Left] -> left
                * [Right] -> right
                === left ===
                = door
                A door.
                -> END
                === right ===
                Nothing. {coins}
                -> END
                """;
        assertEquals(parser.read(source), parser.read(source));
    }

    @Test
    void collectsStructuralErrorsWithoutBuildingAGraph() {
        InkParser.ParseResult result = parser.parse("""
                === a ===
                === a ===
                = s
                * * orphan
                # dangling
                === b ===
                VAR x = 1
                VAR x = 2
                """);
        assertNull(result.graph());
        Set<String> codes = result.errors().stream().map(ParseError::code).collect(Collectors.toSet());
        assertEquals(Set.of("DUPLICATE_KNOT", "INVALID_NESTING", "DANGLING_TAG", "DUPLICATE_VARIABLE"), codes);
        assertEquals(List.of(2, 4, 5, 8), result.errors().stream().map(ParseError::line).sorted().toList());
    }

    @Test
    void stitchBeforeAnyKnotIsRejected() {
        InkParser.ParseResult result = parser.parse("""
                = early
                === k ===
                Hi.
                """);
        assertEquals("STITCH_OUTSIDE_KNOT", result.errors().get(0).code());
    }

    @Test
    void lineErrorsAndStructureErrorsAreReportedTogether() {
        InkParser.ParseResult result = parser.parse("""
                Hello {name
                * * too deep
                -> END
                """);
        assertEquals(2, result.errors().size());
        assertEquals("UNMATCHED_BRACE", result.errors().get(0).code());
        assertEquals("INVALID_NESTING", result.errors().get(1).code());
    }

    @Test
    void ignoresCommentsAndTodoLines() {
        StoryGraph graph = parser.read("""
                Hello world. // trailing
                /* multi
                   line */
                TODO: tidy this scene
                -> END
                """);
        ContentBlock root = graph.knots().get(ROOT_KNOT).defaultStitch().content();
        assertEquals(2, root.size());
        assertEquals(Markup.literal("Hello world."), assertInstanceOf(TextLine.class, root.get(0)).text());
        assertInstanceOf(Divert.class, root.get(1));
    }

    @Test
    void attachesStoryKnotAndLineTags() {
        StoryGraph graph = parser.read("""
                # title: The Hall
                -> hall
                === hall ===
                # place: hall
                # lit
                It is bright.
                # whisper
                Someone speaks.
                -> END
                """);
        assertEquals(List.of("title: The Hall"), graph.tags());
        Knot hall = graph.knots().get("hall");
        assertEquals(List.of("place: hall", "lit"), hall.tags());
        ContentBlock content = hall.defaultStitch().content();
        assertEquals(List.of(), assertInstanceOf(TextLine.class, content.get(0)).tags());
        assertEquals(List.of("whisper"), assertInstanceOf(TextLine.class, content.get(1)).tags());
    }

    @Test
    void knotWithoutOwnContentEntersFirstStitch() {
        StoryGraph graph = parser.read("""
                === train ===
                = platform
                Waiting.
                -> END
                = carriage
                Seated.
                -> END
                """);
        assertEquals(new Address("train", "platform"), graph.resolve(null, "train").orElseThrow());
        assertEquals(new Address("train", "carriage"), graph.resolve("train", "carriage").orElseThrow());
        assertTrue(graph.resolve(null, "carriage").isEmpty());
        assertTrue(graph.resolve(null, "DONE").orElseThrow().terminal());
        assertFalse(graph.hasRootContent());
    }
}
