package com.herzen.ink;

import com.herzen.ink.graph.StoryModels.StoryGraph;
import com.herzen.ink.markup.InkValue;
import com.herzen.ink.parser.InkParser;
import com.herzen.ink.runtime.OutputUnits;
import com.herzen.ink.runtime.RuntimeErrorCode;
import com.herzen.ink.runtime.RuntimeModels.*;
import com.herzen.ink.runtime.StoryRuntime;
import com.herzen.ink.runtime.StoryRuntimeException;
import com.herzen.ink.validation.StoryValidator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StoryRuntimeTest {
    private static final InkParser PARSER = new InkParser(new StoryValidator());

    private static final String FOX = """
            Hello.
            * [North] You go north.
              It is cold.
            * [South] You go south.
            - You meet a fox.
            -> END
            """;

    @Test
    void bothBranchesRejoinAtGather() {
        StoryGraph graph = PARSER.read(FOX);

        StoryRuntime north = StoryRuntime.start(graph);
        assertEquals("Hello.", line(north));
        ChoiceSet choices = assertInstanceOf(ChoiceSet.class, north.advance());
        assertEquals(List.of("North", "South"), choices.choices().stream().map(ChoiceOption::text).toList());
        north.select(0);
        assertEquals("You go north.", line(north));
        assertEquals("It is cold.", line(north));
        assertEquals("You meet a fox.", line(north));
        assertInstanceOf(Ended.class, north.advance());
        assertEquals(Phase.ENDED, north.phase());
        assertInstanceOf(Ended.class, north.advance());

        StoryRuntime south = StoryRuntime.start(graph);
        Passage first = south.advanceUntilPause();
        assertEquals(1, first.lines().size());
        south.select(1);
        Passage rest = south.advanceUntilPause();
        assertTrue(rest.ended());
        assertEquals("You go south.\nYou meet a fox.", OutputUnits.join(rest.lines()));
    }

    @Test
    void everyBranchOfThreeLevelNestingReachesTheSharedTail() {
        StoryGraph graph = PARSER.read("""
                * [A] A.
                  * * [A1] A1.
                    * * * [A1x] A1x.
                    * * * [A1y] A1y.
                    - - - A1 joined.
                  * * [A2] A2.
                  - - A joined.
                * [B] B.
                - Shared tail.
                -> END
                """);
        for (int[] path : new int[][]{{0, 0, 0}, {0, 0, 1}, {0, 1}, {1}}) {
            StoryRuntime runtime = StoryRuntime.start(graph);
            Passage passage = runtime.advanceUntilPause();
            List<String> out = new ArrayList<>();
            for (int pick : path) {
                runtime.select(pick);
                passage = runtime.advanceUntilPause();
                out.addAll(lines(passage));
            }
            assertTrue(passage.ended());
            assertEquals("Shared tail.", out.get(out.size() - 1));
        }
    }

    @Test
    void fallbackIsTakenWithoutPausingWhenConditionsHideEverythingElse() {
        StoryRuntime runtime = StoryRuntime.start(PARSER.read("""
                VAR key = false
                * {key} [Unlock] -> END
                * -> locked
                === locked ===
                The door stays shut.
                -> END
                """));
        assertEquals("The door stays shut.", line(runtime));
        assertInstanceOf(Ended.class, runtime.advance());
    }

    @Test
    void consumedChoicesDisappearAndFallbackIsTakenLast() {
        StoryGraph graph = PARSER.read("""
                === hub ===
                * [Look] You look around.
                * [Listen] You listen.
                + [Wait] You wait.
                * -> done
                - -> hub
                === done ===
                Nothing left.
                -> END
                """);
        StoryRuntime runtime = StoryRuntime.start(graph, "hub");

        assertEquals(List.of("Look", "Listen", "Wait"), texts(runtime.advanceUntilPause()));
        runtime.select(0);
        assertEquals(List.of("Listen", "Wait"), texts(runtime.advanceUntilPause()));
        runtime.select(1);
        assertEquals(List.of("Listen", "Wait"), texts(runtime.advanceUntilPause()));
        runtime.select(0);
        assertEquals(List.of("Wait"), texts(runtime.advanceUntilPause()));
        assertEquals(4, runtime.visitCount("hub"));
    }

    @Test
    void fallbackRunsWhenOnlyConsumedChoicesRemain() {
        StoryGraph graph = PARSER.read("""
                === hub ===
                * [Look] You look around.
                * -> done
                - -> hub
                === done ===
                Nothing left.
                -> END
                """);
        StoryRuntime runtime = StoryRuntime.start(graph, "hub");
        runtime.advanceUntilPause();
        runtime.select(0);

        Passage passage = runtime.advanceUntilPause();
        assertTrue(passage.ended());
        assertEquals("You look around.\nNothing left.", OutputUnits.join(passage.lines()));
    }

    @Test
    void runningOutOfChoicesFailsWithoutChangingState() {
        StoryGraph graph = PARSER.read("""
                === only ===
                * [Once] Done once.
                - -> only
                """);
        StoryRuntime runtime = StoryRuntime.start(graph, "only");
        runtime.advanceUntilPause();
        runtime.select(0);
        assertEquals("Done once.", line(runtime));

        RuntimeState before = runtime.snapshot();
        StoryRuntimeException e = assertThrows(StoryRuntimeException.class, runtime::advance);
        assertEquals(RuntimeErrorCode.OUT_OF_CHOICES, e.getCode());
        assertEquals(before, runtime.snapshot());
        assertEquals(Phase.AT_LINE, runtime.phase());
    }

    @Test
    void rejectsCallsInTheWrongPhase() {
        StoryRuntime runtime = StoryRuntime.start(PARSER.read(FOX));

        StoryRuntimeException notAwaiting = assertThrows(StoryRuntimeException.class, () -> runtime.select(0));
        assertEquals(RuntimeErrorCode.NOT_AWAITING_CHOICE, notAwaiting.getCode());

        runtime.advanceUntilPause();
        assertNotNull(runtime.currentChoices());
        StoryRuntimeException notAtLine = assertThrows(StoryRuntimeException.class, runtime::advance);
        assertEquals(RuntimeErrorCode.NOT_AT_LINE, notAtLine.getCode());

        StoryRuntimeException badIndex = assertThrows(StoryRuntimeException.class, () -> runtime.select(2));
        assertEquals(RuntimeErrorCode.INVALID_CHOICE_INDEX, badIndex.getCode());
        assertEquals(Phase.AWAITING_CHOICE, runtime.phase());
    }

    @Test
    void alternativesAdvanceOncePerVisit() {
        StoryGraph graph = PARSER.read("""
                === loop ===
                {I wake.|I wake again.|Still waking.}
                {&Tick|Tock}
                {!First time.}
                + [Again] -> loop
                """);
        StoryRuntime runtime = StoryRuntime.start(graph, "loop");

        assertEquals(List.of("I wake.", "Tick", "First time."), lines(runtime.advanceUntilPause()));
        runtime.select(0);
        assertEquals(List.of("I wake again.", "Tock"), lines(runtime.advanceUntilPause()));
        runtime.select(0);
        assertEquals(List.of("Still waking.", "Tick"), lines(runtime.advanceUntilPause()));
        runtime.select(0);
        assertEquals(List.of("Still waking.", "Tock"), lines(runtime.advanceUntilPause()));
    }

    @Test
    void glueJoinsLinesWithoutBreak() {
        StoryRuntime runtime = StoryRuntime.start(PARSER.read("""
                We hurried <>
                home.
                -> END
                """));
        assertEquals("We hurried home.", OutputUnits.join(runtime.advanceUntilPause().lines()));
    }

    @Test
    void variablesDriveTextAndChoiceConditions() {
        String source = """
                VAR gold = 5
                VAR name = "Ada"
                Hi {name}, you have {gold * 2} coins.
                {gold > 3: Rich|Poor}
                * {gold > 10} [Buy castle] -> END
                * [Walk away] -> END
                """;
        StoryGraph graph = PARSER.read(source);

        Passage poor = StoryRuntime.start(graph).advanceUntilPause();
        assertEquals(List.of("Hi Ada, you have 10 coins.", "Rich"), lines(poor));
        assertEquals(List.of("Walk away"), poor.choices().choices().stream().map(ChoiceOption::text).toList());

        StoryRuntime rich = StoryRuntime.start(graph);
        rich.overrideVariable("gold", new InkValue.Int(20));
        Passage passage = rich.advanceUntilPause();
        assertEquals("Hi Ada, you have 40 coins.", passage.lines().get(0).text());
        assertEquals(2, passage.choices().choices().size());
        assertEquals(new InkValue.Int(20), rich.snapshot().variableOverrides().get("gold"));
    }

    @Test
    void overridesMustMatchDeclaredVariables() {
        StoryRuntime runtime = StoryRuntime.start(PARSER.read("""
                VAR gold = 5
                Gold: {gold}
                """));
        StoryRuntimeException mismatch = assertThrows(StoryRuntimeException.class,
                () -> runtime.overrideVariable("gold", new InkValue.Text("lots")));
        assertEquals(RuntimeErrorCode.VARIABLE_TYPE_MISMATCH, mismatch.getCode());
        StoryRuntimeException unknown = assertThrows(StoryRuntimeException.class,
                () -> runtime.overrideVariable("silver", new InkValue.Int(1)));
        assertEquals(RuntimeErrorCode.UNKNOWN_VARIABLE, unknown.getCode());
        assertEquals("Gold: 5", line(runtime));
    }

    @Test
    void visitCountsAreReadableAsAddresses() {
        StoryRuntime runtime = StoryRuntime.start(PARSER.read("""
                === intro ===
                {intro > 1: Back again.|First visit.}
                + [Again] -> intro
                """), "intro");
        assertEquals(List.of("First visit."), lines(runtime.advanceUntilPause()));
        runtime.select(0);
        assertEquals(List.of("Back again."), lines(runtime.advanceUntilPause()));
    }

    @Test
    void divertCycleWithoutOutputIsStopped() {
        StoryGraph graph = PARSER.read("""
                === a ===
                -> b
                === b ===
                -> a
                """);
        StoryRuntime runtime = StoryRuntime.start(graph, "a", new RuntimeOptions(50));
        StoryRuntimeException e = assertThrows(StoryRuntimeException.class, runtime::advance);
        assertEquals(RuntimeErrorCode.DIVERT_LOOP, e.getCode());
    }

    @Test
    void startingRequiresAnEntryPoint() {
        StoryGraph graph = PARSER.read("""
                === only_knot ===
                Inside.
                -> END
                """);
        assertEquals(RuntimeErrorCode.UNRESOLVED_DIVERT,
                assertThrows(StoryRuntimeException.class, () -> StoryRuntime.start(graph)).getCode());
        assertEquals(RuntimeErrorCode.UNRESOLVED_DIVERT,
                assertThrows(StoryRuntimeException.class, () -> StoryRuntime.start(graph, "missing")).getCode());
        assertEquals("Inside.", line(StoryRuntime.start(graph, "only_knot")));
    }

    @Test
    void stitchesAreEnteredByQualifiedAndLocalName() {
        StoryGraph graph = PARSER.read("""
                === train ===
                = platform
                You wait on the platform.
                -> carriage
                = carriage
                You board. Platform visits: {platform}.
                -> END
                """);
        StoryRuntime runtime = StoryRuntime.start(graph, "train");
        Passage passage = runtime.advanceUntilPause();
        assertEquals(List.of("You wait on the platform.", "You board. Platform visits: 1."), lines(passage));
        assertEquals(1, runtime.visitCount("train"));
        assertEquals(1, runtime.visitCount("train.carriage"));
        assertEquals("You board. Platform visits: 0.",
                StoryRuntime.start(graph, "train.carriage").advanceUntilPause().lines().get(0).text());
    }

    @Test
    void choiceTagsAndLineTagsAreReported() {
        StoryRuntime runtime = StoryRuntime.start(PARSER.read("""
                # author: someone
                A tagged line. # mood: dark
                # loud
                * [Shout] You shout.
                -> END
                """));
        OutputUnit unit = assertInstanceOf(OutputUnit.class, runtime.advance());
        assertEquals(List.of("mood: dark"), unit.tags());
        ChoiceSet choices = assertInstanceOf(ChoiceSet.class, runtime.advance());
        assertEquals(List.of("loud"), choices.choices().get(0).tags());
    }

    @Test
    void glueBeforeAnInlineDivertJoinsAcrossTheKnotBoundary() {
        StoryRuntime runtime = StoryRuntime.start(PARSER.read("""
                We hurried home <> -> next
                === next ===
                to Savile Row.
                -> END
                """));
        Passage passage = runtime.advanceUntilPause();
        assertTrue(passage.lines().get(0).glueEnd());
        assertEquals("We hurried home to Savile Row.", OutputUnits.join(passage.lines()));
    }

    @Test
    void conditionalDivertTakesEitherBranch() {
        String source = """
                VAR has_key = false
                {has_key: -> vault | -> hall}
                === vault ===
                Gold everywhere.
                -> END
                === hall ===
                An empty hall.
                -> END
                """;
        assertEquals("An empty hall.", line(StoryRuntime.start(PARSER.read(source))));

        StoryRuntime withKey = StoryRuntime.start(PARSER.read(source));
        withKey.overrideVariable("has_key", new InkValue.Bool(true));
        assertEquals("Gold everywhere.", line(withKey));
        assertEquals(0, withKey.visitCount("hall"));
    }

    private static String line(StoryRuntime runtime) {
        return assertInstanceOf(OutputUnit.class, runtime.advance()).text();
    }

    private static List<String> lines(Passage passage) {
        return passage.lines().stream().map(OutputUnit::text).toList();
    }

    private static List<String> texts(Passage passage) {
        return passage.choices().choices().stream().map(ChoiceOption::text).toList();
    }
}
