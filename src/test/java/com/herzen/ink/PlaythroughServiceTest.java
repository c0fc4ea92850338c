package com.herzen.ink;

import com.herzen.ink.runtime.RuntimeErrorCode;
import com.herzen.ink.runtime.RuntimeModels.Phase;
import com.herzen.ink.runtime.StoryRuntimeException;
import com.herzen.ink.service.PlaythroughModels.*;
import com.herzen.ink.service.PlaythroughService;
import com.herzen.ink.service.ResourceNotFoundException;
import com.herzen.ink.service.StoryImportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class PlaythroughServiceTest {
    private static final String LANTERN = """
            VAR oil = 1
            The lantern flickers. # mood: tense
            -> corridor
            === corridor ===
            {oil > 2: The corridor is bright.|The corridor is dim.}
            * [Open the door] You open the door.
            * [Turn back] You turn back.
            - The wind howls.
            -> END
            """;

    @Autowired
    private StoryImportService importService;
    @Autowired
    private PlaythroughService service;

    @BeforeEach
    void importStory() {
        assertTrue(importService.importStory("lantern", LANTERN, false).valid());
    }

    @Test
    void playsSavesAndRestores() {
        PlaythroughView started = service.start("lantern", null, Map.of("oil", 3));
        assertEquals(Phase.AT_LINE, started.phase());

        PlaythroughView first = service.continueToPause(started.sessionId());
        assertEquals("The lantern flickers.\nThe corridor is bright.", first.text());
        assertEquals(List.of("mood: tense"), first.lines().get(0).tags());
        assertEquals(List.of("Open the door", "Turn back"), first.choices().stream().map(ChoiceView::text).toList());

        SaveReceipt receipt = service.save(started.sessionId());
        assertEquals("lantern", receipt.storyId());

        PlaythroughView chosen = service.select(started.sessionId(), 1);
        assertEquals(Phase.AT_LINE, chosen.phase());
        PlaythroughView end = service.continueToPause(started.sessionId());
        assertEquals("You turn back.\nThe wind howls.", end.text());
        assertEquals(Phase.ENDED, end.phase());

        PlaythroughView restored = service.restore(receipt.saveId());
        assertNotEquals(started.sessionId(), restored.sessionId());
        assertEquals(Phase.AWAITING_CHOICE, restored.phase());
        assertEquals(first.choices(), restored.choices());
        service.select(restored.sessionId(), 0);
        assertEquals("You open the door.\nThe wind howls.", service.continueToPause(restored.sessionId()).text());
    }

    @Test
    void advancesOneStepAtATime() {
        String sessionId = service.start("lantern", "corridor", null).sessionId();
        StepView line = service.advance(sessionId);
        assertEquals(StepView.LINE, line.kind());
        assertEquals("The corridor is dim.", line.line().text());

        StepView choices = service.advance(sessionId);
        assertEquals(StepView.CHOICES, choices.kind());
        assertEquals(2, choices.choices().size());

        StoryRuntimeException e = assertThrows(StoryRuntimeException.class, () -> service.advance(sessionId));
        assertEquals(RuntimeErrorCode.NOT_AT_LINE, e.getCode());

        service.select(sessionId, 0);
        service.continueToPause(sessionId);
        assertEquals(StepView.ENDED, service.advance(sessionId).kind());
    }

    @Test
    void variablesCanBeChangedMidPlaythrough() {
        String sessionId = service.start("lantern", null, null).sessionId();
        service.setVariable(sessionId, "oil", 10);
        assertTrue(service.continueToPause(sessionId).text().endsWith("The corridor is bright."));

        StoryRuntimeException mismatch = assertThrows(StoryRuntimeException.class,
                () -> service.setVariable(sessionId, "oil", "lots"));
        assertEquals(RuntimeErrorCode.VARIABLE_TYPE_MISMATCH, mismatch.getCode());
        assertThrows(IllegalArgumentException.class, () -> service.setVariable(sessionId, "oil", List.of(1)));
    }

    @Test
    void rejectsUnknownSessionsStoriesAndSaves() {
        assertThrows(ResourceNotFoundException.class, () -> service.advance("no-such-session"));
        assertThrows(ResourceNotFoundException.class, () -> service.start("no-such-story", null, null));
        assertThrows(ResourceNotFoundException.class, () -> service.restore("no-such-save"));

        StoryRuntimeException badStart = assertThrows(StoryRuntimeException.class,
                () -> service.start("lantern", "cellar", null));
        assertEquals(RuntimeErrorCode.UNRESOLVED_DIVERT, badStart.getCode());
    }
}
