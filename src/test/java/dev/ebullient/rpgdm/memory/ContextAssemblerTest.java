package dev.ebullient.rpgdm.memory;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.ebullient.rpgdm.SessionFixtures;
import dev.ebullient.rpgdm.SessionLog;
import dev.ebullient.rpgdm.model.Event;
import dev.ebullient.rpgdm.model.EventPayload;
import dev.ebullient.rpgdm.model.Session;

class ContextAssemblerTest {

    @TempDir
    Path tempDir;

    SessionLog sessionLog;
    ContextAssembler assembler;

    @BeforeEach
    void setUp() {
        sessionLog = SessionFixtures.sessionLog(tempDir);
        assembler = new ContextAssembler();
        assembler.recentScenes = 2;
        assembler.defaultBudget = 1000;
        // every event and every summary costs 10
        assembler.setSizeEstimator(text -> 10);
    }

    @Test
    void largeBudgetIncludesEveryEventInOrder() {
        Session session = SessionFixtures.tavernAdventure(sessionLog);
        ContextPackage context = assembler.buildContext(session);

        assertEquals(List.of("scene-1-1", "scene-1-2", "scene-2-1", "scene-2-2", "scene-3-1"), eventIds(context));
        assertTrue(context.blocks(ContextLayer.SUMMARIES).isEmpty());
        assertEquals(50, context.consumed());
        assertTrue(context.warning().isEmpty());
    }

    @Test
    void singleActiveSceneIsTheOnlyLayer() {
        Session session = sessionLog.createSession("single");
        sessionLog.startScene(session, "Ambush", "Forest", List.of("Aria"));
        for (int i = 1; i <= 5; i++) {
            sessionLog.logEvent(session, "Aria", new EventPayload.PlayerAction("Action " + i));
        }

        ContextPackage context = assembler.buildContext(session);

        assertEquals(5, context.blocks().size());
        assertEquals(5, context.blocks(ContextLayer.CURRENT_SCENE).size());
        assertEquals(List.of("scene-1-1", "scene-1-2", "scene-1-3", "scene-1-4", "scene-1-5"), eventIds(context));
    }

    @Test
    void recentSceneWindowLimitsFullScenes() {
        Session session = SessionFixtures.tavernAdventure(sessionLog);
        assembler.recentScenes = 1;
        ContextPackage context = assembler.buildContext(session);

        assertEquals(List.of("scene-2-1", "scene-2-2", "scene-3-1"), eventIds(context));
        List<ContextBlock> summaries = context.blocks(ContextLayer.SUMMARIES);
        assertEquals(1, summaries.size());
        assertEquals("scene-1", summaries.get(0).sceneId());
        assertEquals("**The Prancing Pony**: Aria met the barkeep and heard rumours of the old mine.",
                summaries.get(0).text());
        assertTrue(context.blocks().get(0).isSummary());
        assertEquals(40, context.consumed());
    }

    @Test
    void currentSceneAlwaysIncludedWithWarningWhenOverBudget() {
        Session session = SessionFixtures.tavernAdventure(sessionLog);
        ContextPackage context = assembler.buildContext(session, TokenBudget.of(5));

        assertEquals(List.of("scene-3-1"), eventIds(context));
        assertEquals(1, context.blocks().size());
        assertEquals(10, context.consumed());
        assertEquals(0, context.remaining());
        BudgetExhaustedWarning warning = context.warning().orElseThrow();
        assertEquals("scene-3", warning.sceneId());
        assertEquals(10, warning.required());
        assertEquals(5, warning.budget());
    }

    @Test
    void sceneThatDoesNotFitIsDroppedWholeAndSummarized() {
        Session session = SessionFixtures.tavernAdventure(sessionLog);
        ContextPackage context = assembler.buildContext(session, TokenBudget.of(25));

        // scene-2 needs 20 of the 15 left; only its summary fits
        assertEquals(List.of("scene-3-1"), eventIds(context));
        assertEquals(List.of("scene-2"), context.blocks(ContextLayer.SUMMARIES).stream().map(ContextBlock::sceneId).toList());
        assertTrue(context.blocks(ContextLayer.RECENT_SCENES).isEmpty());
        assertEquals(20, context.consumed());
        assertTrue(context.warning().isEmpty());
    }

    @Test
    void summariesFillRemainingBudgetInChronologicalOrder() {
        Session session = SessionFixtures.tavernAdventure(sessionLog);
        ContextPackage context = assembler.buildContext(session, TokenBudget.of(40));

        assertEquals(List.of(ContextLayer.SUMMARIES, ContextLayer.RECENT_SCENES, ContextLayer.RECENT_SCENES,
                ContextLayer.CURRENT_SCENE), context.blocks().stream().map(ContextBlock::layer).toList());
        assertEquals("scene-1", context.blocks().get(0).sceneId());
        assertEquals(40, context.consumed());
        assertEquals(0, context.remaining());
    }

    @Test
    void scenesWithoutSummaryAreSkipped() {
        Session session = sessionLog.createSession("patchy");
        scene(session, "One", "first summary");
        scene(session, "Two", null);
        scene(session, "Three", "third summary");
        sessionLog.startScene(session, "Four", null, List.of());
        sessionLog.logEvent(session, "Aria", new EventPayload.PlayerAction("I wait"));
        assembler.recentScenes = 1;

        ContextPackage context = assembler.buildContext(session);

        assertEquals(List.of("scene-1"), context.blocks(ContextLayer.SUMMARIES).stream().map(ContextBlock::sceneId).toList());
        assertEquals(List.of("scene-3-1", "scene-4-1"), eventIds(context));
    }

    @Test
    void emptyEndedScenesDoNotUseRecentWindow() {
        Session session = sessionLog.createSession("quiet");
        scene(session, "One", "first summary");
        scene(session, "Two", "second summary");
        sessionLog.startScene(session, "Interlude", null, List.of());
        sessionLog.endScene(session, "Nothing happened.");
        sessionLog.startScene(session, "Four", null, List.of());
        sessionLog.logEvent(session, "Aria", new EventPayload.PlayerAction("I wait"));
        assembler.recentScenes = 1;

        ContextPackage context = assembler.buildContext(session);

        assertEquals(List.of("scene-2-1", "scene-4-1"), eventIds(context));
        assertEquals(List.of("scene-2"),
                context.blocks(ContextLayer.RECENT_SCENES).stream().map(ContextBlock::sceneId).distinct().toList());
        assertEquals(List.of("scene-1"), context.blocks(ContextLayer.SUMMARIES).stream().map(ContextBlock::sceneId).toList());
    }

    @Test
    void noActiveSceneUsesEndedScenesOnly() {
        Session session = sessionLog.createSession("finished");
        scene(session, "One", "first summary");
        scene(session, "Two", "second summary");
        assembler.recentScenes = 0;

        ContextPackage context = assembler.buildContext(session, TokenBudget.of(15));

        assertTrue(context.blocks(ContextLayer.CURRENT_SCENE).isEmpty());
        assertTrue(context.blocks(ContextLayer.RECENT_SCENES).isEmpty());
        assertEquals(List.of("scene-2"), context.blocks(ContextLayer.SUMMARIES).stream().map(ContextBlock::sceneId).toList());
        assertTrue(context.warning().isEmpty());
    }

    @Test
    void emptySessionGivesEmptyPackage() {
        Session session = sessionLog.createSession("empty");
        ContextPackage context = assembler.buildContext(session);
        assertTrue(context.isEmpty());
        assertEquals(0, context.consumed());
        assertEquals(1000, context.remaining());
    }

    @Test
    void eventsStayChronologicalWithRealEstimator() {
        Session session = SessionFixtures.tavernAdventure(sessionLog);
        assembler.setSizeEstimator(SizeEstimator.CHARACTERS);

        for (int budget : List.of(0, 30, 80, 150, 400)) {
            ContextPackage context = assembler.buildContext(session, TokenBudget.of(budget));
            List<Instant> times = context.events().stream().map(Event::timestamp).toList();
            for (int i = 1; i < times.size(); i++) {
                assertTrue(times.get(i).isAfter(times.get(i - 1)), "budget " + budget);
            }
            if (context.warning().isEmpty()) {
                assertTrue(context.consumed() <= budget, "budget " + budget);
            }
        }
    }

    @Test
    void negativeEstimateIsRejected() {
        Session session = SessionFixtures.tavernAdventure(sessionLog);
        assembler.setSizeEstimator(text -> -1);
        assertThrows(IllegalStateException.class, () -> assembler.buildContext(session));
    }

    @Test
    void wordEstimatorCountsWords() {
        assertEquals(4, SizeEstimator.WORDS.estimate(" [DM] Howls echo  loudly "));
        assertEquals(0, SizeEstimator.WORDS.estimate("   "));
        assertEquals(5, SizeEstimator.CHARACTERS.estimate("hello"));
    }

    private void scene(Session session, String title, String summary) {
        sessionLog.startScene(session, title, null, List.of());
        sessionLog.logEvent(session, "Aria", new EventPayload.PlayerAction("I act in " + title));
        sessionLog.endScene(session, summary);
    }

    private static List<String> eventIds(ContextPackage context) {
        return context.events().stream().map(Event::id).toList();
    }
}
