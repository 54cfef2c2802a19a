package dev.ebullient.rpgdm.memory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.ebullient.rpgdm.model.Event;
import dev.ebullient.rpgdm.model.Scene;
import dev.ebullient.rpgdm.model.Session;

/**
 * Selects the slice of session history the narrator gets to see.
 * <p>
 * Layers are filled in priority order:
 * <ol>
 * <li>every event of the active scene, even when that alone exceeds the budget;</li>
 * <li>up to {@code rpgdm.context.recent-scenes} ended scenes, newest first, each
 * included whole or not at all; selection stops at the first scene that does not fit.
 * Ended scenes without events are passed over and do not use up the window;</li>
 * <li>summaries of the scenes older than that, newest first, until one does not fit.
 * Scenes without a summary are skipped.</li>
 * </ol>
 * The package is then put back into chronological order.
 */
@Singleton
public class ContextAssembler {
    private static final Logger log = Logger.getLogger(ContextAssembler.class);

    @ConfigProperty(name = "rpgdm.context.recent-scenes", defaultValue = "2")
    int recentScenes;

    @ConfigProperty(name = "rpgdm.context.budget", defaultValue = "8000")
    int defaultBudget;

    SizeEstimator sizeEstimator = SizeEstimator.CHARACTERS;

    public ContextPackage buildContext(Session session) {
        return buildContext(session, TokenBudget.of(defaultBudget));
    }

    public ContextPackage buildContext(Session session, TokenBudget budget) {
        Lock lock = session.lock().readLock();
        lock.lock();
        try {
            return assemble(session, budget);
        } finally {
            lock.unlock();
        }
    }

    public void setSizeEstimator(SizeEstimator sizeEstimator) {
        this.sizeEstimator = sizeEstimator;
    }

    private ContextPackage assemble(Session session, TokenBudget budget) {
        Optional<Scene> active = session.activeScene();
        int consumed = 0;

        List<ContextBlock> current = new ArrayList<>();
        if (active.isPresent()) {
            current = sceneBlocks(active.get(), ContextLayer.CURRENT_SCENE);
            consumed = total(current);
        }

        Optional<BudgetExhaustedWarning> warning = Optional.empty();
        if (consumed > budget.limit()) {
            BudgetExhaustedWarning w = new BudgetExhaustedWarning(active.get().id(), consumed, budget.limit());
            log.warnf("%s: %s", session.id(), w.message());
            warning = Optional.of(w);
        }
        int remaining = Math.max(0, budget.limit() - consumed);

        List<Scene> ended = new ArrayList<>();
        for (Scene scene : session.scenes()) {
            if (!scene.isActive()) {
                ended.add(scene);
            }
        }

        // Newest first while selecting
        List<List<ContextBlock>> recent = new ArrayList<>();
        int next = ended.size() - 1;
        while (next >= 0 && recent.size() < recentScenes) {
            if (ended.get(next).eventCount() == 0) {
                next--;
                continue;
            }
            List<ContextBlock> blocks = sceneBlocks(ended.get(next), ContextLayer.RECENT_SCENES);
            int size = total(blocks);
            if (size > remaining) {
                break;
            }
            recent.add(blocks);
            remaining -= size;
            consumed += size;
            next--;
        }

        List<ContextBlock> summaries = new ArrayList<>();
        for (int i = next; i >= 0; i--) {
            Scene scene = ended.get(i);
            if (scene.summary().isEmpty()) {
                continue;
            }
            ContextBlock block = summaryBlock(scene);
            if (block.size() > remaining) {
                break;
            }
            summaries.add(block);
            remaining -= block.size();
            consumed += block.size();
        }

        List<ContextBlock> ordered = new ArrayList<>();
        Collections.reverse(summaries);
        ordered.addAll(summaries);
        Collections.reverse(recent);
        recent.forEach(ordered::addAll);
        ordered.addAll(current);

        log.debugf("%s: context with %d summaries, %d recent scenes, %d current events; %d of %d used",
                session.id(), summaries.size(), recent.size(), current.size(), consumed, budget.limit());
        return new ContextPackage(ordered, consumed, budget, warning);
    }

    private List<ContextBlock> sceneBlocks(Scene scene, ContextLayer layer) {
        List<ContextBlock> blocks = new ArrayList<>(scene.eventCount());
        for (Event event : scene.events()) {
            String text = event.render();
            blocks.add(new ContextBlock(layer, scene.id(), scene.displayTitle(), scene.location(),
                    event, text, estimate(text)));
        }
        return blocks;
    }

    private ContextBlock summaryBlock(Scene scene) {
        String text = "**%s**: %s".formatted(scene.displayTitle(), scene.summary().orElseThrow());
        return new ContextBlock(ContextLayer.SUMMARIES, scene.id(), scene.displayTitle(), scene.location(),
                null, text, estimate(text));
    }

    private int estimate(String text) {
        int size = sizeEstimator.estimate(text);
        if (size < 0) {
            throw new IllegalStateException("Size estimate must not be negative: " + size);
        }
        return size;
    }

    private static int total(List<ContextBlock> blocks) {
        int total = 0;
        for (ContextBlock block : blocks) {
            total += block.size();
        }
        return total;
    }
}
