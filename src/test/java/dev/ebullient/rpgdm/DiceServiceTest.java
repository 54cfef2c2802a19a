package dev.ebullient.rpgdm;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import dev.ebullient.rpgdm.dice.InvalidNotationException;
import dev.ebullient.rpgdm.dice.ScriptedRandomSource;
import dev.ebullient.rpgdm.model.RollMode;
import dev.ebullient.rpgdm.model.RollResult;

class DiceServiceTest {

    @Test
    void configuredSeedIsReproducible() {
        DiceService first = seeded(1234L);
        DiceService second = seeded(1234L);

        List<Integer> a = first.roll("5#4d6kh3").stream().map(RollResult::total).toList();
        List<Integer> b = second.roll("5#4d6kh3").stream().map(RollResult::total).toList();
        assertEquals(5, a.size());
        assertEquals(a, b);
        assertEquals(1234L, first.rollOnce("d20").seed().getAsLong());
    }

    @Test
    void unseededServiceRollsInRange() {
        DiceService service = new DiceService();
        service.seed = Optional.empty();
        for (int i = 0; i < 100; i++) {
            int total = service.rollOnce("d20+1").total();
            assertTrue(total >= 2 && total <= 21);
        }
        assertTrue(service.rollOnce("d20").seed().isEmpty());
    }

    @Test
    void rollOnceIgnoresRepeat() {
        DiceService service = seeded(5L);
        RollResult result = service.rollOnce("4#2d6");
        assertEquals(2, result.rolls().size());
    }

    @Test
    void advantageAndDisadvantage() {
        DiceService service = new DiceService();
        service.setRandomSource(new ScriptedRandomSource(3, 18, 3, 18));

        RollResult adv = service.advantage(20);
        assertEquals(RollMode.ADVANTAGE, adv.spec().mode());
        assertEquals(18, adv.total());

        RollResult dis = service.disadvantage(20);
        assertEquals(3, dis.total());
        assertEquals("1d20dis", dis.spec().toNotation());
    }

    @Test
    void invalidNotationRollsNothing() {
        DiceService service = new DiceService();
        ScriptedRandomSource rng = new ScriptedRandomSource(4);
        service.setRandomSource(rng);
        assertThrows(InvalidNotationException.class, () -> service.roll("2d6+"));
        assertEquals(1, rng.remaining());
    }

    private static DiceService seeded(long value) {
        DiceService service = new DiceService();
        service.seed = Optional.of(value);
        return service;
    }
}
