package dev.ebullient.rpgdm;

import java.util.List;
import java.util.Optional;

import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.ebullient.rpgdm.dice.DiceNotationParser;
import dev.ebullient.rpgdm.dice.DiceRoller;
import dev.ebullient.rpgdm.dice.RandomSource;
import dev.ebullient.rpgdm.dice.SecureRandomSource;
import dev.ebullient.rpgdm.dice.SeededRandomSource;
import dev.ebullient.rpgdm.model.DiceSpec;
import dev.ebullient.rpgdm.model.RollMode;
import dev.ebullient.rpgdm.model.RollResult;
import dev.ebullient.rpgdm.model.RollTerm;

@Singleton
public class DiceService {
    private static final Logger log = Logger.getLogger(DiceService.class);

    @ConfigProperty(name = "rpgdm.dice.seed")
    Optional<Long> seed;

    DiceRoller roller = new DiceRoller();

    private RandomSource randomSource;

    /**
     * Parse and roll a notation string. Repeated notation ({@code 6#4d6kh3})
     * returns one result per repetition.
     *
     * @throws dev.ebullient.rpgdm.dice.InvalidNotationException if the notation does not parse
     */
    public List<RollResult> roll(String notation) {
        DiceSpec spec = DiceNotationParser.parse(notation);
        List<RollResult> results = roller.rollAll(spec, randomSource());
        if (log.isDebugEnabled()) {
            results.forEach(r -> log.debugf("%s: %s", notation, r.details()));
        }
        return results;
    }

    /**
     * Roll a notation string once, ignoring any repeat prefix.
     */
    public RollResult rollOnce(String notation) {
        return roller.roll(DiceNotationParser.parse(notation), randomSource());
    }

    /** Roll two dice of the given size and keep the higher. */
    public RollResult advantage(int sides) {
        return rollPair(sides, RollMode.ADVANTAGE);
    }

    /** Roll two dice of the given size and keep the lower. */
    public RollResult disadvantage(int sides) {
        return rollPair(sides, RollMode.DISADVANTAGE);
    }

    private RollResult rollPair(int sides, RollMode mode) {
        DiceSpec spec = new DiceSpec(List.of(new RollTerm(1, sides)), mode, 1);
        return roller.roll(spec, randomSource());
    }

    synchronized RandomSource randomSource() {
        if (randomSource == null) {
            if (seed != null && seed.isPresent()) {
                log.infof("Rolling dice with fixed seed %d", seed.get());
                randomSource = new SeededRandomSource(seed.get());
            } else {
                randomSource = new SecureRandomSource();
            }
        }
        return randomSource;
    }

    void setRandomSource(RandomSource randomSource) {
        this.randomSource = randomSource;
    }
}
