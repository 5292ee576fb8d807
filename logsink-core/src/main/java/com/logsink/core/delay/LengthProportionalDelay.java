package com.logsink.core.delay;

import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocks for {@code characters * perCharacter}; 50 ms per character unless configured. Characters
 * are Unicode code points, so a supplementary character such as an emoji counts once.
 */
public class LengthProportionalDelay implements ProcessingDelay {

    public static final Duration DEFAULT_PER_CHARACTER = Duration.ofMillis(50);

    private static final Logger log = LoggerFactory.getLogger(LengthProportionalDelay.class);

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Duration perCharacter;
    private final Sleeper sleeper;

    public LengthProportionalDelay() {
        this(DEFAULT_PER_CHARACTER);
    }

    public LengthProportionalDelay(Duration perCharacter) {
        this(perCharacter, d -> Thread.sleep(d.toMillis(), d.toNanosPart() % 1_000_000));
    }

    LengthProportionalDelay(Duration perCharacter, Sleeper sleeper) {
        this.perCharacter = Objects.requireNonNull(perCharacter, "perCharacter");
        if (perCharacter.isNegative()) {
            throw new IllegalArgumentException("perCharacter must not be negative");
        }
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /** Pure part of the contract: how long {@code text} would block. */
    public Duration durationFor(String text) {
        return perCharacter.multipliedBy(characters(text));
    }

    @Override
    public Duration simulate(String text) throws InterruptedException {
        Duration duration = durationFor(text);
        if (log.isDebugEnabled()) {
            log.debug("Processing {} characters, sleeping {} ms", characters(text), duration.toMillis());
        }
        if (!duration.isZero()) {
            sleeper.sleep(duration);
        }
        return duration;
    }

    private static int characters(String text) {
        return text == null ? 0 : text.codePointCount(0, text.length());
    }
}
