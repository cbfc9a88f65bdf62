package com.cataphract.rng;

import com.cataphract.model.DayPart;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic dice for the campaign engine.
 * <p>
 * Every draw is a pure function of a seed string built from the campaign
 * coordinates and a context label. The seed is hashed with SHA-256 and its
 * first eight bytes start a {@link Random} stream, so a recorded list of
 * (seed, notation) pairs replays a campaign exactly.
 */
@Component
public class SeededRng {

    private static final Pattern DICE_NOTATION = Pattern.compile("^(\\d+)d(\\d+)$", Pattern.CASE_INSENSITIVE);

    /** Exact outcome counts per (dice, sides), index = total. */
    private final Map<DiceSpec, BigInteger[]> pmfCache = new ConcurrentHashMap<>();

    /**
     * Builds the seed string {@code campaign:day:part:label}.
     *
     * @throws IllegalArgumentException if the campaign id or day is negative
     */
    public String seed(int campaignId, int day, DayPart dayPart, String contextLabel) {
        if (campaignId < 0) {
            throw new IllegalArgumentException("campaign id must be non-negative, got " + campaignId);
        }
        if (day < 0) {
            throw new IllegalArgumentException("day must be non-negative, got " + day);
        }
        return campaignId + ":" + day + ":" + dayPart.label() + ":" + contextLabel;
    }

    public DiceRoll rollDice(String seed, String notation) {
        DiceSpec spec = parse(notation);
        Random random = streamFor(seed);
        List<Integer> rolls = new ArrayList<>(spec.dice());
        int total = 0;
        for (int i = 0; i < spec.dice(); i++) {
            int value = random.nextInt(spec.sides()) + 1;
            rolls.add(value);
            total += value;
        }
        return new DiceRoll(notation, rolls, total, seed);
    }

    public <T> ChoiceResult<T> randomChoice(String seed, List<T> options) {
        if (options == null || options.isEmpty()) {
            throw new IllegalArgumentException("options list cannot be empty");
        }
        int index = streamFor(seed).nextInt(options.size());
        return new ChoiceResult<>(options.get(index), index, seed);
    }

    /**
     * Uniform integer in {@code [min, max]}, both inclusive.
     */
    public IntResult randomInt(String seed, int min, int max) {
        if (min > max) {
            throw new IllegalArgumentException("min (" + min + ") cannot be greater than max (" + max + ")");
        }
        long span = (long) max - min + 1;
        long offset = span > Integer.MAX_VALUE
                ? Math.floorMod(streamFor(seed).nextLong(), span)
                : streamFor(seed).nextInt((int) span);
        return new IntResult((int) (min + offset), min, max, seed);
    }

    public <T> ChoiceResult<T> weightedChoice(String seed, List<T> options, List<Double> weights) {
        if (options == null || options.isEmpty()) {
            throw new IllegalArgumentException("options list cannot be empty");
        }
        if (weights == null || weights.size() != options.size()) {
            throw new IllegalArgumentException("weights must match options in size");
        }
        double sum = 0;
        for (Double weight : weights) {
            if (weight == null || weight < 0 || weight.isNaN()) {
                throw new IllegalArgumentException("weights must be non-negative numbers");
            }
            sum += weight;
        }
        if (sum <= 0) {
            throw new IllegalArgumentException("weights must have a positive sum");
        }

        double point = streamFor(seed).nextDouble() * sum;
        double cumulative = 0;
        int lastPositive = 0;
        for (int i = 0; i < options.size(); i++) {
            double weight = weights.get(i);
            if (weight <= 0) {
                continue;
            }
            lastPositive = i;
            cumulative += weight;
            if (point < cumulative) {
                return new ChoiceResult<>(options.get(i), i, seed);
            }
        }
        return new ChoiceResult<>(options.get(lastPositive), lastPositive, seed);
    }

    /**
     * Converts {@code probability} into the smallest dice target whose
     * chance of being met is at least that probability, then rolls.
     *
     * @throws IllegalArgumentException if the probability is outside [0, 1]
     *                                  or the notation is invalid
     */
    public SuccessCheck checkSuccess(String seed, double probability, String notation) {
        if (!(probability >= 0.0 && probability <= 1.0)) {
            throw new IllegalArgumentException("probability must be between 0.0 and 1.0, got " + probability);
        }
        DiceSpec spec = parse(notation);
        int target = thresholdFor(probability, spec);
        int roll = rollDice(seed, notation).total();
        return new SuccessCheck(roll >= target, roll, target, probability, seed);
    }

    /**
     * Minimal target T with P(NdM >= T) >= probability.
     * Zero probability needs an impossible roll, certainty the minimum roll.
     */
    public int thresholdFor(double probability, String notation) {
        return thresholdFor(probability, parse(notation));
    }

    private int thresholdFor(double probability, DiceSpec spec) {
        int minRoll = spec.dice();
        int maxRoll = spec.dice() * spec.sides();
        if (probability <= 0.0) {
            return maxRoll + 1;
        }
        if (probability >= 1.0) {
            return minRoll;
        }

        BigDecimal outcomes = new BigDecimal(BigInteger.valueOf(spec.sides()).pow(spec.dice()));
        BigInteger[] counts = pmf(spec);
        BigInteger cumulative = BigInteger.ZERO;
        for (int target = maxRoll; target >= minRoll; target--) {
            cumulative = cumulative.add(counts[target]);
            double chance = new BigDecimal(cumulative).divide(outcomes, MathContext.DECIMAL128).doubleValue();
            if (chance >= probability) {
                return target;
            }
        }
        return maxRoll + 1;
    }

    // ── internals ───────────────────────────────────────────────────────

    private BigInteger[] pmf(DiceSpec spec) {
        return pmfCache.computeIfAbsent(spec, s -> {
            BigInteger[] counts = {BigInteger.ONE};
            for (int die = 0; die < s.dice(); die++) {
                BigInteger[] next = new BigInteger[counts.length + s.sides()];
                Arrays.fill(next, BigInteger.ZERO);
                for (int total = 0; total < counts.length; total++) {
                    if (counts[total].signum() == 0) {
                        continue;
                    }
                    for (int face = 1; face <= s.sides(); face++) {
                        next[total + face] = next[total + face].add(counts[total]);
                    }
                }
                counts = next;
            }
            return counts;
        });
    }

    private static DiceSpec parse(String notation) {
        if (notation == null) {
            throw new IllegalArgumentException("dice notation is required");
        }
        Matcher matcher = DICE_NOTATION.matcher(notation.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid dice notation: '" + notation
                    + "'. Expected format: NdM (e.g. '2d6', '1d20')");
        }
        int dice;
        int sides;
        try {
            dice = Integer.parseInt(matcher.group(1));
            sides = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("dice notation out of range: " + notation, e);
        }
        if (dice < 1) {
            throw new IllegalArgumentException("number of dice must be positive, got " + dice);
        }
        if (sides < 2) {
            throw new IllegalArgumentException("dice need at least two sides, got " + sides);
        }
        return new DiceSpec(dice, sides);
    }

    private static Random streamFor(String seed) {
        if (seed == null) {
            throw new IllegalArgumentException("seed is required");
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(seed.getBytes(StandardCharsets.UTF_8));
            return new Random(ByteBuffer.wrap(digest, 0, Long.BYTES).getLong());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record DiceSpec(int dice, int sides) {
    }
}
