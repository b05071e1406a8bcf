package io.github.yok.cdflib.util;

import com.google.common.base.Preconditions;
import java.security.SecureRandom;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Generates pronounceable passwords.
 *
 * <p>
 * A word is built from a prefix, a vowel sound, a consonant sound and a postfix, drawn from lists
 * of letter groups that read naturally in English (for example {@code "thrauckful"}). The result
 * trades some entropy for being easy to read out and type, so it suits initial passwords that the
 * user is expected to change.
 * </p>
 */
public final class PasswordGenerator {

    private static final List<String> PREFIXES = List.of("ab", "ac", "acr", "acl", "ad", "adr",
            "ah", "ar", "aw", "ay", "br", "bl", "cl", "cr", "ch", "dr", "dw", "en", "ey", "in", "im",
            "iy", "oy", "och", "on", "qu", "sl", "sh", "sw", "tr", "th", "thr", "un", "st", "str",
            "kn");
    private static final List<String> DIPHTHONGS =
            List.of("ae", "au", "ea", "ou", "ei", "ie", "ia", "ee", "oo", "eo", "io");
    private static final List<String> CONSONANT_PAIRS = List.of("bb", "bl", "br", "ck", "cr", "ch",
            "dd", "dr", "gh", "gr", "gn", "gg", "lb", "ld", "lk", "lp", "mb", "mm", "nc", "nch", "nd",
            "ng", "nn", "nt", "pp", "pl", "pr", "rr", "rch", "rs", "rsh", "rt", "sh", "th", "tt",
            "st", "str");
    private static final List<String> POSTFIXES = List.of("able", "act", "am", "ams", "ect", "ed",
            "edge", "en", "er", "ful", "ia", "ier", "ies", "illy", "im", "ing", "ium", "is", "less",
            "or", "up", "ups", "y", "igle", "ogle", "agle", "ist", "est");
    private static final List<String> VOWELS = List.of("a", "e", "i", "o", "u");
    private static final List<String> CONSONANTS = List.of("b", "c", "d", "f", "g", "h", "j", "k",
            "l", "m", "n", "p", "r", "s", "t", "v", "w", "x", "y", "z");

    private final Random random;

    public PasswordGenerator() {
        this(new SecureRandom());
    }

    /**
     * Creates a generator drawing from the given source.
     *
     * @param random randomness source
     */
    public PasswordGenerator(Random random) {
        this.random = Preconditions.checkNotNull(random, "random must not be null");
    }

    /**
     * Generates a password.
     *
     * @param length exact length of the word part; {@code 0} for the natural length of one word
     * @param caps {@code true} to allow upper-case consonants
     * @param number {@code true} to append a number from 10 to 99, not counted in {@code length}
     * @return password
     */
    public String generate(int length, boolean caps, boolean number) {
        Preconditions.checkArgument(length >= 0, "length must not be negative: %s", length);
        StringBuilder word = new StringBuilder(makeWord(caps));
        if (length > 0) {
            while (word.length() < length) {
                word.append(makeWord(caps));
            }
            word.setLength(length);
        }
        if (number) {
            word.append(10 + random.nextInt(90));
        }
        return word.toString();
    }

    private String makeWord(boolean caps) {
        return prefix(caps) + vowel() + consonant(false, caps) + pick(POSTFIXES);
    }

    private String prefix(boolean caps) {
        return isGoodChance() ? pick(PREFIXES) : consonant(true, caps);
    }

    private String vowel() {
        return isGoodChance() ? pick(DIPHTHONGS) : pick(VOWELS);
    }

    private String consonant(boolean single, boolean caps) {
        if (caps) {
            return pick(CONSONANTS).toUpperCase(Locale.ROOT);
        }
        return isGoodChance() && !single ? pick(CONSONANT_PAIRS) : pick(CONSONANTS);
    }

    // 3 in 11
    private boolean isGoodChance() {
        return random.nextInt(11) > 7;
    }

    private String pick(List<String> list) {
        return list.get(random.nextInt(list.size()));
    }
}
