package com.phillippitts.figuredbass.music.notation;

import com.phillippitts.figuredbass.exception.InvalidNotationException;
import com.phillippitts.figuredbass.music.PitchName;

import java.util.Map;

/**
 * Accidental attached to a single figure, e.g. the {@code #} in {@code "#6"}.
 */
public enum Modifier {
    NONE(0),
    NATURAL(0),
    SHARP(1),
    DOUBLE_SHARP(2),
    FLAT(-1),
    DOUBLE_FLAT(-2);

    private static final Map<String, Modifier> SYMBOLS = Map.ofEntries(
            Map.entry("#", SHARP),
            Map.entry("+", SHARP),
            Map.entry("\\", SHARP),
            Map.entry("##", DOUBLE_SHARP),
            Map.entry("++", DOUBLE_SHARP),
            Map.entry("-", FLAT),
            Map.entry("b", FLAT),
            Map.entry("/", FLAT),
            Map.entry("--", DOUBLE_FLAT),
            Map.entry("bb", DOUBLE_FLAT),
            Map.entry("n", NATURAL)
    );

    private final int alter;

    Modifier(int alter) {
        this.alter = alter;
    }

    /**
     * Resolves a modifier symbol, including the figured-bass aliases ({@code +}, {@code \}, {@code /}, {@code b}).
     *
     * @param symbol modifier text; null or blank means no modifier
     * @return matching modifier
     * @throws InvalidNotationException if the symbol is not a known accidental
     */
    public static Modifier fromSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return NONE;
        }
        Modifier modifier = SYMBOLS.get(symbol.strip());
        if (modifier == null) {
            throw new InvalidNotationException(symbol, "unsupported figure modifier '" + symbol + "'");
        }
        return modifier;
    }

    public int alter() {
        return alter;
    }

    /** Returns {@code true} if this modifier changes or fixes the accidental of its pitch. */
    public boolean isExplicit() {
        return this != NONE;
    }

    /**
     * Applies this modifier to a diatonic pitch name.
     *
     * <p>A natural, or a pitch without accidental, takes the modifier's accidental outright;
     * otherwise the alterations add, so a sharp on B- yields B.
     */
    public PitchName apply(PitchName name) {
        if (this == NONE) {
            return name;
        }
        if (this == NATURAL || name.alter() == 0) {
            return name.withAlter(alter);
        }
        return name.withAlter(name.alter() + alter);
    }
}
