package im.arun.treequery.inflect;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Target form of an inflection: a case, and optionally a number and a definiteness.
 * A null number or definiteness keeps whatever the phrase has. A canonical profile also
 * removes possessive and relative sub-phrases.
 */
@Value
@AllArgsConstructor
public class InflectionProfile {
    GrammaticalCase grammaticalCase;
    GrammaticalNumber number;
    Definiteness definiteness;
    boolean canonical;

    public static final InflectionProfile NOMINATIVE = of(GrammaticalCase.NOMINATIVE);
    public static final InflectionProfile ACCUSATIVE = of(GrammaticalCase.ACCUSATIVE);
    public static final InflectionProfile DATIVE = of(GrammaticalCase.DATIVE);
    public static final InflectionProfile GENITIVE = of(GrammaticalCase.GENITIVE);
    public static final InflectionProfile INDEFINITE =
        new InflectionProfile(GrammaticalCase.NOMINATIVE, null, Definiteness.INDEFINITE, false);
    public static final InflectionProfile CANONICAL =
        new InflectionProfile(GrammaticalCase.NOMINATIVE, GrammaticalNumber.SINGULAR, Definiteness.INDEFINITE, true);

    public static InflectionProfile of(GrammaticalCase grammaticalCase) {
        return new InflectionProfile(grammaticalCase, null, null, false);
    }

    public static InflectionProfile of(GrammaticalCase grammaticalCase, GrammaticalNumber number,
                                       Definiteness definiteness) {
        return new InflectionProfile(grammaticalCase, number, definiteness, false);
    }

    public boolean isIndefinite() {
        return definiteness == Definiteness.INDEFINITE;
    }

    public boolean isDefinite() {
        return definiteness == Definiteness.DEFINITE;
    }
}
