package im.arun.treequery.inflect;

public enum GrammaticalCase {
    NOMINATIVE("nf"),
    ACCUSATIVE("þf"),
    DATIVE("þgf"),
    GENITIVE("ef");

    private final String variant;

    GrammaticalCase(String variant) {
        this.variant = variant;
    }

    /**
     * The variant code used in terminal identifiers, e.g. "þgf".
     */
    public String getVariant() {
        return variant;
    }
}
