package im.arun.treequery.inflect;

public enum GrammaticalNumber {
    SINGULAR("et"),
    PLURAL("ft");

    private final String variant;

    GrammaticalNumber(String variant) {
        this.variant = variant;
    }

    public String getVariant() {
        return variant;
    }
}
