package im.arun.treequery.model;

/**
 * Thrown when a tag-indexed child lookup finds no matching child.
 */
public class NoSuchChildException extends RuntimeException {
    private final String identifier;

    public NoSuchChildException(String identifier, String parentLabel) {
        super(String.format("No child matching '%s' under %s", identifier, parentLabel));
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
