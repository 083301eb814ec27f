package im.arun.treequery.inflect;

/**
 * Whether a noun phrase carries the definite article.
 */
public enum Definiteness {
    DEFINITE,
    INDEFINITE
}
