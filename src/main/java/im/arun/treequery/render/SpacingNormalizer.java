package im.arun.treequery.render;

import java.util.List;

/**
 * Joins token texts into naturally spaced text.
 */
public interface SpacingNormalizer {

    String normalize(List<String> tokens);
}
