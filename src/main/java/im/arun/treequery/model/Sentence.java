package im.arun.treequery.model;

import im.arun.treequery.extract.IfdTagger;
import im.arun.treequery.extract.LemmaExtractor;
import im.arun.treequery.render.DefaultSpacingNormalizer;
import im.arun.treequery.render.SpacingNormalizer;
import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * A tokenized sentence and, if parsing succeeded, its best parse tree.
 */
@Getter
public class Sentence {
    private final List<String> tokens;
    private final ParseTree tree;
    private final int score;
    private final long combinations;
    private final Integer errIndex;

    public Sentence(List<String> tokens, ParseTree tree, int score, long combinations, Integer errIndex) {
        this.tokens = List.copyOf(tokens);
        this.tree = tree;
        this.score = score;
        this.combinations = combinations;
        this.errIndex = errIndex;
    }

    public static Sentence parsed(List<String> tokens, ParseTree tree) {
        return new Sentence(tokens, tree, 0, 1, null);
    }

    public static Sentence failed(List<String> tokens, int errIndex) {
        return new Sentence(tokens, null, 0, 0, errIndex);
    }

    public boolean isParsed() {
        return tree != null;
    }

    public Optional<Node> root() {
        return tree == null ? Optional.empty() : Optional.of(tree.getRoot());
    }

    public int tokenCount() {
        return tokens.size();
    }

    /**
     * Raw tokens separated by single spaces.
     */
    public String text() {
        return String.join(" ", tokens);
    }

    public String tidyText() {
        return tidyText(new DefaultSpacingNormalizer());
    }

    public String tidyText(SpacingNormalizer spacing) {
        return spacing.normalize(tokens);
    }

    public List<TerminalNode> terminals() {
        return tree == null ? List.of() : tree.terminals();
    }

    public List<String> lemmas() {
        return tree == null ? List.of() : LemmaExtractor.lemmas(tree.getRoot());
    }

    public List<String> ifdTags() {
        return tree == null ? List.of() : IfdTagger.ifdTags(tree.getRoot());
    }

    @Override
    public String toString() {
        return text();
    }
}
