package im.arun.treequery.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.treequery.TreeQueryException;
import im.arun.treequery.model.ParseTree;
import im.arun.treequery.model.ParseTreeBuilder;
import im.arun.treequery.model.Sentence;
import im.arun.treequery.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the parser's JSON output into {@link ParseTree}s and {@link Sentence}s.
 */
public class ParseTreeReader {
    private static final Logger logger = LoggerFactory.getLogger(ParseTreeReader.class);

    private final ObjectMapper objectMapper;

    public ParseTreeReader() {
        this(new ObjectMapper());
    }

    public ParseTreeReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads a document file, {@code {"sentences": [...]}}.
     */
    public List<Sentence> read(Path path) throws IOException {
        ParsedDocument document;
        try (InputStream in = Files.newInputStream(path)) {
            document = objectMapper.readValue(in, ParsedDocument.class);
        }
        List<Sentence> sentences = toSentences(document);
        logger.info("Read {} sentences from {}", sentences.size(), path);
        return sentences;
    }

    public List<Sentence> read(InputStream in) throws IOException {
        return toSentences(objectMapper.readValue(in, ParsedDocument.class));
    }

    public Sentence readSentence(String json) {
        try {
            return toSentence(objectMapper.readValue(json, ParsedSentence.class));
        } catch (JsonProcessingException e) {
            throw new TreeQueryException("Malformed sentence JSON: " + e.getOriginalMessage(), e);
        }
    }

    public ParseTree readTree(String json) {
        try {
            return toTree(objectMapper.readValue(json, SimpleTreeNode.class));
        } catch (JsonProcessingException e) {
            throw new TreeQueryException("Malformed tree JSON: " + e.getOriginalMessage(), e);
        }
    }

    public Sentence toSentence(ParsedSentence parsed) {
        List<String> tokens = parsed.getTokens() == null ? List.of() : parsed.getTokens();
        ParseTree tree = parsed.getTree() == null ? null : toTree(parsed.getTree());
        int score = parsed.getScore() == null ? 0 : parsed.getScore();
        long combinations = parsed.getCombinations() == null ? (tree == null ? 0 : 1) : parsed.getCombinations();
        if (tree == null && parsed.getErrIndex() == null) {
            logger.debug("Sentence without tree or error index: {}", tokens);
        }
        return new Sentence(tokens, tree, score, combinations, parsed.getErrIndex());
    }

    /**
     * Builds an arena tree from the nested node objects. A terminal without a token index
     * takes the index following the previous terminal.
     */
    public ParseTree toTree(SimpleTreeNode root) {
        if (root == null) {
            throw new TreeQueryException("Missing tree");
        }
        ParseTreeBuilder builder = new ParseTreeBuilder();
        addNode(builder, root, new int[] {-1});
        try {
            return builder.build();
        } catch (IllegalStateException e) {
            throw new TreeQueryException("Malformed tree: " + e.getMessage(), e);
        }
    }

    private void addNode(ParseTreeBuilder builder, SimpleTreeNode node, int[] lastToken) {
        if (node.isNonterminal()) {
            if (node.getTag() == null) {
                throw new TreeQueryException("Nonterminal without a tag");
            }
            builder.nonterminal(node.getTag());
            if (node.getChildren() != null) {
                for (SimpleTreeNode child : node.getChildren()) {
                    addNode(builder, child, lastToken);
                }
            }
            builder.end();
            return;
        }
        if (node.getTerminal() == null) {
            throw new TreeQueryException("Terminal without an identifier, text: " + node.getText());
        }
        int tokenIndex = node.getTokenIndex() != null ? node.getTokenIndex() : lastToken[0] + 1;
        lastToken[0] = tokenIndex;
        List<String> allVariants = node.getAugmentedTerminal() == null
            ? null
            : TreeUtils.variantsOf(node.getAugmentedTerminal());
        builder.terminal(node.getTerminal(), node.getText(), tokenIndex, node.getLemma(), allVariants);
    }

    private List<Sentence> toSentences(ParsedDocument document) {
        List<Sentence> sentences = new ArrayList<>();
        if (document.getSentences() == null) {
            return sentences;
        }
        for (ParsedSentence parsed : document.getSentences()) {
            sentences.add(toSentence(parsed));
        }
        return sentences;
    }
}
