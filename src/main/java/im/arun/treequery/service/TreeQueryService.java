package im.arun.treequery.service;

import im.arun.treequery.TreeQueryException;
import im.arun.treequery.config.ConfigLoader;
import im.arun.treequery.config.TreeQueryConfig;
import im.arun.treequery.inflect.CaseTransformer;
import im.arun.treequery.inflect.LexiconMorphology;
import im.arun.treequery.inflect.MorphologyLookup;
import im.arun.treequery.match.Pattern;
import im.arun.treequery.match.PatternCompiler;
import im.arun.treequery.match.TreeSearch;
import im.arun.treequery.model.Node;
import im.arun.treequery.model.Sentence;
import im.arun.treequery.render.DefaultSpacingNormalizer;
import im.arun.treequery.render.SpacingNormalizer;
import im.arun.treequery.render.TreeRenderer;
import im.arun.treequery.tree.ParseTreeReader;
import im.arun.treequery.util.ExecutorProvider;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entry point for batch work: reads parsed documents, runs queries over their sentences
 * on the shared worker pool and reports parse statistics.
 */
@Getter
public class TreeQueryService {
    private static final Logger logger = LoggerFactory.getLogger(TreeQueryService.class);

    private final TreeQueryConfig config;
    private final ParseTreeReader reader;
    private final TreeRenderer renderer;
    private final CaseTransformer transformer;

    public TreeQueryService() {
        this(new ConfigLoader().load());
    }

    public TreeQueryService(TreeQueryConfig config) {
        this(config, loadMorphology(config));
    }

    public TreeQueryService(TreeQueryConfig config, MorphologyLookup morphology) {
        this(config, morphology, new DefaultSpacingNormalizer());
    }

    public TreeQueryService(TreeQueryConfig config, MorphologyLookup morphology, SpacingNormalizer spacing) {
        this.config = config;
        this.reader = new ParseTreeReader();
        this.renderer = new TreeRenderer(config, spacing);
        this.transformer = new CaseTransformer(config, morphology, renderer);
        ExecutorProvider.configure(config.getWorkerThreads());
    }

    private static MorphologyLookup loadMorphology(TreeQueryConfig config) {
        if (config.getLexiconPath() == null || config.getLexiconPath().isBlank()) {
            logger.info("No lexicon configured, inflection keeps original word forms");
            return (lemma, category, features) -> Optional.empty();
        }
        try {
            LexiconMorphology lexicon = LexiconMorphology.load(Paths.get(config.getLexiconPath()));
            logger.info("Lexicon loaded with {} entries", lexicon.size());
            return lexicon;
        } catch (IOException e) {
            throw new TreeQueryException("Failed to load lexicon " + config.getLexiconPath(), e);
        }
    }

    public List<Sentence> loadSentences(Path path) throws IOException {
        return reader.read(path);
    }

    /**
     * Text of {@code sentence} joined by this service's spacing rules.
     */
    public String tidyText(Sentence sentence) {
        return sentence.tidyText(renderer.getSpacing());
    }

    /**
     * Applies {@code task} to every sentence on the shared worker pool. Results come back
     * in input order. A failing task fails the whole batch with its original exception.
     */
    public <T> List<T> processConcurrently(List<Sentence> sentences, Function<Sentence, T> task) {
        logger.info("Processing {} sentences", sentences.size());
        List<CompletableFuture<T>> futures = sentences.stream()
            .map(sentence -> CompletableFuture.supplyAsync(() -> task.apply(sentence), ExecutorProvider.getExecutor()))
            .collect(Collectors.toList());

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }

        List<T> results = futures.stream()
            .map(CompletableFuture::join)
            .collect(Collectors.toList());
        logger.info("Processed {} sentences", results.size());
        return results;
    }

    /**
     * Top-level matches of {@code pattern} in each sentence. The pattern is compiled once,
     * before any sentence is searched; unparsed sentences yield no matches.
     */
    public List<List<Node>> search(List<Sentence> sentences, String pattern) {
        Pattern compiled = PatternCompiler.compile(pattern);
        return processConcurrently(sentences, sentence -> {
            List<Node> matches = new ArrayList<>();
            sentence.root().ifPresent(root -> TreeSearch.topMatches(root, compiled).forEach(matches::add));
            return matches;
        });
    }

    /**
     * Canonical forms of the top-level noun phrases in each sentence.
     */
    public List<List<String>> canonicalNounPhrases(List<Sentence> sentences) {
        Pattern nounPhrase = PatternCompiler.compile("NP");
        return processConcurrently(sentences, sentence -> {
            List<String> phrases = new ArrayList<>();
            sentence.root().ifPresent(root -> {
                for (Node np : TreeSearch.topMatches(root, nounPhrase)) {
                    phrases.add(transformer.canonicalNp(np));
                }
            });
            return phrases;
        });
    }

    public BatchStatistics statistics(List<Sentence> sentences) {
        BatchStatistics stats = BatchStatistics.of(sentences);
        logger.info("{} of {} sentences parsed, {} tokens, ambiguity {}",
            stats.getParsed(), stats.getSentences(), stats.getTokens(),
            String.format("%.2f", stats.getAmbiguity()));
        return stats;
    }
}
