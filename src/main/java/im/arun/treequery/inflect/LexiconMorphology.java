package im.arun.treequery.inflect;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import im.arun.treequery.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory {@link MorphologyLookup} backed by a semicolon-separated lexicon file.
 * Lines starting with '#' are comments. A lookup returns the first entry of the lemma
 * and category whose inflectional features equal the requested ones. Compound lemmas
 * missing from the lexicon are inflected through their last component.
 */
public class LexiconMorphology implements MorphologyLookup {
    private static final Logger logger = LoggerFactory.getLogger(LexiconMorphology.class);

    private static final CsvSchema SCHEMA = CsvSchema.builder()
        .addColumn("lemma")
        .addColumn("category")
        .addColumn("form")
        .addColumn("variants")
        .setColumnSeparator(';')
        .build()
        .withComments();

    private final Map<String, List<Form>> forms;

    public LexiconMorphology(List<LexiconEntry> entries) {
        Map<String, List<Form>> index = new HashMap<>();
        for (LexiconEntry entry : entries) {
            if (entry.getLemma() == null || entry.getCategory() == null || entry.getForm() == null) {
                logger.warn("Skipping incomplete lexicon entry: {}", entry);
                continue;
            }
            Set<String> features = TreeUtils.inflectionalFeatures(parseVariants(entry.getVariants()));
            index.computeIfAbsent(key(entry.getLemma(), entry.getCategory()), k -> new ArrayList<>())
                .add(new Form(entry.getForm(), features));
        }
        index.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.forms = index;
    }

    public static LexiconMorphology load(Path path) throws IOException {
        logger.info("Loading lexicon from {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return new LexiconMorphology(readEntries(reader));
        }
    }

    public static LexiconMorphology load(InputStream stream) throws IOException {
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            return new LexiconMorphology(readEntries(reader));
        }
    }

    private static List<LexiconEntry> readEntries(Reader reader) throws IOException {
        CsvMapper mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        mapper.enable(CsvParser.Feature.TRIM_SPACES);
        try (MappingIterator<LexiconEntry> it = mapper.readerFor(LexiconEntry.class)
                .with(SCHEMA)
                .readValues(reader)) {
            List<LexiconEntry> entries = it.readAll();
            logger.debug("Read {} lexicon entries", entries.size());
            return entries;
        }
    }

    /**
     * Number of distinct (lemma, category) pairs.
     */
    public int size() {
        return forms.size();
    }

    @Override
    public Optional<String> lookup(String lemma, String category, Set<String> features) {
        if (lemma == null || category == null) {
            return Optional.empty();
        }
        Set<String> wanted = TreeUtils.inflectionalFeatures(features);
        Optional<String> form = find(lemma, category, wanted);
        if (form.isPresent()) {
            return form;
        }
        int hyphen = lemma.lastIndexOf('-');
        if (hyphen > 0 && hyphen < lemma.length() - 1) {
            String prefix = lemma.substring(0, hyphen).replace("-", "");
            return find(lemma.substring(hyphen + 1), category, wanted).map(last -> prefix + last);
        }
        return Optional.empty();
    }

    private Optional<String> find(String lemma, String category, Set<String> wanted) {
        List<Form> candidates = forms.get(key(lemma, category));
        if (candidates == null) {
            return Optional.empty();
        }
        for (Form candidate : candidates) {
            if (candidate.features.equals(wanted)) {
                return Optional.of(candidate.text);
            }
        }
        return Optional.empty();
    }

    private static List<String> parseVariants(String variants) {
        if (variants == null || variants.isBlank()) {
            return List.of();
        }
        return Arrays.asList(variants.trim().split("_"));
    }

    private static String key(String lemma, String category) {
        return lemma + '\u0000' + category;
    }

    private static final class Form {
        final String text;
        final Set<String> features;

        Form(String text, Set<String> features) {
            this.text = text;
            this.features = features;
        }
    }
}
