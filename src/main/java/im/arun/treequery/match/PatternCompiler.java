package im.arun.treequery.match;

import im.arun.treequery.match.PatternToken.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles pattern strings into {@link Pattern}s.
 *
 * <pre>
 * pattern  := item EOF
 * item     := primary [ ('&gt;' | '&gt;&gt;') context ]
 * primary  := IDENT | '.' | "text" | 'lemma' | '(' item ('|' item)* ')'
 * context  := '{' item+ '}' | '[' element+ ']'
 * element  := '...' | item [ '*' | '+' | '?' ]
 * </pre>
 *
 * Examples: {@code NP}, {@code ( no | lo )}, {@code NP > { no_þf }},
 * {@code S0 >> { IP > { VP > { PP } } }}, {@code NP > [ lo* no ... ]}.
 * The most recently used compiled patterns are cached per pattern string.
 */
public final class PatternCompiler {
    private static final Logger logger = LoggerFactory.getLogger(PatternCompiler.class);
    static final int CACHE_SIZE = 256;

    // Access-ordered LRU, guarded by its own monitor
    private static final Map<String, Pattern> CACHE = new LinkedHashMap<>(64, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Pattern> eldest) {
            return size() > CACHE_SIZE;
        }
    };

    private final String source;
    private final List<PatternToken> tokens;
    private int pos;

    private PatternCompiler(String source) {
        this.source = source;
        this.tokens = new PatternLexer(source).tokenize();
    }

    /**
     * @throws PatternCompileException if the pattern is malformed
     */
    public static Pattern compile(String source) {
        if (source == null || source.isBlank()) {
            throw new PatternCompileException("Empty pattern", source == null ? "" : source, 0);
        }
        synchronized (CACHE) {
            Pattern cached = CACHE.get(source);
            if (cached != null) {
                return cached;
            }
        }
        logger.debug("Compiling pattern: {}", source);
        Pattern compiled = new PatternCompiler(source).parsePattern();
        synchronized (CACHE) {
            Pattern previous = CACHE.putIfAbsent(source, compiled);
            return previous != null ? previous : compiled;
        }
    }

    static int cachedCount() {
        synchronized (CACHE) {
            return CACHE.size();
        }
    }

    private Pattern parsePattern() {
        PatternItem item = parseItem();
        expect(Type.EOF);
        return new Pattern(source, item);
    }

    private PatternItem parseItem() {
        PatternItem primary = parsePrimary();
        Type next = peek().getType();
        if (next == Type.CHILD || next == Type.DESCENDANT) {
            advance();
            boolean deep = next == Type.DESCENDANT;
            return new PatternItem.Nested(primary, deep, parseContext(deep));
        }
        return primary;
    }

    private PatternItem parsePrimary() {
        PatternToken token = advance();
        switch (token.getType()) {
            case IDENT:
                return new PatternItem.Name(token.getText());
            case DOT:
                return PatternItem.Any.INSTANCE;
            case STRING:
                return new PatternItem.Text(token.getText());
            case LEMMA:
                return new PatternItem.Lemma(token.getText());
            case LPAREN:
                List<PatternItem> options = new ArrayList<>();
                options.add(parseItem());
                while (peek().getType() == Type.BAR) {
                    advance();
                    options.add(parseItem());
                }
                expect(Type.RPAREN);
                return options.size() == 1 ? options.get(0) : new PatternItem.Alternatives(options);
            default:
                throw error("Expected identifier, '.', literal or '(' but found " + token.describe(), token);
        }
    }

    private PatternItem.Context parseContext(boolean deep) {
        PatternToken open = advance();
        if (open.getType() == Type.LBRACE) {
            List<PatternItem> items = new ArrayList<>();
            while (peek().getType() != Type.RBRACE) {
                if (peek().getType() == Type.EOF) {
                    throw error("Missing '}'", peek());
                }
                items.add(parseItem());
            }
            advance();
            if (items.isEmpty()) {
                throw error("Empty '{ }' context", open);
            }
            return new PatternItem.Unordered(items);
        }
        if (open.getType() == Type.LBRACKET) {
            if (deep) {
                throw error("An ordered '[ ]' context requires '>', not '>>'", open);
            }
            List<PatternItem.Element> elements = new ArrayList<>();
            while (peek().getType() != Type.RBRACKET) {
                if (peek().getType() == Type.EOF) {
                    throw error("Missing ']'", peek());
                }
                elements.add(parseElement());
            }
            advance();
            if (elements.isEmpty()) {
                throw error("Empty '[ ]' context", open);
            }
            return new PatternItem.Sequence(elements);
        }
        throw error("Expected '{' or '[' but found " + open.describe(), open);
    }

    private PatternItem.Element parseElement() {
        if (peek().getType() == Type.ELLIPSIS) {
            advance();
            return new PatternItem.Element(PatternItem.Any.INSTANCE, 0, Integer.MAX_VALUE);
        }
        PatternItem item = parseItem();
        switch (peek().getType()) {
            case STAR:
                advance();
                return new PatternItem.Element(item, 0, Integer.MAX_VALUE);
            case PLUS:
                advance();
                return new PatternItem.Element(item, 1, Integer.MAX_VALUE);
            case QUESTION:
                advance();
                return new PatternItem.Element(item, 0, 1);
            default:
                return new PatternItem.Element(item, 1, 1);
        }
    }

    private PatternToken peek() {
        return tokens.get(pos);
    }

    private PatternToken advance() {
        PatternToken token = tokens.get(pos);
        if (token.getType() != Type.EOF) {
            pos++;
        }
        return token;
    }

    private void expect(Type type) {
        PatternToken token = advance();
        if (token.getType() != type) {
            throw error("Expected " + type + " but found " + token.describe(), token);
        }
    }

    private PatternCompileException error(String message, PatternToken token) {
        return new PatternCompileException(message, source, token.getPosition());
    }
}
