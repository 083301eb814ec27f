package im.arun.treequery.match;

import im.arun.treequery.match.PatternToken.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a pattern string into tokens.
 */
class PatternLexer {
    private final String source;
    private int pos;

    PatternLexer(String source) {
        this.source = source;
    }

    List<PatternToken> tokenize() {
        List<PatternToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new PatternToken(Type.EOF, "", pos));
                return tokens;
            }
            tokens.add(nextToken());
        }
    }

    private PatternToken nextToken() {
        int start = pos;
        char c = source.charAt(pos);
        if (isIdentifierStart(c)) {
            while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
                pos++;
            }
            return new PatternToken(Type.IDENT, source.substring(start, pos), start);
        }
        switch (c) {
            case '"':
                return quoted('"', Type.STRING);
            case '\'':
                return quoted('\'', Type.LEMMA);
            case '.':
                if (source.startsWith("...", pos)) {
                    pos += 3;
                    return new PatternToken(Type.ELLIPSIS, "...", start);
                }
                pos++;
                return new PatternToken(Type.DOT, ".", start);
            case '>':
                if (source.startsWith(">>", pos)) {
                    pos += 2;
                    return new PatternToken(Type.DESCENDANT, ">>", start);
                }
                pos++;
                return new PatternToken(Type.CHILD, ">", start);
            case '(':
                return single(Type.LPAREN);
            case ')':
                return single(Type.RPAREN);
            case '|':
                return single(Type.BAR);
            case '{':
                return single(Type.LBRACE);
            case '}':
                return single(Type.RBRACE);
            case '[':
                return single(Type.LBRACKET);
            case ']':
                return single(Type.RBRACKET);
            case '*':
                return single(Type.STAR);
            case '+':
                return single(Type.PLUS);
            case '?':
                return single(Type.QUESTION);
            default:
                throw new PatternCompileException("Unexpected character '" + c + "'", source, start);
        }
    }

    private PatternToken single(Type type) {
        int start = pos++;
        return new PatternToken(type, String.valueOf(source.charAt(start)), start);
    }

    private PatternToken quoted(char quote, Type type) {
        int start = pos;
        int close = source.indexOf(quote, start + 1);
        if (close < 0) {
            throw new PatternCompileException("Unterminated literal", source, start);
        }
        pos = close + 1;
        return new PatternToken(type, source.substring(start + 1, close), start);
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }
}
