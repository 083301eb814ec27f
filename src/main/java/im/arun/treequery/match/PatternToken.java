package im.arun.treequery.match;

import lombok.Value;

@Value
class PatternToken {

    enum Type {
        IDENT, STRING, LEMMA, DOT, ELLIPSIS, LPAREN, RPAREN, BAR, LBRACE, RBRACE, LBRACKET, RBRACKET,
        CHILD, DESCENDANT, STAR, PLUS, QUESTION, EOF
    }

    Type type;
    String text;
    int position;

    String describe() {
        return type == Type.EOF ? "end of pattern" : "'" + text + "'";
    }
}
