package de.hpi.isg.xtab.filter;

/**
 * A lexical unit of a filter expression.
 */
class Token {

    enum Type {
        IDENTIFIER, STRING, NUMBER, COMPARATOR, IN, NOT, AND, OR, LEFT_PARENTHESIS, RIGHT_PARENTHESIS, COMMA, END
    }

    private final Type type;

    private final String text;

    /**
     * Position of the token within the expression.
     */
    private final int position;

    Token(Type type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    Type getType() {
        return this.type;
    }

    String getText() {
        return this.text;
    }

    int getPosition() {
        return this.position;
    }

    boolean is(Type type) {
        return this.type == type;
    }

    @Override
    public String toString() {
        return this.type == Type.END ? "end of expression" : String.format("'%s'", this.text);
    }
}
