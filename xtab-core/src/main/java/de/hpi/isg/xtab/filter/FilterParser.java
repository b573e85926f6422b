package de.hpi.isg.xtab.filter;

import de.hpi.isg.xtab.error.CrosstabException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for filter expressions. Grammar:
 * <pre>
 * disjunction := conjunction (('|' | '||') conjunction)*
 * conjunction := unary (('&amp;' | '&amp;&amp;') unary)*
 * unary       := '!' unary | primary
 * primary     := '(' disjunction ')'
 *              | 'is.na' '(' column ')'
 *              | column comparator literal
 *              | column '%in%' 'c' '(' literal (',' literal)* ')'
 * comparator  := '==' | '!=' | '&lt;' | '&lt;=' | '&gt;' | '&gt;='
 * literal     := number | string
 * </pre>
 */
class FilterParser {

    private final String expression;

    private final List<Token> tokens;

    private int position = 0;

    FilterParser(String expression) {
        this.expression = expression;
        this.tokens = FilterLexer.tokenize(expression);
    }

    /**
     * @throws CrosstabException with {@link de.hpi.isg.xtab.error.ErrorCode#FILTER_SYNTAX} on syntax errors
     */
    FilterNode parse() {
        FilterNode node = this.parseDisjunction();
        this.expect(Token.Type.END);
        return node;
    }

    private FilterNode parseDisjunction() {
        FilterNode node = this.parseConjunction();
        while (this.peek().is(Token.Type.OR)) {
            this.position++;
            node = new FilterNode.Junction(node, this.parseConjunction(), false);
        }
        return node;
    }

    private FilterNode parseConjunction() {
        FilterNode node = this.parseUnary();
        while (this.peek().is(Token.Type.AND)) {
            this.position++;
            node = new FilterNode.Junction(node, this.parseUnary(), true);
        }
        return node;
    }

    private FilterNode parseUnary() {
        if (this.peek().is(Token.Type.NOT)) {
            this.position++;
            return new FilterNode.Negation(this.parseUnary());
        }
        return this.parsePrimary();
    }

    private FilterNode parsePrimary() {
        Token token = this.peek();
        if (token.is(Token.Type.LEFT_PARENTHESIS)) {
            this.position++;
            FilterNode node = this.parseDisjunction();
            this.expect(Token.Type.RIGHT_PARENTHESIS);
            return node;
        }

        String column = this.expect(Token.Type.IDENTIFIER).getText();
        if (column.equals("is.na") && this.peek().is(Token.Type.LEFT_PARENTHESIS)) {
            this.position++;
            String argument = this.expect(Token.Type.IDENTIFIER).getText();
            this.expect(Token.Type.RIGHT_PARENTHESIS);
            return new FilterNode.MissingCheck(argument);
        }

        Token operator = this.next();
        if (operator.is(Token.Type.COMPARATOR)) {
            return new FilterNode.Comparison(column, operator.getText(), this.parseLiteral());
        }
        if (operator.is(Token.Type.IN)) {
            Token function = this.expect(Token.Type.IDENTIFIER);
            if (!function.getText().equals("c")) {
                throw this.syntaxError(function, "expected c(...) after %in%");
            }
            this.expect(Token.Type.LEFT_PARENTHESIS);
            List<FilterNode.Literal> literals = new ArrayList<>();
            literals.add(this.parseLiteral());
            while (this.peek().is(Token.Type.COMMA)) {
                this.position++;
                literals.add(this.parseLiteral());
            }
            this.expect(Token.Type.RIGHT_PARENTHESIS);
            return new FilterNode.Membership(column, literals);
        }
        throw this.syntaxError(operator, String.format("expected a comparison or %%in%% after %s but found %s",
                column, operator));
    }

    private FilterNode.Literal parseLiteral() {
        Token token = this.next();
        if (token.is(Token.Type.STRING)) {
            return FilterNode.Literal.ofText(token.getText());
        }
        if (token.is(Token.Type.NUMBER)) {
            try {
                return FilterNode.Literal.ofNumber(token.getText());
            } catch (NumberFormatException e) {
                throw this.syntaxError(token, "malformed number " + token);
            }
        }
        throw this.syntaxError(token, "expected a number or a quoted text but found " + token);
    }

    private Token peek() {
        return this.tokens.get(this.position);
    }

    private Token next() {
        Token token = this.peek();
        if (!token.is(Token.Type.END)) this.position++;
        return token;
    }

    private Token expect(Token.Type type) {
        Token token = this.next();
        if (!token.is(type)) {
            throw this.syntaxError(token, String.format("expected %s but found %s", describe(type), token));
        }
        return token;
    }

    private static String describe(Token.Type type) {
        switch (type) {
            case IDENTIFIER:
                return "a column name";
            case LEFT_PARENTHESIS:
                return "'('";
            case RIGHT_PARENTHESIS:
                return "')'";
            case END:
                return "end of expression";
            default:
                return type.name().toLowerCase();
        }
    }

    private CrosstabException syntaxError(Token token, String reason) {
        return FilterLexer.syntaxError(this.expression, token.getPosition(), reason);
    }
}
