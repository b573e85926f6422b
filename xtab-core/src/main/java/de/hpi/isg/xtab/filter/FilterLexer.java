package de.hpi.isg.xtab.filter;

import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits filter expressions into {@link Token}s after normalizing typographic quotes and spaces and rejecting
 * characters and constructs outside of the filter grammar.
 */
class FilterLexer {

    private static final Pattern UNSAFE_CHARACTER = Pattern.compile("[^A-Za-z0-9_$.()&|!<>= +*/,'\"\\[\\]%:-]");

    private static final Pattern UNSAFE_CONSTRUCT = Pattern.compile(
            "<<?-|->>?|::|\\.GlobalEnv|\\b(system|eval|source|library|require|rm|sink|options|get|assign|mget|do\\.call)\\s*\\(|file\\.",
            Pattern.CASE_INSENSITIVE
    );

    /**
     * Replaces typographic quotes and exotic spaces with their ASCII counterparts and trims the expression.
     */
    static String clean(String expression) {
        return expression
                .replaceAll("[\\u00A0\\u2000-\\u200B\\u202F\\u205F\\u3000]", " ")
                .replaceAll("[\\u2018\\u2019\\u201A\\u201B]", "'")
                .replaceAll("[\\u201C\\u201D\\u201E\\u201F]", "\"")
                .trim();
    }

    /**
     * @throws CrosstabException with {@link ErrorCode#UNSAFE_FILTER} if the expression contains disallowed
     *                           characters or constructs
     */
    static void checkSafety(String expression) {
        if (UNSAFE_CHARACTER.matcher(expression).find()) {
            throw unsafe(String.format("Filter contains potentially unsafe characters: '%s'", expression));
        }
        Matcher matcher = UNSAFE_CONSTRUCT.matcher(expression);
        if (matcher.find()) {
            throw unsafe(String.format("Filter contains unsafe pattern: '%s' not allowed", matcher.group()));
        }
    }

    private static CrosstabException unsafe(String problem) {
        return new CrosstabException(
                ErrorCode.UNSAFE_FILTER, "Unsafe Filter Expression", problem,
                "Filters may only compare columns with values and combine such comparisons.",
                "Use only column names, literals, comparisons (== != < <= > >=), %in% c(...), is.na(), !, & and |"
        );
    }

    static List<Token> tokenize(String expression) {
        List<Token> tokens = new ArrayList<>();
        int pos = 0;
        while (pos < expression.length()) {
            char c = expression.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '(') {
                tokens.add(new Token(Token.Type.LEFT_PARENTHESIS, "(", pos++));
            } else if (c == ')') {
                tokens.add(new Token(Token.Type.RIGHT_PARENTHESIS, ")", pos++));
            } else if (c == ',') {
                tokens.add(new Token(Token.Type.COMMA, ",", pos++));
            } else if (c == '&' || c == '|') {
                int length = pos + 1 < expression.length() && expression.charAt(pos + 1) == c ? 2 : 1;
                tokens.add(new Token(c == '&' ? Token.Type.AND : Token.Type.OR,
                        expression.substring(pos, pos + length), pos));
                pos += length;
            } else if (c == '=' || c == '!' || c == '<' || c == '>') {
                boolean isFollowedByEquals = pos + 1 < expression.length() && expression.charAt(pos + 1) == '=';
                if (isFollowedByEquals) {
                    tokens.add(new Token(Token.Type.COMPARATOR, expression.substring(pos, pos + 2), pos));
                    pos += 2;
                } else if (c == '!') {
                    tokens.add(new Token(Token.Type.NOT, "!", pos++));
                } else if (c == '=') {
                    throw syntaxError(expression, pos, "'=' is not a comparison, use '=='");
                } else {
                    tokens.add(new Token(Token.Type.COMPARATOR, String.valueOf(c), pos++));
                }
            } else if (c == '%') {
                if (!expression.startsWith("%in%", pos)) {
                    throw syntaxError(expression, pos, "only the %in% operator is supported");
                }
                tokens.add(new Token(Token.Type.IN, "%in%", pos));
                pos += 4;
            } else if (c == '\'' || c == '"') {
                int end = expression.indexOf(c, pos + 1);
                if (end == -1) throw syntaxError(expression, pos, "unterminated string literal");
                tokens.add(new Token(Token.Type.STRING, expression.substring(pos + 1, end), pos));
                pos = end + 1;
            } else if (Character.isDigit(c) || (c == '-' && pos + 1 < expression.length()
                    && (Character.isDigit(expression.charAt(pos + 1)) || expression.charAt(pos + 1) == '.'))
                    || (c == '.' && pos + 1 < expression.length() && Character.isDigit(expression.charAt(pos + 1)))) {
                int start = pos++;
                while (pos < expression.length() && (Character.isDigit(expression.charAt(pos)) || expression.charAt(pos) == '.')) {
                    pos++;
                }
                tokens.add(new Token(Token.Type.NUMBER, expression.substring(start, pos), start));
            } else if (Character.isLetter(c) || c == '_' || c == '.') {
                int start = pos++;
                while (pos < expression.length() && isIdentifierPart(expression.charAt(pos))) {
                    pos++;
                }
                tokens.add(new Token(Token.Type.IDENTIFIER, expression.substring(start, pos), start));
            } else {
                throw syntaxError(expression, pos, String.format("unexpected character '%c'", c));
            }
        }
        tokens.add(new Token(Token.Type.END, "", expression.length()));
        return tokens;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }

    static CrosstabException syntaxError(String expression, int position, String reason) {
        return new CrosstabException(
                ErrorCode.FILTER_SYNTAX, "Invalid Filter Expression",
                String.format("Cannot parse filter '%s' at position %d: %s.", expression, position + 1, reason),
                "The base filter determines which respondents a question is tabulated for.",
                "Write comparisons like Q1 == 'Yes' or Age >= 18 and combine them with &, | and !",
                "Use Q %in% c('A', 'B') for lists of values and is.na(Q) for missing values"
        );
    }
}
