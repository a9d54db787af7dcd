package matlabode;

import org.antlr.v4.runtime.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Context-sensitive token post-processing on top of the generated lexer.
 *
 * MATLAB tokens depend on where they appear, which a plain lexer cannot see:
 * whitespace separates elements inside [] and {} literals, newlines are
 * insignificant inside () and {} indexing, "end" inside an index means the
 * last element, and an identifier followed by a word at the start of a
 * statement is command syntax ("hold on") unless that identifier was
 * already assigned as a variable ("x -y" after "x = 1"). This class tracks delimiter
 * nesting and rewrites the raw token stream accordingly, using a small
 * lookahead buffer over the underlying lexer.
 */
public class MatlabTokenizer extends MatlabLexer {

    private static final Logger log = LoggerFactory.getLogger(MatlabTokenizer.class);

    private enum Nesting { PAREN, BRACKET, BRACE, INDEX_BRACE }

    private static final Set<Integer> VALUE_END_TYPES = new HashSet<>(Arrays.asList(
        ID, NUMBER, IMAG_NUMBER, STRING, DQSTRING, RPAREN, RBRACKET, RBRACE,
        TRANSPOSE, NC_TRANSPOSE, END, MatlabParser.END_INDEX));

    private static final Set<Integer> VALUE_START_TYPES = new HashSet<>(Arrays.asList(
        ID, NUMBER, IMAG_NUMBER, STRING, DQSTRING, LPAREN, LBRACKET, LBRACE, AT, NOT, END));

    private static final Set<Integer> STATEMENT_BOUNDARY_TYPES = new HashSet<>(Arrays.asList(
        NEWLINE, SEMI, COMMA, COMMENT, BLOCK_COMMENT, ELSE, TRY, OTHERWISE));

    private static final Set<Integer> COMMAND_END_TYPES = new HashSet<>(Arrays.asList(
        NEWLINE, SEMI, COMMA, COMMENT, BLOCK_COMMENT, EOF));

    // Raw tokens lexed ahead of the current position
    private final List<Token> pending = new ArrayList<>();
    private final Deque<Nesting> nesting = new ArrayDeque<>();
    // Names seen as "name = ..." so far; these never start command syntax
    private final Set<String> assignedNames = new HashSet<>();

    private Token lastSignificant;
    private int lastRawType = -1;

    public MatlabTokenizer(CharStream input) {
        super(input);
    }

    @Override
    public void reset() {
        super.reset();
        if (pending != null) {
            pending.clear();
            nesting.clear();
            assignedNames.clear();
        }
        lastSignificant = null;
        lastRawType = -1;
    }

    @Override
    public Token nextToken() {
        Token token = pull();
        int rawType = token.getType();
        Token result = token;

        switch (rawType) {
            case WS:
            case CONTINUATION:
                if (isElementSeparator()) {
                    result = rewrite(token, COMMA, ",", Token.DEFAULT_CHANNEL);
                }
                break;
            case NEWLINE:
                if (nesting.peek() == Nesting.PAREN || nesting.peek() == Nesting.INDEX_BRACE) {
                    result = rewrite(token, NEWLINE, token.getText(), Token.HIDDEN_CHANNEL);
                }
                break;
            case COMMENT:
            case BLOCK_COMMENT:
                if (!nesting.isEmpty()) {
                    result = rewrite(token, rawType, token.getText(), Token.HIDDEN_CHANNEL);
                }
                break;
            case LPAREN:
                nesting.push(Nesting.PAREN);
                break;
            case LBRACKET:
                nesting.push(Nesting.BRACKET);
                break;
            case LBRACE:
                nesting.push(VALUE_END_TYPES.contains(lastRawType) ? Nesting.INDEX_BRACE : Nesting.BRACE);
                break;
            case RPAREN:
            case RBRACKET:
            case RBRACE:
                // Mismatches are left for the parser to report
                if (!nesting.isEmpty()) {
                    nesting.pop();
                }
                break;
            case END:
                if (!nesting.isEmpty()) {
                    result = rewrite(token, MatlabParser.END_INDEX, token.getText(), Token.DEFAULT_CHANNEL);
                }
                break;
            case ID:
                if (nesting.isEmpty() && assignmentAhead()) {
                    assignedNames.add(token.getText());
                } else if (nesting.isEmpty() && atStatementStart()
                        && !assignedNames.contains(token.getText()) && commandSyntaxAhead()) {
                    result = rewrite(token, MatlabParser.COMMAND_NAME, token.getText(), Token.DEFAULT_CHANNEL);
                    collectCommandArguments();
                }
                break;
            default:
                break;
        }

        lastRawType = rawType;
        if (result.getChannel() == Token.DEFAULT_CHANNEL) {
            lastSignificant = result;
        }
        return result;
    }

    // =====================================================================
    // LOOKAHEAD BUFFER
    // =====================================================================

    private Token pull() {
        return pending.isEmpty() ? super.nextToken() : pending.remove(0);
    }

    private Token peek(int offset) {
        while (pending.size() <= offset) {
            pending.add(super.nextToken());
        }
        return pending.get(offset);
    }

    private static Token rewrite(Token original, int type, String text, int channel) {
        CommonToken token = new CommonToken(original);
        token.setType(type);
        token.setText(text);
        token.setChannel(channel);
        return token;
    }

    // =====================================================================
    // ELEMENT SEPARATION INSIDE [] AND {}
    // =====================================================================

    private boolean isElementSeparator() {
        Nesting top = nesting.peek();
        if (top != Nesting.BRACKET && top != Nesting.BRACE) {
            return false;
        }
        if (lastSignificant == null || !VALUE_END_TYPES.contains(lastSignificant.getType())) {
            return false;
        }
        int offset = 0;
        while (peek(offset).getType() == WS || peek(offset).getType() == CONTINUATION) {
            offset++;
        }
        int nextType = peek(offset).getType();
        if (nextType == PLUS || nextType == MINUS) {
            // "[a -b]" has two elements, "[a - b]" has one
            int following = peek(offset + 1).getType();
            return following != WS && following != CONTINUATION;
        }
        return VALUE_START_TYPES.contains(nextType);
    }

    // =====================================================================
    // COMMAND SYNTAX
    // =====================================================================

    private boolean atStatementStart() {
        return lastSignificant == null || STATEMENT_BOUNDARY_TYPES.contains(lastSignificant.getType());
    }

    private boolean assignmentAhead() {
        int offset = 0;
        while (peek(offset).getType() == WS) {
            offset++;
        }
        return peek(offset).getType() == ASSIGN;
    }

    private boolean commandSyntaxAhead() {
        if (peek(0).getType() != WS) {
            return false;
        }
        int argType = peek(1).getType();
        switch (argType) {
            case ID:
            case NUMBER:
            case STRING:
            case DQSTRING:
                return true;
            case MINUS:
                return peek(2).getType() == ID;
            default:
                return false;
        }
    }

    /**
     * Consumes the rest of the command line and queues it back as one
     * COMMAND_ARG token per whitespace-separated word.
     */
    private void collectCommandArguments() {
        List<Token> words = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        Token wordStart = null;

        Token token = pull();
        while (!COMMAND_END_TYPES.contains(token.getType())) {
            if (token.getType() == WS || token.getType() == CONTINUATION) {
                if (wordStart != null) {
                    words.add(rewrite(wordStart, MatlabParser.COMMAND_ARG, word.toString(), Token.DEFAULT_CHANNEL));
                    word.setLength(0);
                    wordStart = null;
                }
            } else {
                if (wordStart == null) {
                    wordStart = token;
                }
                word.append(commandWordText(token));
            }
            token = pull();
        }
        if (wordStart != null) {
            words.add(rewrite(wordStart, MatlabParser.COMMAND_ARG, word.toString(), Token.DEFAULT_CHANNEL));
        }

        pending.add(0, token);
        pending.addAll(0, words);
        log.debug("Command syntax at line {} with {} argument(s)", token.getLine(), words.size());
    }

    private static String commandWordText(Token token) {
        String text = token.getText();
        if (token.getType() == STRING) {
            return text.substring(1, text.length() - 1).replace("''", "'");
        }
        if (token.getType() == DQSTRING) {
            return text.substring(1, text.length() - 1).replace("\"\"", "\"");
        }
        return text;
    }
}
