package com.viffx.Gnf.Grammar;

import com.viffx.Gnf.Symbols.Symbol;
import com.viffx.Gnf.Symbols.Terminal;
import com.viffx.Gnf.Symbols.Variable;
import com.viffx.Gnf.Utils.LexicalCharacterBuffer;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static java.lang.Character.isLetterOrDigit;
import static java.lang.Character.isUpperCase;
import static java.lang.Character.isWhitespace;

/**
 * Reads grammars written as rule files.
 * <pre>
 *   // the worked example
 *   A1 > A2 A3;
 *   A2 > A3 A1 | b;
 *   A3 > A1 A2 | a;
 * </pre>
 * Identifiers starting with an upper case letter are variables, everything else is a terminal.
 * Punctuation terminals are written quoted, e.g. {@code '('}. A rule whose only body is
 * {@code ∅} defines a variable with no productions.
 * <p>
 * Each defined variable gets its ordering value from the position of its rule, starting at 1.
 * Variables that are referenced but never defined are ordered after them and get no entry in
 * the grammar, so they stay dangling references for the normalizer to deal with.
 */
public final class GrammarLoader {
    private static final Logger logger = LoggerFactory.getLogger(GrammarLoader.class);

    // ====== INSTANCE FIELDS ====== //
    private final LexicalCharacterBuffer lexer;
    private int numRules = 0;
    private int index = 0;
    private int line = 1;
    private int column = 1;
    private final List<Token> currentRule = new ArrayList<>();

    // ====== CONSTRUCTORS ====== //
    private GrammarLoader(Reader source) throws IOException {
        lexer = new LexicalCharacterBuffer(source) {
            @Override
            public void onNextChar() {
                advancePosition(crntChar());
            }
        };
    }

    /**
     * Loads a UTF-8 rule file.
     *
     * @throws IOException if the file cannot be read or is malformed
     */
    @NotNull
    public static Grammar load(@NotNull Path filePath) throws IOException {
        Objects.requireNonNull(filePath, "filePath cannot be null");
        logger.debug("Loading grammar from {}", filePath);
        try (Reader reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8)) {
            return new GrammarLoader(reader).read();
        }
    }

    /**
     * Parses rules held in memory.
     *
     * @throws IOException if the text is malformed
     */
    @NotNull
    public static Grammar parse(@NotNull String text) throws IOException {
        Objects.requireNonNull(text, "text cannot be null");
        try (Reader reader = new StringReader(text)) {
            return new GrammarLoader(reader).read();
        }
    }

    private Grammar read() throws IOException {
        List<RawRule> rules = parseRules();
        Grammar grammar = assemble(rules);
        logger.debug("Loaded {} rule(s) defining {} production(s)", rules.size(), grammar.productionsSize());
        return grammar;
    }

    // ====== INTERNAL DATA TYPES ====== //
    private record RawRule(Token head, List<List<Token>> bodies) {}

    private void advancePosition(char c) {
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
    }

    // ====== PARSING METHODS ====== //

    // Repeatedly call parseRule until all the rules have been parsed
    private List<RawRule> parseRules() throws IOException {
        List<RawRule> rules = new ArrayList<>();
        Set<String> defined = new HashSet<>();
        while (true) {
            ignoreWhiteSpace();
            if (lexer.eof()) break;
            RawRule rule = parseRule();
            if (!defined.add(rule.head().value())) {
                throw new IOException(errorContext() + "variable: " + rule.head().value() + " is already defined");
            }
            rules.add(rule);
        }
        return rules;
    }

    /**
     * Parses a single rule of the form {@code Head > body | body ... ;}.
     *
     * @return the head token and the token lists of its bodies, empty for {@code Head > ∅;}
     * @throws IOException if the rule is malformed or the input ends inside it
     */
    private RawRule parseRule() throws IOException {
        numRules++;
        currentRule.clear();

        // ------ Parse the variable declaration (left hand side) ------ //
        Token head = expect(null, TokenType.VARIABLE);
        currentRule.add(head);
        currentRule.add(expect(">", TokenType.SYMBOL));

        // ------ parse the right hand side ------ //
        Token current = next();
        currentRule.add(current);
        if (current.type() == TokenType.EMPTY_SET) {
            currentRule.add(expect(";", TokenType.SYMBOL));
            return new RawRule(head, List.of());
        }

        List<List<Token>> bodies = new ArrayList<>();
        List<Token> body = new ArrayList<>();
        while (true) {
            switch (current.type()) {
                case VARIABLE, TERMINAL -> body.add(current);
                case EOF -> throw new IOException(errorContext() + "Reached end of file while defining a rule");
                case EMPTY_SET -> throw new IOException(errorContext() + "∅ must be the only body of a rule");
                case SYMBOL -> {
                    if (body.isEmpty()) {
                        throw new IOException(errorContext() + "empty production before " + current + ", write '" + Grammar.EMPTY_SET + "' for a rule without productions");
                    }
                    bodies.add(body);
                    body = new ArrayList<>();
                    switch (current.value()) {
                        case ";":
                            return new RawRule(head, bodies);
                        case ">":
                            index -= 2;
                            throw new IOException(errorContext() + "MISSING SEMICOLON");
                        default: // "|" starts the next production
                            break;
                    }
                }
            }
            current = next();
            currentRule.add(current);
        }
    }

    // ====== GRAMMAR ASSEMBLY ====== //
    // defined variables are ordered by rule position, referenced-only ones after them
    private static Grammar assemble(List<RawRule> rules) {
        Map<String, Variable> variables = new LinkedHashMap<>();
        for (RawRule rule : rules) {
            String name = rule.head().value();
            variables.put(name, Variable.original(name, variables.size() + 1));
        }
        for (RawRule rule : rules) {
            for (List<Token> body : rule.bodies()) {
                for (Token token : body) {
                    if (token.type() != TokenType.VARIABLE) continue;
                    variables.computeIfAbsent(token.value(), name -> Variable.original(name, variables.size() + 1));
                }
            }
        }

        Grammar grammar = new Grammar();
        for (RawRule rule : rules) {
            Variable head = variables.get(rule.head().value());
            grammar.define(head);
            for (List<Token> body : rule.bodies()) {
                List<Symbol> symbols = new ArrayList<>(body.size());
                for (Token token : body) {
                    symbols.add(token.type() == TokenType.VARIABLE
                            ? variables.get(token.value())
                            : new Terminal(token.value()));
                }
                grammar.add(head, new Production(symbols));
            }
        }
        return grammar;
    }

    // ====== LEXICAL UTILITIES ====== //
    private void ignoreWhiteSpace() throws IOException {
        while (!lexer.eof()) {
            if (isWhitespace(lexer.crntChar())) {
                lexer.nextChar();
            } else if (lexer.crntChar() == '/' && lexer.hasPeek() && lexer.peekChar() == '/') {
                while (!lexer.eof() && lexer.crntChar() != '\n') lexer.nextChar();
            } else {
                return;
            }
        }
    }

    /**
     * Reads and returns the next {@link Token} from the rule input.
     * <p>
     * Skips whitespace and line comments, recognizes the punctuation {@code >}, {@code |} and
     * {@code ;}, the empty-set marker, identifiers and quoted terminals.
     *
     * @return the next token, or {@link Token#EOF} if the end of input is reached
     * @throws IOException if an unknown character or an unterminated literal is encountered
     */
    private Token next() throws IOException {
        ignoreWhiteSpace();
        if (lexer.eof()) return Token.EOF;
        index++;

        char c = lexer.crntChar();
        if (c == '\'') return quotedTerminal();
        if (!isLetterOrDigit(c)) {
            lexer.nextChar();
            return switch (c) {
                case '>', '|', ';' -> new Token(TokenType.SYMBOL, String.valueOf(c));
                case '∅' -> new Token(TokenType.EMPTY_SET, Grammar.EMPTY_SET);
                default -> throw new IOException(errorContext() + "unknown symbol: " + c);
            };
        }

        // Read the name of the token
        StringBuilder builder = new StringBuilder();
        while (!lexer.eof() && (isLetterOrDigit(lexer.crntChar()) || lexer.crntChar() == '_')) {
            builder.append(lexer.crntChar());
            lexer.nextChar();
        }
        String name = builder.toString();
        return new Token(isUpperCase(name.charAt(0)) ? TokenType.VARIABLE : TokenType.TERMINAL, name);
    }

    private Token quotedTerminal() throws IOException {
        lexer.nextChar(); // opening quote
        StringBuilder builder = new StringBuilder();
        while (true) {
            if (lexer.eof()) throw new IOException(errorContext() + "expected ' got EOF");
            char c = lexer.crntChar();
            lexer.nextChar();
            if (c == '\'') break;
            if (c == '\\') {
                if (lexer.eof()) throw new IOException(errorContext() + "expected escaped character got EOF");
                c = lexer.crntChar();
                lexer.nextChar();
            }
            builder.append(c);
        }
        if (builder.length() == 0) throw new IOException(errorContext() + "empty quoted terminal");
        return new Token(TokenType.TERMINAL, builder.toString());
    }

    private Token expect(String expectedValue, TokenType type) throws IOException {
        Token token = next();
        if (token.is(type, expectedValue)) return token;
        throw new IOException(errorContext() + "EXPECTED: " + type + "(" + (expectedValue == null ? "" : expectedValue) + ") GOT: " + token);
    }

    // ====== DEBUG / ERROR REPORTING ====== //
    private String errorContext() {
        return "\n\tERROR: Rule:" + numRules + " Index: " + index + " Line: " + line + " Column: " + column +
                "\n\tCONTEXT: " + currentRule +
                "\n\tBuffer: " + lexer.buffer() + "\n\t";
    }
}
