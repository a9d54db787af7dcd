package matlabode;

import org.antlr.v4.runtime.*;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for turning MATLAB source into a resolved {@link MatlabContext}.
 *
 * Parsing runs in three steps: the tokenizer and generated parser build a
 * parse tree, {@link MatlabNodeBuilder} turns it into nodes, and
 * {@link MatlabSemanticAnalyzer} resolves kinds and scopes. The first syntax
 * error aborts the parse; there is no recovery.
 */
public class MatlabASTParser {

    private static final Logger log = LoggerFactory.getLogger(MatlabASTParser.class);

    private static final String STRING_SOURCE = "<string>";

    private final ConverterConfiguration configuration;
    private final KnownFunctionTable knownFunctions;

    public MatlabASTParser() {
        this(new ConverterConfiguration());
    }

    public MatlabASTParser(ConverterConfiguration configuration) {
        this.configuration = configuration;
        String resource = configuration.getKnownFunctionsResource();
        KnownFunctionTable table = ConverterConfiguration.DEFAULT_KNOWN_FUNCTIONS_RESOURCE.equals(resource)
            ? KnownFunctionTable.standard()
            : KnownFunctionTable.load(resource);
        // Configured solvers must resolve as calls even when the table predates them
        this.knownFunctions = table.withNames(configuration.getSolverNames());
    }

    public ConverterConfiguration getConfiguration() {
        return configuration;
    }

    public KnownFunctionTable getKnownFunctions() {
        return knownFunctions;
    }

    // =====================================================================
    // MAIN PARSING ORCHESTRATION
    // =====================================================================

    public MatlabContext parseString(String text) throws OdeConversionException {
        return parseString(text, STRING_SOURCE);
    }

    public MatlabContext parseString(String text, String sourceName) throws OdeConversionException {
        List<MatlabNode> nodes = buildNodes(text, sourceName);
        MatlabContext root = new MatlabSemanticAnalyzer(knownFunctions).analyze(nodes, sourceName, null);
        log.info("Parsed {}: {} statement(s)", sourceName, root.getNodes().size());
        return root;
    }

    public MatlabContext parseFile(Path file) throws IOException, OdeConversionException {
        String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        String sourceName = file.getFileName().toString();
        List<MatlabNode> nodes = buildNodes(text, sourceName);
        MatlabContext root = new MatlabSemanticAnalyzer(knownFunctions).analyze(nodes, sourceName, file);
        log.info("Parsed {}: {} statement(s)", file, root.getNodes().size());
        return root;
    }

    /** Syntactic pass only: nodes as built, before kinds are resolved. */
    List<MatlabNode> buildNodes(String text, String sourceName) throws OdeConversionException {
        MatlabTokenizer lexer = new MatlabTokenizer(CharStreams.fromString(text, sourceName));
        setupErrorHandling(lexer, sourceName);
        CommonTokenStream tokenStream = new CommonTokenStream(lexer);

        try {
            tokenStream.fill();
            rejectUnsupportedTokens(tokenStream);

            MatlabParser parser = new MatlabParser(tokenStream);
            setupErrorHandling(parser, sourceName);
            MatlabParser.ProgramContext tree = parser.program();

            return new MatlabNodeBuilder().buildProgram(tree);
        } catch (ParseCancellationException e) {
            throw unwrap(e, sourceName);
        }
    }

    private void rejectUnsupportedTokens(CommonTokenStream tokenStream) {
        for (Token token : tokenStream.getTokens()) {
            if (token.getType() == MatlabLexer.CLASSDEF) {
                throw unsupported("a classdef definition", token);
            }
            if (token.getType() == MatlabLexer.IMAG_NUMBER) {
                throw unsupported("the complex number " + token.getText(), token);
            }
        }
    }

    private static ParseCancellationException unsupported(String construct, Token token) {
        return new ParseCancellationException(
            new UnsupportedConstructException(construct, token.getLine(), token.getCharPositionInLine() + 1));
    }

    private static OdeConversionException unwrap(ParseCancellationException e, String sourceName) {
        if (e.getCause() instanceof OdeConversionException) {
            return (OdeConversionException) e.getCause();
        }
        return new MatlabSyntaxException(sourceName, 0, 0, String.valueOf(e.getMessage()));
    }

    // =====================================================================
    // ERROR HANDLING
    // =====================================================================

    private void setupErrorHandling(Recognizer<?, ?> recognizer, String sourceName) {
        recognizer.removeErrorListeners();
        recognizer.addErrorListener(new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                    int line, int charPositionInLine, String msg, RecognitionException e) {
                log.debug("Syntax error in {} at {}:{} - {}", sourceName, line, charPositionInLine, msg);
                throw new ParseCancellationException(
                    new MatlabSyntaxException(sourceName, line, charPositionInLine + 1, msg));
            }
        });
    }
}
