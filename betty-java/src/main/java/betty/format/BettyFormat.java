package betty.format;

import betty.ast.Node;
import betty.config.FormatterConfig;
import betty.lexer.Lexer;
import betty.lexer.Token;
import betty.parser.Parser;
import betty.sema.SymbolKind;
import betty.sema.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Lex, parse and print one source text. Each call owns its lexer, symbol table and parser,
 * so one instance may format several files, from several threads.
 */
public final class BettyFormat {

    private static final Logger LOG = LoggerFactory.getLogger(BettyFormat.class);

    /** Formatted text plus the number of lexical errors and of regions kept verbatim. */
    public record Result(String text, int lexErrors, int parseErrors) {
        public boolean fullyModeled() {
            return lexErrors == 0 && parseErrors == 0;
        }
    }

    private final FormatterConfig config;

    public BettyFormat() {
        this(FormatterConfig.defaults());
    }

    public BettyFormat(FormatterConfig config) {
        this.config = config;
    }

    /** Never throws on malformed input; what cannot be parsed is kept as written. */
    public String format(String source) {
        return run(source).text();
    }

    public Result run(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.tokenize();

        Parser parser = new Parser(tokens, globalScope());
        Node program = parser.parseProgram();
        String text = new Formatter(config).format(program);

        LOG.debug("Formatted {} tokens into {} top-level items ({} lexical errors, {} verbatim regions)",
                tokens.size(), program.childCount(), lexer.errorCount(), parser.errorCount());
        return new Result(text, lexer.errorCount(), parser.errorCount());
    }

    /** Layout-only formatting, without building a tree. */
    public String formatTokens(String source) {
        return new TokenStreamFormatter(config).format(new Lexer(source).tokenize());
    }

    private SymbolTable globalScope() {
        SymbolTable global = SymbolTable.withStandardTypedefs();
        for (String name : config.extraTypedefs()) global.add(name, SymbolKind.TYPEDEF);
        return global;
    }
}
