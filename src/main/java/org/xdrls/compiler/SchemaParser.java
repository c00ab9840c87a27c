package org.xdrls.compiler;

import org.xdrls.compiler.api.ISchemaParser;
import org.xdrls.compiler.api.SchemaParseException;
import org.xdrls.compiler.diagnostics.DiagnosticsEngine;
import org.xdrls.compiler.frontend.lexer.Lexer;
import org.xdrls.compiler.frontend.lexer.Token;
import org.xdrls.compiler.frontend.parser.Parser;
import org.xdrls.compiler.frontend.parser.ast.Specification;

import java.util.List;

/**
 * The default {@link ISchemaParser}: runs the lexer and the parser and rejects the
 * whole file if either phase reported an error. It is stateless and thread-safe.
 */
public class SchemaParser implements ISchemaParser {

    @Override
    public Specification parse(String source, String fileName) throws SchemaParseException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, diagnostics, fileName).scanTokens();
        if (diagnostics.hasErrors()) {
            throw new SchemaParseException("Lexical errors in " + fileName + ":\n" + diagnostics.summary(),
                    diagnostics.getDiagnostics());
        }

        Specification specification = new Parser(tokens, diagnostics, fileName).parse();
        if (diagnostics.hasErrors()) {
            throw new SchemaParseException("Syntax errors in " + fileName + ":\n" + diagnostics.summary(),
                    diagnostics.getDiagnostics());
        }
        return specification;
    }
}
