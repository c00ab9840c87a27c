package org.xdrls.compiler.frontend.parser;

import org.xdrls.compiler.diagnostics.DiagnosticsEngine;
import org.xdrls.compiler.frontend.lexer.Token;
import org.xdrls.compiler.frontend.lexer.TokenType;
import org.xdrls.compiler.frontend.parser.ast.CaseSpec;
import org.xdrls.compiler.frontend.parser.ast.Declaration;
import org.xdrls.compiler.frontend.parser.ast.Definition;
import org.xdrls.compiler.frontend.parser.ast.EnumAssign;
import org.xdrls.compiler.frontend.parser.ast.EnumBody;
import org.xdrls.compiler.frontend.parser.ast.Identifier;
import org.xdrls.compiler.frontend.parser.ast.Specification;
import org.xdrls.compiler.frontend.parser.ast.StructBody;
import org.xdrls.compiler.frontend.parser.ast.TypeSpecifier;
import org.xdrls.compiler.frontend.parser.ast.UnionBody;
import org.xdrls.compiler.frontend.parser.ast.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * A recursive-descent parser for the XDR schema language (RFC 4506, section 6).
 * It consumes the tokens produced by the {@link org.xdrls.compiler.frontend.lexer.Lexer}
 * and builds a {@link Specification}.
 * <p>
 * Syntax errors are reported to the {@link DiagnosticsEngine}; the parser then skips to
 * the end of the current top-level definition and continues, so that a single run
 * reports as many problems as possible.
 */
public class Parser {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final String fileName;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting errors.
     * @param fileName The logical file name used in diagnostics.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, String fileName) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.fileName = fileName;
    }

    /**
     * Parses the entire token stream.
     * @return The parsed specification. Definitions that failed to parse are left out.
     */
    public Specification parse() {
        List<Definition> definitions = new ArrayList<>();
        while (!isAtEnd()) {
            Definition definition = definition();
            if (definition != null) {
                definitions.add(definition);
            }
        }
        return new Specification(definitions);
    }

    /**
     * Parses a single top-level definition.
     * @return The parsed {@link Definition}, or null if a syntax error occurred.
     */
    public Definition definition() {
        try {
            if (match(TokenType.CONST)) {
                Identifier name = identifier("Expected constant name after 'const'.");
                consume(TokenType.EQUAL, "Expected '=' after constant name.");
                Token value = consume(TokenType.NUMBER, "Expected a numeric constant.");
                consume(TokenType.SEMICOLON, "Expected ';' after constant definition.");
                return new Definition.Constant(name, value.text());
            }
            if (match(TokenType.TYPEDEF)) {
                Declaration declaration = declaration();
                consume(TokenType.SEMICOLON, "Expected ';' after typedef.");
                return new Definition.TypeDef(declaration);
            }
            if (match(TokenType.ENUM)) {
                Identifier name = identifier("Expected enum name.");
                EnumBody body = enumBody();
                consume(TokenType.SEMICOLON, "Expected ';' after enum definition.");
                return new Definition.EnumDef(name, body);
            }
            if (match(TokenType.STRUCT)) {
                Identifier name = identifier("Expected struct name.");
                StructBody body = structBody();
                consume(TokenType.SEMICOLON, "Expected ';' after struct definition.");
                return new Definition.StructDef(name, body);
            }
            if (match(TokenType.UNION)) {
                Identifier name = identifier("Expected union name.");
                UnionBody body = unionBody();
                consume(TokenType.SEMICOLON, "Expected ';' after union definition.");
                return new Definition.UnionDef(name, body);
            }
            throw error(peek(), "Expected a definition, but got '" + peek().text() + "'.");
        } catch (ParseError ex) {
            synchronize();
            return null;
        }
    }

    private Declaration declaration() {
        if (match(TokenType.VOID)) {
            return new Declaration.VoidDecl();
        }
        if (match(TokenType.OPAQUE)) {
            Identifier name = identifier("Expected name after 'opaque'.");
            if (match(TokenType.LEFT_BRACKET)) {
                Value size = value();
                consume(TokenType.RIGHT_BRACKET, "Expected ']' after opaque size.");
                return new Declaration.FixedOpaque(name, size);
            }
            consume(TokenType.LESS, "Expected '[' or '<' after opaque name.");
            return new Declaration.VariableOpaque(name, optionalBound());
        }
        if (match(TokenType.STRING)) {
            Identifier name = identifier("Expected name after 'string'.");
            consume(TokenType.LESS, "Expected '<' after string name.");
            return new Declaration.StringDecl(name, optionalBound());
        }

        TypeSpecifier type = typeSpecifier();
        if (match(TokenType.STAR)) {
            return new Declaration.OptionalDecl(type, identifier("Expected name after '*'."));
        }
        Identifier name = identifier("Expected declaration name.");
        if (match(TokenType.LEFT_BRACKET)) {
            Value size = value();
            consume(TokenType.RIGHT_BRACKET, "Expected ']' after array size.");
            return new Declaration.FixedArray(type, name, size);
        }
        if (match(TokenType.LESS)) {
            return new Declaration.VariableArray(type, name, optionalBound());
        }
        return new Declaration.Plain(type, name);
    }

    /**
     * Parses the rest of {@code <[value]>} after the opening angle bracket.
     */
    private Value optionalBound() {
        if (match(TokenType.GREATER)) {
            return null;
        }
        Value bound = value();
        consume(TokenType.GREATER, "Expected '>' after bound.");
        return bound;
    }

    private TypeSpecifier typeSpecifier() {
        if (match(TokenType.UNSIGNED)) {
            if (match(TokenType.INT)) return new TypeSpecifier.BuiltIn("unsigned int");
            if (match(TokenType.HYPER)) return new TypeSpecifier.BuiltIn("unsigned hyper");
            return new TypeSpecifier.BuiltIn("unsigned");
        }
        if (match(TokenType.INT, TokenType.HYPER, TokenType.FLOAT, TokenType.DOUBLE,
                TokenType.QUADRUPLE, TokenType.BOOL)) {
            return new TypeSpecifier.BuiltIn(previous().text());
        }
        if (match(TokenType.ENUM)) return new TypeSpecifier.InlineEnum(enumBody());
        if (match(TokenType.STRUCT)) return new TypeSpecifier.InlineStruct(structBody());
        if (match(TokenType.UNION)) return new TypeSpecifier.InlineUnion(unionBody());
        if (match(TokenType.IDENTIFIER)) return new TypeSpecifier.Named(toIdentifier(previous()));
        throw error(peek(), "Expected a type, but got '" + peek().text() + "'.");
    }

    private EnumBody enumBody() {
        consume(TokenType.LEFT_BRACE, "Expected '{' to open enum body.");
        List<EnumAssign> members = new ArrayList<>();
        do {
            Identifier name = identifier("Expected enum member name.");
            consume(TokenType.EQUAL, "Expected '=' after enum member name.");
            members.add(new EnumAssign(name, value()));
        } while (match(TokenType.COMMA));
        consume(TokenType.RIGHT_BRACE, "Expected '}' to close enum body.");
        return new EnumBody(members);
    }

    private StructBody structBody() {
        consume(TokenType.LEFT_BRACE, "Expected '{' to open struct body.");
        List<Declaration> members = new ArrayList<>();
        do {
            members.add(declaration());
            consume(TokenType.SEMICOLON, "Expected ';' after struct member.");
        } while (!check(TokenType.RIGHT_BRACE) && !isAtEnd());
        consume(TokenType.RIGHT_BRACE, "Expected '}' to close struct body.");
        return new StructBody(members);
    }

    private UnionBody unionBody() {
        consume(TokenType.SWITCH, "Expected 'switch' in union body.");
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'switch'.");
        Declaration discriminant = declaration();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after union discriminant.");
        consume(TokenType.LEFT_BRACE, "Expected '{' to open union body.");

        List<CaseSpec> cases = new ArrayList<>();
        do {
            List<Value> guards = new ArrayList<>();
            do {
                consume(TokenType.CASE, "Expected 'case' in union body.");
                guards.add(value());
                consume(TokenType.COLON, "Expected ':' after case value.");
            } while (check(TokenType.CASE));
            Declaration arm = declaration();
            consume(TokenType.SEMICOLON, "Expected ';' after case declaration.");
            cases.add(new CaseSpec(guards, arm));
        } while (check(TokenType.CASE));

        Declaration defaultArm = null;
        if (match(TokenType.DEFAULT)) {
            consume(TokenType.COLON, "Expected ':' after 'default'.");
            defaultArm = declaration();
            consume(TokenType.SEMICOLON, "Expected ';' after default declaration.");
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' to close union body.");
        return new UnionBody(discriminant, cases, defaultArm);
    }

    private Value value() {
        if (match(TokenType.NUMBER)) return new Value.Constant(previous().text());
        if (match(TokenType.IDENTIFIER)) return new Value.Reference(toIdentifier(previous()));
        throw error(peek(), "Expected a constant or a name, but got '" + peek().text() + "'.");
    }

    private Identifier identifier(String errorMessage) {
        return toIdentifier(consume(TokenType.IDENTIFIER, errorMessage));
    }

    private static Identifier toIdentifier(Token token) {
        return new Identifier(token.text(), token.start(), token.end());
    }

    /**
     * Skips tokens until the end of the current top-level definition: the next
     * {@code ;} outside of any braces.
     */
    private void synchronize() {
        int depth = 0;
        while (!isAtEnd()) {
            Token token = advance();
            if (token.type() == TokenType.LEFT_BRACE) {
                depth++;
            } else if (token.type() == TokenType.RIGHT_BRACE) {
                depth = Math.max(0, depth - 1);
            } else if (token.type() == TokenType.SEMICOLON && depth == 0) {
                return;
            }
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    private ParseError error(Token token, String message) {
        diagnostics.reportError(message, fileName, token.line(), token.column());
        return new ParseError(message);
    }

    /**
     * Unwinds the parser to the enclosing definition after a reported syntax error.
     */
    private static final class ParseError extends RuntimeException {
        ParseError(String message) {
            super(message, null, false, false);
        }
    }
}
