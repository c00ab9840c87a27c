package org.xdrls.compiler.api;

import org.xdrls.compiler.frontend.parser.ast.Specification;

/**
 * Turns the text of one schema file into its abstract syntax tree.
 */
public interface ISchemaParser {

    /**
     * Parses a schema file.
     *
     * @param source The decoded file content.
     * @param fileName A name for the file, used in diagnostics.
     * @return The parsed specification.
     * @throws SchemaParseException if the text is not a valid schema. No partial result is produced.
     */
    Specification parse(String source, String fileName) throws SchemaParseException;
}
