package org.xdrls.compiler.frontend.position;

/**
 * A zero-based (line, column) coordinate in a schema file.
 *
 * @param line The number of line breaks preceding the position.
 * @param column The distance from the start of the line, in UTF-16 code units.
 */
public record TextPosition(int line, int column) {}
