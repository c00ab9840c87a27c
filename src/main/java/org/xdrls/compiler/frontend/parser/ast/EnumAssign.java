package org.xdrls.compiler.frontend.parser.ast;

/**
 * One {@code NAME = value} member of an enum body.
 *
 * @param identifier The member name.
 * @param value The assigned value.
 */
public record EnumAssign(Identifier identifier, Value value) {}
