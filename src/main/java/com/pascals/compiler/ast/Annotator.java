package com.pascals.compiler.ast;

/** Supplies an extra {@code "decoration"} value per node when a tree is rendered with {@link Node#toMap(Annotator)}. */
@FunctionalInterface
public interface Annotator {
    Annotator NONE = node -> null;

    /** Value to attach to {@code node}, or null for none. */
    Object annotate(Node node);
}
