package com.pascals.compiler.ast;

import java.util.Map;

/**
 * Common surface of every syntax tree node. Nodes are immutable once the parser has built
 * them; analysis results are kept beside the tree, never on it.
 */
public interface Node {
    <R> R accept(NodeVisitor<R> visitor);

    /** Structural dictionary with a {@code "type"} discriminator and stable field names. */
    default Map<String, Object> toMap() {
        return toMap(Annotator.NONE);
    }

    Map<String, Object> toMap(Annotator annotator);
}
