package com.pascals.compiler.util;

/** A tree that breaks the parser's structural guarantees. Always a bug in whoever built the tree. */
public class AstContractException extends IllegalStateException {
    public AstContractException(String message) {
        super(message);
    }
}
