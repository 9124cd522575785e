package com.pascals.compiler.automaton;

import com.pascals.compiler.error.CompilerException;

/** The DFA configuration is invalid in a way that would break scanning. */
public class DfaConfigException extends CompilerException {
    public DfaConfigException(String message) {
        super(message);
    }

    public DfaConfigException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
