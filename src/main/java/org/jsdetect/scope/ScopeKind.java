package org.jsdetect.scope;

public enum ScopeKind {
    GLOBAL,
    FUNCTION,
    BLOCK,
    CATCH,
    FUNCTION_NAME,
    CLASS
}
