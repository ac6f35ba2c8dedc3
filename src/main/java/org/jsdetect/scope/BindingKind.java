package org.jsdetect.scope;

public enum BindingKind {
    VAR,
    LET,
    CONST,
    FUNCTION,
    CLASS,
    PARAM,
    CATCH_PARAM,
    IMPORT,
    FUNCTION_NAME,
    IMPLICIT_GLOBAL;

    /**
     * let / const / class 存在暂时性死区：同一函数内，声明之前的引用视为未绑定
     */
    public boolean isLexical() {
        return this == LET || this == CONST || this == CLASS;
    }
}
