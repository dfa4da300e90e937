package com.codeasg.engine.ast;

/**
 * The part a child plays in its parent, derived from grammar field names.
 */
public enum Role {
    NONE,
    NAME,
    BODY,
    CONDITION,
    THEN,
    ELSE,
    TARGET,
    VALUE,
    CALLEE,
    ARGUMENTS,
    PARAMETERS,
    DECLARATOR,
    INIT,
    UPDATE,
    HANDLER,
    FINALIZER,
    TYPE,
    MEMBER,
    OBJECT,
    LABEL,
    ALIAS
}
