package com.codeasg.engine.ast;

import java.util.EnumSet;
import java.util.Set;

/**
 * Language-neutral node tags. Grammar kinds without a mapping become {@link #OTHER}
 * and keep their raw kind alongside.
 */
public enum CanonicalKind {

    MODULE("Module"),
    FUNCTION_DECL("FunctionDecl"),
    LAMBDA("Lambda"),
    CLASS_DECL("ClassDecl"),
    PARAMETER("Parameter"),
    VARIABLE_DECL("VariableDecl"),
    DECLARATOR("Declarator"),
    IMPORT("Import"),
    SCOPE_DIRECTIVE("ScopeDirective"),
    BLOCK("Block"),
    EXPR_STMT("ExprStmt"),
    ASSIGNMENT("Assignment"),
    UPDATE_EXPR("UpdateExpr"),
    IF_STMT("IfStmt"),
    ELSE_CLAUSE("ElseClause"),
    WHILE_STMT("WhileStmt"),
    DO_WHILE_STMT("DoWhileStmt"),
    FOR_STMT("ForStmt"),
    FOR_EACH_STMT("ForEachStmt"),
    LOOP_CLAUSE("LoopClause"),
    SWITCH_STMT("SwitchStmt"),
    CASE_CLAUSE("CaseClause"),
    TRY_STMT("TryStmt"),
    CATCH_CLAUSE("CatchClause"),
    FINALLY_CLAUSE("FinallyClause"),
    WITH_STMT("WithStmt"),
    THROW_STMT("ThrowStmt"),
    RETURN_STMT("ReturnStmt"),
    BREAK_STMT("BreakStmt"),
    CONTINUE_STMT("ContinueStmt"),
    FALLTHROUGH_STMT("FallthroughStmt"),
    LABELED_STMT("LabeledStmt"),
    CALL_EXPR("CallExpr"),
    MEMBER_EXPR("MemberExpr"),
    INDEX_EXPR("IndexExpr"),
    IDENTIFIER("Identifier"),
    LITERAL("Literal"),
    COMPREHENSION("Comprehension"),
    ERROR("Error"),
    OTHER("Other"),
    CFG_ENTRY("CfgEntry"),
    CFG_EXIT("CfgExit");

    private static final Set<CanonicalKind> COMPOUND = EnumSet.of(
        BLOCK, IF_STMT, ELSE_CLAUSE, WHILE_STMT, DO_WHILE_STMT, FOR_STMT, FOR_EACH_STMT,
        SWITCH_STMT, CASE_CLAUSE, TRY_STMT, CATCH_CLAUSE, FINALLY_CLAUSE, LABELED_STMT, WITH_STMT);

    private static final Set<CanonicalKind> JUMPS = EnumSet.of(
        THROW_STMT, RETURN_STMT, BREAK_STMT, CONTINUE_STMT, FALLTHROUGH_STMT);

    private final String tag;

    CanonicalKind(String tag) {
        this.tag = tag;
    }

    public String tag() { return tag; }

    public boolean isFunctionLike() {
        return this == FUNCTION_DECL || this == LAMBDA;
    }

    /** Statements that contain other statements and therefore shape control flow. */
    public boolean isCompound() {
        return COMPOUND.contains(this);
    }

    public boolean isJump() {
        return JUMPS.contains(this);
    }

    public boolean isSynthetic() {
        return this == CFG_ENTRY || this == CFG_EXIT;
    }

    /** Finds the kind whose tag equals {@code tag}, or null. */
    public static CanonicalKind fromTag(String tag) {
        for (CanonicalKind kind : values()) {
            if (kind.tag.equals(tag)) return kind;
        }
        return null;
    }
}
