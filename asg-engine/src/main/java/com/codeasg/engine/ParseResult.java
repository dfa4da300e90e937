package com.codeasg.engine;

import com.codeasg.engine.ast.CanonicalAst;
import com.codeasg.engine.ast.ParseError;
import com.codeasg.engine.grammar.Language;

import java.util.List;

/**
 * Canonical tree of a source text plus the syntax errors the parser recovered from.
 */
public record ParseResult(Language language, CanonicalAst ast, List<ParseError> errors) {

    public ParseResult {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
