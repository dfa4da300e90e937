package com.codeasg.engine.grammar;

/**
 * Wraps one external parser. Implementations must be pure over the text and tolerant:
 * local syntax errors produce ERROR/MISSING nodes, never an exception.
 */
public interface GrammarAdapter {

    Language language();

    RawTree parse(SourceText source);
}
