package com.codeasg.engine;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.AstNormalizer;
import com.codeasg.engine.ast.CanonicalAst;
import com.codeasg.engine.ast.CanonicalKind;
import com.codeasg.engine.cache.GraphCache;
import com.codeasg.engine.cfg.CfgBuilder;
import com.codeasg.engine.cfg.FlowGraphs;
import com.codeasg.engine.dfg.DataFlowAnalyzer;
import com.codeasg.engine.grammar.GrammarRegistry;
import com.codeasg.engine.grammar.Language;
import com.codeasg.engine.grammar.SourceText;
import com.codeasg.engine.graph.Asg;
import com.codeasg.engine.graph.AsgAssembler;
import com.codeasg.engine.scope.ScopeBuilder;
import com.codeasg.engine.scope.SymbolTable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared fixtures: runs the build stages directly and looks nodes up by kind and text.
 */
final class Units {

    static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/sample-units");

    static final GrammarRegistry GRAMMARS = GrammarRegistry.treeSitter();

    private Units() {}

    static CanonicalAst parse(String source, Language language) {
        return new AstNormalizer().normalize(GRAMMARS.parse(SourceText.of(source), language));
    }

    static Asg build(String source, Language language) {
        return build(source, language, "unit");
    }

    static Asg build(String source, Language language, String identity) {
        CanonicalAst ast = parse(source, language);
        SymbolTable symbols = new ScopeBuilder().build(ast);
        FlowGraphs flows = new CfgBuilder().build(ast);
        return new AsgAssembler().assemble(identity, GraphCache.contentHash(source), ast, symbols, flows,
            new DataFlowAnalyzer().analyze(ast, symbols, flows));
    }

    static String fixture(String fileName) {
        try {
            return Files.readString(FIXTURE_ROOT.resolve(fileName));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static List<AstNode> nodes(CanonicalAst ast, CanonicalKind kind) {
        List<AstNode> found = new ArrayList<>();
        for (AstNode node : ast.nodes()) {
            if (node.kind() == kind) found.add(node);
        }
        return found;
    }

    static AstNode first(CanonicalAst ast, CanonicalKind kind) {
        List<AstNode> found = nodes(ast, kind);
        if (found.isEmpty()) throw new AssertionError("No " + kind + " node");
        return found.get(0);
    }

    /** Identifier occurrences with the given text, in source order. */
    static List<AstNode> identifiers(CanonicalAst ast, String text) {
        List<AstNode> found = new ArrayList<>();
        for (AstNode node : ast.nodes()) {
            if (node.kind() == CanonicalKind.IDENTIFIER && ast.text(node).equals(text)) found.add(node);
        }
        return found;
    }

    /** Node of the given kind whose text starts with {@code prefix}. */
    static AstNode find(CanonicalAst ast, CanonicalKind kind, String prefix) {
        for (AstNode node : ast.nodes()) {
            if (node.kind() == kind && ast.text(node).startsWith(prefix)) return node;
        }
        throw new AssertionError("No " + kind + " starting with '" + prefix + "'");
    }
}
