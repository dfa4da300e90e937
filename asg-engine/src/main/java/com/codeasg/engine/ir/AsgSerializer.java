package com.codeasg.engine.ir;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.ParseError;
import com.codeasg.engine.cfg.BasicBlock;
import com.codeasg.engine.cfg.CfgEdge;
import com.codeasg.engine.cfg.ControlFlowGraph;
import com.codeasg.engine.grammar.Language;
import com.codeasg.engine.graph.Asg;
import com.codeasg.engine.graph.Edge;
import com.codeasg.engine.scope.Scope;
import com.codeasg.engine.scope.Symbol;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Converts an {@link Asg} to its export model and writes it as JSON.
 * Output is deterministic: nodes by id, edges by kind then endpoints, blocks by function then id.
 */
public class AsgSerializer {

    public static final String FORMAT_VERSION = "0.1";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    public AsgModel.AsgRoot toModel(Asg asg) {
        Language language = asg.language();
        String unit = asg.identity();

        var root = new AsgModel.AsgRoot();
        root.formatVersion = FORMAT_VERSION;
        root.language = language.id();
        root.unit = unit;
        root.contentHash = asg.contentHash();
        root.degraded = asg.isDegraded();

        root.nodes = new ArrayList<>();
        for (AstNode node : asg.nodes()) {
            var out = new AsgModel.AsgNode();
            out.id = NodeRefs.forNode(language, unit, node.id());
            out.kind = node.tag();
            out.rawKind = node.rawKind();
            out.role = node.role().name().toLowerCase();
            out.startByte = node.startByte();
            out.endByte = node.endByte();
            out.startRow = node.start().row();
            out.startColumn = node.start().column();
            out.endRow = node.end().row();
            out.endColumn = node.end().column();
            out.operator = node.operator();
            out.keyword = node.keyword();
            root.nodes.add(out);
        }

        List<Edge> edges = new ArrayList<>(asg.edges());
        edges.sort(Comparator.comparing(Edge::kind)
            .thenComparingInt(Edge::from)
            .thenComparingInt(Edge::to)
            .thenComparing(e -> e.label() == null ? "" : e.label()));
        root.edges = new ArrayList<>();
        for (Edge edge : edges) {
            var out = new AsgModel.AsgEdge();
            out.kind = edge.kind().name().toLowerCase();
            out.from = NodeRefs.forNode(language, unit, edge.from());
            out.to = NodeRefs.forNode(language, unit, edge.to());
            out.label = edge.label();
            root.edges.add(out);
        }

        root.scopes = new ArrayList<>();
        for (Scope scope : asg.symbols().scopes()) {
            var out = new AsgModel.AsgScope();
            out.id = scope.id();
            out.kind = scope.kind().name().toLowerCase();
            out.parent = scope.parent() < 0 ? null : scope.parent();
            out.owner = NodeRefs.forNode(language, unit, scope.ownerNode());
            out.symbols = new ArrayList<>();
            for (int symbol : scope.symbols()) out.symbols.add(NodeRefs.forSymbol(language, unit, symbol));
            root.scopes.add(out);
        }

        root.symbols = new ArrayList<>();
        for (Symbol symbol : asg.symbols().symbols()) {
            var out = new AsgModel.AsgSymbol();
            out.id = NodeRefs.forSymbol(language, unit, symbol.id());
            out.name = symbol.name();
            out.kind = symbol.kind().name().toLowerCase();
            out.scope = symbol.scopeId();
            out.decl = NodeRefs.forNode(language, unit, symbol.declNode());
            out.uses = new ArrayList<>();
            for (int use : symbol.uses()) out.uses.add(NodeRefs.forNode(language, unit, use));
            root.symbols.add(out);
        }

        root.blocks = new ArrayList<>();
        List<ControlFlowGraph> graphs = new ArrayList<>(asg.flowGraphs().graphs());
        graphs.sort(Comparator.comparingInt(ControlFlowGraph::functionNode));
        for (ControlFlowGraph graph : graphs) {
            for (BasicBlock block : graph.blocks()) {
                var out = new AsgModel.AsgBlock();
                out.function = NodeRefs.forNode(language, unit, graph.functionNode());
                out.id = block.id();
                out.items = new ArrayList<>();
                for (int item : block.items()) out.items.add(NodeRefs.forNode(language, unit, item));
                out.successors = new ArrayList<>();
                for (CfgEdge edge : graph.successors(block.id())) out.successors.add(edge.to());
                out.synthetic = block.synthetic();
                out.unreachable = block.unreachable();
                root.blocks.add(out);
            }
        }

        root.parseErrors = new ArrayList<>();
        for (ParseError error : asg.parseErrors()) {
            var out = new AsgModel.AsgParseError();
            out.startByte = error.startByte();
            out.endByte = error.endByte();
            out.row = error.start().row();
            out.column = error.start().column();
            out.message = error.message();
            root.parseErrors.add(out);
        }
        return root;
    }

    public String toJson(Asg asg) {
        return GSON.toJson(toModel(asg));
    }

    /**
     * Writes the export of {@code asg} to {@code outputDir/<unit>.asg.json}, with characters of the
     * unit identity that are unsafe in file names replaced by '_'.
     *
     * @param outputDir directory to write into (created if absent)
     * @return the written file
     */
    public Path write(Asg asg, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }
        Path out = outputDir.resolve(fileName(asg.identity()));
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            GSON.toJson(toModel(asg), w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + out + ": " + e.getMessage(), e);
        }
        System.err.println("[asg-engine] ASG export written: " + out);
        return out;
    }

    static String fileName(String unit) {
        return unit.replaceAll("[^A-Za-z0-9._-]", "_") + ".asg.json";
    }
}
