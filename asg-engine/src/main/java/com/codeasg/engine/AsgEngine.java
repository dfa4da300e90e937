package com.codeasg.engine;

import com.codeasg.engine.analysis.AstDiff;
import com.codeasg.engine.analysis.AstDiffer;
import com.codeasg.engine.analysis.CodeStructure;
import com.codeasg.engine.analysis.NodeLocator;
import com.codeasg.engine.analysis.StructureAnalyzer;
import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.AstNormalizer;
import com.codeasg.engine.ast.CanonicalAst;
import com.codeasg.engine.cache.GraphCache;
import com.codeasg.engine.cfg.CfgBuilder;
import com.codeasg.engine.cfg.FlowGraphs;
import com.codeasg.engine.config.EngineConfig;
import com.codeasg.engine.config.EngineConfigReader;
import com.codeasg.engine.dfg.DataFlow;
import com.codeasg.engine.dfg.DataFlowAnalyzer;
import com.codeasg.engine.grammar.GrammarRegistry;
import com.codeasg.engine.grammar.Language;
import com.codeasg.engine.grammar.LanguageDetector;
import com.codeasg.engine.grammar.RawTree;
import com.codeasg.engine.grammar.SourceText;
import com.codeasg.engine.graph.Asg;
import com.codeasg.engine.graph.AsgAssembler;
import com.codeasg.engine.ir.AsgSerializer;
import com.codeasg.engine.query.QueryEngine;
import com.codeasg.engine.query.QueryOptions;
import com.codeasg.engine.query.QueryResult;
import com.codeasg.engine.query.QuerySpec;
import com.codeasg.engine.scope.ScopeBuilder;
import com.codeasg.engine.scope.SymbolTable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the engine: parses units, builds and caches their graphs, and answers queries.
 * Thread-safe; one instance is meant to be shared by the whole process.
 */
public class AsgEngine implements AutoCloseable {

    private final EngineConfig config;
    private final GrammarRegistry grammars;
    private final GraphCache cache;
    private final ExecutorService workers;
    private final QueryOptions queryOptions;

    private final AstNormalizer normalizer = new AstNormalizer();
    private final ScopeBuilder scopeBuilder = new ScopeBuilder();
    private final CfgBuilder cfgBuilder = new CfgBuilder();
    private final DataFlowAnalyzer dataFlowAnalyzer = new DataFlowAnalyzer();
    private final AsgAssembler assembler = new AsgAssembler();
    private final QueryEngine queryEngine = new QueryEngine();
    private final StructureAnalyzer structureAnalyzer = new StructureAnalyzer();
    private final AstDiffer differ = new AstDiffer();
    private final NodeLocator locator = new NodeLocator();
    private final AsgSerializer serializer = new AsgSerializer();

    /** Engine configured from the {@code asg-engine.json} classpath resource. */
    public AsgEngine() {
        this(new EngineConfigReader().readDefault());
    }

    public AsgEngine(EngineConfig config) {
        this(config, GrammarRegistry.treeSitter(config.enabledLanguages()));
    }

    public AsgEngine(EngineConfig config, GrammarRegistry grammars) {
        this.config = config;
        this.grammars = grammars;
        this.cache = new GraphCache(config.getCacheMaxEntries(), this::runPipeline);
        this.workers = Executors.newFixedThreadPool(config.getWorkerThreads(), new WorkerThreads());
        this.queryOptions = new QueryOptions(config.getQueryMaxResults(),
            Duration.ofMillis(config.getQueryTimeoutMillis()));
    }

    /**
     * Parses and normalizes a source text without building or caching a graph.
     *
     * @throws Language.UnsupportedLanguageException if {@code language} is not supported
     */
    public ParseResult parse(String source, String language) {
        CanonicalAst ast = normalize(source, Language.fromId(language));
        return new ParseResult(ast.language(), ast, ast.errors());
    }

    /**
     * Returns the graph of a unit, building it unless the cache holds one for the same content.
     *
     * @throws Language.UnsupportedLanguageException if {@code language} is not supported
     * @throws AsgAssembler.InconsistentGraphException if the build produced a malformed graph
     */
    public AsgHandle buildAsg(String source, String language, String unitIdentity) {
        Language resolved = checked(language);
        return new AsgHandle(cache.getOrBuild(unitIdentity, source, resolved));
    }

    /** Like {@link #buildAsg}, with the build itself running on the engine's worker pool. */
    public CompletableFuture<AsgHandle> buildAsgAsync(String source, String language, String unitIdentity) {
        Language resolved = checked(language);
        return cache.getOrBuildAsync(unitIdentity, source, resolved, workers).thenApply(AsgHandle::new);
    }

    public QueryResult query(AsgHandle handle, QuerySpec spec) {
        return queryEngine.query(handle.asg(), spec, queryOptions);
    }

    public QueryResult query(AsgHandle handle, QuerySpec spec, QueryOptions options) {
        return queryEngine.query(handle.asg(), spec, options);
    }

    public List<String> supportedLanguages() {
        List<String> ids = new ArrayList<>();
        for (Language language : grammars.languages()) ids.add(language.id());
        return ids;
    }

    public Language detectLanguage(String source, String fileName) {
        return LanguageDetector.detect(source, fileName);
    }

    public CodeStructure analyze(AsgHandle handle) {
        return structureAnalyzer.analyze(handle.asg());
    }

    public AstDiff diff(ParseResult before, ParseResult after) {
        return differ.diff(before.ast(), after.ast());
    }

    public Optional<AstNode> nodeAt(AsgHandle handle, int row, int column) {
        return locator.nodeAt(handle.asg().ast(), row, column);
    }

    public String export(AsgHandle handle) {
        return serializer.toJson(handle.asg());
    }

    public Path export(AsgHandle handle, Path outputDir) {
        return serializer.write(handle.asg(), outputDir);
    }

    public void invalidate(String unitIdentity) {
        cache.invalidate(unitIdentity);
    }

    public EngineConfig config() {
        return config;
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    private Language checked(String language) {
        Language resolved = Language.fromId(language);
        if (!grammars.supports(resolved)) {
            throw new Language.UnsupportedLanguageException(language);
        }
        return resolved;
    }

    private CanonicalAst normalize(String source, Language language) {
        RawTree tree = grammars.parse(SourceText.of(source), language);
        return normalizer.normalize(tree);
    }

    private Asg runPipeline(String identity, String contentHash, String source, Language language) {
        // 1. Parse and normalize
        CanonicalAst ast = normalize(source, language);
        if (ast.hasErrors()) {
            System.err.println("[asg-engine] " + identity + ": " + ast.errors().size()
                + " syntax error(s), graph is degraded");
        }

        // 2. Resolve scopes and bindings
        SymbolTable symbols = scopeBuilder.build(ast);

        // 3. Control flow per function
        FlowGraphs flowGraphs = cfgBuilder.build(ast);

        // 4. Reaching definitions
        DataFlow dataFlow = dataFlowAnalyzer.analyze(ast, symbols, flowGraphs);

        // 5. Assemble under one id space
        return assembler.assemble(identity, contentHash, ast, symbols, flowGraphs, dataFlow);
    }

    private static final class WorkerThreads implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "asg-engine-worker-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
