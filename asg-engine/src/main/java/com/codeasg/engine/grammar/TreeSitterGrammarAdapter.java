package com.codeasg.engine.grammar;

import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSPoint;
import org.treesitter.TSTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link GrammarAdapter} backed by a tree-sitter grammar. Parsers are not thread-safe,
 * so each thread gets its own instance.
 */
public class TreeSitterGrammarAdapter implements GrammarAdapter {

    private final Language language;
    private final ThreadLocal<TSParser> parserCache;

    public TreeSitterGrammarAdapter(Language language, Supplier<TSLanguage> grammar) {
        this.language = language;
        this.parserCache = ThreadLocal.withInitial(() -> {
            var parser = new TSParser();
            parser.setLanguage(grammar.get());
            return parser;
        });
    }

    @Override
    public Language language() { return language; }

    @Override
    public RawTree parse(SourceText source) {
        TSParser parser;
        try {
            parser = parserCache.get();
        } catch (RuntimeException | LinkageError e) {
            throw new GrammarUnavailableException(language, e);
        }
        TSTree tree = parser.parseString(null, source.text());
        if (tree == null) {
            throw new GrammarUnavailableException(language, null);
        }
        return new RawTree(language, source, convert(tree.getRootNode()));
    }

    /** Copies the native tree into {@link RawNode}s without recursion; real files nest deeply. */
    static RawNode convert(TSNode root) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, null));
        while (true) {
            Frame top = stack.peek();
            if (top.nextChild < top.node.getChildCount()) {
                int index = top.nextChild++;
                TSNode child = top.node.getChild(index);
                stack.push(new Frame(child, top.node.getFieldNameForChild(index)));
                continue;
            }
            RawNode built = stack.pop().build();
            if (stack.isEmpty()) return built;
            stack.peek().children.add(built);
        }
    }

    private static final class Frame {
        final TSNode node;
        final String field;
        final List<RawNode> children = new ArrayList<>();
        int nextChild;

        Frame(TSNode node, String field) {
            this.node = node;
            this.field = field;
        }

        RawNode build() {
            String type = node.getType();
            return new RawNode(
                type,
                node.isNamed(),
                "ERROR".equals(type),
                node.isMissing(),
                field,
                node.getStartByte(),
                node.getEndByte(),
                point(node.getStartPoint()),
                point(node.getEndPoint()),
                children
            );
        }

        private static TextPoint point(TSPoint p) {
            return new TextPoint(p.getRow(), p.getColumn());
        }
    }

    /**
     * The native grammar could not be loaded or refused to parse. Terminal for this language.
     */
    public static class GrammarUnavailableException extends RuntimeException {
        public GrammarUnavailableException(Language language, Throwable cause) {
            super("Grammar for " + language.id() + " is unavailable", cause);
        }
    }
}
