package com.codeasg.engine.ast;

import com.codeasg.engine.grammar.RawNode;
import com.codeasg.engine.grammar.RawTree;
import com.codeasg.engine.grammar.SourceText;
import com.codeasg.engine.grammar.TextPoint;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Maps a raw grammar tree onto the canonical AST: named nodes only, canonical tags and roles,
 * dense pre-order ids. Error and missing regions become {@link CanonicalKind#ERROR} nodes and
 * are also reported as {@link ParseError}s.
 */
public class AstNormalizer {

    private static final Set<String> OPERATOR_TOKENS = Set.of(
        "=", ":=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", ">>>=", "**=", "//=",
        "@=", "&&=", "||=", "??=", "&^=", "++", "--");

    private static final Set<String> DECLARATION_KEYWORDS = Set.of("let", "const", "var");

    public CanonicalAst normalize(RawTree tree) {
        KindTable table = KindTable.forLanguage(tree.language());
        SourceText source = tree.source();
        List<Draft> drafts = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();

        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(tree.root(), -1, null, Role.NONE));
        while (!stack.isEmpty()) {
            Pending pending = stack.pop();
            RawNode raw = pending.raw;
            int id = drafts.size();
            Draft draft = new Draft(id, pending.parentId, raw, pending.role);
            draft.kind = (raw.error() || raw.missing()) ? CanonicalKind.ERROR : table.kindOf(raw.kind());
            if (pending.parentId < 0) {
                // the unit spans the whole text, leading and trailing trivia included
                draft.startByte = 0;
                draft.endByte = source.byteLength();
                draft.start = TextPoint.ORIGIN;
                draft.end = source.endPoint();
            }
            if (raw.missing() && pending.parentRaw != null) {
                // zero-width token; the incomplete construct is the parent
                draft.startByte = pending.parentRaw.startByte();
                draft.endByte = pending.parentRaw.endByte();
                draft.start = pending.parentRaw.start();
                draft.end = pending.parentRaw.end();
                errors.add(new ParseError(draft.startByte, draft.endByte, draft.start, "missing '" + raw.kind() + "'"));
            } else if (raw.error()) {
                errors.add(new ParseError(raw.startByte(), raw.endByte(), raw.start(), "unexpected syntax"));
            }
            drafts.add(draft);
            if (pending.parentId >= 0) drafts.get(pending.parentId).children.add(id);

            List<Pending> kept = new ArrayList<>();
            boolean aliasNext = false;
            for (RawNode child : raw.children()) {
                if (!keep(child)) {
                    String token = source.slice(child.startByte(), child.endByte());
                    if ("operator".equals(child.field())) {
                        draft.operator = token;
                    } else if ("kind".equals(child.field()) || DECLARATION_KEYWORDS.contains(token)) {
                        if (draft.keyword == null) draft.keyword = token;
                    } else if (draft.operator == null && OPERATOR_TOKENS.contains(token)) {
                        draft.operator = token;
                    }
                    aliasNext = "as".equals(token);
                    continue;
                }
                Role role = table.roleOf(raw.kind(), child.field());
                if (role == Role.NONE && aliasNext) role = Role.ALIAS;
                aliasNext = false;
                kept.add(new Pending(child, id, raw, role));
            }
            for (int i = kept.size() - 1; i >= 0; i--) stack.push(kept.get(i));
        }

        List<AstNode> nodes = new ArrayList<>(drafts.size());
        for (Draft draft : drafts) nodes.add(draft.build());
        return new CanonicalAst(tree.language(), source, nodes, errors);
    }

    private static boolean keep(RawNode node) {
        return node.named() || node.error() || node.missing();
    }

    private record Pending(RawNode raw, int parentId, RawNode parentRaw, Role role) {}

    private static final class Draft {
        final int id;
        final int parent;
        final String rawKind;
        final Role role;
        final List<Integer> children = new ArrayList<>();
        CanonicalKind kind;
        int startByte;
        int endByte;
        TextPoint start;
        TextPoint end;
        String operator;
        String keyword;

        Draft(int id, int parent, RawNode raw, Role role) {
            this.id = id;
            this.parent = parent;
            this.rawKind = raw.kind();
            this.role = role;
            this.startByte = raw.startByte();
            this.endByte = raw.endByte();
            this.start = raw.start();
            this.end = raw.end();
        }

        AstNode build() {
            return new AstNode(id, kind, rawKind, role, parent, children, startByte, endByte, start, end,
                operator, keyword);
        }
    }
}
