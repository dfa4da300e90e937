package com.codeasg.engine.cfg;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.AstShapes;
import com.codeasg.engine.ast.CanonicalAst;
import com.codeasg.engine.ast.CanonicalKind;
import com.codeasg.engine.ast.Role;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds one {@link ControlFlowGraph} per function-like node and one for top-level code.
 * Synthetic entry and exit nodes get ids after the last AST node, in build order.
 */
public class CfgBuilder {

    private static final Set<String> SKIPPED_KINDS = Set.of(
        "comment", "line_comment", "block_comment", "empty_statement", "pass_statement");

    public FlowGraphs build(CanonicalAst ast) {
        FlowPolicy policy = FlowPolicy.forLanguage(ast.language());
        List<ControlFlowGraph> graphs = new ArrayList<>();
        List<AstNode> synthetic = new ArrayList<>();
        int nextId = ast.size();
        for (AstNode node : ast.nodes()) {
            if (node.id() != 0 && !node.kind().isFunctionLike()) continue;
            AstNode entry = syntheticNode(nextId++, CanonicalKind.CFG_ENTRY, node, node.startByte(), node);
            AstNode exit = syntheticNode(nextId++, CanonicalKind.CFG_EXIT, node, node.endByte(), node);
            synthetic.add(entry);
            synthetic.add(exit);
            graphs.add(new FunctionFlow(ast, policy, node, entry.id(), exit.id()).build());
        }
        return new FlowGraphs(graphs, synthetic);
    }

    private static AstNode syntheticNode(int id, CanonicalKind kind, AstNode owner, int offset, AstNode anchor) {
        var point = offset == anchor.startByte() ? anchor.start() : anchor.end();
        return new AstNode(id, kind, null, Role.NONE,
            owner.id(), List.of(), offset, offset, point, point, null, null);
    }

    private static final class Draft {
        final int id;
        final List<Integer> items = new ArrayList<>();
        final Set<CfgEdge> out = new LinkedHashSet<>();

        Draft(int id) {
            this.id = id;
        }
    }

    private static final class JumpFrame {
        final String label;
        final Draft breakTarget;
        final Draft continueTarget;
        final boolean labeledOnly;

        JumpFrame(String label, Draft breakTarget, Draft continueTarget, boolean labeledOnly) {
            this.label = label;
            this.breakTarget = breakTarget;
            this.continueTarget = continueTarget;
            this.labeledOnly = labeledOnly;
        }
    }

    private static final class TryFrame {
        final List<Draft> exceptionTargets;
        final Draft finallyBlock;
        boolean routesReturns;
        boolean routesExceptions;

        TryFrame(List<Draft> exceptionTargets, Draft finallyBlock) {
            this.exceptionTargets = exceptionTargets;
            this.finallyBlock = finallyBlock;
        }
    }

    private static final class FunctionFlow {
        private final CanonicalAst ast;
        private final FlowPolicy policy;
        private final AstNode function;
        private final int entryNode;
        private final int exitNode;
        private final List<Draft> blocks = new ArrayList<>();
        private final Set<Integer> headerOnly = new HashSet<>();
        private final Deque<JumpFrame> jumps = new ArrayDeque<>();
        private final Deque<TryFrame> tries = new ArrayDeque<>();
        private final Draft entry;
        private final Draft exit;
        private Draft current;
        private String pendingLabel;
        private boolean fallthroughRequested;

        FunctionFlow(CanonicalAst ast, FlowPolicy policy, AstNode function, int entryNode, int exitNode) {
            this.ast = ast;
            this.policy = policy;
            this.function = function;
            this.entryNode = entryNode;
            this.exitNode = exitNode;
            this.entry = newBlock();
            this.exit = newBlock();
            entry.items.add(entryNode);
            exit.items.add(exitNode);
        }

        ControlFlowGraph build() {
            current = newBlock();
            edge(entry, current, FlowLabel.SEQ);
            if (function.id() == 0) {
                visitAll(ast.children(function));
            } else {
                AstNode body = AstShapes.body(ast, function);
                if (body != null) visitStatement(body);
            }
            edge(current, exit, FlowLabel.SEQ);
            return finish();
        }

        // --- statements ---

        private void visitAll(List<AstNode> statements) {
            for (AstNode statement : statements) visitStatement(statement);
        }

        private void visitStatement(AstNode node) {
            if (SKIPPED_KINDS.contains(node.rawKind())) return;
            switch (node.kind()) {
                case BLOCK, ELSE_CLAUSE, FINALLY_CLAUSE -> visitAll(AstShapes.statements(ast, node));
                case IF_STMT -> visitIf(node, List.of());
                case WHILE_STMT -> visitWhile(node);
                case DO_WHILE_STMT -> visitDoWhile(node);
                case FOR_STMT -> visitFor(node);
                case FOR_EACH_STMT -> visitForEach(node, node, true);
                case SWITCH_STMT -> visitSwitch(node);
                case TRY_STMT -> visitTry(node);
                case LABELED_STMT -> visitLabeled(node);
                case WITH_STMT -> {
                    append(node, true);
                    AstNode body = AstShapes.body(ast, node);
                    if (body != null) visitStatement(body);
                }
                case RETURN_STMT -> {
                    append(node, false);
                    edge(current, returnTarget(), FlowLabel.RETURN);
                    current = newBlock();
                }
                case THROW_STMT -> {
                    append(node, false);
                    raise();
                    current = newBlock();
                }
                case BREAK_STMT -> {
                    append(node, false);
                    JumpFrame frame = findBreak(AstShapes.labelText(ast, node));
                    if (frame != null) {
                        edge(current, frame.breakTarget, FlowLabel.SEQ);
                        current = newBlock();
                    }
                }
                case CONTINUE_STMT -> {
                    append(node, false);
                    JumpFrame frame = findContinue(AstShapes.labelText(ast, node));
                    if (frame != null) {
                        edge(current, frame.continueTarget, FlowLabel.LOOP_BACK);
                        current = newBlock();
                    }
                }
                case FALLTHROUGH_STMT -> {
                    append(node, false);
                    fallthroughRequested = true;
                }
                case EXPR_STMT -> visitExpressionStatement(node);
                default -> {
                    if (node.kind().isJump() || node.kind().isCompound()) {
                        visitAll(ast.children(node));
                    } else {
                        append(node, false);
                    }
                }
            }
        }

        // Rust wraps control expressions in expression statements.
        private void visitExpressionStatement(AstNode node) {
            List<AstNode> children = ast.children(node);
            if (children.size() == 1) {
                AstNode inner = children.get(0);
                if (inner.kind().isCompound() || inner.kind().isJump()) {
                    visitStatement(inner);
                    return;
                }
            }
            append(node, false);
            if (isAbortingCall(node)) {
                raise();
                current = newBlock();
            }
        }

        private boolean isAbortingCall(AstNode statement) {
            if (policy.abortingCalls().isEmpty()) return false;
            AstNode call = ast.child(statement, CanonicalKind.CALL_EXPR);
            if (call == null) return false;
            AstNode callee = ast.child(call, Role.CALLEE);
            return callee != null && policy.abortingCalls().contains(ast.text(callee).trim());
        }

        private void visitIf(AstNode node, List<AstNode> inheritedAlternatives) {
            append(node, true);
            Draft header = current;
            Draft after = newBlock();

            Draft thenBlock = newBlock();
            edge(header, thenBlock, FlowLabel.TRUE);
            current = thenBlock;
            AstNode then = ast.child(node, Role.THEN);
            if (then == null) then = AstShapes.body(ast, node);
            if (then != null) visitStatement(then);
            edge(current, after, FlowLabel.SEQ);

            List<AstNode> alternatives = new ArrayList<>(ast.children(node, Role.ELSE));
            alternatives.addAll(inheritedAlternatives);
            if (alternatives.isEmpty()) {
                edge(header, after, FlowLabel.FALSE);
            } else {
                Draft elseBlock = newBlock();
                edge(header, elseBlock, FlowLabel.FALSE);
                current = elseBlock;
                AstNode alternative = alternatives.get(0);
                List<AstNode> rest = alternatives.subList(1, alternatives.size());
                if (alternative.kind() == CanonicalKind.IF_STMT) {
                    visitIf(alternative, rest);
                } else {
                    visitStatement(alternative);
                }
                edge(current, after, FlowLabel.SEQ);
            }
            current = after;
        }

        private void visitWhile(AstNode node) {
            String label = takeLabel(node);
            Draft header = newBlock();
            edge(current, header, FlowLabel.SEQ);
            current = header;
            append(node, true);
            AstNode condition = ast.child(node, Role.CONDITION);
            Draft body = newBlock();
            Draft after = newBlock();
            Draft exitPath = loopElse(node, after);
            if (condition != null) {
                edge(header, body, FlowLabel.TRUE);
                edge(header, exitPath, FlowLabel.FALSE);
            } else {
                edge(header, body, FlowLabel.SEQ);
            }
            jumps.push(new JumpFrame(label, after, header, false));
            current = body;
            AstNode bodyNode = AstShapes.body(ast, node);
            if (bodyNode != null) visitStatement(bodyNode);
            edge(current, header, FlowLabel.LOOP_BACK);
            jumps.pop();
            finishLoopElse(node, exitPath, after);
            current = after;
        }

        private void visitDoWhile(AstNode node) {
            String label = takeLabel(node);
            Draft body = newBlock();
            edge(current, body, FlowLabel.SEQ);
            Draft test = newBlock();
            Draft after = newBlock();
            jumps.push(new JumpFrame(label, after, test, false));
            current = body;
            AstNode bodyNode = AstShapes.body(ast, node);
            if (bodyNode != null) visitStatement(bodyNode);
            edge(current, test, FlowLabel.SEQ);
            jumps.pop();
            current = test;
            AstNode condition = ast.child(node, Role.CONDITION);
            if (condition != null) append(condition, false);
            edge(test, body, FlowLabel.LOOP_BACK);
            edge(test, after, FlowLabel.FALSE);
            current = after;
        }

        private void visitFor(AstNode node) {
            AstNode parts = node;
            AstNode clause = ast.child(node, CanonicalKind.LOOP_CLAUSE);
            if (clause != null) {
                if (ast.child(clause, Role.TARGET) != null || ast.child(clause, Role.VALUE) != null) {
                    visitForEach(node, clause, false);
                    return;
                }
                parts = clause;
            }
            String label = takeLabel(node);
            for (AstNode init : ast.children(parts, Role.INIT)) {
                if (!isEmptyStatement(init)) append(init, false);
            }
            AstNode condition = ast.child(parts, Role.CONDITION);
            if (condition == null && clause == null) condition = bareCondition(node);
            if (condition != null && isEmptyStatement(condition)) condition = null;
            List<AstNode> updates = ast.children(parts, Role.UPDATE);

            Draft header = newBlock();
            edge(current, header, FlowLabel.SEQ);
            current = header;
            if (condition != null) append(condition, false);
            else append(node, true);
            Draft body = newBlock();
            Draft after = newBlock();
            Draft update = updates.isEmpty() ? header : newBlock();
            edge(header, body, condition != null ? FlowLabel.TRUE : FlowLabel.SEQ);
            if (condition != null) edge(header, after, FlowLabel.FALSE);

            jumps.push(new JumpFrame(label, after, update, false));
            current = body;
            AstNode bodyNode = AstShapes.body(ast, node);
            if (bodyNode != null) visitStatement(bodyNode);
            if (update != header) {
                edge(current, update, FlowLabel.SEQ);
                current = update;
                for (AstNode step : updates) append(step, false);
            }
            edge(current, header, FlowLabel.LOOP_BACK);
            jumps.pop();
            current = after;
        }

        // Go: "for cond { }" carries its condition as an unlabeled child.
        private AstNode bareCondition(AstNode node) {
            for (AstNode child : ast.children(node)) {
                if (child.role() == Role.NONE && child.kind() != CanonicalKind.BLOCK
                    && !AstShapes.isLabelKind(child.rawKind()) && !SKIPPED_KINDS.contains(child.rawKind())) {
                    return child;
                }
            }
            return null;
        }

        private boolean isEmptyStatement(AstNode node) {
            return node.rawKind().equals("empty_statement") || ast.text(node).trim().equals(";");
        }

        private void visitForEach(AstNode loop, AstNode headerNode, boolean headerOnlyItem) {
            String label = takeLabel(loop);
            Draft header = newBlock();
            edge(current, header, FlowLabel.SEQ);
            current = header;
            append(headerNode, headerOnlyItem);
            Draft body = newBlock();
            Draft after = newBlock();
            Draft exitPath = loopElse(loop, after);
            edge(header, body, FlowLabel.TRUE);
            edge(header, exitPath, FlowLabel.FALSE);
            jumps.push(new JumpFrame(label, after, header, false));
            current = body;
            AstNode bodyNode = AstShapes.body(ast, loop);
            if (bodyNode != null) visitStatement(bodyNode);
            edge(current, header, FlowLabel.LOOP_BACK);
            jumps.pop();
            finishLoopElse(loop, exitPath, after);
            current = after;
        }

        /** Python loops run their else clause when the loop ends without break. */
        private Draft loopElse(AstNode loop, Draft after) {
            return ast.child(loop, Role.ELSE) != null ? newBlock() : after;
        }

        private void finishLoopElse(AstNode loop, Draft exitPath, Draft after) {
            if (exitPath == after) return;
            current = exitPath;
            visitStatement(ast.child(loop, Role.ELSE));
            edge(current, after, FlowLabel.SEQ);
        }

        private void visitSwitch(AstNode node) {
            String label = takeLabel(node);
            append(node, true);
            Draft header = current;
            Draft after = newBlock();
            jumps.push(new JumpFrame(label, after, null, false));
            boolean hasDefault = false;
            Draft openEnd = null;
            for (AstNode clause : caseClauses(node)) {
                Draft caseBlock = newBlock();
                edge(header, caseBlock, FlowLabel.CASE);
                if (openEnd != null) edge(openEnd, caseBlock, FlowLabel.SEQ);
                current = caseBlock;
                append(clause, true);
                if (isDefaultCase(clause)) hasDefault = true;
                fallthroughRequested = false;
                visitAll(AstShapes.statements(ast, clause));
                boolean fallsThrough = fallthroughRequested
                    || (policy.switchFallthrough() && !clause.rawKind().equals("switch_rule"));
                if (fallsThrough) {
                    openEnd = current;
                } else {
                    edge(current, after, FlowLabel.SEQ);
                    openEnd = null;
                }
            }
            fallthroughRequested = false;
            if (openEnd != null) edge(openEnd, after, FlowLabel.SEQ);
            if (!hasDefault) edge(header, after, FlowLabel.FALSE);
            jumps.pop();
            current = after;
        }

        private List<AstNode> caseClauses(AstNode node) {
            List<AstNode> clauses = ast.children(node, CanonicalKind.CASE_CLAUSE);
            if (!clauses.isEmpty()) return clauses;
            AstNode body = AstShapes.body(ast, node);
            return body != null ? ast.children(body, CanonicalKind.CASE_CLAUSE) : clauses;
        }

        private boolean isDefaultCase(AstNode clause) {
            if (clause.rawKind().contains("default")) return true;
            String text = ast.text(clause).trim();
            if (text.startsWith("default")) return true;
            AstNode pattern = ast.child(clause, Role.TARGET);
            if (pattern != null && ast.text(pattern).trim().equals("_")) return true;
            for (AstNode child : ast.children(clause)) {
                if (child.rawKind().equals("case_pattern") && ast.text(child).trim().equals("_")) return true;
                if (child.rawKind().equals("switch_label") && ast.text(child).trim().startsWith("default")) return true;
            }
            return false;
        }

        private void visitTry(AstNode node) {
            List<AstNode> catches = new ArrayList<>(ast.children(node, CanonicalKind.CATCH_CLAUSE));
            for (AstNode handler : ast.children(node, Role.HANDLER)) {
                if (!catches.contains(handler)) catches.add(handler);
            }
            AstNode finallyNode = ast.child(node, CanonicalKind.FINALLY_CLAUSE);
            if (finallyNode == null) finallyNode = ast.child(node, Role.FINALIZER);
            AstNode elseNode = ast.child(node, CanonicalKind.ELSE_CLAUSE);

            if (!ItemWalker.headerChildren(ast, node).isEmpty()) append(node, true);
            Draft after = newBlock();
            Draft finallyBlock = finallyNode != null ? newBlock() : null;
            List<Draft> handlers = new ArrayList<>();
            for (int i = 0; i < catches.size(); i++) handlers.add(newBlock());

            Draft body = newBlock();
            edge(current, body, FlowLabel.SEQ);
            TryFrame bodyFrame = new TryFrame(
                !handlers.isEmpty() ? handlers : finallyBlock != null ? List.of(finallyBlock) : List.of(),
                finallyBlock);
            tries.push(bodyFrame);
            current = body;
            AstNode bodyNode = AstShapes.body(ast, node);
            if (bodyNode != null) visitStatement(bodyNode);
            // any statement of the body may raise
            for (Draft handler : handlers) {
                edge(body, handler, FlowLabel.EXCEPTION);
                edge(current, handler, FlowLabel.EXCEPTION);
            }
            tries.pop();
            if (elseNode != null) visitStatement(elseNode);
            Draft join = finallyBlock != null ? finallyBlock : after;
            edge(current, join, FlowLabel.SEQ);

            TryFrame handlerFrame = new TryFrame(finallyBlock != null ? List.of(finallyBlock) : List.of(), finallyBlock);
            tries.push(handlerFrame);
            for (int i = 0; i < catches.size(); i++) {
                current = handlers.get(i);
                AstNode clause = catches.get(i);
                append(clause, true);
                AstNode clauseBody = AstShapes.body(ast, clause);
                if (clauseBody != null) visitStatement(clauseBody);
                else visitAll(AstShapes.statements(ast, clause).stream()
                    .filter(child -> child.kind().isCompound() || child.kind() == CanonicalKind.BLOCK)
                    .toList());
                edge(current, join, FlowLabel.SEQ);
            }
            tries.pop();

            if (finallyBlock != null) {
                current = finallyBlock;
                visitStatement(finallyNode);
                edge(current, after, FlowLabel.SEQ);
                if (bodyFrame.routesReturns || handlerFrame.routesReturns) {
                    edge(current, returnTarget(), FlowLabel.RETURN);
                }
                if (bodyFrame.routesExceptions || handlerFrame.routesExceptions) {
                    for (Draft target : exceptionTargets()) edge(current, target, FlowLabel.EXCEPTION);
                }
            }
            current = after;
        }

        private void visitLabeled(AstNode node) {
            String label = AstShapes.labelText(ast, node);
            List<AstNode> inner = AstShapes.statements(ast, node);
            if (inner.size() == 1 && isLoopOrSwitch(inner.get(0))) {
                pendingLabel = label;
                visitStatement(inner.get(0));
                return;
            }
            Draft after = newBlock();
            jumps.push(new JumpFrame(label, after, null, true));
            visitAll(inner);
            jumps.pop();
            edge(current, after, FlowLabel.SEQ);
            current = after;
        }

        private boolean isLoopOrSwitch(AstNode node) {
            return switch (node.kind()) {
                case WHILE_STMT, DO_WHILE_STMT, FOR_STMT, FOR_EACH_STMT, SWITCH_STMT -> true;
                default -> false;
            };
        }

        private String takeLabel(AstNode loop) {
            String label = pendingLabel;
            pendingLabel = null;
            return label != null ? label : AstShapes.labelText(ast, loop);
        }

        // --- jumps ---

        private JumpFrame findBreak(String label) {
            for (JumpFrame frame : jumps) {
                if (label == null ? !frame.labeledOnly : label.equals(frame.label)) return frame;
            }
            return null;
        }

        private JumpFrame findContinue(String label) {
            for (JumpFrame frame : jumps) {
                if (frame.continueTarget == null) continue;
                if (label == null || label.equals(frame.label)) return frame;
            }
            return null;
        }

        private Draft returnTarget() {
            for (TryFrame frame : tries) {
                if (frame.finallyBlock != null) {
                    frame.routesReturns = true;
                    return frame.finallyBlock;
                }
            }
            return exit;
        }

        private List<Draft> exceptionTargets() {
            for (TryFrame frame : tries) {
                if (!frame.exceptionTargets.isEmpty()) {
                    frame.routesExceptions = true;
                    return frame.exceptionTargets;
                }
            }
            return List.of(exit);
        }

        private void raise() {
            for (Draft target : exceptionTargets()) edge(current, target, FlowLabel.EXCEPTION);
        }

        // --- items and blocks ---

        private void append(AstNode node, boolean headerOnlyItem) {
            current.items.add(node.id());
            if (headerOnlyItem) headerOnly.add(node.id());
            if (mayRaise(node, headerOnlyItem)) raise();
        }

        private boolean mayRaise(AstNode item, boolean headerOnlyItem) {
            if (!policy.callsMayThrow() && policy.raisingKinds().isEmpty()) return false;
            boolean[] found = {false};
            ItemWalker.walk(ast, item, headerOnlyItem, node -> {
                if (policy.callsMayThrow() && node.kind() == CanonicalKind.CALL_EXPR) found[0] = true;
                if (policy.raisingKinds().contains(node.rawKind())) found[0] = true;
            });
            return found[0];
        }

        private Draft newBlock() {
            Draft block = new Draft(blocks.size());
            blocks.add(block);
            return block;
        }

        private void edge(Draft from, Draft to, FlowLabel label) {
            if (from == exit) return;
            from.out.add(new CfgEdge(from.id, to.id, label));
        }

        // --- cleanup ---

        private ControlFlowGraph finish() {
            Set<Integer> removed = new HashSet<>();
            boolean changed = true;
            while (changed) {
                changed = false;
                for (Draft block : blocks) {
                    if (block == entry || block == exit || removed.contains(block.id) || !block.items.isEmpty()) continue;
                    List<CfgEdge> incoming = incoming(block, removed);
                    if (incoming.isEmpty()) {
                        removed.add(block.id);
                        changed = true;
                        continue;
                    }
                    Set<Integer> targets = new HashSet<>();
                    for (CfgEdge edge : block.out) targets.add(edge.to());
                    if (targets.size() != 1 || targets.contains(block.id)) continue;
                    CfgEdge outgoing = block.out.iterator().next();
                    for (CfgEdge edge : incoming) {
                        Draft source = blocks.get(edge.from());
                        source.out.remove(edge);
                        FlowLabel label = outgoing.label().dominatesFold() ? outgoing.label() : edge.label();
                        source.out.add(new CfgEdge(source.id, outgoing.to(), label));
                    }
                    block.out.clear();
                    removed.add(block.id);
                    changed = true;
                }
            }

            int[] renumber = new int[blocks.size()];
            List<Draft> kept = new ArrayList<>();
            for (Draft block : blocks) {
                if (removed.contains(block.id)) {
                    renumber[block.id] = -1;
                } else {
                    renumber[block.id] = kept.size();
                    kept.add(block);
                }
            }
            List<CfgEdge> edges = new ArrayList<>();
            for (Draft block : kept) {
                for (CfgEdge edge : block.out) {
                    if (renumber[edge.to()] < 0) continue;
                    edges.add(new CfgEdge(renumber[edge.from()], renumber[edge.to()], edge.label()));
                }
            }
            boolean[] reachable = new boolean[kept.size()];
            Deque<Integer> work = new ArrayDeque<>();
            reachable[0] = true;
            work.add(0);
            while (!work.isEmpty()) {
                int block = work.poll();
                for (CfgEdge edge : edges) {
                    if (edge.from() == block && !reachable[edge.to()]) {
                        reachable[edge.to()] = true;
                        work.add(edge.to());
                    }
                }
            }
            List<BasicBlock> result = new ArrayList<>();
            for (int i = 0; i < kept.size(); i++) {
                Draft block = kept.get(i);
                result.add(new BasicBlock(i, block.items, block == entry || block == exit, !reachable[i]));
            }
            return new ControlFlowGraph(function.id(), entryNode, exitNode, result, edges, headerOnly);
        }

        private List<CfgEdge> incoming(Draft target, Set<Integer> removed) {
            List<CfgEdge> result = new ArrayList<>();
            for (Draft block : blocks) {
                if (removed.contains(block.id)) continue;
                for (CfgEdge edge : block.out) {
                    if (edge.to() == target.id && edge.from() != target.id) result.add(edge);
                }
            }
            return result;
        }
    }
}
