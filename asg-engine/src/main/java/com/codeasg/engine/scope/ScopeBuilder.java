package com.codeasg.engine.scope;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.AstShapes;
import com.codeasg.engine.ast.CanonicalAst;
import com.codeasg.engine.ast.CanonicalKind;
import com.codeasg.engine.ast.KindTable;
import com.codeasg.engine.ast.Role;
import com.codeasg.engine.grammar.Language;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the scope tree and symbol table for a canonical AST.
 *
 * <p>Two passes: the first walks the tree opening scopes, declaring names and classifying
 * every identifier occurrence; the second resolves the remaining occurrences outward
 * through the scope chain under the language's {@link ScopePolicy}.
 */
public class ScopeBuilder {

    public SymbolTable build(CanonicalAst ast) {
        return new Resolution(ast).run();
    }

    private static final class ScopeDraft {
        final int id;
        final ScopeKind kind;
        final int parent;
        final int owner;
        final List<Integer> symbols = new ArrayList<>();
        final Map<String, List<Integer>> names = new HashMap<>();
        final Set<String> globals = new HashSet<>();
        final Set<String> nonlocals = new HashSet<>();

        ScopeDraft(int id, ScopeKind kind, int parent, int owner) {
            this.id = id;
            this.kind = kind;
            this.parent = parent;
            this.owner = owner;
        }
    }

    private record SymbolDraft(int id, String name, SymbolKind kind, int scope, int declNode, int visibleFrom) {}

    private static final class Resolution {
        private final CanonicalAst ast;
        private final ScopePolicy policy;
        private final KindTable table;
        private final List<ScopeDraft> scopes = new ArrayList<>();
        private final List<SymbolDraft> symbols = new ArrayList<>();
        private final int[] scopeOf;
        private final Map<Integer, AccessMode> access = new HashMap<>();
        private final Map<Integer, Integer> bindings = new HashMap<>();
        private final List<Integer> pending = new ArrayList<>();
        private final Map<Integer, Integer> memberRefs = new LinkedHashMap<>();
        private final Set<Integer> reusedBlocks = new HashSet<>();
        private final Set<Integer> opaqueNodes = new HashSet<>();

        Resolution(CanonicalAst ast) {
            this.ast = ast;
            this.policy = ScopePolicy.forLanguage(ast.language());
            this.table = KindTable.forLanguage(ast.language());
            this.scopeOf = new int[ast.size()];
        }

        SymbolTable run() {
            int module = newScope(ScopeKind.MODULE, -1, ast.root());
            visit(ast.root(), module, false);
            List<Integer> unresolved = resolvePending();
            resolveMemberRefs();
            return assemble(unresolved);
        }

        // --- pass 1 ---

        private void visit(AstNode node, int scope, boolean opaque) {
            scopeOf[node.id()] = scope;
            if (opaque || opaqueNodes.contains(node.id()) || table.isOpaque(node.rawKind())) {
                markScope(node, scope);
                return;
            }
            int inner = scope;
            switch (node.kind()) {
                case FUNCTION_DECL, LAMBDA -> {
                    visitFunction(node, scope);
                    return;
                }
                case CLASS_DECL -> {
                    visitClass(node, scope);
                    return;
                }
                case IMPORT -> {
                    for (ImportNames.ImportedName imported : ImportNames.of(ast, node)) {
                        declare(imported.name(), imported.node(), scope, SymbolKind.IMPORT,
                            AccessMode.DECLARE_INIT, node.startByte());
                    }
                    markScope(node, scope);
                    return;
                }
                case SCOPE_DIRECTIVE -> {
                    recordDirective(node, scope);
                    markScope(node, scope);
                    return;
                }
                case COMPREHENSION -> inner = newScope(ScopeKind.FUNCTION, scope, node);
                case VARIABLE_DECL -> declareVariables(node, scope);
                case ASSIGNMENT -> claimAssignment(node, scope);
                case UPDATE_EXPR -> claimUpdate(node);
                case BLOCK -> {
                    if (policy.blockScoped() && node.id() != 0 && !reusedBlocks.contains(node.id())) {
                        inner = newScope(ScopeKind.BLOCK, scope, node);
                    }
                }
                case FOR_STMT -> {
                    if (policy.blockScoped()) inner = newScope(ScopeKind.BLOCK, scope, node);
                }
                case IF_STMT, SWITCH_STMT -> {
                    if (policy.blockScoped() && ast.child(node, Role.INIT) != null) {
                        inner = newScope(ScopeKind.BLOCK, scope, node);
                    }
                }
                case FOR_EACH_STMT -> {
                    if (policy.blockScoped()) inner = newScope(ScopeKind.BLOCK, scope, node);
                    declareLoopTarget(node, inner);
                }
                case LOOP_CLAUSE -> declareLoopTarget(node, scope);
                case CATCH_CLAUSE -> {
                    if (policy.blockScoped()) inner = newScope(ScopeKind.BLOCK, scope, node);
                    declareCatchParameters(node, inner);
                }
                case CASE_CLAUSE -> {
                    if (ast.language() == Language.RUST) {
                        inner = newScope(ScopeKind.BLOCK, scope, node);
                        declareArmPattern(node, inner);
                    }
                }
                case CALL_EXPR -> markCallee(node, scope);
                case IDENTIFIER -> {
                    if (!access.containsKey(node.id())) claim(node, AccessMode.READ);
                }
                default -> { }
            }
            visitChildren(node, inner);
        }

        private void visitChildren(AstNode node, int scope) {
            for (AstNode child : ast.children(node)) {
                if (child.role() == Role.ALIAS) declareAlias(child, scope);
                visit(child, scope, skipsVariables(node, child));
            }
        }

        /** Children whose identifiers are names of members, types or labels rather than variables. */
        private boolean skipsVariables(AstNode parent, AstNode child) {
            switch (child.role()) {
                case TYPE, MEMBER, LABEL:
                    return true;
                case NAME:
                    if (child.kind() == CanonicalKind.IDENTIFIER && !access.containsKey(child.id())) return true;
                    break;
                default:
                    break;
            }
            if (child.kind() == CanonicalKind.IDENTIFIER && AstShapes.labelsByIdentifier(parent)) return true;
            return AstShapes.isLabelKind(child.rawKind());
        }

        private void visitFunction(AstNode node, int scope) {
            if (node.kind() == CanonicalKind.FUNCTION_DECL) {
                AstNode name = AstShapes.declaredName(ast, node);
                if (name != null) {
                    declare(ast.text(name), name, scope, SymbolKind.FUNCTION, AccessMode.DECLARE_INIT,
                        node.startByte());
                }
            }
            int function = newScope(ScopeKind.FUNCTION, scope, node);
            for (AstNode list : AstShapes.parameterLists(ast, node)) {
                for (AstNode parameter : bindingNames(list)) {
                    if (access.containsKey(parameter.id())) continue;
                    declare(ast.text(parameter), parameter, function, SymbolKind.PARAMETER, AccessMode.DECLARE_INIT,
                        node.startByte());
                }
            }
            AstNode body = AstShapes.body(ast, node);
            if (body != null && body.kind() == CanonicalKind.BLOCK) reusedBlocks.add(body.id());
            visitChildren(node, function);
        }

        private void visitClass(AstNode node, int scope) {
            AstNode name = ast.child(node, Role.NAME);
            if (name != null) {
                declare(ast.text(name), name, scope, SymbolKind.CLASS, AccessMode.DECLARE_INIT, node.startByte());
            }
            int classScope = newScope(ScopeKind.CLASS, scope, node);
            visitChildren(node, classScope);
        }

        private void declareVariables(AstNode node, int scope) {
            boolean hoisted = policy.hoistsVar()
                && ("var".equals(node.keyword()) || node.rawKind().equals("variable_declaration"));
            int target = hoisted ? functionScope(scope) : scope;
            boolean shortVar = node.rawKind().equals("short_var_declaration");
            int visibleFrom = policy.orderedLookup() ? node.endByte() : node.startByte();
            boolean sawDeclarator = false;
            for (AstNode child : ast.children(node)) {
                if (child.kind() != CanonicalKind.DECLARATOR && child.role() != Role.DECLARATOR) continue;
                sawDeclarator = true;
                if (child.rawKind().equals("function_declarator")) {
                    for (AstNode parameters : ast.children(child, Role.PARAMETERS)) opaqueNodes.add(parameters.id());
                }
                if (child.kind() == CanonicalKind.DECLARATOR) {
                    boolean init = ast.child(child, Role.VALUE) != null;
                    List<AstNode> names = new ArrayList<>();
                    for (AstNode part : ast.children(child)) {
                        if (part.role() == Role.NAME || part.role() == Role.DECLARATOR || part.role() == Role.TARGET) {
                            names.addAll(bindingNames(part));
                        }
                    }
                    declareAll(names, target, init, shortVar, visibleFrom);
                } else {
                    declareAll(bindingNames(child), target, false, shortVar, visibleFrom);
                }
            }
            if (sawDeclarator) return;
            boolean init = ast.child(node, Role.VALUE) != null;
            List<AstNode> names = new ArrayList<>();
            for (AstNode child : ast.children(node)) {
                if (child.role() == Role.NAME || child.role() == Role.TARGET) names.addAll(bindingNames(child));
            }
            declareAll(names, target, init, shortVar, visibleFrom);
        }

        private void declareAll(List<AstNode> names, int scope, boolean init, boolean shortVar, int visibleFrom) {
            for (AstNode name : names) {
                String text = ast.text(name);
                if (shortVar && scopes.get(scope).names.containsKey(text)) {
                    claim(name, AccessMode.WRITE);
                } else {
                    declare(text, name, scope, SymbolKind.VARIABLE,
                        init ? AccessMode.DECLARE_INIT : AccessMode.DECLARE, visibleFrom);
                }
            }
        }

        private void claimAssignment(AstNode node, int scope) {
            boolean augmented = node.isAugmented();
            for (AstNode target : ast.children(node, Role.TARGET)) {
                for (AstNode name : bindingNames(target)) {
                    if (access.containsKey(name.id())) continue;
                    if (augmented) {
                        claim(name, AccessMode.READ_WRITE);
                    } else if (policy.implicitDeclaration()) {
                        declareImplicit(name, scope);
                    } else {
                        claim(name, AccessMode.WRITE);
                    }
                }
            }
        }

        private void claimUpdate(AstNode node) {
            for (AstNode child : ast.children(node)) {
                if (child.kind() == CanonicalKind.IDENTIFIER) {
                    claim(child, AccessMode.READ_WRITE);
                    return;
                }
            }
        }

        private void declareLoopTarget(AstNode node, int scope) {
            AstNode target = ast.child(node, Role.TARGET);
            if (target == null) return;
            List<AstNode> names = bindingNames(target);
            if (policy.implicitDeclaration()) {
                for (AstNode name : names) declareImplicit(name, scope);
                return;
            }
            boolean declares;
            if (policy.hoistsVar()) {
                declares = node.keyword() != null;
            } else if (node.kind() == CanonicalKind.LOOP_CLAUSE) {
                declares = ":=".equals(node.operator());
            } else {
                declares = true;
            }
            int declScope = declares && "var".equals(node.keyword()) ? functionScope(scope) : scope;
            for (AstNode name : names) {
                if (declares) {
                    declare(ast.text(name), name, declScope, SymbolKind.VARIABLE, AccessMode.DECLARE_INIT,
                        node.startByte());
                } else {
                    claim(name, AccessMode.WRITE);
                }
            }
        }

        private void declareCatchParameters(AstNode node, int scope) {
            for (AstNode child : ast.children(node)) {
                if (child.role() != Role.PARAMETERS && child.kind() != CanonicalKind.PARAMETER) continue;
                for (AstNode name : bindingNames(child)) {
                    declare(ast.text(name), name, scope, SymbolKind.VARIABLE, AccessMode.DECLARE_INIT,
                        node.startByte());
                }
            }
        }

        // Rust arm patterns: capitalised names are enum variants and constants, not bindings.
        private void declareArmPattern(AstNode node, int scope) {
            AstNode pattern = ast.child(node, Role.TARGET);
            if (pattern == null) return;
            for (AstNode name : bindingNames(pattern)) {
                String text = ast.text(name);
                if (text.isEmpty() || Character.isUpperCase(text.charAt(0))) continue;
                declare(text, name, scope, SymbolKind.VARIABLE, AccessMode.DECLARE_INIT, node.startByte());
            }
        }

        private void declareAlias(AstNode alias, int scope) {
            for (AstNode name : bindingNames(alias)) {
                if (access.containsKey(name.id())) continue;
                if (policy.implicitDeclaration()) {
                    declareImplicit(name, scope);
                } else {
                    declare(ast.text(name), name, scope, SymbolKind.VARIABLE, AccessMode.DECLARE_INIT,
                        name.startByte());
                }
            }
        }

        private void declareImplicit(AstNode name, int scope) {
            String text = ast.text(name);
            int target = implicitScope(scope, text);
            if (target < 0) {
                claim(name, AccessMode.WRITE);
                return;
            }
            declare(text, name, target, SymbolKind.VARIABLE, AccessMode.DECLARE_INIT, name.startByte());
        }

        private void recordDirective(AstNode node, int scope) {
            ScopeDraft owner = scopes.get(nonBlockScope(scope));
            boolean global = node.rawKind().startsWith("global");
            for (AstNode child : ast.children(node, CanonicalKind.IDENTIFIER)) {
                (global ? owner.globals : owner.nonlocals).add(ast.text(child));
            }
        }

        private void markCallee(AstNode node, int scope) {
            AstNode callee = ast.child(node, Role.CALLEE);
            if (callee == null) return;
            AstNode receiver = ast.child(node, Role.OBJECT);
            if (receiver != null) {
                opaqueNodes.add(callee.id());
                if (AstShapes.isSelfReference(ast, receiver)) memberRefs.put(callee.id(), scope);
                return;
            }
            if (callee.kind() == CanonicalKind.MEMBER_EXPR) {
                AstNode object = ast.child(callee, Role.OBJECT);
                AstNode member = ast.child(callee, Role.MEMBER);
                if (member != null && AstShapes.isSelfReference(ast, object)) memberRefs.put(member.id(), scope);
            }
        }

        /**
         * Names bound by a declaration target or parameter list. Member, index and call
         * expressions bind nothing; their identifiers stay reads.
         */
        private List<AstNode> bindingNames(AstNode root) {
            List<AstNode> names = new ArrayList<>();
            Deque<AstNode> work = new ArrayDeque<>();
            work.push(root);
            while (!work.isEmpty()) {
                AstNode node = work.pop();
                if (node.kind() == CanonicalKind.IDENTIFIER) {
                    names.add(node);
                    continue;
                }
                if (node != root) {
                    Role role = node.role();
                    if (role == Role.TYPE || role == Role.VALUE || role == Role.MEMBER
                        || role == Role.PARAMETERS || role == Role.LABEL) {
                        continue;
                    }
                }
                if (table.isOpaque(node.rawKind())) continue;
                if (node.kind() == CanonicalKind.PARAMETER || node.kind() == CanonicalKind.DECLARATOR
                    || KindTable.isPatternContainer(node.rawKind())) {
                    List<Integer> children = node.children();
                    for (int i = children.size() - 1; i >= 0; i--) work.push(ast.node(children.get(i)));
                }
            }
            return names;
        }

        private int declare(String name, AstNode node, int scope, SymbolKind kind, AccessMode mode, int visibleFrom) {
            ScopeDraft draft = scopes.get(scope);
            List<Integer> existing = draft.names.get(name);
            if (existing != null && policy.mergesRedeclarations()) {
                int symbol = existing.get(0);
                bindings.put(node.id(), symbol);
                access.put(node.id(), mode == AccessMode.DECLARE_INIT ? AccessMode.WRITE : AccessMode.DECLARE);
                return symbol;
            }
            int symbol = symbols.size();
            symbols.add(new SymbolDraft(symbol, name, kind, scope, node.id(), visibleFrom));
            draft.names.computeIfAbsent(name, k -> new ArrayList<>()).add(symbol);
            draft.symbols.add(symbol);
            bindings.put(node.id(), symbol);
            access.put(node.id(), mode);
            return symbol;
        }

        private void claim(AstNode node, AccessMode mode) {
            access.put(node.id(), mode);
            pending.add(node.id());
        }

        private int newScope(ScopeKind kind, int parent, AstNode owner) {
            int id = scopes.size();
            scopes.add(new ScopeDraft(id, kind, parent, owner.id()));
            return id;
        }

        private int functionScope(int scope) {
            int current = scope;
            while (scopes.get(current).kind != ScopeKind.FUNCTION && scopes.get(current).kind != ScopeKind.MODULE) {
                current = scopes.get(current).parent;
            }
            return current;
        }

        private int nonBlockScope(int scope) {
            int current = scope;
            while (scopes.get(current).kind == ScopeKind.BLOCK) current = scopes.get(current).parent;
            return current;
        }

        /** Scope an implicit declaration lands in; -1 when a nonlocal directive forwards it outward. */
        private int implicitScope(int scope, String name) {
            ScopeDraft owner = scopes.get(nonBlockScope(scope));
            if (owner.globals.contains(name)) return 0;
            if (owner.nonlocals.contains(name)) return -1;
            return owner.id;
        }

        private void markScope(AstNode root, int scope) {
            Deque<AstNode> work = new ArrayDeque<>();
            work.push(root);
            while (!work.isEmpty()) {
                AstNode node = work.pop();
                scopeOf[node.id()] = scope;
                for (int child : node.children()) work.push(ast.node(child));
            }
        }

        // --- pass 2 ---

        private List<Integer> resolvePending() {
            List<Integer> deferred = new ArrayList<>();
            for (int occurrence : pending) {
                if (bindings.containsKey(occurrence)) continue;
                AstNode node = ast.node(occurrence);
                String name = ast.text(node);
                Integer symbol = lookup(name, scopeOf[occurrence], node.startByte());
                if (symbol != null) {
                    bindings.put(occurrence, symbol);
                } else if (policy.implicitGlobals() && access.get(occurrence) == AccessMode.WRITE) {
                    declare(name, node, 0, SymbolKind.VARIABLE, AccessMode.DECLARE_INIT, 0);
                } else {
                    deferred.add(occurrence);
                }
            }
            // implicit globals created above may satisfy earlier reads
            List<Integer> unresolved = new ArrayList<>();
            for (int occurrence : deferred) {
                AstNode node = ast.node(occurrence);
                Integer symbol = lookup(ast.text(node), scopeOf[occurrence], node.startByte());
                if (symbol != null) {
                    bindings.put(occurrence, symbol);
                } else {
                    unresolved.add(occurrence);
                }
            }
            return unresolved;
        }

        private void resolveMemberRefs() {
            for (Map.Entry<Integer, Integer> ref : memberRefs.entrySet()) {
                int current = ref.getValue();
                while (current >= 0 && scopes.get(current).kind != ScopeKind.CLASS) current = scopes.get(current).parent;
                if (current < 0) continue;
                List<Integer> candidates = scopes.get(current).names.get(ast.text(ast.node(ref.getKey())));
                if (candidates == null) continue;
                bindings.put(ref.getKey(), candidates.get(0));
                access.put(ref.getKey(), AccessMode.READ);
            }
        }

        private Integer lookup(String name, int fromScope, int usePosition) {
            int current = fromScope;
            boolean crossedFunction = false;
            while (current >= 0) {
                ScopeDraft scope = scopes.get(current);
                if (scope.globals.contains(name) && current != 0) {
                    current = 0;
                    crossedFunction = true;
                    continue;
                }
                boolean visible = !scope.nonlocals.contains(name)
                    && !(scope.kind == ScopeKind.CLASS && crossedFunction && !policy.classMembersVisibleInMethods());
                if (visible) {
                    List<Integer> candidates = scope.names.get(name);
                    if (candidates != null) {
                        Integer chosen = choose(candidates, scope, usePosition);
                        if (chosen != null) return chosen;
                    }
                }
                if (scope.kind == ScopeKind.FUNCTION) crossedFunction = true;
                current = scope.parent;
            }
            return null;
        }

        /**
         * Unordered languages see the single declaration. Ordered ones take the nearest
         * preceding declaration; when none precedes, module and class scopes and hoisted
         * function or class items still match, anything else defers to the enclosing scope.
         */
        private Integer choose(List<Integer> candidates, ScopeDraft scope, int usePosition) {
            if (!policy.orderedLookup()) return candidates.get(0);
            Integer preceding = null;
            for (int candidate : candidates) {
                if (symbols.get(candidate).visibleFrom() <= usePosition) preceding = candidate;
            }
            if (preceding != null) return preceding;
            if (scope.kind == ScopeKind.MODULE || scope.kind == ScopeKind.CLASS) return candidates.get(0);
            for (int candidate : candidates) {
                SymbolKind kind = symbols.get(candidate).kind();
                if (kind == SymbolKind.FUNCTION || kind == SymbolKind.CLASS) return candidate;
            }
            return null;
        }

        private SymbolTable assemble(List<Integer> unresolved) {
            Map<Integer, List<Integer>> uses = new HashMap<>();
            for (Map.Entry<Integer, Integer> binding : new TreeMap<>(bindings).entrySet()) {
                SymbolDraft symbol = symbols.get(binding.getValue());
                if (symbol.declNode() == binding.getKey()) continue;
                uses.computeIfAbsent(symbol.id(), k -> new ArrayList<>()).add(binding.getKey());
            }
            List<Symbol> builtSymbols = new ArrayList<>(symbols.size());
            for (SymbolDraft draft : symbols) {
                builtSymbols.add(new Symbol(draft.id(), draft.name(), draft.kind(), draft.scope(), draft.declNode(),
                    uses.getOrDefault(draft.id(), List.of())));
            }
            List<Scope> builtScopes = new ArrayList<>(scopes.size());
            for (ScopeDraft draft : scopes) {
                builtScopes.add(new Scope(draft.id, draft.kind, draft.parent, draft.owner, draft.symbols));
            }
            List<Integer> sortedUnresolved = new ArrayList<>(unresolved);
            sortedUnresolved.sort(null);
            return new SymbolTable(builtScopes, builtSymbols, scopeOf, new HashMap<>(access), new HashMap<>(bindings),
                sortedUnresolved);
        }
    }
}
