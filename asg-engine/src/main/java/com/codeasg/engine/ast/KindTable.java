package com.codeasg.engine.ast;

import com.codeasg.engine.grammar.Language;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static com.codeasg.engine.ast.CanonicalKind.*;

/**
 * Per-language mapping from grammar node kinds and field names to canonical kinds and roles.
 * Pure data; one shared instance per language.
 */
public final class KindTable {

    private static final Map<String, Role> COMMON_FIELDS = new HashMap<>();

    static {
        COMMON_FIELDS.put("name", Role.NAME);
        COMMON_FIELDS.put("body", Role.BODY);
        COMMON_FIELDS.put("condition", Role.CONDITION);
        COMMON_FIELDS.put("consequence", Role.THEN);
        COMMON_FIELDS.put("alternative", Role.ELSE);
        COMMON_FIELDS.put("left", Role.TARGET);
        COMMON_FIELDS.put("pattern", Role.TARGET);
        COMMON_FIELDS.put("right", Role.VALUE);
        COMMON_FIELDS.put("value", Role.VALUE);
        COMMON_FIELDS.put("function", Role.CALLEE);
        COMMON_FIELDS.put("macro", Role.CALLEE);
        COMMON_FIELDS.put("constructor", Role.CALLEE);
        COMMON_FIELDS.put("arguments", Role.ARGUMENTS);
        COMMON_FIELDS.put("parameters", Role.PARAMETERS);
        COMMON_FIELDS.put("parameter", Role.PARAMETERS);
        COMMON_FIELDS.put("receiver", Role.PARAMETERS);
        COMMON_FIELDS.put("declarator", Role.DECLARATOR);
        COMMON_FIELDS.put("initializer", Role.INIT);
        COMMON_FIELDS.put("init", Role.INIT);
        COMMON_FIELDS.put("update", Role.UPDATE);
        COMMON_FIELDS.put("increment", Role.UPDATE);
        COMMON_FIELDS.put("handler", Role.HANDLER);
        COMMON_FIELDS.put("finalizer", Role.FINALIZER);
        COMMON_FIELDS.put("type", Role.TYPE);
        COMMON_FIELDS.put("return_type", Role.TYPE);
        COMMON_FIELDS.put("result", Role.TYPE);
        COMMON_FIELDS.put("type_parameters", Role.TYPE);
        COMMON_FIELDS.put("type_arguments", Role.TYPE);
        COMMON_FIELDS.put("superclass", Role.TYPE);
        COMMON_FIELDS.put("interfaces", Role.TYPE);
        COMMON_FIELDS.put("dimensions", Role.TYPE);
        COMMON_FIELDS.put("property", Role.MEMBER);
        COMMON_FIELDS.put("field", Role.MEMBER);
        COMMON_FIELDS.put("attribute", Role.MEMBER);
        COMMON_FIELDS.put("object", Role.OBJECT);
        COMMON_FIELDS.put("operand", Role.OBJECT);
        COMMON_FIELDS.put("argument", Role.OBJECT);
        COMMON_FIELDS.put("label", Role.LABEL);
        COMMON_FIELDS.put("alias", Role.ALIAS);
    }

    private static final Map<Language, KindTable> TABLES = new EnumMap<>(Language.class);

    static {
        TABLES.put(Language.PYTHON, python());
        TABLES.put(Language.JAVASCRIPT, javascript(Language.JAVASCRIPT).build());
        TABLES.put(Language.TYPESCRIPT, typescript());
        TABLES.put(Language.GO, go());
        TABLES.put(Language.RUST, rust());
        TABLES.put(Language.C, c(Language.C).build());
        TABLES.put(Language.CPP, cpp());
        TABLES.put(Language.JAVA, java());
    }

    private final Language language;
    private final Map<String, CanonicalKind> kinds;
    private final Map<String, Role> overrides;
    private final Set<String> opaqueKinds;

    private KindTable(Builder builder) {
        this.language = builder.language;
        this.kinds = Collections.unmodifiableMap(new HashMap<>(builder.kinds));
        this.overrides = Collections.unmodifiableMap(new HashMap<>(builder.overrides));
        this.opaqueKinds = Set.copyOf(builder.opaque);
    }

    public static KindTable forLanguage(Language language) {
        return TABLES.get(language);
    }

    public Language language() { return language; }

    public CanonicalKind kindOf(String rawKind) {
        return kinds.getOrDefault(rawKind, OTHER);
    }

    public Role roleOf(String parentRawKind, String field) {
        if (field == null) return Role.NONE;
        Role override = overrides.get(parentRawKind + "." + field);
        if (override != null) return override;
        return COMMON_FIELDS.getOrDefault(field, Role.NONE);
    }

    /** Kinds whose subtree never references a variable: type expressions, labels, annotations, paths. */
    public boolean isOpaque(String rawKind) {
        return opaqueKinds.contains(rawKind);
    }

    /** Raw kinds in assignment targets and declarations that hold nested binding names. */
    public static boolean isPatternContainer(String rawKind) {
        return rawKind.endsWith("pattern")
            || rawKind.endsWith("pattern_list")
            || rawKind.endsWith("declarator")
            || rawKind.endsWith("parameter")
            || rawKind.endsWith("parameters")
            || rawKind.endsWith("parameter_declaration")
            || rawKind.equals("expression_list")
            || rawKind.equals("as_pattern_target")
            || rawKind.equals("parameter_list")
            || rawKind.equals("inferred_parameters")
            || rawKind.equals("tuple")
            || rawKind.equals("list");
    }

    // --- per-language tables ---

    private static KindTable python() {
        return new Builder(Language.PYTHON)
            .map(MODULE, "module")
            .map(FUNCTION_DECL, "function_definition")
            .map(LAMBDA, "lambda")
            .map(CLASS_DECL, "class_definition")
            .map(PARAMETER, "default_parameter", "typed_parameter", "typed_default_parameter")
            .map(IMPORT, "import_statement", "import_from_statement", "future_import_statement")
            .map(SCOPE_DIRECTIVE, "global_statement", "nonlocal_statement")
            .map(BLOCK, "block")
            .map(EXPR_STMT, "expression_statement")
            .map(ASSIGNMENT, "assignment", "augmented_assignment", "named_expression")
            .map(IF_STMT, "if_statement", "elif_clause")
            .map(ELSE_CLAUSE, "else_clause")
            .map(WHILE_STMT, "while_statement")
            .map(FOR_EACH_STMT, "for_statement")
            .map(LOOP_CLAUSE, "for_in_clause")
            .map(SWITCH_STMT, "match_statement")
            .map(CASE_CLAUSE, "case_clause")
            .map(TRY_STMT, "try_statement")
            .map(CATCH_CLAUSE, "except_clause", "except_group_clause")
            .map(FINALLY_CLAUSE, "finally_clause")
            .map(WITH_STMT, "with_statement")
            .map(THROW_STMT, "raise_statement")
            .map(RETURN_STMT, "return_statement")
            .map(BREAK_STMT, "break_statement")
            .map(CONTINUE_STMT, "continue_statement")
            .map(CALL_EXPR, "call")
            .map(MEMBER_EXPR, "attribute")
            .map(INDEX_EXPR, "subscript")
            .map(IDENTIFIER, "identifier")
            .map(LITERAL, "integer", "float", "string", "true", "false", "none", "concatenated_string")
            .map(COMPREHENSION, "list_comprehension", "set_comprehension", "dictionary_comprehension",
                "generator_expression")
            .role("keyword_argument.name", Role.MEMBER)
            .role("match_statement.subject", Role.CONDITION)
            .role("named_expression.name", Role.TARGET)
            .role("import_from_statement.module_name", Role.NONE)
            .opaque("type", "decorator_type")
            .build();
    }

    private static Builder javascript(Language language) {
        return new Builder(language)
            .map(MODULE, "program")
            .map(FUNCTION_DECL, "function_declaration", "generator_function_declaration", "method_definition")
            .map(LAMBDA, "arrow_function", "function_expression", "function", "generator_function")
            .map(CLASS_DECL, "class_declaration", "class")
            .map(VARIABLE_DECL, "lexical_declaration", "variable_declaration")
            .map(DECLARATOR, "variable_declarator")
            .map(IMPORT, "import_statement")
            .map(BLOCK, "statement_block")
            .map(EXPR_STMT, "expression_statement")
            .map(ASSIGNMENT, "assignment_expression", "augmented_assignment_expression")
            .map(UPDATE_EXPR, "update_expression")
            .map(IF_STMT, "if_statement")
            .map(ELSE_CLAUSE, "else_clause")
            .map(WHILE_STMT, "while_statement")
            .map(DO_WHILE_STMT, "do_statement")
            .map(FOR_STMT, "for_statement")
            .map(FOR_EACH_STMT, "for_in_statement")
            .map(SWITCH_STMT, "switch_statement")
            .map(CASE_CLAUSE, "switch_case", "switch_default")
            .map(TRY_STMT, "try_statement")
            .map(CATCH_CLAUSE, "catch_clause")
            .map(FINALLY_CLAUSE, "finally_clause")
            .map(THROW_STMT, "throw_statement")
            .map(RETURN_STMT, "return_statement")
            .map(BREAK_STMT, "break_statement")
            .map(CONTINUE_STMT, "continue_statement")
            .map(LABELED_STMT, "labeled_statement")
            .map(CALL_EXPR, "call_expression", "new_expression")
            .map(MEMBER_EXPR, "member_expression")
            .map(INDEX_EXPR, "subscript_expression")
            .map(IDENTIFIER, "identifier", "shorthand_property_identifier",
                "shorthand_property_identifier_pattern")
            .map(LITERAL, "number", "string", "template_string", "true", "false", "null", "undefined", "regex")
            .role("switch_statement.value", Role.CONDITION)
            .role("switch_case.body", Role.NONE)
            .role("switch_default.body", Role.NONE)
            .role("pair_pattern.value", Role.TARGET)
            .role("pair_pattern.key", Role.MEMBER)
            .role("pair.key", Role.MEMBER)
            .role("for_in_statement.kind", Role.NONE)
            .opaque("statement_identifier", "jsx_opening_element", "jsx_closing_element", "regex_pattern");
    }

    private static KindTable typescript() {
        return javascript(Language.TYPESCRIPT)
            .map(FUNCTION_DECL, "function_signature")
            .map(CLASS_DECL, "abstract_class_declaration", "interface_declaration", "enum_declaration",
                "type_alias_declaration", "internal_module")
            .map(PARAMETER, "required_parameter", "optional_parameter")
            .opaque("type_annotation", "type_arguments", "type_parameters", "predefined_type",
                "type_identifier", "generic_type", "interface_body", "object_type")
            .build();
    }

    private static KindTable go() {
        return new Builder(Language.GO)
            .map(MODULE, "source_file")
            .map(FUNCTION_DECL, "function_declaration", "method_declaration")
            .map(LAMBDA, "func_literal")
            .map(CLASS_DECL, "type_spec")
            .map(VARIABLE_DECL, "var_declaration", "const_declaration", "short_var_declaration")
            .map(DECLARATOR, "var_spec", "const_spec")
            .map(PARAMETER, "parameter_declaration", "variadic_parameter_declaration")
            .map(IMPORT, "import_declaration")
            .map(BLOCK, "block")
            .map(EXPR_STMT, "expression_statement")
            .map(ASSIGNMENT, "assignment_statement")
            .map(UPDATE_EXPR, "inc_statement", "dec_statement")
            .map(IF_STMT, "if_statement")
            .map(FOR_STMT, "for_statement")
            .map(LOOP_CLAUSE, "for_clause", "range_clause")
            .map(SWITCH_STMT, "expression_switch_statement", "type_switch_statement", "select_statement")
            .map(CASE_CLAUSE, "expression_case", "default_case", "type_case", "communication_case")
            .map(RETURN_STMT, "return_statement")
            .map(BREAK_STMT, "break_statement")
            .map(CONTINUE_STMT, "continue_statement")
            .map(FALLTHROUGH_STMT, "fallthrough_statement")
            .map(LABELED_STMT, "labeled_statement")
            .map(CALL_EXPR, "call_expression")
            .map(MEMBER_EXPR, "selector_expression")
            .map(INDEX_EXPR, "index_expression")
            .map(IDENTIFIER, "identifier")
            .map(LITERAL, "int_literal", "float_literal", "interpreted_string_literal", "raw_string_literal",
                "rune_literal", "true", "false", "nil")
            .role("expression_switch_statement.value", Role.CONDITION)
            .role("type_switch_statement.value", Role.CONDITION)
            .role("expression_case.value", Role.VALUE)
            .role("short_var_declaration.left", Role.TARGET)
            .role("keyed_element.key", Role.MEMBER)
            .opaque("label_name", "type_identifier", "qualified_type", "pointer_type", "slice_type",
                "map_type", "array_type", "channel_type", "function_type", "struct_type", "interface_type",
                "type_arguments", "package_identifier", "field_identifier")
            .build();
    }

    private static KindTable rust() {
        return new Builder(Language.RUST)
            .map(MODULE, "source_file")
            .map(FUNCTION_DECL, "function_item", "function_signature_item")
            .map(LAMBDA, "closure_expression")
            .map(CLASS_DECL, "struct_item", "enum_item", "trait_item", "impl_item", "mod_item", "union_item")
            .map(VARIABLE_DECL, "let_declaration", "const_item", "static_item")
            .map(PARAMETER, "parameter", "self_parameter")
            .map(IMPORT, "use_declaration", "extern_crate_declaration")
            .map(BLOCK, "block")
            .map(EXPR_STMT, "expression_statement")
            .map(ASSIGNMENT, "assignment_expression", "compound_assignment_expr")
            .map(IF_STMT, "if_expression", "if_let_expression")
            .map(ELSE_CLAUSE, "else_clause")
            .map(WHILE_STMT, "while_expression", "while_let_expression", "loop_expression")
            .map(FOR_EACH_STMT, "for_expression")
            .map(SWITCH_STMT, "match_expression")
            .map(CASE_CLAUSE, "match_arm")
            .map(RETURN_STMT, "return_expression")
            .map(BREAK_STMT, "break_expression")
            .map(CONTINUE_STMT, "continue_expression")
            .map(CALL_EXPR, "call_expression", "macro_invocation")
            .map(MEMBER_EXPR, "field_expression")
            .map(INDEX_EXPR, "index_expression")
            .map(IDENTIFIER, "identifier")
            .map(LITERAL, "integer_literal", "float_literal", "string_literal", "raw_string_literal",
                "char_literal", "boolean_literal")
            .role("match_expression.value", Role.CONDITION)
            .role("match_arm.value", Role.BODY)
            .role("field_expression.value", Role.OBJECT)
            .role("for_expression.value", Role.VALUE)
            .role("scoped_identifier.path", Role.MEMBER)
            .role("scoped_identifier.name", Role.MEMBER)
            .role("field_initializer.field", Role.MEMBER)
            .role("struct_expression.name", Role.TYPE)
            .role("use_declaration.argument", Role.NONE)
            .opaque("label", "lifetime", "type_identifier", "primitive_type", "generic_type", "reference_type",
                "scoped_type_identifier", "type_arguments", "attribute_item", "inner_attribute_item",
                "field_identifier")
            .build();
    }

    private static Builder c(Language language) {
        return new Builder(language)
            .map(MODULE, "translation_unit")
            .map(FUNCTION_DECL, "function_definition")
            .map(VARIABLE_DECL, "declaration")
            .map(DECLARATOR, "init_declarator")
            .map(PARAMETER, "parameter_declaration")
            .map(IMPORT, "preproc_include")
            .map(BLOCK, "compound_statement")
            .map(EXPR_STMT, "expression_statement")
            .map(ASSIGNMENT, "assignment_expression")
            .map(UPDATE_EXPR, "update_expression")
            .map(IF_STMT, "if_statement")
            .map(ELSE_CLAUSE, "else_clause")
            .map(WHILE_STMT, "while_statement")
            .map(DO_WHILE_STMT, "do_statement")
            .map(FOR_STMT, "for_statement")
            .map(SWITCH_STMT, "switch_statement")
            .map(CASE_CLAUSE, "case_statement")
            .map(RETURN_STMT, "return_statement")
            .map(BREAK_STMT, "break_statement")
            .map(CONTINUE_STMT, "continue_statement")
            .map(LABELED_STMT, "labeled_statement")
            .map(CALL_EXPR, "call_expression")
            .map(MEMBER_EXPR, "field_expression")
            .map(INDEX_EXPR, "subscript_expression")
            .map(IDENTIFIER, "identifier")
            .map(LITERAL, "number_literal", "string_literal", "char_literal", "true", "false", "null",
                "concatenated_string")
            .opaque("statement_identifier", "primitive_type", "type_identifier", "sized_type_specifier",
                "type_descriptor", "struct_specifier", "union_specifier", "enum_specifier", "field_identifier",
                "preproc_def", "preproc_function_def", "type_definition");
    }

    private static KindTable cpp() {
        Builder builder = c(Language.CPP)
            .map(LAMBDA, "lambda_expression")
            .map(CLASS_DECL, "class_specifier", "struct_specifier", "union_specifier", "namespace_definition")
            .map(VARIABLE_DECL, "field_declaration")
            .map(IMPORT, "using_declaration")
            .map(FOR_EACH_STMT, "for_range_loop")
            .map(TRY_STMT, "try_statement")
            .map(CATCH_CLAUSE, "catch_clause")
            .map(THROW_STMT, "throw_statement")
            .map(CALL_EXPR, "new_expression")
            .map(IDENTIFIER, "field_identifier")
            .map(LITERAL, "nullptr", "raw_string_literal")
            .role("for_range_loop.declarator", Role.TARGET)
            .role("qualified_identifier.scope", Role.MEMBER)
            .opaque("template_argument_list", "template_parameter_list", "namespace_identifier",
                "qualified_type_identifier", "auto", "attribute_specifier", "access_specifier");
        builder.opaque.remove("struct_specifier");
        builder.opaque.remove("union_specifier");
        builder.opaque.remove("field_identifier");
        return builder.build();
    }

    private static KindTable java() {
        return new Builder(Language.JAVA)
            .map(MODULE, "program")
            .map(FUNCTION_DECL, "method_declaration", "constructor_declaration", "compact_constructor_declaration")
            .map(LAMBDA, "lambda_expression")
            .map(CLASS_DECL, "class_declaration", "interface_declaration", "enum_declaration", "record_declaration",
                "annotation_type_declaration")
            .map(VARIABLE_DECL, "local_variable_declaration", "field_declaration", "constant_declaration")
            .map(DECLARATOR, "variable_declarator")
            .map(PARAMETER, "formal_parameter", "spread_parameter", "catch_formal_parameter", "receiver_parameter")
            .map(IMPORT, "import_declaration")
            .map(BLOCK, "block", "constructor_body")
            .map(EXPR_STMT, "expression_statement")
            .map(ASSIGNMENT, "assignment_expression")
            .map(UPDATE_EXPR, "update_expression")
            .map(IF_STMT, "if_statement")
            .map(WHILE_STMT, "while_statement")
            .map(DO_WHILE_STMT, "do_statement")
            .map(FOR_STMT, "for_statement")
            .map(FOR_EACH_STMT, "enhanced_for_statement")
            .map(SWITCH_STMT, "switch_expression", "switch_statement")
            .map(CASE_CLAUSE, "switch_block_statement_group", "switch_rule")
            .map(TRY_STMT, "try_statement", "try_with_resources_statement")
            .map(CATCH_CLAUSE, "catch_clause")
            .map(FINALLY_CLAUSE, "finally_clause")
            .map(THROW_STMT, "throw_statement")
            .map(RETURN_STMT, "return_statement")
            .map(BREAK_STMT, "break_statement")
            .map(CONTINUE_STMT, "continue_statement")
            .map(LABELED_STMT, "labeled_statement")
            .map(CALL_EXPR, "method_invocation", "object_creation_expression", "explicit_constructor_invocation")
            .map(MEMBER_EXPR, "field_access")
            .map(INDEX_EXPR, "array_access")
            .map(IDENTIFIER, "identifier")
            .map(LITERAL, "decimal_integer_literal", "hex_integer_literal", "decimal_floating_point_literal",
                "string_literal", "character_literal", "true", "false", "null_literal")
            .role("method_invocation.name", Role.CALLEE)
            .role("enhanced_for_statement.name", Role.TARGET)
            .role("enhanced_for_statement.value", Role.VALUE)
            .role("switch_expression.condition", Role.CONDITION)
            .role("switch_statement.condition", Role.CONDITION)
            .role("switch_rule.body", Role.BODY)
            .opaque("type_identifier", "generic_type", "scoped_type_identifier", "integral_type",
                "floating_point_type", "boolean_type", "void_type", "array_type", "type_arguments",
                "type_parameters", "annotation", "marker_annotation", "package_declaration", "scoped_identifier",
                "dimensions")
            .build();
    }

    private static final class Builder {
        private final Language language;
        private final Map<String, CanonicalKind> kinds = new HashMap<>();
        private final Map<String, Role> overrides = new HashMap<>();
        private final Set<String> opaque = new HashSet<>();

        Builder(Language language) {
            this.language = language;
        }

        Builder map(CanonicalKind kind, String... rawKinds) {
            for (String raw : rawKinds) kinds.put(raw, kind);
            return this;
        }

        Builder role(String parentDotField, Role role) {
            overrides.put(parentDotField, role);
            return this;
        }

        Builder opaque(String... rawKinds) {
            opaque.addAll(Set.of(rawKinds));
            return this;
        }

        KindTable build() {
            return new KindTable(this);
        }
    }
}
