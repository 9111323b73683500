package org.pragmatica.fsfmt.syntax;

/**
 * Kind tag of every syntax node. Together with the node range it identifies a trivia anchor.
 */
public enum NodeKind {
    FILE,
    MODULE_OR_NAMESPACE,

    DECL_OPEN,
    DECL_LET,
    DECL_TYPES,
    DECL_NESTED_MODULE,
    DECL_DO,
    DECL_HASH_DIRECTIVE,

    BINDING,
    MATCH_CLAUSE,
    RECORD_FIELD,
    ATTRIBUTE_LIST,
    ATTRIBUTE,

    EXPR_CONST,
    EXPR_IDENT,
    EXPR_NULL,
    EXPR_PAREN,
    EXPR_TYPED,
    EXPR_TUPLE,
    EXPR_ARRAY_OR_LIST,
    EXPR_RECORD,
    EXPR_COMPUTATION,
    EXPR_APP,
    EXPR_INFIX,
    EXPR_PREFIX,
    EXPR_DOT_GET,
    EXPR_LAMBDA,
    EXPR_MATCH_LAMBDA,
    EXPR_MATCH,
    EXPR_IF_THEN_ELSE,
    EXPR_LET_OR_USE,
    EXPR_SEQUENTIAL,
    EXPR_FOR_EACH,
    EXPR_WHILE,
    EXPR_TRY_WITH,
    EXPR_TRY_FINALLY,
    EXPR_KEYWORD_APP,
    EXPR_INLINE_IL,
    EXPR_FROM_PARSE_ERROR,

    PAT_WILD,
    PAT_NAMED,
    PAT_CONST,
    PAT_LONG_IDENT,
    PAT_PAREN,
    PAT_TUPLE,
    PAT_TYPED,
    PAT_ARRAY_OR_LIST,
    PAT_CONS,
    PAT_OR,
    PAT_NULL,

    TYPE_LONG_IDENT,
    TYPE_VAR,
    TYPE_APP,
    TYPE_FUN,
    TYPE_TUPLE,
    TYPE_ARRAY,
    TYPE_PAREN,

    TYPE_DEFN_RECORD,
    TYPE_DEFN_UNION,
    TYPE_DEFN_ABBREV,
    FIELD_DECL,
    UNION_CASE
}
