package org.pragmatica.fsfmt.syntax;

import java.util.List;

/**
 * Node of the immutable syntax tree. Parents own their children; there are no back references.
 */
public sealed interface SyntaxNode permits ParsedFile, ModuleOrNamespace, ModuleDecl, Binding, MatchClause,
                                           RecordFieldExpr, AttributeList, Attribute, Expr, Pat, SynType, TypeDefn,
                                           FieldDecl, UnionCase {
    NodeKind kind();

    SourceRange range();

    /**
     * Direct children in source order.
     */
    List<SyntaxNode> children();

    /**
     * Keyword and punctuation tokens owned by this node that may carry trivia of their own.
     */
    default List<TokenRef> anchorTokens() {
        return List.of();
    }

    <R> R accept(NodeVisitor<R> visitor);
}
