package org.pragmatica.fsfmt.syntax;

import java.util.List;

/**
 * Type definitions: records, unions and abbreviations.
 */
public sealed interface TypeDefn extends SyntaxNode {
    String name();

    List<String> typeParameters();

    TokenRef equals();

    record RecordType(String name,
                  List<String> typeParameters,
                  TokenRef equals,
                  TokenRef lbrace,
                  List<FieldDecl> fields,
                  TokenRef rbrace,
                  SourceRange range) implements TypeDefn {
        public RecordType {
            typeParameters = List.copyOf(typeParameters);
            fields = List.copyOf(fields);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TYPE_DEFN_RECORD;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(fields);
        }

        @Override
        public List<TokenRef> anchorTokens() {
            return List.of(equals, lbrace, rbrace);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitRecordDefn(this);
        }
    }

    record UnionType(String name, List<String> typeParameters, TokenRef equals, List<UnionCase> cases, SourceRange range)
    implements TypeDefn {
        public UnionType {
            typeParameters = List.copyOf(typeParameters);
            cases = List.copyOf(cases);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TYPE_DEFN_UNION;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(cases);
        }

        @Override
        public List<TokenRef> anchorTokens() {
            return List.of(equals);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitUnionDefn(this);
        }
    }

    record Abbreviation(String name, List<String> typeParameters, TokenRef equals, SynType type, SourceRange range)
    implements TypeDefn {
        public Abbreviation {
            typeParameters = List.copyOf(typeParameters);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TYPE_DEFN_ABBREV;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(type);
        }

        @Override
        public List<TokenRef> anchorTokens() {
            return List.of(equals);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAbbrevDefn(this);
        }
    }
}
