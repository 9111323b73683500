package org.pragmatica.fsfmt.syntax;

/**
 * Visitor over every node kind of the syntax tree.
 */
public interface NodeVisitor<R> {
    R visitFile(ParsedFile node);

    R visitModuleOrNamespace(ModuleOrNamespace node);

    R visitOpen(ModuleDecl.Open node);

    R visitLetDecl(ModuleDecl.Let node);

    R visitTypes(ModuleDecl.Types node);

    R visitNestedModule(ModuleDecl.NestedModule node);

    R visitDoExpr(ModuleDecl.DoExpr node);

    R visitHashDirective(ModuleDecl.HashDirective node);

    R visitBinding(Binding node);

    R visitMatchClause(MatchClause node);

    R visitRecordField(RecordFieldExpr node);

    R visitAttributeList(AttributeList node);

    R visitAttribute(Attribute node);

    R visitConst(Expr.Const node);

    R visitIdent(Expr.Ident node);

    R visitNull(Expr.Null node);

    R visitParen(Expr.Paren node);

    R visitTyped(Expr.Typed node);

    R visitTuple(Expr.Tuple node);

    R visitArrayOrList(Expr.ArrayOrList node);

    R visitRecord(Expr.RecordExpr node);

    R visitComputation(Expr.Computation node);

    R visitApp(Expr.App node);

    R visitInfix(Expr.Infix node);

    R visitPrefix(Expr.Prefix node);

    R visitDotGet(Expr.DotGet node);

    R visitLambda(Expr.Lambda node);

    R visitMatchLambda(Expr.MatchLambda node);

    R visitMatch(Expr.Match node);

    R visitIfThenElse(Expr.IfThenElse node);

    R visitLetOrUse(Expr.LetOrUse node);

    R visitSequential(Expr.Sequential node);

    R visitForEach(Expr.ForEach node);

    R visitWhile(Expr.While node);

    R visitTryWith(Expr.TryWith node);

    R visitTryFinally(Expr.TryFinally node);

    R visitKeywordApp(Expr.KeywordApp node);

    R visitInlineIL(Expr.InlineIL node);

    R visitFromParseError(Expr.FromParseError node);

    R visitPatWild(Pat.Wild node);

    R visitPatNamed(Pat.Named node);

    R visitPatConst(Pat.Const node);

    R visitPatLongIdent(Pat.LongIdent node);

    R visitPatParen(Pat.Paren node);

    R visitPatTuple(Pat.Tuple node);

    R visitPatTyped(Pat.Typed node);

    R visitPatArrayOrList(Pat.ArrayOrList node);

    R visitPatCons(Pat.Cons node);

    R visitPatOr(Pat.Or node);

    R visitPatNull(Pat.Null node);

    R visitTypeLongIdent(SynType.LongIdent node);

    R visitTypeVar(SynType.Var node);

    R visitTypeApp(SynType.App node);

    R visitTypeFun(SynType.Fun node);

    R visitTypeTuple(SynType.Tuple node);

    R visitTypeArray(SynType.Array node);

    R visitTypeParen(SynType.Paren node);

    R visitRecordDefn(TypeDefn.RecordType node);

    R visitUnionDefn(TypeDefn.UnionType node);

    R visitAbbrevDefn(TypeDefn.Abbreviation node);

    R visitFieldDecl(FieldDecl node);

    R visitUnionCase(UnionCase node);
}
