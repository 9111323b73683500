package org.pragmatica.fsfmt.syntax;

/**
 * Visitor with a single fallback for every node kind. Subclasses override the kinds they handle.
 */
public abstract class NodeVisitorAdapter<R> implements NodeVisitor<R> {
    protected abstract R defaultVisit(SyntaxNode node);

    @Override
    public R visitFile(ParsedFile node) {
        return defaultVisit(node);
    }

    @Override
    public R visitModuleOrNamespace(ModuleOrNamespace node) {
        return defaultVisit(node);
    }

    @Override
    public R visitOpen(ModuleDecl.Open node) {
        return defaultVisit(node);
    }

    @Override
    public R visitLetDecl(ModuleDecl.Let node) {
        return defaultVisit(node);
    }

    @Override
    public R visitTypes(ModuleDecl.Types node) {
        return defaultVisit(node);
    }

    @Override
    public R visitNestedModule(ModuleDecl.NestedModule node) {
        return defaultVisit(node);
    }

    @Override
    public R visitDoExpr(ModuleDecl.DoExpr node) {
        return defaultVisit(node);
    }

    @Override
    public R visitHashDirective(ModuleDecl.HashDirective node) {
        return defaultVisit(node);
    }

    @Override
    public R visitBinding(Binding node) {
        return defaultVisit(node);
    }

    @Override
    public R visitMatchClause(MatchClause node) {
        return defaultVisit(node);
    }

    @Override
    public R visitRecordField(RecordFieldExpr node) {
        return defaultVisit(node);
    }

    @Override
    public R visitAttributeList(AttributeList node) {
        return defaultVisit(node);
    }

    @Override
    public R visitAttribute(Attribute node) {
        return defaultVisit(node);
    }

    @Override
    public R visitConst(Expr.Const node) {
        return defaultVisit(node);
    }

    @Override
    public R visitIdent(Expr.Ident node) {
        return defaultVisit(node);
    }

    @Override
    public R visitNull(Expr.Null node) {
        return defaultVisit(node);
    }

    @Override
    public R visitParen(Expr.Paren node) {
        return defaultVisit(node);
    }

    @Override
    public R visitTyped(Expr.Typed node) {
        return defaultVisit(node);
    }

    @Override
    public R visitTuple(Expr.Tuple node) {
        return defaultVisit(node);
    }

    @Override
    public R visitArrayOrList(Expr.ArrayOrList node) {
        return defaultVisit(node);
    }

    @Override
    public R visitRecord(Expr.RecordExpr node) {
        return defaultVisit(node);
    }

    @Override
    public R visitComputation(Expr.Computation node) {
        return defaultVisit(node);
    }

    @Override
    public R visitApp(Expr.App node) {
        return defaultVisit(node);
    }

    @Override
    public R visitInfix(Expr.Infix node) {
        return defaultVisit(node);
    }

    @Override
    public R visitPrefix(Expr.Prefix node) {
        return defaultVisit(node);
    }

    @Override
    public R visitDotGet(Expr.DotGet node) {
        return defaultVisit(node);
    }

    @Override
    public R visitLambda(Expr.Lambda node) {
        return defaultVisit(node);
    }

    @Override
    public R visitMatchLambda(Expr.MatchLambda node) {
        return defaultVisit(node);
    }

    @Override
    public R visitMatch(Expr.Match node) {
        return defaultVisit(node);
    }

    @Override
    public R visitIfThenElse(Expr.IfThenElse node) {
        return defaultVisit(node);
    }

    @Override
    public R visitLetOrUse(Expr.LetOrUse node) {
        return defaultVisit(node);
    }

    @Override
    public R visitSequential(Expr.Sequential node) {
        return defaultVisit(node);
    }

    @Override
    public R visitForEach(Expr.ForEach node) {
        return defaultVisit(node);
    }

    @Override
    public R visitWhile(Expr.While node) {
        return defaultVisit(node);
    }

    @Override
    public R visitTryWith(Expr.TryWith node) {
        return defaultVisit(node);
    }

    @Override
    public R visitTryFinally(Expr.TryFinally node) {
        return defaultVisit(node);
    }

    @Override
    public R visitKeywordApp(Expr.KeywordApp node) {
        return defaultVisit(node);
    }

    @Override
    public R visitInlineIL(Expr.InlineIL node) {
        return defaultVisit(node);
    }

    @Override
    public R visitFromParseError(Expr.FromParseError node) {
        return defaultVisit(node);
    }

    @Override
    public R visitPatWild(Pat.Wild node) {
        return defaultVisit(node);
    }

    @Override
    public R visitPatNamed(Pat.Named node) {
        return defaultVisit(node);
    }

    @Override
    public R visitPatConst(Pat.Const node) {
        return defaultVisit(node);
    }

    @Override
    public R visitPatLongIdent(Pat.LongIdent node) {
        return defaultVisit(node);
    }

    @Override
    public R visitPatParen(Pat.Paren node) {
        return defaultVisit(node);
    }

    @Override
    public R visitPatTuple(Pat.Tuple node) {
        return defaultVisit(node);
    }

    @Override
    public R visitPatTyped(Pat.Typed node) {
        return defaultVisit(node);
    }

    @Override
    public R visitPatArrayOrList(Pat.ArrayOrList node) {
        return defaultVisit(node);
    }

    @Override
    public R visitPatCons(Pat.Cons node) {
        return defaultVisit(node);
    }

    @Override
    public R visitPatOr(Pat.Or node) {
        return defaultVisit(node);
    }

    @Override
    public R visitPatNull(Pat.Null node) {
        return defaultVisit(node);
    }

    @Override
    public R visitTypeLongIdent(SynType.LongIdent node) {
        return defaultVisit(node);
    }

    @Override
    public R visitTypeVar(SynType.Var node) {
        return defaultVisit(node);
    }

    @Override
    public R visitTypeApp(SynType.App node) {
        return defaultVisit(node);
    }

    @Override
    public R visitTypeFun(SynType.Fun node) {
        return defaultVisit(node);
    }

    @Override
    public R visitTypeTuple(SynType.Tuple node) {
        return defaultVisit(node);
    }

    @Override
    public R visitTypeArray(SynType.Array node) {
        return defaultVisit(node);
    }

    @Override
    public R visitTypeParen(SynType.Paren node) {
        return defaultVisit(node);
    }

    @Override
    public R visitRecordDefn(TypeDefn.RecordType node) {
        return defaultVisit(node);
    }

    @Override
    public R visitUnionDefn(TypeDefn.UnionType node) {
        return defaultVisit(node);
    }

    @Override
    public R visitAbbrevDefn(TypeDefn.Abbreviation node) {
        return defaultVisit(node);
    }

    @Override
    public R visitFieldDecl(FieldDecl node) {
        return defaultVisit(node);
    }

    @Override
    public R visitUnionCase(UnionCase node) {
        return defaultVisit(node);
    }
}
