package org.pragmatica.fsfmt.format.printer;

import org.pragmatica.fsfmt.format.FormatterConfig;
import org.pragmatica.fsfmt.format.FormattingError;
import org.pragmatica.fsfmt.parser.Operators;
import org.pragmatica.fsfmt.syntax.Attribute;
import org.pragmatica.fsfmt.syntax.AttributeList;
import org.pragmatica.fsfmt.syntax.Binding;
import org.pragmatica.fsfmt.syntax.Expr;
import org.pragmatica.fsfmt.syntax.FieldDecl;
import org.pragmatica.fsfmt.syntax.MatchClause;
import org.pragmatica.fsfmt.syntax.ModuleDecl;
import org.pragmatica.fsfmt.syntax.ModuleOrNamespace;
import org.pragmatica.fsfmt.syntax.NodeVisitorAdapter;
import org.pragmatica.fsfmt.syntax.ParsedFile;
import org.pragmatica.fsfmt.syntax.Pat;
import org.pragmatica.fsfmt.syntax.RecordFieldExpr;
import org.pragmatica.fsfmt.syntax.SynType;
import org.pragmatica.fsfmt.syntax.SyntaxNode;
import org.pragmatica.fsfmt.syntax.TokenRef;
import org.pragmatica.fsfmt.syntax.TypeDefn;
import org.pragmatica.fsfmt.syntax.UnionCase;
import org.pragmatica.fsfmt.trivia.Anchor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static org.pragmatica.fsfmt.format.printer.Layouts.atCurrentColumn;
import static org.pragmatica.fsfmt.format.printer.Layouts.empty;
import static org.pragmatica.fsfmt.format.printer.Layouts.forceExpanded;
import static org.pragmatica.fsfmt.format.printer.Layouts.indented;
import static org.pragmatica.fsfmt.format.printer.Layouts.indentedBy;
import static org.pragmatica.fsfmt.format.printer.Layouts.join;
import static org.pragmatica.fsfmt.format.printer.Layouts.newline;
import static org.pragmatica.fsfmt.format.printer.Layouts.newlineIfPending;
import static org.pragmatica.fsfmt.format.printer.Layouts.sequence;
import static org.pragmatica.fsfmt.format.printer.Layouts.space;
import static org.pragmatica.fsfmt.format.printer.Layouts.text;
import static org.pragmatica.fsfmt.format.printer.Layouts.tryCompact;
import static org.pragmatica.fsfmt.format.printer.Layouts.when;

/**
 * Builds the layout of every node kind.
 * <p>
 * Each node either has a single shape or a compact/expanded pair decided by
 * {@link Layouts#tryCompact}. Child layouts are built once and shared by both shapes.
 */
final class NodeRenderer extends NodeVisitorAdapter<Layout> {
    private final FormatterConfig config;

    NodeRenderer(FormatterConfig config) {
        this.config = config;
    }

    /**
     * Layout of the node wrapped with its attached trivia.
     */
    Layout render(SyntaxNode node) {
        return TriviaPrinter.around(Anchor.of(node), node.accept(this));
    }

    @Override
    protected Layout defaultVisit(SyntaxNode node) {
        throw FormattingError.unsupportedConstruct(node.range(), node.kind()
                                                                     .name())
                             .exception();
    }

    // ===== Helpers =====

    private List<Layout> renderAll(List<? extends SyntaxNode> nodes) {
        var layouts = new ArrayList<Layout>(nodes.size());
        nodes.forEach(node -> layouts.add(render(node)));
        return layouts;
    }

    private static Layout token(TokenRef token, String text) {
        return TriviaPrinter.around(Anchor.of(token), text(text));
    }

    private static Layout token(Optional<TokenRef> token, String text) {
        return token.map(ref -> token(ref, text))
                    .orElseGet(() -> text(text));
    }

    private Layout colon() {
        return text(config.spaceBeforeColon()
                    ? " : "
                    : ": ");
    }

    private Layout delimiterSpace() {
        return when(config.spaceAroundDelimiter(), space());
    }

    private Layout collectionSeparator() {
        return config.semicolonAtEndOfLine()
               ? sequence(text(";"), newline())
               : newline();
    }

    /**
     * Body after {@code =} or {@code ->}: on the same line when it fits, otherwise indented below.
     */
    private static Layout body(Layout body, int maxWidth) {
        return tryCompact(sequence(space(), body), indented(sequence(newline(), body)), maxWidth);
    }

    private static Layout typeParameters(List<String> parameters) {
        return when(!parameters.isEmpty(), text("<" + String.join(", ", parameters) + ">"));
    }

    // ===== File and modules =====

    @Override
    public Layout visitFile(ParsedFile node) {
        return join(newline(), renderAll(node.modules()));
    }

    @Override
    public Layout visitModuleOrNamespace(ModuleOrNamespace node) {
        var decls = join(newline(), renderAll(node.decls()));
        if (node.moduleKind() == ModuleOrNamespace.Kind.ANONYMOUS_MODULE) {
            return decls;
        }
        var keyword = node.moduleKind() == ModuleOrNamespace.Kind.NAMESPACE
                      ? "namespace"
                      : "module";
        return sequence(token(node.keyword(), keyword),
                        space(),
                        when(node.recursive(), text("rec ")),
                        token(node.name(), node.nameText()),
                        when(!node.decls()
                                  .isEmpty(), sequence(newline(), decls)));
    }

    @Override
    public Layout visitOpen(ModuleDecl.Open node) {
        return text("open " + node.name());
    }

    @Override
    public Layout visitHashDirective(ModuleDecl.HashDirective node) {
        return text(node.text());
    }

    @Override
    public Layout visitDoExpr(ModuleDecl.DoExpr node) {
        return render(node.expr());
    }

    @Override
    public Layout visitLetDecl(ModuleDecl.Let node) {
        return sequence(attributes(node.attributes()), bindings("let", node.recursive(), node.bindings()));
    }

    private Layout attributes(List<AttributeList> attributes) {
        var layouts = new ArrayList<Layout>();
        for (var list : attributes) {
            layouts.add(render(list));
            layouts.add(newline());
        }
        return sequence(layouts);
    }

    private Layout bindings(String keyword, boolean recursive, List<Binding> bindings) {
        var layouts = new ArrayList<Layout>();
        for (var i = 0; i < bindings.size(); i++) {
            if (i > 0) {
                layouts.add(newline());
            }
            var prefix = i == 0
                         ? keyword + (recursive
                                      ? " rec "
                                      : " ")
                         : "and ";
            layouts.add(sequence(text(prefix), render(bindings.get(i))));
        }
        return sequence(layouts);
    }

    @Override
    public Layout visitNestedModule(ModuleDecl.NestedModule node) {
        return sequence(text("module "),
                        when(node.recursive(), text("rec ")),
                        text(node.name()),
                        space(),
                        token(node.equals(), "="),
                        indented(sequence(newline(), join(newline(), renderAll(node.decls())))));
    }

    @Override
    public Layout visitAttributeList(AttributeList node) {
        return sequence(text("[<"), join(text("; "), renderAll(node.attributes())), text(">]"));
    }

    @Override
    public Layout visitAttribute(Attribute node) {
        return sequence(text(node.name()),
                        node.argument()
                            .map(this::render)
                            .orElse(empty()));
    }

    @Override
    public Layout visitBinding(Binding node) {
        var width = node.isFunction()
                    ? config.maxFunctionBindingWidth()
                    : config.maxValueBindingWidth();
        return sequence(when(node.mutable(), text("mutable ")),
                        when(node.inline(), text("inline ")),
                        render(node.head()),
                        node.returnType()
                            .map(type -> sequence(colon(), render(type)))
                            .orElse(empty()),
                        space(),
                        token(node.equals(), "="),
                        body(render(node.body()), width));
    }

    // ===== Type definitions =====

    @Override
    public Layout visitTypes(ModuleDecl.Types node) {
        var layouts = new ArrayList<Layout>();
        layouts.add(attributes(node.attributes()));
        var definitions = node.definitions();
        for (var i = 0; i < definitions.size(); i++) {
            if (i > 0) {
                layouts.add(newline());
            }
            layouts.add(text(i == 0
                             ? "type "
                             : "and "));
            layouts.add(render(definitions.get(i)));
        }
        return sequence(layouts);
    }

    private Layout typeHeader(TypeDefn node) {
        return sequence(text(node.name()), typeParameters(node.typeParameters()), space(), token(node.equals(), "="));
    }

    @Override
    public Layout visitRecordDefn(TypeDefn.RecordType node) {
        var fields = renderAll(node.fields());
        var lbrace = token(node.lbrace(), "{");
        var rbrace = token(node.rbrace(), "}");
        var compact = sequence(space(),
                               lbrace,
                               delimiterSpace(),
                               join(text("; "), fields),
                               delimiterSpace(),
                               rbrace);
        return sequence(typeHeader(node),
                        tryCompact(compact,
                                   indented(sequence(newline(), expandedBlock(lbrace, 1, fields, rbrace))),
                                   config.maxRecordWidth()));
    }

    @Override
    public Layout visitUnionDefn(TypeDefn.UnionType node) {
        var cases = new ArrayList<Layout>();
        for (var unionCase : node.cases()) {
            cases.add(TriviaPrinter.around(Anchor.of(unionCase),
                                           sequence(token(unionCase.bar(), "|"), space(), unionCase.accept(this))));
        }
        var expanded = indented(sequence(newline(), join(newline(), cases)));
        if (node.cases()
                .size() > 1) {
            return sequence(typeHeader(node), forceExpanded(expanded));
        }
        // a single case without fields needs its bar, otherwise it reads as an abbreviation
        var single = node.cases()
                         .get(0);
        var bar = single.fields()
                        .isEmpty()
                  ? sequence(token(single.bar(), "|"), space())
                  : single.bar()
                          .map(ref -> token(ref, ""))
                          .orElse(empty());
        var compact = sequence(space(), TriviaPrinter.around(Anchor.of(single), sequence(bar, single.accept(this))));
        return sequence(typeHeader(node), tryCompact(compact, expanded, config.maxLineLength()));
    }

    @Override
    public Layout visitUnionCase(UnionCase node) {
        if (node.fields()
                .isEmpty()) {
            return text(node.name());
        }
        return sequence(text(node.name() + " of "), join(text(" * "), renderAll(node.fields())));
    }

    @Override
    public Layout visitAbbrevDefn(TypeDefn.Abbreviation node) {
        return sequence(typeHeader(node), space(), render(node.type()));
    }

    @Override
    public Layout visitFieldDecl(FieldDecl node) {
        return sequence(when(node.mutable(), text("mutable ")),
                        node.name()
                            .map(name -> sequence(text(name), colon()))
                            .orElse(empty()),
                        render(node.type()));
    }

    // ===== Simple expressions =====

    @Override
    public Layout visitConst(Expr.Const node) {
        return TriviaPrinter.literal(Anchor.of(node),
                                     node.value()
                                         .canonicalText());
    }

    @Override
    public Layout visitIdent(Expr.Ident node) {
        return text(node.name());
    }

    @Override
    public Layout visitNull(Expr.Null node) {
        return text("null");
    }

    @Override
    public Layout visitParen(Expr.Paren node) {
        return sequence(token(node.lparen(), "("), render(node.inner()), token(node.rparen(), ")"));
    }

    @Override
    public Layout visitTyped(Expr.Typed node) {
        return sequence(render(node.expr()), colon(), render(node.type()));
    }

    @Override
    public Layout visitPrefix(Expr.Prefix node) {
        return sequence(text(node.operator()), render(node.operand()));
    }

    @Override
    public Layout visitDotGet(Expr.DotGet node) {
        return sequence(render(node.target()), text("." + node.member()));
    }

    @Override
    public Layout visitKeywordApp(Expr.KeywordApp node) {
        return sequence(text(node.keyword()), space(), render(node.operand()));
    }

    @Override
    public Layout visitFromParseError(Expr.FromParseError node) {
        throw FormattingError.inputParseError(node.range(), "tree contains a parse error")
                             .exception();
    }

    // ===== Collections =====

    @Override
    public Layout visitTuple(Expr.Tuple node) {
        return tryCompact(tupleItems(node, space()),
                          atCurrentColumn(tupleItems(node, newline())),
                          config.maxLineLength());
    }

    // a comment after a comma stays after it
    private Layout tupleItems(Expr.Tuple node, Layout separator) {
        var items = node.items();
        var commas = node.commas();
        var parts = new ArrayList<Layout>();
        for (var i = 0; i < items.size(); i++) {
            if (i > 0) {
                parts.add(token(commas.get(i - 1), ","));
                parts.add(separator);
            }
            parts.add(render(items.get(i)));
        }
        return sequence(parts);
    }

    @Override
    public Layout visitArrayOrList(Expr.ArrayOrList node) {
        var open = token(node.open(),
                         node.array()
                         ? "[|"
                         : "[");
        var close = token(node.close(),
                          node.array()
                          ? "|]"
                          : "]");
        if (node.items()
                .isEmpty()) {
            return sequence(open, spaceBeforeComment(node.close()), close);
        }
        var items = renderAll(node.items());
        var compact = sequence(open, delimiterSpace(), join(text("; "), items), delimiterSpace(), close);
        return tryCompact(compact,
                          expandedBlock(open,
                                        node.array()
                                        ? 2
                                        : 1,
                                        items,
                                        close),
                          config.maxArrayOrListWidth());
    }

    // [ (* c *) ] keeps the comment centered
    private static Layout spaceBeforeComment(TokenRef close) {
        return context -> context.trivia()
                                 .entry(Anchor.of(close))
                                 .before()
                                 .isEmpty()
                          ? context
                          : context.space();
    }

    /**
     * One item per line, either aligned after the opening bracket or, when configured, between
     * brackets on their own lines.
     */
    private Layout expandedBlock(Layout open, int openWidth, List<Layout> items, Layout close) {
        if (config.multilineBlockBracketsOnSameColumn()) {
            return atCurrentColumn(sequence(open,
                                            indented(sequence(newline(), join(collectionSeparator(), items))),
                                            newline(),
                                            close));
        }
        var itemColumn = openWidth + (config.spaceAroundDelimiter()
                                      ? 1
                                      : 0);
        return atCurrentColumn(sequence(open,
                                        delimiterSpace(),
                                        indentedBy(itemColumn, join(collectionSeparator(), items)),
                                        newlineIfPending(),
                                        delimiterSpace(),
                                        close));
    }

    @Override
    public Layout visitRecord(Expr.RecordExpr node) {
        var lbrace = token(node.lbrace(), "{");
        var rbrace = token(node.rbrace(), "}");
        var fields = renderAll(node.fields());
        if (node.copyFrom()
                .isPresent()) {
            var source = render(node.copyFrom()
                                    .get());
            var compact = sequence(lbrace,
                                   space(),
                                   source,
                                   text(" with "),
                                   join(text("; "), fields),
                                   space(),
                                   rbrace);
            var expanded = atCurrentColumn(sequence(lbrace,
                                                    space(),
                                                    source,
                                                    text(" with"),
                                                    indented(sequence(newline(), join(newline(), fields))),
                                                    space(),
                                                    rbrace));
            return tryCompact(compact, expanded, config.maxRecordWidth());
        }
        var compact = sequence(lbrace, delimiterSpace(), join(text("; "), fields), delimiterSpace(), rbrace);
        return tryCompact(compact, expandedBlock(lbrace, 1, fields, rbrace), config.maxRecordWidth());
    }

    @Override
    public Layout visitRecordField(RecordFieldExpr node) {
        return sequence(text(node.name()),
                        space(),
                        token(node.equals(), "="),
                        body(render(node.value()), config.maxLineLength()));
    }

    @Override
    public Layout visitComputation(Expr.Computation node) {
        var lbrace = token(node.lbrace(), "{");
        var rbrace = token(node.rbrace(), "}");
        var body = render(node.body());
        return tryCompact(sequence(lbrace, space(), body, space(), rbrace),
                          sequence(lbrace, indented(sequence(newline(), body)), newline(), rbrace),
                          config.maxLineLength());
    }

    // ===== Application and operators =====

    @Override
    public Layout visitApp(Expr.App node) {
        var function = render(node.function());
        var args = renderAll(node.args());
        if (node.highPrecedence()) {
            return sequence(function, sequence(args));
        }
        var compact = sequence(function, space(), join(space(), args));
        var expanded = sequence(function, indented(sequence(newline(), join(newline(), args))));
        var last = node.args()
                       .get(node.args()
                                .size() - 1);
        if (hugsLastArgument(last)) {
            // a trailing computation expression or lambda starts on the line of the call
            expanded = sequence(function,
                                space(),
                                join(space(), args.subList(0, args.size() - 1)),
                                space(),
                                args.get(args.size() - 1));
        }
        return tryCompact(compact, expanded, config.maxArgumentsWidth());
    }

    private static boolean hugsLastArgument(Expr last) {
        return last instanceof Expr.Computation || (last instanceof Expr.Paren paren
                                                     && (paren.inner() instanceof Expr.Lambda
                                                         || paren.inner() instanceof Expr.MatchLambda));
    }

    @Override
    public Layout visitInfix(Expr.Infix node) {
        var operands = new ArrayList<Expr>();
        var operators = new ArrayList<String>();
        flatten(node, Operators.precedence(node.operator()), operands, operators);

        var layouts = renderAll(operands);
        var compactParts = new ArrayList<Layout>();
        var expandedParts = new ArrayList<Layout>();
        compactParts.add(layouts.get(0));
        expandedParts.add(layouts.get(0));
        var breakable = false;
        for (var i = 0; i < operators.size(); i++) {
            var operator = operators.get(i);
            var operand = layouts.get(i + 1);
            if (operator.equals("..") && isAtomic(operands.get(i)) && isAtomic(operands.get(i + 1))) {
                compactParts.add(sequence(text(operator), operand));
                expandedParts.add(sequence(text(operator), operand));
                continue;
            }
            var inline = sequence(space(), text(operator), space(), operand);
            compactParts.add(inline);
            if (Operators.neverBreaks(operator) || operator.equals("..")) {
                expandedParts.add(inline);
            } else {
                breakable = true;
                expandedParts.add(sequence(newline(), text(operator), space(), operand));
            }
        }
        var compact = sequence(compactParts);
        if (!breakable) {
            return compact;
        }
        return tryCompact(compact, atCurrentColumn(sequence(expandedParts)), config.maxInfixOperatorExpression());
    }

    /**
     * Collect operands of a chain of operators sharing one precedence level, following the
     * associativity of the level.
     */
    private static void flatten(Expr expr, int precedence, List<Expr> operands, List<String> operators) {
        if (!(expr instanceof Expr.Infix infix) || Operators.precedence(infix.operator()) != precedence) {
            operands.add(expr);
            return;
        }
        if (Operators.isRightAssociative(infix.operator())) {
            operands.add(infix.left());
            operators.add(infix.operator());
            flatten(infix.right(), precedence, operands, operators);
        } else {
            flatten(infix.left(), precedence, operands, operators);
            operators.add(infix.operator());
            operands.add(infix.right());
        }
    }

    private static boolean isAtomic(Expr expr) {
        return expr instanceof Expr.Const || expr instanceof Expr.Ident;
    }

    // ===== Functions and control flow =====

    @Override
    public Layout visitLambda(Expr.Lambda node) {
        return sequence(token(node.fun(), "fun"),
                        space(),
                        join(space(), renderAll(node.parameters())),
                        space(),
                        token(node.arrow(), "->"),
                        body(render(node.body()), config.maxLineLength()));
    }

    @Override
    public Layout visitMatchLambda(Expr.MatchLambda node) {
        return atCurrentColumn(sequence(token(node.function(), "function"), clauses(node.clauses())));
    }

    @Override
    public Layout visitMatch(Expr.Match node) {
        return forceExpanded(atCurrentColumn(sequence(token(node.match(), "match"),
                                                      space(),
                                                      render(node.subject()),
                                                      space(),
                                                      token(node.with(), "with"),
                                                      clauses(node.clauses()))));
    }

    private Layout clauses(List<MatchClause> clauses) {
        var layouts = new ArrayList<Layout>();
        for (var clause : clauses) {
            layouts.add(newline());
            layouts.add(render(clause));
        }
        return sequence(layouts);
    }

    @Override
    public Layout visitMatchClause(MatchClause node) {
        return sequence(token(node.bar(), "|"),
                        space(),
                        render(node.pattern()),
                        node.guard()
                            .map(guard -> sequence(text(" when "), render(guard)))
                            .orElse(empty()),
                        space(),
                        token(node.arrow(), "->"),
                        body(render(node.body()), config.maxLineLength()));
    }

    @Override
    public Layout visitIfThenElse(Expr.IfThenElse node) {
        var links = new ArrayList<IfLink>();
        Expr.IfThenElse current = node;
        Optional<ElseLink> finalElse = Optional.empty();
        while (current != null) {
            var link = new IfLink(current,
                                  token(current.ifKeyword(),
                                        current.isElif()
                                        ? "elif"
                                        : "if"),
                                  condition(current.condition()),
                                  token(current.then(), "then"),
                                  render(current.thenBranch()),
                                  current.elseKeyword()
                                         .map(keyword -> token(keyword, "else")));
            links.add(link);
            var next = current.elseBranch()
                              .orElse(null);
            if (next instanceof Expr.IfThenElse nested) {
                current = nested;
            } else {
                if (next != null) {
                    finalElse = Optional.of(new ElseLink(link.elseKeyword()
                                                             .orElseThrow(),
                                                         render(next)));
                }
                current = null;
            }
        }
        return tryCompact(compactIf(links, 0, finalElse),
                          atCurrentColumn(expandedIf(links, 0, finalElse)),
                          config.maxIfThenElseShortWidth());
    }

    // if (foo) then becomes if foo then
    private Layout condition(Expr condition) {
        return condition instanceof Expr.Paren paren && paren.inner() instanceof Expr.Ident
               ? unlessTrivia(paren, paren.lparen(), paren.rparen(), paren.inner())
               : render(condition);
    }

    private record IfLink(Expr.IfThenElse node,
                          Layout keyword,
                          Layout condition,
                          Layout then,
                          Layout thenBranch,
                          Optional<Layout> elseKeyword) {}

    private record ElseLink(Layout keyword, Layout body) {}

    /**
     * The first link is the node being rendered and carries its trivia through {@link #render};
     * later links are nested nodes and carry their own.
     */
    private static Layout wrapLink(IfLink link, int index, Layout layout) {
        return index == 0
               ? layout
               : TriviaPrinter.around(Anchor.of(link.node()), layout);
    }

    private Layout compactIf(List<IfLink> links, int index, Optional<ElseLink> finalElse) {
        var link = links.get(index);
        var parts = new ArrayList<Layout>();
        parts.add(sequence(link.keyword(),
                           space(),
                           link.condition(),
                           space(),
                           link.then(),
                           space(),
                           link.thenBranch()));
        if (index + 1 < links.size()) {
            parts.add(space());
            parts.add(link.elseKeyword()
                          .map(keyword -> sequence(keyword, space()))
                          .orElse(empty()));
            parts.add(compactIf(links, index + 1, finalElse));
        } else {
            finalElse.ifPresent(elseLink -> parts.add(sequence(space(), elseLink.keyword(), space(), elseLink.body())));
        }
        return wrapLink(link, index, sequence(parts));
    }

    private Layout expandedIf(List<IfLink> links, int index, Optional<ElseLink> finalElse) {
        var link = links.get(index);
        var parts = new ArrayList<Layout>();
        parts.add(sequence(link.keyword(), space(), link.condition(), space(), link.then()));
        parts.add(indented(sequence(newline(), link.thenBranch())));
        if (index + 1 < links.size()) {
            parts.add(newline());
            parts.add(link.elseKeyword()
                          .map(keyword -> sequence(keyword, space()))
                          .orElse(empty()));
            parts.add(expandedIf(links, index + 1, finalElse));
        } else {
            finalElse.ifPresent(elseLink -> parts.add(sequence(newline(),
                                                               elseLink.keyword(),
                                                               indented(sequence(newline(), elseLink.body())))));
        }
        return wrapLink(link, index, sequence(parts));
    }

    @Override
    public Layout visitLetOrUse(Expr.LetOrUse node) {
        return atCurrentColumn(sequence(bindings(node.use()
                                                 ? "use"
                                                 : "let",
                                                 node.recursive(),
                                                 node.bindings()),
                                        newline(),
                                        render(node.body())));
    }

    @Override
    public Layout visitSequential(Expr.Sequential node) {
        return atCurrentColumn(sequence(render(node.first()), newline(), render(node.second())));
    }

    @Override
    public Layout visitForEach(Expr.ForEach node) {
        return atCurrentColumn(sequence(text("for "),
                                        render(node.pattern()),
                                        text(" in "),
                                        render(node.enumerable()),
                                        text(" do"),
                                        indented(sequence(newline(), render(node.body())))));
    }

    @Override
    public Layout visitWhile(Expr.While node) {
        return atCurrentColumn(sequence(text("while "),
                                        render(node.condition()),
                                        text(" do"),
                                        indented(sequence(newline(), render(node.body())))));
    }

    @Override
    public Layout visitTryWith(Expr.TryWith node) {
        return atCurrentColumn(sequence(token(node.tryKeyword(), "try"),
                                        indented(sequence(newline(), render(node.body()))),
                                        newline(),
                                        token(node.with(), "with"),
                                        clauses(node.clauses())));
    }

    @Override
    public Layout visitTryFinally(Expr.TryFinally node) {
        return atCurrentColumn(sequence(token(node.tryKeyword(), "try"),
                                        indented(sequence(newline(), render(node.body()))),
                                        newline(),
                                        token(node.finallyKeyword(), "finally"),
                                        indented(sequence(newline(), render(node.finallyBody())))));
    }

    // ===== Patterns =====

    @Override
    public Layout visitPatWild(Pat.Wild node) {
        return text("_");
    }

    @Override
    public Layout visitPatNamed(Pat.Named node) {
        return text(node.name());
    }

    @Override
    public Layout visitPatConst(Pat.Const node) {
        return TriviaPrinter.literal(Anchor.of(node),
                                     node.value()
                                         .canonicalText());
    }

    @Override
    public Layout visitPatNull(Pat.Null node) {
        return text("null");
    }

    @Override
    public Layout visitPatLongIdent(Pat.LongIdent node) {
        var args = node.args();
        if (args.size() == 1 && args.get(0) instanceof Pat.Paren paren && Character.isUpperCase(
                lastSegment(node.name()).charAt(0))) {
            // Some(bar) becomes Some bar, a tuple or nested constructor keeps its parentheses
            return isSingleName(paren.inner())
                   ? sequence(text(node.name()), space(), unlessTrivia(paren, paren.lparen(), paren.rparen(),
                                                                       paren.inner()))
                   : sequence(text(node.name()), space(), render(paren));
        }
        return sequence(text(node.name()), space(), join(space(), renderAll(args)));
    }

    private static boolean isSingleName(Pat pattern) {
        return pattern instanceof Pat.Named || pattern instanceof Pat.Wild;
    }

    /**
     * Renders the inner node without its parentheses, unless a comment is attached to the node or to one
     * of the parentheses.
     */
    private Layout unlessTrivia(SyntaxNode paren, TokenRef lparen, TokenRef rparen, SyntaxNode inner) {
        return context -> {
            var trivia = context.trivia();
            var keep = trivia.contains(Anchor.of(paren)) || trivia.contains(Anchor.of(lparen))
                       || trivia.contains(Anchor.of(rparen));
            return render(keep
                          ? paren
                          : inner).apply(context);
        };
    }

    private static String lastSegment(String name) {
        return name.substring(name.lastIndexOf('.') + 1);
    }

    @Override
    public Layout visitPatParen(Pat.Paren node) {
        return sequence(token(node.lparen(), "("), render(node.inner()), token(node.rparen(), ")"));
    }

    @Override
    public Layout visitPatTuple(Pat.Tuple node) {
        return join(text(", "), renderAll(node.items()));
    }

    @Override
    public Layout visitPatTyped(Pat.Typed node) {
        return sequence(render(node.pattern()), colon(), render(node.type()));
    }

    @Override
    public Layout visitPatArrayOrList(Pat.ArrayOrList node) {
        var open = token(node.open(),
                         node.array()
                         ? "[|"
                         : "[");
        var close = token(node.close(),
                          node.array()
                          ? "|]"
                          : "]");
        if (node.items()
                .isEmpty()) {
            return sequence(open, spaceBeforeComment(node.close()), close);
        }
        return sequence(open, delimiterSpace(), join(text("; "), renderAll(node.items())), delimiterSpace(), close);
    }

    @Override
    public Layout visitPatCons(Pat.Cons node) {
        return sequence(render(node.head()), text(" :: "), render(node.tail()));
    }

    @Override
    public Layout visitPatOr(Pat.Or node) {
        return tryCompact(compactOr(node), expandedOr(node), config.maxLineLength());
    }

    private Layout compactOr(Pat.Or node) {
        return sequence(orOperand(node.left(), this::compactOr), text(" | "), render(node.right()));
    }

    /**
     * One alternative per line, each {@code |} inside the alternative's trivia so comments between
     * alternatives stay above the bar.
     */
    private Layout expandedOr(Pat.Or node) {
        var right = node.right();
        return sequence(orOperand(node.left(), this::expandedOr),
                        newline(),
                        TriviaPrinter.around(Anchor.of(right), sequence(text("| "), right.accept(this))));
    }

    private Layout orOperand(Pat pattern, Function<Pat.Or, Layout> nested) {
        return pattern instanceof Pat.Or or
               ? TriviaPrinter.around(Anchor.of(or), nested.apply(or))
               : render(pattern);
    }

    // ===== Types =====

    @Override
    public Layout visitTypeLongIdent(SynType.LongIdent node) {
        return text(node.name());
    }

    @Override
    public Layout visitTypeVar(SynType.Var node) {
        return text(node.name());
    }

    @Override
    public Layout visitTypeApp(SynType.App node) {
        var type = render(node.type());
        var args = renderAll(node.args());
        if (node.postfix()) {
            return sequence(join(space(), args), space(), type);
        }
        return sequence(type, text("<"), join(text(", "), args), text(">"));
    }

    @Override
    public Layout visitTypeFun(SynType.Fun node) {
        return sequence(render(node.argument()), text(" -> "), render(node.result()));
    }

    @Override
    public Layout visitTypeTuple(SynType.Tuple node) {
        return join(text(" * "), renderAll(node.items()));
    }

    @Override
    public Layout visitTypeArray(SynType.Array node) {
        return sequence(render(node.element()), text("[]"));
    }

    @Override
    public Layout visitTypeParen(SynType.Paren node) {
        return sequence(text("("), render(node.inner()), text(")"));
    }
}
