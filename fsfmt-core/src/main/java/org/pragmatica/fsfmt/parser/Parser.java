package org.pragmatica.fsfmt.parser;

import org.pragmatica.fsfmt.format.FormattingError;
import org.pragmatica.fsfmt.syntax.Attribute;
import org.pragmatica.fsfmt.syntax.AttributeList;
import org.pragmatica.fsfmt.syntax.Binding;
import org.pragmatica.fsfmt.syntax.ConstValue;
import org.pragmatica.fsfmt.syntax.Expr;
import org.pragmatica.fsfmt.syntax.FieldDecl;
import org.pragmatica.fsfmt.syntax.MatchClause;
import org.pragmatica.fsfmt.syntax.ModuleDecl;
import org.pragmatica.fsfmt.syntax.ModuleOrNamespace;
import org.pragmatica.fsfmt.syntax.ParsedFile;
import org.pragmatica.fsfmt.syntax.Pat;
import org.pragmatica.fsfmt.syntax.RecordFieldExpr;
import org.pragmatica.fsfmt.syntax.SourceRange;
import org.pragmatica.fsfmt.syntax.SynType;
import org.pragmatica.fsfmt.syntax.Token;
import org.pragmatica.fsfmt.syntax.TokenKind;
import org.pragmatica.fsfmt.syntax.TokenRef;
import org.pragmatica.fsfmt.syntax.TypeDefn;
import org.pragmatica.fsfmt.syntax.UnionCase;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import static org.pragmatica.fsfmt.syntax.TokenKind.*;

/**
 * Recursive-descent parser over significant tokens, applying the offside rule.
 * <p>
 * Every construct that opens a context (a binding body, a branch, an element) remembers the
 * column of its first token. A token that starts a line at or left of that column ends the
 * construct, except infix operators, which may be undented by their own width plus one.
 */
public final class Parser {
    private static final Set<TokenKind> ATOM_START = EnumSet.of(IDENT,
                                                                INT,
                                                                FLOAT,
                                                                STRING,
                                                                CHAR,
                                                                TRUE,
                                                                FALSE,
                                                                NULL,
                                                                LPAREN,
                                                                LBRACK,
                                                                LBRACK_BAR,
                                                                LBRACE,
                                                                LPAREN_HASH);
    private static final Set<TokenKind> KEYWORD_EXPR_START = EnumSet.of(IF,
                                                                        MATCH,
                                                                        FUN,
                                                                        FUNCTION,
                                                                        LET,
                                                                        USE,
                                                                        TRY,
                                                                        FOR,
                                                                        WHILE,
                                                                        LAZY,
                                                                        ASSERT,
                                                                        YIELD,
                                                                        RETURN);
    private static final Set<TokenKind> PAT_START = EnumSet.of(UNDERSCORE,
                                                               IDENT,
                                                               INT,
                                                               FLOAT,
                                                               STRING,
                                                               CHAR,
                                                               TRUE,
                                                               FALSE,
                                                               NULL,
                                                               LPAREN,
                                                               LBRACK,
                                                               LBRACK_BAR);

    private final List<Token> tokens;
    private boolean[] lineStarts;
    private int index;
    private int limit = -1;

    private Parser(List<Token> tokens) {
        this.tokens = new ArrayList<>(tokens);
        this.lineStarts = new boolean[tokens.size()];
        for (var i = 0; i < tokens.size(); i++) {
            lineStarts[i] = i == 0 || tokens.get(i)
                                           .line() > tokens.get(i - 1)
                                                           .range()
                                                           .endLine();
        }
    }

    /**
     * Parse significant tokens (ending with {@link TokenKind#EOF}) into a file tree.
     */
    public static ParsedFile parse(List<Token> significantTokens) {
        return new Parser(significantTokens).parseFile();
    }

    // ===== File and declarations =====

    private ParsedFile parseFile() {
        var modules = new ArrayList<ModuleOrNamespace>();
        if (at(NAMESPACE)) {
            while (at(NAMESPACE)) {
                modules.add(parseHeaderedModule(ModuleOrNamespace.Kind.NAMESPACE));
            }
        } else if (at(MODULE) && isModuleHeader()) {
            modules.add(parseHeaderedModule(ModuleOrNamespace.Kind.NAMED_MODULE));
        } else {
            var decls = parseDecls(peek().column());
            var range = decls.isEmpty()
                        ? SourceRange.point(1, 0)
                        : decls.get(0)
                               .range()
                               .union(decls.get(decls.size() - 1)
                                           .range());
            modules.add(new ModuleOrNamespace(ModuleOrNamespace.Kind.ANONYMOUS_MODULE,
                                              Optional.empty(),
                                              Optional.empty(),
                                              "",
                                              false,
                                              decls,
                                              range));
        }
        if (!at(EOF)) {
            throw error(peek(), "unexpected " + describe(peek()));
        }
        var end = peek().range();
        return new ParsedFile(modules, new SourceRange(1, 0, end.endLine(), end.endColumn()));
    }

    /**
     * A {@code module} keyword at file start is a header unless its name is followed by {@code =}.
     */
    private boolean isModuleHeader() {
        var i = index + 1;
        if (tokens.get(i)
                  .is(REC)) {
            i++;
        }
        while (tokens.get(i)
                     .is(IDENT) || tokens.get(i)
                                         .is(DOT)) {
            i++;
        }
        return !tokens.get(i)
                      .is(EQUALS);
    }

    private ModuleOrNamespace parseHeaderedModule(ModuleOrNamespace.Kind kind) {
        var keyword = advance();
        var recursive = accept(REC).isPresent();
        var nameStart = peek();
        var name = parseLongIdent();
        var nameRef = new TokenRef(IDENT, nameStart.range()
                                                   .union(previous().range()));
        List<ModuleDecl> decls = at(EOF) || at(NAMESPACE)
                                 ? List.of()
                                 : parseDecls(peek().column());
        var range = keyword.range()
                           .union(decls.isEmpty()
                                  ? nameRef.range()
                                  : decls.get(decls.size() - 1)
                                         .range());
        return new ModuleOrNamespace(kind,
                                     Optional.of(keyword.ref()),
                                     Optional.of(nameRef),
                                     name,
                                     recursive,
                                     decls,
                                     range);
    }

    private List<ModuleDecl> parseDecls(int column) {
        var decls = new ArrayList<ModuleDecl>();
        while (!at(EOF) && !at(NAMESPACE) && peek().column() == column && (decls.isEmpty() || isLineStart())) {
            decls.add(parseDecl());
        }
        if (!at(EOF) && !at(NAMESPACE) && peek().column() > column && isLineStart()) {
            throw error(peek(), "unexpected indentation");
        }
        return decls;
    }

    private ModuleDecl parseDecl() {
        var start = peek();
        var attributes = parseAttributeLists();

        if (at(LET)) {
            return parseLetDecl(start, attributes);
        }
        if (at(TYPE)) {
            return parseTypes(start, attributes);
        }
        if (!attributes.isEmpty()) {
            throw error(peek(), "expected let or type after attributes");
        }
        return switch (peek().kind()) {
            case OPEN -> {
                advance();
                var name = parseLongIdent();
                yield new ModuleDecl.Open(name, rangeFrom(start));
            }
            case MODULE -> parseNestedModule();
            case HASH_DIRECTIVE -> {
                var token = advance();
                yield new ModuleDecl.HashDirective(token.text(), token.range());
            }
            default -> {
                var expr = withLimit(peek().column(), this::parseExpr);
                yield new ModuleDecl.DoExpr(expr, expr.range());
            }
        };
    }

    private List<AttributeList> parseAttributeLists() {
        var lists = new ArrayList<AttributeList>();
        while (at(LBRACK_LESS)) {
            var open = advance();
            var attributes = new ArrayList<Attribute>();
            do {
                var nameToken = peek();
                var name = parseLongIdent();
                Optional<Expr> argument = at(LPAREN) && adjacent()
                                          ? Optional.of(parseAtom())
                                          : Optional.empty();
                attributes.add(new Attribute(name, argument, rangeFrom(nameToken)));
            } while (accept(SEMICOLON).isPresent());
            expect(GREATER_RBRACK, "'>]'");
            lists.add(new AttributeList(attributes, rangeFrom(open)));
        }
        return lists;
    }

    private ModuleDecl parseLetDecl(Token start, List<AttributeList> attributes) {
        var letColumn = peek().column();
        advance();
        var recursive = accept(REC).isPresent();
        var bindings = parseBindings();
        if (at(IN)) {
            advance();
            var body = parseBlock();
            var expr = new Expr.LetOrUse(false, recursive, bindings, body, rangeFrom(start));
            return new ModuleDecl.DoExpr(expr, expr.range());
        }
        if (attributes.isEmpty() && isLineStart() && peek().column() > letColumn) {
            throw error(peek(), "unexpected indentation");
        }
        return new ModuleDecl.Let(attributes, recursive, bindings, rangeFrom(start));
    }

    private List<Binding> parseBindings() {
        var bindings = new ArrayList<Binding>();
        bindings.add(parseBinding());
        while (at(AND)) {
            advance();
            bindings.add(parseBinding());
        }
        return bindings;
    }

    private Binding parseBinding() {
        var start = peek();
        var mutable = accept(MUTABLE).isPresent();
        var inline = accept(INLINE).isPresent();
        var head = withLimit(-1, this::parsePattern);
        Optional<SynType> returnType = accept(COLON).isPresent()
                                       ? Optional.of(parseType())
                                       : Optional.empty();
        var equals = expect(EQUALS, "'='");
        var body = parseBlock();
        return new Binding(mutable, inline, head, returnType, equals.ref(), body, rangeFrom(start));
    }

    private ModuleDecl parseNestedModule() {
        var start = advance();
        var recursive = accept(REC).isPresent();
        var name = parseLongIdent();
        var equals = expect(EQUALS, "'='");
        if (!isLineStart() || peek().column() <= start.column()) {
            throw error(peek(), "module body must start on an indented line");
        }
        var decls = parseDecls(peek().column());
        return new ModuleDecl.NestedModule(name, recursive, equals.ref(), decls, rangeFrom(start));
    }

    // ===== Type definitions =====

    private ModuleDecl parseTypes(Token start, List<AttributeList> attributes) {
        advance();
        var definitions = new ArrayList<TypeDefn>();
        definitions.add(parseTypeDefn());
        while (at(AND)) {
            advance();
            definitions.add(parseTypeDefn());
        }
        return new ModuleDecl.Types(attributes, definitions, rangeFrom(start));
    }

    private TypeDefn parseTypeDefn() {
        var start = peek();
        var name = expect(IDENT, "type name").text();
        var typeParameters = new ArrayList<String>();
        if (peek().isOperator("<")) {
            advance();
            do {
                typeParameters.add(expect(TYPE_VAR, "type parameter").text());
            } while (accept(COMMA).isPresent());
            expectCloseAngle();
        }
        var equals = expect(EQUALS, "'='").ref();

        if (at(LBRACE)) {
            var lbrace = advance();
            var fields = new ArrayList<FieldDecl>();
            var fieldColumn = peek().column();
            while (!at(RBRACE)) {
                fields.add(parseRecordFieldDecl());
                if (accept(SEMICOLON).isEmpty() && !(isLineStart() && peek().column() == fieldColumn)) {
                    break;
                }
            }
            var rbrace = expect(RBRACE, "'}'");
            return new TypeDefn.RecordType(name,
                                           typeParameters,
                                           equals,
                                           lbrace.ref(),
                                           fields,
                                           rbrace.ref(),
                                           rangeFrom(start));
        }
        if (isUnionRepresentation()) {
            var cases = new ArrayList<UnionCase>();
            do {
                cases.add(parseUnionCase());
            } while (at(BAR));
            return new TypeDefn.UnionType(name, typeParameters, equals, cases, rangeFrom(start));
        }
        var type = parseType();
        return new TypeDefn.Abbreviation(name, typeParameters, equals, type, rangeFrom(start));
    }

    private boolean isUnionRepresentation() {
        if (at(BAR)) {
            return true;
        }
        if (!at(IDENT)) {
            return false;
        }
        var next = tokens.get(index + 1);
        return next.is(OF) || next.is(BAR);
    }

    private FieldDecl parseRecordFieldDecl() {
        var start = peek();
        var mutable = accept(MUTABLE).isPresent();
        var name = expect(IDENT, "field name").text();
        expect(COLON, "':'");
        var type = parseType();
        return new FieldDecl(mutable, Optional.of(name), type, rangeFrom(start));
    }

    private UnionCase parseUnionCase() {
        var start = peek();
        var bar = accept(BAR).map(Token::ref);
        var name = expect(IDENT, "union case name").text();
        var fields = new ArrayList<FieldDecl>();
        if (accept(OF).isPresent()) {
            fields.add(parseUnionField());
            while (peek().isOperator("*")) {
                advance();
                fields.add(parseUnionField());
            }
        }
        return new UnionCase(bar, name, fields, rangeFrom(start));
    }

    private FieldDecl parseUnionField() {
        var start = peek();
        Optional<String> name = Optional.empty();
        if (at(IDENT) && tokens.get(index + 1)
                               .is(COLON)) {
            name = Optional.of(advance().text());
            advance();
        }
        var type = parsePostfixType();
        return new FieldDecl(false, name, type, rangeFrom(start));
    }

    // ===== Expressions =====

    /**
     * Parse an expression that opens a new offside context at its first token.
     */
    private Expr parseBlock() {
        var column = peek().column();
        return withLimit(column, () -> parseSequential(column));
    }

    private Expr parseSequential(int column) {
        if (at(LET) || at(USE)) {
            return parseLetOrUse(column);
        }
        var first = parseExpr();
        if (at(SEMICOLON) && !closesSequence(tokens.get(index + 1))) {
            advance();
            var second = parseSequential(column);
            return new Expr.Sequential(first, second, first.range()
                                                           .union(second.range()));
        }
        if (isLineStart() && peek().column() == column && canStartExpr(peek())) {
            var second = parseSequential(column);
            return new Expr.Sequential(first, second, first.range()
                                                           .union(second.range()));
        }
        return first;
    }

    private static boolean closesSequence(Token token) {
        return token.is(RPAREN) || token.is(RBRACE) || token.is(RBRACK) || token.is(BAR_RBRACK) || token.is(EOF);
    }

    private Expr parseLetOrUse(int column) {
        var start = advance();
        var use = start.is(USE);
        var recursive = accept(REC).isPresent();
        var bindings = parseBindings();
        Expr body;
        if (accept(IN).isPresent()) {
            body = parseBlock();
        } else if (isLineStart() && peek().column() == column && canStartExpr(peek())) {
            body = parseSequential(column);
        } else {
            throw error(peek(), "the block following this 'let' is unfinished");
        }
        return new Expr.LetOrUse(use, recursive, bindings, body, start.range()
                                                                      .union(body.range()));
    }

    /**
     * Tuple-level expression without sequencing.
     */
    private Expr parseExpr() {
        var first = parseInfix(0);
        if (!at(COMMA)) {
            return first;
        }
        var items = new ArrayList<Expr>();
        var commas = new ArrayList<TokenRef>();
        items.add(first);
        while (at(COMMA)) {
            commas.add(advance().ref());
            items.add(parseInfix(0));
        }
        return new Expr.Tuple(items, commas, first.range()
                                          .union(items.get(items.size() - 1)
                                                      .range()));
    }

    private Expr parseInfix(int minPrecedence) {
        var left = parsePrefix();
        while (true) {
            var operator = peek();
            var text = infixOperatorText(operator);
            if (text == null || (isLineStart() && operator.column() < limit - text.length() - 1)) {
                return left;
            }
            var precedence = Operators.precedence(text);
            if (precedence < minPrecedence) {
                return left;
            }
            advance();
            var right = parseInfix(Operators.isRightAssociative(text)
                                   ? precedence
                                   : precedence + 1);
            left = new Expr.Infix(text, operator.range(), left, right, left.range()
                                                                           .union(right.range()));
        }
    }

    private static String infixOperatorText(Token token) {
        return switch (token.kind()) {
            case EQUALS, COLON_COLON, DOT_DOT -> token.text();
            case OPERATOR -> Operators.isPrefixOnly(token.text()) || Operators.isTypeOperator(token.text())
                             ? null
                             : token.text();
            default -> null;
        };
    }

    private Expr parsePrefix() {
        var token = peek();
        if (token.is(OPERATOR) && Operators.isPrefix(token.text())) {
            advance();
            var operand = parsePrefix();
            return new Expr.Prefix(token.text(), operand, token.range()
                                                               .union(operand.range()));
        }
        return parseApp();
    }

    private Expr parseApp() {
        if (KEYWORD_EXPR_START.contains(peek().kind())) {
            return parseKeywordExpr();
        }
        var function = parsePostfixAtom();
        var args = new ArrayList<Expr>();
        while (ATOM_START.contains(peek().kind()) && !offside()) {
            args.add(parsePostfixAtom());
        }
        if (args.isEmpty()) {
            return function;
        }
        return new Expr.App(function, args, false, function.range()
                                                           .union(args.get(args.size() - 1)
                                                                      .range()));
    }

    /**
     * Atom followed by member access and high-precedence applications such as {@code f(x).Length}.
     */
    private Expr parsePostfixAtom() {
        var expr = parseAtom();
        while (true) {
            if (at(DOT) && adjacent() && tokens.get(index + 1)
                                               .is(IDENT)) {
                advance();
                var member = parseLongIdent();
                expr = new Expr.DotGet(expr, member, expr.range()
                                                         .union(previous().range()));
            } else if (at(LPAREN) && adjacent() && isApplicable(expr)) {
                var argument = parseAtom();
                expr = new Expr.App(expr, List.of(argument), true, expr.range()
                                                                       .union(argument.range()));
            } else {
                return expr;
            }
        }
    }

    private static boolean isApplicable(Expr expr) {
        return expr instanceof Expr.Ident || expr instanceof Expr.DotGet || expr instanceof Expr.App app && app.highPrecedence();
    }

    private Expr parseAtom() {
        var token = peek();
        return switch (token.kind()) {
            case INT, FLOAT, STRING, CHAR, TRUE, FALSE -> {
                advance();
                yield new Expr.Const(Literals.constValue(token), token.range());
            }
            case NULL -> {
                advance();
                yield new Expr.Null(token.range());
            }
            case IDENT -> {
                var name = parseLongIdent();
                yield new Expr.Ident(name, rangeFrom(token));
            }
            case LPAREN -> parseParen();
            case LBRACK, LBRACK_BAR -> parseArrayOrList();
            case LBRACE -> parseBrace();
            case LPAREN_HASH -> {
                advance();
                yield new Expr.InlineIL(token.text(), token.range());
            }
            default -> throw error(token, "unexpected " + describe(token) + " in expression");
        };
    }

    private Expr parseParen() {
        var lparen = advance();
        if (at(RPAREN)) {
            var rparen = advance();
            return new Expr.Const(new ConstValue.Unit(), lparen.range()
                                                              .union(rparen.range()));
        }
        if (at(OPERATOR) && tokens.get(index + 1)
                                  .is(RPAREN)) {
            var operator = advance();
            advance();
            return new Expr.Ident("(" + operator.text() + ")", rangeFrom(lparen));
        }
        var inner = parseBlock();
        if (accept(COLON).isPresent()) {
            var type = parseType();
            inner = new Expr.Typed(inner, type, inner.range()
                                                     .union(type.range()));
        }
        var rparen = expect(RPAREN, "')'");
        return new Expr.Paren(lparen.ref(), inner, rparen.ref(), rangeFrom(lparen));
    }

    private Expr parseArrayOrList() {
        var open = advance();
        var array = open.is(LBRACK_BAR);
        var closeKind = array
                        ? BAR_RBRACK
                        : RBRACK;
        var items = new ArrayList<Expr>();
        if (!at(closeKind)) {
            items.add(parseElement());
            while (true) {
                if (accept(SEMICOLON).isPresent()) {
                    if (at(closeKind)) {
                        break;
                    }
                    items.add(parseElement());
                } else if (!at(closeKind) && isLineStart() && canStartExpr(peek())) {
                    items.add(parseElement());
                } else {
                    break;
                }
            }
        }
        var close = expect(closeKind, array
                                      ? "'|]'"
                                      : "']'");
        return new Expr.ArrayOrList(array, open.ref(), items, close.ref(), rangeFrom(open));
    }

    /**
     * Collection element or record field value: a new context without sequencing.
     */
    private Expr parseElement() {
        return withLimit(peek().column(), this::parseExpr);
    }

    private Expr parseBrace() {
        var lbrace = advance();
        if (at(IDENT) && isRecordStart()) {
            Optional<Expr> copyFrom = Optional.empty();
            if (!tokens.get(afterLongIdent())
                       .is(EQUALS)) {
                var source = peek();
                copyFrom = Optional.of(new Expr.Ident(parseLongIdent(), rangeFrom(source)));
                expect(WITH, "'with'");
            }
            var fields = new ArrayList<RecordFieldExpr>();
            var fieldColumn = peek().column();
            while (at(IDENT)) {
                var nameToken = peek();
                var name = parseLongIdent();
                var equals = expect(EQUALS, "'='");
                var value = parseElement();
                fields.add(new RecordFieldExpr(name, equals.ref(), value, rangeFrom(nameToken)));
                if (accept(SEMICOLON).isEmpty() && !(isLineStart() && peek().column() == fieldColumn)) {
                    break;
                }
            }
            var rbrace = expect(RBRACE, "'}'");
            return new Expr.RecordExpr(lbrace.ref(), copyFrom, fields, rbrace.ref(), rangeFrom(lbrace));
        }
        var body = parseBlock();
        var rbrace = expect(RBRACE, "'}'");
        return new Expr.Computation(lbrace.ref(), body, rbrace.ref(), rangeFrom(lbrace));
    }

    private boolean isRecordStart() {
        var next = tokens.get(afterLongIdent());
        return next.is(EQUALS) || next.is(WITH);
    }

    private int afterLongIdent() {
        var i = index + 1;
        while (tokens.get(i)
                     .is(DOT) && tokens.get(i + 1)
                                       .is(IDENT)) {
            i += 2;
        }
        return i;
    }

    // ===== Keyword expressions =====

    private Expr parseKeywordExpr() {
        var token = peek();
        return switch (token.kind()) {
            case IF -> parseIf(token.column());
            case MATCH -> parseMatch();
            case FUN -> parseLambda();
            case FUNCTION -> {
                advance();
                var clauses = parseClauses();
                yield new Expr.MatchLambda(token.ref(), clauses, rangeFrom(token));
            }
            case LET, USE -> parseLetOrUse(token.column());
            case TRY -> parseTry();
            case FOR -> parseForEach();
            case WHILE -> {
                advance();
                var condition = parseElement();
                expect(DO, "'do'");
                var body = parseBlock();
                yield new Expr.While(condition, body, rangeFrom(token));
            }
            default -> {
                advance();
                var operand = parseExpr();
                yield new Expr.KeywordApp(token.text(), operand, rangeFrom(token));
            }
        };
    }

    private Expr parseIf(int alignColumn) {
        var ifKeyword = advance();
        var condition = parseElement();
        var then = expect(THEN, "'then'");
        var thenBranch = parseBlock();
        Optional<TokenRef> elseKeyword = Optional.empty();
        Optional<Expr> elseBranch = Optional.empty();

        if (at(ELIF) && continuesConditional(alignColumn)) {
            elseBranch = Optional.of(parseIf(peek().column()));
        } else if (at(ELSE) && continuesConditional(alignColumn)) {
            var elseToken = advance();
            elseKeyword = Optional.of(elseToken.ref());
            elseBranch = Optional.of(at(IF) && peek().line() == elseToken.line()
                                     ? parseIf(elseToken.column())
                                     : parseBlock());
        }
        return new Expr.IfThenElse(ifKeyword.ref(),
                                   condition,
                                   then.ref(),
                                   thenBranch,
                                   elseKeyword,
                                   elseBranch,
                                   rangeFrom(ifKeyword));
    }

    private boolean continuesConditional(int alignColumn) {
        return !isLineStart() || peek().column() >= alignColumn;
    }

    private Expr parseMatch() {
        var match = advance();
        var subject = parseElement();
        var with = expect(WITH, "'with'");
        var clauses = parseClauses();
        return new Expr.Match(match.ref(), subject, with.ref(), clauses, rangeFrom(match));
    }

    private List<MatchClause> parseClauses() {
        var clauses = new ArrayList<MatchClause>();
        var alignColumn = peek().column();
        while (true) {
            if (!clauses.isEmpty() && (!at(BAR) || (isLineStart() && peek().column() < alignColumn))) {
                return clauses;
            }
            var start = peek();
            var bar = accept(BAR).map(Token::ref);
            var pattern = withLimit(-1, this::parsePattern);
            Optional<Expr> guard = accept(WHEN).isPresent()
                                   ? Optional.of(parseElement())
                                   : Optional.empty();
            var arrow = expect(RARROW, "'->'");
            var body = parseBlock();
            clauses.add(new MatchClause(bar, pattern, guard, arrow.ref(), body, rangeFrom(start)));
        }
    }

    private Expr parseLambda() {
        var fun = advance();
        var parameters = new ArrayList<Pat>();
        while (!at(RARROW)) {
            parameters.add(parseAtomicPattern());
        }
        var arrow = advance();
        var body = parseBlock();
        return new Expr.Lambda(fun.ref(), parameters, arrow.ref(), body, rangeFrom(fun));
    }

    private Expr parseTry() {
        var tryKeyword = advance();
        var body = parseBlock();
        if (at(FINALLY)) {
            var finallyKeyword = advance();
            var finallyBody = parseBlock();
            return new Expr.TryFinally(tryKeyword.ref(), body, finallyKeyword.ref(), finallyBody, rangeFrom(tryKeyword));
        }
        var with = expect(WITH, "'with' or 'finally'");
        var clauses = parseClauses();
        return new Expr.TryWith(tryKeyword.ref(), body, with.ref(), clauses, rangeFrom(tryKeyword));
    }

    private Expr parseForEach() {
        var forKeyword = advance();
        var pattern = withLimit(-1, this::parsePattern);
        expect(IN, "'in'");
        var enumerable = parseElement();
        expect(DO, "'do'");
        var body = parseBlock();
        return new Expr.ForEach(pattern, enumerable, body, rangeFrom(forKeyword));
    }

    private boolean canStartExpr(Token token) {
        return ATOM_START.contains(token.kind()) || KEYWORD_EXPR_START.contains(token.kind())
               || (token.is(OPERATOR) && Operators.isPrefix(token.text()));
    }

    // ===== Patterns =====

    private Pat parsePattern() {
        var left = parseTuplePattern();
        while (at(BAR)) {
            advance();
            var right = parseTuplePattern();
            left = new Pat.Or(left, right, left.range()
                                               .union(right.range()));
        }
        return left;
    }

    private Pat parseTuplePattern() {
        var first = parseConsPattern();
        if (!at(COMMA)) {
            return first;
        }
        var items = new ArrayList<Pat>();
        items.add(first);
        while (accept(COMMA).isPresent()) {
            items.add(parseConsPattern());
        }
        return new Pat.Tuple(items, first.range()
                                         .union(items.get(items.size() - 1)
                                                     .range()));
    }

    private Pat parseConsPattern() {
        var head = parseAppPattern();
        if (!at(COLON_COLON)) {
            return head;
        }
        advance();
        var tail = parseConsPattern();
        return new Pat.Cons(head, tail, head.range()
                                            .union(tail.range()));
    }

    private Pat parseAppPattern() {
        if (!at(IDENT)) {
            return parseAtomicPattern();
        }
        var start = peek();
        var name = parseLongIdent();
        var args = new ArrayList<Pat>();
        while (PAT_START.contains(peek().kind())) {
            args.add(parseAtomicPattern());
        }
        if (args.isEmpty()) {
            return new Pat.Named(name, rangeFrom(start));
        }
        return new Pat.LongIdent(name, args, rangeFrom(start));
    }

    private Pat parseAtomicPattern() {
        var token = peek();
        return switch (token.kind()) {
            case UNDERSCORE -> {
                advance();
                yield new Pat.Wild(token.range());
            }
            case IDENT -> {
                var name = parseLongIdent();
                yield new Pat.Named(name, rangeFrom(token));
            }
            case INT, FLOAT, STRING, CHAR, TRUE, FALSE -> {
                advance();
                yield new Pat.Const(Literals.constValue(token), token.range());
            }
            case NULL -> {
                advance();
                yield new Pat.Null(token.range());
            }
            case LPAREN -> parseParenPattern();
            case LBRACK, LBRACK_BAR -> parseListPattern();
            default -> throw error(token, "unexpected " + describe(token) + " in pattern");
        };
    }

    private Pat parseParenPattern() {
        var lparen = advance();
        if (at(RPAREN)) {
            var rparen = advance();
            return new Pat.Const(new ConstValue.Unit(), lparen.range()
                                                             .union(rparen.range()));
        }
        var inner = parsePattern();
        if (accept(COLON).isPresent()) {
            var type = parseType();
            inner = new Pat.Typed(inner, type, inner.range()
                                                    .union(type.range()));
        }
        var rparen = expect(RPAREN, "')'");
        return new Pat.Paren(lparen.ref(), inner, rparen.ref(), rangeFrom(lparen));
    }

    private Pat parseListPattern() {
        var open = advance();
        var array = open.is(LBRACK_BAR);
        var closeKind = array
                        ? BAR_RBRACK
                        : RBRACK;
        var items = new ArrayList<Pat>();
        while (!at(closeKind)) {
            items.add(parsePattern());
            if (accept(SEMICOLON).isEmpty()) {
                break;
            }
        }
        var close = expect(closeKind, array
                                      ? "'|]'"
                                      : "']'");
        return new Pat.ArrayOrList(array, open.ref(), items, close.ref(), rangeFrom(open));
    }

    // ===== Types =====

    private SynType parseType() {
        var argument = parseTupleType();
        if (!at(RARROW)) {
            return argument;
        }
        advance();
        var result = parseType();
        return new SynType.Fun(argument, result, argument.range()
                                                         .union(result.range()));
    }

    private SynType parseTupleType() {
        var first = parsePostfixType();
        if (!peek().isOperator("*")) {
            return first;
        }
        var items = new ArrayList<SynType>();
        items.add(first);
        while (peek().isOperator("*")) {
            advance();
            items.add(parsePostfixType());
        }
        return new SynType.Tuple(items, first.range()
                                             .union(items.get(items.size() - 1)
                                                         .range()));
    }

    private SynType parsePostfixType() {
        var type = parseAtomicType();
        while (true) {
            if (at(IDENT) && peek().line() == previous().range()
                                                        .endLine()) {
                var start = peek();
                var name = new SynType.LongIdent(parseLongIdent(), rangeFrom(start));
                type = new SynType.App(name, List.of(type), true, type.range()
                                                                      .union(name.range()));
            } else if (at(LBRACK) && adjacent() && tokens.get(index + 1)
                                                         .is(RBRACK)) {
                advance();
                advance();
                type = new SynType.Array(type, type.range()
                                                   .union(previous().range()));
            } else {
                return type;
            }
        }
    }

    private SynType parseAtomicType() {
        var token = peek();
        SynType type = switch (token.kind()) {
            case TYPE_VAR -> {
                advance();
                yield new SynType.Var(token.text(), token.range());
            }
            case IDENT -> new SynType.LongIdent(parseLongIdent(), rangeFrom(token));
            case UNDERSCORE -> {
                advance();
                yield new SynType.LongIdent("_", token.range());
            }
            case LPAREN -> {
                advance();
                var inner = parseType();
                expect(RPAREN, "')'");
                yield new SynType.Paren(inner, rangeFrom(token));
            }
            default -> throw error(token, "unexpected " + describe(token) + " in type");
        };
        if (peek().isOperator("<") && adjacent()) {
            advance();
            var args = new ArrayList<SynType>();
            do {
                args.add(parseType());
            } while (accept(COMMA).isPresent());
            expectCloseAngle();
            type = new SynType.App(type, args, false, rangeFrom(token));
        }
        return type;
    }

    /**
     * Consume one {@code >}, splitting operator tokens such as {@code >>} produced by nested generics.
     */
    private void expectCloseAngle() {
        var token = peek();
        if (!token.is(OPERATOR) || !token.text()
                                         .startsWith(">")) {
            throw error(token, "expected '>' but found " + describe(token));
        }
        if (token.text()
                 .length() == 1) {
            advance();
            return;
        }
        var range = token.range();
        var consumed = Token.token(OPERATOR,
                                   new SourceRange(range.startLine(),
                                                   range.startColumn(),
                                                   range.startLine(),
                                                   range.startColumn() + 1),
                                   ">");
        var rest = Token.token(OPERATOR,
                               new SourceRange(range.startLine(),
                                               range.startColumn() + 1,
                                               range.endLine(),
                                               range.endColumn()),
                               token.text()
                                    .substring(1));
        tokens.set(index, rest);
        tokens.add(index, consumed);
        shiftLineStarts();
        advance();
    }

    private void shiftLineStarts() {
        // token list grew by one at the current index; the inserted token shares its line with the rest
        var copy = new boolean[tokens.size()];
        System.arraycopy(lineStarts, 0, copy, 0, index + 1);
        System.arraycopy(lineStarts, index, copy, index + 1, lineStarts.length - index);
        copy[index + 1] = false;
        lineStarts = copy;
    }

    // ===== Token helpers =====

    private String parseLongIdent() {
        var builder = new StringBuilder(expect(IDENT, "identifier").text());
        while (at(DOT) && adjacent() && tokens.get(index + 1)
                                              .is(IDENT) && tokens.get(index + 1)
                                                                  .range()
                                                                  .startColumn() == peek().range()
                                                                                          .endColumn()) {
            advance();
            builder.append('.')
                   .append(advance().text());
        }
        return builder.toString();
    }

    private <T> T withLimit(int newLimit, Supplier<T> parser) {
        var saved = limit;
        limit = newLimit;
        try {
            return parser.get();
        } finally {
            limit = saved;
        }
    }

    private boolean offside() {
        return isLineStart() && peek().column() <= limit;
    }

    private boolean isLineStart() {
        return lineStarts[index];
    }

    /**
     * True when the current token starts exactly where the previous one ended.
     */
    private boolean adjacent() {
        if (index == 0) {
            return false;
        }
        var previousEnd = tokens.get(index - 1)
                                .range();
        var current = peek().range();
        return previousEnd.endLine() == current.startLine() && previousEnd.endColumn() == current.startColumn();
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(Math.max(0, index - 1));
    }

    private boolean at(TokenKind kind) {
        return peek().is(kind);
    }

    private Token advance() {
        var token = peek();
        if (!token.is(EOF)) {
            index++;
        }
        return token;
    }

    private Optional<Token> accept(TokenKind kind) {
        return at(kind)
               ? Optional.of(advance())
               : Optional.empty();
    }

    private Token expect(TokenKind kind, String description) {
        if (!at(kind)) {
            throw error(peek(), "expected " + description + " but found " + describe(peek()));
        }
        return advance();
    }

    private SourceRange rangeFrom(Token start) {
        return start.range()
                    .union(previous().range());
    }

    private static String describe(Token token) {
        return token.is(EOF)
               ? "end of input"
               : "'" + token.text() + "'";
    }

    private static RuntimeException error(Token token, String detail) {
        return FormattingError.inputParseError(token.range(), detail)
                              .exception();
    }
}
