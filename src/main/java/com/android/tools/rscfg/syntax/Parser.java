// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.android.tools.rscfg.errors.SyntaxError;
import com.android.tools.rscfg.syntax.Token.Kind;
import com.android.tools.rscfg.utils.Timing;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser for the subset of Rust that the control flow graph builder handles.
 *
 * <p>Items other than functions are skipped, and so are items nested in function bodies. Types,
 * generics, macro arguments and attributes are only skipped over; the parser keeps just enough of
 * them to record the source text of each element.
 */
public final class Parser {

  private static final Set<String> ITEM_KEYWORDS =
      ImmutableSet.of(
          "fn", "struct", "enum", "union", "trait", "impl", "mod", "use", "const", "static",
          "type", "extern", "pub", "macro_rules", "async");

  private final String text;
  private final List<Token> tokens;
  private int position = 0;

  // Set while parsing the head of `if`, `while`, `match` and `for`, where `x {` starts the body.
  private boolean noStructLiteral = false;

  private Parser(String text) {
    this.text = text;
    this.tokens = Lexer.tokenize(text);
  }

  public static SourceFile parseFile(String text) {
    return parseFile(text, Timing.empty());
  }

  public static SourceFile parseFile(String text, Timing timing) {
    return timing.time(
        "Parse",
        () -> {
          SourceFile file = new Parser(text).parseFile();
          NeverTypeResolver.resolve(file);
          return file;
        });
  }

  private SourceFile parseFile() {
    List<FunctionDecl> functions = new ArrayList<>();
    while (peek().kind != Kind.EOF) {
      if (at("#")) {
        skipAttribute();
        continue;
      }
      int start = peek().startOffset;
      skipFunctionQualifiers();
      if (at("fn")) {
        functions.add(parseFunction(start));
      } else {
        skipItem();
      }
    }
    return new SourceFile(text, functions);
  }

  private void skipFunctionQualifiers() {
    while (true) {
      if (at("pub")) {
        advance();
        if (at("(")) {
          skipBalanced();
        }
      } else if (at("const") || at("async") || at("unsafe")) {
        if (!peek(1).is("fn") && !isFunctionQualifier(peek(1))) {
          return;
        }
        advance();
      } else if (at("extern") && peek(1).kind == Kind.STRING) {
        advance();
        advance();
      } else {
        return;
      }
    }
  }

  private static boolean isFunctionQualifier(Token token) {
    return token.is("const")
        || token.is("async")
        || token.is("unsafe")
        || token.is("extern")
        || token.is("pub");
  }

  private FunctionDecl parseFunction(int start) {
    expect("fn");
    String name = expectIdentifier().text;
    if (at("<")) {
      skipGenerics();
    }
    if (!at("(")) {
      throw error("Expected '(' after function name");
    }
    skipBalanced();
    String returnTypeText = null;
    if (at("->")) {
      advance();
      int typeStart = peek().startOffset;
      parseType();
      returnTypeText = text.substring(typeStart, lastEndOffset());
    }
    while (!at("{") && !at(";")) {
      if (peek().kind == Kind.EOF) {
        throw error("Unterminated function declaration");
      }
      // Where clauses.
      advance();
    }
    Block body = null;
    if (at(";")) {
      advance();
    } else {
      body = parseBlock();
    }
    return new FunctionDecl(rangeFrom(start), name, returnTypeText, body);
  }

  private void skipItem() {
    if (peek().kind == Kind.EOF) {
      return;
    }
    // Skip tokens until a `;` or a brace delimited body at the item level.
    while (peek().kind != Kind.EOF) {
      if (at(";")) {
        advance();
        return;
      }
      if (at("{")) {
        skipBalanced();
        if (at(";")) {
          advance();
        }
        return;
      }
      if (at("(") || at("[")) {
        skipBalanced();
      } else {
        advance();
      }
    }
  }

  private void skipAttribute() {
    expect("#");
    if (at("!")) {
      advance();
    }
    if (!at("[")) {
      throw error("Expected '[' in attribute");
    }
    skipBalanced();
  }

  // Statements.

  private Block parseBlock() {
    int start = expect("{").startOffset;
    boolean savedNoStructLiteral = noStructLiteral;
    noStructLiteral = false;
    List<Stmt> stmts = new ArrayList<>();
    Expr tailExpr = null;
    while (!at("}")) {
      if (peek().kind == Kind.EOF) {
        throw error("Unterminated block");
      }
      if (tailExpr != null) {
        throw error("Expected '}' after the trailing expression of a block");
      }
      if (at(";")) {
        advance();
        continue;
      }
      if (at("#")) {
        skipAttribute();
        continue;
      }
      if (at("let")) {
        stmts.add(parseLetDecl());
        continue;
      }
      if (atNestedItem()) {
        skipFunctionQualifiers();
        skipItem();
        continue;
      }
      int exprStart = peek().startOffset;
      Expr expr = atBlockLikeExprStart() ? parsePrimary() : parseExpr();
      if (at(";")) {
        advance();
        stmts.add(new ExprStmt(rangeFrom(exprStart), expr, true));
      } else if (at("}")) {
        tailExpr = expr;
      } else if (expr.isBlockLike()) {
        stmts.add(new ExprStmt(rangeFrom(exprStart), expr, false));
      } else {
        throw error("Expected ';' or '}' after expression");
      }
    }
    expect("}");
    noStructLiteral = savedNoStructLiteral;
    return new Block(rangeFrom(start), stmts, tailExpr);
  }

  private boolean atNestedItem() {
    Token token = peek();
    if (!token.isIdentifier() || !ITEM_KEYWORDS.contains(token.text)) {
      return false;
    }
    // `unsafe { .. }`, `async { .. }` and `const { .. }` blocks are expressions.
    if (peek(1).is("{") || peek(1).is("move")) {
      return false;
    }
    return !token.is("macro_rules") || peek(1).is("!");
  }

  private LetDecl parseLetDecl() {
    int start = expect("let").startOffset;
    Pat pat = parsePat();
    String typeText = null;
    if (at(":")) {
      advance();
      int typeStart = peek().startOffset;
      parseType();
      typeText = text.substring(typeStart, lastEndOffset());
    }
    Expr initializer = null;
    Block elseBlock = null;
    if (at("=")) {
      advance();
      initializer = parseExpr();
      if (at("else")) {
        advance();
        elseBlock = parseBlock();
      }
    }
    expect(";");
    return new LetDecl(rangeFrom(start), pat, typeText, initializer, elseBlock);
  }

  // Expressions.

  private Expr parseExpr() {
    return parseAssignment();
  }

  private Expr parseAssignment() {
    int start = peek().startOffset;
    Expr left = parseRange();
    if (peek().kind == Kind.PUNCTUATION && BinaryExpr.isAssignmentOperator(peek().text)) {
      String operator = advance().text;
      Expr right = parseAssignment();
      return new BinaryExpr(rangeFrom(start), operator, left, right);
    }
    return left;
  }

  private Expr parseRange() {
    int start = peek().startOffset;
    Expr left = atRangeOperator() ? null : parseBinary(1);
    if (!atRangeOperator()) {
      return left;
    }
    String operator = advance().text;
    Expr right = canStartExpression() ? parseBinary(1) : null;
    return new RangeExpr(rangeFrom(start), left, operator, right);
  }

  private static int binaryPrecedence(Token token) {
    if (token.kind != Kind.PUNCTUATION) {
      return -1;
    }
    switch (token.text) {
      case "||":
        return 1;
      case "&&":
        return 2;
      case "==":
      case "!=":
      case "<":
      case ">":
      case "<=":
      case ">=":
        return 3;
      case "|":
        return 4;
      case "^":
        return 5;
      case "&":
        return 6;
      case "<<":
      case ">>":
        return 7;
      case "+":
      case "-":
        return 8;
      case "*":
      case "/":
      case "%":
        return 9;
      default:
        return -1;
    }
  }

  private static final int CAST_PRECEDENCE = 10;

  private Expr parseBinary(int minPrecedence) {
    int start = peek().startOffset;
    Expr left = parseUnary();
    while (true) {
      Token operator = peek();
      if (operator.is("as")) {
        if (CAST_PRECEDENCE < minPrecedence) {
          return left;
        }
        advance();
        int typeStart = peek().startOffset;
        parseType();
        left = new CastExpr(rangeFrom(start), left, text.substring(typeStart, lastEndOffset()));
        continue;
      }
      int precedence = binaryPrecedence(operator);
      if (precedence < minPrecedence) {
        return left;
      }
      advance();
      Expr right = parseBinary(precedence + 1);
      left = new BinaryExpr(rangeFrom(start), operator.text, left, right);
    }
  }

  private Expr parseUnary() {
    int start = peek().startOffset;
    if (at("-") || at("!") || at("*")) {
      String operator = advance().text;
      Expr operand = parseUnary();
      return new UnaryExpr(rangeFrom(start), operator, operand);
    }
    if (at("&") || at("&&")) {
      boolean isDoubleReference = at("&&");
      advance();
      String operator = "&";
      if (at("mut")) {
        advance();
        operator = "&mut";
      }
      Expr operand = parseUnary();
      if (isDoubleReference) {
        Expr inner =
            new UnaryExpr(new SourceRange(text, start + 1, lastEndOffset()), operator, operand);
        return new UnaryExpr(rangeFrom(start), "&", inner);
      }
      return new UnaryExpr(rangeFrom(start), operator, operand);
    }
    return parsePostfix();
  }

  private Expr parsePostfix() {
    int start = peek().startOffset;
    Expr expr = parsePrimary();
    while (true) {
      if (at("?")) {
        advance();
        expr = new TryExpr(rangeFrom(start), expr);
      } else if (at("(")) {
        List<Expr> arguments = parseParenthesizedExprList();
        expr = new CallExpr(rangeFrom(start), expr, arguments);
      } else if (at("[")) {
        advance();
        boolean savedNoStructLiteral = noStructLiteral;
        noStructLiteral = false;
        Expr index = parseExpr();
        noStructLiteral = savedNoStructLiteral;
        expect("]");
        expr = new IndexExpr(rangeFrom(start), expr, index);
      } else if (at(".")) {
        advance();
        Token name = advance();
        if (name.kind != Kind.IDENTIFIER
            && name.kind != Kind.INTEGER
            && name.kind != Kind.FLOAT) {
          throw new SyntaxError("Expected field or method name", name.startOffset);
        }
        if (at("::")) {
          advance();
          skipGenerics();
        }
        if (at("(")) {
          List<Expr> arguments = parseParenthesizedExprList();
          expr = new MethodCallExpr(rangeFrom(start), expr, name.text, arguments);
        } else {
          expr = new FieldExpr(rangeFrom(start), expr, name.text);
        }
      } else {
        return expr;
      }
    }
  }

  private List<Expr> parseParenthesizedExprList() {
    expect("(");
    boolean savedNoStructLiteral = noStructLiteral;
    noStructLiteral = false;
    List<Expr> exprs = new ArrayList<>();
    while (!at(")")) {
      exprs.add(parseExpr());
      if (!at(",")) {
        break;
      }
      advance();
    }
    expect(")");
    noStructLiteral = savedNoStructLiteral;
    return exprs;
  }

  private Expr parsePrimary() {
    Token token = peek();
    int start = token.startOffset;
    if (token.isLiteral()) {
      advance();
      return new LitExpr(rangeFrom(start));
    }
    if (token.kind == Kind.LIFETIME && peek(1).is(":")) {
      String label = advance().text;
      advance();
      return parseLabeled(start, label);
    }
    if (at("(")) {
      return parseParenOrTuple(start);
    }
    if (at("[")) {
      return parseArray(start);
    }
    if (at("{")) {
      Block block = parseBlock();
      return new BlockExpr(rangeFrom(start), null, block);
    }
    if ((at("unsafe") || at("async") || at("const")) && peek(1).is("{")) {
      advance();
      Block block = parseBlock();
      return new BlockExpr(rangeFrom(start), null, block);
    }
    if (at("if")) {
      return parseIf();
    }
    if (at("match")) {
      return parseMatch();
    }
    if (at("loop") || at("while") || at("for")) {
      return parseLoop(start, null);
    }
    if (at("return")) {
      advance();
      Expr value = canStartExpression() ? parseExpr() : null;
      return new ReturnExpr(rangeFrom(start), value);
    }
    if (at("break")) {
      advance();
      String label = peek().kind == Kind.LIFETIME ? advance().text : null;
      Expr value = canStartExpression() ? parseExpr() : null;
      return new BreakExpr(rangeFrom(start), label, value);
    }
    if (at("continue")) {
      advance();
      String label = peek().kind == Kind.LIFETIME ? advance().text : null;
      return new ContinueExpr(rangeFrom(start), label);
    }
    if (at("|") || at("||") || at("move")) {
      return parseLambda(start);
    }
    if (token.isIdentifier() || at("::") || at("<")) {
      return parsePathBasedExpr(start);
    }
    throw error("Expected expression");
  }

  private Expr parseLabeled(int start, String label) {
    if (at("{")) {
      Block block = parseBlock();
      return new BlockExpr(rangeFrom(start), label, block);
    }
    if (at("loop") || at("while") || at("for")) {
      return parseLoop(start, label);
    }
    throw error("Expected loop or block after label " + label);
  }

  private Expr parseParenOrTuple(int start) {
    expect("(");
    boolean savedNoStructLiteral = noStructLiteral;
    noStructLiteral = false;
    try {
      if (at(")")) {
        advance();
        return new TupleExpr(rangeFrom(start), ImmutableList.of());
      }
      Expr first = parseExpr();
      if (at(")")) {
        advance();
        return new ParenExpr(rangeFrom(start), first);
      }
      List<Expr> elements = new ArrayList<>();
      elements.add(first);
      while (at(",")) {
        advance();
        if (at(")")) {
          break;
        }
        elements.add(parseExpr());
      }
      expect(")");
      return new TupleExpr(rangeFrom(start), elements);
    } finally {
      noStructLiteral = savedNoStructLiteral;
    }
  }

  private Expr parseArray(int start) {
    expect("[");
    boolean savedNoStructLiteral = noStructLiteral;
    noStructLiteral = false;
    try {
      List<Expr> elements = new ArrayList<>();
      if (at("]")) {
        advance();
        return new ArrayExpr(rangeFrom(start), elements, false);
      }
      elements.add(parseExpr());
      if (at(";")) {
        advance();
        elements.add(parseExpr());
        expect("]");
        return new ArrayExpr(rangeFrom(start), elements, true);
      }
      while (at(",")) {
        advance();
        if (at("]")) {
          break;
        }
        elements.add(parseExpr());
      }
      expect("]");
      return new ArrayExpr(rangeFrom(start), elements, false);
    } finally {
      noStructLiteral = savedNoStructLiteral;
    }
  }

  private IfExpr parseIf() {
    int start = expect("if").startOffset;
    Condition condition = parseCondition();
    Block thenBranch = parseBlock();
    Block elseBlock = null;
    IfExpr elseIf = null;
    if (at("else")) {
      advance();
      if (at("if")) {
        elseIf = parseIf();
      } else {
        elseBlock = parseBlock();
      }
    }
    return new IfExpr(rangeFrom(start), condition, thenBranch, elseBlock, elseIf);
  }

  private Condition parseCondition() {
    List<Pat> pats = ImmutableList.of();
    if (at("let")) {
      advance();
      pats = parseOrPatterns();
      expect("=");
    }
    Expr expr = parseExprWithoutStructLiteral();
    return new Condition(pats, expr);
  }

  private Expr parseExprWithoutStructLiteral() {
    boolean savedNoStructLiteral = noStructLiteral;
    noStructLiteral = true;
    Expr expr = parseExpr();
    noStructLiteral = savedNoStructLiteral;
    return expr;
  }

  private MatchExpr parseMatch() {
    int start = expect("match").startOffset;
    Expr discriminant = parseExprWithoutStructLiteral();
    expect("{");
    boolean savedNoStructLiteral = noStructLiteral;
    noStructLiteral = false;
    List<MatchArm> arms = new ArrayList<>();
    while (!at("}")) {
      if (at("#")) {
        skipAttribute();
        continue;
      }
      List<Pat> pats = parseOrPatterns();
      MatchArmGuard guard = null;
      if (at("if")) {
        int guardStart = advance().startOffset;
        Expr condition = parseExpr();
        guard = new MatchArmGuard(rangeFrom(guardStart), condition);
      }
      expect("=>");
      Expr body = atBlockLikeExprStart() ? parsePrimary() : parseExpr();
      arms.add(new MatchArm(pats, guard, body));
      if (at(",")) {
        advance();
      } else if (!at("}") && !body.isBlockLike()) {
        throw error("Expected ',' after match arm");
      }
    }
    expect("}");
    noStructLiteral = savedNoStructLiteral;
    return new MatchExpr(rangeFrom(start), discriminant, arms);
  }

  private LooplikeExpr parseLoop(int start, String label) {
    if (at("loop")) {
      advance();
      Block body = parseBlock();
      return new LoopExpr(rangeFrom(start), label, body);
    }
    if (at("while")) {
      advance();
      Condition condition = parseCondition();
      Block body = parseBlock();
      return new WhileExpr(rangeFrom(start), label, condition, body);
    }
    expect("for");
    Pat pat = parsePat();
    expect("in");
    Expr iterable = parseExprWithoutStructLiteral();
    Block body = parseBlock();
    return new ForExpr(rangeFrom(start), label, pat, iterable, body);
  }

  private LambdaExpr parseLambda(int start) {
    if (at("move")) {
      advance();
    }
    if (at("||")) {
      advance();
    } else {
      expect("|");
      while (!at("|")) {
        parsePat();
        if (at(":")) {
          advance();
          parseType();
        }
        if (!at(",")) {
          break;
        }
        advance();
      }
      expect("|");
    }
    Expr body;
    if (at("->")) {
      advance();
      parseType();
      int bodyStart = peek().startOffset;
      Block block = parseBlock();
      body = new BlockExpr(rangeFrom(bodyStart), null, block);
    } else {
      body = parseExpr();
    }
    return new LambdaExpr(rangeFrom(start), body);
  }

  private Expr parsePathBasedExpr(int start) {
    parsePath();
    String path = text.substring(start, lastEndOffset());
    if (at("!")) {
      advance();
      Token open = peek();
      if (!open.is("(") && !open.is("[") && !open.is("{")) {
        throw error("Expected macro arguments");
      }
      skipBalanced();
      return new MacroExpr(rangeFrom(start), path, open.text.charAt(0));
    }
    if (at("{") && !noStructLiteral) {
      return parseStructLiteral(start, path);
    }
    return new PathExpr(rangeFrom(start));
  }

  private StructLiteralExpr parseStructLiteral(int start, String path) {
    expect("{");
    List<StructLiteralExpr.Field> fields = new ArrayList<>();
    Expr base = null;
    while (!at("}")) {
      if (at("..")) {
        advance();
        base = parseExpr();
        break;
      }
      Token name = advance();
      if (name.kind != Kind.IDENTIFIER && name.kind != Kind.INTEGER) {
        throw new SyntaxError("Expected field name", name.startOffset);
      }
      Expr value = null;
      if (at(":")) {
        advance();
        value = parseExpr();
      }
      fields.add(new StructLiteralExpr.Field(name.text, value));
      if (!at(",")) {
        break;
      }
      advance();
    }
    expect("}");
    return new StructLiteralExpr(rangeFrom(start), path, fields, base);
  }

  private void parsePath() {
    if (at("<")) {
      // Qualified path, e.g. <T as Trait>::f.
      skipGenerics();
    }
    if (at("::")) {
      advance();
    }
    expectIdentifier();
    while (at("::")) {
      advance();
      if (at("<")) {
        skipGenerics();
      } else {
        expectIdentifier();
      }
    }
  }

  // Patterns.

  private List<Pat> parseOrPatterns() {
    if (at("|")) {
      advance();
    }
    List<Pat> pats = new ArrayList<>();
    pats.add(parsePat());
    while (at("|")) {
      advance();
      pats.add(parsePat());
    }
    return pats;
  }

  private Pat parsePat() {
    Token token = peek();
    int start = token.startOffset;
    if (at("_")) {
      advance();
      return new PatWild(rangeFrom(start));
    }
    if (at("..")) {
      advance();
      return new PatRest(rangeFrom(start));
    }
    if (at("&") || at("&&")) {
      advance();
      if (at("mut")) {
        advance();
      }
      Pat pat = parsePat();
      return new PatRef(rangeFrom(start), pat);
    }
    if (at("(")) {
      List<Pat> pats = parseDelimitedPatterns("(", ")");
      return new PatTup(rangeFrom(start), pats);
    }
    if (at("[")) {
      List<Pat> pats = parseDelimitedPatterns("[", "]");
      return new PatSlice(rangeFrom(start), pats);
    }
    if (token.isLiteral() || (at("-") && isNumber(peek(1)))) {
      if (at("-")) {
        advance();
      }
      advance();
      return parseRangePatternRest(start);
    }
    if (at("ref") || at("mut")) {
      return parsePatIdent(start);
    }
    if (token.isIdentifier() || at("::") || at("<")) {
      Token next = peek(1);
      boolean isSimpleName =
          token.isIdentifier()
              && !next.is("::")
              && !next.is("(")
              && !next.is("{")
              && !next.is("!")
              && !isRangeOperator(next);
      if (isSimpleName) {
        return parsePatIdent(start);
      }
      parsePath();
      String path = text.substring(start, lastEndOffset());
      if (at("(")) {
        List<Pat> pats = parseDelimitedPatterns("(", ")");
        return new PatTupleStruct(rangeFrom(start), path, pats);
      }
      if (at("{")) {
        return parsePatStruct(start, path);
      }
      if (at("!")) {
        advance();
        skipBalanced();
        return new PatConst(rangeFrom(start));
      }
      return parseRangePatternRest(start);
    }
    throw error("Expected pattern");
  }

  private Pat parseRangePatternRest(int start) {
    if (!atRangeOperator()) {
      return new PatConst(rangeFrom(start));
    }
    advance();
    if (at("-")) {
      advance();
    }
    if (peek().isLiteral()) {
      advance();
    } else if (peek().isIdentifier() || at("::")) {
      parsePath();
    }
    return new PatRange(rangeFrom(start));
  }

  private List<Pat> parseDelimitedPatterns(String open, String close) {
    expect(open);
    List<Pat> pats = new ArrayList<>();
    while (!at(close)) {
      pats.add(parsePat());
      if (!at(",")) {
        break;
      }
      advance();
    }
    expect(close);
    return pats;
  }

  private PatIdent parsePatIdent(int start) {
    PatBinding binding = parsePatBinding(start);
    Pat subPat = null;
    if (at("@")) {
      advance();
      subPat = parsePat();
    }
    return new PatIdent(rangeFrom(start), binding, subPat);
  }

  private PatBinding parsePatBinding(int start) {
    boolean isRef = false;
    boolean isMutable = false;
    if (at("ref")) {
      advance();
      isRef = true;
    }
    if (at("mut")) {
      advance();
      isMutable = true;
    }
    String name = expectIdentifier().text;
    return new PatBinding(rangeFrom(start), name, isMutable, isRef);
  }

  private PatStruct parsePatStruct(int start, String path) {
    expect("{");
    List<PatStruct.Field> fields = new ArrayList<>();
    boolean hasRest = false;
    while (!at("}")) {
      if (at("..")) {
        advance();
        hasRest = true;
        break;
      }
      int fieldStart = peek().startOffset;
      if (peek(1).is(":")) {
        String name = advance().text;
        advance();
        fields.add(new PatStruct.Field(name, parsePat(), null));
      } else {
        PatBinding binding = parsePatBinding(fieldStart);
        fields.add(new PatStruct.Field(binding.getName(), null, binding));
      }
      if (!at(",")) {
        break;
      }
      advance();
    }
    expect("}");
    return new PatStruct(rangeFrom(start), path, fields, hasRest);
  }

  // Types.

  private void parseType() {
    if (at("!") || at("_")) {
      advance();
      return;
    }
    if (at("&") || at("&&")) {
      advance();
      if (peek().kind == Kind.LIFETIME) {
        advance();
      }
      if (at("mut")) {
        advance();
      }
      parseType();
      return;
    }
    if (at("*")) {
      advance();
      if (at("const") || at("mut")) {
        advance();
      }
      parseType();
      return;
    }
    if (at("(")) {
      advance();
      while (!at(")")) {
        parseType();
        if (!at(",")) {
          break;
        }
        advance();
      }
      expect(")");
      return;
    }
    if (at("[")) {
      advance();
      parseType();
      if (at(";")) {
        advance();
        parseExpr();
      }
      expect("]");
      return;
    }
    if (at("fn") || at("unsafe") || at("extern")) {
      while (!at("fn")) {
        advance();
      }
      advance();
      skipBalanced();
      if (at("->")) {
        advance();
        parseType();
      }
      return;
    }
    if (at("impl") || at("dyn")) {
      advance();
      parseTypeBound();
      while (at("+")) {
        advance();
        parseTypeBound();
      }
      return;
    }
    parseTypePath();
  }

  private void parseTypeBound() {
    if (peek().kind == Kind.LIFETIME) {
      advance();
      return;
    }
    if (at("?")) {
      advance();
    }
    parseTypePath();
  }

  private void parseTypePath() {
    if (at("<")) {
      skipGenerics();
    }
    if (at("::")) {
      advance();
    }
    expectIdentifier();
    while (true) {
      if (at("<")) {
        skipGenerics();
      } else if (at("::")) {
        advance();
        if (at("<")) {
          skipGenerics();
        } else {
          expectIdentifier();
        }
      } else if (at("(")) {
        // Fn(A, B) -> C sugar.
        skipBalanced();
        if (at("->")) {
          advance();
          parseType();
        }
        return;
      } else {
        return;
      }
    }
  }

  // Token helpers.

  private void skipGenerics() {
    int depth = 0;
    do {
      Token token = advance();
      if (token.kind == Kind.EOF) {
        throw new SyntaxError("Unterminated generic arguments", token.startOffset);
      }
      if (token.kind == Kind.PUNCTUATION) {
        switch (token.text) {
          case "<":
            depth++;
            break;
          case "<<":
            depth += 2;
            break;
          case ">":
            depth--;
            break;
          case ">>":
            depth -= 2;
            break;
          default:
            break;
        }
      }
    } while (depth > 0);
  }

  /** Skips a parenthesized, bracketed or braced token tree, including its delimiters. */
  private void skipBalanced() {
    int depth = 0;
    do {
      Token token = advance();
      if (token.kind == Kind.EOF) {
        throw new SyntaxError("Unbalanced delimiters", token.startOffset);
      }
      if (token.is("(") || token.is("[") || token.is("{")) {
        depth++;
      } else if (token.is(")") || token.is("]") || token.is("}")) {
        depth--;
      }
    } while (depth > 0);
  }

  private boolean atBlockLikeExprStart() {
    Token token = peek();
    if (token.kind == Kind.LIFETIME) {
      return peek(1).is(":");
    }
    return at("if")
        || at("match")
        || at("while")
        || at("loop")
        || at("for")
        || at("{")
        || ((at("unsafe") || at("async") || at("const")) && peek(1).is("{"));
  }

  private boolean canStartExpression() {
    Token token = peek();
    switch (token.kind) {
      case EOF:
        return false;
      case IDENTIFIER:
        return !token.is("else") && !token.is("as") && !token.is("in");
      case PUNCTUATION:
        if (token.is("{")) {
          return !noStructLiteral;
        }
        return token.is("(")
            || token.is("[")
            || token.is("-")
            || token.is("!")
            || token.is("*")
            || token.is("&")
            || token.is("&&")
            || token.is("|")
            || token.is("||")
            || token.is("..")
            || token.is("::")
            || token.is("<");
      default:
        return true;
    }
  }

  private boolean atRangeOperator() {
    return isRangeOperator(peek());
  }

  private static boolean isRangeOperator(Token token) {
    return token.is("..") || token.is("..=") || token.is("...");
  }

  private static boolean isNumber(Token token) {
    return token.kind == Kind.INTEGER || token.kind == Kind.FLOAT;
  }

  private Token peek() {
    return tokens.get(position);
  }

  private Token peek(int distance) {
    return tokens.get(Math.min(position + distance, tokens.size() - 1));
  }

  private boolean at(String text) {
    return peek().is(text);
  }

  private Token advance() {
    Token token = peek();
    if (token.kind != Kind.EOF) {
      position++;
    }
    return token;
  }

  private Token expect(String expected) {
    if (!at(expected)) {
      throw error("Expected '" + expected + "'");
    }
    return advance();
  }

  private Token expectIdentifier() {
    if (!peek().isIdentifier()) {
      throw error("Expected identifier");
    }
    return advance();
  }

  private int lastEndOffset() {
    return position == 0 ? 0 : tokens.get(position - 1).endOffset;
  }

  private SourceRange rangeFrom(int startOffset) {
    return new SourceRange(text, startOffset, lastEndOffset());
  }

  private SyntaxError error(String message) {
    return new SyntaxError(message + " but found " + peek(), peek().startOffset);
  }
}
