/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package cloak.frontend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import cloak.ast.Identifier;
import cloak.ast.Node;
import cloak.ast.decl.SourceUnit;
import cloak.ast.expr.CallArgumentList;
import cloak.ast.expr.Expression;
import cloak.ast.expr.FunctionCallExpr;
import cloak.ast.expr.LocationExpr;
import cloak.ast.expr.TupleOrLocationExpr;
import cloak.ast.stmt.Block;
import cloak.ast.stmt.Statement;
import cloak.common.exceptions.UserException;
import cloak.common.lang.AnnotatedTypeName;
import cloak.common.lang.Types.TypeName;

/**
 * Recursive descent parser for the part of the language the tests use.
 * Builds every node through {@link NodeFactory}.
 *
 * The fragment kind is picked from the text: source units and
 * definitions by their keyword, otherwise a statement, or an expression
 * if the text has no terminating semicolon.
 */
public class FragmentParser implements FrontEnd {

  private static final Set<String> MULTI_CHAR_PUNCT = new HashSet<String>(
      Arrays.asList("=>", "**", "==", "!=", "<=", ">=", "&&", "||", "<<",
                    ">>", "++", "--", "+=", "-=", "*=", "/=", "%=", "|=",
                    "&=", "^="));

  private static final Set<String> NUMBER_UNITS = new HashSet<String>(
      Arrays.asList("wei", "gwei", "ether", "seconds", "minutes", "hours",
                    "days", "weeks"));

  private static final Set<String> FUNCTION_KEYWORDS = new HashSet<String>(
      Arrays.asList("public", "private", "internal", "external", "pure",
                    "view", "payable", "virtual"));

  private static final Set<String> STATE_KEYWORDS = new HashSet<String>(
      Arrays.asList("public", "private", "internal", "constant",
                    "immutable"));

  private static final Set<String> STORAGE = new HashSet<String>(
      Arrays.asList("memory", "storage", "calldata"));

  private static enum Kind {
    IDENT,
    NUMBER,
    STRING,
    PUNCT,
    EOF,
  }

  private static class Token {
    final Kind kind;
    final String text;
    final int offset;
    final int line;
    final int column;

    Token(Kind kind, String text, int offset, int line, int column) {
      this.kind = kind;
      this.text = text;
      this.offset = offset;
      this.line = line;
      this.column = column;
    }

    @Override
    public String toString() {
      return kind == Kind.EOF ? "end of input" : "'" + text + "'";
    }
  }

  private String source;
  private List<Token> tokens;
  private int pos;

  @Override
  public Node parse(String code) throws UserException {
    this.source = code;
    this.tokens = tokenize(code);
    this.pos = 0;

    Node result;
    if (at("pragma") || at("contract") || at("interface") ||
        at("library")) {
      result = sourceUnitOrDefinition();
    } else if (at("function") || at("constructor") || at("fallback") ||
               at("receive")) {
      result = function();
    } else if (at("struct") || at("enum") || at("event") ||
               at("modifier")) {
      result = contractPart();
    } else {
      result = statementOrExpression();
    }
    if (peek().kind != Kind.EOF) {
      throw error("Unexpected " + peek() + " after fragment");
    }
    if (!(result instanceof SourceUnit)) {
      result.linkParents();
    }
    return result;
  }

  /* Tokens */

  private List<Token> tokenize(String s) throws UserException {
    List<Token> result = new ArrayList<Token>();
    int i = 0;
    int line = 1;
    int lineStart = 0;
    while (i < s.length()) {
      char c = s.charAt(i);
      if (c == '\n') {
        line++;
        lineStart = i + 1;
        i++;
      } else if (Character.isWhitespace(c)) {
        i++;
      } else if (s.startsWith("//", i)) {
        while (i < s.length() && s.charAt(i) != '\n') {
          i++;
        }
      } else if (s.startsWith("/*", i)) {
        int end = s.indexOf("*/", i + 2);
        if (end < 0) {
          throw new UserException("Unterminated comment at line " + line);
        }
        for (int j = i; j < end; j++) {
          if (s.charAt(j) == '\n') {
            line++;
            lineStart = j + 1;
          }
        }
        i = end + 2;
      } else if (Character.isLetter(c) || c == '_' || c == '$') {
        int start = i;
        while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) ||
               s.charAt(i) == '_' || s.charAt(i) == '$')) {
          i++;
        }
        result.add(new Token(Kind.IDENT, s.substring(start, i), start,
                             line, start - lineStart + 1));
      } else if (Character.isDigit(c)) {
        int start = i;
        while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) ||
               s.charAt(i) == '_' ||
               (s.charAt(i) == '.' && i + 1 < s.length() &&
                Character.isDigit(s.charAt(i + 1))))) {
          i++;
        }
        result.add(new Token(Kind.NUMBER, s.substring(start, i), start,
                             line, start - lineStart + 1));
      } else if (c == '\'' || c == '"') {
        int end = s.indexOf(c, i + 1);
        if (end < 0) {
          throw new UserException("Unterminated string at line " + line);
        }
        result.add(new Token(Kind.STRING, s.substring(i + 1, end), i,
                             line, i - lineStart + 1));
        i = end + 1;
      } else {
        String punct = String.valueOf(c);
        if (i + 1 < s.length() &&
            MULTI_CHAR_PUNCT.contains(s.substring(i, i + 2))) {
          punct = s.substring(i, i + 2);
        }
        result.add(new Token(Kind.PUNCT, punct, i, line,
                             i - lineStart + 1));
        i += punct.length();
      }
    }
    result.add(new Token(Kind.EOF, "", s.length(), line,
                         s.length() - lineStart + 1));
    return result;
  }

  private Token peek() {
    return tokens.get(pos);
  }

  private Token peek(int ahead) {
    return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
  }

  private boolean at(String text) {
    Token t = peek();
    return t.kind != Kind.EOF && t.kind != Kind.STRING &&
           t.text.equals(text);
  }

  private boolean atAhead(int ahead, String text) {
    Token t = peek(ahead);
    return t.kind != Kind.EOF && t.kind != Kind.STRING &&
           t.text.equals(text);
  }

  private boolean accept(String text) {
    if (at(text)) {
      pos++;
      return true;
    }
    return false;
  }

  private Token expect(String text) throws UserException {
    if (!at(text)) {
      throw error("Expected '" + text + "' but found " + peek());
    }
    return tokens.get(pos++);
  }

  private Token expectIdent() throws UserException {
    if (peek().kind != Kind.IDENT) {
      throw error("Expected identifier but found " + peek());
    }
    return tokens.get(pos++);
  }

  private UserException error(String msg) {
    Token t = peek();
    return new UserException(Diagnostics.positionPrefix(t.line, t.column) +
                             msg);
  }

  private static boolean isElementaryType(String name) {
    return name.equals("bool") || name.equals("string") ||
           name.equals("address") || name.matches("u?int[0-9]*") ||
           name.matches("bytes[0-9]*");
  }

  /* Node construction shorthands */

  private <T extends Node> T build(Class<T> cls, Production p, Token at,
                                   Object ... args) throws UserException {
    return NodeFactory.build(cls, p, at.line, at.column, args);
  }

  private Identifier identifier(Token t) throws UserException {
    return build(Identifier.class, Production.IDENTIFIER, t, t.text);
  }

  private Identifier identifier() throws UserException {
    return identifier(expectIdent());
  }

  /* Top level */

  private Node sourceUnitOrDefinition() throws UserException {
    Token start = peek();
    List<Node> units = new ArrayList<Node>();
    while (peek().kind != Kind.EOF) {
      if (at("pragma")) {
        Token kw = expect("pragma");
        String name = expectIdent().text;
        int versionStart = peek().offset;
        while (!at(";")) {
          if (peek().kind == Kind.EOF) {
            throw error("Unterminated pragma");
          }
          pos++;
        }
        String version = source.substring(versionStart, peek().offset).trim();
        expect(";");
        units.add(build(Node.class, Production.PRAGMA, kw, name, version));
      } else {
        units.add(namespace());
      }
    }
    if (units.size() == 1 && !start.text.equals("pragma")) {
      return units.get(0);
    }
    return build(Node.class, Production.SOURCE_UNIT, start, units, source);
  }

  private Node namespace() throws UserException {
    Token kw = peek();
    if (accept("contract")) {
      Identifier idf = identifier();
      expect("{");
      List<Node> parts = contractBody();
      return build(Node.class, Production.CONTRACT, kw, idf, parts);
    } else if (accept("library")) {
      Identifier idf = identifier();
      expect("{");
      return build(Node.class, Production.LIBRARY, kw, idf, contractBody());
    } else if (accept("interface")) {
      Identifier idf = identifier();
      List<Node> bases = new ArrayList<Node>();
      if (accept("is")) {
        do {
          Token b = peek();
          bases.add(build(Node.class, Production.INHERITANCE_SPECIFIER, b,
                          path(), null));
        } while (accept(","));
      }
      expect("{");
      return build(Node.class, Production.INTERFACE, kw, idf, bases,
                   contractBody());
    }
    throw error("Expected a contract, library or interface but found " +
                peek());
  }

  private List<Node> contractBody() throws UserException {
    List<Node> parts = new ArrayList<Node>();
    while (!accept("}")) {
      parts.add(contractPart());
    }
    return parts;
  }

  private Node contractPart() throws UserException {
    Token kw = peek();
    if (at("function") || at("constructor") || at("fallback") ||
        at("receive")) {
      return function();
    } else if (accept("struct")) {
      Identifier idf = identifier();
      expect("{");
      List<Node> members = new ArrayList<Node>();
      while (!accept("}")) {
        members.add(variableDeclaration());
        expect(";");
      }
      return build(Node.class, Production.STRUCT_DEFINITION, kw, idf,
                   members);
    } else if (accept("enum")) {
      Identifier idf = identifier();
      expect("{");
      List<Node> values = new ArrayList<Node>();
      if (!at("}")) {
        do {
          Token v = peek();
          values.add(build(Node.class, Production.ENUM_VALUE, v,
                           identifier()));
        } while (accept(","));
      }
      expect("}");
      return build(Node.class, Production.ENUM_DEFINITION, kw, idf, values);
    } else if (accept("event")) {
      Identifier idf = identifier();
      expect("(");
      List<Node> params = new ArrayList<Node>();
      if (!at(")")) {
        do {
          Token p = peek();
          AnnotatedTypeName t = annotatedType();
          boolean indexed = accept("indexed");
          Identifier name = peek().kind == Kind.IDENT ? identifier() : null;
          params.add(build(Node.class, Production.EVENT_PARAMETER, p, t,
                           indexed, name));
        } while (accept(","));
      }
      expect(")");
      boolean anonymous = accept("anonymous");
      expect(";");
      return build(Node.class, Production.EVENT_DEFINITION, kw, idf, params,
                   anonymous);
    } else if (accept("modifier")) {
      Identifier idf = identifier();
      List<Node> params = parameterList();
      boolean virtual = accept("virtual");
      Block body = at(";") ? null : block();
      if (body == null) {
        expect(";");
      }
      return build(Node.class, Production.MODIFIER_DEFINITION, kw, idf,
                   params, virtual, Collections.emptyList(), body);
    }
    return stateVariable();
  }

  private Node stateVariable() throws UserException {
    Token start = peek();
    List<String> keywords = new ArrayList<String>();
    if (accept("final")) {
      keywords.add("final");
    }
    AnnotatedTypeName type = annotatedType();
    while (STATE_KEYWORDS.contains(peek().text) && peek().kind == Kind.IDENT) {
      keywords.add(tokens.get(pos++).text);
    }
    Identifier idf = identifier();
    Expression init = null;
    if (accept("=")) {
      init = expression();
    }
    expect(";");
    if (keywords.contains("constant")) {
      return build(Node.class, Production.CONSTANT_VARIABLE, start, type, idf,
                   init);
    }
    return build(Node.class, Production.STATE_VARIABLE, start, type,
                 keywords, idf, init, null);
  }

  private Node function() throws UserException {
    Token kw = tokens.get(pos++);
    Identifier idf = null;
    if (kw.text.equals("function")) {
      idf = identifier();
    }
    List<Node> params = parameterList();
    List<Node> modifiers = new ArrayList<Node>();
    while (peek().kind == Kind.IDENT && !at("returns")) {
      Token m = tokens.get(pos++);
      if (FUNCTION_KEYWORDS.contains(m.text)) {
        modifiers.add(build(Node.class, Production.MODIFIER_KEYWORD, m,
                            m.text));
      } else if (m.text.equals("override")) {
        modifiers.add(build(Node.class, Production.OVERRIDE_SPECIFIER, m,
                            Collections.emptyList()));
      } else {
        CallArgumentList args = null;
        if (accept("(")) {
          args = callArguments(m);
        }
        modifiers.add(build(Node.class, Production.MODIFIER_INVOCATION, m,
                            Collections.singletonList(m.text), args));
      }
    }
    List<Node> returns = Collections.emptyList();
    if (accept("returns")) {
      returns = parameterList();
    }
    Block body = null;
    if (!accept(";")) {
      body = block();
    }
    return build(Node.class, Production.FUNCTION, kw, kw.text, idf, params,
                 modifiers, returns, body);
  }

  private List<Node> parameterList() throws UserException {
    expect("(");
    List<Node> params = new ArrayList<Node>();
    if (!at(")")) {
      do {
        Token p = peek();
        List<String> keywords = new ArrayList<String>();
        if (accept("final")) {
          keywords.add("final");
        }
        AnnotatedTypeName t = annotatedType();
        String storage = null;
        if (STORAGE.contains(peek().text)) {
          storage = tokens.get(pos++).text;
        }
        Identifier name = peek().kind == Kind.IDENT ? identifier() : null;
        params.add(build(Node.class, Production.PARAMETER, p, keywords, t,
                         name, storage));
      } while (accept(","));
    }
    expect(")");
    return params;
  }

  private List<String> path() throws UserException {
    List<String> path = new ArrayList<String>();
    path.add(expectIdent().text);
    while (accept(".")) {
      path.add(expectIdent().text);
    }
    return path;
  }

  /* Types */

  private TypeName typeName() throws UserException {
    Token t = peek();
    if (accept("mapping")) {
      expect("(");
      TypeName key = typeName();
      Identifier label = null;
      if (accept("!")) {
        label = identifier();
      }
      expect("=>");
      AnnotatedTypeName value = annotatedType();
      expect(")");
      return build(TypeName.class, Production.MAPPING, t, key, label, value);
    } else if (t.kind == Kind.IDENT && isElementaryType(t.text)) {
      pos++;
      String name = t.text;
      if (name.equals("address") && accept("payable")) {
        name = "address payable";
      }
      return build(TypeName.class, Production.ELEMENTARY_TYPE, t, name);
    }
    List<Identifier> names = new ArrayList<Identifier>();
    names.add(identifier());
    while (accept(".")) {
      names.add(identifier());
    }
    return build(TypeName.class, Production.USER_DEFINED_TYPE, t, names);
  }

  private Expression privacyLabel() throws UserException {
    Token t = peek();
    if (accept("me")) {
      return build(Expression.class, Production.ME, t);
    } else if (accept("all")) {
      return build(Expression.class, Production.ALL, t);
    } else if (accept("tee")) {
      return build(Expression.class, Production.TEE, t);
    }
    return build(Expression.class, Production.IDENTIFIER_EXPR, t,
                 identifier());
  }

  private AnnotatedTypeName annotatedType() throws UserException {
    Token start = peek();
    TypeName t = typeName();
    Expression label = accept("@") ? privacyLabel() : null;
    while (at("[")) {
      Token open = expect("[");
      Expression length = at("]") ? null : expression();
      expect("]");
      AnnotatedTypeName element = build(AnnotatedTypeName.class,
          Production.ANNOTATED_TYPE, start, t, label);
      t = build(TypeName.class, Production.ARRAY_TYPE, open, element, length);
      label = accept("@") ? privacyLabel() : null;
    }
    return build(AnnotatedTypeName.class, Production.ANNOTATED_TYPE, start,
                 t, label);
  }

  /* Statements */

  private Block block() throws UserException {
    Token open = expect("{");
    List<Statement> stmts = new ArrayList<Statement>();
    while (!accept("}")) {
      stmts.add(statement());
    }
    return build(Block.class, Production.BLOCK, open, stmts, false);
  }

  /**
   * Body of a control statement: a block, or a single statement that
   * prints without braces
   */
  private Block body() throws UserException {
    if (at("{")) {
      return block();
    }
    Token t = peek();
    Statement s = statement();
    return build(Block.class, Production.BLOCK, t,
                 Collections.singletonList(s), true);
  }

  private Statement statement() throws UserException {
    Token kw = peek();
    if (at("{")) {
      return block();
    } else if (accept("if")) {
      expect("(");
      Expression cond = expression();
      expect(")");
      Block then = body();
      Block otherwise = accept("else") ? body() : null;
      return build(Statement.class, Production.IF, kw, cond, then, otherwise);
    } else if (accept("while")) {
      expect("(");
      Expression cond = expression();
      expect(")");
      return build(Statement.class, Production.WHILE, kw, cond, body());
    } else if (accept("do")) {
      Block b = body();
      expect("while");
      expect("(");
      Expression cond = expression();
      expect(")");
      expect(";");
      return build(Statement.class, Production.DO_WHILE, kw, b, cond);
    } else if (accept("for")) {
      expect("(");
      Statement init = accept(";") ? null : simpleStatement(true);
      Expression cond = at(";") ? null : expression();
      expect(";");
      Statement update = at(")") ? null : simpleStatement(false);
      expect(")");
      return build(Statement.class, Production.FOR, kw, init, cond, update,
                   body());
    } else if (accept("break")) {
      expect(";");
      return build(Statement.class, Production.BREAK, kw);
    } else if (accept("continue")) {
      expect(";");
      return build(Statement.class, Production.CONTINUE, kw);
    } else if (accept("return")) {
      Expression e = at(";") ? null : expression();
      expect(";");
      return build(Statement.class, Production.RETURN, kw, e);
    } else if (at("emit") || at("revert")) {
      pos++;
      Expression call = expression();
      expect(";");
      if (!(call instanceof FunctionCallExpr)) {
        throw error(kw.text + " needs a call");
      }
      FunctionCallExpr fc = (FunctionCallExpr)call;
      Expression func = fc.func();
      CallArgumentList args = fc.args();
      func.detach();
      args.detach();
      return build(Statement.class, kw.text.equals("emit") ? Production.EMIT
                                                           : Production.REVERT,
                   kw, func, args);
    } else if (at("require") && atAhead(1, "(")) {
      pos += 2;
      Expression cond = expression();
      Expression comment = accept(",") ? expression() : null;
      expect(")");
      expect(";");
      return build(Statement.class, Production.REQUIRE, kw, cond, comment);
    }
    return simpleStatement(true);
  }

  private boolean atDeclaration() {
    Token t = peek();
    if (t.kind != Kind.IDENT) {
      return false;
    }
    if (t.text.equals("final") || t.text.equals("mapping")) {
      return true;
    }
    if (isElementaryType(t.text)) {
      return !atAhead(1, "(");
    }
    return peek(1).kind == Kind.IDENT || atAhead(1, "@");
  }

  private VariableDeclarationLike variableDeclarationParts()
      throws UserException {
    Token start = peek();
    List<String> keywords = new ArrayList<String>();
    if (accept("final")) {
      keywords.add("final");
    }
    AnnotatedTypeName t = annotatedType();
    String storage = null;
    if (STORAGE.contains(peek().text)) {
      storage = tokens.get(pos++).text;
    }
    Identifier idf = identifier();
    return new VariableDeclarationLike(start, keywords, t, idf, storage);
  }

  private static class VariableDeclarationLike {
    final Token start;
    final List<String> keywords;
    final AnnotatedTypeName type;
    final Identifier idf;
    final String storage;

    VariableDeclarationLike(Token start, List<String> keywords,
        AnnotatedTypeName type, Identifier idf, String storage) {
      this.start = start;
      this.keywords = keywords;
      this.type = type;
      this.idf = idf;
      this.storage = storage;
    }
  }

  private Node variableDeclaration() throws UserException {
    VariableDeclarationLike v = variableDeclarationParts();
    return build(Node.class, Production.VARIABLE_DECLARATION, v.start,
                 v.keywords, v.type, v.idf, v.storage);
  }

  /**
   * Declaration, assignment or expression statement
   * @param terminated whether a semicolon ends the statement
   */
  private Statement simpleStatement(boolean terminated) throws UserException {
    Token start = peek();
    Statement result;
    if (atDeclaration()) {
      Node decl = variableDeclaration();
      Expression init = accept("=") ? expression() : null;
      result = build(Statement.class,
          Production.VARIABLE_DECLARATION_STATEMENT, start, decl, init);
    } else if (at("++") || at("--")) {
      String op = tokens.get(pos++).text;
      int lhsStart = pos;
      TupleOrLocationExpr lhs = location(unary());
      TupleOrLocationExpr copy = reparseLocation(lhsStart);
      result = build(Statement.class, Production.INC_DEC, start, lhs, copy,
                     op, true);
    } else {
      int lhsStart = pos;
      Expression e = expression();
      if (accept("=")) {
        Expression rhs = expression();
        result = build(Statement.class, Production.ASSIGNMENT, start,
                       location(e), rhs);
      } else if (peek().kind == Kind.PUNCT && peek().text.length() == 2 &&
                 peek().text.endsWith("=") &&
                 !at("==") && !at("!=") && !at("<=") && !at(">=")) {
        String op = tokens.get(pos++).text.substring(0, 1);
        int rhsStart = pos;
        TupleOrLocationExpr copy = reparseLocation(lhsStart);
        pos = rhsStart;
        Expression rhs = expression();
        result = build(Statement.class, Production.COMPOUND_ASSIGNMENT,
                       start, location(e), copy, op, rhs);
      } else if (at("++") || at("--")) {
        String op = tokens.get(pos++).text;
        int after = pos;
        TupleOrLocationExpr copy = reparseLocation(lhsStart);
        pos = after;
        result = build(Statement.class, Production.INC_DEC, start,
                       location(e), copy, op, false);
      } else {
        result = build(Statement.class, Production.EXPRESSION_STATEMENT,
                       start, e);
      }
    }
    if (terminated) {
      expect(";");
    }
    return result;
  }

  /**
   * Parse the left side again from its first token, for the copy that
   * compound assignments carry.  Leaves the position after the copy.
   */
  private TupleOrLocationExpr reparseLocation(int start) throws UserException {
    int saved = pos;
    pos = start;
    TupleOrLocationExpr copy = location(postfix());
    if (pos > saved) {
      throw error("Left side copy ran past the operator");
    }
    return copy;
  }

  private TupleOrLocationExpr location(Expression e) throws UserException {
    if (!(e instanceof TupleOrLocationExpr)) {
      throw error("Cannot assign to " + e.getClass().getSimpleName());
    }
    return (TupleOrLocationExpr)e;
  }

  /**
   * Statement, or a bare expression if the text ends without semicolon
   */
  private Node statementOrExpression() throws UserException {
    int start = pos;
    // A leading ++ or -- only starts a statement, never an expression
    if (!atDeclaration() && !at("{") && !at("if") && !at("while") &&
        !at("for") && !at("do") && !at("return") &&
        !at("++") && !at("--")) {
      Expression e = expression();
      if (peek().kind == Kind.EOF) {
        return e;
      }
      pos = start;
    }
    return statement();
  }

  /* Expressions */

  private static final List<List<String>> BINARY_LEVELS = Arrays.asList(
      Arrays.asList("||"),
      Arrays.asList("&&"),
      Arrays.asList("==", "!="),
      Arrays.asList("<", ">", "<=", ">="),
      Arrays.asList("|"),
      Arrays.asList("^"),
      Arrays.asList("&"),
      Arrays.asList("<<", ">>"),
      Arrays.asList("+", "-"),
      Arrays.asList("*", "/", "%"));

  private Expression expression() throws UserException {
    Token start = peek();
    Expression cond = binary(0);
    if (accept("?")) {
      Expression then = expression();
      expect(":");
      Expression otherwise = expression();
      return build(Expression.class, Production.BUILTIN_CALL, start, "ite",
                   Arrays.asList(cond, then, otherwise));
    }
    return cond;
  }

  private Expression binary(int level) throws UserException {
    if (level == BINARY_LEVELS.size()) {
      return power();
    }
    Expression lhs = binary(level + 1);
    while (peek().kind == Kind.PUNCT &&
           BINARY_LEVELS.get(level).contains(peek().text)) {
      Token op = tokens.get(pos++);
      Expression rhs = binary(level + 1);
      lhs = build(Expression.class, Production.BUILTIN_CALL, op, op.text,
                  Arrays.asList(lhs, rhs));
    }
    return lhs;
  }

  private Expression power() throws UserException {
    Expression base = unary();
    if (at("**")) {
      Token op = tokens.get(pos++);
      Expression exponent = power();
      return build(Expression.class, Production.BUILTIN_CALL, op, "**",
                   Arrays.asList(base, exponent));
    }
    return base;
  }

  private Expression unary() throws UserException {
    Token t = peek();
    String symbol = null;
    if (accept("!")) {
      symbol = "!";
    } else if (accept("~")) {
      symbol = "~";
    } else if (accept("-")) {
      symbol = "sign-";
    } else if (accept("+")) {
      symbol = "sign+";
    }
    if (symbol != null) {
      return build(Expression.class, Production.BUILTIN_CALL, t, symbol,
                   Collections.singletonList(unary()));
    }
    return postfix();
  }

  private Expression postfix() throws UserException {
    Expression e = primary();
    while (true) {
      Token t = peek();
      if (accept(".")) {
        e = build(Expression.class, Production.MEMBER_ACCESS, t, e,
                  identifier());
      } else if (accept("[")) {
        if (!(e instanceof LocationExpr)) {
          throw error("Cannot index " + e.getClass().getSimpleName());
        }
        LocationExpr arr = (LocationExpr)e;
        Expression first = at("]") || at(":") ? null : expression();
        if (accept(":")) {
          Expression end = at("]") ? null : expression();
          expect("]");
          e = build(Expression.class, Production.RANGE_INDEX, t, arr, first,
                    end);
        } else {
          expect("]");
          e = build(Expression.class, Production.INDEX, t, arr, first);
        }
      } else if (accept("(")) {
        e = build(Expression.class, Production.FUNCTION_CALL, t, e,
                  callArguments(t), false);
      } else if (at("{") && peek(1).kind == Kind.IDENT && atAhead(2, ":")) {
        pos++;
        CallArgumentList options = namedArguments(t);
        e = build(Expression.class, Production.FUNCTION_CALL, t, e, options,
                  true);
      } else {
        return e;
      }
    }
  }

  /**
   * Arguments after an opening parenthesis, up to and including the
   * closing one
   */
  private CallArgumentList callArguments(Token open) throws UserException {
    if (accept("{")) {
      CallArgumentList named = namedArguments(open);
      expect(")");
      return named;
    }
    List<Expression> args = new ArrayList<Expression>();
    if (!at(")")) {
      do {
        args.add(expression());
      } while (accept(","));
    }
    expect(")");
    return build(CallArgumentList.class, Production.CALL_ARGUMENTS, open,
                 args, false);
  }

  /**
   * Named arguments after an opening brace, up to and including the
   * closing one
   */
  private CallArgumentList namedArguments(Token open) throws UserException {
    List<Node> args = new ArrayList<Node>();
    if (!at("}")) {
      do {
        Token key = expectIdent();
        expect(":");
        args.add(build(Node.class, Production.NAMED_ARGUMENT, key, key.text,
                       expression()));
      } while (accept(","));
    }
    expect("}");
    return build(CallArgumentList.class, Production.CALL_ARGUMENTS, open,
                 args, true);
  }

  private Expression primary() throws UserException {
    Token t = peek();
    switch (t.kind) {
      case NUMBER: {
        pos++;
        String unit = null;
        if (peek().kind == Kind.IDENT && NUMBER_UNITS.contains(peek().text)) {
          unit = tokens.get(pos++).text;
        }
        return build(Expression.class, Production.NUMBER_LITERAL, t, t.text,
                     unit);
      }
      case STRING:
        pos++;
        return build(Expression.class, Production.STRING_LITERAL, t, t.text);
      case EOF:
        throw error("Unexpected end of input");
      default:
        break;
    }

    if (accept("(")) {
      List<Expression> elements = new ArrayList<Expression>();
      elements.add(expression());
      if (accept(")")) {
        return build(Expression.class, Production.BUILTIN_CALL, t,
                     "parenthesis", elements);
      }
      while (accept(",")) {
        elements.add(expression());
      }
      expect(")");
      return build(Expression.class, Production.TUPLE, t, elements);
    } else if (accept("[")) {
      List<Expression> elements = new ArrayList<Expression>();
      if (!at("]")) {
        do {
          elements.add(expression());
        } while (accept(","));
      }
      expect("]");
      return build(Expression.class, Production.INLINE_ARRAY, t, elements);
    } else if (accept("true") || accept("false")) {
      return build(Expression.class, Production.BOOLEAN_LITERAL, t,
                   t.text.equals("true"));
    } else if (at("me") || at("all") || at("tee")) {
      return privacyLabel();
    } else if (at("reveal") && atAhead(1, "(")) {
      pos += 2;
      Expression e = expression();
      expect(",");
      Expression label = privacyLabel();
      expect(")");
      return build(Expression.class, Production.RECLASSIFY, t, e, label);
    } else if (accept("new")) {
      return build(Expression.class, Production.NEW, t, typeName());
    } else if (at("type") && atAhead(1, "(")) {
      pos += 2;
      TypeName typeName = typeName();
      expect(")");
      return build(Expression.class, Production.META_TYPE, t, typeName);
    } else if (t.kind == Kind.IDENT && isElementaryType(t.text) &&
               atAhead(1, "(")) {
      TypeName type = typeName();
      expect("(");
      Expression e = expression();
      expect(")");
      return build(Expression.class, Production.PRIMITIVE_CAST, t, type, e);
    } else if (t.kind == Kind.IDENT) {
      return build(Expression.class, Production.IDENTIFIER_EXPR, t,
                   identifier());
    }
    throw error("Unexpected " + t);
  }
}
