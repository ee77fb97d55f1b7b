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
package cloak.codegen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import cloak.ast.BaseNodeVisitor;
import cloak.ast.Comment;
import cloak.ast.Identifier;
import cloak.ast.Node;
import cloak.ast.decl.ConstantVariableDeclaration;
import cloak.ast.decl.ConstructorOrFunctionDefinition;
import cloak.ast.decl.ContractDefinition;
import cloak.ast.decl.EnumDefinition;
import cloak.ast.decl.EnumValue;
import cloak.ast.decl.ErrorDefinition;
import cloak.ast.decl.ErrorParameter;
import cloak.ast.decl.EventDefinition;
import cloak.ast.decl.EventParameter;
import cloak.ast.decl.IdentifierDeclaration;
import cloak.ast.decl.ImportDirective;
import cloak.ast.decl.InheritanceSpecifier;
import cloak.ast.decl.InterfaceDefinition;
import cloak.ast.decl.LibraryDefinition;
import cloak.ast.decl.ModifierDefinition;
import cloak.ast.decl.ModifierInvocation;
import cloak.ast.decl.ModifierKeyword;
import cloak.ast.decl.OverrideSpecifier;
import cloak.ast.decl.Parameter;
import cloak.ast.decl.PragmaDirective;
import cloak.ast.decl.SourceUnit;
import cloak.ast.decl.StateVariableDeclaration;
import cloak.ast.decl.StructDefinition;
import cloak.ast.decl.UserDefinedValueTypeDefinition;
import cloak.ast.decl.UsingDirective;
import cloak.ast.decl.VariableDeclaration;
import cloak.ast.expr.ArrayLiteralExpr;
import cloak.ast.expr.BooleanLiteralExpr;
import cloak.ast.expr.BuiltinFunction;
import cloak.ast.expr.CallArgumentList;
import cloak.ast.expr.Expression;
import cloak.ast.expr.FunctionCallExpr;
import cloak.ast.expr.IdentifierExpr;
import cloak.ast.expr.IndexExpr;
import cloak.ast.expr.InlineArrayExpr;
import cloak.ast.expr.MemberAccessExpr;
import cloak.ast.expr.MetaTypeExpr;
import cloak.ast.expr.NamedArgument;
import cloak.ast.expr.NewExpr;
import cloak.ast.expr.NumberLiteralExpr;
import cloak.ast.expr.PrimitiveCastExpr;
import cloak.ast.expr.PrivacyLabelExpr;
import cloak.ast.expr.RangeIndexExpr;
import cloak.ast.expr.ReclassifyExpr;
import cloak.ast.expr.SliceExpr;
import cloak.ast.expr.StringLiteralExpr;
import cloak.ast.expr.TupleExpr;
import cloak.ast.stmt.AssemblyStatement;
import cloak.ast.stmt.AssignmentStatement;
import cloak.ast.stmt.Block;
import cloak.ast.stmt.BreakStatement;
import cloak.ast.stmt.CatchClause;
import cloak.ast.stmt.ContinueStatement;
import cloak.ast.stmt.DoWhileStatement;
import cloak.ast.stmt.EmitStatement;
import cloak.ast.stmt.ExpressionStatement;
import cloak.ast.stmt.ForStatement;
import cloak.ast.stmt.IfStatement;
import cloak.ast.stmt.IndentBlock;
import cloak.ast.stmt.RequireStatement;
import cloak.ast.stmt.ReturnStatement;
import cloak.ast.stmt.RevertStatement;
import cloak.ast.stmt.Statement;
import cloak.ast.stmt.StatementList;
import cloak.ast.stmt.TryStatement;
import cloak.ast.stmt.TupleVariableDeclarationStatement;
import cloak.ast.stmt.VariableDeclarationStatement;
import cloak.ast.stmt.WhileStatement;
import cloak.common.Settings;
import cloak.common.exceptions.CompilerError;
import cloak.common.lang.AnnotatedTypeName;
import cloak.common.lang.Types.AddressPayableTypeName;
import cloak.common.lang.Types.AddressTypeName;
import cloak.common.lang.Types.ArrayTypeName;
import cloak.common.lang.Types.ElementaryTypeName;
import cloak.common.lang.Types.FunctionTypeName;
import cloak.common.lang.Types.Mapping;
import cloak.common.lang.Types.TupleType;
import cloak.common.lang.Types.UserDefinedTypeName;
import cloak.common.util.StringUtil;

/**
 * Prints a tree as source text.
 *
 * The output parses back to an equivalent tree.  In backend mode
 * privacy annotations are left out, so the result is plain code for the
 * target compiler.
 */
public class CodeGenerator extends BaseNodeVisitor<String> {

  private final boolean displayFinal;
  private final boolean forBackend;
  private final CodeWriter writer;

  /**
   * @param displayFinal print the final keyword of variables
   * @param forBackend print for the backend compiler; implies not
   *                   displayFinal
   */
  public CodeGenerator(boolean displayFinal, boolean forBackend) {
    this.displayFinal = displayFinal && !forBackend;
    this.forBackend = forBackend;
    this.writer = new CodeWriter();
  }

  public String generate(Node node) {
    if (node instanceof Statement) {
      return statement((Statement)node);
    }
    return node.accept(this);
  }

  @Override
  protected String unhandled(Node node) {
    throw new CompilerError("No rendering rule for " +
                            node.getClass().getSimpleName());
  }

  private String visit(Node node) {
    return node.accept(this);
  }

  /**
   * Render list elements, skipping null elements
   */
  private String visitList(List<? extends Node> nodes, String separator) {
    List<String> parts = new ArrayList<String>(nodes.size());
    for (Node n: nodes) {
      if (n != null) {
        parts.add(visit(n));
      }
    }
    return StringUtil.concat(separator, parts);
  }

  /**
   * Render a statement preceded by its pre-statements
   */
  private String statement(Statement stmt) {
    if (stmt.preStatements().isEmpty()) {
      return visit(stmt);
    }
    List<String> lines = new ArrayList<String>();
    for (Statement pre: stmt.preStatements()) {
      lines.add(statement(pre));
    }
    lines.add(visit(stmt));
    return StringUtil.concat("\n", lines);
  }

  private String statements(List<Statement> stmts) {
    List<String> parts = new ArrayList<String>(stmts.size());
    for (Statement s: stmts) {
      parts.add(statement(s));
    }
    return StringUtil.concat("\n", parts);
  }

  private String dotted(List<String> path) {
    return StringUtil.concat(".", path);
  }

  /* Names and comments */

  @Override
  public String visitIdentifier(Identifier node) {
    return node.name();
  }

  @Override
  public String visitComment(Comment node) {
    if (node.text().isEmpty()) {
      return "";
    } else if (node.text().contains("\n")) {
      return "/* " + node.text() + " */";
    }
    return "// " + node.text();
  }

  /* Type names */

  @Override
  public String visitElementaryTypeName(ElementaryTypeName node) {
    return node.name();
  }

  @Override
  public String visitUserDefinedTypeName(UserDefinedTypeName node) {
    return visitList(node.names(), ".");
  }

  @Override
  public String visitAddressTypeName(AddressTypeName node) {
    return "address";
  }

  @Override
  public String visitAddressPayableTypeName(AddressPayableTypeName node) {
    return "address payable";
  }

  @Override
  public String visitMapping(Mapping node) {
    String label = "";
    if (!forBackend && node.hasKeyLabel()) {
      label = "!" + visit(node.keyLabel());
    }
    return "mapping(" + visit(node.keyType()) + label + " => " +
           visit(node.valueType()) + ")";
  }

  @Override
  public String visitArrayTypeName(ArrayTypeName node) {
    String length = node.length() == null ? "" : visit(node.length());
    return visit(node.valueType()) + "[" + length + "]";
  }

  @Override
  public String visitTupleType(TupleType node) {
    return "(" + visitList(node.types(), ", ") + ")";
  }

  @Override
  public String visitFunctionTypeName(FunctionTypeName node) {
    StringBuilder sb = new StringBuilder();
    sb.append("function(").append(visitList(node.parameters(), ", "))
      .append(")");
    if (!node.modifiers().isEmpty()) {
      sb.append(" ").append(StringUtil.concat(" ", node.modifiers()));
    }
    if (!node.returnParameters().isEmpty()) {
      sb.append(" returns (")
        .append(visitList(node.returnParameters(), ", ")).append(")");
    }
    return sb.toString();
  }

  @Override
  public String visitAnnotatedTypeName(AnnotatedTypeName node) {
    String t = visit(node.typeName());
    if (!forBackend && node.hadPrivacyAnnotation()) {
      return t + "@" + visit(node.privacyAnnotation());
    }
    return t;
  }

  /* Expressions */

  @Override
  public String visitBuiltinFunction(BuiltinFunction node) {
    return node.op().symbol();
  }

  @Override
  public String visitNamedArgument(NamedArgument node) {
    return node.key() + ": " + visit(node.value());
  }

  @Override
  public String visitCallArgumentList(CallArgumentList node) {
    String args = visitList(node.args(), ", ");
    return node.namedArguments() ? "{" + args + "}" : args;
  }

  @Override
  public String visitFunctionCallExpr(FunctionCallExpr node) {
    if (node.func() instanceof BuiltinFunction) {
      BuiltinFunction f = (BuiltinFunction)node.func();
      List<String> args = new ArrayList<String>();
      for (Node arg: node.args().args()) {
        args.add(visit(arg));
      }
      return f.op().format(args);
    }
    String args = visit(node.args());
    if (node.callOptions()) {
      return visit(node.func()) + args;
    }
    return visit(node.func()) + "(" + args + ")";
  }

  @Override
  public String visitMetaTypeExpr(MetaTypeExpr node) {
    return "type(" + visit(node.typeName()) + ")";
  }

  @Override
  public String visitNewExpr(NewExpr node) {
    return "new " + visit(node.targetType());
  }

  @Override
  public String visitPrimitiveCastExpr(PrimitiveCastExpr node) {
    if (node.isImplicit()) {
      return visit(node.expr());
    }
    return visit(node.elemType()) + "(" + visit(node.expr()) + ")";
  }

  @Override
  public String visitBooleanLiteralExpr(BooleanLiteralExpr node) {
    return node.value() ? "true" : "false";
  }

  @Override
  public String visitNumberLiteralExpr(NumberLiteralExpr node) {
    String value;
    if (node.sourceText() != null) {
      value = node.sourceText();
    } else {
      value = node.wasHex() ? "0x" + node.value().toString(16)
                            : node.value().toString();
    }
    if (node.unit() != null && !node.unit().isEmpty()) {
      return value + " " + node.unit();
    }
    return value;
  }

  @Override
  public String visitStringLiteralExpr(StringLiteralExpr node) {
    return "'" + node.value() + "'";
  }

  @Override
  public String visitArrayLiteralExpr(ArrayLiteralExpr node) {
    return "[" + visitList(node.values(), ", ") + "]";
  }

  @Override
  public String visitTupleExpr(TupleExpr node) {
    return "(" + visitList(node.elements(), ", ") + ")";
  }

  @Override
  public String visitInlineArrayExpr(InlineArrayExpr node) {
    return "[" + visitList(node.exprs(), ", ") + "]";
  }

  @Override
  public String visitIdentifierExpr(IdentifierExpr node) {
    return visit(node.idf());
  }

  @Override
  public String visitMemberAccessExpr(MemberAccessExpr node) {
    return visit(node.expr()) + "." + visit(node.member());
  }

  @Override
  public String visitIndexExpr(IndexExpr node) {
    String key = node.key() == null ? "" : visit(node.key());
    return visit(node.arr()) + "[" + key + "]";
  }

  @Override
  public String visitRangeIndexExpr(RangeIndexExpr node) {
    String start = node.start() == null ? "" : visit(node.start());
    String end = node.end() == null ? "" : visit(node.end());
    return visit(node.arr()) + "[" + start + ":" + end + "]";
  }

  @Override
  public String visitSliceExpr(SliceExpr node) {
    String base = sliceBase(node);
    return visit(node.arr()) + "[" + base + node.startOffset() + ":" +
           base + (node.startOffset() + node.size()) + "]";
  }

  private String sliceBase(SliceExpr slice) {
    return slice.base() == null ? "" : visit(slice.base()) + " + ";
  }

  @Override
  public String visitPrivacyLabelExpr(PrivacyLabelExpr node) {
    if (node.isMeExpr()) {
      return forBackend ? "msg.sender" : "me";
    } else if (node.isTeeExpr()) {
      return "tee";
    }
    return "all";
  }

  @Override
  public String visitReclassifyExpr(ReclassifyExpr node) {
    String e = visit(node.expr());
    if (forBackend) {
      return e;
    }
    return "reveal(" + e + ", " + visit(node.privacy()) + ")";
  }

  /* Statements */

  @Override
  public String visitIfStatement(IfStatement node) {
    String result = "if (" + visit(node.condition()) + ") " +
                    visit(node.thenBranch());
    if (node.elseBranch() != null) {
      result += " else " + visit(node.elseBranch());
    }
    return result;
  }

  @Override
  public String visitWhileStatement(WhileStatement node) {
    return "while (" + visit(node.condition()) + ") " + visit(node.body());
  }

  @Override
  public String visitDoWhileStatement(DoWhileStatement node) {
    return "do " + visit(node.body()) + " while (" +
           visit(node.condition()) + ");";
  }

  @Override
  public String visitForStatement(ForStatement node) {
    String init = node.init() == null ? ";" : visit(node.init());
    String cond = node.condition() == null ? ""
                                           : " " + visit(node.condition());
    String update = "";
    if (node.update() != null) {
      update = " " + StringUtil.rstrip(visit(node.update()));
      if (update.endsWith(";")) {
        update = update.substring(0, update.length() - 1);
      }
    }
    return "for (" + init + cond + ";" + update + ") " + visit(node.body());
  }

  @Override
  public String visitBreakStatement(BreakStatement node) {
    return "break;";
  }

  @Override
  public String visitContinueStatement(ContinueStatement node) {
    return "continue;";
  }

  @Override
  public String visitReturnStatement(ReturnStatement node) {
    if (node.expr() == null) {
      return "return;";
    }
    return "return " + visit(node.expr()) + ";";
  }

  @Override
  public String visitEmitStatement(EmitStatement node) {
    return "emit " + visit(node.expr()) + "(" + visit(node.args()) + ");";
  }

  @Override
  public String visitRevertStatement(RevertStatement node) {
    return "revert " + visit(node.expr()) + "(" + visit(node.args()) + ");";
  }

  @Override
  public String visitAssemblyStatement(AssemblyStatement node) {
    return node.text();
  }

  @Override
  public String visitExpressionStatement(ExpressionStatement node) {
    return visit(node.expr()) + ";";
  }

  @Override
  public String visitRequireStatement(RequireStatement node) {
    String c = visit(node.condition());
    if (node.comment() != null) {
      return "require(" + c + ", " + visit(node.comment()) + ");";
    }
    return "require(" + c + ");";
  }

  /**
   * Assignments print in their original short form where one was used,
   * unless the target is private: private updates print in full.
   */
  @Override
  public String visitAssignmentStatement(AssignmentStatement node) {
    String op = node.op();
    AnnotatedTypeName lhsType = node.lhs().annotatedType();
    if (lhsType != null && lhsType.isPrivate()) {
      op = "";
    }

    Expression rhs = node.rhs();
    if (!op.isEmpty()) {
      if (!(rhs instanceof FunctionCallExpr)) {
        throw new CompilerError("Assignment with operator " + op +
                                " has no operator call on its right side");
      }
      rhs = ((FunctionCallExpr)rhs).arg(1);
    }

    String format;
    if (op.startsWith(AssignmentStatement.PRE_PREFIX)) {
      op = op.substring(AssignmentStatement.PRE_PREFIX.length());
      format = "%2$s%1$s;";
    } else if (op.startsWith(AssignmentStatement.POST_PREFIX)) {
      op = op.substring(AssignmentStatement.POST_PREFIX.length());
      format = "%1$s%2$s;";
    } else {
      format = "%1$s %2$s= %3$s;";
    }

    if (node.lhs() instanceof SliceExpr && rhs instanceof SliceExpr) {
      SliceExpr lhs = (SliceExpr)node.lhs();
      SliceExpr rslice = (SliceExpr)rhs;
      if (lhs.size() != rslice.size()) {
        throw new CompilerError("Slice ranges don't have the same size: " +
                                lhs.size() + " and " + rslice.size());
      }
      String larr = visit(lhs.arr());
      String rarr = visit(rslice.arr());
      String lbase = sliceBase(lhs);
      String rbase = sliceBase(rslice);
      List<String> lines = new ArrayList<String>(lhs.size());
      for (int i = 0; i < lhs.size(); i++) {
        lines.add(String.format(format,
            larr + "[" + lbase + (lhs.startOffset() + i) + "]", op,
            rarr + "[" + rbase + (rslice.startOffset() + i) + "]"));
      }
      return StringUtil.concat("\n", lines);
    }
    return String.format(format, visit(node.lhs()), op, visit(rhs));
  }

  @Override
  public String visitVariableDeclarationStatement(
                                  VariableDeclarationStatement node) {
    String s = visit(node.variableDeclaration());
    if (node.expr() != null) {
      s += " = " + visit(node.expr());
    }
    return s + ";";
  }

  @Override
  public String visitTupleVariableDeclarationStatement(
                                  TupleVariableDeclarationStatement node) {
    List<String> parts = new ArrayList<String>();
    for (VariableDeclaration v: node.vs()) {
      parts.add(v == null ? "" : visit(v));
    }
    return "(" + StringUtil.concat(", ", parts) + ") = " +
           visit(node.expr()) + ";";
  }

  @Override
  public String visitStatementList(StatementList node) {
    return statements(node.statements());
  }

  @Override
  public String visitBlock(Block node) {
    String body = StringUtil.rstrip(statements(node.statements()));
    if (node.wasSingleStatement() && node.size() == 1) {
      return body;
    }
    return writer.braced(body);
  }

  @Override
  public String visitIndentBlock(IndentBlock node) {
    return writer.indent(statements(node.statements()));
  }

  @Override
  public String visitTryStatement(TryStatement node) {
    StringBuilder sb = new StringBuilder();
    sb.append("try ").append(visit(node.expr()));
    if (!node.returnParameters().isEmpty()) {
      sb.append(" returns (")
        .append(visitList(node.returnParameters(), ", ")).append(")");
    }
    sb.append(" ").append(visit(node.body()));
    if (!node.catchClauses().isEmpty()) {
      sb.append(" ").append(visitList(node.catchClauses(), " "));
    }
    return sb.toString();
  }

  @Override
  public String visitCatchClause(CatchClause node) {
    StringBuilder sb = new StringBuilder("catch");
    if (node.errorName() != null) {
      sb.append(" ").append(visit(node.errorName()));
    }
    if (!node.parameters().isEmpty()) {
      sb.append("(").append(visitList(node.parameters(), ", ")).append(")");
    }
    sb.append(" ").append(visit(node.body()));
    return sb.toString();
  }

  /* Declarations and definitions */

  private List<String> shownKeywords(IdentifierDeclaration decl) {
    List<String> result = new ArrayList<String>();
    for (String k: decl.keywords()) {
      if (displayFinal || !k.equals(IdentifierDeclaration.FINAL)) {
        result.add(k);
      }
    }
    return result;
  }

  @Override
  public String visitVariableDeclaration(VariableDeclaration node) {
    String k = StringUtil.concat(" ", shownKeywords(node));
    String t = visit(node.annotatedType());
    String s = node.storageLocation() == null ||
               node.storageLocation().isEmpty() ? ""
                    : " " + node.storageLocation();
    return (k + " " + t + s + " " + visit(node.idf())).trim();
  }

  @Override
  public String visitParameter(Parameter node) {
    List<String> parts = new ArrayList<String>();
    if (displayFinal && node.isFinal()) {
      parts.add(IdentifierDeclaration.FINAL);
    }
    parts.add(visit(node.annotatedType()));
    parts.add(node.storageLocation());
    if (node.idf() != null) {
      parts.add(visit(node.idf()));
    }
    return CodeWriter.joinNonEmpty(" ", parts);
  }

  @Override
  public String visitStateVariableDeclaration(StateVariableDeclaration node) {
    List<String> keywords = shownKeywords(node);
    String f = keywords.contains(IdentifierDeclaration.FINAL) ? "final " : "";
    List<String> others = new ArrayList<String>();
    for (String k: keywords) {
      if (!k.equals(IdentifierDeclaration.FINAL)) {
        others.add(k);
      }
    }
    String k = others.isEmpty() ? "" : StringUtil.concat(" ", others) + " ";
    String override = node.overrideSpecifier() == null ? ""
                            : visit(node.overrideSpecifier()) + " ";
    String result = (f + visit(node.annotatedType()) + " " + k + override +
                     visit(node.idf())).trim();
    if (node.expr() != null) {
      result += " = " + visit(node.expr());
    }
    return result + ";";
  }

  @Override
  public String visitConstantVariableDeclaration(
                                        ConstantVariableDeclaration node) {
    return visit(node.annotatedType()) + " constant " + visit(node.idf()) +
           " = " + visit(node.expr()) + ";";
  }

  @Override
  public String visitConstructorOrFunctionDefinition(
                                    ConstructorOrFunctionDefinition node) {
    StringBuilder sb = new StringBuilder(node.kind().keyword());
    if (node.isFunction()) {
      sb.append(" ").append(visit(node.idf()));
    }
    sb.append("(").append(visitList(node.parameters(), ", ")).append(")");
    if (!node.modifiers().isEmpty()) {
      sb.append(" ").append(visitList(node.modifiers(), " "));
    }
    if (!node.returnParameters().isEmpty()) {
      sb.append(" returns (")
        .append(visitList(node.returnParameters(), ", ")).append(")");
    }
    if (node.body() == null) {
      sb.append(";");
    } else {
      sb.append(" ").append(visit(node.body()));
    }
    return sb.toString();
  }

  @Override
  public String visitModifierKeyword(ModifierKeyword node) {
    return node.keyword();
  }

  @Override
  public String visitModifierInvocation(ModifierInvocation node) {
    String args = node.args() == null ? "" : "(" + visit(node.args()) + ")";
    return dotted(node.path()) + args;
  }

  @Override
  public String visitOverrideSpecifier(OverrideSpecifier node) {
    if (node.paths().isEmpty()) {
      return "override";
    }
    List<String> paths = new ArrayList<String>();
    for (List<String> p: node.paths()) {
      paths.add(dotted(p));
    }
    return "override(" + StringUtil.concat(", ", paths) + ")";
  }

  @Override
  public String visitModifierDefinition(ModifierDefinition node) {
    StringBuilder sb = new StringBuilder("modifier ");
    sb.append(visit(node.idf())).append("(")
      .append(visitList(node.parameters(), ", ")).append(")");
    if (node.isVirtual()) {
      sb.append(" virtual");
    }
    if (!node.overrideSpecifiers().isEmpty()) {
      sb.append(" ").append(visitList(node.overrideSpecifiers(), " "));
    }
    if (node.body() == null) {
      sb.append(";");
    } else {
      sb.append(" ").append(visit(node.body()));
    }
    return sb.toString();
  }

  @Override
  public String visitEnumValue(EnumValue node) {
    return visit(node.idf());
  }

  @Override
  public String visitEnumDefinition(EnumDefinition node) {
    return "enum " + visit(node.idf()) + " " +
           writer.braced(visitList(node.values(), ", "));
  }

  @Override
  public String visitUserDefinedValueTypeDefinition(
                                  UserDefinedValueTypeDefinition node) {
    return "type " + visit(node.idf()) + " is " +
           visit(node.underlyingType()) + ";";
  }

  @Override
  public String visitEventParameter(EventParameter node) {
    String indexed = node.isIndexed() ? " indexed" : "";
    String name = node.name() == null ? "" : " " + visit(node.name());
    return visit(node.annotatedType()) + indexed + name;
  }

  @Override
  public String visitEventDefinition(EventDefinition node) {
    String anonymous = node.isAnonymous() ? " anonymous" : "";
    return "event " + visit(node.idf()) + "(" +
           visitList(node.parameters(), ", ") + ")" + anonymous + ";";
  }

  @Override
  public String visitErrorParameter(ErrorParameter node) {
    String name = node.name() == null ? "" : " " + visit(node.name());
    return visit(node.annotatedType()) + name;
  }

  @Override
  public String visitErrorDefinition(ErrorDefinition node) {
    return "error " + visit(node.idf()) + "(" +
           visitList(node.parameters(), ", ") + ");";
  }

  @Override
  public String visitUsingDirective(UsingDirective node) {
    String t = node.typeName() == null ? "*" : visit(node.typeName());
    return "using " + dotted(node.path()) + " for " + t + ";";
  }

  @Override
  public String visitStructDefinition(StructDefinition node) {
    String members = node.members().isEmpty() ? ""
                        : visitList(node.members(), ";\n") + ";";
    return "struct " + visit(node.idf()) + " " + writer.braced(members);
  }

  @Override
  public String visitContractDefinition(ContractDefinition node) {
    String body = CodeWriter.joinNonEmpty("\n\n", Arrays.asList(
        visitList(node.extraHeadParts(), "\n"),
        visitList(node.units(), "\n"),
        visitList(node.extraTailParts(), "\n")));
    return "contract " + visit(node.idf()) + " " + writer.braced(body);
  }

  @Override
  public String visitPragmaDirective(PragmaDirective node) {
    if (forBackend) {
      return "pragma solidity " +
             Settings.get(Settings.CODEGEN_SOLC_VERSION) + ";";
    }
    return "pragma " + node.name() + " " + node.version() + ";";
  }

  @Override
  public String visitImportDirective(ImportDirective node) {
    String path = "\"" + node.path() + "\"";
    if (!node.aliases().isEmpty()) {
      List<String> symbols = new ArrayList<String>();
      for (Map.Entry<String, String> e: node.aliases().entrySet()) {
        symbols.add(e.getValue() == null ? e.getKey()
                                         : e.getKey() + " as " + e.getValue());
      }
      return "import {" + StringUtil.concat(", ", symbols) + "} from " +
             path + ";";
    } else if (node.unitAlias() != null) {
      return "import " + path + " as " + node.unitAlias() + ";";
    }
    return "import " + path + ";";
  }

  @Override
  public String visitInheritanceSpecifier(InheritanceSpecifier node) {
    String args = node.args() == null ? "" : "(" + visit(node.args()) + ")";
    return dotted(node.path()) + args;
  }

  @Override
  public String visitInterfaceDefinition(InterfaceDefinition node) {
    String bases = "";
    if (!node.inheritanceSpecifiers().isEmpty()) {
      bases = " is " + visitList(node.inheritanceSpecifiers(), ", ");
    }
    return "interface " + visit(node.idf()) + bases + " " +
           writer.braced(visitList(node.units(), "\n"));
  }

  @Override
  public String visitLibraryDefinition(LibraryDefinition node) {
    return "library " + visit(node.idf()) + " " +
           writer.braced(visitList(node.units(), "\n"));
  }

  @Override
  public String visitSourceUnit(SourceUnit node) {
    return CodeWriter.joinNonEmpty("\n\n", Arrays.asList(
        visitList(node.extraHeadParts(), "\n"),
        visitList(node.units(), "\n\n")));
  }
}
