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
package cloak.ast;

import cloak.ast.decl.ConstantVariableDeclaration;
import cloak.ast.decl.ConstructorOrFunctionDefinition;
import cloak.ast.decl.ContractDefinition;
import cloak.ast.decl.EnumDefinition;
import cloak.ast.decl.EnumValue;
import cloak.ast.decl.ErrorDefinition;
import cloak.ast.decl.ErrorParameter;
import cloak.ast.decl.EventDefinition;
import cloak.ast.decl.EventParameter;
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
import cloak.ast.stmt.StatementList;
import cloak.ast.stmt.TryStatement;
import cloak.ast.stmt.TupleVariableDeclarationStatement;
import cloak.ast.stmt.VariableDeclarationStatement;
import cloak.ast.stmt.WhileStatement;
import cloak.common.lang.AnnotatedTypeName;
import cloak.common.lang.Types.AddressPayableTypeName;
import cloak.common.lang.Types.AddressTypeName;
import cloak.common.lang.Types.ArrayTypeName;
import cloak.common.lang.Types.BoolTypeName;
import cloak.common.lang.Types.BooleanLiteralType;
import cloak.common.lang.Types.BytesTypeName;
import cloak.common.lang.Types.ContractTypeName;
import cloak.common.lang.Types.ElementaryTypeName;
import cloak.common.lang.Types.EnumTypeName;
import cloak.common.lang.Types.EnumValueTypeName;
import cloak.common.lang.Types.FunctionTypeName;
import cloak.common.lang.Types.IntTypeName;
import cloak.common.lang.Types.Mapping;
import cloak.common.lang.Types.NumberLiteralType;
import cloak.common.lang.Types.NumberTypeName;
import cloak.common.lang.Types.StringTypeName;
import cloak.common.lang.Types.StructTypeName;
import cloak.common.lang.Types.TupleType;
import cloak.common.lang.Types.UintTypeName;
import cloak.common.lang.Types.UserDefinedTypeName;
import cloak.common.exceptions.CompilerError;

/**
 * Visitor that fails on every node class it does not handle.
 *
 * Subclasses of node classes that have a visit method of their own fall
 * back to the visit method of their superclass, e.g. an unhandled
 * {@link IntTypeName} is visited as a {@link NumberTypeName}.
 */
public abstract class BaseNodeVisitor<R> implements NodeVisitor<R> {

  protected R unhandled(Node node) {
    throw new CompilerError("No rule for " + node.getClass().getSimpleName() +
                            " in " + getClass().getSimpleName());
  }

  @Override
  public R visitIdentifier(Identifier node) {
    return unhandled(node);
  }

  @Override
  public R visitComment(Comment node) {
    return unhandled(node);
  }

  @Override
  public R visitBlankLine(BlankLine node) {
    return visitComment(node);
  }

  @Override
  public R visitElementaryTypeName(ElementaryTypeName node) {
    return unhandled(node);
  }

  @Override
  public R visitBoolTypeName(BoolTypeName node) {
    return visitElementaryTypeName(node);
  }

  @Override
  public R visitBooleanLiteralType(BooleanLiteralType node) {
    return visitElementaryTypeName(node);
  }

  @Override
  public R visitNumberTypeName(NumberTypeName node) {
    return visitElementaryTypeName(node);
  }

  @Override
  public R visitNumberLiteralType(NumberLiteralType node) {
    return visitNumberTypeName(node);
  }

  @Override
  public R visitIntTypeName(IntTypeName node) {
    return visitNumberTypeName(node);
  }

  @Override
  public R visitUintTypeName(UintTypeName node) {
    return visitNumberTypeName(node);
  }

  @Override
  public R visitBytesTypeName(BytesTypeName node) {
    return visitElementaryTypeName(node);
  }

  @Override
  public R visitStringTypeName(StringTypeName node) {
    return visitElementaryTypeName(node);
  }

  @Override
  public R visitUserDefinedTypeName(UserDefinedTypeName node) {
    return unhandled(node);
  }

  @Override
  public R visitEnumTypeName(EnumTypeName node) {
    return visitUserDefinedTypeName(node);
  }

  @Override
  public R visitEnumValueTypeName(EnumValueTypeName node) {
    return visitUserDefinedTypeName(node);
  }

  @Override
  public R visitStructTypeName(StructTypeName node) {
    return visitUserDefinedTypeName(node);
  }

  @Override
  public R visitContractTypeName(ContractTypeName node) {
    return visitUserDefinedTypeName(node);
  }

  @Override
  public R visitAddressTypeName(AddressTypeName node) {
    return visitUserDefinedTypeName(node);
  }

  @Override
  public R visitAddressPayableTypeName(AddressPayableTypeName node) {
    return visitUserDefinedTypeName(node);
  }

  @Override
  public R visitMapping(Mapping node) {
    return unhandled(node);
  }

  @Override
  public R visitArrayTypeName(ArrayTypeName node) {
    return unhandled(node);
  }

  @Override
  public R visitTupleType(TupleType node) {
    return unhandled(node);
  }

  @Override
  public R visitFunctionTypeName(FunctionTypeName node) {
    return unhandled(node);
  }

  @Override
  public R visitAnnotatedTypeName(AnnotatedTypeName node) {
    return unhandled(node);
  }

  @Override
  public R visitBuiltinFunction(BuiltinFunction node) {
    return unhandled(node);
  }

  @Override
  public R visitNamedArgument(NamedArgument node) {
    return unhandled(node);
  }

  @Override
  public R visitCallArgumentList(CallArgumentList node) {
    return unhandled(node);
  }

  @Override
  public R visitFunctionCallExpr(FunctionCallExpr node) {
    return unhandled(node);
  }

  @Override
  public R visitMetaTypeExpr(MetaTypeExpr node) {
    return unhandled(node);
  }

  @Override
  public R visitNewExpr(NewExpr node) {
    return unhandled(node);
  }

  @Override
  public R visitPrimitiveCastExpr(PrimitiveCastExpr node) {
    return unhandled(node);
  }

  @Override
  public R visitBooleanLiteralExpr(BooleanLiteralExpr node) {
    return unhandled(node);
  }

  @Override
  public R visitNumberLiteralExpr(NumberLiteralExpr node) {
    return unhandled(node);
  }

  @Override
  public R visitStringLiteralExpr(StringLiteralExpr node) {
    return unhandled(node);
  }

  @Override
  public R visitArrayLiteralExpr(ArrayLiteralExpr node) {
    return unhandled(node);
  }

  @Override
  public R visitTupleExpr(TupleExpr node) {
    return unhandled(node);
  }

  @Override
  public R visitInlineArrayExpr(InlineArrayExpr node) {
    return unhandled(node);
  }

  @Override
  public R visitIdentifierExpr(IdentifierExpr node) {
    return unhandled(node);
  }

  @Override
  public R visitMemberAccessExpr(MemberAccessExpr node) {
    return unhandled(node);
  }

  @Override
  public R visitIndexExpr(IndexExpr node) {
    return unhandled(node);
  }

  @Override
  public R visitRangeIndexExpr(RangeIndexExpr node) {
    return unhandled(node);
  }

  @Override
  public R visitSliceExpr(SliceExpr node) {
    return unhandled(node);
  }

  @Override
  public R visitPrivacyLabelExpr(PrivacyLabelExpr node) {
    return unhandled(node);
  }

  @Override
  public R visitReclassifyExpr(ReclassifyExpr node) {
    return unhandled(node);
  }

  @Override
  public R visitIfStatement(IfStatement node) {
    return unhandled(node);
  }

  @Override
  public R visitWhileStatement(WhileStatement node) {
    return unhandled(node);
  }

  @Override
  public R visitDoWhileStatement(DoWhileStatement node) {
    return unhandled(node);
  }

  @Override
  public R visitForStatement(ForStatement node) {
    return unhandled(node);
  }

  @Override
  public R visitBreakStatement(BreakStatement node) {
    return unhandled(node);
  }

  @Override
  public R visitContinueStatement(ContinueStatement node) {
    return unhandled(node);
  }

  @Override
  public R visitReturnStatement(ReturnStatement node) {
    return unhandled(node);
  }

  @Override
  public R visitEmitStatement(EmitStatement node) {
    return unhandled(node);
  }

  @Override
  public R visitRevertStatement(RevertStatement node) {
    return unhandled(node);
  }

  @Override
  public R visitAssemblyStatement(AssemblyStatement node) {
    return unhandled(node);
  }

  @Override
  public R visitExpressionStatement(ExpressionStatement node) {
    return unhandled(node);
  }

  @Override
  public R visitRequireStatement(RequireStatement node) {
    return unhandled(node);
  }

  @Override
  public R visitAssignmentStatement(AssignmentStatement node) {
    return unhandled(node);
  }

  @Override
  public R visitVariableDeclarationStatement(VariableDeclarationStatement node) {
    return unhandled(node);
  }

  @Override
  public R visitTupleVariableDeclarationStatement(TupleVariableDeclarationStatement node) {
    return unhandled(node);
  }

  @Override
  public R visitStatementList(StatementList node) {
    return unhandled(node);
  }

  @Override
  public R visitBlock(Block node) {
    return unhandled(node);
  }

  @Override
  public R visitIndentBlock(IndentBlock node) {
    return unhandled(node);
  }

  @Override
  public R visitTryStatement(TryStatement node) {
    return unhandled(node);
  }

  @Override
  public R visitCatchClause(CatchClause node) {
    return unhandled(node);
  }

  @Override
  public R visitVariableDeclaration(VariableDeclaration node) {
    return unhandled(node);
  }

  @Override
  public R visitParameter(Parameter node) {
    return unhandled(node);
  }

  @Override
  public R visitStateVariableDeclaration(StateVariableDeclaration node) {
    return unhandled(node);
  }

  @Override
  public R visitConstantVariableDeclaration(ConstantVariableDeclaration node) {
    return unhandled(node);
  }

  @Override
  public R visitConstructorOrFunctionDefinition(ConstructorOrFunctionDefinition node) {
    return unhandled(node);
  }

  @Override
  public R visitModifierKeyword(ModifierKeyword node) {
    return unhandled(node);
  }

  @Override
  public R visitModifierInvocation(ModifierInvocation node) {
    return unhandled(node);
  }

  @Override
  public R visitOverrideSpecifier(OverrideSpecifier node) {
    return unhandled(node);
  }

  @Override
  public R visitModifierDefinition(ModifierDefinition node) {
    return unhandled(node);
  }

  @Override
  public R visitEnumValue(EnumValue node) {
    return unhandled(node);
  }

  @Override
  public R visitEnumDefinition(EnumDefinition node) {
    return unhandled(node);
  }

  @Override
  public R visitUserDefinedValueTypeDefinition(UserDefinedValueTypeDefinition node) {
    return unhandled(node);
  }

  @Override
  public R visitEventParameter(EventParameter node) {
    return unhandled(node);
  }

  @Override
  public R visitEventDefinition(EventDefinition node) {
    return unhandled(node);
  }

  @Override
  public R visitErrorParameter(ErrorParameter node) {
    return unhandled(node);
  }

  @Override
  public R visitErrorDefinition(ErrorDefinition node) {
    return unhandled(node);
  }

  @Override
  public R visitUsingDirective(UsingDirective node) {
    return unhandled(node);
  }

  @Override
  public R visitStructDefinition(StructDefinition node) {
    return unhandled(node);
  }

  @Override
  public R visitContractDefinition(ContractDefinition node) {
    return unhandled(node);
  }

  @Override
  public R visitPragmaDirective(PragmaDirective node) {
    return unhandled(node);
  }

  @Override
  public R visitImportDirective(ImportDirective node) {
    return unhandled(node);
  }

  @Override
  public R visitInheritanceSpecifier(InheritanceSpecifier node) {
    return unhandled(node);
  }

  @Override
  public R visitInterfaceDefinition(InterfaceDefinition node) {
    return unhandled(node);
  }

  @Override
  public R visitLibraryDefinition(LibraryDefinition node) {
    return unhandled(node);
  }

  @Override
  public R visitSourceUnit(SourceUnit node) {
    return unhandled(node);
  }
}
