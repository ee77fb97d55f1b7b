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

/**
 * One method per concrete node class.
 * Nodes dispatch to the matching method from {@link Node#accept}.
 */
public interface NodeVisitor<R> {
  /* Names and comments */
  R visitIdentifier(Identifier node);
  R visitComment(Comment node);
  R visitBlankLine(BlankLine node);

  /* Type names */
  R visitElementaryTypeName(ElementaryTypeName node);
  R visitBoolTypeName(BoolTypeName node);
  R visitBooleanLiteralType(BooleanLiteralType node);
  R visitNumberTypeName(NumberTypeName node);
  R visitNumberLiteralType(NumberLiteralType node);
  R visitIntTypeName(IntTypeName node);
  R visitUintTypeName(UintTypeName node);
  R visitBytesTypeName(BytesTypeName node);
  R visitStringTypeName(StringTypeName node);
  R visitUserDefinedTypeName(UserDefinedTypeName node);
  R visitEnumTypeName(EnumTypeName node);
  R visitEnumValueTypeName(EnumValueTypeName node);
  R visitStructTypeName(StructTypeName node);
  R visitContractTypeName(ContractTypeName node);
  R visitAddressTypeName(AddressTypeName node);
  R visitAddressPayableTypeName(AddressPayableTypeName node);
  R visitMapping(Mapping node);
  R visitArrayTypeName(ArrayTypeName node);
  R visitTupleType(TupleType node);
  R visitFunctionTypeName(FunctionTypeName node);
  R visitAnnotatedTypeName(AnnotatedTypeName node);

  /* Expressions */
  R visitBuiltinFunction(BuiltinFunction node);
  R visitNamedArgument(NamedArgument node);
  R visitCallArgumentList(CallArgumentList node);
  R visitFunctionCallExpr(FunctionCallExpr node);
  R visitMetaTypeExpr(MetaTypeExpr node);
  R visitNewExpr(NewExpr node);
  R visitPrimitiveCastExpr(PrimitiveCastExpr node);
  R visitBooleanLiteralExpr(BooleanLiteralExpr node);
  R visitNumberLiteralExpr(NumberLiteralExpr node);
  R visitStringLiteralExpr(StringLiteralExpr node);
  R visitArrayLiteralExpr(ArrayLiteralExpr node);
  R visitTupleExpr(TupleExpr node);
  R visitInlineArrayExpr(InlineArrayExpr node);
  R visitIdentifierExpr(IdentifierExpr node);
  R visitMemberAccessExpr(MemberAccessExpr node);
  R visitIndexExpr(IndexExpr node);
  R visitRangeIndexExpr(RangeIndexExpr node);
  R visitSliceExpr(SliceExpr node);
  R visitPrivacyLabelExpr(PrivacyLabelExpr node);
  R visitReclassifyExpr(ReclassifyExpr node);

  /* Statements */
  R visitIfStatement(IfStatement node);
  R visitWhileStatement(WhileStatement node);
  R visitDoWhileStatement(DoWhileStatement node);
  R visitForStatement(ForStatement node);
  R visitBreakStatement(BreakStatement node);
  R visitContinueStatement(ContinueStatement node);
  R visitReturnStatement(ReturnStatement node);
  R visitEmitStatement(EmitStatement node);
  R visitRevertStatement(RevertStatement node);
  R visitAssemblyStatement(AssemblyStatement node);
  R visitExpressionStatement(ExpressionStatement node);
  R visitRequireStatement(RequireStatement node);
  R visitAssignmentStatement(AssignmentStatement node);
  R visitVariableDeclarationStatement(VariableDeclarationStatement node);
  R visitTupleVariableDeclarationStatement(TupleVariableDeclarationStatement node);
  R visitStatementList(StatementList node);
  R visitBlock(Block node);
  R visitIndentBlock(IndentBlock node);
  R visitTryStatement(TryStatement node);
  R visitCatchClause(CatchClause node);

  /* Declarations and definitions */
  R visitVariableDeclaration(VariableDeclaration node);
  R visitParameter(Parameter node);
  R visitStateVariableDeclaration(StateVariableDeclaration node);
  R visitConstantVariableDeclaration(ConstantVariableDeclaration node);
  R visitConstructorOrFunctionDefinition(ConstructorOrFunctionDefinition node);
  R visitModifierKeyword(ModifierKeyword node);
  R visitModifierInvocation(ModifierInvocation node);
  R visitOverrideSpecifier(OverrideSpecifier node);
  R visitModifierDefinition(ModifierDefinition node);
  R visitEnumValue(EnumValue node);
  R visitEnumDefinition(EnumDefinition node);
  R visitUserDefinedValueTypeDefinition(UserDefinedValueTypeDefinition node);
  R visitEventParameter(EventParameter node);
  R visitEventDefinition(EventDefinition node);
  R visitErrorParameter(ErrorParameter node);
  R visitErrorDefinition(ErrorDefinition node);
  R visitUsingDirective(UsingDirective node);
  R visitStructDefinition(StructDefinition node);
  R visitContractDefinition(ContractDefinition node);
  R visitPragmaDirective(PragmaDirective node);
  R visitImportDirective(ImportDirective node);
  R visitInheritanceSpecifier(InheritanceSpecifier node);
  R visitInterfaceDefinition(InterfaceDefinition node);
  R visitLibraryDefinition(LibraryDefinition node);
  R visitSourceUnit(SourceUnit node);
}
