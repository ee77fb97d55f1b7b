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

/**
 * Kinds of node a front end can ask {@link NodeFactory} to build.
 * Arguments are listed in the order builders expect them.
 */
public enum Production {
  /* Names and comments */
  /** name: String */
  IDENTIFIER,
  /** text: String */
  COMMENT,

  /* Types */
  /** keyword: String, e.g. "uint8" or "address payable" */
  ELEMENTARY_TYPE,
  /** names: List of Identifier */
  USER_DEFINED_TYPE,
  /** key type, key label Identifier or null, value AnnotatedTypeName */
  MAPPING,
  /** element AnnotatedTypeName, length Expression or null */
  ARRAY_TYPE,
  /** TypeName, privacy label Expression or null */
  ANNOTATED_TYPE,

  /* Expressions */
  /** value: Boolean */
  BOOLEAN_LITERAL,
  /** source text: String, unit: String or null */
  NUMBER_LITERAL,
  /** value: String, without quotes */
  STRING_LITERAL,
  /** values: List of Expression */
  ARRAY_LITERAL,
  /** elements: List of Expression */
  TUPLE,
  /** elements: List of Expression */
  INLINE_ARRAY,
  /** Identifier */
  IDENTIFIER_EXPR,
  /** Expression, member Identifier */
  MEMBER_ACCESS,
  /** LocationExpr, key Expression or null */
  INDEX,
  /** LocationExpr, start Expression or null, end Expression or null */
  RANGE_INDEX,
  /** operator symbol: String, operands: List of Expression */
  BUILTIN_CALL,
  /** function Expression, CallArgumentList, call options: Boolean */
  FUNCTION_CALL,
  /** key: String, Expression */
  NAMED_ARGUMENT,
  /** arguments: List of Expression or NamedArgument, named: Boolean */
  CALL_ARGUMENTS,
  /** TypeName, Expression */
  PRIMITIVE_CAST,
  /** TypeName */
  NEW,
  /** TypeName */
  META_TYPE,
  /** no arguments */
  ME,
  /** no arguments */
  ALL,
  /** no arguments */
  TEE,
  /** Expression, privacy label Expression */
  RECLASSIFY,

  /* Statements */
  /** condition, then Block, else Block or null */
  IF,
  /** condition, Block */
  WHILE,
  /** Block, condition */
  DO_WHILE,
  /** init or null, condition or null, update or null, Block */
  FOR,
  /** no arguments */
  BREAK,
  /** no arguments */
  CONTINUE,
  /** Expression or null */
  RETURN,
  /** event Expression, CallArgumentList */
  EMIT,
  /** error Expression, CallArgumentList */
  REVERT,
  /** text: String */
  ASSEMBLY,
  /** Expression */
  EXPRESSION_STATEMENT,
  /** condition, comment Expression or null */
  REQUIRE,
  /** lhs, rhs */
  ASSIGNMENT,
  /** lhs, copy of lhs, operator symbol: String, rhs */
  COMPOUND_ASSIGNMENT,
  /** lhs, copy of lhs, "++" or "--", prefix: Boolean */
  INC_DEC,
  /** VariableDeclaration, initializer Expression or null */
  VARIABLE_DECLARATION_STATEMENT,
  /** List of VariableDeclaration with nulls for holes, Expression */
  TUPLE_VARIABLE_DECLARATION_STATEMENT,
  /** statements: List of Statement, was single statement: Boolean */
  BLOCK,
  /** Expression, return List of Parameter, Block, List of CatchClause */
  TRY,
  /** error name Identifier or null, List of Parameter, Block */
  CATCH,

  /* Declarations and definitions */
  /** keywords: List of String, AnnotatedTypeName, Identifier,
   *  storage location: String or null */
  VARIABLE_DECLARATION,
  /** same as VARIABLE_DECLARATION; the Identifier may be null */
  PARAMETER,
  /** AnnotatedTypeName, keywords: List of String, Identifier,
   *  initializer or null, OverrideSpecifier or null */
  STATE_VARIABLE,
  /** AnnotatedTypeName, Identifier, Expression */
  CONSTANT_VARIABLE,
  /** kind: String, Identifier or null, List of Parameter, List of
   *  modifier nodes, List of return Parameter, Block or null */
  FUNCTION,
  /** keyword: String */
  MODIFIER_KEYWORD,
  /** path: List of String, CallArgumentList or null */
  MODIFIER_INVOCATION,
  /** paths: List of List of String */
  OVERRIDE_SPECIFIER,
  /** Identifier, List of Parameter, virtual: Boolean, List of
   *  OverrideSpecifier, Block or null */
  MODIFIER_DEFINITION,
  /** Identifier */
  ENUM_VALUE,
  /** Identifier, List of EnumValue */
  ENUM_DEFINITION,
  /** Identifier, ElementaryTypeName */
  USER_DEFINED_VALUE_TYPE,
  /** AnnotatedTypeName, indexed: Boolean, Identifier or null */
  EVENT_PARAMETER,
  /** Identifier, List of EventParameter, anonymous: Boolean */
  EVENT_DEFINITION,
  /** AnnotatedTypeName, Identifier or null */
  ERROR_PARAMETER,
  /** Identifier, List of ErrorParameter */
  ERROR_DEFINITION,
  /** path: List of String, TypeName or null */
  USING,
  /** Identifier, List of VariableDeclaration */
  STRUCT_DEFINITION,
  /** Identifier, units: List of Node */
  CONTRACT,
  /** name: String, version: String */
  PRAGMA,
  /** path: String, unit alias: String or null,
   *  aliases: Map of String to String or null */
  IMPORT,
  /** path: List of String, CallArgumentList or null */
  INHERITANCE_SPECIFIER,
  /** Identifier, List of InheritanceSpecifier, units: List of Node */
  INTERFACE,
  /** Identifier, units: List of Node */
  LIBRARY,
  /** units: List of Node, source text: String or null */
  SOURCE_UNIT,
}
