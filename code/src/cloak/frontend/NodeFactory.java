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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

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
import cloak.ast.expr.LocationExpr;
import cloak.ast.expr.MemberAccessExpr;
import cloak.ast.expr.MetaTypeExpr;
import cloak.ast.expr.NamedArgument;
import cloak.ast.expr.NewExpr;
import cloak.ast.expr.NumberLiteralExpr;
import cloak.ast.expr.PrimitiveCastExpr;
import cloak.ast.expr.PrivacyLabelExpr;
import cloak.ast.expr.RangeIndexExpr;
import cloak.ast.expr.ReclassifyExpr;
import cloak.ast.expr.StringLiteralExpr;
import cloak.ast.expr.TupleExpr;
import cloak.ast.expr.TupleOrLocationExpr;
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
import cloak.ast.stmt.RequireStatement;
import cloak.ast.stmt.ReturnStatement;
import cloak.ast.stmt.RevertStatement;
import cloak.ast.stmt.SimpleStatement;
import cloak.ast.stmt.Statement;
import cloak.ast.stmt.TryStatement;
import cloak.ast.stmt.TupleVariableDeclarationStatement;
import cloak.ast.stmt.VariableDeclarationStatement;
import cloak.ast.stmt.WhileStatement;
import cloak.common.Logging;
import cloak.common.exceptions.CompilerError;
import cloak.common.exceptions.UserException;
import cloak.common.lang.AnnotatedTypeName;
import cloak.common.lang.Types;
import cloak.common.lang.Types.ArrayTypeName;
import cloak.common.lang.Types.ElementaryTypeName;
import cloak.common.lang.Types.Mapping;
import cloak.common.lang.Types.TypeName;
import cloak.common.lang.Types.UserDefinedTypeName;

/**
 * Builds tree nodes for a front end.
 *
 * Every {@link Production} has exactly one builder; this is checked when
 * the class is loaded.  Built nodes get their source position, and their
 * direct children are linked to them.  A source unit is linked
 * throughout, so statements and expressions also know their enclosing
 * function and statement.
 */
public class NodeFactory {

  private static final Logger logger = Logging.getCloakLogger();

  /**
   * Positional arguments of a production, with checked typed access
   */
  public static class Args {
    private final Production production;
    private final List<Object> values;

    public Args(Production production, List<Object> values) {
      this.production = production;
      this.values = values;
    }

    public int size() {
      return values.size();
    }

    private Object get(int i) {
      if (i >= values.size()) {
        throw new CompilerError(production + ": expected argument " + i +
                                ", got " + values.size() + " arguments");
      }
      return values.get(i);
    }

    /**
     * @return argument i, which may be null
     */
    public <T> T opt(int i, Class<T> cls) {
      Object o = get(i);
      if (o == null) {
        return null;
      }
      if (!cls.isInstance(o)) {
        throw new CompilerError(production + ": argument " + i +
            " should be " + cls.getSimpleName() + " but was " +
            o.getClass().getSimpleName());
      }
      return cls.cast(o);
    }

    /**
     * @return argument i, which must not be null
     */
    public <T> T req(int i, Class<T> cls) {
      T result = opt(i, cls);
      if (result == null) {
        throw new CompilerError(production + ": argument " + i +
                                " must not be null");
      }
      return result;
    }

    public String string(int i) {
      return opt(i, String.class);
    }

    public boolean flag(int i) {
      return req(i, Boolean.class);
    }

    /**
     * @return fresh mutable copy of the list argument i, checking each
     *         element; null elements are kept
     */
    public <T> List<T> list(int i, Class<T> cls) {
      List<?> l = opt(i, List.class);
      List<T> result = new ArrayList<T>();
      if (l == null) {
        return result;
      }
      for (Object o: l) {
        if (o != null && !cls.isInstance(o)) {
          throw new CompilerError(production + ": argument " + i +
              " should only contain " + cls.getSimpleName() + " but had " +
              o.getClass().getSimpleName());
        }
        result.add(cls.cast(o));
      }
      return result;
    }
  }

  /**
   * Builds the node for one production
   */
  public static interface Builder {
    public Node build(Args args, int line, int column) throws UserException;
  }

  private static final Map<Production, Builder> builders =
                        new EnumMap<Production, Builder>(Production.class);

  static {
    registerNameBuilders();
    registerTypeBuilders();
    registerExpressionBuilders();
    registerStatementBuilders();
    registerDeclarationBuilders();

    for (Production p: Production.values()) {
      if (!builders.containsKey(p)) {
        throw new CompilerError("No builder for production " + p);
      }
    }
  }

  private static void register(Production p, Builder b) {
    if (builders.put(p, b) != null) {
      throw new CompilerError("Two builders for production " + p);
    }
  }

  /**
   * Build a node and record its position
   * @param line 1-based line, -1 if unknown
   * @param column 1-based column, -1 if unknown
   */
  public static Node build(Production p, int line, int column,
                           Object ... args) throws UserException {
    if (logger.isTraceEnabled()) {
      logger.trace("build " + p + " at " + line + ":" + column);
    }
    Node node = builders.get(p).build(new Args(p, Arrays.asList(args)),
                                      line, column);
    node.setPosition(line, column);
    if (node instanceof SourceUnit) {
      node.linkParents();
    } else {
      for (Node child: node.children()) {
        child.setParent(node);
      }
    }
    return node;
  }

  /**
   * Build a node of a known class
   */
  public static <T extends Node> T build(Class<T> cls, Production p,
        int line, int column, Object ... args) throws UserException {
    Node node = build(p, line, column, args);
    if (!cls.isInstance(node)) {
      throw new CompilerError(p + " built a " +
          node.getClass().getSimpleName() + ", not a " + cls.getSimpleName());
    }
    return cls.cast(node);
  }

  /**
   * Value of a number literal as written, e.g. 0xff, 1_000 or 2e3
   */
  public static BigInteger parseNumber(String text) {
    String digits = text.replace("_", "");
    if (digits.startsWith("0x") || digits.startsWith("0X")) {
      return new BigInteger(digits.substring(2), 16);
    }
    try {
      return new BigDecimal(digits).toBigIntegerExact();
    } catch (ArithmeticException e) {
      throw new CompilerError("Number literal " + text +
                              " is not an integer");
    }
  }

  private static void registerNameBuilders() {
    register(Production.IDENTIFIER, new Builder() {
      @Override
      public Node build(Args a, int line, int column) throws UserException {
        String name = a.req(0, String.class);
        NameChecker.checkName(name, line, column);
        return new Identifier(name);
      }
    });
    register(Production.COMMENT, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new Comment(a.req(0, String.class));
      }
    });
  }

  private static void registerTypeBuilders() {
    register(Production.ELEMENTARY_TYPE, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return Types.elementaryType(a.req(0, String.class));
      }
    });
    register(Production.USER_DEFINED_TYPE, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new UserDefinedTypeName(a.list(0, Identifier.class));
      }
    });
    register(Production.MAPPING, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new Mapping(a.req(0, TypeName.class),
            a.opt(1, Identifier.class), a.req(2, AnnotatedTypeName.class));
      }
    });
    register(Production.ARRAY_TYPE, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new ArrayTypeName(a.req(0, AnnotatedTypeName.class),
                                 a.opt(1, Expression.class));
      }
    });
    register(Production.ANNOTATED_TYPE, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new AnnotatedTypeName(a.req(0, TypeName.class),
                                     a.opt(1, Expression.class));
      }
    });
  }

  private static void registerExpressionBuilders() {
    register(Production.BOOLEAN_LITERAL, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new BooleanLiteralExpr(a.flag(0));
      }
    });
    register(Production.NUMBER_LITERAL, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        String text = a.req(0, String.class);
        boolean hex = text.startsWith("0x") || text.startsWith("0X");
        return new NumberLiteralExpr(parseNumber(text), hex, text,
                                     a.string(1));
      }
    });
    register(Production.STRING_LITERAL, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new StringLiteralExpr(a.req(0, String.class));
      }
    });
    register(Production.ARRAY_LITERAL, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new ArrayLiteralExpr(a.list(0, Expression.class));
      }
    });
    register(Production.TUPLE, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new TupleExpr(a.list(0, Expression.class));
      }
    });
    register(Production.INLINE_ARRAY, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new InlineArrayExpr(a.list(0, Expression.class));
      }
    });
    register(Production.IDENTIFIER_EXPR, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new IdentifierExpr(a.req(0, Identifier.class));
      }
    });
    register(Production.MEMBER_ACCESS, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new MemberAccessExpr(a.req(0, Expression.class),
                                    a.req(1, Identifier.class));
      }
    });
    register(Production.INDEX, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new IndexExpr(a.req(0, LocationExpr.class),
                             a.opt(1, Expression.class));
      }
    });
    register(Production.RANGE_INDEX, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new RangeIndexExpr(a.req(0, LocationExpr.class),
            a.opt(1, Expression.class), a.opt(2, Expression.class));
      }
    });
    register(Production.BUILTIN_CALL, new Builder() {
      @Override
      public Node build(Args a, int line, int column) throws UserException {
        BuiltinFunction f = new BuiltinFunction(a.req(0, String.class));
        List<Expression> operands = a.list(1, Expression.class);
        if (operands.size() != f.arity()) {
          throw new CompilerError("Operator " + f.op() + " takes " +
              f.arity() + " operands, got " + operands.size());
        }
        f.setPosition(line, column);
        return new FunctionCallExpr(f, operands);
      }
    });
    register(Production.FUNCTION_CALL, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new FunctionCallExpr(a.req(0, Expression.class),
            a.req(1, CallArgumentList.class), a.flag(2));
      }
    });
    register(Production.NAMED_ARGUMENT, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new NamedArgument(a.req(0, String.class),
                                 a.req(1, Expression.class));
      }
    });
    register(Production.CALL_ARGUMENTS, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new CallArgumentList(a.list(0, Node.class), a.flag(1));
      }
    });
    register(Production.PRIMITIVE_CAST, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new PrimitiveCastExpr(a.req(0, TypeName.class),
                                     a.req(1, Expression.class));
      }
    });
    register(Production.NEW, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new NewExpr(a.req(0, TypeName.class));
      }
    });
    register(Production.META_TYPE, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new MetaTypeExpr(a.req(0, TypeName.class));
      }
    });
    register(Production.ME, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return PrivacyLabelExpr.me();
      }
    });
    register(Production.ALL, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return PrivacyLabelExpr.all();
      }
    });
    register(Production.TEE, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return PrivacyLabelExpr.tee();
      }
    });
    register(Production.RECLASSIFY, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new ReclassifyExpr(a.req(0, Expression.class),
                                  a.req(1, Expression.class));
      }
    });
  }

  private static void registerStatementBuilders() {
    register(Production.IF, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new IfStatement(a.req(0, Expression.class),
            a.req(1, Block.class), a.opt(2, Block.class));
      }
    });
    register(Production.WHILE, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new WhileStatement(a.req(0, Expression.class),
                                  a.req(1, Block.class));
      }
    });
    register(Production.DO_WHILE, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new DoWhileStatement(a.req(0, Block.class),
                                    a.req(1, Expression.class));
      }
    });
    register(Production.FOR, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new ForStatement(a.opt(0, SimpleStatement.class),
            a.opt(1, Expression.class), a.opt(2, SimpleStatement.class),
            a.req(3, Block.class));
      }
    });
    register(Production.BREAK, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new BreakStatement();
      }
    });
    register(Production.CONTINUE, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new ContinueStatement();
      }
    });
    register(Production.RETURN, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new ReturnStatement(a.opt(0, Expression.class));
      }
    });
    register(Production.EMIT, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new EmitStatement(a.req(0, Expression.class),
                                 a.req(1, CallArgumentList.class));
      }
    });
    register(Production.REVERT, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new RevertStatement(a.req(0, Expression.class),
                                   a.req(1, CallArgumentList.class));
      }
    });
    register(Production.ASSEMBLY, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new AssemblyStatement(a.req(0, String.class));
      }
    });
    register(Production.EXPRESSION_STATEMENT, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new ExpressionStatement(a.req(0, Expression.class));
      }
    });
    register(Production.REQUIRE, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new RequireStatement(a.req(0, Expression.class),
                                    a.opt(1, Expression.class));
      }
    });
    register(Production.ASSIGNMENT, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new AssignmentStatement(a.req(0, TupleOrLocationExpr.class),
                                       a.req(1, Expression.class));
      }
    });
    register(Production.COMPOUND_ASSIGNMENT, new Builder() {
      @Override
      public Node build(Args a, int line, int column) throws UserException {
        return AssignmentStatement.compound(
            a.req(0, TupleOrLocationExpr.class),
            a.req(1, TupleOrLocationExpr.class), a.req(2, String.class),
            a.req(3, Expression.class));
      }
    });
    register(Production.INC_DEC, new Builder() {
      @Override
      public Node build(Args a, int line, int column) throws UserException {
        return AssignmentStatement.incDec(
            a.req(0, TupleOrLocationExpr.class),
            a.req(1, TupleOrLocationExpr.class), a.req(2, String.class),
            a.flag(3));
      }
    });
    register(Production.VARIABLE_DECLARATION_STATEMENT, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new VariableDeclarationStatement(
            a.req(0, VariableDeclaration.class), a.opt(1, Expression.class));
      }
    });
    register(Production.TUPLE_VARIABLE_DECLARATION_STATEMENT, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new TupleVariableDeclarationStatement(
            a.list(0, VariableDeclaration.class), a.req(1, Expression.class));
      }
    });
    register(Production.BLOCK, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new Block(a.list(0, Statement.class), a.flag(1));
      }
    });
    register(Production.TRY, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new TryStatement(a.req(0, Expression.class),
            a.list(1, Parameter.class), a.req(2, Block.class),
            a.list(3, CatchClause.class));
      }
    });
    register(Production.CATCH, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new CatchClause(a.opt(0, Identifier.class),
            a.list(1, Parameter.class), a.req(2, Block.class));
      }
    });
  }

  private static void registerDeclarationBuilders() {
    register(Production.VARIABLE_DECLARATION, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new VariableDeclaration(a.list(0, String.class),
            a.req(1, AnnotatedTypeName.class), a.req(2, Identifier.class),
            a.string(3));
      }
    });
    register(Production.PARAMETER, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new Parameter(a.list(0, String.class),
            a.req(1, AnnotatedTypeName.class), a.opt(2, Identifier.class),
            a.string(3));
      }
    });
    register(Production.STATE_VARIABLE, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new StateVariableDeclaration(
            a.req(0, AnnotatedTypeName.class), a.list(1, String.class),
            a.req(2, Identifier.class), a.opt(3, Expression.class),
            a.opt(4, OverrideSpecifier.class));
      }
    });
    register(Production.CONSTANT_VARIABLE, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new ConstantVariableDeclaration(
            a.req(0, AnnotatedTypeName.class), a.req(1, Identifier.class),
            a.req(2, Expression.class));
      }
    });
    register(Production.FUNCTION, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        String keyword = a.req(0, String.class);
        ConstructorOrFunctionDefinition.Kind kind =
            ConstructorOrFunctionDefinition.Kind.fromKeyword(keyword);
        if (kind == null) {
          throw new CompilerError("Unknown function kind: " + keyword);
        }
        return new ConstructorOrFunctionDefinition(a.opt(1, Identifier.class),
            a.list(2, Parameter.class), a.list(3, Node.class),
            a.list(4, Parameter.class), a.opt(5, Block.class), kind);
      }
    });
    register(Production.MODIFIER_KEYWORD, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new ModifierKeyword(a.req(0, String.class));
      }
    });
    register(Production.MODIFIER_INVOCATION, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new ModifierInvocation(a.list(0, String.class),
                                      a.opt(1, CallArgumentList.class));
      }
    });
    register(Production.OVERRIDE_SPECIFIER, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        List<List<String>> paths = new ArrayList<List<String>>();
        for (List<?> path: a.list(0, List.class)) {
          List<String> p = new ArrayList<String>();
          for (Object o: path) {
            p.add((String)o);
          }
          paths.add(p);
        }
        return new OverrideSpecifier(paths);
      }
    });
    register(Production.MODIFIER_DEFINITION, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new ModifierDefinition(a.req(0, Identifier.class),
            a.list(1, Parameter.class), a.flag(2),
            a.list(3, OverrideSpecifier.class), a.opt(4, Block.class));
      }
    });
    register(Production.ENUM_VALUE, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new EnumValue(a.req(0, Identifier.class));
      }
    });
    register(Production.ENUM_DEFINITION, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new EnumDefinition(a.req(0, Identifier.class),
                                  a.list(1, EnumValue.class));
      }
    });
    register(Production.USER_DEFINED_VALUE_TYPE, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new UserDefinedValueTypeDefinition(a.req(0, Identifier.class),
            a.req(1, ElementaryTypeName.class));
      }
    });
    register(Production.EVENT_PARAMETER, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new EventParameter(a.req(0, AnnotatedTypeName.class),
            a.flag(1), a.opt(2, Identifier.class));
      }
    });
    register(Production.EVENT_DEFINITION, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new EventDefinition(a.req(0, Identifier.class),
            a.list(1, EventParameter.class), a.flag(2));
      }
    });
    register(Production.ERROR_PARAMETER, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new ErrorParameter(a.req(0, AnnotatedTypeName.class),
                                  a.opt(1, Identifier.class));
      }
    });
    register(Production.ERROR_DEFINITION, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new ErrorDefinition(a.req(0, Identifier.class),
                                   a.list(1, ErrorParameter.class));
      }
    });
    register(Production.USING, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new UsingDirective(a.list(0, String.class),
                                  a.opt(1, TypeName.class));
      }
    });
    register(Production.STRUCT_DEFINITION, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new StructDefinition(a.req(0, Identifier.class),
                                    a.list(1, VariableDeclaration.class));
      }
    });
    register(Production.CONTRACT, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new ContractDefinition(a.req(0, Identifier.class),
                                      a.list(1, Node.class));
      }
    });
    register(Production.PRAGMA, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new PragmaDirective(a.req(0, String.class),
                                   a.req(1, String.class));
      }
    });
    register(Production.IMPORT, new Builder() {
      @Override
      @SuppressWarnings("unchecked")
      public Node build(Args a, int line, int column) {
        return new ImportDirective(a.req(0, String.class), a.string(1),
                                   a.opt(2, Map.class));
      }
    });
    register(Production.INHERITANCE_SPECIFIER, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new InheritanceSpecifier(a.list(0, String.class),
                                        a.opt(1, CallArgumentList.class));
      }
    });
    register(Production.INTERFACE, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new InterfaceDefinition(a.req(0, Identifier.class),
            a.list(1, InheritanceSpecifier.class), a.list(2, Node.class));
      }
    });
    register(Production.LIBRARY, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        return new LibraryDefinition(a.req(0, Identifier.class),
                                     a.list(1, Node.class));
      }
    });
    register(Production.SOURCE_UNIT, new Builder() {
      @Override
      public Node build(Args a, int line, int column) {
        SourceUnit unit = new SourceUnit(a.list(0, Node.class));
        String code = a.string(1);
        if (code != null) {
          unit.setOriginalCode(code);
        }
        return unit;
      }
    });
  }
}
