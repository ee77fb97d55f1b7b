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
package cloak.common.lang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import cloak.common.exceptions.UnknownOperatorException;
import cloak.common.lang.Types.TypeName;

/**
 * Builtin operators of the contract language
 */
public class Operators {

  public static enum OpCategory {
    ARITHMETIC,
    COMPARISON,
    EQUALITY,
    BOOLEAN,
    BITWISE,
    SHIFT,
    TERNARY,
    PARENTHESIS,
  }

  /**
   * Each operator prints through a template with one %s per operand.
   */
  public static enum BuiltinOp {
    POW("**", "%s ** %s", OpCategory.ARITHMETIC),
    MULT("*", "%s * %s", OpCategory.ARITHMETIC),
    DIV("/", "%s / %s", OpCategory.ARITHMETIC),
    MOD("%", "%s %% %s", OpCategory.ARITHMETIC),
    PLUS("+", "%s + %s", OpCategory.ARITHMETIC),
    MINUS("-", "%s - %s", OpCategory.ARITHMETIC),
    SIGN_PLUS("sign+", "+%s", OpCategory.ARITHMETIC),
    SIGN_MINUS("sign-", "-%s", OpCategory.ARITHMETIC),
    LT("<", "%s < %s", OpCategory.COMPARISON),
    GT(">", "%s > %s", OpCategory.COMPARISON),
    LTE("<=", "%s <= %s", OpCategory.COMPARISON),
    GTE(">=", "%s >= %s", OpCategory.COMPARISON),
    EQ("==", "%s == %s", OpCategory.EQUALITY),
    NEQ("!=", "%s != %s", OpCategory.EQUALITY),
    AND("&&", "%s && %s", OpCategory.BOOLEAN),
    OR("||", "%s || %s", OpCategory.BOOLEAN),
    NOT("!", "!%s", OpCategory.BOOLEAN),
    BIT_OR("|", "%s | %s", OpCategory.BITWISE),
    BIT_AND("&", "%s & %s", OpCategory.BITWISE),
    BIT_XOR("^", "%s ^ %s", OpCategory.BITWISE),
    BIT_NOT("~", "~%s", OpCategory.BITWISE),
    SHL("<<", "%s << %s", OpCategory.SHIFT),
    SHR(">>", "%s >> %s", OpCategory.SHIFT),
    ITE("ite", "%s ? %s : %s", OpCategory.TERNARY),
    PARENTHESIS("parenthesis", "(%s)", OpCategory.PARENTHESIS),
    ;

    private final String symbol;
    private final String template;
    private final OpCategory category;
    private final int arity;

    private BuiltinOp(String symbol, String template, OpCategory category) {
      this.symbol = symbol;
      this.template = template;
      this.category = category;
      this.arity = template.split("%s", -1).length - 1;
    }

    public String symbol() {
      return symbol;
    }

    public String template() {
      return template;
    }

    public OpCategory category() {
      return category;
    }

    public int arity() {
      return arity;
    }

    /**
     * Render the operator applied to already rendered operands
     */
    public String format(List<String> operands) {
      return String.format(template, operands.toArray());
    }

    public boolean isArithmetic() {
      return category == OpCategory.ARITHMETIC;
    }

    public boolean isNegSign() {
      return this == SIGN_MINUS;
    }

    public boolean isComparison() {
      return category == OpCategory.COMPARISON;
    }

    public boolean isEquality() {
      return category == OpCategory.EQUALITY;
    }

    public boolean isBoolean() {
      return category == OpCategory.BOOLEAN;
    }

    public boolean isBitwise() {
      return category == OpCategory.BITWISE;
    }

    public boolean isShift() {
      return category == OpCategory.SHIFT;
    }

    public boolean isIte() {
      return this == ITE;
    }

    public boolean isParenthesis() {
      return this == PARENTHESIS;
    }

    public boolean hasShortCircuiting() {
      return this == AND || this == OR || this == ITE;
    }

    /**
     * @return true if the operation itself can be evaluated in a private
     *         circuit; for equality and ite the operands must be checked
     *         separately
     */
    public boolean canBePrivate() {
      return this != POW && this != MOD && this != DIV;
    }

    /**
     * @return operand types, or null if the operator is generic
     */
    public List<TypeName> inputTypes() {
      TypeName t;
      switch (category) {
        case ARITHMETIC:
        case COMPARISON:
        case BITWISE:
        case SHIFT:
          t = Types.numberType();
          break;
        case BOOLEAN:
          t = Types.boolType();
          break;
        default:
          return null;
      }
      return Collections.nCopies(arity, t);
    }

    /**
     * @return result type, or null if the operator is generic
     */
    public TypeName outputType() {
      switch (category) {
        case ARITHMETIC:
        case BITWISE:
        case SHIFT:
          return Types.numberType();
        case COMPARISON:
        case EQUALITY:
        case BOOLEAN:
          return Types.boolType();
        default:
          return null;
      }
    }
  }

  private static final Map<String, BuiltinOp> bySymbol =
                                    new HashMap<String, BuiltinOp>();

  static {
    for (BuiltinOp op: BuiltinOp.values()) {
      bySymbol.put(op.symbol(), op);
    }
  }

  public static BuiltinOp fromSymbol(String symbol)
                              throws UnknownOperatorException {
    BuiltinOp op = bySymbol.get(symbol);
    if (op == null) {
      throw new UnknownOperatorException(symbol);
    }
    return op;
  }

  public static boolean isBuiltin(String symbol) {
    return bySymbol.containsKey(symbol);
  }

  public static List<BuiltinOp> inCategory(OpCategory category) {
    List<BuiltinOp> result = new ArrayList<BuiltinOp>();
    for (BuiltinOp op: BuiltinOp.values()) {
      if (op.category() == category) {
        result.add(op);
      }
    }
    return result;
  }
}
