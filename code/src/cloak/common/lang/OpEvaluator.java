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

import java.math.BigInteger;
import java.util.List;

import cloak.common.lang.Operators.BuiltinOp;

/**
 * Compile time evaluation of builtin operators on constant operands.
 * Integers are {@link BigInteger}, booleans are {@link Boolean}.
 */
public class OpEvaluator {

  /** Largest shift or exponent that is folded */
  private static final BigInteger FOLD_LIMIT =
                          BigInteger.valueOf(Types.MAX_BITWIDTH);

  /**
   * Try to do compile-time evaluation of operator
   *
   * @param op
   * @param inputs operand values, null where not constant
   * @return value of the operation, or null if it cannot be evaluated at
   *         compile time
   */
  public static Object eval(BuiltinOp op, List<?> inputs) {
    if (inputs.size() != op.arity()) {
      return null;
    }
    if (op.hasShortCircuiting()) {
      return evalShortCircuit(op, inputs);
    }
    for (Object in: inputs) {
      if (in == null) {
        return null;
      }
    }
    if (op.isParenthesis()) {
      return inputs.get(0);
    }

    boolean allInt = true;
    boolean allBool = true;
    for (Object in: inputs) {
      allInt = allInt && in instanceof BigInteger;
      allBool = allBool && in instanceof Boolean;
    }
    if (allInt) {
      return evalIntOp(op, inputs);
    } else if (allBool) {
      return evalBoolOp(op, inputs);
    }
    return null;
  }

  /**
   * Operators where one known operand may decide the result
   */
  private static Object evalShortCircuit(BuiltinOp op, List<?> inputs) {
    Object arg1 = inputs.get(0);
    if (op == BuiltinOp.ITE) {
      if (!(arg1 instanceof Boolean)) {
        return null;
      }
      return ((Boolean)arg1) ? inputs.get(1) : inputs.get(2);
    }

    Object arg2 = inputs.get(1);
    if (arg1 != null && !(arg1 instanceof Boolean)) {
      return null;
    }
    if (arg2 != null && !(arg2 instanceof Boolean)) {
      return null;
    }
    if (arg1 != null) {
      boolean b1 = (Boolean)arg1;
      if (op == BuiltinOp.AND && !b1) {
        return false;
      } else if (op == BuiltinOp.OR && b1) {
        return true;
      } else if (arg2 != null) {
        return arg2;
      }
    }
    return null;
  }

  private static Object evalIntOp(BuiltinOp op, List<?> inputs) {
    BigInteger arg1 = (BigInteger)inputs.get(0);
    if (op.arity() == 1) {
      switch (op) {
        case SIGN_PLUS:
          return arg1;
        case SIGN_MINUS:
          return arg1.negate();
        case BIT_NOT:
          return arg1.not();
        default:
          return null;
      }
    }

    BigInteger arg2 = (BigInteger)inputs.get(1);
    switch (op) {
      case PLUS:
        return arg1.add(arg2);
      case MINUS:
        return arg1.subtract(arg2);
      case MULT:
        return arg1.multiply(arg2);
      case DIV:
        if (arg2.signum() == 0) {
          // Leave to runtime
          return null;
        }
        return floorDiv(arg1, arg2);
      case MOD:
        if (arg2.signum() == 0) {
          return null;
        }
        return arg1.subtract(floorDiv(arg1, arg2).multiply(arg2));
      case POW:
        return pow(arg1, arg2);
      case LT:
        return arg1.compareTo(arg2) < 0;
      case GT:
        return arg1.compareTo(arg2) > 0;
      case LTE:
        return arg1.compareTo(arg2) <= 0;
      case GTE:
        return arg1.compareTo(arg2) >= 0;
      case EQ:
        return arg1.equals(arg2);
      case NEQ:
        return !arg1.equals(arg2);
      case BIT_OR:
        return arg1.or(arg2);
      case BIT_AND:
        return arg1.and(arg2);
      case BIT_XOR:
        return arg1.xor(arg2);
      case SHL:
        if (arg2.signum() < 0 || arg2.compareTo(FOLD_LIMIT) > 0) {
          return null;
        }
        return fits(arg1.shiftLeft(arg2.intValue()));
      case SHR:
        if (arg2.signum() < 0) {
          return null;
        }
        if (arg2.compareTo(FOLD_LIMIT) > 0) {
          // Everything is shifted out
          return arg1.signum() < 0 ? BigInteger.ONE.negate() : BigInteger.ZERO;
        }
        return arg1.shiftRight(arg2.intValue());
      default:
        return null;
    }
  }

  private static Object evalBoolOp(BuiltinOp op, List<?> inputs) {
    boolean arg1 = (Boolean)inputs.get(0);
    if (op == BuiltinOp.NOT) {
      return !arg1;
    }
    if (op.arity() != 2) {
      return null;
    }
    boolean arg2 = (Boolean)inputs.get(1);
    switch (op) {
      case EQ:
        return arg1 == arg2;
      case NEQ:
        return arg1 != arg2;
      default:
        return null;
    }
  }

  /**
   * Exponent with a result of at most {@link Types#MAX_BITWIDTH} bits,
   * or null
   */
  private static BigInteger pow(BigInteger base, BigInteger exponent) {
    if (exponent.signum() < 0) {
      return null;
    }
    if (base.abs().compareTo(BigInteger.ONE) <= 0) {
      // 0, 1 and -1 stay small for any exponent
      if (base.signum() < 0 && exponent.testBit(0)) {
        return base;
      }
      return exponent.signum() == 0 ? BigInteger.ONE : base.abs();
    }
    if (exponent.compareTo(FOLD_LIMIT) > 0) {
      return null;
    }
    return fits(base.pow(exponent.intValue()));
  }

  private static BigInteger fits(BigInteger value) {
    return value.bitLength() > Types.MAX_BITWIDTH ? null : value;
  }

  /**
   * Integer division rounding towards negative infinity
   */
  static BigInteger floorDiv(BigInteger a, BigInteger b) {
    BigInteger[] qr = a.divideAndRemainder(b);
    if (qr[1].signum() != 0 && (qr[1].signum() != b.signum())) {
      return qr[0].subtract(BigInteger.ONE);
    }
    return qr[0];
  }
}
