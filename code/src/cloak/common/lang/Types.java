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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import cloak.ast.Identifier;
import cloak.ast.Node;
import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;
import cloak.ast.decl.NamespaceDefinition;
import cloak.ast.decl.Parameter;
import cloak.ast.expr.Expression;
import cloak.ast.expr.NumberLiteralExpr;
import cloak.common.exceptions.CompilerError;

/**
 * Type names of the contract language.  Types are tree nodes, so that
 * they can appear in declarations, but they are never modified once
 * built: analysis results refer to them by value.
 */
public class Types {

  public static final int ADDRESS_BITWIDTH = 160;
  public static final int MAX_BITWIDTH = 256;

  public abstract static class TypeName extends Node {

    /**
     * @return true if a value of this type can be used where the expected
     *         type is required without an explicit conversion
     */
    public boolean implicitlyConvertibleTo(TypeName expected) {
      return expected.equals(this);
    }

    public boolean compatibleWith(TypeName other) {
      return implicitlyConvertibleTo(other) ||
             other.implicitlyConvertibleTo(this);
    }

    /**
     * Find the type both this and other convert into.
     * @param convertLiterals if false, two literals are reported as
     *              still literal rather than widened
     */
    public TypeCombination combinedType(TypeName other,
                                        boolean convertLiterals) {
      if (other.implicitlyConvertibleTo(this)) {
        return TypeCombination.of(this);
      } else if (this.implicitlyConvertibleTo(other)) {
        return TypeCombination.of(other);
      }
      return TypeCombination.none();
    }

    public AnnotatedTypeName annotate(Expression privacyAnnotation) {
      return new AnnotatedTypeName(this, privacyAnnotation);
    }

    /**
     * @return how many uints this type occupies when serialized
     */
    public int sizeInUints() {
      return 1;
    }

    /**
     * Bit width, only defined for primitive types
     */
    public int elemBitwidth() {
      throw new CompilerError("elemBitwidth() not implemented for " +
                              getClass().getSimpleName());
    }

    public boolean isLiteral() {
      return false;
    }

    /**
     * @return smallest non-literal type that represents this type's values
     */
    public TypeName toAbstractType() {
      return this;
    }

    public boolean isAddress() {
      return false;
    }

    public boolean isPrimitiveType() {
      return false;
    }

    public boolean isNumeric() {
      return false;
    }

    public boolean isBoolean() {
      return false;
    }

    public boolean isSignedNumeric() {
      return false;
    }

    public boolean isMapping() {
      return false;
    }

    public boolean canBePrivate() {
      return isPrimitiveType() &&
          !(isSignedNumeric() && elemBitwidth() == MAX_BITWIDTH);
    }

    @Override
    public abstract boolean equals(Object obj);

    @Override
    public abstract int hashCode();
  }

  public static class ElementaryTypeName extends TypeName {
    private final String name;

    public ElementaryTypeName(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public boolean isPrimitiveType() {
      return true;
    }

    @Override
    public boolean equals(Object obj) {
      return obj != null && obj.getClass() == getClass() &&
             ((ElementaryTypeName)obj).name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitElementaryTypeName(this);
    }
  }

  public static class BoolTypeName extends ElementaryTypeName {
    public BoolTypeName() {
      super("bool");
    }

    @Override
    public int elemBitwidth() {
      return 1;
    }

    @Override
    public boolean isBoolean() {
      return true;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof BoolTypeName;
    }

    @Override
    public int hashCode() {
      return BoolTypeName.class.hashCode();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitBoolTypeName(this);
    }
  }

  public static class BooleanLiteralType extends ElementaryTypeName {
    private final boolean value;

    public BooleanLiteralType(boolean value) {
      super(value ? "true" : "false");
      this.value = value;
    }

    public boolean value() {
      return value;
    }

    @Override
    public boolean implicitlyConvertibleTo(TypeName expected) {
      return super.implicitlyConvertibleTo(expected) ||
             expected instanceof BoolTypeName;
    }

    @Override
    public TypeCombination combinedType(TypeName other,
                                        boolean convertLiterals) {
      if (other instanceof BooleanLiteralType) {
        return convertLiterals ? TypeCombination.of(boolType())
                               : TypeCombination.stillLiteral();
      }
      return super.combinedType(other, convertLiterals);
    }

    @Override
    public int elemBitwidth() {
      return 1;
    }

    @Override
    public boolean isLiteral() {
      return true;
    }

    @Override
    public boolean isBoolean() {
      return true;
    }

    @Override
    public TypeName toAbstractType() {
      return boolType();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof BooleanLiteralType;
    }

    @Override
    public int hashCode() {
      return BooleanLiteralType.class.hashCode();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitBooleanLiteralType(this);
    }
  }

  /**
   * Integer type.  A bit width of 0 means the unqualified name, which
   * behaves as 256 bits.  The type with empty name stands for "any number".
   */
  public static class NumberTypeName extends ElementaryTypeName {
    private final String prefix;
    private final boolean signed;
    private final int sizeInBits;

    public NumberTypeName(String name, String prefix, boolean signed,
                          int bitwidth) {
      super(name);
      if (!name.startsWith(prefix)) {
        throw new CompilerError("Type name " + name +
                                " does not start with " + prefix);
      }
      this.prefix = prefix;
      this.signed = signed;
      this.sizeInBits = bitwidth;
    }

    public NumberTypeName(String name, String prefix, boolean signed) {
      this(name, prefix, signed, parseBitwidth(name, prefix));
    }

    private static int parseBitwidth(String name, String prefix) {
      if (name.length() <= prefix.length()) {
        return 0;
      }
      try {
        return Integer.parseInt(name.substring(prefix.length()));
      } catch (NumberFormatException e) {
        throw new CompilerError("Bad bit width in type name " + name);
      }
    }

    /**
     * @return the generic number type every number converts into
     */
    public static NumberTypeName any() {
      return new NumberTypeName("", "", true, MAX_BITWIDTH);
    }

    public String prefix() {
      return prefix;
    }

    public boolean signed() {
      return signed;
    }

    @Override
    public boolean implicitlyConvertibleTo(TypeName expected) {
      return super.implicitlyConvertibleTo(expected) ||
             expected.getClass() == NumberTypeName.class;
    }

    @Override
    public int elemBitwidth() {
      return sizeInBits == 0 ? MAX_BITWIDTH : sizeInBits;
    }

    /**
     * @return true if value is within the range of this type
     */
    public boolean canRepresent(BigInteger value) {
      int w = elemBitwidth();
      BigInteger lo, hi;
      if (signed) {
        lo = BigInteger.ONE.shiftLeft(w - 1).negate();
        hi = BigInteger.ONE.shiftLeft(w - 1);
      } else {
        lo = BigInteger.ZERO;
        hi = BigInteger.ONE.shiftLeft(w);
      }
      return lo.compareTo(value) <= 0 && value.compareTo(hi) < 0;
    }

    @Override
    public boolean isNumeric() {
      return true;
    }

    @Override
    public boolean isSignedNumeric() {
      return signed;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof NumberTypeName &&
             ((NumberTypeName)obj).name().equals(name());
    }

    @Override
    public int hashCode() {
      return name().hashCode();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitNumberTypeName(this);
    }
  }

  public static class NumberLiteralType extends NumberTypeName {
    private final BigInteger value;

    public NumberLiteralType(BigInteger value) {
      super(value.toString(), value.toString(), value.signum() < 0,
            literalBitwidth(value));
      this.value = value;
    }

    public NumberLiteralType(long value) {
      this(BigInteger.valueOf(value));
    }

    /**
     * Smallest multiple of 8 bits, at least 8 and at most 256, that holds
     * the value in two's complement (signed) or plain binary (unsigned)
     */
    public static int literalBitwidth(BigInteger value) {
      int blen = value.abs().bitLength();
      int bitwidth;
      if (value.signum() < 0) {
        BigInteger minForLength = BigInteger.ONE.shiftLeft(blen - 1).negate();
        bitwidth = value.equals(minForLength) ? blen : blen + 1;
      } else {
        bitwidth = blen;
      }
      bitwidth = ((bitwidth + 7) / 8) * 8;
      return Math.min(Math.max(bitwidth, 8), MAX_BITWIDTH);
    }

    public BigInteger value() {
      return value;
    }

    @Override
    public boolean implicitlyConvertibleTo(TypeName expected) {
      if (expected.isNumeric() && !expected.isLiteral()) {
        return ((NumberTypeName)expected).canRepresent(value);
      } else if (expected.isAddress() && elemBitwidth() == ADDRESS_BITWIDTH
                 && !signed()) {
        return true;
      }
      return super.implicitlyConvertibleTo(expected);
    }

    @Override
    public TypeCombination combinedType(TypeName other,
                                        boolean convertLiterals) {
      if (other instanceof NumberLiteralType) {
        if (!convertLiterals) {
          return TypeCombination.stillLiteral();
        }
        return toAbstractType().combinedType(other.toAbstractType(), true);
      }
      return super.combinedType(other, convertLiterals);
    }

    @Override
    public TypeName toAbstractType() {
      if (value.signum() < 0) {
        return new IntTypeName("int" + elemBitwidth());
      } else {
        return new UintTypeName("uint" + elemBitwidth());
      }
    }

    @Override
    public boolean isLiteral() {
      return true;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof NumberLiteralType;
    }

    @Override
    public int hashCode() {
      return NumberLiteralType.class.hashCode();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitNumberLiteralType(this);
    }
  }

  public static class IntTypeName extends NumberTypeName {
    public IntTypeName(String name) {
      super(name, "int", true);
    }

    public IntTypeName() {
      this("int");
    }

    @Override
    public boolean implicitlyConvertibleTo(TypeName expected) {
      return super.implicitlyConvertibleTo(expected) ||
          (expected instanceof IntTypeName &&
           expected.elemBitwidth() >= elemBitwidth());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitIntTypeName(this);
    }
  }

  public static class UintTypeName extends NumberTypeName {
    public UintTypeName(String name) {
      super(name, "uint", false);
    }

    public UintTypeName() {
      this("uint");
    }

    @Override
    public boolean implicitlyConvertibleTo(TypeName expected) {
      return super.implicitlyConvertibleTo(expected) ||
          (expected instanceof UintTypeName &&
           expected.elemBitwidth() >= elemBitwidth());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitUintTypeName(this);
    }
  }

  public static class BytesTypeName extends ElementaryTypeName {
    /** Fixed length, or -1 for dynamic bytes */
    private final int length;

    public BytesTypeName(String name) {
      super(name);
      if (!name.startsWith("bytes")) {
        throw new CompilerError("Not a bytes type: " + name);
      }
      String len = name.substring("bytes".length());
      this.length = len.isEmpty() ? -1 : Integer.parseInt(len);
    }

    public BytesTypeName() {
      this("bytes");
    }

    public int length() {
      return length;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitBytesTypeName(this);
    }
  }

  public static class StringTypeName extends ElementaryTypeName {
    public StringTypeName() {
      super("string");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitStringTypeName(this);
    }
  }

  /**
   * Type referring to a named definition.  The target is set by symbol
   * resolution.
   */
  public static class UserDefinedTypeName extends TypeName {
    private final List<Identifier> names;
    private NamespaceDefinition target;

    public UserDefinedTypeName(List<Identifier> names,
                               NamespaceDefinition target) {
      this.names = names;
      this.target = target;
    }

    public UserDefinedTypeName(List<Identifier> names) {
      this(names, null);
    }

    public List<Identifier> names() {
      return names;
    }

    public NamespaceDefinition target() {
      return target;
    }

    public void setTarget(NamespaceDefinition target) {
      this.target = target;
    }

    /**
     * @return dotted path, from the resolved target if known
     */
    public List<String> path() {
      List<Identifier> idfs = names;
      if (target != null && !target.qualifiedName().isEmpty()) {
        idfs = target.qualifiedName();
      }
      List<String> result = new ArrayList<String>(idfs.size());
      for (Identifier idf: idfs) {
        result.add(idf.name());
      }
      return result;
    }

    @Override
    public void processChildren(TreeRewriter rewriter) {
      rewriteChildren(rewriter, names, Identifier.class);
    }

    /**
     * All user-defined types compare by qualified path, whether resolved
     * or not and whatever their kind.  Address types have reserved paths.
     */
    @Override
    public final boolean equals(Object obj) {
      return obj instanceof UserDefinedTypeName &&
             ((UserDefinedTypeName)obj).path().equals(path());
    }

    @Override
    public final int hashCode() {
      return path().hashCode();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitUserDefinedTypeName(this);
    }
  }

  public static class EnumTypeName extends UserDefinedTypeName {
    public EnumTypeName(List<Identifier> names, NamespaceDefinition target) {
      super(names, target);
    }

    @Override
    public int elemBitwidth() {
      return MAX_BITWIDTH;
    }

    @Override
    public boolean isPrimitiveType() {
      return true;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitEnumTypeName(this);
    }
  }

  /**
   * Type of a single enum member; names end with the member name.
   */
  public static class EnumValueTypeName extends UserDefinedTypeName {
    public EnumValueTypeName(List<Identifier> names,
                             NamespaceDefinition target) {
      super(names, target);
    }

    @Override
    public int elemBitwidth() {
      return MAX_BITWIDTH;
    }

    @Override
    public boolean isPrimitiveType() {
      return true;
    }

    @Override
    public boolean isLiteral() {
      return true;
    }

    private List<String> enumPath() {
      List<String> path = path();
      return path.subList(0, path.size() - 1);
    }

    @Override
    public TypeName toAbstractType() {
      List<Identifier> enumNames =
          new ArrayList<Identifier>(names().subList(0, names().size() - 1));
      NamespaceDefinition enumDef = null;
      if (target() != null && target().parent() instanceof NamespaceDefinition) {
        enumDef = (NamespaceDefinition)target().parent();
      }
      return new EnumTypeName(enumNames, enumDef);
    }

    @Override
    public boolean implicitlyConvertibleTo(TypeName expected) {
      return super.implicitlyConvertibleTo(expected) ||
          (expected instanceof EnumTypeName &&
           ((EnumTypeName)expected).path().equals(enumPath()));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitEnumValueTypeName(this);
    }
  }

  public static class StructTypeName extends UserDefinedTypeName {
    public StructTypeName(List<Identifier> names, NamespaceDefinition target) {
      super(names, target);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitStructTypeName(this);
    }
  }

  public static class ContractTypeName extends UserDefinedTypeName {
    public ContractTypeName(List<Identifier> names,
                            NamespaceDefinition target) {
      super(names, target);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitContractTypeName(this);
    }
  }

  public static class AddressTypeName extends UserDefinedTypeName {
    public AddressTypeName() {
      super(new ArrayList<Identifier>(Collections.singletonList(
                                      new Identifier("<address>"))));
    }

    @Override
    public int elemBitwidth() {
      return ADDRESS_BITWIDTH;
    }

    @Override
    public boolean isAddress() {
      return true;
    }

    @Override
    public boolean isPrimitiveType() {
      return true;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitAddressTypeName(this);
    }
  }

  public static class AddressPayableTypeName extends UserDefinedTypeName {
    public AddressPayableTypeName() {
      super(new ArrayList<Identifier>(Collections.singletonList(
                                      new Identifier("<address_payable>"))));
    }

    @Override
    public boolean implicitlyConvertibleTo(TypeName expected) {
      return super.implicitlyConvertibleTo(expected) ||
             expected.equals(addressType());
    }

    @Override
    public int elemBitwidth() {
      return ADDRESS_BITWIDTH;
    }

    @Override
    public boolean isAddress() {
      return true;
    }

    @Override
    public boolean isPrimitiveType() {
      return true;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitAddressPayableTypeName(this);
    }
  }

  /**
   * Mapping from an elementary key to a value.  The key label names the
   * owner of each entry and does not take part in type equality.
   */
  public static class Mapping extends TypeName {
    private TypeName keyType;
    private Identifier keyLabel;
    private AnnotatedTypeName valueType;

    /** Key expression of the index expression this type was read at */
    private Expression instantiatedKey = null;

    public Mapping(TypeName keyType, Identifier keyLabel,
                   AnnotatedTypeName valueType) {
      this.keyType = keyType;
      this.keyLabel = keyLabel;
      this.valueType = valueType;
    }

    public TypeName keyType() {
      return keyType;
    }

    public Identifier keyLabel() {
      return keyLabel;
    }

    public boolean hasKeyLabel() {
      return keyLabel != null;
    }

    public AnnotatedTypeName valueType() {
      return valueType;
    }

    public Expression instantiatedKey() {
      return instantiatedKey;
    }

    public void setInstantiatedKey(Expression instantiatedKey) {
      this.instantiatedKey = instantiatedKey;
    }

    @Override
    public boolean isMapping() {
      return true;
    }

    /**
     * @return number of directly nested mappings, counting this one
     */
    public int mapDepth() {
      int depth = 1;
      TypeName inner = valueType.typeName();
      while (inner instanceof Mapping) {
        depth++;
        inner = ((Mapping)inner).valueType.typeName();
      }
      return depth;
    }

    /**
     * Flatten nested mappings.
     * @return (depth, key types outermost first, innermost value type)
     */
    public MappingSplit split() {
      List<TypeName> keys = new ArrayList<TypeName>();
      Mapping map = this;
      keys.add(map.keyType);
      while (map.valueType.typeName() instanceof Mapping) {
        map = (Mapping)map.valueType.typeName();
        keys.add(map.keyType);
      }
      return new MappingSplit(keys.size(), keys, map.valueType);
    }

    @Override
    public void processChildren(TreeRewriter rewriter) {
      keyType = rewriteChild(rewriter, keyType, TypeName.class);
      keyLabel = rewriteChild(rewriter, keyLabel, Identifier.class);
      valueType = rewriteChild(rewriter, valueType, AnnotatedTypeName.class);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Mapping)) {
        return false;
      }
      Mapping other = (Mapping)obj;
      return keyType.equals(other.keyType) &&
             valueType.equals(other.valueType);
    }

    @Override
    public int hashCode() {
      return keyType.hashCode() * 31 + valueType.hashCode();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitMapping(this);
    }
  }

  public static class MappingSplit {
    public final int depth;
    public final List<TypeName> keyTypes;
    public final AnnotatedTypeName valueType;

    public MappingSplit(int depth, List<TypeName> keyTypes,
                        AnnotatedTypeName valueType) {
      this.depth = depth;
      this.keyTypes = Collections.unmodifiableList(keyTypes);
      this.valueType = valueType;
    }
  }

  public static class ArrayTypeName extends TypeName {
    /** Reported by {@link #sizeInUints()} when the length is not known */
    public static final int UNKNOWN_SIZE = -1;

    private AnnotatedTypeName valueType;
    private Expression length;

    /**
     * @param length static length, or null for a dynamic array
     */
    public ArrayTypeName(AnnotatedTypeName valueType, Expression length) {
      this.valueType = valueType;
      this.length = length;
    }

    public ArrayTypeName(AnnotatedTypeName valueType) {
      this(valueType, null);
    }

    public AnnotatedTypeName valueType() {
      return valueType;
    }

    public Expression length() {
      return length;
    }

    @Override
    public int sizeInUints() {
      if (length instanceof NumberLiteralExpr) {
        return ((NumberLiteralExpr)length).value().intValue();
      }
      return UNKNOWN_SIZE;
    }

    @Override
    public int elemBitwidth() {
      return valueType.typeName().elemBitwidth();
    }

    @Override
    public void processChildren(TreeRewriter rewriter) {
      valueType = rewriteChild(rewriter, valueType, AnnotatedTypeName.class);
      length = rewriteChild(rewriter, length, Expression.class);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ArrayTypeName)) {
        return false;
      }
      ArrayTypeName other = (ArrayTypeName)obj;
      if (!valueType.equals(other.valueType)) {
        return false;
      }
      if (length == null && other.length == null) {
        return true;
      }
      return length instanceof NumberLiteralExpr &&
             other.length instanceof NumberLiteralExpr &&
             ((NumberLiteralExpr)length).value().equals(
                            ((NumberLiteralExpr)other.length).value());
    }

    @Override
    public int hashCode() {
      return valueType.hashCode();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitArrayTypeName(this);
    }
  }

  /**
   * Type of a multi-valued expression.  Never written in source; the
   * components belong to the expressions they were taken from.
   */
  public static class TupleType extends TypeName {
    private final List<AnnotatedTypeName> types;

    public TupleType(List<AnnotatedTypeName> types) {
      this.types = types;
    }

    public static TupleType empty() {
      return new TupleType(new ArrayList<AnnotatedTypeName>());
    }

    /**
     * @return t itself if it is a tuple, else a tuple with t as only member
     */
    public static AnnotatedTypeName ensureTuple(AnnotatedTypeName t) {
      if (t == null) {
        return new AnnotatedTypeName(empty());
      } else if (t.typeName() instanceof TupleType) {
        return t;
      }
      List<AnnotatedTypeName> types = new ArrayList<AnnotatedTypeName>();
      types.add(t);
      return new AnnotatedTypeName(new TupleType(types));
    }

    public List<AnnotatedTypeName> types() {
      return types;
    }

    public int size() {
      return types.size();
    }

    public AnnotatedTypeName get(int i) {
      return types.get(i);
    }

    @Override
    public boolean implicitlyConvertibleTo(TypeName expected) {
      if (!sameArity(expected)) {
        return false;
      }
      TupleType other = (TupleType)expected;
      for (int i = 0; i < types.size(); i++) {
        if (!types.get(i).typeName().implicitlyConvertibleTo(
                                  other.types.get(i).typeName())) {
          return false;
        }
      }
      return true;
    }

    @Override
    public boolean compatibleWith(TypeName other) {
      if (!sameArity(other)) {
        return false;
      }
      TupleType tuple = (TupleType)other;
      for (int i = 0; i < types.size(); i++) {
        if (!types.get(i).typeName().compatibleWith(
                                   tuple.types.get(i).typeName())) {
          return false;
        }
      }
      return true;
    }

    @Override
    public TypeCombination combinedType(TypeName other,
                                        boolean convertLiterals) {
      if (!sameArity(other)) {
        return TypeCombination.none();
      }
      TupleType tuple = (TupleType)other;
      List<AnnotatedTypeName> combined = new ArrayList<AnnotatedTypeName>();
      boolean stillLiteral = false;
      for (int i = 0; i < types.size(); i++) {
        TypeCombination c = types.get(i).typeName().combinedType(
                          tuple.types.get(i).typeName(), convertLiterals);
        if (c.isNone()) {
          return TypeCombination.none();
        } else if (c.isStillLiteral()) {
          stillLiteral = true;
        } else {
          combined.add(new AnnotatedTypeName(c.type()));
        }
      }
      if (stillLiteral) {
        return TypeCombination.stillLiteral();
      }
      return TypeCombination.of(new TupleType(combined));
    }

    /**
     * Annotate every component with the same label
     */
    @Override
    public AnnotatedTypeName annotate(Expression privacyAnnotation) {
      List<AnnotatedTypeName> annotated = new ArrayList<AnnotatedTypeName>();
      for (AnnotatedTypeName t: types) {
        annotated.add(t.typeName().annotate(privacyAnnotation));
      }
      return new AnnotatedTypeName(new TupleType(annotated));
    }

    /**
     * Annotate each component with its own label
     */
    public AnnotatedTypeName annotate(List<Expression> privacyAnnotations) {
      if (privacyAnnotations.size() != types.size()) {
        throw new CompilerError("Expected " + types.size() +
            " annotations for tuple, got " + privacyAnnotations.size());
      }
      List<AnnotatedTypeName> annotated = new ArrayList<AnnotatedTypeName>();
      for (int i = 0; i < types.size(); i++) {
        annotated.add(types.get(i).typeName().annotate(
                                         privacyAnnotations.get(i)));
      }
      return new AnnotatedTypeName(new TupleType(annotated));
    }

    private boolean sameArity(TypeName other) {
      return other instanceof TupleType &&
             ((TupleType)other).types.size() == types.size();
    }

    @Override
    public boolean equals(Object obj) {
      if (!sameArity(obj instanceof TypeName ? (TypeName)obj : null)) {
        return false;
      }
      return types.equals(((TupleType)obj).types);
    }

    @Override
    public int hashCode() {
      return types.hashCode();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitTupleType(this);
    }
  }

  public static class FunctionTypeName extends TypeName {
    private final List<Parameter> parameters;
    private final List<String> modifiers;
    private final List<Parameter> returnParameters;

    public FunctionTypeName(List<Parameter> parameters, List<String> modifiers,
                            List<Parameter> returnParameters) {
      this.parameters = parameters;
      this.modifiers = modifiers;
      this.returnParameters = returnParameters;
    }

    public List<Parameter> parameters() {
      return parameters;
    }

    public List<String> modifiers() {
      return modifiers;
    }

    public List<Parameter> returnParameters() {
      return returnParameters;
    }

    @Override
    public void processChildren(TreeRewriter rewriter) {
      rewriteChildren(rewriter, parameters, Parameter.class);
      rewriteChildren(rewriter, returnParameters, Parameter.class);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof FunctionTypeName)) {
        return false;
      }
      FunctionTypeName other = (FunctionTypeName)obj;
      return parameters.equals(other.parameters) &&
             modifiers.equals(other.modifiers) &&
             returnParameters.equals(other.returnParameters);
    }

    @Override
    public int hashCode() {
      return parameters.hashCode() * 31 + returnParameters.hashCode();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
      return visitor.visitFunctionTypeName(this);
    }
  }

  public static BoolTypeName boolType() {
    return new BoolTypeName();
  }

  public static UintTypeName uintType() {
    return new UintTypeName();
  }

  public static NumberTypeName numberType() {
    return NumberTypeName.any();
  }

  public static AddressTypeName addressType() {
    return new AddressTypeName();
  }

  public static AddressPayableTypeName addressPayableType() {
    return new AddressPayableTypeName();
  }

  public static ArrayTypeName dynUintArray() {
    return new ArrayTypeName(AnnotatedTypeName.uintAll());
  }

  /**
   * Build the type named by an elementary type keyword
   */
  public static TypeName elementaryType(String name) {
    if (name.equals("bool")) {
      return boolType();
    } else if (name.startsWith("uint")) {
      return new UintTypeName(name);
    } else if (name.startsWith("int")) {
      return new IntTypeName(name);
    } else if (name.startsWith("bytes")) {
      return new BytesTypeName(name);
    } else if (name.equals("string")) {
      return new StringTypeName();
    } else if (name.equals("address")) {
      return addressType();
    } else if (name.equals("address payable")) {
      return addressPayableType();
    }
    return new ElementaryTypeName(name);
  }
}
