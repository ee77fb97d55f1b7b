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
package cloak.ast.decl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import cloak.ast.Identifier;
import cloak.ast.Node;
import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;
import cloak.ast.stmt.Block;
import cloak.ast.stmt.Statement;
import cloak.common.Settings;
import cloak.common.lang.AnnotatedTypeName;
import cloak.common.lang.Types.FunctionTypeName;
import cloak.common.lang.Types.TupleType;
import cloak.common.lang.Types.TypeName;

/**
 * Function, constructor, fallback or receive function.
 *
 * The function type and the return bindings are derived from the
 * parameters.  They are not children: they are rebuilt when the
 * parameters change and are never linked into the tree.
 */
public class ConstructorOrFunctionDefinition extends NamespaceDefinition {

  public static final String CONSTRUCTOR_NAME = "constructor";

  public static enum Kind {
    FUNCTION("function"),
    CONSTRUCTOR("constructor"),
    FALLBACK("fallback"),
    RECEIVE("receive");

    private final String keyword;

    private Kind(String keyword) {
      this.keyword = keyword;
    }

    public String keyword() {
      return keyword;
    }

    public static Kind fromKeyword(String keyword) {
      for (Kind k: values()) {
        if (k.keyword.equals(keyword)) {
          return k;
        }
      }
      return null;
    }
  }

  /**
   * How the private parts of a function are executed
   */
  public static enum PrivacyType {
    PUB,
    ZKP,
    MPC,
    TEE,
  }

  private final Kind kind;
  private final List<Parameter> parameters;
  /** {@link ModifierKeyword}, {@link ModifierInvocation} or
   *  {@link OverrideSpecifier} nodes, in source order */
  private final List<Node> modifiers;
  private final List<Parameter> returnParameters;
  /** null for a declaration without body */
  private Block body;

  /** Body before any lowering pass, if a pass kept it */
  private Block originalBody = null;

  private AnnotatedTypeName annotatedType;

  private final Set<ConstructorOrFunctionDefinition> calledFunctions =
                new LinkedHashSet<ConstructorOrFunctionDefinition>();
  private boolean isRecursive = false;
  private boolean hasStaticBody = true;
  private boolean canBePrivate = true;
  private boolean requiresVerificationWhenExternal = false;

  private PrivacyType privacyType = PrivacyType.PUB;

  private List<VariableDeclaration> returnVarDecls;

  public ConstructorOrFunctionDefinition(Identifier idf,
      List<Parameter> parameters, List<Node> modifiers,
      List<Parameter> returnParameters, Block body, Kind kind) {
    super(idf != null ? idf : new Identifier(CONSTRUCTOR_NAME));
    this.kind = kind;
    this.parameters = parameters;
    this.modifiers = modifiers;
    this.returnParameters = returnParameters != null ? returnParameters
                                          : new ArrayList<Parameter>();
    this.body = body;
    updateFunctionType();
    updateReturnVarDecls();
  }

  /**
   * Empty constructor, used where a contract declares none
   */
  public static ConstructorOrFunctionDefinition emptyConstructor() {
    return new ConstructorOrFunctionDefinition(null,
        new ArrayList<Parameter>(), new ArrayList<Node>(), null,
        new Block(new ArrayList<Statement>()), Kind.CONSTRUCTOR);
  }

  public Kind kind() {
    return kind;
  }

  public boolean isConstructor() {
    return kind == Kind.CONSTRUCTOR;
  }

  public boolean isFunction() {
    return kind == Kind.FUNCTION;
  }

  public List<Parameter> parameters() {
    return parameters;
  }

  public List<Node> modifiers() {
    return modifiers;
  }

  /**
   * @return the bare keyword modifiers, e.g. "public", "view"
   */
  public List<String> modifierKeywords() {
    List<String> result = new ArrayList<String>();
    for (Node m: modifiers) {
      if (m instanceof ModifierKeyword) {
        result.add(((ModifierKeyword)m).keyword());
      }
    }
    return result;
  }

  public boolean hasModifier(String keyword) {
    return modifierKeywords().contains(keyword);
  }

  public List<Parameter> returnParameters() {
    return returnParameters;
  }

  public Block body() {
    return body;
  }

  public Block originalBody() {
    return originalBody;
  }

  public void setOriginalBody(Block originalBody) {
    this.originalBody = originalBody;
  }

  public AnnotatedTypeName annotatedType() {
    return annotatedType;
  }

  public boolean hasSideEffects() {
    return !(hasModifier("pure") || hasModifier("view"));
  }

  public boolean canBeExternal() {
    return !(hasModifier("private") || hasModifier("internal"));
  }

  public boolean isExternal() {
    return hasModifier("external");
  }

  public boolean isPayable() {
    return hasModifier("payable");
  }

  public TupleType returnType() {
    return new TupleType(typesOf(returnParameters));
  }

  public TupleType parameterTypes() {
    return new TupleType(typesOf(parameters));
  }

  private static List<AnnotatedTypeName> typesOf(List<Parameter> params) {
    List<AnnotatedTypeName> result = new ArrayList<AnnotatedTypeName>();
    for (Parameter p: params) {
      result.add(p.annotatedType());
    }
    return result;
  }

  /**
   * Append a parameter and recompute the function type.
   * Reference types get the given storage location, primitive types none.
   */
  public Parameter addParam(AnnotatedTypeName t, Identifier idf,
                            String refStorageLocation) {
    String storage = t.typeName().isPrimitiveType() ? "" : refStorageLocation;
    Parameter p = new Parameter(new ArrayList<String>(), t, idf, storage);
    p.setParent(this);
    parameters.add(p);
    updateFunctionType();
    return p;
  }

  public Parameter addParam(TypeName t, String name) {
    return addParam(new AnnotatedTypeName(t), new Identifier(name), "memory");
  }

  private void updateFunctionType() {
    annotatedType = new AnnotatedTypeName(new FunctionTypeName(
          parameters, modifierKeywords(), returnParameters));
  }

  private void updateReturnVarDecls() {
    String base = Settings.get(isZkp() ? Settings.ZK_RETURN_NAME
                                       : Settings.TEE_RETURN_NAME);
    List<VariableDeclaration> decls = new ArrayList<VariableDeclaration>();
    for (int idx = 0; idx < returnParameters.size(); idx++) {
      Parameter rp = returnParameters.get(idx);
      VariableDeclaration vd = new VariableDeclaration(
          new ArrayList<String>(), rp.annotatedType(),
          new Identifier(base + "_" + idx), rp.storageLocation());
      vd.idf().setParent(vd);
      decls.add(vd);
    }
    returnVarDecls = Collections.unmodifiableList(decls);
  }

  /**
   * @return one binding per return parameter, holding the returned value
   */
  public List<VariableDeclaration> returnVarDecls() {
    return returnVarDecls;
  }

  public Set<ConstructorOrFunctionDefinition> calledFunctions() {
    return calledFunctions;
  }

  public boolean isRecursive() {
    return isRecursive;
  }

  public void setRecursive(boolean isRecursive) {
    this.isRecursive = isRecursive;
  }

  public boolean hasStaticBody() {
    return hasStaticBody;
  }

  public void setHasStaticBody(boolean hasStaticBody) {
    this.hasStaticBody = hasStaticBody;
  }

  public boolean canBePrivate() {
    return canBePrivate;
  }

  public void setCanBePrivate(boolean canBePrivate) {
    this.canBePrivate = canBePrivate;
  }

  public boolean requiresVerificationWhenExternal() {
    return requiresVerificationWhenExternal;
  }

  public void setRequiresVerificationWhenExternal(boolean value) {
    this.requiresVerificationWhenExternal = value;
  }

  public PrivacyType privacyType() {
    return privacyType;
  }

  public void setPrivacyType(PrivacyType privacyType) {
    if (this.privacyType != privacyType) {
      this.privacyType = privacyType;
      updateReturnVarDecls();
    }
  }

  public boolean requiresVerification() {
    return isZkp();
  }

  /**
   * Only ever raises the classification to ZKP; false is ignored
   */
  public void setRequiresVerification(boolean requiresVerification) {
    if (requiresVerification) {
      setPrivacyType(PrivacyType.ZKP);
    }
  }

  public boolean isPub() {
    return privacyType == PrivacyType.PUB;
  }

  public boolean isZkp() {
    return privacyType == PrivacyType.ZKP;
  }

  public boolean isTee() {
    return privacyType == PrivacyType.TEE;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    super.processChildren(rewriter);
    rewriteChildren(rewriter, parameters, Parameter.class);
    rewriteChildren(rewriter, modifiers, Node.class);
    rewriteChildren(rewriter, returnParameters, Parameter.class);
    body = rewriteChild(rewriter, body, Block.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitConstructorOrFunctionDefinition(this);
  }
}
