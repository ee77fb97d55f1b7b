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

import cloak.ast.Identifier;

/**
 * Canonical key of a privacy label.  The public, caller and tee labels
 * are singletons; owner labels compare by the identity of the identifier
 * that declares the owner.
 */
public final class PrivacyLabel {

  public static enum Kind {
    PUBLIC,
    CALLER,
    TEE,
    OWNER,
  }

  public static final PrivacyLabel PUBLIC = new PrivacyLabel(Kind.PUBLIC, null);
  public static final PrivacyLabel CALLER = new PrivacyLabel(Kind.CALLER, null);
  public static final PrivacyLabel TEE = new PrivacyLabel(Kind.TEE, null);

  private final Kind kind;
  private final Identifier owner;

  private PrivacyLabel(Kind kind, Identifier owner) {
    this.kind = kind;
    this.owner = owner;
  }

  public static PrivacyLabel owner(Identifier owner) {
    return new PrivacyLabel(Kind.OWNER, owner);
  }

  public Kind kind() {
    return kind;
  }

  /**
   * @return declaring identifier for owner labels, null otherwise
   */
  public Identifier ownerIdentifier() {
    return owner;
  }

  public boolean isPublic() {
    return kind == Kind.PUBLIC;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof PrivacyLabel)) {
      return false;
    }
    PrivacyLabel other = (PrivacyLabel)obj;
    return kind == other.kind && owner == other.owner;
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + System.identityHashCode(owner);
  }

  @Override
  public String toString() {
    switch (kind) {
      case PUBLIC:
        return "all";
      case CALLER:
        return "me";
      case TEE:
        return "tee";
      default:
        return owner.name();
    }
  }
}
