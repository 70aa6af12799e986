/*
 * Copyright 2025 The Tytle Authors
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
 * limitations under the License.
 */

package org.tytle.ast;

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;
import org.tytle.code.Address;

/** A variable symbol. Its address is assigned once, when the resolver allocates storage for it. */
public final class Variable extends Symbol {

  /** Where the variable's value lives at run time. */
  public enum Storage {
    GLOBAL,
    LOCAL
  }

  public final Storage storage;

  public final ExpressionType type;

  private Address address;

  public Variable(String name, Storage storage, ExpressionType type) {
    super(name);
    Preconditions.checkArgument(type != ExpressionType.UNIT, "variable %s cannot be UNIT", name);
    this.storage = storage;
    this.type = type;
  }

  public static Variable global(String name, ExpressionType type) {
    return new Variable(name, Storage.GLOBAL, type);
  }

  public static Variable local(String name, ExpressionType type) {
    return new Variable(name, Storage.LOCAL, type);
  }

  @Override
  public Kind kind() {
    return Kind.VAR;
  }

  public boolean isGlobal() {
    return storage == Storage.GLOBAL;
  }

  /** Returns the variable's address, or null if it has not been allocated yet. */
  public @Nullable Address address() {
    return address;
  }

  /** Sets the variable's address; may only be called once, with an address of matching kind. */
  public void setAddress(Address address) {
    Preconditions.checkState(this.address == null, "%s already has an address", name);
    Preconditions.checkArgument(address.isGlobal() == isGlobal());
    this.address = address;
  }

  @Override
  public String toString() {
    return String.format(
        "%s:%s@%s", name, type, (address == null) ? Ascii.toLowerCase(storage.name()) : address);
  }
}
