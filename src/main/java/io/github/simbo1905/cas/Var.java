// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.cas;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/// A variable, identified by its name alone
public record Var(String name) implements Expr {
  public Var {
    Objects.requireNonNull(name, "Variable name must not be null");
  }

  public static Var of(String name) {
    return new Var(name);
  }

  @Override
  public Kind kind() {
    return Kind.VAR;
  }

  @Override
  public List<Expr> children() {
    return List.of();
  }

  @Override
  public Var withChildren(List<Expr> children) {
    Kind.VAR.checkArity(children);
    return this;
  }

  @Override
  public Set<Var> dependencies() {
    return Set.of(this);
  }

  @Override
  public String toString() {
    return name;
  }
}
