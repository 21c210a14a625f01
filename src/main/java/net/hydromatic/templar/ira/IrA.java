/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.templar.ira;

import net.hydromatic.templar.ast.IrNode;
import net.hydromatic.templar.ast.IrWriter;
import net.hydromatic.templar.ast.Op;
import net.hydromatic.templar.type.CustomType;
import net.hydromatic.templar.type.ExprType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/** IR-A, the intermediate representation whose operands are always
 * variables and whose match expressions destructure types using
 * patterns.
 *
 * <p>Nodes are immutable. Create them using {@link IrABuilder}, which
 * checks that operand types are consistent and derives each node's type;
 * constructors here only store their arguments. */
public class IrA {
  private IrA() {}

  /** Abstract base class of IR-A nodes. */
  public abstract static class Node extends IrNode {
    Node(Op op) {
      super(op);
    }

    /** Accepts a visitor, calling the {@code visit} method appropriate to
     * the type of this node. */
    public abstract void accept(Visitor visitor);
  }

  /** Abstract base class of nodes that have a type. */
  public abstract static class Typed extends Node {
    public final ExprType type;

    Typed(Op op, ExprType type) {
      super(op);
      this.type = requireNonNull(type);
    }

    /** Describes the fields that are not printed in the non-verbose
     * form. */
    String describeFields() {
      return "type: " + type;
    }
  }

  /** Abstract base class of expressions. */
  public abstract static class Expr extends Typed {
    Expr(Op op, ExprType type) {
      super(op, type);
    }
  }

  /** Abstract base class of patterns, which occur only in the cases of a
   * {@link MatchExpr}. */
  public abstract static class Pattern extends Typed {
    Pattern(Op op, ExprType type) {
      super(op, type);
    }
  }

  /** Abstract base class of statements. */
  public abstract static class Stmt extends Node {
    Stmt(Op op) {
      super(op);
    }
  }

  /** Reference to a variable or function. */
  public static class VarReference extends Expr {
    public final String name;
    public final boolean isGlobalFunction;
    public final boolean isFunctionThatMayThrow;

    VarReference(ExprType type, String name, boolean isGlobalFunction,
        boolean isFunctionThatMayThrow) {
      super(Op.VAR_REF, type);
      this.name = requireNonNull(name);
      this.isGlobalFunction = isGlobalFunction;
      this.isFunctionThatMayThrow = isFunctionThatMayThrow;
    }

    @Override public int hashCode() {
      return Objects.hash(name, type, isGlobalFunction,
          isFunctionThatMayThrow);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof VarReference
          && name.equals(((VarReference) o).name)
          && type.equals(((VarReference) o).type)
          && isGlobalFunction == ((VarReference) o).isGlobalFunction
          && isFunctionThatMayThrow
              == ((VarReference) o).isFunctionThatMayThrow;
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append(name);
    }

    @Override String describeFields() {
      return describe(name, type, isGlobalFunction, isFunctionThatMayThrow);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  private static String describe(String name, ExprType type,
      boolean isGlobalFunction, boolean isFunctionThatMayThrow) {
    return name + ": " + type
        + (isGlobalFunction ? ", global function" : "")
        + (isFunctionThatMayThrow ? ", may throw" : "");
  }

  /** One case of a {@link MatchExpr}. */
  public static class MatchCase extends Node {
    public final ImmutableList<Pattern> typePatterns;
    public final ImmutableList<String> matchedVarNames;
    public final ImmutableList<String> matchedVariadicVarNames;
    public final FunctionCall expr;

    MatchCase(ImmutableList<Pattern> typePatterns,
        ImmutableList<String> matchedVarNames,
        ImmutableList<String> matchedVariadicVarNames, FunctionCall expr) {
      super(Op.MATCH_CASE);
      this.typePatterns = requireNonNull(typePatterns);
      this.matchedVarNames = requireNonNull(matchedVarNames);
      this.matchedVariadicVarNames = requireNonNull(matchedVariadicVarNames);
      this.expr = requireNonNull(expr);
    }

    /** Returns the names bound by this case, non-variadic names first. */
    public ImmutableList<String> boundNames() {
      return ImmutableList.<String>builder().addAll(matchedVarNames)
          .addAll(matchedVariadicVarNames).build();
    }

    /** Returns whether this case is the main definition (the catch-all).
     *
     * <p>It is if every pattern is a plain variable, and the variables are
     * exactly the names bound by this case. IR-B applies the same rule to
     * its expression patterns; see {@code IrB.MatchCase}. */
    public boolean isMainDefinition() {
      final Set<String> names = new HashSet<>();
      for (Pattern pattern : typePatterns) {
        if (!(pattern instanceof VarReferencePattern)) {
          return false;
        }
        names.add(((VarReferencePattern) pattern).name);
      }
      return names.equals(ImmutableSet.copyOf(boundNames()));
    }

    @Override public int hashCode() {
      return Objects.hash(typePatterns, matchedVarNames,
          matchedVariadicVarNames, expr);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof MatchCase
          && typePatterns.equals(((MatchCase) o).typePatterns)
          && matchedVarNames.equals(((MatchCase) o).matchedVarNames)
          && matchedVariadicVarNames.equals(
              ((MatchCase) o).matchedVariadicVarNames)
          && expr.equals(((MatchCase) o).expr);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      w.append("lambda ").append(String.join(", ", boundNames()))
          .append(":").newline().indent();
      w.appendAll(typePatterns, ", ").append(":").newline().indent();
      return w.append(expr).append(",").newline().outdent().outdent();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Match expression. Its type is the type of its cases' results. */
  public static class MatchExpr extends Expr {
    public final ImmutableList<VarReference> matchedVars;
    public final ImmutableList<MatchCase> matchCases;

    MatchExpr(ExprType type, ImmutableList<VarReference> matchedVars,
        ImmutableList<MatchCase> matchCases) {
      super(Op.MATCH, type);
      this.matchedVars = requireNonNull(matchedVars);
      this.matchCases = requireNonNull(matchCases);
    }

    @Override public int hashCode() {
      return Objects.hash(matchedVars, matchCases);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof MatchExpr
          && matchedVars.equals(((MatchExpr) o).matchedVars)
          && matchCases.equals(((MatchExpr) o).matchCases);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      w.append("match(").appendAll(matchedVars, ", ").append(")({")
          .newline().indent();
      return w.appendAll(matchCases, "").outdent().append("})");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Boolean literal, {@code True} or {@code False}. */
  public static class BoolLiteral extends Expr {
    public final boolean value;

    BoolLiteral(ExprType type, boolean value) {
      super(Op.BOOL_LITERAL, type);
      this.value = value;
    }

    @Override public int hashCode() {
      return Boolean.hashCode(value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof BoolLiteral
          && value == ((BoolLiteral) o).value;
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append(value ? "True" : "False");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Integer literal. */
  public static class IntLiteral extends Expr {
    public final long value;

    IntLiteral(ExprType type, long value) {
      super(Op.INT_LITERAL, type);
      this.value = value;
    }

    @Override public int hashCode() {
      return Long.hashCode(value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof IntLiteral
          && value == ((IntLiteral) o).value;
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append(Long.toString(value));
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Literal that denotes a type of the target language, for example
   * {@code Type('int')}. */
  public static class AtomicTypeLiteral extends Expr {
    public final String cppType;

    AtomicTypeLiteral(ExprType type, String cppType) {
      super(Op.ATOMIC_TYPE_LITERAL, type);
      this.cppType = requireNonNull(cppType);
    }

    @Override public int hashCode() {
      return cppType.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof AtomicTypeLiteral
          && cppType.equals(((AtomicTypeLiteral) o).cppType);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("Type('").append(cppType).append("')");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of expressions that apply a type constructor,
   * such as pointer, to a variable of type {@code Type}. */
  public abstract static class WrappedTypeExpr extends Expr {
    public final VarReference typeExpr;
    private final String function;

    WrappedTypeExpr(Op op, ExprType type, VarReference typeExpr,
        String function) {
      super(op, type);
      this.typeExpr = requireNonNull(typeExpr);
      this.function = function;
    }

    @Override public int hashCode() {
      return Objects.hash(op, typeExpr);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof WrappedTypeExpr
          && op == ((WrappedTypeExpr) o).op
          && typeExpr.equals(((WrappedTypeExpr) o).typeExpr);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("Type.").append(function).append("(").append(typeExpr)
          .append(")");
    }

    @Override String describeFields() {
      return typeExpr.describeFields();
    }
  }

  /** Pointer type, {@code T*}. */
  public static class PointerTypeExpr extends WrappedTypeExpr {
    PointerTypeExpr(ExprType type, VarReference typeExpr) {
      super(Op.POINTER_TYPE, type, typeExpr, "pointer");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Reference type, {@code T&}. */
  public static class ReferenceTypeExpr extends WrappedTypeExpr {
    ReferenceTypeExpr(ExprType type, VarReference typeExpr) {
      super(Op.REFERENCE_TYPE, type, typeExpr, "reference");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Rvalue reference type, {@code T&&}. */
  public static class RvalueReferenceTypeExpr extends WrappedTypeExpr {
    RvalueReferenceTypeExpr(ExprType type, VarReference typeExpr) {
      super(Op.RVALUE_REFERENCE_TYPE, type, typeExpr, "rvalue_reference");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Const type, {@code const T}. */
  public static class ConstTypeExpr extends WrappedTypeExpr {
    ConstTypeExpr(ExprType type, VarReference typeExpr) {
      super(Op.CONST_TYPE, type, typeExpr, "const");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Array type, {@code T[]}. */
  public static class ArrayTypeExpr extends WrappedTypeExpr {
    ArrayTypeExpr(ExprType type, VarReference typeExpr) {
      super(Op.ARRAY_TYPE, type, typeExpr, "array");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Function type, built from a return type and a list of argument
   * types. */
  public static class FunctionTypeExpr extends Expr {
    public final VarReference returnTypeExpr;
    public final VarReference argListExpr;

    FunctionTypeExpr(ExprType type, VarReference returnTypeExpr,
        VarReference argListExpr) {
      super(Op.FUNCTION_TYPE, type);
      this.returnTypeExpr = requireNonNull(returnTypeExpr);
      this.argListExpr = requireNonNull(argListExpr);
    }

    @Override public int hashCode() {
      return Objects.hash(returnTypeExpr, argListExpr);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FunctionTypeExpr
          && returnTypeExpr.equals(((FunctionTypeExpr) o).returnTypeExpr)
          && argListExpr.equals(((FunctionTypeExpr) o).argListExpr);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("Type.function(").append(returnTypeExpr).append(", ")
          .append(argListExpr).append(")");
    }

    @Override String describeFields() {
      return "return_type: " + returnTypeExpr.describeFields()
          + "; arg_type_list: " + argListExpr.describeFields();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Expansion of a parameter pack, {@code *(x)}. Its type is the pack's
   * element type. */
  public static class ParameterPackExpansion extends Expr {
    public final VarReference expr;

    ParameterPackExpansion(ExprType type, VarReference expr) {
      super(Op.PARAMETER_PACK_EXPANSION, type);
      this.expr = requireNonNull(expr);
    }

    @Override public int hashCode() {
      return expr.hashCode() + 17;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ParameterPackExpansion
          && expr.equals(((ParameterPackExpansion) o).expr);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("*(").append(expr).append(")");
    }

    @Override String describeFields() {
      return expr.describeFields();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Instantiation of a template; for example, applying
   * {@code std::vector} to a list containing {@code int} yields
   * {@code std::vector<int>}. */
  public static class TemplateInstantiationExpr extends Expr {
    public final String templateAtomicCppType;
    public final VarReference argListExpr;

    TemplateInstantiationExpr(ExprType type, String templateAtomicCppType,
        VarReference argListExpr) {
      super(Op.TEMPLATE_INSTANTIATION, type);
      this.templateAtomicCppType = requireNonNull(templateAtomicCppType);
      this.argListExpr = requireNonNull(argListExpr);
    }

    @Override public int hashCode() {
      return Objects.hash(templateAtomicCppType, argListExpr);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TemplateInstantiationExpr
          && templateAtomicCppType.equals(
              ((TemplateInstantiationExpr) o).templateAtomicCppType)
          && argListExpr.equals(((TemplateInstantiationExpr) o).argListExpr);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("Type.template_instantiation('")
          .append(templateAtomicCppType).append("', ").append(argListExpr)
          .append(")");
    }

    @Override String describeFields() {
      return argListExpr.describeFields();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Access to a member template of a class; for example, member
   * {@code bar} of {@code foo} applied to {@code int} yields
   * {@code foo::bar<int>}. */
  public static class TemplateMemberAccessExpr extends Expr {
    public final VarReference classTypeExpr;
    public final String memberName;
    public final VarReference argListExpr;

    TemplateMemberAccessExpr(ExprType type, VarReference classTypeExpr,
        String memberName, VarReference argListExpr) {
      super(Op.TEMPLATE_MEMBER_ACCESS, type);
      this.classTypeExpr = requireNonNull(classTypeExpr);
      this.memberName = requireNonNull(memberName);
      this.argListExpr = requireNonNull(argListExpr);
    }

    @Override public int hashCode() {
      return Objects.hash(classTypeExpr, memberName, argListExpr);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TemplateMemberAccessExpr
          && classTypeExpr.equals(((TemplateMemberAccessExpr) o).classTypeExpr)
          && memberName.equals(((TemplateMemberAccessExpr) o).memberName)
          && argListExpr.equals(((TemplateMemberAccessExpr) o).argListExpr);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("Type.template_member(").append(classTypeExpr)
          .append(", '").append(memberName).append("', ").append(argListExpr)
          .append(")");
    }

    @Override String describeFields() {
      return "class_type: " + classTypeExpr.describeFields()
          + "; arg_type_list: " + argListExpr.describeFields();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** List literal, {@code [a, b, c]}. */
  public static class ListExpr extends Expr {
    public final ExprType elemType;
    public final ImmutableList<VarReference> elems;

    ListExpr(ExprType type, ExprType elemType,
        ImmutableList<VarReference> elems) {
      super(Op.LIST, type);
      this.elemType = requireNonNull(elemType);
      this.elems = requireNonNull(elems);
    }

    @Override public int hashCode() {
      return Objects.hash(elemType, elems);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ListExpr
          && elemType.equals(((ListExpr) o).elemType)
          && elems.equals(((ListExpr) o).elems);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("[").appendAll(elems, ", ").append("]");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of expressions that have a single variable
   * operand. */
  public abstract static class VarOpExpr extends Expr {
    public final VarReference var;

    VarOpExpr(Op op, ExprType type, VarReference var) {
      super(op, type);
      this.var = requireNonNull(var);
    }

    @Override public int hashCode() {
      return Objects.hash(op, type, var);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof VarOpExpr
          && op == ((VarOpExpr) o).op
          && type.equals(((VarOpExpr) o).type)
          && var.equals(((VarOpExpr) o).var);
    }

    @Override String describeFields() {
      return var.describeFields();
    }
  }

  /** Converts a list that contains no duplicates to a set. */
  public static class ListToSetExpr extends VarOpExpr {
    ListToSetExpr(ExprType type, VarReference var) {
      super(Op.LIST_TO_SET, type, var);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("list_to_set(").append(var).append(")");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Converts a set to a list. */
  public static class SetToListExpr extends VarOpExpr {
    SetToListExpr(ExprType type, VarReference var) {
      super(Op.SET_TO_LIST, type, var);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("set_to_list(").append(var).append(")");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Logical negation, {@code not x}. */
  public static class NotExpr extends VarOpExpr {
    NotExpr(ExprType type, VarReference var) {
      super(Op.NOT, type, var);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("not ").append(var);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Integer negation, {@code -x}. */
  public static class UnaryMinusExpr extends VarOpExpr {
    UnaryMinusExpr(ExprType type, VarReference var) {
      super(Op.UNARY_MINUS, type, var);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("-").append(var);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Sum of a list of integers, {@code sum(x)}. */
  public static class IntListSumExpr extends VarOpExpr {
    IntListSumExpr(ExprType type, VarReference var) {
      super(Op.INT_LIST_SUM, type, var);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("sum(").append(var).append(")");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Whether all elements of a list of booleans are true,
   * {@code all(x)}. */
  public static class BoolListAllExpr extends VarOpExpr {
    BoolListAllExpr(ExprType type, VarReference var) {
      super(Op.BOOL_LIST_ALL, type, var);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("all(").append(var).append(")");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Whether any element of a list of booleans is true, {@code any(x)}. */
  public static class BoolListAnyExpr extends VarOpExpr {
    BoolListAnyExpr(ExprType type, VarReference var) {
      super(Op.BOOL_LIST_ANY, type, var);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("any(").append(var).append(")");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of expressions that have two variable
   * operands. */
  public abstract static class BinaryExpr extends Expr {
    public final VarReference lhs;
    public final VarReference rhs;

    BinaryExpr(Op op, ExprType type, VarReference lhs, VarReference rhs) {
      super(op, type);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
    }

    @Override public int hashCode() {
      return Objects.hash(op, lhs, rhs);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof BinaryExpr
          && op == ((BinaryExpr) o).op
          && lhs.equals(((BinaryExpr) o).lhs)
          && rhs.equals(((BinaryExpr) o).rhs);
    }

    @Override String describeFields() {
      return "(lhs: " + lhs.describeFields() + "; rhs: "
          + rhs.describeFields() + ")";
    }
  }

  /** Adds an element to a set (represented as a list without
   * duplicates). */
  public static class AddToSetExpr extends BinaryExpr {
    AddToSetExpr(ExprType type, VarReference setExpr, VarReference elemExpr) {
      super(Op.ADD_TO_SET, type, setExpr, elemExpr);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("add_to_set(").append(lhs).append(", ").append(rhs)
          .append(")");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Equality comparison, {@code x == y}. */
  public static class EqualityComparison extends BinaryExpr {
    EqualityComparison(ExprType type, VarReference lhs, VarReference rhs) {
      super(Op.EQUAL, type, lhs, rhs);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append(lhs).append(" == ").append(rhs);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Whether two sets (represented as lists) contain the same
   * elements. */
  public static class SetEqualityComparison extends BinaryExpr {
    SetEqualityComparison(ExprType type, VarReference lhs, VarReference rhs) {
      super(Op.SET_EQUAL, type, lhs, rhs);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("set_equals(").append(lhs).append(", ").append(rhs)
          .append(")");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Whether a list contains a value, {@code x in l}. */
  public static class IsInListExpr extends BinaryExpr {
    IsInListExpr(ExprType type, VarReference lhs, VarReference rhs) {
      super(Op.IS_IN_LIST, type, lhs, rhs);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append(lhs).append(" in ").append(rhs);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Concatenation of two lists of the same type. */
  public static class ListConcatExpr extends BinaryExpr {
    ListConcatExpr(ExprType type, VarReference lhs, VarReference rhs) {
      super(Op.LIST_CONCAT, type, lhs, rhs);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append(lhs).append(" + ").append(rhs);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Comparison of two integers; {@link #operator} is one of
   * {@link Op#LT}, {@link Op#GT}, {@link Op#LE}, {@link Op#GE}. */
  public static class IntComparisonExpr extends BinaryExpr {
    public final Op operator;

    IntComparisonExpr(ExprType type, VarReference lhs, VarReference rhs,
        Op operator) {
      super(Op.INT_COMPARISON, type, lhs, rhs);
      this.operator = requireNonNull(operator);
    }

    @Override public int hashCode() {
      return super.hashCode() * 31 + operator.hashCode();
    }

    @Override public boolean equals(Object o) {
      return super.equals(o)
          && operator == ((IntComparisonExpr) o).operator;
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append(lhs).append(" ").append(operator.opName).append(" ")
          .append(rhs);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Arithmetic on two integers; {@link #operator} is one of
   * {@link Op#PLUS}, {@link Op#MINUS}, {@link Op#TIMES}, {@link Op#DIVIDE},
   * {@link Op#MOD}. */
  public static class IntBinaryOpExpr extends BinaryExpr {
    public final Op operator;

    IntBinaryOpExpr(ExprType type, VarReference lhs, VarReference rhs,
        Op operator) {
      super(Op.INT_BINARY_OP, type, lhs, rhs);
      this.operator = requireNonNull(operator);
    }

    @Override public int hashCode() {
      return super.hashCode() * 31 + operator.hashCode();
    }

    @Override public boolean equals(Object o) {
      return super.equals(o)
          && operator == ((IntBinaryOpExpr) o).operator;
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append(lhs).append(" ").append(operator.opName).append(" ")
          .append(rhs);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to a function. */
  public static class FunctionCall extends Expr {
    public final VarReference fun;
    public final ImmutableList<VarReference> args;

    FunctionCall(ExprType type, VarReference fun,
        ImmutableList<VarReference> args) {
      super(Op.FUNCTION_CALL, type);
      this.fun = requireNonNull(fun);
      this.args = requireNonNull(args);
    }

    @Override public int hashCode() {
      return Objects.hash(fun, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FunctionCall
          && fun.equals(((FunctionCall) o).fun)
          && args.equals(((FunctionCall) o).args);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append(fun).append("(").appendAll(args, ", ").append(")");
    }

    @Override String describeFields() {
      final StringBuilder b = new StringBuilder();
      for (VarReference arg : args) {
        b.append(b.length() == 0 ? "" : "; ").append(arg.describeFields());
      }
      return b.toString();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Access to an attribute of a type or of a value of a custom type,
   * {@code x.a}. */
  public static class AttributeAccessExpr extends Expr {
    public final VarReference var;
    public final String attributeName;

    AttributeAccessExpr(ExprType type, VarReference var,
        String attributeName) {
      super(Op.ATTRIBUTE_ACCESS, type);
      this.var = requireNonNull(var);
      this.attributeName = requireNonNull(attributeName);
    }

    @Override public int hashCode() {
      return Objects.hash(type, var, attributeName);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof AttributeAccessExpr
          && type.equals(((AttributeAccessExpr) o).type)
          && var.equals(((AttributeAccessExpr) o).var)
          && attributeName.equals(((AttributeAccessExpr) o).attributeName);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append(var).append(".").append(attributeName);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Whether a value is an instance of a custom type. */
  public static class IsInstanceExpr extends Expr {
    public final VarReference var;
    public final CustomType checkedType;

    IsInstanceExpr(ExprType type, VarReference var, CustomType checkedType) {
      super(Op.IS_INSTANCE, type);
      this.var = requireNonNull(var);
      this.checkedType = requireNonNull(checkedType);
    }

    @Override public int hashCode() {
      return Objects.hash(var, checkedType);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof IsInstanceExpr
          && var.equals(((IsInstanceExpr) o).var)
          && checkedType.equals(((IsInstanceExpr) o).checkedType);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("isinstance(").append(var).append(", ")
          .append(checkedType).append(")");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Cast of an error-or-void value to the custom type that it is known to
   * have. */
  public static class SafeUncheckedCast extends VarOpExpr {
    SafeUncheckedCast(ExprType type, VarReference var) {
      super(Op.SAFE_UNCHECKED_CAST, type, var);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append(var).append("  # type: ").append(type);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** List comprehension, {@code [f(x) for x in l]}. */
  public static class ListComprehensionExpr extends Expr {
    public final VarReference listVar;
    public final VarReference loopVar;
    public final FunctionCall resultElemExpr;

    ListComprehensionExpr(ExprType type, VarReference listVar,
        VarReference loopVar, FunctionCall resultElemExpr) {
      super(Op.LIST_COMPREHENSION, type);
      this.listVar = requireNonNull(listVar);
      this.loopVar = requireNonNull(loopVar);
      this.resultElemExpr = requireNonNull(resultElemExpr);
    }

    @Override public int hashCode() {
      return Objects.hash(listVar, loopVar, resultElemExpr);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ListComprehensionExpr
          && listVar.equals(((ListComprehensionExpr) o).listVar)
          && loopVar.equals(((ListComprehensionExpr) o).loopVar)
          && resultElemExpr.equals(
              ((ListComprehensionExpr) o).resultElemExpr);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("[").append(resultElemExpr).append(" for ")
          .append(loopVar).append(" in ").append(listVar).append("]");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // patterns

  /** Pattern that binds, or refers to, a variable. */
  public static class VarReferencePattern extends Pattern {
    public final String name;
    public final boolean isGlobalFunction;
    public final boolean isFunctionThatMayThrow;

    VarReferencePattern(ExprType type, String name, boolean isGlobalFunction,
        boolean isFunctionThatMayThrow) {
      super(Op.VAR_REF_PAT, type);
      this.name = requireNonNull(name);
      this.isGlobalFunction = isGlobalFunction;
      this.isFunctionThatMayThrow = isFunctionThatMayThrow;
    }

    /** Converts this pattern to an equivalent variable reference. */
    public VarReference toVarReference() {
      return new VarReference(type, name, isGlobalFunction,
          isFunctionThatMayThrow);
    }

    @Override public int hashCode() {
      return Objects.hash(name, type, isGlobalFunction,
          isFunctionThatMayThrow);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof VarReferencePattern
          && name.equals(((VarReferencePattern) o).name)
          && type.equals(((VarReferencePattern) o).type)
          && isGlobalFunction == ((VarReferencePattern) o).isGlobalFunction
          && isFunctionThatMayThrow
              == ((VarReferencePattern) o).isFunctionThatMayThrow;
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append(name);
    }

    @Override String describeFields() {
      return describe(name, type, isGlobalFunction, isFunctionThatMayThrow);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Pattern that matches one type of the target language. */
  public static class AtomicTypeLiteralPattern extends Pattern {
    public final String cppType;

    AtomicTypeLiteralPattern(ExprType type, String cppType) {
      super(Op.ATOMIC_TYPE_LITERAL_PAT, type);
      this.cppType = requireNonNull(cppType);
    }

    @Override public int hashCode() {
      return cppType.hashCode() + 3;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof AtomicTypeLiteralPattern
          && cppType.equals(((AtomicTypeLiteralPattern) o).cppType);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("Type('").append(cppType).append("')");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of patterns that match a type constructor, such
   * as pointer, applied to a type. */
  public abstract static class WrappedTypePattern extends Pattern {
    public final Pattern typePattern;
    private final String function;

    WrappedTypePattern(Op op, ExprType type, Pattern typePattern,
        String function) {
      super(op, type);
      this.typePattern = requireNonNull(typePattern);
      this.function = function;
    }

    @Override public int hashCode() {
      return Objects.hash(op, typePattern);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof WrappedTypePattern
          && op == ((WrappedTypePattern) o).op
          && typePattern.equals(((WrappedTypePattern) o).typePattern);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("Type.").append(function).append("(")
          .append(typePattern).append(")");
    }

    @Override String describeFields() {
      return typePattern.describeFields();
    }
  }

  /** Pattern that matches a pointer type. */
  public static class PointerTypePattern extends WrappedTypePattern {
    PointerTypePattern(ExprType type, Pattern typePattern) {
      super(Op.POINTER_TYPE_PAT, type, typePattern, "pointer");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Pattern that matches a reference type. */
  public static class ReferenceTypePattern extends WrappedTypePattern {
    ReferenceTypePattern(ExprType type, Pattern typePattern) {
      super(Op.REFERENCE_TYPE_PAT, type, typePattern, "reference");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Pattern that matches an rvalue reference type. */
  public static class RvalueReferenceTypePattern extends WrappedTypePattern {
    RvalueReferenceTypePattern(ExprType type, Pattern typePattern) {
      super(Op.RVALUE_REFERENCE_TYPE_PAT, type, typePattern,
          "rvalue_reference");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Pattern that matches a const type. */
  public static class ConstTypePattern extends WrappedTypePattern {
    ConstTypePattern(ExprType type, Pattern typePattern) {
      super(Op.CONST_TYPE_PAT, type, typePattern, "const");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Pattern that matches an array type. */
  public static class ArrayTypePattern extends WrappedTypePattern {
    ArrayTypePattern(ExprType type, Pattern typePattern) {
      super(Op.ARRAY_TYPE_PAT, type, typePattern, "array");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Pattern that matches a function type. */
  public static class FunctionTypePattern extends Pattern {
    public final Pattern returnTypePattern;
    public final Pattern argListPattern;

    FunctionTypePattern(ExprType type, Pattern returnTypePattern,
        Pattern argListPattern) {
      super(Op.FUNCTION_TYPE_PAT, type);
      this.returnTypePattern = requireNonNull(returnTypePattern);
      this.argListPattern = requireNonNull(argListPattern);
    }

    @Override public int hashCode() {
      return Objects.hash(returnTypePattern, argListPattern);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FunctionTypePattern
          && returnTypePattern.equals(
              ((FunctionTypePattern) o).returnTypePattern)
          && argListPattern.equals(((FunctionTypePattern) o).argListPattern);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("Type.function(").append(returnTypePattern)
          .append(", ").append(argListPattern).append(")");
    }

    @Override String describeFields() {
      return "return_type: " + returnTypePattern.describeFields()
          + "; arg_type_list: " + argListPattern.describeFields();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Pattern that matches an instantiation of a template.
   *
   * <p>If {@link #listExtractionArg} is present, it binds the arguments
   * that follow those matched by {@link #argPatterns}. */
  public static class TemplateInstantiationPattern extends Pattern {
    public final String templateAtomicCppType;
    public final ImmutableList<Pattern> argPatterns;
    public final @Nullable VarReferencePattern listExtractionArg;

    TemplateInstantiationPattern(ExprType type, String templateAtomicCppType,
        ImmutableList<Pattern> argPatterns,
        @Nullable VarReferencePattern listExtractionArg) {
      super(Op.TEMPLATE_INSTANTIATION_PAT, type);
      this.templateAtomicCppType = requireNonNull(templateAtomicCppType);
      this.argPatterns = requireNonNull(argPatterns);
      this.listExtractionArg = listExtractionArg;
    }

    @Override public int hashCode() {
      return Objects.hash(templateAtomicCppType, argPatterns,
          listExtractionArg);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TemplateInstantiationPattern
          && templateAtomicCppType.equals(
              ((TemplateInstantiationPattern) o).templateAtomicCppType)
          && argPatterns.equals(((TemplateInstantiationPattern) o).argPatterns)
          && Objects.equals(listExtractionArg,
              ((TemplateInstantiationPattern) o).listExtractionArg);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      w.append("Type.template_instantiation('").append(templateAtomicCppType)
          .append("', [").appendAll(argPatterns, ", ");
      if (listExtractionArg != null) {
        w.append(argPatterns.isEmpty() ? "*" : ", *")
            .append(listExtractionArg);
      }
      return w.append("])");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Pattern that matches a list.
   *
   * <p>If {@link #listExtraction} is present, it binds the elements that
   * follow those matched by {@link #elems}. */
  public static class ListPattern extends Pattern {
    public final ExprType elemType;
    public final ImmutableList<Pattern> elems;
    public final @Nullable VarReferencePattern listExtraction;

    ListPattern(ExprType type, ExprType elemType, ImmutableList<Pattern> elems,
        @Nullable VarReferencePattern listExtraction) {
      super(Op.LIST_PAT, type);
      this.elemType = requireNonNull(elemType);
      this.elems = requireNonNull(elems);
      this.listExtraction = listExtraction;
    }

    @Override public int hashCode() {
      return Objects.hash(elemType, elems, listExtraction);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ListPattern
          && elemType.equals(((ListPattern) o).elemType)
          && elems.equals(((ListPattern) o).elems)
          && Objects.equals(listExtraction, ((ListPattern) o).listExtraction);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      w.append("[").appendAll(elems, ", ");
      if (listExtraction != null) {
        w.append(elems.isEmpty() ? "*" : ", *").append(listExtraction);
      }
      return w.append("]");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // statements

  /** Statement that does nothing. */
  public static class PassStmt extends Stmt {
    PassStmt() {
      super(Op.PASS);
    }

    @Override public int hashCode() {
      return Op.PASS.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o instanceof PassStmt;
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("pass").newline();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Assertion that a boolean variable is true. */
  public static class Assert extends Stmt {
    public final VarReference var;
    public final String message;

    Assert(VarReference var, String message) {
      super(Op.ASSERT);
      this.var = requireNonNull(var);
      this.message = requireNonNull(message);
    }

    @Override public int hashCode() {
      return Objects.hash(var, message);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Assert
          && var.equals(((Assert) o).var)
          && message.equals(((Assert) o).message);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("assert ").append(var).comment(var.describeFields())
          .newline();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Assignment, {@code x = e}.
   *
   * <p>If {@link #lhs2} is present, it receives the error-or-void result
   * of a call, match or comprehension that may fail:
   * {@code x, err = f(y)}. */
  public static class Assignment extends Stmt {
    public final VarReference lhs;
    public final @Nullable VarReference lhs2;
    public final Expr rhs;

    Assignment(VarReference lhs, @Nullable VarReference lhs2, Expr rhs) {
      super(Op.ASSIGNMENT);
      this.lhs = requireNonNull(lhs);
      this.lhs2 = lhs2;
      this.rhs = requireNonNull(rhs);
    }

    @Override public int hashCode() {
      return Objects.hash(lhs, lhs2, rhs);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Assignment
          && lhs.equals(((Assignment) o).lhs)
          && Objects.equals(lhs2, ((Assignment) o).lhs2)
          && rhs.equals(((Assignment) o).rhs);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      w.append(lhs);
      if (lhs2 != null) {
        w.append(", ").append(lhs2);
      }
      w.append(" = ").append(rhs);
      if (!(rhs instanceof MatchExpr)) {
        w.comment("lhs: " + lhs.describeFields() + "; rhs: "
            + rhs.describeFields());
      }
      return w.newline();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Propagates the error held by an error-or-void variable, if any. */
  public static class CheckIfError extends Stmt {
    public final VarReference var;

    CheckIfError(VarReference var) {
      super(Op.CHECK_IF_ERROR);
      this.var = requireNonNull(var);
    }

    @Override public int hashCode() {
      return var.hashCode() + 5;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof CheckIfError
          && var.equals(((CheckIfError) o).var);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append("check_if_error(").append(var).append(")")
          .comment(var.describeFields()).newline();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Assignment that unpacks a list into variables,
   * {@code [a, b] = l}. */
  public static class UnpackingAssignment extends Stmt {
    public final ImmutableList<VarReference> lhsList;
    public final VarReference rhs;
    public final String errorMessage;

    UnpackingAssignment(ImmutableList<VarReference> lhsList, VarReference rhs,
        String errorMessage) {
      super(Op.UNPACKING_ASSIGNMENT);
      this.lhsList = requireNonNull(lhsList);
      this.rhs = requireNonNull(rhs);
      this.errorMessage = requireNonNull(errorMessage);
    }

    @Override public int hashCode() {
      return Objects.hash(lhsList, rhs, errorMessage);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof UnpackingAssignment
          && lhsList.equals(((UnpackingAssignment) o).lhsList)
          && rhs.equals(((UnpackingAssignment) o).rhs)
          && errorMessage.equals(((UnpackingAssignment) o).errorMessage);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      w.append("[").appendAll(lhsList, ", ").append("] = ").append(rhs);
      if (w.isVerbose()) {
        final StringBuilder b = new StringBuilder("lhs: [");
        for (int i = 0; i < lhsList.size(); i++) {
          b.append(i == 0 ? "" : ", ").append(lhsList.get(i).describeFields());
        }
        w.comment(b.append("]; rhs: ").append(rhs.describeFields())
            .toString());
      }
      return w.newline();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Returns a result, an error, or both. */
  public static class ReturnStmt extends Stmt {
    public final @Nullable VarReference result;
    public final @Nullable VarReference error;

    ReturnStmt(@Nullable VarReference result, @Nullable VarReference error) {
      super(Op.RETURN);
      this.result = result;
      this.error = error;
    }

    @Override public int hashCode() {
      return Objects.hash(result, error);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ReturnStmt
          && Objects.equals(result, ((ReturnStmt) o).result)
          && Objects.equals(error, ((ReturnStmt) o).error);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      w.append("return ").append(result == null ? "None" : result.name)
          .append(", ").append(error == null ? "None" : error.name);
      return w.comment("result: "
              + (result == null ? "" : result.describeFields())
              + ", error: " + (error == null ? "" : error.describeFields()))
          .newline();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Conditional statement. */
  public static class IfStmt extends Stmt {
    public final VarReference cond;
    public final ImmutableList<Stmt> ifStmts;
    public final ImmutableList<Stmt> elseStmts;

    IfStmt(VarReference cond, ImmutableList<Stmt> ifStmts,
        ImmutableList<Stmt> elseStmts) {
      super(Op.IF);
      this.cond = requireNonNull(cond);
      this.ifStmts = requireNonNull(ifStmts);
      this.elseStmts = requireNonNull(elseStmts);
    }

    @Override public int hashCode() {
      return Objects.hash(cond, ifStmts, elseStmts);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof IfStmt
          && cond.equals(((IfStmt) o).cond)
          && ifStmts.equals(((IfStmt) o).ifStmts)
          && elseStmts.equals(((IfStmt) o).elseStmts);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      w.append("if ").append(cond).append(":")
          .comment(cond.describeFields()).newline().indent();
      w.appendAll(ifStmts, "");
      if (ifStmts.isEmpty()) {
        w.append("pass").newline();
      }
      w.outdent();
      if (!elseStmts.isEmpty()) {
        w.append("else:").newline().indent().appendAll(elseStmts, "")
            .outdent();
      }
      return w;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // declarations

  /** Declaration of a function argument. */
  public static class FunctionArgDecl extends Typed {
    /** Name of the argument; empty if the argument is unnamed. */
    public final String name;

    FunctionArgDecl(ExprType type, String name) {
      super(Op.ARG_DECL, type);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return Objects.hash(type, name);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FunctionArgDecl
          && type.equals(((FunctionArgDecl) o).type)
          && name.equals(((FunctionArgDecl) o).name);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append(name).append(": ").append(type);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Definition of a function. */
  public static class FunctionDefn extends Node {
    public final String name;
    public final String description;
    public final ImmutableList<FunctionArgDecl> args;
    public final ImmutableList<Stmt> body;
    public final ExprType returnType;

    FunctionDefn(String name, String description,
        ImmutableList<FunctionArgDecl> args, ImmutableList<Stmt> body,
        ExprType returnType) {
      super(Op.FUNCTION_DEFN);
      this.name = requireNonNull(name);
      this.description = requireNonNull(description);
      this.args = requireNonNull(args);
      this.body = requireNonNull(body);
      this.returnType = requireNonNull(returnType);
    }

    @Override public int hashCode() {
      return Objects.hash(name, args, body, returnType);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FunctionDefn
          && name.equals(((FunctionDefn) o).name)
          && description.equals(((FunctionDefn) o).description)
          && args.equals(((FunctionDefn) o).args)
          && body.equals(((FunctionDefn) o).body)
          && returnType.equals(((FunctionDefn) o).returnType);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      if (!description.isEmpty()) {
        w.append("# ").append(description).newline();
      }
      w.append("def ").append(name).append("(").appendAll(args, ", ")
          .append(") -> ").append(returnType).append(":").newline();
      return w.indent().appendAll(body, "").outdent().newline();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Definition of a custom type, at the top level of a module. */
  public static class CustomTypeDefn extends Node {
    public final CustomType customType;

    CustomTypeDefn(CustomType customType) {
      super(Op.CUSTOM_TYPE_DEFN);
      this.customType = requireNonNull(customType);
    }

    @Override public int hashCode() {
      return customType.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof CustomTypeDefn
          && customType.equals(((CustomTypeDefn) o).customType);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return customType.unparseDefn(w);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Definition of the built-in function that checks whether a value is
   * one of the error types of a module. Maps each error type to its
   * message. */
  public static class CheckIfErrorDefn extends Node {
    public final ImmutableMap<CustomType, String> errorTypesAndMessages;

    CheckIfErrorDefn(ImmutableMap<CustomType, String> errorTypesAndMessages) {
      super(Op.CHECK_IF_ERROR_DEFN);
      this.errorTypesAndMessages = requireNonNull(errorTypesAndMessages);
    }

    @Override public int hashCode() {
      return errorTypesAndMessages.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof CheckIfErrorDefn
          && errorTypesAndMessages.equals(
              ((CheckIfErrorDefn) o).errorTypesAndMessages);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      w.append("def check_if_error(x):").newline().indent();
      errorTypesAndMessages.forEach((errorType, message) ->
          w.append("if isinstance(x, ").append(errorType.name).append("):")
              .newline().indent().append("... # builtin").newline()
              .outdent());
      if (errorTypesAndMessages.isEmpty()) {
        w.append("... # builtin").newline();
      }
      return w.outdent().newline();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Module, the top-level unit of compilation.
   *
   * <p>The body holds function, type and error-check definitions, and
   * top-level statements, in the order that they are executed. */
  public static class Module extends Node {
    public final ImmutableList<Node> body;
    public final ImmutableSortedSet<String> publicNames;

    Module(ImmutableList<Node> body, ImmutableSortedSet<String> publicNames) {
      super(Op.MODULE);
      this.body = requireNonNull(body);
      this.publicNames = requireNonNull(publicNames);
    }

    @Override public int hashCode() {
      return Objects.hash(body, publicNames);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Module
          && body.equals(((Module) o).body)
          && publicNames.equals(((Module) o).publicNames);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.appendAll(body, "");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }
}

// End IrA.java
