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
package net.hydromatic.templar.irb;

import net.hydromatic.templar.ast.IrNode;
import net.hydromatic.templar.ast.IrWriter;
import net.hydromatic.templar.ast.Op;
import net.hydromatic.templar.ast.SourceBranch;
import net.hydromatic.templar.type.CustomType;
import net.hydromatic.templar.type.ExprType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static net.hydromatic.templar.irb.IrBBuilder.irB;

import static java.util.Objects.requireNonNull;

/** IR-B, the intermediate representation in which operands are arbitrary
 * expressions, and which has sets, exceptions and short-circuit boolean
 * operators.
 *
 * <p>Nodes are immutable. Create them using {@link IrBBuilder}, which
 * checks that operand types are consistent and derives each node's type.
 * Each composite node has a {@code copy} method that returns the node
 * itself if its children are unchanged, and otherwise builds a new node
 * using the builder; {@link Shuttle} uses these methods to rewrite trees.
 *
 * <p>{@link SourceBranch} fields are optional; they are carried through
 * rewrites unchanged. */
public class IrB {
  private IrB() {}

  /** Returns whether two lists hold the same nodes, compared by identity.
   * A rewritten node may be equal to the node it replaces yet differ in
   * fields that equality ignores, such as the argument names of a function
   * type. */
  static boolean sameElements(List<?> list0, List<?> list1) {
    if (list0.size() != list1.size()) {
      return false;
    }
    for (int i = 0; i < list0.size(); i++) {
      if (list0.get(i) != list1.get(i)) {
        return false;
      }
    }
    return true;
  }

  /** Abstract base class of IR-B nodes. */
  public abstract static class Node extends IrNode {
    Node(Op op) {
      super(op);
    }

    /** Accepts a visitor, calling the {@code visit} method appropriate to
     * the type of this node. */
    public abstract void accept(Visitor visitor);

    /** Accepts a shuttle, calling the {@code visit} method appropriate to
     * the type of this node, and returning the result. */
    public abstract Node accept(Shuttle shuttle);
  }

  /** Abstract base class of expressions. */
  public abstract static class Expr extends Node {
    public final ExprType type;

    Expr(Op op, ExprType type) {
      super(op);
      this.type = requireNonNull(type);
    }

    @Override public abstract Expr accept(Shuttle shuttle);

    /** Writes this expression as the operand of an operator, in parentheses
     * if it is itself an operator. */
    IrWriter unparseOperand(IrWriter w) {
      return w.append(this);
    }
  }

  /** Abstract base class of statements. */
  public abstract static class Stmt extends Node {
    public final @Nullable SourceBranch sourceBranch;

    Stmt(Op op, @Nullable SourceBranch sourceBranch) {
      super(op);
      this.sourceBranch = sourceBranch;
    }

    @Override public abstract Stmt accept(Shuttle shuttle);

    /** Ends the line of a statement, adding a comment in verbose mode. */
    IrWriter endLine(IrWriter w) {
      if (sourceBranch != null) {
        w.comment("branch: " + sourceBranch);
      }
      return w.newline();
    }
  }

  /** Reference to a variable or function.
   *
   * <p>If {@link #sourceModule} is present, the reference is to a global
   * function imported from that module. */
  public static class VarReference extends Expr {
    public final String name;
    public final boolean isGlobalFunction;
    public final boolean isFunctionThatMayThrow;
    public final @Nullable String sourceModule;

    VarReference(ExprType type, String name, boolean isGlobalFunction,
        boolean isFunctionThatMayThrow, @Nullable String sourceModule) {
      super(Op.VAR_REF, type);
      this.name = requireNonNull(name);
      this.isGlobalFunction = isGlobalFunction;
      this.isFunctionThatMayThrow = isFunctionThatMayThrow;
      this.sourceModule = sourceModule;
    }

    @Override public int hashCode() {
      return Objects.hash(name, type, isGlobalFunction,
          isFunctionThatMayThrow, sourceModule);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof VarReference
          && name.equals(((VarReference) o).name)
          && type.equals(((VarReference) o).type)
          && isGlobalFunction == ((VarReference) o).isGlobalFunction
          && isFunctionThatMayThrow
              == ((VarReference) o).isFunctionThatMayThrow
          && Objects.equals(sourceModule, ((VarReference) o).sourceModule);
    }

    /** Returns a copy of this reference with a given "may throw" flag. */
    public VarReference withFunctionThatMayThrow(boolean mayThrow) {
      return mayThrow == isFunctionThatMayThrow ? this
          : irB.varReference(type, name, isGlobalFunction, mayThrow,
              sourceModule);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return w.append(name);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public VarReference accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** One case of a {@link MatchExpr}. */
  public static class MatchCase extends Node {
    public final ImmutableList<Expr> typePatterns;
    public final ImmutableList<String> matchedVarNames;
    public final ImmutableList<String> matchedVariadicVarNames;
    public final Expr expr;
    public final @Nullable SourceBranch startBranch;
    public final @Nullable SourceBranch endBranch;

    MatchCase(ImmutableList<Expr> typePatterns,
        ImmutableList<String> matchedVarNames,
        ImmutableList<String> matchedVariadicVarNames, Expr expr,
        @Nullable SourceBranch startBranch, @Nullable SourceBranch endBranch) {
      super(Op.MATCH_CASE);
      this.typePatterns = requireNonNull(typePatterns);
      this.matchedVarNames = requireNonNull(matchedVarNames);
      this.matchedVariadicVarNames = requireNonNull(matchedVariadicVarNames);
      this.expr = requireNonNull(expr);
      this.startBranch = startBranch;
      this.endBranch = endBranch;
    }

    /** Returns the names bound by this case, non-variadic names first. */
    public ImmutableList<String> boundNames() {
      return ImmutableList.<String>builder().addAll(matchedVarNames)
          .addAll(matchedVariadicVarNames).build();
    }

    /** Returns whether this case is the main definition (the catch-all).
     *
     * <p>The rule is the same as IR-A's: every pattern is a plain variable
     * reference, and the referenced names are exactly the names bound by
     * this case. */
    public boolean isMainDefinition() {
      final Set<String> names = new HashSet<>();
      for (Expr pattern : typePatterns) {
        if (!(pattern instanceof VarReference)) {
          return false;
        }
        names.add(((VarReference) pattern).name);
      }
      return names.equals(ImmutableSet.copyOf(boundNames()));
    }

    public MatchCase copy(Expr expr) {
      return expr == this.expr ? this
          : irB.matchCase(typePatterns, matchedVarNames,
              matchedVariadicVarNames, expr, startBranch, endBranch);
    }

    @Override public int hashCode() {
      return Objects.hash(typePatterns, matchedVarNames,
          matchedVariadicVarNames, expr, startBranch, endBranch);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof MatchCase
          && typePatterns.equals(((MatchCase) o).typePatterns)
          && matchedVarNames.equals(((MatchCase) o).matchedVarNames)
          && matchedVariadicVarNames.equals(
              ((MatchCase) o).matchedVariadicVarNames)
          && expr.equals(((MatchCase) o).expr)
          && Objects.equals(startBranch, ((MatchCase) o).startBranch)
          && Objects.equals(endBranch, ((MatchCase) o).endBranch);
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

    @Override public MatchCase accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Match expression. Its type is the type of its cases' results. */
  public static class MatchExpr extends Expr {
    public final ImmutableList<Expr> matchedExprs;
    public final ImmutableList<MatchCase> matchCases;

    MatchExpr(ExprType type, ImmutableList<Expr> matchedExprs,
        ImmutableList<MatchCase> matchCases) {
      super(Op.MATCH, type);
      this.matchedExprs = requireNonNull(matchedExprs);
      this.matchCases = requireNonNull(matchCases);
    }

    public MatchExpr copy(List<Expr> matchedExprs,
        List<MatchCase> matchCases) {
      return sameElements(matchedExprs, this.matchedExprs)
          && sameElements(matchCases, this.matchCases) ? this
          : irB.match(matchedExprs, matchCases);
    }

    @Override public int hashCode() {
      return Objects.hash(matchedExprs, matchCases);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof MatchExpr
          && matchedExprs.equals(((MatchExpr) o).matchedExprs)
          && matchCases.equals(((MatchExpr) o).matchCases);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      w.append("match(").appendAll(matchedExprs, ", ").append(")({")
          .newline().indent();
      return w.appendAll(matchCases, "").outdent().append("})");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
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

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
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

    @Override IrWriter unparseOperand(IrWriter w) {
      return value < 0 ? w.append("(").append(this).append(")")
          : w.append(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
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

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Abstract base class of expressions that apply a type constructor,
   * such as pointer, to an expression of type {@code Type}. */
  public abstract static class WrappedTypeExpr extends Expr {
    public final Expr typeExpr;
    private final String function;

    WrappedTypeExpr(Op op, ExprType type, Expr typeExpr, String function) {
      super(op, type);
      this.typeExpr = requireNonNull(typeExpr);
      this.function = function;
    }

    /** Returns an expression of the same kind with a different
     * operand. */
    public abstract Expr copy(Expr typeExpr);

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
  }

  /** Pointer type, {@code T*}. */
  public static class PointerTypeExpr extends WrappedTypeExpr {
    PointerTypeExpr(ExprType type, Expr typeExpr) {
      super(Op.POINTER_TYPE, type, typeExpr, "pointer");
    }

    @Override public Expr copy(Expr typeExpr) {
      return typeExpr == this.typeExpr ? this : irB.pointerType(typeExpr);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Reference type, {@code T&}. */
  public static class ReferenceTypeExpr extends WrappedTypeExpr {
    ReferenceTypeExpr(ExprType type, Expr typeExpr) {
      super(Op.REFERENCE_TYPE, type, typeExpr, "reference");
    }

    @Override public Expr copy(Expr typeExpr) {
      return typeExpr == this.typeExpr ? this : irB.referenceType(typeExpr);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Rvalue reference type, {@code T&&}. */
  public static class RvalueReferenceTypeExpr extends WrappedTypeExpr {
    RvalueReferenceTypeExpr(ExprType type, Expr typeExpr) {
      super(Op.RVALUE_REFERENCE_TYPE, type, typeExpr, "rvalue_reference");
    }

    @Override public Expr copy(Expr typeExpr) {
      return typeExpr == this.typeExpr ? this
          : irB.rvalueReferenceType(typeExpr);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Const type, {@code const T}. */
  public static class ConstTypeExpr extends WrappedTypeExpr {
    ConstTypeExpr(ExprType type, Expr typeExpr) {
      super(Op.CONST_TYPE, type, typeExpr, "const");
    }

    @Override public Expr copy(Expr typeExpr) {
      return typeExpr == this.typeExpr ? this : irB.constType(typeExpr);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Array type, {@code T[]}. */
  public static class ArrayTypeExpr extends WrappedTypeExpr {
    ArrayTypeExpr(ExprType type, Expr typeExpr) {
      super(Op.ARRAY_TYPE, type, typeExpr, "array");
    }

    @Override public Expr copy(Expr typeExpr) {
      return typeExpr == this.typeExpr ? this : irB.arrayType(typeExpr);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Function type, built from a return type and a list of argument
   * types. */
  public static class FunctionTypeExpr extends Expr {
    public final Expr returnTypeExpr;
    public final Expr argListExpr;

    FunctionTypeExpr(ExprType type, Expr returnTypeExpr, Expr argListExpr) {
      super(Op.FUNCTION_TYPE, type);
      this.returnTypeExpr = requireNonNull(returnTypeExpr);
      this.argListExpr = requireNonNull(argListExpr);
    }

    public FunctionTypeExpr copy(Expr returnTypeExpr, Expr argListExpr) {
      return returnTypeExpr == this.returnTypeExpr
          && argListExpr == this.argListExpr ? this
          : irB.functionType(returnTypeExpr, argListExpr);
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

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Instantiation of a template, such as {@code std::vector<int>}. */
  public static class TemplateInstantiationExpr extends Expr {
    public final String templateAtomicCppType;
    public final Expr argListExpr;

    TemplateInstantiationExpr(ExprType type, String templateAtomicCppType,
        Expr argListExpr) {
      super(Op.TEMPLATE_INSTANTIATION, type);
      this.templateAtomicCppType = requireNonNull(templateAtomicCppType);
      this.argListExpr = requireNonNull(argListExpr);
    }

    public TemplateInstantiationExpr copy(Expr argListExpr) {
      return argListExpr == this.argListExpr ? this
          : irB.templateInstantiation(templateAtomicCppType, argListExpr);
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

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Access to a member template of a class, such as
   * {@code foo::bar<int>}. */
  public static class TemplateMemberAccessExpr extends Expr {
    public final Expr classTypeExpr;
    public final String memberName;
    public final Expr argListExpr;

    TemplateMemberAccessExpr(ExprType type, Expr classTypeExpr,
        String memberName, Expr argListExpr) {
      super(Op.TEMPLATE_MEMBER_ACCESS, type);
      this.classTypeExpr = requireNonNull(classTypeExpr);
      this.memberName = requireNonNull(memberName);
      this.argListExpr = requireNonNull(argListExpr);
    }

    public TemplateMemberAccessExpr copy(Expr classTypeExpr,
        Expr argListExpr) {
      return classTypeExpr == this.classTypeExpr
          && argListExpr == this.argListExpr ? this
          : irB.templateMemberAccess(classTypeExpr, memberName, argListExpr);
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

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** List literal, {@code [a, b, c]}.
   *
   * <p>If {@link #listExtractionExpr} is present, the list is used as a
   * match pattern, and the variable binds the remaining elements:
   * {@code [a, *rest]}. */
  public static class ListExpr extends Expr {
    public final ExprType elemType;
    public final ImmutableList<Expr> elemExprs;
    public final @Nullable VarReference listExtractionExpr;

    ListExpr(ExprType type, ExprType elemType, ImmutableList<Expr> elemExprs,
        @Nullable VarReference listExtractionExpr) {
      super(Op.LIST, type);
      this.elemType = requireNonNull(elemType);
      this.elemExprs = requireNonNull(elemExprs);
      this.listExtractionExpr = listExtractionExpr;
    }

    public ListExpr copy(List<Expr> elemExprs,
        @Nullable VarReference listExtractionExpr) {
      return sameElements(elemExprs, this.elemExprs)
          && listExtractionExpr == this.listExtractionExpr ? this
          : irB.list(elemType, elemExprs, listExtractionExpr);
    }

    @Override public int hashCode() {
      return Objects.hash(elemType, elemExprs, listExtractionExpr);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ListExpr
          && elemType.equals(((ListExpr) o).elemType)
          && elemExprs.equals(((ListExpr) o).elemExprs)
          && Objects.equals(listExtractionExpr,
              ((ListExpr) o).listExtractionExpr);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      w.append("[").appendAll(elemExprs, ", ");
      if (listExtractionExpr != null) {
        w.append(elemExprs.isEmpty() ? "*" : ", *").append(listExtractionExpr);
      }
      return w.append("]");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Set literal, {@code {a, b, c}}. */
  public static class SetExpr extends Expr {
    public final ExprType elemType;
    public final ImmutableList<Expr> elemExprs;

    SetExpr(ExprType type, ExprType elemType, ImmutableList<Expr> elemExprs) {
      super(Op.SET, type);
      this.elemType = requireNonNull(elemType);
      this.elemExprs = requireNonNull(elemExprs);
    }

    public SetExpr copy(List<Expr> elemExprs) {
      return sameElements(elemExprs, this.elemExprs) ? this
          : irB.set(elemType, elemExprs);
    }

    @Override public int hashCode() {
      return Objects.hash(elemType, elemExprs) + 1;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof SetExpr
          && elemType.equals(((SetExpr) o).elemType)
          && elemExprs.equals(((SetExpr) o).elemExprs);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      if (elemExprs.isEmpty()) {
        return w.append("set()");
      }
      return w.append("{").appendAll(elemExprs, ", ").append("}");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Abstract base class of expressions that have one operand. */
  public abstract static class UnaryExpr extends Expr {
    public final Expr expr;

    UnaryExpr(Op op, ExprType type, Expr expr) {
      super(op, type);
      this.expr = requireNonNull(expr);
    }

    /** Returns an expression of the same kind with a different
     * operand. */
    public abstract Expr copy(Expr expr);

    @Override public int hashCode() {
      return Objects.hash(op, expr);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof UnaryExpr
          && op == ((UnaryExpr) o).op
          && expr.equals(((UnaryExpr) o).expr);
    }

    /** Writes a call to a built-in function, such as {@code sum(x)}. */
    IrWriter unparseCall(IrWriter w, String function) {
      return w.append(function).append("(").append(expr).append(")");
    }
  }

  /** Sum of a list of integers, {@code sum(l)}. */
  public static class IntListSumExpr extends UnaryExpr {
    IntListSumExpr(ExprType type, Expr expr) {
      super(Op.INT_LIST_SUM, type, expr);
    }

    @Override public Expr copy(Expr expr) {
      return expr == this.expr ? this : irB.intListSum(expr);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return unparseCall(w, "sum");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Sum of a set of integers, {@code sum(s)}. */
  public static class IntSetSumExpr extends UnaryExpr {
    IntSetSumExpr(ExprType type, Expr expr) {
      super(Op.INT_SET_SUM, type, expr);
    }

    @Override public Expr copy(Expr expr) {
      return expr == this.expr ? this : irB.intSetSum(expr);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return unparseCall(w, "sum");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Whether all elements of a list of booleans are true. */
  public static class BoolListAllExpr extends UnaryExpr {
    BoolListAllExpr(ExprType type, Expr expr) {
      super(Op.BOOL_LIST_ALL, type, expr);
    }

    @Override public Expr copy(Expr expr) {
      return expr == this.expr ? this : irB.boolListAll(expr);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return unparseCall(w, "all");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Whether any element of a list of booleans is true. */
  public static class BoolListAnyExpr extends UnaryExpr {
    BoolListAnyExpr(ExprType type, Expr expr) {
      super(Op.BOOL_LIST_ANY, type, expr);
    }

    @Override public Expr copy(Expr expr) {
      return expr == this.expr ? this : irB.boolListAny(expr);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return unparseCall(w, "any");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Whether all elements of a set of booleans are true. */
  public static class BoolSetAllExpr extends UnaryExpr {
    BoolSetAllExpr(ExprType type, Expr expr) {
      super(Op.BOOL_SET_ALL, type, expr);
    }

    @Override public Expr copy(Expr expr) {
      return expr == this.expr ? this : irB.boolSetAll(expr);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return unparseCall(w, "all");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Whether any element of a set of booleans is true. */
  public static class BoolSetAnyExpr extends UnaryExpr {
    BoolSetAnyExpr(ExprType type, Expr expr) {
      super(Op.BOOL_SET_ANY, type, expr);
    }

    @Override public Expr copy(Expr expr) {
      return expr == this.expr ? this : irB.boolSetAny(expr);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return unparseCall(w, "any");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Logical negation, {@code not x}. */
  public static class NotExpr extends UnaryExpr {
    NotExpr(ExprType type, Expr expr) {
      super(Op.NOT, type, expr);
    }

    @Override public Expr copy(Expr expr) {
      return expr == this.expr ? this : irB.not(expr);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return expr.unparseOperand(w.append("not "));
    }

    @Override IrWriter unparseOperand(IrWriter w) {
      return w.append("(").append(this).append(")");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Integer negation, {@code -x}. */
  public static class IntUnaryMinusExpr extends UnaryExpr {
    IntUnaryMinusExpr(ExprType type, Expr expr) {
      super(Op.UNARY_MINUS, type, expr);
    }

    @Override public Expr copy(Expr expr) {
      return expr == this.expr ? this : irB.unaryMinus(expr);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return expr.unparseOperand(w.append("-"));
    }

    @Override IrWriter unparseOperand(IrWriter w) {
      return w.append("(").append(this).append(")");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Abstract base class of expressions that have two operands and are
   * written as an infix operator. */
  public abstract static class BinaryExpr extends Expr {
    public final Expr lhs;
    public final Expr rhs;

    BinaryExpr(Op op, ExprType type, Expr lhs, Expr rhs) {
      super(op, type);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
    }

    /** Returns an expression of the same kind with different operands. */
    public abstract Expr copy(Expr lhs, Expr rhs);

    /** Returns the operator symbol, e.g. "and". */
    abstract String opName();

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

    @Override protected IrWriter unparse(IrWriter w) {
      lhs.unparseOperand(w).append(" ").append(opName()).append(" ");
      return rhs.unparseOperand(w);
    }

    @Override IrWriter unparseOperand(IrWriter w) {
      return w.append("(").append(this).append(")");
    }
  }

  /** Short-circuit conjunction, {@code a and b}. */
  public static class AndExpr extends BinaryExpr {
    AndExpr(ExprType type, Expr lhs, Expr rhs) {
      super(Op.AND, type, lhs, rhs);
    }

    @Override public Expr copy(Expr lhs, Expr rhs) {
      return lhs == this.lhs && rhs == this.rhs ? this : irB.and(lhs, rhs);
    }

    @Override String opName() {
      return "and";
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Short-circuit disjunction, {@code a or b}. */
  public static class OrExpr extends BinaryExpr {
    OrExpr(ExprType type, Expr lhs, Expr rhs) {
      super(Op.OR, type, lhs, rhs);
    }

    @Override public Expr copy(Expr lhs, Expr rhs) {
      return lhs == this.lhs && rhs == this.rhs ? this : irB.or(lhs, rhs);
    }

    @Override String opName() {
      return "or";
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Equality comparison, {@code a == b}. */
  public static class EqualityComparison extends BinaryExpr {
    EqualityComparison(ExprType type, Expr lhs, Expr rhs) {
      super(Op.EQUAL, type, lhs, rhs);
    }

    @Override public Expr copy(Expr lhs, Expr rhs) {
      return lhs == this.lhs && rhs == this.rhs ? this : irB.equal(lhs, rhs);
    }

    @Override String opName() {
      return "==";
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Membership of a list or set, {@code a in b}. */
  public static class InExpr extends BinaryExpr {
    InExpr(ExprType type, Expr lhs, Expr rhs) {
      super(Op.IN, type, lhs, rhs);
    }

    @Override public Expr copy(Expr lhs, Expr rhs) {
      return lhs == this.lhs && rhs == this.rhs ? this : irB.in(lhs, rhs);
    }

    @Override String opName() {
      return "in";
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Concatenation of two lists, {@code a + b}. */
  public static class ListConcatExpr extends BinaryExpr {
    ListConcatExpr(ExprType type, Expr lhs, Expr rhs) {
      super(Op.LIST_CONCAT, type, lhs, rhs);
    }

    @Override public Expr copy(Expr lhs, Expr rhs) {
      return lhs == this.lhs && rhs == this.rhs ? this
          : irB.listConcat(lhs, rhs);
    }

    @Override String opName() {
      return "+";
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Comparison of two integers; {@link #operator} is one of
   * {@link Op#LT}, {@link Op#GT}, {@link Op#LE}, {@link Op#GE}. */
  public static class IntComparisonExpr extends BinaryExpr {
    public final Op operator;

    IntComparisonExpr(ExprType type, Expr lhs, Expr rhs, Op operator) {
      super(Op.INT_COMPARISON, type, lhs, rhs);
      this.operator = requireNonNull(operator);
    }

    @Override public Expr copy(Expr lhs, Expr rhs) {
      return lhs == this.lhs && rhs == this.rhs ? this
          : irB.intComparison(lhs, operator, rhs);
    }

    @Override String opName() {
      return operator.opName;
    }

    @Override public int hashCode() {
      return super.hashCode() * 31 + operator.hashCode();
    }

    @Override public boolean equals(Object o) {
      return super.equals(o)
          && operator == ((IntComparisonExpr) o).operator;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Arithmetic on two integers; {@link #operator} is one of
   * {@link Op#PLUS}, {@link Op#MINUS}, {@link Op#TIMES}, {@link Op#DIVIDE},
   * {@link Op#MOD}. */
  public static class IntBinaryOpExpr extends BinaryExpr {
    public final Op operator;

    IntBinaryOpExpr(ExprType type, Expr lhs, Expr rhs, Op operator) {
      super(Op.INT_BINARY_OP, type, lhs, rhs);
      this.operator = requireNonNull(operator);
    }

    @Override public Expr copy(Expr lhs, Expr rhs) {
      return lhs == this.lhs && rhs == this.rhs ? this
          : irB.intBinaryOp(lhs, operator, rhs);
    }

    @Override String opName() {
      return operator.opName;
    }

    @Override public int hashCode() {
      return super.hashCode() * 31 + operator.hashCode();
    }

    @Override public boolean equals(Object o) {
      return super.equals(o)
          && operator == ((IntBinaryOpExpr) o).operator;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Call to a function. If {@link #mayThrow}, the callee may raise an
   * exception. */
  public static class FunctionCall extends Expr {
    public final Expr funExpr;
    public final ImmutableList<Expr> args;
    public final boolean mayThrow;

    FunctionCall(ExprType type, Expr funExpr, ImmutableList<Expr> args,
        boolean mayThrow) {
      super(Op.FUNCTION_CALL, type);
      this.funExpr = requireNonNull(funExpr);
      this.args = requireNonNull(args);
      this.mayThrow = mayThrow;
    }

    public FunctionCall copy(Expr funExpr, List<Expr> args,
        boolean mayThrow) {
      return funExpr == this.funExpr
          && sameElements(args, this.args)
          && mayThrow == this.mayThrow ? this
          : irB.functionCall(funExpr, args, mayThrow);
    }

    @Override public int hashCode() {
      return Objects.hash(funExpr, args, mayThrow);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FunctionCall
          && funExpr.equals(((FunctionCall) o).funExpr)
          && args.equals(((FunctionCall) o).args)
          && mayThrow == ((FunctionCall) o).mayThrow;
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return funExpr.unparseOperand(w).append("(").appendAll(args, ", ")
          .append(")");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Access to an attribute of a type or of a value of a custom type,
   * {@code x.a}. */
  public static class AttributeAccessExpr extends Expr {
    public final Expr expr;
    public final String attributeName;

    AttributeAccessExpr(ExprType type, Expr expr, String attributeName) {
      super(Op.ATTRIBUTE_ACCESS, type);
      this.expr = requireNonNull(expr);
      this.attributeName = requireNonNull(attributeName);
    }

    public AttributeAccessExpr copy(Expr expr) {
      return expr == this.expr ? this
          : irB.attributeAccess(expr, attributeName, type);
    }

    @Override public int hashCode() {
      return Objects.hash(type, expr, attributeName);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof AttributeAccessExpr
          && type.equals(((AttributeAccessExpr) o).type)
          && expr.equals(((AttributeAccessExpr) o).expr)
          && attributeName.equals(((AttributeAccessExpr) o).attributeName);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return expr.unparseOperand(w).append(".").append(attributeName);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Abstract base class of comprehensions, which apply an expression to
   * each element of a collection. */
  public abstract static class Comprehension extends Expr {
    public final Expr collectionExpr;
    public final VarReference loopVar;
    public final Expr resultElemExpr;
    public final @Nullable SourceBranch loopBodyStartBranch;
    public final @Nullable SourceBranch loopExitBranch;

    Comprehension(Op op, ExprType type, Expr collectionExpr,
        VarReference loopVar, Expr resultElemExpr,
        @Nullable SourceBranch loopBodyStartBranch,
        @Nullable SourceBranch loopExitBranch) {
      super(op, type);
      this.collectionExpr = requireNonNull(collectionExpr);
      this.loopVar = requireNonNull(loopVar);
      this.resultElemExpr = requireNonNull(resultElemExpr);
      this.loopBodyStartBranch = loopBodyStartBranch;
      this.loopExitBranch = loopExitBranch;
    }

    /** Returns a comprehension of the same kind with different
     * children. */
    public abstract Comprehension copy(Expr collectionExpr,
        VarReference loopVar, Expr resultElemExpr);

    @Override public int hashCode() {
      return Objects.hash(op, collectionExpr, loopVar, resultElemExpr,
          loopBodyStartBranch, loopExitBranch);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Comprehension
          && op == ((Comprehension) o).op
          && collectionExpr.equals(((Comprehension) o).collectionExpr)
          && loopVar.equals(((Comprehension) o).loopVar)
          && resultElemExpr.equals(((Comprehension) o).resultElemExpr)
          && Objects.equals(loopBodyStartBranch,
              ((Comprehension) o).loopBodyStartBranch)
          && Objects.equals(loopExitBranch,
              ((Comprehension) o).loopExitBranch);
    }

    IrWriter unparse(IrWriter w, String open, String close) {
      return w.append(open).append(resultElemExpr).append(" for ")
          .append(loopVar).append(" in ").append(collectionExpr)
          .append(close);
    }
  }

  /** List comprehension, {@code [f(x) for x in l]}. */
  public static class ListComprehension extends Comprehension {
    ListComprehension(ExprType type, Expr listExpr, VarReference loopVar,
        Expr resultElemExpr, @Nullable SourceBranch loopBodyStartBranch,
        @Nullable SourceBranch loopExitBranch) {
      super(Op.LIST_COMPREHENSION, type, listExpr, loopVar, resultElemExpr,
          loopBodyStartBranch, loopExitBranch);
    }

    @Override public ListComprehension copy(Expr listExpr,
        VarReference loopVar, Expr resultElemExpr) {
      return listExpr == this.collectionExpr
          && loopVar == this.loopVar
          && resultElemExpr == this.resultElemExpr ? this
          : irB.listComprehension(listExpr, loopVar, resultElemExpr,
              loopBodyStartBranch, loopExitBranch);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return unparse(w, "[", "]");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Set comprehension, {@code {f(x) for x in s}}. */
  public static class SetComprehension extends Comprehension {
    SetComprehension(ExprType type, Expr setExpr, VarReference loopVar,
        Expr resultElemExpr, @Nullable SourceBranch loopBodyStartBranch,
        @Nullable SourceBranch loopExitBranch) {
      super(Op.SET_COMPREHENSION, type, setExpr, loopVar, resultElemExpr,
          loopBodyStartBranch, loopExitBranch);
    }

    @Override public SetComprehension copy(Expr setExpr,
        VarReference loopVar, Expr resultElemExpr) {
      return setExpr == this.collectionExpr
          && loopVar == this.loopVar
          && resultElemExpr == this.resultElemExpr ? this
          : irB.setComprehension(setExpr, loopVar, resultElemExpr,
              loopBodyStartBranch, loopExitBranch);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return unparse(w, "{", "}");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  // statements

  /** Statement that does nothing. */
  public static class PassStmt extends Stmt {
    PassStmt(@Nullable SourceBranch sourceBranch) {
      super(Op.PASS, sourceBranch);
    }

    @Override public int hashCode() {
      return Objects.hash(op, sourceBranch);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof PassStmt
          && Objects.equals(sourceBranch, ((PassStmt) o).sourceBranch);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return endLine(w.append("pass"));
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public PassStmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Assertion that a boolean expression is true. */
  public static class Assert extends Stmt {
    public final Expr expr;
    public final String message;

    Assert(Expr expr, String message, @Nullable SourceBranch sourceBranch) {
      super(Op.ASSERT, sourceBranch);
      this.expr = requireNonNull(expr);
      this.message = requireNonNull(message);
    }

    public Assert copy(Expr expr) {
      return expr == this.expr ? this
          : irB.assertStmt(expr, message, sourceBranch);
    }

    @Override public int hashCode() {
      return Objects.hash(expr, message, sourceBranch);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Assert
          && expr.equals(((Assert) o).expr)
          && message.equals(((Assert) o).message)
          && Objects.equals(sourceBranch, ((Assert) o).sourceBranch);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return endLine(w.append("assert ").append(expr));
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Assert accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Assignment, {@code x = e}. */
  public static class Assignment extends Stmt {
    public final VarReference lhs;
    public final Expr rhs;

    Assignment(VarReference lhs, Expr rhs,
        @Nullable SourceBranch sourceBranch) {
      super(Op.ASSIGNMENT, sourceBranch);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
    }

    public Assignment copy(VarReference lhs, Expr rhs) {
      return lhs == this.lhs && rhs == this.rhs ? this
          : irB.assignment(lhs, rhs, sourceBranch);
    }

    @Override public int hashCode() {
      return Objects.hash(lhs, rhs, sourceBranch);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Assignment
          && lhs.equals(((Assignment) o).lhs)
          && rhs.equals(((Assignment) o).rhs)
          && Objects.equals(sourceBranch, ((Assignment) o).sourceBranch);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return endLine(w.append(lhs).append(" = ").append(rhs));
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Assignment that unpacks a list into variables,
   * {@code [a, b] = e}. */
  public static class UnpackingAssignment extends Stmt {
    public final ImmutableList<VarReference> lhsList;
    public final Expr rhs;
    public final String errorMessage;

    UnpackingAssignment(ImmutableList<VarReference> lhsList, Expr rhs,
        String errorMessage, @Nullable SourceBranch sourceBranch) {
      super(Op.UNPACKING_ASSIGNMENT, sourceBranch);
      this.lhsList = requireNonNull(lhsList);
      this.rhs = requireNonNull(rhs);
      this.errorMessage = requireNonNull(errorMessage);
    }

    public UnpackingAssignment copy(List<VarReference> lhsList, Expr rhs) {
      return sameElements(lhsList, this.lhsList) && rhs == this.rhs ? this
          : irB.unpackingAssignment(lhsList, rhs, errorMessage, sourceBranch);
    }

    @Override public int hashCode() {
      return Objects.hash(lhsList, rhs, errorMessage, sourceBranch);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof UnpackingAssignment
          && lhsList.equals(((UnpackingAssignment) o).lhsList)
          && rhs.equals(((UnpackingAssignment) o).rhs)
          && errorMessage.equals(((UnpackingAssignment) o).errorMessage)
          && Objects.equals(sourceBranch,
              ((UnpackingAssignment) o).sourceBranch);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return endLine(
          w.append("[").appendAll(lhsList, ", ").append("] = ").append(rhs));
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Return statement. */
  public static class ReturnStmt extends Stmt {
    public final Expr expr;

    ReturnStmt(Expr expr, @Nullable SourceBranch sourceBranch) {
      super(Op.RETURN, sourceBranch);
      this.expr = requireNonNull(expr);
    }

    public ReturnStmt copy(Expr expr) {
      return expr == this.expr ? this : irB.returnStmt(expr, sourceBranch);
    }

    @Override public int hashCode() {
      return Objects.hash(expr, sourceBranch);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ReturnStmt
          && expr.equals(((ReturnStmt) o).expr)
          && Objects.equals(sourceBranch, ((ReturnStmt) o).sourceBranch);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return endLine(w.append("return ").append(expr));
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Conditional statement. */
  public static class IfStmt extends Stmt {
    public final Expr condExpr;
    public final ImmutableList<Stmt> ifStmts;
    public final ImmutableList<Stmt> elseStmts;

    IfStmt(Expr condExpr, ImmutableList<Stmt> ifStmts,
        ImmutableList<Stmt> elseStmts) {
      super(Op.IF, null);
      this.condExpr = requireNonNull(condExpr);
      this.ifStmts = requireNonNull(ifStmts);
      this.elseStmts = requireNonNull(elseStmts);
    }

    public IfStmt copy(Expr condExpr, List<Stmt> ifStmts,
        List<Stmt> elseStmts) {
      return condExpr == this.condExpr
          && sameElements(ifStmts, this.ifStmts)
          && sameElements(elseStmts, this.elseStmts) ? this
          : irB.ifStmt(condExpr, ifStmts, elseStmts);
    }

    @Override public int hashCode() {
      return Objects.hash(condExpr, ifStmts, elseStmts);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof IfStmt
          && condExpr.equals(((IfStmt) o).condExpr)
          && ifStmts.equals(((IfStmt) o).ifStmts)
          && elseStmts.equals(((IfStmt) o).elseStmts);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      w.append("if ").append(condExpr).append(":").newline().indent();
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

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Raises an exception, {@code raise e}. */
  public static class RaiseStmt extends Stmt {
    public final Expr expr;

    RaiseStmt(Expr expr, @Nullable SourceBranch sourceBranch) {
      super(Op.RAISE, sourceBranch);
      this.expr = requireNonNull(expr);
    }

    public RaiseStmt copy(Expr expr) {
      return expr == this.expr ? this : irB.raise(expr, sourceBranch);
    }

    @Override public int hashCode() {
      return Objects.hash(op, expr, sourceBranch);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof RaiseStmt
          && expr.equals(((RaiseStmt) o).expr)
          && Objects.equals(sourceBranch, ((RaiseStmt) o).sourceBranch);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      return endLine(w.append("raise ").append(expr));
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Executes a block, and if it raises an exception of a given type,
   * binds the exception to a name and executes another block. */
  public static class TryExcept extends Stmt {
    public final ImmutableList<Stmt> tryBody;
    public final CustomType caughtExceptionType;
    public final String caughtExceptionName;
    public final ImmutableList<Stmt> exceptBody;
    public final @Nullable SourceBranch tryBranch;
    public final @Nullable SourceBranch exceptBranch;

    TryExcept(ImmutableList<Stmt> tryBody, CustomType caughtExceptionType,
        String caughtExceptionName, ImmutableList<Stmt> exceptBody,
        @Nullable SourceBranch tryBranch,
        @Nullable SourceBranch exceptBranch) {
      super(Op.TRY_EXCEPT, null);
      this.tryBody = requireNonNull(tryBody);
      this.caughtExceptionType = requireNonNull(caughtExceptionType);
      this.caughtExceptionName = requireNonNull(caughtExceptionName);
      this.exceptBody = requireNonNull(exceptBody);
      this.tryBranch = tryBranch;
      this.exceptBranch = exceptBranch;
    }

    public TryExcept copy(List<Stmt> tryBody, List<Stmt> exceptBody) {
      return sameElements(tryBody, this.tryBody)
          && sameElements(exceptBody, this.exceptBody) ? this
          : irB.tryExcept(tryBody, caughtExceptionType, caughtExceptionName,
              exceptBody, tryBranch, exceptBranch);
    }

    @Override public int hashCode() {
      return Objects.hash(tryBody, caughtExceptionType, caughtExceptionName,
          exceptBody, tryBranch, exceptBranch);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TryExcept
          && tryBody.equals(((TryExcept) o).tryBody)
          && caughtExceptionType.equals(((TryExcept) o).caughtExceptionType)
          && caughtExceptionName.equals(((TryExcept) o).caughtExceptionName)
          && exceptBody.equals(((TryExcept) o).exceptBody)
          && Objects.equals(tryBranch, ((TryExcept) o).tryBranch)
          && Objects.equals(exceptBranch, ((TryExcept) o).exceptBranch);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      w.append("try:").newline().indent().appendAll(tryBody, "").outdent();
      w.append("except ").append(caughtExceptionType).append(" as ")
          .append(caughtExceptionName).append(":").newline().indent();
      w.appendAll(exceptBody, "");
      if (exceptBody.isEmpty()) {
        w.append("pass").newline();
      }
      return w.outdent();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  // declarations

  /** Declaration of a function argument. */
  public static class FunctionArgDecl extends Node {
    public final ExprType type;
    /** Name of the argument; empty if the argument is unnamed. */
    public final String name;

    FunctionArgDecl(ExprType type, String name) {
      super(Op.ARG_DECL);
      this.type = requireNonNull(type);
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

    @Override public FunctionArgDecl accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Definition of a function. */
  public static class FunctionDefn extends Node {
    public final String name;
    public final ImmutableList<FunctionArgDecl> args;
    public final ImmutableList<Stmt> body;
    public final ExprType returnType;

    FunctionDefn(String name, ImmutableList<FunctionArgDecl> args,
        ImmutableList<Stmt> body, ExprType returnType) {
      super(Op.FUNCTION_DEFN);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
      this.body = requireNonNull(body);
      this.returnType = requireNonNull(returnType);
    }

    public FunctionDefn copy(List<FunctionArgDecl> args, List<Stmt> body) {
      return sameElements(args, this.args)
          && sameElements(body, this.body) ? this
          : irB.functionDefn(name, args, body, returnType);
    }

    @Override public int hashCode() {
      return Objects.hash(name, args, body, returnType);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FunctionDefn
          && name.equals(((FunctionDefn) o).name)
          && args.equals(((FunctionDefn) o).args)
          && body.equals(((FunctionDefn) o).body)
          && returnType.equals(((FunctionDefn) o).returnType);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      w.append("def ").append(name).append("(").appendAll(args, ", ")
          .append(") -> ").append(returnType).append(":").newline();
      return w.indent().appendAll(body, "").outdent().newline();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public FunctionDefn accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Module, the top-level unit of compilation. */
  public static class Module extends Node {
    public final ImmutableList<FunctionDefn> functionDefns;
    public final ImmutableList<Assert> assertions;
    public final ImmutableList<CustomType> customTypes;
    public final ImmutableSortedSet<String> publicNames;
    public final ImmutableList<PassStmt> passStmts;

    Module(ImmutableList<FunctionDefn> functionDefns,
        ImmutableList<Assert> assertions,
        ImmutableList<CustomType> customTypes,
        ImmutableSortedSet<String> publicNames,
        ImmutableList<PassStmt> passStmts) {
      super(Op.MODULE);
      this.functionDefns = requireNonNull(functionDefns);
      this.assertions = requireNonNull(assertions);
      this.customTypes = requireNonNull(customTypes);
      this.publicNames = requireNonNull(publicNames);
      this.passStmts = requireNonNull(passStmts);
    }

    public Module copy(List<FunctionDefn> functionDefns,
        List<Assert> assertions, List<PassStmt> passStmts) {
      return sameElements(functionDefns, this.functionDefns)
          && sameElements(assertions, this.assertions)
          && sameElements(passStmts, this.passStmts) ? this
          : irB.module(functionDefns, assertions, customTypes, publicNames,
              passStmts);
    }

    /** Returns the function with a given name, or null. */
    public @Nullable FunctionDefn functionDefn(String name) {
      for (FunctionDefn functionDefn : functionDefns) {
        if (functionDefn.name.equals(name)) {
          return functionDefn;
        }
      }
      return null;
    }

    @Override public int hashCode() {
      return Objects.hash(functionDefns, assertions, customTypes, publicNames,
          passStmts);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Module
          && functionDefns.equals(((Module) o).functionDefns)
          && assertions.equals(((Module) o).assertions)
          && customTypes.equals(((Module) o).customTypes)
          && publicNames.equals(((Module) o).publicNames)
          && passStmts.equals(((Module) o).passStmts);
    }

    @Override protected IrWriter unparse(IrWriter w) {
      customTypes.forEach(customType -> customType.unparseDefn(w));
      return w.appendAll(functionDefns, "").appendAll(assertions, "")
          .appendAll(passStmts, "");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Module accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }
}

// End IrB.java
