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
package net.hydromatic.templar.ast;

/** Kinds of node in the intermediate representations, and the operators
 * used by some of them.
 *
 * <p>Most kinds occur in both IR-A and IR-B; the remainder are marked. */
public enum Op {
  // expressions
  VAR_REF,
  MATCH,
  MATCH_CASE,
  BOOL_LITERAL,
  INT_LITERAL,
  ATOMIC_TYPE_LITERAL,
  POINTER_TYPE,
  REFERENCE_TYPE,
  RVALUE_REFERENCE_TYPE,
  CONST_TYPE,
  ARRAY_TYPE,
  FUNCTION_TYPE,
  TEMPLATE_INSTANTIATION,
  TEMPLATE_MEMBER_ACCESS,
  LIST,
  FUNCTION_CALL,
  EQUAL,
  ATTRIBUTE_ACCESS,
  NOT,
  UNARY_MINUS,
  INT_LIST_SUM,
  BOOL_LIST_ALL,
  BOOL_LIST_ANY,
  INT_COMPARISON,
  INT_BINARY_OP,
  LIST_CONCAT,
  LIST_COMPREHENSION,

  // IR-A expressions
  PARAMETER_PACK_EXPANSION,
  ADD_TO_SET,
  SET_TO_LIST,
  LIST_TO_SET,
  SET_EQUAL,
  IS_IN_LIST,
  IS_INSTANCE,
  SAFE_UNCHECKED_CAST,

  // IR-B expressions
  SET,
  INT_SET_SUM,
  BOOL_SET_ALL,
  BOOL_SET_ANY,
  IN,
  AND,
  OR,
  SET_COMPREHENSION,

  // IR-A patterns
  VAR_REF_PAT,
  ATOMIC_TYPE_LITERAL_PAT,
  POINTER_TYPE_PAT,
  REFERENCE_TYPE_PAT,
  RVALUE_REFERENCE_TYPE_PAT,
  CONST_TYPE_PAT,
  ARRAY_TYPE_PAT,
  FUNCTION_TYPE_PAT,
  TEMPLATE_INSTANTIATION_PAT,
  LIST_PAT,

  // statements
  PASS,
  ASSERT,
  ASSIGNMENT,
  UNPACKING_ASSIGNMENT,
  RETURN,
  IF,
  CHECK_IF_ERROR,
  RAISE,
  TRY_EXCEPT,

  // declarations
  ARG_DECL,
  FUNCTION_DEFN,
  CUSTOM_TYPE_DEFN,
  CHECK_IF_ERROR_DEFN,
  MODULE,

  // integer operators
  LT("<"),
  GT(">"),
  LE("<="),
  GE(">="),
  PLUS("+"),
  MINUS("-"),
  TIMES("*"),
  DIVIDE("//"),
  MOD("%");

  /** Operator symbol, e.g. "<="; null if this is not an operator. */
  public final String opName;

  Op() {
    this(null);
  }

  Op(String opName) {
    this.opName = opName;
  }

  /** Returns whether this is an integer comparison operator. */
  public boolean isComparison() {
    return this == LT || this == GT || this == LE || this == GE;
  }

  /** Returns whether this is an integer arithmetic operator. */
  public boolean isArithmetic() {
    return this == PLUS || this == MINUS || this == TIMES || this == DIVIDE
        || this == MOD;
  }
}

// End Op.java
