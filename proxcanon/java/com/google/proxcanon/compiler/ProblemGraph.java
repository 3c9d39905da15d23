// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.proxcanon.compiler;

import com.google.proxcanon.expression.Expression;
import com.google.proxcanon.expression.ExpressionUtil;
import com.google.proxcanon.expression.Expressions;
import com.google.proxcanon.expression.LinearMapProperties;
import com.google.proxcanon.expression.LinearMaps;
import com.google.proxcanon.expression.Problem;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bipartite incidence graph between functions and the variables they reference.
 *
 * <p>The graph keeps two indices of its edges, by variable and by function, plus the set of
 * objective terms. Every mutating method updates all of them before returning, and a variable
 * without edges is dropped. Iteration follows insertion order, which the transforms rely on to
 * produce the same output for the same input.
 *
 * <p>A graph is owned by one compilation and is not thread-safe.
 */
public final class ProblemGraph {
  private final Map<Function, List<FunctionVariable>> edgesByFunction;
  private final Map<String, List<FunctionVariable>> edgesByVariable;
  private final Set<Function> objTerms;
  // ADD objective the graph was built from, null otherwise.
  private Expression objective;

  /** Creates an empty graph. */
  public ProblemGraph() {
    edgesByFunction = new LinkedHashMap<>();
    edgesByVariable = new LinkedHashMap<>();
    objTerms = new LinkedHashSet<>();
  }

  /**
   * Builds the graph of {@code problem}.
   *
   * <p>Each summand of an ADD objective becomes an objective term, any other objective is a single
   * term. Each constraint becomes a constraint function.
   */
  public static ProblemGraph fromProblem(Problem problem) {
    ProblemGraph graph = new ProblemGraph();
    Expression objective = problem.getObjective();
    if (objective.getExpressionType() == Expression.Type.ADD) {
      graph.objective = objective;
      for (Expression term : objective.getArgList()) {
        graph.addFunction(new Function(term, /* constraint= */ false));
      }
    } else if (objective.getExpressionType() != Expression.Type.UNKNOWN) {
      graph.addFunction(new Function(objective, /* constraint= */ false));
    }
    for (Expression constraint : problem.getConstraintList()) {
      graph.addFunction(new Function(constraint, /* constraint= */ true));
    }
    return graph;
  }

  /**
   * Returns the problem formed by the sum of the objective terms and the constraints.
   *
   * <p>When the graph was built from an ADD objective, that node is returned as is if its terms
   * are unchanged. Otherwise it keeps its own attributes with the new terms as arguments.
   */
  public Problem toProblem() {
    Problem.Builder problem = Problem.newBuilder();
    List<Expression> terms = new ArrayList<>();
    for (Function f : objTerms) {
      terms.add(f.getExpression());
    }
    if (terms.size() == 1) {
      problem.setObjective(terms.get(0));
    } else if (!terms.isEmpty()) {
      problem.setObjective(sum(terms));
    }
    for (Function f : edgesByFunction.keySet()) {
      if (f.isConstraint()) {
        problem.addConstraint(f.getExpression());
      }
    }
    return problem.build();
  }

  // Mutations.

  /** Adds {@code f} with one edge per variable found in its expression. */
  public void addFunction(Function f) {
    if (edgesByFunction.containsKey(f)) {
      throw new IllegalArgumentException("function already in graph: " + f);
    }
    List<FunctionVariable> edges = deriveEdges(f);
    edgesByFunction.put(f, new ArrayList<>());
    if (!f.isConstraint()) {
      objTerms.add(f);
    }
    for (FunctionVariable edge : edges) {
      insertEdge(edge);
    }
  }

  /** Removes {@code f} and all of its edges. */
  public void removeFunction(Function f) {
    List<FunctionVariable> edges = edgesByFunction.remove(f);
    if (edges == null) {
      throw new IllegalArgumentException("function not in graph: " + f);
    }
    objTerms.remove(f);
    for (FunctionVariable edge : edges) {
      detachFromVariable(edge);
    }
  }

  /** Adds an edge between a function of the graph and a variable. */
  public void addEdge(FunctionVariable edge) {
    List<FunctionVariable> functionEdges = edgesByFunction.get(edge.getFunction());
    if (functionEdges == null) {
      throw new IllegalArgumentException("function not in graph: " + edge.getFunction());
    }
    for (FunctionVariable existing : functionEdges) {
      if (existing.getVariable().equals(edge.getVariable())) {
        throw new IllegalArgumentException("duplicate edge: " + edge);
      }
    }
    insertEdge(edge);
  }

  /** Removes {@code edge}, leaving its function in the graph. */
  public void removeEdge(FunctionVariable edge) {
    List<FunctionVariable> functionEdges = edgesByFunction.get(edge.getFunction());
    if (functionEdges == null || !functionEdges.remove(edge)) {
      throw new IllegalArgumentException("edge not in graph: " + edge);
    }
    detachFromVariable(edge);
  }

  /**
   * Substitutes {@code newVariable} for every occurrence of the edge's variable in its function.
   *
   * <p>The function gets a rebuilt expression, and the edge is swapped for one on the new
   * variable. Returns the new edge.
   */
  public FunctionVariable replaceVariable(FunctionVariable edge, Expression newVariable) {
    String newId = ExpressionUtil.variableId(newVariable);
    removeEdge(edge);
    Function f = edge.getFunction();
    f.setExpression(
        ExpressionUtil.replaceVariable(f.getExpression(), edge.getVariable(), newVariable));
    List<VariableInstance> instances = new ArrayList<>();
    for (VariableInstance instance : edge.getInstances()) {
      instances.add(instance.withExpression(newVariable));
    }
    FunctionVariable replaced = new FunctionVariable(f, newId, instances);
    addEdge(replaced);
    return replaced;
  }

  // Queries. Returned collections are snapshots, safe to hold across mutations.

  /** Returns the variable ids in insertion order. */
  public List<String> variables() {
    return new ArrayList<>(edgesByVariable.keySet());
  }

  public boolean hasVariable(String variable) {
    return edgesByVariable.containsKey(variable);
  }

  /** Returns all functions in insertion order. */
  public List<Function> functions() {
    return new ArrayList<>(edgesByFunction.keySet());
  }

  public boolean hasFunction(Function f) {
    return edgesByFunction.containsKey(f);
  }

  /** Returns the objective terms in insertion order. */
  public List<Function> objTerms() {
    return new ArrayList<>(objTerms);
  }

  /** Returns the edges of {@code variable}, empty if it is not in the graph. */
  public List<FunctionVariable> edgesByVariable(String variable) {
    List<FunctionVariable> edges = edgesByVariable.get(variable);
    if (edges == null) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(new ArrayList<>(edges));
  }

  /** Returns the edges of {@code variable} whose function is an objective term. */
  public List<FunctionVariable> objectiveEdgesByVariable(String variable) {
    List<FunctionVariable> edges = new ArrayList<>();
    for (FunctionVariable edge : edgesByVariable(variable)) {
      if (!edge.getFunction().isConstraint()) {
        edges.add(edge);
      }
    }
    return edges;
  }

  /** Returns the edges of {@code f}, empty if it is not in the graph. */
  public List<FunctionVariable> edgesByFunction(Function f) {
    List<FunctionVariable> edges = edgesByFunction.get(f);
    if (edges == null) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(new ArrayList<>(edges));
  }

  // Internal helpers.

  private Expression sum(List<Expression> terms) {
    if (objective != null && objective.getArgList().equals(terms)) {
      return objective;
    }
    Expression sum = Expressions.add(terms);
    if (objective == null) {
      return sum;
    }
    Expression.Builder rebuilt =
        objective.toBuilder().clearArg().addAllArg(terms).setSize(sum.getSize()).clearAffineProps();
    if (sum.hasAffineProps()) {
      rebuilt.setAffineProps(sum.getAffineProps());
    }
    return rebuilt.build();
  }

  private void insertEdge(FunctionVariable edge) {
    edgesByFunction.get(edge.getFunction()).add(edge);
    edgesByVariable.computeIfAbsent(edge.getVariable(), k -> new ArrayList<>()).add(edge);
  }

  private void detachFromVariable(FunctionVariable edge) {
    List<FunctionVariable> variableEdges = edgesByVariable.get(edge.getVariable());
    variableEdges.remove(edge);
    if (variableEdges.isEmpty()) {
      edgesByVariable.remove(edge.getVariable());
    }
  }

  private static List<FunctionVariable> deriveEdges(Function f) {
    Map<String, List<VariableInstance>> instances = new LinkedHashMap<>();
    collectInstances(
        f.getExpression(), /* scalar= */ true, Collections.<String, Boolean>emptyMap(), instances);
    List<FunctionVariable> edges = new ArrayList<>(instances.size());
    for (Map.Entry<String, List<VariableInstance>> entry : instances.entrySet()) {
      edges.add(new FunctionVariable(f, entry.getKey(), entry.getValue()));
    }
    return edges;
  }

  // Pre-order walk, so instances and edges come in the order the leaves appear. The linear maps
  // attached to the outermost node mentioning a variable decide the scalar flag of its
  // occurrences below that node; the operators on the path decide it otherwise.
  private static void collectInstances(
      Expression expr,
      boolean scalar,
      Map<String, Boolean> attached,
      Map<String, List<VariableInstance>> instances) {
    if (expr.getExpressionType() == Expression.Type.VARIABLE) {
      String variable = expr.getVariable().getVariableId();
      Boolean attachedScalar = attached.get(variable);
      instances
          .computeIfAbsent(variable, k -> new ArrayList<>())
          .add(new VariableInstance(expr, attachedScalar != null ? attachedScalar : scalar));
      return;
    }

    Map<String, Boolean> inner = attached;
    for (Map.Entry<String, LinearMapProperties> entry :
        expr.getAffineProps().getLinearMapsMap().entrySet()) {
      if (inner.containsKey(entry.getKey())) {
        continue;
      }
      if (inner == attached) {
        inner = new HashMap<>(attached);
      }
      inner.put(entry.getKey(), scalar && entry.getValue().getScalar());
    }
    for (int i = 0; i < expr.getArgCount(); ++i) {
      collectInstances(
          expr.getArg(i), scalar && LinearMaps.preservesScalar(expr, i), inner, instances);
    }
  }
}
