/*
 * Copyright 2025 The Modelwright Authors
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

package org.modelwright.compiler;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.antlr.v4.runtime.tree.ParseTree;
import org.jspecify.annotations.Nullable;
import org.modelwright.Model;
import org.modelwright.algebra.AffExpr;
import org.modelwright.algebra.Algebra;
import org.modelwright.compiler.ModelSpecParser.AnonymousRefContext;
import org.modelwright.compiler.ModelSpecParser.ComparisonConstraintContext;
import org.modelwright.compiler.ModelSpecParser.ConstraintExprContext;
import org.modelwright.compiler.ModelSpecParser.ConstraintStatementContext;
import org.modelwright.compiler.ModelSpecParser.ExpressionStatementContext;
import org.modelwright.compiler.ModelSpecParser.IncompleteConstraintContext;
import org.modelwright.compiler.ModelSpecParser.IndexListContext;
import org.modelwright.compiler.ModelSpecParser.IndexSpecContext;
import org.modelwright.compiler.ModelSpecParser.MembershipConstraintContext;
import org.modelwright.compiler.ModelSpecParser.NamedRefContext;
import org.modelwright.compiler.ModelSpecParser.ObjectiveStatementContext;
import org.modelwright.compiler.ModelSpecParser.ParamStatementContext;
import org.modelwright.compiler.ModelSpecParser.RangedConstraintContext;
import org.modelwright.compiler.ModelSpecParser.RefContext;
import org.modelwright.compiler.ModelSpecParser.SdConstraintStatementContext;
import org.modelwright.compiler.ModelSpecParser.StatementOptionContext;
import org.modelwright.compiler.ModelSpecParser.VariableStatementContext;

/**
 * A visitor that compiles each statement and returns its result: the declared container or handle
 * for variable, constraint and expression statements, the value of a param statement, or the
 * objective function.
 */
class StatementCompiler extends VisitorBase<Object> {
  private final Symbols symbols;
  private final SyntaxBuilder syntaxBuilder = new SyntaxBuilder();

  StatementCompiler(Symbols symbols) {
    this.symbols = symbols;
  }

  @Override
  public Object visitVariableStatement(VariableStatementContext ctx) {
    ErrorContext errorContext = Compiler.errorContext(ctx);
    return new VariableCompiler(symbols, errorContext, this)
        .compile(ctx.varDecl(), options(ctx.statementOption()));
  }

  @Override
  public Object visitConstraintStatement(ConstraintStatementContext ctx) {
    ErrorContext errorContext = Compiler.errorContext(ctx);
    RelationalSpec relation = relationalSpec(ctx.constraintExpr(), errorContext);
    List<StatementOption> options = options(ctx.statementOption());
    ContainerKind kind = containerKind(options, errorContext);
    RelationalForm form = RelationalCanonicalizer.canonicalize(relation, errorContext);
    ContainerSpec spec = containerSpec(ctx.ref(), ConstraintCompiler.elementType(form), kind);
    return new ConstraintCompiler(symbols, errorContext).compile(spec, form);
  }

  @Override
  public Object visitSdConstraintStatement(SdConstraintStatementContext ctx) {
    ErrorContext errorContext = Compiler.errorContext(ctx);
    RelationalSpec relation = relationalSpec(ctx.constraintExpr(), errorContext);
    RelationalForm form = RelationalCanonicalizer.canonicalizeSemidefinite(relation, errorContext);
    ContainerSpec spec =
        containerSpec(ctx.ref(), ConstraintCompiler.elementType(form), ContainerKind.AUTO);
    return new ConstraintCompiler(symbols, errorContext).compile(spec, form);
  }

  @Override
  public Object visitExpressionStatement(ExpressionStatementContext ctx) {
    ErrorContext errorContext = Compiler.errorContext(ctx);
    List<StatementOption> options = options(ctx.statementOption());
    ContainerKind kind = containerKind(options, errorContext);
    boolean indexed = isIndexed(ctx.ref());
    // Indexed expressions are stored as AffExprs; a single expression keeps its value.
    ContainerSpec spec = containerSpec(ctx.ref(), indexed ? AffExpr.class : Object.class, kind);
    return new ExpressionCompiler(symbols, errorContext)
        .compile(spec, indexed, syntaxBuilder.visit(ctx.arith()));
  }

  @Override
  public Object visitParamStatement(ParamStatementContext ctx) {
    ErrorContext errorContext = Compiler.errorContext(ctx);
    String name = ctx.ID().getText();
    symbols.checkUndeclared(name, errorContext);
    Object value = evaluate(syntaxBuilder.visit(ctx.arith()), errorContext);
    symbols.declare(name, value, false, errorContext);
    return value;
  }

  @Override
  public Object visitObjectiveStatement(ObjectiveStatementContext ctx) {
    ErrorContext errorContext = Compiler.errorContext(ctx);
    Syntax syntax = syntaxBuilder.visit(ctx.arith());
    Object function = evaluate(syntax, errorContext);
    if (!Algebra.isScalar(function)) {
      throw errorContext.specificationError(
          "Objective %s must be a scalar function, got %s", syntax, Algebra.describe(function));
    }
    Model.ObjectiveSense sense =
        (ctx.sense.getType() == ModelSpecParser.MINIMIZE)
            ? Model.ObjectiveSense.MIN
            : Model.ObjectiveSense.MAX;
    symbols.model.setObjective(sense, function);
    return function;
  }

  /** Converts an expression to Syntax. */
  Syntax syntax(ParseTree tree) {
    return syntaxBuilder.visit(tree);
  }

  /** Evaluates an expression once, in the top-level Scope. */
  Object evaluate(Syntax syntax, ErrorContext errorContext) {
    return symbols.parser.parse(syntax, errorContext).build(symbols.root);
  }

  /** Returns true if {@code ref} is followed by a bracketed index list. */
  static boolean isIndexed(@Nullable RefContext ref) {
    return ref instanceof AnonymousRefContext
        || (ref instanceof NamedRefContext named && named.indexList() != null);
  }

  /**
   * Returns a ContainerSpec for the given ref. Index positions without a name are given a
   * synthetic one; a null ref is an anonymous scalar.
   */
  ContainerSpec containerSpec(@Nullable RefContext ref, Class<?> elementType, ContainerKind kind) {
    String name = null;
    IndexListContext indexList = null;
    if (ref instanceof NamedRefContext named) {
      name = named.ID().getText();
      indexList = named.indexList();
    } else if (ref instanceof AnonymousRefContext anonymous) {
      indexList = anonymous.indexList();
    }
    if (indexList == null) {
      return ContainerSpec.scalar(name, elementType).withRequestedKind(kind);
    }
    ImmutableList.Builder<IndexSpec> indexSpecs = ImmutableList.builder();
    List<IndexSpecContext> specs = indexList.indexSpec();
    for (int i = 0; i < specs.size(); i++) {
      IndexSpecContext spec = specs.get(i);
      String indexName =
          (spec.ID() != null) ? spec.ID().getText() : IndexSpec.syntheticName(i + 1);
      indexSpecs.add(new IndexSpec(indexName, syntaxBuilder.visit(spec.arith())));
    }
    Syntax filter =
        (indexList.condition() == null) ? null : syntaxBuilder.visit(indexList.condition());
    return new ContainerSpec(name, indexSpecs.build(), filter, elementType, kind);
  }

  /** Converts the options of a statement. */
  List<StatementOption> options(List<StatementOptionContext> options) {
    ImmutableList.Builder<StatementOption> result = ImmutableList.builder();
    for (StatementOptionContext option : options) {
      Syntax value = (option.arith() == null) ? null : syntaxBuilder.visit(option.arith());
      result.add(new StatementOption(option.ID().getText(), value));
    }
    return result.build();
  }

  /**
   * Returns the container kind requested by the {@code container} option, or {@link
   * ContainerKind#AUTO} if there is none. Any other option is rejected unless it is one of {@code
   * allowed}.
   */
  static ContainerKind containerKind(
      List<StatementOption> options, ErrorContext errorContext, String... allowed) {
    ContainerKind result = ContainerKind.AUTO;
    for (StatementOption option : options) {
      if (option.name.equals("container")) {
        if (option.value instanceof Syntax.Name kind) {
          result = ContainerKind.fromKeyword(kind.name, errorContext);
        } else {
          result = ContainerKind.fromKeyword(String.valueOf(option.value), errorContext);
        }
      } else if (!List.of(allowed).contains(option.name)) {
        throw option.isFlag()
            ? errorContext.specificationError("Unrecognized option %s", option.name)
            : errorContext.specificationError("Unrecognized keyword argument %s", option.name);
      }
    }
    return result;
  }

  /** Converts the relation of a constraint statement. */
  RelationalSpec relationalSpec(ConstraintExprContext ctx, ErrorContext errorContext) {
    if (ctx instanceof ComparisonConstraintContext comparison) {
      return new RelationalSpec.Comparison(
          syntaxBuilder.visit(comparison.arith(0)),
          SyntaxBuilder.relOp(comparison.relOp()),
          syntaxBuilder.visit(comparison.arith(1)));
    } else if (ctx instanceof RangedConstraintContext ranged) {
      return new RelationalSpec.Ranged(
          syntaxBuilder.visit(ranged.arith(0)),
          SyntaxBuilder.relOp(ranged.relOp(0)),
          syntaxBuilder.visit(ranged.arith(1)),
          SyntaxBuilder.relOp(ranged.relOp(1)),
          syntaxBuilder.visit(ranged.arith(2)));
    } else if (ctx instanceof MembershipConstraintContext membership) {
      return new RelationalSpec.Membership(
          syntaxBuilder.visit(membership.arith(0)), syntaxBuilder.visit(membership.arith(1)));
    }
    IncompleteConstraintContext incomplete = (IncompleteConstraintContext) ctx;
    throw errorContext.specificationError(
        "Incomplete constraint specification %s. Are you missing a comparison (<=, >=, or ==)?",
        syntaxBuilder.visit(incomplete.arith()));
  }
}
