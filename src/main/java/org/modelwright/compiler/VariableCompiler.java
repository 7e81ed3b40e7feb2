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

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.modelwright.Model;
import org.modelwright.algebra.Algebra;
import org.modelwright.algebra.VariableRef;
import org.modelwright.compiler.ModelSpecParser.AnonymousRefContext;
import org.modelwright.compiler.ModelSpecParser.BoundedVariableContext;
import org.modelwright.compiler.ModelSpecParser.NamedRefContext;
import org.modelwright.compiler.ModelSpecParser.PlainVariableContext;
import org.modelwright.compiler.ModelSpecParser.RangedVariableContext;
import org.modelwright.compiler.ModelSpecParser.RefContext;
import org.modelwright.compiler.ModelSpecParser.ReversedVariableContext;
import org.modelwright.compiler.ModelSpecParser.VarDeclContext;
import org.modelwright.entity.Constraint;
import org.modelwright.entity.ScalarVariable;
import org.modelwright.sets.PsdCone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a variable statement.
 *
 * <p>Bounds may be given by comparisons in the declaration ({@code x >= 0}, {@code 0 <= x[i] <=
 * u[i]}, {@code x == 1}) or by the {@code lowerbound}, {@code upperbound} and {@code start}
 * options; each is evaluated separately for every element. The {@code Bin} and {@code Int} flags
 * (or the {@code binary} and {@code integer} options) restrict the domain, {@code Symmetric}
 * builds a square matrix whose elements above and below the diagonal are the same variables, and
 * {@code PSD} additionally constrains that matrix to be positive semidefinite.
 */
final class VariableCompiler {
  private static final Logger logger = LoggerFactory.getLogger(VariableCompiler.class);

  private final Symbols symbols;
  private final ErrorContext errorContext;
  private final StatementCompiler statements;

  private @Nullable Syntax lowerBound;
  private @Nullable Syntax upperBound;
  private @Nullable Syntax fixedValue;
  private @Nullable Syntax start;
  private @Nullable Syntax binary;
  private @Nullable Syntax integer;
  private @Nullable Syntax basename;
  private boolean binaryFlag;
  private boolean integerFlag;
  private boolean symmetric;
  private boolean psd;
  private ContainerKind kind = ContainerKind.AUTO;

  VariableCompiler(Symbols symbols, ErrorContext errorContext, StatementCompiler statements) {
    this.symbols = symbols;
    this.errorContext = errorContext;
    this.statements = statements;
  }

  Object compile(VarDeclContext decl, List<StatementOption> options) {
    RefContext ref = declaredRef(decl);
    if (ref instanceof NamedRefContext named && named.indexList() == null) {
      String name = named.ID().getText();
      if (name.equals("Int") || name.equals("Bin") || name.equals("PSD")) {
        throw errorContext.specificationError(
            "Ambiguous variable name %s detected. Use the \"integer\" or \"binary\" options, or"
                + " give the variable a different name.",
            name);
      }
    }
    if (ref instanceof AnonymousRefContext && !(decl instanceof PlainVariableContext)) {
      throw errorContext.specificationError(
          "Cannot use explicit bounds via >=, <= with an anonymous variable");
    }
    options.forEach(this::addOption);
    if (binaryFlag && binary != null) {
      throw errorContext.specificationError(
          "'Bin' and 'binary' keyword argument cannot both be specified.");
    } else if (integerFlag && integer != null) {
      throw errorContext.specificationError(
          "'Int' and 'integer' keyword argument cannot both be specified.");
    }

    ContainerSpec spec = statements.containerSpec(ref, VariableRef.class, kind);
    boolean indexed = StatementCompiler.isIndexed(ref);
    if (psd && !indexed) {
      throw errorContext.specificationError("Cannot add a semidefinite scalar variable");
    }
    if (spec.name != null) {
      symbols.checkUndeclared(spec.name, errorContext);
    }
    String base = baseName(spec);
    ContainerPlan plan = ContainerSynthesizer.synthesize(spec, errorContext);
    LoopBuilder loopBuilder = new LoopBuilder(symbols.parser, errorContext);
    LoopBuilder.ElementBuilder<Object> elementBuilder = elementBuilder(base);
    LoopBuilder.PopulationProcedure procedure;
    if (symmetric && indexed) {
      procedure = loopBuilder.buildSymmetric(plan, elementBuilder);
      if (lowerBound != null || upperBound != null) {
        throw errorContext.specificationError(
            "Semidefinite or symmetric variables cannot be provided bounds");
      }
    } else {
      procedure = loopBuilder.build(plan, elementBuilder);
    }
    Object result = procedure.populate(symbols.root);
    if (psd) {
      Constraint constraint = symbols.dispatch.build(errorContext, result, PsdCone.INSTANCE);
      symbols.model.addConstraint(constraint, "");
    }
    logger.debug("{} added {}", errorContext, plan.isScalar() ? "a variable" : plan.kind);
    if (spec.name != null) {
      symbols.declare(spec.name, result, true, errorContext);
    }
    return result;
  }

  /** Records the bounds given by the declaration and returns its ref. */
  private RefContext declaredRef(VarDeclContext decl) {
    if (decl instanceof PlainVariableContext plain) {
      return plain.ref();
    } else if (decl instanceof BoundedVariableContext bounded) {
      Syntax value = statements.syntax(bounded.arith());
      RelOp op = SyntaxBuilder.relOp(bounded.relOp());
      switch (op) {
        case LE -> setUpperBound(value);
        case GE -> setLowerBound(value);
        case EQ -> setFixedValue(value);
        default -> throw errorContext.specificationError("Unknown sense %s.", op);
      }
      return bounded.ref();
    } else if (decl instanceof RangedVariableContext ranged) {
      RelOp leftOp = SyntaxBuilder.relOp(ranged.relOp(0));
      RelOp rightOp = SyntaxBuilder.relOp(ranged.relOp(1));
      Syntax left = statements.syntax(ranged.arith(0));
      Syntax right = statements.syntax(ranged.arith(1));
      if (leftOp == RelOp.LE && rightOp == RelOp.LE) {
        setLowerBound(left);
        setUpperBound(right);
      } else if (leftOp == RelOp.GE && rightOp == RelOp.GE) {
        setLowerBound(right);
        setUpperBound(left);
      } else {
        throw errorContext.specificationError("Use the form lb <= ... <= ub.");
      }
      return ranged.ref();
    }
    ReversedVariableContext reversed = (ReversedVariableContext) decl;
    RelOp op = SyntaxBuilder.relOp(reversed.relOp());
    RelOp flipped =
        switch (op) {
          case LE -> RelOp.GE;
          case GE -> RelOp.LE;
          case EQ -> RelOp.EQ;
          default -> throw errorContext.specificationError("Unknown sense %s.", op);
        };
    String value = Compiler.sourceText(reversed.arith());
    String var = Compiler.sourceText(reversed.ref());
    throw errorContext.specificationError(
        "Variable declaration of the form `%s %s %s` is not supported. Use `%s %s %s` instead.",
        value, op, var, var, flipped, value);
  }

  private void addOption(StatementOption option) {
    if (option.isFlag()) {
      switch (option.name) {
        case "Bin" -> binaryFlag = true;
        case "Int" -> integerFlag = true;
        case "Symmetric" -> symmetric = true;
        case "PSD" -> {
          psd = true;
          symmetric = true;
        }
        default -> throw errorContext.specificationError("Unrecognized option %s", option.name);
      }
      return;
    }
    Syntax value = option.value;
    switch (option.name) {
      case "lowerbound" -> setLowerBound(value);
      case "upperbound" -> setUpperBound(value);
      case "start" -> {
        checkUnset(start, "start value");
        start = value;
      }
      case "binary" -> binary = value;
      case "integer" -> integer = value;
      case "basename" -> basename = value;
      case "container" -> kind =
          ContainerKind.fromKeyword(
              (value instanceof Syntax.Name name) ? name.name : String.valueOf(value),
              errorContext);
      default -> throw errorContext.specificationError(
          "Unrecognized keyword argument %s", option.name);
    }
  }

  private void setLowerBound(Syntax value) {
    checkUnset(lowerBound, "lowerbound");
    lowerBound = value;
  }

  private void setUpperBound(Syntax value) {
    checkUnset(upperBound, "upperbound");
    upperBound = value;
  }

  private void setFixedValue(Syntax value) {
    checkUnset(fixedValue, "fixed value");
    fixedValue = value;
  }

  private void checkUnset(@Nullable Syntax prev, String what) {
    if (prev != null) {
      throw errorContext.specificationError("Cannot specify variable %s twice", what);
    }
  }

  /** Returns the prefix used to name each variable, which defaults to the container's name. */
  private String baseName(ContainerSpec spec) {
    if (basename == null) {
      return (spec.name == null) ? "" : spec.name;
    }
    Object value = statements.evaluate(basename, errorContext);
    if (value instanceof String s) {
      return s;
    }
    throw errorContext.specificationError(
        "Expected basename to be a string, got %s", Algebra.describe(value));
  }

  private LoopBuilder.ElementBuilder<Object> elementBuilder(String base) {
    Model.ParsedExpression lb = parse(lowerBound);
    Model.ParsedExpression ub = parse(upperBound);
    Model.ParsedExpression fix = parse(fixedValue);
    Model.ParsedExpression startValue = parse(start);
    Model.ParsedExpression isBinary = parse(binary);
    Model.ParsedExpression isInteger = parse(integer);
    return (scope, key) -> {
      ScalarVariable.Builder builder = ScalarVariable.builder();
      if (lb != null) {
        builder.setLowerBound(number(lb.build(scope), lowerBound));
      }
      if (ub != null) {
        builder.setUpperBound(number(ub.build(scope), upperBound));
      }
      if (fix != null) {
        builder.setFixedValue(number(fix.build(scope), fixedValue));
      }
      if (startValue != null) {
        builder.setStart(number(startValue.build(scope), start));
      }
      if (binaryFlag || (isBinary != null && bool(isBinary.build(scope), binary))) {
        builder.setBinary();
      }
      if (integerFlag || (isInteger != null && bool(isInteger.build(scope), integer))) {
        builder.setInteger();
      }
      return symbols.model.addVariable(builder.build(), key.elementName(base));
    };
  }

  private Model.@Nullable ParsedExpression parse(@Nullable Syntax syntax) {
    return (syntax == null) ? null : symbols.parser.parse(syntax, errorContext);
  }

  private double number(Object value, Syntax syntax) {
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    throw errorContext.specificationError(
        "Expected %s to be a number, got %s", syntax, Algebra.describe(value));
  }

  private boolean bool(Object value, Syntax syntax) {
    if (value instanceof Boolean b) {
      return b;
    }
    throw errorContext.specificationError(
        "Expected %s to be true or false, got %s", syntax, Algebra.describe(value));
  }
}
