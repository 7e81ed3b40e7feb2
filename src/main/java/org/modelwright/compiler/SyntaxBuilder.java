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
import org.antlr.v4.runtime.ParserRuleContext;
import org.modelwright.compiler.ModelSpecParser.AdditiveContext;
import org.modelwright.compiler.ModelSpecParser.AndConditionContext;
import org.modelwright.compiler.ModelSpecParser.ArithContext;
import org.modelwright.compiler.ModelSpecParser.BooleanLiteralContext;
import org.modelwright.compiler.ModelSpecParser.CompareConditionContext;
import org.modelwright.compiler.ModelSpecParser.FunctionCallContext;
import org.modelwright.compiler.ModelSpecParser.GeneratorContext;
import org.modelwright.compiler.ModelSpecParser.IdentifierContext;
import org.modelwright.compiler.ModelSpecParser.IndexRefContext;
import org.modelwright.compiler.ModelSpecParser.ListLiteralContext;
import org.modelwright.compiler.ModelSpecParser.MultiplicativeContext;
import org.modelwright.compiler.ModelSpecParser.NegateContext;
import org.modelwright.compiler.ModelSpecParser.NotConditionContext;
import org.modelwright.compiler.ModelSpecParser.NumberLiteralContext;
import org.modelwright.compiler.ModelSpecParser.OrConditionContext;
import org.modelwright.compiler.ModelSpecParser.ParenConditionContext;
import org.modelwright.compiler.ModelSpecParser.PowerContext;
import org.modelwright.compiler.ModelSpecParser.RangeContext;
import org.modelwright.compiler.ModelSpecParser.RelOpContext;
import org.modelwright.compiler.ModelSpecParser.StringLiteralContext;
import org.modelwright.compiler.ModelSpecParser.SumGeneratorContext;
import org.modelwright.compiler.ModelSpecParser.ValueConditionContext;
import org.modelwright.compiler.Syntax.Binary;
import org.modelwright.compiler.Syntax.BinaryOp;
import org.modelwright.compiler.Syntax.Unary;
import org.modelwright.compiler.Syntax.UnaryOp;

/** A visitor that converts {@code arith} and {@code condition} parse trees to {@link Syntax}. */
class SyntaxBuilder extends VisitorBase<Syntax> {

  /** Converts a list of parse trees. */
  ImmutableList<Syntax> visitAll(List<? extends ParserRuleContext> nodes) {
    ImmutableList.Builder<Syntax> builder = ImmutableList.builder();
    nodes.forEach(node -> builder.add(visit(node)));
    return builder.build();
  }

  /** Returns the RelOp for a {@code relOp} node. */
  static RelOp relOp(RelOpContext ctx) {
    int type = ctx.start.getType();
    if (type == ModelSpecParser.LE) {
      return RelOp.LE;
    } else if (type == ModelSpecParser.GE) {
      return RelOp.GE;
    } else if (type == ModelSpecParser.EQ) {
      return RelOp.EQ;
    } else if (type == ModelSpecParser.NE) {
      return RelOp.NE;
    } else if (type == ModelSpecParser.LT) {
      return RelOp.LT;
    } else if (type == ModelSpecParser.GT) {
      return RelOp.GT;
    } else if (type == ModelSpecParser.DOT_LE) {
      return RelOp.DOT_LE;
    } else if (type == ModelSpecParser.DOT_GE) {
      return RelOp.DOT_GE;
    } else if (type == ModelSpecParser.DOT_EQ) {
      return RelOp.DOT_EQ;
    } else if (type == ModelSpecParser.SUCC_EQ) {
      return RelOp.SUCC_EQ;
    } else if (type == ModelSpecParser.PREC_EQ) {
      return RelOp.PREC_EQ;
    }
    throw new AssertionError(ctx.getText());
  }

  @Override
  public Syntax visitNumberLiteral(NumberLiteralContext ctx) {
    String text = ctx.NUMBER().getText();
    if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
      try {
        return new Syntax.Num(Integer.parseInt(text));
      } catch (NumberFormatException e) {
        throw error("Integer literal %s is too large", text);
      }
    }
    return new Syntax.Num(Double.parseDouble(text));
  }

  @Override
  public Syntax visitStringLiteral(StringLiteralContext ctx) {
    return new Syntax.Str(unescape(ctx.STRING().getText()));
  }

  /** Removes the quotes surrounding a STRING token, and resolves any escapes. */
  static String unescape(String s) {
    assert s.length() >= 2 && s.charAt(0) == '"' && s.charAt(s.length() - 1) == '"';
    StringBuilder sb = new StringBuilder(s.length() - 2);
    for (int i = 1; i < s.length() - 1; i++) {
      char c = s.charAt(i);
      if (c == '\\') {
        c = s.charAt(++i);
        switch (c) {
          case 'n' -> sb.append('\n');
          case 't' -> sb.append('\t');
          case 'r' -> sb.append('\r');
          default -> sb.append(c);
        }
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  @Override
  public Syntax visitBooleanLiteral(BooleanLiteralContext ctx) {
    return new Syntax.Bool(ctx.value.getType() == ModelSpecParser.TRUE);
  }

  @Override
  public Syntax visitSumGenerator(SumGeneratorContext ctx) {
    ImmutableList.Builder<Syntax.Generator> generators = ImmutableList.builder();
    for (GeneratorContext g : ctx.generator()) {
      generators.add(new Syntax.Generator(g.ID().getText(), visit(g.arith())));
    }
    Syntax condition = (ctx.condition() == null) ? null : visit(ctx.condition());
    return new Syntax.Sum(visit(ctx.arith()), generators.build(), condition);
  }

  @Override
  public Syntax visitIndexRef(IndexRefContext ctx) {
    return new Syntax.Index(ctx.ID().getText(), visitAll(ctx.arith()));
  }

  @Override
  public Syntax visitFunctionCall(FunctionCallContext ctx) {
    return new Syntax.Call(ctx.ID().getText(), visitAll(ctx.arith()));
  }

  @Override
  public Syntax visitIdentifier(IdentifierContext ctx) {
    return new Syntax.Name(ctx.ID().getText());
  }

  @Override
  public Syntax visitListLiteral(ListLiteralContext ctx) {
    return new Syntax.ListOf(visitAll(ctx.arith()));
  }

  @Override
  public Syntax visitPower(PowerContext ctx) {
    return binary(BinaryOp.POW, ctx.arith(0), ctx.arith(1));
  }

  @Override
  public Syntax visitNegate(NegateContext ctx) {
    Syntax operand = visit(ctx.arith());
    if (operand instanceof Syntax.Num num) {
      // Fold negative literals, so that e.g. "-1" is a Num.
      Number value = num.value;
      return new Syntax.Num(
          (value instanceof Integer i) ? (Number) (-i) : (Number) (-value.doubleValue()));
    }
    return new Unary(UnaryOp.NEG, operand);
  }

  @Override
  public Syntax visitMultiplicative(MultiplicativeContext ctx) {
    BinaryOp op = (ctx.op.getType() == ModelSpecParser.STAR) ? BinaryOp.MUL : BinaryOp.DIV;
    return binary(op, ctx.arith(0), ctx.arith(1));
  }

  @Override
  public Syntax visitAdditive(AdditiveContext ctx) {
    BinaryOp op = (ctx.op.getType() == ModelSpecParser.PLUS) ? BinaryOp.ADD : BinaryOp.SUB;
    return binary(op, ctx.arith(0), ctx.arith(1));
  }

  @Override
  public Syntax visitRange(RangeContext ctx) {
    return binary(BinaryOp.RANGE, ctx.arith(0), ctx.arith(1));
  }

  private Syntax binary(BinaryOp op, ArithContext left, ArithContext right) {
    return new Binary(op, visit(left), visit(right));
  }

  @Override
  public Syntax visitNotCondition(NotConditionContext ctx) {
    return new Unary(UnaryOp.NOT, visit(ctx.condition()));
  }

  @Override
  public Syntax visitAndCondition(AndConditionContext ctx) {
    return new Binary(BinaryOp.AND, visit(ctx.condition(0)), visit(ctx.condition(1)));
  }

  @Override
  public Syntax visitOrCondition(OrConditionContext ctx) {
    return new Binary(BinaryOp.OR, visit(ctx.condition(0)), visit(ctx.condition(1)));
  }

  @Override
  public Syntax visitParenCondition(ParenConditionContext ctx) {
    return visit(ctx.condition());
  }

  @Override
  public Syntax visitCompareCondition(CompareConditionContext ctx) {
    RelOp relOp = relOp(ctx.relOp());
    BinaryOp op =
        switch (relOp) {
          case LE -> BinaryOp.LE;
          case GE -> BinaryOp.GE;
          case EQ -> BinaryOp.EQ;
          case NE -> BinaryOp.NE;
          case LT -> BinaryOp.LT;
          case GT -> BinaryOp.GT;
          default -> throw error("Operator %s is not allowed in a condition", relOp);
        };
    return binary(op, ctx.arith(0), ctx.arith(1));
  }

  @Override
  public Syntax visitValueCondition(ValueConditionContext ctx) {
    return visit(ctx.arith());
  }
}
