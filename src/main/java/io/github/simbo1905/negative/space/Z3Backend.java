// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import com.microsoft.z3.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;
import java.util.regex.Matcher;

import static io.github.simbo1905.negative.space.NegativeSpace.LOGGER;

/// [SmtBackend] on the Z3 Java bindings.
///
/// All constraints of one solve share one variable per sort so they are conjunctive on the same value:
/// ranges bind an Int, lengths and patterns bind a String, enumerations take the sort of their first value.
public final class Z3Backend implements SmtBackend<BoolExpr> {

  static final String VARIABLE = "v";

  private static final java.util.regex.Pattern INTEGER = java.util.regex.Pattern.compile("-?\\d+");
  private static final java.util.regex.Pattern NEGATED = java.util.regex.Pattern.compile("\\(-\\s+([^()]+)\\)");
  private static final java.util.regex.Pattern RATIONAL = java.util.regex.Pattern.compile("(-?\\d+(?:\\.\\d+)?)/(\\d+(?:\\.\\d+)?)");
  private static final java.util.regex.Pattern DECIMAL = java.util.regex.Pattern.compile("-?\\d+\\.\\d+\\??");
  private static final java.util.regex.Pattern CODE_POINT = java.util.regex.Pattern.compile("\\\\u\\{([0-9a-fA-F]+)}");

  private Context context;
  private SmtOptions defaults = SmtOptions.DEFAULTS;

  /// Whether the native Z3 library can be loaded on this machine.
  public static boolean isNativeAvailable() {
    try (Context context = new Context()) {
      LOGGER.finer(() -> "Z3 native library loaded: " + context);
      return true;
    } catch (UnsatisfiedLinkError | NoClassDefFoundError | ExceptionInInitializerError e) {
      LOGGER.fine(() -> "Z3 native library is not available: " + e);
      return false;
    }
  }

  @Override
  public void init(SmtOptions options) {
    if (context != null) {
      return;
    }
    this.defaults = Objects.requireNonNull(options, "options must not be null");
    final var config = new HashMap<String, String>();
    config.put("model", Boolean.toString(options.produceModels()));
    context = new Context(config);
    LOGGER.fine(() -> "Initialized Z3 " + Version.getFullVersion());
  }

  @Override
  public boolean isInitialized() {
    return context != null;
  }

  @Override
  public SmtTranslation<BoolExpr> translateConstraint(TypeConstraint constraint, String varName) {
    final Context ctx = requireContext();
    if (constraint instanceof TypeConstraint.Range range) {
      final IntExpr x = ctx.mkIntConst(varName);
      final var bounds = new ArrayList<BoolExpr>();
      if (Double.isFinite(range.min())) {
        bounds.add(ctx.mkLe(ctx.mkInt(integerText(Math.ceil(range.min()))), x));
      }
      if (Double.isFinite(range.max())) {
        bounds.add(ctx.mkLe(x, ctx.mkInt(integerText(Math.floor(range.max())))));
      }
      return translation(conjunction(ctx, bounds), constraint, new SmtVariable(varName, SmtSort.INT));
    } else if (constraint instanceof TypeConstraint.Length length) {
      final Expr<SeqSort<CharSort>> s = ctx.mkConst(varName, ctx.getStringSort());
      final IntExpr len = ctx.mkLength(s);
      final var bounds = new ArrayList<BoolExpr>();
      bounds.add(ctx.mkLe(ctx.mkInt(length.min()), len));
      if (length.isBounded()) {
        bounds.add(ctx.mkLe(len, ctx.mkInt(length.max())));
      }
      return translation(conjunction(ctx, bounds), constraint, new SmtVariable(varName, SmtSort.STRING));
    } else if (constraint instanceof TypeConstraint.Pattern pattern) {
      final Expr<SeqSort<CharSort>> s = ctx.mkConst(varName, ctx.getStringSort());
      return translation(anchorMatch(ctx, s, pattern.regex()), constraint, new SmtVariable(varName, SmtSort.STRING));
    } else if (constraint instanceof TypeConstraint.Enumeration enumeration) {
      return translateEnumeration(ctx, enumeration, varName);
    }
    throw new IllegalArgumentException("Unknown constraint: " + constraint);
  }

  @Override
  public SmtSolution solve(List<TypeConstraint> constraints, List<Value> exclusions, SmtOptions options) {
    final Context ctx = requireContext();
    final Solver solver = options.logic() != null ? ctx.mkSolver(options.logic()) : ctx.mkSolver();
    final Params params = ctx.mkParams();
    params.add("timeout", (int) Math.min(Integer.MAX_VALUE, options.timeoutMs()));
    if (options.randomSeed() != null) {
      params.add("random_seed", options.randomSeed());
    }
    solver.setParameters(params);

    final var variables = new LinkedHashMap<String, SmtVariable>();
    for (TypeConstraint constraint : constraints) {
      final var translation = translateConstraint(constraint, VARIABLE + "_" + sortOf(constraint).name().toLowerCase(Locale.ROOT));
      solver.add(translation.expression());
      translation.variables().forEach(v -> variables.putIfAbsent(v.name(), v));
    }
    if (!variables.isEmpty()) {
      final SmtVariable first = variables.values().iterator().next();
      for (Value excluded : exclusions) {
        final Optional<BoolExpr> equality = equality(ctx, first, excluded);
        if (equality.isPresent()) {
          solver.add(ctx.mkNot(equality.get()));
        } else {
          LOGGER.fine(() -> "Cannot exclude " + excluded.render() + " from a " + first.sort() + " variable");
        }
      }
    }

    final Status status = solver.check();
    LOGGER.finer(() -> "Z3 answered " + status + " for " + constraints.size() + " constraints and "
        + exclusions.size() + " exclusions");
    if (status == Status.UNSATISFIABLE) {
      return SmtSolution.of(SmtStatus.UNSAT);
    } else if (status == Status.UNKNOWN) {
      LOGGER.fine(() -> "Z3 gave up: " + solver.getReasonUnknown());
      return SmtSolution.of(SmtStatus.UNKNOWN);
    }
    final Model model = solver.getModel();
    final var assignments = new LinkedHashMap<String, Value>();
    for (SmtVariable variable : variables.values()) {
      final Expr<?> value = model.eval(constant(ctx, variable), true);
      assignments.put(variable.name(), parseNative(value.toString()));
    }
    return new SmtSolution(SmtStatus.SAT, assignments);
  }

  @Override
  public void dispose() {
    if (context != null) {
      context.close();
      context = null;
      LOGGER.fine("Disposed Z3 context");
    }
  }

  /// Reads a model value printed by Z3: integers, negated terms, rationals, quoted strings and booleans.
  /// Anything else is returned as its raw text.
  static Value parseNative(String text) {
    final String t = text.strip();
    if (INTEGER.matcher(t).matches()) {
      return Value.number(new BigInteger(t).doubleValue());
    }
    final Matcher negated = NEGATED.matcher(t);
    if (negated.matches()) {
      final Value inner = parseNative(negated.group(1));
      if (inner instanceof Value.NumberValue n) {
        return Value.number(-n.value());
      }
    }
    final Matcher rational = RATIONAL.matcher(t);
    if (rational.matches()) {
      return Value.number(new BigDecimal(rational.group(1)).doubleValue() / new BigDecimal(rational.group(2)).doubleValue());
    }
    if (DECIMAL.matcher(t).matches()) {
      return Value.number(Double.parseDouble(t.replace("?", "")));
    }
    if (t.length() >= 2 && t.startsWith("\"") && t.endsWith("\"")) {
      return Value.string(unescape(t.substring(1, t.length() - 1)));
    }
    if ("true".equals(t) || "false".equals(t)) {
      return Value.bool(Boolean.parseBoolean(t));
    }
    return Value.string(t);
  }

  static SmtSort sortOf(TypeConstraint constraint) {
    if (constraint instanceof TypeConstraint.Range) {
      return SmtSort.INT;
    } else if (constraint instanceof TypeConstraint.Enumeration e) {
      if (e.values().isEmpty()) {
        return SmtSort.BOOL;
      }
      final Value first = e.values().get(0);
      if (first instanceof Value.NumberValue n) {
        return n.isInteger() ? SmtSort.INT : SmtSort.REAL;
      }
      return first instanceof Value.StringValue ? SmtSort.STRING : SmtSort.BOOL;
    }
    return SmtSort.STRING;
  }

  private SmtTranslation<BoolExpr> translateEnumeration(Context ctx, TypeConstraint.Enumeration enumeration, String varName) {
    final SmtSort sort = sortOf(enumeration);
    if (enumeration.values().isEmpty()) {
      return translation(ctx.mkFalse(), enumeration, new SmtVariable(varName, SmtSort.BOOL));
    }
    final var variable = new SmtVariable(varName, sort);
    if (sort == SmtSort.BOOL) {
      LOGGER.fine(() -> "Enumeration of " + enumeration.values().get(0).typeName() + " values is not translated");
      ctx.mkBoolConst(varName);
      return translation(ctx.mkTrue(), enumeration, variable);
    }
    final var disjuncts = new ArrayList<BoolExpr>();
    for (Value v : enumeration.values()) {
      final Optional<BoolExpr> equality = equality(ctx, variable, v);
      if (equality.isPresent()) {
        disjuncts.add(equality.get());
      } else {
        LOGGER.fine(() -> "Skipping enumeration value " + v.render() + " of a different sort than " + sort);
      }
    }
    final BoolExpr expression = disjuncts.isEmpty() ? ctx.mkFalse()
        : disjuncts.size() == 1 ? disjuncts.get(0) : ctx.mkOr(disjuncts.toArray(BoolExpr[]::new));
    return translation(expression, enumeration, variable);
  }

  /// `^x$` is equality, `^x` a prefix, `x$` a suffix and anything else a substring. Regex syntax inside `x` is
  /// taken literally.
  private static BoolExpr anchorMatch(Context ctx, Expr<SeqSort<CharSort>> s, String regex) {
    final boolean start = regex.startsWith("^");
    final boolean end = regex.endsWith("$") && !regex.endsWith("\\$") && regex.length() > (start ? 1 : 0);
    final String literal = regex.substring(start ? 1 : 0, end ? regex.length() - 1 : regex.length());
    final SeqExpr<CharSort> text = ctx.mkString(literal);
    if (start && end) {
      return ctx.mkEq(s, text);
    } else if (start) {
      return ctx.mkPrefixOf(text, s);
    } else if (end) {
      return ctx.mkSuffixOf(text, s);
    } else if (literal.isEmpty()) {
      return ctx.mkTrue();
    }
    return ctx.mkContains(s, text);
  }

  private static Optional<BoolExpr> equality(Context ctx, SmtVariable variable, Value value) {
    switch (variable.sort()) {
      case INT -> {
        if (value instanceof Value.NumberValue n && n.isInteger()) {
          return Optional.of(ctx.mkEq(ctx.mkIntConst(variable.name()), ctx.mkInt(integerText(n.value()))));
        }
      }
      case REAL -> {
        if (value instanceof Value.NumberValue n && n.isFinite()) {
          return Optional.of(ctx.mkEq(ctx.mkRealConst(variable.name()),
              ctx.mkReal(BigDecimal.valueOf(n.value()).toPlainString())));
        }
      }
      case STRING -> {
        if (value instanceof Value.StringValue s) {
          final Expr<SeqSort<CharSort>> x = ctx.mkConst(variable.name(), ctx.getStringSort());
          return Optional.of(ctx.mkEq(x, ctx.mkString(s.value())));
        }
      }
      case BOOL -> {
        if (value instanceof Value.BooleanValue b) {
          return Optional.of(ctx.mkEq(ctx.mkBoolConst(variable.name()), ctx.mkBool(b.value())));
        }
      }
    }
    return Optional.empty();
  }

  private static Expr<?> constant(Context ctx, SmtVariable variable) {
    return switch (variable.sort()) {
      case INT -> ctx.mkIntConst(variable.name());
      case REAL -> ctx.mkRealConst(variable.name());
      case STRING -> ctx.mkConst(variable.name(), ctx.getStringSort());
      case BOOL -> ctx.mkBoolConst(variable.name());
    };
  }

  private static BoolExpr conjunction(Context ctx, List<BoolExpr> parts) {
    if (parts.isEmpty()) {
      return ctx.mkTrue();
    }
    return parts.size() == 1 ? parts.get(0) : ctx.mkAnd(parts.toArray(BoolExpr[]::new));
  }

  private static SmtTranslation<BoolExpr> translation(BoolExpr expression, TypeConstraint original, SmtVariable variable) {
    return new SmtTranslation<>(expression, List.of(variable), original);
  }

  private static String integerText(double d) {
    return BigDecimal.valueOf(d).toBigInteger().toString();
  }

  private static String unescape(String s) {
    final Matcher m = CODE_POINT.matcher(s.replace("\"\"", "\""));
    final var sb = new StringBuilder();
    while (m.find()) {
      m.appendReplacement(sb, Matcher.quoteReplacement(new String(Character.toChars(Integer.parseInt(m.group(1), 16)))));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  private Context requireContext() {
    if (context == null) {
      throw new IllegalStateException("Z3 backend is not initialized, call init() first");
    }
    return context;
  }

  @Override
  public String toString() {
    return "Z3Backend[" + (context == null ? "disposed" : "ready") + ", timeout=" + defaults.timeoutMs() + "ms]";
  }
}
