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
package net.hydromatic.dcalc.eval;

import static java.util.Objects.requireNonNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.Period;
import java.util.List;
import java.util.function.Supplier;
import net.hydromatic.dcalc.ast.Pos;
import net.hydromatic.dcalc.compile.BuiltIn;
import net.hydromatic.dcalc.util.DcalcException;

/** Implementations of built-in operators, and the runtime errors that they
 * and translated programs raise. */
public abstract class Codes {
  private Codes() {}

  /** Applies a strict built-in operator to argument values.
   *
   * <p>Integers are {@link BigInteger}, decimals and money are {@link
   * BigDecimal}, dates are {@link LocalDate} and durations are {@link
   * Period}. */
  public static Object apply(BuiltIn builtIn, List<Object> args, Pos pos) {
    final Object a0 = args.get(0);
    switch (builtIn) {
      case NOT:
        return !(Boolean) a0;
      case AND:
        return (Boolean) a0 && (Boolean) args.get(1);
      case OR:
        return (Boolean) a0 || (Boolean) args.get(1);
      case NEGATE:
        if (a0 instanceof BigInteger) {
          return ((BigInteger) a0).negate();
        }
        if (a0 instanceof Period) {
          return ((Period) a0).negated();
        }
        return ((BigDecimal) a0).negate();
      case PLUS:
        return plus(a0, args.get(1));
      case MINUS:
        return minus(a0, args.get(1));
      case TIMES:
        return times(a0, args.get(1));
      case DIVIDE:
        return divide(a0, args.get(1), pos);
      case LT:
        return compare(a0, args.get(1)) < 0;
      case LE:
        return compare(a0, args.get(1)) <= 0;
      case GT:
        return compare(a0, args.get(1)) > 0;
      case GE:
        return compare(a0, args.get(1)) >= 0;
      case EQ:
        return equal(a0, args.get(1));
      case NE:
        return !equal(a0, args.get(1));
      case LENGTH:
        return BigInteger.valueOf(((List) a0).size());
      default:
        throw new IllegalArgumentException("not a strict operator: "
            + builtIn);
    }
  }

  private static Object plus(Object a0, Object a1) {
    if (a0 instanceof BigInteger) {
      return ((BigInteger) a0).add((BigInteger) a1);
    }
    if (a0 instanceof LocalDate) {
      return ((LocalDate) a0).plus((Period) a1);
    }
    if (a0 instanceof Period) {
      return ((Period) a0).plus((Period) a1);
    }
    return ((BigDecimal) a0).add((BigDecimal) a1);
  }

  private static Object minus(Object a0, Object a1) {
    if (a0 instanceof BigInteger) {
      return ((BigInteger) a0).subtract((BigInteger) a1);
    }
    if (a0 instanceof LocalDate) {
      if (a1 instanceof LocalDate) {
        return Period.between((LocalDate) a1, (LocalDate) a0);
      }
      return ((LocalDate) a0).minus((Period) a1);
    }
    if (a0 instanceof Period) {
      return ((Period) a0).minus((Period) a1);
    }
    return ((BigDecimal) a0).subtract((BigDecimal) a1);
  }

  private static Object times(Object a0, Object a1) {
    if (a0 instanceof BigInteger) {
      return ((BigInteger) a0).multiply((BigInteger) a1);
    }
    if (a0 instanceof Period) {
      return ((Period) a0).multipliedBy(((BigInteger) a1).intValueExact());
    }
    return ((BigDecimal) a0).multiply((BigDecimal) a1);
  }

  private static Object divide(Object a0, Object a1, Pos pos) {
    final BigDecimal d0 = toDecimal(a0);
    final BigDecimal d1 = toDecimal(a1);
    if (d1.signum() == 0) {
      throw new DcalcRuntimeException(RuntimeExn.DIVISION_BY_ZERO, pos);
    }
    return d0.divide(d1, MathContext.DECIMAL128);
  }

  private static BigDecimal toDecimal(Object o) {
    return o instanceof BigInteger
        ? new BigDecimal((BigInteger) o)
        : (BigDecimal) o;
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private static int compare(Object a0, Object a1) {
    if (a0 instanceof Period) {
      throw new IllegalArgumentException("durations are not ordered: " + a0);
    }
    return ((Comparable) a0).compareTo(a1);
  }

  private static boolean equal(Object a0, Object a1) {
    if (a0 instanceof BigDecimal) {
      return ((BigDecimal) a0).compareTo((BigDecimal) a1) == 0;
    }
    return a0.equals(a1);
  }

  /**
   * Resolves a default whose exceptions, justification and consequence are
   * options.
   *
   * <p>If more than one exception is present, raises {@link
   * RuntimeExn#CONFLICT_ERROR}; if exactly one is present, returns it;
   * otherwise, if the justification is {@code Some true}, evaluates and
   * returns the consequence; otherwise returns {@code None}.
   */
  public static Variant handleDefaultOpt(String optionEnum,
      List<Variant> excepts, Variant just, Supplier<Variant> cons, Pos pos) {
    Variant present = null;
    for (Variant except : excepts) {
      if (except.isSome()) {
        if (present != null) {
          throw new DcalcRuntimeException(RuntimeExn.CONFLICT_ERROR, pos);
        }
        present = except;
      }
    }
    if (present != null) {
      return present;
    }
    if (just.isSome() && Boolean.TRUE.equals(just.value)) {
      return cons.get();
    }
    return Variant.none(optionEnum);
  }

  /** Java exception that is raised by a translated program, or by the
   * evaluation of a default calculus program. */
  public static class DcalcRuntimeException extends RuntimeException
      implements DcalcException {
    private final RuntimeExn exn;
    private final Pos pos;

    /** Creates a DcalcRuntimeException. */
    public DcalcRuntimeException(RuntimeExn exn, Pos pos) {
      this.exn = requireNonNull(exn);
      this.pos = requireNonNull(pos);
    }

    @Override
    public String toString() {
      return exn.mlName + " at " + pos;
    }

    @Override
    public String getMessage() {
      return describeTo(new StringBuilder()).toString();
    }

    /** Returns the kind of error. */
    public RuntimeExn exn() {
      return exn;
    }

    @Override
    public StringBuilder describeTo(StringBuilder buf) {
      buf.append("uncaught exception ").append(exn.mlName).append(" at ");
      return pos.describeTo(buf);
    }

    @Override
    public Pos pos() {
      return pos;
    }
  }

  /** Runtime errors. */
  public enum RuntimeExn {
    /** More than one exception of a default is present. */
    CONFLICT_ERROR("ConflictError"),
    /** A value that is required is absent. */
    NO_VALUE_PROVIDED("NoValueProvided"),
    ASSERTION_FAILED("AssertionFailed"),
    DIVISION_BY_ZERO("DivisionByZero");

    public final String mlName;

    RuntimeExn(String mlName) {
      this.mlName = mlName;
    }
  }
}

// End Codes.java
