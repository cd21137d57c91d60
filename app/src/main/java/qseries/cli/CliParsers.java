package qseries.cli;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import qseries.algebra.BigRational;
import qseries.examples.Identities;
import qseries.examples.Identity;
import qseries.model.HypergeometricSeries;
import qseries.model.QMonomial;
import qseries.profile.IdentityProfiler;
import qseries.zeilberger.IndexDependenceDetector;

/** Shared helpers for CLI argument parsing and series loading. */
final class CliParsers {
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Splitter MONOMIAL_SPLITTER = Splitter.on(':').trimResults();

  static final int DEFAULT_EXAMPLE_INDEX = IdentityProfiler.DEFAULT_N_START;

  private CliParsers() {}

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static BigRational parseRational(String raw, String optionName) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Missing value for " + optionName);
    }
    try {
      return BigRational.parse(raw.trim());
    } catch (IllegalArgumentException | ArithmeticException ex) {
      throw new IllegalArgumentException("Invalid rational for " + optionName + ": " + raw, ex);
    }
  }

  /** {@code "1,-1/2,3"}; an empty string is an empty list. */
  static List<BigRational> parseRationalList(String raw, String optionName) {
    List<BigRational> values = new ArrayList<>();
    if (raw == null) {
      return values;
    }
    for (String token : LIST_SPLITTER.split(raw)) {
      values.add(parseRational(token, optionName));
    }
    return values;
  }

  /** {@code "coeff:power"}; a bare coefficient means power 0. */
  static QMonomial parseMonomial(String raw, String optionName) {
    List<String> parts = MONOMIAL_SPLITTER.splitToList(raw == null ? "" : raw);
    if (parts.size() == 1) {
      return QMonomial.constant(parseRational(parts.get(0), optionName));
    }
    if (parts.size() != 2) {
      throw new IllegalArgumentException(
          "Invalid monomial for " + optionName + " (expected coeff:power): " + raw);
    }
    BigRational coefficient = parseRational(parts.get(0), optionName);
    int power = parseInt(parts.get(1), 0, optionName);
    return new QMonomial(coefficient, power);
  }

  static List<QMonomial> parseMonomialList(String raw, String optionName) {
    List<QMonomial> monomials = new ArrayList<>();
    if (raw == null) {
      return monomials;
    }
    for (String token : LIST_SPLITTER.split(raw)) {
      monomials.add(parseMonomial(token, optionName));
    }
    return monomials;
  }

  static Identity loadExampleByName(String exampleName) {
    return Identities.byName(exampleName);
  }

  /**
   * Outer index {@code n}: {@code --n} when given, {@link #DEFAULT_EXAMPLE_INDEX} for an example,
   * else the termination order of an explicit series.
   */
  static int resolveIndex(CliOptions options, HypergeometricSeries series) {
    if (options.n() != null) {
      return options.n();
    }
    if (options.hasExample()) {
      return DEFAULT_EXAMPLE_INDEX;
    }
    OptionalInt order = series.terminationOrder();
    return order.isPresent() ? order.getAsInt() : 0;
  }

  /** Series named by {@code --example} at {@code --n}, or given explicitly. */
  static HypergeometricSeries loadSeries(CliOptions options) {
    if (options.hasExample()) {
      int n = options.n() != null ? options.n() : DEFAULT_EXAMPLE_INDEX;
      return loadExampleByName(options.exampleName()).lhs().apply(n);
    }
    if (options.hasSeries()) {
      return new HypergeometricSeries(options.upper(), options.lower(), options.argument());
    }
    throw new IllegalArgumentException("Provide --example or --upper/--lower/--argument");
  }

  static IndexDependenceDetector detectorFor(CliOptions options) {
    return options.hasExample()
        ? loadExampleByName(options.exampleName()).detector()
        : IndexDependenceDetector.heuristic();
  }
}
