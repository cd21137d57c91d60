package qseries.cli;

import java.util.List;
import qseries.algebra.BigRational;
import qseries.core.TelescopingOptions;
import qseries.model.QMonomial;

record CliOptions(
    String exampleName,
    List<QMonomial> upper,
    List<QMonomial> lower,
    QMonomial argument,
    BigRational q,
    Integer n,
    int maxOrder,
    int maxK,
    List<BigRational> coefficients,
    List<BigRational> certificateNumerator,
    List<BigRational> certificateDenominator) {

  static final BigRational DEFAULT_Q = BigRational.of(1, 3);

  CliOptions {
    upper = upper == null ? List.of() : List.copyOf(upper);
    lower = lower == null ? List.of() : List.copyOf(lower);
    q = q == null ? DEFAULT_Q : q;
    if (q.isZero()) {
      throw new IllegalArgumentException("--q must be non-zero");
    }
    if (n != null && n < 0) {
      throw new IllegalArgumentException("--n must be non-negative: " + n);
    }
    if (maxOrder < 1) {
      throw new IllegalArgumentException("--max-order must be at least 1: " + maxOrder);
    }
    if (maxK < 0) {
      throw new IllegalArgumentException("--max-k must be non-negative: " + maxK);
    }
    coefficients = coefficients == null ? List.of() : List.copyOf(coefficients);
    certificateNumerator =
        certificateNumerator == null ? List.of() : List.copyOf(certificateNumerator);
    certificateDenominator =
        certificateDenominator == null
            ? List.of(BigRational.ONE)
            : List.copyOf(certificateDenominator);
  }

  boolean hasExample() {
    return exampleName != null && !exampleName.isBlank();
  }

  boolean hasSeries() {
    return argument != null;
  }

  TelescopingOptions telescopingOptions() {
    return TelescopingOptions.defaults().withMaxOrder(maxOrder);
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private String exampleName;
    private List<QMonomial> upper = List.of();
    private List<QMonomial> lower = List.of();
    private QMonomial argument;
    private BigRational q = DEFAULT_Q;
    private Integer n;
    private int maxOrder = TelescopingOptions.defaults().maxOrder();
    private int maxK = TelescopingOptions.defaults().verifyWindow();
    private List<BigRational> coefficients = List.of();
    private List<BigRational> certificateNumerator = List.of();
    private List<BigRational> certificateDenominator = List.of(BigRational.ONE);

    Builder exampleName(String exampleName) {
      this.exampleName = exampleName;
      return this;
    }

    Builder upper(List<QMonomial> upper) {
      this.upper = upper;
      return this;
    }

    Builder lower(List<QMonomial> lower) {
      this.lower = lower;
      return this;
    }

    Builder argument(QMonomial argument) {
      this.argument = argument;
      return this;
    }

    Builder q(BigRational q) {
      this.q = q;
      return this;
    }

    Builder n(int n) {
      this.n = n;
      return this;
    }

    Builder maxOrder(int maxOrder) {
      this.maxOrder = maxOrder;
      return this;
    }

    Builder maxK(int maxK) {
      this.maxK = maxK;
      return this;
    }

    Builder coefficients(List<BigRational> coefficients) {
      this.coefficients = coefficients;
      return this;
    }

    Builder certificateNumerator(List<BigRational> certificateNumerator) {
      this.certificateNumerator = certificateNumerator;
      return this;
    }

    Builder certificateDenominator(List<BigRational> certificateDenominator) {
      this.certificateDenominator = certificateDenominator;
      return this;
    }

    CliOptions build() {
      boolean explicitSeries = argument != null || !upper.isEmpty() || !lower.isEmpty();
      if (exampleName != null && !exampleName.isBlank() && explicitSeries) {
        throw new IllegalArgumentException(
            "Provide at most one of --example or --upper/--argument");
      }
      if (argument == null && (!upper.isEmpty() || !lower.isEmpty())) {
        throw new IllegalArgumentException("--argument is required with --upper/--lower");
      }
      return new CliOptions(
          exampleName,
          upper,
          lower,
          argument,
          q,
          n,
          maxOrder,
          maxK,
          coefficients,
          certificateNumerator,
          certificateDenominator);
    }
  }
}
