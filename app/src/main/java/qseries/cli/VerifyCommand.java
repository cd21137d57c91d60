package qseries.cli;

import java.io.PrintStream;
import qseries.algebra.RationalFunction;
import qseries.algebra.RationalPolynomial;
import qseries.core.Recurrence;
import qseries.model.HypergeometricSeries;
import qseries.model.IndexDependence;
import qseries.pipeline.Pipeline;
import qseries.util.Timing;

/** Handles the `verify` command: checks a supplied recurrence and certificate. */
final class VerifyCommand {

  int execute(String[] args, PrintStream out) {
    CliOptions options = CliArguments.parse(args);
    if (options.coefficients().isEmpty()) {
      throw new IllegalArgumentException("verify needs --coefficients c0,c1,...");
    }
    if (options.certificateNumerator().isEmpty()) {
      throw new IllegalArgumentException("verify needs --certificate-numerator");
    }
    HypergeometricSeries series = CliParsers.loadSeries(options);
    int n = CliParsers.resolveIndex(options, series);
    Recurrence recurrence = new Recurrence(options.coefficients());
    RationalFunction certificate =
        RationalFunction.of(
            RationalPolynomial.of(options.certificateNumerator()),
            RationalPolynomial.of(options.certificateDenominator()));
    IndexDependence dependence =
        CliParsers.detectorFor(options).detect(series, n, options.q());

    Timing timer = Timing.start();
    boolean valid =
        new Pipeline(options.telescopingOptions())
            .verify(series, options.q(), recurrence, certificate, dependence, options.maxK());
    out.println(
        new JsonReportBuilder()
            .verify(
                series,
                options.q(),
                recurrence,
                certificate,
                options.maxK(),
                valid,
                timer.elapsedMillis()));
    return valid ? 0 : 3;
  }
}
