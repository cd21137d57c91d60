package qseries.cli;

import java.io.PrintStream;
import java.util.Optional;
import qseries.core.ZeilbergerResult;
import qseries.model.HypergeometricSeries;
import qseries.pipeline.Pipeline;
import qseries.util.Timing;

/** Handles the `zeilberger` command. */
final class ZeilbergerCommand {

  int execute(String[] args, PrintStream out) {
    CliOptions options = CliArguments.parse(args);
    HypergeometricSeries series = CliParsers.loadSeries(options);
    int n = CliParsers.resolveIndex(options, series);
    Timing timer = Timing.start();
    Optional<ZeilbergerResult> result =
        new Pipeline(options.telescopingOptions())
            .zeilberger(series, n, options.q(), CliParsers.detectorFor(options));
    out.println(
        new JsonReportBuilder()
            .zeilberger(series, options.q(), n, result, timer.elapsedMillis()));
    return result.isPresent() ? 0 : 3;
  }
}
