package qseries.cli;

import java.io.PrintStream;
import qseries.core.GosperResult;
import qseries.model.HypergeometricSeries;
import qseries.pipeline.Pipeline;
import qseries.util.Timing;

/** Handles the `gosper` command. */
final class GosperCommand {

  int execute(String[] args, PrintStream out) {
    CliOptions options = CliArguments.parse(args);
    HypergeometricSeries series = CliParsers.loadSeries(options);
    Timing timer = Timing.start();
    GosperResult result = new Pipeline(options.telescopingOptions()).gosper(series, options.q());
    out.println(
        new JsonReportBuilder().gosper(series, options.q(), result, timer.elapsedMillis()));
    return result.isSummable() ? 0 : 3;
  }
}
