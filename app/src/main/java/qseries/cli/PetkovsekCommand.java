package qseries.cli;

import java.io.PrintStream;
import java.util.List;
import qseries.core.PetkovsekSolution;
import qseries.pipeline.Pipeline;
import qseries.util.Timing;

/** Handles the `petkovsek` command. */
final class PetkovsekCommand {

  int execute(String[] args, PrintStream out) {
    CliOptions options = CliArguments.parse(args);
    if (options.coefficients().isEmpty()) {
      throw new IllegalArgumentException("petkovsek needs --coefficients c0,c1,...");
    }
    Timing timer = Timing.start();
    List<PetkovsekSolution> solutions =
        new Pipeline(options.telescopingOptions())
            .petkovsek(options.coefficients(), options.q());
    out.println(
        new JsonReportBuilder()
            .petkovsek(options.coefficients(), options.q(), solutions, timer.elapsedMillis()));
    return solutions.isEmpty() ? 3 : 0;
  }
}
