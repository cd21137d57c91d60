package qseries.cli;

import java.io.PrintStream;
import qseries.core.ProofResult;
import qseries.examples.Identity;
import qseries.pipeline.Pipeline;
import qseries.util.Timing;

/** Handles the `prove` command for a catalogue identity. */
final class ProveCommand {
  int execute(String[] args, PrintStream out) {
    CliOptions options = CliArguments.parse(args);
    if (!options.hasExample()) {
      throw new IllegalArgumentException("prove needs --example <identity>");
    }
    Identity identity = CliParsers.loadExampleByName(options.exampleName());
    int nTest = options.n() != null ? options.n() : CliParsers.DEFAULT_EXAMPLE_INDEX;

    Timing timer = Timing.start();
    ProofResult result =
        new Pipeline(options.telescopingOptions())
            .prove(
                identity.lhs(),
                identity.rhsAt(options.q()),
                options.q(),
                nTest,
                identity.detector());
    out.println(
        new JsonReportBuilder()
            .proof(identity.name(), options.q(), nTest, result, timer.elapsedMillis()));
    return result.isProved() ? 0 : 3;
  }
}
