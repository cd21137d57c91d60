package qseries.cli;

import java.io.PrintStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qseries.profile.IdentityProfiler;
import qseries.profile.IdentityProfiler.NamedIdentity;
import qseries.profile.IdentityProfiler.ProfileReport;
import qseries.profile.IdentityProfiler.ProfileRun;

/** Handles the `profile` command: proves the whole catalogue, or one identity. */
final class ProfileCommand {
  private static final Logger LOG = LoggerFactory.getLogger(ProfileCommand.class);

  int execute(String[] args, PrintStream out) {
    CliOptions options = CliArguments.parse(args);
    List<NamedIdentity> identities =
        options.hasExample()
            ? List.of(
                NamedIdentity.of(CliParsers.loadExampleByName(options.exampleName()), options.q()))
            : IdentityProfiler.defaultIdentities(options.q());

    ProfileReport report =
        new IdentityProfiler().profile(identities, options.telescopingOptions());
    logProfileReport(report);
    out.println(new JsonReportBuilder().profile(options.q(), report));
    return report.provedCount() == report.runs().size() ? 0 : 3;
  }

  private void logProfileReport(ProfileReport report) {
    LOG.info("Profiled {} identities", report.runs().size());
    for (ProfileRun run : report.runs()) {
      LOG.info(
          "- {}: elapsed={}ms, proved={}, order={}",
          run.identityName(),
          run.elapsedMillis(),
          run.proved(),
          run.recurrenceOrder());
      if (run.failure() != null) {
        LOG.warn("  failure: {}", run.failure());
      }
    }
    LOG.info("Total elapsed millis: {}", report.totalElapsedMillis());
  }
}
