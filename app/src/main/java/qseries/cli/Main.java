package qseries.cli;

import java.io.PrintStream;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <p>Usage: {@code Main <gosper|zeilberger|verify|petkovsek|prove|profile> [options]}. The report
 * goes to stdout as JSON. Exit code 0 means a positive result, 3 an expected negative one (not
 * summable, no recurrence, no roots, proof failed) and 2 bad arguments.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_USAGE = 2;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args, System.out));
  }

  static int run(String[] args, PrintStream out) {
    if (args == null || args.length == 0) {
      LOG.error("Missing command: gosper, zeilberger, verify, petkovsek, prove or profile");
      return EXIT_USAGE;
    }
    String command = args[0].toLowerCase(Locale.ROOT);
    try {
      return switch (command) {
        case "gosper" -> new GosperCommand().execute(args, out);
        case "zeilberger" -> new ZeilbergerCommand().execute(args, out);
        case "verify" -> new VerifyCommand().execute(args, out);
        case "petkovsek" -> new PetkovsekCommand().execute(args, out);
        case "prove" -> new ProveCommand().execute(args, out);
        case "profile" -> new ProfileCommand().execute(args, out);
        default -> throw new IllegalArgumentException("Unknown command: " + args[0]);
      };
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      return EXIT_USAGE;
    }
  }
}
