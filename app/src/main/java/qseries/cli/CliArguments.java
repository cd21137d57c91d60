package qseries.cli;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import qseries.core.TelescopingOptions;

/** Option table shared by every command. */
final class CliArguments {
  private static final Map<String, OptionSpec> SPECS = optionSpecs();

  private CliArguments() {}

  /** Parses everything after the command word. */
  static CliOptions parse(String[] args) {
    String[] effectiveArgs = stripCommand(args);
    CliOptions.Builder builder = CliOptions.builder();

    for (int i = 0; i < effectiveArgs.length; i++) {
      ParsedArg parsed = ParsedArg.parse(effectiveArgs[i]);
      OptionSpec spec = SPECS.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + effectiveArgs[i]);
      }

      String value = parsed.value();
      if (value == null || value.isBlank()) {
        if (i + 1 >= effectiveArgs.length) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = effectiveArgs[++i];
      }
      spec.apply(builder, value);
    }

    return builder.build();
  }

  private static Map<String, OptionSpec> optionSpecs() {
    TelescopingOptions defaults = TelescopingOptions.defaults();
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--example", new OptionSpec((b, raw) -> b.exampleName(raw)));
    specs.put(
        "--upper",
        new OptionSpec((b, raw) -> b.upper(CliParsers.parseMonomialList(raw, "--upper"))));
    specs.put(
        "--lower",
        new OptionSpec((b, raw) -> b.lower(CliParsers.parseMonomialList(raw, "--lower"))));
    specs.put(
        "--argument",
        new OptionSpec((b, raw) -> b.argument(CliParsers.parseMonomial(raw, "--argument"))));
    specs.put("--q", new OptionSpec((b, raw) -> b.q(CliParsers.parseRational(raw, "--q"))));
    specs.put("--n", new OptionSpec((b, raw) -> b.n(CliParsers.parseInt(raw, 0, "--n"))));
    specs.put(
        "--max-order",
        new OptionSpec(
            (b, raw) ->
                b.maxOrder(CliParsers.parseInt(raw, defaults.maxOrder(), "--max-order"))));
    specs.put(
        "--max-k",
        new OptionSpec(
            (b, raw) -> b.maxK(CliParsers.parseInt(raw, defaults.verifyWindow(), "--max-k"))));
    specs.put(
        "--coefficients",
        new OptionSpec(
            (b, raw) -> b.coefficients(CliParsers.parseRationalList(raw, "--coefficients"))));
    specs.put(
        "--certificate-numerator",
        new OptionSpec(
            (b, raw) ->
                b.certificateNumerator(
                    CliParsers.parseRationalList(raw, "--certificate-numerator"))));
    specs.put(
        "--certificate-denominator",
        new OptionSpec(
            (b, raw) ->
                b.certificateDenominator(
                    CliParsers.parseRationalList(raw, "--certificate-denominator"))));
    return Map.copyOf(specs);
  }

  private static String[] stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if (args[0].startsWith("--")) {
      return args;
    }
    return Arrays.copyOfRange(args, 1, args.length);
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(BiConsumer<CliOptions.Builder, String> apply) {
    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
