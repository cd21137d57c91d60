package qseries.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import qseries.algebra.BigRational;
import qseries.core.ZeilbergerResult;
import qseries.examples.Identities;
import qseries.examples.Identity;
import qseries.model.HypergeometricSeries;
import qseries.zeilberger.QZeilberger;

final class MainTest {

  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

  private int run(String... args) {
    return Main.run(args, out);
  }

  private JsonObject report() {
    return JsonParser.parseString(buffer.toString(StandardCharsets.UTF_8)).getAsJsonObject();
  }

  @Test
  void gosperSummableExitsZero() {
    int code = run("gosper", "--upper", "1:3,1:1", "--lower", "1:2", "--argument", "1:1");
    assertEquals(0, code);
    assertTrue(report().get("summable").getAsBoolean(), "Report should mark the series summable");
  }

  @Test
  void gosperNotSummableExitsThree() {
    assertEquals(3, run("gosper", "--argument=1:1"));
    assertEquals("gosper", report().getAsJsonObject("meta").get("command").getAsString());
  }

  @Test
  void zeilbergerOnExample() {
    assertEquals(0, run("zeilberger", "--example", "vandermonde", "--n", "4", "--q", "1/3"));
    JsonObject report = report();
    assertTrue(report.get("found").getAsBoolean());
    assertEquals(1, report.get("order").getAsInt());
    assertEquals(2, report.getAsJsonArray("recurrence").size());
  }

  @Test
  void zeilbergerOnExplicitSeries() {
    assertEquals(
        0, run("zeilberger", "--upper", "1:-3,1:2", "--lower", "1:3", "--argument", "1:4"));
    assertEquals(3, report().get("n").getAsInt(), "n should default to the termination order");
  }

  @Test
  void verifyAcceptsEngineCertificate() {
    BigRational q = BigRational.of(1, 3);
    Identity vandermonde = Identities.qVandermonde();
    HypergeometricSeries series = vandermonde.lhs().apply(5);
    ZeilbergerResult result =
        new QZeilberger().find(series, 5, q, vandermonde.detector()).orElseThrow();

    int code =
        run(
            "verify",
            "--example",
            "vandermonde",
            "--n",
            "5",
            "--coefficients",
            join(result.recurrence().coefficients()),
            "--certificate-numerator",
            join(result.certificate().numerator().coefficients()),
            "--certificate-denominator",
            join(result.certificate().denominator().coefficients()),
            "--max-k",
            "10");
    assertEquals(0, code);
    assertTrue(report().get("valid").getAsBoolean());
  }

  @Test
  void petkovsekExitCodes() {
    assertEquals(0, run("petkovsek", "--coefficients", "1/6,-5/6,1"));
    assertEquals(2, report().getAsJsonArray("solutions").size());
    assertEquals(3, run("petkovsek", "--coefficients", "1,2,3"));
  }

  @Test
  void proveCatalogueIdentity() {
    assertEquals(0, run("prove", "--example", "binomial"));
    JsonObject report = report();
    assertTrue(report.get("proved").getAsBoolean());
    assertEquals(2, report.get("initial_conditions_checked").getAsInt());
  }

  @Test
  void profileWholeCatalogue() {
    assertEquals(0, run("profile"));
    assertEquals(Identities.all().size(), report().getAsJsonArray("runs").size());
  }

  @Test
  void badArgumentsExitTwo() {
    assertEquals(2, run());
    assertEquals(2, run("frobnicate"));
    assertEquals(2, run("gosper", "--bogus", "1"));
    assertEquals(2, run("zeilberger", "--example", "nope"));
    assertEquals(2, run("prove"));
    assertEquals(2, run("petkovsek", "--coefficients", "1"));
    assertEquals(2, run("petkovsek", "--coefficients", "1,0"));
    assertEquals(2, run("gosper", "--upper", "1:2"));
    assertEquals(2, run("gosper", "--q", "0", "--argument", "1:1"));
    assertEquals(2, run("verify", "--example", "gauss"));
  }

  private static String join(List<BigRational> values) {
    return values.stream().map(BigRational::toString).collect(Collectors.joining(","));
  }
}
