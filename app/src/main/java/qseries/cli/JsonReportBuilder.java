package qseries.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import qseries.algebra.BigRational;
import qseries.algebra.RationalFunction;
import qseries.algebra.RationalPolynomial;
import qseries.core.ClosedForm;
import qseries.core.GosperResult;
import qseries.core.PetkovsekSolution;
import qseries.core.ProofResult;
import qseries.core.Recurrence;
import qseries.core.ZeilbergerResult;
import qseries.model.HypergeometricSeries;
import qseries.model.QMonomial;
import qseries.profile.IdentityProfiler.ProfileReport;
import qseries.profile.IdentityProfiler.ProfileRun;

/** Renders workflow results as pretty-printed JSON; rationals are written as strings. */
final class JsonReportBuilder {
  private static final String VERSION = "0.1.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

  String gosper(HypergeometricSeries series, BigRational q, GosperResult result, long millis) {
    Map<String, Object> root = root("gosper", q, millis);
    root.put("series", series(series));
    root.put("summable", result.isSummable());
    root.put("certificate", result.isSummable() ? function(result.certificate()) : null);
    return gson.toJson(root);
  }

  String zeilberger(
      HypergeometricSeries series,
      BigRational q,
      int n,
      Optional<ZeilbergerResult> result,
      long millis) {
    Map<String, Object> root = root("zeilberger", q, millis);
    root.put("series", series(series));
    root.put("n", n);
    root.put("found", result.isPresent());
    if (result.isPresent()) {
      root.put("order", result.get().order());
      root.put("recurrence", rationals(result.get().recurrence().coefficients()));
      root.put("certificate", function(result.get().certificate()));
    }
    return gson.toJson(root);
  }

  String verify(
      HypergeometricSeries series,
      BigRational q,
      Recurrence recurrence,
      RationalFunction certificate,
      int maxK,
      boolean valid,
      long millis) {
    Map<String, Object> root = root("verify", q, millis);
    root.put("series", series(series));
    root.put("recurrence", rationals(recurrence.coefficients()));
    root.put("certificate", function(certificate));
    root.put("max_k", maxK);
    root.put("valid", valid);
    return gson.toJson(root);
  }

  String petkovsek(
      List<BigRational> coefficients,
      BigRational q,
      List<PetkovsekSolution> solutions,
      long millis) {
    Map<String, Object> root = root("petkovsek", q, millis);
    root.put("coefficients", rationals(coefficients));
    List<Map<String, Object>> entries = new ArrayList<>();
    for (PetkovsekSolution solution : solutions) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("ratio", solution.ratio().toString());
      entry.put("closed_form", solution.hasClosedForm() ? closedForm(solution.closedForm()) : null);
      entries.add(entry);
    }
    root.put("solutions", entries);
    return gson.toJson(root);
  }

  String proof(String identity, BigRational q, int nTest, ProofResult result, long millis) {
    Map<String, Object> root = root("prove", q, millis);
    root.put("identity", identity);
    root.put("n_test", nTest);
    root.put("proved", result.isProved());
    if (result.isProved()) {
      root.put("order", result.order());
      root.put("recurrence", rationals(result.coefficients()));
      root.put("initial_conditions_checked", result.initialConditionsChecked());
    } else {
      root.put("reason", result.reason().name().toLowerCase(Locale.ROOT));
      root.put("message", result.message());
    }
    return gson.toJson(root);
  }

  String profile(BigRational q, ProfileReport report) {
    Map<String, Object> root = root("profile", q, Math.round(report.totalElapsedMillis()));
    List<Map<String, Object>> runs = new ArrayList<>();
    for (ProfileRun run : report.runs()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("identity", run.identityName());
      entry.put("time_ms", run.elapsedMillis());
      entry.put("proved", run.proved());
      entry.put("order", run.recurrenceOrder());
      if (run.failure() != null) {
        entry.put("failure", run.failure());
      }
      runs.add(entry);
    }
    root.put("runs", runs);
    root.put("proved", report.provedCount());
    return gson.toJson(root);
  }

  private Map<String, Object> root(String command, BigRational q, long millis) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("command", command);
    meta.put("q", q.toString());
    meta.put("time_ms", millis);
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta);
    return root;
  }

  private Map<String, Object> series(HypergeometricSeries series) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("upper", monomials(series.upper()));
    map.put("lower", monomials(series.lower()));
    map.put("argument", series.argument().toString());
    map.put("text", series.toString());
    return map;
  }

  private Map<String, Object> function(RationalFunction function) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("numerator", polynomial(function.numerator()));
    map.put("denominator", polynomial(function.denominator()));
    map.put("text", function.toString());
    return map;
  }

  private List<String> polynomial(RationalPolynomial polynomial) {
    return rationals(polynomial.coefficients());
  }

  private Map<String, Object> closedForm(ClosedForm form) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("scalar", form.scalar().toString());
    map.put("q_power_coefficient", form.qPowerCoefficient());
    map.put("numerator_factors", monomials(form.numeratorFactors()));
    map.put("denominator_factors", monomials(form.denominatorFactors()));
    return map;
  }

  private List<String> monomials(List<QMonomial> monomials) {
    return monomials.stream().map(QMonomial::toString).toList();
  }

  private List<String> rationals(List<BigRational> values) {
    return values.stream().map(BigRational::toString).toList();
  }
}
