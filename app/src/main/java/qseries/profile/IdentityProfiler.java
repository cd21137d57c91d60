package qseries.profile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import qseries.algebra.BigRational;
import qseries.core.ProofResult;
import qseries.core.TelescopingOptions;
import qseries.examples.Identities;
import qseries.examples.Identity;
import qseries.nonterminating.NonterminatingProver;
import qseries.util.Timing;

/** Runs the prover over a set of identities and records how long each proof took. */
public final class IdentityProfiler {
  /** Outer index a profiled proof starts from. */
  public static final int DEFAULT_N_START = 5;

  /** Identity evaluated at a concrete base {@code q}, starting from {@code nStart}. */
  public record NamedIdentity(Identity identity, BigRational q, int nStart) {
    public NamedIdentity {
      Objects.requireNonNull(identity, "identity");
      Objects.requireNonNull(q, "q");
      if (nStart < 0) {
        throw new IllegalArgumentException("nStart must be non-negative: " + nStart);
      }
    }

    public static NamedIdentity of(Identity identity, BigRational q) {
      return new NamedIdentity(identity, q, DEFAULT_N_START);
    }

    public String name() {
      return identity.name();
    }
  }

  /** Per-identity outcome. */
  public record ProfileRun(
      String identityName,
      double elapsedMillis,
      boolean proved,
      int recurrenceOrder,
      String failure) {}

  public record ProfileReport(List<ProfileRun> runs) {
    public ProfileReport {
      runs = List.copyOf(Objects.requireNonNull(runs, "runs"));
    }

    public double totalElapsedMillis() {
      return runs.stream().mapToDouble(ProfileRun::elapsedMillis).sum();
    }

    public long provedCount() {
      return runs.stream().filter(ProfileRun::proved).count();
    }
  }

  public ProfileReport profile(List<NamedIdentity> identities, TelescopingOptions options) {
    Objects.requireNonNull(identities, "identities");
    if (identities.isEmpty()) {
      throw new IllegalArgumentException("Profiling requires at least one identity.");
    }
    TelescopingOptions effective = TelescopingOptions.normalize(options);

    List<ProfileRun> runs = new ArrayList<>(identities.size());
    for (NamedIdentity named : identities) {
      Identity identity = named.identity();
      NonterminatingProver prover = new NonterminatingProver(effective, identity.detector());
      Timing timer = Timing.start();
      ProofResult result =
          prover.prove(identity.lhs(), identity.rhsAt(named.q()), named.q(), named.nStart());
      runs.add(
          new ProfileRun(
              named.name(),
              timer.elapsedMillisPrecise(),
              result.isProved(),
              result.order(),
              result.isProved() ? null : result.message()));
    }
    return new ProfileReport(runs);
  }

  /** Every catalogue identity at {@code q = 1/3}. */
  public static List<NamedIdentity> defaultIdentities() {
    return defaultIdentities(BigRational.of(1, 3));
  }

  public static List<NamedIdentity> defaultIdentities(BigRational q) {
    List<NamedIdentity> named = new ArrayList<>();
    for (Identity identity : Identities.all()) {
      named.add(NamedIdentity.of(identity, q));
    }
    return named;
  }
}
