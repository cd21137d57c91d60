package qseries.model;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Which parts of a series move when the outer index {@code n} advances.
 *
 * <p>{@code upperPositions} lists the upper parameters that carry {@code q^{-n}}; {@code
 * argumentDependent} marks an argument of the form {@code z * q^n}.
 */
public record IndexDependence(SortedSet<Integer> upperPositions, boolean argumentDependent) {

  public IndexDependence {
    Objects.requireNonNull(upperPositions, "upperPositions");
    for (Integer position : upperPositions) {
      if (position == null || position < 0) {
        throw new IllegalArgumentException("Invalid upper parameter position: " + position);
      }
    }
    upperPositions = Collections.unmodifiableSortedSet(new TreeSet<>(upperPositions));
  }

  public static IndexDependence of(Set<Integer> upperPositions, boolean argumentDependent) {
    return new IndexDependence(new TreeSet<>(upperPositions), argumentDependent);
  }

  public static IndexDependence none() {
    return of(Set.of(), false);
  }

  public boolean dependsOnUpper(int position) {
    return upperPositions.contains(position);
  }
}
