package qseries.algebra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Exact linear algebra over {@link BigRational}. */
public final class LinearSystems {

  private LinearSystems() {}

  /**
   * Solves {@code A x = b} by Gauss-Jordan elimination to reduced row-echelon form.
   *
   * <p>Free variables are set to zero, so an under-determined system yields one particular
   * solution. Returns empty when the system is inconsistent.
   *
   * @param matrix row-major coefficient matrix; every row must have {@code columns} entries
   * @param rhs right-hand side, one entry per row
   * @param columns number of unknowns
   */
  public static Optional<List<BigRational>> solve(
      List<List<BigRational>> matrix, List<BigRational> rhs, int columns) {
    Objects.requireNonNull(matrix, "matrix");
    Objects.requireNonNull(rhs, "rhs");
    if (matrix.size() != rhs.size()) {
      throw new IllegalArgumentException(
          "Row count " + matrix.size() + " does not match right-hand side " + rhs.size());
    }
    int rows = matrix.size();
    BigRational[][] augmented = new BigRational[rows][columns + 1];
    for (int r = 0; r < rows; r++) {
      List<BigRational> row = matrix.get(r);
      if (row.size() != columns) {
        throw new IllegalArgumentException("Row " + r + " has " + row.size() + " columns");
      }
      for (int c = 0; c < columns; c++) {
        augmented[r][c] = row.get(c);
      }
      augmented[r][columns] = rhs.get(r);
    }

    int[] pivotColumnOfRow = new int[rows];
    int pivotRow = 0;
    for (int col = 0; col < columns && pivotRow < rows; col++) {
      int found = -1;
      for (int r = pivotRow; r < rows; r++) {
        if (!augmented[r][col].isZero()) {
          found = r;
          break;
        }
      }
      if (found < 0) {
        continue;
      }
      BigRational[] swap = augmented[found];
      augmented[found] = augmented[pivotRow];
      augmented[pivotRow] = swap;

      BigRational pivot = augmented[pivotRow][col];
      if (!pivot.isOne()) {
        for (int c = col; c <= columns; c++) {
          augmented[pivotRow][c] = augmented[pivotRow][c].divide(pivot);
        }
      }
      for (int r = 0; r < rows; r++) {
        if (r == pivotRow) {
          continue;
        }
        BigRational factor = augmented[r][col];
        if (factor.isZero()) {
          continue;
        }
        for (int c = col; c <= columns; c++) {
          augmented[r][c] = augmented[r][c].subtract(factor.multiply(augmented[pivotRow][c]));
        }
      }
      pivotColumnOfRow[pivotRow] = col;
      pivotRow++;
    }

    // rows below the last pivot are all-zero on the left
    for (int r = pivotRow; r < rows; r++) {
      if (!augmented[r][columns].isZero()) {
        return Optional.empty();
      }
    }

    List<BigRational> solution = new ArrayList<>(Collections.nCopies(columns, BigRational.ZERO));
    for (int r = 0; r < pivotRow; r++) {
      solution.set(pivotColumnOfRow[r], augmented[r][columns]);
    }
    return Optional.of(List.copyOf(solution));
  }
}
