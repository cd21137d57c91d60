package qseries.core;

/** Why a nonterminating identity could not be proved. */
public enum ProofFailureReason {
  LHS_NOT_TERMINATING,
  NO_RECURRENCE,
  RECURRENCE_MISMATCH,
  INITIAL_CONDITION_MISMATCH;
}
