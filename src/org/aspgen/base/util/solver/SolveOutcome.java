package org.aspgen.base.util.solver;

public enum SolveOutcome
{
  SATISFIABLE,
  UNSATISFIABLE,

  /**
   * The solver stopped (at a time limit, say) before deciding.
   */
  UNKNOWN;
}
