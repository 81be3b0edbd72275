package org.aspgen.base.util.solver;

/**
 * Something that can find the answer sets of a program.
 */
public interface Solver
{
  /**
   * Solve a program.
   *
   * @param xiProgram - the program text.
   * @param xiSettings - the solve settings.
   *
   * @return the outcome, and the models found, as atom text.
   *
   * @throws SolverException if the solver can't be run, fails, or reports problems at or above the configured level.
   */
  public SolveResult solve(String xiProgram, SolveSettings xiSettings) throws SolverException;
}
