package org.aspgen.base.util.asp.compose;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.aspgen.base.util.asp.grammar.Aggregate;
import org.aspgen.base.util.asp.grammar.AggregateElement;
import org.aspgen.base.util.asp.grammar.Comparison;
import org.aspgen.base.util.asp.grammar.Count;
import org.aspgen.base.util.asp.grammar.Term;
import org.aspgen.base.util.asp.grammar.Terms;
import org.aspgen.base.util.asp.grammar.Variable;
import org.aspgen.base.util.asp.program.Program;
import org.aspgen.base.util.config.AspConfiguration;
import org.aspgen.base.util.config.AspConfiguration.CfgItem;
import org.aspgen.base.util.solver.DecodedModel;
import org.aspgen.base.util.solver.ModelDecoder;
import org.aspgen.base.util.solver.SolveResult;
import org.aspgen.base.util.solver.SolveSettings;
import org.aspgen.base.util.solver.Solver;
import org.aspgen.base.util.solver.SolverException;

import com.google.common.collect.ImmutableList;

/**
 * Coordinates a set of {@link Module}s writing into a single {@link Program}.
 *
 * The composer owns the program, the registry of modules (by name) and the memoization cache the modules share.
 */
public class ProgramComposer
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final List<String> COUNT_VARIABLE_NAMES = ImmutableList.of("N", "C", "Count");

  private final String              mName;
  private final Program             mProgram;
  private final PredicateCache      mCache;
  private final Map<String, Module> mModules = new LinkedHashMap<>();
  private boolean                   mFinalized;

  /**
   * @param xiName - the name of the program, which is used for its header comment.  The program's default segment
   *                 is named by the configuration.
   */
  public ProgramComposer(String xiName)
  {
    mName = xiName;
    mProgram = new Program(xiName, AspConfiguration.getCfgStr(CfgItem.DEFAULT_SEGMENT));
    mCache = new PredicateCache(mProgram);
  }

  public String getName()
  {
    return mName;
  }

  public Program getProgram()
  {
    return mProgram;
  }

  public PredicateCache getPredicateCache()
  {
    return mCache;
  }

  /**
   * Register a module.  Modules register themselves on construction, so there's no need to call this directly.
   *
   * @throws IllegalArgumentException if a module with the same name is already registered.
   */
  void registerModule(Module xiModule)
  {
    checkArgument(!mModules.containsKey(xiModule.getName()),
                  "Module with name '%s' is already registered",
                  xiModule.getName());
    mModules.put(xiModule.getName(), xiModule);
    mProgram.addSegment(xiModule.getName());
    LOGGER.debug("Registered " + xiModule);
  }

  /**
   * @return the named module.
   *
   * @throws IllegalArgumentException if there's no such module.
   */
  public Module getModule(String xiName)
  {
    Module lModule = mModules.get(xiName);
    checkArgument(lModule != null, "No module named '%s' is registered", xiName);
    return lModule;
  }

  public Collection<Module> getModules()
  {
    return Collections.unmodifiableCollection(mModules.values());
  }

  /**
   * Constrain the number of distinct values of a term for which conditions hold.  For example, "exactly 1 X such
   * that p(X)" becomes
   *
   * <pre>
   *   :- N = #count{X : p(X)}, N != 1.
   * </pre>
   *
   * @param xiSegment - the segment to add the constraint to.
   * @param xiCountOver - the term being counted.
   * @param xiConditions - the conditions under which an instance counts.
   * @param xiWhen - further body literals that limit where the constraint applies.  May be empty.
   * @param xiBound - the kind of bound.
   * @param xiValue - the bound value.
   */
  public void countConstraint(String xiSegment,
                              Object xiCountOver,
                              List<? extends Term> xiConditions,
                              List<? extends Term> xiWhen,
                              CountBound xiBound,
                              Object xiValue)
  {
    Term lCountOver = Terms.coerce(xiCountOver);

    Set<String> lUsed = new LinkedHashSet<>(lCountOver.getVariableNames());
    for (Term lTerm : xiConditions)
    {
      lUsed.addAll(lTerm.getVariableNames());
    }
    for (Term lTerm : xiWhen)
    {
      lUsed.addAll(lTerm.getVariableNames());
    }
    Variable lCount = uniqueVariable(lUsed, COUNT_VARIABLE_NAMES);

    Aggregate lAggregate = Count.of(AggregateElement.of(lCountOver)
                                                    .when(xiConditions.toArray(new Term[xiConditions.size()])));

    List<Term> lBody = new ArrayList<>(xiWhen);
    lBody.add(lAggregate.assignTo(lCount));
    lBody.add(Comparison.of(lCount, xiBound.getViolation(), xiValue));
    mProgram.forbid(xiSegment, lBody.toArray(new Term[lBody.size()]));
  }

  /**
   * @return a variable whose name isn't in use: the first free preferred name, or else the last preferred name with
   * the lowest free numeric suffix.
   *
   * @param xiUsed - the names already in use.
   * @param xiPreferred - the preferred names, in order of preference.
   */
  public static Variable uniqueVariable(Set<String> xiUsed, List<String> xiPreferred)
  {
    checkArgument(!xiPreferred.isEmpty(), "Need at least one preferred name");
    for (String lName : xiPreferred)
    {
      if (!xiUsed.contains(lName))
      {
        return new Variable(lName);
      }
    }

    String lBase = xiPreferred.get(xiPreferred.size() - 1);
    int lSuffix = 1;
    while (xiUsed.contains(lBase + lSuffix))
    {
      lSuffix++;
    }
    return new Variable(lBase + lSuffix);
  }

  /**
   * Give every module the chance to add its final rules.  Only the first call has any effect.
   */
  public void finalizeModules()
  {
    if (!mFinalized)
    {
      mFinalized = true;
      for (Module lModule : mModules.values())
      {
        lModule.finalizeModule();
      }
    }
  }

  /**
   * @return the program text, after finalizing the modules.
   */
  public String render()
  {
    finalizeModules();
    return mProgram.render();
  }

  /**
   * Solve the program.
   *
   * @param xiSolver - the solver to use.
   * @param xiSettings - the solve settings.
   *
   * @return the models found, decoded into predicates.
   *
   * @throws SolverException if the solver fails or reports problems at or above the configured level.
   */
  public List<DecodedModel> solve(Solver xiSolver, SolveSettings xiSettings) throws SolverException
  {
    SolveResult lResult = xiSolver.solve(render(), xiSettings);
    LOGGER.info(mName + ": " + lResult);

    ModelDecoder lDecoder = new ModelDecoder(mProgram.getSymbolTable());
    List<DecodedModel> lModels = new ArrayList<>();
    for (List<String> lAtoms : lResult.getModels())
    {
      lModels.add(lDecoder.decode(lAtoms));
    }
    return lModels;
  }
}
