package org.aspgen.base.util.asp.compose;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;
import java.util.regex.Pattern;

import org.aspgen.base.util.asp.grammar.Field;
import org.aspgen.base.util.asp.grammar.PredicateDefinition;
import org.aspgen.base.util.asp.grammar.Term;
import org.aspgen.base.util.asp.program.Program;

import com.google.common.base.Supplier;
import com.google.common.collect.ImmutableList;

/**
 * A unit of program generation, such as a grid or a set of symbols.
 *
 * Each module writes into its own segment of the program and (unless it is the composer's primary module) prefixes
 * the predicates it defines with its own namespace.  Subclasses typically expose their predicates through methods
 * built on {@link #cached(String, Supplier)}, so that the rules behind each predicate are generated once, on first
 * use.
 */
public abstract class Module
{
  private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z][A-Za-z0-9]*");

  private final ProgramComposer mComposer;
  private final String          mName;
  private final String          mNamespace;

  /**
   * Create a module and register it with its composer.
   *
   * @param xiComposer - the composer.
   * @param xiName - the module name (letters and digits, starting with a letter).  Used, lower-cased, as the segment
   * name and namespace.
   * @param xiPrimaryNamespace - whether this module's predicates go without a namespace prefix.
   *
   * @throws IllegalArgumentException if the name is invalid or already in use.
   */
  protected Module(ProgramComposer xiComposer, String xiName, boolean xiPrimaryNamespace)
  {
    checkArgument(xiName != null && NAME_PATTERN.matcher(xiName).matches(),
                  "Bad module name '%s': must be alphanumeric and start with a letter",
                  xiName);
    mComposer = xiComposer;
    mName = xiName.toLowerCase();
    mNamespace = xiPrimaryNamespace ? "" : mName;

    xiComposer.registerModule(this);
  }

  public String getName()
  {
    return mName;
  }

  /**
   * @return the prefix for this module's predicates, or the empty string if there isn't one.
   */
  public String getNamespace()
  {
    return mNamespace;
  }

  public ProgramComposer getComposer()
  {
    return mComposer;
  }

  protected Program getProgram()
  {
    return mComposer.getProgram();
  }

  /**
   * Hook called once, before the program is rendered, for any rules that can only be written once everything else
   * is known.
   */
  public void finalizeModule()
  {
    // Nothing to do by default.
  }

  /**
   * @return the result of the specified generator, running it only the first time this module asks for the id.
   *
   * @param xiId - identifies the result within this module.
   * @param xiGenerator - produces the result (and usually adds the rules that define it).
   *
   * @throws org.aspgen.base.util.asp.exceptions.CycleException if the generator, directly or indirectly, asks for
   * its own result.
   */
  protected <T> T cached(String xiId, Supplier<T> xiGenerator)
  {
    return mComposer.getPredicateCache().get(this, xiId, xiGenerator);
  }

  /**
   * @return a nullary predicate definition in this module's namespace.
   */
  protected PredicateDefinition define(String xiName)
  {
    return PredicateDefinition.define(xiName).inNamespace(mNamespace);
  }

  /**
   * @return a predicate definition in this module's namespace.
   */
  protected PredicateDefinition define(String xiName, String... xiFields)
  {
    return PredicateDefinition.define(xiName, xiFields).inNamespace(mNamespace);
  }

  /**
   * @return a predicate definition, with typed fields, in this module's namespace.
   */
  protected PredicateDefinition define(String xiName, Field... xiFields)
  {
    return PredicateDefinition.define(xiName, xiFields).inNamespace(mNamespace);
  }

  // Methods that write to this module's segment.

  public void fact(Term... xiHeads)
  {
    getProgram().fact(mName, xiHeads);
  }

  public void when(List<? extends Term> xiBody, Term xiHead)
  {
    getProgram().when(mName, xiBody, xiHead);
  }

  public void when(Term xiBodyLiteral, Term xiHead)
  {
    getProgram().when(mName, ImmutableList.of(xiBodyLiteral), xiHead);
  }

  public void forbid(Term... xiBody)
  {
    getProgram().forbid(mName, xiBody);
  }

  public void comment(String xiText)
  {
    getProgram().comment(mName, xiText);
  }

  public void blankLine()
  {
    getProgram().blankLine(mName);
  }

  public void section(String xiTitle)
  {
    getProgram().section(mName, xiTitle);
  }

  /**
   * Constrain a count, in this module's segment.  See
   * {@link ProgramComposer#countConstraint(String, Object, List, List, CountBound, Object)}.
   */
  public void countConstraint(Object xiCountOver,
                              List<? extends Term> xiConditions,
                              List<? extends Term> xiWhen,
                              CountBound xiBound,
                              Object xiValue)
  {
    mComposer.countConstraint(mName, xiCountOver, xiConditions, xiWhen, xiBound, xiValue);
  }

  @Override
  public String toString()
  {
    return getClass().getSimpleName() + "[" + mName + "]";
  }
}
