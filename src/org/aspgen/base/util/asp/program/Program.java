package org.aspgen.base.util.asp.program;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.WordUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.aspgen.base.util.asp.exceptions.PositionException;
import org.aspgen.base.util.asp.exceptions.SafetyException;
import org.aspgen.base.util.asp.exceptions.UnregisteredConstantException;
import org.aspgen.base.util.asp.grammar.ConditionalLiteral;
import org.aspgen.base.util.asp.grammar.Predicate;
import org.aspgen.base.util.asp.grammar.PredicateDefinition;
import org.aspgen.base.util.asp.grammar.SymbolicConstant;
import org.aspgen.base.util.asp.grammar.Term;
import org.aspgen.base.validator.ArityValidator;
import org.aspgen.base.validator.ConstantRegistrationValidator;
import org.aspgen.base.validator.RuleValidator;
import org.aspgen.base.validator.SafetyValidator;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * A complete ASP program: rules, comments and blank lines arranged in named segments, plus the registered constants
 * and predicate definitions they use.
 *
 * Rules are checked for safety, constant registration and arity as they're added.  A rule that fails any check is
 * not added, and nothing about the program changes.  {@link #render()} produces the program text, deterministically,
 * with <tt>#const</tt> directives first and <tt>#show</tt> directives (derived from the predicates used) last.
 */
public class Program
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Segment that rules go into when no segment is named, unless the program is created with another.
   */
  public static final String DEFAULT_SEGMENT = "Rules";

  private static final List<RuleValidator> VALIDATORS = ImmutableList.of(new SafetyValidator(),
                                                                          new ConstantRegistrationValidator(),
                                                                          new ArityValidator());

  private final String                            mHeader;
  private final String                            mDefaultSegment;
  private final Map<String, List<ProgramElement>> mSegments       = new LinkedHashMap<>();
  private final SymbolTable                       mSymbols        = new SymbolTable();
  private final Map<String, ConditionalLiteral>   mShowConditions = new LinkedHashMap<>();

  /**
   * Create an empty program with no header comment.
   */
  public Program()
  {
    this(null);
  }

  /**
   * Create an empty program.
   *
   * @param xiHeader - a comment to put at the top of the program, or null for none.
   */
  public Program(String xiHeader)
  {
    this(xiHeader, DEFAULT_SEGMENT);
  }

  /**
   * Create an empty program.
   *
   * @param xiHeader         - a comment to put at the top of the program, or null for none.
   * @param xiDefaultSegment - name of the segment that rules go into when no segment is named.
   */
  public Program(String xiHeader, String xiDefaultSegment)
  {
    checkArgument(!StringUtils.isBlank(xiDefaultSegment), "Default segment name must not be blank");
    mHeader = StringUtils.isBlank(xiHeader) ? null : xiHeader;
    mDefaultSegment = xiDefaultSegment;
    mSegments.put(mDefaultSegment, new ArrayList<ProgramElement>());
  }

  public String getHeader()
  {
    return mHeader;
  }

  public String getDefaultSegment()
  {
    return mDefaultSegment;
  }

  public SymbolTable getSymbolTable()
  {
    return mSymbols;
  }

  //---------------------------------------------------------------------------------------------------------------
  // Segments
  //---------------------------------------------------------------------------------------------------------------

  /**
   * Add a new, empty segment.  Segments render in the order they're added.
   *
   * @param xiName - the segment name.
   *
   * @throws IllegalArgumentException if there's already a segment with this name.
   */
  public void addSegment(String xiName)
  {
    checkArgument(StringUtils.isNotBlank(xiName), "Segment name may not be blank");
    checkArgument(!mSegments.containsKey(xiName), "Segment '%s' already exists", xiName);
    mSegments.put(xiName, new ArrayList<ProgramElement>());
  }

  public boolean hasSegment(String xiName)
  {
    return mSegments.containsKey(xiName);
  }

  public List<String> getSegmentNames()
  {
    return ImmutableList.copyOf(mSegments.keySet());
  }

  /**
   * @return the elements of the named segment, in order.
   */
  public List<ProgramElement> getElements(String xiSegment)
  {
    List<ProgramElement> lElements = mSegments.get(xiSegment);
    return (lElements == null) ? Collections.<ProgramElement>emptyList() : Collections.unmodifiableList(lElements);
  }

  /**
   * @return every rule in the program, in rendering order.
   */
  public List<Rule> getRules()
  {
    List<Rule> lRules = new ArrayList<>();
    for (List<ProgramElement> lElements : mSegments.values())
    {
      for (ProgramElement lElement : lElements)
      {
        if (lElement instanceof Rule)
        {
          lRules.add((Rule)lElement);
        }
      }
    }
    return lRules;
  }

  private List<ProgramElement> segment(String xiName)
  {
    List<ProgramElement> lElements = mSegments.get(xiName);
    if (lElements == null)
    {
      lElements = new ArrayList<>();
      mSegments.put(xiName, lElements);
    }
    return lElements;
  }

  //---------------------------------------------------------------------------------------------------------------
  // Registration
  //---------------------------------------------------------------------------------------------------------------

  /**
   * Register a symbolic constant with an integer default.
   *
   * @return the term for referring to the constant in rules.
   *
   * @throws org.aspgen.base.util.asp.exceptions.DuplicateRegistrationException if it's already registered with a
   * different default.
   */
  public SymbolicConstant registerConstant(String xiName, int xiDefault)
  {
    return mSymbols.registerConstant(xiName, xiDefault);
  }

  /**
   * Register a symbolic constant with a string default.
   *
   * @return the term for referring to the constant in rules.
   *
   * @throws org.aspgen.base.util.asp.exceptions.DuplicateRegistrationException if it's already registered with a
   * different default.
   */
  public SymbolicConstant registerConstant(String xiName, String xiDefault)
  {
    return mSymbols.registerConstant(xiName, xiDefault);
  }

  /**
   * Override the value of a registered constant.
   *
   * @throws org.aspgen.base.util.asp.exceptions.UnregisteredConstantException if it isn't registered.
   */
  public void overrideConstant(String xiName, int xiValue)
  {
    mSymbols.overrideConstant(xiName, xiValue);
  }

  /**
   * Override the value of a registered constant.
   *
   * @throws org.aspgen.base.util.asp.exceptions.UnregisteredConstantException if it isn't registered.
   */
  public void overrideConstant(String xiName, String xiValue)
  {
    mSymbols.overrideConstant(xiName, xiValue);
  }

  /**
   * Register a predicate definition up front.  Definitions are also registered automatically on first use.
   *
   * @throws org.aspgen.base.util.asp.exceptions.ArityMismatchException if the name is registered with another arity.
   * @throws org.aspgen.base.util.asp.exceptions.DuplicateRegistrationException if the name is registered with other
   * metadata.
   */
  public void registerPredicate(PredicateDefinition xiDefinition)
  {
    mSymbols.registerPredicate(xiDefinition);
  }

  /**
   * Show a predicate only where a condition holds, <tt>#show p(X) : q(X).</tt>, in place of its plain
   * <tt>#show p/n.</tt> directive.
   *
   * @param xiDefinition - the predicate.
   * @param xiCondition - the conditional literal.  Its head must be an instance of the predicate, and its conditions
   *                      must bind every variable in the head.
   */
  public void showWhen(PredicateDefinition xiDefinition, ConditionalLiteral xiCondition)
  {
    if (!(xiCondition.getHead() instanceof Predicate) ||
        !((Predicate)xiCondition.getHead()).getDefinition().getName().equals(xiDefinition.getName()))
    {
      throw new PositionException("The head of a show condition for " + xiDefinition.getName() +
                                  " must be an instance of it", xiCondition);
    }

    // The condition must bind every variable in the head, as the body of the equivalent rule would.
    Set<String> lUnsafe = SafetyValidator.findUnsafeVariables(new Rule(xiCondition.getHead(),
                                                                        xiCondition.getConditions()));
    if (!lUnsafe.isEmpty())
    {
      throw new SafetyException(xiCondition, lUnsafe);
    }

    // Register nothing until the condition passes.
    SymbolTable lScratch = mSymbols.copy();
    List<Predicate> lPredicates = new ArrayList<>();
    xiCondition.collect(Predicate.class, lPredicates);
    for (Predicate lPredicate : lPredicates)
    {
      lScratch.registerPredicate(lPredicate.getDefinition());
    }
    List<SymbolicConstant> lConstants = new ArrayList<>();
    xiCondition.collect(SymbolicConstant.class, lConstants);
    for (SymbolicConstant lConstant : lConstants)
    {
      if (!mSymbols.isConstantRegistered(lConstant.getName()))
      {
        throw new UnregisteredConstantException(lConstant.getName(), xiCondition);
      }
    }

    mSymbols.restore(lScratch);
    mShowConditions.put(xiDefinition.getName(), xiCondition);
  }

  //---------------------------------------------------------------------------------------------------------------
  // Adding elements
  //---------------------------------------------------------------------------------------------------------------

  /**
   * Add a rule to the default segment.
   *
   * @throws org.aspgen.base.util.asp.exceptions.AspException if the rule is invalid in this program.
   */
  public void addRule(Rule xiRule)
  {
    addRules(mDefaultSegment, ImmutableList.of(xiRule));
  }

  /**
   * Add a rule to the named segment, creating the segment if necessary.
   *
   * @throws org.aspgen.base.util.asp.exceptions.AspException if the rule is invalid in this program.
   */
  public void addRule(String xiSegment, Rule xiRule)
  {
    addRules(xiSegment, ImmutableList.of(xiRule));
  }

  /**
   * Add several rules to the named segment.  Either all of them are added or, if any is invalid, none is.
   *
   * @throws org.aspgen.base.util.asp.exceptions.AspException if any rule is invalid in this program.
   */
  public void addRules(String xiSegment, List<Rule> xiRules)
  {
    // Validate everything against a scratch copy of the symbol table, so that definitions introduced by earlier rules
    // in the batch are seen by later ones.
    SymbolTable lScratch = mSymbols.copy();
    for (Rule lRule : xiRules)
    {
      for (RuleValidator lValidator : VALIDATORS)
      {
        lValidator.checkValidity(lRule, lScratch);
      }
      for (Predicate lPredicate : lRule.collect(Predicate.class))
      {
        lScratch.registerPredicate(lPredicate.getDefinition());
      }
    }

    mSymbols.restore(lScratch);
    List<ProgramElement> lSegment = segment(xiSegment);
    for (Rule lRule : xiRules)
    {
      LOGGER.debug("Adding to " + xiSegment + ": " + lRule);
      lSegment.add(lRule);
    }
  }

  /**
   * Add facts to the default segment.
   */
  public void fact(Term... xiHeads)
  {
    fact(mDefaultSegment, xiHeads);
  }

  /**
   * Add facts to the named segment.  Either all are added or none is.
   */
  public void fact(String xiSegment, Term... xiHeads)
  {
    List<Rule> lRules = new ArrayList<>();
    for (Term lHead : xiHeads)
    {
      lRules.add(Rule.fact(lHead));
    }
    addRules(xiSegment, lRules);
  }

  /**
   * Add the rule <tt>head :- body.</tt> to the default segment.
   */
  public void when(List<? extends Term> xiBody, Term xiHead)
  {
    when(mDefaultSegment, xiBody, xiHead);
  }

  /**
   * Add the rule <tt>head :- literal.</tt> to the default segment.
   */
  public void when(Term xiBodyLiteral, Term xiHead)
  {
    when(mDefaultSegment, ImmutableList.of(xiBodyLiteral), xiHead);
  }

  /**
   * Add the rule <tt>head :- body.</tt> to the named segment.
   */
  public void when(String xiSegment, List<? extends Term> xiBody, Term xiHead)
  {
    addRule(xiSegment, new Rule(xiHead, xiBody));
  }

  /**
   * Add the constraint <tt>:- body.</tt> to the default segment.
   */
  public void forbid(Term... xiBody)
  {
    forbid(mDefaultSegment, xiBody);
  }

  /**
   * Add the constraint <tt>:- body.</tt> to the named segment.
   */
  public void forbid(String xiSegment, Term... xiBody)
  {
    addRule(xiSegment, Rule.constraint(xiBody));
  }

  public void comment(String xiText)
  {
    comment(mDefaultSegment, xiText);
  }

  public void comment(String xiSegment, String xiText)
  {
    segment(xiSegment).add(new Comment(xiText));
  }

  public void blankLine()
  {
    blankLine(mDefaultSegment);
  }

  public void blankLine(String xiSegment)
  {
    segment(xiSegment).add(BlankLine.INSTANCE);
  }

  /**
   * Start a new section of the default segment: a blank line (unless the segment is empty) and a comment.
   */
  public void section(String xiTitle)
  {
    section(mDefaultSegment, xiTitle);
  }

  /**
   * Start a new section of the named segment: a blank line (unless the segment is empty) and a comment.
   */
  public void section(String xiSegment, String xiTitle)
  {
    List<ProgramElement> lSegment = segment(xiSegment);
    if (!lSegment.isEmpty())
    {
      lSegment.add(BlankLine.INSTANCE);
    }
    lSegment.add(new Comment(xiTitle));
  }

  //---------------------------------------------------------------------------------------------------------------
  // Checkpoints
  //---------------------------------------------------------------------------------------------------------------

  /**
   * An opaque snapshot of a program's state, for {@link Program#rollback(Checkpoint)}.
   */
  public static final class Checkpoint
  {
    private final Program                         mProgram;
    private final Map<String, Integer>            mSegmentSizes;
    private final SymbolTable                     mSymbols;
    private final Map<String, ConditionalLiteral> mShowConditions;

    private Checkpoint(Program xiProgram)
    {
      mProgram = xiProgram;
      mSegmentSizes = new LinkedHashMap<>();
      for (Entry<String, List<ProgramElement>> lEntry : xiProgram.mSegments.entrySet())
      {
        mSegmentSizes.put(lEntry.getKey(), lEntry.getValue().size());
      }
      mSymbols = xiProgram.mSymbols.copy();
      mShowConditions = new LinkedHashMap<>(xiProgram.mShowConditions);
    }
  }

  /**
   * @return a checkpoint of the current state.
   */
  public Checkpoint checkpoint()
  {
    return new Checkpoint(this);
  }

  /**
   * Undo everything done to this program since the specified checkpoint was taken.
   *
   * @param xiCheckpoint - a checkpoint of this program.
   */
  public void rollback(Checkpoint xiCheckpoint)
  {
    checkArgument(xiCheckpoint.mProgram == this, "Checkpoint belongs to a different program");

    mSegments.keySet().retainAll(xiCheckpoint.mSegmentSizes.keySet());
    for (Entry<String, Integer> lEntry : xiCheckpoint.mSegmentSizes.entrySet())
    {
      List<ProgramElement> lElements = mSegments.get(lEntry.getKey());
      lElements.subList(lEntry.getValue(), lElements.size()).clear();
    }
    mSymbols.restore(xiCheckpoint.mSymbols);
    mShowConditions.clear();
    mShowConditions.putAll(xiCheckpoint.mShowConditions);
  }

  //---------------------------------------------------------------------------------------------------------------
  // Rendering
  //---------------------------------------------------------------------------------------------------------------

  /**
   * @return the shown predicate definitions, in the order the program first uses them.
   */
  public List<PredicateDefinition> getShownPredicates()
  {
    List<PredicateDefinition> lShown = new ArrayList<>();
    for (PredicateDefinition lDefinition : getUsedPredicates())
    {
      if (lDefinition.isShown())
      {
        lShown.add(lDefinition);
      }
    }
    return lShown;
  }

  private Set<PredicateDefinition> getUsedPredicates()
  {
    Set<PredicateDefinition> lUsed = new LinkedHashSet<>();
    for (Rule lRule : getRules())
    {
      for (Predicate lPredicate : lRule.collect(Predicate.class))
      {
        lUsed.add(lPredicate.getDefinition());
      }
    }
    return lUsed;
  }

  /**
   * @return the program text.  Rendering doesn't change the program, so repeated calls return identical text.
   */
  public String render()
  {
    List<String> lLines = new ArrayList<>();

    if (mHeader != null)
    {
      lLines.add(new Comment(mHeader).render());
    }

    for (ConstantDefinition lConstant : mSymbols.getConstants())
    {
      lLines.add(lConstant.render());
    }

    int lNonEmpty = 0;
    for (List<ProgramElement> lElements : mSegments.values())
    {
      if (!lElements.isEmpty())
      {
        lNonEmpty++;
      }
    }

    boolean lFirstSegment = true;
    for (Entry<String, List<ProgramElement>> lEntry : mSegments.entrySet())
    {
      if (lEntry.getValue().isEmpty())
      {
        continue;
      }

      if (!lLines.isEmpty() && (lFirstSegment || lNonEmpty > 1))
      {
        lLines.add("");
      }
      if (lNonEmpty > 1)
      {
        lLines.add("% ===== " + WordUtils.capitalizeFully(lEntry.getKey().replace('_', ' ')) + " =====");
      }
      for (ProgramElement lElement : lEntry.getValue())
      {
        lLines.add(lElement.render());
      }
      lFirstSegment = false;
    }

    List<String> lShowLines = renderShowDirectives();
    if (!lShowLines.isEmpty())
    {
      if (!lLines.isEmpty())
      {
        lLines.add("");
      }
      lLines.addAll(lShowLines);
    }

    if (lLines.isEmpty())
    {
      return "";
    }
    return Joiner.on('\n').join(lLines) + "\n";
  }

  private List<String> renderShowDirectives()
  {
    Set<PredicateDefinition> lUsed = getUsedPredicates();
    if (lUsed.isEmpty() && mShowConditions.isEmpty())
    {
      return Collections.emptyList();
    }

    List<String> lLines = new ArrayList<>();
    lLines.add("#show.");

    Set<String> lDone = new LinkedHashSet<>();
    for (PredicateDefinition lDefinition : lUsed)
    {
      ConditionalLiteral lCondition = mShowConditions.get(lDefinition.getName());
      if (lCondition != null)
      {
        lLines.add("#show " + lCondition.render() + ".");
        lDone.add(lDefinition.getName());
      }
      else if (lDefinition.isShown())
      {
        lLines.add("#show " + lDefinition.getSignature() + ".");
      }
    }

    for (Entry<String, ConditionalLiteral> lEntry : mShowConditions.entrySet())
    {
      if (!lDone.contains(lEntry.getKey()))
      {
        lLines.add("#show " + lEntry.getValue().render() + ".");
      }
    }

    return lLines;
  }

  @Override
  public String toString()
  {
    return render();
  }
}
