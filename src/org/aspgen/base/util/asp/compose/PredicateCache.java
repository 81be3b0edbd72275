package org.aspgen.base.util.asp.compose;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.aspgen.base.util.asp.exceptions.CycleException;
import org.aspgen.base.util.asp.program.Program;

import com.google.common.base.Supplier;

/**
 * Memoization of predicate generators.
 *
 * Each (module instance, id) pair is generated at most once.  The generator typically adds rules to the program and
 * returns a handle (a predicate definition, say) that callers use to refer to what it generated.  Generators may ask
 * for other cached results, but a generator that ends up asking for its own result fails with a
 * {@link CycleException}.  If a generator fails, the program is rolled back to its state before the generator ran and
 * nothing is cached, so a later request runs the generator afresh.
 */
public final class PredicateCache
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Cache key.  Modules are compared by identity, so two equal-looking modules never share results.
   */
  private static final class Key
  {
    private final Module mModule;
    private final String mId;

    Key(Module xiModule, String xiId)
    {
      mModule = xiModule;
      mId = xiId;
    }

    @Override
    public boolean equals(Object xiOther)
    {
      if (!(xiOther instanceof Key))
      {
        return false;
      }
      Key lOther = (Key)xiOther;
      return (lOther.mModule == mModule) && lOther.mId.equals(mId);
    }

    @Override
    public int hashCode()
    {
      return 31 * System.identityHashCode(mModule) + mId.hashCode();
    }

    @Override
    public String toString()
    {
      return mModule.getName() + "." + mId;
    }
  }

  private final Program          mProgram;
  private final Map<Key, Object> mEntries      = new HashMap<>();
  private final List<Key>        mInsertOrder  = new ArrayList<>();
  private final Set<Key>         mInProgress   = new LinkedHashSet<>();

  public PredicateCache(Program xiProgram)
  {
    mProgram = xiProgram;
  }

  /**
   * @return the cached result for the specified key, running the generator to produce it if necessary.
   *
   * @param xiModule - the module that owns the result.
   * @param xiId - the identifier of the result within the module.
   * @param xiGenerator - the generator.
   *
   * @throws CycleException if the result is already being generated.
   */
  @SuppressWarnings("unchecked")
  public <T> T get(Module xiModule, String xiId, Supplier<T> xiGenerator)
  {
    Key lKey = new Key(xiModule, xiId);
    if (mEntries.containsKey(lKey))
    {
      return (T)mEntries.get(lKey);
    }

    if (mInProgress.contains(lKey))
    {
      List<String> lPath = new ArrayList<>();
      for (Key lPending : mInProgress)
      {
        lPath.add(lPending.toString());
      }
      lPath.add(lKey.toString());
      throw new CycleException(lPath);
    }

    LOGGER.debug("Generating " + lKey);
    Program.Checkpoint lCheckpoint = mProgram.checkpoint();
    int lCacheSize = mInsertOrder.size();
    boolean lSuccess = false;
    mInProgress.add(lKey);
    try
    {
      T lResult = xiGenerator.get();
      mEntries.put(lKey, lResult);
      mInsertOrder.add(lKey);
      lSuccess = true;
      return lResult;
    }
    finally
    {
      mInProgress.remove(lKey);
      if (!lSuccess)
      {
        LOGGER.debug("Generation of " + lKey + " failed - rolling back");
        mProgram.rollback(lCheckpoint);
        while (mInsertOrder.size() > lCacheSize)
        {
          mEntries.remove(mInsertOrder.remove(mInsertOrder.size() - 1));
        }
      }
    }
  }

  /**
   * @return whether the specified result has been generated.
   */
  public boolean contains(Module xiModule, String xiId)
  {
    return mEntries.containsKey(new Key(xiModule, xiId));
  }

  /**
   * @return the number of cached results.
   */
  public int size()
  {
    return mEntries.size();
  }
}
