package org.aspgen.base.util.asp.grammar;

/**
 * Something that has a canonical textual form in the ASP language.
 */
public interface Renderable
{
  /**
   * @return the canonical rendering.  Identical structures always render identically.
   */
  String render();
}
