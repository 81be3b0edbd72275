package org.aspgen.base.util.asp.program;

import org.aspgen.base.util.asp.grammar.Renderable;

/**
 * Something that occupies its own line(s) of a program: a rule, comment or blank line.
 */
public interface ProgramElement extends Renderable
{
  // Marker.
}
