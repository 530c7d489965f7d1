package org.cinder.frontend;

/**
 * One significant physical line: its 1-based number, its indentation width and its text with
 * indentation, comment and trailing whitespace removed.
 */
public record SourceLine(int number, int indent, String text)
{
}
