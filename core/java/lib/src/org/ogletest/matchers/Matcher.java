package org.ogletest.matchers;

/**
 * A predicate over arbitrary candidate values which can also describe what it
 * expects. Implementations are immutable and may be invoked any number of
 * times with different candidates.
 */
public
interface Matcher
{
    /**
     * Returns a human-readable description of the values this matcher accepts,
     * such as {@code 17} or {@code or(1, 2)}.
     */
    public
    CharSequence
    getDescription();

    /**
     * Classifies {@code candidate}, which may be null. Returns {@link
     * MatchOutcome#TRUE} or {@link MatchOutcome#FALSE} when the matcher can
     * decide, and an {@link MatchResult#UNDEFINED UNDEFINED} outcome with a
     * non-empty explanation when it can't.
     */
    public
    MatchOutcome
    matches( Object candidate );
}
