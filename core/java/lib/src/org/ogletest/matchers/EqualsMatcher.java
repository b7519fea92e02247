package org.ogletest.matchers;

import org.ogletest.lang.Strings;

import java.util.Objects;

final
class EqualsMatcher
extends AbstractMatcher
{
    private final Object expct;

    EqualsMatcher( Object expct ) { this.expct = expct; }

    public CharSequence getDescription() { return Strings.inspect( expct ); }

    // deepEquals so that arrays, including primitive arrays, compare by
    // contents
    public
    MatchOutcome
    matches( Object candidate )
    {
        return MatchOutcome.of( Objects.deepEquals( expct, candidate ) );
    }
}
