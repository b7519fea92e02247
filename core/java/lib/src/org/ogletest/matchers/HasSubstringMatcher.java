package org.ogletest.matchers;

import org.ogletest.validation.Inputs;

import org.ogletest.lang.Strings;

final
class HasSubstringMatcher
extends AbstractMatcher
{
    private final static Inputs inputs = new Inputs();

    private final String substr;

    HasSubstringMatcher( CharSequence substr )
    {
        this.substr = inputs.notNull( substr, "substr" ).toString();
    }

    public
    CharSequence
    getDescription()
    {
        return "has substring " + Strings.inspect( substr );
    }

    public
    MatchOutcome
    matches( Object candidate )
    {
        if ( candidate instanceof CharSequence )
        {
            return MatchOutcome.of( candidate.toString().contains( substr ) );
        }
        else return MatchOutcome.undefined( "which is not a string" );
    }
}
