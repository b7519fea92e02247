package org.ogletest.matchers;

import org.ogletest.validation.Inputs;

final
class NotMatcher
extends AbstractMatcher
{
    private final static Inputs inputs = new Inputs();

    private final Matcher wrapped;

    NotMatcher( Matcher wrapped ) 
    { 
        this.wrapped = inputs.notNull( wrapped, "wrapped" ); 
    }

    public
    CharSequence
    getDescription()
    {
        return "not(" + wrapped.getDescription() + ")";
    }

    public
    MatchOutcome
    matches( Object candidate )
    {
        MatchOutcome res = wrapped.matches( candidate );

        switch ( res.getResult() )
        {
            case TRUE: return MatchOutcome.FALSE;
            case FALSE: return MatchOutcome.TRUE;
            default: return res;
        }
    }
}
