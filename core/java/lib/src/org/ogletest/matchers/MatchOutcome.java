package org.ogletest.matchers;

import org.ogletest.validation.Inputs;

public
final
class MatchOutcome
{
    private final static Inputs inputs = new Inputs();

    public final static MatchOutcome TRUE = 
        new MatchOutcome( MatchResult.TRUE, "" );

    public final static MatchOutcome FALSE = 
        new MatchOutcome( MatchResult.FALSE, "" );

    private final MatchResult result;
    private final String message;

    private
    MatchOutcome( MatchResult result,
                  String message )
    {
        this.result = result;
        this.message = message;
    }

    public MatchResult getResult() { return result; }

    // Empty unless getResult() is UNDEFINED
    public String getMessage() { return message; }

    public boolean isTrue() { return result == MatchResult.TRUE; }

    @Override
    public
    String
    toString()
    {
        if ( message.isEmpty() ) return result.name();
        else return result.name() + ": " + message;
    }

    public
    static
    MatchOutcome
    of( boolean matched )
    {
        return matched ? TRUE : FALSE;
    }

    public
    static
    MatchOutcome
    undefined( CharSequence message )
    {
        inputs.notEmpty( message, "message" );
        return new MatchOutcome( MatchResult.UNDEFINED, message.toString() );
    }
}
