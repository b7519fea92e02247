package org.ogletest.matchers;

import org.ogletest.validation.Inputs;

import org.ogletest.lang.Lang;
import org.ogletest.lang.Strings;

import java.util.List;

// Base for matchers which evaluate a fixed list of wrapped matchers in order
// and stop at the first outcome other than the one named by passResult().
abstract
class CompositeMatcher
extends AbstractMatcher
{
    private final static Inputs inputs = new Inputs();

    private final String name;
    private final List< Matcher > wrapped;

    CompositeMatcher( String name,
                      List< Matcher > wrapped )
    {
        this.name = inputs.notNull( name, "name" );
        this.wrapped = 
            Lang.unmodifiableCopy( inputs.noneNull( wrapped, "wrapped" ) );
    }

    final List< Matcher > wrapped() { return wrapped; }

    // the result that lets evaluation continue to the next wrapped matcher
    abstract
    MatchResult
    passResult();

    public
    final
    CharSequence
    getDescription()
    {
        List< CharSequence > descs = Lang.newList( wrapped.size() );
        for ( Matcher m : wrapped ) descs.add( m.getDescription() );

        return new StringBuilder().
            append( name ).
            append( '(' ).
            append( Strings.join( ", ", descs ) ).
            append( ')' );
    }

    public
    final
    MatchOutcome
    matches( Object candidate )
    {
        for ( Matcher m : wrapped )
        {
            MatchOutcome res = m.matches( candidate );
            if ( res.getResult() != passResult() ) return res;
        }

        return passResult() == MatchResult.TRUE 
            ? MatchOutcome.TRUE : MatchOutcome.FALSE;
    }
}
