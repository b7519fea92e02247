package org.ogletest.matchers;

import org.ogletest.validation.Inputs;

import org.ogletest.lang.Lang;

import java.util.List;

/**
 * Factory methods for the built-in matchers. Methods which accept {@code
 * Object} arguments treat any {@link Matcher} as-is and wrap every other value,
 * null included, with {@link #equalTo}.
 */
public
final
class Matchers
{
    private final static Inputs inputs = new Inputs();

    private final static Matcher ANY =
        new AbstractMatcher() {
            public CharSequence getDescription() { return "is anything"; }
            public MatchOutcome matches( Object c ) { return MatchOutcome.TRUE; }
        };

    private Matchers() {}

    public
    static
    Matcher
    asMatcher( Object val )
    {
        if ( val instanceof Matcher ) return (Matcher) val;
        else return equalTo( val );
    }

    private
    static
    List< Matcher >
    asMatchers( Object[] vals )
    {
        inputs.notNull( vals, "vals" );

        List< Matcher > res = Lang.newList( vals.length );
        for ( Object val : vals ) res.add( asMatcher( val ) );

        return res;
    }

    /**
     * Matches candidates deep-equal to {@code expct}. Never returns UNDEFINED.
     */
    public
    static
    Matcher
    equalTo( Object expct )
    {
        return new EqualsMatcher( expct );
    }

    /**
     * Logical OR over {@code vals}, evaluated in order and stopping at the
     * first result other than FALSE. An UNDEFINED result from an earlier
     * matcher is returned even if a later one would have matched, so list the
     * matchers most likely to match definitively first. With no arguments the
     * result matches nothing and is described as {@code or()}.
     */
    public
    static
    Matcher
    anyOf( Object... vals )
    {
        return new AnyOfMatcher( asMatchers( vals ) );
    }

    public
    static
    Matcher
    allOf( Object... vals )
    {
        return new AllOfMatcher( asMatchers( vals ) );
    }

    public
    static
    Matcher
    not( Object val )
    {
        return new NotMatcher( asMatcher( val ) );
    }

    public static Matcher any() { return ANY; }

    public
    static
    Matcher
    hasSubstring( CharSequence substr )
    {
        return new HasSubstringMatcher( substr );
    }

    public
    static
    Matcher
    lessThan( Object bound )
    {
        return new OrderingMatcher( bound, OrderingMatcher.Direction.LESS );
    }

    public
    static
    Matcher
    greaterThan( Object bound )
    {
        return new OrderingMatcher( bound, OrderingMatcher.Direction.GREATER );
    }
}
