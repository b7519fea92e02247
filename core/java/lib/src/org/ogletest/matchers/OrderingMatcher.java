package org.ogletest.matchers;

import org.ogletest.validation.Inputs;

import org.ogletest.lang.Strings;

import java.math.BigDecimal;
import java.math.BigInteger;

// lessThan/greaterThan. Numbers are compared by value regardless of their
// boxed type; other candidates must be Comparable instances of the bound's
// class.
final
class OrderingMatcher
extends AbstractMatcher
{
    private final static Inputs inputs = new Inputs();

    static enum Direction 
    { 
        LESS( "less than" ), 
        GREATER( "greater than" );

        private final String desc;

        private Direction( String desc ) { this.desc = desc; }

        private 
        boolean 
        accepts( int cmp ) 
        { 
            return this == LESS ? cmp < 0 : cmp > 0; 
        }
    }

    private final Object bound;
    private final Direction dir;

    OrderingMatcher( Object bound,
                     Direction dir )
    {
        this.bound = inputs.notNull( bound, "bound" );
        this.dir = inputs.notNull( dir, "dir" );

        inputs.isTrue( bound instanceof Number || bound instanceof Comparable,
            "Bound is neither a number nor comparable:", bound );
        
        inputs.isFalse( 
            bound instanceof Number && toDecimal( (Number) bound ) == null,
            "Bound has no ordering:", bound );
    }

    public
    CharSequence
    getDescription()
    {
        return dir.desc + " " + Strings.inspect( bound );
    }

    private
    static
    BigDecimal
    fromDouble( double d )
    {
        if ( Double.isNaN( d ) || Double.isInfinite( d ) ) return null;
        else return new BigDecimal( d );
    }

    // returns null for values with no decimal representation (NaN, infinity)
    private
    static
    BigDecimal
    toDecimal( Number n )
    {
        if ( n instanceof BigDecimal ) return (BigDecimal) n;
        if ( n instanceof BigInteger ) return new BigDecimal( (BigInteger) n );

        if ( n instanceof Double || n instanceof Float ) 
        {
            return fromDouble( n.doubleValue() );
        }

        if ( n instanceof Long || n instanceof Integer || 
             n instanceof Short || n instanceof Byte )
        {
            return BigDecimal.valueOf( n.longValue() );
        }

        // Other Number types (adders, atomics, user types) may carry a
        // fraction that longValue() would drop
        try { return new BigDecimal( n.toString() ); }
        catch ( NumberFormatException nfe ) 
        { 
            return fromDouble( n.doubleValue() ); 
        }
    }

    private
    MatchOutcome
    matchNumber( Number candidate )
    {
        BigDecimal c = toDecimal( candidate );

        if ( c == null ) return MatchOutcome.undefined( "which is not ordered" );
        else
        {
            int cmp = c.compareTo( toDecimal( (Number) bound ) );
            return MatchOutcome.of( dir.accepts( cmp ) );
        }
    }

    @SuppressWarnings( "unchecked" )
    private
    MatchOutcome
    matchComparable( Object candidate )
    {
        if ( bound.getClass().isInstance( candidate ) )
        {
            int cmp = ( (Comparable< Object >) candidate ).compareTo( bound );
            return MatchOutcome.of( dir.accepts( cmp ) );
        }
        else
        {
            return MatchOutcome.undefined( 
                "which is not comparable to " + 
                bound.getClass().getSimpleName() );
        }
    }

    public
    MatchOutcome
    matches( Object candidate )
    {
        if ( candidate == null ) return MatchOutcome.undefined( "which is null" );

        if ( bound instanceof Number )
        {
            if ( candidate instanceof Number ) 
            {
                return matchNumber( (Number) candidate );
            }
            else return MatchOutcome.undefined( "which is not a number" );
        }
        else return matchComparable( candidate );
    }
}
