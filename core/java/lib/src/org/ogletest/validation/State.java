package org.ogletest.validation;

import java.util.List;

public
class State
extends Validator
{
    public
    IllegalStateException
    createException( CharSequence inputName,
                     CharSequence msg )
    {
        return new IllegalStateException( getDefaultMessage( inputName, msg ) );
    }

    // Abbreviated notNull for inline and test assertions, where there is no
    // meaningful input name to report.
    public
    final
    < T >
    T
    notNull( T obj )
    {
        isFalse( obj == null, "Unexpected null value" );
        return obj;
    }

    // Fails if exactly one of expct and actual is null. Returns true when both
    // are non-null, so callers can guard a deeper comparison:
    //
    //      if ( sameNullity( o1, o2 ) ) doSomeDeeperCheck( o1, o2 );
    //
    public
    final
    boolean
    sameNullity( Object expct,
                 Object actual )
    {
        if ( ( expct == null ) != ( actual == null ) )
        {
            if ( expct == null ) 
            {
                fail( "'expct' is null, but 'actual' is:", actual );
            }
            else fail( "'actual' is null, but 'expct' is:", expct );
        }
        
        return expct != null;
    }

    public
    final
    void
    equal( Object expct,
           Object actual,
           Object... msg )
    {
        if ( sameNullity( expct, actual ) && ( ! expct.equals( actual ) ) )
        {
            if ( msg == null || msg.length == 0 )
            {
                fail( "Objects are not equal; expected", expct, "but got", 
                    actual );
            }
            else fail( msg );
        }
    }

    public
    final
    void
    equalInt( int expct,
              int actual,
              Object... msg )
    {
        if ( expct != actual )
        {
            if ( msg == null || msg.length == 0 )
            {
                fail( "Expected", expct, "but got", actual );
            }
            else fail( msg );
        }
    }

    public
    final
    void
    equalString( CharSequence expct,
                 CharSequence actual )
    {
        if ( sameNullity( expct, actual ) )
        {
            isTruef( expct.toString().equals( actual.toString() ),
                "Strings differ; expected '%s' but got '%s'", expct, actual );
        }
    }

    public
    final
    < T >
    T
    getOnly( List< T > l,
             String listName )
    {
        notNull( l, listName );
        equalInt( 1, l.size(), 
            "Expected exactly one element in", listName, "but got", l );

        return l.get( 0 );
    }
}
