package org.ogletest.lang;

import org.ogletest.validation.Inputs;

import java.util.Arrays;
import java.util.Iterator;

public
final
class Strings
{
    private static Inputs inputs = new Inputs();

    private Strings() {}

    public
    static
    CharSequence
    join( CharSequence delim,
          Iterable< ? > toks )
    {
        inputs.notNull( delim, "delim" );
        inputs.notNull( toks, "toks" );

        StringBuilder res = new StringBuilder();

        for ( Iterator< ? > it = toks.iterator(); it.hasNext(); )
        {
            res.append( String.valueOf( it.next() ) );
            if ( it.hasNext() ) { res.append( delim ); }
        }

        return res;
    }

    public
    static
    CharSequence
    join( CharSequence delim,
          Object... toks )
    {
        inputs.notNull( toks, "toks" );
        return join( delim, Arrays.asList( toks ) );
    }

    // Renders strings and characters in double and single quotes respectively,
    // arrays by their deep contents, and everything else via String.valueOf.
    public
    static
    CharSequence
    inspect( Object obj )
    {
        if ( obj instanceof CharSequence ) 
        {
            return new StringBuilder().append( '"' ).append( obj ).append( '"' );
        }
        else if ( obj instanceof Character ) return "'" + obj + "'";
        else if ( obj instanceof Object[] ) 
        {
            return Arrays.deepToString( (Object[]) obj );
        }
        else if ( obj != null && obj.getClass().isArray() )
        {
            // primitive array; wrap it so deepToString does the work
            String s = Arrays.deepToString( new Object[] { obj } );
            return s.substring( 1, s.length() - 1 );
        }
        else return String.valueOf( obj );
    }
}
