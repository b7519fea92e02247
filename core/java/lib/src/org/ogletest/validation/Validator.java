package org.ogletest.validation;

import java.util.Arrays;
import java.util.Map;

public
abstract
class Validator
{
    private final static Inputs inputs = new Inputs();

    protected
    final
    String
    getDefaultMessage( CharSequence inputName,
                       CharSequence msg )
    {
        String res;

        if ( inputName == null && msg == null ) res = null;
        else
        {
            StringBuilder sb = new StringBuilder();
            if ( inputName != null ) 
            {
                sb.append( "Input '" ).append( inputName ).append( "' " );
            }

            res = sb.append( msg ).toString();
        }

        return res;
    }

    // Must throw or return a runtime exception built from the given message.
    // Either argument may be null.
    public
    abstract
    RuntimeException
    createException( CharSequence inputName,
                     CharSequence msg );

    // Joins message parts with single spaces. Strings.join is not used here so
    // that a failure inside join can't recurse back into this class.
    private
    CharSequence
    makeMessage( Object... message )
    {
        StringBuilder sb = new StringBuilder();

        if ( message != null )
        {
            for ( int i = 0, e = message.length; i < e; )
            {
                sb.append( message[ i ] );
                if ( ++i < e ) sb.append( ' ' );
            }
        }

        return sb;
    }
 
    // Typed to return an exception so callers can write 'throw v.fail( ... )'
    // where the compiler needs to see that control does not continue. It never
    // actually returns.
    public
    final
    RuntimeException
    fail( Object... message )
    { 
        throw createException( null, makeMessage( message ) );
    }

    public
    final
    RuntimeException
    failf( String fmt,
           Object... args )
    {
        return fail( String.format( fmt, args ) );
    }

    public
    final
    void
    isTrue( boolean b,
            Object... message )
    {
        if ( ! b ) fail( message );
    }

    public
    final
    void
    isTruef( boolean b,
             String fmt,
             Object... args )
    {
        if ( ! b ) failf( fmt, args );
    }

    public
    final
    void
    isFalse( boolean b,
             Object... message )
    {
        isTrue( ! b, message );
    }

    public
    final
    < T >
    T
    notNull( T val,
             String inputName )
    {
        if ( val == null ) throw createException( inputName, "cannot be null" );
 
        return val;
    }

    public
    final
    < T, I extends Iterable< T > >
    I
    noneNull( I vals,
              String inputName )
    {
        notNull( vals, inputName ); 

        int i = 0;
        for ( T val : vals )
        {
            isTrue( val != null, "Element", i, "of", inputName, "is null" );
            i++;
        }

        return vals;
    }
 
    public
    final
    < T >
    T[]
    noneNull( T[] vals,
              String inputName )
    {
        noneNull( Arrays.asList( notNull( vals, inputName ) ), inputName );
        return vals;
    }

    public
    final
    < K, V >
    V
    get( Map< K, V > map,
         K key,
         String mapName )
    {
        inputs.notNull( map, "map" );

        V res = map.get( key );

        if ( res == null ) 
        {
            fail( "Map '" + mapName + "' has no value for key " + key );
        }

        return res;
    }

    public
    final
    CharSequence
    notEmpty( CharSequence s,
              String inputName )
    {
        notNull( s, inputName );
        if ( s.length() == 0 ) throw createException( inputName, "is empty" );

        return s;
    }

    public
    final
    int
    nonnegativeI( int val,
                  String inputName )
    {
        if ( val < 0 ) fail( inputName, "must be nonnegative (got", val, ")" );
        return val;
    }
}
