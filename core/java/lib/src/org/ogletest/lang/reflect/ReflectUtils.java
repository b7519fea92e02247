package org.ogletest.lang.reflect;

import org.ogletest.validation.Inputs;
import org.ogletest.validation.State;

import org.ogletest.lang.Lang;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;

import java.util.Arrays;
import java.util.List;

public
final
class ReflectUtils
{
    private static Inputs inputs = new Inputs();
    private static State state = new State();

    private ReflectUtils() {}

    // Throws the target of ite as-is, so that callers see the throwable the
    // invoked code raised rather than the reflection wrapper.
    public
    static
    void
    rethrow( InvocationTargetException ite )
        throws Exception
    {
        Throwable cause = state.notNull( ite.getCause() );
        
        state.isTrue( cause instanceof Error || cause instanceof Exception );

        if ( cause instanceof Error ) throw (Error) cause;
        else throw (Exception) cause;
    }

    public
    static
    Object
    invoke( Method m,
            Object obj,
            Object... args )
        throws Exception
    {
        inputs.notNull( m, "m" );

        Object res = null;

        try { res = m.invoke( obj, args ); }
        catch ( InvocationTargetException ite ) { rethrow( ite ); }

        return res;
    }

    public
    static
    < T >
    T
    invoke( Constructor< T > c,
            Object... args )
        throws Exception
    {
        inputs.notNull( c, "c" );

        T res = null;

        try { res = c.newInstance( args ); }
        catch ( InvocationTargetException ite ) { rethrow( ite ); }

        return res;
    }

    // Returns null if cls declares no constructor with the given parameter
    // types
    public
    static
    < T >
    Constructor< T >
    getDeclaredConstructor( Class< T > cls,
                            Class< ? >... paramTypes )
    {
        inputs.notNull( cls, "cls" );

        try { return cls.getDeclaredConstructor( paramTypes ); }
        catch ( NoSuchMethodException nsme ) { return null; }
    }

    private
    static
    boolean
    isModified( Member m,
                int expct )
    {
        return ( inputs.notNull( m, "m" ).getModifiers() & expct ) > 0;
    }

    public
    static
    boolean
    isStatic( Member m )
    {
        return isModified( m, Modifier.STATIC );
    }

    public
    static
    boolean
    isPublic( Member m )
    {
        return isModified( m, Modifier.PUBLIC );
    }

    // Methods declared by cls and its ancestors, stopping before
    // java.lang.Object. Methods overridden in a subclass appear once, as
    // declared by the most derived class.
    public
    static
    List< Method >
    getDeclaredAncestorMethods( Class< ? > cls )
    {
        inputs.notNull( cls, "cls" );

        List< Method > res = Lang.newList();

        for ( Class< ? > c = cls; 
                c != null && ( ! c.equals( Object.class ) ); 
                c = c.getSuperclass() )
        {
            for ( Method m : c.getDeclaredMethods() )
            {
                if ( ! ( m.isSynthetic() || m.isBridge() || 
                         isOverridden( m, res ) ) )
                {
                    res.add( m );
                }
            }
        }

        return res;
    }

    private
    static
    boolean
    isOverridden( Method m,
                  List< Method > seen )
    {
        for ( Method s : seen )
        {
            if ( s.getName().equals( m.getName() ) &&
                 Arrays.equals( s.getParameterTypes(), m.getParameterTypes() ) )
            {
                return true;
            }
        }

        return false;
    }
}
