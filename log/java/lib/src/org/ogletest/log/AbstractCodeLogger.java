package org.ogletest.log;

// Joins message parts with single spaces, the way every caller of
// CodeLoggers.code() expects, and hands a finished line to the subclass.
public
abstract
class AbstractCodeLogger
implements CodeLogger
{
    // th may be null
    protected
    abstract
    void
    logCodeImpl( CodeEventType type,
                 CharSequence msg,
                 Throwable th );

    static
    CharSequence
    makeMessage( Object... msg )
    {
        StringBuilder sb = new StringBuilder();

        if ( msg != null )
        {
            for ( int i = 0, e = msg.length; i < e; )
            {
                sb.append( msg[ i ] );
                if ( ++i < e ) sb.append( ' ' );
            }
        }

        return sb;
    }

    public
    final
    void
    code( Throwable th,
          Object... msg )
    {
        logCodeImpl( CodeEventType.CODE, makeMessage( msg ), th );
    }

    public
    final
    void
    code( Object... msg )
    {
        logCodeImpl( CodeEventType.CODE, makeMessage( msg ), null );
    }

    public
    final
    void
    warn( Throwable th,
          Object... msg )
    {
        logCodeImpl( CodeEventType.WARN, makeMessage( msg ), th );
    }

    public
    final
    void
    warn( Object... msg )
    {
        logCodeImpl( CodeEventType.WARN, makeMessage( msg ), null );
    }
}
