package org.ogletest.log;

import org.ogletest.validation.Inputs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public
final
class CodeLoggers
{
    private final static Inputs inputs = new Inputs();

    public final static String DEFAULT_LOGGER_NAME = "org.ogletest";

    private static CodeLogger defl = createSlf4jLogger( DEFAULT_LOGGER_NAME );

    private CodeLoggers() {}

    public static CodeLogger getDefaultLogger() { return defl; }

    // CODE events go out at info, WARN events at warn
    public
    static
    CodeLogger
    createSlf4jLogger( String name )
    {
        inputs.notNull( name, "name" );

        final Logger log = LoggerFactory.getLogger( name );

        return
            new AbstractCodeLogger() {
                protected void logCodeImpl( CodeEventType type,
                                            CharSequence msg,
                                            Throwable th ) 
                {
                    if ( type == CodeEventType.WARN ) 
                    {
                        log.warn( msg.toString(), th );
                    }
                    else log.info( msg.toString(), th );
                }
            };
    }

    // Not synchronized and defl is not volatile: callers replacing the default
    // are expected to do so before the code whose output they care about runs
    // (typically in test setup).
    public
    static
    CodeLogger
    replaceDefault( CodeLogger logger )
    {
        CodeLogger res = defl;
        defl = inputs.notNull( logger, "logger" );

        return res;
    }

    public static void code( Object... msg ) { defl.code( msg ); }

    public
    static
    void
    code( Throwable th,
          Object... msg )
    {
        defl.code( th, msg );
    }

    public static void warn( Object... msg ) { defl.warn( msg ); }

    public
    static
    void
    warn( Throwable th,
          Object... msg )
    {
        defl.warn( th, msg );
    }
}
