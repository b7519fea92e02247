package org.ogletest.log;

import org.ogletest.validation.State;

import java.util.List;
import java.util.ArrayList;

import org.junit.jupiter.api.Test;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;

import ch.qos.logback.core.read.ListAppender;

final
class CodeLoggersTests
{
    private final static State state = new State();

    private
    final
    static
    class Event
    {
        private final CodeEventType type;
        private final String msg;
        private final Throwable th;

        private
        Event( CodeEventType type,
               CharSequence msg,
               Throwable th )
        {
            this.type = type;
            this.msg = msg.toString();
            this.th = th;
        }
    }

    private
    final
    static
    class CapturingLogger
    extends AbstractCodeLogger
    {
        private final List< Event > events = new ArrayList< Event >();

        protected
        void
        logCodeImpl( CodeEventType type,
                     CharSequence msg,
                     Throwable th )
        {
            events.add( new Event( type, msg, th ) );
        }
    }

    @Test
    void
    testDefaultReplacementAndMessageJoining()
    {
        CapturingLogger cl = new CapturingLogger();
        CodeLogger prev = CodeLoggers.replaceDefault( cl );

        try
        {
            state.isTrue( CodeLoggers.getDefaultLogger() == cl );

            Exception ex = new Exception( "test" );

            CodeLoggers.code( "Ran", 3, "tests" );
            CodeLoggers.warn( ex, "Failed", "badly" );
            CodeLoggers.code( ex, "Recovered" );
            CodeLoggers.warn( "warned", "here" );
        
            state.equalInt( 4, cl.events.size() );

            state.equal( CodeEventType.CODE, cl.events.get( 0 ).type );
            state.equal( "Ran 3 tests", cl.events.get( 0 ).msg );
            state.isTrue( cl.events.get( 0 ).th == null );

            state.equal( CodeEventType.WARN, cl.events.get( 1 ).type );
            state.equal( "Failed badly", cl.events.get( 1 ).msg );
            state.isTrue( cl.events.get( 1 ).th == ex );

            state.equal( CodeEventType.CODE, cl.events.get( 2 ).type );
            state.equal( "Recovered", cl.events.get( 2 ).msg );
            state.isTrue( cl.events.get( 2 ).th == ex );

            state.equal( CodeEventType.WARN, cl.events.get( 3 ).type );
            state.equal( "warned here", cl.events.get( 3 ).msg );
        }
        finally { CodeLoggers.replaceDefault( prev ); }
    }

    @Test
    void
    testReplaceDefaultRejectsNull()
    {
        try 
        { 
            CodeLoggers.replaceDefault( null ); 
            state.fail( "Expected failure" );
        }
        catch ( IllegalArgumentException iae ) 
        {
            state.equal( "Input 'logger' cannot be null", iae.getMessage() );
        }
    }

    @Test
    void
    testSlf4jLoggerLevels()
    {
        String nm = CodeLoggers.DEFAULT_LOGGER_NAME + ".slf4jtest";

        Logger lbLog = (Logger) LoggerFactory.getLogger( nm );
        lbLog.setLevel( Level.INFO );

        ListAppender< ILoggingEvent > app = new ListAppender< ILoggingEvent >();
        app.start();
        lbLog.addAppender( app );

        try
        {
            CodeLogger cl = CodeLoggers.createSlf4jLogger( nm );

            cl.code( "hello", "there" );
            cl.warn( new RuntimeException(), "uh", "oh" );

            state.equalInt( 2, app.list.size() );

            ILoggingEvent ev1 = app.list.get( 0 );
            state.equal( Level.INFO, ev1.getLevel() );
            state.equal( "hello there", ev1.getFormattedMessage() );

            ILoggingEvent ev2 = app.list.get( 1 );
            state.equal( Level.WARN, ev2.getLevel() );
            state.equal( "uh oh", ev2.getFormattedMessage() );
            state.notNull( ev2.getThrowableProxy() );
        }
        finally { lbLog.detachAppender( app ); }
    }
}
