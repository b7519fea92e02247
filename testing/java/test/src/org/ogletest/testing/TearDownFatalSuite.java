package org.ogletest.testing;

import static org.ogletest.testing.Expectations.*;

final
class TearDownFatalSuite
{
    static int assertLine;
    static int bodyLine;

    public 
    void 
    tearDown() 
    { 
        SuiteEvents.add( "tearDown" ); 

        assertLine = SuiteEvents.currentLine() + 1;
        assertEq( 1, 2 );
        SuiteEvents.add( "unreachable" );
    }

    public
    void
    testBody()
    {
        SuiteEvents.add( "testBody" ); 

        bodyLine = SuiteEvents.currentLine() + 1;
        throw new IllegalStateException( "body" );
    }
}
