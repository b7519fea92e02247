package org.ogletest.testing;

final
class TearDownFailureSuite
{
    public 
    void 
    tearDown() 
    { 
        SuiteEvents.add( "tearDown" ); 
        throw new IllegalStateException( "tear" );
    }

    public
    void
    testBody()
    {
        SuiteEvents.add( "testBody" ); 
        throw new IllegalStateException( "body" );
    }
}
