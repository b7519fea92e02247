package org.ogletest.lang;

import org.ogletest.validation.State;

import org.junit.jupiter.api.Test;

final
class StringsTests
{
    private final static State state = new State();

    private
    static
    void
    assertInspect( String expct,
                   Object obj )
    {
        state.equalString( expct, Strings.inspect( obj ) );
    }

    @Test
    void
    testInspect()
    {
        assertInspect( "\"hello\"", "hello" );
        assertInspect( "\"\"", new StringBuilder() );
        assertInspect( "'x'", 'x' );
        assertInspect( "12", 12 );
        assertInspect( "null", null );
        assertInspect( "[a, null]", new String[] { "a", null } );
        assertInspect( "[[1], [2, 3]]", new Integer[][] { { 1 }, { 2, 3 } } );
        assertInspect( "[true, false]", new boolean[] { true, false } );
        assertInspect( "[]", new long[ 0 ] );
    }

    @Test
    void
    testJoin()
    {
        state.equalString( "a, 1, null", Strings.join( ", ", "a", 1, null ) );
        state.equalString( "", Strings.join( "-", Lang.newList() ) );
        state.equalString( "x", Strings.join( "-", Lang.asList( "x" ) ) );
    }

    @Test
    void
    testPatternHelperSingleLineMessage()
    {
        try 
        { 
            PatternHelper.compile( "a(" ); 
            state.fail( "Expected failure" );
        }
        catch ( IllegalArgumentException iae ) 
        {
            String msg = iae.getMessage();

            state.isTrue( msg.startsWith( "Invalid pattern 'a(':" ), msg );
            state.isFalse( msg.contains( "\n" ), msg );
        }
    }
}
