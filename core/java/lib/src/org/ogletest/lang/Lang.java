package org.ogletest.lang;

import org.ogletest.validation.Inputs;

import java.util.List;
import java.util.Map;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;

public
final
class Lang
{
    private static Inputs inputs = new Inputs();

    private Lang() {}

    public static < V > List< V > newList() { return new ArrayList< V >(); }

    public
    static
    < V >
    List< V >
    newList( int size )
    {
        return new ArrayList< V >( inputs.nonnegativeI( size, "size" ) );
    }

    public
    static
    < V >
    List< V >
    newList( Collection< ? extends V > coll )
    {
        return new ArrayList< V >( inputs.notNull( coll, "coll" ) );
    }

    // Insertion ordered, since callers here generally report in the order
    // entries were added.
    public
    static
    < K, V >
    Map< K, V >
    newMap()
    {
        return new LinkedHashMap< K, V >();
    }

    public
    static
    < V >
    List< V >
    asList( V... vals )
    {
        return Arrays.asList( inputs.notNull( vals, "vals" ) );
    }

    public
    static
    < V >
    List< V >
    unmodifiableList( List< V > l )
    {
        return Collections.unmodifiableList( inputs.notNull( l, "l" ) );
    }

    public
    static
    < V >
    List< V >
    unmodifiableCopy( Collection< ? extends V > coll )
    {
        return unmodifiableList( Lang.< V >newList( coll ) );
    }

    public
    static
    < K, V >
    Map< K, V >
    unmodifiableMap( Map< K, V > m )
    {
        return Collections.unmodifiableMap( inputs.notNull( m, "m" ) );
    }
}
