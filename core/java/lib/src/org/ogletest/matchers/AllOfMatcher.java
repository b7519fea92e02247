package org.ogletest.matchers;

import java.util.List;

// Logical AND, the mirror image of AnyOfMatcher: the first FALSE or UNDEFINED
// is returned and TRUE results only if every wrapped matcher said TRUE.
final
class AllOfMatcher
extends CompositeMatcher
{
    AllOfMatcher( List< Matcher > wrapped ) { super( "and", wrapped ); }

    MatchResult passResult() { return MatchResult.TRUE; }
}
