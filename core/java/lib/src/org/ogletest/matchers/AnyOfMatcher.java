package org.ogletest.matchers;

import java.util.List;

// Logical OR. Wrapped matchers are tried in order: the first TRUE wins, the
// first UNDEFINED seen before any TRUE is returned as-is, and FALSE results
// only if every wrapped matcher said FALSE. A later TRUE is therefore never
// reached once an earlier matcher returns UNDEFINED.
final
class AnyOfMatcher
extends CompositeMatcher
{
    AnyOfMatcher( List< Matcher > wrapped ) { super( "or", wrapped ); }

    MatchResult passResult() { return MatchResult.FALSE; }
}
