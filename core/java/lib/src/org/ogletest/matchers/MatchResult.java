package org.ogletest.matchers;

public
enum MatchResult
{
    TRUE,
    FALSE,

    // the matcher can't say whether the candidate matches, typically because
    // the candidate is of a type the matcher doesn't apply to
    UNDEFINED;
}
