package org.ogletest.matchers;

public
abstract
class AbstractMatcher
implements Matcher
{
    @Override
    public
    final
    String
    toString()
    {
        return getDescription().toString();
    }
}
