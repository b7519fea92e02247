package org.ogletest.log;

public
interface CodeLogger
{
    public
    void
    code( Throwable th,
          Object... msg );

    public
    void
    code( Object... msg );

    public
    void
    warn( Throwable th,
          Object... msg );

    public
    void
    warn( Object... msg );
}
