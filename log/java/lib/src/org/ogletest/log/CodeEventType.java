package org.ogletest.log;

public
enum CodeEventType
{
    CODE,
    WARN;
}
