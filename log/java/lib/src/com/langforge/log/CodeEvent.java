package com.langforge.log;

public
interface CodeEvent
{
    // not null
    public 
    CodeEventType 
    type();

    // not null; may be empty. Implementations need not make defensive copies
    public 
    Object[] 
    message();

    // may be null
    public 
    Throwable 
    throwable();

    // should be positive
    public 
    long 
    time();
}
