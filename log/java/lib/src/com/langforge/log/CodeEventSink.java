package com.langforge.log;

public
interface CodeEventSink
{
    // ev should be non-null; impls may fail on receipt of null or discard it
    // silently. No guarantee is made as to when, if ever, the event reaches a
    // backing medium
    public
    void
    logCode( CodeEvent ev );
}
