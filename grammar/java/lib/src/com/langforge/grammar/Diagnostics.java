package com.langforge.grammar;

// Receives the errors and warnings found while compiling a grammar. Message
// parts are joined with single spaces. Locations may be null
public
interface Diagnostics
{
    public
    void
    check( boolean cond,
           SourceTextLocation loc,
           Object... msg );

    /**
     * Returns the exception stopping compilation for the given error. It is
     * returned rather than thrown so that callers can write {@code throw
     * diagnostics.fatal( ... )}.
     */
    public
    GrammarDiagnosticException
    fatal( SourceTextLocation loc,
           Object... msg );

    public
    void
    warnIf( WarningKind kind,
            boolean cond,
            SourceTextLocation loc,
            Object... msg );
}
