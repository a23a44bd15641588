package com.langforge.grammar;

public
final
class GrammarDiagnosticException
extends RuntimeException
{
    private final SourceTextLocation loc;
    private final String rawMsg;

    GrammarDiagnosticException( SourceTextLocation loc,
                                String rawMsg )
    {
        super( SourceTextLocation.prefix( loc, rawMsg ) );

        this.loc = loc;
        this.rawMsg = rawMsg;
    }

    public SourceTextLocation getLocation() { return loc; }

    public String getRawMessage() { return rawMsg; }
}
