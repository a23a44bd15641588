package com.langforge.grammar;

import com.langforge.validation.Inputs;

public
final
class Warning
{
    private static Inputs inputs = new Inputs();

    private final WarningKind kind;
    private final SourceTextLocation loc;
    private final String msg;

    Warning( WarningKind kind,
             SourceTextLocation loc,
             String msg )
    {
        this.kind = inputs.notNull( kind, "kind" );
        this.loc = loc;
        this.msg = inputs.notNull( msg, "msg" );
    }

    public WarningKind getKind() { return kind; }

    // Returns the location the warning refers to, possibly null
    public SourceTextLocation getLocation() { return loc; }

    public String getMessage() { return msg; }

    @Override
    public
    String
    toString()
    {
        return SourceTextLocation.prefix( loc, msg );
    }
}
