package com.langforge.unparse;

import com.langforge.validation.State;

import com.langforge.grammar.SourceTextLocation;

public
final
class Derivation
{
    private static State state = new State();

    public
    static
    enum Status
    {
        DERIVED,
        UNSUPPORTED,
        SESSION_ABORTED;
    }

    private final static Derivation ABORTED = 
        new Derivation( Status.SESSION_ABORTED, null, null, null );

    private final Status status;
    private final NodeUnparser unparser;
    private final String reason;
    private final SourceTextLocation loc;

    private
    Derivation( Status status,
                NodeUnparser unparser,
                String reason,
                SourceTextLocation loc )
    {
        this.status = status;
        this.unparser = unparser;
        this.reason = reason;
        this.loc = loc;
    }

    public Status getStatus() { return status; }

    public
    NodeUnparser
    getUnparser()
    {
        state.isTrue( status == Status.DERIVED, "No unparser in", status, "derivation" );
        return unparser;
    }

    public String getReason() { return reason; }

    public SourceTextLocation getLocation() { return loc; }

    @Override
    public
    String
    toString()
    {
        switch ( status )
        {
            case DERIVED: return status + ": " + unparser.dumps();
            case UNSUPPORTED: return status + ": " + reason;
            default: return status.toString();
        }
    }

    static
    Derivation
    derived( NodeUnparser unparser )
    {
        return new Derivation( Status.DERIVED, state.notNull( unparser ), null, null );
    }

    static
    Derivation
    unsupported( String reason,
                 SourceTextLocation loc )
    {
        return new Derivation( Status.UNSUPPORTED, null, state.notNull( reason ), loc );
    }

    static Derivation sessionAborted() { return ABORTED; }
}
