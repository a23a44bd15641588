package com.langforge.grammar;

import com.langforge.lang.Lang;

import java.util.List;

// Parses its sub-parser if possible and yields a null value otherwise. Two
// variants change what is yielded. A booleanized optional yields a node of
// its "present" type when the sub-parser matched and of its "absent" type
// otherwise, dropping the sub-parser's value. An error optional never fails:
// a missing sub-parser match is recorded as a parsing error
public
final
class OptionalCombinator
extends Combinator
{
    private final Combinator parser;
    private final NodeType presentType;
    private final NodeType absentType;
    private final boolean errorOnMissing;

    OptionalCombinator( Combinator parser,
                        NodeType presentType,
                        NodeType absentType,
                        boolean errorOnMissing )
    {
        this.parser = parser;
        this.presentType = presentType;
        this.absentType = absentType;
        this.errorOnMissing = errorOnMissing;
    }

    public Kind kind() { return Kind.OPTIONAL; }

    public Combinator getParser() { return parser; }

    public boolean isBooleanized() { return presentType != null; }

    // Returns the "present" alternative type, or null if not booleanized
    public NodeType getPresentType() { return presentType; }

    public NodeType getAbsentType() { return absentType; }

    public
    List< NodeType >
    getAlternatives()
    {
        if ( isBooleanized() ) return Lang.asList( presentType, absentType );
        else return Lang.emptyList();
    }

    public boolean isErrorOnMissing() { return errorOnMissing; }

    public
    NodeType
    getType()
    {
        if ( isBooleanized() ) return presentType.commonAncestor( absentType );
        else return parser.getType();
    }

    @Override
    public
    boolean
    discards()
    {
        return ! isBooleanized() && parser.discards();
    }

    @Override
    public
    List< Combinator >
    children()
    {
        return Lang.singletonList( parser );
    }

    void
    appendTo( StringBuilder sb )
    {
        sb.append( "Opt(" );
        parser.appendTo( sb );

        if ( isBooleanized() ) 
        {
            sb.append( ", as=" ).append( getType() ); 
        }

        if ( errorOnMissing ) sb.append( ", error" );
        sb.append( ')' );
    }
}
