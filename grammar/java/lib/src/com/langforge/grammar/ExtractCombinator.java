package com.langforge.grammar;

import com.langforge.lang.Lang;

import java.util.List;

public
final
class ExtractCombinator
extends Combinator
{
    private final SequenceCombinator row;
    private final int index;

    ExtractCombinator( SequenceCombinator row,
                       int index )
    {
        this.row = row;
        this.index = index;
    }

    public Kind kind() { return Kind.EXTRACT; }

    public SequenceCombinator getRow() { return row; }

    public int getIndex() { return index; }

    public Combinator getExtracted() { return row.get( index ); }

    public NodeType getType() { return getExtracted().getType(); }

    @Override
    public
    List< Combinator >
    children()
    {
        return Lang.< Combinator >singletonList( row );
    }

    void
    appendTo( StringBuilder sb )
    {
        appendAll( sb, "Pick", row.getParsers() );
        if ( index != 0 ) sb.append( '[' ).append( index ).append( ']' );
    }
}
