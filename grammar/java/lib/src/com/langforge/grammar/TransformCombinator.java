package com.langforge.grammar;

import com.langforge.lang.Lang;

import java.util.List;

// Builds a node of its type out of a sequence: each value-producing element
// of the sequence fills the next parse field of the node
public
final
class TransformCombinator
extends Combinator
{
    private final NodeType type;
    private final SequenceCombinator row;

    TransformCombinator( NodeType type,
                         SequenceCombinator row )
    {
        this.type = type;
        this.row = row;
    }

    public Kind kind() { return Kind.TRANSFORM; }

    public NodeType getType() { return type; }

    public SequenceCombinator getRow() { return row; }

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
        appendAll( sb, type.getName(), row.getParsers() );
    }
}
