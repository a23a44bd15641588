package com.langforge.grammar;

import com.langforge.lang.Lang;

import java.util.List;

public
final
class AlternationCombinator
extends Combinator
{
    private final List< Combinator > alternatives;

    AlternationCombinator( List< Combinator > alternatives )
    {
        this.alternatives = Lang.unmodifiableCopy( alternatives, "alternatives" );
    }

    public Kind kind() { return Kind.ALTERNATION; }

    public List< Combinator > getAlternatives() { return alternatives; }

    @Override public List< Combinator > children() { return alternatives; }

    // The most derived type common to all alternatives yielding a node, or
    // null if two of them share no ancestor
    public
    NodeType
    getType()
    {
        NodeType res = null;

        for ( Combinator alt : alternatives )
        {
            NodeType t = alt.getType();

            if ( t == null ) continue;

            if ( res == null ) res = t;
            else if ( ( res = res.commonAncestor( t ) ) == null ) return null;
        }

        return res;
    }

    void appendTo( StringBuilder sb ) { appendAll( sb, "Or", alternatives ); }
}
