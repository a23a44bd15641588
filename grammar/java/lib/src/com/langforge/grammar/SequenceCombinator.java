package com.langforge.grammar;

import com.langforge.validation.Inputs;

import com.langforge.lang.Lang;

import java.util.List;

public
final
class SequenceCombinator
extends Combinator
{
    private static Inputs inputs = new Inputs();

    private final List< Combinator > parsers;

    SequenceCombinator( List< Combinator > parsers ) 
    { 
        this.parsers = Lang.unmodifiableCopy( parsers, "parsers" ); 
    }

    public Kind kind() { return Kind.SEQUENCE; }

    public List< Combinator > getParsers() { return parsers; }

    public int size() { return parsers.size(); }

    public
    Combinator
    get( int indx )
    {
        inputs.isTrue( 
            indx >= 0 && indx < parsers.size(), 
            "Index", indx, "out of bounds for sequence of", parsers.size() );

        return parsers.get( indx );
    }

    @Override public List< Combinator > children() { return parsers; }

    public NodeType getType() { return null; }

    @Override
    public
    boolean
    discards()
    {
        for ( Combinator p : parsers ) if ( ! p.discards() ) return false;
        return true;
    }

    void appendTo( StringBuilder sb ) { appendAll( sb, "Row", parsers ); }
}
