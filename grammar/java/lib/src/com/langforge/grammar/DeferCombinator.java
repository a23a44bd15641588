package com.langforge.grammar;

import com.langforge.validation.Inputs;
import com.langforge.validation.State;

public
final
class DeferCombinator
extends Combinator
{
    private static Inputs inputs = new Inputs();
    private static State state = new State();

    private final String name;

    private Combinator parser;

    // Guards getType() against cycles made only of references and
    // alternations
    private boolean resolvingType;

    DeferCombinator( String name ) { this.name = name; }

    public Kind kind() { return Kind.DEFER; }

    public String getName() { return name; }

    public boolean isResolved() { return parser != null; }

    public
    Combinator
    getParser()
    {
        state.isTrue( parser != null, "Reference to", name, "is unresolved" );
        return parser;
    }

    void
    resolve( Combinator parser )
    {
        state.isTrue( this.parser == null, "Reference to", name, "resolved twice" );
        this.parser = inputs.notNull( parser, "parser" );
    }

    public
    NodeType
    getType()
    {
        if ( resolvingType ) return null;

        resolvingType = true;
        try { return getParser().getType(); }
        finally { resolvingType = false; }
    }

    void appendTo( StringBuilder sb ) { sb.append( "Defer(" ).append( name ).append( ')' ); }
}
