package com.langforge.grammar;

public
final
class NullCombinator
extends Combinator
{
    private final NodeType type;

    NullCombinator( NodeType type ) { this.type = type; }

    public Kind kind() { return Kind.NULL; }

    public NodeType getType() { return type; }

    void appendTo( StringBuilder sb ) { sb.append( "Null(" ).append( type ).append( ')' ); }
}
