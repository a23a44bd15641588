package com.langforge.grammar;

public
final
class SkipCombinator
extends Combinator
{
    private final NodeType type;

    SkipCombinator( NodeType type ) { this.type = type; }

    public Kind kind() { return Kind.SKIP; }

    public NodeType getType() { return type; }

    void appendTo( StringBuilder sb ) { sb.append( "Skip(" ).append( type ).append( ')' ); }
}
