package com.langforge.grammar;

import com.langforge.lang.Lang;

import java.util.List;

public
final
class PredicateCombinator
extends Combinator
{
    private final Combinator parser;
    private final String predicateName;

    PredicateCombinator( Combinator parser,
                         String predicateName )
    {
        this.parser = parser;
        this.predicateName = predicateName;
    }

    public Kind kind() { return Kind.PREDICATE; }

    public Combinator getParser() { return parser; }

    public String getPredicateName() { return predicateName; }

    public NodeType getType() { return parser.getType(); }

    @Override public List< Combinator > children() { return Lang.singletonList( parser ); }

    void
    appendTo( StringBuilder sb )
    {
        sb.append( "Predicate(" );
        parser.appendTo( sb );
        sb.append( ", " ).append( predicateName ).append( ')' );
    }
}
