package com.langforge.grammar;

import com.langforge.lang.Lang;

import java.util.List;

// Parses its sub-parser while forbidding error recovery from skipping tokens
// that the guard parser would match. The guard is kept in a helper rule of
// its own (see Grammar.getHelperRules()), not among the children
public
final
class DontSkipCombinator
extends Combinator
{
    private final Combinator parser;
    private final Combinator guard;

    DontSkipCombinator( Combinator parser,
                        Combinator guard )
    {
        this.parser = parser;
        this.guard = guard;
    }

    public Kind kind() { return Kind.DONT_SKIP; }

    public Combinator getParser() { return parser; }

    public Combinator getGuard() { return guard; }

    public NodeType getType() { return parser.getType(); }

    @Override public boolean discards() { return parser.discards(); }

    @Override public List< Combinator > children() { return Lang.singletonList( parser ); }

    void
    appendTo( StringBuilder sb )
    {
        sb.append( "DontSkip(" );
        parser.appendTo( sb );
        sb.append( ", " );
        guard.appendTo( sb );
        sb.append( ')' );
    }
}
