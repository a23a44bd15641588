package com.langforge.grammar;

// Cut marker inside a sequence: once parsing reaches it, a failure in the
// rest of the sequence is reported as an error instead of backtracking.
// Consumes nothing
public
final
class NoBacktrackCombinator
extends Combinator
{
    NoBacktrackCombinator() {}

    public Kind kind() { return Kind.NO_BACKTRACK; }

    public NodeType getType() { return null; }

    @Override public boolean discards() { return true; }

    void appendTo( StringBuilder sb ) { sb.append( "Cut()" ); }
}
