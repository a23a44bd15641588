package com.langforge.grammar;

import com.langforge.validation.Inputs;
import com.langforge.validation.State;

import com.langforge.lang.Lang;

import java.util.List;

// A node of a grammar's parser combinator tree. The set of combinators is
// closed: every instance is one of the classes in this package, identified by
// kind(). Code that analyzes combinator trees switches over the kind and
// fails on kinds it does not expect
public
abstract
class Combinator
{
    private static Inputs inputs = new Inputs();
    private static State state = new State();

    public
    static
    enum Kind
    {
        SEQUENCE,
        TRANSFORM,
        EXTRACT,
        LIST,
        OPTIONAL,
        ALTERNATION,
        DEFER,
        TOKEN,
        NULL,
        PREDICATE,
        SKIP,
        NO_BACKTRACK,
        DONT_SKIP;
    }

    private SourceTextLocation loc;
    private String ruleName;
    private boolean dontSkipParser;

    // Only the classes of this package may extend this one
    Combinator() {}

    public abstract Kind kind();

    public List< Combinator > children() { return Lang.emptyList(); }

    // Returns the node type this combinator yields, or null if it yields no
    // node (token matches and sequences of them)
    public abstract NodeType getType();

    // Whether this combinator produces no value at all: token matches, cut
    // markers and sequences made only of those
    public boolean discards() { return false; }

    // Whether this is a helper rule generated for a DontSkipCombinator. Such
    // rules create no node
    public boolean isDontSkipParser() { return dontSkipParser; }

    final void markDontSkipParser() { dontSkipParser = true; }

    // Returns where the enclosing rule was declared; may be null
    public SourceTextLocation getLocation() { return loc; }

    public String getRuleName() { return ruleName; }

    final
    void
    setRuleName( String ruleName )
    {
        state.isTrue( 
            this.ruleName == null, 
            "Combinator is already the body of rule", this.ruleName );

        this.ruleName = inputs.notNull( ruleName, "ruleName" );
    }

    final
    void
    inheritLocation( SourceTextLocation loc )
    {
        if ( this.loc == null && loc != null ) 
        {
            this.loc = loc;
            for ( Combinator c : children() ) c.inheritLocation( loc );
        }
    }

    abstract
    void
    appendTo( StringBuilder sb );

    final
    static
    void
    appendAll( StringBuilder sb,
               String name,
               List< ? extends Combinator > parsers )
    {
        sb.append( name ).append( '(' );

        for ( int i = 0, e = parsers.size(); i < e; ++i )
        {
            if ( i > 0 ) sb.append( ", " );
            parsers.get( i ).appendTo( sb );
        }

        sb.append( ')' );
    }

    @Override
    public
    final
    String
    toString()
    {
        StringBuilder sb = new StringBuilder();
        appendTo( sb );

        return sb.toString();
    }
}
