package com.langforge.unparse;

import com.langforge.validation.Inputs;
import com.langforge.validation.State;

import com.langforge.grammar.Diagnostics;
import com.langforge.grammar.NodeType;
import com.langforge.grammar.SourceTextLocation;

public
abstract
class NodeUnparser
extends Unparser
{
    private static Inputs inputs = new Inputs();
    private static State state = new State();

    private final NodeType node;

    NodeUnparser( NodeType node ) { this.node = node; }

    public final NodeType getNode() { return node; }

    /**
     * Returns an unparser holding the information of both this and other,
     * raising a fatal diagnostic through diags if they contradict each other.
     * A {@link NullNodeUnparser} operand contributes nothing. Otherwise both
     * operands must be of the same variant and for the same node.
     */
    public
    final
    NodeUnparser
    combine( NodeUnparser other,
             Diagnostics diags,
             SourceTextLocation loc )
    {
        inputs.notNull( other, "other" );
        inputs.notNull( diags, "diags" );

        if ( other instanceof NullNodeUnparser ) return this;
        if ( this instanceof NullNodeUnparser ) return other;

        state.isTrue( 
            getClass() == other.getClass() && node == other.node,
            "Incompatible unparsers:\n" + dumps() + "\n... and...\n" + 
                other.dumps() );

        return combineSame( other, diags, loc );
    }

    abstract
    NodeUnparser
    combineSame( NodeUnparser other,
                 Diagnostics diags,
                 SourceTextLocation loc );

    // Registers the token sequences this unparser references with unparsers,
    // in the order they appear in the unparsed text
    abstract
    void
    collect( Unparsers unparsers );
}
