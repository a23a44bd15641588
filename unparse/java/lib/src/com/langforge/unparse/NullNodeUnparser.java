package com.langforge.unparse;

import com.langforge.grammar.Diagnostics;
import com.langforge.grammar.NodeType;
import com.langforge.grammar.SourceTextLocation;

// Derived from a parser that consumes no token and yields a null node. It
// carries no information about the node
public
final
class NullNodeUnparser
extends NodeUnparser
{
    NullNodeUnparser( NodeType node ) { super( node ); }

    void
    dump( StringBuilder sb )
    {
        sb.append( "Unparser for " ).append( getNode() ).append( ": null\n" );
    }

    // Never reached: combine() handles null operands first
    NodeUnparser
    combineSame( NodeUnparser other,
                 Diagnostics diags,
                 SourceTextLocation loc )
    {
        return this;
    }

    void collect( Unparsers unparsers ) {}
}
