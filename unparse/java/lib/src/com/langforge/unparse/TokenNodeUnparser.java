package com.langforge.unparse;

import com.langforge.grammar.Diagnostics;
import com.langforge.grammar.NodeType;
import com.langforge.grammar.SourceTextLocation;

public
final
class TokenNodeUnparser
extends NodeUnparser
{
    TokenNodeUnparser( NodeType node ) { super( node ); }

    void
    dump( StringBuilder sb )
    {
        sb.append( "Unparser for " ).append( getNode() ).append( '\n' );
    }

    NodeUnparser
    combineSame( NodeUnparser other,
                 Diagnostics diags,
                 SourceTextLocation loc )
    {
        return this;
    }

    void collect( Unparsers unparsers ) {}
}
