package com.langforge.unparse;

import com.langforge.grammar.Diagnostics;
import com.langforge.grammar.NodeType;
import com.langforge.grammar.SourceTextLocation;

public
final
class ListNodeUnparser
extends NodeUnparser
{
    private final TokenUnparser separator;

    ListNodeUnparser( NodeType node,
                      TokenUnparser separator )
    {
        super( node );
        this.separator = separator;
    }

    public TokenUnparser getSeparator() { return separator; }

    void
    dump( StringBuilder sb )
    {
        sb.append( "Unparser for " ).append( getNode() ).append( ":\n" );

        if ( separator != null ) 
        {
            sb.append( "   separator: " ).append( separator.dumps() ).append( '\n' );
        }
    }

    NodeUnparser
    combineSame( NodeUnparser other,
                 Diagnostics diags,
                 SourceTextLocation loc )
    {
        TokenUnparser otherSep = ( (ListNodeUnparser) other ).separator;

        diags.check(
            TokenUnparser.equivalent( separator, otherSep ),
            loc,
            "Inconsistent separation token for " + getNode() + ": " +
                TokenUnparser.dumpOrNone( separator ) + " and " +
                TokenUnparser.dumpOrNone( otherSep ) );

        return this;
    }

    void collect( Unparsers unparsers ) {}
}
