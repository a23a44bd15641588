package com.langforge.unparse;

import com.langforge.grammar.SourceTextLocation;

// Unwinds a derivation that reached a parser shape it cannot unparse
final
class UnsupportedConstructException
extends Exception
{
    private final SourceTextLocation loc;

    UnsupportedConstructException( SourceTextLocation loc,
                                   String msg )
    {
        super( msg );
        this.loc = loc;
    }

    SourceTextLocation getLocation() { return loc; }
}
