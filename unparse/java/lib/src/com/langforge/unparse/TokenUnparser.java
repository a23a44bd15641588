package com.langforge.unparse;

import com.langforge.grammar.TokenKind;

public
final
class TokenUnparser
extends Unparser
{
    private final TokenKind kind;
    private final String matchText;

    TokenUnparser( TokenKind kind,
                   String matchText )
    {
        this.kind = kind;
        this.matchText = matchText;
    }

    public TokenKind getTokenKind() { return kind; }

    public String getMatchText() { return matchText; }

    void
    dump( StringBuilder sb )
    {
        sb.append( matchText == null ? kind.getLiteral() : matchText );
    }

    // Whether both tokens render the same text. Two null tokens are
    // equivalent; a null token is not equivalent to a non-null one
    public
    static
    boolean
    equivalent( TokenUnparser tok1,
                TokenUnparser tok2 )
    {
        if ( tok1 == null || tok2 == null ) return tok1 == tok2;
        else return tok1.dumps().equals( tok2.dumps() );
    }

    public
    static
    String
    dumpOrNone( TokenUnparser tok )
    {
        return tok == null ? "<none>" : tok.dumps();
    }
}
