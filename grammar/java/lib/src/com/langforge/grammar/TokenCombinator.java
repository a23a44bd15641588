package com.langforge.grammar;

public
final
class TokenCombinator
extends Combinator
{
    private final TokenKind tokenKind;
    private final String matchText;

    TokenCombinator( TokenKind tokenKind,
                     String matchText )
    {
        this.tokenKind = tokenKind;
        this.matchText = matchText;
    }

    public Kind kind() { return Kind.TOKEN; }

    public TokenKind getTokenKind() { return tokenKind; }

    public String getMatchText() { return matchText; }

    public NodeType getType() { return null; }

    @Override public boolean discards() { return true; }

    void
    appendTo( StringBuilder sb )
    {
        sb.append( "Tok(" ).append( tokenKind.getName() );
        if ( matchText != null ) sb.append( ", \"" ).append( matchText ).append( '"' );
        sb.append( ')' );
    }
}
