package com.langforge.grammar;

import com.langforge.validation.Inputs;

public
final
class TokenKind
{
    private static Inputs inputs = new Inputs();

    public final static TokenKind TERMINATION = 
        new TokenKind( "Termination", "" );

    private final String name;
    private final String literal;

    private
    TokenKind( String name,
               String literal )
    {
        this.name = name;
        this.literal = literal;
    }

    public String getName() { return name; }

    // Returns the fixed text of this kind, or null if tokens of this kind may
    // have any text
    public String getLiteral() { return literal; }

    public boolean hasLiteral() { return literal != null; }

    @Override public String toString() { return name; }

    public
    static
    TokenKind
    literal( String name,
             String literal )
    {
        inputs.notNull( name, "name" );
        inputs.notNull( literal, "literal" );
        inputs.isFalse( literal.isEmpty(), "Empty literal for token", name );

        return new TokenKind( name, literal );
    }

    public
    static
    TokenKind
    variable( String name )
    {
        return new TokenKind( inputs.notNull( name, "name" ), null );
    }
}
