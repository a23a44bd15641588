package com.langforge.unparse;

import com.langforge.validation.Inputs;

import com.langforge.lang.Lang;

import com.langforge.grammar.Diagnostics;
import com.langforge.grammar.SourceTextLocation;

import java.util.List;

// An ordered run of tokens. Sequences compare by equivalence of their tokens,
// never by identity
public
final
class TokenSequenceUnparser
extends Unparser
{
    private static Inputs inputs = new Inputs();

    private final List< TokenUnparser > tokens;

    public TokenSequenceUnparser() { this( Lang.< TokenUnparser >newList() ); }

    private 
    TokenSequenceUnparser( List< TokenUnparser > tokens ) 
    { 
        this.tokens = tokens; 
    }

    public
    void
    append( TokenUnparser tok )
    {
        tokens.add( inputs.notNull( tok, "tok" ) );
    }

    // Returns a new sequence made of the tokens of this one followed by those
    // of other. Neither operand is changed
    public
    TokenSequenceUnparser
    concat( TokenSequenceUnparser other )
    {
        inputs.notNull( other, "other" );

        List< TokenUnparser > res = Lang.newList( size() + other.size() );
        res.addAll( tokens );
        res.addAll( other.tokens );

        return new TokenSequenceUnparser( res );
    }

    public int size() { return tokens.size(); }

    public boolean isEmpty() { return tokens.isEmpty(); }

    public List< TokenUnparser > getTokens() { return Lang.unmodifiableList( tokens ); }

    void
    dump( StringBuilder sb )
    {
        for ( int i = 0, e = tokens.size(); i < e; ++i )
        {
            if ( i > 0 ) sb.append( ' ' );
            tokens.get( i ).dump( sb );
        }
    }

    public
    boolean
    isEquivalent( TokenSequenceUnparser other )
    {
        inputs.notNull( other, "other" );

        if ( size() != other.size() ) return false;

        for ( int i = 0, e = size(); i < e; ++i )
        {
            if ( ! TokenUnparser.equivalent( tokens.get( i ), other.tokens.get( i ) ) )
            {
                return false;
            }
        }

        return true;
    }

    public
    void
    checkEquivalence( String role,
                      TokenSequenceUnparser other,
                      Diagnostics diags,
                      SourceTextLocation loc )
    {
        inputs.notNull( role, "role" );
        inputs.notNull( diags, "diags" );

        diags.check(
            isEquivalent( other ),
            loc,
            "Inconsistent " + role + ":\n  " + dumps() + "\nand:\n  " + 
                other.dumps() );
    }
}
