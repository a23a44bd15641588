package com.langforge.unparse;

import com.langforge.validation.Inputs;
import com.langforge.validation.State;

import com.langforge.grammar.Diagnostics;
import com.langforge.grammar.Field;
import com.langforge.grammar.NodeType;
import com.langforge.grammar.SourceTextLocation;

// The fixed tokens around one field of a node, and whether the field is known
// to be always absent. The node may be a subtype of the type declaring the
// field
public
final
class FieldUnparser
extends Unparser
{
    private static Inputs inputs = new Inputs();
    private static State state = new State();

    private final NodeType node;
    private final Field field;

    private boolean alwaysAbsent = true;
    private TokenSequenceUnparser preTokens = new TokenSequenceUnparser();
    private TokenSequenceUnparser postTokens = new TokenSequenceUnparser();

    FieldUnparser( NodeType node,
                   Field field )
    {
        this.node = node;
        this.field = field;
    }

    public NodeType getNode() { return node; }

    public Field getField() { return field; }

    public boolean isAlwaysAbsent() { return alwaysAbsent; }

    void setAlwaysAbsent( boolean alwaysAbsent ) { this.alwaysAbsent = alwaysAbsent; }

    public TokenSequenceUnparser getPreTokens() { return preTokens; }

    void setPreTokens( TokenSequenceUnparser preTokens ) { this.preTokens = preTokens; }

    public TokenSequenceUnparser getPostTokens() { return postTokens; }

    void setPostTokens( TokenSequenceUnparser postTokens ) { this.postTokens = postTokens; }

    void
    dump( StringBuilder sb )
    {
        sb.append( "   if " ).append( field.getQualifiedName() ).append( ": " );
        preTokens.dump( sb );
        sb.append( " [field] " );
        postTokens.dump( sb );
        sb.append( '\n' );
    }

    // Merges the information of two occurrences of the same field. An always
    // absent operand contributes nothing; otherwise both must have equivalent
    // tokens around the field
    public
    FieldUnparser
    combine( FieldUnparser other,
             Diagnostics diags,
             SourceTextLocation loc )
    {
        inputs.notNull( other, "other" );
        state.isTrue( 
            node == other.node && field == other.field,
            "Cannot combine unparsers of", field.getQualifiedName(), "and",
            other.field.getQualifiedName() );

        if ( alwaysAbsent ) return other;
        else if ( other.alwaysAbsent ) return this;
        else
        {
            String name = field.getQualifiedName();

            preTokens.checkEquivalence( 
                "prefix tokens for " + name, other.preTokens, diags, loc );

            postTokens.checkEquivalence( 
                "postfix tokens for " + name, other.postTokens, diags, loc );

            return this;
        }
    }

    void
    collect( Unparsers unparsers )
    {
        unparsers.collectTokenSequence( preTokens );
        unparsers.collectTokenSequence( postTokens );
    }
}
