package com.langforge.unparse;

import com.langforge.validation.State;

import com.langforge.lang.Lang;

import com.langforge.grammar.Diagnostics;
import com.langforge.grammar.Field;
import com.langforge.grammar.NodeType;
import com.langforge.grammar.SourceTextLocation;

import java.util.List;

public
final
class RegularNodeUnparser
extends NodeUnparser
{
    private static State state = new State();

    private final TokenSequenceUnparser preTokens;
    private final List< FieldUnparser > fieldUnparsers;
    private final List< TokenSequenceUnparser > interTokens;
    private final TokenSequenceUnparser postTokens;

    private
    RegularNodeUnparser( NodeType node,
                         TokenSequenceUnparser preTokens,
                         List< FieldUnparser > fieldUnparsers,
                         List< TokenSequenceUnparser > interTokens,
                         TokenSequenceUnparser postTokens )
    {
        super( node );

        this.preTokens = preTokens;
        this.fieldUnparsers = fieldUnparsers;
        this.interTokens = interTokens;
        this.postTokens = postTokens;
    }

    // Fields are created in parse field order, each always absent and
    // without tokens
    RegularNodeUnparser( NodeType node )
    {
        this( 
            node, 
            new TokenSequenceUnparser(), 
            Lang.< FieldUnparser >newList(),
            Lang.< TokenSequenceUnparser >newList(),
            new TokenSequenceUnparser() );

        List< Field > fields = node.getParseFields();

        for ( int i = 0, e = fields.size(); i < e; ++i )
        {
            fieldUnparsers.add( new FieldUnparser( node, fields.get( i ) ) );
            if ( i > 0 ) interTokens.add( new TokenSequenceUnparser() );
        }
    }

    public TokenSequenceUnparser getPreTokens() { return preTokens; }

    public
    List< FieldUnparser >
    getFieldUnparsers()
    {
        return Lang.unmodifiableList( fieldUnparsers );
    }

    // Returns the token sequences between fields: the one at index N sits
    // between fields N and N+1
    public
    List< TokenSequenceUnparser >
    getInterTokens()
    {
        return Lang.unmodifiableList( interTokens );
    }

    public TokenSequenceUnparser getPostTokens() { return postTokens; }

    void
    dump( StringBuilder sb )
    {
        sb.append( "Unparser for " ).append( getNode() ).append( ":\n" );

        if ( ! preTokens.isEmpty() )
        {
            sb.append( "   pre: " ).append( preTokens.dumps() ).append( '\n' );
        }

        for ( int i = 0, e = fieldUnparsers.size(); i < e; ++i )
        {
            sb.append( '\n' );

            if ( i > 0 && ! interTokens.get( i - 1 ).isEmpty() )
            {
                sb.append( "   tokens: " ).
                   append( interTokens.get( i - 1 ).dumps() ).
                   append( '\n' );
            }

            fieldUnparsers.get( i ).dump( sb );
        }

        if ( ! fieldUnparsers.isEmpty() ) sb.append( '\n' );

        if ( ! postTokens.isEmpty() )
        {
            sb.append( "   post: " ).append( postTokens.dumps() ).append( '\n' );
        }
    }

    NodeUnparser
    combineSame( NodeUnparser other,
                 Diagnostics diags,
                 SourceTextLocation loc )
    {
        RegularNodeUnparser o = (RegularNodeUnparser) other;

        state.equalInt( fieldUnparsers.size(), o.fieldUnparsers.size() );
        state.equalInt( interTokens.size(), o.interTokens.size() );

        String nodeName = getNode().getName();

        preTokens.checkEquivalence( 
            "prefix tokens for " + nodeName, o.preTokens, diags, loc );

        for ( int i = 0, e = interTokens.size(); i < e; ++i )
        {
            Field f = fieldUnparsers.get( i ).getField();

            interTokens.get( i ).checkEquivalence(
                "tokens after " + f.getQualifiedName(), 
                o.interTokens.get( i ), 
                diags, 
                loc );
        }

        postTokens.checkEquivalence( 
            "postfix tokens for " + nodeName, o.postTokens, diags, loc );

        List< FieldUnparser > fields = Lang.newList( fieldUnparsers.size() );

        for ( int i = 0, e = fieldUnparsers.size(); i < e; ++i )
        {
            fields.add( 
                fieldUnparsers.get( i ).combine( 
                    o.fieldUnparsers.get( i ), diags, loc ) );
        }

        return 
            new RegularNodeUnparser( 
                getNode(), preTokens, fields, interTokens, postTokens );
    }

    void
    collect( Unparsers unparsers )
    {
        unparsers.collectTokenSequence( preTokens );

        for ( int i = 0, e = fieldUnparsers.size(); i < e; ++i )
        {
            if ( i > 0 ) unparsers.collectTokenSequence( interTokens.get( i - 1 ) );
            fieldUnparsers.get( i ).collect( unparsers );
        }

        unparsers.collectTokenSequence( postTokens );
    }
}
