package com.langforge.unparse;

import com.langforge.validation.Inputs;
import com.langforge.validation.State;

import com.langforge.lang.Lang;

import com.langforge.grammar.Combinator;
import com.langforge.grammar.NodeType;

import java.util.List;
import java.util.Map;

// The final unparsing tables of a grammar, as handed to code generation.
// Contents and their order only depend on the grammar
public
final
class UnparsingTables
{
    private static Inputs inputs = new Inputs();
    private static State state = new State();

    private final Map< NodeType, NodeUnparser > nodeUnparsers;
    private final Map< NodeType, Combinator > canonicalParsers;
    private final List< TokenUnparser > tokenUnparsers;
    private final List< TokenSequenceUnparser > tokenSequences;

    private
    UnparsingTables( Unparsers u )
    {
        this.nodeUnparsers = Lang.unmodifiableCopy( u.getNodeUnparsers() );
        this.canonicalParsers = Lang.unmodifiableCopy( u.getCanonicalParsers() );
        this.tokenUnparsers = 
            Lang.unmodifiableCopy( u.getSortedTokenUnparsers(), "tokenUnparsers" );
        this.tokenSequences = 
            Lang.unmodifiableCopy( 
                u.getTokenSequenceUnparsers(), "tokenSequences" );
    }

    public Map< NodeType, NodeUnparser > getNodeUnparsers() { return nodeUnparsers; }

    public
    NodeUnparser
    getNodeUnparser( NodeType node )
    {
        return nodeUnparsers.get( inputs.notNull( node, "node" ) );
    }

    public Map< NodeType, Combinator > getCanonicalParsers() { return canonicalParsers; }

    public List< TokenUnparser > getTokenUnparsers() { return tokenUnparsers; }

    public List< TokenSequenceUnparser > getTokenSequences() { return tokenSequences; }

    public
    String
    dump()
    {
        StringBuilder sb = new StringBuilder();

        for ( NodeUnparser u : nodeUnparsers.values() ) u.dump( sb );

        sb.append( "Token unparsers:\n" );
        for ( TokenUnparser t : tokenUnparsers )
        {
            sb.append( "   " ).append( Lang.getRfc4627String( t.dumps() ) ).append( '\n' );
        }

        sb.append( "Token sequences:\n" );
        for ( TokenSequenceUnparser seq : tokenSequences )
        {
            sb.append( "   [" ).append( seq.dumps() ).append( "]\n" );
        }

        return sb.toString();
    }

    static
    UnparsingTables
    create( Unparsers u )
    {
        state.isTrue( 
            u.isFinalized() && u.isGenerationEnabled(), 
            "No tables for an unfinished or aborted session" );

        return new UnparsingTables( u );
    }
}
