package com.langforge.unparse;

import com.langforge.validation.Inputs;
import com.langforge.validation.State;

import com.langforge.grammar.AlternationCombinator;
import com.langforge.grammar.Combinator;
import com.langforge.grammar.ExtractCombinator;
import com.langforge.grammar.ListCombinator;
import com.langforge.grammar.NodeType;
import com.langforge.grammar.OptionalCombinator;
import com.langforge.grammar.SequenceCombinator;
import com.langforge.grammar.TokenCombinator;
import com.langforge.grammar.TransformCombinator;

import java.util.List;

// Maps a parser known to build a node type to the node unparser for that
// occurrence. Token unparsers come from the registry's cache.
final
class NodeUnparserDerivation
{
    private static Inputs inputs = new Inputs();
    private static State state = new State();

    private final Unparsers unparsers;

    NodeUnparserDerivation( Unparsers unparsers ) { this.unparsers = unparsers; }

    Derivation
    derive( NodeType node,
            Combinator parser )
    {
        inputs.notNull( node, "node" );
        inputs.notNull( parser, "parser" );

        if ( ! unparsers.isGenerationEnabled() ) return Derivation.sessionAborted();

        try { return Derivation.derived( deriveNode( node, parser ) ); }
        catch ( UnsupportedConstructException uce )
        {
            return Derivation.unsupported( uce.getMessage(), uce.getLocation() );
        }
    }

    private
    static
    UnsupportedConstructException
    unsupported( String msg,
                 Combinator p )
    {
        return new UnsupportedConstructException( p.getLocation(), msg + ": " + p );
    }

    private
    static
    boolean
    isSingleTokenTransform( Combinator p )
    {
        if ( p.kind() != Combinator.Kind.TRANSFORM ) return false;

        SequenceCombinator row = ( (TransformCombinator) p ).getRow();

        return row.size() == 1 &&
            CombinatorShapes.unwrapDontSkip( row.get( 0 ) ).kind() == 
                Combinator.Kind.TOKEN;
    }

    private
    NodeUnparser
    deriveNode( NodeType node,
                Combinator parser )
        throws UnsupportedConstructException
    {
        state.isFalse( 
            node.isAbstract() || node.isSynthetic(), 
            "Invalid unparser request for", node );

        Combinator p = CombinatorShapes.unwrapDontSkip( parser );

        if ( node.isTokenNode() )
        {
            if ( isSingleTokenTransform( p ) ) return new TokenNodeUnparser( node );

            throw unsupported( 
                "Unsupported token node parser for unparsers generation", p );
        }

        switch ( p.kind() )
        {
            case TRANSFORM: 
                return deriveRegular( node, (TransformCombinator) p );

            case LIST:
                return new ListNodeUnparser( 
                    node,
                    unparsers.getTokenUnparser( 
                        ( (ListCombinator) p ).getSeparator() ) );

            case OPTIONAL: 
                return deriveOptional( node, (OptionalCombinator) p );

            case NULL: return new NullNodeUnparser( node );

            default:
                throw unsupported( 
                    "Unsupported parser for unparsers generation", p );
        }
    }

    // Tokens go before the first field, between fields or after the last one
    // depending on how many fields precede them
    private
    NodeUnparser
    deriveRegular( NodeType node,
                   TransformCombinator p )
        throws UnsupportedConstructException
    {
        RegularNodeUnparser res = new RegularNodeUnparser( node );

        List< FieldUnparser > fields = res.getFieldUnparsers();
        int nextField = 0;

        for ( Combinator sub : p.getRow().getParsers() )
        {
            if ( sub.discards() )
            {
                TokenSequenceUnparser seq;

                if ( nextField == 0 ) seq = res.getPreTokens();
                else if ( nextField < fields.size() ) 
                {
                    seq = res.getInterTokens().get( nextField - 1 );
                }
                else seq = res.getPostTokens();

                emitToTokenSequence( sub, seq );
            }
            else
            {
                if ( nextField == fields.size() )
                {
                    throw unsupported( 
                        "More values parsed than " + node + " has fields", p );
                }

                emitToFieldUnparser( sub, fields.get( nextField++ ) );
            }
        }

        if ( nextField != fields.size() )
        {
            throw unsupported( 
                "Fewer values parsed than " + node + " has fields", p );
        }

        return res;
    }

    // When the parser matches the "present" alternative is built, otherwise
    // the "absent" one is built and no token is consumed
    private
    NodeUnparser
    deriveOptional( NodeType node,
                    OptionalCombinator p )
        throws UnsupportedConstructException
    {
        if ( p.isBooleanized() )
        {
            RegularNodeUnparser res = new RegularNodeUnparser( node );

            if ( node == p.getPresentType() ) 
            {
                emitToTokenSequence( p.getParser(), res.getPreTokens() );
            }

            return res;
        }
        else return deriveNode( node, p.getParser() );
    }

    private
    void
    emitToTokenSequence( Combinator parser,
                         TokenSequenceUnparser seq )
        throws UnsupportedConstructException
    {
        Combinator p = CombinatorShapes.unwrapDontSkip( parser );

        switch ( p.kind() )
        {
            case SEQUENCE:
                for ( Combinator sub : ( (SequenceCombinator) p ).getParsers() )
                {
                    emitToTokenSequence( sub, seq );
                }
                break;

            case TOKEN: 
                seq.append( unparsers.getTokenUnparser( (TokenCombinator) p ) );
                break;

            case OPTIONAL:
                OptionalCombinator opt = (OptionalCombinator) p;

                if ( ! opt.isErrorOnMissing() ) 
                {
                    throw unsupported( 
                        "Static sequence of tokens expected, but got", p );
                }

                emitToTokenSequence( opt.getParser(), seq );
                break;

            case NO_BACKTRACK: break;

            default:
                throw unsupported( 
                    "Static sequence of tokens expected, but got", p );
        }
    }

    private
    void
    emitToFieldUnparser( Combinator parser,
                         FieldUnparser fu )
        throws UnsupportedConstructException
    {
        Combinator p = CombinatorShapes.unwrapDontSkip( parser );

        switch ( p.kind() )
        {
            case DEFER:
            case LIST:
            case NULL:
            case TRANSFORM:
                fu.setAlwaysAbsent( 
                    fu.isAlwaysAbsent() && p.kind() == Combinator.Kind.NULL );
                break;

            case OPTIONAL:
                OptionalCombinator opt = (OptionalCombinator) p;
                fu.setAlwaysAbsent( false );

                if ( ! opt.isBooleanized() ) 
                {
                    emitToFieldUnparser( opt.getParser(), fu );
                }
                break;

            case ALTERNATION:
                fu.setAlwaysAbsent( false );
                checkAlternatives( (AlternationCombinator) p );
                break;

            case EXTRACT:
                fu.setAlwaysAbsent( false );
                emitExtract( (ExtractCombinator) p, fu );
                break;

            default:
                throw unsupported( "Unsupported parser for node field", p );
        }
    }

    // The tokens around the extracted parser wrap those already known for
    // the field, so nested extractions accumulate from the outside in
    private
    void
    emitExtract( ExtractCombinator p,
                 FieldUnparser fu )
        throws UnsupportedConstructException
    {
        List< Combinator > subs = p.getRow().getParsers();
        int index = p.getIndex();

        TokenSequenceUnparser pre = new TokenSequenceUnparser();
        for ( int i = 0; i < index; ++i ) emitToTokenSequence( subs.get( i ), pre );

        TokenSequenceUnparser post = new TokenSequenceUnparser();
        for ( int i = index + 1, e = subs.size(); i < e; ++i ) 
        {
            emitToTokenSequence( subs.get( i ), post );
        }

        fu.setPreTokens( fu.getPreTokens().concat( pre ) );
        fu.setPostTokens( post.concat( fu.getPostTokens() ) );

        emitToFieldUnparser( subs.get( index ), fu );
    }

    // Nothing is recorded for an alternation field: each branch must be
    // unparsable on its own. References are checked where they are defined;
    // null branches build no node and have no shape.
    private
    void
    checkAlternatives( AlternationCombinator p )
        throws UnsupportedConstructException
    {
        for ( Combinator alt : p.getAlternatives() )
        {
            Combinator branch = CombinatorShapes.unwrapDontSkip( alt );

            if ( branch.kind() == Combinator.Kind.DEFER ||
                 branch.kind() == Combinator.Kind.NULL )
            {
                continue;
            }
            
            if ( branch.kind() == Combinator.Kind.ALTERNATION )
            {
                checkAlternatives( (AlternationCombinator) branch );
            }
            else if ( branch.kind() == Combinator.Kind.OPTIONAL &&
                      ( (OptionalCombinator) branch ).isBooleanized() )
            {
                OptionalCombinator opt = (OptionalCombinator) branch;

                deriveNode( opt.getPresentType(), opt );
                deriveNode( opt.getAbsentType(), opt );
            }
            else
            {
                NodeType t = branch.getType();

                if ( t == null || t.isAbstract() || t.isSynthetic() )
                {
                    throw unsupported( "Unsupported parser for node field", branch );
                }

                deriveNode( t, branch );
            }
        }
    }
}
