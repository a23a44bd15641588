package com.langforge.unparse;

import com.langforge.validation.Inputs;
import com.langforge.validation.State;

import com.langforge.lang.Lang;

import com.langforge.log.CodeLoggers;

import com.langforge.grammar.Combinator;
import com.langforge.grammar.Diagnostics;
import com.langforge.grammar.ExtractCombinator;
import com.langforge.grammar.NodeType;
import com.langforge.grammar.OptionalCombinator;
import com.langforge.grammar.SourceTextLocation;
import com.langforge.grammar.TokenCombinator;
import com.langforge.grammar.TokenKind;
import com.langforge.grammar.WarningKind;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds one unparser per node type for a grammar. A session calls {@link
 * #compute} on every rule, then {@link #checkNodesToRules}, then {@link
 * #finalizeUnparsers}.
 *
 * <p>Errors in the grammar are fatal and raised through the session's {@link
 * com.langforge.grammar.Diagnostics}. Grammars that are valid but too
 * irregular to unparse instead disable generation for the rest of the
 * session, with a warning; the grammar walk still completes so that the
 * other checks run.
 */
public
final
class Unparsers
{
    private static Inputs inputs = new Inputs();
    private static State state = new State();

    private final static Comparator< TokenUnparser > BY_DUMP =
        new Comparator< TokenUnparser >() {
            public int compare( TokenUnparser t1, TokenUnparser t2 ) {
                return t1.dumps().compareTo( t2.dumps() );
            }
        };

    private final UnparserContext ctx;
    private final Diagnostics diags;
    private final NodeUnparserDerivation derivation;

    private boolean generationEnabled;
    private boolean finalized;

    private final Map< NodeType, List< Combinator > > nodesToRules = 
        Lang.newLinkedMap();

    private final Map< NodeType, List< NodeUnparser > > occurrences = 
        Lang.newLinkedMap();

    private final Map< TokenKind, Map< String, TokenUnparser > > tokenUnparsers =
        Lang.newLinkedMap();

    private final Map< NodeType, Combinator > canonicalParsers = 
        Lang.newLinkedMap();

    private final Map< NodeType, NodeUnparser > nodeUnparsers = 
        Lang.newLinkedMap();

    private final List< TokenSequenceUnparser > tokenSequences = Lang.newList();
    private final Set< TokenSequenceUnparser > seenSequences = 
        Lang.newIdentitySet();

    public
    Unparsers( UnparserContext ctx )
    {
        this.ctx = inputs.notNull( ctx, "ctx" );
        this.diags = ctx.getDiagnostics();
        this.generationEnabled = ctx.isGenerateUnparser();
        this.derivation = new NodeUnparserDerivation( this );
    }

    public UnparserContext getContext() { return ctx; }

    // Whether unparsers are still to be generated. Once false it stays false
    public boolean isGenerationEnabled() { return generationEnabled; }

    public
    void
    abortUnparser( String msg )
    {
        inputs.notNull( msg, "msg" );

        diags.warnIf( 
            WarningKind.UNPARSER_BAD_GRAMMAR, 
            true, 
            null,
            msg + " This prevents the generation of an automatic unparser." +
                ( generationEnabled ? 
                    "\nFor more information, enable the structural-equality " +
                    "trace." : "" ) );

        generationEnabled = false;
    }

    // Returns the cached unparser for the token p matches, or null if p is
    // null
    public
    TokenUnparser
    getTokenUnparser( TokenCombinator p )
    {
        if ( p == null ) return null;

        TokenKind kind = p.getTokenKind();
        String matchText = p.getMatchText();
        if ( matchText != null && matchText.isEmpty() ) matchText = null;

        if ( matchText == null && ! kind.hasLiteral() )
        {
            throw diags.fatal( 
                p.getLocation(), 
                "Token " + kind + " has no fixed text, so " + p + 
                    " needs a match text to be unparsed" );
        }

        Map< String, TokenUnparser > byText = tokenUnparsers.get( kind );

        if ( byText == null ) 
        {
            byText = Lang.newLinkedMap();
            tokenUnparsers.put( kind, byText );
        }

        TokenUnparser res = byText.get( matchText );

        if ( res == null )
        {
            res = new TokenUnparser( kind, matchText );
            byText.put( matchText, res );
        }

        return res;
    }

    public
    Derivation
    derive( NodeType node,
            Combinator parser )
    {
        return derivation.derive( node, parser );
    }

    private
    void
    append( NodeType node,
            Combinator p )
    {
        Lang.putAppend( nodesToRules, node, p );

        if ( generationEnabled )
        {
            Derivation d = derivation.derive( node, p );

            switch ( d.getStatus() )
            {
                case DERIVED: 
                    Lang.putAppend( occurrences, node, d.getUnparser() ); 
                    break;

                case UNSUPPORTED: throw diags.fatal( d.getLocation(), d.getReason() );

                default: break;
            }
        }
    }

    // Only an extraction below the root of a rule loses information fatally;
    // one at the root disables generation once the rule is walked.
    private
    void
    checkTopLevelExtract( Combinator root,
                          ExtractCombinator p,
                          boolean topLevel )
    {
        diags.check(
            ! generationEnabled || 
                ! topLevel || 
                p == CombinatorShapes.unwrapTransparent( root ) ||
                CombinatorShapes.endsWithTermination( p ),
            p.getLocation(),
            "Top-level information loss prevents unparsers generation" );
    }

    private
    void
    computeInternal( Combinator root,
                     Combinator p,
                     boolean topLevel )
    {
        switch ( p.kind() )
        {
            // Nodes built by error recovery say nothing about unparsing
            case SKIP: return;

            case OPTIONAL:
                OptionalCombinator opt = (OptionalCombinator) p;

                if ( opt.isBooleanized() )
                {
                    for ( NodeType alt : opt.getAlternatives() ) append( alt, p );
                    topLevel = false;
                }
                break;

            case LIST:
            case TRANSFORM:
                append( p.getType(), p );
                topLevel = false;
                break;

            case EXTRACT: 
                checkTopLevelExtract( root, (ExtractCombinator) p, topLevel );
                break;

            default: break;
        }

        for ( Combinator c : p.children() ) computeInternal( root, c, topLevel );
    }

    // Records every node type that rule builds along with the parser building
    // it and, while generation is enabled, derives the matching unparser.
    // Helper rules of dont-skip parsers are ignored
    public
    void
    compute( Combinator rule )
    {
        inputs.notNull( rule, "rule" );
        state.isFalse( finalized, "Unparsers are already finalized" );

        if ( rule.isDontSkipParser() ) return;

        computeInternal( rule, rule, true );

        if ( ! CombinatorShapes.createsNode( rule ) )
        {
            abortUnparser( 
                "'" + rule.getRuleName() + "' toplevel rule loses information." );
        }
    }

    private
    boolean
    isUnused( NodeType t )
    {
        return ! nodesToRules.containsKey( t ) &&
            ! t.isAbstract() &&
            ! t.isSynthetic() &&
            ! t.isBaseListType();
    }

    public
    void
    checkNodesToRules()
    {
        for ( NodeType t : ctx.getNodeTypes().getNodeTypes() )
        {
            diags.warnIf( 
                WarningKind.UNUSED_NODE_TYPE,
                isUnused( t ),
                null,
                t + " has no parser, and is marked neither abstract nor " +
                    "synthetic" );
        }

        if ( ! generationEnabled ) return;

        for ( Map.Entry< NodeType, List< Combinator > > e : 
                nodesToRules.entrySet() )
        {
            NodeType node = e.getKey();

            boolean eq = CombinatorShapes.structurallyEqual( 
                e.getValue(), true, ctx.isLogStructuralEquality() );

            if ( ! eq )
            {
                abortUnparser( 
                    "Node " + node + " is parsed in different incompatible " +
                    "ways." );

                return;
            }

            Combinator canonical = 
                CombinatorShapes.findCanonicalParser( e.getValue() );

            canonicalParsers.put( node, canonical );

            if ( ctx.isLogCanonicalParsers() )
            {
                CodeLoggers.code( "Canonical parser for", node + ":", canonical );
            }
        }
    }

    private
    NodeUnparser
    combineAll( NodeType node,
                List< NodeUnparser > occs )
    {
        List< NodeUnparser > nonNull = Lang.newList( occs.size() );

        for ( NodeUnparser u : occs ) 
        {
            if ( ! ( u instanceof NullNodeUnparser ) ) nonNull.add( u );
        }

        state.isFalse( 
            nonNull.isEmpty(), 
            "No non-null unparser for non-synthetic node:", node );

        Combinator canonical = canonicalParsers.get( node );
        SourceTextLocation loc = 
            canonical == null ? null : canonical.getLocation();

        NodeUnparser res = nonNull.get( 0 );

        for ( int i = 1, e = nonNull.size(); i < e; ++i )
        {
            res = res.combine( nonNull.get( i ), diags, loc );
        }

        return res;
    }

    // Merges the unparsers derived for each node type into one, in node type
    // declaration order, and collects the token sequences they use. Does
    // nothing more than mark this instance finalized once generation is
    // disabled
    public
    void
    finalizeUnparsers()
    {
        state.isFalse( finalized, "Unparsers are already finalized" );
        finalized = true;

        if ( ! generationEnabled ) return;

        for ( NodeType node : ctx.getNodeTypes().getNodeTypes() )
        {
            List< NodeUnparser > occs = occurrences.get( node );

            if ( occs != null )
            {
                NodeUnparser u = combineAll( node, occs );

                nodeUnparsers.put( node, u );
                u.collect( this );
            }
        }
    }

    void
    collectTokenSequence( TokenSequenceUnparser seq )
    {
        if ( seenSequences.add( seq ) ) tokenSequences.add( seq );
    }

    public boolean isFinalized() { return finalized; }

    // Returns a snapshot: the registry's own lists stay parallel to the
    // occurrences derived from them
    public
    Map< NodeType, List< Combinator > >
    getNodesToRules()
    {
        Map< NodeType, List< Combinator > > res = Lang.newLinkedMap();

        for ( Map.Entry< NodeType, List< Combinator > > e : 
                nodesToRules.entrySet() )
        {
            res.put( e.getKey(), Lang.unmodifiableCopy( e.getValue() ) );
        }

        return Lang.unmodifiableMap( res );
    }

    public
    List< NodeUnparser >
    getOccurrences( NodeType node )
    {
        inputs.notNull( node, "node" );

        List< NodeUnparser > res = occurrences.get( node );

        if ( res == null ) return Lang.emptyList();
        else return Lang.unmodifiableList( res );
    }

    public
    Combinator
    getCanonicalParser( NodeType node )
    {
        return canonicalParsers.get( inputs.notNull( node, "node" ) );
    }

    public
    NodeUnparser
    getNodeUnparser( NodeType node )
    {
        return nodeUnparsers.get( inputs.notNull( node, "node" ) );
    }

    Map< NodeType, NodeUnparser > getNodeUnparsers() { return nodeUnparsers; }

    Map< NodeType, Combinator > getCanonicalParsers() { return canonicalParsers; }

    public
    List< TokenUnparser >
    getSortedTokenUnparsers()
    {
        List< TokenUnparser > res = Lang.newList();

        for ( Map< String, TokenUnparser > m : tokenUnparsers.values() )
        {
            res.addAll( m.values() );
        }

        Collections.sort( res, BY_DUMP );

        return res;
    }

    // Returns the distinct token sequences of the final unparsers. Empty
    // until finalizeUnparsers has run
    public
    List< TokenSequenceUnparser >
    getTokenSequenceUnparsers()
    {
        return Lang.unmodifiableList( tokenSequences );
    }
}
