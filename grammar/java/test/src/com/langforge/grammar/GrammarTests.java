package com.langforge.grammar;

import com.langforge.validation.State;

import java.util.Iterator;

import org.junit.Test;

public
final
class GrammarTests
{
    private static State state = new State();

    private final static TokenKind LPAR = TokenKind.literal( "LPar", "(" );
    private final static TokenKind RPAR = TokenKind.literal( "RPar", ")" );
    private final static TokenKind COMMA = TokenKind.literal( "Comma", "," );
    private final static TokenKind IDENT = TokenKind.variable( "Identifier" );

    private NodeType id;
    private NodeType paren;
    private NodeType absent;
    private NodeType present;

    private
    NodeTypes
    nodeTypes()
    {
        NodeTypes.Builder b = new NodeTypes.Builder();

        id = b.addTokenNode( "Id", null );
        paren = b.addNode( "Paren", null, "expr" );

        NodeType flag = b.addAbstractNode( "Flag", null );
        present = b.addNode( "FlagPresent", flag );
        absent = b.addNode( "FlagAbsent", flag );

        return b.build();
    }

    @Test
    public
    void
    testRulesKeepOrderAndResolveDefers()
    {
        Grammar.Builder b = Grammar.createBuilder( nodeTypes() );

        DeferCombinator ref = b.defer( "id" );

        b.addRule( "paren", 
            b.transform( paren, b.tok( LPAR ), ref, b.tok( RPAR ) ) );
        b.addRule( "id", b.transform( id, b.tok( IDENT ) ) );

        Grammar g = b.build();

        Iterator< String > it = g.getRuleNames().iterator();
        state.equalString( "paren", it.next() );
        state.equalString( "id", it.next() );

        state.isTrue( ref.getParser() == g.getRule( "id" ) );
        state.isTrue( ref.getType() == id );
        state.equalString( "id", g.getRule( "id" ).getRuleName() );
    }

    @Test( expected = UndefinedRuleException.class )
    public
    void
    testUndefinedRuleFailsBuild()
    {
        Grammar.Builder b = Grammar.createBuilder( nodeTypes() );

        b.addRule( "paren", 
            b.transform( paren, b.tok( LPAR ), b.defer( "nope" ) ) );

        b.build();
    }

    @Test( expected = IllegalStateException.class )
    public
    void
    testDuplicateRuleFails()
    {
        Grammar.Builder b = Grammar.createBuilder( nodeTypes() );

        b.addRule( "id", b.transform( id, b.tok( IDENT ) ) );
        b.addRule( "id", b.transform( id, b.tok( IDENT ) ) );
    }

    @Test
    public
    void
    testPickFindsSoleValue()
    {
        Grammar.Builder b = Grammar.createBuilder( nodeTypes() );

        ExtractCombinator p = 
            b.pick( b.tok( LPAR ), b.transform( id, b.tok( IDENT ) ), b.tok( RPAR ) );

        state.equalInt( 1, p.getIndex() );
        state.isTrue( p.getType() == id );
        state.equalString( "Pick(Tok(LPar), Id(Tok(Identifier)), Tok(RPar))[1]", p.toString() );
    }

    @Test
    public
    void
    testListsRecordSeparatorAndEmptiness()
    {
        NodeTypes.Builder nb = new NodeTypes.Builder();
        NodeType elt = nb.addTokenNode( "Id", null );
        NodeType lst = nb.listOf( elt );

        Grammar.Builder b = Grammar.createBuilder( nb.build() );

        ListCombinator l1 = b.list( lst, b.transform( elt, b.tok( IDENT ) ) );
        ListCombinator l2 = 
            b.listOrEmpty( lst, b.transform( elt, b.tok( IDENT ) ), b.tok( COMMA ) );

        state.isFalse( l1.isEmptyValid() );
        state.isTrue( l1.getSeparator() == null );
        state.equalInt( 1, l1.children().size() );
        state.equalString( "List(Id(Tok(Identifier)))", l1.toString() );

        state.isTrue( l2.isEmptyValid() );
        state.equalInt( 2, l2.children().size() );
        state.isTrue( l2.children().get( 1 ) == l2.getSeparator() );
        state.equalString( 
            "List(Id(Tok(Identifier)), sep=Tok(Comma), empty_valid)", 
            l2.toString() );
    }

    @Test
    public
    void
    testAlternationTypeIsCommonAncestor()
    {
        Grammar.Builder b = Grammar.createBuilder( nodeTypes() );

        Combinator pres = b.transform( present, b.tok( LPAR ) );
        Combinator abs = b.transform( absent, b.tok( RPAR ) );
        Combinator i = b.transform( id, b.tok( IDENT ) );

        state.equalString( "Flag", b.or( pres, b.tok( COMMA ), abs ).getType().getName() );
        state.isTrue( b.or( b.tok( COMMA ) ).getType() == null );

        // no shared ancestor, whatever the order
        state.isTrue( b.or( pres, i, abs ).getType() == null );
        state.isTrue( b.or( i, pres, abs ).getType() == null );
        state.isTrue( b.or( pres, abs, i ).getType() == null );
    }

    @Test( expected = IllegalArgumentException.class )
    public
    void
    testPickRejectsTwoValues()
    {
        Grammar.Builder b = Grammar.createBuilder( nodeTypes() );

        b.pick( 
            b.transform( id, b.tok( IDENT ) ), 
            b.tok( COMMA ), 
            b.transform( id, b.tok( IDENT ) ) );
    }

    @Test
    public
    void
    testOptBoolYieldsCommonBase()
    {
        Grammar.Builder b = Grammar.createBuilder( nodeTypes() );

        OptionalCombinator o = b.optBool( present, absent, b.tok( COMMA ) );

        state.isTrue( o.isBooleanized() );
        state.equalString( "Flag", o.getType().getName() );
        state.isFalse( o.discards() );
        state.equalInt( 2, o.getAlternatives().size() );
    }

    @Test( expected = IllegalArgumentException.class )
    public
    void
    testOptBoolRequiresAbstractBase()
    {
        Grammar.Builder b = Grammar.createBuilder( nodeTypes() );
        b.optBool( present, paren, b.tok( COMMA ) );
    }

    @Test
    public
    void
    testRuleLocationIsInherited()
    {
        Grammar.Builder b = Grammar.createBuilder( nodeTypes() );

        TokenCombinator t = b.tok( IDENT );
        SourceTextLocation loc = SourceTextLocation.create( "g.lkt", 3, 5 );

        b.addRule( "id", b.transform( id, t ), loc );

        state.isTrue( t.getLocation() == loc );
        state.equalString( "g.lkt [3,5]: oops", SourceTextLocation.prefix( loc, "oops" ) );
    }

    @Test
    public
    void
    testDontSkipRegistersHelperRule()
    {
        Grammar.Builder b = Grammar.createBuilder( nodeTypes() );

        TokenCombinator guard = b.tok( RPAR );
        DontSkipCombinator ds = 
            b.dontSkip( b.transform( id, b.tok( IDENT ) ), guard );

        b.addRule( "id", ds );
        Grammar g = b.build();

        state.equalInt( 1, g.getHelperRules().size() );
        state.isTrue( guard.isDontSkipParser() );
        state.isFalse( ds.isDontSkipParser() );
        state.equalInt( 2, g.getAllRules().size() );
        state.isTrue( ds.getType() == id );
    }

    @Test
    public
    void
    testDiagnosticsRecordWarningsAndRaiseFatal()
    {
        DefaultDiagnostics d = 
            new DefaultDiagnostics.Builder().
                disableWarning( WarningKind.UNPARSER_BAD_GRAMMAR ).
                build();

        d.warnIf( WarningKind.UNUSED_NODE_TYPE, true, null, "X", "is unused" );
        d.warnIf( WarningKind.UNUSED_NODE_TYPE, false, null, "Y" );
        d.warnIf( WarningKind.UNPARSER_BAD_GRAMMAR, true, null, "Z" );

        state.equalInt( 1, d.getWarnings().size() );
        state.equalString( "X is unused", d.getWarnings().get( 0 ).getMessage() );
        state.equalInt( 0, d.getWarnings( WarningKind.UNPARSER_BAD_GRAMMAR ).size() );

        SourceTextLocation loc = SourceTextLocation.create( "g.lkt", 1, 2 );

        try 
        { 
            d.check( false, loc, "Bad", "thing" ); 
            state.fail( "Expected failure" );
        }
        catch ( GrammarDiagnosticException gde )
        {
            state.equalString( "Bad thing", gde.getRawMessage() );
            state.equalString( "g.lkt [1,2]: Bad thing", gde.getMessage() );
        }
    }
}
