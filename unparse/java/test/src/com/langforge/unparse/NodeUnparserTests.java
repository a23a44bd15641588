package com.langforge.unparse;

import static com.langforge.unparse.UnparseFixtures.*;

import com.langforge.validation.State;

import com.langforge.grammar.Combinator;
import com.langforge.grammar.GrammarDiagnosticException;
import com.langforge.grammar.NodeType;

import org.junit.Test;

public
final
class NodeUnparserTests
{
    private static State state = new State();

    private final UnparseFixtures f = new UnparseFixtures();

    private
    NodeUnparser
    derive( Unparsers u,
            NodeType node,
            Combinator p )
    {
        Derivation d = u.derive( node, p );
        state.equal( Derivation.Status.DERIVED, d.getStatus() );

        return d.getUnparser();
    }

    private
    void
    assertUnsupported( NodeType node,
                       Combinator p,
                       String expct )
    {
        Derivation d = f.unparsers().derive( node, p );

        state.equal( Derivation.Status.UNSUPPORTED, d.getStatus() );
        state.equalString( expct, d.getReason() );
    }

    @Test
    public
    void
    testParenDerivation()
    {
        Unparsers u = f.unparsers();
        Combinator p = f.parenParser( LPAR, RPAR );

        RegularNodeUnparser ru = (RegularNodeUnparser) derive( u, f.paren, p );

        state.equalString( "(", ru.getPreTokens().dumps() );
        state.equalString( ")", ru.getPostTokens().dumps() );
        state.equalInt( 1, ru.getFieldUnparsers().size() );
        state.equalInt( 0, ru.getInterTokens().size() );

        FieldUnparser fu = ru.getFieldUnparsers().get( 0 );
        state.isTrue( fu.getPreTokens().isEmpty() );
        state.isTrue( fu.getPostTokens().isEmpty() );
        state.isFalse( fu.isAlwaysAbsent() );

        state.equalString(
            "Unparser for Paren:\n" +
            "   pre: (\n" +
            "\n" +
            "   if Paren.expr:  [field] \n" +
            "\n" +
            "   post: )\n",
            ru.dumps() );

        // deriving again from the same parser yields the same shape
        state.equalString( ru.dumps(), derive( u, f.paren, p ).dumps() );
    }

    @Test
    public
    void
    testDeclDerivationSplitsTokensAroundFields()
    {
        Unparsers u = f.unparsers();

        Combinator p = 
            f.b.transform( f.decl,
                f.b.optBool( f.flagPresent, f.flagAbsent, f.b.tok( CONST ) ),
                f.b.tok( VAR ),
                f.b.defer( "id" ),
                f.b.opt( f.b.pick( f.b.tok( EQ ), f.b.defer( "expr" ) ) ),
                f.b.tok( SEMI ) );

        state.equalString(
            "Unparser for Decl:\n" +
            "\n" +
            "   if Decl.flag:  [field] \n" +
            "\n" +
            "   tokens: var\n" +
            "   if Decl.name:  [field] \n" +
            "\n" +
            "   if Decl.value: = [field] \n" +
            "\n" +
            "   post: ;\n",
            derive( u, f.decl, p ).dumps() );
    }

    @Test
    public
    void
    testBooleanizedOptionalDerivation()
    {
        Unparsers u = f.unparsers();
        Combinator p = f.b.optBool( f.flagPresent, f.flagAbsent, f.b.tok( CONST ) );

        state.equalString( 
            "Unparser for FlagPresent:\n   pre: const\n", 
            derive( u, f.flagPresent, p ).dumps() );

        state.equalString( 
            "Unparser for FlagAbsent:\n", derive( u, f.flagAbsent, p ).dumps() );
    }

    @Test
    public
    void
    testNestedExtractionsAccumulateFieldTokens()
    {
        Combinator p =
            f.b.transform( f.paren,
                f.b.pick( 
                    f.b.tok( LBRACK ),
                    f.b.pick( f.b.tok( LPAR ), f.b.defer( "expr" ), f.b.tok( RPAR ) ),
                    f.b.tok( RBRACK ) ) );

        RegularNodeUnparser ru = 
            (RegularNodeUnparser) derive( f.unparsers(), f.paren, p );

        FieldUnparser fu = ru.getFieldUnparsers().get( 0 );

        state.equalString( "[ (", fu.getPreTokens().dumps() );
        state.equalString( ") ]", fu.getPostTokens().dumps() );
        state.isTrue( ru.getPreTokens().isEmpty() );
    }

    @Test
    public
    void
    testListTokenNodeAndNullDerivations()
    {
        Unparsers u = f.unparsers();

        ListNodeUnparser lu = (ListNodeUnparser) 
            derive( u, f.idList, f.b.list( f.idList, f.b.defer( "id" ), f.b.tok( COMMA ) ) );

        state.equalString( ",", lu.getSeparator().dumps() );
        state.equalString( "Unparser for Id.list:\n   separator: ,\n", lu.dumps() );

        lu = (ListNodeUnparser) 
            derive( u, f.idList, f.b.list( f.idList, f.b.defer( "id" ) ) );

        state.isTrue( lu.getSeparator() == null );
        state.equalString( "Unparser for Id.list:\n", lu.dumps() );

        NodeUnparser tu = derive( u, f.id, f.b.transform( f.id, f.b.tok( IDENT ) ) );
        state.isTrue( tu instanceof TokenNodeUnparser );
        state.equalString( "Unparser for Id\n", tu.dumps() );

        NodeUnparser nu = derive( u, f.paren, f.b.nul( f.paren ) );
        state.isTrue( nu instanceof NullNodeUnparser );
        state.equalString( "Unparser for Paren: null\n", nu.dumps() );
    }

    @Test
    public
    void
    testWrappersAreTransparent()
    {
        Unparsers u = f.unparsers();

        Combinator p = 
            f.b.dontSkip( 
                f.b.opt( f.parenParser( LPAR, RPAR ) ), f.b.tok( RPAR ) );

        state.equalString(
            derive( u, f.paren, f.parenParser( LPAR, RPAR ) ).dumps(),
            derive( u, f.paren, p ).dumps() );
    }

    @Test
    public
    void
    testAlternationFieldChecksBranches()
    {
        Combinator p =
            f.b.transform( f.paren, 
                f.b.tok( LPAR ),
                f.b.or( f.b.defer( "id" ), f.parenParser( LBRACK, RBRACK ) ),
                f.b.tok( RPAR ) );

        RegularNodeUnparser ru = 
            (RegularNodeUnparser) derive( f.unparsers(), f.paren, p );

        state.isFalse( ru.getFieldUnparsers().get( 0 ).isAlwaysAbsent() );

        Combinator bad =
            f.b.transform( f.paren, 
                f.b.tok( LPAR ),
                f.b.or( 
                    f.b.defer( "id" ), 
                    f.b.pick( f.b.tok( COMMA ), f.parenParser( LBRACK, RBRACK ) ) ),
                f.b.tok( RPAR ) );

        assertUnsupported( 
            f.paren, bad, 
            "Unsupported parser for unparsers generation: " +
            "Pick(Tok(Comma), Paren(Tok(LBrack), Defer(expr), Tok(RBrack)))[1]" );
    }

    @Test
    public
    void
    testAlternationFieldSkipsNullBranches()
    {
        Combinator p =
            f.b.transform( f.paren, 
                f.b.tok( LPAR ),
                f.b.or( 
                    f.b.nul( f.expr ), 
                    f.b.defer( "id" ), 
                    f.parenParser( LBRACK, RBRACK ) ),
                f.b.tok( RPAR ) );

        RegularNodeUnparser ru = 
            (RegularNodeUnparser) derive( f.unparsers(), f.paren, p );

        state.equalInt( 1, ru.getFieldUnparsers().size() );
        state.isFalse( ru.getFieldUnparsers().get( 0 ).isAlwaysAbsent() );
        state.equalString( "(", ru.getPreTokens().dumps() );
        state.equalString( ")", ru.getPostTokens().dumps() );
    }

    @Test
    public
    void
    testUnsupportedShapes()
    {
        assertUnsupported( 
            f.paren, f.b.row( f.b.tok( LPAR ) ),
            "Unsupported parser for unparsers generation: Row(Tok(LPar))" );

        assertUnsupported( 
            f.id, f.b.transform( f.id, f.b.tok( IDENT ), f.b.tok( SEMI ) ),
            "Unsupported token node parser for unparsers generation: " +
            "Id(Tok(Identifier), Tok(Semicolon))" );

        assertUnsupported(
            f.paren, 
            f.b.transform( f.paren, f.b.predicate( f.b.defer( "expr" ), "isOk" ) ),
            "Unsupported parser for node field: Predicate(Defer(expr), isOk)" );

        assertUnsupported(
            f.paren,
            f.b.transform( f.paren, 
                f.b.pick( f.b.opt( f.b.tok( LPAR ) ), f.b.defer( "expr" ) ) ),
            "Static sequence of tokens expected, but got: Opt(Tok(LPar))" );
    }

    @Test
    public
    void
    testFieldCountMismatchIsUnsupported()
    {
        Derivation d = 
            f.unparsers().derive( 
                f.paren, 
                f.b.transform( f.paren, f.b.defer( "expr" ), f.b.defer( "expr" ) ) );

        state.equal( Derivation.Status.UNSUPPORTED, d.getStatus() );
        state.isTrue( d.getReason().startsWith( "More values parsed than Paren" ) );
    }

    @Test
    public
    void
    testErrorOptionalTokensAreStatic()
    {
        Combinator p = 
            f.b.transform( f.paren, 
                f.b.tok( LPAR ), 
                f.b.noBacktrack(),
                f.b.defer( "expr" ), 
                f.b.optError( f.b.tok( RPAR ) ) );

        RegularNodeUnparser ru = 
            (RegularNodeUnparser) derive( f.unparsers(), f.paren, p );

        state.equalString( ")", ru.getPostTokens().dumps() );
        state.equalString( "(", ru.getPreTokens().dumps() );
    }

    @Test
    public
    void
    testNoDerivationOnceGenerationIsDisabled()
    {
        Unparsers u = 
            new Unparsers( f.contextBuilder().setGenerateUnparser( false ).build() );

        state.equal( 
            Derivation.Status.SESSION_ABORTED, 
            u.derive( f.paren, f.parenParser( LPAR, RPAR ) ).getStatus() );
    }

    @Test
    public
    void
    testCombineWithNullAndSelf()
    {
        Unparsers u = f.unparsers();

        NodeUnparser x = derive( u, f.paren, f.parenParser( LPAR, RPAR ) );
        NodeUnparser nul = derive( u, f.paren, f.b.nul( f.paren ) );

        state.isTrue( x.combine( nul, f.diags, null ) == x );
        state.isTrue( nul.combine( x, f.diags, null ) == x );
        state.equalString( x.dumps(), x.combine( x, f.diags, null ).dumps() );
    }

    @Test
    public
    void
    testCombineRejectsInconsistentPrefixTokens()
    {
        Unparsers u = f.unparsers();

        NodeUnparser x = derive( u, f.paren, f.parenParser( LPAR, RPAR ) );
        NodeUnparser y = derive( u, f.paren, f.parenParser( LBRACK, RPAR ) );

        try
        {
            x.combine( y, f.diags, null );
            state.fail( "Expected failure" );
        }
        catch ( GrammarDiagnosticException gde )
        {
            state.equalString( 
                "Inconsistent prefix tokens for Paren:\n  (\nand:\n  [", 
                gde.getRawMessage() );
        }
    }

    @Test( expected = IllegalStateException.class )
    public
    void
    testCombineRejectsDifferentVariants()
    {
        Unparsers u = f.unparsers();

        NodeUnparser x = derive( u, f.paren, f.parenParser( LPAR, RPAR ) );
        x.combine( new ListNodeUnparser( f.paren, null ), f.diags, null );
    }

    @Test
    public
    void
    testFieldCombine()
    {
        Unparsers u = f.unparsers();

        Combinator withValue = 
            f.b.transform( f.decl,
                f.b.nul( f.flag ),
                f.b.tok( VAR ),
                f.b.defer( "id" ),
                f.b.opt( f.b.pick( f.b.tok( EQ ), f.b.defer( "expr" ) ) ) );

        Combinator withoutValue = 
            f.b.transform( f.decl,
                f.b.nul( f.flag ),
                f.b.tok( VAR ),
                f.b.defer( "id" ),
                f.b.nul( f.expr ) );

        RegularNodeUnparser x = (RegularNodeUnparser) derive( u, f.decl, withValue );
        RegularNodeUnparser y = (RegularNodeUnparser) derive( u, f.decl, withoutValue );

        FieldUnparser fx = x.getFieldUnparsers().get( 2 );
        FieldUnparser fy = y.getFieldUnparsers().get( 2 );

        state.isFalse( fx.isAlwaysAbsent() );
        state.isTrue( fy.isAlwaysAbsent() );
        state.isTrue( fx.combine( fy, f.diags, null ) == fx );
        state.isTrue( fy.combine( fx, f.diags, null ) == fx );

        RegularNodeUnparser xy = 
            (RegularNodeUnparser) y.combine( x, f.diags, null );

        FieldUnparser merged = xy.getFieldUnparsers().get( 2 );

        state.isFalse( merged.isAlwaysAbsent() );
        state.equalString( "=", merged.getPreTokens().dumps() );
        state.isTrue( xy.getFieldUnparsers().get( 0 ).isAlwaysAbsent() );
    }

    @Test
    public
    void
    testFieldCombineRejectsInconsistentTokens()
    {
        Unparsers u = f.unparsers();

        RegularNodeUnparser x = (RegularNodeUnparser) 
            derive( u, f.paren, 
                f.b.transform( f.paren, f.b.pick( f.b.tok( LPAR ), f.b.defer( "expr" ) ) ) );

        RegularNodeUnparser y = (RegularNodeUnparser) 
            derive( u, f.paren, 
                f.b.transform( f.paren, f.b.pick( f.b.tok( COMMA ), f.b.defer( "expr" ) ) ) );

        try
        {
            x.getFieldUnparsers().get( 0 ).combine( 
                y.getFieldUnparsers().get( 0 ), f.diags, null );

            state.fail( "Expected failure" );
        }
        catch ( GrammarDiagnosticException gde )
        {
            state.equalString( 
                "Inconsistent prefix tokens for Paren.expr:\n  (\nand:\n  ,", 
                gde.getRawMessage() );
        }
    }
}
