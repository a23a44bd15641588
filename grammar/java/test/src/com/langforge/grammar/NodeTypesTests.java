package com.langforge.grammar;

import com.langforge.validation.State;

import java.util.List;

import org.junit.Test;

public
final
class NodeTypesTests
{
    private static State state = new State();

    @Test
    public
    void
    testParseFieldsPutInheritedFieldsFirst()
    {
        NodeTypes.Builder b = new NodeTypes.Builder();

        NodeType expr = b.addAbstractNode( "Expr", null, "loc" );
        NodeType binOp = b.addNode( "BinOp", expr, "left", "op", "right" );

        List< Field > fields = binOp.getParseFields();

        state.equalInt( 4, fields.size() );
        state.equalString( "Expr.loc", fields.get( 0 ).getQualifiedName() );
        state.equalString( "BinOp.left", fields.get( 1 ).getQualifiedName() );
        state.equalString( "BinOp.right", fields.get( 3 ).getQualifiedName() );
        state.equalInt( 3, binOp.getDeclaredFields().size() );
    }

    @Test( expected = IllegalArgumentException.class )
    public
    void
    testDuplicateInheritedFieldFails()
    {
        NodeTypes.Builder b = new NodeTypes.Builder();

        NodeType expr = b.addAbstractNode( "Expr", null, "loc" );
        b.addNode( "Lit", expr, "loc" );
    }

    @Test( expected = IllegalStateException.class )
    public
    void
    testDuplicateTypeNameFails()
    {
        NodeTypes.Builder b = new NodeTypes.Builder();

        b.addNode( "Id", null );
        b.addNode( "Id", null );
    }

    @Test
    public
    void
    testListTypes()
    {
        NodeTypes.Builder b = new NodeTypes.Builder();

        NodeType id = b.addNode( "Id", null );
        NodeType ids = b.addListNode( "IdList", id );
        NodeTypes types = b.build();

        NodeType base = types.get( "Id.list" );

        state.isTrue( base == b.listOf( id ) );
        state.isTrue( base.isBaseListType() );
        state.isFalse( ids.isBaseListType() );
        state.isTrue( ids.isListType() );
        state.isTrue( ids.isSubtypeOf( base ) );
        state.isTrue( ids.getElementType() == id );

        state.equalInt( 3, types.getNodeTypes().size() );
        state.isTrue( types.getNodeTypes().get( 1 ) == base );
    }

    @Test
    public
    void
    testCommonAncestor()
    {
        NodeTypes.Builder b = new NodeTypes.Builder();

        NodeType root = b.addAbstractNode( "Node", null );
        NodeType expr = b.addAbstractNode( "Expr", root );
        NodeType lit = b.addNode( "Lit", expr );
        NodeType name = b.addNode( "Name", expr );
        NodeType stmt = b.addNode( "Stmt", root );
        NodeType other = b.addNode( "Other", null );

        state.isTrue( lit.commonAncestor( name ) == expr );
        state.isTrue( lit.commonAncestor( stmt ) == root );
        state.isTrue( lit.commonAncestor( lit ) == lit );
        state.isTrue( lit.commonAncestor( other ) == null );
    }
}
