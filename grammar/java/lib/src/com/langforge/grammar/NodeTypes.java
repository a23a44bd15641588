package com.langforge.grammar;

import com.langforge.validation.Inputs;
import com.langforge.validation.State;

import com.langforge.lang.Lang;

import java.util.List;
import java.util.Map;

// The node type registry of one grammar. Iteration follows declaration order,
// base list types being registered when first requested
public
final
class NodeTypes
{
    private static Inputs inputs = new Inputs();
    private static State state = new State();

    private final List< NodeType > types;
    private final Map< String, NodeType > byName;

    private
    NodeTypes( Builder b )
    {
        this.types = Lang.unmodifiableCopy( b.types, "types" );
        this.byName = Lang.unmodifiableCopy( b.byName );
    }

    public List< NodeType > getNodeTypes() { return types; }

    public
    NodeType
    get( String name )
    {
        inputs.notNull( name, "name" );
        return state.get( byName, name, "byName" );
    }

    public boolean contains( NodeType t ) { return byName.get( t.getName() ) == t; }

    public
    final
    static
    class Builder
    {
        private final List< NodeType > types = Lang.newList();
        private final Map< String, NodeType > byName = Lang.newLinkedMap();

        private boolean built;

        private
        NodeType
        register( NodeType t,
                  String... fieldNames )
        {
            state.isFalse( built, "Registry already built" );
            inputs.noneNull( fieldNames, "fieldNames" );

            Lang.putUnique( byName, t.getName(), t );
            types.add( t );

            for ( String f : fieldNames ) t.addField( f );

            return t;
        }

        private
        NodeType
        checkBase( NodeType base )
        {
            if ( base != null ) 
            {
                inputs.isTrue( 
                    byName.get( base.getName() ) == base,
                    "Base type", base, "is not declared in this registry" );
                
                inputs.isFalse( 
                    base.isTokenNode() || base.isListType(),
                    "Cannot derive from", base );
            }

            return base;
        }

        public
        NodeType
        addNode( String name,
                 NodeType base,
                 String... fieldNames )
        {
            inputs.notNull( name, "name" );

            return register( 
                new NodeType( name, checkBase( base ), false, false, false, null ),
                fieldNames );
        }

        public
        NodeType
        addAbstractNode( String name,
                         NodeType base,
                         String... fieldNames )
        {
            inputs.notNull( name, "name" );

            return register( 
                new NodeType( name, checkBase( base ), true, false, false, null ),
                fieldNames );
        }

        public
        NodeType
        addSyntheticNode( String name,
                          NodeType base,
                          String... fieldNames )
        {
            inputs.notNull( name, "name" );

            return register( 
                new NodeType( name, checkBase( base ), false, true, false, null ),
                fieldNames );
        }

        public
        NodeType
        addTokenNode( String name,
                      NodeType base )
        {
            inputs.notNull( name, "name" );

            return register( 
                new NodeType( name, checkBase( base ), false, false, true, null ) );
        }

        // Returns the list type derived for element, declaring it on first
        // request under the name <element>.list
        public
        NodeType
        listOf( NodeType element )
        {
            inputs.notNull( element, "element" );
            inputs.isTrue( 
                byName.get( element.getName() ) == element,
                "Element type", element, "is not declared in this registry" );

            NodeType res = element.getListType();

            if ( res == null )
            {
                res = register( 
                    new NodeType( 
                        element.getName() + ".list", 
                        null, false, false, false, element ) );
                
                element.setListType( res );
            }

            return res;
        }

        public
        NodeType
        addListNode( String name,
                     NodeType element )
        {
            inputs.notNull( name, "name" );

            NodeType base = listOf( element );

            return register( 
                new NodeType( name, base, false, false, false, element ) );
        }

        public
        NodeTypes
        build()
        {
            built = true;
            return new NodeTypes( this );
        }
    }
}
