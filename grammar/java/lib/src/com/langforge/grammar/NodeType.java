package com.langforge.grammar;

import com.langforge.validation.Inputs;
import com.langforge.validation.State;

import com.langforge.lang.Lang;

import java.util.List;

// A variant of the syntax tree taxonomy. Instances are created through
// NodeTypes.Builder and compared by identity
public
final
class NodeType
{
    private static Inputs inputs = new Inputs();
    private static State state = new State();

    private final String name;
    private final NodeType base;
    private final boolean isAbstract;
    private final boolean isSynthetic;
    private final boolean isTokenNode;
    private final NodeType elementType;

    private final List< Field > fields = Lang.newList();

    // Base list type derived for this type when used as a list element
    private NodeType listType;

    NodeType( String name,
              NodeType base,
              boolean isAbstract,
              boolean isSynthetic,
              boolean isTokenNode,
              NodeType elementType )
    {
        this.name = name;
        this.base = base;
        this.isAbstract = isAbstract;
        this.isSynthetic = isSynthetic;
        this.isTokenNode = isTokenNode;
        this.elementType = elementType;
    }

    public String getName() { return name; }

    public NodeType getBase() { return base; }

    public boolean isAbstract() { return isAbstract; }
    public boolean isSynthetic() { return isSynthetic; }
    public boolean isTokenNode() { return isTokenNode; }

    public boolean isListType() { return elementType != null; }

    public NodeType getElementType() { return elementType; }

    NodeType getListType() { return listType; }

    void 
    setListType( NodeType listType ) 
    { 
        state.isTrue( this.listType == null, "List type already set for", name );
        this.listType = listType; 
    }

    // Whether this is the list type derived automatically for its element
    // type, as opposed to a list type declared explicitly
    public
    boolean
    isBaseListType()
    {
        return isListType() && elementType.getListType() == this;
    }

    Field
    addField( String fieldName )
    {
        inputs.notNull( fieldName, "fieldName" );

        for ( Field f : getParseFields() )
        {
            inputs.isFalse( 
                f.getName().equals( fieldName ), 
                "Duplicate field", fieldName, "in", name );
        }

        Field res = new Field( this, fieldName );
        fields.add( res );

        return res;
    }

    public List< Field > getDeclaredFields() { return Lang.unmodifiableList( fields ); }

    // Returns inherited fields followed by the fields this type declares, in
    // declaration order
    public
    List< Field >
    getParseFields()
    {
        List< Field > res = 
            base == null ? Lang.< Field >newList() : base.getParseFields();

        res.addAll( fields );
        return res;
    }

    public
    Field
    getField( String fieldName )
    {
        inputs.notNull( fieldName, "fieldName" );

        for ( Field f : getParseFields() )
        {
            if ( f.getName().equals( fieldName ) ) return f;
        }

        throw inputs.createFail( "No field", fieldName, "in", name );
    }

    public
    boolean
    isSubtypeOf( NodeType other )
    {
        inputs.notNull( other, "other" );

        for ( NodeType t = this; t != null; t = t.base ) 
        {
            if ( t == other ) return true;
        }

        return false;
    }

    // Returns the most derived type that both this and other inherit from (or
    // are), or null if they share no ancestor
    public
    NodeType
    commonAncestor( NodeType other )
    {
        inputs.notNull( other, "other" );

        for ( NodeType t = this; t != null; t = t.base )
        {
            if ( other.isSubtypeOf( t ) ) return t;
        }

        return null;
    }

    @Override public String toString() { return name; }
}
