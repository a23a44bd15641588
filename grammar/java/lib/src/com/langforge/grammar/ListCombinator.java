package com.langforge.grammar;

import com.langforge.lang.Lang;

import java.util.List;

public
final
class ListCombinator
extends Combinator
{
    private final NodeType listType;
    private final Combinator element;
    private final TokenCombinator separator;
    private final boolean emptyValid;

    ListCombinator( NodeType listType,
                    Combinator element,
                    TokenCombinator separator,
                    boolean emptyValid )
    {
        this.listType = listType;
        this.element = element;
        this.separator = separator;
        this.emptyValid = emptyValid;
    }

    public Kind kind() { return Kind.LIST; }

    public NodeType getType() { return listType; }

    public Combinator getElement() { return element; }

    // Returns the separator token, or null if elements are not separated
    public TokenCombinator getSeparator() { return separator; }

    public boolean isEmptyValid() { return emptyValid; }

    @Override
    public
    List< Combinator >
    children()
    {
        List< Combinator > res = Lang.newList( 2 );

        res.add( element );
        if ( separator != null ) res.add( separator );

        return Lang.unmodifiableList( res );
    }

    void
    appendTo( StringBuilder sb )
    {
        sb.append( "List(" );
        element.appendTo( sb );

        if ( separator != null ) 
        {
            sb.append( ", sep=" );
            separator.appendTo( sb );
        }

        if ( emptyValid ) sb.append( ", empty_valid" );
        sb.append( ')' );
    }
}
