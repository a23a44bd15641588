package com.langforge.lang;

import com.langforge.validation.Inputs;
import com.langforge.validation.State;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.RandomAccess;
import java.util.Set;

public
final
class Lang
{
    private final static Inputs inputs = new Inputs();
    private final static State state = new State();

    private Lang() {}

    public static < V > List< V > newList() { return new ArrayList< V >(); }

    public
    static
    < V >
    List< V >
    newList( int expctMaxCap )
    {
        inputs.nonnegativeI( expctMaxCap, "expctMaxCap" );
        return new ArrayList< V >( expctMaxCap );
    }

    public 
    static 
    < V > 
    List< V > 
    emptyList() 
    { 
        return Collections.emptyList();
    }

    @SafeVarargs
    public
    static
    < V >
    List< V >
    asList( V... arr )
    {
        inputs.notNull( arr, "arr" );
        return Arrays.asList( arr );
    }

    public 
    static
    < V >
    List< V >
    singletonList( V elt )
    {
        return Collections.singletonList( elt );
    }

    // Returns a map that accepts null values, but is not guaranteed to accept
    // the null key
    public
    static
    < K, V >
    Map< K, V >
    newMap() 
    {
        return new HashMap< K, V >(); 
    }

    // Iteration follows insertion order; callers that must produce identical
    // output across runs use this instead of newMap()
    public
    static
    < K, V >
    Map< K, V >
    newLinkedMap()
    {
        return new LinkedHashMap< K, V >();
    }

    // Keys are compared with ==, for objects whose equals() is structural but
    // which must be tracked by instance
    public
    static
    < V >
    Set< V >
    newIdentitySet()
    {
        return Collections.newSetFromMap( new IdentityHashMap< V, Boolean >() );
    }

    public
    static
    < K, V >
    Map< K, V >
    unmodifiableMap( Map< K, V > m )
    {
        inputs.notNull( m, "m" );
        return Collections.unmodifiableMap( m );
    }

    public
    static
    < V >
    List< V >
    unmodifiableList( List< V > l )
    {
        inputs.notNull( l, "l" );
        return Collections.unmodifiableList( l );
    }

    private
    final
    static
    class ImmutableList< V, L extends List< V > & RandomAccess >
    extends AbstractList< V >
    implements RandomAccess
    {
        private final L list;
        private final boolean allowNullElts;

        private 
        ImmutableList( L list,
                       boolean allowNullElts ) 
        { 
            this.list = list; 
            this.allowNullElts = allowNullElts;
        }

        public int size() { return list.size(); }

        public V get( int i ) { return list.get( i ); }
    }

    // Returns l itself if it is already the result of a previous call with
    // the same allowNullElts
    public
    static
    < V >
    List< V >
    unmodifiableCopy( List< V > l,
                      String listName,
                      boolean allowNullElts )
    {
        inputs.notNull( l, "l" );

        if ( l instanceof ImmutableList && 
             ( (ImmutableList< ?, ? >) l ).allowNullElts == allowNullElts ) 
        {
            return l;
        }

        ArrayList< V > copy = new ArrayList< V >( l.size() );

        int indx = 0;

        for ( V elt : l )
        {
            if ( elt == null && ! allowNullElts )
            {
                inputs.fail( 
                    "List '" + listName + "' contains null at index", indx );
            }
            else copy.add( elt );

            ++indx;
        }

        return new ImmutableList< V, ArrayList< V > >( copy, allowNullElts );
    }

    public
    static
    < V >
    List< V >
    unmodifiableCopy( List< V > l,
                      String listName )
    {
        return unmodifiableCopy( l, listName, false );
    }

    public
    static
    < V >
    List< V >
    unmodifiableCopy( List< V > l )
    {
        return unmodifiableCopy( l, "l", true );
    }

    public
    static
    < K, V >
    Map< K, V >
    unmodifiableCopy( Map< K, V > m )
    {
        inputs.notNull( m, "m" );
        return unmodifiableMap( new LinkedHashMap< K, V >( m ) );
    }

    // Does a put only if m does not already contain key
    public
    static
    < K, V >
    void
    putUnique( Map< K, V > m,
               K key,
               V val )
    {
        inputs.notNull( m, "m" );
        inputs.notNull( key, "key" );

        if ( m.containsKey( key ) )
        {
            state.fail( 
                "Map already contains value", m.get( key ), "for key", key,
                "(Attempt to set value", val + ")" );
        }
        else m.put( key, val );
    }

    public
    static
    < K, V >
    void
    putAppend( Map< K, List< V > > map,
               K key,
               V val )
    {
        inputs.notNull( map, "map" );
        inputs.notNull( key, "key" );
        inputs.notNull( val, "val" );

        List< V > appendTarg = map.get( key );

        if ( appendTarg == null )
        {
            appendTarg = newList();
            map.put( key, appendTarg );
        }

        appendTarg.add( val );
    }

    private
    static
    void
    appendChar( char ch,
                StringBuilder sb )
    {
        switch ( ch )
        {
            case '"': sb.append( "\\\"" ); break;
            case '\\': sb.append( "\\\\" ); break;
            case '\b': sb.append( "\\b" ); break;
            case '\f': sb.append( "\\f" ); break;
            case '\n': sb.append( "\\n" ); break;
            case '\r': sb.append( "\\r" ); break;
            case '\t': sb.append( "\\t" ); break;

            default:
                if ( ch < 0x20 ) sb.append( String.format( "\\u%04x", (int) ch ) );
                else sb.append( ch );
        }
    }

    public
    static
    StringBuilder
    appendRfc4627String( StringBuilder sb,
                         CharSequence str )
    {
        inputs.notNull( sb, "sb" );
        inputs.notNull( str, "str" );

        sb.append( '"' );
        for ( int i = 0, e = str.length(); i < e; ++i ) 
        {
            appendChar( str.charAt( i ), sb );
        }
        sb.append( '"' );

        return sb;
    }

    public
    static
    CharSequence
    getRfc4627String( CharSequence str )
    {
        return appendRfc4627String( new StringBuilder(), str );
    }
}
