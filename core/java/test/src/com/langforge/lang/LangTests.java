package com.langforge.lang;

import com.langforge.validation.Inputs;
import com.langforge.validation.State;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Test;

public
final
class LangTests
{
    private static Inputs inputs = new Inputs();
    private static State state = new State();

    @Test
    public
    void
    testPutAppendKeepsInsertionOrder()
    {
        Map< String, List< Integer > > m = Lang.newLinkedMap();

        Lang.putAppend( m, "b", 1 );
        Lang.putAppend( m, "a", 2 );
        Lang.putAppend( m, "b", 3 );

        Iterator< String > it = m.keySet().iterator();
        state.equalString( "b", it.next() );
        state.equalString( "a", it.next() );
        state.isFalse( it.hasNext() );

        state.equal( Arrays.asList( 1, 3 ), m.get( "b" ) );
    }

    @Test( expected = IllegalStateException.class )
    public
    void
    testPutUniqueFailsOnDuplicateKey()
    {
        Map< String, String > m = Lang.newMap();

        Lang.putUnique( m, "k", "v1" );
        Lang.putUnique( m, "k", "v2" );
    }

    @Test
    public
    void
    testUnmodifiableCopyIsStableAndDetached()
    {
        List< String > src = Lang.newList();
        src.add( "x" );

        List< String > copy = Lang.unmodifiableCopy( src, "src" );
        src.add( "y" );

        state.equalInt( 1, copy.size() );
        state.isTrue( copy == Lang.unmodifiableCopy( copy, "copy" ) );
    }

    @Test( expected = UnsupportedOperationException.class )
    public
    void
    testUnmodifiableCopyRejectsMutation()
    {
        Lang.unmodifiableCopy( Lang.< String >newList(), "l" ).add( "z" );
    }

    @Test( expected = IllegalArgumentException.class )
    public
    void
    testUnmodifiableCopyRejectsNullElements()
    {
        List< String > src = Lang.newList();
        src.add( null );

        Lang.unmodifiableCopy( src, "src" );
    }

    @Test
    public
    void
    testIdentitySetDistinguishesEqualInstances()
    {
        Set< String > s = Lang.newIdentitySet();

        String s1 = new String( "tok" );
        String s2 = new String( "tok" );

        s.add( s1 );
        s.add( s2 );
        s.add( s1 );

        state.equalInt( 2, s.size() );
    }

    @Test
    public
    void
    testRfc4627String()
    {
        state.equalString( 
            "\"a\\\"b\\n\"", Lang.getRfc4627String( "a\"b\n" ) );
    }

    @Test
    public
    void
    testJoin()
    {
        state.equalString( "a, 1, null", Strings.join( ", ", "a", 1, null ) );
        state.equalString( "", Strings.join( "-", Lang.emptyList() ) );
    }
}
