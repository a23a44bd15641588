package com.langforge.validation;

import com.langforge.lang.Lang;

import java.util.List;

public
class State
extends Validator
{
    // Can be overridden if needed. Generally only useful to do so in
    // specialized test code
    public
    IllegalStateException
    createException( CharSequence inputName,
                     CharSequence msg )
    {
        return new IllegalStateException( getDefaultMessage( inputName, msg ) );
    }

    // Abbreviated form of notNull for inline and test assertions, where a
    // caller could not be expected to recover from the failure anyway
    public
    final
    < T >
    T
    notNull( T obj )
    {
        isFalse( obj == null, (Object[]) null );
        return obj;
    }

    // Fails if one is null and the other isn't; otherwise returns true when
    // both are non-null, so callers can guard deeper comparisons:
    //
    //      if ( sameNullity( o1, o2 ) ) doSomeDeeperCheck( o1, o2 );
    //
    public
    final
    boolean
    sameNullity( Object expct,
                 Object actual )
    {
        if ( ( expct == null && actual != null ) || 
             ( expct != null && actual == null ) )
        {
            if ( expct == null ) 
            {
                fail( "'expct' is null, but 'actual' is:", actual );
            }
            else fail( "'actual' is null, but 'expct' is:", expct );
        }
        
        return expct != null;
    }

    private
    Object
    format( Object obj )
    {
        if ( obj instanceof CharSequence )
        {
            return Lang.getRfc4627String( (CharSequence) obj );
        }
        else return obj;
    }

    private
    Object[]
    createNotEqualMessage( Object expct,
                           Object actual )
    {
        return new Object[] {
            "Arguments are not equal (got", 
            format( actual ), 
            "but expected", 
            format( expct ), 
            ")"
        };
    }

    public
    final
    void
    equal( Object expct,
           Object actual,
           Object... msg )
    {
        if ( sameNullity( expct, actual ) )
        {
            isTrue( expct.equals( actual ), msg );
        }
    }

    public
    final
    void
    equal( Object expct,
           Object actual )
    {
        equal( expct, actual, createNotEqualMessage( expct, actual ) );
    }

    public
    final
    void
    equal( List< ? > expct,
           List< ? > actual )
    {
        equal( (Object) expct, (Object) actual );
    }

    public
    final
    void
    equalString( CharSequence s1,
                 CharSequence s2 )
    {
        if ( sameNullity( s1, s2 ) ) equal( s1.toString(), s2.toString() );
    }

    public
    final
    void
    equal( long expct,
           long actual,
           Object... msg )
    {
        isTrue( expct == actual, msg );
    }

    public
    final
    void
    equal( long expct,
           long actual )
    {
        equal( expct, actual, createNotEqualMessage( expct, actual ) );
    }

    public
    final
    void
    equalInt( int expct,
              int actual,
              Object... msg )
    {
        equal( (long) expct, (long) actual, msg );
    }

    public
    final
    void
    equalInt( int expct,
              int actual )
    {
        equal( (long) expct, (long) actual );
    }
}
