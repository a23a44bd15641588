package com.langforge.validation;

import java.util.Arrays;
import java.util.Map;

public
abstract
class Validator
{
    private final static Inputs inputs = new Inputs();
 
    protected
    final
    String
    getDefaultMessage( CharSequence inputName,
                       CharSequence msg )
    {
        String res;

        if ( inputName == null && msg == null ) res = null;
        else
        {
            StringBuilder sb = new StringBuilder();
            if ( inputName != null ) 
            {
                sb.append( "Input '" ).append( inputName ).append( "' " );
            }

            res = sb.append( msg ).toString();
        }

        return res;
    }

    // Must throw a runtime exception using the given message. Either or both
    // may be null. Most impls will simply throw an exception with a message
    // created by getDefaultMessage
    public
    abstract
    RuntimeException
    createException( CharSequence inputName,
                     CharSequence msg );

    // Deliberately not built on Strings.join: a bug there that calls back into
    // a validator would otherwise recurse until the stack is exhausted
    private
    CharSequence
    makeMessage( Object... message )
    {
        StringBuilder sb = new StringBuilder();

        if ( message != null )
        {
            for ( int i = 0, e = message.length; i < e; )
            {
                sb.append( message[ i ] );
                if ( ++i < e ) sb.append( ' ' );
            }
        }

        return sb;
    }
 
    // Typed to return a value so that callers can write 'throw v.fail( ... )'
    // where the compiler needs convincing that a method does not return
    public
    final
    RuntimeException
    fail( Object... message )
    { 
        throw createException( null, makeMessage( message ) );
    }

    public
    final
    RuntimeException
    createFail( Object... message )
    {
        return createException( (CharSequence) null, makeMessage( message ) );
    }

    public
    final
    void
    isTrue( boolean b,
            Object... message )
    {
        if ( ! b ) fail( message );
    }

    public
    final
    void
    isFalse( boolean b,
             Object... message )
    {
        isTrue( ! b, message );
    }

    public
    final
    < T >
    T
    notNull( T val,
             String inputName )
    {
        if ( val == null ) throw createException( inputName, "cannot be null" );
 
        return val;
    }

    public
    final
    < T, I extends Iterable< T > >
    I
    noneNull( I vals,
              String inputName )
    {
        notNull( vals, inputName ); 

        int i = 0;
        for ( T val : vals )
        {
            isTrue( val != null, "Element", i, "of", inputName, "is null" );
            i++;
        }

        return vals;
    }
 
    public
    final
    < T >
    T[]
    noneNull( T[] vals,
              String inputName )
    {
        noneNull( Arrays.asList( notNull( vals, inputName ) ), inputName );
        return vals;
    }

    public
    final
    < K, V >
    V
    get( Map< K, V > map,
         K key,
         String mapName )
    {
        inputs.notNull( map, "map" );

        V res = map.get( key );

        if ( res == null ) 
        {
            fail( "Map '" + mapName + "' has no value for key " + key );
        }

        return res;
    }

    public
    final
    int
    nonnegativeI( int val,
                  String inputName )
    {
        if ( val < 0 ) fail( inputName, "must be nonnegative (got", val, ")" );
        return val;
    }
}
