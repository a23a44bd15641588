package com.langforge.lang;

import com.langforge.validation.Inputs;

import java.util.Arrays;
import java.util.Iterator;

// Code should call the varargs join; should unrolled variants for short
// argument lists turn out to matter they will go behind that method
public
final
class Strings
{
    private static Inputs inputs = new Inputs();

    private Strings() {}

    public
    static
    CharSequence
    join( CharSequence delim,
          Iterable< ? > toks )
    {
        inputs.notNull( delim, "delim" );
        inputs.notNull( toks, "toks" );

        StringBuilder res = new StringBuilder();

        for ( Iterator< ? > it = toks.iterator(); it.hasNext(); )
        {
            res.append( String.valueOf( it.next() ) );
            if ( it.hasNext() ) { res.append( delim ); }
        }

        return res;
    }

    public
    static
    CharSequence
    join( CharSequence delim,
          Object... toks )
    {
        inputs.notNull( toks, "toks" );
        return join( delim, Arrays.asList( toks ) );
    }

    public
    static
    StringBuilder
    appendIndent( StringBuilder sb,
                  int width )
    {
        inputs.notNull( sb, "sb" );
        inputs.nonnegativeI( width, "width" );

        for ( int i = 0; i < width; ++i ) sb.append( ' ' );
        return sb;
    }
}
