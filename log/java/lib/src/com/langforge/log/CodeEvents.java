package com.langforge.log;

import com.langforge.validation.Inputs;

public
final
class CodeEvents
{
    private final static Inputs inputs = new Inputs();

    final static Object[] EMPTY_MSG = new Object[] {};

    private final static DefaultCodeEventFormatter DEFAULT_FORMATTER =
        new DefaultCodeEventFormatter();
    
    private CodeEvents() {}

    public
    static
    CodeEventType
    type( CodeEvent ev )
    {
        return inputs.notNull( inputs.notNull( ev, "ev" ).type(), "ev.type()" );
    }

    public
    static
    Object[]
    message( CodeEvent ev )
    {
        inputs.notNull( ev, "ev" );
        return inputs.notNull( ev.message(), "ev.message()" );
    }

    public
    static
    long
    time( CodeEvent ev )
    {
        return inputs.notNull( ev, "ev" ).time();
    }

    // The message parts joined by single spaces, without time or type
    public
    static
    CharSequence
    messageText( CodeEvent ev )
    {
        StringBuilder sb = new StringBuilder();

        Object[] msg = message( ev );
        for ( int i = 0, e = msg.length; i < e; )
        {
            sb.append( msg[ i ] );
            if ( ++i < e ) sb.append( ' ' );
        }

        return sb;
    }

    public
    static
    CharSequence
    format( CodeEvent ev,
            CodeEventFormatter fmtr )
    {
        inputs.notNull( ev, "ev" );
        inputs.notNull( fmtr, "fmtr" );

        StringBuilder res = new StringBuilder();
        fmtr.appendFormat( res, ev );

        return res;
    }

    public
    static
    CharSequence
    format( CodeEvent ev )
    {
        return format( ev, DEFAULT_FORMATTER );
    }

    // msg may be null; the returned event will have a non-null but empty
    // message
    public
    static
    CodeEvent
    create( final CodeEventType type,
            final Object[] msg,
            final Throwable th,
            final long time )
    {
        inputs.notNull( type, "type" );
        inputs.isTrue( time > 0, "time must be positive (got", time, ")" );

        return new CodeEvent() {
            public CodeEventType type() { return type; }
            public Object[] message() { return msg == null ? EMPTY_MSG : msg; }
            public Throwable throwable() { return th; }
            public long time() { return time; }
        };
    }
}
