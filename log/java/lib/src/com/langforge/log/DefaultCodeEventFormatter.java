package com.langforge.log;

import java.text.SimpleDateFormat;

public
class DefaultCodeEventFormatter
implements CodeEventFormatter
{
    private final static String EXCPT_SEP = "\n-------\n";
 
    // Approximately rfc3339, except that the zone offset has no ':' between
    // hours and minutes; appendTime() adds it
    private final static String RFC3339_APPROX_DATE_FMT =
        "yyyy-MM-dd'T'HH:mm:ss.SSSZ";

    public DefaultCodeEventFormatter() {}

    protected final void openBracket( StringBuilder sb ) { sb.append( "[ " ); }
    protected final void closeBracket( StringBuilder sb ) { sb.append( " ]" ); }

    protected
    void
    appendType( StringBuilder sb,
                CodeEvent ev )
    {
        openBracket( sb );
        sb.append( CodeEvents.type( ev ) );
        closeBracket( sb );
    }

    protected
    void
    appendMessage( StringBuilder sb,
                   CodeEvent ev )
    {
        if ( CodeEvents.message( ev ).length > 0 ) 
        {
            sb.append( ": " ).append( CodeEvents.messageText( ev ) );
        }
    }

    protected
    void
    appendThrowable( StringBuilder sb,
                     Throwable th,
                     boolean isTop )
    {
        if ( th != null )
        {
            sb.append( EXCPT_SEP );
            sb.append( isTop ? "Throwable " : "Caused by " );

            sb.append( th.getClass().getName() ).
               append( ": " ).
               append( th.getLocalizedMessage() );
     
            for ( StackTraceElement elt : th.getStackTrace() )
            {
                sb.append( '\n' ).append( elt );
            }
    
            appendThrowable( sb, th.getCause(), false );
        }
    }

    // SimpleDateFormat is not thread safe, so each call gets its own
    protected
    void
    appendTime( StringBuilder sb,
                long time )
    {
        String ts = new SimpleDateFormat( RFC3339_APPROX_DATE_FMT ).
            format( time );
 
        int len = ts.length();

        openBracket( sb );
        sb.append( ts, 0, len - 2 );
        sb.append( ':' );
        sb.append( ts, len - 2, len );
        closeBracket( sb );
    }

    public
    final
    void
    appendFormat( StringBuilder sb,
                  CodeEvent ev )
    {
        appendTime( sb, CodeEvents.time( ev ) );
        sb.append( ' ' );
        appendType( sb, ev );
        appendMessage( sb, ev );
        appendThrowable( sb, ev.throwable(), true );
    }
}
