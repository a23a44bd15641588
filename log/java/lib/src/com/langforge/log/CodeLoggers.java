package com.langforge.log;

import com.langforge.validation.Inputs;

import java.io.PrintStream;

public
final
class CodeLoggers
{
    private static Inputs inputs = new Inputs();

    private static CodeLogger defl = createStreamLogger( System.out );

    private CodeLoggers() {}

    public static CodeLogger getDefaultLogger() { return defl; }

    public
    static
    CodeLogger
    createStreamLogger( final PrintStream ps )
    {
        inputs.notNull( ps, "ps" );

        return
            new AbstractCodeLogger() {
                protected void logCodeImpl( CodeEvent ev ) {
                    ps.println( CodeEvents.format( ev ) );
                }
            };
    }

    // defl is neither volatile nor guarded: callers of replaceDefaultSink()
    // are expected to order that call before the logging they care about
    public
    static
    void
    replaceDefaultSink( final CodeEventSink sink )
    {
        inputs.notNull( sink, "sink" );

        if ( sink instanceof CodeLogger ) defl = (CodeLogger) sink;
        else
        {
            defl = 
                new AbstractCodeLogger() {
                    protected void logCodeImpl( CodeEvent ev ) {
                        sink.logCode( ev );
                    }
                };
        }
    }

    public static void code( Object... msg ) { defl.code( msg ); }

    public
    static
    void
    code( Throwable th,
          Object... msg )
    {
        defl.code( th, msg );
    }

    public static void warn( Object... msg ) { defl.warn( msg ); }
}
