package com.langforge.log;

public
abstract
class AbstractCodeLogger
implements CodeLogger
{
    private long time() { return System.currentTimeMillis(); }

    // ev will be not-null when this is called
    protected
    abstract
    void
    logCodeImpl( CodeEvent ev );

    public
    final
    void
    logCode( CodeEvent ev )
    {
        if ( ev != null ) logCodeImpl( ev );
    }

    private
    void
    log( CodeEventType type,
         Throwable th,
         Object[] msg )
    {
        logCode( CodeEvents.create( type, msg, th, time() ) );
    }

    public
    final
    void
    code( Throwable th,
          Object... msg )
    {
        log( CodeEventType.CODE, th, msg );
    }

    public final void code( Object... msg ) { log( CodeEventType.CODE, null, msg ); }

    public
    final
    void
    warn( Throwable th,
          Object... msg )
    {
        log( CodeEventType.WARN, th, msg );
    }

    public final void warn( Object... msg ) { log( CodeEventType.WARN, null, msg ); }
}
