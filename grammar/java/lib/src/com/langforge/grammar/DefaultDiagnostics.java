package com.langforge.grammar;

import com.langforge.validation.Inputs;

import com.langforge.lang.Lang;
import com.langforge.lang.Strings;

import com.langforge.log.CodeLogger;
import com.langforge.log.CodeLoggers;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public
final
class DefaultDiagnostics
implements Diagnostics
{
    private static Inputs inputs = new Inputs();

    private final CodeLogger logger;
    private final Set< WarningKind > disabled;

    private final List< Warning > warnings = Lang.newList();

    private
    DefaultDiagnostics( Builder b )
    {
        this.logger = b.logger == null ? CodeLoggers.getDefaultLogger() : b.logger;
        this.disabled = EnumSet.copyOf( b.disabled );
    }

    private
    static
    String
    makeMessage( Object[] msg )
    {
        return Strings.join( " ", inputs.notNull( msg, "msg" ) ).toString();
    }

    public
    void
    check( boolean cond,
           SourceTextLocation loc,
           Object... msg )
    {
        if ( ! cond ) throw fatal( loc, msg );
    }

    public
    GrammarDiagnosticException
    fatal( SourceTextLocation loc,
           Object... msg )
    {
        return new GrammarDiagnosticException( loc, makeMessage( msg ) );
    }

    public
    void
    warnIf( WarningKind kind,
            boolean cond,
            SourceTextLocation loc,
            Object... msg )
    {
        inputs.notNull( kind, "kind" );

        if ( cond && ! disabled.contains( kind ) )
        {
            Warning w = new Warning( kind, loc, makeMessage( msg ) );

            warnings.add( w );
            logger.warn( w );
        }
    }

    public List< Warning > getWarnings() { return Lang.unmodifiableList( warnings ); }

    public
    List< Warning >
    getWarnings( WarningKind kind )
    {
        inputs.notNull( kind, "kind" );

        List< Warning > res = Lang.newList();
        for ( Warning w : warnings ) if ( w.getKind() == kind ) res.add( w );

        return res;
    }

    public
    final
    static
    class Builder
    {
        private CodeLogger logger;
        private final Set< WarningKind > disabled = 
            EnumSet.noneOf( WarningKind.class );

        public
        Builder
        setLogger( CodeLogger logger )
        {
            this.logger = inputs.notNull( logger, "logger" );
            return this;
        }

        public
        Builder
        disableWarning( WarningKind kind )
        {
            disabled.add( inputs.notNull( kind, "kind" ) );
            return this;
        }

        public DefaultDiagnostics build() { return new DefaultDiagnostics( this ); }
    }
}
