package com.langforge.unparse;

import com.langforge.validation.Inputs;
import com.langforge.validation.State;

import com.langforge.lang.Lang;
import com.langforge.lang.Strings;

import com.langforge.log.CodeLoggers;

import com.langforge.grammar.AlternationCombinator;
import com.langforge.grammar.Combinator;
import com.langforge.grammar.DeferCombinator;
import com.langforge.grammar.DontSkipCombinator;
import com.langforge.grammar.ExtractCombinator;
import com.langforge.grammar.OptionalCombinator;
import com.langforge.grammar.PredicateCombinator;
import com.langforge.grammar.SequenceCombinator;
import com.langforge.grammar.TokenCombinator;
import com.langforge.grammar.TokenKind;

import java.util.List;

public
final
class CombinatorShapes
{
    private static Inputs inputs = new Inputs();
    private static State state = new State();

    private CombinatorShapes() {}

    static
    Combinator
    unwrapDontSkip( Combinator p )
    {
        while ( p.kind() == Combinator.Kind.DONT_SKIP ) 
        {
            p = ( (DontSkipCombinator) p ).getParser();
        }

        return p;
    }

    // Strips the wrappers that neither consume tokens nor shape the result
    static
    Combinator
    unwrapTransparent( Combinator p )
    {
        while ( true )
        {
            switch ( p.kind() )
            {
                case DONT_SKIP: p = ( (DontSkipCombinator) p ).getParser(); break;
                case PREDICATE: p = ( (PredicateCombinator) p ).getParser(); break;
                default: return p;
            }
        }
    }

    static
    boolean
    endsWithTermination( ExtractCombinator p )
    {
        SequenceCombinator row = p.getRow();

        if ( row.size() != 2 ) return false;

        Combinator term = row.get( 1 );

        return term.kind() == Combinator.Kind.TOKEN &&
            ( (TokenCombinator) term ).getTokenKind() == TokenKind.TERMINATION;
    }

    // Whether p creates a node directly, or only refers to parsers that do so
    // without parsing anything more. A node followed by the termination token
    // counts as creating the node
    public
    static
    boolean
    createsNode( Combinator p )
    {
        inputs.notNull( p, "p" );

        switch ( p.kind() )
        {
            case ALTERNATION:
                for ( Combinator alt : 
                        ( (AlternationCombinator) p ).getAlternatives() )
                {
                    if ( ! createsNode( alt ) ) return false;
                }
                return true;

            case DEFER: return p.getType() != null;

            case OPTIONAL:
                OptionalCombinator opt = (OptionalCombinator) p;
                return opt.isBooleanized() || createsNode( opt.getParser() );

            case PREDICATE:
                return createsNode( ( (PredicateCombinator) p ).getParser() );

            case DONT_SKIP:
                return createsNode( ( (DontSkipCombinator) p ).getParser() );

            case EXTRACT:
                ExtractCombinator ext = (ExtractCombinator) p;

                return ext.getIndex() == 0 && 
                    endsWithTermination( ext ) &&
                    createsNode( ext.getExtracted() );

            case TRANSFORM:
            case SKIP:
            case LIST:
                return true;

            default: return false;
        }
    }

    public
    static
    boolean
    hasNull( Combinator p )
    {
        inputs.notNull( p, "p" );

        if ( p.kind() == Combinator.Kind.NULL ) return true;

        for ( Combinator c : p.children() ) if ( hasNull( c ) ) return true;

        return false;
    }

    // Returns the first of parsers that has no null parser in it, or the
    // first parser if all of them have one
    public
    static
    Combinator
    findCanonicalParser( List< Combinator > parsers )
    {
        inputs.noneNull( parsers, "parsers" );
        inputs.isFalse( parsers.isEmpty(), "No parsers" );

        for ( Combinator p : parsers ) if ( ! hasNull( p ) ) return p;

        return parsers.get( 0 );
    }

    public
    static
    boolean
    structurallyEqual( List< Combinator > parsers,
                       boolean atTopLevel )
    {
        return structurallyEqual( parsers, atTopLevel, false );
    }

    /**
     * Whether the given parsers all yield the same unparsing shape. Below the
     * top level, parsers that only create nodes are considered equal: their
     * own shapes are checked where they are defined. When trace is set each
     * decision is logged.
     */
    public
    static
    boolean
    structurallyEqual( List< Combinator > parsers,
                       boolean atTopLevel,
                       boolean trace )
    {
        inputs.noneNull( parsers, "parsers" );
        return new EqualityCheck( trace ).run( parsers, atTopLevel, 0 );
    }

    private
    final
    static
    class EqualityCheck
    {
        private final boolean trace;

        private EqualityCheck( boolean trace ) { this.trace = trace; }

        private
        void
        log( int depth,
             Object... msg )
        {
            if ( trace )
            {
                StringBuilder sb = Strings.appendIndent( new StringBuilder(), depth * 2 );
                CodeLoggers.code( sb.append( Strings.join( " ", msg ) ) );
            }
        }

        private
        boolean
        run( List< Combinator > parsers,
             boolean atTopLevel,
             int depth )
        {
            List< Combinator > ps = Lang.newList( parsers.size() );

            for ( Combinator p : parsers )
            {
                Combinator u = unwrapTransparent( p );
                if ( u.kind() != Combinator.Kind.NULL ) ps.add( u );
            }

            log( depth, "parsers:", ps );

            boolean res = compare( ps, atTopLevel, depth );
            log( depth, "equal:", res );

            return res;
        }

        private
        boolean
        compare( List< Combinator > ps,
                 boolean atTopLevel,
                 int depth )
        {
            if ( ps.size() <= 1 ) return true;

            Combinator.Kind kind = ps.get( 0 ).kind();

            if ( sameKind( ps ) )
            {
                switch ( kind )
                {
                    case OPTIONAL:
                        if ( ! samePresentType( ps ) ) return false;
                        return childrenEqual( ps, depth );

                    case SEQUENCE:
                    case TRANSFORM:
                    case LIST:
                        return childrenEqual( ps, depth );

                    case TOKEN: return sameToken( ps );

                    case EXTRACT: return extractsEqual( ps, atTopLevel, depth );

                    case SKIP:
                        for ( Combinator p : ps )
                        {
                            if ( p.getType() != ps.get( 0 ).getType() ) return false;
                        }
                        return true;

                    case NO_BACKTRACK: return true;

                    case ALTERNATION:
                    case DEFER:
                        break;

                    default: throw state.createFail( "Unexpected parser:", ps.get( 0 ) );
                }
            }

            if ( atTopLevel ) return false;

            for ( Combinator p : ps )
            {
                Combinator resolved = p.kind() == Combinator.Kind.DEFER ?
                    ( (DeferCombinator) p ).getParser() : p;

                if ( ! createsNode( resolved ) ) return false;
            }

            return true;
        }

        private
        boolean
        sameKind( List< Combinator > ps )
        {
            for ( Combinator p : ps ) 
            {
                if ( p.kind() != ps.get( 0 ).kind() ) return false;
            }

            return true;
        }

        private
        boolean
        samePresentType( List< Combinator > ps )
        {
            Object expct = ( (OptionalCombinator) ps.get( 0 ) ).getPresentType();

            for ( Combinator p : ps )
            {
                if ( ( (OptionalCombinator) p ).getPresentType() != expct ) return false;
            }

            return true;
        }

        private
        boolean
        sameToken( List< Combinator > ps )
        {
            TokenCombinator expct = (TokenCombinator) ps.get( 0 );

            for ( Combinator p : ps )
            {
                TokenCombinator t = (TokenCombinator) p;

                if ( t.getTokenKind() != expct.getTokenKind() ) return false;

                if ( t.getMatchText() == null ? expct.getMatchText() != null :
                        ! t.getMatchText().equals( expct.getMatchText() ) )
                {
                    return false;
                }
            }

            return true;
        }

        private
        boolean
        extractsEqual( List< Combinator > ps,
                       boolean atTopLevel,
                       int depth )
        {
            List< Combinator > rows = Lang.newList( ps.size() );
            int index = ( (ExtractCombinator) ps.get( 0 ) ).getIndex();

            for ( Combinator p : ps )
            {
                ExtractCombinator ext = (ExtractCombinator) p;

                if ( ext.getIndex() != index ) return false;
                rows.add( ext.getRow() );
            }

            return run( rows, atTopLevel, depth + 1 );
        }

        // A list's separator, when it has one, is its second child
        private
        List< Combinator >
        shapeChildren( Combinator p )
        {
            List< Combinator > res = Lang.newList( p.children().size() );

            for ( Combinator c : p.children() )
            {
                if ( c.kind() != Combinator.Kind.NO_BACKTRACK ) res.add( c );
            }

            return res;
        }

        private
        boolean
        childrenEqual( List< Combinator > ps,
                       int depth )
        {
            List< List< Combinator > > children = Lang.newList( ps.size() );

            for ( Combinator p : ps ) 
            {
                List< Combinator > c = shapeChildren( p );

                if ( ! children.isEmpty() && 
                     c.size() != children.get( 0 ).size() )
                {
                    return false;
                }

                children.add( c );
            }

            for ( int i = 0, e = children.get( 0 ).size(); i < e; ++i )
            {
                List< Combinator > column = Lang.newList( ps.size() );
                for ( List< Combinator > c : children ) column.add( c.get( i ) );

                if ( ! run( column, false, depth + 1 ) ) return false;
            }

            return true;
        }
    }
}
