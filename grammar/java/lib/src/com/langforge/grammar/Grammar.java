package com.langforge.grammar;

import com.langforge.validation.Inputs;
import com.langforge.validation.State;

import com.langforge.lang.Lang;
import com.langforge.lang.Strings;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

public
final
class Grammar
{
    private static Inputs inputs = new Inputs();
    private static State state = new State();

    private final NodeTypes nodeTypes;
    private final Map< String, Combinator > rules;
    private final List< Combinator > helperRules;

    private 
    Grammar( Builder b,
             NodeTypes nodeTypes )
    {
        this.nodeTypes = nodeTypes;
        this.rules = Lang.unmodifiableCopy( b.rules );
        this.helperRules = Lang.unmodifiableCopy( b.helperRules, "helperRules" );
    }

    public NodeTypes getNodeTypes() { return nodeTypes; }

    public
    Combinator
    getRule( String name )
    {
        inputs.notNull( name, "name" );
        return state.get( rules, name, "rules" );
    }

    public Collection< String > getRuleNames() { return rules.keySet(); }

    public Collection< Combinator > getRules() { return rules.values(); }

    public List< Combinator > getHelperRules() { return helperRules; }

    public
    List< Combinator >
    getAllRules()
    {
        List< Combinator > res = Lang.newList( rules.size() + helperRules.size() );

        res.addAll( rules.values() );
        res.addAll( helperRules );

        return res;
    }

    public
    static
    Builder
    createBuilder( NodeTypes nodeTypes )
    {
        return new Builder( inputs.notNull( nodeTypes, "nodeTypes" ) );
    }

    public
    final
    static
    class Builder
    {
        private final NodeTypes nodeTypes;

        private final Map< String, Combinator > rules = Lang.newLinkedMap();
        private final List< Combinator > helperRules = Lang.newList();
        private final List< DeferCombinator > defers = Lang.newList();

        private Builder( NodeTypes nodeTypes ) { this.nodeTypes = nodeTypes; }

        private
        NodeType
        checkType( NodeType t,
                   String name )
        {
            inputs.notNull( t, name );
            inputs.isTrue( 
                nodeTypes.contains( t ), 
                "Type", t, "is not declared in the grammar's registry" );

            return t;
        }

        private
        List< Combinator >
        asList( Combinator[] parsers )
        {
            return Arrays.asList( inputs.noneNull( parsers, "parsers" ) );
        }

        public
        SequenceCombinator
        row( Combinator... parsers )
        {
            return new SequenceCombinator( asList( parsers ) );
        }

        public
        TransformCombinator
        transform( NodeType type,
                   Combinator... parsers )
        {
            checkType( type, "type" );

            inputs.isFalse( 
                type.isAbstract(), "Cannot build abstract type", type );
            inputs.isFalse( 
                type.isListType(), "List type", type, "needs a list parser" );

            return new TransformCombinator( type, row( parsers ) );
        }

        public
        ExtractCombinator
        extract( int index,
                 Combinator... parsers )
        {
            SequenceCombinator row = row( parsers );

            inputs.isTrue( 
                index >= 0 && index < row.size(), 
                "Index", index, "out of bounds for", row );

            return new ExtractCombinator( row, index );
        }

        public
        ExtractCombinator
        pick( Combinator... parsers )
        {
            inputs.noneNull( parsers, "parsers" );
            int index = -1;

            for ( int i = 0; i < parsers.length; ++i )
            {
                if ( ! parsers[ i ].discards() )
                {
                    inputs.isTrue( 
                        index < 0, 
                        "More than one value in pick:", Arrays.asList( parsers ) );

                    index = i;
                }
            }

            inputs.isTrue( 
                index >= 0, "No value to pick in", Arrays.asList( parsers ) );

            return extract( index, parsers );
        }

        private
        ListCombinator
        list( NodeType listType,
              Combinator element,
              TokenCombinator separator,
              boolean emptyValid )
        {
            checkType( listType, "listType" );
            inputs.notNull( element, "element" );
            inputs.isTrue( listType.isListType(), listType, "is not a list type" );

            return 
                new ListCombinator( listType, element, separator, emptyValid );
        }

        public
        ListCombinator
        list( NodeType listType,
              Combinator element )
        {
            return list( listType, element, null, false );
        }

        public
        ListCombinator
        list( NodeType listType,
              Combinator element,
              TokenCombinator separator )
        {
            return 
                list( listType, element, 
                      inputs.notNull( separator, "separator" ), false );
        }

        public
        ListCombinator
        listOrEmpty( NodeType listType,
                     Combinator element,
                     TokenCombinator separator )
        {
            return list( listType, element, separator, true );
        }

        public
        OptionalCombinator
        opt( Combinator parser )
        {
            inputs.notNull( parser, "parser" );
            return new OptionalCombinator( parser, null, null, false );
        }

        // An optional yielding a node of type present when parser matches and
        // of type absent otherwise. Both must derive from a common abstract
        // type
        public
        OptionalCombinator
        optBool( NodeType present,
                 NodeType absent,
                 Combinator parser )
        {
            checkType( present, "present" );
            checkType( absent, "absent" );
            inputs.notNull( parser, "parser" );

            NodeType base = present.commonAncestor( absent );

            inputs.isTrue( 
                present != absent && base != null && base.isAbstract(),
                "Alternatives", present, "and", absent, 
                "must derive from a common abstract type" );

            return new OptionalCombinator( parser, present, absent, false );
        }

        public
        OptionalCombinator
        optError( Combinator parser )
        {
            inputs.notNull( parser, "parser" );
            return new OptionalCombinator( parser, null, null, true );
        }

        public
        AlternationCombinator
        or( Combinator... alternatives )
        {
            inputs.isTrue( 
                inputs.noneNull( alternatives, "alternatives" ).length > 0, 
                "No alternatives" );

            return new AlternationCombinator( asList( alternatives ) );
        }

        public
        DeferCombinator
        defer( String ruleName )
        {
            DeferCombinator res = 
                new DeferCombinator( inputs.notNull( ruleName, "ruleName" ) );

            defers.add( res );
            return res;
        }

        public
        TokenCombinator
        tok( TokenKind kind )
        {
            return new TokenCombinator( inputs.notNull( kind, "kind" ), null );
        }

        public
        TokenCombinator
        tok( TokenKind kind,
             String matchText )
        {
            inputs.notNull( kind, "kind" );
            inputs.notNull( matchText, "matchText" );

            return new TokenCombinator( kind, matchText );
        }

        public
        NullCombinator
        nul( NodeType type )
        {
            return new NullCombinator( checkType( type, "type" ) );
        }

        public
        PredicateCombinator
        predicate( Combinator parser,
                   String predicateName )
        {
            inputs.notNull( parser, "parser" );
            inputs.notNull( predicateName, "predicateName" );

            return new PredicateCombinator( parser, predicateName );
        }

        public
        SkipCombinator
        skip( NodeType type )
        {
            return new SkipCombinator( checkType( type, "type" ) );
        }

        public NoBacktrackCombinator noBacktrack() { return new NoBacktrackCombinator(); }

        public
        DontSkipCombinator
        dontSkip( Combinator parser,
                  Combinator guard )
        {
            inputs.notNull( parser, "parser" );
            inputs.notNull( guard, "guard" );

            guard.markDontSkipParser();
            helperRules.add( guard );

            return new DontSkipCombinator( parser, guard );
        }

        public
        Builder
        addRule( String name,
                 Combinator body,
                 SourceTextLocation loc )
        {
            inputs.notNull( name, "name" );
            inputs.notNull( body, "body" );

            Lang.putUnique( rules, name, body );

            body.setRuleName( name );
            body.inheritLocation( loc );
 
            return this;
        }

        public
        Builder
        addRule( String name,
                 Combinator body )
        {
            return addRule( name, body, null );
        }

        public
        Grammar 
        build() 
        { 
            Set< String > undefined = new TreeSet< String >();

            for ( DeferCombinator d : defers )
            {
                Combinator target = rules.get( d.getName() );

                if ( target == null ) undefined.add( d.getName() );
                else if ( ! d.isResolved() ) d.resolve( target );
            }

            if ( ! undefined.isEmpty() )
            {
                throw new UndefinedRuleException(
                    "One or more parsers reference undefined rule(s): " + 
                    Strings.join( ", ", undefined ) );
            }

            return new Grammar( this, nodeTypes ); 
        }
    }
}
