package com.langforge.unparse;

import com.langforge.validation.Inputs;

import com.langforge.log.CodeLoggers;

import com.langforge.grammar.Combinator;
import com.langforge.grammar.Grammar;

public
final
class UnparserPass
{
    private static Inputs inputs = new Inputs();

    private UnparserPass() {}

    // Computes, checks and finalizes unparsers for every rule of grammar, in
    // rule order, and returns the registry in its final state
    public
    static
    Unparsers
    createUnparsers( Grammar grammar,
                     UnparserContext ctx )
    {
        inputs.notNull( grammar, "grammar" );
        inputs.notNull( ctx, "ctx" );
        inputs.isTrue( 
            grammar.getNodeTypes() == ctx.getNodeTypes(),
            "Grammar and context use different node type registries" );

        Unparsers res = new Unparsers( ctx );

        for ( Combinator rule : grammar.getAllRules() ) res.compute( rule );

        res.checkNodesToRules();
        res.finalizeUnparsers();

        return res;
    }

    // Returns the unparsing tables of grammar, or null if the grammar cannot
    // be unparsed automatically or unparsers were not requested
    public
    static
    UnparsingTables
    run( Grammar grammar,
         UnparserContext ctx )
    {
        Unparsers u = createUnparsers( grammar, ctx );

        if ( u.isGenerationEnabled() ) return UnparsingTables.create( u );
        else
        {
            if ( ctx.isGenerateUnparser() ) 
            {
                CodeLoggers.code( "No unparsers generated for this grammar" );
            }

            return null;
        }
    }
}
