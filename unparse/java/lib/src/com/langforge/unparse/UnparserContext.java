package com.langforge.unparse;

import com.langforge.validation.Inputs;

import com.langforge.grammar.DefaultDiagnostics;
import com.langforge.grammar.Diagnostics;
import com.langforge.grammar.NodeTypes;

public
final
class UnparserContext
{
    private static Inputs inputs = new Inputs();

    private final NodeTypes nodeTypes;
    private final Diagnostics diagnostics;
    private final boolean generateUnparser;
    private final boolean logCanonicalParsers;
    private final boolean logStructuralEquality;

    private
    UnparserContext( Builder b )
    {
        this.nodeTypes = inputs.notNull( b.nodeTypes, "nodeTypes" );
        this.diagnostics = b.diagnostics == null ? 
            new DefaultDiagnostics.Builder().build() : b.diagnostics;
        this.generateUnparser = b.generateUnparser;
        this.logCanonicalParsers = b.logCanonicalParsers;
        this.logStructuralEquality = b.logStructuralEquality;
    }

    public NodeTypes getNodeTypes() { return nodeTypes; }
    public Diagnostics getDiagnostics() { return diagnostics; }

    public boolean isGenerateUnparser() { return generateUnparser; }

    public boolean isLogCanonicalParsers() { return logCanonicalParsers; }
    public boolean isLogStructuralEquality() { return logStructuralEquality; }

    public
    final
    static
    class Builder
    {
        private NodeTypes nodeTypes;
        private Diagnostics diagnostics;
        private boolean generateUnparser = true;
        private boolean logCanonicalParsers;
        private boolean logStructuralEquality;

        public
        Builder
        setNodeTypes( NodeTypes nodeTypes )
        {
            this.nodeTypes = inputs.notNull( nodeTypes, "nodeTypes" );
            return this;
        }

        public
        Builder
        setDiagnostics( Diagnostics diagnostics )
        {
            this.diagnostics = inputs.notNull( diagnostics, "diagnostics" );
            return this;
        }

        public
        Builder
        setGenerateUnparser( boolean generateUnparser )
        {
            this.generateUnparser = generateUnparser;
            return this;
        }

        public
        Builder
        setLogCanonicalParsers( boolean logCanonicalParsers )
        {
            this.logCanonicalParsers = logCanonicalParsers;
            return this;
        }

        public
        Builder
        setLogStructuralEquality( boolean logStructuralEquality )
        {
            this.logStructuralEquality = logStructuralEquality;
            return this;
        }

        public UnparserContext build() { return new UnparserContext( this ); }
    }
}
