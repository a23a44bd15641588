package com.langforge.grammar;

public
final
class Field
{
    private final NodeType owner;
    private final String name;

    Field( NodeType owner,
           String name )
    {
        this.owner = owner;
        this.name = name;
    }

    public NodeType getOwner() { return owner; }
    public String getName() { return name; }

    public
    String
    getQualifiedName()
    {
        return owner.getName() + "." + name;
    }

    @Override public String toString() { return getQualifiedName(); }
}
