package com.langforge.unparse;

public
abstract
class Unparser
{
    Unparser() {}

    abstract
    void
    dump( StringBuilder sb );

    public
    final
    String
    dumps()
    {
        StringBuilder sb = new StringBuilder();
        dump( sb );

        return sb.toString();
    }

    @Override public String toString() { return dumps(); }
}
