package com.langforge.grammar;

public
enum WarningKind
{
    UNUSED_NODE_TYPE,
    UNPARSER_BAD_GRAMMAR;
}
