package com.langforge.grammar;

public
final
class UndefinedRuleException
extends RuntimeException
{
    UndefinedRuleException( String msg ) { super( msg ); }
}
