package com.langforge.validation;

public
class Inputs
extends Validator
{
    public
    IllegalArgumentException
    createException( CharSequence inputName,
                     CharSequence msg )
    {
        return new IllegalArgumentException( 
            getDefaultMessage( inputName, msg ) );
    }
}
