package com.langforge.log;

public
enum CodeEventType
{
    CODE,
    WARN;
}
