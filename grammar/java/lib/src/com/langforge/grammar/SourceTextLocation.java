package com.langforge.grammar;

import com.langforge.validation.Inputs;

public
final
class SourceTextLocation
{
    private static Inputs inputs = new Inputs();

    private final CharSequence fileName;
    private final int line;
    private final int col;

    private
    SourceTextLocation( CharSequence fileName,
                        int line,
                        int col )
    {
        this.fileName = fileName;
        this.line = line;
        this.col = col;
    }

    public CharSequence getFileName() { return fileName; }
    public int getLine() { return line; }
    public int getColumn() { return col; }

    @Override
    public
    String
    toString()
    {
        return 
            new StringBuilder().
                append( fileName ).
                append( " [" ).
                append( line ).
                append( ',' ).
                append( col ).
                append( ']' ).
                toString();
    }

    // "file [line,col]: msg", or just msg when loc is null
    public
    static
    String
    prefix( SourceTextLocation loc,
            CharSequence msg )
    {
        inputs.notNull( msg, "msg" );

        if ( loc == null ) return msg.toString();
        else return loc.toString() + ": " + msg;
    }

    // Line and col may be 0, meaning respectively before the first line and
    // before the first character of the line
    public
    static
    SourceTextLocation
    create( CharSequence fileName,
            int line,
            int col )
    {
        return
            new SourceTextLocation(
                inputs.notNull( fileName, "fileName" ),
                inputs.nonnegativeI( line, "line" ),
                inputs.nonnegativeI( col, "col" ) );
    }
}
