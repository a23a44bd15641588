package com.langforge.log;

import com.langforge.validation.Inputs;

import com.langforge.lang.Lang;

import java.util.List;

// Retains every event in arrival order; not safe for concurrent use
public
final
class CollectingCodeLogger
extends AbstractCodeLogger
{
    private static Inputs inputs = new Inputs();

    private final List< CodeEvent > events = Lang.newList();

    protected void logCodeImpl( CodeEvent ev ) { events.add( ev ); }

    public List< CodeEvent > getEvents() { return Lang.unmodifiableList( events ); }

    public
    List< CodeEvent >
    getEvents( CodeEventType type )
    {
        inputs.notNull( type, "type" );

        List< CodeEvent > res = Lang.newList();
        for ( CodeEvent ev : events ) if ( ev.type() == type ) res.add( ev );

        return res;
    }

    public void clear() { events.clear(); }
}
