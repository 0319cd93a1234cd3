/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.units;

import gov.sandia.uq.language.EvaluationException;
import gov.sandia.uq.language.Type;

/**
    Composition of two converters that could not be merged into one step.
    Applies second, then first.
**/
public class CompoundConverter extends UnitConverter
{
    public final UnitConverter first;
    public final UnitConverter second;

    public CompoundConverter (UnitConverter first, UnitConverter second)
    {
        this.first  = first;
        this.second = second;
    }

    public double convert (double value)
    {
        return first.convert (second.convert (value));
    }

    public Type convert (Type value) throws EvaluationException
    {
        return first.convert (second.convert (value));
    }

    public UnitConverter inverse ()
    {
        return second.inverse ().concatenate (first.inverse ());
    }

    public boolean isLinear ()
    {
        return first.isLinear ()  &&  second.isLinear ();
    }

    public double getFactor () throws EvaluationException
    {
        if (isLinear ()) return first.getFactor () * second.getFactor ();
        return super.getFactor ();
    }

    /**
        Tries to fold the incoming converter into our second step, for example
        (+273.15 after *2) after *3 becomes +273.15 after *6.
    **/
    protected UnitConverter merge (UnitConverter that)
    {
        UnitConverter inner = second.merge (that);
        if (inner == null) return null;
        return first.concatenate (inner);
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof CompoundConverter)) return false;
        CompoundConverter c = (CompoundConverter) that;
        return first.equals (c.first)  &&  second.equals (c.second);
    }

    public int hashCode ()
    {
        return 31 * first.hashCode () + second.hashCode ();
    }

    public String toString ()
    {
        return second + " then " + first;
    }
}
