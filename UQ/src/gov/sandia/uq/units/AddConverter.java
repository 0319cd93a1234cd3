/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.units;

import gov.sandia.uq.language.EvaluationException;
import gov.sandia.uq.language.Type;
import gov.sandia.uq.language.type.Scalar;

/**
    Adds a fixed offset. Used for affine scales such as degree Celsius.
**/
public class AddConverter extends UnitConverter
{
    public final double offset;

    public AddConverter (double offset)
    {
        this.offset = offset;
    }

    public double convert (double value)
    {
        return value + offset;
    }

    public Type convert (Type value) throws EvaluationException
    {
        return value.add (new Scalar (offset));
    }

    public UnitConverter inverse ()
    {
        return new AddConverter (-offset);
    }

    public boolean isLinear ()
    {
        return false;
    }

    protected UnitConverter merge (UnitConverter that)
    {
        if (! (that instanceof AddConverter)) return null;
        double sum = offset + ((AddConverter) that).offset;
        if (sum == 0) return IDENTITY;
        return new AddConverter (sum);
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof AddConverter)) return false;
        return offset == ((AddConverter) that).offset;
    }

    public int hashCode ()
    {
        return Double.hashCode (offset);
    }

    public String toString ()
    {
        if (offset < 0) return "-" + Scalar.print (-offset);
        return "+" + Scalar.print (offset);
    }
}
