/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.units;

import gov.sandia.uq.language.EvaluationException;
import gov.sandia.uq.language.Type;
import gov.sandia.uq.language.type.RationalNumber;
import gov.sandia.uq.language.type.Scalar;

/**
    Multiplies by a floating-point factor.
**/
public class MultiplyConverter extends UnitConverter
{
    public final double factor;

    public MultiplyConverter (double factor)
    {
        this.factor = factor;
    }

    public double convert (double value)
    {
        return value * factor;
    }

    public Type convert (Type value) throws EvaluationException
    {
        return value.multiply (new Scalar (factor));
    }

    public UnitConverter inverse ()
    {
        return linear (1 / factor);
    }

    public boolean isLinear ()
    {
        return true;
    }

    public double getFactor ()
    {
        return factor;
    }

    public UnitConverter pow (RationalNumber exponent)
    {
        return linear (Math.pow (factor, exponent.getDouble ()));
    }

    protected UnitConverter merge (UnitConverter that)
    {
        if (that.isLinear ()  &&  ! (that instanceof CompoundConverter)) return linear (factor * that.getFactor ());
        return null;
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof MultiplyConverter)) return false;
        return factor == ((MultiplyConverter) that).factor;
    }

    public int hashCode ()
    {
        return Double.hashCode (factor);
    }

    public String toString ()
    {
        return "*" + Scalar.print (factor);
    }
}
