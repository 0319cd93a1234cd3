/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.units;

import gov.sandia.uq.language.EvaluationException;
import gov.sandia.uq.language.Type;
import gov.sandia.uq.language.UnsupportedOperandException;
import gov.sandia.uq.language.type.RationalNumber;

/**
    Invertible transform of numeric values from one unit to another.
    Converters are immutable and compose associatively through concatenate().
**/
public abstract class UnitConverter
{
    public static final UnitConverter IDENTITY = new RationalConverter (RationalNumber.ONE);

    /**
        @return A linear converter with the given exact factor, or IDENTITY if the factor is one.
    **/
    public static UnitConverter linear (RationalNumber factor)
    {
        if (factor.equals (RationalNumber.ONE)) return IDENTITY;
        return new RationalConverter (factor);
    }

    /**
        @return A linear converter with the given factor, or IDENTITY if the factor is one.
    **/
    public static UnitConverter linear (double factor)
    {
        if (factor == 1) return IDENTITY;
        return new MultiplyConverter (factor);
    }

    public abstract double convert (double value);

    /**
        Converts a value of any numeric kind. Uncertain values pass through graph operations,
        so the result stays connected to the inputs of the original value.
    **/
    public abstract Type convert (Type value) throws EvaluationException;

    public abstract UnitConverter inverse ();

    /**
        Linear converters map zero to zero.
    **/
    public abstract boolean isLinear ();

    public boolean isIdentity ()
    {
        return this == IDENTITY;
    }

    /**
        Scale factor of a linear converter.
    **/
    public double getFactor () throws EvaluationException
    {
        throw new UnsupportedOperandException ("getFactor", this);
    }

    /**
        Converter for a unit raised to the given power. Only linear converters can be raised.
    **/
    public UnitConverter pow (RationalNumber exponent) throws EvaluationException
    {
        if (! isLinear ()) throw new UnsupportedOperandException ("pow", this, exponent);
        return linear (Math.pow (getFactor (), exponent.getDouble ()));
    }

    /**
        @return Converter equivalent to applying that first, then this.
    **/
    public UnitConverter concatenate (UnitConverter that)
    {
        if (isIdentity ()) return that;
        if (that.isIdentity ()) return this;
        UnitConverter merged = merge (that);
        if (merged != null) return merged;
        return new CompoundConverter (this, that);
    }

    /**
        Subclasses combine with a compatible converter into a single step.
        @return The combined converter (this after that), or null if no simplification applies.
    **/
    protected UnitConverter merge (UnitConverter that)
    {
        return null;
    }
}
