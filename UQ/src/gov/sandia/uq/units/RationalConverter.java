/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.units;

import org.apache.log4j.Logger;

import gov.sandia.uq.language.EvaluationException;
import gov.sandia.uq.language.Type;
import gov.sandia.uq.language.Type.Kind;
import gov.sandia.uq.language.type.RationalNumber;
import gov.sandia.uq.language.type.Scalar;

/**
    Multiplies by an exact fraction, such as the 1/1000 between millivolt and volt.
    Exact values (integers and rationals) stay exact through the conversion.
**/
public class RationalConverter extends UnitConverter
{
    public final RationalNumber factor;

    private static Logger logger = Logger.getLogger (RationalConverter.class);

    public RationalConverter (RationalNumber factor)
    {
        this.factor = factor;
    }

    public double convert (double value)
    {
        return value * factor.numerator / factor.denominator;
    }

    public Type convert (Type value) throws EvaluationException
    {
        if (isIdentity ()) return value;
        Kind k = value.kind ();
        if (k == Kind.INTEGER  ||  k == Kind.RATIONAL) return value.multiply (factor);
        return value.multiply (new Scalar (factor.getDouble ()));
    }

    public UnitConverter inverse ()
    {
        return linear (factor.reciprocal ());
    }

    public boolean isLinear ()
    {
        return true;
    }

    public double getFactor ()
    {
        return factor.getDouble ();
    }

    /**
        Stays exact while the result fits in a long fraction. Beyond that, for example nm^3 at 10^-27,
        the factor continues as a double.
    **/
    public UnitConverter pow (RationalNumber exponent)
    {
        if (exponent.isInteger ())
        {
            try
            {
                return linear (factor.pow (exponent.numerator));
            }
            catch (ArithmeticException e)
            {
                logger.debug ("exact factor overflow in " + this + "^" + exponent);
            }
        }
        return linear (Math.pow (factor.getDouble (), exponent.getDouble ()));
    }

    protected UnitConverter merge (UnitConverter that)
    {
        if (that instanceof RationalConverter)
        {
            RationalNumber b = ((RationalConverter) that).factor;
            try
            {
                return linear (factor.multiply (b));
            }
            catch (ArithmeticException e)
            {
                logger.debug ("exact factor overflow in " + this + " after " + that);
                return linear (factor.getDouble () * b.getDouble ());
            }
        }
        if (that instanceof MultiplyConverter) return linear (factor.getDouble () * ((MultiplyConverter) that).factor);
        return null;
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof RationalConverter)) return false;
        return factor.equals (((RationalConverter) that).factor);
    }

    public int hashCode ()
    {
        return factor.hashCode ();
    }

    public String toString ()
    {
        if (isIdentity ()) return "identity";
        return "*" + factor;
    }
}
