/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.units;

import java.util.LinkedHashMap;
import java.util.Map;

import gov.sandia.uq.language.EvaluationException;
import gov.sandia.uq.language.IncompatibleUnitsException;
import gov.sandia.uq.language.Type;
import gov.sandia.uq.language.type.RationalNumber;

/**
    Physical unit. Units are immutable, and the algebraic operations always return new units.
    A unit takes part in the coercion tower only to form products and quotients with other units.
    Combining a unit arithmetically with a number is undefined; use multiply(double) and friends
    to define a scaled unit, or wrap the number in a Quantity.
**/
public abstract class Unit extends Type
{
    /**
        The dimensionless unit.
    **/
    public static final Unit ONE = new ProductUnit (new LinkedHashMap<Unit,RationalNumber> ());

    public Kind kind ()
    {
        return Kind.UNIT;
    }

    public abstract Dimension getDimension ();

    /**
        @return Converter from this unit to getSystemUnit().
    **/
    public abstract UnitConverter toCoherent () throws EvaluationException;

    /**
        @return The product of base units that has the same dimension as this unit.
        For example, the system unit of millivolt is kg·m^2·s^-3·A^-1.
    **/
    public abstract Unit getSystemUnit ();

    /**
        Decomposition of this unit into elementary factors (base units and named alternate units),
        each with its exponent.
    **/
    public abstract Map<Unit,RationalNumber> getElements ();

    public boolean isCompatible (Unit that)
    {
        return getDimension ().equals (that.getDimension ());
    }

    /**
        Returns the converter that takes values in this unit to values in the target unit.
        @throws IncompatibleUnitsException if the dimensions differ.
    **/
    public UnitConverter getOperatorTo (Unit that) throws EvaluationException
    {
        if (equals (that)) return UnitConverter.IDENTITY;
        if (! isCompatible (that)) throw new IncompatibleUnitsException (this, that);
        return that.toCoherent ().inverse ().concatenate (toCoherent ());
    }

    // Algebra ---------------------------------------------------------------

    public Unit multiply (Unit that)
    {
        Map<Unit,RationalNumber> factors = new LinkedHashMap<Unit,RationalNumber> ();
        ProductUnit.accumulate (factors, this, RationalNumber.ONE);
        ProductUnit.accumulate (factors, that, RationalNumber.ONE);
        return ProductUnit.compose (factors);
    }

    public Unit divide (Unit that)
    {
        Map<Unit,RationalNumber> factors = new LinkedHashMap<Unit,RationalNumber> ();
        ProductUnit.accumulate (factors, this, RationalNumber.ONE);
        ProductUnit.accumulate (factors, that, RationalNumber.ONE.negate ());
        return ProductUnit.compose (factors);
    }

    public Unit pow (RationalNumber exponent)
    {
        Map<Unit,RationalNumber> factors = new LinkedHashMap<Unit,RationalNumber> ();
        ProductUnit.accumulate (factors, this, exponent);
        return ProductUnit.compose (factors);
    }

    public Unit pow (int exponent)
    {
        return pow (new RationalNumber (exponent));
    }

    public Unit root (int n)
    {
        return pow (new RationalNumber (1, n));
    }

    public Unit inverse ()
    {
        return pow (-1);
    }

    /**
        @return A unit that is the given multiple of this one. For example, METER.multiply (1000) is a kilometer.
    **/
    public Unit multiply (long factor)
    {
        return scale (UnitConverter.linear (new RationalNumber (factor)));
    }

    public Unit divide (long divisor)
    {
        return scale (UnitConverter.linear (new RationalNumber (1, divisor)));
    }

    public Unit multiply (double factor)
    {
        return scale (UnitConverter.linear (factor));
    }

    public Unit divide (double divisor)
    {
        return scale (UnitConverter.linear (1 / divisor));
    }

    /**
        @return A unit whose origin is shifted by the given amount of this unit.
        For example, KELVIN.add (273.15) is degree Celsius.
    **/
    public Unit add (double offset)
    {
        return scale (new AddConverter (offset));
    }

    /**
        @param converter Takes values in the new unit to values in this unit.
    **/
    public Unit scale (UnitConverter converter)
    {
        if (converter.isIdentity ()) return this;
        return new AlternateUnit (null, this, converter);
    }

    // Type interface --------------------------------------------------------

    protected Type multiplySame (Type that)
    {
        return multiply ((Unit) that);
    }

    protected Type divideSame (Type that)
    {
        return divide ((Unit) that);
    }

    protected boolean equalsSame (Type that)
    {
        return getElements ().equals (((Unit) that).getElements ());
    }

    public int hashCode ()
    {
        return getElements ().hashCode ();
    }

    /**
        Renders an exponent for use after a symbol, for example "^2" or "^(1/2)".
    **/
    public static String formatExponent (RationalNumber e)
    {
        if (e.isInteger ()) return "^" + e.numerator;
        return "^(" + e + ")";
    }
}
