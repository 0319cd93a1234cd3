/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.units;

import java.util.Arrays;

import gov.sandia.uq.language.type.RationalNumber;

/**
    Physical dimension, as a vector of rational exponents over the seven SI base dimensions.
    Instances are immutable. The only way to obtain a new dimension is through the algebraic
    operations, which return new objects.
**/
public class Dimension
{
    public static final int LENGTH             = 0;
    public static final int MASS               = 1;
    public static final int TIME               = 2;
    public static final int CURRENT            = 3;
    public static final int TEMPERATURE        = 4;
    public static final int AMOUNT             = 5;
    public static final int LUMINOUS_INTENSITY = 6;
    public static final int COUNT              = 7;

    protected static final String[] symbols = {"L", "M", "T", "I", "Θ", "N", "J"};

    public static final Dimension NONE = new Dimension (new RationalNumber[COUNT]);

    protected final RationalNumber[] exponents;

    /**
        @param exponents Takes ownership of the array. Null entries are read as zero.
    **/
    protected Dimension (RationalNumber[] exponents)
    {
        for (int i = 0; i < COUNT; i++) if (exponents[i] == null) exponents[i] = RationalNumber.ZERO;
        this.exponents = exponents;
    }

    /**
        @return The dimension of one of the base quantities, for example Dimension.base (Dimension.LENGTH).
    **/
    public static Dimension base (int index)
    {
        RationalNumber[] e = new RationalNumber[COUNT];
        e[index] = RationalNumber.ONE;
        return new Dimension (e);
    }

    public static String symbol (int index)
    {
        return symbols[index];
    }

    public RationalNumber getExponent (int index)
    {
        return exponents[index];
    }

    public boolean isDimensionless ()
    {
        for (RationalNumber e : exponents) if (! e.isZero ()) return false;
        return true;
    }

    public Dimension multiply (Dimension that)
    {
        RationalNumber[] e = new RationalNumber[COUNT];
        for (int i = 0; i < COUNT; i++) e[i] = exponents[i].add (that.exponents[i]);
        return new Dimension (e);
    }

    public Dimension divide (Dimension that)
    {
        RationalNumber[] e = new RationalNumber[COUNT];
        for (int i = 0; i < COUNT; i++) e[i] = exponents[i].subtract (that.exponents[i]);
        return new Dimension (e);
    }

    public Dimension pow (RationalNumber power)
    {
        RationalNumber[] e = new RationalNumber[COUNT];
        for (int i = 0; i < COUNT; i++) e[i] = exponents[i].multiply (power);
        return new Dimension (e);
    }

    public Dimension root (int n)
    {
        return pow (new RationalNumber (1, n));
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Dimension)) return false;
        return Arrays.equals (exponents, ((Dimension) that).exponents);
    }

    public int hashCode ()
    {
        return Arrays.hashCode (exponents);
    }

    public String toString ()
    {
        if (isDimensionless ()) return "1";
        StringBuilder result = new StringBuilder ();
        for (int i = 0; i < COUNT; i++)
        {
            RationalNumber e = exponents[i];
            if (e.isZero ()) continue;
            if (result.length () > 0) result.append ("·");
            result.append (symbols[i]);
            if (! e.equals (RationalNumber.ONE)) result.append (Unit.formatExponent (e));
        }
        return result.toString ();
    }
}
