/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.language.type;

import gov.sandia.uq.language.DivisionByZeroException;
import gov.sandia.uq.language.EvaluationException;
import gov.sandia.uq.language.Type;

/**
    Exact integer. Division and negative powers produce a RationalNumber.
    A result that does not fit in a long continues as a floating-point Scalar rather than wrapping.
**/
public class Integral extends Type
{
    public final long value;

    public Integral (long value)
    {
        this.value = value;
    }

    public Kind kind ()
    {
        return Kind.INTEGER;
    }

    public double getDouble ()
    {
        return value;
    }

    public boolean isZero ()
    {
        return value == 0;
    }

    protected Type inexact (String operator)
    {
        return new Scalar (value);
    }

    protected Type addSame (Type that)
    {
        long b = ((Integral) that).value;
        try
        {
            return new Integral (Math.addExact (value, b));
        }
        catch (ArithmeticException e)
        {
            return new Scalar ((double) value + b);
        }
    }

    protected Type subtractSame (Type that)
    {
        long b = ((Integral) that).value;
        try
        {
            return new Integral (Math.subtractExact (value, b));
        }
        catch (ArithmeticException e)
        {
            return new Scalar ((double) value - b);
        }
    }

    protected Type multiplySame (Type that)
    {
        long b = ((Integral) that).value;
        try
        {
            return new Integral (Math.multiplyExact (value, b));
        }
        catch (ArithmeticException e)
        {
            return new Scalar ((double) value * b);
        }
    }

    protected Type divideSame (Type that) throws EvaluationException
    {
        long b = ((Integral) that).value;
        if (b == 0) throw new DivisionByZeroException (this);
        return new RationalNumber (value, b);
    }

    protected Type powerSame (Type that) throws EvaluationException
    {
        long e = ((Integral) that).value;
        if (e < 0  &&  value == 0) throw new DivisionByZeroException (new Integral (1));
        try
        {
            if (e >= 0) return new Integral (pow (value, e));
            return new RationalNumber (1, pow (value, Math.negateExact (e)));
        }
        catch (ArithmeticException overflow)
        {
            return new Scalar (Math.pow (value, e));
        }
    }

    /**
        Exact integer power by repeated squaring.
    **/
    public static long pow (long base, long exponent)
    {
        long result = 1;
        while (exponent > 0)
        {
            if ((exponent & 1) != 0) result = Math.multiplyExact (result, base);
            exponent >>= 1;
            if (exponent > 0) base = Math.multiplyExact (base, base);
        }
        return result;
    }

    protected boolean equalsSame (Type that)
    {
        return value == ((Integral) that).value;
    }

    public Type negate ()
    {
        if (value == Long.MIN_VALUE) return new Scalar (- (double) value);
        return new Integral (- value);
    }

    public Type abs ()
    {
        if (value == Long.MIN_VALUE) return new Scalar (- (double) value);
        return new Integral (Math.abs (value));
    }

    public Type conjugate ()
    {
        return this;
    }

    public int hashCode ()
    {
        return Double.hashCode (value);
    }

    public String toString ()
    {
        return String.valueOf (value);
    }
}
