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
    Exact fraction. Always held in lowest terms with a positive denominator, so two equal
    fractions have identical fields. Used for the exponents of dimensions and units as well
    as for general arithmetic. The typed methods (add, multiply, pow, ...) throw ArithmeticException
    when a numerator or denominator would overflow a long. The generic Type operations instead
    continue the calculation as a floating-point Scalar.
**/
public class RationalNumber extends Type implements Comparable<RationalNumber>
{
    public final long numerator;
    public final long denominator;

    public static final RationalNumber ZERO = new RationalNumber (0);
    public static final RationalNumber ONE  = new RationalNumber (1);

    public RationalNumber (long numerator)
    {
        this (numerator, 1);
    }

    public RationalNumber (long numerator, long denominator) throws DivisionByZeroException
    {
        if (denominator == 0) throw new DivisionByZeroException (numerator);
        if (denominator < 0)
        {
            numerator   = Math.negateExact (numerator);
            denominator = Math.negateExact (denominator);
        }
        long g = gcd (Math.abs (numerator), denominator);
        this.numerator   = numerator   / g;
        this.denominator = denominator / g;
    }

    public static long gcd (long a, long b)
    {
        while (b != 0)
        {
            long t = a % b;
            a = b;
            b = t;
        }
        if (a == 0) return 1;  // only when both are zero, and then the denominator check has already failed
        return a;
    }

    public Kind kind ()
    {
        return Kind.RATIONAL;
    }

    public double getDouble ()
    {
        return (double) numerator / denominator;
    }

    public boolean isZero ()
    {
        return numerator == 0;
    }

    public boolean isInteger ()
    {
        return denominator == 1;
    }

    public int signum ()
    {
        return Long.signum (numerator);
    }

    protected Type inexact (String operator)
    {
        return new Scalar (getDouble ());
    }

    // Typed arithmetic, used directly by the dimension and unit algebra.

    public RationalNumber add (RationalNumber that)
    {
        long n = Math.addExact (Math.multiplyExact (numerator, that.denominator), Math.multiplyExact (that.numerator, denominator));
        return new RationalNumber (n, Math.multiplyExact (denominator, that.denominator));
    }

    public RationalNumber subtract (RationalNumber that)
    {
        return add (that.negate ());
    }

    public RationalNumber multiply (RationalNumber that)
    {
        // Cross-reduce first to keep intermediate values small.
        long g1 = gcd (Math.abs (numerator), that.denominator);
        long g2 = gcd (Math.abs (that.numerator), denominator);
        long n = Math.multiplyExact (numerator / g1, that.numerator / g2);
        long d = Math.multiplyExact (denominator / g2, that.denominator / g1);
        return new RationalNumber (n, d);
    }

    public RationalNumber divide (RationalNumber that) throws DivisionByZeroException
    {
        return multiply (that.reciprocal ());
    }

    public RationalNumber reciprocal () throws DivisionByZeroException
    {
        if (numerator == 0) throw new DivisionByZeroException (ONE);
        return new RationalNumber (denominator, numerator);
    }

    public RationalNumber negate ()
    {
        return new RationalNumber (Math.negateExact (numerator), denominator);
    }

    public RationalNumber abs ()
    {
        if (numerator >= 0) return this;
        return negate ();
    }

    public RationalNumber pow (long exponent) throws DivisionByZeroException
    {
        if (exponent < 0) return reciprocal ().pow (Math.negateExact (exponent));
        return new RationalNumber (Integral.pow (numerator, exponent), Integral.pow (denominator, exponent));
    }

    // Type interface. Exact while the result fits in long fractions, floating-point beyond that.

    protected Type addSame (Type that)
    {
        RationalNumber b = (RationalNumber) that;
        try
        {
            return add (b);
        }
        catch (ArithmeticException e)
        {
            return new Scalar (getDouble () + b.getDouble ());
        }
    }

    protected Type subtractSame (Type that)
    {
        RationalNumber b = (RationalNumber) that;
        try
        {
            return subtract (b);
        }
        catch (ArithmeticException e)
        {
            return new Scalar (getDouble () - b.getDouble ());
        }
    }

    protected Type multiplySame (Type that)
    {
        RationalNumber b = (RationalNumber) that;
        try
        {
            return multiply (b);
        }
        catch (ArithmeticException e)
        {
            return new Scalar (getDouble () * b.getDouble ());
        }
    }

    protected Type divideSame (Type that) throws EvaluationException
    {
        RationalNumber b = (RationalNumber) that;
        if (b.numerator == 0) throw new DivisionByZeroException (this);
        try
        {
            return divide (b);
        }
        catch (ArithmeticException e)
        {
            return new Scalar (getDouble () / b.getDouble ());
        }
    }

    protected Type powerSame (Type that) throws EvaluationException
    {
        RationalNumber e = (RationalNumber) that;
        if (e.isInteger ())
        {
            if (numerator == 0  &&  e.numerator < 0) throw new DivisionByZeroException (ONE);
            try
            {
                return pow (e.numerator);
            }
            catch (ArithmeticException overflow)
            {
                return new Scalar (Math.pow (getDouble (), e.numerator));
            }
        }
        return new Scalar (Math.pow (getDouble (), e.getDouble ()));
    }

    protected boolean equalsSame (Type that)
    {
        RationalNumber b = (RationalNumber) that;
        return numerator == b.numerator  &&  denominator == b.denominator;
    }

    public Type conjugate ()
    {
        return this;
    }

    public int compareTo (RationalNumber that)
    {
        // a/b ? c/d  <=>  a*d ? c*b, since both denominators are positive
        return Long.compare (Math.multiplyExact (numerator, that.denominator), Math.multiplyExact (that.numerator, denominator));
    }

    public int hashCode ()
    {
        return Double.hashCode (getDouble ());
    }

    public String toString ()
    {
        if (denominator == 1) return String.valueOf (numerator);
        return numerator + "/" + denominator;
    }
}
