/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.language.type;

import gov.sandia.uq.language.DivisionByZeroException;
import gov.sandia.uq.language.Type;

/**
    Immutable complex number.
    The typed methods (taking and returning Complex) are used by the complex uncertainty graph
    to evaluate nominal values and derivatives. The Type methods wrap them for the coercion tower.
**/
public class Complex extends Type
{
    public final double real;
    public final double imag;

    public static final Complex ZERO = new Complex (0, 0);
    public static final Complex ONE  = new Complex (1, 0);
    public static final Complex I    = new Complex (0, 1);

    public Complex (double real, double imag)
    {
        this.real = real;
        this.imag = imag;
    }

    public static Complex polar (double magnitude, double phase)
    {
        return new Complex (magnitude * Math.cos (phase), magnitude * Math.sin (phase));
    }

    public Kind kind ()
    {
        return Kind.COMPLEX;
    }

    public boolean isZero ()
    {
        return real == 0  &&  imag == 0;
    }

    /**
        Only defined when the imaginary part is exactly zero.
    **/
    public double getDouble ()
    {
        if (imag == 0) return real;
        return super.getDouble ();
    }

    public double magnitude ()
    {
        return Math.hypot (real, imag);
    }

    public double phase ()
    {
        return Math.atan2 (imag, real);
    }

    // Typed arithmetic ------------------------------------------------------

    public Complex add (Complex that)
    {
        return new Complex (real + that.real, imag + that.imag);
    }

    public Complex subtract (Complex that)
    {
        return new Complex (real - that.real, imag - that.imag);
    }

    public Complex multiply (Complex that)
    {
        return new Complex (real * that.real - imag * that.imag, real * that.imag + imag * that.real);
    }

    public Complex multiply (double scale)
    {
        return new Complex (real * scale, imag * scale);
    }

    public Complex divide (Complex that) throws DivisionByZeroException
    {
        if (that.isZero ()) throw new DivisionByZeroException (this);
        double d = that.real * that.real + that.imag * that.imag;
        return new Complex ((real * that.real + imag * that.imag) / d, (imag * that.real - real * that.imag) / d);
    }

    public Complex reciprocal () throws DivisionByZeroException
    {
        return ONE.divide (this);
    }

    public Complex pow (Complex exponent)
    {
        if (exponent.isZero ()) return ONE;
        if (isZero ())
        {
            if (exponent.real > 0) return ZERO;
            throw new DivisionByZeroException (ONE);
        }
        return exponent.multiply (ln ()).expComplex ();
    }

    public Complex negate ()
    {
        return new Complex (-real, -imag);
    }

    public Complex conjugate ()
    {
        return new Complex (real, -imag);
    }

    public Complex expComplex ()
    {
        return polar (Math.exp (real), imag);
    }

    /**
        Principal branch of the natural logarithm.
    **/
    public Complex ln ()
    {
        return new Complex (Math.log (magnitude ()), phase ());
    }

    /**
        Principal square root.
    **/
    public Complex sqrtComplex ()
    {
        if (isZero ()) return ZERO;
        double m = magnitude ();
        double a = Math.sqrt ((m + Math.abs (real)) / 2);
        if (real >= 0) return new Complex (a, imag / (2 * a));
        return new Complex (Math.abs (imag) / (2 * a), Math.copySign (a, imag));
    }

    public Complex sinComplex ()
    {
        return new Complex (Math.sin (real) * Math.cosh (imag), Math.cos (real) * Math.sinh (imag));
    }

    public Complex cosComplex ()
    {
        return new Complex (Math.cos (real) * Math.cosh (imag), -Math.sin (real) * Math.sinh (imag));
    }

    public Complex tanComplex ()
    {
        return sinComplex ().divide (cosComplex ());
    }

    public Complex sinhComplex ()
    {
        return new Complex (Math.sinh (real) * Math.cos (imag), Math.cosh (real) * Math.sin (imag));
    }

    public Complex coshComplex ()
    {
        return new Complex (Math.cosh (real) * Math.cos (imag), Math.sinh (real) * Math.sin (imag));
    }

    public Complex tanhComplex ()
    {
        return sinhComplex ().divide (coshComplex ());
    }

    // Type interface --------------------------------------------------------

    protected Type addSame (Type that)
    {
        return add ((Complex) that);
    }

    protected Type subtractSame (Type that)
    {
        return subtract ((Complex) that);
    }

    protected Type multiplySame (Type that)
    {
        return multiply ((Complex) that);
    }

    protected Type divideSame (Type that)
    {
        return divide ((Complex) that);
    }

    protected Type powerSame (Type that)
    {
        return pow ((Complex) that);
    }

    protected boolean equalsSame (Type that)
    {
        Complex b = (Complex) that;
        return real == b.real  &&  imag == b.imag;
    }

    /**
        Magnitude, as a real number.
    **/
    public Type abs ()
    {
        return new Scalar (magnitude ());
    }

    public Type sqrt ()
    {
        return sqrtComplex ();
    }

    public Type exp ()
    {
        return expComplex ();
    }

    public Type log ()
    {
        return ln ();
    }

    public Type log10 ()
    {
        return ln ().multiply (1 / Math.log (10));
    }

    public Type sin ()
    {
        return sinComplex ();
    }

    public Type cos ()
    {
        return cosComplex ();
    }

    public Type tan ()
    {
        return tanComplex ();
    }

    public Type sinh ()
    {
        return sinhComplex ();
    }

    public Type cosh ()
    {
        return coshComplex ();
    }

    public Type tanh ()
    {
        return tanhComplex ();
    }

    public int hashCode ()
    {
        if (imag == 0) return Double.hashCode (real + 0.0);
        return 31 * Double.hashCode (real + 0.0) + Double.hashCode (imag);
    }

    public String toString ()
    {
        if (imag == 0) return Scalar.print (real);
        if (imag < 0) return "(" + Scalar.print (real) + "-" + Scalar.print (-imag) + "j)";
        return "(" + Scalar.print (real) + "+" + Scalar.print (imag) + "j)";
    }
}
