/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.cucomponents;

import gov.sandia.uq.language.NegativeUncertaintyException;
import gov.sandia.uq.language.type.Complex;
import gov.sandia.uq.linear.MatrixDense;
import gov.sandia.uq.ucomponents.Context;

/**
    Complex measured value. Its uncertainty is a 2x2 covariance over the real and imaginary
    components, which allows the two components of one measurement to be correlated.
**/
public class CUncertainInput extends CUncertainComponent
{
    protected final Complex     value;
    protected final MatrixDense covariance;
    protected final String      label;

    /**
        Independent components with the given standard uncertainties.
    **/
    public CUncertainInput (Complex value, double uRe, double uIm)
    {
        this (value, uRe, uIm, 0);
    }

    /**
        @param r Correlation coefficient between the real and imaginary components.
    **/
    public CUncertainInput (Complex value, double uRe, double uIm, double r)
    {
        this (value, covariance (value, uRe, uIm, r), null);
    }

    public CUncertainInput (Complex value, MatrixDense covariance)
    {
        this (value, covariance, null);
    }

    /**
        @param covariance Must be symmetric positive semi-definite. A copy is kept.
        @throws NegativeUncertaintyException otherwise.
    **/
    public CUncertainInput (Complex value, MatrixDense covariance, String label)
    {
        check (value, covariance);
        this.value      = value;
        this.covariance = new MatrixDense (covariance);
        this.label      = label;
    }

    protected static MatrixDense covariance (Complex value, double uRe, double uIm, double r)
    {
        if (! (uRe >= 0)  ||  ! (uIm >= 0)  ||  ! (Math.abs (r) <= 1)) throw new NegativeUncertaintyException (value, new double[] {uRe, uIm, r});
        double c = r * uRe * uIm;
        return new MatrixDense (new double[][] {{uRe * uRe, c}, {c, uIm * uIm}});
    }

    protected static void check (Complex value, MatrixDense C)
    {
        if (C.rows () != 2  ||  C.columns () != 2) throw new NegativeUncertaintyException (value, C);
        double a = C.get (0, 0);
        double b = C.get (0, 1);
        double d = C.get (1, 1);
        if (! (a >= 0)  ||  ! (d >= 0)) throw new NegativeUncertaintyException (value, C);
        double scale = Math.max (a, d);
        // Written so that NaN fails each test.
        if (! (Math.abs (b - C.get (1, 0)) <= Context.tolerance * scale)) throw new NegativeUncertaintyException (value, C);
        if (! (a * d - b * b >= - Context.tolerance * scale * scale))     throw new NegativeUncertaintyException (value, C);
    }

    public Complex getValue ()
    {
        return value;
    }

    /**
        @return A copy of the covariance matrix.
    **/
    public MatrixDense getCovariance ()
    {
        return new MatrixDense (covariance);
    }

    public String getLabel ()
    {
        return label;
    }

    public String toString ()
    {
        String result = "(" + value + " ± [" + Math.sqrt (covariance.get (0, 0)) + ", " + Math.sqrt (covariance.get (1, 1)) + "])";
        if (label != null) result = label + result;
        return result;
    }
}
