/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.cucomponents;

import gov.sandia.uq.linear.MatrixDense;

/**
    Uncertainty of a complex value: the variances of its real and imaginary components and
    their covariance.
**/
public class Covariance
{
    protected final double varianceReal;
    protected final double varianceImaginary;
    protected final double covariance;

    public Covariance (double varianceReal, double varianceImaginary, double covariance)
    {
        this.varianceReal      = varianceReal;
        this.varianceImaginary = varianceImaginary;
        this.covariance        = covariance;
    }

    public Covariance (MatrixDense C)
    {
        this (C.get (0, 0), C.get (1, 1), (C.get (0, 1) + C.get (1, 0)) / 2);
    }

    public double getVarianceReal ()
    {
        return varianceReal;
    }

    public double getVarianceImaginary ()
    {
        return varianceImaginary;
    }

    public double getCovariance ()
    {
        return covariance;
    }

    public double getUncertaintyReal ()
    {
        return Math.sqrt (varianceReal);
    }

    public double getUncertaintyImaginary ()
    {
        return Math.sqrt (varianceImaginary);
    }

    /**
        @return Correlation coefficient between the two components, or 0 if either has no uncertainty.
    **/
    public double getCorrelation ()
    {
        double d = Math.sqrt (varianceReal * varianceImaginary);
        if (d == 0) return 0;
        return covariance / d;
    }

    public MatrixDense getMatrix ()
    {
        return new MatrixDense (new double[][] {{varianceReal, covariance}, {covariance, varianceImaginary}});
    }

    public String toString ()
    {
        return "[[" + varianceReal + ", " + covariance + "], [" + covariance + ", " + varianceImaginary + "]]";
    }
}
