/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.ucomponents;

import gov.sandia.uq.language.NegativeUncertaintyException;
import gov.sandia.uq.language.type.Scalar;

/**
    Leaf of the graph: a measured value with a declared standard uncertainty.
    Distinct inputs are treated as statistically independent.
**/
public class UncertainInput extends UncertainComponent
{
    protected final double value;
    protected final double uncertainty;
    protected final String label;

    public UncertainInput (double value, double uncertainty)
    {
        this (value, uncertainty, null);
    }

    /**
        @param label Optional name, used when reporting an uncertainty budget.
        @throws NegativeUncertaintyException if uncertainty is negative or not a number.
    **/
    public UncertainInput (double value, double uncertainty, String label)
    {
        if (! (uncertainty >= 0)) throw new NegativeUncertaintyException (value, uncertainty);
        this.value       = value;
        this.uncertainty = uncertainty;
        this.label       = label;
    }

    public double getValue ()
    {
        return value;
    }

    public double getUncertainty ()
    {
        return uncertainty;
    }

    public String getLabel ()
    {
        return label;
    }

    public String toString ()
    {
        String result = "(" + Scalar.print (value) + " ± " + Scalar.print (uncertainty) + ")";
        if (label != null) result = label + result;
        return result;
    }
}
