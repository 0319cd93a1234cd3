/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.ucomponents;

import gov.sandia.uq.language.type.Scalar;

/**
    Leaf of the graph that carries no uncertainty. Plain numbers become constants when
    they are combined with uncertain components.
**/
public class Constant extends UncertainComponent
{
    protected final double value;

    public Constant (double value)
    {
        this.value = value;
    }

    public double getValue ()
    {
        return value;
    }

    public boolean isZero ()
    {
        return value == 0;
    }

    public String toString ()
    {
        return Scalar.print (value);
    }
}
