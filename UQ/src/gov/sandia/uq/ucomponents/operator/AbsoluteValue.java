/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.ucomponents.operator;

import gov.sandia.uq.ucomponents.Operation;
import gov.sandia.uq.ucomponents.UncertainComponent;

/**
    The derivative at zero is taken as 0.
**/
public class AbsoluteValue extends Operation
{
    public AbsoluteValue (UncertainComponent a)
    {
        super (Math.abs (a.getValue ()), a);
    }

    public String name ()
    {
        return "abs";
    }

    public double partial (int i)
    {
        return Math.signum (x (0));
    }
}
