/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.ucomponents.operator;

import gov.sandia.uq.ucomponents.Operation;
import gov.sandia.uq.ucomponents.UncertainComponent;

/**
    Raises the first operand to the power of the second.
**/
public class Power extends Operation
{
    public Power (UncertainComponent a, UncertainComponent b)
    {
        super (Math.pow (a.getValue (), b.getValue ()), a, b);
    }

    public String name ()
    {
        return "^";
    }

    public double partial (int i)
    {
        double a = x (0);
        double b = x (1);
        if (i == 0)
        {
            if (b == 0) return 0;
            return b * Math.pow (a, b - 1);
        }
        if (a == 0) return 0;  // limit for positive exponent
        return value * Math.log (a);  // NaN for negative base
    }
}
