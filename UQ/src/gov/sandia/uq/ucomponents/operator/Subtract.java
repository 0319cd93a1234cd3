/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.ucomponents.operator;

import gov.sandia.uq.ucomponents.Operation;
import gov.sandia.uq.ucomponents.UncertainComponent;

public class Subtract extends Operation
{
    public Subtract (UncertainComponent a, UncertainComponent b)
    {
        super (a.getValue () - b.getValue (), a, b);
    }

    public String name ()
    {
        return "-";
    }

    public double partial (int i)
    {
        if (i == 0) return 1;
        return -1;
    }
}
