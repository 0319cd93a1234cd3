/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.ucomponents.operator;

import gov.sandia.uq.ucomponents.Operation;
import gov.sandia.uq.ucomponents.UncertainComponent;

public class ArcSine extends Operation
{
    public ArcSine (UncertainComponent a)
    {
        super (Math.asin (a.getValue ()), a);
    }

    public String name ()
    {
        return "asin";
    }

    public double partial (int i)
    {
        double a = x (0);
        return 1 / Math.sqrt (1 - a * a);
    }
}
