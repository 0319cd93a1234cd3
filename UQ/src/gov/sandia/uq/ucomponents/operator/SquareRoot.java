/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.ucomponents.operator;

import gov.sandia.uq.ucomponents.Operation;
import gov.sandia.uq.ucomponents.UncertainComponent;

public class SquareRoot extends Operation
{
    public SquareRoot (UncertainComponent a)
    {
        super (Math.sqrt (a.getValue ()), a);
    }

    public String name ()
    {
        return "sqrt";
    }

    public double partial (int i)
    {
        return 0.5 / value;
    }
}
