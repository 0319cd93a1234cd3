/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.ucomponents.operator;

import gov.sandia.uq.ucomponents.Operation;
import gov.sandia.uq.ucomponents.UncertainComponent;

/**
    Natural logarithm.
**/
public class Log extends Operation
{
    public Log (UncertainComponent a)
    {
        super (Math.log (a.getValue ()), a);
    }

    public String name ()
    {
        return "log";
    }

    public double partial (int i)
    {
        return 1 / x (0);
    }
}
