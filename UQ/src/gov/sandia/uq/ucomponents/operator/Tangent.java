/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.ucomponents.operator;

import gov.sandia.uq.ucomponents.Operation;
import gov.sandia.uq.ucomponents.UncertainComponent;

public class Tangent extends Operation
{
    public Tangent (UncertainComponent a)
    {
        super (Math.tan (a.getValue ()), a);
    }

    public String name ()
    {
        return "tan";
    }

    public double partial (int i)
    {
        double c = Math.cos (x (0));
        return 1 / (c * c);
    }
}
