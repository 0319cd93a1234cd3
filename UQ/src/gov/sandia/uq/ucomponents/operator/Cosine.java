/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.ucomponents.operator;

import gov.sandia.uq.ucomponents.Operation;
import gov.sandia.uq.ucomponents.UncertainComponent;

public class Cosine extends Operation
{
    public Cosine (UncertainComponent a)
    {
        super (Math.cos (a.getValue ()), a);
    }

    public String name ()
    {
        return "cos";
    }

    public double partial (int i)
    {
        return - Math.sin (x (0));
    }
}
