/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.ucomponents.operator;

import gov.sandia.uq.ucomponents.Operation;
import gov.sandia.uq.ucomponents.UncertainComponent;

/**
    Angle of the point (b,a), so the first operand plays the role of y.
**/
public class ArcTangent2 extends Operation
{
    public ArcTangent2 (UncertainComponent a, UncertainComponent b)
    {
        super (Math.atan2 (a.getValue (), b.getValue ()), a, b);
    }

    public String name ()
    {
        return "atan2";
    }

    public double partial (int i)
    {
        double a  = x (0);
        double b  = x (1);
        double r2 = a * a + b * b;
        if (r2 == 0) return 0;
        if (i == 0) return b / r2;
        return - a / r2;
    }
}
