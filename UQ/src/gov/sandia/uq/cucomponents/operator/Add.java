/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.cucomponents.operator;

import gov.sandia.uq.cucomponents.COperation;
import gov.sandia.uq.cucomponents.CUncertainComponent;
import gov.sandia.uq.linear.MatrixDense;

public class Add extends COperation
{
    public Add (CUncertainComponent a, CUncertainComponent b)
    {
        super (a.getValue ().add (b.getValue ()), a, b);
    }

    public String name ()
    {
        return "+";
    }

    public MatrixDense jacobian (int i)
    {
        return MatrixDense.identity (2);
    }
}
