/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.cucomponents.operator;

import gov.sandia.uq.cucomponents.COperation;
import gov.sandia.uq.cucomponents.CUncertainComponent;
import gov.sandia.uq.linear.MatrixDense;

public class Cosine extends COperation
{
    public Cosine (CUncertainComponent a)
    {
        super (a.getValue ().cosComplex (), a);
    }

    public String name ()
    {
        return "cos";
    }

    public MatrixDense jacobian (int i)
    {
        return holomorphic (x (0).sinComplex ().negate ());
    }
}
