/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.cucomponents.operator;

import gov.sandia.uq.cucomponents.COperation;
import gov.sandia.uq.cucomponents.CUncertainComponent;
import gov.sandia.uq.linear.MatrixDense;

/**
    Not complex-differentiable, but linear as a map on (real, imaginary).
**/
public class Conjugate extends COperation
{
    public Conjugate (CUncertainComponent a)
    {
        super (a.getValue ().conjugate (), a);
    }

    public String name ()
    {
        return "conjugate";
    }

    public MatrixDense jacobian (int i)
    {
        return new MatrixDense (new double[][] {{1, 0}, {0, -1}});
    }
}
