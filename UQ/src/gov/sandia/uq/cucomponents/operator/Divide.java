/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.cucomponents.operator;

import gov.sandia.uq.cucomponents.COperation;
import gov.sandia.uq.cucomponents.CUncertainComponent;
import gov.sandia.uq.language.type.Complex;
import gov.sandia.uq.linear.MatrixDense;

/**
    Division by an exactly zero divisor fails when the node is created.
**/
public class Divide extends COperation
{
    public Divide (CUncertainComponent a, CUncertainComponent b)
    {
        super (a.getValue ().divide (b.getValue ()), a, b);
    }

    public String name ()
    {
        return "/";
    }

    public MatrixDense jacobian (int i)
    {
        Complex b = x (1);
        if (i == 0) return holomorphic (b.reciprocal ());
        return holomorphic (x (0).negate ().divide (b.multiply (b)));
    }
}
