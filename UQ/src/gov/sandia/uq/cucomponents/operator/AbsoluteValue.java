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
    Magnitude of the operand, as a complex number with zero imaginary part.
    The derivative at the origin is taken as zero.
**/
public class AbsoluteValue extends COperation
{
    public AbsoluteValue (CUncertainComponent a)
    {
        super (new Complex (a.getValue ().magnitude (), 0), a);
    }

    public String name ()
    {
        return "abs";
    }

    public MatrixDense jacobian (int i)
    {
        Complex z = x (0);
        double r = value.real;
        if (r == 0) return new MatrixDense (2, 2);
        return new MatrixDense (new double[][] {{z.real / r, z.imag / r}, {0, 0}});
    }
}
