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
    Phase angle of the operand in (-pi, pi], as a complex number with zero imaginary part.
**/
public class Argument extends COperation
{
    public Argument (CUncertainComponent a)
    {
        super (new Complex (a.getValue ().phase (), 0), a);
    }

    public String name ()
    {
        return "arg";
    }

    public MatrixDense jacobian (int i)
    {
        Complex z = x (0);
        double r2 = z.real * z.real + z.imag * z.imag;
        if (r2 == 0) return new MatrixDense (2, 2);
        return new MatrixDense (new double[][] {{- z.imag / r2, z.real / r2}, {0, 0}});
    }
}
