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

public class ImaginaryPart extends COperation
{
    public ImaginaryPart (CUncertainComponent a)
    {
        super (new Complex (a.getValue ().imag, 0), a);
    }

    public String name ()
    {
        return "imag";
    }

    public MatrixDense jacobian (int i)
    {
        return new MatrixDense (new double[][] {{0, 1}, {0, 0}});
    }
}
