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
    Principal value of a^b.
**/
public class Power extends COperation
{
    public Power (CUncertainComponent a, CUncertainComponent b)
    {
        super (a.getValue ().pow (b.getValue ()), a, b);
    }

    public String name ()
    {
        return "^";
    }

    public MatrixDense jacobian (int i)
    {
        Complex a = x (0);
        Complex b = x (1);
        if (a.isZero ())
        {
            if (i == 0  &&  b.equals (Complex.ONE)) return MatrixDense.identity (2);
            return new MatrixDense (2, 2);
        }
        if (i == 0) return holomorphic (b.multiply (a.pow (b.subtract (Complex.ONE))));
        return holomorphic (value.multiply (a.ln ()));
    }
}
