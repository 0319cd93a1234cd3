/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.cucomponents.operator;

import gov.sandia.uq.cucomponents.COperation;
import gov.sandia.uq.cucomponents.CUncertainComponent;
import gov.sandia.uq.language.DivisionByZeroException;
import gov.sandia.uq.linear.MatrixDense;

/**
    Principal natural logarithm.
    The derivative is unbounded at zero. There the Jacobian is not defined, and evaluating the
    uncertainty of a node that depends on this one throws DivisionByZeroException, as complex
    division by zero does. The nominal value is still computed.
**/
public class Log extends COperation
{
    public Log (CUncertainComponent a)
    {
        super (a.getValue ().ln (), a);
    }

    public String name ()
    {
        return "log";
    }

    public MatrixDense jacobian (int i)
    {
        if (x (0).isZero ()) throw new DivisionByZeroException (this);
        return holomorphic (x (0).reciprocal ());
    }
}
