/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.cucomponents;

import gov.sandia.uq.language.type.Complex;
import gov.sandia.uq.linear.MatrixDense;

/**
    Interior node of the complex graph. Each operator is treated as a map from R^2 to R^2
    for each operand, so it need not be holomorphic.
**/
public abstract class COperation extends CUncertainComponent
{
    protected final CUncertainComponent[] operands;
    protected final Complex               value;

    protected COperation (Complex value, CUncertainComponent... operands)
    {
        this.value    = value;
        this.operands = operands;
    }

    public abstract String name ();

    /**
        @return The 2x2 matrix that takes a perturbation (real, imaginary) of operand i
        to the resulting perturbation of this node, as column vectors.
    **/
    public abstract MatrixDense jacobian (int i);

    public Complex getValue ()
    {
        return value;
    }

    public int getOperandCount ()
    {
        return operands.length;
    }

    public CUncertainComponent getOperand (int i)
    {
        return operands[i];
    }

    protected Complex x (int i)
    {
        return operands[i].getValue ();
    }

    /**
        Jacobian of a complex-differentiable function with derivative d.
        Multiplication by d=a+ib rotates and scales the perturbation.
    **/
    public static MatrixDense holomorphic (Complex d)
    {
        return new MatrixDense (new double[][] {{d.real, -d.imag}, {d.imag, d.real}});
    }

    public String toString ()
    {
        return name () + "#" + id + "=" + value;
    }
}
