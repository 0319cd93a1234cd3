/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.ucomponents;

import gov.sandia.uq.language.type.Scalar;

/**
    Interior node of the graph. The nominal value is computed once, when the node is created.
    Subclasses supply the partial derivative with respect to each operand, evaluated at the
    nominal values of the operands.
**/
public abstract class Operation extends UncertainComponent
{
    protected final UncertainComponent[] operands;
    protected final double               value;

    protected Operation (double value, UncertainComponent... operands)
    {
        this.value    = value;
        this.operands = operands;
    }

    public abstract String name ();

    /**
        @return The sensitivity coefficient of this operation with respect to operand i.
    **/
    public abstract double partial (int i);

    public double getValue ()
    {
        return value;
    }

    public int getOperandCount ()
    {
        return operands.length;
    }

    public UncertainComponent getOperand (int i)
    {
        return operands[i];
    }

    /**
        Shorthand for the nominal value of an operand.
    **/
    protected double x (int i)
    {
        return operands[i].getValue ();
    }

    /**
        Only describes this node. Operands are not rendered, since graphs can be deep.
    **/
    public String toString ()
    {
        return name () + "#" + id + "=" + Scalar.print (value);
    }
}
