/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.uq.language;

/**
    Base of all failures raised while building or evaluating an expression.
    Every subclass reports a local precondition failure. No state is modified before it is thrown,
    so the caller may simply correct the inputs and try again.
**/
@SuppressWarnings("serial")
public class EvaluationException extends RuntimeException
{
    protected Object[] operands;

    public EvaluationException (String message, Object... operands)
    {
        super (message);
        this.operands = operands;
    }

    public EvaluationException (String message, Throwable cause, Object... operands)
    {
        super (message, cause);
        this.operands = operands;
    }

    /**
        @return The values that triggered this failure, in the order they were given to the operation.
        May be empty, but never null.
    **/
    public Object[] getOperands ()
    {
        if (operands == null) return new Object[0];
        return operands.clone ();
    }
}
