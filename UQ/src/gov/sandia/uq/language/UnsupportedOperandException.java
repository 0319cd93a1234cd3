/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.uq.language;

/**
    No coercion rule exists for the given operands, or the operator does not apply to their kind.
**/
@SuppressWarnings("serial")
public class UnsupportedOperandException extends EvaluationException
{
    public UnsupportedOperandException (String operator, Object... operands)
    {
        super (describe (operator, operands), operands);
    }

    public UnsupportedOperandException (String operator, Throwable cause, Object... operands)
    {
        super (describe (operator, operands), cause, operands);
    }

    protected static String describe (String operator, Object[] operands)
    {
        StringBuilder result = new StringBuilder ();
        result.append ("Operation '" + operator + "' not supported for (");
        for (int i = 0; i < operands.length; i++)
        {
            if (i > 0) result.append (", ");
            Object o = operands[i];
            if      (o instanceof Type) result.append (((Type) o).kind ());
            else if (o == null)         result.append ("null");
            else                        result.append (o.getClass ().getSimpleName ());
        }
        result.append (")");
        return result.toString ();
    }
}
