/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.uq.language;

@SuppressWarnings("serial")
public class DivisionByZeroException extends EvaluationException
{
    public DivisionByZeroException (Object dividend)
    {
        super ("Division by zero: " + dividend + " / 0", dividend);
    }
}
