/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.uq.language;

/**
    A declared standard uncertainty is negative, or a declared covariance matrix is not
    symmetric positive-semidefinite.
**/
@SuppressWarnings("serial")
public class NegativeUncertaintyException extends EvaluationException
{
    public NegativeUncertaintyException (Object value, Object uncertainty)
    {
        super ("Invalid uncertainty " + uncertainty + " for value " + value, value, uncertainty);
    }
}
