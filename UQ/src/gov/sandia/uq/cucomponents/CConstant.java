/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.cucomponents;

import gov.sandia.uq.language.type.Complex;

/**
    Complex leaf without uncertainty.
**/
public class CConstant extends CUncertainComponent
{
    protected final Complex value;

    public CConstant (Complex value)
    {
        this.value = value;
    }

    public Complex getValue ()
    {
        return value;
    }

    public boolean isZero ()
    {
        return value.isZero ();
    }

    public String toString ()
    {
        return value.toString ();
    }
}
