/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.cucomponents;

import java.util.concurrent.atomic.AtomicLong;

import gov.sandia.uq.cucomponents.operator.AbsoluteValue;
import gov.sandia.uq.cucomponents.operator.Add;
import gov.sandia.uq.cucomponents.operator.Argument;
import gov.sandia.uq.cucomponents.operator.Conjugate;
import gov.sandia.uq.cucomponents.operator.Cosine;
import gov.sandia.uq.cucomponents.operator.Divide;
import gov.sandia.uq.cucomponents.operator.Exp;
import gov.sandia.uq.cucomponents.operator.ImaginaryPart;
import gov.sandia.uq.cucomponents.operator.Log;
import gov.sandia.uq.cucomponents.operator.Multiply;
import gov.sandia.uq.cucomponents.operator.Negate;
import gov.sandia.uq.cucomponents.operator.Power;
import gov.sandia.uq.cucomponents.operator.RealPart;
import gov.sandia.uq.cucomponents.operator.Sine;
import gov.sandia.uq.cucomponents.operator.SquareRoot;
import gov.sandia.uq.cucomponents.operator.Subtract;
import gov.sandia.uq.language.Type;
import gov.sandia.uq.language.type.Complex;

/**
    Node in a graph of complex-valued computations. Same structure as the real graph,
    except that a perturbation has two components (real, imaginary), so each edge of the
    graph carries a 2x2 Jacobian rather than a single sensitivity coefficient.
**/
public abstract class CUncertainComponent extends Type
{
    protected static final AtomicLong nextID = new AtomicLong ();

    public final long id = nextID.getAndIncrement ();

    public Kind kind ()
    {
        return Kind.CUNCERTAIN;
    }

    public abstract Complex getValue ();

    public int getOperandCount ()
    {
        return 0;
    }

    public CUncertainComponent getOperand (int i)
    {
        throw new IndexOutOfBoundsException (String.valueOf (i));
    }

    protected Type addSame (Type that)
    {
        return new Add (this, (CUncertainComponent) that);
    }

    protected Type subtractSame (Type that)
    {
        return new Subtract (this, (CUncertainComponent) that);
    }

    protected Type multiplySame (Type that)
    {
        return new Multiply (this, (CUncertainComponent) that);
    }

    protected Type divideSame (Type that)
    {
        return new Divide (this, (CUncertainComponent) that);
    }

    protected Type powerSame (Type that)
    {
        return new Power (this, (CUncertainComponent) that);
    }

    public Type negate ()
    {
        return new Negate (this);
    }

    public Type conjugate ()
    {
        return new Conjugate (this);
    }

    /**
        Magnitude, carried in the real part of the result.
    **/
    public Type abs ()
    {
        return new AbsoluteValue (this);
    }

    /**
        Phase angle, carried in the real part of the result.
    **/
    public CUncertainComponent arg ()
    {
        return new Argument (this);
    }

    public CUncertainComponent real ()
    {
        return new RealPart (this);
    }

    public CUncertainComponent imag ()
    {
        return new ImaginaryPart (this);
    }

    public Type sqrt ()
    {
        return new SquareRoot (this);
    }

    public Type exp ()
    {
        return new Exp (this);
    }

    public Type log ()
    {
        return new Log (this);
    }

    public Type sin ()
    {
        return new Sine (this);
    }

    public Type cos ()
    {
        return new Cosine (this);
    }

    public boolean equals (Object that)
    {
        return this == that;
    }

    public int hashCode ()
    {
        return Long.hashCode (id);
    }
}
