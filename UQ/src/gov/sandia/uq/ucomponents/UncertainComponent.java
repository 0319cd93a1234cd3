/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.ucomponents;

import java.util.concurrent.atomic.AtomicLong;

import gov.sandia.uq.language.Coercion;
import gov.sandia.uq.language.EvaluationException;
import gov.sandia.uq.language.Type;
import gov.sandia.uq.ucomponents.operator.AbsoluteValue;
import gov.sandia.uq.ucomponents.operator.Add;
import gov.sandia.uq.ucomponents.operator.ArcCosine;
import gov.sandia.uq.ucomponents.operator.ArcSine;
import gov.sandia.uq.ucomponents.operator.ArcTangent;
import gov.sandia.uq.ucomponents.operator.ArcTangent2;
import gov.sandia.uq.ucomponents.operator.Cosine;
import gov.sandia.uq.ucomponents.operator.Divide;
import gov.sandia.uq.ucomponents.operator.Exp;
import gov.sandia.uq.ucomponents.operator.HyperbolicCosine;
import gov.sandia.uq.ucomponents.operator.HyperbolicSine;
import gov.sandia.uq.ucomponents.operator.HyperbolicTangent;
import gov.sandia.uq.ucomponents.operator.Hypot;
import gov.sandia.uq.ucomponents.operator.Log;
import gov.sandia.uq.ucomponents.operator.Log10;
import gov.sandia.uq.ucomponents.operator.Multiply;
import gov.sandia.uq.ucomponents.operator.Negate;
import gov.sandia.uq.ucomponents.operator.Power;
import gov.sandia.uq.ucomponents.operator.Sine;
import gov.sandia.uq.ucomponents.operator.SquareRoot;
import gov.sandia.uq.ucomponents.operator.Subtract;
import gov.sandia.uq.ucomponents.operator.Tangent;

/**
    Node in a graph of real-valued computations, which records how a result depends on
    uncertain inputs. Every arithmetic operation on a node creates a new Operation node that
    refers to its operands, so a sub-expression used twice is shared rather than copied.
    Nodes never change after construction. The uncertainty of a node is not stored in it;
    it is derived on demand by a Context.

    <p>Nodes are distinguished by identity. Two inputs with the same value and uncertainty are
    still independent sources of error.
**/
public abstract class UncertainComponent extends Type
{
    protected static final AtomicLong nextID = new AtomicLong ();

    /**
        Stable handle for this node, unique within the process.
    **/
    public final long id = nextID.getAndIncrement ();

    public Kind kind ()
    {
        return Kind.UNCERTAIN;
    }

    /**
        @return The nominal value.
    **/
    public abstract double getValue ();

    /**
        Leaves have no operands.
    **/
    public int getOperandCount ()
    {
        return 0;
    }

    public UncertainComponent getOperand (int i)
    {
        throw new IndexOutOfBoundsException (String.valueOf (i));
    }

    // Binary operations -----------------------------------------------------

    protected Type addSame (Type that)
    {
        return new Add (this, (UncertainComponent) that);
    }

    protected Type subtractSame (Type that)
    {
        return new Subtract (this, (UncertainComponent) that);
    }

    protected Type multiplySame (Type that)
    {
        return new Multiply (this, (UncertainComponent) that);
    }

    protected Type divideSame (Type that)
    {
        return new Divide (this, (UncertainComponent) that);
    }

    protected Type powerSame (Type that)
    {
        return new Power (this, (UncertainComponent) that);
    }

    public Type atan2 (Type x) throws EvaluationException
    {
        return new ArcTangent2 (this, (UncertainComponent) Coercion.convert (x, Kind.UNCERTAIN, this, false));
    }

    public Type hypot (Type that) throws EvaluationException
    {
        return new Hypot (this, (UncertainComponent) Coercion.convert (that, Kind.UNCERTAIN, this, false));
    }

    // Unary operations ------------------------------------------------------

    public Type negate ()
    {
        return new Negate (this);
    }

    public Type abs ()
    {
        return new AbsoluteValue (this);
    }

    public Type conjugate ()
    {
        return this;
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

    public Type log10 ()
    {
        return new Log10 (this);
    }

    public Type sin ()
    {
        return new Sine (this);
    }

    public Type cos ()
    {
        return new Cosine (this);
    }

    public Type tan ()
    {
        return new Tangent (this);
    }

    public Type asin ()
    {
        return new ArcSine (this);
    }

    public Type acos ()
    {
        return new ArcCosine (this);
    }

    public Type atan ()
    {
        return new ArcTangent (this);
    }

    public Type sinh ()
    {
        return new HyperbolicSine (this);
    }

    public Type cosh ()
    {
        return new HyperbolicCosine (this);
    }

    public Type tanh ()
    {
        return new HyperbolicTangent (this);
    }

    // Identity --------------------------------------------------------------

    public boolean equals (Object that)
    {
        return this == that;
    }

    public int hashCode ()
    {
        return Long.hashCode (id);
    }
}
