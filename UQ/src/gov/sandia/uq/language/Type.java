/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.language;

import gov.sandia.uq.language.type.Integral;
import gov.sandia.uq.language.type.Scalar;
import gov.sandia.uq.linear.MatrixDense;

/**
    Holds a value of one of the numeric kinds, and knows how to perform operations with all other kinds.
    Binary operations first bring both operands to a common kind (see Coercion), then dispatch to the
    same-kind implementation in the concrete class. A concrete class only needs to override the
    same-kind methods and the unary functions it supports. Everything else is reported as an
    UnsupportedOperandException.
**/
public abstract class Type
{
    /**
        The closed set of kinds that participate in arithmetic.
        The order of the constants is significant: Coercion.promote() relies on it to visit each pair once.
    **/
    public enum Kind
    {
        INTEGER,
        RATIONAL,
        FLOAT,
        COMPLEX,
        ARRAY,
        QUANTITY,
        UNCERTAIN,
        CUNCERTAIN,
        UNIT
    }

    public abstract Kind kind ();

    /**
        Converts a plain Java value into the corresponding kind.
        Integer types become INTEGER, floating-point types become FLOAT, and double[] becomes a column vector.
    **/
    public static Type valueOf (Object value) throws EvaluationException
    {
        if (value instanceof Type) return (Type) value;
        if (value instanceof Long  ||  value instanceof Integer  ||  value instanceof Short  ||  value instanceof Byte)
        {
            return new Integral (((Number) value).longValue ());
        }
        if (value instanceof Double  ||  value instanceof Float) return new Scalar (((Number) value).doubleValue ());
        if (value instanceof double[]) return new MatrixDense ((double[]) value);
        throw new UnsupportedOperandException ("valueOf", value);
    }

    /**
        @return The value of a real scalar kind as a double.
    **/
    public double getDouble () throws EvaluationException
    {
        throw new UnsupportedOperandException ("getDouble", this);
    }

    public boolean isZero ()
    {
        return false;
    }

    // Binary operations -----------------------------------------------------

    public Type add (Type that) throws EvaluationException
    {
        Type[] pair = Coercion.align ("+", true, this, that);
        return pair[0].addSame (pair[1]);
    }

    public Type subtract (Type that) throws EvaluationException
    {
        Type[] pair = Coercion.align ("-", true, this, that);
        return pair[0].subtractSame (pair[1]);
    }

    public Type multiply (Type that) throws EvaluationException
    {
        Type[] pair = Coercion.align ("*", false, this, that);
        return pair[0].multiplySame (pair[1]);
    }

    public Type divide (Type that) throws EvaluationException
    {
        Type[] pair = Coercion.align ("/", false, this, that);
        return pair[0].divideSame (pair[1]);
    }

    public Type power (Type that) throws EvaluationException
    {
        Type[] pair = Coercion.align ("^", false, this, that);
        return pair[0].powerSame (pair[1]);
    }

    /**
        Two-argument arctangent of this/x. The kind of the result follows this object only.
        The argument is converted to that kind where possible, so atan2(a,b) may succeed
        while atan2(b,a) fails.
    **/
    public Type atan2 (Type x) throws EvaluationException
    {
        return inexact ("atan2").atan2 (x);
    }

    /**
        sqrt(this^2 + that^2), with the same first-argument rule as atan2().
    **/
    public Type hypot (Type that) throws EvaluationException
    {
        return inexact ("hypot").hypot (that);
    }

    protected Type addSame (Type that) throws EvaluationException
    {
        throw new UnsupportedOperandException ("+", this, that);
    }

    protected Type subtractSame (Type that) throws EvaluationException
    {
        throw new UnsupportedOperandException ("-", this, that);
    }

    protected Type multiplySame (Type that) throws EvaluationException
    {
        throw new UnsupportedOperandException ("*", this, that);
    }

    protected Type divideSame (Type that) throws EvaluationException
    {
        throw new UnsupportedOperandException ("/", this, that);
    }

    protected Type powerSame (Type that) throws EvaluationException
    {
        throw new UnsupportedOperandException ("^", this, that);
    }

    /**
        Compares two values of the same kind. Only called after Coercion.align().
    **/
    protected boolean equalsSame (Type that)
    {
        return false;
    }

    // Unary operations ------------------------------------------------------

    /**
        Exact kinds have no closed form for the transcendental functions.
        They override this to hand back an equivalent floating-point value, which then does the work.
    **/
    protected Type inexact (String operator) throws EvaluationException
    {
        throw new UnsupportedOperandException (operator, this);
    }

    public Type negate () throws EvaluationException
    {
        throw new UnsupportedOperandException ("negate", this);
    }

    public Type abs () throws EvaluationException
    {
        throw new UnsupportedOperandException ("abs", this);
    }

    public Type conjugate () throws EvaluationException
    {
        throw new UnsupportedOperandException ("conjugate", this);
    }

    public Type sqrt () throws EvaluationException
    {
        return inexact ("sqrt").sqrt ();
    }

    public Type exp () throws EvaluationException
    {
        return inexact ("exp").exp ();
    }

    public Type log () throws EvaluationException
    {
        return inexact ("log").log ();
    }

    public Type log10 () throws EvaluationException
    {
        return inexact ("log10").log10 ();
    }

    public Type sin () throws EvaluationException
    {
        return inexact ("sin").sin ();
    }

    public Type cos () throws EvaluationException
    {
        return inexact ("cos").cos ();
    }

    public Type tan () throws EvaluationException
    {
        return inexact ("tan").tan ();
    }

    public Type asin () throws EvaluationException
    {
        return inexact ("asin").asin ();
    }

    public Type acos () throws EvaluationException
    {
        return inexact ("acos").acos ();
    }

    public Type atan () throws EvaluationException
    {
        return inexact ("atan").atan ();
    }

    public Type sinh () throws EvaluationException
    {
        return inexact ("sinh").sinh ();
    }

    public Type cosh () throws EvaluationException
    {
        return inexact ("cosh").cosh ();
    }

    public Type tanh () throws EvaluationException
    {
        return inexact ("tanh").tanh ();
    }

    // Comparison ------------------------------------------------------------

    /**
        Two values are equal if they can be brought to a common kind and are equal there.
        For example, the integer 2 equals the rational 2/1 and the float 2.0.
        A plain number only equals a dimensionless quantity.
        Subclasses that must hash consistently across kinds use the double value of the number.
    **/
    public boolean equals (Object that)
    {
        if (this == that) return true;
        if (! (that instanceof Type)) return false;
        Type t = (Type) that;
        if (Coercion.promote (kind (), t.kind ()) == null) return false;
        Type[] pair = Coercion.align ("==", false, this, t);
        return pair[0].equalsSame (pair[1]);
    }

    public int hashCode ()
    {
        return kind ().hashCode ();
    }
}
