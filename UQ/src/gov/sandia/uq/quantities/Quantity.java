/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.quantities;

import gov.sandia.uq.language.Coercion;
import gov.sandia.uq.language.EvaluationException;
import gov.sandia.uq.language.IncompatibleUnitsException;
import gov.sandia.uq.language.Type;
import gov.sandia.uq.language.UnsupportedOperandException;
import gov.sandia.uq.language.type.Integral;
import gov.sandia.uq.language.type.RationalNumber;
import gov.sandia.uq.language.type.Scalar;
import gov.sandia.uq.units.Dimension;
import gov.sandia.uq.units.Unit;
import gov.sandia.uq.units.UnitConverter;

/**
    A numeric value tied to a physical unit. The value may be of any non-unit kind, including
    an uncertain component, in which case operations on the quantity extend the uncertainty graph.
    The unit of a result is always derived from the units of the operands, never looked up.
**/
public class Quantity extends Type
{
    protected final Unit unit;
    protected final Type value;

    /**
        A quantity wrapped in another quantity is flattened, with the two units multiplied.
    **/
    public Quantity (Unit unit, Type value)
    {
        if (value instanceof Unit) throw new UnsupportedOperandException ("Quantity", unit, value);
        if (value instanceof Quantity)
        {
            Quantity q = (Quantity) value;
            unit  = unit.multiply (q.unit);
            value = q.value;
        }
        this.unit  = unit;
        this.value = value;
    }

    public Quantity (Unit unit, double value)
    {
        this (unit, new Scalar (value));
    }

    public Quantity (Unit unit, long value)
    {
        this (unit, new Integral (value));
    }

    public Kind kind ()
    {
        return Kind.QUANTITY;
    }

    public Unit getDefaultUnit ()
    {
        return unit;
    }

    public Type getValue ()
    {
        return value;
    }

    /**
        Expresses this quantity in the given unit.
        @throws IncompatibleUnitsException if the dimensions differ.
    **/
    public Quantity to (Unit target) throws EvaluationException
    {
        return new Quantity (target, unit.getOperatorTo (target).convert (value));
    }

    /**
        @return The value in the coherent unit, which must be dimensionless.
        For example, 5 percent or 0.5 rad.
    **/
    protected Type dimensionless (String operator) throws EvaluationException
    {
        if (! unit.getDimension ().isDimensionless ()) throw new UnsupportedOperandException (operator, this);
        return unit.toCoherent ().convert (value);
    }

    public double getDouble () throws EvaluationException
    {
        return dimensionless ("getDouble").getDouble ();
    }

    public boolean isZero ()
    {
        return value.isZero ();
    }

    // Binary operations -----------------------------------------------------

    protected Type addSame (Type that) throws EvaluationException
    {
        return new Quantity (unit, value.add (convertHere ((Quantity) that)));
    }

    protected Type subtractSame (Type that) throws EvaluationException
    {
        return new Quantity (unit, value.subtract (convertHere ((Quantity) that)));
    }

    /**
        @return The value of the given quantity expressed in our unit.
    **/
    protected Type convertHere (Quantity that) throws EvaluationException
    {
        return that.unit.getOperatorTo (unit).convert (that.value);
    }

    protected Type multiplySame (Type that) throws EvaluationException
    {
        Quantity q = (Quantity) that;
        return new Quantity (unit.multiply (q.unit), value.multiply (q.value));
    }

    protected Type divideSame (Type that) throws EvaluationException
    {
        Quantity q = (Quantity) that;
        return new Quantity (unit.divide (q.unit), value.divide (q.value));
    }

    /**
        The exponent must be dimensionless. A quantity with dimension can only be raised to an exact
        rational power, so the unit of the result is well defined. A dimensionless base accepts any exponent.
    **/
    protected Type powerSame (Type that) throws EvaluationException
    {
        Quantity q = (Quantity) that;
        Type e = q.dimensionless ("^");

        RationalNumber r = null;
        switch (e.kind ())
        {
            case INTEGER:
                r = new RationalNumber (((Integral) e).value);
                break;
            case RATIONAL:
                r = (RationalNumber) e;
                break;
            case FLOAT:
                double d = e.getDouble ();
                if (d == Math.rint (d)  &&  Math.abs (d) < Long.MAX_VALUE) r = new RationalNumber ((long) d);
                break;
            default:
                break;
        }

        if (r == null)
        {
            if (! unit.getDimension ().isDimensionless ()) throw new UnsupportedOperandException ("^", this, that);
            return new Quantity (Unit.ONE, dimensionless ("^").power (e));
        }
        Type exponent = r;
        if (r.isInteger ()) exponent = new Integral (r.numerator);
        return new Quantity (unit.pow (r), value.power (exponent));
    }

    /**
        The argument is brought to this unit, so atan2(y,x) requires y and x to have compatible dimensions.
        A plain number as argument is read in the unit of this quantity.
    **/
    public Type atan2 (Type x) throws EvaluationException
    {
        return new Quantity (Unit.ONE, value.atan2 (argument ("atan2", x)));
    }

    public Type hypot (Type that) throws EvaluationException
    {
        return new Quantity (unit, value.hypot (argument ("hypot", that)));
    }

    protected Type argument (String operator, Type that) throws EvaluationException
    {
        Type converted = Coercion.convert (that, Kind.QUANTITY, this, true);
        if (! (converted instanceof Quantity)) throw new UnsupportedOperandException (operator, this, that);
        return convertHere ((Quantity) converted);
    }

    // Unary operations ------------------------------------------------------

    public Type negate () throws EvaluationException
    {
        return new Quantity (unit, value.negate ());
    }

    public Type abs () throws EvaluationException
    {
        return new Quantity (unit, value.abs ());
    }

    public Type conjugate () throws EvaluationException
    {
        return new Quantity (unit, value.conjugate ());
    }

    public Type sqrt () throws EvaluationException
    {
        return new Quantity (unit.root (2), value.sqrt ());
    }

    public Type exp () throws EvaluationException
    {
        return new Quantity (Unit.ONE, dimensionless ("exp").exp ());
    }

    public Type log () throws EvaluationException
    {
        return new Quantity (Unit.ONE, dimensionless ("log").log ());
    }

    public Type log10 () throws EvaluationException
    {
        return new Quantity (Unit.ONE, dimensionless ("log10").log10 ());
    }

    public Type sin () throws EvaluationException
    {
        return new Quantity (Unit.ONE, dimensionless ("sin").sin ());
    }

    public Type cos () throws EvaluationException
    {
        return new Quantity (Unit.ONE, dimensionless ("cos").cos ());
    }

    public Type tan () throws EvaluationException
    {
        return new Quantity (Unit.ONE, dimensionless ("tan").tan ());
    }

    public Type asin () throws EvaluationException
    {
        return new Quantity (Unit.ONE, dimensionless ("asin").asin ());
    }

    public Type acos () throws EvaluationException
    {
        return new Quantity (Unit.ONE, dimensionless ("acos").acos ());
    }

    public Type atan () throws EvaluationException
    {
        return new Quantity (Unit.ONE, dimensionless ("atan").atan ());
    }

    public Type sinh () throws EvaluationException
    {
        return new Quantity (Unit.ONE, dimensionless ("sinh").sinh ());
    }

    public Type cosh () throws EvaluationException
    {
        return new Quantity (Unit.ONE, dimensionless ("cosh").cosh ());
    }

    public Type tanh () throws EvaluationException
    {
        return new Quantity (Unit.ONE, dimensionless ("tanh").tanh ());
    }

    // Comparison ------------------------------------------------------------

    protected boolean equalsSame (Type that)
    {
        Quantity q = (Quantity) that;
        if (! unit.isCompatible (q.unit)) return false;
        return value.equals (convertHere (q));
    }

    /**
        Equal quantities may be expressed in different units, so only the dimension can be hashed,
        except for dimensionless values which may also equal plain numbers. Converting an uncertain
        value would create a new graph node each time, so those are hashed as they stand, and only
        when no conversion is needed.
    **/
    public int hashCode ()
    {
        Dimension d = unit.getDimension ();
        if (! d.isDimensionless ()) return d.hashCode ();
        try
        {
            UnitConverter c = unit.toCoherent ();
            Kind k = value.kind ();
            if (k == Kind.UNCERTAIN  ||  k == Kind.CUNCERTAIN)
            {
                if (c.isIdentity ()) return value.hashCode ();
                return d.hashCode ();
            }
            return c.convert (value).hashCode ();
        }
        catch (EvaluationException e)
        {
            return d.hashCode ();
        }
    }

    public String toString ()
    {
        if (unit.equals (Unit.ONE)) return value.toString ();
        return value + " " + unit;
    }
}
