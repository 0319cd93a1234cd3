/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.language;

import gov.sandia.uq.cucomponents.CConstant;
import gov.sandia.uq.language.Type.Kind;
import gov.sandia.uq.language.type.Complex;
import gov.sandia.uq.language.type.Integral;
import gov.sandia.uq.language.type.Matrix;
import gov.sandia.uq.language.type.RationalNumber;
import gov.sandia.uq.language.type.Scalar;
import gov.sandia.uq.quantities.Quantity;
import gov.sandia.uq.ucomponents.Constant;
import gov.sandia.uq.units.Unit;

/**
    The numeric coercion tower.
    For any pair of kinds, promote() names the kind both operands are brought to before a binary
    operation, or null if the pair is undefined. convert() performs the conversion of one value.

    <p>Conversions, by target kind:
    <ul>
    <li>RATIONAL   -- integer n becomes n/1
    <li>FLOAT      -- integer or rational becomes its double value
    <li>COMPLEX    -- any real scalar becomes x+0i
    <li>ARRAY      -- real scalar is broadcast to the shape of the array operand
    <li>QUANTITY   -- any non-unit value is wrapped. Additive operations use the unit of the quantity
                      operand, so q+1 means "1 in the units of q". Multiplicative operations use ONE.
    <li>UNCERTAIN  -- real scalar becomes a Constant node, which carries no uncertainty
    <li>CUNCERTAIN -- real or complex scalar becomes a CConstant node
    </ul>
**/
public class Coercion
{
    /**
        Total and symmetric promotion function.
        @return The common kind, or null if no operation is defined between the two kinds.
    **/
    public static Kind promote (Kind a, Kind b)
    {
        if (a == b) return a;
        if (a.ordinal () > b.ordinal ())  // Only visit each unordered pair once.
        {
            Kind t = a;
            a = b;
            b = t;
        }
        switch (a)
        {
            case INTEGER:
                switch (b)
                {
                    case RATIONAL:
                    case FLOAT:
                    case COMPLEX:
                    case ARRAY:
                    case QUANTITY:
                    case UNCERTAIN:
                    case CUNCERTAIN: return b;
                    default:         return null;
                }
            case RATIONAL:
                switch (b)
                {
                    case FLOAT:
                    case COMPLEX:
                    case QUANTITY:
                    case UNCERTAIN:
                    case CUNCERTAIN: return b;
                    default:         return null;  // ARRAY, UNIT
                }
            case FLOAT:
                switch (b)
                {
                    case COMPLEX:
                    case ARRAY:
                    case QUANTITY:
                    case UNCERTAIN:
                    case CUNCERTAIN: return b;
                    default:         return null;
                }
            case COMPLEX:
                switch (b)
                {
                    case QUANTITY:
                    case CUNCERTAIN: return b;
                    default:         return null;  // ARRAY (real only), UNCERTAIN, UNIT
                }
            case ARRAY:
                if (b == Kind.QUANTITY) return b;
                return null;
            case QUANTITY:
                if (b == Kind.UNCERTAIN  ||  b == Kind.CUNCERTAIN) return Kind.QUANTITY;
                return null;
            default:  // UNCERTAIN vs CUNCERTAIN, or anything vs UNIT
                return null;
        }
    }

    /**
        Brings both operands of a binary operation to their common kind.
        @param operator Name of the operation, used only for error reporting.
        @param additive Selects how plain numbers are wrapped when promoted to QUANTITY.
        @return Two-element array holding the converted operands, in their original order.
    **/
    public static Type[] align (String operator, boolean additive, Type a, Type b) throws EvaluationException
    {
        Kind k = promote (a.kind (), b.kind ());
        if (k == null) throw new UnsupportedOperandException (operator, a, b);
        return new Type[] {convert (a, k, b, additive), convert (b, k, a, additive)};
    }

    /**
        Converts value to the given kind.
        @param reference The other operand of the binary operation. Supplies the shape for ARRAY
        and the unit for additive QUANTITY conversions.
    **/
    public static Type convert (Type value, Kind target, Type reference, boolean additive) throws EvaluationException
    {
        Kind from = value.kind ();
        if (from == target) return value;

        boolean real = from == Kind.INTEGER  ||  from == Kind.RATIONAL  ||  from == Kind.FLOAT;
        switch (target)
        {
            case RATIONAL:
                if (from == Kind.INTEGER) return new RationalNumber (((Integral) value).value);
                break;
            case FLOAT:
                if (real) return new Scalar (value.getDouble ());
                break;
            case COMPLEX:
                if (real) return new Complex (value.getDouble (), 0);
                break;
            case ARRAY:
                if (from == Kind.INTEGER  ||  from == Kind.FLOAT)
                {
                    if (reference instanceof Matrix) return ((Matrix) reference).clear (value.getDouble ());
                }
                break;
            case QUANTITY:
                if (from == Kind.UNIT) break;
                Unit unit = Unit.ONE;
                if (additive  &&  reference instanceof Quantity) unit = ((Quantity) reference).getDefaultUnit ();
                return new Quantity (unit, value);
            case UNCERTAIN:
                if (real) return new Constant (value.getDouble ());
                break;
            case CUNCERTAIN:
                if (real)                  return new CConstant (new Complex (value.getDouble (), 0));
                if (from == Kind.COMPLEX) return new CConstant ((Complex) value);
                break;
            default:
                break;
        }
        throw new UnsupportedOperandException ("convert to " + target, value);
    }
}
