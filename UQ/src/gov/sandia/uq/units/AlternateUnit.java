/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.units;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

import gov.sandia.uq.language.EvaluationException;
import gov.sandia.uq.language.type.RationalNumber;

/**
    Unit defined by applying a converter to an existing unit.
    With a symbol, this is a named unit such as the volt (W/A, identity converter) or the millivolt
    (V, factor 1/1000). Without a symbol, it is the anonymous result of scaling a unit by a number,
    as in VOLT.divide (1000).
**/
public class AlternateUnit extends Unit
{
    public final String           symbol;     // null for an anonymous scaled unit
    protected final Unit          reference;
    protected final UnitConverter converter;  // takes values in this unit to values in reference

    /**
        Names the given unit. If the given unit is itself an anonymous scaled unit, its scale is
        adopted, so AlternateUnit ("mV", VOLT.divide (1000)) refers directly to the volt.
    **/
    public AlternateUnit (String symbol, Unit reference)
    {
        this (symbol, base (reference), scaleOf (reference));
    }

    public AlternateUnit (String symbol, Unit reference, UnitConverter converter)
    {
        this.symbol    = symbol;
        this.reference = reference;
        this.converter = converter;
    }

    protected static Unit base (Unit reference)
    {
        if (reference instanceof AlternateUnit)
        {
            AlternateUnit a = (AlternateUnit) reference;
            if (a.symbol == null) return a.reference;
        }
        return reference;
    }

    protected static UnitConverter scaleOf (Unit reference)
    {
        if (reference instanceof AlternateUnit)
        {
            AlternateUnit a = (AlternateUnit) reference;
            if (a.symbol == null) return a.converter;
        }
        return UnitConverter.IDENTITY;
    }

    public Unit getReference ()
    {
        return reference;
    }

    public UnitConverter getConverter ()
    {
        return converter;
    }

    public Dimension getDimension ()
    {
        return reference.getDimension ();
    }

    public UnitConverter toCoherent () throws EvaluationException
    {
        return reference.toCoherent ().concatenate (converter);
    }

    public Unit getSystemUnit ()
    {
        return reference.getSystemUnit ();
    }

    public Map<Unit,RationalNumber> getElements ()
    {
        return Collections.singletonMap (this, RationalNumber.ONE);
    }

    public Unit scale (UnitConverter c)
    {
        if (symbol == null  &&  ! c.isIdentity ()) return reference.scale (converter.concatenate (c));
        return super.scale (c);
    }

    public boolean equals (Object that)
    {
        if (this == that) return true;
        if (! (that instanceof AlternateUnit)) return false;
        AlternateUnit a = (AlternateUnit) that;
        return Objects.equals (symbol, a.symbol)  &&  reference.equals (a.reference)  &&  converter.equals (a.converter);
    }

    public int hashCode ()
    {
        return Objects.hash (symbol, reference, converter);
    }

    public String toString ()
    {
        if (symbol != null) return symbol;
        String r = reference.toString ();
        if (reference instanceof ProductUnit) r = "(" + r + ")";
        return r + converter;
    }
}
