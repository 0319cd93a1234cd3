/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.units;

import java.util.Collections;
import java.util.Map;

import gov.sandia.uq.language.type.RationalNumber;

/**
    The coherent unit of one of the base dimensions, such as the meter for length.
**/
public class BaseUnit extends Unit
{
    public final String    symbol;
    protected final int       index;
    protected final Dimension dimension;

    public BaseUnit (String symbol, int dimensionIndex)
    {
        this.symbol    = symbol;
        this.index     = dimensionIndex;
        this.dimension = Dimension.base (dimensionIndex);
    }

    public Dimension getDimension ()
    {
        return dimension;
    }

    public UnitConverter toCoherent ()
    {
        return UnitConverter.IDENTITY;
    }

    public Unit getSystemUnit ()
    {
        return this;
    }

    public Map<Unit,RationalNumber> getElements ()
    {
        return Collections.singletonMap (this, RationalNumber.ONE);
    }

    /**
        Base units are elementary, so structural equality would recurse on itself.
    **/
    public boolean equals (Object that)
    {
        if (this == that) return true;
        if (! (that instanceof BaseUnit)) return false;
        BaseUnit b = (BaseUnit) that;
        return index == b.index  &&  symbol.equals (b.symbol);
    }

    public int hashCode ()
    {
        return 31 * index + symbol.hashCode ();
    }

    public String toString ()
    {
        return symbol;
    }
}
