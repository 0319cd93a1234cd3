/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.units;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;

import gov.sandia.uq.language.EvaluationException;
import gov.sandia.uq.language.UnsupportedOperandException;
import gov.sandia.uq.language.type.RationalNumber;

/**
    Product of elementary units, each raised to a rational power. For example, m/s^2 is stored as {m:1, s:-2}.
    Elements are always base units or alternate units, never other product units. Factors whose
    exponents cancel are dropped.
**/
public class ProductUnit extends Unit
{
    protected final Map<Unit,RationalNumber> elements;
    protected final Dimension                 dimension;

    /**
        Constructs the product of the given units, flattening any nested products.
        Use compose() instead to get the simplest unit that represents the product.
    **/
    public ProductUnit (Map<Unit,RationalNumber> factors)
    {
        Map<Unit,RationalNumber> flat = new LinkedHashMap<Unit,RationalNumber> ();
        for (Entry<Unit,RationalNumber> e : factors.entrySet ()) accumulate (flat, e.getKey (), e.getValue ());
        elements = Collections.unmodifiableMap (flat);

        Dimension d = Dimension.NONE;
        for (Entry<Unit,RationalNumber> e : elements.entrySet ()) d = d.multiply (e.getKey ().getDimension ().pow (e.getValue ()));
        dimension = d;
    }

    /**
        Adds unit^exponent into the given collection of elementary factors.
    **/
    public static void accumulate (Map<Unit,RationalNumber> factors, Unit unit, RationalNumber exponent)
    {
        if (exponent.isZero ()) return;
        if (unit instanceof ProductUnit)
        {
            for (Entry<Unit,RationalNumber> e : ((ProductUnit) unit).elements.entrySet ())
            {
                accumulate (factors, e.getKey (), e.getValue ().multiply (exponent));
            }
            return;
        }
        RationalNumber current = factors.get (unit);
        if (current == null) current = RationalNumber.ZERO;
        current = current.add (exponent);
        if (current.isZero ()) factors.remove (unit);
        else                   factors.put (unit, current);
    }

    /**
        @return The simplest unit equivalent to the product of the given factors. An empty product
        is ONE, and a single factor with exponent 1 is that factor itself.
    **/
    public static Unit compose (Map<Unit,RationalNumber> factors)
    {
        Map<Unit,RationalNumber> flat = new LinkedHashMap<Unit,RationalNumber> ();
        for (Entry<Unit,RationalNumber> e : factors.entrySet ()) accumulate (flat, e.getKey (), e.getValue ());
        if (flat.isEmpty ()) return ONE;
        if (flat.size () == 1)
        {
            Entry<Unit,RationalNumber> e = flat.entrySet ().iterator ().next ();
            if (e.getValue ().equals (RationalNumber.ONE)) return e.getKey ();
        }
        return new ProductUnit (flat);
    }

    public Dimension getDimension ()
    {
        return dimension;
    }

    /**
        Only linear factors can be raised to a power. A product involving an affine unit such as
        degree Celsius has no meaningful conversion.
    **/
    public UnitConverter toCoherent () throws EvaluationException
    {
        UnitConverter result = UnitConverter.IDENTITY;
        for (Entry<Unit,RationalNumber> e : elements.entrySet ())
        {
            UnitConverter c = e.getKey ().toCoherent ();
            if (! c.isLinear ()) throw new UnsupportedOperandException ("toCoherent", this);
            result = result.concatenate (c.pow (e.getValue ()));
        }
        return result;
    }

    public Unit getSystemUnit ()
    {
        Map<Unit,RationalNumber> factors = new LinkedHashMap<Unit,RationalNumber> ();
        for (Entry<Unit,RationalNumber> e : elements.entrySet ()) accumulate (factors, e.getKey ().getSystemUnit (), e.getValue ());
        return compose (factors);
    }

    public Map<Unit,RationalNumber> getElements ()
    {
        return elements;
    }

    public String toString ()
    {
        if (elements.isEmpty ()) return "1";
        StringBuilder result = new StringBuilder ();
        for (Entry<Unit,RationalNumber> e : elements.entrySet ())
        {
            if (result.length () > 0) result.append ("·");
            Unit u = e.getKey ();
            boolean anonymous =  u instanceof AlternateUnit  &&  ((AlternateUnit) u).symbol == null;
            if (anonymous) result.append ("(" + u + ")");
            else           result.append (u);
            RationalNumber p = e.getValue ();
            if (! p.equals (RationalNumber.ONE)) result.append (formatExponent (p));
        }
        return result.toString ();
    }
}
