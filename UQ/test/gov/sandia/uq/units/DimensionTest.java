/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.units;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import gov.sandia.uq.language.type.RationalNumber;

public class DimensionTest
{
    public static final Unit[] units = {SI.METER, SI.SECOND, SI.KILOGRAM, SI.VOLT, SI.NEWTON, SI.OHM, SI.kilo (SI.METER), SI.GRAM, SI.RADIAN, Unit.ONE};

    @Test
    public void testProductAndQuotient ()
    {
        for (Unit a : units)
        {
            for (Unit b : units)
            {
                String pair = a + "," + b;
                assertEquals (pair, a.getDimension ().multiply (b.getDimension ()), a.multiply (b).getDimension ());
                assertEquals (pair, a.getDimension ().divide   (b.getDimension ()), a.divide   (b).getDimension ());
            }
        }
    }

    @Test
    public void testRoots ()
    {
        RationalNumber half = new RationalNumber (1, 2);
        for (Unit a : units)
        {
            assertEquals (a.toString (), a.getDimension ().pow (half), a.root (2).getDimension ());

            // Nesting
            Unit nested = a.multiply (SI.SECOND).root (2).root (3).pow (6);
            assertEquals (a.toString (), a.getDimension ().multiply (SI.SECOND.getDimension ()), nested.getDimension ());
        }
    }

    @Test
    public void testExponents ()
    {
        Dimension v = SI.VOLT.getDimension ();
        assertEquals (new RationalNumber ( 2), v.getExponent (Dimension.LENGTH));
        assertEquals (new RationalNumber ( 1), v.getExponent (Dimension.MASS));
        assertEquals (new RationalNumber (-3), v.getExponent (Dimension.TIME));
        assertEquals (new RationalNumber (-1), v.getExponent (Dimension.CURRENT));
        assertEquals (RationalNumber.ZERO,     v.getExponent (Dimension.TEMPERATURE));

        Dimension r = SI.METER.root (2).getDimension ();
        assertEquals (new RationalNumber (1, 2), r.getExponent (Dimension.LENGTH));

        assertTrue  (SI.RADIAN.getDimension ().isDimensionless ());
        assertTrue  (Dimension.NONE.isDimensionless ());
        assertFalse (v.isDimensionless ());
        assertEquals (Dimension.NONE, SI.METER.divide (SI.METER).getDimension ());
    }

    @Test
    public void testEquality ()
    {
        Dimension a = Dimension.base (Dimension.LENGTH).divide (Dimension.base (Dimension.TIME));
        Dimension b = SI.METER.divide (SI.SECOND).getDimension ();
        assertEquals (a, b);
        assertEquals (a.hashCode (), b.hashCode ());
        assertEquals (SI.JOULE.getDimension (), SI.NEWTON.multiply (SI.METER).getDimension ());
    }
}
