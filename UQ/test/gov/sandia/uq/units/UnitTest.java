/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.units;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import gov.sandia.uq.language.IncompatibleUnitsException;
import gov.sandia.uq.language.Type;
import gov.sandia.uq.language.type.Integral;
import gov.sandia.uq.language.type.RationalNumber;
import gov.sandia.uq.quantities.Quantity;

public class UnitTest
{
    @Test
    public void testRoundTrip ()
    {
        Unit[][] pairs =
        {
            {SI.METER,                      SI.kilo (SI.METER)},
            {SI.VOLT,                       SI.milli (SI.VOLT)},
            {SI.GRAM,                       SI.KILOGRAM},
            {SI.CELSIUS,                    SI.KELVIN},
            {SI.JOULE,                      SI.NEWTON.multiply (SI.METER)},
            {SI.kilo (SI.METER).divide (SI.SECOND), SI.METER.divide (SI.milli (SI.SECOND))},
            {SI.METER.root (2),             SI.centi (SI.METER).root (2)},
            {SI.METER.multiply (2.5),       SI.micro (SI.METER)}
        };
        double[] values = {-273.15, -1, 0, 1e-9, 0.5, 2, 1234.5678};
        for (Unit[] p : pairs)
        {
            UnitConverter there = p[0].getOperatorTo (p[1]);
            UnitConverter back  = p[1].getOperatorTo (p[0]);
            for (double v : values)
            {
                double t = back.convert (there.convert (v));
                assertEquals (p[0] + " -> " + p[1], v, t, 1e-9 * Math.max (1, Math.abs (v)));
            }
        }
    }

    @Test
    public void testIdentity ()
    {
        assertSame (UnitConverter.IDENTITY, SI.METER.getOperatorTo (SI.METER));
        assertSame (UnitConverter.IDENTITY, SI.milli (SI.VOLT).getOperatorTo (SI.milli (SI.VOLT)));
        assertTrue (SI.VOLT.getOperatorTo (SI.WATT.divide (SI.AMPERE)).isIdentity ());
        assertTrue (UnitConverter.linear (2.0).concatenate (UnitConverter.linear (0.5)).isIdentity ());
        assertTrue (UnitConverter.linear (new RationalNumber (3)).concatenate (UnitConverter.linear (new RationalNumber (1, 3))).isIdentity ());
        assertTrue (new AddConverter (5).concatenate (new AddConverter (-5)).isIdentity ());
    }

    @Test
    public void testIncompatible ()
    {
        assertFalse (SI.METER.isCompatible (SI.SECOND));
        try
        {
            SI.METER.getOperatorTo (SI.SECOND);
            fail ("converted length to time");
        }
        catch (IncompatibleUnitsException e)
        {
            assertEquals (2, e.getOperands ().length);
        }
    }

    @Test
    public void testMillivolt ()
    {
        Unit mV = new AlternateUnit ("mV", SI.VOLT.divide (1000));
        assertEquals (SI.milli (SI.VOLT), mV);
        assertEquals ("mV", mV.toString ());
        assertEquals ("V*1/1000", SI.VOLT.divide (1000).toString ());

        UnitConverter c = SI.VOLT.getOperatorTo (mV);
        assertEquals (2000, c.convert (2), 0);
        Type exact = c.convert (new Integral (2));
        assertEquals (Type.Kind.RATIONAL, exact.kind ());
        assertEquals (new Integral (2000), exact);
    }

    @Test
    public void testCelsius ()
    {
        UnitConverter c = SI.CELSIUS.getOperatorTo (SI.KELVIN);
        assertFalse (c.isLinear ());
        assertEquals (273.15, c.convert (0),   1e-12);
        assertEquals (373.15, c.convert (100), 1e-12);
        assertEquals (0,      c.inverse ().convert (273.15), 1e-12);
    }

    @Test
    public void testAssociativity ()
    {
        UnitConverter a = UnitConverter.linear (3.0);
        UnitConverter b = new AddConverter (7);
        UnitConverter c = UnitConverter.linear (new RationalNumber (1, 4));
        UnitConverter left  = a.concatenate (b).concatenate (c);
        UnitConverter right = a.concatenate (b.concatenate (c));
        for (double v : new double[] {-2, 0, 1, 10})
        {
            assertEquals (left.convert (v), right.convert (v), 1e-12);
            assertEquals (3 * (v / 4 + 7), left.convert (v), 1e-12);  // c is applied first
        }
    }

    @Test
    public void testAlgebra ()
    {
        assertSame   (Unit.ONE, SI.METER.divide (SI.METER));
        assertEquals (SI.METER, SI.METER.root (2).pow (2));
        assertEquals (SI.METER.multiply (SI.METER), SI.METER.pow (2));
        assertEquals (SI.SECOND.inverse (), Unit.ONE.divide (SI.SECOND));
        assertEquals ("m^(1/2)", SI.METER.root (2).toString ());
        assertEquals ("m·s^-2",  SI.METER.divide (SI.SECOND.pow (2)).toString ());
        assertEquals ("1",       Unit.ONE.toString ());

        // Named units are distinct even when they have the same dimension.
        assertTrue  (SI.HERTZ.isCompatible (SI.BECQUEREL));
        assertFalse (SI.HERTZ.equals (SI.BECQUEREL));

        // System unit
        assertEquals (SI.KILOGRAM.multiply (SI.METER.pow (2)).divide (SI.SECOND.pow (3)).divide (SI.AMPERE), SI.milli (SI.VOLT).getSystemUnit ());
    }

    @Test
    public void testLargePrefixPowers ()
    {
        // Factors that no longer fit in a long fraction continue in floating-point.
        Quantity q = new Quantity (SI.nano (SI.METER).pow (3), 5.0).to (SI.METER.pow (3));
        assertEquals (SI.METER.pow (3), q.getDefaultUnit ());
        assertEquals (5e-27, q.getValue ().getDouble (), 1e-39);

        UnitConverter c = SI.tera (SI.METER).getOperatorTo (SI.pico (SI.METER));
        assertEquals (1e24, c.convert (1.0), 1e12);
        assertEquals (3, SI.pico (SI.METER).getOperatorTo (SI.tera (SI.METER)).convert (c.convert (3.0)), 1e-12);

        assertEquals (1e-24, SI.micro (SI.METER).pow (4).getOperatorTo (SI.METER.pow (4)).convert (1.0), 1e-36);
        assertEquals (1e-24, SI.pico  (SI.METER).pow (2).getOperatorTo (SI.METER.pow (2)).convert (1.0), 1e-36);

        // Factors that fit stay exact.
        UnitConverter k = SI.kilo (SI.METER).pow (2).getOperatorTo (SI.METER.pow (2));
        assertTrue (k instanceof RationalConverter);
        assertEquals (new RationalNumber (1000000), ((RationalConverter) k).factor);
    }
}
