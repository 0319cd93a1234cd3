/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.units;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import gov.sandia.uq.language.Type;
import gov.sandia.uq.language.UnsupportedOperandException;
import gov.sandia.uq.language.type.Scalar;
import gov.sandia.uq.quantities.Quantity;

public class SITest
{
    @Test
    public void testLookup ()
    {
        assertSame   (SI.VOLT,     SI.getUnit ("V"));
        assertSame   (SI.KILOGRAM, SI.getUnit ("kg"));
        assertSame   (SI.MOLE,     SI.getUnit ("mol"));
        assertSame   (SI.PASCAL,   SI.getUnit ("Pa"));
        assertEquals (SI.milli (SI.VOLT),    SI.getUnit ("mV"));
        assertEquals (SI.kilo (SI.METER),    SI.getUnit ("km"));
        assertEquals (SI.deka (SI.METER),    SI.getUnit ("dam"));
        assertEquals (SI.milli (SI.GRAM),    SI.getUnit ("mg"));
        assertEquals (SI.micro (SI.SECOND),  SI.getUnit ("µs"));
        assertNull   (SI.getUnit ("furlong"));
        assertNull   (SI.getUnit ("m" + "kg"));  // kilogram takes no further prefix
    }

    @Test
    public void testRegistryIsReadOnly ()
    {
        assertTrue (SI.getUnits ().size () >= 30);
        try
        {
            SI.getUnits ().put ("x", SI.METER);
            fail ("registry was modified");
        }
        catch (UnsupportedOperationException e)
        {
            // expected
        }
    }

    @Test
    public void testDerivedUnits ()
    {
        assertTrue (SI.WATT.isCompatible (SI.VOLT.multiply (SI.AMPERE)));
        assertTrue (SI.OHM.isCompatible (SI.SIEMENS.inverse ()));
        assertTrue (SI.TESLA.isCompatible (SI.WEBER.divide (SI.METER.pow (2))));
        assertTrue (SI.HENRY.multiply (SI.FARAD).isCompatible (SI.SECOND.pow (2)));
        assertTrue (SI.RADIAN.getDimension ().isDimensionless ());

        Quantity m = new Quantity (SI.GRAM, 1500);
        assertEquals (new Scalar (1.5), m.to (SI.KILOGRAM).getValue ());

        Quantity t = new Quantity (SI.CELSIUS, 25.0);
        assertEquals (298.15, t.to (SI.KELVIN).getValue ().getDouble (), 1e-12);
    }

    @Test
    public void testParse ()
    {
        UnitValue v = new UnitValue ("2 mV");
        assertEquals (2, v.value, 0);
        assertEquals (SI.milli (SI.VOLT), v.unit);
        assertEquals (new Quantity (SI.milli (SI.VOLT), 2.0), v.get ());

        UnitValue d = new UnitValue ("1.5km");
        assertEquals (new Quantity (SI.METER, 1500.0), d.get ());

        UnitValue s = new UnitValue ("3 m/s");
        assertEquals (SI.METER.divide (SI.SECOND).getDimension (), s.unit.getDimension ());

        UnitValue n = new UnitValue ("42");
        assertNull (n.unit);
        Type plain = n.get ();
        assertEquals (new Scalar (42), plain);
    }

    @Test
    public void testParseFailure ()
    {
        try
        {
            new UnitValue ("2 furlongs");
            fail ("parsed unknown unit");
        }
        catch (UnsupportedOperandException e)
        {
            assertTrue (e.getCause () != null);
        }

        try
        {
            new UnitValue ("volts");
            fail ("parsed missing number");
        }
        catch (UnsupportedOperandException e)
        {
            // expected
        }
    }
}
