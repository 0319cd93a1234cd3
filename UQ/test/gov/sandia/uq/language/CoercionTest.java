/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.language;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import org.junit.Test;

import gov.sandia.uq.cucomponents.CUncertainInput;
import gov.sandia.uq.language.Type.Kind;
import gov.sandia.uq.language.type.Complex;
import gov.sandia.uq.language.type.Integral;
import gov.sandia.uq.language.type.RationalNumber;
import gov.sandia.uq.language.type.Scalar;
import gov.sandia.uq.linear.MatrixDense;
import gov.sandia.uq.quantities.Quantity;
import gov.sandia.uq.ucomponents.UncertainInput;
import gov.sandia.uq.units.SI;

public class CoercionTest
{
    /**
        Expected promotion for every pair of kinds, in the order Kind declares them:
        I=INTEGER R=RATIONAL F=FLOAT C=COMPLEX A=ARRAY Q=QUANTITY U=UNCERTAIN X=CUNCERTAIN N=UNIT, and - for undefined.
    **/
    public static final String[] table =
    {
        //          I R F C A Q U X N
        /* I */    "I R F C A Q U X -",
        /* R */    "R R F C - Q U X -",
        /* F */    "F F F C A Q U X -",
        /* C */    "C C C C - Q - X -",
        /* A */    "A - A - A Q - - -",
        /* Q */    "Q Q Q Q Q Q Q Q -",
        /* U */    "U U U - - Q U - -",
        /* X */    "X X X X - Q - X -",
        /* N */    "- - - - - - - - N"
    };

    public static Kind expected (Kind a, Kind b)
    {
        char c = table[a.ordinal ()].charAt (2 * b.ordinal ());
        if (c == '-') return null;
        for (Kind k : Kind.values ())
        {
            char name = k == Kind.CUNCERTAIN ? 'X' : k == Kind.UNIT ? 'N' : k.name ().charAt (0);
            if (name == c) return k;
        }
        throw new IllegalStateException ();
    }

    public static Type sample (Kind k)
    {
        switch (k)
        {
            case INTEGER:    return new Integral (2);
            case RATIONAL:   return new RationalNumber (1, 2);
            case FLOAT:      return new Scalar (1.5);
            case COMPLEX:    return new Complex (1, 1);
            case ARRAY:      return new MatrixDense (new double[] {1, 2});
            case QUANTITY:   return new Quantity (SI.METER, 2);
            case UNCERTAIN:  return new UncertainInput (1, 0.1);
            case CUNCERTAIN: return new CUncertainInput (new Complex (1, 1), 0.1, 0.1);
            default:         return SI.METER;
        }
    }

    @Test
    public void testPromotionTable ()
    {
        for (Kind a : Kind.values ())
        {
            for (Kind b : Kind.values ())
            {
                String pair = a + "," + b;
                assertEquals (pair, expected (a, b), Coercion.promote (a, b));
                assertEquals (pair, Coercion.promote (a, b), Coercion.promote (b, a));
            }
        }
    }

    @Test
    public void testOperationsFollowTable ()
    {
        for (Kind a : Kind.values ())
        {
            for (Kind b : Kind.values ())
            {
                Type x = sample (a);
                Type y = sample (b);
                String pair = a + "," + b;
                Kind k = expected (a, b);
                if (k == null)
                {
                    try
                    {
                        x.multiply (y);
                        fail (pair + " should be undefined");
                    }
                    catch (UnsupportedOperandException e)
                    {
                        assertEquals (2, e.getOperands ().length);
                    }
                }
                else
                {
                    assertEquals (pair, k, x.multiply (y).kind ());
                }
            }
        }
    }

    @Test
    public void testConversions ()
    {
        Type r = Coercion.convert (new Integral (3), Kind.RATIONAL, null, false);
        assertEquals (new RationalNumber (3), r);

        Type c = Coercion.convert (new RationalNumber (1, 4), Kind.COMPLEX, null, false);
        assertEquals (Kind.COMPLEX, c.kind ());
        assertEquals (0.25, ((Complex) c).real, 0);

        MatrixDense A = new MatrixDense (2, 3);
        Type broadcast = Coercion.convert (new Scalar (7), Kind.ARRAY, A, false);
        MatrixDense B = (MatrixDense) broadcast;
        assertEquals (2, B.rows ());
        assertEquals (3, B.columns ());
        assertEquals (7, B.get (1, 2), 0);
        assertEquals (0, A.get (1, 2), 0);  // reference is not modified
    }

    @Test
    public void testQuantityWrapping ()
    {
        Quantity km = new Quantity (SI.kilo (SI.METER), 2);

        // Additive: a plain number is read in the unit of the quantity.
        Quantity sum = (Quantity) km.add (new Integral (1));
        assertEquals (SI.kilo (SI.METER), sum.getDefaultUnit ());
        assertEquals (new Integral (3), sum.getValue ());

        // Multiplicative: a plain number is dimensionless.
        Quantity product = (Quantity) km.multiply (new Integral (5));
        assertEquals (SI.kilo (SI.METER), product.getDefaultUnit ());
        assertEquals (new Integral (10), product.getValue ());
    }

    @Test
    public void testUnitWithNumberIsUndefined ()
    {
        assertNull (Coercion.promote (Kind.UNIT, Kind.FLOAT));
        try
        {
            SI.METER.add (new Scalar (1));
            fail ();
        }
        catch (UnsupportedOperandException e)
        {
            // expected
        }
    }
}
