/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.language.type;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import gov.sandia.uq.language.DivisionByZeroException;
import gov.sandia.uq.language.Type;
import gov.sandia.uq.linear.MatrixDense;

public class RationalNumberTest
{
    @Test
    public void testNormalization ()
    {
        RationalNumber a = new RationalNumber (4, 8);
        assertEquals (new RationalNumber (1, 2), a);
        assertEquals (1, a.numerator);
        assertEquals (2, a.denominator);

        RationalNumber b = new RationalNumber (3, -6);
        assertEquals (-1, b.numerator);
        assertEquals ( 2, b.denominator);

        RationalNumber z = new RationalNumber (0, -5);
        assertEquals (0, z.numerator);
        assertEquals (1, z.denominator);
        assertTrue (z.isZero ());
    }

    @Test
    public void testZeroDenominator ()
    {
        try
        {
            new RationalNumber (3, 0);
            fail ("zero denominator accepted");
        }
        catch (DivisionByZeroException e)
        {
            assertEquals (3L, e.getOperands ()[0]);
        }

        try
        {
            new RationalNumber (1, 2).divide ((Type) RationalNumber.ZERO);
            fail ("division by zero accepted");
        }
        catch (DivisionByZeroException e)
        {
            // expected
        }
    }

    @Test
    public void testArithmetic ()
    {
        RationalNumber half  = new RationalNumber (1, 2);
        RationalNumber third = new RationalNumber (1, 3);
        assertEquals (new RationalNumber (5, 6),  half.add (third));
        assertEquals (new RationalNumber (1, 6),  half.subtract (third));
        assertEquals (new RationalNumber (1, 6),  half.multiply (third));
        assertEquals (new RationalNumber (3, 2),  half.divide (third));
        assertEquals (new RationalNumber (1, 8),  half.pow (3));
        assertEquals (new RationalNumber (8),     half.pow (-3));
        assertEquals (new RationalNumber (-1, 2), half.negate ());
        assertTrue (half.compareTo (third) > 0);
        assertEquals ("1/2", half.toString ());
    }

    @Test
    public void testIntegerDivisionIsExact ()
    {
        Type q = new Integral (1).divide (new Integral (3));
        assertEquals (Type.Kind.RATIONAL, q.kind ());
        assertEquals (new RationalNumber (1, 3), q);
        assertEquals (new Integral (2), new Integral (6).divide (new Integral (3)));

        try
        {
            new Integral (1).divide (new Integral (0));
            fail ("integer division by zero accepted");
        }
        catch (DivisionByZeroException e)
        {
            // expected
        }

        // Floating-point division follows IEEE.
        assertEquals (Double.POSITIVE_INFINITY, new Scalar (1).divide (new Scalar (0)).getDouble (), 0);
    }

    @Test
    public void testEqualityAcrossKinds ()
    {
        RationalNumber half = new RationalNumber (1, 2);
        Scalar         s    = new Scalar (0.5);
        assertEquals (half, s);
        assertEquals (s, half);
        assertEquals (half.hashCode (), s.hashCode ());
        assertEquals (new Integral (2), new RationalNumber (4, 2));
        assertEquals (new Integral (2).hashCode (), new RationalNumber (4, 2).hashCode ());
        assertFalse (half.equals (new Scalar (0.25)));
        assertEquals (new Complex (0.5, 0), half);
    }

    @Test
    public void testOverflow ()
    {
        Type p = new Integral (10).power (new Integral (20));
        assertEquals (Type.Kind.FLOAT, p.kind ());
        assertEquals (1e20, p.getDouble (), 1e5);

        p = new Integral (10).power (new Integral (-20));
        assertEquals (Type.Kind.FLOAT, p.kind ());
        assertEquals (1e-20, p.getDouble (), 1e-35);

        p = new Integral (Long.MAX_VALUE).add (new Integral (1));
        assertEquals (Type.Kind.FLOAT, p.kind ());
        assertEquals (9.223372036854775808e18, p.getDouble (), 1e4);

        assertEquals (Type.Kind.FLOAT, new Integral (Long.MIN_VALUE).negate ().kind ());

        Type a = new RationalNumber (1, 3000000000L);
        Type b = new RationalNumber (1, 7000000000L);
        p = a.multiply (b);
        assertEquals (Type.Kind.FLOAT, p.kind ());
        assertEquals (1 / 2.1e19, p.getDouble (), 1e-33);

        // The typed methods used by the unit algebra still report overflow.
        try
        {
            new RationalNumber (1, 3000000000L).multiply (new RationalNumber (1, 7000000000L));
            fail ("overflow not reported");
        }
        catch (ArithmeticException e)
        {
            // expected
        }

        // Results that fit stay exact.
        p = new Integral (2).power (new Integral (10));
        assertEquals (Type.Kind.INTEGER, p.kind ());
        assertEquals (new Integral (1024), p);
        assertEquals (Type.Kind.RATIONAL, new Integral (2).power (new Integral (-3)).kind ());
    }

    @Test
    public void testHashAcrossKinds ()
    {
        Type[][] equal =
        {
            {new Integral (0),  new Scalar (-0.0)},
            {new Scalar (0.0),  new Scalar (-0.0)},
            {new Integral (0),  new Complex (-0.0, 0)},
            {new Integral (2),  new MatrixDense (new double[] {2})},
            {new Integral (2),  new MatrixDense (2, 3, 2.0)},
            {new Scalar (-0.0), new MatrixDense (2, 2)},
        };
        for (Type[] pair : equal)
        {
            assertEquals (pair[0], pair[1]);
            assertEquals (pair[1], pair[0]);
            assertEquals (pair[0] + " and " + pair[1], pair[0].hashCode (), pair[1].hashCode ());
        }

        MatrixDense a = new MatrixDense (new double[][] {{1, -0.0}, {2, 3}});
        MatrixDense b = new MatrixDense (new double[][] {{1,  0.0}, {2, 3}});
        assertEquals (a, b);
        assertEquals (a.hashCode (), b.hashCode ());
    }
}
