/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.language;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

import gov.sandia.uq.language.type.Complex;
import gov.sandia.uq.language.type.Integral;
import gov.sandia.uq.language.type.Matrix;
import gov.sandia.uq.language.type.RationalNumber;
import gov.sandia.uq.language.type.Scalar;
import gov.sandia.uq.linear.MatrixDense;
import gov.sandia.uq.quantities.Quantity;
import gov.sandia.uq.units.SI;

public class FunctionTest
{
    @Test
    public void testValueOf ()
    {
        assertEquals (Type.Kind.INTEGER, Type.valueOf (3).kind ());
        assertEquals (Type.Kind.INTEGER, Type.valueOf (3L).kind ());
        assertEquals (Type.Kind.FLOAT,   Type.valueOf (3.0).kind ());
        assertEquals (Type.Kind.ARRAY,   Type.valueOf (new double[] {1, 2}).kind ());
        try
        {
            Type.valueOf ("3");
            fail ("converted a string");
        }
        catch (UnsupportedOperandException e)
        {
            // expected
        }
    }

    @Test
    public void testElementary ()
    {
        assertEquals (new Scalar (2),  Function.sqrt (4));
        assertEquals (new Integral (8), Function.pow (2, 3));
        assertEquals (new RationalNumber (1, 8), Function.pow (2, -3));
        assertEquals (new Scalar (5),  Function.hypot (3.0, 4.0));
        assertEquals (Math.E, Function.exp (1).getDouble (), 1e-15);
        assertEquals (2, Function.log10 (100.0).getDouble (), 1e-15);
        assertEquals (new Scalar (3), Function.abs (-3.0));
        assertEquals (new Complex (1, -2), Function.conjugate (new Complex (1, 2)));
        assertEquals (new Complex (0, 1), Function.sqrt (new Complex (-1, 0)));

        Quantity q = (Quantity) Function.sqrt (new Quantity (SI.METER.pow (2), 16));
        assertEquals (SI.METER, q.getDefaultUnit ());
        assertEquals (new Scalar (4), q.getValue ());
    }

    @Test
    public void testElementWise ()
    {
        Matrix A = new MatrixDense (new double[] {0, 1, 4});
        Matrix R = (Matrix) Function.sqrt (A);
        assertEquals (2, R.get (2), 0);

        Matrix S = (Matrix) A.add (new Integral (1));
        assertEquals (5, S.get (2), 0);
    }

    /**
        The first argument alone decides the kind of atan2 and hypot.
    **/
    @Test
    public void testFirstArgumentDecides ()
    {
        Matrix A = new MatrixDense (new double[] {1, -1});
        Matrix R = (Matrix) Function.atan2 (A, 1.0);
        assertEquals ( Math.PI / 4, R.get (0), 1e-15);
        assertEquals (-Math.PI / 4, R.get (1), 1e-15);

        try
        {
            Function.atan2 (1.0, A);
            fail ("scalar atan2 accepted an array argument");
        }
        catch (UnsupportedOperandException e)
        {
            // expected
        }

        Matrix H = (Matrix) Function.hypot (A, 0);
        assertEquals (1, H.get (1), 0);
    }
}
