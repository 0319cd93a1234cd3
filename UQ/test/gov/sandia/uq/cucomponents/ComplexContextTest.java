/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.cucomponents;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

import gov.sandia.uq.language.DivisionByZeroException;
import gov.sandia.uq.language.NegativeUncertaintyException;
import gov.sandia.uq.language.Type;
import gov.sandia.uq.language.type.Complex;
import gov.sandia.uq.linear.MatrixDense;
import gov.sandia.uq.quantities.Quantity;
import gov.sandia.uq.ucomponents.Context;
import gov.sandia.uq.units.SI;

public class ComplexContextTest
{
    public static final double tolerance = 1e-12;

    public static void assertMatrix (double[][] expected, MatrixDense actual)
    {
        for (int r = 0; r < 2; r++)
        {
            for (int c = 0; c < 2; c++)
            {
                assertEquals ("(" + r + "," + c + ")", expected[r][c], actual.get (r, c), tolerance);
            }
        }
    }

    @Test
    public void testAdd ()
    {
        CUncertainInput z1 = new CUncertainInput (new Complex (1, 2), 0.1, 0.2);
        CUncertainInput z2 = new CUncertainInput (new Complex (3, 4), 0.3, 0.4);
        CUncertainComponent z = (CUncertainComponent) z1.add (z2);
        assertEquals (new Complex (4, 6), z.getValue ());

        Context context = new Context ();
        Covariance c = context.uncertainty (z);
        assertEquals (0.1, c.getVarianceReal (),      tolerance);
        assertEquals (0.2, c.getVarianceImaginary (), tolerance);
        assertEquals (0,   c.getCovariance (),        tolerance);
        assertMatrix (new double[][] {{1, 0}, {0, 1}}, context.jacobian (z, z1));
    }

    @Test
    public void testSharedInputCancels ()
    {
        CUncertainInput z = new CUncertainInput (new Complex (1, 2), 0.1, 0.2, 0.5);
        Covariance c = new Context ().uncertainty ((CUncertainComponent) z.subtract (z));
        assertMatrix (new double[][] {{0, 0}, {0, 0}}, c.getMatrix ());
    }

    @Test
    public void testConjugate ()
    {
        CUncertainInput z = new CUncertainInput (new Complex (1, 2), 0.1, 0.2, 0.5);
        CUncertainComponent w = (CUncertainComponent) z.conjugate ();
        assertEquals (new Complex (1, -2), w.getValue ());

        Context context = new Context ();
        assertMatrix (new double[][] {{1, 0}, {0, -1}}, context.jacobian (w, z));
        Covariance c = context.uncertainty (w);
        assertEquals (0.01,  c.getVarianceReal (),      tolerance);
        assertEquals (0.04,  c.getVarianceImaginary (), tolerance);
        assertEquals (-0.01, c.getCovariance (),        tolerance);
        assertEquals (-0.5,  c.getCorrelation (),       tolerance);
    }

    @Test
    public void testMultiply ()
    {
        // Multiplying by i swaps the components.
        CUncertainInput z = new CUncertainInput (new Complex (1, 2), 0.1, 0.2);
        Covariance c = new Context ().uncertainty ((CUncertainComponent) z.multiply (Complex.I));
        assertEquals (0.04, c.getVarianceReal (),      tolerance);
        assertEquals (0.01, c.getVarianceImaginary (), tolerance);

        CUncertainInput a = new CUncertainInput (new Complex (2, 0), 0.1, 0.1);
        CUncertainInput b = new CUncertainInput (new Complex (3, 0), 0.2, 0.2);
        CUncertainComponent p = (CUncertainComponent) a.multiply (b);
        Context context = new Context ();
        assertMatrix (new double[][] {{3, 0}, {0, 3}}, context.jacobian (p, a));
        assertMatrix (new double[][] {{2, 0}, {0, 2}}, context.jacobian (p, b));
        c = context.uncertainty (p);
        assertEquals (0.25, c.getVarianceReal (),      tolerance);
        assertEquals (0.25, c.getVarianceImaginary (), tolerance);
        assertEquals (0,    c.getCovariance (),        tolerance);

        // A general value: the Jacobian of a*b with respect to a is multiplication by b.
        CUncertainInput u = new CUncertainInput (new Complex (1, 1), 0.1, 0.1);
        CUncertainInput v = new CUncertainInput (new Complex (2, -3), 0.1, 0.1);
        assertMatrix (new double[][] {{2, 3}, {-3, 2}}, new Context ().jacobian ((CUncertainComponent) u.multiply (v), u));
    }

    @Test
    public void testDivide ()
    {
        CUncertainInput a = new CUncertainInput (new Complex (1, 1), 0.1, 0.1);
        CUncertainInput b = new CUncertainInput (new Complex (0, 2), 0.1, 0.1);
        CUncertainComponent q = (CUncertainComponent) a.divide (b);
        // d(a/b)/da = 1/b = -i/2
        assertMatrix (new double[][] {{0, 0.5}, {-0.5, 0}}, new Context ().jacobian (q, a));
        // d(a/b)/db = -a/b^2 = (1+i)/4
        assertMatrix (new double[][] {{0.25, -0.25}, {0.25, 0.25}}, new Context ().jacobian (q, b));
    }

    @Test
    public void testMagnitude ()
    {
        CUncertainInput z = new CUncertainInput (new Complex (3, 4), 0.1, 0.1);
        CUncertainComponent r = (CUncertainComponent) z.abs ();
        assertEquals (new Complex (5, 0), r.getValue ());
        Covariance c = new Context ().uncertainty (r);
        assertEquals (0.01, c.getVarianceReal (),      tolerance);
        assertEquals (0,    c.getVarianceImaginary (), tolerance);

        CUncertainComponent phase = z.arg ();
        assertMatrix (new double[][] {{-4.0 / 25, 3.0 / 25}, {0, 0}}, new Context ().jacobian (phase, z));
        assertMatrix (new double[][] {{1, 0}, {0, 0}}, new Context ().jacobian (z.real (), z));
        assertMatrix (new double[][] {{0, 1}, {0, 0}}, new Context ().jacobian (z.imag (), z));
    }

    @Test
    public void testHolomorphicFunctions ()
    {
        Complex z0 = new Complex (0.3, 0.4);
        CUncertainInput z = new CUncertainInput (z0, 0.1, 0.1);
        Type[] results = {z.exp (), z.log (), z.sqrt (), z.sin (), z.cos (), z.power (new Complex (2, 0))};
        Complex[] derivatives =
        {
            z0.expComplex (),
            z0.reciprocal (),
            new Complex (0.5, 0).divide (z0.sqrtComplex ()),
            z0.cosComplex (),
            z0.sinComplex ().negate (),
            z0.multiply (2.0)
        };
        for (int i = 0; i < results.length; i++)
        {
            Complex d = derivatives[i];
            MatrixDense J = new Context ().jacobian ((CUncertainComponent) results[i], z);
            assertMatrix (new double[][] {{d.real, -d.imag}, {d.imag, d.real}}, J);
        }
    }

    @Test
    public void testInvalidCovariance ()
    {
        Complex z = new Complex (1, 1);
        double[][][] bad =
        {
            {{1, 2}, {2, 1}},    // indefinite
            {{-1, 0}, {0, 1}},   // negative variance
            {{1, 0.5}, {0, 1}},  // not symmetric
            {{1, Double.NaN}, {Double.NaN, 1}},
            {{1, Double.NaN}, {0, 1}},
            {{Double.NaN, 0}, {0, 1}},
        };
        for (double[][] b : bad)
        {
            try
            {
                new CUncertainInput (z, new MatrixDense (b));
                fail ("accepted invalid covariance");
            }
            catch (NegativeUncertaintyException e)
            {
                // expected
            }
        }

        try
        {
            new CUncertainInput (z, 0.1, 0.1, 1.5);
            fail ("accepted correlation outside [-1,1]");
        }
        catch (NegativeUncertaintyException e)
        {
            // expected
        }

        try
        {
            new CUncertainInput (z, -0.1, 0.1);
            fail ("accepted negative uncertainty");
        }
        catch (NegativeUncertaintyException e)
        {
            // expected
        }

        // Perfect correlation is singular but still valid.
        new CUncertainInput (z, new MatrixDense (new double[][] {{1, 1}, {1, 1}}));
    }

    @Test
    public void testQuantity ()
    {
        CUncertainInput z = new CUncertainInput (new Complex (1, 2), 0.3, 0.4);
        Quantity q = new Quantity (SI.VOLT, z);
        Quantity u = new Context ().uncertainty ((Quantity) q.multiply (new Quantity (SI.AMPERE, 2)));
        assertEquals (SI.VOLT.multiply (SI.AMPERE), u.getDefaultUnit ());
        Complex c = (Complex) u.getValue ();
        assertEquals (0.6, c.real, tolerance);
        assertEquals (0.8, c.imag, tolerance);
    }

    @Test
    public void testSingularDerivative ()
    {
        CUncertainInput zero = new CUncertainInput (Complex.ZERO, 0.1, 0.1);
        CUncertainComponent[] nodes = {(CUncertainComponent) zero.sqrt (), (CUncertainComponent) zero.log ()};
        assertEquals (Complex.ZERO, nodes[0].getValue ());
        for (CUncertainComponent n : nodes)
        {
            try
            {
                new Context ().uncertainty (n);
                fail ("derivative at zero accepted for " + n.toString ());
            }
            catch (DivisionByZeroException e)
            {
                // expected
            }
        }

        // Away from zero the same operators evaluate normally.
        CUncertainInput one = new CUncertainInput (Complex.ONE, 0.1, 0.1);
        Covariance c = new Context ().uncertainty ((CUncertainComponent) one.sqrt ());
        assertEquals (0.05, c.getUncertaintyReal (),      1e-12);
        assertEquals (0.05, c.getUncertaintyImaginary (), 1e-12);
    }
}
