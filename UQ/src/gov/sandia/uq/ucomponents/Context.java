/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.ucomponents;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.apache.log4j.Logger;

import gov.sandia.uq.cucomponents.CConstant;
import gov.sandia.uq.cucomponents.COperation;
import gov.sandia.uq.cucomponents.CUncertainComponent;
import gov.sandia.uq.cucomponents.CUncertainInput;
import gov.sandia.uq.cucomponents.Covariance;
import gov.sandia.uq.language.CyclicGraphException;
import gov.sandia.uq.language.EvaluationException;
import gov.sandia.uq.language.Type;
import gov.sandia.uq.language.UnsupportedOperandException;
import gov.sandia.uq.language.type.Complex;
import gov.sandia.uq.language.type.Scalar;
import gov.sandia.uq.linear.MatrixDense;
import gov.sandia.uq.quantities.Quantity;

/**
    Evaluation session that derives the uncertainty of nodes in a computation graph.

    <p>The standard uncertainty of a node y is computed from first-order propagation:
    u(y)^2 = sum over inputs x of (dy/dx * u(x))^2. The sensitivity dy/dx composes through
    the graph by the chain rule, dy/dx = sum over operands o of (df/do * do/dx), so an input
    reached along several paths has its contributions summed before squaring. That is what
    makes x-x exactly certain when both operands are the same input.

    <p>Sensitivities are accumulated backward from y, in reverse topological order, which
    visits each node once no matter how many paths lead to it. The traversal uses an explicit
    stack, so deep graphs do not exhaust the call stack.

    <p>Results are cached by node identity for the life of the Context. A Context is meant for
    one evaluation pass by one thread. Nodes themselves are immutable, so any number of
    Contexts may evaluate the same graph concurrently.
**/
public class Context
{
    /**
        Relative tolerance for checking that a covariance matrix is symmetric and positive semi-definite.
    **/
    public static final double tolerance = 1e-12;

    private static Logger logger = Logger.getLogger (Context.class);

    protected Map<UncertainComponent,Map<UncertainInput,Double>>        sensitivities = new IdentityHashMap<UncertainComponent,Map<UncertainInput,Double>> ();
    protected Map<UncertainComponent,Double>                            uncertainties = new IdentityHashMap<UncertainComponent,Double> ();
    protected Map<CUncertainComponent,Map<CUncertainInput,MatrixDense>> jacobians     = new IdentityHashMap<CUncertainComponent,Map<CUncertainInput,MatrixDense>> ();
    protected Map<CUncertainComponent,Covariance>                       covariances   = new IdentityHashMap<CUncertainComponent,Covariance> ();

    // Real graph ------------------------------------------------------------

    /**
        @return The standard uncertainty of the given node.
    **/
    public double uncertainty (UncertainComponent y)
    {
        if (y instanceof UncertainInput) return ((UncertainInput) y).getUncertainty ();
        Double cached = uncertainties.get (y);
        if (cached != null) return cached;

        double variance = 0;
        for (Entry<UncertainInput,Double> e : sensitivities (y).entrySet ())
        {
            double c = e.getValue () * e.getKey ().getUncertainty ();
            variance += c * c;
        }
        double result = Math.sqrt (variance);
        uncertainties.put (y, result);
        return result;
    }

    /**
        @return The partial derivative of y with respect to input x, evaluated at nominal values.
        Zero if y does not depend on x.
    **/
    public double sensitivity (UncertainComponent y, UncertainInput x)
    {
        Double result = sensitivities (y).get (x);
        if (result == null) return 0;
        return result;
    }

    /**
        @return Contribution |dy/dx| * u(x) of each input x that y depends on, in graph order.
    **/
    public Map<UncertainInput,Double> budget (UncertainComponent y)
    {
        Map<UncertainInput,Double> result = new LinkedHashMap<UncertainInput,Double> ();
        for (Entry<UncertainInput,Double> e : sensitivities (y).entrySet ())
        {
            result.put (e.getKey (), Math.abs (e.getValue () * e.getKey ().getUncertainty ()));
        }
        return result;
    }

    /**
        @return Covariance between two nodes due to the inputs they share.
    **/
    public double covariance (UncertainComponent a, UncertainComponent b)
    {
        Map<UncertainInput,Double> sa = sensitivities (a);
        Map<UncertainInput,Double> sb = sensitivities (b);
        double result = 0;
        for (Entry<UncertainInput,Double> e : sa.entrySet ())
        {
            Double s = sb.get (e.getKey ());
            if (s == null) continue;
            double u = e.getKey ().getUncertainty ();
            result += e.getValue () * s * u * u;
        }
        return result;
    }

    /**
        @return Correlation coefficient between two nodes, or 0 if either one is certain.
    **/
    public double correlation (UncertainComponent a, UncertainComponent b)
    {
        double d = uncertainty (a) * uncertainty (b);
        if (d == 0) return 0;
        return covariance (a, b) / d;
    }

    /**
        @param k Coverage factor, typically 2 for roughly 95% coverage.
    **/
    public double expandedUncertainty (UncertainComponent y, double k)
    {
        return k * uncertainty (y);
    }

    /**
        Sensitivity of y to every input it depends on.
    **/
    protected Map<UncertainInput,Double> sensitivities (UncertainComponent y)
    {
        Map<UncertainInput,Double> result = sensitivities.get (y);
        if (result != null) return result;

        List<UncertainComponent> order = order (y);
        Map<UncertainComponent,Double> adjoint = new IdentityHashMap<UncertainComponent,Double> ();
        adjoint.put (y, 1.0);
        result = new LinkedHashMap<UncertainInput,Double> ();
        for (int i = order.size () - 1; i >= 0; i--)
        {
            UncertainComponent n = order.get (i);
            Double a = adjoint.remove (n);
            if (a == null) continue;
            if (n instanceof UncertainInput)
            {
                result.put ((UncertainInput) n, a);
            }
            else if (n instanceof Operation)
            {
                Operation op = (Operation) n;
                int count = op.getOperandCount ();
                for (int j = 0; j < count; j++)
                {
                    UncertainComponent o = op.getOperand (j);
                    if (o instanceof Constant) continue;
                    double s = a * op.partial (j);
                    Double previous = adjoint.get (o);
                    if (previous != null) s += previous;
                    adjoint.put (o, s);
                }
            }
        }

        result = Collections.unmodifiableMap (result);
        sensitivities.put (y, result);
        if (logger.isDebugEnabled ()) logger.debug ("node " + y.id + ": " + order.size () + " nodes, " + result.size () + " inputs, cache " + sensitivities.size ());
        return result;
    }

    /**
        Lists the nodes reachable from root, each after all of its operands.
        @throws CyclicGraphException if a node is reached again while its own operands are being listed.
    **/
    protected static List<UncertainComponent> order (UncertainComponent root)
    {
        List<UncertainComponent>          result    = new ArrayList<UncertainComponent> ();
        Map<UncertainComponent,Boolean>   done      = new IdentityHashMap<UncertainComponent,Boolean> ();  // false while on the stack
        Deque<UncertainComponent>         nodes     = new ArrayDeque<UncertainComponent> ();
        Deque<Integer>                    positions = new ArrayDeque<Integer> ();

        nodes.push (root);
        positions.push (0);
        done.put (root, false);
        while (! nodes.isEmpty ())
        {
            UncertainComponent n = nodes.peek ();
            int p = positions.pop ();
            if (p < n.getOperandCount ())
            {
                positions.push (p + 1);
                UncertainComponent o = n.getOperand (p);
                Boolean state = done.get (o);
                if (state == null)
                {
                    done.put (o, false);
                    nodes.push (o);
                    positions.push (0);
                }
                else if (! state)
                {
                    throw new CyclicGraphException (o);
                }
            }
            else
            {
                nodes.pop ();
                done.put (n, true);
                result.add (n);
            }
        }
        return result;
    }

    // Complex graph ---------------------------------------------------------

    /**
        @return The 2x2 covariance of the real and imaginary components of z.
    **/
    public Covariance uncertainty (CUncertainComponent z)
    {
        Covariance cached = covariances.get (z);
        if (cached != null) return cached;

        MatrixDense C = new MatrixDense (2, 2);
        for (Entry<CUncertainInput,MatrixDense> e : jacobians (z).entrySet ())
        {
            MatrixDense J = e.getValue ();
            C = C.plus (J.product (e.getKey ().getCovariance ()).product (J.transpose ()));
        }
        Covariance result = new Covariance (C);
        covariances.put (z, result);
        return result;
    }

    /**
        @return The 2x2 matrix taking a perturbation of input x to the resulting perturbation of z.
        Zero if z does not depend on x.
    **/
    public MatrixDense jacobian (CUncertainComponent z, CUncertainInput x)
    {
        MatrixDense result = jacobians (z).get (x);
        if (result == null) return new MatrixDense (2, 2);
        return new MatrixDense (result);
    }

    /**
        @return Cross-covariance between the components of a (rows) and the components of b (columns).
    **/
    public MatrixDense covariance (CUncertainComponent a, CUncertainComponent b)
    {
        Map<CUncertainInput,MatrixDense> ja = jacobians (a);
        Map<CUncertainInput,MatrixDense> jb = jacobians (b);
        MatrixDense result = new MatrixDense (2, 2);
        for (Entry<CUncertainInput,MatrixDense> e : ja.entrySet ())
        {
            MatrixDense Jb = jb.get (e.getKey ());
            if (Jb == null) continue;
            result = result.plus (e.getValue ().product (e.getKey ().getCovariance ()).product (Jb.transpose ()));
        }
        return result;
    }

    protected Map<CUncertainInput,MatrixDense> jacobians (CUncertainComponent z)
    {
        Map<CUncertainInput,MatrixDense> result = jacobians.get (z);
        if (result != null) return result;

        List<CUncertainComponent> order = order (z);
        Map<CUncertainComponent,MatrixDense> adjoint = new IdentityHashMap<CUncertainComponent,MatrixDense> ();
        adjoint.put (z, MatrixDense.identity (2));
        result = new LinkedHashMap<CUncertainInput,MatrixDense> ();
        for (int i = order.size () - 1; i >= 0; i--)
        {
            CUncertainComponent n = order.get (i);
            MatrixDense A = adjoint.remove (n);
            if (A == null) continue;
            if (n instanceof CUncertainInput)
            {
                result.put ((CUncertainInput) n, A);
            }
            else if (n instanceof COperation)
            {
                COperation op = (COperation) n;
                int count = op.getOperandCount ();
                for (int j = 0; j < count; j++)
                {
                    CUncertainComponent o = op.getOperand (j);
                    if (o instanceof CConstant) continue;
                    MatrixDense S = A.product (op.jacobian (j));
                    MatrixDense previous = adjoint.get (o);
                    if (previous != null) S = S.plus (previous);
                    adjoint.put (o, S);
                }
            }
        }

        result = Collections.unmodifiableMap (result);
        jacobians.put (z, result);
        if (logger.isDebugEnabled ()) logger.debug ("complex node " + z.id + ": " + order.size () + " nodes, " + result.size () + " inputs, cache " + jacobians.size ());
        return result;
    }

    protected static List<CUncertainComponent> order (CUncertainComponent root)
    {
        List<CUncertainComponent>        result    = new ArrayList<CUncertainComponent> ();
        Map<CUncertainComponent,Boolean> done      = new IdentityHashMap<CUncertainComponent,Boolean> ();
        Deque<CUncertainComponent>       nodes     = new ArrayDeque<CUncertainComponent> ();
        Deque<Integer>                   positions = new ArrayDeque<Integer> ();

        nodes.push (root);
        positions.push (0);
        done.put (root, false);
        while (! nodes.isEmpty ())
        {
            CUncertainComponent n = nodes.peek ();
            int p = positions.pop ();
            if (p < n.getOperandCount ())
            {
                positions.push (p + 1);
                CUncertainComponent o = n.getOperand (p);
                Boolean state = done.get (o);
                if (state == null)
                {
                    done.put (o, false);
                    nodes.push (o);
                    positions.push (0);
                }
                else if (! state)
                {
                    throw new CyclicGraphException (o);
                }
            }
            else
            {
                nodes.pop ();
                done.put (n, true);
                result.add (n);
            }
        }
        return result;
    }

    // Any kind --------------------------------------------------------------

    /**
        Standard uncertainty of a quantity, in the unit of the quantity.
        For a complex value, the result holds the standard uncertainties of the real and
        imaginary components as the real and imaginary parts of a complex number.
    **/
    public Quantity uncertainty (Quantity q) throws EvaluationException
    {
        return new Quantity (q.getDefaultUnit (), uncertainty (q.getValue ()));
    }

    /**
        Standard uncertainty of a value of any kind. Exact and plain floating-point values have none.
    **/
    public Type uncertainty (Type value) throws EvaluationException
    {
        switch (value.kind ())
        {
            case INTEGER:
            case RATIONAL:
            case FLOAT:
                return new Scalar (0);
            case COMPLEX:
                return new Complex (0, 0);
            case UNCERTAIN:
                return new Scalar (uncertainty ((UncertainComponent) value));
            case CUNCERTAIN:
                Covariance c = uncertainty ((CUncertainComponent) value);
                return new Complex (c.getUncertaintyReal (), c.getUncertaintyImaginary ());
            case QUANTITY:
                return uncertainty ((Quantity) value);
            default:
                throw new UnsupportedOperandException ("uncertainty", value);
        }
    }

    /**
        @return The nominal value, with the same unit if the value is a quantity.
    **/
    public Type value (Type value) throws EvaluationException
    {
        switch (value.kind ())
        {
            case UNCERTAIN:
                return new Scalar (((UncertainComponent) value).getValue ());
            case CUNCERTAIN:
                return ((CUncertainComponent) value).getValue ();
            case QUANTITY:
                Quantity q = (Quantity) value;
                return new Quantity (q.getDefaultUnit (), value (q.getValue ()));
            default:
                return value;
        }
    }
}
