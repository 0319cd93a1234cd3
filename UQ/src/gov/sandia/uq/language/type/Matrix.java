/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.language.type;

import gov.sandia.uq.language.Coercion;
import gov.sandia.uq.language.EvaluationException;
import gov.sandia.uq.language.Type;
import gov.sandia.uq.linear.MatrixDense;

/**
    Real-valued numeric array. All arithmetic through the Type interface is element-wise,
    with plain numbers broadcast to every element. Linear-algebra products are available
    through MatrixDense.product().
**/
public abstract class Matrix extends Type
{
    public interface Visitor
    {
        double apply (double a);
    }

    public interface Combiner
    {
        double apply (double a, double b);
    }

    public abstract int rows ();

    public abstract int columns ();

    public abstract double get (int row, int column);

    public double get (int row)
    {
        return get (row, 0);
    }

    public abstract void set (int row, int column, double a);

    public void set (int row, double a)
    {
        set (row, 0, a);
    }

    /**
        @return New matrix with the same shape as this one, with every element set to initialValue.
    **/
    public abstract Matrix clear (double initialValue);

    /**
        @return New matrix holding the function of each element.
    **/
    public abstract Matrix visit (Visitor visitor);

    /**
        @return New matrix holding the function of each pair of corresponding elements.
        The two matrices must have the same shape.
    **/
    public Matrix combine (Matrix that, Combiner combiner) throws EvaluationException
    {
        int h = rows ();
        int w = columns ();
        if (that.rows () != h  ||  that.columns () != w)
        {
            throw new EvaluationException ("Shape mismatch: " + h + "x" + w + " and " + that.rows () + "x" + that.columns (), this, that);
        }
        MatrixDense result = new MatrixDense (h, w);
        for (int c = 0; c < w; c++)
        {
            for (int r = 0; r < h; r++)
            {
                result.set (r, c, combiner.apply (get (r, c), that.get (r, c)));
            }
        }
        return result;
    }

    public Kind kind ()
    {
        return Kind.ARRAY;
    }

    public boolean isZero ()
    {
        int h = rows ();
        int w = columns ();
        for (int c = 0; c < w; c++)
        {
            for (int r = 0; r < h; r++)
            {
                if (get (r, c) != 0) return false;
            }
        }
        return true;
    }

    /**
        Only defined for a 1x1 matrix.
    **/
    public double getDouble ()
    {
        if (rows () == 1  &&  columns () == 1) return get (0, 0);
        return super.getDouble ();
    }

    protected Type addSame (Type that)
    {
        return combine ((Matrix) that, (a, b) -> a + b);
    }

    protected Type subtractSame (Type that)
    {
        return combine ((Matrix) that, (a, b) -> a - b);
    }

    protected Type multiplySame (Type that)
    {
        return combine ((Matrix) that, (a, b) -> a * b);
    }

    protected Type divideSame (Type that)
    {
        return combine ((Matrix) that, (a, b) -> a / b);
    }

    protected Type powerSame (Type that)
    {
        return combine ((Matrix) that, Math::pow);
    }

    protected boolean equalsSame (Type that)
    {
        Matrix B = (Matrix) that;
        int h = rows ();
        int w = columns ();
        if (B.rows () != h  ||  B.columns () != w) return false;
        for (int c = 0; c < w; c++)
        {
            for (int r = 0; r < h; r++)
            {
                if (get (r, c) != B.get (r, c)) return false;
            }
        }
        return true;
    }

    public Type atan2 (Type x) throws EvaluationException
    {
        Matrix B = (Matrix) Coercion.convert (x, Kind.ARRAY, this, false);
        return combine (B, Math::atan2);
    }

    public Type hypot (Type that) throws EvaluationException
    {
        Matrix B = (Matrix) Coercion.convert (that, Kind.ARRAY, this, false);
        return combine (B, Math::hypot);
    }

    public Type negate ()
    {
        return visit (a -> -a);
    }

    public Type abs ()
    {
        return visit (Math::abs);
    }

    public Type conjugate ()
    {
        return this;
    }

    public Type sqrt ()
    {
        return visit (Math::sqrt);
    }

    public Type exp ()
    {
        return visit (Math::exp);
    }

    public Type log ()
    {
        return visit (Math::log);
    }

    public Type log10 ()
    {
        return visit (Math::log10);
    }

    public Type sin ()
    {
        return visit (Math::sin);
    }

    public Type cos ()
    {
        return visit (Math::cos);
    }

    public Type tan ()
    {
        return visit (Math::tan);
    }

    public Type asin ()
    {
        return visit (Math::asin);
    }

    public Type acos ()
    {
        return visit (Math::acos);
    }

    public Type atan ()
    {
        return visit (Math::atan);
    }

    public Type sinh ()
    {
        return visit (Math::sinh);
    }

    public Type cosh ()
    {
        return visit (Math::cosh);
    }

    public Type tanh ()
    {
        return visit (Math::tanh);
    }

    /**
        A number equals any matrix filled with that number, so a uniform matrix hashes as the number.
    **/
    public int hashCode ()
    {
        int h = rows ();
        int w = columns ();
        if (h > 0  &&  w > 0)
        {
            double first = get (0, 0);
            boolean uniform = true;
            for (int c = 0; c < w  &&  uniform; c++)
            {
                for (int r = 0; r < h; r++)
                {
                    if (get (r, c) != first)
                    {
                        uniform = false;
                        break;
                    }
                }
            }
            if (uniform) return Double.hashCode (first + 0.0);
        }

        int result = 31 * h + w;
        for (int c = 0; c < w; c++)
        {
            for (int r = 0; r < h; r++)
            {
                result = 31 * result + Double.hashCode (get (r, c) + 0.0);
            }
        }
        return result;
    }

    public String toString ()
    {
        StringBuilder result = new StringBuilder ();
        int h = rows ();
        int w = columns ();
        result.append ("[");
        for (int r = 0; r < h; r++)
        {
            if (r > 0) result.append (";");
            for (int c = 0; c < w; c++)
            {
                if (c > 0) result.append (",");
                result.append (Scalar.print (get (r, c)));
            }
        }
        result.append ("]");
        return result.toString ();
    }
}
