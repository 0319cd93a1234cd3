/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.language.type;

import gov.sandia.uq.language.Coercion;
import gov.sandia.uq.language.EvaluationException;
import gov.sandia.uq.language.Type;

/**
    Floating-point type.
**/
public class Scalar extends Type
{
    public final double value;

    public static final double epsilon = Math.ulp (1.0);

    public Scalar (double value)
    {
        this.value = value;
    }

    public Kind kind ()
    {
        return Kind.FLOAT;
    }

    public double getDouble ()
    {
        return value;
    }

    public boolean isZero ()
    {
        return value == 0;
    }

    protected Type addSame (Type that)
    {
        return new Scalar (value + ((Scalar) that).value);
    }

    protected Type subtractSame (Type that)
    {
        return new Scalar (value - ((Scalar) that).value);
    }

    protected Type multiplySame (Type that)
    {
        return new Scalar (value * ((Scalar) that).value);
    }

    /**
        Follows IEEE semantics, so division by zero produces an infinity or NaN rather than an exception.
    **/
    protected Type divideSame (Type that)
    {
        return new Scalar (value / ((Scalar) that).value);
    }

    protected Type powerSame (Type that)
    {
        return new Scalar (Math.pow (value, ((Scalar) that).value));
    }

    protected boolean equalsSame (Type that)
    {
        return value == ((Scalar) that).value;
    }

    public Type atan2 (Type x) throws EvaluationException
    {
        Scalar b = (Scalar) Coercion.convert (x, Kind.FLOAT, this, false);
        return new Scalar (Math.atan2 (value, b.value));
    }

    public Type hypot (Type that) throws EvaluationException
    {
        Scalar b = (Scalar) Coercion.convert (that, Kind.FLOAT, this, false);
        return new Scalar (Math.hypot (value, b.value));
    }

    public Type negate ()
    {
        return new Scalar (-value);
    }

    public Type abs ()
    {
        return new Scalar (Math.abs (value));
    }

    public Type conjugate ()
    {
        return this;
    }

    public Type sqrt ()
    {
        return new Scalar (Math.sqrt (value));
    }

    public Type exp ()
    {
        return new Scalar (Math.exp (value));
    }

    public Type log ()
    {
        return new Scalar (Math.log (value));
    }

    public Type log10 ()
    {
        return new Scalar (Math.log10 (value));
    }

    public Type sin ()
    {
        return new Scalar (Math.sin (value));
    }

    public Type cos ()
    {
        return new Scalar (Math.cos (value));
    }

    public Type tan ()
    {
        return new Scalar (Math.tan (value));
    }

    public Type asin ()
    {
        return new Scalar (Math.asin (value));
    }

    public Type acos ()
    {
        return new Scalar (Math.acos (value));
    }

    public Type atan ()
    {
        return new Scalar (Math.atan (value));
    }

    public Type sinh ()
    {
        return new Scalar (Math.sinh (value));
    }

    public Type cosh ()
    {
        return new Scalar (Math.cosh (value));
    }

    public Type tanh ()
    {
        return new Scalar (Math.tanh (value));
    }

    public static String print (double d)
    {
        // Round to integer?
        long l = Math.round (d);
        if (l != 0  &&  Math.abs (d - l) < epsilon) return String.valueOf (l);

        // Check rounding to each of the first 3 places after the decimal.
        // This prevents ridiculous and ugly output such as "0.19999999999999998"
        double sd = Math.abs (d);
        if (sd < 1)
        {
            String sign = "";
            if (d < 0) sign = "-";
            int power = 1;
            for (int i = 1; i <= 3; i++)
            {
                power *= 10;  // now power==10^i
                double t = sd * power;
                l = Math.round (t);
                if (l != 0  &&  Math.abs (t - l) < epsilon)
                {
                    String value = String.valueOf (l);
                    String pad = "";
                    for (int j = value.length (); j < i; j++) pad += "0";
                    return sign + "0." + pad + value;
                }
            }
        }

        String result = String.valueOf (d).toLowerCase ();  // get rid of upper-case E
        // Don't add ugly and useless ".0"
        result = result.replace (".0e", "e");
        if (result.endsWith (".0")) result = result.substring (0, result.length () - 2);
        return result;
    }

    /**
        Consistent with equality across kinds: -0.0 hashes as 0.0, as does the integer 0.
    **/
    public int hashCode ()
    {
        return Double.hashCode (value + 0.0);
    }

    public String toString ()
    {
        return print (value);
    }
}
