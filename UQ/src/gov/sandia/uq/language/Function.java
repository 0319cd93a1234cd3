/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.language;

/**
    Free functions over every numeric kind. Arguments may be any Type or a plain Java number,
    which is converted by Type.valueOf().

    <p>The two-argument functions atan2() and hypot() are not symmetric in the coercion tower.
    The kind of the result is determined by the first argument alone, and the second argument is
    converted to that kind if possible. So atan2(array, 1.0) works element-wise, while
    atan2(1.0, array) fails.
**/
public class Function
{
    public static Type sqrt (Object x)
    {
        return Type.valueOf (x).sqrt ();
    }

    public static Type exp (Object x)
    {
        return Type.valueOf (x).exp ();
    }

    public static Type log (Object x)
    {
        return Type.valueOf (x).log ();
    }

    public static Type log10 (Object x)
    {
        return Type.valueOf (x).log10 ();
    }

    public static Type sin (Object x)
    {
        return Type.valueOf (x).sin ();
    }

    public static Type cos (Object x)
    {
        return Type.valueOf (x).cos ();
    }

    public static Type tan (Object x)
    {
        return Type.valueOf (x).tan ();
    }

    public static Type asin (Object x)
    {
        return Type.valueOf (x).asin ();
    }

    public static Type acos (Object x)
    {
        return Type.valueOf (x).acos ();
    }

    public static Type atan (Object x)
    {
        return Type.valueOf (x).atan ();
    }

    public static Type sinh (Object x)
    {
        return Type.valueOf (x).sinh ();
    }

    public static Type cosh (Object x)
    {
        return Type.valueOf (x).cosh ();
    }

    public static Type tanh (Object x)
    {
        return Type.valueOf (x).tanh ();
    }

    public static Type abs (Object x)
    {
        return Type.valueOf (x).abs ();
    }

    public static Type conjugate (Object x)
    {
        return Type.valueOf (x).conjugate ();
    }

    public static Type pow (Object base, Object exponent)
    {
        return Type.valueOf (base).power (Type.valueOf (exponent));
    }

    public static Type atan2 (Object y, Object x)
    {
        return Type.valueOf (y).atan2 (Type.valueOf (x));
    }

    public static Type hypot (Object a, Object b)
    {
        return Type.valueOf (a).hypot (Type.valueOf (b));
    }
}
