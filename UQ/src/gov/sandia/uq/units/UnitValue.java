/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.units;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.measure.MeasurementException;
import javax.measure.format.UnitFormat;

import org.apache.log4j.Logger;

import gov.sandia.uq.language.Type;
import gov.sandia.uq.language.UnsupportedOperandException;
import gov.sandia.uq.language.type.RationalNumber;
import gov.sandia.uq.language.type.Scalar;
import gov.sandia.uq.quantities.Quantity;
import tech.units.indriya.format.SimpleUnitFormat;
import tech.units.indriya.unit.UnitDimension;

/**
    Utility class for reading a numeric constant with an optional unit, such as "2 mV" or "9.81 m/s^2".
    Unit text is parsed by the JSR 385 reference implementation, then translated into our own units
    by dimension and scale. Symbols known to SI are used directly, so "mV" yields SI.milli (SI.VOLT)
    rather than an anonymous scaled unit.
**/
public class UnitValue
{
    public double value;
    public Unit   unit;  // null if the input had no unit

    private static Logger logger = Logger.getLogger (UnitValue.class);

    public static Pattern    floatParser = Pattern.compile ("[-+]?(NaN|Infinity|([0-9]*\\.?[0-9]*([eE][-+]?[0-9]+)?))");
    public static UnitFormat format      = SimpleUnitFormat.getInstance ();

    protected static final javax.measure.Dimension[] baseDimensions =
    {
        UnitDimension.LENGTH,
        UnitDimension.MASS,
        UnitDimension.TIME,
        UnitDimension.ELECTRIC_CURRENT,
        UnitDimension.TEMPERATURE,
        UnitDimension.AMOUNT_OF_SUBSTANCE,
        UnitDimension.LUMINOUS_INTENSITY
    };

    protected static final BaseUnit[] baseUnits = {SI.METER, SI.KILOGRAM, SI.SECOND, SI.AMPERE, SI.KELVIN, SI.MOLE, SI.CANDELA};

    /**
        Parses the given string, which must be a properly-formatted number with an optional unit at the end.
        @throws UnsupportedOperandException if either part is malformed.
    **/
    public UnitValue (String input)
    {
        input = input.trim ();
        int unitIndex = findUnits (input);
        String valueString = input.substring (0, unitIndex).trim ();
        String unitString  = input.substring (unitIndex).trim ();
        try
        {
            value = Double.parseDouble (valueString);
        }
        catch (NumberFormatException e)
        {
            logger.debug ("malformed number in \"" + input + "\"");
            throw new UnsupportedOperandException ("parse", e, input);
        }
        if (! unitString.isEmpty ()) unit = parseUnit (unitString);
    }

    /**
        @return The parsed value as a Quantity, or as a plain number if there was no unit.
    **/
    public Type get ()
    {
        if (unit == null) return new Scalar (value);
        return new Quantity (unit, new Scalar (value));
    }

    public static int findUnits (String value)
    {
        Matcher m = floatParser.matcher (value);
        m.find ();
        return m.end ();
    }

    /**
        Converts unit text into one of our units.
        @throws UnsupportedOperandException if the text is not a recognized unit expression.
    **/
    public static Unit parseUnit (String text)
    {
        javax.measure.Unit<?> parsed;
        try
        {
            parsed = format.parse (text);
        }
        catch (MeasurementException | IllegalArgumentException e)
        {
            logger.debug ("unrecognized unit \"" + text + "\": " + e.getMessage ());
            throw new UnsupportedOperandException ("parse", e, text);
        }

        Unit result = fromMeasure (parsed);
        Unit named  = SI.getUnit (text);
        if (named != null  &&  named.isCompatible (result)  &&  isIdentity (named.getOperatorTo (result))) return named;
        return result;
    }

    /**
        Factors computed through floating-point may be off by an ulp or so.
    **/
    protected static boolean isIdentity (UnitConverter c)
    {
        if (c.isIdentity ()) return true;
        return c.isLinear ()  &&  Math.abs (c.getFactor () - 1) < 1e-12;
    }

    /**
        Translates a javax.measure unit into the equivalent product of SI base units, scaled and offset
        as needed. The result has no symbol of its own.
    **/
    @SuppressWarnings({ "unchecked", "rawtypes" })
    public static Unit fromMeasure (javax.measure.Unit<?> measure)
    {
        Map<Unit,RationalNumber> factors = new LinkedHashMap<Unit,RationalNumber> ();
        accumulate (factors, measure.getDimension (), 1);
        Unit coherent = ProductUnit.compose (factors);

        javax.measure.UnitConverter c;
        try
        {
            c = measure.getConverterTo ((javax.measure.Unit) measure.getSystemUnit ());
        }
        catch (MeasurementException e)
        {
            throw new UnsupportedOperandException ("convert", e, measure.toString ());
        }
        if (c.isLinear ()) return coherent.scale (UnitConverter.linear (c.convert (1.0)));
        double offset = c.convert (0.0);
        double factor = c.convert (1.0) - offset;
        return coherent.scale (new AddConverter (offset).concatenate (UnitConverter.linear (factor)));
    }

    protected static void accumulate (Map<Unit,RationalNumber> factors, javax.measure.Dimension dimension, int power)
    {
        Map<? extends javax.measure.Dimension,Integer> parts = dimension.getBaseDimensions ();
        if (parts == null)  // This is a base dimension.
        {
            for (int i = 0; i < baseDimensions.length; i++)
            {
                if (baseDimensions[i].equals (dimension))
                {
                    ProductUnit.accumulate (factors, baseUnits[i], new RationalNumber (power));
                    return;
                }
            }
            throw new UnsupportedOperandException ("dimension", dimension.toString ());
        }
        for (Entry<? extends javax.measure.Dimension,Integer> e : parts.entrySet ())
        {
            accumulate (factors, e.getKey (), power * e.getValue ());
        }
    }

    public String toString ()
    {
        String result = Scalar.print (value);
        if (unit != null) result += " " + unit;
        return result;
    }
}
