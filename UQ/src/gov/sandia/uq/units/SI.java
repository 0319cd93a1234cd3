/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.units;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.log4j.Logger;

import gov.sandia.uq.language.type.RationalNumber;

/**
    The International System of Units.
    All constants are created when this class is loaded and never change afterward,
    so they may be shared freely between threads.
**/
public class SI
{
    private static Logger logger = Logger.getLogger (SI.class);

    // Base units
    public static final BaseUnit METER    = new BaseUnit ("m",   Dimension.LENGTH);
    public static final BaseUnit KILOGRAM = new BaseUnit ("kg",  Dimension.MASS);
    public static final BaseUnit SECOND   = new BaseUnit ("s",   Dimension.TIME);
    public static final BaseUnit AMPERE   = new BaseUnit ("A",   Dimension.CURRENT);
    public static final BaseUnit KELVIN   = new BaseUnit ("K",   Dimension.TEMPERATURE);
    public static final BaseUnit MOLE     = new BaseUnit ("mol", Dimension.AMOUNT);
    public static final BaseUnit CANDELA  = new BaseUnit ("cd",  Dimension.LUMINOUS_INTENSITY);

    // Dimensionless
    public static final Unit RADIAN    = new AlternateUnit ("rad", Unit.ONE);
    public static final Unit STERADIAN = new AlternateUnit ("sr",  Unit.ONE);

    // Derived units with special names
    public static final Unit HERTZ     = new AlternateUnit ("Hz",  SECOND.inverse ());
    public static final Unit NEWTON    = new AlternateUnit ("N",   METER.multiply (KILOGRAM).divide (SECOND.pow (2)));
    public static final Unit PASCAL    = new AlternateUnit ("Pa",  NEWTON.divide (METER.pow (2)));
    public static final Unit JOULE     = new AlternateUnit ("J",   NEWTON.multiply (METER));
    public static final Unit WATT      = new AlternateUnit ("W",   JOULE.divide (SECOND));
    public static final Unit COULOMB   = new AlternateUnit ("C",   SECOND.multiply (AMPERE));
    public static final Unit VOLT      = new AlternateUnit ("V",   WATT.divide (AMPERE));
    public static final Unit FARAD     = new AlternateUnit ("F",   COULOMB.divide (VOLT));
    public static final Unit OHM       = new AlternateUnit ("Ω",   VOLT.divide (AMPERE));
    public static final Unit SIEMENS   = new AlternateUnit ("S",   AMPERE.divide (VOLT));
    public static final Unit WEBER     = new AlternateUnit ("Wb",  VOLT.multiply (SECOND));
    public static final Unit TESLA     = new AlternateUnit ("T",   WEBER.divide (METER.pow (2)));
    public static final Unit HENRY     = new AlternateUnit ("H",   WEBER.divide (AMPERE));
    public static final Unit LUMEN     = new AlternateUnit ("lm",  CANDELA.multiply (STERADIAN));
    public static final Unit LUX       = new AlternateUnit ("lx",  LUMEN.divide (METER.pow (2)));
    public static final Unit BECQUEREL = new AlternateUnit ("Bq",  SECOND.inverse ());
    public static final Unit GRAY      = new AlternateUnit ("Gy",  JOULE.divide (KILOGRAM));
    public static final Unit SIEVERT   = new AlternateUnit ("Sv",  JOULE.divide (KILOGRAM));
    public static final Unit KATAL     = new AlternateUnit ("kat", MOLE.divide (SECOND));

    // Units outside the coherent system
    public static final Unit GRAM      = new AlternateUnit ("g",   KILOGRAM.divide (1000));
    public static final Unit CELSIUS   = new AlternateUnit ("℃",   KELVIN.add (273.15));

    protected static final Map<String,Unit>           units;
    protected static final Map<String,RationalNumber> prefixes;
    static
    {
        Map<String,Unit> u = new LinkedHashMap<String,Unit> ();
        for (Unit unit : new Unit[] {METER, KILOGRAM, SECOND, AMPERE, KELVIN, MOLE, CANDELA,
                                     RADIAN, STERADIAN, HERTZ, NEWTON, PASCAL, JOULE, WATT, COULOMB, VOLT,
                                     FARAD, OHM, SIEMENS, WEBER, TESLA, HENRY, LUMEN, LUX, BECQUEREL, GRAY,
                                     SIEVERT, KATAL, GRAM, CELSIUS})
        {
            u.put (symbolOf (unit), unit);
        }
        units = Collections.unmodifiableMap (u);

        Map<String,RationalNumber> p = new LinkedHashMap<String,RationalNumber> ();
        p.put ("E",  new RationalNumber (1000000000000000000L));
        p.put ("P",  new RationalNumber (1000000000000000L));
        p.put ("T",  new RationalNumber (1000000000000L));
        p.put ("G",  new RationalNumber (1000000000L));
        p.put ("M",  new RationalNumber (1000000L));
        p.put ("k",  new RationalNumber (1000L));
        p.put ("h",  new RationalNumber (100L));
        p.put ("da", new RationalNumber (10L));
        p.put ("d",  new RationalNumber (1, 10L));
        p.put ("c",  new RationalNumber (1, 100L));
        p.put ("m",  new RationalNumber (1, 1000L));
        p.put ("µ",  new RationalNumber (1, 1000000L));
        p.put ("n",  new RationalNumber (1, 1000000000L));
        p.put ("p",  new RationalNumber (1, 1000000000000L));
        p.put ("f",  new RationalNumber (1, 1000000000000000L));
        p.put ("a",  new RationalNumber (1, 1000000000000000000L));
        prefixes = Collections.unmodifiableMap (p);

        logger.debug ("registered " + units.size () + " units and " + prefixes.size () + " prefixes");
    }

    protected static String symbolOf (Unit unit)
    {
        if (unit instanceof BaseUnit)      return ((BaseUnit)      unit).symbol;
        if (unit instanceof AlternateUnit) return ((AlternateUnit) unit).symbol;
        return null;
    }

    /**
        @return All named units, keyed by symbol, in order of definition. The map is read-only.
    **/
    public static Map<String,Unit> getUnits ()
    {
        return units;
    }

    /**
        Finds a unit by its symbol. A symbol that is not registered directly may be a
        prefixed form of a registered unit, such as "mV" or "km".
        @return The unit, or null if the symbol is not recognized.
    **/
    public static Unit getUnit (String symbol)
    {
        Unit result = units.get (symbol);
        if (result != null) return result;
        for (String p : prefixes.keySet ())
        {
            if (! symbol.startsWith (p)  ||  symbol.length () == p.length ()) continue;
            Unit base = units.get (symbol.substring (p.length ()));
            if (base != null  &&  base != KILOGRAM) return prefix (p, base);
        }
        return null;
    }

    /**
        Applies a prefix by its symbol. The resulting unit is named when the given unit is named.
    **/
    public static Unit prefix (String p, Unit unit)
    {
        Unit scaled = unit.scale (UnitConverter.linear (prefixes.get (p)));
        String symbol = symbolOf (unit);
        if (symbol == null) return scaled;
        return new AlternateUnit (p + symbol, scaled);
    }

    public static Unit exa   (Unit unit) {return prefix ("E",  unit);}
    public static Unit peta  (Unit unit) {return prefix ("P",  unit);}
    public static Unit tera  (Unit unit) {return prefix ("T",  unit);}
    public static Unit giga  (Unit unit) {return prefix ("G",  unit);}
    public static Unit mega  (Unit unit) {return prefix ("M",  unit);}
    public static Unit kilo  (Unit unit) {return prefix ("k",  unit);}
    public static Unit hecto (Unit unit) {return prefix ("h",  unit);}
    public static Unit deka  (Unit unit) {return prefix ("da", unit);}
    public static Unit deci  (Unit unit) {return prefix ("d",  unit);}
    public static Unit centi (Unit unit) {return prefix ("c",  unit);}
    public static Unit milli (Unit unit) {return prefix ("m",  unit);}
    public static Unit micro (Unit unit) {return prefix ("µ",  unit);}
    public static Unit nano  (Unit unit) {return prefix ("n",  unit);}
    public static Unit pico  (Unit unit) {return prefix ("p",  unit);}
    public static Unit femto (Unit unit) {return prefix ("f",  unit);}
    public static Unit atto  (Unit unit) {return prefix ("a",  unit);}
}
