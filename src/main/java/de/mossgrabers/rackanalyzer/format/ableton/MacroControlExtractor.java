// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.format.ableton;

import de.mossgrabers.rackanalyzer.core.MacroControl;
import de.mossgrabers.rackanalyzer.model.XmlNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;


/**
 * Reads the macro controls of a rack which were named by the user.
 *
 * @author Jürgen Moßgraber
 */
public class MacroControlExtractor
{
    /** Plain decimal numbers with an optional exponent, no type suffix and no hex notation. */
    private static final Pattern DECIMAL_NUMBER = Pattern.compile ("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");


    /**
     * Constructor.
     */
    private MacroControlExtractor ()
    {
        // Intentionally empty
    }


    /**
     * Get all macro controls of the rack which have a name different from the default name (e.g.
     * 'Macro 1').
     *
     * @param rackNode The rack device element
     * @param warnings Where to add a warning if a value is not a number
     * @return The controls ordered by their slot index
     */
    public static List<MacroControl> extract (final XmlNode rackNode, final List<String> warnings)
    {
        final List<MacroControl> controls = new ArrayList<> ();
        for (int index = 0; index < MacroControl.NUMBER_OF_SLOTS; index++)
        {
            final Optional<String> name = AbletonTags.getValue (rackNode, AbletonTags.MACRO_DISPLAY_NAME + index);
            if (name.isEmpty () || name.get ().isBlank () || name.get ().equals (MacroControl.getDefaultName (index)))
                continue;

            final String valueText = AbletonTags.getValue (rackNode, AbletonTags.MACRO_CONTROL + index + "/" + AbletonTags.MACRO_CONTROL_MANUAL).orElse ("0");
            controls.add (new MacroControl (name.get (), parseValue (valueText, name.get (), index, warnings), index));
        }
        return controls;
    }


    private static double parseValue (final String valueText, final String name, final int index, final List<String> warnings)
    {
        final String text = valueText.trim ();
        if (DECIMAL_NUMBER.matcher (text).matches ())
        {
            final double value = Double.parseDouble (text);
            if (Double.isFinite (value))
                return value;
        }
        warnings.add ("Value '" + valueText + "' of macro '" + name + "' (slot " + index + ") is not a number, using 0.");
        return 0.0;
    }
}
