// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.core;

/**
 * A macro control of a rack which was named by the user.
 *
 * @author Jürgen Moßgraber
 */
public class MacroControl
{
    /** The number of macro slots of a rack. */
    public static final int NUMBER_OF_SLOTS = 16;

    private final String    name;
    private final double    value;
    private final int       index;


    /**
     * Constructor.
     *
     * @param name The name given by the user, must not be empty
     * @param value The value of the control
     * @param index The index of the slot in the range of [0..15]
     */
    public MacroControl (final String name, final double value, final int index)
    {
        if (name == null || name.isEmpty ())
            throw new IllegalArgumentException ("Macro control name must not be empty.");
        if (index < 0 || index >= NUMBER_OF_SLOTS)
            throw new IllegalArgumentException ("Macro slot index out of range: " + index);

        this.name = name;
        this.value = value;
        this.index = index;
    }


    /**
     * Get the name of the control.
     *
     * @return The name
     */
    public String getName ()
    {
        return this.name;
    }


    /**
     * Get the value of the control.
     *
     * @return The value
     */
    public double getValue ()
    {
        return this.value;
    }


    /**
     * Get the index of the macro slot.
     *
     * @return The index in the range of [0..15]
     */
    public int getIndex ()
    {
        return this.index;
    }


    /**
     * Get the name the format generates for a slot which was not renamed.
     *
     * @param index The index of the slot
     * @return The default name, e.g. "Macro 1" for index 0
     */
    public static String getDefaultName (final int index)
    {
        return "Macro " + (index + 1);
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        return this.name + " [" + this.index + "]: " + this.value;
    }
}
