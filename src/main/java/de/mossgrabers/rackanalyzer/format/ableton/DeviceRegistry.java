// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.format.ableton;

import de.mossgrabers.rackanalyzer.core.DeviceType;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;


/**
 * Lookup of the device types by their tags.
 *
 * @author Jürgen Moßgraber
 */
public class DeviceRegistry
{
    private static final Map<String, DeviceType> DEVICE_TYPES = new HashMap<> ();

    static
    {
        for (final DeviceType type: DeviceType.values ())
            DEVICE_TYPES.put (type.getTag (), type);
    }


    /**
     * Constructor.
     */
    private DeviceRegistry ()
    {
        // Intentionally empty
    }


    /**
     * Get the device type for a tag.
     *
     * @param tag The tag of an element
     * @return The type or empty if the tag is not a known device
     */
    public static Optional<DeviceType> classify (final String tag)
    {
        return Optional.ofNullable (DEVICE_TYPES.get (tag));
    }


    /**
     * Get all registered device types by their tags.
     *
     * @return The unmodifiable lookup
     */
    public static Map<String, DeviceType> getAll ()
    {
        return Collections.unmodifiableMap (DEVICE_TYPES);
    }
}
