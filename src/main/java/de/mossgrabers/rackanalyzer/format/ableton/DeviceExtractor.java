// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.format.ableton;

import de.mossgrabers.rackanalyzer.core.Chain;
import de.mossgrabers.rackanalyzer.core.Device;
import de.mossgrabers.rackanalyzer.core.DeviceType;
import de.mossgrabers.rackanalyzer.model.XmlNode;

import java.util.List;
import java.util.Optional;


/**
 * Reads the name and the on/off state of a device element.
 *
 * @author Jürgen Moßgraber
 */
public class DeviceExtractor
{
    /**
     * Constructor.
     */
    private DeviceExtractor ()
    {
        // Intentionally empty
    }


    /**
     * Create a device which is not a rack.
     *
     * @param node The device element
     * @param type The type of the device
     * @return The device
     */
    public static Device extract (final XmlNode node, final DeviceType type)
    {
        return new Device (type, getDisplayName (node, type), isOn (node));
    }


    /**
     * Create a rack device.
     *
     * @param node The device element
     * @param type The type of the device, must be a rack type
     * @param chains The already decoded chains of the rack
     * @return The device
     */
    public static Device extractRack (final XmlNode node, final DeviceType type, final List<Chain> chains)
    {
        return new Device (type, getDisplayName (node, type), isOn (node), chains);
    }


    /**
     * Get the name of a device. This is the name given by the user. If there is none or it is
     * identical to the tag, the label of the device type is used.
     *
     * @param node The device element
     * @param type The type of the device
     * @return The name
     */
    public static String getDisplayName (final XmlNode node, final DeviceType type)
    {
        final Optional<String> userName = AbletonTags.getNonEmptyValue (node, AbletonTags.DEVICE_USER_NAME);
        if (userName.isPresent () && !userName.get ().equals (type.getTag ()))
            return userName.get ();
        return type.getLabel ();
    }


    /**
     * Is the device enabled? A missing 'On' parameter means that the device is on.
     *
     * @param node The device element
     * @return True if on
     */
    public static boolean isOn (final XmlNode node)
    {
        final Optional<String> value = AbletonTags.getValue (node, AbletonTags.DEVICE_ON_MANUAL);
        return value.isEmpty () || AbletonTags.VALUE_TRUE.equals (value.get ());
    }
}
