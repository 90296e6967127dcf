// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.core;

import java.util.List;
import java.util.Optional;


/**
 * A device in a chain. This is either a single processing unit (effect, instrument) or a nested
 * rack. Only nested racks have chains.
 *
 * @author Jürgen Moßgraber
 */
public class Device
{
    private final DeviceType  type;
    private final String      name;
    private final boolean     isOn;
    private final List<Chain> chains;


    /**
     * Constructor for a device which is not a rack.
     *
     * @param type The type of the device
     * @param name The display name
     * @param isOn True if the device is enabled
     */
    public Device (final DeviceType type, final String name, final boolean isOn)
    {
        if (type.isRack ())
            throw new IllegalArgumentException ("A rack device requires chains: " + type.getTag ());

        this.type = type;
        this.name = name;
        this.isOn = isOn;
        this.chains = null;
    }


    /**
     * Constructor for a rack device.
     *
     * @param type The type of the device, must be a rack type
     * @param name The display name
     * @param isOn True if the device is enabled
     * @param chains The chains of the rack
     */
    public Device (final DeviceType type, final String name, final boolean isOn, final List<Chain> chains)
    {
        if (!type.isRack ())
            throw new IllegalArgumentException ("Only rack devices can have chains: " + type.getTag ());

        this.type = type;
        this.name = name;
        this.isOn = isOn;
        this.chains = List.copyOf (chains);
    }


    /**
     * Get the type of the device.
     *
     * @return The type
     */
    public DeviceType getType ()
    {
        return this.type;
    }


    /**
     * Get the name to display for the device.
     *
     * @return The name
     */
    public String getName ()
    {
        return this.name;
    }


    /**
     * Is the device enabled?
     *
     * @return True if enabled
     */
    public boolean isOn ()
    {
        return this.isOn;
    }


    /**
     * Get the chains of a nested rack.
     *
     * @return The chains, empty if the device is not a rack
     */
    public Optional<List<Chain>> getChains ()
    {
        return Optional.ofNullable (this.chains);
    }


    /**
     * Count this device and all devices in its' nested chains.
     *
     * @return The number of devices, at least 1
     */
    public int countDevices ()
    {
        int count = 1;
        if (this.chains != null)
        {
            for (final Chain chain: this.chains)
                count += chain.countDevices ();
        }
        return count;
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        final StringBuilder sb = new StringBuilder (this.name).append (" (").append (this.type.getTag ()).append (')');
        if (!this.isOn)
            sb.append (" off");
        if (this.chains != null)
            sb.append (' ').append (this.chains);
        return sb.toString ();
    }
}
