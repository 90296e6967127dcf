// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.core;

import java.util.List;


/**
 * One parallel signal path inside of a rack.
 *
 * @author Jürgen Moßgraber
 */
public class Chain
{
    private final String       name;
    private final boolean      isSoloed;
    private final List<Device> devices;


    /**
     * Constructor.
     *
     * @param name The name of the chain
     * @param isSoloed True if the chain is soloed
     * @param devices The devices of the chain in document order
     */
    public Chain (final String name, final boolean isSoloed, final List<Device> devices)
    {
        this.name = name;
        this.isSoloed = isSoloed;
        this.devices = List.copyOf (devices);
    }


    /**
     * Get the name of the chain.
     *
     * @return The name
     */
    public String getName ()
    {
        return this.name;
    }


    /**
     * Is the chain soloed?
     *
     * @return True if soloed
     */
    public boolean isSoloed ()
    {
        return this.isSoloed;
    }


    /**
     * Get the devices of the chain.
     *
     * @return The devices in document order
     */
    public List<Device> getDevices ()
    {
        return this.devices;
    }


    /**
     * Count the devices of the chain including all devices in nested racks. A nested rack counts
     * as a device itself.
     *
     * @return The number of devices
     */
    public int countDevices ()
    {
        int count = 0;
        for (final Device device: this.devices)
            count += device.countDevices ();
        return count;
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        return this.name + (this.isSoloed ? " (soloed)" : "") + " " + this.devices;
    }
}
