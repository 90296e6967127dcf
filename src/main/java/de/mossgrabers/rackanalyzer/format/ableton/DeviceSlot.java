// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.format.ableton;

import de.mossgrabers.rackanalyzer.model.XmlNode;

import java.util.List;
import java.util.Optional;


/**
 * A direct child of a device container. Live sets store the device element directly, presets wrap
 * it: &lt;AudioEffectGroupDevicePreset&gt;&lt;Device&gt;&lt;AudioEffectGroupDevice/&gt; ... The
 * wrapper of a rack preset also holds the chains in its' 'BranchPresets' element.
 *
 * @author Jürgen Moßgraber
 */
public class DeviceSlot
{
    private final XmlNode device;
    private final XmlNode wrapper;


    /**
     * Constructor.
     *
     * @param device The device element
     * @param wrapper The preset element wrapping the device, might be null
     */
    public DeviceSlot (final XmlNode device, final XmlNode wrapper)
    {
        this.device = device;
        this.wrapper = wrapper;
    }


    /**
     * Creates the slot for a child of a device container. Unwraps preset elements.
     *
     * @param child The child element
     * @return The slot
     */
    public static DeviceSlot of (final XmlNode child)
    {
        if (child.getTag ().endsWith (AbletonTags.PRESET_SUFFIX))
        {
            final Optional<XmlNode> deviceNode = child.getChildNode (AbletonTags.PRESET_DEVICE);
            if (deviceNode.isPresent ())
            {
                final List<XmlNode> wrapped = deviceNode.get ().getChildNodes ();
                if (!wrapped.isEmpty ())
                    return new DeviceSlot (wrapped.get (0), child);
            }
        }
        return new DeviceSlot (child, null);
    }


    /**
     * Get the device element.
     *
     * @return The element which carries the device settings
     */
    public XmlNode getDevice ()
    {
        return this.device;
    }


    /**
     * Get the preset element wrapping the device.
     *
     * @return The wrapper or empty if the device is not wrapped
     */
    public Optional<XmlNode> getWrapper ()
    {
        return Optional.ofNullable (this.wrapper);
    }
}
