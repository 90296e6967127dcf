// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.format.ableton;

import de.mossgrabers.rackanalyzer.core.DeviceType;
import de.mossgrabers.rackanalyzer.model.XmlNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;


/**
 * Detects if a device element is a rack and where its' chains are stored.
 *
 * @author Jürgen Moßgraber
 */
public class RackClassifier
{
    /**
     * Constructor.
     */
    private RackClassifier ()
    {
        // Intentionally empty
    }


    /**
     * Classify a device element which is not wrapped in a preset element.
     *
     * @param node The device element
     * @return The variant
     */
    public static RackVariant classify (final XmlNode node)
    {
        return classify (new DeviceSlot (node, null));
    }


    /**
     * Classify a device slot.
     *
     * @param slot The slot
     * @return The variant
     */
    public static RackVariant classify (final DeviceSlot slot)
    {
        final Optional<DeviceType> type = DeviceRegistry.classify (slot.getDevice ().getTag ());
        if (type.isEmpty ())
            return RackVariant.NOT_A_RACK;

        switch (type.get ())
        {
            case INSTRUMENT_RACK:
                return RackVariant.INSTRUMENT_RACK;

            case AUDIO_EFFECT_RACK:
                // A rack with a single chain is stored without branches
                return getBranches (slot).isEmpty () ? RackVariant.AUDIO_EFFECT_RACK_FLAT : RackVariant.AUDIO_EFFECT_RACK_BRANCHING;

            default:
                return RackVariant.NOT_A_RACK;
        }
    }


    /**
     * Get the chain elements of a rack in document order. These are taken from the 'Branches'
     * element of the device. If there are none, the 'BranchPresets' element of a preset wrapper is
     * checked.
     *
     * @param slot The slot of the rack
     * @return The branch elements, empty if there are none
     */
    public static List<XmlNode> getBranches (final DeviceSlot slot)
    {
        final List<XmlNode> branches = getBranches (slot.getDevice ().getChildNode (AbletonTags.RACK_BRANCHES));
        if (!branches.isEmpty ())
            return branches;

        final Optional<XmlNode> wrapper = slot.getWrapper ();
        if (wrapper.isEmpty ())
            return branches;
        return getBranches (wrapper.get ().getChildNode (AbletonTags.RACK_BRANCH_PRESETS));
    }


    private static List<XmlNode> getBranches (final Optional<XmlNode> container)
    {
        final List<XmlNode> branches = new ArrayList<> ();
        if (container.isPresent ())
        {
            for (final XmlNode child: container.get ().getChildNodes ())
            {
                if (AbletonTags.isBranch (child.getTag ()))
                    branches.add (child);
            }
        }
        return branches;
    }
}
