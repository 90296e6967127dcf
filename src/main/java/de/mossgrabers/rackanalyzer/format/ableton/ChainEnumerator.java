// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.format.ableton;

import de.mossgrabers.rackanalyzer.core.Chain;
import de.mossgrabers.rackanalyzer.core.Device;
import de.mossgrabers.rackanalyzer.model.XmlNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;


/**
 * Creates the chains of a rack.
 *
 * @author Jürgen Moßgraber
 */
public class ChainEnumerator
{
    /** The name of the single chain of a rack without branches, if the rack has no name. */
    public static final String MAIN_CHAIN_NAME = "Main Chain";


    /**
     * Constructor.
     */
    private ChainEnumerator ()
    {
        // Intentionally empty
    }


    /**
     * Create the chains of a rack.
     *
     * @param slot The slot of the rack
     * @param variant The variant of the rack
     * @param walker The walker to use for decoding the devices of the chains
     * @return The chains in document order
     */
    public static List<Chain> enumerate (final DeviceSlot slot, final RackVariant variant, final DeviceChainWalker walker)
    {
        switch (variant)
        {
            case INSTRUMENT_RACK:
                return enumerateBranches (slot, AbletonTags.BRANCH_NAME, walker);

            case AUDIO_EFFECT_RACK_BRANCHING:
                return enumerateBranches (slot, AbletonTags.BRANCH_USER_NAME, walker);

            case AUDIO_EFFECT_RACK_FLAT:
                return enumerateFlat (slot, walker);

            default:
                return Collections.emptyList ();
        }
    }


    /**
     * Create one chain for each branch of the rack.
     *
     * @param slot The slot of the rack
     * @param nameTag The tag of the element which contains the name of a chain
     * @param walker The walker to use for decoding the devices of the chains
     * @return The chains
     */
    private static List<Chain> enumerateBranches (final DeviceSlot slot, final String nameTag, final DeviceChainWalker walker)
    {
        final List<XmlNode> branches = RackClassifier.getBranches (slot);
        final List<Chain> chains = new ArrayList<> (branches.size ());
        for (int i = 0; i < branches.size (); i++)
        {
            final XmlNode branch = branches.get (i);
            final String name = AbletonTags.getNonEmptyValue (branch, nameTag).orElse ("Chain " + (i + 1));
            final boolean isSoloed = AbletonTags.VALUE_TRUE.equals (AbletonTags.getValue (branch, AbletonTags.BRANCH_IS_SOLOED).orElse ("false"));
            chains.add (new Chain (name, isSoloed, walkDevices (branch, walker)));
        }
        return chains;
    }


    /**
     * Create the single chain of a rack without branches. The devices are stored in the rack
     * itself.
     *
     * @param slot The slot of the rack
     * @param walker The walker to use for decoding the devices of the chain
     * @return The chain or an empty list if the rack does not contain any devices
     */
    private static List<Chain> enumerateFlat (final DeviceSlot slot, final DeviceChainWalker walker)
    {
        final XmlNode rackNode = slot.getDevice ();
        final List<Device> devices = walkDevices (rackNode, walker);
        if (devices.isEmpty ())
            return Collections.emptyList ();

        final String name = AbletonTags.getNonEmptyValue (rackNode, AbletonTags.DEVICE_USER_NAME).orElse (MAIN_CHAIN_NAME);
        return Collections.singletonList (new Chain (name, false, devices));
    }


    private static List<Device> walkDevices (final XmlNode owner, final DeviceChainWalker walker)
    {
        final Optional<XmlNode> container = findDeviceContainer (owner);
        return container.isPresent () ? walker.walk (container.get ()) : Collections.emptyList ();
    }


    /**
     * Find the element which contains the devices of a chain or a rack. Supported are
     * 'DeviceChain/Devices', 'DeviceChain/*DeviceChain/Devices' and 'DevicePresets'.
     *
     * @param owner The branch or rack element
     * @return The container or empty if there is none
     */
    public static Optional<XmlNode> findDeviceContainer (final XmlNode owner)
    {
        final Optional<XmlNode> deviceChain = owner.getChildNode (AbletonTags.CHUNK_DEVICE_CHAIN);
        if (deviceChain.isPresent ())
        {
            final Optional<XmlNode> devices = deviceChain.get ().getChildNode (AbletonTags.CHUNK_DEVICES);
            if (devices.isPresent ())
                return devices;

            // Live sets wrap the devices, e.g. DeviceChain/AudioToAudioDeviceChain/Devices
            for (final XmlNode child: deviceChain.get ().getChildNodes ())
            {
                if (child.getTag ().endsWith (AbletonTags.DEVICE_CHAIN_SUFFIX))
                {
                    final Optional<XmlNode> wrappedDevices = child.getChildNode (AbletonTags.CHUNK_DEVICES);
                    if (wrappedDevices.isPresent ())
                        return wrappedDevices;
                }
            }
        }
        return owner.getChildNode (AbletonTags.CHUNK_DEVICE_PRESETS);
    }
}
