// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.format.ableton;

import de.mossgrabers.rackanalyzer.core.Chain;
import de.mossgrabers.rackanalyzer.core.Device;
import de.mossgrabers.rackanalyzer.core.DeviceType;
import de.mossgrabers.rackanalyzer.model.XmlNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;


/**
 * Walks the device containers of one rack document. Each container is processed by looking only at
 * its' direct children, a nested rack is decoded completely by descending into its' chains. This
 * way every device element ends up in exactly one chain. All device elements which were added to
 * the result are remembered and a second occurrence is rejected.
 *
 * Create one instance for each document, it is not thread-safe.
 *
 * @author Jürgen Moßgraber
 */
public class DeviceChainWalker
{
    private static final Logger LOGGER   = LoggerFactory.getLogger (DeviceChainWalker.class);

    private final Set<XmlNode>  claimed        = Collections.newSetFromMap (new IdentityHashMap<> ());
    private final Set<String>   unknownDevices = new LinkedHashSet<> ();
    private final List<String>  warnings;
    private int                 depth          = 0;
    private int                 maxDepth       = 0;


    /**
     * Constructor.
     *
     * @param warnings Where to add warnings about problems in the document
     */
    public DeviceChainWalker (final List<String> warnings)
    {
        this.warnings = warnings;
    }


    /**
     * Decode all devices which are direct children of a device container.
     *
     * @param container The container element, e.g. 'Devices'
     * @return The devices in document order
     */
    public List<Device> walk (final XmlNode container)
    {
        final List<Device> devices = new ArrayList<> ();
        for (final XmlNode child: container.getChildNodes ())
        {
            final DeviceSlot slot = DeviceSlot.of (child);
            final XmlNode deviceNode = slot.getDevice ();
            final Optional<DeviceType> type = DeviceRegistry.classify (deviceNode.getTag ());
            if (type.isEmpty ())
            {
                LOGGER.debug ("Skipping unknown device '{}'.", deviceNode.getTag ());
                this.unknownDevices.add (deviceNode.getTag ());
                continue;
            }

            if (!this.claim (deviceNode))
            {
                this.warnings.add ("Device '" + deviceNode.getTag () + "' is referenced more than once, ignored the duplicate.");
                continue;
            }

            final RackVariant variant = RackClassifier.classify (slot);
            if (variant == RackVariant.NOT_A_RACK)
                devices.add (DeviceExtractor.extract (deviceNode, type.get ()));
            else
                devices.add (DeviceExtractor.extractRack (deviceNode, type.get (), this.enumerateChains (slot, variant)));
        }
        return devices;
    }


    /**
     * Decode the chains of a rack one nesting level deeper.
     *
     * @param slot The slot of the rack
     * @param variant The variant of the rack
     * @return The chains of the rack
     */
    public List<Chain> enumerateChains (final DeviceSlot slot, final RackVariant variant)
    {
        this.depth++;
        this.maxDepth = Math.max (this.maxDepth, this.depth);
        try
        {
            return ChainEnumerator.enumerate (slot, variant, this);
        }
        finally
        {
            this.depth--;
        }
    }


    /**
     * Mark a device element as added to the result.
     *
     * @param deviceNode The device element
     * @return False if the element was already added before
     */
    public boolean claim (final XmlNode deviceNode)
    {
        return this.claimed.add (deviceNode);
    }


    /**
     * Get the tags of all skipped elements which are not known devices.
     *
     * @return The tags in the order of their first occurrence, each only once
     */
    public Set<String> getUnknownDevices ()
    {
        return Collections.unmodifiableSet (this.unknownDevices);
    }


    /**
     * Get the deepest rack nesting level which was decoded. The top level rack has level 1.
     *
     * @return The level
     */
    public int getMaxDepth ()
    {
        return this.maxDepth;
    }
}
