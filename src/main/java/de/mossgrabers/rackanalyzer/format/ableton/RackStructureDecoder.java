// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.format.ableton;

import de.mossgrabers.rackanalyzer.INotifier;
import de.mossgrabers.rackanalyzer.core.Chain;
import de.mossgrabers.rackanalyzer.core.DeviceType;
import de.mossgrabers.rackanalyzer.core.MacroControl;
import de.mossgrabers.rackanalyzer.core.RackAnalysis;
import de.mossgrabers.rackanalyzer.model.XmlNode;
import de.mossgrabers.rackanalyzer.utils.FileUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;


/**
 * Decodes the document of a rack preset into its' macro controls, chains and devices. Needs to be
 * state-less.
 *
 * @author Jürgen Moßgraber
 */
public class RackStructureDecoder
{
    /** The rack and use case name if no file name is available. */
    public static final String  UNKNOWN_NAME = "Unknown";

    private static final Logger LOGGER       = LoggerFactory.getLogger (RackStructureDecoder.class);


    /**
     * Constructor.
     */
    private RackStructureDecoder ()
    {
        // Intentionally empty
    }


    /**
     * Decode a rack document.
     *
     * @param root The root element of the document
     * @param filename The name of the file the document was read from, used for the rack name and
     *            use case; might contain a path; might be null
     * @return The decoded rack
     * @throws ParseException The document is not an Ableton document or does not contain a rack
     */
    public static RackAnalysis decode (final XmlNode root, final String filename) throws ParseException
    {
        return decode (root, filename, null);
    }


    /**
     * Decode a rack document and report skipped elements which are not known devices.
     *
     * @param root The root element of the document
     * @param filename The name of the file the document was read from, used for the rack name and
     *            use case; might contain a path; might be null
     * @param notifier Where to report unknown devices, might be null
     * @return The decoded rack
     * @throws ParseException The document is not an Ableton document or does not contain a rack
     */
    public static RackAnalysis decode (final XmlNode root, final String filename, final INotifier notifier) throws ParseException
    {
        if (root == null || !AbletonTags.DOCUMENT_ROOT.equals (root.getTag ()))
            throw new ParseException ("No Ableton document. Root element '" + AbletonTags.DOCUMENT_ROOT + "' not found.", 0);

        final DeviceSlot rackSlot = findRack (root).orElseThrow ( () -> new ParseException ("No rack found in the Ableton document.", 0));

        final String name = filename == null ? UNKNOWN_NAME : FileUtils.getNameWithoutType (filename);
        final List<String> warnings = new ArrayList<> ();

        final List<MacroControl> macroControls = MacroControlExtractor.extract (rackSlot.getDevice (), warnings);

        final DeviceChainWalker walker = new DeviceChainWalker (warnings);
        walker.claim (rackSlot.getDevice ());
        final List<Chain> chains = walker.enumerateChains (rackSlot, RackClassifier.classify (rackSlot));
        if (notifier != null)
        {
            for (final String tag: walker.getUnknownDevices ())
                notifier.log ("IDS_NOTIFY_UNKNOWN_DEVICE", tag);
        }

        final RackAnalysis analysis = new RackAnalysis (name, name, macroControls, chains, warnings);
        LOGGER.debug ("Decoded rack '{}': {} chain(s), {} device(s), nesting depth {}.", name, chains.size (), analysis.countDevices (), walker.getMaxDepth ());
        return analysis;
    }


    /**
     * Find the top level rack. Racks which are direct children of the root are preferred, otherwise
     * the first rack in document order is used.
     *
     * @param root The root element
     * @return The slot of the rack or empty if there is none
     */
    private static Optional<DeviceSlot> findRack (final XmlNode root)
    {
        for (final XmlNode child: root.getChildNodes ())
        {
            final DeviceSlot slot = DeviceSlot.of (child);
            if (isRack (slot))
                return Optional.of (slot);
        }
        return findNestedRack (root);
    }


    private static Optional<DeviceSlot> findNestedRack (final XmlNode parent)
    {
        for (final XmlNode child: parent.getChildNodes ())
        {
            final DeviceSlot slot = DeviceSlot.of (child);
            if (isRack (slot))
                return Optional.of (slot);
            final Optional<DeviceSlot> nested = findNestedRack (child);
            if (nested.isPresent ())
                return nested;
        }
        return Optional.empty ();
    }


    private static boolean isRack (final DeviceSlot slot)
    {
        final Optional<DeviceType> type = DeviceRegistry.classify (slot.getDevice ().getTag ());
        return type.isPresent () && type.get ().isRack ();
    }
}
