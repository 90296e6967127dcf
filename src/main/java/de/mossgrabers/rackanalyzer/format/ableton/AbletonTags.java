// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.format.ableton;

import de.mossgrabers.rackanalyzer.model.XmlNode;

import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;


/**
 * Tags used in Ableton rack preset files.
 *
 * @author Jürgen Moßgraber
 */
public class AbletonTags
{
    protected static final String    DOCUMENT_ROOT            = "Ableton";
    protected static final String    VALUE                    = "Value";

    protected static final String    DEVICE_USER_NAME         = "UserName";
    protected static final String    DEVICE_ON_MANUAL         = "On/Manual";

    protected static final String    RACK_BRANCHES            = "Branches";
    protected static final String    RACK_BRANCH_PRESETS      = "BranchPresets";
    protected static final String    MACRO_DISPLAY_NAME       = "MacroDisplayNames.";
    protected static final String    MACRO_CONTROL            = "MacroControls.";
    protected static final String    MACRO_CONTROL_MANUAL     = "Manual";

    protected static final String    BRANCH_AUDIO_EFFECT      = "AudioEffectBranchPreset";
    protected static final String    BRANCH_AUDIO_EFFECT_LIVE = "AudioEffectBranch";
    protected static final String    BRANCH_INSTRUMENT        = "InstrumentBranchPreset";
    protected static final String    BRANCH_INSTRUMENT_LIVE   = "InstrumentBranch";
    protected static final String    BRANCH_NAME              = "Name";
    protected static final String    BRANCH_USER_NAME         = "UserName";
    protected static final String    BRANCH_IS_SOLOED         = "IsSoloed";

    protected static final String    CHUNK_DEVICE_CHAIN       = "DeviceChain";
    protected static final String    DEVICE_CHAIN_SUFFIX      = "DeviceChain";
    protected static final String    CHUNK_DEVICES            = "Devices";
    protected static final String    CHUNK_DEVICE_PRESETS     = "DevicePresets";

    protected static final String    PRESET_SUFFIX            = "Preset";
    protected static final String    PRESET_DEVICE            = "Device";

    protected static final String    VALUE_TRUE               = "true";

    private static final Set<String> BRANCH_TAGS              = new HashSet<> ();

    static
    {
        Collections.addAll (BRANCH_TAGS, BRANCH_AUDIO_EFFECT, BRANCH_AUDIO_EFFECT_LIVE, BRANCH_INSTRUMENT, BRANCH_INSTRUMENT_LIVE);
    }


    /**
     * Constructor.
     */
    private AbletonTags ()
    {
        // Intentionally empty
    }


    /**
     * Is the given tag the tag of a chain inside of a rack?
     *
     * @param tag The tag to check
     * @return True if it is a branch tag
     */
    public static boolean isBranch (final String tag)
    {
        return BRANCH_TAGS.contains (tag);
    }


    /**
     * Get the 'Value' attribute of a child element.
     *
     * @param node The parent node
     * @param path The path to the child, e.g. "On/Manual"
     * @return The value or empty if the child or the attribute do not exist
     */
    public static Optional<String> getValue (final XmlNode node, final String path)
    {
        return node.getPath (path).flatMap (child -> child.getAttribute (VALUE));
    }


    /**
     * Get the 'Value' attribute of a child element if it is not empty.
     *
     * @param node The parent node
     * @param path The path to the child
     * @return The value or empty if the child or the attribute do not exist or the value is empty
     */
    public static Optional<String> getNonEmptyValue (final XmlNode node, final String path)
    {
        return getValue (node, path).filter (value -> !value.isEmpty ());
    }
}
