// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.format.ableton;

/**
 * The different structures of a device element.
 *
 * @author Jürgen Moßgraber
 */
public enum RackVariant
{
    /** An instrument rack. The chain names are stored in 'Name'. */
    INSTRUMENT_RACK,
    /** An audio effect rack with chains. The chain names are stored in 'UserName'. */
    AUDIO_EFFECT_RACK_BRANCHING,
    /** An audio effect rack without chains, the devices are stored in the rack itself. */
    AUDIO_EFFECT_RACK_FLAT,
    /** A plain device. */
    NOT_A_RACK
}
