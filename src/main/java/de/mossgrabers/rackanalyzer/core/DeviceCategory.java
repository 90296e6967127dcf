// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.core;

/**
 * The categories of the devices.
 *
 * @author Jürgen Moßgraber
 */
public enum DeviceCategory
{
    /** A container with chains. */
    RACK,
    /** Equalizers. */
    EQ,
    /** Compressors, gates and limiters. */
    DYNAMICS,
    /** Delays and repeaters. */
    DELAY,
    /** Reverbs. */
    REVERB,
    /** Chorus, phaser, flanger and panning effects. */
    MODULATION,
    /** Filters. */
    FILTER,
    /** Saturation and lo-fi effects. */
    DISTORTION,
    /** Frequency and pitch shifting, resonators. */
    PITCH,
    /** Gain and routing utilities. */
    UTILITY,
    /** Sound generators. */
    INSTRUMENT,
    /** Max for Live devices. */
    MAX_FOR_LIVE
}
