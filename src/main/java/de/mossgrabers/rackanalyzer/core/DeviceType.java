// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.core;

/**
 * All known device types. The tag is the element name used in the rack documents and also the
 * identifier in the JSON output.
 *
 * @author Jürgen Moßgraber
 */
public enum DeviceType
{
    AUDIO_EFFECT_RACK("AudioEffectGroupDevice", "Audio Effect Rack", DeviceCategory.RACK),
    INSTRUMENT_RACK("InstrumentGroupDevice", "Instrument Rack", DeviceCategory.RACK),

    EQ_THREE("Eq3", "EQ Three", DeviceCategory.EQ),
    EQ_EIGHT("Eq8", "EQ Eight", DeviceCategory.EQ),

    COMPRESSOR("Compressor2", "Compressor", DeviceCategory.DYNAMICS),
    GLUE_COMPRESSOR("GlueCompressor", "Glue Compressor", DeviceCategory.DYNAMICS),
    MULTIBAND_DYNAMICS("MultibandDynamics", "Multiband Dynamics", DeviceCategory.DYNAMICS),
    GATE("Gate", "Gate", DeviceCategory.DYNAMICS),
    LIMITER("Limiter", "Limiter", DeviceCategory.DYNAMICS),

    DELAY("Delay", "Delay", DeviceCategory.DELAY),
    FILTER_DELAY("FilterDelay", "Filter Delay", DeviceCategory.DELAY),
    BEAT_REPEAT("BeatRepeat", "Beat Repeat", DeviceCategory.DELAY),

    REVERB("Reverb", "Reverb", DeviceCategory.REVERB),

    CHORUS("Chorus", "Chorus", DeviceCategory.MODULATION),
    PHASER("Phaser", "Phaser", DeviceCategory.MODULATION),
    PHASER_FLANGER("PhaserNew", "Phaser-Flanger", DeviceCategory.MODULATION),
    FLANGER("Flanger", "Flanger", DeviceCategory.MODULATION),
    AUTO_PAN("AutoPan", "Auto Pan", DeviceCategory.MODULATION),

    AUTO_FILTER("AutoFilter", "Auto Filter", DeviceCategory.FILTER),

    SATURATOR("Saturator", "Saturator", DeviceCategory.DISTORTION),
    DYNAMIC_TUBE("Tube", "Dynamic Tube", DeviceCategory.DISTORTION),
    REDUX("Redux", "Redux", DeviceCategory.DISTORTION),

    FREQUENCY_SHIFTER("FrequencyShifter", "Frequency Shifter", DeviceCategory.PITCH),
    FREQUENCY_SHIFTER_LEGACY("Frequency", "Frequency Shifter", DeviceCategory.PITCH),
    SHIFTER("Shifter", "Shifter", DeviceCategory.PITCH),
    RESONATOR("Resonator", "Resonator", DeviceCategory.PITCH),
    VOCODER("Vocoder", "Vocoder", DeviceCategory.PITCH),

    UTILITY("StereoGain", "Utility", DeviceCategory.UTILITY),
    BRANCH_MIXER("AudioBranchMixerDevice", "Branch Mixer", DeviceCategory.UTILITY),

    OPERATOR("Operator", "Operator", DeviceCategory.INSTRUMENT),
    BASS("Bass", "Bass", DeviceCategory.INSTRUMENT),
    COLLISION("Collision", "Collision", DeviceCategory.INSTRUMENT),
    TENSION("Tension", "Tension", DeviceCategory.INSTRUMENT),
    IMPULSE("Impulse", "Impulse", DeviceCategory.INSTRUMENT),
    SIMPLER("Simpler", "Simpler", DeviceCategory.INSTRUMENT),
    SIMPLER_ORIGINAL("OriginalSimpler", "Simpler", DeviceCategory.INSTRUMENT),
    WAVETABLE("Wavetable", "Wavetable", DeviceCategory.INSTRUMENT),
    WAVETABLE_VECTOR("InstrumentVector", "Wavetable", DeviceCategory.INSTRUMENT),
    DRUM_RACK("DrumRack", "Drum Rack", DeviceCategory.INSTRUMENT),

    MAX_AUDIO_EFFECT("MxDeviceAudioEffect", "Max Audio Effect", DeviceCategory.MAX_FOR_LIVE),
    MAX_INSTRUMENT("MxDeviceInstrument", "Max Instrument", DeviceCategory.MAX_FOR_LIVE);


    private final String         tag;
    private final String         label;
    private final DeviceCategory category;


    /**
     * Constructor.
     *
     * @param tag The element name in the rack document
     * @param label The name to display if the user did not name the device
     * @param category The category
     */
    private DeviceType (final String tag, final String label, final DeviceCategory category)
    {
        this.tag = tag;
        this.label = label;
        this.category = category;
    }


    /**
     * Get the element name of the device in the rack document.
     *
     * @return The tag
     */
    public String getTag ()
    {
        return this.tag;
    }


    /**
     * Get the friendly name of the device type.
     *
     * @return The label
     */
    public String getLabel ()
    {
        return this.label;
    }


    /**
     * Get the category of the device type.
     *
     * @return The category
     */
    public DeviceCategory getCategory ()
    {
        return this.category;
    }


    /**
     * Is this a rack which contains chains?
     *
     * @return True if it is a rack type
     */
    public boolean isRack ()
    {
        return this.category == DeviceCategory.RACK;
    }
}
