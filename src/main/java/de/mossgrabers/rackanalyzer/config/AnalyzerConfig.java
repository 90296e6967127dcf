// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;


/**
 * The settings of the analyzer. The defaults are read from the class path, a user settings file can
 * override them.
 *
 * @author Jürgen Moßgraber
 */
public class AnalyzerConfig
{
    /** The file extensions of rack presets. */
    public static final String RACK_EXTENSIONS  = "rack.extensions";
    /** Indent the JSON output. */
    public static final String JSON_PRETTY      = "json.pretty";
    /** Omit the device tree in the text summary. */
    public static final String SUMMARY_QUIET    = "summary.quiet";

    private static final String DEFAULTS_RESOURCE = "/de/mossgrabers/rackanalyzer/analyzer.properties";

    private final Properties    properties        = new Properties ();


    /**
     * Constructor. Loads the defaults.
     *
     * @throws IOException Could not read the default settings
     */
    public AnalyzerConfig () throws IOException
    {
        try (final InputStream in = AnalyzerConfig.class.getResourceAsStream (DEFAULTS_RESOURCE))
        {
            if (in == null)
                throw new IOException ("Default settings not found: " + DEFAULTS_RESOURCE);
            this.load (in);
        }
    }


    /**
     * Load settings from a file. Present keys override the current values.
     *
     * @param settingsFile The properties file to load
     * @throws IOException Could not read the file
     */
    public void load (final File settingsFile) throws IOException
    {
        try (final InputStream in = new FileInputStream (settingsFile))
        {
            this.load (in);
        }
    }


    /**
     * Load settings from a stream. Present keys override the current values.
     *
     * @param in The stream with the properties in UTF-8
     * @throws IOException Could not read the stream
     */
    public void load (final InputStream in) throws IOException
    {
        try (final Reader reader = new InputStreamReader (in, StandardCharsets.UTF_8))
        {
            this.properties.load (reader);
        }
    }


    /**
     * Get a property value.
     *
     * @param key The key of the property
     * @return The value or null if not set
     */
    public String getProperty (final String key)
    {
        return this.properties.getProperty (key);
    }


    /**
     * Get a property value.
     *
     * @param key The key of the property
     * @param defaultValue The value to return if the property is not set
     * @return The value
     */
    public String getProperty (final String key, final String defaultValue)
    {
        return this.properties.getProperty (key, defaultValue);
    }


    /**
     * Set a property value.
     *
     * @param key The key of the property
     * @param value The value to set
     */
    public void setProperty (final String key, final String value)
    {
        this.properties.setProperty (key, value);
    }


    /**
     * Get a boolean property value.
     *
     * @param key The key of the property
     * @return True if the property is set to 'true' (ignoring case)
     */
    public boolean getBoolean (final String key)
    {
        return Boolean.parseBoolean (this.getProperty (key, "false").trim ());
    }


    /**
     * Set a boolean property value.
     *
     * @param key The key of the property
     * @param value The value to set
     */
    public void setBoolean (final String key, final boolean value)
    {
        this.setProperty (key, Boolean.toString (value));
    }


    /**
     * Get a comma separated property as a list. Entries are trimmed, empty ones are dropped.
     *
     * @param key The key of the property
     * @return The entries, empty if the property is not set
     */
    public List<String> getList (final String key)
    {
        final List<String> result = new ArrayList<> ();
        final String value = this.getProperty (key);
        if (value == null)
            return result;
        for (final String part: value.split (","))
        {
            final String entry = part.trim ();
            if (!entry.isEmpty ())
                result.add (entry);
        }
        return result;
    }
}
