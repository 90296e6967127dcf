// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.MissingResourceException;
import java.util.ResourceBundle;


/**
 * A notifier which resolves the message IDs from the string resources and forwards the messages to
 * SLF4J.
 *
 * @author Jürgen Moßgraber
 */
public class LoggingNotifier implements INotifier
{
    private static final String BUNDLE_NAME = "de.mossgrabers.rackanalyzer.Strings";

    private final Logger        logger;
    private final ResourceBundle messages;
    private volatile boolean    cancelled   = false;


    /**
     * Constructor. Logs to the logger of this class.
     */
    public LoggingNotifier ()
    {
        this (LoggerFactory.getLogger (LoggingNotifier.class));
    }


    /**
     * Constructor.
     *
     * @param logger The logger to forward the messages to
     */
    public LoggingNotifier (final Logger logger)
    {
        this.logger = logger;
        this.messages = ResourceBundle.getBundle (BUNDLE_NAME);
    }


    /** {@inheritDoc} */
    @Override
    public void log (final String messageID, final String... replaceStrings)
    {
        this.logger.info (this.getMessage (messageID, replaceStrings));
    }


    /** {@inheritDoc} */
    @Override
    public void logWarning (final String messageID, final String... replaceStrings)
    {
        this.logger.warn (this.getMessage (messageID, replaceStrings));
    }


    /** {@inheritDoc} */
    @Override
    public void logError (final String messageID, final String... replaceStrings)
    {
        this.logger.error (this.getMessage (messageID, replaceStrings));
    }


    /** {@inheritDoc} */
    @Override
    public void logError (final String messageID, final Throwable throwable)
    {
        this.logger.error (this.getMessage (messageID, throwable.getMessage ()), throwable);
    }


    /** {@inheritDoc} */
    @Override
    public void logError (final Throwable throwable)
    {
        final String message = throwable.getMessage ();
        this.logger.error (message == null ? throwable.getClass ().getName () : message, throwable);
    }


    /** {@inheritDoc} */
    @Override
    public boolean isCancelled ()
    {
        return this.cancelled;
    }


    /**
     * Request all running analysis tasks to stop.
     */
    public void cancel ()
    {
        this.cancelled = true;
    }


    /**
     * Get the message text for the given ID and replace the %1..%n place holders.
     *
     * @param messageID The ID of the message, if no resource exists the ID is used as the text
     * @param replaceStrings The texts to insert
     * @return The formatted message
     */
    public String getMessage (final String messageID, final String... replaceStrings)
    {
        String message;
        try
        {
            message = this.messages.getString (messageID);
        }
        catch (final MissingResourceException ex)
        {
            message = messageID;
        }

        for (int i = 0; i < replaceStrings.length; i++)
            message = message.replace ("%" + (i + 1), replaceStrings[i] == null ? "" : replaceStrings[i]);
        return message;
    }
}
